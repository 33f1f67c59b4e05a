package me.rosey.bot.domain.model;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.Builder;
import lombok.Data;

/**
 * Outcome of a management operation. Failures are values, never exceptions.
 */
@Data
@Builder
public class PluginOperationResult {

    @SuppressWarnings("PMD.AvoidFieldNameMatchingMethodName") // Lombok generates isSuccess()
    private boolean success;
    private String plugin;
    private String message;
    private Object data;

    public static PluginOperationResult success(String plugin, String message) {
        return PluginOperationResult.builder()
                .success(true)
                .plugin(plugin)
                .message(message)
                .build();
    }

    public static PluginOperationResult success(String plugin, String message, Object data) {
        return PluginOperationResult.builder()
                .success(true)
                .plugin(plugin)
                .message(message)
                .data(data)
                .build();
    }

    public static PluginOperationResult failure(String plugin, String message) {
        return PluginOperationResult.builder()
                .success(false)
                .plugin(plugin)
                .message(message)
                .build();
    }
}
