package me.rosey.bot.plugin.api;

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

import me.rosey.bot.domain.model.Capability;

import java.nio.file.Path;
import java.util.Map;

/**
 * What a running plugin sees of its host.
 */
public interface PluginContext {

    String pluginName();

    /**
     * Read-only plugin configuration from the manifest.
     */
    Map<String, Object> config();

    /**
     * Isolated storage directory of this plugin.
     */
    Path storageDirectory();

    /**
     * Permission-checked access to the message bus.
     */
    PluginMessaging messaging();

    boolean hasCapability(Capability capability);

    /**
     * @throws me.rosey.bot.domain.service.PermissionDeniedException
     *             when the capability was not declared
     */
    void requireCapability(Capability capability);
}
