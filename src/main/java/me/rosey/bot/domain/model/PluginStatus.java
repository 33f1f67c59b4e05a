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

import java.time.Instant;
import java.util.List;

/**
 * Read-only view of one plugin, as returned by the management API.
 */
@Data
@Builder
public class PluginStatus {

    private String name;
    private String version;
    private PluginState state;
    private boolean enabled;
    private long uptimeSeconds;
    private int crashCount;
    private long restartCount;
    private double errorRate;
    private long permissionDenials;
    private List<String> dependencies;
    private List<String> dependents;
    private Long pid;
    private Double cpuPercent;
    private Double memoryMb;
    private Instant startedAt;
    private Instant lastHealthCheck;
}
