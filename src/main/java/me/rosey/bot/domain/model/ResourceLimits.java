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
import lombok.Value;

/**
 * Advisory resource limits declared by a plugin. A value of zero means the
 * limit is not enforced.
 */
@Value
@Builder
public class ResourceLimits {

    public static final ResourceLimits UNLIMITED = ResourceLimits.builder().build();

    @Builder.Default
    double maxCpuPercent = 0;

    @Builder.Default
    double maxMemoryMb = 0;

    @Builder.Default
    long maxUptimeSeconds = 0;

    @Builder.Default
    int maxMessagesPerSecond = 0;

    public boolean hasCpuLimit() {
        return maxCpuPercent > 0;
    }

    public boolean hasMemoryLimit() {
        return maxMemoryMb > 0;
    }

    public boolean hasUptimeLimit() {
        return maxUptimeSeconds > 0;
    }

    public boolean hasMessageRateLimit() {
        return maxMessagesPerSecond > 0;
    }
}
