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

import java.util.Locale;
import java.util.Optional;

/**
 * Opt-in grants a plugin must declare in its manifest. Checked independently
 * of message-bus subject permissions.
 */
public enum Capability {

    FILESYSTEM_READ,
    FILESYSTEM_WRITE,
    NETWORK_HTTP,
    NETWORK_SOCKET,
    DATABASE_READ,
    DATABASE_WRITE,
    PLUGIN_BROADCAST,
    PLUGIN_LISTEN,
    PLATFORM_SEND,
    PLATFORM_MODERATE,
    SYSTEM_ENV,
    SYSTEM_PROCESS,
    CONFIG_READ,
    CONFIG_WRITE;

    /**
     * Manifest spelling of this capability, e.g. {@code filesystem-read}.
     */
    public String key() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }

    /**
     * Resolve a manifest key. Accepts {@code filesystem-read},
     * {@code filesystem.read} and {@code FILESYSTEM_READ}.
     */
    public static Optional<Capability> fromKey(String key) {
        if (key == null || key.isBlank()) {
            return Optional.empty();
        }
        String normalized = key.trim()
                .replace('-', '_')
                .replace('.', '_')
                .toUpperCase(Locale.ROOT);
        for (Capability capability : values()) {
            if (capability.name().equals(normalized)) {
                return Optional.of(capability);
            }
        }
        return Optional.empty();
    }
}
