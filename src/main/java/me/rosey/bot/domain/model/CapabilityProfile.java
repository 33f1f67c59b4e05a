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

import java.util.EnumSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Pre-configured capability sets a manifest may name instead of listing every
 * capability. Declared capabilities are added on top of the profile.
 */
public enum CapabilityProfile {

    MINIMAL(EnumSet.of(Capability.CONFIG_READ)),

    STANDARD(EnumSet.of(
            Capability.CONFIG_READ,
            Capability.CONFIG_WRITE,
            Capability.FILESYSTEM_READ,
            Capability.PLATFORM_SEND,
            Capability.DATABASE_READ,
            Capability.NETWORK_HTTP)),

    EXTENDED(EnumSet.of(
            Capability.CONFIG_READ,
            Capability.CONFIG_WRITE,
            Capability.FILESYSTEM_READ,
            Capability.FILESYSTEM_WRITE,
            Capability.PLUGIN_BROADCAST,
            Capability.PLUGIN_LISTEN,
            Capability.PLATFORM_SEND,
            Capability.PLATFORM_MODERATE,
            Capability.DATABASE_READ,
            Capability.DATABASE_WRITE,
            Capability.NETWORK_HTTP)),

    ADMIN(EnumSet.allOf(Capability.class));

    private final Set<Capability> capabilities;

    CapabilityProfile(Set<Capability> capabilities) {
        this.capabilities = capabilities;
    }

    public Set<Capability> getCapabilities() {
        return EnumSet.copyOf(capabilities);
    }

    public static Optional<CapabilityProfile> fromKey(String key) {
        if (key == null || key.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(key.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
