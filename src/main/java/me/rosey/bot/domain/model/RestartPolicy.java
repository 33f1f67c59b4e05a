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
 * What the supervisor does after a plugin process dies unexpectedly.
 */
public enum RestartPolicy {

    /** Restart regardless of exit code. */
    ALWAYS("always"),

    /** Restart only when the process exited with a non-zero code. */
    ON_FAILURE("on-failure"),

    /** Restart unless an operator stopped the plugin. */
    UNLESS_STOPPED("unless-stopped"),

    /** Log the crash and leave the plugin crashed. */
    NEVER("never");

    private final String key;

    RestartPolicy(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static Optional<RestartPolicy> fromKey(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (RestartPolicy policy : values()) {
            if (policy.key.equals(normalized)) {
                return Optional.of(policy);
            }
        }
        return Optional.empty();
    }
}
