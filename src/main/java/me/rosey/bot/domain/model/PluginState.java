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

/**
 * Lifecycle states of a registered plugin.
 *
 * <pre>
 * STOPPED → STARTING → RUNNING ⇄ UNHEALTHY → STOPPING → STOPPED
 * RUNNING | UNHEALTHY → CRASHED → DISABLED (crash threshold)
 * DISABLED → STOPPED (enable)
 * </pre>
 */
public enum PluginState {

    STOPPED,
    STARTING,
    RUNNING,
    UNHEALTHY,
    STOPPING,
    CRASHED,
    DISABLED;

    /**
     * Whether a live process is expected in this state.
     */
    public boolean isActive() {
        return this == RUNNING || this == UNHEALTHY;
    }
}
