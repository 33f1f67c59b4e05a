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

import me.rosey.bot.domain.model.BusMessage;

import java.util.Map;

/**
 * Entry point a plugin implements. The worker runtime calls the hooks on one
 * thread and bounds {@link #onLoad} and {@link #onUnload} by the stop grace
 * period.
 */
public interface RoseyPlugin {

    /**
     * Called once after the plugin process connects. Subscriptions are made
     * here through {@link PluginContext#messaging()}.
     */
    void onLoad(PluginContext context);

    /**
     * Called for every message on a subscribe pattern declared in the
     * manifest. Subscriptions made in {@link #onLoad} use their own handlers.
     */
    void onEvent(BusMessage message);

    /**
     * Handle a message on {@code rosey.commands.<name>.execute}. The returned
     * map is published on the plugin's result subject (and sent as the reply
     * when the command was a request); an exception is published on its error
     * subject.
     */
    default Map<String, Object> onCommand(BusMessage command) {
        throw new UnsupportedOperationException("Plugin does not handle commands");
    }

    /**
     * Called once before the process exits.
     */
    default void onUnload() {
        // Default no-op
    }
}
