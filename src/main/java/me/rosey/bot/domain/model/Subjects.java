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
 * Message-bus subject hierarchy.
 *
 * <pre>
 * rosey.commands.{plugin}.execute   command requests to a plugin
 * rosey.commands.{plugin}.result    command results from a plugin
 * rosey.commands.{plugin}.error     command failures from a plugin
 * rosey.plugins.{plugin}.{event}    events published by a plugin
 * rosey.plugins.{plugin}.health     health ping (request/reply)
 * rosey.events.{event}              normalized platform events
 * </pre>
 */
public final class Subjects {

    public static final String BASE = "rosey";
    public static final String COMMANDS = BASE + ".commands";
    public static final String PLUGINS = BASE + ".plugins";
    public static final String EVENTS = BASE + ".events";

    public static final String SINGLE_WILDCARD = "*";
    public static final String MULTI_WILDCARD = ">";

    public static final String EVENT_PLUGIN_START = "plugin.start";
    public static final String EVENT_PLUGIN_STOP = "plugin.stop";
    public static final String EVENT_PLUGIN_ERROR = "plugin.error";
    public static final String EVENT_PLUGIN_READY = "plugin.ready";

    /** Published by a plugin on its own namespace when a check denies it. */
    public static final String EVENT_PERMISSION_DENIED = "permission_denied";

    /** Results of every plugin's commands. */
    public static final String ALL_COMMAND_RESULTS = COMMANDS + ".*.result";

    /** Failures of every plugin's commands. */
    public static final String ALL_COMMAND_ERRORS = COMMANDS + ".*.error";

    /** Permission denials reported by every plugin. */
    public static final String ALL_PERMISSION_DENIALS = PLUGINS + ".*." + EVENT_PERMISSION_DENIED;

    private Subjects() {
    }

    public static String commandExecute(String plugin) {
        return COMMANDS + "." + plugin + ".execute";
    }

    public static String commandResult(String plugin) {
        return COMMANDS + "." + plugin + ".result";
    }

    public static String commandError(String plugin) {
        return COMMANDS + "." + plugin + ".error";
    }

    public static String pluginEvent(String plugin, String event) {
        return PLUGINS + "." + plugin + "." + event;
    }

    public static String pluginEvents(String plugin) {
        return PLUGINS + "." + plugin + "." + MULTI_WILDCARD;
    }

    public static String health(String plugin) {
        return PLUGINS + "." + plugin + ".health";
    }

    public static String event(String event) {
        return EVENTS + "." + event;
    }

    /**
     * Plugin name encoded in a {@code rosey.commands.<plugin>.*} or
     * {@code rosey.plugins.<plugin>.*} subject, or {@code null} for any other
     * subject.
     */
    public static String pluginOf(String subject) {
        if (subject == null || !(subject.startsWith(COMMANDS + ".") || subject.startsWith(PLUGINS + "."))) {
            return null;
        }
        String[] tokens = subject.split("\\.");
        return tokens.length >= 4 ? tokens[2] : null;
    }
}
