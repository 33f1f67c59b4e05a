package me.rosey.bot.port.inbound;

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

import me.rosey.bot.domain.model.PluginManifest;
import me.rosey.bot.domain.model.PluginOperationResult;
import me.rosey.bot.domain.model.PluginState;
import me.rosey.bot.domain.model.PluginStatus;

import java.util.List;
import java.util.Map;

/**
 * Management API over installed plugins, used by the host's command surface.
 * Operations never throw; failures come back as
 * {@link PluginOperationResult#isSuccess() unsuccessful} results.
 */
public interface PluginManagementPort {

    /**
     * All registered plugins, sorted by name.
     */
    List<PluginStatus> list();

    /**
     * Status of one plugin; the result data is a {@link PluginStatus}.
     */
    PluginOperationResult status(String name);

    PluginOperationResult start(String name);

    /**
     * Stop a plugin together with every running plugin that depends on it.
     */
    PluginOperationResult stop(String name);

    PluginOperationResult restart(String name);

    /**
     * Clear the crash count and make a disabled plugin startable again.
     */
    PluginOperationResult enable(String name);

    /**
     * Prevent future starts and crash recovery. A running instance keeps
     * running.
     */
    PluginOperationResult disable(String name);

    /**
     * Register a validated manifest and start it when its dependencies are
     * running. Other plugins are not touched.
     */
    PluginOperationResult install(PluginManifest manifest);

    /**
     * Stop a plugin with its dependents and deregister it.
     */
    PluginOperationResult uninstall(String name);

    /**
     * Number of plugins per lifecycle state.
     */
    Map<PluginState, Long> statistics();
}
