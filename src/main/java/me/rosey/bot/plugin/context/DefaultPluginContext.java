package me.rosey.bot.plugin.context;

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
import me.rosey.bot.domain.service.PermissionValidator;
import me.rosey.bot.plugin.api.PluginContext;
import me.rosey.bot.plugin.api.PluginMessaging;

import java.nio.file.Path;
import java.util.Map;

/**
 * Plugin context assembled by {@link PluginWorkerRuntime}.
 */
public class DefaultPluginContext implements PluginContext {

    private final PermissionValidator permissions;
    private final Map<String, Object> config;
    private final Path storageDirectory;
    private final PluginMessaging messaging;

    public DefaultPluginContext(PermissionValidator permissions, Map<String, Object> config, Path storageDirectory,
            PluginMessaging messaging) {
        this.permissions = permissions;
        this.config = config != null ? Map.copyOf(config) : Map.of();
        this.storageDirectory = storageDirectory;
        this.messaging = messaging;
    }

    @Override
    public String pluginName() {
        return permissions.getPluginName();
    }

    @Override
    public Map<String, Object> config() {
        return config;
    }

    @Override
    public Path storageDirectory() {
        return storageDirectory;
    }

    @Override
    public PluginMessaging messaging() {
        return messaging;
    }

    @Override
    public boolean hasCapability(Capability capability) {
        return permissions.validateCapability(capability).allowed();
    }

    @Override
    public void requireCapability(Capability capability) {
        permissions.validateCapability(capability).orThrow();
    }
}
