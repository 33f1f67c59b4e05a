package me.rosey.bot.port.outbound;

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

import java.nio.file.Path;
import java.util.List;

/**
 * Port for plugin packaging on disk: the directory plugins are discovered in
 * and the isolated per-plugin storage directories.
 */
public interface PluginStoragePort {

    /**
     * Directory scanned for installed plugins.
     */
    Path pluginsDirectory();

    /**
     * Subdirectories of {@link #pluginsDirectory()} that contain a manifest
     * file, sorted by name.
     */
    List<Path> listPluginDirectories();

    /**
     * Isolated storage directory {@code <storage root>/<plugin name>}, created
     * if missing.
     */
    Path provisionStorage(String pluginName);

    /**
     * Storage directory of a plugin without creating it.
     */
    Path storageDirectory(String pluginName);
}
