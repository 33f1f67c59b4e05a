package me.rosey.bot.domain.service;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.rosey.bot.domain.model.PluginManifest;
import me.rosey.bot.port.outbound.PluginStoragePort;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Finds installed plugins in the plugins directory. A plugin with an invalid
 * manifest is logged with every problem and skipped; the others still load.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PluginDiscoveryService {

    private final PluginStoragePort storagePort;
    private final ManifestLoader manifestLoader;

    public List<PluginManifest> discover() {
        List<PluginManifest> manifests = new ArrayList<>();
        Set<String> names = new HashSet<>();
        for (Path directory : storagePort.listPluginDirectories()) {
            try {
                PluginManifest manifest = manifestLoader.load(directory);
                if (!names.add(manifest.getName())) {
                    log.warn("[Plugins] Duplicate plugin name '{}' in {}, skipping", manifest.getName(), directory);
                    continue;
                }
                manifests.add(manifest);
            } catch (ManifestValidationException e) {
                log.error("[Plugins] Skipping {}: {}", directory.getFileName(), e.getMessage());
            }
        }
        log.info("[Plugins] Discovered {} plugin(s) in {}", manifests.size(), storagePort.pluginsDirectory());
        return manifests;
    }

    /**
     * Load a plugin directory for installation. Relative paths resolve against
     * the plugins directory.
     *
     * @throws ManifestValidationException
     *             when the directory has no valid manifest
     */
    public PluginManifest loadFromDirectory(String location) {
        Path path = Path.of(location);
        if (!path.isAbsolute()) {
            path = storagePort.pluginsDirectory().resolve(path);
        }
        path = path.normalize();
        if (!Files.isDirectory(path)) {
            throw new ManifestValidationException(null, List.of("not a plugin directory: " + path));
        }
        return manifestLoader.load(path);
    }
}
