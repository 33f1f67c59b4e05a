package me.rosey.bot.adapter.outbound.storage;

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

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.rosey.bot.domain.service.ManifestLoader;
import me.rosey.bot.domain.service.ManifestValidator;
import me.rosey.bot.infrastructure.config.BotProperties;
import me.rosey.bot.port.outbound.PluginStoragePort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Local filesystem implementation of {@link PluginStoragePort}.
 *
 * <p>
 * Layout:
 * <ul>
 * <li>{@code bot.plugins.directory}/&lt;plugin&gt;/plugin.yaml - installed
 * plugins
 * <li>{@code bot.plugins.storage-root}/&lt;plugin&gt;/ - isolated plugin data
 * </ul>
 * Both default below {@code ${user.home}/.rosey}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LocalPluginStorageAdapter implements PluginStoragePort {

    private final BotProperties properties;

    private Path pluginsDirectory;
    private Path storageRoot;

    @PostConstruct
    public void init() {
        this.pluginsDirectory = resolve(properties.getPlugins().getDirectory());
        this.storageRoot = resolve(properties.getPlugins().getStorageRoot());
        try {
            Files.createDirectories(pluginsDirectory);
            Files.createDirectories(storageRoot);
            log.info("[Plugins] Plugin directory: {}, storage root: {}", pluginsDirectory, storageRoot);
        } catch (IOException e) {
            log.error("[Plugins] Failed to create plugin directories", e);
        }
    }

    private static Path resolve(String path) {
        return Paths.get(path.replace("${user.home}", System.getProperty("user.home")))
                .toAbsolutePath().normalize();
    }

    @Override
    public Path pluginsDirectory() {
        return pluginsDirectory;
    }

    @Override
    public List<Path> listPluginDirectories() {
        if (!Files.isDirectory(pluginsDirectory)) {
            return List.of();
        }
        try (Stream<Path> entries = Files.list(pluginsDirectory)) {
            return entries
                    .filter(Files::isDirectory)
                    .filter(LocalPluginStorageAdapter::hasManifest)
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .toList();
        } catch (IOException e) {
            log.warn("[Plugins] Cannot list {}: {}", pluginsDirectory, e.getMessage());
            return List.of();
        }
    }

    private static boolean hasManifest(Path directory) {
        return ManifestLoader.MANIFEST_FILE_NAMES.stream()
                .anyMatch(name -> Files.isRegularFile(directory.resolve(name)));
    }

    @Override
    public Path provisionStorage(String pluginName) {
        Path directory = storageDirectory(pluginName);
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create storage for plugin '" + pluginName + "'", e);
        }
        return directory;
    }

    @Override
    public Path storageDirectory(String pluginName) {
        if (!ManifestValidator.isValidName(pluginName)) {
            throw new IllegalArgumentException("Invalid plugin name: " + pluginName);
        }
        Path directory = storageRoot.resolve(pluginName).normalize();
        if (!directory.startsWith(storageRoot)) {
            throw new IllegalArgumentException("Path traversal attempt: " + pluginName);
        }
        return directory;
    }
}
