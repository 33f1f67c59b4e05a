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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.rosey.bot.domain.model.PluginManifest;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads {@code plugin.yaml}, {@code plugin.yml} or {@code plugin.json} from a
 * plugin directory and validates it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ManifestLoader {

    public static final List<String> MANIFEST_FILE_NAMES = List.of("plugin.yaml", "plugin.yml", "plugin.json");

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    /**
     * Manifest file inside a plugin directory, if there is one.
     */
    public Optional<Path> findManifestFile(Path pluginDirectory) {
        for (String fileName : MANIFEST_FILE_NAMES) {
            Path candidate = pluginDirectory.resolve(fileName);
            if (Files.isRegularFile(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    /**
     * Load and validate the manifest of a plugin directory.
     *
     * @throws ManifestValidationException
     *             when the file is missing, unreadable or invalid
     */
    public PluginManifest load(Path pluginDirectory) {
        Path manifestFile = findManifestFile(pluginDirectory).orElseThrow(
                () -> new ManifestValidationException(pluginDirectory.getFileName().toString(),
                        List.of("no plugin.yaml or plugin.json in " + pluginDirectory)));
        Map<String, Object> raw = read(manifestFile);
        PluginManifest manifest = ManifestValidator.validate(raw, pluginDirectory.toAbsolutePath().normalize());
        log.debug("[Plugins] Loaded manifest {} from {}", manifest.label(), manifestFile);
        return manifest;
    }

    /**
     * Parse a manifest document given as text, e.g. one received through the
     * management API.
     */
    public PluginManifest parse(String content, boolean json, Path pluginDirectory) {
        Map<String, Object> raw;
        try {
            raw = (json ? objectMapper : yamlMapper).readValue(content, MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new ManifestValidationException(null, "manifest is not valid " + (json ? "JSON" : "YAML")
                    + ": " + e.getOriginalMessage(), e);
        }
        return ManifestValidator.validate(raw, pluginDirectory);
    }

    private Map<String, Object> read(Path manifestFile) {
        ObjectMapper mapper = manifestFile.getFileName().toString().endsWith(".json") ? objectMapper : yamlMapper;
        try {
            return mapper.readValue(manifestFile.toFile(), MAP_TYPE);
        } catch (IOException e) {
            String pluginName = manifestFile.getParent() != null
                    ? String.valueOf(manifestFile.getParent().getFileName())
                    : null;
            throw new ManifestValidationException(pluginName, "cannot read " + manifestFile + ": " + e.getMessage(),
                    e);
        }
    }
}
