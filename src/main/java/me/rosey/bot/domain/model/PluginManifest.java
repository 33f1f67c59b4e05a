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

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Validated, immutable description of an installed plugin. Produced by
 * {@link me.rosey.bot.domain.service.ManifestValidator}; updating a plugin
 * means unloading it and loading a new manifest.
 */
@Value
@Builder(toBuilder = true)
public class PluginManifest {

    String name;

    String displayName;

    String version;

    @Builder.Default
    String description = "";

    @Builder.Default
    String author = "";

    /**
     * Command line started inside {@link #pluginDirectory}.
     */
    String entryPoint;

    @Builder.Default
    List<SubjectPermission> permissions = List.of();

    @Builder.Default
    Set<Capability> capabilities = Set.of();

    @Builder.Default
    ResourceLimits limits = ResourceLimits.UNLIMITED;

    @Builder.Default
    RestartPolicy restartPolicy = RestartPolicy.ON_FAILURE;

    @Builder.Default
    List<String> dependencies = List.of();

    /**
     * Higher priority starts first among plugins the dependency order leaves
     * unordered.
     */
    @Builder.Default
    int priority = 0;

    @Builder.Default
    boolean autoStart = true;

    @Builder.Default
    Map<String, Object> configSchema = Map.of();

    @Builder.Default
    Map<String, Object> config = Map.of();

    Path pluginDirectory;

    public String label() {
        return (displayName != null && !displayName.isBlank() ? displayName : name) + " v" + version;
    }
}
