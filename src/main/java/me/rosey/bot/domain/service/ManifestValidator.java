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

import me.rosey.bot.domain.model.Capability;
import me.rosey.bot.domain.model.CapabilityProfile;
import me.rosey.bot.domain.model.PluginManifest;
import me.rosey.bot.domain.model.ResourceLimits;
import me.rosey.bot.domain.model.RestartPolicy;
import me.rosey.bot.domain.model.SubjectPermission;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns a raw manifest document (already parsed from YAML or JSON into maps
 * and lists) into a validated {@link PluginManifest}.
 *
 * <p>
 * Every problem is collected before failing, so a plugin author sees the whole
 * list at once. Unknown top-level fields are ignored.
 */
public final class ManifestValidator {

    public static final Pattern NAME_PATTERN = Pattern.compile("^[a-z][a-z0-9_]*$");
    public static final int MAX_NAME_LENGTH = 64;
    private static final Pattern VERSION_PATTERN = Pattern.compile("^\\d+\\.\\d+\\.\\d+$");
    private static final Set<String> SCHEMA_TYPES = Set.of(
            "object", "array", "string", "number", "integer", "boolean", "null");

    private ManifestValidator() {
    }

    public static boolean isValidName(String name) {
        return name != null && name.length() <= MAX_NAME_LENGTH && NAME_PATTERN.matcher(name).matches();
    }

    /**
     * Validate a raw manifest.
     *
     * @param raw
     *            parsed manifest document
     * @param pluginDirectory
     *            unpacked plugin directory, may be {@code null} for manifests
     *            installed without files
     * @throws ManifestValidationException
     *             listing every problem found
     */
    public static PluginManifest validate(Map<String, Object> raw, Path pluginDirectory) {
        if (raw == null) {
            throw new ManifestValidationException(null, List.of("manifest is empty"));
        }
        List<String> problems = new ArrayList<>();

        String name = requiredString(raw, "name", problems);
        if (name != null && !isValidName(name)) {
            problems.add("name '" + name + "' must match " + NAME_PATTERN.pattern()
                    + " and be at most " + MAX_NAME_LENGTH + " characters");
        }
        String version = requiredString(raw, "version", problems);
        if (version != null && !VERSION_PATTERN.matcher(version).matches()) {
            problems.add("version '" + version + "' must be a semantic version (e.g. 1.0.0)");
        }
        String entryPoint = requiredString(raw, "entry_point", problems);

        PluginManifest.PluginManifestBuilder builder = PluginManifest.builder()
                .name(name)
                .version(version)
                .entryPoint(entryPoint)
                .pluginDirectory(pluginDirectory);

        String displayName = optionalString(raw, "display_name", problems);
        builder.displayName(displayName != null ? displayName : name);
        String description = optionalString(raw, "description", problems);
        if (description != null) {
            builder.description(description);
        }
        String author = optionalString(raw, "author", problems);
        if (author != null) {
            builder.author(author);
        }

        builder.permissions(parsePermissions(raw.get("permissions"), problems));
        builder.capabilities(parseCapabilities(raw.get("capabilities"), raw.get("profile"), problems));
        builder.limits(parseLimits(raw.get("limits"), problems));

        Object policy = raw.get("restart_policy");
        if (policy != null) {
            RestartPolicy.fromKey(String.valueOf(policy)).ifPresentOrElse(
                    builder::restartPolicy,
                    () -> problems.add("unknown restart_policy '" + policy
                            + "' (expected always, on-failure, unless-stopped or never)"));
        }

        builder.dependencies(parseDependencies(raw.get("dependencies"), name, problems));

        Object priority = raw.get("priority");
        if (priority != null) {
            if (priority instanceof Number number && number.doubleValue() == Math.rint(number.doubleValue())) {
                builder.priority(number.intValue());
            } else {
                problems.add("priority must be an integer");
            }
        }
        Object autoStart = raw.get("auto_start");
        if (autoStart != null) {
            if (autoStart instanceof Boolean flag) {
                builder.autoStart(flag);
            } else {
                problems.add("auto_start must be true or false");
            }
        }

        Map<String, Object> schema = Map.of();
        Object rawSchema = raw.get("config_schema");
        if (rawSchema != null) {
            if (rawSchema instanceof Map<?, ?> schemaMap) {
                schema = copyObject(schemaMap);
                validateSchema(schema, "config_schema", problems);
                builder.configSchema(Collections.unmodifiableMap(schema));
            } else {
                problems.add("config_schema must be an object");
            }
        }
        Object rawConfig = raw.get("config");
        if (rawConfig != null) {
            if (rawConfig instanceof Map<?, ?> configMap) {
                Map<String, Object> config = copyObject(configMap);
                if (!schema.isEmpty()) {
                    validateConfig(config, schema, problems);
                }
                builder.config(Collections.unmodifiableMap(config));
            } else {
                problems.add("config must be an object");
            }
        }

        if (!problems.isEmpty()) {
            throw new ManifestValidationException(name, problems);
        }
        return builder.build();
    }

    private static String requiredString(Map<String, Object> raw, String key, List<String> problems) {
        Object value = raw.get(key);
        if (value == null || String.valueOf(value).isBlank()) {
            problems.add("missing required field '" + key + "'");
            return null;
        }
        if (!(value instanceof String)) {
            problems.add("'" + key + "' must be a string");
            return null;
        }
        return ((String) value).trim();
    }

    private static String optionalString(Map<String, Object> raw, String key, List<String> problems) {
        Object value = raw.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof String)) {
            problems.add("'" + key + "' must be a string");
            return null;
        }
        return (String) value;
    }

    private static List<SubjectPermission> parsePermissions(Object raw, List<String> problems) {
        if (raw == null) {
            return List.of();
        }
        if (!(raw instanceof List<?> entries)) {
            problems.add("permissions must be a list");
            return List.of();
        }
        List<SubjectPermission> permissions = new ArrayList<>();
        for (int i = 0; i < entries.size(); i++) {
            Object entry = entries.get(i);
            String where = "permissions[" + i + "]";
            if (!(entry instanceof Map<?, ?> map)) {
                problems.add(where + " must be an object with pattern, subscribe and publish");
                continue;
            }
            Object pattern = map.get("pattern");
            if (!(pattern instanceof String patternText) || !SubjectMatcher.isValidPattern(patternText)) {
                problems.add(where + " has malformed subject pattern '" + pattern + "'");
                continue;
            }
            Boolean subscribe = flag(map.get("subscribe"), where + ".subscribe", problems);
            Boolean publish = flag(map.get("publish"), where + ".publish", problems);
            if (subscribe == null || publish == null) {
                continue;
            }
            if (!subscribe && !publish) {
                problems.add(where + " grants neither subscribe nor publish on '" + patternText + "'");
                continue;
            }
            for (Object key : map.keySet()) {
                if (!"pattern".equals(key) && !"subscribe".equals(key) && !"publish".equals(key)) {
                    problems.add(where + " has unknown permission '" + key + "'");
                }
            }
            permissions.add(new SubjectPermission(patternText, subscribe, publish));
        }
        return List.copyOf(permissions);
    }

    private static Boolean flag(Object value, String where, List<String> problems) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean bool) {
            return bool;
        }
        problems.add(where + " must be true or false");
        return null;
    }

    private static Set<Capability> parseCapabilities(Object raw, Object profile, List<String> problems) {
        Set<Capability> capabilities = EnumSet.noneOf(Capability.class);
        if (profile != null) {
            CapabilityProfile.fromKey(String.valueOf(profile)).ifPresentOrElse(
                    p -> capabilities.addAll(p.getCapabilities()),
                    () -> problems.add("unknown capability profile '" + profile
                            + "' (expected minimal, standard, extended or admin)"));
        }
        if (raw != null) {
            if (raw instanceof Collection<?> keys) {
                for (Object key : keys) {
                    Capability.fromKey(key != null ? String.valueOf(key) : null).ifPresentOrElse(
                            capabilities::add,
                            () -> problems.add("unknown capability '" + key + "'"));
                }
            } else {
                problems.add("capabilities must be a list");
            }
        }
        return capabilities.isEmpty() ? Set.of() : Set.copyOf(capabilities);
    }

    private static ResourceLimits parseLimits(Object raw, List<String> problems) {
        if (raw == null) {
            return ResourceLimits.UNLIMITED;
        }
        if (!(raw instanceof Map<?, ?> map)) {
            problems.add("limits must be an object");
            return ResourceLimits.UNLIMITED;
        }
        ResourceLimits.ResourceLimitsBuilder builder = ResourceLimits.builder();
        Double cpu = limit(map, "max_cpu_percent", problems);
        if (cpu != null) {
            builder.maxCpuPercent(cpu);
        }
        Double memory = limit(map, "max_memory_mb", problems);
        if (memory != null) {
            builder.maxMemoryMb(memory);
        }
        Double uptime = limit(map, "max_uptime_seconds", problems);
        if (uptime != null) {
            builder.maxUptimeSeconds(uptime.longValue());
        }
        Double rate = limit(map, "max_messages_per_second", problems);
        if (rate != null) {
            builder.maxMessagesPerSecond(rate.intValue());
        }
        return builder.build();
    }

    private static Double limit(Map<?, ?> limits, String key, List<String> problems) {
        Object value = limits.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof Number number)) {
            problems.add("limits." + key + " must be a number");
            return null;
        }
        if (number.doubleValue() < 0) {
            problems.add("limits." + key + " must not be negative");
            return null;
        }
        return number.doubleValue();
    }

    private static List<String> parseDependencies(Object raw, String name, List<String> problems) {
        if (raw == null) {
            return List.of();
        }
        if (!(raw instanceof List<?> entries)) {
            problems.add("dependencies must be a list of plugin names");
            return List.of();
        }
        Set<String> dependencies = new LinkedHashSet<>();
        for (Object entry : entries) {
            if (!(entry instanceof String dependency) || !isValidName(dependency)) {
                problems.add("dependency '" + entry + "' is not a valid plugin name");
                continue;
            }
            if (dependency.equals(name)) {
                problems.add("plugin cannot depend on itself");
                continue;
            }
            dependencies.add(dependency);
        }
        return List.copyOf(dependencies);
    }

    private static void validateSchema(Map<String, Object> schema, String path, List<String> problems) {
        Object type = schema.get("type");
        if (type != null && !(type instanceof String typeName && SCHEMA_TYPES.contains(typeName))) {
            problems.add(path + ".type '" + type + "' is not a JSON schema type");
        }
        Object properties = schema.get("properties");
        if (properties != null) {
            if (properties instanceof Map<?, ?> props) {
                for (Map.Entry<?, ?> entry : props.entrySet()) {
                    String propertyPath = path + ".properties." + entry.getKey();
                    if (entry.getValue() instanceof Map<?, ?> nested) {
                        validateSchema(copyObject(nested), propertyPath, problems);
                    } else {
                        problems.add(propertyPath + " must be an object");
                    }
                }
            } else {
                problems.add(path + ".properties must be an object");
            }
        }
        Object required = schema.get("required");
        if (required != null) {
            if (!(required instanceof List<?> list) || list.stream().anyMatch(r -> !(r instanceof String))) {
                problems.add(path + ".required must be a list of strings");
            }
        }
    }

    private static void validateConfig(Map<String, Object> config, Map<String, Object> schema,
            List<String> problems) {
        if (schema.get("required") instanceof List<?> required) {
            for (Object key : required) {
                if (key instanceof String requiredKey && !config.containsKey(requiredKey)) {
                    problems.add("config is missing required key '" + requiredKey + "'");
                }
            }
        }
        if (!(schema.get("properties") instanceof Map<?, ?> properties)) {
            return;
        }
        for (Map.Entry<String, Object> entry : config.entrySet()) {
            if (properties.get(entry.getKey()) instanceof Map<?, ?> property
                    && property.get("type") instanceof String expected
                    && !matchesType(entry.getValue(), expected)) {
                problems.add("config." + entry.getKey() + " must be of type " + expected);
            }
        }
    }

    private static boolean matchesType(Object value, String type) {
        return switch (type) {
        case "object" -> value instanceof Map;
        case "array" -> value instanceof List;
        case "string" -> value instanceof String;
        case "number" -> value instanceof Number;
        case "integer" -> value instanceof Number number && number.doubleValue() == Math.rint(number.doubleValue());
        case "boolean" -> value instanceof Boolean;
        case "null" -> value == null;
        default -> true;
        };
    }

    /**
     * Deep copy with string keys; nested maps and lists are unmodifiable.
     * Null values are kept, so {@code Map.copyOf} is not an option here.
     */
    private static Map<String, Object> copyObject(Map<?, ?> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> copy.put(String.valueOf(key), freeze(value)));
        return copy;
    }

    private static Object freeze(Object value) {
        if (value instanceof Map<?, ?> map) {
            return Collections.unmodifiableMap(copyObject(map));
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            list.forEach(element -> copy.add(freeze(element)));
            return Collections.unmodifiableList(copy);
        }
        return value;
    }
}
