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
import me.rosey.bot.domain.model.PermissionDecision;
import me.rosey.bot.domain.model.PluginManifest;
import me.rosey.bot.domain.model.ResourceLimits;
import me.rosey.bot.domain.model.ResourceSnapshot;
import me.rosey.bot.domain.model.SubjectPermission;
import me.rosey.bot.domain.model.Subjects;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Pure permission decisions over one validated manifest.
 *
 * <p>
 * Everything not granted is denied. Each plugin implicitly owns its command
 * namespace and its event namespace:
 * <ul>
 * <li>subscribe {@code rosey.commands.<name>.execute} and
 * {@code rosey.plugins.<name>.health}</li>
 * <li>publish {@code rosey.commands.<name>.result},
 * {@code rosey.commands.<name>.error} and {@code rosey.plugins.<name>.>}</li>
 * </ul>
 * Anything else must be declared in the manifest.
 *
 * <p>
 * Instances are immutable and safe to share between threads.
 */
public final class PermissionValidator {

    private final String pluginName;
    private final List<String> subscribePatterns;
    private final List<String> publishPatterns;
    private final Set<Capability> capabilities;
    private final ResourceLimits limits;

    private PermissionValidator(PluginManifest manifest) {
        this.pluginName = manifest.getName();
        this.limits = manifest.getLimits() != null ? manifest.getLimits() : ResourceLimits.UNLIMITED;

        List<String> subscribe = new ArrayList<>(implicitSubscribe(pluginName));
        List<String> publish = new ArrayList<>(implicitPublish(pluginName));
        for (SubjectPermission permission : manifest.getPermissions()) {
            if (permission.subscribe()) {
                subscribe.add(permission.pattern());
            }
            if (permission.publish()) {
                publish.add(permission.pattern());
            }
        }
        this.subscribePatterns = Collections.unmodifiableList(subscribe);
        this.publishPatterns = Collections.unmodifiableList(publish);

        Set<Capability> declared = manifest.getCapabilities();
        this.capabilities = declared.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.noneOf(Capability.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(declared));
    }

    public static PermissionValidator forManifest(PluginManifest manifest) {
        return new PermissionValidator(manifest);
    }

    public static List<String> implicitSubscribe(String pluginName) {
        return List.of(Subjects.commandExecute(pluginName), Subjects.health(pluginName));
    }

    public static List<String> implicitPublish(String pluginName) {
        return List.of(
                Subjects.commandResult(pluginName),
                Subjects.commandError(pluginName),
                Subjects.pluginEvents(pluginName));
    }

    /**
     * Check a subscription request. The requested pattern must be covered
     * entirely by one granted pattern.
     */
    public PermissionDecision validateSubscribe(String subject) {
        if (!SubjectMatcher.isValidPattern(subject)) {
            return PermissionDecision.deny(
                    "Plugin '" + pluginName + "' cannot subscribe to malformed subject '" + subject + "'",
                    null);
        }
        for (String granted : subscribePatterns) {
            if (SubjectMatcher.covers(granted, subject)) {
                return PermissionDecision.allow();
            }
        }
        String required = declaration(subject, "subscribe");
        return PermissionDecision.deny(
                "Plugin '" + pluginName + "' is not allowed to subscribe to '" + subject
                        + "'. Declare " + required + " in its manifest permissions",
                required);
    }

    /**
     * Check a publish. Only concrete subjects may be published.
     */
    public PermissionDecision validatePublish(String subject) {
        if (!SubjectMatcher.isConcreteSubject(subject)) {
            return PermissionDecision.deny(
                    "Plugin '" + pluginName + "' cannot publish to non-concrete subject '" + subject + "'",
                    null);
        }
        for (String granted : publishPatterns) {
            if (SubjectMatcher.matches(granted, subject)) {
                return PermissionDecision.allow();
            }
        }
        String required = declaration(subject, "publish");
        return PermissionDecision.deny(
                "Plugin '" + pluginName + "' is not allowed to publish to '" + subject
                        + "'. Declare " + required + " in its manifest permissions",
                required);
    }

    public PermissionDecision validateCapability(Capability capability) {
        if (capability != null && capabilities.contains(capability)) {
            return PermissionDecision.allow();
        }
        String key = capability != null ? capability.key() : "null";
        return PermissionDecision.deny(
                "Plugin '" + pluginName + "' lacks capability '" + key
                        + "'. Add it to the manifest capabilities",
                key);
    }

    /**
     * Compare a resource sample with the declared limits. Never throws; a
     * limit of zero is not enforced.
     *
     * @return human-readable violations, empty when within limits
     */
    public List<String> checkResourceLimits(ResourceSnapshot snapshot) {
        if (snapshot == null) {
            return List.of();
        }
        List<String> violations = new ArrayList<>();
        if (limits.hasCpuLimit() && snapshot.cpuPercent() > limits.getMaxCpuPercent()) {
            violations.add(String.format(Locale.ROOT, "CPU %.1f%% exceeds limit %.1f%%",
                    snapshot.cpuPercent(), limits.getMaxCpuPercent()));
        }
        if (limits.hasMemoryLimit() && snapshot.memoryMb() > limits.getMaxMemoryMb()) {
            violations.add(String.format(Locale.ROOT, "Memory %.1fMB exceeds limit %.1fMB",
                    snapshot.memoryMb(), limits.getMaxMemoryMb()));
        }
        if (limits.hasUptimeLimit() && snapshot.uptimeSeconds() > limits.getMaxUptimeSeconds()) {
            violations.add(String.format(Locale.ROOT, "Uptime %ds exceeds limit %ds",
                    snapshot.uptimeSeconds(), limits.getMaxUptimeSeconds()));
        }
        return violations;
    }

    public String getPluginName() {
        return pluginName;
    }

    public List<String> getSubscribePatterns() {
        return subscribePatterns;
    }

    public List<String> getPublishPatterns() {
        return publishPatterns;
    }

    public Set<Capability> getCapabilities() {
        return capabilities;
    }

    public ResourceLimits getLimits() {
        return limits;
    }

    private static String declaration(String subject, String direction) {
        return "{pattern: \"" + subject + "\", " + direction + ": true}";
    }
}
