package me.rosey.bot.adapter.outbound.process;

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
import com.fasterxml.jackson.databind.ObjectMapper;
import me.rosey.bot.domain.component.PluginProcess;
import me.rosey.bot.domain.component.ProcessStartException;
import me.rosey.bot.domain.model.Capability;
import me.rosey.bot.domain.model.PluginManifest;
import me.rosey.bot.domain.model.ResourceSnapshot;
import me.rosey.bot.domain.service.PermissionValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.TimeUnit;

/**
 * One plugin running as an operating system process.
 *
 * <p>
 * The entry point is run through {@code /bin/sh -c} inside the plugin
 * directory. The process learns its identity and grants from environment
 * variables:
 * <ul>
 * <li>{@code ROSEY_PLUGIN_NAME}, {@code ROSEY_PLUGIN_VERSION},
 * {@code ROSEY_BUS_URL}, {@code ROSEY_PLUGIN_STORAGE}</li>
 * <li>{@code ROSEY_PLUGIN_MAX_MESSAGES_PER_SECOND}, zero when unlimited</li>
 * <li>{@code ROSEY_PLUGIN_SUBSCRIBE}, {@code ROSEY_PLUGIN_PUBLISH},
 * {@code ROSEY_PLUGIN_CAPABILITIES} and {@code ROSEY_PLUGIN_CONFIG} as JSON</li>
 * </ul>
 * stdout goes to the log at INFO, stderr at WARN.
 *
 * <p>
 * Not a Spring bean. Created per start by {@link OsPluginProcessAdapter}.
 */
public class OsPluginProcess implements PluginProcess {

    private static final Logger log = LoggerFactory.getLogger(OsPluginProcess.class);

    public static final String ENV_PLUGIN_NAME = "ROSEY_PLUGIN_NAME";
    public static final String ENV_PLUGIN_VERSION = "ROSEY_PLUGIN_VERSION";
    public static final String ENV_BUS_URL = "ROSEY_BUS_URL";
    public static final String ENV_STORAGE = "ROSEY_PLUGIN_STORAGE";
    public static final String ENV_SUBSCRIBE = "ROSEY_PLUGIN_SUBSCRIBE";
    public static final String ENV_PUBLISH = "ROSEY_PLUGIN_PUBLISH";
    public static final String ENV_CAPABILITIES = "ROSEY_PLUGIN_CAPABILITIES";
    public static final String ENV_CONFIG = "ROSEY_PLUGIN_CONFIG";
    public static final String ENV_MESSAGE_RATE = "ROSEY_PLUGIN_MAX_MESSAGES_PER_SECOND";

    private final PluginManifest manifest;
    private final String busUrl;
    private final Path storageDirectory;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Duration startupProbe;

    private volatile Process process;
    private volatile Instant startedAt;
    private volatile boolean stopping;
    private volatile ProcessResourceSampler sampler;

    public OsPluginProcess(PluginManifest manifest, String busUrl, Path storageDirectory,
            ObjectMapper objectMapper, Clock clock, Duration startupProbe) {
        this.manifest = manifest;
        this.busUrl = busUrl;
        this.storageDirectory = storageDirectory;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.startupProbe = startupProbe;
    }

    @Override
    public String getPluginName() {
        return manifest.getName();
    }

    @Override
    public synchronized void start() {
        if (process != null) {
            throw new IllegalStateException("Process unit for '" + getPluginName() + "' was already started");
        }
        log.info("[Plugin:{}] Starting: {}", getPluginName(), manifest.getEntryPoint());

        ProcessBuilder pb = new ProcessBuilder("/bin/sh", "-c", manifest.getEntryPoint());
        pb.redirectErrorStream(false);
        if (manifest.getPluginDirectory() != null) {
            pb.directory(manifest.getPluginDirectory().toFile());
        }
        pb.environment().putAll(buildEnvironment());

        Process started;
        try {
            started = pb.start();
        } catch (IOException e) {
            throw new ProcessStartException(getPluginName(),
                    "Failed to spawn plugin '" + getPluginName() + "': " + e.getMessage(), e);
        }
        process = started;
        startedAt = clock.instant();
        sampler = new ProcessResourceSampler(started.toHandle(), startedAt, clock);

        drain(started.getInputStream(), "stdout", false);
        drain(started.getErrorStream(), "stderr", true);

        awaitStartupProbe(started);
        log.info("[Plugin:{}] Spawned with PID {}", getPluginName(), started.pid());
    }

    private void awaitStartupProbe(Process started) {
        if (startupProbe.isZero() || startupProbe.isNegative()) {
            return;
        }
        try {
            if (started.waitFor(startupProbe.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new ProcessStartException(getPluginName(), "Plugin '" + getPluginName()
                        + "' exited during startup with code " + started.exitValue());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            started.destroyForcibly();
            throw new ProcessStartException(getPluginName(), "Interrupted while starting '" + getPluginName() + "'",
                    e);
        }
    }

    Map<String, String> buildEnvironment() {
        PermissionValidator grants = PermissionValidator.forManifest(manifest);
        List<String> capabilities = grants.getCapabilities().stream()
                .map(Capability::key)
                .sorted()
                .toList();
        return Map.of(
                ENV_PLUGIN_NAME, getPluginName(),
                ENV_PLUGIN_VERSION, manifest.getVersion(),
                ENV_BUS_URL, busUrl != null ? busUrl : "",
                ENV_STORAGE, storageDirectory != null ? storageDirectory.toString() : "",
                ENV_SUBSCRIBE, toJson(grants.getSubscribePatterns()),
                ENV_PUBLISH, toJson(grants.getPublishPatterns()),
                ENV_CAPABILITIES, toJson(capabilities),
                ENV_CONFIG, toJson(manifest.getConfig()),
                ENV_MESSAGE_RATE, String.valueOf(grants.getLimits().getMaxMessagesPerSecond()));
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new ProcessStartException(getPluginName(), "Cannot encode plugin environment: " + e.getMessage(),
                    e);
        }
    }

    private void drain(InputStream stream, String name, boolean warn) {
        Thread thread = new Thread(() -> {
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(stream, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    if (warn) {
                        log.warn("[Plugin:{}] {}", getPluginName(), line);
                    } else {
                        log.info("[Plugin:{}] {}", getPluginName(), line);
                    }
                }
            } catch (IOException e) {
                if (!stopping) {
                    log.debug("[Plugin:{}] {} drain ended: {}", getPluginName(), name, e.getMessage());
                }
            }
        }, "plugin-" + name + "-" + getPluginName());
        thread.setDaemon(true);
        thread.start();
    }

    @Override
    public void stop(Duration gracePeriod) {
        Process p = this.process;
        if (p == null || !p.isAlive()) {
            return;
        }
        stopping = true;
        log.info("[Plugin:{}] Stopping PID {}", getPluginName(), p.pid());

        List<ProcessHandle> descendants = p.descendants().toList();
        p.destroy();
        descendants.forEach(ProcessHandle::destroy);
        try {
            if (!p.waitFor(gracePeriod.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("[Plugin:{}] Did not stop within {}s, killing", getPluginName(), gracePeriod.toSeconds());
                forceKill(p, descendants);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            forceKill(p, descendants);
        }
        descendants.stream().filter(ProcessHandle::isAlive).forEach(ProcessHandle::destroyForcibly);
    }

    private void forceKill(Process p, List<ProcessHandle> descendants) {
        descendants.forEach(ProcessHandle::destroyForcibly);
        p.destroyForcibly();
        try {
            p.waitFor(1, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public boolean isRunning() {
        Process p = this.process;
        return p != null && p.isAlive();
    }

    @Override
    public Optional<Long> pid() {
        Process p = this.process;
        return p != null ? Optional.of(p.pid()) : Optional.empty();
    }

    @Override
    public OptionalInt exitCode() {
        Process p = this.process;
        if (p == null || p.isAlive()) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(p.exitValue());
    }

    @Override
    public Optional<ResourceSnapshot> sampleResources() {
        ProcessResourceSampler current = this.sampler;
        return current != null ? current.sample() : Optional.empty();
    }

    @Override
    public Instant getStartedAt() {
        return startedAt;
    }
}
