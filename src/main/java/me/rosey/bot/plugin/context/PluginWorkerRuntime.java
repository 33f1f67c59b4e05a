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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.rosey.bot.adapter.outbound.process.OsPluginProcess;
import me.rosey.bot.domain.model.BusMessage;
import me.rosey.bot.domain.model.Capability;
import me.rosey.bot.domain.model.PluginManifest;
import me.rosey.bot.domain.model.ResourceLimits;
import me.rosey.bot.domain.model.SubjectPermission;
import me.rosey.bot.domain.model.Subjects;
import me.rosey.bot.domain.service.PermissionDeniedException;
import me.rosey.bot.domain.service.PermissionValidator;
import me.rosey.bot.plugin.api.PluginContext;
import me.rosey.bot.plugin.api.RoseyPlugin;
import me.rosey.bot.port.outbound.MessageBusPort;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs a {@link RoseyPlugin} inside its worker process.
 *
 * <p>
 * All plugin hooks run on one thread named {@code plugin-<name>}. On
 * {@link #start()} the runtime:
 * <ol>
 * <li>calls {@link RoseyPlugin#onLoad} bounded by the grace period</li>
 * <li>delivers messages on the manifest's declared subscribe patterns to
 * {@link RoseyPlugin#onEvent}</li>
 * <li>answers {@code rosey.commands.<name>.execute} with the result or error
 * subject, and as a reply when the command was a request</li>
 * <li>answers {@code rosey.plugins.<name>.health} pings</li>
 * <li>publishes {@code rosey.plugins.<name>.plugin.ready}</li>
 * </ol>
 */
@Slf4j
public class PluginWorkerRuntime implements AutoCloseable {

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };
    private static final TypeReference<Map<String, Object>> CONFIG_MAP = new TypeReference<>() {
    };

    private final PluginManifest manifest;
    private final RoseyPlugin plugin;
    private final MessageBusPort bus;
    private final Path storageDirectory;
    private final Duration gracePeriod;
    private final PermissionValidator permissions;
    private final GuardedPluginMessaging messaging;
    private final ExecutorService executor;
    private final List<MessageBusPort.Subscription> subscriptions = new ArrayList<>();

    private volatile boolean running;

    public PluginWorkerRuntime(PluginManifest manifest, RoseyPlugin plugin, MessageBusPort bus,
            Path storageDirectory, Duration gracePeriod) {
        this.manifest = manifest;
        this.plugin = plugin;
        this.bus = bus;
        this.storageDirectory = storageDirectory;
        this.gracePeriod = gracePeriod;
        this.permissions = PermissionValidator.forManifest(manifest);
        this.messaging = new GuardedPluginMessaging(bus, permissions);
        this.executor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "plugin-" + manifest.getName());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Build a runtime from the {@code ROSEY_*} variables the host sets on the
     * plugin process.
     */
    public static PluginWorkerRuntime fromEnvironment(Map<String, String> env, RoseyPlugin plugin,
            MessageBusPort bus, ObjectMapper objectMapper, Duration gracePeriod) {
        PluginManifest manifest = manifestFromEnvironment(env, objectMapper);
        String storage = env.get(OsPluginProcess.ENV_STORAGE);
        Path storageDirectory = storage != null && !storage.isBlank() ? Path.of(storage) : null;
        return new PluginWorkerRuntime(manifest, plugin, bus, storageDirectory, gracePeriod);
    }

    static PluginManifest manifestFromEnvironment(Map<String, String> env, ObjectMapper objectMapper) {
        String name = env.get(OsPluginProcess.ENV_PLUGIN_NAME);
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException(OsPluginProcess.ENV_PLUGIN_NAME + " is not set");
        }
        List<String> implicitSubscribe = PermissionValidator.implicitSubscribe(name);
        List<String> implicitPublish = PermissionValidator.implicitPublish(name);

        List<SubjectPermission> permissions = new ArrayList<>();
        for (String pattern : readJson(env, OsPluginProcess.ENV_SUBSCRIBE, STRING_LIST, List.of(), objectMapper)) {
            if (!implicitSubscribe.contains(pattern)) {
                permissions.add(SubjectPermission.subscribeOnly(pattern));
            }
        }
        for (String pattern : readJson(env, OsPluginProcess.ENV_PUBLISH, STRING_LIST, List.of(), objectMapper)) {
            if (!implicitPublish.contains(pattern)) {
                permissions.add(SubjectPermission.publishOnly(pattern));
            }
        }

        Set<Capability> capabilities = EnumSet.noneOf(Capability.class);
        for (String key : readJson(env, OsPluginProcess.ENV_CAPABILITIES, STRING_LIST, List.of(), objectMapper)) {
            Capability capability = Capability.fromKey(key)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown capability: " + key));
            capabilities.add(capability);
        }

        int messageRate = 0;
        String rate = env.get(OsPluginProcess.ENV_MESSAGE_RATE);
        if (rate != null && !rate.isBlank()) {
            try {
                messageRate = Integer.parseInt(rate.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(
                        OsPluginProcess.ENV_MESSAGE_RATE + " is not an integer: " + rate, e);
            }
        }

        String version = env.getOrDefault(OsPluginProcess.ENV_PLUGIN_VERSION, "0.0.0");
        return PluginManifest.builder()
                .name(name)
                .displayName(name)
                .version(version)
                .entryPoint("")
                .permissions(List.copyOf(permissions))
                .capabilities(Set.copyOf(capabilities))
                .limits(ResourceLimits.builder().maxMessagesPerSecond(messageRate).build())
                .config(readJson(env, OsPluginProcess.ENV_CONFIG, CONFIG_MAP, Map.of(), objectMapper))
                .build();
    }

    private static <T> T readJson(Map<String, String> env, String key, TypeReference<T> type, T fallback,
            ObjectMapper objectMapper) {
        String value = env.get(key);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            T parsed = objectMapper.readValue(value, type);
            return parsed != null ? parsed : fallback;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(key + " is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        String name = manifest.getName();
        PluginContext context = new DefaultPluginContext(permissions, manifest.getConfig(), storageDirectory,
                messaging);
        runBounded("load", () -> plugin.onLoad(context));
        running = true;

        subscriptions.add(messaging.subscribe(Subjects.commandExecute(name), this::dispatchCommand));
        subscriptions.add(messaging.subscribe(Subjects.health(name), this::answerHealth));
        Set<String> declared = new LinkedHashSet<>();
        for (SubjectPermission permission : manifest.getPermissions()) {
            if (permission.subscribe()) {
                declared.add(permission.pattern());
            }
        }
        for (String pattern : declared) {
            subscriptions.add(messaging.subscribe(pattern, this::dispatchEvent));
        }

        Map<String, Object> ready = new LinkedHashMap<>();
        ready.put("plugin", name);
        ready.put("version", manifest.getVersion());
        ready.put("subscriptions", List.copyOf(declared));
        messaging.publish(Subjects.pluginEvent(name, Subjects.EVENT_PLUGIN_READY), ready);
        log.info("[Plugin:{}] Ready ({} subscription(s))", name, declared.size());
    }

    public boolean isRunning() {
        return running;
    }

    public long getDeniedCount() {
        return messaging.getDeniedCount();
    }

    @Override
    public synchronized void close() {
        if (!running) {
            executor.shutdownNow();
            return;
        }
        running = false;
        subscriptions.forEach(MessageBusPort.Subscription::unsubscribe);
        subscriptions.clear();
        try {
            runBounded("unload", plugin::onUnload);
        } catch (IllegalStateException e) {
            log.warn("[Plugin:{}] {}", manifest.getName(), e.getMessage());
        }
        executor.shutdownNow();
        log.info("[Plugin:{}] Unloaded", manifest.getName());
    }

    private void runBounded(String phase, Runnable hook) {
        Future<?> future = executor.submit(hook);
        try {
            future.get(gracePeriod.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new IllegalStateException("Plugin '" + manifest.getName() + "' did not finish " + phase
                    + " within " + gracePeriod.toMillis() + "ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new IllegalStateException("Plugin '" + manifest.getName() + "' failed to " + phase + ": "
                    + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted during " + phase + " of '" + manifest.getName() + "'", e);
        }
    }

    private void dispatchEvent(BusMessage message) {
        submit(() -> {
            try {
                plugin.onEvent(message);
            } catch (RuntimeException e) {
                log.warn("[Plugin:{}] Event handler failed on {}: {}", manifest.getName(), message.subject(),
                        e.getMessage(), e);
            }
        });
    }

    private void dispatchCommand(BusMessage command) {
        submit(() -> handleCommand(command));
    }

    private void handleCommand(BusMessage command) {
        String name = manifest.getName();
        Map<String, Object> response = new LinkedHashMap<>();
        String subject;
        try {
            Map<String, Object> result = plugin.onCommand(command);
            response.put("plugin", name);
            response.put("success", true);
            response.put("result", result != null ? result : Map.of());
            subject = Subjects.commandResult(name);
        } catch (RuntimeException e) {
            log.warn("[Plugin:{}] Command failed: {}", name, e.getMessage());
            response.put("plugin", name);
            response.put("success", false);
            response.put("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            subject = Subjects.commandError(name);
        }
        if (command.data().containsKey("command_id")) {
            response.put("command_id", command.data().get("command_id"));
        }
        if (command.expectsReply()) {
            messaging.reply(command, response);
        }
        try {
            messaging.publish(subject, response);
        } catch (PermissionDeniedException e) {
            log.warn("[Plugin:{}] Cannot publish command outcome: {}", name, e.getMessage());
        }
    }

    private void answerHealth(BusMessage ping) {
        if (!ping.expectsReply()) {
            return;
        }
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("plugin", manifest.getName());
        status.put("status", running ? "ok" : "stopping");
        status.put("permission_denials", messaging.getDeniedCount());
        messaging.reply(ping, status);
    }

    private void submit(Runnable task) {
        if (!running) {
            return;
        }
        try {
            executor.execute(task);
        } catch (RejectedExecutionException e) {
            log.debug("[Plugin:{}] Dropped message after shutdown", manifest.getName());
        }
    }
}
