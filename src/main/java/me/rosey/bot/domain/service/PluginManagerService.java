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

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.rosey.bot.domain.component.PluginProcess;
import me.rosey.bot.domain.model.BusMessage;
import me.rosey.bot.domain.model.PluginLifecycleEvent;
import me.rosey.bot.domain.model.PluginManifest;
import me.rosey.bot.domain.model.PluginOperationResult;
import me.rosey.bot.domain.model.PluginRuntimeState;
import me.rosey.bot.domain.model.PluginState;
import me.rosey.bot.domain.model.PluginStatus;
import me.rosey.bot.domain.model.ResourceSnapshot;
import me.rosey.bot.domain.model.Subjects;
import me.rosey.bot.infrastructure.config.BotProperties;
import me.rosey.bot.infrastructure.event.SpringEventBus;
import me.rosey.bot.port.inbound.PluginManagementPort;
import me.rosey.bot.port.outbound.MessageBusPort;
import me.rosey.bot.port.outbound.PluginProcessPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.TreeMap;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Supervises every installed plugin: registry, dependency order, lifecycle
 * state machine, periodic health checks, crash recovery and hot
 * install/uninstall.
 *
 * <p>
 * All registry state is confined to one single-threaded scheduled executor,
 * the {@code plugin-control-loop}. Public operations are submitted to it and
 * waited for with {@code bot.plugins.operation-timeout}, plus one
 * {@code bot.plugins.stop-grace-period} per registered plugin for operations
 * that may stop plugins; calls made from the loop itself run inline. An
 * operation that outlives its bound is never interrupted: it finishes on the
 * loop and the caller is told it is still in progress. Health sweeps and backoff restarts are scheduled on
 * the same loop, so no operation ever observes a half-applied transition.
 *
 * <p>
 * Crash count semantics:
 * <ul>
 * <li>an operator start (start, start-all, install) clears it</li>
 * <li>recovery restarts and limit-violation restarts keep it</li>
 * <li>{@link #enable(String)} clears it</li>
 * <li>a plugin healthy for {@code bot.plugins.crash-reset-after} has it
 * cleared at the next health check</li>
 * </ul>
 */
@Service
@Slf4j
public class PluginManagerService implements PluginManagementPort {

    private final PluginProcessPort processPort;
    private final MessageBusPort messageBus;
    private final SpringEventBus eventBus;
    private final BotProperties.PluginsProperties settings;
    private final Clock clock;
    private final CrashRecoveryPolicy recoveryPolicy;

    /** Confined to the control loop. */
    private final Map<String, PluginRuntimeState> registry = new HashMap<>();
    private DependencyGraph graph = DependencyGraph.of(List.of());

    private final ScheduledExecutorService controlLoop;
    private volatile Thread loopThread;
    private final List<MessageBusPort.Subscription> subscriptions = new ArrayList<>();
    private volatile boolean monitoring;
    private volatile int pluginCount;

    public PluginManagerService(PluginProcessPort processPort, MessageBusPort messageBus, SpringEventBus eventBus,
            BotProperties properties, Clock clock) {
        this.processPort = processPort;
        this.messageBus = messageBus;
        this.eventBus = eventBus;
        this.settings = properties.getPlugins();
        this.clock = clock;
        this.recoveryPolicy = new CrashRecoveryPolicy(settings.getDisableThreshold(), settings.getBackoffBase(),
                settings.getMaxBackoff());
        this.controlLoop = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "plugin-control-loop");
            t.setDaemon(true);
            loopThread = t;
            return t;
        });
    }

    private enum StartCause {
        OPERATOR,
        RESTART,
        RECOVERY
    }

    // ==================== Registration ====================

    /**
     * Register discovered manifests without starting them. Duplicate names are
     * skipped; dependency cycles are left for {@link #startAll()} to report.
     */
    public void registerAll(Collection<PluginManifest> manifests) {
        onControlLoop(() -> {
            for (PluginManifest manifest : manifests) {
                if (registry.containsKey(manifest.getName())) {
                    log.warn("[Plugins] Duplicate plugin '{}' ignored", manifest.getName());
                    continue;
                }
                registry.put(manifest.getName(), new PluginRuntimeState(manifest));
                log.info("[Plugins] Registered {}", manifest.label());
            }
            rebuildGraph();
            return null;
        });
    }

    /**
     * Install a plugin at runtime. Fails on a duplicate name or a dependency
     * cycle; starts the plugin when it auto-starts and its dependencies are
     * running.
     */
    public PluginOperationResult loadPlugin(PluginManifest manifest) {
        if (manifest == null) {
            return PluginOperationResult.failure(null, "Manifest is required");
        }
        return operation(manifest.getName(), () -> {
            String name = manifest.getName();
            if (registry.containsKey(name)) {
                return PluginOperationResult.failure(name, "Plugin '" + name + "' is already installed");
            }
            if (graph.with(manifest).findCycleMembers().contains(name)) {
                return PluginOperationResult.failure(name,
                        "Installing '" + name + "' would create a dependency cycle");
            }
            registry.put(name, new PluginRuntimeState(manifest));
            rebuildGraph();
            log.info("[Plugins] Installed {}", manifest.label());
            publishLifecycle(registry.get(name), PluginLifecycleEvent.Type.LOADED, manifest.label());

            if (!manifest.isAutoStart()) {
                return PluginOperationResult.success(name, "Installed " + manifest.label() + " (auto-start off)");
            }
            Optional<String> blocked = unmetDependency(name);
            if (blocked.isPresent()) {
                return PluginOperationResult.success(name,
                        "Installed " + manifest.label() + ", not started: " + blocked.get());
            }
            PluginOperationResult started = startInternal(name, false, StartCause.OPERATOR);
            return started.isSuccess()
                    ? PluginOperationResult.success(name, "Installed and started " + manifest.label())
                    : PluginOperationResult.failure(name,
                            "Installed " + manifest.label() + " but start failed: " + started.getMessage());
        });
    }

    /**
     * Stop a plugin together with its running dependents and remove it from
     * the registry.
     */
    public PluginOperationResult unloadPlugin(String name) {
        return operation(name, () -> {
            PluginRuntimeState runtime = registry.get(name);
            if (runtime == null) {
                return unknown(name);
            }
            if (runtime.getState().isActive() || runtime.getState() == PluginState.CRASHED) {
                stopWithDependents(name, true);
            }
            runtime.cancelPendingRecovery();
            registry.remove(name);
            rebuildGraph();
            log.info("[Plugins] Uninstalled {}", runtime.getManifest().label());
            publishLifecycle(runtime, PluginLifecycleEvent.Type.UNLOADED, null);
            return PluginOperationResult.success(name, "Uninstalled " + runtime.getManifest().label());
        });
    }

    // ==================== Lifecycle ====================

    /**
     * Start one plugin. Refused for unknown, running or (unless forced)
     * disabled plugins, and when a dependency is not running.
     */
    public PluginOperationResult startPlugin(String name, boolean force) {
        return operation(name, () -> startInternal(name, force, StartCause.OPERATOR));
    }

    /**
     * Stop one plugin. With {@code stopDependents} every running plugin that
     * depends on it is stopped first; without it the stop is refused while
     * dependents run.
     */
    public PluginOperationResult stopPlugin(String name, boolean stopDependents) {
        return operation(name, () -> {
            PluginRuntimeState runtime = registry.get(name);
            if (runtime == null) {
                return unknown(name);
            }
            if (!isStoppable(runtime)) {
                return PluginOperationResult.failure(name,
                        "Plugin '" + name + "' is not running (" + runtime.getState() + ")");
            }
            return stopWithDependents(name, stopDependents);
        });
    }

    /**
     * Stop the plugin alone (dependents keep running) and start it again.
     * Refused for disabled plugins.
     */
    public PluginOperationResult restartPlugin(String name) {
        return operation(name, () -> {
            PluginRuntimeState runtime = registry.get(name);
            if (runtime == null) {
                return unknown(name);
            }
            if (!runtime.isEnabled() || runtime.getState() == PluginState.DISABLED) {
                return PluginOperationResult.failure(name,
                        "Plugin '" + name + "' is disabled; enable it first");
            }
            if (isStoppable(runtime)) {
                stopInternal(runtime, true);
            }
            PluginOperationResult result = startInternal(name, true, StartCause.RESTART);
            if (result.isSuccess()) {
                publishLifecycle(runtime, PluginLifecycleEvent.Type.RESTARTED, "operator restart");
                return PluginOperationResult.success(name, "Restarted " + runtime.getManifest().label());
            }
            return result;
        });
    }

    /**
     * Start every startable plugin in dependency order. Plugins on a
     * dependency cycle are disabled; plugins downstream of a cycle, missing
     * or stopped dependency are skipped.
     *
     * @return result whose data is the list of plugins started
     */
    public PluginOperationResult startAll() {
        return operation(null, () -> {
            for (String member : graph.findCycleMembers()) {
                PluginRuntimeState runtime = registry.get(member);
                if (runtime.getState() != PluginState.DISABLED) {
                    log.error("[Plugins] Configuration error: '{}' is part of a dependency cycle, disabling",
                            member);
                    if (isStoppable(runtime)) {
                        stopInternal(runtime, false);
                    }
                    runtime.setEnabled(false);
                    runtime.setState(PluginState.DISABLED);
                    publishLifecycle(runtime, PluginLifecycleEvent.Type.DISABLED, "dependency cycle");
                }
            }

            DependencyGraph.TopologicalOrder order = graph.topologicalOrder();
            for (String name : order.residual()) {
                if (registry.get(name).getState() != PluginState.DISABLED) {
                    log.warn("[Plugins] Skipping '{}': depends on a dependency cycle", name);
                }
            }

            List<String> started = new ArrayList<>();
            for (String name : order.order()) {
                PluginRuntimeState runtime = registry.get(name);
                Optional<String> skip = autoStartBlocker(runtime);
                if (skip.isPresent()) {
                    log.info("[Plugins] Not starting '{}': {}", name, skip.get());
                    continue;
                }
                PluginOperationResult result = startInternal(name, false, StartCause.OPERATOR);
                if (result.isSuccess()) {
                    started.add(name);
                }
            }
            log.info("[Plugins] Started {} of {} plugins: {}", started.size(), registry.size(), started);
            return PluginOperationResult.success(null, "Started " + started.size() + " plugin(s)",
                    List.copyOf(started));
        });
    }

    /**
     * Stop every plugin in reverse dependency order.
     *
     * @return result whose data is the list of plugins stopped
     */
    public PluginOperationResult stopAll() {
        return operation(null, () -> {
            List<String> ordered = new ArrayList<>(graph.topologicalOrder().reversed());
            registry.keySet().stream()
                    .filter(name -> !ordered.contains(name))
                    .sorted()
                    .forEach(ordered::add);

            List<String> stopped = new ArrayList<>();
            for (String name : ordered) {
                PluginRuntimeState runtime = registry.get(name);
                if (isStoppable(runtime)) {
                    stopInternal(runtime, true);
                    stopped.add(name);
                }
                runtime.cancelPendingRecovery();
            }
            log.info("[Plugins] Stopped {} plugins: {}", stopped.size(), stopped);
            return PluginOperationResult.success(null, "Stopped " + stopped.size() + " plugin(s)",
                    List.copyOf(stopped));
        });
    }

    @Override
    public PluginOperationResult enable(String name) {
        return operation(name, () -> {
            PluginRuntimeState runtime = registry.get(name);
            if (runtime == null) {
                return unknown(name);
            }
            runtime.setEnabled(true);
            runtime.setCrashCount(0);
            if (runtime.getState() == PluginState.DISABLED) {
                runtime.setState(PluginState.STOPPED);
            }
            log.info("[Plugins] Enabled '{}'", name);
            publishLifecycle(runtime, PluginLifecycleEvent.Type.ENABLED, null);
            return PluginOperationResult.success(name, "Enabled '" + name + "'");
        });
    }

    @Override
    public PluginOperationResult disable(String name) {
        return operation(name, () -> {
            PluginRuntimeState runtime = registry.get(name);
            if (runtime == null) {
                return unknown(name);
            }
            runtime.setEnabled(false);
            runtime.cancelPendingRecovery();
            if (!runtime.getState().isActive()) {
                runtime.setState(PluginState.DISABLED);
            }
            log.info("[Plugins] Disabled '{}'", name);
            publishLifecycle(runtime, PluginLifecycleEvent.Type.DISABLED, "operator");
            String suffix = runtime.getState().isActive() ? " (still running until stopped)" : "";
            return PluginOperationResult.success(name, "Disabled '" + name + "'" + suffix);
        });
    }

    // ==================== Health ====================

    /**
     * Check one plugin: liveness, resource limits, error rate and, when
     * enabled, a health ping.
     */
    public PluginOperationResult healthCheckPlugin(String name) {
        return operation(name, () -> healthCheckInternal(name));
    }

    /**
     * Check every plugin; one failing check never affects the others.
     */
    public void healthCheckAll() {
        onControlLoop(() -> {
            sweep();
            return null;
        });
    }

    private void sweep() {
        for (String name : new ArrayList<>(registry.keySet())) {
            try {
                healthCheckInternal(name);
            } catch (RuntimeException e) {
                log.error("[Plugins] Health check of '{}' failed: {}", name, e.getMessage(), e);
            }
        }
    }

    private PluginOperationResult healthCheckInternal(String name) {
        PluginRuntimeState runtime = registry.get(name);
        if (runtime == null) {
            return unknown(name);
        }
        if (!runtime.getState().isActive()) {
            return PluginOperationResult.success(name, "Not running (" + runtime.getState() + ")");
        }
        Instant now = clock.instant();
        runtime.setLastHealthCheck(now);

        PluginProcess process = runtime.getProcess();
        if (process == null || !process.isRunning()) {
            Integer exitCode = exitCodeOf(process);
            handleCrash(runtime, exitCode, "process exited" + (exitCode != null ? " with code " + exitCode : ""));
            return PluginOperationResult.failure(name, "Plugin '" + name + "' crashed");
        }

        List<String> violations = new ArrayList<>();
        sample(runtime, process).ifPresent(snapshot -> violations.addAll(
                runtime.getPermissions().checkResourceLimits(snapshot)));
        if (settings.isHealthPingEnabled()) {
            ping(runtime).ifPresent(violations::add);
        }

        if (!violations.isEmpty()) {
            runtime.setConsecutiveViolations(runtime.getConsecutiveViolations() + 1);
            if (violations.size() >= 2 || runtime.getConsecutiveViolations() >= 2) {
                log.warn("[Plugins] '{}' exceeded limits ({} consecutive): {}. Restarting", name,
                        runtime.getConsecutiveViolations(), violations);
                return restartForViolation(runtime, violations);
            }
            markUnhealthy(runtime, String.join("; ", violations));
            return PluginOperationResult.failure(name, "Unhealthy: " + String.join("; ", violations));
        }

        runtime.setConsecutiveViolations(0);
        double errorRate = runtime.errorRate();
        if (errorRate > settings.getMaxErrorRate()) {
            String reason = String.format(Locale.ROOT, "command error rate %.2f exceeds %.2f", errorRate,
                    settings.getMaxErrorRate());
            markUnhealthy(runtime, reason);
            return PluginOperationResult.failure(name, "Unhealthy: " + reason);
        }

        if (runtime.getState() == PluginState.UNHEALTHY) {
            runtime.setState(PluginState.RUNNING);
            log.info("[Plugins] '{}' recovered", name);
            publishLifecycle(runtime, PluginLifecycleEvent.Type.RECOVERED, null);
        }
        if (runtime.getCrashCount() > 0
                && runtime.uptime(now).compareTo(settings.getCrashResetAfter()) >= 0) {
            log.info("[Plugins] '{}' stable for {}s, clearing crash count {}", name,
                    runtime.uptime(now).toSeconds(), runtime.getCrashCount());
            runtime.setCrashCount(0);
        }
        return PluginOperationResult.success(name, "Healthy");
    }

    private Optional<ResourceSnapshot> sample(PluginRuntimeState runtime, PluginProcess process) {
        try {
            Optional<ResourceSnapshot> snapshot = process.sampleResources();
            snapshot.ifPresent(runtime::setLastSnapshot);
            return snapshot;
        } catch (RuntimeException e) {
            log.warn("[Plugins] Cannot sample resources of '{}': {}", runtime.getName(), e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<String> ping(PluginRuntimeState runtime) {
        Duration timeout = settings.getHealthPingTimeout();
        try {
            messageBus.request(Subjects.health(runtime.getName()),
                    Map.of("timestamp", clock.instant().toString()), timeout)
                    .get(timeout.toMillis() + 100, TimeUnit.MILLISECONDS);
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.of("health ping interrupted");
        } catch (ExecutionException | TimeoutException e) {
            Throwable cause = e instanceof ExecutionException && e.getCause() != null ? e.getCause() : e;
            return Optional.of("health ping failed: " + cause.getClass().getSimpleName());
        }
    }

    private void markUnhealthy(PluginRuntimeState runtime, String reason) {
        if (runtime.getState() != PluginState.UNHEALTHY) {
            runtime.setState(PluginState.UNHEALTHY);
            log.warn("[Plugins] '{}' unhealthy: {}", runtime.getName(), reason);
            publishLifecycle(runtime, PluginLifecycleEvent.Type.UNHEALTHY, reason);
        }
    }

    private PluginOperationResult restartForViolation(PluginRuntimeState runtime, List<String> violations) {
        String name = runtime.getName();
        stopInternal(runtime, false);
        if (!runtime.isEnabled()) {
            return PluginOperationResult.failure(name, "Stopped for limit violations; plugin is disabled");
        }
        PluginOperationResult result = startInternal(name, true, StartCause.RESTART);
        if (result.isSuccess()) {
            publishLifecycle(runtime, PluginLifecycleEvent.Type.RESTARTED, String.join("; ", violations));
            return PluginOperationResult.failure(name, "Restarted for limit violations: " + violations);
        }
        return result;
    }

    // ==================== Crash recovery ====================

    private void handleCrash(PluginRuntimeState runtime, Integer exitCode, String reason) {
        String name = runtime.getName();
        stopQuietly(runtime);
        runtime.setProcess(null);
        runtime.setState(PluginState.CRASHED);
        runtime.setStoppedAt(clock.instant());
        runtime.setLastExitCode(exitCode);
        runtime.setConsecutiveViolations(0);
        runtime.setCrashCount(runtime.getCrashCount() + 1);
        log.error("[Plugins] '{}' crashed ({}), crash count {}", name, reason, runtime.getCrashCount());
        publishLifecycle(runtime, PluginLifecycleEvent.Type.CRASHED, reason);
        publishBus(Subjects.event(Subjects.EVENT_PLUGIN_ERROR), eventPayload(runtime, reason));

        CrashRecoveryPolicy.Decision decision = recoveryPolicy.decide(runtime.getCrashCount(),
                runtime.getManifest().getRestartPolicy(), runtime.isOperatorStopped(), exitCode);
        switch (decision.action()) {
        case DISABLE -> {
            runtime.setEnabled(false);
            runtime.setState(PluginState.DISABLED);
            log.error("[Plugins] Disabling '{}': {}", name, decision.reason());
            publishLifecycle(runtime, PluginLifecycleEvent.Type.DISABLED, decision.reason());
        }
        case RESTART -> {
            if (!runtime.isEnabled()) {
                log.info("[Plugins] Not restarting '{}': disabled", name);
                return;
            }
            log.info("[Plugins] Restarting '{}' in {}ms", name, decision.delay().toMillis());
            runtime.cancelPendingRecovery();
            runtime.setPendingRecovery(controlLoop.schedule(() -> recover(name), decision.delay().toMillis(),
                    TimeUnit.MILLISECONDS));
        }
        case NONE -> log.info("[Plugins] Leaving '{}' crashed: {}", name, decision.reason());
        }
    }

    private void recover(String name) {
        PluginRuntimeState runtime = registry.get(name);
        if (runtime == null) {
            return;
        }
        runtime.setPendingRecovery(null);
        if (runtime.getState() != PluginState.CRASHED || !runtime.isEnabled()) {
            return;
        }
        try {
            PluginOperationResult result = startInternal(name, true, StartCause.RECOVERY);
            if (result.isSuccess()) {
                publishLifecycle(runtime, PluginLifecycleEvent.Type.RESTARTED, "crash recovery");
            } else if (runtime.getState() == PluginState.CRASHED && runtime.getProcess() == null
                    && unmetDependency(name).isEmpty()) {
                handleCrash(runtime, null, "restart failed: " + result.getMessage());
            } else {
                log.warn("[Plugins] Recovery of '{}' did not start it: {}", name, result.getMessage());
            }
        } catch (RuntimeException e) {
            log.error("[Plugins] Recovery of '{}' failed: {}", name, e.getMessage(), e);
        }
    }

    // ==================== Transitions ====================

    private PluginOperationResult startInternal(String name, boolean force, StartCause cause) {
        PluginRuntimeState runtime = registry.get(name);
        if (runtime == null) {
            return unknown(name);
        }
        PluginState previous = runtime.getState();
        if (previous.isActive()) {
            return PluginOperationResult.failure(name, "Plugin '" + name + "' is already running");
        }
        if (previous == PluginState.DISABLED && !force) {
            return PluginOperationResult.failure(name,
                    "Plugin '" + name + "' is disabled; enable it first");
        }
        Optional<String> blocked = unmetDependency(name);
        if (blocked.isPresent()) {
            return PluginOperationResult.failure(name, "Cannot start '" + name + "': " + blocked.get());
        }

        runtime.cancelPendingRecovery();
        runtime.setState(PluginState.STARTING);
        PluginProcess process = null;
        try {
            process = processPort.create(runtime.getManifest());
            process.start();
        } catch (RuntimeException e) {
            log.error("[Plugins] Failed to start '{}': {}", name, e.getMessage());
            if (process != null) {
                stopProcess(name, process);
            }
            runtime.setState(previous == PluginState.CRASHED || previous == PluginState.DISABLED
                    ? previous
                    : PluginState.STOPPED);
            return PluginOperationResult.failure(name, "Failed to start '" + name + "': " + e.getMessage());
        }

        Instant now = clock.instant();
        runtime.setProcess(process);
        runtime.setState(PluginState.RUNNING);
        runtime.setStartedAt(now);
        runtime.setStoppedAt(null);
        runtime.setLastHealthCheck(null);
        runtime.setLastSnapshot(null);
        runtime.setLastExitCode(null);
        runtime.setConsecutiveViolations(0);
        runtime.setCommandSuccesses(0);
        runtime.setCommandErrors(0);
        if (cause == StartCause.OPERATOR) {
            runtime.setCrashCount(0);
            runtime.setOperatorStopped(false);
        } else {
            runtime.setRestartCount(runtime.getRestartCount() + 1);
        }

        log.info("[Plugins] Started {} (pid {})", runtime.getManifest().label(),
                process.pid().map(String::valueOf).orElse("?"));
        publishLifecycle(runtime, PluginLifecycleEvent.Type.STARTED, cause.name().toLowerCase(Locale.ROOT));
        publishBus(Subjects.event(Subjects.EVENT_PLUGIN_START), eventPayload(runtime, null));
        return PluginOperationResult.success(name, "Started " + runtime.getManifest().label());
    }

    private PluginOperationResult stopWithDependents(String name, boolean stopDependents) {
        List<String> runningDependents = graph.transitiveDependentsInStopOrder(name).stream()
                .filter(dependent -> isStoppable(registry.get(dependent)))
                .toList();
        if (!stopDependents && !runningDependents.isEmpty()) {
            return PluginOperationResult.failure(name,
                    "Plugin '" + name + "' has running dependents: " + String.join(", ", runningDependents));
        }
        for (String dependent : runningDependents) {
            log.info("[Plugins] Stopping dependent '{}' of '{}'", dependent, name);
            stopInternal(registry.get(dependent), true);
        }
        PluginRuntimeState runtime = registry.get(name);
        if (isStoppable(runtime)) {
            stopInternal(runtime, true);
        }
        List<String> stopped = new ArrayList<>(runningDependents);
        stopped.add(name);
        return PluginOperationResult.success(name, "Stopped " + String.join(", ", stopped), List.copyOf(stopped));
    }

    private void stopInternal(PluginRuntimeState runtime, boolean operator) {
        runtime.cancelPendingRecovery();
        runtime.setState(PluginState.STOPPING);
        PluginProcess process = runtime.getProcess();
        if (process != null) {
            stopProcess(runtime.getName(), process);
        }
        runtime.setProcess(null);
        runtime.setStoppedAt(clock.instant());
        runtime.setConsecutiveViolations(0);
        if (operator) {
            runtime.setOperatorStopped(true);
        }
        runtime.setState(runtime.isEnabled() ? PluginState.STOPPED : PluginState.DISABLED);
        log.info("[Plugins] Stopped '{}'", runtime.getName());
        publishLifecycle(runtime, PluginLifecycleEvent.Type.STOPPED, null);
        publishBus(Subjects.event(Subjects.EVENT_PLUGIN_STOP), eventPayload(runtime, null));
    }

    private void stopProcess(String name, PluginProcess process) {
        try {
            process.stop(settings.getStopGracePeriod());
        } catch (RuntimeException e) {
            log.warn("[Plugins] Error stopping '{}': {}", name, e.getMessage());
        }
    }

    private void stopQuietly(PluginRuntimeState runtime) {
        PluginProcess process = runtime.getProcess();
        if (process != null && process.isRunning()) {
            stopProcess(runtime.getName(), process);
        }
    }

    private static boolean isStoppable(PluginRuntimeState runtime) {
        PluginState state = runtime.getState();
        return state.isActive() || state == PluginState.CRASHED || state == PluginState.STARTING;
    }

    private Optional<String> unmetDependency(String name) {
        for (String dependency : graph.dependenciesOf(name)) {
            PluginRuntimeState runtime = registry.get(dependency);
            if (runtime == null) {
                return Optional.of("dependency '" + dependency + "' is not installed");
            }
            if (!runtime.getState().isActive()) {
                return Optional.of("dependency '" + dependency + "' is not running (" + runtime.getState() + ")");
            }
        }
        return Optional.empty();
    }

    private Optional<String> autoStartBlocker(PluginRuntimeState runtime) {
        if (runtime.getState().isActive()) {
            return Optional.of("already running");
        }
        if (!runtime.isEnabled() || runtime.getState() == PluginState.DISABLED) {
            return Optional.of("disabled");
        }
        if (!runtime.getManifest().isAutoStart()) {
            return Optional.of("auto-start is off");
        }
        return unmetDependency(runtime.getName());
    }

    private void rebuildGraph() {
        graph = DependencyGraph.of(registry.values().stream().map(PluginRuntimeState::getManifest).toList());
        pluginCount = registry.size();
        for (PluginRuntimeState runtime : registry.values()) {
            runtime.setDependents(graph.dependentsOf(runtime.getName()));
        }
    }

    private static Integer exitCodeOf(PluginProcess process) {
        if (process == null) {
            return null;
        }
        OptionalInt exitCode = process.exitCode();
        return exitCode.isPresent() ? exitCode.getAsInt() : null;
    }

    // ==================== Counters ====================

    /**
     * Count a command outcome towards the plugin's error rate. Safe to call
     * from any thread; the update is applied on the control loop.
     */
    public void recordCommandResult(String name, boolean success) {
        onControlLoopAsync(() -> {
            PluginRuntimeState runtime = registry.get(name);
            if (runtime == null) {
                return;
            }
            if (success) {
                runtime.setCommandSuccesses(runtime.getCommandSuccesses() + 1);
            } else {
                runtime.setCommandErrors(runtime.getCommandErrors() + 1);
            }
        });
    }

    public void recordPermissionDenied(String name) {
        onControlLoopAsync(() -> {
            PluginRuntimeState runtime = registry.get(name);
            if (runtime != null) {
                runtime.setPermissionDenials(runtime.getPermissionDenials() + 1);
            }
        });
    }

    // ==================== Monitoring ====================

    /**
     * Schedule the periodic health sweep and listen for command outcomes and
     * permission denials on the bus.
     */
    public synchronized void startMonitoring() {
        if (monitoring) {
            return;
        }
        monitoring = true;
        long interval = settings.getHealthCheckInterval().toMillis();
        controlLoop.scheduleWithFixedDelay(this::sweepSafely, interval, interval, TimeUnit.MILLISECONDS);
        subscriptions.add(messageBus.subscribe(Subjects.ALL_COMMAND_RESULTS,
                message -> onCommandOutcome(message, true)));
        subscriptions.add(messageBus.subscribe(Subjects.ALL_COMMAND_ERRORS,
                message -> onCommandOutcome(message, false)));
        subscriptions.add(messageBus.subscribe(Subjects.ALL_PERMISSION_DENIALS, message -> {
            String plugin = Subjects.pluginOf(message.subject());
            if (plugin != null) {
                recordPermissionDenied(plugin);
            }
        }));
        log.info("[Plugins] Health checks every {}s", settings.getHealthCheckInterval().toSeconds());
    }

    private void onCommandOutcome(BusMessage message, boolean success) {
        String plugin = Subjects.pluginOf(message.subject());
        if (plugin != null) {
            recordCommandResult(plugin, success);
        }
    }

    private void sweepSafely() {
        try {
            sweep();
        } catch (RuntimeException e) {
            log.error("[Plugins] Health sweep failed: {}", e.getMessage(), e);
        }
    }

    @PreDestroy
    public void shutdown() {
        log.info("[Plugins] Shutting down plugin manager");
        subscriptions.forEach(MessageBusPort.Subscription::unsubscribe);
        subscriptions.clear();
        try {
            stopAll();
        } catch (RuntimeException e) {
            log.warn("[Plugins] Error stopping plugins on shutdown: {}", e.getMessage());
        }
        controlLoop.shutdownNow();
        try {
            controlLoop.awaitTermination(2, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    // ==================== Management API ====================

    @Override
    public List<PluginStatus> list() {
        return onControlLoop(() -> new TreeMap<>(registry).values().stream()
                .map(this::toStatus)
                .toList());
    }

    @Override
    public PluginOperationResult status(String name) {
        return operation(name, () -> {
            PluginRuntimeState runtime = registry.get(name);
            if (runtime == null) {
                return unknown(name);
            }
            PluginStatus status = toStatus(runtime);
            return PluginOperationResult.success(name, runtime.getManifest().label() + ": " + status.getState(),
                    status);
        });
    }

    @Override
    public PluginOperationResult start(String name) {
        return startPlugin(name, false);
    }

    @Override
    public PluginOperationResult stop(String name) {
        return stopPlugin(name, true);
    }

    @Override
    public PluginOperationResult restart(String name) {
        return restartPlugin(name);
    }

    @Override
    public PluginOperationResult install(PluginManifest manifest) {
        return loadPlugin(manifest);
    }

    @Override
    public PluginOperationResult uninstall(String name) {
        return unloadPlugin(name);
    }

    @Override
    public Map<PluginState, Long> statistics() {
        return onControlLoop(() -> {
            Map<PluginState, Long> counts = new EnumMap<>(PluginState.class);
            for (PluginState state : PluginState.values()) {
                counts.put(state, 0L);
            }
            registry.values().forEach(runtime -> counts.merge(runtime.getState(), 1L, Long::sum));
            return counts;
        });
    }

    /**
     * Current state of a plugin, empty when not registered.
     */
    public Optional<PluginState> getState(String name) {
        return onControlLoop(() -> Optional.ofNullable(registry.get(name)).map(PluginRuntimeState::getState));
    }

    private PluginStatus toStatus(PluginRuntimeState runtime) {
        Instant now = clock.instant();
        ResourceSnapshot snapshot = runtime.getLastSnapshot();
        PluginProcess process = runtime.getProcess();
        return PluginStatus.builder()
                .name(runtime.getName())
                .version(runtime.getManifest().getVersion())
                .state(runtime.getState())
                .enabled(runtime.isEnabled())
                .uptimeSeconds(runtime.uptime(now).toSeconds())
                .crashCount(runtime.getCrashCount())
                .restartCount(runtime.getRestartCount())
                .errorRate(runtime.errorRate())
                .permissionDenials(runtime.getPermissionDenials())
                .dependencies(runtime.getManifest().getDependencies())
                .dependents(runtime.getDependents().stream().sorted().toList())
                .pid(process != null ? process.pid().orElse(null) : null)
                .cpuPercent(snapshot != null ? snapshot.cpuPercent() : null)
                .memoryMb(snapshot != null ? snapshot.memoryMb() : null)
                .startedAt(runtime.getState().isActive() ? runtime.getStartedAt() : null)
                .lastHealthCheck(runtime.getLastHealthCheck())
                .build();
    }

    // ==================== Events ====================

    private void publishLifecycle(PluginRuntimeState runtime, PluginLifecycleEvent.Type type, String detail) {
        eventBus.publish(new PluginLifecycleEvent(runtime.getName(), type, runtime.getState(), detail,
                clock.instant()));
    }

    private void publishBus(String subject, Map<String, Object> payload) {
        try {
            messageBus.publish(subject, payload);
        } catch (RuntimeException e) {
            log.debug("[Plugins] Cannot publish {}: {}", subject, e.getMessage());
        }
    }

    private Map<String, Object> eventPayload(PluginRuntimeState runtime, String reason) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("plugin", runtime.getName());
        payload.put("state", runtime.getState().name());
        payload.put("crash_count", runtime.getCrashCount());
        PluginProcess process = runtime.getProcess();
        if (process != null) {
            process.pid().ifPresent(pid -> payload.put("pid", pid));
        }
        if (runtime.getLastExitCode() != null) {
            payload.put("exit_code", runtime.getLastExitCode());
        }
        if (reason != null) {
            payload.put("reason", reason);
        }
        payload.put("timestamp", clock.instant().toString());
        return payload;
    }

    // ==================== Control loop ====================

    private static PluginOperationResult unknown(String name) {
        return PluginOperationResult.failure(name, "Unknown plugin: " + name);
    }

    /**
     * Bound for operations that may stop plugins: each stop can take a full
     * grace period before the process is forced.
     */
    private Duration lifecycleTimeout() {
        return settings.getOperationTimeout().plus(settings.getStopGracePeriod().multipliedBy(pluginCount));
    }

    private PluginOperationResult operation(String name, Callable<PluginOperationResult> action) {
        try {
            return onControlLoop(action, lifecycleTimeout());
        } catch (OperationInProgressException e) {
            log.warn("[Plugins] Operation on '{}' {}", name, e.getMessage());
            return PluginOperationResult.failure(name, "Operation " + e.getMessage());
        } catch (RuntimeException e) {
            log.error("[Plugins] Operation on '{}' failed: {}", name, e.getMessage(), e);
            return PluginOperationResult.failure(name, e.getMessage());
        }
    }

    private <T> T onControlLoop(Callable<T> action) {
        return onControlLoop(action, settings.getOperationTimeout());
    }

    private <T> T onControlLoop(Callable<T> action, Duration timeout) {
        if (Thread.currentThread() == loopThread) {
            return callInline(action);
        }
        AtomicBoolean started = new AtomicBoolean();
        Future<T> future;
        try {
            future = controlLoop.submit(() -> {
                started.set(true);
                return action.call();
            });
        } catch (RejectedExecutionException e) {
            throw new IllegalStateException("Plugin manager is shut down", e);
        }
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (!started.get()) {
                future.cancel(false);
            }
            throw new IllegalStateException("Interrupted waiting for plugin operation", e);
        } catch (TimeoutException e) {
            // a started task keeps running so stops stay graceful; one still queued is dropped
            if (!started.get() && future.cancel(false)) {
                throw new IllegalStateException("Plugin operation not started within " + timeout.toMillis() + "ms",
                        e);
            }
            throw new OperationInProgressException("still in progress after " + timeout.toMillis() + "ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new IllegalStateException(cause);
        }
    }

    private static <T> T callInline(Callable<T> action) {
        try {
            return action.call();
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }

    private static final class OperationInProgressException extends RuntimeException {
        private static final long serialVersionUID = 1L;

        private OperationInProgressException(String message) {
            super(message);
        }
    }

    private void onControlLoopAsync(Runnable action) {
        if (Thread.currentThread() == loopThread) {
            action.run();
            return;
        }
        try {
            controlLoop.execute(action);
        } catch (RejectedExecutionException e) {
            log.debug("[Plugins] Control loop is shut down, dropping update");
        }
    }
}
