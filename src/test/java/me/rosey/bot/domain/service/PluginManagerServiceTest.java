package me.rosey.bot.domain.service;

import me.rosey.bot.adapter.outbound.bus.LocalMessageBusAdapter;
import me.rosey.bot.domain.component.PluginProcess;
import me.rosey.bot.domain.component.ProcessStartException;
import me.rosey.bot.domain.model.BusMessage;
import me.rosey.bot.domain.model.PluginLifecycleEvent;
import me.rosey.bot.domain.model.PluginManifest;
import me.rosey.bot.domain.model.PluginOperationResult;
import me.rosey.bot.domain.model.PluginState;
import me.rosey.bot.domain.model.PluginStatus;
import me.rosey.bot.domain.model.ResourceLimits;
import me.rosey.bot.domain.model.ResourceSnapshot;
import me.rosey.bot.domain.model.RestartPolicy;
import me.rosey.bot.domain.model.Subjects;
import me.rosey.bot.infrastructure.config.BotProperties;
import me.rosey.bot.infrastructure.event.SpringEventBus;
import me.rosey.bot.port.outbound.PluginProcessPort;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class PluginManagerServiceTest {

    private static final Instant START = Instant.parse("2026-01-01T00:00:00Z");

    private MutableClock clock;
    private FakeProcessPort processPort;
    private LocalMessageBusAdapter bus;
    private SpringEventBus eventBus;
    private BotProperties properties;
    private PluginManagerService manager;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        processPort = new FakeProcessPort();
        bus = new LocalMessageBusAdapter();
        eventBus = mock(SpringEventBus.class);
        properties = new BotProperties();
        properties.getPlugins().setBackoffBase(Duration.ZERO);
        properties.getPlugins().setMaxBackoff(Duration.ZERO);
        properties.getPlugins().setOperationTimeout(Duration.ofSeconds(10));
        manager = new PluginManagerService(processPort, bus, eventBus, properties, clock);
    }

    @AfterEach
    void tearDown() {
        manager.shutdown();
    }

    private static PluginManifest plugin(String name, String... dependencies) {
        return PluginManifest.builder()
                .name(name)
                .displayName(name)
                .version("1.0.0")
                .entryPoint("./run")
                .dependencies(List.of(dependencies))
                .build();
    }

    private PluginState state(String name) {
        return manager.getState(name).orElseThrow();
    }

    @Test
    void startAll_startsInDependencyOrderAndStopAllReverses() {
        manager.registerAll(List.of(plugin("c", "b"), plugin("a"), plugin("b", "a")));

        PluginOperationResult started = manager.startAll();
        PluginOperationResult stopped = manager.stopAll();

        assertEquals(List.of("a", "b", "c"), started.getData());
        assertEquals(List.of("a", "b", "c"), processPort.startOrder);
        assertEquals(List.of("c", "b", "a"), stopped.getData());
        assertEquals(List.of("c", "b", "a"), processPort.stopOrder);
        assertEquals(PluginState.STOPPED, state("a"));
    }

    @Test
    void startAll_publishesStartEventsOnBus() {
        List<BusMessage> events = new CopyOnWriteArrayList<>();
        bus.subscribe(Subjects.event(Subjects.EVENT_PLUGIN_START), events::add);
        manager.registerAll(List.of(plugin("a")));

        manager.startAll();

        assertEquals(1, events.size());
        assertEquals("a", events.get(0).data().get("plugin"));
        assertEquals("RUNNING", events.get(0).data().get("state"));
    }

    @Test
    void stop_stopsRunningDependentsFirst() {
        manager.registerAll(List.of(plugin("a"), plugin("b", "a")));
        manager.startAll();

        PluginOperationResult result = manager.stop("a");

        assertTrue(result.isSuccess());
        assertEquals(List.of("b", "a"), processPort.stopOrder);
        assertEquals(PluginState.STOPPED, state("b"));
        assertEquals(PluginState.STOPPED, state("a"));
    }

    @Test
    void stopPlugin_refusesWhileDependentsRunWithoutCascade() {
        manager.registerAll(List.of(plugin("a"), plugin("b", "a")));
        manager.startAll();

        PluginOperationResult result = manager.stopPlugin("a", false);

        assertFalse(result.isSuccess());
        assertTrue(result.getMessage().contains("running dependents: b"));
        assertEquals(PluginState.RUNNING, state("a"));
    }

    @Test
    void stop_failsWhenNotRunning() {
        manager.registerAll(List.of(plugin("a")));

        PluginOperationResult result = manager.stop("a");

        assertFalse(result.isSuccess());
        assertTrue(result.getMessage().contains("not running"));
    }

    @Test
    void start_refusesWhenDependencyIsNotRunning() {
        manager.registerAll(List.of(plugin("a"), plugin("b", "a")));

        PluginOperationResult result = manager.start("b");

        assertFalse(result.isSuccess());
        assertTrue(result.getMessage().contains("dependency 'a' is not running"));
        assertTrue(processPort.startOrder.isEmpty());
    }

    @Test
    void startAll_disablesPluginsOnDependencyCycle() {
        manager.registerAll(List.of(plugin("a", "b"), plugin("b", "a"), plugin("c")));

        PluginOperationResult result = manager.startAll();

        assertEquals(List.of("c"), result.getData());
        assertEquals(PluginState.DISABLED, state("a"));
        assertEquals(PluginState.DISABLED, state("b"));
        assertEquals(List.of("c"), processPort.startOrder);
    }

    @Test
    void startAll_skipsPluginWithMissingDependency() {
        manager.registerAll(List.of(plugin("weather", "http_cache")));

        PluginOperationResult result = manager.startAll();

        assertEquals(List.of(), result.getData());
        assertEquals(PluginState.STOPPED, state("weather"));
    }

    @Test
    void startAll_skipsPluginsWithAutoStartOff() {
        manager.registerAll(List.of(plugin("a").toBuilder().autoStart(false).build()));

        manager.startAll();

        assertEquals(PluginState.STOPPED, state("a"));
        assertTrue(manager.start("a").isSuccess());
    }

    @Test
    void crashes_restartUntilThresholdThenDisable() {
        manager.registerAll(List.of(plugin("a")));
        manager.startAll();

        for (int crash = 1; crash <= 2; crash++) {
            processPort.latest("a").crash(1);
            manager.healthCheckPlugin("a");
            assertEquals(PluginState.RUNNING, state("a"), "recovered after crash " + crash);
        }
        processPort.latest("a").crash(1);
        manager.healthCheckPlugin("a");

        assertEquals(PluginState.DISABLED, state("a"));
        PluginStatus status = (PluginStatus) manager.status("a").getData();
        assertEquals(3, status.getCrashCount());
        assertEquals(2, status.getRestartCount());
        assertFalse(status.isEnabled());

        int spawned = processPort.created.size();
        PluginOperationResult fourth = manager.start("a");
        assertFalse(fourth.isSuccess());
        assertEquals(spawned, processPort.created.size());
        assertEquals(PluginState.DISABLED, state("a"));
    }

    @Test
    void restart_refusesPluginDisabledByCrashes() {
        manager.registerAll(List.of(plugin("a")));
        manager.startAll();
        for (int crash = 0; crash < 3; crash++) {
            processPort.latest("a").crash(1);
            manager.healthCheckPlugin("a");
            manager.getState("a");
        }
        assertEquals(PluginState.DISABLED, state("a"));
        int spawned = processPort.created.size();

        PluginOperationResult result = manager.restart("a");

        assertFalse(result.isSuccess());
        assertTrue(result.getMessage().contains("enable it first"));
        assertEquals(PluginState.DISABLED, state("a"));
        assertEquals(spawned, processPort.created.size());
    }

    @Test
    void restart_refusesRunningPluginDisabledByOperator() {
        manager.registerAll(List.of(plugin("a")));
        manager.startAll();
        manager.disable("a");

        PluginOperationResult result = manager.restart("a");

        assertFalse(result.isSuccess());
        assertEquals(PluginState.RUNNING, state("a"));
        assertEquals(1, processPort.created.size());
    }

    @Test
    void crash_publishesErrorEvent() {
        List<BusMessage> errors = new CopyOnWriteArrayList<>();
        bus.subscribe(Subjects.event(Subjects.EVENT_PLUGIN_ERROR), errors::add);
        manager.registerAll(List.of(plugin("a")));
        manager.startAll();

        processPort.latest("a").crash(7);
        manager.healthCheckPlugin("a");
        manager.getState("a");

        assertEquals(1, errors.size());
        assertEquals(7, errors.get(0).data().get("exit_code"));
        assertEquals(1, errors.get(0).data().get("crash_count"));
    }

    @Test
    void crash_withNeverPolicyStaysCrashed() {
        manager.registerAll(List.of(plugin("a").toBuilder().restartPolicy(RestartPolicy.NEVER).build()));
        manager.startAll();

        processPort.latest("a").crash(1);
        manager.healthCheckPlugin("a");

        assertEquals(PluginState.CRASHED, state("a"));
        assertEquals(1, processPort.created.size());
    }

    @Test
    void enable_clearsCrashCountAndAllowsStart() {
        manager.registerAll(List.of(plugin("a")));
        manager.startAll();
        for (int crash = 0; crash < 3; crash++) {
            processPort.latest("a").crash(1);
            manager.healthCheckPlugin("a");
            manager.getState("a");
        }
        assertEquals(PluginState.DISABLED, state("a"));

        assertTrue(manager.enable("a").isSuccess());
        assertEquals(PluginState.STOPPED, state("a"));
        assertTrue(manager.start("a").isSuccess());

        PluginStatus status = (PluginStatus) manager.status("a").getData();
        assertEquals(0, status.getCrashCount());
        assertEquals(PluginState.RUNNING, status.getState());
    }

    @Test
    void disable_preventsStartUntilEnabled() {
        manager.registerAll(List.of(plugin("a")));

        manager.disable("a");

        assertEquals(PluginState.DISABLED, state("a"));
        assertFalse(manager.start("a").isSuccess());
        assertTrue(manager.startPlugin("a", true).isSuccess());
    }

    @Test
    void healthCheck_restartsAfterSecondConsecutiveLimitViolation() {
        PluginManifest limited = plugin("a").toBuilder()
                .limits(ResourceLimits.builder().maxCpuPercent(50).build())
                .build();
        manager.registerAll(List.of(limited));
        manager.startAll();
        processPort.cpuPercent = 80;

        PluginOperationResult first = manager.healthCheckPlugin("a");
        assertFalse(first.isSuccess());
        assertEquals(PluginState.UNHEALTHY, state("a"));
        assertEquals(1, processPort.created.size());

        PluginOperationResult second = manager.healthCheckPlugin("a");
        assertFalse(second.isSuccess());
        assertTrue(second.getMessage().startsWith("Restarted for limit violations"));
        assertEquals(2, processPort.created.size());
        assertEquals(PluginState.RUNNING, state("a"));

        PluginStatus status = (PluginStatus) manager.status("a").getData();
        assertEquals(0, status.getCrashCount());
        assertEquals(1, status.getRestartCount());
    }

    @Test
    void healthCheck_restartsImmediatelyOnSimultaneousViolations() {
        PluginManifest limited = plugin("a").toBuilder()
                .limits(ResourceLimits.builder().maxCpuPercent(50).maxMemoryMb(100).build())
                .build();
        manager.registerAll(List.of(limited));
        manager.startAll();
        processPort.cpuPercent = 80;
        processPort.memoryMb = 150;

        PluginOperationResult result = manager.healthCheckPlugin("a");

        assertFalse(result.isSuccess());
        assertTrue(result.getMessage().startsWith("Restarted for limit violations"));
        assertEquals(2, processPort.created.size());
        assertEquals(PluginState.RUNNING, state("a"));
        PluginStatus status = (PluginStatus) manager.status("a").getData();
        assertEquals(0, status.getCrashCount());
        assertEquals(1, status.getRestartCount());
    }

    @Test
    void stopAll_waitsOneGracePeriodPerPlugin() {
        properties.getPlugins().setOperationTimeout(Duration.ofMillis(500));
        properties.getPlugins().setStopGracePeriod(Duration.ofSeconds(1));
        manager.registerAll(List.of(plugin("a"), plugin("b"), plugin("c"), plugin("d")));
        manager.startAll();
        processPort.stopDelayMillis = 300;

        PluginOperationResult result = manager.stopAll();

        assertTrue(result.isSuccess(), result.getMessage());
        assertEquals(List.of("a", "b", "c", "d"), new ArrayList<>(processPort.stopOrder).stream().sorted().toList());
        assertFalse(processPort.interruptedDuringStop);
    }

    @Test
    void stopAll_overrunningBoundReportsInProgressWithoutInterrupting() {
        properties.getPlugins().setOperationTimeout(Duration.ofMillis(200));
        properties.getPlugins().setStopGracePeriod(Duration.ZERO);
        manager.registerAll(List.of(plugin("a")));
        manager.startAll();
        processPort.stopDelayMillis = 600;

        PluginOperationResult result = manager.stopAll();

        assertFalse(result.isSuccess());
        assertEquals("Operation still in progress after 200ms", result.getMessage());
        properties.getPlugins().setOperationTimeout(Duration.ofSeconds(10));
        assertEquals(PluginState.STOPPED, state("a"));
        assertFalse(processPort.interruptedDuringStop);
    }

    @Test
    void healthCheck_recoversUnhealthyPluginWhenBackWithinLimits() {
        PluginManifest limited = plugin("a").toBuilder()
                .limits(ResourceLimits.builder().maxMemoryMb(100).build())
                .build();
        manager.registerAll(List.of(limited));
        manager.startAll();

        processPort.memoryMb = 150;
        manager.healthCheckPlugin("a");
        assertEquals(PluginState.UNHEALTHY, state("a"));

        processPort.memoryMb = 50;
        assertTrue(manager.healthCheckPlugin("a").isSuccess());
        assertEquals(PluginState.RUNNING, state("a"));

        ArgumentCaptor<Object> events = ArgumentCaptor.forClass(Object.class);
        verify(eventBus, atLeastOnce()).publish(events.capture());
        assertTrue(events.getAllValues().stream()
                .anyMatch(event -> event instanceof PluginLifecycleEvent lifecycle
                        && lifecycle.type() == PluginLifecycleEvent.Type.RECOVERED));
    }

    @Test
    void healthCheck_marksUnhealthyOnHighCommandErrorRate() {
        manager.registerAll(List.of(plugin("a")));
        manager.startAll();
        manager.startMonitoring();

        bus.publish(Subjects.commandError("a"), Map.of("error", "boom"));
        bus.publish(Subjects.commandError("a"), Map.of("error", "boom"));
        bus.publish(Subjects.commandResult("a"), Map.of("ok", true));

        assertFalse(manager.healthCheckPlugin("a").isSuccess());
        assertEquals(PluginState.UNHEALTHY, state("a"));
    }

    @Test
    void healthCheck_clearsCrashCountAfterStablePeriod() {
        manager.registerAll(List.of(plugin("a")));
        manager.startAll();
        processPort.latest("a").crash(1);
        manager.healthCheckPlugin("a");
        assertEquals(PluginState.RUNNING, state("a"));

        clock.advance(Duration.ofMinutes(6));
        manager.healthCheckPlugin("a");

        assertEquals(0, ((PluginStatus) manager.status("a").getData()).getCrashCount());
    }

    @Test
    void permissionDenials_areCountedFromBusReports() {
        manager.registerAll(List.of(plugin("a")));
        manager.startMonitoring();

        bus.publish(Subjects.pluginEvent("a", Subjects.EVENT_PERMISSION_DENIED), Map.of("subject", "x.y"));

        assertEquals(1, ((PluginStatus) manager.status("a").getData()).getPermissionDenials());
    }

    @Test
    void install_startsNewPluginWithoutRestartingOthers() {
        manager.registerAll(List.of(plugin("a"), plugin("b", "a")));
        manager.startAll();
        Instant startedA = ((PluginStatus) manager.status("a").getData()).getStartedAt();
        Instant startedB = ((PluginStatus) manager.status("b").getData()).getStartedAt();
        clock.advance(Duration.ofSeconds(30));

        PluginOperationResult result = manager.install(plugin("c", "b"));

        assertTrue(result.isSuccess());
        assertEquals(PluginState.RUNNING, state("c"));
        assertEquals(startedA, ((PluginStatus) manager.status("a").getData()).getStartedAt());
        assertEquals(startedB, ((PluginStatus) manager.status("b").getData()).getStartedAt());
        assertEquals(List.of("a", "b", "c"), processPort.startOrder);
    }

    @Test
    void install_rejectsDuplicateAndCycle() {
        manager.registerAll(List.of(plugin("a", "c"), plugin("b", "a")));

        assertFalse(manager.install(plugin("a")).isSuccess());
        PluginOperationResult cyclic = manager.install(plugin("c", "b"));

        assertFalse(cyclic.isSuccess());
        assertTrue(cyclic.getMessage().contains("dependency cycle"));
        assertTrue(manager.getState("c").isEmpty());
    }

    @Test
    void uninstall_stopsDependentsAndRemovesPlugin() {
        manager.registerAll(List.of(plugin("a"), plugin("b", "a")));
        manager.startAll();

        assertTrue(manager.uninstall("a").isSuccess());

        assertTrue(manager.getState("a").isEmpty());
        assertEquals(PluginState.STOPPED, state("b"));
        assertEquals(List.of("b", "a"), processPort.stopOrder);
    }

    @Test
    void start_failureLeavesPluginStopped() {
        manager.registerAll(List.of(plugin("a")));
        processPort.failNextStart = true;

        PluginOperationResult result = manager.start("a");

        assertFalse(result.isSuccess());
        assertTrue(result.getMessage().contains("exited immediately"));
        assertEquals(PluginState.STOPPED, state("a"));
    }

    @Test
    void restart_keepsDependentsRunning() {
        manager.registerAll(List.of(plugin("a"), plugin("b", "a")));
        manager.startAll();

        assertTrue(manager.restart("a").isSuccess());

        assertEquals(PluginState.RUNNING, state("a"));
        assertEquals(PluginState.RUNNING, state("b"));
        assertEquals(List.of("a"), processPort.stopOrder);
    }

    @Test
    void list_andStatistics_reportEveryPlugin() {
        manager.registerAll(List.of(plugin("b"), plugin("a")));
        manager.start("a");

        List<PluginStatus> plugins = manager.list();
        Map<PluginState, Long> counts = manager.statistics();

        assertEquals(List.of("a", "b"), plugins.stream().map(PluginStatus::getName).toList());
        assertEquals(42L, plugins.get(0).getPid());
        assertEquals(1L, counts.get(PluginState.RUNNING));
        assertEquals(1L, counts.get(PluginState.STOPPED));
        assertEquals(0L, counts.get(PluginState.CRASHED));
        assertEquals(Set.of(PluginState.values()), counts.keySet());
    }

    @Test
    void operations_onUnknownPluginFail() {
        assertFalse(manager.start("ghost").isSuccess());
        assertFalse(manager.stop("ghost").isSuccess());
        assertFalse(manager.status("ghost").isSuccess());
        assertFalse(manager.enable("ghost").isSuccess());
        assertFalse(manager.uninstall("ghost").isSuccess());
    }

    private static final class MutableClock extends Clock {
        private Instant now;

        private MutableClock(Instant now) {
            this.now = now;
        }

        private synchronized void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public synchronized Instant instant() {
            return now;
        }
    }

    private final class FakeProcessPort implements PluginProcessPort {
        private final List<FakeProcess> created = new CopyOnWriteArrayList<>();
        private final List<String> startOrder = Collections.synchronizedList(new ArrayList<>());
        private final List<String> stopOrder = Collections.synchronizedList(new ArrayList<>());
        private final Map<String, FakeProcess> latest = new HashMap<>();
        private volatile double cpuPercent;
        private volatile double memoryMb;
        private volatile boolean failNextStart;
        private volatile long stopDelayMillis;
        private volatile boolean interruptedDuringStop;

        @Override
        public synchronized PluginProcess create(PluginManifest manifest) {
            FakeProcess process = new FakeProcess(manifest.getName(), this);
            created.add(process);
            latest.put(manifest.getName(), process);
            return process;
        }

        private synchronized FakeProcess latest(String name) {
            return latest.get(name);
        }
    }

    private final class FakeProcess implements PluginProcess {
        private final String name;
        private final FakeProcessPort port;
        private volatile boolean running;
        private volatile Integer exitCode;
        private volatile Instant startedAt;

        private FakeProcess(String name, FakeProcessPort port) {
            this.name = name;
            this.port = port;
        }

        private void crash(int code) {
            running = false;
            exitCode = code;
        }

        @Override
        public String getPluginName() {
            return name;
        }

        @Override
        public void start() {
            if (port.failNextStart) {
                port.failNextStart = false;
                throw new ProcessStartException(name, "Plugin '" + name + "' exited immediately with code 1");
            }
            running = true;
            startedAt = clock.instant();
            port.startOrder.add(name);
        }

        @Override
        public void stop(Duration gracePeriod) {
            if (running) {
                if (port.stopDelayMillis > 0) {
                    try {
                        Thread.sleep(port.stopDelayMillis);
                    } catch (InterruptedException e) {
                        port.interruptedDuringStop = true;
                        Thread.currentThread().interrupt();
                    }
                }
                running = false;
                exitCode = 0;
                port.stopOrder.add(name);
            }
        }

        @Override
        public boolean isRunning() {
            return running;
        }

        @Override
        public Optional<Long> pid() {
            return startedAt != null ? Optional.of(42L) : Optional.empty();
        }

        @Override
        public OptionalInt exitCode() {
            return exitCode != null ? OptionalInt.of(exitCode) : OptionalInt.empty();
        }

        @Override
        public Optional<ResourceSnapshot> sampleResources() {
            if (!running) {
                return Optional.empty();
            }
            return Optional.of(new ResourceSnapshot(42, port.cpuPercent, port.memoryMb,
                    Duration.between(startedAt, clock.instant()).toSeconds(), clock.instant()));
        }

        @Override
        public Instant getStartedAt() {
            return startedAt;
        }
    }
}
