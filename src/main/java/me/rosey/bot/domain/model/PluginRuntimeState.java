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

import lombok.Data;
import me.rosey.bot.domain.component.PluginProcess;
import me.rosey.bot.domain.service.PermissionValidator;

import java.time.Duration;
import java.time.Instant;
import java.util.Set;
import java.util.concurrent.ScheduledFuture;

/**
 * Mutable per-plugin runtime record. Owned by the plugin manager's control
 * loop; nothing else mutates it.
 */
@Data
public class PluginRuntimeState {

    private final PluginManifest manifest;
    private final PermissionValidator permissions;

    private PluginState state = PluginState.STOPPED;
    private boolean enabled = true;
    private boolean operatorStopped;

    private PluginProcess process;
    private Instant startedAt;
    private Instant stoppedAt;
    private Instant lastHealthCheck;
    private ResourceSnapshot lastSnapshot;
    private Integer lastExitCode;

    private int crashCount;
    private long restartCount;
    private int consecutiveViolations;
    private long commandSuccesses;
    private long commandErrors;
    private long permissionDenials;

    private Set<String> dependents = Set.of();

    private ScheduledFuture<?> pendingRecovery;

    public PluginRuntimeState(PluginManifest manifest) {
        this.manifest = manifest;
        this.permissions = PermissionValidator.forManifest(manifest);
    }

    public String getName() {
        return manifest.getName();
    }

    /**
     * Lifetime command error rate, 0 when nothing was executed.
     */
    public double errorRate() {
        long total = commandSuccesses + commandErrors;
        return total == 0 ? 0.0 : (double) commandErrors / total;
    }

    public Duration uptime(Instant now) {
        if (!state.isActive() || startedAt == null) {
            return Duration.ZERO;
        }
        return Duration.between(startedAt, now);
    }

    public void cancelPendingRecovery() {
        if (pendingRecovery != null) {
            pendingRecovery.cancel(false);
            pendingRecovery = null;
        }
    }
}
