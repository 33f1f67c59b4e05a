package me.rosey.bot.domain.component;

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

import me.rosey.bot.domain.model.ResourceSnapshot;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Supervision unit for one plugin OS process. A unit is started at most once;
 * a restart creates a new unit.
 */
public interface PluginProcess {

    String getPluginName();

    /**
     * Spawn the process. Never retries.
     *
     * @throws ProcessStartException
     *             if the process cannot be spawned or exits immediately
     */
    void start();

    /**
     * Request graceful termination, wait up to {@code gracePeriod}, then kill.
     * Returns once the process is gone. Safe to call on a stopped unit.
     */
    void stop(Duration gracePeriod);

    /**
     * Non-blocking liveness check.
     */
    boolean isRunning();

    /**
     * OS process id, empty before start.
     */
    Optional<Long> pid();

    /**
     * Exit code once the process has exited.
     */
    OptionalInt exitCode();

    /**
     * Sample CPU (since the previous sample), resident memory and uptime.
     * Empty when the process is not running.
     */
    Optional<ResourceSnapshot> sampleResources();

    Instant getStartedAt();
}
