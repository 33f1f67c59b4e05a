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

import me.rosey.bot.domain.model.ResourceSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Samples CPU and resident memory of a process tree. CPU is the CPU time
 * consumed between two samples divided by the wall time between them, summed
 * over the process and its descendants, so a shell wrapper around the real
 * plugin is accounted for.
 *
 * <p>
 * CPU time is tracked per pid. A process first seen in this sample is charged
 * its whole CPU time, since it started after the previous sample; a process
 * that exited since the previous sample drops out without affecting the rest.
 *
 * <p>
 * Memory is read from {@code /proc/<pid>/status} ({@code VmRSS}); where procfs
 * is unavailable memory is reported as 0.
 */
class ProcessResourceSampler {

    private static final Logger log = LoggerFactory.getLogger(ProcessResourceSampler.class);
    private static final Path PROC = Path.of("/proc");
    private static final double KB_PER_MB = 1024.0;

    private final ProcessHandle handle;
    private final Instant startedAt;
    private final Clock clock;

    private Map<Long, Duration> lastCpuByPid = Map.of();
    private Instant lastSampledAt;

    ProcessResourceSampler(ProcessHandle handle, Instant startedAt, Clock clock) {
        this.handle = handle;
        this.startedAt = startedAt;
        this.clock = clock;
        this.lastSampledAt = startedAt;
    }

    synchronized Optional<ResourceSnapshot> sample() {
        if (!handle.isAlive()) {
            return Optional.empty();
        }
        Instant now = clock.instant();
        List<ProcessHandle> tree = tree();

        Map<Long, Duration> cpuByPid = new HashMap<>();
        for (ProcessHandle process : tree) {
            process.info().totalCpuDuration().ifPresent(cpu -> cpuByPid.put(process.pid(), cpu));
        }
        long wallNanos = Duration.between(lastSampledAt, now).toNanos();
        long cpuNanos = cpuDeltaNanos(lastCpuByPid, cpuByPid);
        double cpuPercent = wallNanos > 0 ? cpuNanos * 100.0 / wallNanos : 0.0;
        lastCpuByPid = cpuByPid;
        lastSampledAt = now;

        double memoryMb = tree.stream()
                .mapToLong(p -> residentKb(p.pid()))
                .sum() / KB_PER_MB;
        long uptime = Math.max(0, Duration.between(startedAt, now).toSeconds());

        return Optional.of(new ResourceSnapshot(handle.pid(), cpuPercent, memoryMb, uptime, now));
    }

    /**
     * CPU time consumed between two per-pid readings. A pid reused by a new
     * process reads lower than before and is charged its current total.
     */
    static long cpuDeltaNanos(Map<Long, Duration> previous, Map<Long, Duration> current) {
        long total = 0;
        for (Map.Entry<Long, Duration> entry : current.entrySet()) {
            Duration before = previous.getOrDefault(entry.getKey(), Duration.ZERO);
            Duration delta = entry.getValue().compareTo(before) >= 0
                    ? entry.getValue().minus(before)
                    : entry.getValue();
            total += delta.toNanos();
        }
        return total;
    }

    private List<ProcessHandle> tree() {
        return Stream.concat(Stream.of(handle), handle.descendants())
                .filter(ProcessHandle::isAlive)
                .toList();
    }

    static long residentKb(long pid) {
        Path status = PROC.resolve(Long.toString(pid)).resolve("status");
        if (!Files.isReadable(status)) {
            return 0;
        }
        try {
            for (String line : Files.readAllLines(status, StandardCharsets.UTF_8)) {
                if (line.startsWith("VmRSS:")) {
                    return parseKb(line.substring("VmRSS:".length()));
                }
            }
        } catch (IOException e) {
            log.debug("Cannot read {}: {}", status, e.getMessage());
        }
        return 0;
    }

    static long parseKb(String value) {
        String digits = value.trim().split("\\s+")[0];
        try {
            return Long.parseLong(digits);
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
