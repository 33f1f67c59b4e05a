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

import me.rosey.bot.domain.model.RestartPolicy;

import java.time.Duration;

/**
 * Decides what happens after a plugin crash: disable it, restart it after an
 * exponential backoff, or leave it crashed.
 */
public final class CrashRecoveryPolicy {

    private static final int MAX_BACKOFF_EXPONENT = 30;

    private final int disableThreshold;
    private final Duration backoffBase;
    private final Duration maxBackoff;

    public CrashRecoveryPolicy(int disableThreshold, Duration backoffBase, Duration maxBackoff) {
        if (disableThreshold < 1) {
            throw new IllegalArgumentException("disableThreshold must be at least 1");
        }
        this.disableThreshold = disableThreshold;
        this.backoffBase = backoffBase;
        this.maxBackoff = maxBackoff;
    }

    /**
     * @param crashCount
     *            crash count including the crash being handled
     * @param policy
     *            manifest restart policy
     * @param operatorStopped
     *            whether an operator stopped the plugin since its last
     *            operator start
     * @param exitCode
     *            process exit code, {@code null} when unknown
     */
    public Decision decide(int crashCount, RestartPolicy policy, boolean operatorStopped, Integer exitCode) {
        if (crashCount >= disableThreshold) {
            return new Decision(Action.DISABLE, Duration.ZERO,
                    "crashed " + crashCount + " times (threshold " + disableThreshold + ")");
        }
        boolean restart = switch (policy) {
        case ALWAYS -> true;
        case UNLESS_STOPPED -> !operatorStopped;
        case ON_FAILURE -> exitCode == null || exitCode != 0;
        case NEVER -> false;
        };
        if (!restart) {
            return new Decision(Action.NONE, Duration.ZERO,
                    "restart policy " + policy.key() + " does not restart"
                            + (exitCode != null ? " after exit code " + exitCode : ""));
        }
        Duration delay = backoff(crashCount);
        return new Decision(Action.RESTART, delay, "restart in " + delay.toMillis() + "ms");
    }

    /**
     * {@code min(2^crashCount * base, max)}.
     */
    public Duration backoff(int crashCount) {
        int exponent = Math.max(0, Math.min(crashCount, MAX_BACKOFF_EXPONENT));
        long multiplier = 1L << exponent;
        long baseMillis = backoffBase.toMillis();
        long maxMillis = maxBackoff.toMillis();
        if (baseMillis > 0 && multiplier > maxMillis / baseMillis) {
            return maxBackoff;
        }
        return Duration.ofMillis(Math.min(baseMillis * multiplier, maxMillis));
    }

    public int getDisableThreshold() {
        return disableThreshold;
    }

    public enum Action {
        RESTART,
        DISABLE,
        NONE
    }

    public record Decision(Action action, Duration delay, String reason) {
    }
}
