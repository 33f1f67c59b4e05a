package me.rosey.bot.domain.service;

import me.rosey.bot.domain.model.RestartPolicy;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class CrashRecoveryPolicyTest {

    private final CrashRecoveryPolicy policy = new CrashRecoveryPolicy(3, Duration.ofSeconds(1),
            Duration.ofSeconds(60));

    @Test
    void decide_restartsWithExponentialBackoff() {
        CrashRecoveryPolicy.Decision first = policy.decide(1, RestartPolicy.ON_FAILURE, false, 1);
        CrashRecoveryPolicy.Decision second = policy.decide(2, RestartPolicy.ON_FAILURE, false, 1);

        assertEquals(CrashRecoveryPolicy.Action.RESTART, first.action());
        assertEquals(Duration.ofSeconds(2), first.delay());
        assertEquals(Duration.ofSeconds(4), second.delay());
    }

    @Test
    void decide_disablesAtThreshold() {
        CrashRecoveryPolicy.Decision decision = policy.decide(3, RestartPolicy.ALWAYS, false, 1);

        assertEquals(CrashRecoveryPolicy.Action.DISABLE, decision.action());
        assertEquals("crashed 3 times (threshold 3)", decision.reason());
    }

    @Test
    void decide_onFailureSkipsCleanExit() {
        assertEquals(CrashRecoveryPolicy.Action.NONE,
                policy.decide(1, RestartPolicy.ON_FAILURE, false, 0).action());
        assertEquals(CrashRecoveryPolicy.Action.RESTART,
                policy.decide(1, RestartPolicy.ON_FAILURE, false, null).action());
    }

    @Test
    void decide_unlessStoppedHonorsOperatorStop() {
        assertEquals(CrashRecoveryPolicy.Action.NONE,
                policy.decide(1, RestartPolicy.UNLESS_STOPPED, true, 1).action());
        assertEquals(CrashRecoveryPolicy.Action.RESTART,
                policy.decide(1, RestartPolicy.UNLESS_STOPPED, false, 0).action());
    }

    @Test
    void decide_neverRestarts() {
        assertEquals(CrashRecoveryPolicy.Action.NONE, policy.decide(1, RestartPolicy.NEVER, false, 1).action());
    }

    @Test
    void backoff_isCappedAtMaximum() {
        assertEquals(Duration.ofSeconds(1), policy.backoff(0));
        assertEquals(Duration.ofSeconds(32), policy.backoff(5));
        assertEquals(Duration.ofSeconds(60), policy.backoff(6));
        assertEquals(Duration.ofSeconds(60), policy.backoff(500));
    }

    @Test
    void backoff_zeroBaseRestartsImmediately() {
        CrashRecoveryPolicy immediate = new CrashRecoveryPolicy(3, Duration.ZERO, Duration.ofSeconds(60));

        assertEquals(Duration.ZERO, immediate.backoff(2));
    }

    @Test
    void constructor_rejectsThresholdBelowOne() {
        assertThrows(IllegalArgumentException.class,
                () -> new CrashRecoveryPolicy(0, Duration.ofSeconds(1), Duration.ofSeconds(60)));
    }
}
