package me.rosey.bot.domain.model;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CapabilityTest {

    @Test
    void fromKey_acceptsManifestSpellings() {
        assertEquals(Optional.of(Capability.FILESYSTEM_READ), Capability.fromKey("filesystem-read"));
        assertEquals(Optional.of(Capability.FILESYSTEM_READ), Capability.fromKey("filesystem.read"));
        assertEquals(Optional.of(Capability.FILESYSTEM_READ), Capability.fromKey("FILESYSTEM_READ"));
        assertTrue(Capability.fromKey("teleport").isEmpty());
        assertTrue(Capability.fromKey(" ").isEmpty());
    }

    @Test
    void profiles_growMonotonically() {
        assertTrue(CapabilityProfile.STANDARD.getCapabilities()
                .containsAll(CapabilityProfile.MINIMAL.getCapabilities()));
        assertTrue(CapabilityProfile.EXTENDED.getCapabilities()
                .containsAll(CapabilityProfile.STANDARD.getCapabilities()));
        assertEquals(Capability.values().length, CapabilityProfile.ADMIN.getCapabilities().size());
    }

    @Test
    void restartPolicy_parsesKeys() {
        assertEquals(Optional.of(RestartPolicy.UNLESS_STOPPED), RestartPolicy.fromKey("unless_stopped"));
        assertEquals(Optional.of(RestartPolicy.ON_FAILURE), RestartPolicy.fromKey("On-Failure"));
        assertTrue(RestartPolicy.fromKey("sometimes").isEmpty());
    }
}
