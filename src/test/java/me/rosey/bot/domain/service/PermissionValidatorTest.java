package me.rosey.bot.domain.service;

import me.rosey.bot.domain.model.Capability;
import me.rosey.bot.domain.model.PermissionDecision;
import me.rosey.bot.domain.model.PluginManifest;
import me.rosey.bot.domain.model.ResourceLimits;
import me.rosey.bot.domain.model.ResourceSnapshot;
import me.rosey.bot.domain.model.SubjectPermission;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PermissionValidatorTest {

    private static final String ECHO = "echo";
    private static final String MESSAGE_SUBJECT = "rosey.events.message";

    private static PluginManifest manifest(String name, List<SubjectPermission> permissions,
            Set<Capability> capabilities, ResourceLimits limits) {
        return PluginManifest.builder()
                .name(name)
                .displayName(name)
                .version("1.0.0")
                .entryPoint("./run.sh")
                .permissions(permissions)
                .capabilities(capabilities)
                .limits(limits)
                .build();
    }

    @Test
    void validateSubscribe_deniesUndeclaredSubjectWithRequiredDeclaration() {
        PermissionValidator validator = PermissionValidator
                .forManifest(manifest(ECHO, List.of(), Set.of(), ResourceLimits.UNLIMITED));

        PermissionDecision decision = validator.validateSubscribe(MESSAGE_SUBJECT);

        assertFalse(decision.allowed());
        assertEquals("{pattern: \"rosey.events.message\", subscribe: true}", decision.requiredDeclaration());
        assertTrue(decision.reason().contains("echo"));
        assertTrue(decision.reason().contains(decision.requiredDeclaration()));
    }

    @Test
    void validateSubscribe_allowsPatternCoveredByGrant() {
        PermissionValidator validator = PermissionValidator.forManifest(manifest(ECHO,
                List.of(SubjectPermission.subscribeOnly("rosey.events.>")), Set.of(), ResourceLimits.UNLIMITED));

        assertTrue(validator.validateSubscribe(MESSAGE_SUBJECT).allowed());
        assertTrue(validator.validateSubscribe("rosey.events.*").allowed());
        assertFalse(validator.validateSubscribe("rosey.>").allowed());
    }

    @Test
    void validateSubscribe_allowsImplicitCommandAndHealthSubjects() {
        PermissionValidator validator = PermissionValidator
                .forManifest(manifest(ECHO, List.of(), Set.of(), ResourceLimits.UNLIMITED));

        assertTrue(validator.validateSubscribe("rosey.commands.echo.execute").allowed());
        assertTrue(validator.validateSubscribe("rosey.plugins.echo.health").allowed());
        assertFalse(validator.validateSubscribe("rosey.commands.other.execute").allowed());
    }

    @Test
    void validateSubscribe_deniesMalformedPattern() {
        PermissionValidator validator = PermissionValidator.forManifest(manifest(ECHO,
                List.of(SubjectPermission.subscribeOnly("rosey.>")), Set.of(), ResourceLimits.UNLIMITED));

        PermissionDecision decision = validator.validateSubscribe("rosey..events");

        assertFalse(decision.allowed());
        assertNull(decision.requiredDeclaration());
    }

    @Test
    void validatePublish_respectsDirection() {
        PermissionValidator validator = PermissionValidator.forManifest(manifest(ECHO,
                List.of(SubjectPermission.subscribeOnly(MESSAGE_SUBJECT),
                        SubjectPermission.publishOnly("rosey.events.reply.*")),
                Set.of(), ResourceLimits.UNLIMITED));

        assertFalse(validator.validatePublish(MESSAGE_SUBJECT).allowed());
        assertTrue(validator.validatePublish("rosey.events.reply.discord").allowed());
        assertEquals("{pattern: \"rosey.events.message\", publish: true}",
                validator.validatePublish(MESSAGE_SUBJECT).requiredDeclaration());
    }

    @Test
    void validatePublish_allowsOwnNamespaceAndCommandOutcomes() {
        PermissionValidator validator = PermissionValidator
                .forManifest(manifest(ECHO, List.of(), Set.of(), ResourceLimits.UNLIMITED));

        assertTrue(validator.validatePublish("rosey.commands.echo.result").allowed());
        assertTrue(validator.validatePublish("rosey.commands.echo.error").allowed());
        assertTrue(validator.validatePublish("rosey.plugins.echo.plugin.ready").allowed());
        assertFalse(validator.validatePublish("rosey.plugins.other.plugin.ready").allowed());
    }

    @Test
    void validatePublish_deniesWildcardSubject() {
        PermissionValidator validator = PermissionValidator.forManifest(manifest(ECHO,
                List.of(SubjectPermission.publishOnly("rosey.events.>")), Set.of(), ResourceLimits.UNLIMITED));

        assertFalse(validator.validatePublish("rosey.events.*").allowed());
    }

    @Test
    void validateCapability_requiresDeclaration() {
        PermissionValidator validator = PermissionValidator.forManifest(manifest(ECHO, List.of(),
                Set.of(Capability.NETWORK_HTTP), ResourceLimits.UNLIMITED));

        assertTrue(validator.validateCapability(Capability.NETWORK_HTTP).allowed());
        PermissionDecision denied = validator.validateCapability(Capability.FILESYSTEM_WRITE);
        assertFalse(denied.allowed());
        assertEquals("filesystem-write", denied.requiredDeclaration());

        PermissionDeniedException exception = assertThrows(PermissionDeniedException.class, denied::orThrow);
        assertEquals("filesystem-write", exception.getRequiredDeclaration());
    }

    @Test
    void checkResourceLimits_reportsEveryExceededLimit() {
        ResourceLimits limits = ResourceLimits.builder()
                .maxCpuPercent(50)
                .maxMemoryMb(128)
                .maxUptimeSeconds(60)
                .build();
        PermissionValidator validator = PermissionValidator
                .forManifest(manifest(ECHO, List.of(), Set.of(), limits));

        List<String> violations = validator
                .checkResourceLimits(new ResourceSnapshot(42, 80.0, 256.0, 120, Instant.now()));

        assertEquals(List.of(
                "CPU 80.0% exceeds limit 50.0%",
                "Memory 256.0MB exceeds limit 128.0MB",
                "Uptime 120s exceeds limit 60s"), violations);
    }

    @Test
    void checkResourceLimits_ignoresZeroLimits() {
        PermissionValidator validator = PermissionValidator
                .forManifest(manifest(ECHO, List.of(), Set.of(), ResourceLimits.UNLIMITED));

        assertTrue(validator.checkResourceLimits(new ResourceSnapshot(42, 999, 99999, 99999, Instant.now()))
                .isEmpty());
        assertTrue(validator.checkResourceLimits(null).isEmpty());
    }
}
