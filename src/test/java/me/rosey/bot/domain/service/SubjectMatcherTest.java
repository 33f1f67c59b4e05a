package me.rosey.bot.domain.service;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SubjectMatcherTest {

    @ParameterizedTest
    @CsvSource({
            "rosey.events.message, rosey.events.message, true",
            "rosey.events.*, rosey.events.message, true",
            "rosey.events.*, rosey.events.message.created, false",
            "rosey.events.>, rosey.events.message, true",
            "rosey.events.>, rosey.events.message.created, true",
            "rosey.events.>, rosey.events, false",
            "rosey.*.message, rosey.events.message, true",
            "rosey.events.message, rosey.events.Message, false",
            "rosey.events, rosey.events.message, false"
    })
    void matches_followsTokenWildcards(String pattern, String subject, boolean expected) {
        assertEquals(expected, SubjectMatcher.matches(pattern, subject));
    }

    @Test
    void matches_rejectsNullAndEmpty() {
        assertFalse(SubjectMatcher.matches(null, "a.b"));
        assertFalse(SubjectMatcher.matches("a.b", null));
        assertFalse(SubjectMatcher.matches("", ""));
    }

    @ParameterizedTest
    @CsvSource({
            "rosey.events.>, rosey.events.*, true",
            "rosey.events.>, rosey.events.>, true",
            "rosey.events.>, rosey.events.message.>, true",
            "rosey.events.*, rosey.events.*, true",
            "rosey.events.*, rosey.events.>, false",
            "rosey.events.message, rosey.events.*, false",
            "rosey.events.*, rosey.events.message, true",
            "rosey.events.>, rosey.>, false"
    })
    void covers_requiresEveryRequestedSubjectToBeGranted(String granted, String requested, boolean expected) {
        assertEquals(expected, SubjectMatcher.covers(granted, requested));
    }

    @Test
    void isValidPattern_acceptsWholeTokenWildcards() {
        assertTrue(SubjectMatcher.isValidPattern("rosey.events.*"));
        assertTrue(SubjectMatcher.isValidPattern("rosey.>"));
        assertTrue(SubjectMatcher.isValidPattern("rosey.*.result"));
    }

    @Test
    void isValidPattern_rejectsMalformedPatterns() {
        assertFalse(SubjectMatcher.isValidPattern("rosey..events"));
        assertFalse(SubjectMatcher.isValidPattern("rosey.>.events"));
        assertFalse(SubjectMatcher.isValidPattern("rosey.ev*"));
        assertFalse(SubjectMatcher.isValidPattern("rosey events"));
        assertFalse(SubjectMatcher.isValidPattern(""));
        assertFalse(SubjectMatcher.isValidPattern(".rosey"));
    }

    @Test
    void isConcreteSubject_rejectsWildcards() {
        assertTrue(SubjectMatcher.isConcreteSubject("rosey.events.message"));
        assertFalse(SubjectMatcher.isConcreteSubject("rosey.events.*"));
        assertFalse(SubjectMatcher.isConcreteSubject("rosey.>"));
    }
}
