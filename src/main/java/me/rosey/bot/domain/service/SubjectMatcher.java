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

import me.rosey.bot.domain.model.Subjects;

/**
 * Dot-separated subject pattern matching.
 *
 * <p>
 * {@code *} matches exactly one token; {@code >} matches one or more trailing
 * tokens and may only appear as the last token. Matching is case-sensitive.
 */
public final class SubjectMatcher {

    private SubjectMatcher() {
    }

    /**
     * Whether a concrete subject matches a pattern.
     */
    public static boolean matches(String pattern, String subject) {
        if (pattern == null || subject == null || pattern.isEmpty() || subject.isEmpty()) {
            return false;
        }
        String[] patternTokens = pattern.split("\\.", -1);
        String[] subjectTokens = subject.split("\\.", -1);

        for (int i = 0; i < patternTokens.length; i++) {
            String token = patternTokens[i];
            if (Subjects.MULTI_WILDCARD.equals(token)) {
                return i == patternTokens.length - 1 && subjectTokens.length > i;
            }
            if (i >= subjectTokens.length) {
                return false;
            }
            if (!Subjects.SINGLE_WILDCARD.equals(token) && !token.equals(subjectTokens[i])) {
                return false;
            }
        }
        return patternTokens.length == subjectTokens.length;
    }

    /**
     * Whether every subject matched by {@code requested} is also matched by
     * {@code granted}. Used for subscriptions, where the plugin asks for a
     * pattern rather than a concrete subject.
     */
    public static boolean covers(String granted, String requested) {
        if (granted == null || requested == null || granted.isEmpty() || requested.isEmpty()) {
            return false;
        }
        String[] grantedTokens = granted.split("\\.", -1);
        String[] requestedTokens = requested.split("\\.", -1);

        for (int i = 0; i < grantedTokens.length; i++) {
            String token = grantedTokens[i];
            if (Subjects.MULTI_WILDCARD.equals(token)) {
                return requestedTokens.length > i;
            }
            if (i >= requestedTokens.length) {
                return false;
            }
            String requestedToken = requestedTokens[i];
            if (Subjects.MULTI_WILDCARD.equals(requestedToken)) {
                return false;
            }
            if (Subjects.SINGLE_WILDCARD.equals(token)) {
                continue;
            }
            if (!token.equals(requestedToken)) {
                return false;
            }
        }
        return grantedTokens.length == requestedTokens.length;
    }

    /**
     * Syntactic validity: non-empty tokens, no whitespace, wildcards occupy a
     * whole token, {@code >} only last.
     */
    public static boolean isValidPattern(String pattern) {
        if (pattern == null || pattern.isBlank()) {
            return false;
        }
        String[] tokens = pattern.split("\\.", -1);
        for (int i = 0; i < tokens.length; i++) {
            String token = tokens[i];
            if (token.isEmpty() || token.chars().anyMatch(Character::isWhitespace)) {
                return false;
            }
            if (Subjects.MULTI_WILDCARD.equals(token)) {
                if (i != tokens.length - 1) {
                    return false;
                }
                continue;
            }
            if (!Subjects.SINGLE_WILDCARD.equals(token) && (token.contains("*") || token.contains(">"))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Whether a subject is concrete (valid and free of wildcards), as required
     * for publishing.
     */
    public static boolean isConcreteSubject(String subject) {
        return isValidPattern(subject) && !subject.contains("*") && !subject.contains(">");
    }
}
