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

import me.rosey.bot.domain.service.PermissionDeniedException;

/**
 * Result of a subscribe, publish or capability check. Recomputed on every
 * check and never persisted.
 *
 * @param allowed
 *            whether the operation may proceed
 * @param reason
 *            human-readable denial reason, {@code null} when allowed
 * @param requiredDeclaration
 *            manifest entry that would make the check pass, {@code null} when
 *            allowed
 */
public record PermissionDecision(
        boolean allowed,
        String reason,
        String requiredDeclaration
) {
    private static final PermissionDecision ALLOW = new PermissionDecision(true, null, null);

    public static PermissionDecision allow() {
        return ALLOW;
    }

    public static PermissionDecision deny(String reason, String requiredDeclaration) {
        return new PermissionDecision(false, reason, requiredDeclaration);
    }

    public boolean denied() {
        return !allowed;
    }

    /**
     * Throw {@link PermissionDeniedException} when denied.
     */
    public void orThrow() {
        if (!allowed) {
            throw new PermissionDeniedException(this);
        }
    }
}
