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

import me.rosey.bot.domain.model.PermissionDecision;

/**
 * Raised inside a plugin when it attempts a subscribe, publish or capability
 * use its manifest does not grant. The plugin keeps running.
 */
public class PermissionDeniedException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final transient PermissionDecision decision;

    public PermissionDeniedException(PermissionDecision decision) {
        super(decision.reason());
        this.decision = decision;
    }

    public PermissionDecision getDecision() {
        return decision;
    }

    public String getRequiredDeclaration() {
        return decision.requiredDeclaration();
    }
}
