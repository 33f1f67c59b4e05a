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

/**
 * One declared message-bus grant: a subject pattern plus the directions it is
 * allowed in.
 */
public record SubjectPermission(
        String pattern,
        boolean subscribe,
        boolean publish
) {
    public static SubjectPermission subscribeOnly(String pattern) {
        return new SubjectPermission(pattern, true, false);
    }

    public static SubjectPermission publishOnly(String pattern) {
        return new SubjectPermission(pattern, false, true);
    }

    public static SubjectPermission both(String pattern) {
        return new SubjectPermission(pattern, true, true);
    }
}
