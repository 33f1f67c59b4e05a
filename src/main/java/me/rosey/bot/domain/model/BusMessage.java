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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A message delivered over the message bus.
 *
 * @param subject
 *            concrete subject the message was published on
 * @param data
 *            JSON-compatible payload
 * @param replyTo
 *            inbox subject for request/reply, {@code null} for plain publishes
 */
public record BusMessage(
        String subject,
        Map<String, Object> data,
        String replyTo
) {
    public BusMessage {
        data = data != null ? Collections.unmodifiableMap(new LinkedHashMap<>(data)) : Map.of();
    }

    public static BusMessage of(String subject, Map<String, Object> data) {
        return new BusMessage(subject, data, null);
    }

    public boolean expectsReply() {
        return replyTo != null && !replyTo.isBlank();
    }
}
