package me.rosey.bot.plugin.api;

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

import me.rosey.bot.domain.model.BusMessage;
import me.rosey.bot.port.outbound.MessageBusPort;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Message bus as seen by a plugin. Every call is checked against the plugin's
 * grants and raises {@link me.rosey.bot.domain.service.PermissionDeniedException}
 * when not allowed.
 */
public interface PluginMessaging {

    void publish(String subject, Map<String, Object> data);

    MessageBusPort.Subscription subscribe(String pattern, Consumer<BusMessage> handler);

    CompletableFuture<BusMessage> request(String subject, Map<String, Object> data, Duration timeout);

    /**
     * Reply to a request. Replies go to the request's inbox and need no grant.
     */
    void reply(BusMessage request, Map<String, Object> data);
}
