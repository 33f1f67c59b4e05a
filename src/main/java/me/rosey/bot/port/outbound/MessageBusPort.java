package me.rosey.bot.port.outbound;

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

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Port to the publish/subscribe and request/reply message bus that connects
 * the host with plugin processes.
 *
 * <p>
 * Subjects are dot-separated tokens. Subscription patterns may use {@code *}
 * for exactly one token and {@code >} for the remaining tokens.
 */
public interface MessageBusPort {

    /**
     * Publish a message to a concrete subject.
     */
    void publish(String subject, Map<String, Object> data);

    /**
     * Reply to a request message. No-op when the message does not expect a
     * reply.
     */
    default void reply(BusMessage request, Map<String, Object> data) {
        if (request.expectsReply()) {
            publish(request.replyTo(), data);
        }
    }

    /**
     * Subscribe a handler to a subject pattern.
     *
     * @return handle used to cancel the subscription
     */
    Subscription subscribe(String pattern, Consumer<BusMessage> handler);

    /**
     * Send a request and wait for the first reply.
     *
     * @return future completed with the reply, or completed exceptionally with
     *         a {@link java.util.concurrent.TimeoutException} when no reply
     *         arrives in time
     */
    CompletableFuture<BusMessage> request(String subject, Map<String, Object> data, Duration timeout);

    /**
     * Whether the transport is connected.
     */
    boolean isConnected();

    /**
     * An active subscription.
     */
    interface Subscription extends AutoCloseable {

        String pattern();

        void unsubscribe();

        @Override
        default void close() {
            unsubscribe();
        }
    }
}
