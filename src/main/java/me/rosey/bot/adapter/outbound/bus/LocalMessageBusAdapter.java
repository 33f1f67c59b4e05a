package me.rosey.bot.adapter.outbound.bus;

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

import lombok.extern.slf4j.Slf4j;
import me.rosey.bot.domain.model.BusMessage;
import me.rosey.bot.domain.service.SubjectMatcher;
import me.rosey.bot.port.outbound.MessageBusPort;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * In-process message bus. Used when no external transport is wired and by
 * tests that run plugin runtimes inside the host JVM.
 *
 * <p>
 * Handlers run synchronously on the publishing thread, in subscription order.
 * A failing handler is logged and does not affect other handlers. Requests
 * use a one-off {@code _INBOX.<id>} reply subject and fail fast when nothing
 * is subscribed to the request subject.
 */
@Component
@Slf4j
public class LocalMessageBusAdapter implements MessageBusPort {

    private static final String INBOX_PREFIX = "_INBOX.";

    private final List<LocalSubscription> subscriptions = new CopyOnWriteArrayList<>();

    @Override
    public void publish(String subject, Map<String, Object> data) {
        deliver(new BusMessage(subject, data, null));
    }

    @Override
    public Subscription subscribe(String pattern, Consumer<BusMessage> handler) {
        if (!SubjectMatcher.isValidPattern(pattern)) {
            throw new IllegalArgumentException("Invalid subject pattern: " + pattern);
        }
        LocalSubscription subscription = new LocalSubscription(pattern, handler);
        subscriptions.add(subscription);
        log.debug("[Bus] Subscribed to {}", pattern);
        return subscription;
    }

    @Override
    public CompletableFuture<BusMessage> request(String subject, Map<String, Object> data, Duration timeout) {
        CompletableFuture<BusMessage> reply = new CompletableFuture<>();
        if (!hasSubscribers(subject)) {
            reply.completeExceptionally(new IllegalStateException("No responders for " + subject));
            return reply;
        }
        String inbox = INBOX_PREFIX + UUID.randomUUID().toString().replace("-", "");
        Subscription inboxSubscription = subscribe(inbox, reply::complete);
        reply.whenComplete((message, error) -> inboxSubscription.unsubscribe());
        reply.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
        deliver(new BusMessage(subject, data, inbox));
        return reply;
    }

    @Override
    public boolean isConnected() {
        return true;
    }

    public boolean hasSubscribers(String subject) {
        return subscriptions.stream().anyMatch(s -> SubjectMatcher.matches(s.pattern, subject));
    }

    public int subscriptionCount() {
        return subscriptions.size();
    }

    private void deliver(BusMessage message) {
        if (!SubjectMatcher.isConcreteSubject(message.subject())) {
            throw new IllegalArgumentException("Cannot publish to subject: " + message.subject());
        }
        for (LocalSubscription subscription : subscriptions) {
            if (subscription.active.get() && SubjectMatcher.matches(subscription.pattern, message.subject())) {
                try {
                    subscription.handler.accept(message);
                } catch (RuntimeException e) {
                    log.warn("[Bus] Handler for {} failed on {}: {}", subscription.pattern, message.subject(),
                            e.getMessage(), e);
                }
            }
        }
    }

    private final class LocalSubscription implements Subscription {
        private final String pattern;
        private final Consumer<BusMessage> handler;
        private final AtomicBoolean active = new AtomicBoolean(true);

        private LocalSubscription(String pattern, Consumer<BusMessage> handler) {
            this.pattern = pattern;
            this.handler = handler;
        }

        @Override
        public String pattern() {
            return pattern;
        }

        @Override
        public void unsubscribe() {
            if (active.compareAndSet(true, false)) {
                subscriptions.remove(this);
                log.debug("[Bus] Unsubscribed from {}", pattern);
            }
        }
    }
}
