package me.rosey.bot.plugin.context;

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
import me.rosey.bot.domain.model.PermissionDecision;
import me.rosey.bot.domain.model.Subjects;
import me.rosey.bot.domain.service.PermissionDeniedException;
import me.rosey.bot.domain.service.PermissionValidator;
import me.rosey.bot.plugin.api.PluginMessaging;
import me.rosey.bot.port.outbound.MessageBusPort;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Plugin-side bus facade that enforces the manifest before anything reaches
 * the transport.
 *
 * <p>
 * A denied call is counted, reported to the host on
 * {@code rosey.plugins.<name>.permission_denied} and raised as
 * {@link PermissionDeniedException}; the plugin keeps running. Publishes and
 * requests also draw from the plugin's message-rate bucket.
 */
@Slf4j
public class GuardedPluginMessaging implements PluginMessaging {

    private final MessageBusPort bus;
    private final PermissionValidator permissions;
    private final MessageRateLimiter rateLimiter;
    private final AtomicLong deniedCount = new AtomicLong();

    public GuardedPluginMessaging(MessageBusPort bus, PermissionValidator permissions) {
        this(bus, permissions, new MessageRateLimiter(permissions.getLimits().getMaxMessagesPerSecond()));
    }

    GuardedPluginMessaging(MessageBusPort bus, PermissionValidator permissions, MessageRateLimiter rateLimiter) {
        this.bus = bus;
        this.permissions = permissions;
        this.rateLimiter = rateLimiter;
    }

    @Override
    public void publish(String subject, Map<String, Object> data) {
        check("publish", subject, permissions.validatePublish(subject));
        acquire(subject);
        bus.publish(subject, data);
    }

    @Override
    public MessageBusPort.Subscription subscribe(String pattern, Consumer<BusMessage> handler) {
        check("subscribe", pattern, permissions.validateSubscribe(pattern));
        return bus.subscribe(pattern, handler);
    }

    @Override
    public CompletableFuture<BusMessage> request(String subject, Map<String, Object> data, Duration timeout) {
        check("request", subject, permissions.validatePublish(subject));
        acquire(subject);
        return bus.request(subject, data, timeout);
    }

    @Override
    public void reply(BusMessage request, Map<String, Object> data) {
        bus.reply(request, data);
    }

    public long getDeniedCount() {
        return deniedCount.get();
    }

    private void check(String operation, String subject, PermissionDecision decision) {
        if (decision.allowed()) {
            return;
        }
        deniedCount.incrementAndGet();
        String plugin = permissions.getPluginName();
        log.warn("[Plugin:{}] Permission denied: {}", plugin, decision.reason());

        Map<String, Object> report = new LinkedHashMap<>();
        report.put("operation", operation);
        report.put("subject", subject);
        report.put("reason", decision.reason());
        if (decision.requiredDeclaration() != null) {
            report.put("required", decision.requiredDeclaration());
        }
        try {
            bus.publish(Subjects.pluginEvent(plugin, Subjects.EVENT_PERMISSION_DENIED), report);
        } catch (RuntimeException e) {
            log.debug("[Plugin:{}] Cannot report denial: {}", plugin, e.getMessage());
        }
        throw new PermissionDeniedException(decision);
    }

    private void acquire(String subject) {
        if (!rateLimiter.tryAcquire()) {
            String plugin = permissions.getPluginName();
            throw new PermissionDeniedException(PermissionDecision.deny(
                    "Plugin '" + plugin + "' exceeded " + permissions.getLimits().getMaxMessagesPerSecond()
                            + " messages per second publishing to '" + subject + "'; retry in "
                            + rateLimiter.waitTimeMs() + "ms",
                    null));
        }
    }
}
