package me.rosey.bot.adapter.outbound.bus;

import me.rosey.bot.domain.model.BusMessage;
import me.rosey.bot.port.outbound.MessageBusPort;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LocalMessageBusAdapterTest {

    private final LocalMessageBusAdapter bus = new LocalMessageBusAdapter();

    @Test
    void publish_deliversToMatchingSubscriptionsOnly() {
        List<String> received = new ArrayList<>();
        bus.subscribe("rosey.events.*", message -> received.add("single:" + message.subject()));
        bus.subscribe("rosey.>", message -> received.add("multi:" + message.subject()));
        bus.subscribe("rosey.commands.*", message -> received.add("commands:" + message.subject()));

        bus.publish("rosey.events.message", Map.of("text", "hi"));

        assertEquals(List.of("single:rosey.events.message", "multi:rosey.events.message"), received);
    }

    @Test
    void publish_continuesAfterFailingHandler() {
        List<BusMessage> received = new ArrayList<>();
        bus.subscribe("rosey.events.message", message -> {
            throw new IllegalStateException("boom");
        });
        bus.subscribe("rosey.events.message", received::add);

        bus.publish("rosey.events.message", Map.of());

        assertEquals(1, received.size());
    }

    @Test
    void publish_rejectsWildcardSubject() {
        assertThrows(IllegalArgumentException.class, () -> bus.publish("rosey.events.*", Map.of()));
    }

    @Test
    void subscribe_rejectsMalformedPattern() {
        assertThrows(IllegalArgumentException.class, () -> bus.subscribe("rosey..events", message -> {
        }));
    }

    @Test
    void unsubscribe_stopsDelivery() {
        List<BusMessage> received = new ArrayList<>();
        MessageBusPort.Subscription subscription = bus.subscribe("rosey.events.message", received::add);

        subscription.close();
        bus.publish("rosey.events.message", Map.of());

        assertTrue(received.isEmpty());
        assertEquals(0, bus.subscriptionCount());
        assertFalse(bus.hasSubscribers("rosey.events.message"));
    }

    @Test
    void request_completesWithReply() throws Exception {
        bus.subscribe("rosey.plugins.echo.health", message -> bus.reply(message, Map.of("status", "ok")));

        BusMessage reply = bus.request("rosey.plugins.echo.health", Map.of(), Duration.ofSeconds(1))
                .get(1, TimeUnit.SECONDS);

        assertEquals("ok", reply.data().get("status"));
        assertEquals(1, bus.subscriptionCount());
    }

    @Test
    void request_failsFastWithoutResponders() {
        CompletableFuture<BusMessage> reply = bus.request("rosey.plugins.ghost.health", Map.of(),
                Duration.ofSeconds(1));

        ExecutionException exception = assertThrows(ExecutionException.class, reply::get);
        assertTrue(exception.getCause().getMessage().startsWith("No responders for"));
    }

    @Test
    void request_timesOutWhenNobodyReplies() {
        bus.subscribe("rosey.plugins.slow.health", message -> {
        });

        CompletableFuture<BusMessage> reply = bus.request("rosey.plugins.slow.health", Map.of(),
                Duration.ofMillis(50));

        ExecutionException exception = assertThrows(ExecutionException.class,
                () -> reply.get(2, TimeUnit.SECONDS));
        assertInstanceOf(TimeoutException.class, exception.getCause());
    }
}
