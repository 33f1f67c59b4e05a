package me.rosey.bot.infrastructure.event;

import me.rosey.bot.domain.model.PluginLifecycleEvent;
import me.rosey.bot.domain.model.PluginState;
import org.junit.jupiter.api.Test;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class SpringEventBusTest {

    private final PluginLifecycleEvent event = new PluginLifecycleEvent("echo", PluginLifecycleEvent.Type.STARTED,
            PluginState.RUNNING, "pid 42", Instant.parse("2026-01-01T00:00:00Z"));

    @Test
    void publish_delegatesToSpring() {
        ApplicationEventPublisher publisher = mock(ApplicationEventPublisher.class);

        new SpringEventBus(publisher).publish(event);

        verify(publisher).publishEvent(event);
    }

    @Test
    void publish_isolatesFailingListener() {
        ApplicationEventPublisher publisher = mock(ApplicationEventPublisher.class);
        doThrow(new IllegalStateException("listener broke")).when(publisher).publishEvent(any(Object.class));

        assertDoesNotThrow(() -> new SpringEventBus(publisher).publish(event));
    }
}
