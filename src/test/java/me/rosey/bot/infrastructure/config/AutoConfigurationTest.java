package me.rosey.bot.infrastructure.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.rosey.bot.domain.model.PluginManifest;
import me.rosey.bot.domain.model.PluginOperationResult;
import me.rosey.bot.domain.service.PluginDiscoveryService;
import me.rosey.bot.domain.service.PluginManagerService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.info.BuildProperties;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AutoConfigurationTest {

    @Mock
    private PluginDiscoveryService discoveryService;
    @Mock
    private PluginManagerService pluginManager;
    @Mock
    private ObjectProvider<BuildProperties> buildPropertiesProvider;

    private final List<PluginManifest> manifests = List.of(PluginManifest.builder()
            .name("echo")
            .displayName("echo")
            .version("1.0.0")
            .entryPoint("./run")
            .build());

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        when(buildPropertiesProvider.getIfAvailable()).thenReturn(null);
        when(discoveryService.discover()).thenReturn(manifests);
        when(pluginManager.startAll()).thenReturn(PluginOperationResult.success(null, "Started 1 plugin(s)"));
    }

    @Test
    void shouldRegisterStartAndMonitorOnInit() {
        BotProperties properties = new BotProperties();
        AutoConfiguration configuration = new AutoConfiguration(properties, discoveryService, pluginManager,
                buildPropertiesProvider);

        configuration.init();

        InOrder order = inOrder(pluginManager);
        order.verify(pluginManager).registerAll(manifests);
        order.verify(pluginManager).startAll();
        order.verify(pluginManager).startMonitoring();
    }

    @Test
    void shouldSkipStartAllWhenAutoStartDisabled() {
        BotProperties properties = new BotProperties();
        properties.getPlugins().setAutoStartOnBoot(false);
        AutoConfiguration configuration = new AutoConfiguration(properties, discoveryService, pluginManager,
                buildPropertiesProvider);

        configuration.init();

        verify(pluginManager).registerAll(manifests);
        verify(pluginManager, never()).startAll();
        verify(pluginManager).startMonitoring();
    }

    @Test
    void objectMapperShouldWriteIsoDates() throws Exception {
        ObjectMapper mapper = AutoConfiguration.objectMapper();

        String json = mapper.writeValueAsString(Map.of("at", Instant.parse("2026-01-01T00:00:00Z")));

        assertEquals("{\"at\":\"2026-01-01T00:00:00Z\"}", json);
    }
}
