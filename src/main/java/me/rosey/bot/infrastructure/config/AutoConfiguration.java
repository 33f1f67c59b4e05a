package me.rosey.bot.infrastructure.config;

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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.rosey.bot.domain.model.PluginManifest;
import me.rosey.bot.domain.model.PluginOperationResult;
import me.rosey.bot.domain.service.PluginDiscoveryService;
import me.rosey.bot.domain.service.PluginManagerService;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.info.BuildProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;

/**
 * Spring configuration that discovers installed plugins and starts the
 * supervisor on application startup.
 *
 * <p>
 * This configuration:
 * <ul>
 * <li>Registers every plugin with a valid manifest</li>
 * <li>Starts them in dependency order when
 * {@code bot.plugins.auto-start-on-boot} is true</li>
 * <li>Starts periodic health checks and crash monitoring</li>
 * </ul>
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final BotProperties properties;
    private final PluginDiscoveryService discoveryService;
    private final PluginManagerService pluginManager;
    private final ObjectProvider<BuildProperties> buildPropertiesProvider;

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @PostConstruct
    public void init() {
        BuildProperties buildProps = buildPropertiesProvider.getIfAvailable();
        String version = buildProps != null ? buildProps.getVersion() : "dev";
        log.info("Rosey plugin supervisor v{} starting...", version);
        log.info("Plugins directory: {}", properties.getPlugins().getDirectory());
        log.info("Message bus: {}", properties.getBus().getUrl());

        List<PluginManifest> manifests = discoveryService.discover();
        pluginManager.registerAll(manifests);

        if (properties.getPlugins().isAutoStartOnBoot()) {
            PluginOperationResult result = pluginManager.startAll();
            log.info("[Plugins] {}", result.getMessage());
        } else {
            log.info("[Plugins] Auto-start disabled, {} plugin(s) registered", manifests.size());
        }

        pluginManager.startMonitoring();
        log.info("Rosey plugin supervisor started");
    }
}
