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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized configuration properties for the bot, bound from
 * application.properties.
 *
 * <p>
 * All configuration lives under the {@code bot.*} prefix:
 * <ul>
 * <li>{@link PluginsProperties} - plugin discovery, supervision and crash
 * recovery</li>
 * <li>{@link BusProperties} - message bus connection handed to plugins</li>
 * </ul>
 */
@Component
@ConfigurationProperties(prefix = "bot")
@Data
public class BotProperties {

    private PluginsProperties plugins = new PluginsProperties();
    private BusProperties bus = new BusProperties();

    @Data
    public static class PluginsProperties {
        /** Directory scanned for {@code <plugin>/plugin.yaml}. */
        private String directory = "${user.home}/.rosey/plugins";
        /** Root of the per-plugin storage directories. */
        private String storageRoot = "${user.home}/.rosey/plugin-data";
        private boolean autoStartOnBoot = true;
        private Duration healthCheckInterval = Duration.ofSeconds(30);
        private int disableThreshold = 3;
        private Duration backoffBase = Duration.ofSeconds(1);
        private Duration maxBackoff = Duration.ofSeconds(60);
        private Duration stopGracePeriod = Duration.ofSeconds(10);
        /** A process that exits within this window counts as a failed start. */
        private Duration startupProbe = Duration.ofMillis(200);
        private Duration operationTimeout = Duration.ofSeconds(120);
        /** A plugin that stays healthy this long has its crash count cleared. */
        private Duration crashResetAfter = Duration.ofMinutes(5);
        private double maxErrorRate = 0.5;
        private boolean healthPingEnabled = false;
        private Duration healthPingTimeout = Duration.ofSeconds(5);
    }

    @Data
    public static class BusProperties {
        private String url = "nats://localhost:4222";
        private Duration requestTimeout = Duration.ofSeconds(5);
    }
}
