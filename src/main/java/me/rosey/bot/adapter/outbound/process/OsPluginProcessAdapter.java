package me.rosey.bot.adapter.outbound.process;

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

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.rosey.bot.domain.component.PluginProcess;
import me.rosey.bot.domain.model.PluginManifest;
import me.rosey.bot.infrastructure.config.BotProperties;
import me.rosey.bot.port.outbound.PluginProcessPort;
import me.rosey.bot.port.outbound.PluginStoragePort;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Creates {@link OsPluginProcess} units. Provisions the plugin's storage
 * directory before handing it to the process.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OsPluginProcessAdapter implements PluginProcessPort {

    private final BotProperties properties;
    private final PluginStoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    public PluginProcess create(PluginManifest manifest) {
        Path storage = storagePort.provisionStorage(manifest.getName());
        log.debug("[Plugin:{}] Storage directory {}", manifest.getName(), storage);
        return new OsPluginProcess(
                manifest,
                properties.getBus().getUrl(),
                storage,
                objectMapper,
                clock,
                properties.getPlugins().getStartupProbe());
    }
}
