package me.rosey.bot;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the Rosey plugin supervisor.
 *
 * <p>
 * Rosey runs every plugin as its own operating system process connected to a
 * shared message bus. The supervisor discovers plugins from their manifests,
 * starts them in dependency order, enforces the subjects and capabilities they
 * declare, watches their resource usage and restarts them after crashes.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports & Adapters):
 *
 * <pre>
 * Input Layer        → PluginCommandRouter
 * Domain Layer       → PluginManagerService, PermissionValidator, DependencyGraph
 * Infrastructure     → OS process, message bus and storage adapters
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under
 * {@code bot.*} prefix.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class RoseyApplication {

    public static void main(String[] args) {
        SpringApplication.run(RoseyApplication.class, args);
    }

}
