package me.rosey.bot.domain.service;

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

import java.util.List;

/**
 * A manifest could not be loaded: malformed fields, unknown capability names,
 * or an unresolvable or cyclic dependency. The plugin never starts.
 */
public class ManifestValidationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String pluginName;
    private final List<String> problems;

    public ManifestValidationException(String pluginName, List<String> problems) {
        super(buildMessage(pluginName, problems));
        this.pluginName = pluginName;
        this.problems = List.copyOf(problems);
    }

    public ManifestValidationException(String pluginName, String problem, Throwable cause) {
        super(buildMessage(pluginName, List.of(problem)), cause);
        this.pluginName = pluginName;
        this.problems = List.of(problem);
    }

    public String getPluginName() {
        return pluginName;
    }

    public List<String> getProblems() {
        return problems;
    }

    private static String buildMessage(String pluginName, List<String> problems) {
        String subject = pluginName != null ? "'" + pluginName + "'" : "(unnamed)";
        return "Invalid plugin manifest " + subject + ": " + String.join("; ", problems);
    }
}
