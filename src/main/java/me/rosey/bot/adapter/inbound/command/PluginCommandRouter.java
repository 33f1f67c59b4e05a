package me.rosey.bot.adapter.inbound.command;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.rosey.bot.domain.model.PluginManifest;
import me.rosey.bot.domain.model.PluginOperationResult;
import me.rosey.bot.domain.model.PluginState;
import me.rosey.bot.domain.model.PluginStatus;
import me.rosey.bot.domain.service.ManifestValidationException;
import me.rosey.bot.domain.service.PluginDiscoveryService;
import me.rosey.bot.port.inbound.CommandPort;
import me.rosey.bot.port.inbound.PluginManagementPort;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Routes plugin management commands to the {@link PluginManagementPort}.
 *
 * <ul>
 * <li>/plugins - table of installed plugins
 * <li>/plugin status|start|stop|restart|enable|disable &lt;name&gt;
 * <li>/plugin install &lt;directory&gt; - install from an unpacked plugin
 * directory
 * <li>/plugin uninstall &lt;name&gt;
 * <li>/plugin stats - plugin count per state
 * <li>/help - list commands
 * </ul>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PluginCommandRouter implements CommandPort {

    private static final String TABLE_SEPARATOR = " | ";
    private static final String CMD_PLUGINS = "plugins";
    private static final String CMD_PLUGIN = "plugin";
    private static final String CMD_HELP = "help";
    private static final String PLUGIN_USAGE = "Usage: /plugin <status|start|stop|restart|enable|disable|install"
            + "|uninstall|stats> [name]";

    private static final List<CommandDefinition> COMMANDS = List.of(
            new CommandDefinition(CMD_PLUGINS, "List installed plugins", "/plugins"),
            new CommandDefinition(CMD_PLUGIN, "Manage one plugin",
                    "/plugin <status|start|stop|restart|enable|disable|uninstall> <name>"),
            new CommandDefinition(CMD_PLUGIN, "Install a plugin directory", "/plugin install <directory>"),
            new CommandDefinition(CMD_PLUGIN, "Plugin count per state", "/plugin stats"),
            new CommandDefinition(CMD_HELP, "Show available commands", "/help"));

    private final PluginManagementPort management;
    private final PluginDiscoveryService discoveryService;

    @Override
    public CompletableFuture<CommandResult> execute(String command, List<String> args, Map<String, Object> context) {
        return CompletableFuture.supplyAsync(() -> {
            log.debug("Executing command: /{} {}", command, args);
            return switch (command) {
            case CMD_PLUGINS -> handleList();
            case CMD_PLUGIN -> handlePlugin(args);
            case CMD_HELP -> handleHelp();
            default -> CommandResult.failure("Unknown command: /" + command);
            };
        });
    }

    @Override
    public boolean hasCommand(String command) {
        return COMMANDS.stream().anyMatch(definition -> definition.name().equals(command));
    }

    @Override
    public List<CommandDefinition> listCommands() {
        return COMMANDS;
    }

    private CommandResult handleList() {
        List<PluginStatus> plugins = management.list();
        if (plugins.isEmpty()) {
            return CommandResult.success("No plugins installed");
        }
        StringBuilder sb = new StringBuilder();
        sb.append("**Plugins** (").append(plugins.size()).append(")\n\n");
        sb.append("| Plugin").append(TABLE_SEPARATOR).append("Version").append(TABLE_SEPARATOR)
                .append("State").append(TABLE_SEPARATOR).append("Uptime").append(TABLE_SEPARATOR)
                .append("Crashes").append(TABLE_SEPARATOR).append("Restarts").append(TABLE_SEPARATOR)
                .append("Errors |\n");
        sb.append("|---|---|---|---|---|---|---|\n");
        for (PluginStatus status : plugins) {
            sb.append("| ").append(status.getName())
                    .append(TABLE_SEPARATOR).append(status.getVersion())
                    .append(TABLE_SEPARATOR).append(formatState(status))
                    .append(TABLE_SEPARATOR).append(formatUptime(status.getUptimeSeconds()))
                    .append(TABLE_SEPARATOR).append(status.getCrashCount())
                    .append(TABLE_SEPARATOR).append(status.getRestartCount())
                    .append(TABLE_SEPARATOR).append(formatPercent(status.getErrorRate()))
                    .append(" |\n");
        }
        return CommandResult.success(sb.toString(), plugins);
    }

    private CommandResult handlePlugin(List<String> args) {
        if (args.isEmpty()) {
            return CommandResult.failure(PLUGIN_USAGE);
        }
        String operation = args.get(0).toLowerCase(Locale.ROOT);
        if ("stats".equals(operation)) {
            return handleStats();
        }
        if (args.size() < 2) {
            return CommandResult.failure(PLUGIN_USAGE);
        }
        String target = args.get(1);
        return switch (operation) {
        case "status" -> handleStatus(target);
        case "start" -> toCommandResult(management.start(target));
        case "stop" -> toCommandResult(management.stop(target));
        case "restart" -> toCommandResult(management.restart(target));
        case "enable" -> toCommandResult(management.enable(target));
        case "disable" -> toCommandResult(management.disable(target));
        case "install" -> handleInstall(target);
        case "uninstall", "remove" -> toCommandResult(management.uninstall(target));
        default -> CommandResult.failure(PLUGIN_USAGE);
        };
    }

    private CommandResult handleStatus(String name) {
        PluginOperationResult result = management.status(name);
        if (!result.isSuccess() || !(result.getData() instanceof PluginStatus status)) {
            return toCommandResult(result);
        }
        StringBuilder sb = new StringBuilder();
        sb.append("**").append(status.getName()).append("** v").append(status.getVersion()).append("\n\n");
        sb.append("State: ").append(formatState(status)).append("\n");
        sb.append("Uptime: ").append(formatUptime(status.getUptimeSeconds())).append("\n");
        sb.append("Crashes: ").append(status.getCrashCount())
                .append(", restarts: ").append(status.getRestartCount()).append("\n");
        sb.append("Command error rate: ").append(formatPercent(status.getErrorRate())).append("\n");
        sb.append("Permission denials: ").append(status.getPermissionDenials()).append("\n");
        if (status.getPid() != null) {
            sb.append("PID: ").append(status.getPid()).append("\n");
        }
        if (status.getCpuPercent() != null && status.getMemoryMb() != null) {
            sb.append(String.format(Locale.ROOT, "CPU: %.1f%%, memory: %.1f MB%n",
                    status.getCpuPercent(), status.getMemoryMb()));
        }
        if (!status.getDependencies().isEmpty()) {
            sb.append("Depends on: ").append(String.join(", ", status.getDependencies())).append("\n");
        }
        if (!status.getDependents().isEmpty()) {
            sb.append("Required by: ").append(String.join(", ", status.getDependents())).append("\n");
        }
        return CommandResult.success(sb.toString().trim(), status);
    }

    private CommandResult handleInstall(String location) {
        PluginManifest manifest;
        try {
            manifest = discoveryService.loadFromDirectory(location);
        } catch (ManifestValidationException e) {
            return CommandResult.failure(e.getMessage());
        }
        return toCommandResult(management.install(manifest));
    }

    private CommandResult handleStats() {
        Map<PluginState, Long> counts = management.statistics();
        long total = counts.values().stream().mapToLong(Long::longValue).sum();
        StringBuilder sb = new StringBuilder();
        sb.append("**Plugins**: ").append(total).append("\n");
        counts.forEach((state, count) -> {
            if (count > 0) {
                sb.append(state.name().toLowerCase(Locale.ROOT)).append(": ").append(count).append("\n");
            }
        });
        return CommandResult.success(sb.toString().trim(), counts);
    }

    private CommandResult handleHelp() {
        StringBuilder sb = new StringBuilder();
        sb.append("Available commands:\n");
        for (CommandDefinition command : COMMANDS) {
            sb.append(command.usage()).append(" - ").append(command.description()).append("\n");
        }
        return CommandResult.success(sb.toString().trim());
    }

    private static CommandResult toCommandResult(PluginOperationResult result) {
        return new CommandResult(result.isSuccess(), result.getMessage(), result.getData());
    }

    private static String formatState(PluginStatus status) {
        String state = status.getState().name().toLowerCase(Locale.ROOT);
        return status.isEnabled() || status.getState() == PluginState.DISABLED ? state : state + " (disabled)";
    }

    static String formatUptime(long seconds) {
        if (seconds <= 0) {
            return "-";
        }
        long hours = seconds / 3600;
        long minutes = (seconds % 3600) / 60;
        long secs = seconds % 60;
        if (hours > 0) {
            return String.format(Locale.ROOT, "%dh %02dm", hours, minutes);
        }
        if (minutes > 0) {
            return String.format(Locale.ROOT, "%dm %02ds", minutes, secs);
        }
        return secs + "s";
    }

    private static String formatPercent(double rate) {
        return String.format(Locale.ROOT, "%.0f%%", rate * 100);
    }
}
