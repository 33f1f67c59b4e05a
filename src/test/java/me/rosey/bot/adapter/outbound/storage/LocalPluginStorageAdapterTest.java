package me.rosey.bot.adapter.outbound.storage;

import me.rosey.bot.infrastructure.config.BotProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LocalPluginStorageAdapterTest {

    @TempDir
    Path tempDir;

    private LocalPluginStorageAdapter storageAdapter;

    @BeforeEach
    void setUp() {
        BotProperties properties = new BotProperties();
        properties.getPlugins().setDirectory(tempDir.resolve("plugins").toString());
        properties.getPlugins().setStorageRoot(tempDir.resolve("data").toString());

        storageAdapter = new LocalPluginStorageAdapter(properties);
        storageAdapter.init();
    }

    @Test
    void init_createsDirectories() {
        assertTrue(Files.isDirectory(tempDir.resolve("plugins")));
        assertTrue(Files.isDirectory(tempDir.resolve("data")));
        assertEquals(tempDir.resolve("plugins").toAbsolutePath().normalize(), storageAdapter.pluginsDirectory());
    }

    @Test
    void listPluginDirectories_returnsOnlyDirectoriesWithManifest() throws IOException {
        Path plugins = storageAdapter.pluginsDirectory();
        Files.createDirectories(plugins.resolve("weather"));
        Files.writeString(plugins.resolve("weather/plugin.json"), "{}");
        Files.createDirectories(plugins.resolve("echo"));
        Files.writeString(plugins.resolve("echo/plugin.yaml"), "name: echo");
        Files.createDirectories(plugins.resolve("notes"));
        Files.writeString(plugins.resolve("README.md"), "plugins");

        List<Path> directories = storageAdapter.listPluginDirectories();

        assertEquals(List.of(plugins.resolve("echo"), plugins.resolve("weather")), directories);
    }

    @Test
    void provisionStorage_createsIsolatedDirectory() {
        Path directory = storageAdapter.provisionStorage("echo");

        assertTrue(Files.isDirectory(directory));
        assertEquals(tempDir.resolve("data").resolve("echo").toAbsolutePath().normalize(), directory);
    }

    @Test
    void storageDirectory_rejectsTraversal() {
        assertThrows(IllegalArgumentException.class, () -> storageAdapter.storageDirectory("../etc"));
        assertThrows(IllegalArgumentException.class, () -> storageAdapter.storageDirectory("a/b"));
    }
}
