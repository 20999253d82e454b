package io.modelgate.cli;

import static org.assertj.core.api.Assertions.assertThat;

import io.modelgate.core.config.ConfigService;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class StatusCommandTest {

    private MockWebServer server;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void shouldReportValidDesignatedModels() throws Exception {
        server.enqueue(listing("qwen3", "llava"));
        CliContext context = new CliContext(new ConfigService(), writeConfig("local/qwen3"));

        String out = run(new StatusCommand(context));

        assertThat(out).contains("Config exists: true");
        assertThat(out).contains("Backends: 1");
        assertThat(out).contains("Chat model: local/qwen3");
        assertThat(out).contains("Model validation: ok");
    }

    @Test
    void shouldListValidationProblems() throws Exception {
        server.enqueue(listing("llava"));
        CliContext context = new CliContext(new ConfigService(), writeConfig("local/qwen3"));

        String out = run(new StatusCommand(context));

        assertThat(out).contains("Model validation: 2 problem(s)");
        assertThat(out).contains("chat model local/qwen3 is not available");
        assertThat(out).contains("intent model local/qwen3 is not available");
    }

    @Test
    void initShouldCreateThenRefreshConfig() throws Exception {
        Path configPath = tempDir.resolve("fresh/config.json");
        CliContext context = new CliContext(new ConfigService(), configPath);

        String initOut = run(new InitCommand(context));

        assertThat(initOut).contains("Created config: " + configPath);
        assertThat(Files.exists(configPath)).isTrue();
        assertThat(run(new InitCommand(context))).contains("Refreshed config with new defaults");
    }

    private Path writeConfig(String chatModel) throws IOException {
        Path configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, """
            {
              "agents": { "defaults": { "models": { "chat": "%s" } } },
              "providers": { "local": { "baseUrl": "%s", "models": ["qwen3"] } },
              "gateway": { "defaultProvider": "local" }
            }
            """.formatted(chatModel, server.url("/v1")));
        return configPath;
    }

    private static MockResponse listing(String... ids) {
        StringBuilder data = new StringBuilder();
        for (String id : ids) {
            if (data.length() > 0) {
                data.append(',');
            }
            data.append("{\"id\":\"").append(id).append("\"}");
        }
        return new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setBody("{\"object\":\"list\",\"data\":[" + data + "]}");
    }

    private static String run(Object command) {
        PrintStream originalOut = System.out;
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
            assertThat(new CommandLine(command).execute()).isZero();
        } finally {
            System.setOut(originalOut);
        }
        return out.toString(StandardCharsets.UTF_8);
    }
}
