package com.symbexlog.recorder;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

class TraceConfigReaderTest {

    private final TraceConfigReader reader = new TraceConfigReader();

    @Test
    void readsAllKeys(@TempDir Path tmp) throws IOException {
        String json = """
            {
              "enabled": true,
              "output_dir": "/tmp/trace",
              "write_files": true,
              "aborted_branch_policy": "exclude",
              "baseline_dir": "baselines"
            }
            """;
        Path file = tmp.resolve("trace.json");
        Files.writeString(file, json);

        TraceConfig config = reader.read(file);
        assertTrue(config.enabled());
        assertEquals(Paths.get("/tmp/trace"), config.outputDir());
        assertTrue(config.writeFiles());
        assertEquals(AbortedBranchPolicy.EXCLUDE, config.abortedBranchPolicy());
        assertEquals(Paths.get("baselines"), config.baselineDir());
    }

    @Test
    void absentKeysTakeDefaults(@TempDir Path tmp) throws IOException {
        Path file = tmp.resolve("trace.json");
        Files.writeString(file, "{ \"enabled\": true }");

        assertEquals(TraceConfig.defaults().withEnabled(true), reader.read(file));
    }

    @Test
    void nonAsciiValuesAreDecodedAsUtf8(@TempDir Path tmp) throws IOException {
        Path file = tmp.resolve("policy.json");
        Files.writeString(file, "{ \"aborted_branch_policy\": \"str\u00e4ng\" }", StandardCharsets.UTF_8);

        TraceConfigReader.ConfigReadException e =
            assertThrows(TraceConfigReader.ConfigReadException.class, () -> reader.read(file));
        assertTrue(e.getMessage().contains("STR\u00c4NG"), e.getMessage());
    }

    @Test
    void missingFileThrows(@TempDir Path tmp) {
        Path missing = tmp.resolve("nope.json");
        TraceConfigReader.ConfigReadException e =
            assertThrows(TraceConfigReader.ConfigReadException.class, () -> reader.read(missing));
        assertTrue(e.getMessage().contains("not found"));
    }

    @Test
    void emptyFileThrows(@TempDir Path tmp) throws IOException {
        Path file = tmp.resolve("empty.json");
        Files.writeString(file, "");
        assertThrows(TraceConfigReader.ConfigReadException.class, () -> reader.read(file));
    }

    @Test
    void malformedJsonThrows(@TempDir Path tmp) throws IOException {
        Path file = tmp.resolve("bad.json");
        Files.writeString(file, "{ \"enabled\": ");
        assertThrows(TraceConfigReader.ConfigReadException.class, () -> reader.read(file));
    }

    @Test
    void unknownPolicyThrows(@TempDir Path tmp) throws IOException {
        Path file = tmp.resolve("policy.json");
        Files.writeString(file, "{ \"aborted_branch_policy\": \"sometimes\" }");
        assertThrows(TraceConfigReader.ConfigReadException.class, () -> reader.read(file));
    }
}
