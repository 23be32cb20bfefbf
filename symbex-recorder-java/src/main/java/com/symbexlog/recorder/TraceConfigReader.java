package com.symbexlog.recorder;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

public class TraceConfigReader {

    private static final Gson GSON = new Gson();

    /**
     * Reads and deserializes a trace configuration file.
     *
     * @throws ConfigReadException if the file is missing, empty or malformed
     */
    public TraceConfig read(Path configPath) {
        if (!configPath.toFile().exists()) {
            throw new ConfigReadException("Trace config not found: " + configPath);
        }
        // JSON is UTF-8 regardless of the platform charset
        try (Reader reader = Files.newBufferedReader(configPath)) {
            TraceConfigFile file = GSON.fromJson(reader, TraceConfigFile.class);
            if (file == null) {
                throw new ConfigReadException("Trace config is empty or invalid JSON: " + configPath);
            }
            return file.toConfig();
        } catch (NoSuchFileException e) {
            throw new ConfigReadException("Trace config not found: " + configPath, e);
        } catch (JsonParseException e) {
            throw new ConfigReadException("Malformed trace config: " + configPath + ": " + e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new ConfigReadException("Invalid value in trace config " + configPath + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new ConfigReadException("Failed to read trace config: " + configPath + ": " + e.getMessage(), e);
        }
    }

    public static class ConfigReadException extends RuntimeException {
        public ConfigReadException(String message) { super(message); }
        public ConfigReadException(String message, Throwable cause) { super(message, cause); }
    }
}
