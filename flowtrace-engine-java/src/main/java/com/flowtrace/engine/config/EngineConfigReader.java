package com.flowtrace.engine.config;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import java.io.FileReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Map;

/**
 * Loads the engine configuration: the bundled defaults, optionally overlaid with a user file.
 * The overlay replaces keys one by one; for {@code side_effect_calls} it replaces categories one by one.
 */
public class EngineConfigReader {

    static final String DEFAULTS_RESOURCE = "flowtrace/default-config.json";

    private static final Gson GSON = new Gson();

    /** The bundled defaults. */
    public EngineConfig defaults() {
        return GSON.fromJson(loadDefaults(), EngineConfig.class);
    }

    /**
     * Reads {@code configPath} over the defaults.
     *
     * @throws ConfigReadException if the file is missing or is not a JSON object
     */
    public EngineConfig read(Path configPath) {
        if (!configPath.toFile().exists()) {
            throw new ConfigReadException("Config file not found: " + configPath);
        }
        JsonObject overlay;
        try (FileReader reader = new FileReader(configPath.toFile(), StandardCharsets.UTF_8)) {
            JsonElement parsed = JsonParser.parseReader(reader);
            if (parsed == null || !parsed.isJsonObject()) {
                throw new ConfigReadException("Config file is empty or not a JSON object: " + configPath);
            }
            overlay = parsed.getAsJsonObject();
        } catch (JsonParseException e) {
            throw new ConfigReadException("Config file is not valid JSON: " + configPath + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new ConfigReadException("Failed to read config: " + configPath + ": " + e.getMessage(), e);
        }
        JsonObject merged = loadDefaults();
        for (Map.Entry<String, JsonElement> e : overlay.entrySet()) {
            JsonElement base = merged.get(e.getKey());
            if (e.getKey().equals("side_effect_calls") && base != null && base.isJsonObject()
                    && e.getValue().isJsonObject()) {
                for (Map.Entry<String, JsonElement> category : e.getValue().getAsJsonObject().entrySet()) {
                    base.getAsJsonObject().add(category.getKey(), category.getValue());
                }
            } else {
                merged.add(e.getKey(), e.getValue());
            }
        }
        try {
            return GSON.fromJson(merged, EngineConfig.class);
        } catch (JsonParseException e) {
            throw new ConfigReadException("Config file has a value of the wrong type: " + configPath
                + ": " + e.getMessage(), e);
        }
    }

    private JsonObject loadDefaults() {
        InputStream in = EngineConfigReader.class.getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE);
        if (in == null) {
            throw new ConfigReadException("Missing bundled resource: " + DEFAULTS_RESOURCE);
        }
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            return JsonParser.parseReader(reader).getAsJsonObject();
        } catch (IOException | JsonParseException | IllegalStateException e) {
            throw new ConfigReadException("Could not load " + DEFAULTS_RESOURCE + ": " + e.getMessage(), e);
        }
    }

    public static class ConfigReadException extends RuntimeException {
        public ConfigReadException(String message) { super(message); }
        public ConfigReadException(String message, Throwable cause) { super(message, cause); }
    }
}
