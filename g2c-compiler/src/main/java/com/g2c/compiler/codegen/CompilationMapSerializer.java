package com.g2c.compiler.codegen;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads and writes {@code <file>.map.json}. Keys are written in sorted order so that equal maps
 * serialize to identical bytes.
 */
public class CompilationMapSerializer {

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();
    private static final Type MAP_TYPE = new TypeToken<LinkedHashMap<String, CompilationMap.NodeSpan>>() {}.getType();

    public static class SerializerException extends RuntimeException {
        public SerializerException(String msg) { super(msg); }
        public SerializerException(String msg, Throwable cause) { super(msg, cause); }
    }

    public String toJson(CompilationMap map) {
        return GSON.toJson(map.spans(), MAP_TYPE);
    }

    public void write(CompilationMap map, Path path) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            try (Writer w = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
                w.write(toJson(map));
                w.write('\n');
            }
        } catch (IOException e) {
            throw new SerializerException("Failed to write compilation map " + path + ": " + e.getMessage(), e);
        }
    }

    public CompilationMap read(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new SerializerException("Compilation map not found: " + path);
        }
        try (Reader r = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return fromJson(GSON.fromJson(r, MAP_TYPE), path.toString());
        } catch (IOException e) {
            throw new SerializerException("Failed to read compilation map " + path + ": " + e.getMessage(), e);
        } catch (JsonParseException e) {
            throw new SerializerException("Compilation map is not valid JSON: " + path + ": " + e.getMessage(), e);
        }
    }

    public CompilationMap parse(String json) {
        try {
            return fromJson(GSON.fromJson(json, MAP_TYPE), "<string>");
        } catch (JsonParseException e) {
            throw new SerializerException("Compilation map is not valid JSON: " + e.getMessage(), e);
        }
    }

    private static CompilationMap fromJson(Map<String, CompilationMap.NodeSpan> spans, String origin) {
        if (spans == null) {
            throw new SerializerException("Compilation map is empty: " + origin);
        }
        for (Map.Entry<String, CompilationMap.NodeSpan> e : spans.entrySet()) {
            if (e.getValue() == null) {
                throw new SerializerException("Compilation map entry " + e.getKey() + " has no span: " + origin);
            }
        }
        return new CompilationMap(spans);
    }
}
