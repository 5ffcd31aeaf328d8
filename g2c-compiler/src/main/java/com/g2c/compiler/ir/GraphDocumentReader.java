package com.g2c.compiler.ir;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads a graph document (nodes, edges, functions, imports) from JSON.
 * Shape problems beyond "is this a JSON object" are left to the validator.
 */
public class GraphDocumentReader {

    private static final Gson GSON = new Gson();

    /**
     * Reads and deserializes the document at {@code documentPath}.
     *
     * @throws DocumentReadException if the file is missing, empty or not valid JSON
     */
    public GraphModel.Graph read(Path documentPath) {
        if (!Files.isRegularFile(documentPath)) {
            throw new DocumentReadException("Graph document not found: " + documentPath);
        }
        try (Reader reader = Files.newBufferedReader(documentPath, StandardCharsets.UTF_8)) {
            return parse(reader, documentPath.toString());
        } catch (IOException e) {
            throw new DocumentReadException("Failed to read graph document: " + documentPath + ": " + e.getMessage(), e);
        }
    }

    /** Parses a document held in memory. */
    public GraphModel.Graph parse(String json) {
        return parse(new StringReader(json), "<string>");
    }

    private GraphModel.Graph parse(Reader reader, String origin) {
        GraphModel.Graph graph;
        try {
            graph = GSON.fromJson(reader, GraphModel.Graph.class);
        } catch (JsonParseException e) {
            throw new DocumentReadException("Graph document is not valid JSON: " + origin + ": " + e.getMessage(), e);
        }
        if (graph == null) {
            throw new DocumentReadException("Graph document is empty: " + origin);
        }
        return graph;
    }

    public static class DocumentReadException extends RuntimeException {
        public DocumentReadException(String message) { super(message); }
        public DocumentReadException(String message, Throwable cause) { super(message, cause); }
    }
}
