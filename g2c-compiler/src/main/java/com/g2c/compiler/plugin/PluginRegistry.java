package com.g2c.compiler.plugin;

import com.g2c.compiler.codegen.RuleRegistry;
import com.g2c.compiler.ir.NodeCatalog;
import com.g2c.compiler.ir.NodeRole;
import com.g2c.compiler.ir.NodeSignature;
import com.g2c.compiler.ir.PortSpec;
import com.g2c.compiler.ir.ValueType;
import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * External-function descriptors keyed by node type.
 *
 * <p>Descriptors are checked against a fixed schema on the raw JSON tree before they are bound.
 * A descriptor that fails the check, a file that cannot be read, and a node type that collides
 * with a built-in or an earlier plugin are skipped with a warning; the rest still load.
 */
public final class PluginRegistry {

    private static final Gson GSON = new Gson();
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Pattern QUALIFIED = Pattern.compile("(::)?[A-Za-z_][A-Za-z0-9_]*(::[A-Za-z_][A-Za-z0-9_]*)*");
    private static final Set<String> KINDS = Set.of("boundInput", "literalConstant");

    private final Map<String, PluginDescriptor> descriptors = new LinkedHashMap<>();
    private final List<String> warnings = new ArrayList<>();

    private PluginRegistry() {}

    public static PluginRegistry empty() {
        return new PluginRegistry();
    }

    /**
     * Loads every {@code *.json} file in {@code directory}, in file-name order. A missing
     * directory yields an empty registry.
     */
    public static PluginRegistry load(Path directory) {
        PluginRegistry registry = new PluginRegistry();
        if (!Files.isDirectory(directory)) {
            return registry;
        }
        List<Path> files;
        try (Stream<Path> listing = Files.list(directory)) {
            files = listing
                    .filter(p -> p.getFileName().toString().endsWith(".json"))
                    .sorted((a, b) -> a.getFileName().toString().compareTo(b.getFileName().toString()))
                    .collect(Collectors.toList());
        } catch (IOException e) {
            registry.warn("Could not list plugin directory " + directory + ": " + e.getMessage());
            return registry;
        }
        for (Path file : files) {
            String json;
            try {
                json = Files.readString(file, StandardCharsets.UTF_8);
            } catch (IOException e) {
                registry.warn("Skipping plugin " + file.getFileName() + ": " + e.getMessage());
                continue;
            }
            registry.add(file.getFileName().toString(), json);
        }
        return registry;
    }

    /**
     * Checks and registers one descriptor.
     *
     * @param origin file name or other label used in warnings
     * @return true if the descriptor was registered
     */
    public boolean add(String origin, String json) {
        JsonElement tree;
        try {
            tree = JsonParser.parseString(json);
        } catch (JsonParseException e) {
            warn("Skipping plugin " + origin + ": not valid JSON: " + e.getMessage());
            return false;
        }
        List<String> problems = checkSchema(tree);
        if (!problems.isEmpty()) {
            warn("Skipping plugin " + origin + ": " + String.join("; ", problems));
            return false;
        }
        PluginDescriptor descriptor = GSON.fromJson(tree, PluginDescriptor.class);
        if (NodeCatalog.builtIns().contains(descriptor.nodeType)) {
            warn("Skipping plugin " + origin + ": node type " + descriptor.nodeType + " is built in");
            return false;
        }
        if (descriptors.containsKey(descriptor.nodeType)) {
            warn("Skipping plugin " + origin + ": node type " + descriptor.nodeType + " is already registered");
            return false;
        }
        descriptors.put(descriptor.nodeType, descriptor);
        return true;
    }

    static List<String> checkSchema(JsonElement tree) {
        List<String> problems = new ArrayList<>();
        if (tree == null || !tree.isJsonObject()) {
            problems.add("descriptor must be a JSON object");
            return problems;
        }
        JsonObject root = tree.getAsJsonObject();
        String nodeType = string(root, "nodeType", true, problems);
        if (nodeType != null && nodeType.isBlank()) problems.add("nodeType must not be blank");
        String symbol = string(root, "externalSymbol", true, problems);
        if (symbol != null && !QUALIFIED.matcher(symbol).matches()) {
            problems.add("externalSymbol '" + symbol + "' is not a C++ name");
        }
        string(root, "requiredDeclaration", false, problems);
        String returnType = string(root, "returnType", false, problems);
        if (returnType != null && ValueType.parse(returnType) != null
                && ValueType.parse(returnType).kind() == ValueType.Kind.ANY) {
            problems.add("returnType must be a concrete type");
        }

        JsonElement params = root.get("parameters");
        if (params != null && !params.isJsonNull()) {
            if (!params.isJsonArray()) {
                problems.add("parameters must be an array");
                return problems;
            }
            JsonArray array = params.getAsJsonArray();
            Set<String> names = new HashSet<>();
            for (int i = 0; i < array.size(); i++) {
                checkParameter(array.get(i), i, names, problems);
            }
        }
        return problems;
    }

    private static void checkParameter(JsonElement element, int index, Set<String> names, List<String> problems) {
        String where = "parameters[" + index + "]";
        if (!element.isJsonObject()) {
            problems.add(where + " must be an object");
            return;
        }
        JsonObject param = element.getAsJsonObject();
        List<String> own = new ArrayList<>();
        String name = string(param, "name", true, own);
        String kind = string(param, "kind", true, own);
        string(param, "type", false, own);
        for (String p : own) problems.add(where + ": " + p);

        if (name != null && !IDENTIFIER.matcher(name).matches()) {
            problems.add(where + ": name '" + name + "' is not an identifier");
        } else if (name != null && !names.add(name)) {
            problems.add(where + ": duplicate parameter name '" + name + "'");
        }
        if (kind != null && !KINDS.contains(kind)) {
            problems.add(where + ": kind must be boundInput or literalConstant, not '" + kind + "'");
        }
        JsonElement value = param.get("value");
        if (value != null && !value.isJsonNull() && !value.isJsonPrimitive()) {
            problems.add(where + ": value must be a number, string or boolean");
        }
        if ("literalConstant".equals(kind) && (value == null || value.isJsonNull())) {
            problems.add(where + ": literalConstant needs a default value");
        }
    }

    private static String string(JsonObject obj, String key, boolean required, List<String> problems) {
        JsonElement e = obj.get(key);
        if (e == null || e.isJsonNull()) {
            if (required) problems.add("missing required field " + key);
            return null;
        }
        if (!e.isJsonPrimitive() || !e.getAsJsonPrimitive().isString()) {
            problems.add(key + " must be a string");
            return null;
        }
        return e.getAsString();
    }

    private void warn(String message) {
        warnings.add(message);
        System.err.println("[g2c] WARNING: " + message);
    }

    // --- registration ---

    /** Node signature of a descriptor: bound inputs in order, {@code out} when a return type is declared. */
    static NodeSignature signatureOf(PluginDescriptor d) {
        List<PortSpec> inputs = new ArrayList<>();
        for (PluginDescriptor.ParameterSpec p : d.getParameters()) {
            if (p.isBoundInput()) inputs.add(PortSpec.of(p.name, ValueType.parse(p.type)));
        }
        ValueType returns = ValueType.parse(d.returnType);
        List<PortSpec> outputs = returns == null || returns.equals(ValueType.VOID)
                ? List.of()
                : List.of(PortSpec.of("out", returns));
        return new NodeSignature(d.nodeType, NodeRole.EFFECT, inputs, outputs, false);
    }

    /** {@code base} plus one signature per registered descriptor. */
    public NodeCatalog extend(NodeCatalog base) {
        NodeCatalog catalog = base;
        for (PluginDescriptor d : descriptors.values()) {
            catalog = catalog.with(signatureOf(d));
        }
        return catalog;
    }

    /** Registers one call rule per descriptor. */
    public void registerRules(RuleRegistry rules) {
        for (PluginDescriptor d : descriptors.values()) {
            rules.register(d.nodeType, new PluginCallRule(d));
        }
    }

    public Optional<PluginDescriptor> get(String nodeType) {
        return Optional.ofNullable(descriptors.get(nodeType));
    }

    public List<PluginDescriptor> descriptors() {
        return Collections.unmodifiableList(new ArrayList<>(descriptors.values()));
    }

    public List<String> warnings() {
        return Collections.unmodifiableList(warnings);
    }

    public int size() {
        return descriptors.size();
    }
}
