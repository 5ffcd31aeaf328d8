package com.g2c.compiler.plugin;

import com.google.gson.JsonElement;
import com.google.gson.annotations.SerializedName;

import java.util.Collections;
import java.util.List;

/**
 * One external C++ function exposed as a node type. Deserialized only after the raw JSON
 * passed {@link PluginRegistry}'s schema check.
 */
public class PluginDescriptor {

    @SerializedName("nodeType")            public String nodeType;
    @SerializedName("externalSymbol")      public String externalSymbol;
    @SerializedName("requiredDeclaration") public String requiredDeclaration;  // nullable
    @SerializedName("parameters")          public List<ParameterSpec> parameters;
    @SerializedName("returnType")          public String returnType;           // nullable: void

    public List<ParameterSpec> getParameters() {
        return parameters != null ? parameters : Collections.emptyList();
    }

    public enum ParameterKind {
        @SerializedName("boundInput") BOUND_INPUT,
        @SerializedName("literalConstant") LITERAL_CONSTANT
    }

    public static class ParameterSpec {
        @SerializedName("name")  public String name;
        @SerializedName("kind")  public ParameterKind kind;
        @SerializedName("type")  public String type;    // nullable
        @SerializedName("value") public JsonElement value;  // default for literal constants

        public boolean isBoundInput() {
            return kind == ParameterKind.BOUND_INPUT;
        }
    }
}
