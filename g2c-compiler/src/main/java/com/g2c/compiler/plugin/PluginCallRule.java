package com.g2c.compiler.plugin;

import com.g2c.compiler.codegen.CodeGenerator;
import com.g2c.compiler.codegen.CppSyntax;
import com.g2c.compiler.codegen.EmitContext;
import com.g2c.compiler.codegen.NodeRule;
import com.g2c.compiler.ir.GraphModel;
import com.g2c.compiler.ir.ValueType;
import com.google.gson.JsonElement;

/**
 * Calls a plugin's external symbol. Bound inputs resolve like any built-in input; literal
 * constants take the node's parameter of the same name, else the descriptor's value.
 */
final class PluginCallRule implements NodeRule {

    private final PluginDescriptor descriptor;

    PluginCallRule(PluginDescriptor descriptor) {
        this.descriptor = descriptor;
    }

    @Override
    public void emit(GraphModel.Node node, EmitContext ctx) {
        ctx.declarations().require(descriptor.requiredDeclaration);

        ValueType returns = ValueType.parse(descriptor.returnType);
        EmitContext.Line line = returns != null && !returns.equals(ValueType.VOID)
                ? ctx.declare(node, "out")
                : ctx.line();
        line.text(descriptor.externalSymbol + "(");
        boolean first = true;
        for (PluginDescriptor.ParameterSpec p : descriptor.getParameters()) {
            if (!first) line.text(", ");
            first = false;
            if (p.isBoundInput()) {
                line.input(node, p.name);
            } else {
                line.text(constant(node, p, ctx));
            }
        }
        line.text(");").end();
    }

    private String constant(GraphModel.Node node, PluginDescriptor.ParameterSpec p, EmitContext ctx) {
        JsonElement value = node.hasParameter(p.name) ? node.parameter(p.name) : p.value;
        try {
            return CppSyntax.literal(value, ValueType.parse(p.type));
        } catch (IllegalArgumentException e) {
            throw new CodeGenerator.GenerationException(ctx.scope().messagePrefix() + "Constant " + p.name
                    + " of node " + node.id + " is not a scalar", e);
        }
    }
}
