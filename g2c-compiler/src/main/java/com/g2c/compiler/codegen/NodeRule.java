package com.g2c.compiler.codegen;

import com.g2c.compiler.ir.GraphModel;

/**
 * Generation rule for one node type. A rule writes the node's statements through the context,
 * resolving its inputs through the scope's symbol table and binding its outputs there.
 */
@FunctionalInterface
public interface NodeRule {

    void emit(GraphModel.Node node, EmitContext ctx);
}
