package org.elnamic.runtime.exec.evaluators;

import org.elnamic.compiler.frontend.lexer.Token;
import org.elnamic.compiler.frontend.parser.features.decl.VariableDeclarationNode;
import org.elnamic.runtime.exec.ExecutionContext;
import org.elnamic.runtime.exec.INodeEvaluator;
import org.elnamic.runtime.model.TypeName;
import org.elnamic.runtime.model.UnitValue;
import org.elnamic.runtime.model.Value;

/**
 * Binds every declared name in the current scope to the initializer's value, which is
 * evaluated once. Without an initializer names start out as unit.
 */
public final class VariableDeclarationEvaluator implements INodeEvaluator<VariableDeclarationNode> {

    @Override
    public Value evaluate(VariableDeclarationNode node, ExecutionContext ctx) {
        Value value = node.initializer() != null ? ctx.evaluate(node.initializer()) : UnitValue.INSTANCE;
        TypeName type = node.type() != null ? node.type().type() : null;
        for (Token name : node.names()) {
            ctx.environment().define(name.text(), value, type, node.isConstant(), name.sourceInfo());
        }
        return UnitValue.INSTANCE;
    }
}
