package org.optiscope.compiler.frontend.parser.ast;

import org.optiscope.compiler.model.SourceLocation;

import java.util.ArrayList;
import java.util.List;

public record Switch(Expression expression, List<Case> cases, SourceLocation location) implements Statement {

    public Switch {
        cases = List.copyOf(cases);
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>();
        children.add(expression);
        children.addAll(cases);
        return children;
    }
}
