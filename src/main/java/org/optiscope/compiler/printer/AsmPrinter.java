package org.optiscope.compiler.printer;

import org.optiscope.compiler.frontend.parser.ast.Assignment;
import org.optiscope.compiler.frontend.parser.ast.Block;
import org.optiscope.compiler.frontend.parser.ast.Break;
import org.optiscope.compiler.frontend.parser.ast.Case;
import org.optiscope.compiler.frontend.parser.ast.Continue;
import org.optiscope.compiler.frontend.parser.ast.Expression;
import org.optiscope.compiler.frontend.parser.ast.ExpressionStatement;
import org.optiscope.compiler.frontend.parser.ast.ForLoop;
import org.optiscope.compiler.frontend.parser.ast.FunctionCall;
import org.optiscope.compiler.frontend.parser.ast.FunctionDefinition;
import org.optiscope.compiler.frontend.parser.ast.Identifier;
import org.optiscope.compiler.frontend.parser.ast.If;
import org.optiscope.compiler.frontend.parser.ast.Leave;
import org.optiscope.compiler.frontend.parser.ast.Literal;
import org.optiscope.compiler.frontend.parser.ast.Statement;
import org.optiscope.compiler.frontend.parser.ast.Switch;
import org.optiscope.compiler.frontend.parser.ast.TypedName;
import org.optiscope.compiler.frontend.parser.ast.VariableDeclaration;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders a code block back to source text.
 * <p>
 * Blocks whose content fits on one short line are printed inline ({@code { let x := 1 }}),
 * all others with one statement per line and four spaces of indentation per level.
 * Empty blocks are printed as {@code { }}.
 */
public class AsmPrinter {

    private static final String INDENT = "    ";
    private static final int INLINE_LIMIT = 30;

    public String print(Block block) {
        if (block.isEmpty()) {
            return "{ }";
        }
        String body = block.statements().stream().map(this::print).collect(Collectors.joining("\n"));
        if (body.length() < INLINE_LIMIT && body.indexOf('\n') < 0) {
            return "{ " + body + " }";
        }
        return "{\n" + INDENT + body.replace("\n", "\n" + INDENT) + "\n}";
    }

    public String print(Statement statement) {
        if (statement instanceof Block block) {
            return print(block);
        }
        if (statement instanceof ExpressionStatement expressionStatement) {
            return print(expressionStatement.expression());
        }
        if (statement instanceof VariableDeclaration declaration) {
            String out = "let " + declaration.variables().stream().map(TypedName::name).collect(Collectors.joining(", "));
            return declaration.value() == null ? out : out + " := " + print(declaration.value());
        }
        if (statement instanceof Assignment assignment) {
            return assignment.variableNames().stream().map(Identifier::name).collect(Collectors.joining(", "))
                    + " := " + print(assignment.value());
        }
        if (statement instanceof If ifStatement) {
            String body = print(ifStatement.body());
            char delimiter = body.indexOf('\n') < 0 ? ' ' : '\n';
            return "if " + print(ifStatement.condition()) + delimiter + body;
        }
        if (statement instanceof Switch switchStatement) {
            StringBuilder out = new StringBuilder("switch ").append(print(switchStatement.expression()));
            for (Case switchCase : switchStatement.cases()) {
                out.append('\n');
                out.append(switchCase.isDefault() ? "default " : "case " + print(switchCase.value()) + " ");
                out.append(print(switchCase.body()));
            }
            return out.toString();
        }
        if (statement instanceof ForLoop loop) {
            String pre = print(loop.pre());
            String condition = print(loop.condition());
            String post = print(loop.post());
            String body = print(loop.body());
            boolean multiline = pre.indexOf('\n') >= 0 || post.indexOf('\n') >= 0 || body.indexOf('\n') >= 0;
            String delimiter = multiline ? "\n" : " ";
            return "for " + pre + delimiter + condition + delimiter + post + delimiter + body;
        }
        if (statement instanceof FunctionDefinition function) {
            StringBuilder out = new StringBuilder("function ").append(function.name()).append('(');
            out.append(joinNames(function.parameters())).append(')');
            if (!function.returnVariables().isEmpty()) {
                out.append(" -> ").append(joinNames(function.returnVariables()));
            }
            return out.append('\n').append(print(function.body())).toString();
        }
        if (statement instanceof Break) return "break";
        if (statement instanceof Continue) return "continue";
        if (statement instanceof Leave) return "leave";
        throw new IllegalArgumentException("Cannot print statement " + statement.getClass().getSimpleName());
    }

    public String print(Expression expression) {
        if (expression instanceof Identifier identifier) {
            return identifier.name();
        }
        if (expression instanceof Literal literal) {
            return switch (literal.kind()) {
                case NUMBER, BOOLEAN -> literal.value();
                case STRING -> "\"" + escape(literal.value()) + "\"";
            };
        }
        if (expression instanceof FunctionCall call) {
            return call.functionName().name() + "("
                    + call.arguments().stream().map(this::print).collect(Collectors.joining(", ")) + ")";
        }
        throw new IllegalArgumentException("Cannot print expression " + expression.getClass().getSimpleName());
    }

    private static String joinNames(List<TypedName> names) {
        return names.stream().map(TypedName::name).collect(Collectors.joining(", "));
    }

    static String escape(String text) {
        StringBuilder out = new StringBuilder();
        for (char c : text.toCharArray()) {
            switch (c) {
                case '\\' -> out.append("\\\\");
                case '"' -> out.append("\\\"");
                case '\n' -> out.append("\\n");
                case '\r' -> out.append("\\r");
                case '\t' -> out.append("\\t");
                default -> {
                    if (c < 0x20 || c > 0x7e) {
                        out.append(String.format("\\x%02x", (int) c & 0xff));
                    } else {
                        out.append(c);
                    }
                }
            }
        }
        return out.toString();
    }
}
