package org.optiscope.compiler.optimizer.features.stack;

import org.optiscope.compiler.dialect.Dialect;
import org.optiscope.compiler.frontend.parser.ast.Block;
import org.optiscope.compiler.frontend.parser.ast.Case;
import org.optiscope.compiler.frontend.parser.ast.Expression;
import org.optiscope.compiler.frontend.parser.ast.ForLoop;
import org.optiscope.compiler.frontend.parser.ast.FunctionCall;
import org.optiscope.compiler.frontend.parser.ast.FunctionDefinition;
import org.optiscope.compiler.frontend.parser.ast.Identifier;
import org.optiscope.compiler.frontend.parser.ast.If;
import org.optiscope.compiler.frontend.parser.ast.Literal;
import org.optiscope.compiler.frontend.parser.ast.Statement;
import org.optiscope.compiler.frontend.parser.ast.Switch;
import org.optiscope.compiler.frontend.parser.ast.VariableDeclaration;
import org.optiscope.compiler.optimizer.AstCopier;
import org.optiscope.compiler.optimizer.AstTransformer;
import org.optiscope.compiler.optimizer.ReferenceCounter;
import org.optiscope.compiler.optimizer.SideEffects;
import org.optiscope.compiler.optimizer.StepContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Reduces the number of simultaneously live variables in regions whose estimated stack height
 * exceeds the limit. Each round rematerialises one cheap variable per offending region: a
 * variable that is never reassigned and bound to a literal or to a movable builtin call on
 * literals. Its references are replaced by copies of the value and its declaration is dropped.
 * <p>
 * Compression never fails. If no candidate is left or the round limit is reached, the best code
 * found so far is returned. The step relies on unique names.
 */
public class StackCompressor {

    private static final Logger log = LoggerFactory.getLogger(StackCompressor.class);

    /**
     * @param code       The compressed code.
     * @param limitMet   True if every region is within the stack limit.
     * @param iterations The number of rounds that changed the code.
     */
    public record Result(Block code, boolean limitMet, int iterations) {
    }

    public Result run(StepContext context, Block code) {
        int limit = context.settings().stackLimit();
        int maxIterations = context.settings().stackCompressorMaxIterations();
        Block current = code;
        for (int iteration = 0; ; iteration++) {
            Set<String> overLimit = StackHeightEstimator.estimate(current).entrySet().stream()
                    .filter(e -> e.getValue() > limit)
                    .map(Map.Entry::getKey)
                    .collect(Collectors.toSet());
            if (overLimit.isEmpty()) {
                return new Result(current, true, iteration);
            }
            if (iteration == maxIterations) {
                log.warn("Stack compression stopped after {} rounds, regions {} still exceed {} variables",
                        iteration, overLimit, limit);
                return new Result(current, false, iteration);
            }
            Map<String, Expression> candidates = new CandidateFinder(context.dialect(), ReferenceCounter.count(current),
                    overLimit).find(current);
            if (candidates.isEmpty()) {
                log.warn("Stack compression found nothing to rematerialise, regions {} still exceed {} variables",
                        overLimit, limit);
                return new Result(current, false, iteration);
            }
            log.debug("Stack compression round {}: rematerialising {}", iteration + 1, candidates.keySet());
            current = rematerialise(current, candidates);
        }
    }

    private static Block rematerialise(Block code, Map<String, Expression> values) {
        return new AstTransformer() {
            @Override
            protected List<Statement> transformStatement(Statement statement) {
                if (statement instanceof VariableDeclaration declaration && declaration.variables().size() == 1
                        && values.containsKey(declaration.variables().get(0).name())) {
                    return List.of();
                }
                return super.transformStatement(statement);
            }

            @Override
            protected Expression transformIdentifierExpression(Identifier identifier) {
                Expression value = values.get(identifier.name());
                return value == null ? super.transformIdentifierExpression(identifier) : AstCopier.copy(value);
            }
        }.transformBlock(code);
    }

    /**
     * Picks the first cheap variable of every region over the limit.
     */
    private static final class CandidateFinder {

        private final Dialect dialect;
        private final ReferenceCounter references;
        private final Set<String> regions;
        private final Map<String, Expression> candidates = new HashMap<>();
        private final Set<String> regionsDone = new HashSet<>();

        CandidateFinder(Dialect dialect, ReferenceCounter references, Set<String> regions) {
            this.dialect = dialect;
            this.references = references;
            this.regions = regions;
        }

        Map<String, Expression> find(Block code) {
            block(code, StackHeightEstimator.TOP_LEVEL);
            return candidates;
        }

        private void block(Block block, String region) {
            for (Statement statement : block.statements()) {
                statement(statement, region);
            }
        }

        private void statement(Statement statement, String region) {
            if (statement instanceof VariableDeclaration declaration) {
                if (regions.contains(region) && !regionsDone.contains(region) && isCandidate(declaration)) {
                    candidates.put(declaration.variables().get(0).name(), declaration.value());
                    regionsDone.add(region);
                }
            } else if (statement instanceof Block nested) {
                block(nested, region);
            } else if (statement instanceof If ifStatement) {
                block(ifStatement.body(), region);
            } else if (statement instanceof Switch switchStatement) {
                for (Case switchCase : switchStatement.cases()) {
                    block(switchCase.body(), region);
                }
            } else if (statement instanceof ForLoop loop) {
                block(loop.pre(), region);
                block(loop.post(), region);
                block(loop.body(), region);
            } else if (statement instanceof FunctionDefinition function) {
                block(function.body(), function.name());
            }
        }

        private boolean isCandidate(VariableDeclaration declaration) {
            return declaration.variables().size() == 1
                    && declaration.value() != null
                    && !references.isAssigned(declaration.variables().get(0).name())
                    && isCheap(declaration.value());
        }

        private boolean isCheap(Expression value) {
            if (value instanceof Literal) {
                return true;
            }
            if (value instanceof FunctionCall call && SideEffects.isMovable(call, dialect)) {
                return call.arguments().stream().allMatch(this::isCheap);
            }
            return false;
        }
    }
}
