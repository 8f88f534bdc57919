package org.optiscope.compiler.optimizer.features.cleanup;

import org.optiscope.compiler.dialect.Dialect;
import org.optiscope.compiler.frontend.parser.ast.Block;
import org.optiscope.compiler.frontend.parser.ast.FunctionDefinition;
import org.optiscope.compiler.frontend.parser.ast.Identifier;
import org.optiscope.compiler.frontend.parser.ast.Statement;
import org.optiscope.compiler.frontend.parser.ast.TypedName;
import org.optiscope.compiler.optimizer.AstScanner;
import org.optiscope.compiler.optimizer.AstTransformer;
import org.optiscope.compiler.optimizer.StepContext;

import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Gives variables short readable names again after other steps introduced suffixed ones.
 * <p>
 * Every function body is a region of its own, the code outside of functions is another. Inside a
 * region a numeric {@code _N} suffix is stripped and the shortest free spelling is chosen; names of
 * functions, builtins, keywords, reserved identifiers and of enclosing regions are never chosen.
 * Variables in different functions may end up with the same name, so the result is in general no
 * longer disambiguated.
 */
public class VarNameCleaner {

    private static final Pattern NUMERIC_SUFFIX = Pattern.compile("^(.+?)(_[0-9]+)+$");

    public Block run(StepContext context, Block code) {
        Set<String> functionNames = new HashSet<>();
        new AstScanner() {
            @Override
            protected void visitFunction(FunctionDefinition function) {
                functionNames.add(function.name());
            }
        }.scan(code);
        return new Region(context, functionNames, Set.of()).clean(code);
    }

    static String stripSuffix(String name) {
        Matcher matcher = NUMERIC_SUFFIX.matcher(name);
        return matcher.matches() ? matcher.group(1) : name;
    }

    /**
     * Renaming of one function body or of the code outside of all functions.
     */
    private static final class Region extends AstTransformer {

        private final StepContext context;
        private final Set<String> functionNames;
        private final Set<String> outerNames;
        private final Map<String, String> renamed = new HashMap<>();
        private final Set<String> taken = new LinkedHashSet<>();

        Region(StepContext context, Set<String> functionNames, Set<String> outerNames) {
            this.context = context;
            this.functionNames = functionNames;
            this.outerNames = outerNames;
        }

        Block clean(Block block) {
            return transformBlock(block);
        }

        @Override
        protected Statement transformFunction(FunctionDefinition function) {
            Set<String> visible = new HashSet<>(outerNames);
            // only names declared before the definition can clash with names inside it
            visible.addAll(taken);
            Region inner = new Region(context, functionNames, visible);
            List<TypedName> parameters = inner.transformNames(function.parameters());
            List<TypedName> returns = inner.transformNames(function.returnVariables());
            return new FunctionDefinition(function.name(), parameters, returns, inner.clean(function.body()),
                    function.location());
        }

        @Override
        protected TypedName transformName(TypedName name) {
            return new TypedName(cleanName(name.name()), name.location());
        }

        @Override
        protected Identifier transformIdentifier(Identifier identifier) {
            return new Identifier(renamed.getOrDefault(identifier.name(), identifier.name()), identifier.location());
        }

        private String cleanName(String original) {
            String existing = renamed.get(original);
            if (existing != null) {
                return existing;
            }
            String base = stripSuffix(original);
            String candidate = base;
            for (int i = 1; isTaken(candidate); i++) {
                candidate = base + "_" + i;
            }
            taken.add(candidate);
            renamed.put(original, candidate);
            return candidate;
        }

        private boolean isTaken(String name) {
            Dialect dialect = context.dialect();
            return taken.contains(name) || outerNames.contains(name) || functionNames.contains(name)
                    || context.reservedIdentifiers().contains(name)
                    || dialect.isBuiltin(name) || dialect.isKeyword(name);
        }
    }
}
