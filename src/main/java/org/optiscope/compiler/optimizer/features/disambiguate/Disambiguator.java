package org.optiscope.compiler.optimizer.features.disambiguate;

import org.optiscope.compiler.frontend.parser.ast.Block;
import org.optiscope.compiler.frontend.parser.ast.FunctionDefinition;
import org.optiscope.compiler.frontend.parser.ast.Identifier;
import org.optiscope.compiler.frontend.parser.ast.TypedName;
import org.optiscope.compiler.frontend.semantics.AnalysisInfo;
import org.optiscope.compiler.frontend.semantics.Symbol;
import org.optiscope.compiler.optimizer.AstTransformer;
import org.optiscope.compiler.optimizer.NameDispenser;

import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Renames declarations so that no two declarations share a name. Declarations are matched to
 * their references through the analysis info of the code, so the info must be fresh.
 * <p>
 * The dispenser decides the new names. When one dispenser is shared across several code blocks
 * the names become unique across all of them; the first declaration of a name keeps it.
 */
public class Disambiguator {

    private final NameDispenser names;

    public Disambiguator(NameDispenser names) {
        this.names = names;
    }

    /**
     * @param code The code to rename.
     * @param info The analysis info computed for exactly this code instance.
     * @return The renamed code.
     */
    public Block run(Block code, AnalysisInfo info) {
        Map<Symbol, String> renamed = new IdentityHashMap<>();
        return new AstTransformer() {
            @Override
            protected TypedName transformName(TypedName name) {
                return new TypedName(nameFor(info.declaredSymbol(name), name.name()), name.location());
            }

            @Override
            protected String transformFunctionName(FunctionDefinition function) {
                return nameFor(info.declaredSymbol(function), function.name());
            }

            @Override
            protected Identifier transformIdentifier(Identifier identifier) {
                return new Identifier(nameFor(info.referencedSymbol(identifier), identifier.name()),
                        identifier.location());
            }

            @Override
            protected Identifier transformCallee(Identifier callee) {
                return transformIdentifier(callee);
            }

            private String nameFor(Optional<Symbol> symbol, String original) {
                return symbol.map(s -> renamed.computeIfAbsent(s, key -> names.newName(key.name()))).orElse(original);
            }
        }.transformBlock(code);
    }
}
