package org.optiscope.driver;

import org.optiscope.compiler.frontend.parser.ast.Block;
import org.optiscope.compiler.optimizer.StepContext;
import org.optiscope.compiler.optimizer.StepDescriptor;
import org.optiscope.compiler.optimizer.StepRegistry;
import org.optiscope.compiler.printer.AsmPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A validated sequence of step codes such as {@code "dhfo[xsu]"}. Whitespace is ignored; a
 * bracketed part is repeated until the code stops changing, at most
 * {@code sequence.max-rounds} times. Brackets cannot be nested.
 */
public final class StepSequence {

    private static final Logger log = LoggerFactory.getLogger(StepSequence.class);

    /**
     * @param steps    The steps of this part, in order.
     * @param repeated True for a bracketed part.
     */
    public record Element(List<StepDescriptor> steps, boolean repeated) {
        public Element {
            steps = List.copyOf(steps);
        }
    }

    private final String text;
    private final List<Element> elements;

    private StepSequence(String text, List<Element> elements) {
        this.text = text;
        this.elements = elements;
    }

    /**
     * Parses and validates the whole sequence.
     * @param text     The sequence text.
     * @param registry The registry resolving the codes.
     * @return The sequence.
     * @throws UnknownStepException   for a code that is not registered.
     * @throws ConfigurationException for unbalanced, nested or empty brackets.
     */
    public static StepSequence parse(String text, StepRegistry registry) {
        List<Element> elements = new ArrayList<>();
        List<StepDescriptor> group = null;
        for (char c : text.toCharArray()) {
            if (Character.isWhitespace(c)) {
                continue;
            }
            if (c == '[') {
                if (group != null) {
                    throw new ConfigurationException("Nested brackets are not supported in step sequence '" + text + "'.");
                }
                group = new ArrayList<>();
            } else if (c == ']') {
                if (group == null) {
                    throw new ConfigurationException("Unbalanced ']' in step sequence '" + text + "'.");
                }
                if (group.isEmpty()) {
                    throw new ConfigurationException("Empty brackets in step sequence '" + text + "'.");
                }
                elements.add(new Element(group, true));
                group = null;
            } else {
                StepDescriptor step = registry.resolve(c).orElseThrow(() -> new UnknownStepException(c));
                if (group != null) {
                    group.add(step);
                } else {
                    elements.add(new Element(List.of(step), false));
                }
            }
        }
        if (group != null) {
            throw new ConfigurationException("Unbalanced '[' in step sequence '" + text + "'.");
        }
        return new StepSequence(text, Collections.unmodifiableList(elements));
    }

    public List<Element> getElements() {
        return elements;
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    public boolean requiresDisambiguation() {
        return elements.stream().flatMap(e -> e.steps().stream()).anyMatch(StepDescriptor::requiresDisambiguation);
    }

    /**
     * Applies the sequence to one code block.
     */
    public Block apply(StepContext context, Block code) {
        Block current = code;
        for (Element element : elements) {
            if (!element.repeated()) {
                current = runSteps(element.steps(), context, current);
                continue;
            }
            AsmPrinter printer = new AsmPrinter();
            int maxRounds = context.settings().maxRounds();
            for (int round = 1; round <= maxRounds; round++) {
                String before = printer.print(current);
                current = runSteps(element.steps(), context, current);
                if (printer.print(current).equals(before)) {
                    log.debug("Repetition {} reached a fixed point after {} round(s)", describe(element), round);
                    break;
                }
                if (round == maxRounds) {
                    log.debug("Repetition {} stopped after {} rounds without reaching a fixed point",
                            describe(element), maxRounds);
                }
            }
        }
        return current;
    }

    private static Block runSteps(List<StepDescriptor> steps, StepContext context, Block code) {
        Block current = code;
        for (StepDescriptor step : steps) {
            current = step.step().run(context, current);
        }
        return current;
    }

    private static String describe(Element element) {
        StringBuilder sb = new StringBuilder("[");
        element.steps().forEach(s -> sb.append(s.abbreviation()));
        return sb.append(']').toString();
    }

    @Override
    public String toString() {
        return text;
    }
}
