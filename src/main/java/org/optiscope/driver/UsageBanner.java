package org.optiscope.driver;

import org.optiscope.compiler.optimizer.StepDescriptor;
import org.optiscope.compiler.optimizer.StepRegistry;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Renders the menu of step codes and control codes, sorted by name ignoring case (lower-cased code
 * as tie-break) and laid out column by column.
 */
public final class UsageBanner {

    private record Option(char key, String name) {
    }

    private UsageBanner() {}

    /**
     * @param registry      The registered steps.
     * @param controlCodes  The control codes with their names.
     * @param columns       The number of columns, at least 1.
     * @return The menu, one line per row, each line terminated by a newline.
     * @throws InvariantViolationException if a control code is also a step code.
     */
    public static String render(StepRegistry registry, Map<Character, String> controlCodes, int columns) {
        if (columns < 1) {
            throw new IllegalArgumentException("columns must be positive");
        }
        List<String> overlapping = new ArrayList<>();
        for (char key : controlCodes.keySet()) {
            if (registry.contains(key)) {
                overlapping.add(String.valueOf(key));
            }
        }
        if (!overlapping.isEmpty()) {
            throw new InvariantViolationException("Control codes conflict with the step codes "
                    + String.join(", ", overlapping) + ".");
        }

        List<Option> options = new ArrayList<>();
        for (StepDescriptor step : registry.getSteps()) {
            options.add(new Option(step.abbreviation(), step.name()));
        }
        controlCodes.forEach((key, name) -> options.add(new Option(key, name)));
        options.sort(Comparator.comparing(Option::name, String.CASE_INSENSITIVE_ORDER)
                .thenComparingInt(o -> Character.toLowerCase(o.key())));

        int width = options.stream().mapToInt(o -> o.name().length()).max().orElse(0);
        int rows = options.isEmpty() ? 0 : (options.size() - 1) / columns + 1;
        StringBuilder out = new StringBuilder();
        for (int row = 0; row < rows; row++) {
            for (int i = row; i < options.size(); i += rows) {
                Option option = options.get(i);
                out.append(option.key()).append(": ");
                out.append(String.format("%-" + width + "s", option.name())).append(' ');
            }
            out.append('\n');
        }
        return out.toString();
    }
}
