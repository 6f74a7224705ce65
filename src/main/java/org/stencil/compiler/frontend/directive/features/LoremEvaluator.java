package org.stencil.compiler.frontend.directive.features;

import org.stencil.compiler.frontend.directive.DirectiveEntry;
import org.stencil.compiler.frontend.directive.Purity;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

/**
 * Folds {@code {% lorem [count] [w|p|b] %}} to placeholder text. The output never varies,
 * so the {@code random} keyword is rejected.
 */
public final class LoremEvaluator {

    static final String COMMON_PARAGRAPH = "Lorem ipsum dolor sit amet, consectetur adipisicing elit, "
            + "sed do eiusmod tempor incididunt ut labore et dolore magna aliqua. Ut enim ad minim veniam, "
            + "quis nostrud exercitation ullamco laboris nisi ut aliquip ex ea commodo consequat. "
            + "Duis aute irure dolor in reprehenderit in voluptate velit esse cillum dolore eu fugiat nulla pariatur. "
            + "Excepteur sint occaecat cupidatat non proident, sunt in culpa qui officia deserunt mollit anim id est laborum.";

    private static final List<String> COMMON_WORDS = Arrays.asList(
            "lorem", "ipsum", "dolor", "sit", "amet", "consectetur", "adipisicing", "elit", "sed", "do",
            "eiusmod", "tempor", "incididunt", "ut", "labore", "et", "dolore", "magna", "aliqua");

    private LoremEvaluator() {
    }

    /**
     * @return The registry entry of {@code lorem}.
     */
    public static DirectiveEntry entry() {
        return new DirectiveEntry("lorem", Purity.PURE, null, List.of(), 0, 3,
                Set.of("w", "p", "b", "random"), LoremEvaluator::evaluate);
    }

    static String evaluate(List<String> arguments) {
        int count = 1;
        String method = "b";
        for (String argument : arguments) {
            switch (argument) {
                case "w", "p", "b" -> method = argument;
                case "random" -> throw new IllegalArgumentException("lorem random cannot be evaluated at compile time");
                default -> {
                    count = Integer.parseInt(argument);
                    if (count < 0) {
                        throw new IllegalArgumentException("lorem count must not be negative: " + count);
                    }
                }
            }
        }
        if (method.equals("w")) {
            List<String> words = new ArrayList<>(count);
            for (int i = 0; i < count; i++) {
                words.add(COMMON_WORDS.get(i % COMMON_WORDS.size()));
            }
            return String.join(" ", words);
        }
        List<String> paragraphs = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            paragraphs.add(COMMON_PARAGRAPH);
        }
        if (method.equals("p")) {
            return paragraphs.stream().map(p -> "<p>" + p + "</p>").reduce("", String::concat);
        }
        return String.join("\n\n", paragraphs);
    }
}
