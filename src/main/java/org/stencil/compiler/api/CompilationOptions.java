package org.stencil.compiler.api;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The resolved option set of a compilation unit. Immutable; every modification returns a new
 * instance. Two option sets are equal when they enable the same flags and debug mode.
 *
 * @param flags The enabled flags.
 * @param debug Whether the code generator emits debug markers.
 */
public record CompilationOptions(Set<OptionFlag> flags, boolean debug) {

    public CompilationOptions {
        EnumSet<OptionFlag> copy = EnumSet.noneOf(OptionFlag.class);
        copy.addAll(flags);
        flags = Collections.unmodifiableSet(copy);
    }

    /**
     * @return An option set with no flags enabled.
     */
    public static CompilationOptions none() {
        return new CompilationOptions(Set.of(), false);
    }

    /**
     * Creates an option set from flags.
     * @param flags The flags to enable.
     * @return The option set.
     */
    public static CompilationOptions of(OptionFlag... flags) {
        return new CompilationOptions(Set.of(flags), false);
    }

    /**
     * @param flag The flag to test.
     * @return {@code true} if the flag is enabled.
     */
    public boolean has(OptionFlag flag) {
        return flags.contains(flag);
    }

    /**
     * @param debug The new debug setting.
     * @return A copy with the given debug setting.
     */
    public CompilationOptions withDebug(boolean debug) {
        return new CompilationOptions(flags, debug);
    }

    /**
     * Applies flag directives in order. {@code name} enables a flag, {@code no-name} disables it.
     * Later directives win over earlier ones.
     *
     * @param directives The flag names to apply.
     * @param onUnknown Produces the exception for an unknown name.
     * @param <X> The exception type.
     * @return The modified option set.
     * @throws X if a name is not a known flag.
     */
    public <X extends Exception> CompilationOptions apply(Collection<String> directives,
                                                          Function<String, X> onUnknown) throws X {
        EnumSet<OptionFlag> result = EnumSet.noneOf(OptionFlag.class);
        result.addAll(flags);
        for (String directive : directives) {
            boolean remove = directive.startsWith("no-");
            String name = remove ? directive.substring(3) : directive;
            Optional<OptionFlag> flag = OptionFlag.fromConfigName(name);
            if (flag.isEmpty()) {
                throw onUnknown.apply(directive);
            }
            if (remove) {
                result.remove(flag.get());
            } else {
                result.add(flag.get());
            }
        }
        return new CompilationOptions(result, debug);
    }

    /**
     * Applies flag directives, rejecting unknown names with an {@link IllegalArgumentException}.
     * @param directives The flag names to apply.
     * @return The modified option set.
     */
    public CompilationOptions apply(Collection<String> directives) {
        return apply(directives, name -> new IllegalArgumentException("Unknown option flag: " + name));
    }

    @Override
    public String toString() {
        String names = flags.stream()
                .map(OptionFlag::configName)
                .collect(Collectors.joining(","));
        return "[" + names + (debug ? ";debug" : "") + "]";
    }
}
