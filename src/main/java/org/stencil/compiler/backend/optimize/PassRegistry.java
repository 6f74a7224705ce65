package org.stencil.compiler.backend.optimize;

import org.stencil.compiler.backend.optimize.features.ConstantFoldingPass;
import org.stencil.compiler.backend.optimize.features.HtmlValidationPass;
import org.stencil.compiler.backend.optimize.features.ScriptStyleMergePass;
import org.stencil.compiler.backend.optimize.features.WhitespaceCompressionPass;

import java.util.ArrayList;
import java.util.List;

/**
 * Registry for optimization passes applied in order.
 */
public final class PassRegistry {

    private final List<IOptimizationPass> passes = new ArrayList<>();

    /**
     * Registers a new pass after the ones already registered.
     * @param pass The pass to register.
     */
    public void register(IOptimizationPass pass) { passes.add(pass); }

    /**
     * @return The registered passes in application order.
     */
    public List<IOptimizationPass> passes() { return List.copyOf(passes); }

    /**
     * Initializes a new pass registry with the default passes.
     * @return A new registry with default passes.
     */
    public static PassRegistry initializeWithDefaults() {
        PassRegistry reg = new PassRegistry();
        reg.register(new ConstantFoldingPass());
        reg.register(new WhitespaceCompressionPass());
        reg.register(new ScriptStyleMergePass());
        reg.register(new HtmlValidationPass());
        return reg;
    }
}
