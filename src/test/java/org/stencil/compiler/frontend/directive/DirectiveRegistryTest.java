package org.stencil.compiler.frontend.directive;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests the directive registry: built-ins, configured runtime names, providers and
 * duplicate detection.
 */
public class DirectiveRegistryTest {

    @Test
    @Tag("unit")
    void testBuiltinsAreRegistered() {
        DirectiveRegistry registry = DirectiveRegistry.initialize(DirectiveSettings.defaults());

        assertThat(registry.isBlock("if")).isTrue();
        assertThat(registry.isBlock("for")).isTrue();
        assertThat(registry.isBlock("static")).isFalse();
        assertThat(registry.lookup("static")).get().extracting(DirectiveEntry::purity).isEqualTo(Purity.PURE);
        assertThat(registry.lookup("url")).get().extracting(DirectiveEntry::purity).isEqualTo(Purity.CONTEXT_DEPENDENT);
        assertThat(registry.lookup("for")).get().extracting(DirectiveEntry::blockKind).isEqualTo(BlockKind.LOOP);
        assertThat(registry.isBranchKeyword("elif")).isTrue();
        assertThat(registry.isBranchKeyword("endif")).isFalse();
    }

    @Test
    @Tag("unit")
    void testProvidersOnClassPathAreLoaded() {
        DirectiveRegistry registry = DirectiveRegistry.initialize(DirectiveSettings.defaults());

        assertThat(registry.lookup("site_name")).get().extracting(DirectiveEntry::purity).isEqualTo(Purity.PURE);
        assertThat(registry.lookup("current_user")).get().extracting(DirectiveEntry::evaluator).isNull();
    }

    @Test
    @Tag("unit")
    void testConfiguredRuntimeNames() {
        DirectiveRegistry registry = DirectiveRegistry.initialize(
                new DirectiveSettings("/assets/", List.of("menu"), List.of("cache")));

        assertThat(registry.lookup("menu")).get().extracting(DirectiveEntry::purity).isEqualTo(Purity.CONTEXT_DEPENDENT);
        assertThat(registry.isBlock("cache")).isTrue();
        assertThat(registry.lookup("cache")).get().extracting(DirectiveEntry::blockKind).isEqualTo(BlockKind.ALTERNATIVES);
    }

    @Test
    @Tag("unit")
    void testDuplicateRegistrationFails() {
        DirectiveRegistry.Builder builder = DirectiveRegistry.builder()
                .register(DirectiveEntry.runtime("menu", 0, 0));

        assertThatThrownBy(() -> builder.register(DirectiveEntry.runtime("menu", 1, 1)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("menu");
    }

    @Test
    @Tag("unit")
    void testConfiguredNameCollidingWithBuiltinFails() {
        DirectiveSettings settings = new DirectiveSettings("/static/", List.of("if"), List.of());

        assertThatThrownBy(() -> DirectiveRegistry.initialize(settings))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @Tag("unit")
    void testPureEntryNeedsEvaluator() {
        assertThatThrownBy(() -> DirectiveEntry.pure("broken", 0, 0, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @Tag("unit")
    void testRegistryIsIndependentOfBuilderAfterBuild() {
        DirectiveRegistry.Builder builder = DirectiveRegistry.builder();
        builder.register(DirectiveEntry.runtime("a", 0, 0));
        DirectiveRegistry registry = builder.build();

        builder.register(DirectiveEntry.runtime("b", 0, 0));

        assertThat(registry.size()).isEqualTo(1);
        assertThat(registry.lookup("b")).isEmpty();
    }
}
