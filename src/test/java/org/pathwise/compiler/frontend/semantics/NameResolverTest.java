package org.pathwise.compiler.frontend.semantics;

import org.pathwise.compiler.api.CompilationUnit;
import org.pathwise.compiler.api.ItemKind;
import org.pathwise.compiler.api.ModuleSource;
import org.pathwise.compiler.api.Namespace;
import org.pathwise.compiler.diagnostics.Diagnostic;
import org.pathwise.compiler.diagnostics.DiagnosticKind;
import org.pathwise.compiler.diagnostics.DiagnosticsEngine;
import org.pathwise.compiler.frontend.module.ModuleId;
import org.pathwise.compiler.frontend.semantics.ResolverOptions.LocalImportCollision;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

/**
 * End-to-end tests of the resolver passes on in-memory compilation units.
 */
@Tag("unit")
class NameResolverTest {

    private static final ModuleId TYPES = ModuleId.ROOT.child("contract_a_types");
    private static final ModuleId LIB = ModuleId.ROOT.child("another_lib");

    /**
     * The contract whose ABI takes two structs that share a name but live in different modules.
     */
    private static CompilationUnit veryCommonNameContract() {
        return CompilationUnit.of("main.sw",
                ModuleSource.builder("main.sw")
                        .mod("contract_a_types", "contract_a_types.sw")
                        .mod("another_lib", "another_lib.sw")
                        .use("another_lib::VeryCommonNameStruct")
                        .item(ItemKind.ABI, "MyContract")
                        .reference("contract_a_types::VeryCommonNameStruct", Namespace.TYPE)
                        .reference("VeryCommonNameStruct", Namespace.TYPE)
                        .reference("MyContract", Namespace.TYPE)
                        .reference("contract_a_types::VeryCommonNameStruct", Namespace.TYPE)
                        .reference("VeryCommonNameStruct", Namespace.TYPE)
                        .build(),
                ModuleSource.builder("contract_a_types.sw").struct("VeryCommonNameStruct").build(),
                ModuleSource.builder("another_lib.sw").struct("VeryCommonNameStruct").build());
    }

    private static ResolutionResult analyze(ResolverOptions options, CompilationUnit unit) {
        return new NameResolver(new DiagnosticsEngine(), options).analyze(unit);
    }

    private static List<ResolvedReference> references(ResolutionResult result) {
        return new ArrayList<>(result.references().values());
    }

    @Test
    void sameNamedStructsInDifferentModulesStayDistinct() {
        ResolutionResult result = analyze(ResolverOptions.DEFAULTS, veryCommonNameContract());
        List<ResolvedReference> references = references(result);

        assertThat(result.diagnostics()).isEmpty();
        assertThat(references).hasSize(5).allMatch(ResolvedReference::isResolved);

        ResolvedReference qualified = references.get(0);
        ResolvedReference imported = references.get(1);
        assertThat(qualified.declaration().module()).isEqualTo(TYPES);
        assertThat(imported.declaration().module()).isEqualTo(LIB);
        assertThat(qualified.declaration().name()).isEqualTo(imported.declaration().name());
        assertThat(qualified.refersToSameDeclaration(imported)).isFalse();

        assertThat(references.get(2).declaration().kind()).isEqualTo(ItemKind.ABI);
        assertThat(references.get(3).refersToSameDeclaration(qualified)).isTrue();
        assertThat(references.get(4).refersToSameDeclaration(imported)).isTrue();
    }

    @Test
    void localStructWithTheImportedNameWinsAndTheImportIsFlagged() {
        CompilationUnit unit = CompilationUnit.of("main.sw",
                ModuleSource.builder("main.sw")
                        .mod("contract_a_types", "contract_a_types.sw")
                        .mod("another_lib", "another_lib.sw")
                        .use("another_lib::VeryCommonNameStruct")
                        .struct("VeryCommonNameStruct")
                        .reference("contract_a_types::VeryCommonNameStruct", Namespace.TYPE)
                        .reference("VeryCommonNameStruct", Namespace.TYPE)
                        .build(),
                ModuleSource.builder("contract_a_types.sw").struct("VeryCommonNameStruct").build(),
                ModuleSource.builder("another_lib.sw").struct("VeryCommonNameStruct").build());

        ResolutionResult result = analyze(ResolverOptions.DEFAULTS, unit);
        List<ResolvedReference> references = references(result);

        assertThat(references.get(0).declaration().module()).isEqualTo(TYPES);
        assertThat(references.get(1).declaration().module()).isEqualTo(ModuleId.ROOT);
        assertThat(result.diagnostics()).extracting(Diagnostic::kind).containsExactly(DiagnosticKind.DUPLICATE_IMPORT);
    }

    @Test
    void referencesFollowModuleAndSourceOrder() {
        CompilationUnit unit = CompilationUnit.of("main.sw",
                ModuleSource.builder("main.sw").mod("a", "a.sw").reference("a::One").reference("Missing").build(),
                ModuleSource.builder("a.sw").struct("One").reference("One").build());

        ResolutionResult result = analyze(ResolverOptions.DEFAULTS, unit);

        assertThat(result.references().keySet())
                .extracting(UseSite::module, UseSite::path)
                .containsExactly(
                        tuple(ModuleId.ROOT, "a::One"),
                        tuple(ModuleId.ROOT, "Missing"),
                        tuple(ModuleId.ROOT.child("a"), "One"));
        assertThat(result.hasErrors()).isTrue();
        assertThat(result.diagnostics()).singleElement()
                .satisfies(d -> assertThat(d.kind()).isEqualTo(DiagnosticKind.UNRESOLVED_NAME));
    }

    @ParameterizedTest
    @EnumSource(LocalImportCollision.class)
    void localDeclarationWinsOverImportWrittenBeforeIt(LocalImportCollision policy) {
        CompilationUnit unit = CompilationUnit.of("main.sw",
                ModuleSource.builder("main.sw").mod("a", "a.sw")
                        .use("a::Token")
                        .struct("Token")
                        .reference("Token", Namespace.TYPE)
                        .build(),
                ModuleSource.builder("a.sw").struct("Token").build());

        assertLocalWins(policy, unit);
    }

    @ParameterizedTest
    @EnumSource(LocalImportCollision.class)
    void localDeclarationWinsOverImportWrittenAfterIt(LocalImportCollision policy) {
        CompilationUnit unit = CompilationUnit.of("main.sw",
                ModuleSource.builder("main.sw").mod("a", "a.sw")
                        .struct("Token")
                        .use("a::Token")
                        .reference("Token", Namespace.TYPE)
                        .build(),
                ModuleSource.builder("a.sw").struct("Token").build());

        assertLocalWins(policy, unit);
    }

    private static void assertLocalWins(LocalImportCollision policy, CompilationUnit unit) {
        ResolutionResult result = analyze(ResolverOptions.DEFAULTS.withLocalImportCollision(policy), unit);

        ResolvedReference reference = references(result).get(0);
        assertThat(reference.declaration().module()).isEqualTo(ModuleId.ROOT);
        assertThat(result.symbolTable().scope(ModuleId.ROOT).importBinding("Token")).isEmpty();

        if (policy == LocalImportCollision.REPORT) {
            assertThat(result.diagnostics()).singleElement().satisfies(d -> {
                assertThat(d.kind()).isEqualTo(DiagnosticKind.DUPLICATE_IMPORT);
                assertThat(d.surfaceText()).isEqualTo("a::Token");
                assertThat(d.candidates()).hasSize(2);
            });
        } else {
            assertThat(result.diagnostics()).isEmpty();
        }
    }

    @Test
    void parallelRunMatchesSequentialRun() {
        List<ModuleSource> sources = new ArrayList<>();
        ModuleSource.Builder main = ModuleSource.builder("main.sw");
        for (int i = 0; i < 24; i++) {
            String name = "m" + i;
            main.mod(name, name + ".sw");
            ModuleSource.Builder module = ModuleSource.builder(name + ".sw").struct("Item" + i);
            if (i > 0) {
                // Each module re-exports everything its predecessor exported.
                for (int j = 0; j < i; j++) {
                    module.pubUse("crate::m" + (i - 1) + "::Item" + j);
                }
            }
            module.reference("Item" + i).reference("crate::m" + ((i + 5) % 24) + "::Item0").reference("Nope" + i);
            sources.add(module.build());
        }
        main.use("m23::Item7").reference("Item7").reference("m3::Item2");
        sources.add(0, main.build());
        CompilationUnit unit = new CompilationUnit("main.sw", sources);

        ResolutionResult sequential = analyze(ResolverOptions.DEFAULTS, unit);
        ResolutionResult parallel = analyze(ResolverOptions.DEFAULTS.withParallelism(4), unit);

        assertThat(parallel.references()).isEqualTo(sequential.references());
        assertThat(parallel.diagnostics()).isEqualTo(sequential.diagnostics());
        assertThat(sequential.diagnostics())
                .allSatisfy(d -> assertThat(d.kind()).isEqualTo(DiagnosticKind.UNRESOLVED_NAME))
                .hasSize(24);
        assertThat(sequential.pathResolver().resolve(ModuleId.ROOT, "Item7", Namespace.TYPE).declaration().module())
                .isEqualTo(ModuleId.ROOT.child("m7"));
    }

    @Test
    void reexportChainIsVisibleToQualifiedPaths() {
        CompilationUnit unit = CompilationUnit.of("main.sw",
                ModuleSource.builder("main.sw").mod("api", "api.sw").mod("core", "core.sw")
                        .reference("api::Wallet", Namespace.TYPE)
                        .reference("api::internal", Namespace.TYPE)
                        .build(),
                ModuleSource.builder("api.sw").mod("types", "api/types.sw").pubUse("self::types::Wallet").build(),
                ModuleSource.builder("api/types.sw").pubUse("crate::core::Wallet").build(),
                ModuleSource.builder("core.sw").struct("Wallet").build());

        ResolutionResult result = analyze(ResolverOptions.DEFAULTS, unit);
        List<ResolvedReference> references = references(result);

        assertThat(references.get(0).declaration().module()).isEqualTo(ModuleId.ROOT.child("core"));
        assertThat(references.get(1).error().kind()).isEqualTo(DiagnosticKind.UNKNOWN_DECLARATION);
        assertThat(result.diagnostics()).hasSize(1);
    }
}
