package org.pathwise.compiler.frontend.semantics;

import org.pathwise.compiler.api.CompilationUnit;
import org.pathwise.compiler.api.ItemKind;
import org.pathwise.compiler.api.ModuleSource;
import org.pathwise.compiler.api.Namespace;
import org.pathwise.compiler.api.SourceLocation;
import org.pathwise.compiler.diagnostics.DiagnosticKind;
import org.pathwise.compiler.diagnostics.DiagnosticsEngine;
import org.pathwise.compiler.frontend.module.ModuleId;
import org.pathwise.compiler.frontend.module.ModuleTree;
import org.pathwise.compiler.frontend.module.ModuleTreeBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests resolution of qualified and bare paths against the frozen tables.
 *
 * <pre>
 * crate            struct Root; use a::Inner;
 * ├── a            struct Inner; fn Inner; pub use crate::x::Shared; use crate::x::Local as Hidden;
 * │   ├── x        struct Local
 * │   └── deep     struct Deep
 * └── x            struct Shared; struct Local
 * </pre>
 */
@Tag("unit")
class PathResolverTest {

    private static final ModuleId A = ModuleId.ROOT.child("a");
    private static final ModuleId A_X = A.child("x");
    private static final ModuleId DEEP = A.child("deep");
    private static final ModuleId X = ModuleId.ROOT.child("x");

    private DiagnosticsEngine diagnostics;
    private ResolutionResult result;
    private PathResolver resolver;

    @BeforeEach
    void setUp() {
        diagnostics = new DiagnosticsEngine();
        CompilationUnit unit = CompilationUnit.of("main.sw",
                ModuleSource.builder("main.sw").mod("a", "a.sw").mod("x", "x.sw").struct("Root").use("a::Inner").build(),
                ModuleSource.builder("a.sw").mod("x", "a/x.sw").mod("deep", "a/deep.sw")
                        .struct("Inner").function("Inner")
                        .pubUse("crate::x::Shared").use("crate::x::Local", "Hidden").build(),
                ModuleSource.builder("a/x.sw").struct("Local").build(),
                ModuleSource.builder("a/deep.sw").struct("Deep").build(),
                ModuleSource.builder("x.sw").struct("Shared").struct("Local").build());
        result = new NameResolver(diagnostics).analyze(unit);
        resolver = result.pathResolver();
        assertThat(diagnostics.getDiagnostics()).isEmpty();
    }

    private Declaration declared(ModuleId module, String name, ItemKind kind) {
        return result.symbolTable().scope(module).declaration(name, kind).orElseThrow();
    }

    private ResolvedReference resolve(ModuleId from, String path) {
        return resolver.resolve(from, path, Namespace.TYPE);
    }

    @Test
    void relativeFirstSegmentPrefersChildOfCurrentModule() {
        assertThat(resolve(A, "x::Local").declaration()).isEqualTo(declared(A_X, "Local", ItemKind.STRUCT));
    }

    @Test
    void relativeFirstSegmentFallsBackToCrateRoot() {
        assertThat(resolve(DEEP, "x::Local").declaration()).isEqualTo(declared(X, "Local", ItemKind.STRUCT));
    }

    @Test
    void crateSelfAndSuperRoots() {
        Declaration deep = declared(DEEP, "Deep", ItemKind.STRUCT);

        assertThat(resolve(X, "crate::a::deep::Deep").declaration()).isEqualTo(deep);
        assertThat(resolve(X, "::a::deep::Deep").declaration()).isEqualTo(deep);
        assertThat(resolve(DEEP, "self::Deep").declaration()).isEqualTo(deep);
        assertThat(resolve(A_X, "super::deep::Deep").declaration()).isEqualTo(deep);
        assertThat(resolve(DEEP, "super::super::Root").declaration()).isEqualTo(declared(ModuleId.ROOT, "Root", ItemKind.STRUCT));
    }

    @Test
    void superAboveCrateRootIsUnknownModule() {
        ResolvedReference reference = resolve(A, "super::super::Root");

        assertThat(reference.isResolved()).isFalse();
        assertThat(reference.error().kind()).isEqualTo(DiagnosticKind.UNKNOWN_MODULE);
    }

    @Test
    void missingSegmentAndMissingItem() {
        assertThat(resolve(ModuleId.ROOT, "a::nope::Deep").error().kind()).isEqualTo(DiagnosticKind.UNKNOWN_MODULE);
        assertThat(resolve(ModuleId.ROOT, "nope::Deep").error().kind()).isEqualTo(DiagnosticKind.UNKNOWN_MODULE);
        assertThat(resolve(ModuleId.ROOT, "a::deep::Missing").error().kind()).isEqualTo(DiagnosticKind.UNKNOWN_DECLARATION);
        assertThat(resolve(ModuleId.ROOT, "a::::Deep").error().kind()).isEqualTo(DiagnosticKind.MALFORMED_PATH);
    }

    @Test
    void qualifiedPathSeesReexportsOnly() {
        assertThat(resolve(ModuleId.ROOT, "a::Shared").declaration()).isEqualTo(declared(X, "Shared", ItemKind.STRUCT));
        assertThat(resolve(ModuleId.ROOT, "a::Hidden").error().kind()).isEqualTo(DiagnosticKind.UNKNOWN_DECLARATION);
    }

    @Test
    void bareNameConsultsLocalsThenImports() {
        assertThat(resolve(ModuleId.ROOT, "Root").declaration()).isEqualTo(declared(ModuleId.ROOT, "Root", ItemKind.STRUCT));
        assertThat(resolve(ModuleId.ROOT, "Inner").declaration()).isEqualTo(declared(A, "Inner", ItemKind.STRUCT));
        assertThat(resolve(A, "Hidden").declaration()).isEqualTo(declared(X, "Local", ItemKind.STRUCT));
        assertThat(resolve(A, "Root").error().kind()).isEqualTo(DiagnosticKind.UNRESOLVED_NAME);
    }

    @Test
    void namespaceSeparatesKindsSharingAName() {
        assertThat(resolver.resolve(A, "Inner", Namespace.VALUE).declaration())
                .isEqualTo(declared(A, "Inner", ItemKind.FUNCTION));

        ResolvedReference any = resolver.resolve(A, "Inner", null);
        assertThat(any.error().kind()).isEqualTo(DiagnosticKind.AMBIGUOUS_NAME);
        assertThat(any.error().candidates()).containsExactlyInAnyOrder(
                declared(A, "Inner", ItemKind.STRUCT), declared(A, "Inner", ItemKind.FUNCTION));
    }

    @Test
    void failuresAreMemoizedAndReportedOnce() {
        UseSite site = new UseSite(ModuleId.ROOT, "Missing", Namespace.TYPE, new SourceLocation("main.sw", 20, 3));

        ResolvedReference first = resolver.resolve(site);
        ResolvedReference second = result.resolve(site);

        assertThat(second).isSameAs(first);
        assertThat(diagnostics.ofKind(DiagnosticKind.UNRESOLVED_NAME))
                .singleElement()
                .satisfies(d -> {
                    assertThat(d.location()).isEqualTo(site.location());
                    assertThat(d.surfaceText()).isEqualTo("Missing");
                });
    }

    @Test
    void freshResolverOverTheSameTablesGivesAnEqualReference() {
        UseSite site = new UseSite(A, "x::Local", Namespace.TYPE, new SourceLocation("a.sw", 7, 9));
        ResolvedReference first = resolver.resolve(site);

        PathResolver fresh = new PathResolver(result.symbolTable(), new DiagnosticsEngine());
        ResolvedReference again = fresh.resolve(site);

        assertThat(again).isNotSameAs(first).isEqualTo(first);
        assertThat(again.declaration()).isEqualTo(declared(A_X, "Local", ItemKind.STRUCT));
        assertThat(diagnostics.getDiagnostics()).isEmpty();
    }

    @Test
    void referencesCompareByDeclarationNotText() {
        ResolvedReference qualified = resolve(ModuleId.ROOT, "crate::a::Inner");
        ResolvedReference imported = resolve(ModuleId.ROOT, "Inner");
        ResolvedReference other = resolve(ModuleId.ROOT, "x::Local");
        ResolvedReference sameText = resolve(A, "x::Local");

        assertThat(qualified.refersToSameDeclaration(imported)).isTrue();
        assertThat(other.refersToSameDeclaration(sameText)).isFalse();
    }

    @Test
    void canonicalAndRelativePathsResolveBackToTheDeclaration() {
        for (Declaration declaration : result.symbolTable().getAllDeclarations()) {
            Namespace namespace = declaration.kind().namespace();
            QualifiedPath canonical = resolver.canonicalPath(declaration);
            for (var module : result.tree().nodes()) {
                assertThat(resolver.resolve(module.id(), canonical.toString(), namespace).declaration())
                        .as("%s from %s", canonical, module.id())
                        .isEqualTo(declaration);

                QualifiedPath relative = resolver.relativePath(declaration, module.id());
                assertThat(resolver.resolve(module.id(), relative.toString(), namespace).declaration())
                        .as("%s from %s", relative, module.id())
                        .isEqualTo(declaration);
            }
        }
    }

    @Test
    void relativePathShape() {
        Declaration deep = declared(DEEP, "Deep", ItemKind.STRUCT);

        assertThat(resolver.canonicalPath(deep).toString()).isEqualTo("crate::a::deep::Deep");
        assertThat(resolver.relativePath(deep, DEEP).toString()).isEqualTo("self::Deep");
        assertThat(resolver.relativePath(deep, A).toString()).isEqualTo("self::deep::Deep");
        assertThat(resolver.relativePath(deep, A_X).toString()).isEqualTo("super::deep::Deep");
        assertThat(resolver.relativePath(deep, X).toString()).isEqualTo("super::a::deep::Deep");
    }

    @Test
    void unfrozenTableIsRejected() {
        ModuleTree tree = new ModuleTreeBuilder(diagnostics).build(
                CompilationUnit.of("main.sw", ModuleSource.builder("main.sw").build()));

        assertThatThrownBy(() -> new PathResolver(new SymbolTable(tree), diagnostics))
                .isInstanceOf(IllegalStateException.class);
    }
}
