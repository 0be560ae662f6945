package org.pathwise.compiler.frontend.semantics;

import org.pathwise.compiler.api.CompilationUnit;
import org.pathwise.compiler.api.ModuleSource;
import org.pathwise.compiler.diagnostics.DiagnosticsEngine;
import org.pathwise.compiler.frontend.PassWorkerPool;
import org.pathwise.compiler.frontend.module.ModuleNode;
import org.pathwise.compiler.frontend.module.ModuleTree;
import org.pathwise.compiler.frontend.module.ModuleTreeBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs module-aware name resolution for a compilation unit.
 *
 * <p>The passes run in a fixed order with a barrier after each one:</p>
 * <ol>
 *   <li>Module tree construction from the {@code mod} declarations.</li>
 *   <li>Declaration collection, per module in parallel.</li>
 *   <li>Import resolution to a fixed point, after which the symbol table is frozen.</li>
 *   <li>Resolution of every path reference of every mounted module, per module in parallel.</li>
 * </ol>
 * <p>No pass aborts on a diagnosed problem; the result carries the diagnostics together
 * with everything that could be resolved.</p>
 */
public class NameResolver {

    private static final Logger LOG = LoggerFactory.getLogger(NameResolver.class);

    private final DiagnosticsEngine diagnostics;
    private final ResolverOptions options;

    public NameResolver(DiagnosticsEngine diagnostics) {
        this(diagnostics, ResolverOptions.DEFAULTS);
    }

    public NameResolver(DiagnosticsEngine diagnostics, ResolverOptions options) {
        this.diagnostics = diagnostics;
        this.options = options;
    }

    /**
     * Resolves all names of the compilation unit.
     *
     * @param unit The module sources to resolve.
     * @return The frozen tables, the resolution of every path reference, and the diagnostics.
     */
    public ResolutionResult analyze(CompilationUnit unit) {
        long start = System.nanoTime();
        ModuleTree tree = new ModuleTreeBuilder(diagnostics).build(unit);
        SymbolTable symbolTable = new SymbolTable(tree);

        try (PassWorkerPool pool = new PassWorkerPool(options.parallelism())) {
            new DeclarationCollector(diagnostics).collectAll(tree, symbolTable, pool);
            new ImportResolver(diagnostics, options).resolveAll(tree, symbolTable, pool);
            symbolTable.freeze();

            PathResolver pathResolver = new PathResolver(symbolTable, diagnostics);
            Map<UseSite, ResolvedReference> references = resolveReferences(tree, pathResolver, pool);

            long resolved = references.values().stream().filter(ResolvedReference::isResolved).count();
            LOG.info("Resolved {}/{} reference(s) in {} module(s) with {} error(s) in {} ms",
                    resolved, references.size(), tree.size(), diagnostics.errorCount(),
                    (System.nanoTime() - start) / 1_000_000);
            return new ResolutionResult(tree, symbolTable, references, diagnostics, pathResolver);
        }
    }

    private static Map<UseSite, ResolvedReference> resolveReferences(ModuleTree tree, PathResolver pathResolver,
                                                                     PassWorkerPool pool) {
        List<List<ResolvedReference>> perModule = new ArrayList<>(tree.size());
        for (int i = 0; i < tree.size(); i++) {
            perModule.add(null);
        }

        pool.dispatch(tree.size(), (from, to) -> {
            for (int i = from; i < to; i++) {
                ModuleNode node = tree.node(i);
                List<ResolvedReference> moduleReferences = new ArrayList<>();
                for (ModuleSource.PathReference reference : node.source().references()) {
                    moduleReferences.add(pathResolver.resolve(UseSite.of(node.id(), reference)));
                }
                perModule.set(i, moduleReferences);
                LOG.debug("Resolved {} reference(s) in module {}", moduleReferences.size(), node.id());
            }
        });

        Map<UseSite, ResolvedReference> references = new LinkedHashMap<>();
        for (List<ResolvedReference> moduleReferences : perModule) {
            for (ResolvedReference reference : moduleReferences) {
                references.put(reference.useSite(), reference);
            }
        }
        return references;
    }
}
