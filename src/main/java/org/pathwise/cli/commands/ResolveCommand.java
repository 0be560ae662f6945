package org.pathwise.cli.commands;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

import org.pathwise.cli.CommandLineInterface;
import org.pathwise.compiler.api.CompilationUnit;
import org.pathwise.compiler.diagnostics.Diagnostic;
import org.pathwise.compiler.diagnostics.DiagnosticsEngine;
import org.pathwise.compiler.frontend.module.ModuleNode;
import org.pathwise.compiler.frontend.scan.ModuleSourceScanner;
import org.pathwise.compiler.frontend.scan.ScannerOptions;
import org.pathwise.compiler.frontend.semantics.Declaration;
import org.pathwise.compiler.frontend.semantics.NameResolver;
import org.pathwise.compiler.frontend.semantics.ResolutionResult;
import org.pathwise.compiler.frontend.semantics.ResolvedReference;
import org.pathwise.compiler.frontend.semantics.ResolverOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.typesafe.config.Config;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * CLI command that scans a source tree from its root file, resolves every type path in it
 * and prints the resolutions and diagnostics.
 * <p>
 * Exit codes: 0 when no error was diagnosed, 1 when errors were diagnosed, 2 when the root
 * file cannot be read.
 */
@Command(
    name = "resolve",
    description = "Resolve module paths and imports of a source tree"
)
public class ResolveCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ResolveCommand.class);

    static final int EXIT_OK = 0;
    static final int EXIT_ERRORS = 1;
    static final int EXIT_UNREADABLE = 2;

    @Option(
        names = {"-f", "--file"},
        required = true,
        description = "Root source file of the crate"
    )
    private Path file;

    @Option(
        names = {"--json"},
        description = "Print the report as JSON"
    )
    private boolean json;

    @Option(
        names = {"-p", "--parallelism"},
        description = "Worker threads for resolution passes, 0 for one per processor (default: pathwise.resolver.parallelism)"
    )
    private Integer parallelism;

    @Option(
        names = {"--local-import-collision"},
        description = "REPORT or SHADOW an import that binds a locally declared name (default: pathwise.resolver.local-import-collision)"
    )
    private ResolverOptions.LocalImportCollision localImportCollision;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        Config config = parent.getConfig();
        ResolverOptions options = ResolverOptions.fromConfig(config.getConfig("pathwise.resolver"));
        if (parallelism != null) {
            options = options.withParallelism(ResolverOptions.effectiveParallelism(parallelism));
        }
        if (localImportCollision != null) {
            options = options.withLocalImportCollision(localImportCollision);
        }
        ScannerOptions scannerOptions = ScannerOptions.fromConfig(config.getConfig("pathwise.scanner"));

        CompilationUnit unit;
        try {
            unit = new ModuleSourceScanner(scannerOptions).scan(file);
        } catch (IOException e) {
            log.debug("Root source {} is unreadable", file, e);
            err.println("Error: cannot read root source file " + file + ": " + e.getMessage());
            return EXIT_UNREADABLE;
        }

        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        ResolutionResult result = new NameResolver(diagnostics, options).analyze(unit);
        Report report = Report.of(unit.rootPath(), result);

        if (json) {
            Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();
            out.println(gson.toJson(report));
        } else {
            printText(report, out);
        }
        out.flush();
        return result.hasErrors() ? EXIT_ERRORS : EXIT_OK;
    }

    private static void printText(Report report, PrintWriter out) {
        out.printf("Modules (%d):%n", report.modules().size());
        for (ModuleEntry module : report.modules()) {
            out.printf("  %-40s %s%n", module.id(), module.source());
        }

        out.printf("%nReferences (%d):%n", report.references().size());
        for (ReferenceEntry reference : report.references()) {
            String target = reference.declaration() != null
                    ? reference.kind() + " " + reference.declaration()
                    : "error[" + reference.error() + "]";
            out.printf("  %s  %s -> %s%n", reference.location(), reference.path(), target);
        }

        if (!report.diagnostics().isEmpty()) {
            out.printf("%nDiagnostics (%d):%n", report.diagnostics().size());
            for (DiagnosticEntry diagnostic : report.diagnostics()) {
                out.printf("  %s: %s[%s]: %s%n", diagnostic.location(), diagnostic.severity(),
                        diagnostic.kind(), diagnostic.message());
            }
        }

        out.printf("%n%d/%d reference(s) resolved, %d error(s), %d warning(s)%n",
                report.resolved(), report.references().size(), report.errors(), report.warnings());
    }

    // Report model, serialized by Gson as is.

    record Report(String root, List<ModuleEntry> modules, List<ReferenceEntry> references,
                  List<DiagnosticEntry> diagnostics, int resolved, int errors, int warnings) {

        static Report of(String root, ResolutionResult result) {
            List<ModuleEntry> modules = new ArrayList<>();
            for (ModuleNode node : result.tree().nodes()) {
                modules.add(new ModuleEntry(node.id().path(), node.source().sourcePath()));
            }

            List<ReferenceEntry> references = new ArrayList<>();
            int resolved = 0;
            for (ResolvedReference reference : result.references().values()) {
                Declaration target = reference.declaration();
                if (target != null) {
                    resolved++;
                }
                references.add(new ReferenceEntry(
                        reference.useSite().module().path(),
                        reference.useSite().path(),
                        reference.useSite().location().toString(),
                        target != null ? target.id().toString() : null,
                        target != null ? target.kind().keyword() : null,
                        target == null ? reference.error().kind().name() : null));
            }

            List<DiagnosticEntry> diagnostics = new ArrayList<>();
            int errors = 0;
            for (Diagnostic diagnostic : result.diagnostics()) {
                if (diagnostic.isError()) {
                    errors++;
                }
                diagnostics.add(new DiagnosticEntry(
                        diagnostic.severity().name().toLowerCase(Locale.ROOT),
                        diagnostic.kind().name(),
                        diagnostic.message(),
                        diagnostic.location().toString(),
                        diagnostic.candidates().stream().map(d -> d.id().toString()).toList()));
            }
            return new Report(root, modules, references, diagnostics, resolved, errors, diagnostics.size() - errors);
        }
    }

    record ModuleEntry(String id, String source) {}

    record ReferenceEntry(String module, String path, String location, String declaration, String kind, String error) {}

    record DiagnosticEntry(String severity, String kind, String message, String location, List<String> candidates) {}
}
