package org.pathwise.compiler.frontend.scan;

import org.pathwise.compiler.api.CompilationUnit;
import org.pathwise.compiler.api.ItemKind;
import org.pathwise.compiler.api.ModuleSource;
import org.pathwise.compiler.api.Namespace;
import org.pathwise.compiler.api.SourceLocation;
import org.pathwise.compiler.frontend.io.SourceLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds a {@link CompilationUnit} from a tree of source files by following {@code mod}
 * declarations from the root file.
 *
 * <p>This is a lightweight line-based text scan. It does not invoke a lexer or parser. It
 * recognizes, per line:</p>
 * <ul>
 *   <li>{@code mod name;}, {@code [pub] use path [as alias];} and {@code use a::{X, Y as Z};}
 *       at brace depth 0</li>
 *   <li>top-level items ({@code struct}, {@code enum}, {@code fn}, {@code type}, {@code trait},
 *       {@code abi}, {@code const}) at brace depth 0</li>
 *   <li>type paths after {@code :} and {@code ->} on {@code fn} signature lines and on field
 *       lines of struct and enum bodies, and both paths of {@code impl Trait for Type}</li>
 * </ul>
 * <p>A {@code mod x;} in the root file or in a {@code mod.<ext>} file refers to {@code x.<ext>}
 * or {@code x/mod.<ext>} next to it; in any other file {@code f.<ext>} it refers to
 * {@code f/x.<ext>} or {@code f/x/mod.<ext>}.</p>
 */
public final class ModuleSourceScanner {

    private static final Logger LOG = LoggerFactory.getLogger(ModuleSourceScanner.class);

    private static final Pattern MOD_PATTERN = Pattern.compile("^(?:pub\\s+)?mod\\s+([A-Za-z_]\\w*)\\s*;$");
    private static final Pattern USE_PATTERN = Pattern.compile("^(pub\\s+)?use\\s+(.+?)\\s*;$");
    private static final Pattern GROUP_PATTERN = Pattern.compile("^(.*?)::\\{(.*)}$");
    private static final Pattern ALIAS_PATTERN = Pattern.compile("^(.+?)\\s+as\\s+([A-Za-z_]\\w*)$");
    private static final Pattern ITEM_PATTERN = Pattern.compile(
            "^(?:pub\\s+)?(struct|enum|fn|type|trait|abi|const)\\s+([A-Za-z_]\\w*)");
    private static final Pattern IMPL_PATTERN = Pattern.compile(
            "^impl(?:<[^>]*>)?\\s+((?:::)?[A-Za-z_][\\w:]*)\\s+for\\s+((?:::)?[A-Za-z_][\\w:]*)");
    private static final Pattern FN_PATTERN = Pattern.compile("^(?:pub\\s+)?fn\\s+([A-Za-z_]\\w*)\\s*(?:<([^>]*)>)?");
    private static final Pattern FIELD_PATTERN = Pattern.compile("^(?:pub\\s+)?[A-Za-z_]\\w*\\s*:(?!:)");
    private static final Pattern PATH_TOKEN = Pattern.compile("(?:::)?[A-Za-z_]\\w*(?:::[A-Za-z_]\\w*)*");
    private static final Set<String> TYPE_KEYWORDS = Set.of("mut", "ref", "dyn", "impl", "where", "for");

    private enum Block { STRUCT, ENUM, OTHER }

    private final ScannerOptions options;
    private final SourceReader reader;

    public ModuleSourceScanner(ScannerOptions options) {
        this(options, SourceReader.FILESYSTEM);
    }

    public ModuleSourceScanner(ScannerOptions options, SourceReader reader) {
        this.options = options;
        this.reader = reader;
    }

    /**
     * Scans the root file and every module it transitively mounts.
     *
     * <p>A module file that cannot be read is logged and left out of the unit; the module
     * tree builder then reports the {@code mod} declaration that points to it.</p>
     *
     * @param rootFile The crate root source file.
     * @return The compilation unit, with the root file's logical name as root path.
     * @throws IOException if the root file itself cannot be read.
     */
    public CompilationUnit scan(Path rootFile) throws IOException {
        Path root = rootFile.toAbsolutePath().normalize();
        String rootName = SourceLoader.logicalName(root);
        SourceLoader.LoadResult rootContent = reader.read(root);

        Map<String, ModuleSource> scanned = new LinkedHashMap<>();
        Set<String> unreadable = new HashSet<>();
        Deque<Path> work = new ArrayDeque<>();
        scanned.put(rootName, scanFile(root, rootContent.content(), true, work));

        while (!work.isEmpty()) {
            Path file = work.poll();
            String name = SourceLoader.logicalName(file);
            if (scanned.containsKey(name) || unreadable.contains(name)) {
                continue;
            }
            try {
                SourceLoader.LoadResult loaded = reader.read(file);
                scanned.put(name, scanFile(file, loaded.content(), false, work));
            } catch (IOException e) {
                LOG.warn("Could not read module source {}: {}", name, e.getMessage());
                unreadable.add(name);
            }
        }

        LOG.debug("Scanned {} module source(s) from {}", scanned.size(), rootName);
        return new CompilationUnit(rootName, new ArrayList<>(scanned.values()));
    }

    /**
     * Scans one file's content. Target files of its {@code mod} declarations are appended to
     * {@code work}.
     */
    ModuleSource scanFile(Path file, String content, boolean isRoot, Deque<Path> work) {
        String sourceName = SourceLoader.logicalName(file);
        List<ModuleSource.ModDecl> mods = new ArrayList<>();
        List<ModuleSource.UseDecl> uses = new ArrayList<>();
        List<ModuleSource.ItemDecl> items = new ArrayList<>();
        List<ModuleSource.PathReference> references = new ArrayList<>();
        Deque<Block> blocks = new ArrayDeque<>();

        String[] lines = content.split("\\r?\\n");
        for (int i = 0; i < lines.length; i++) {
            String raw = stripComment(lines[i]);
            String line = raw.strip();
            if (line.isEmpty()) continue;
            int indent = raw.indexOf(line.charAt(0));
            int lineNo = i + 1;
            Block lineBlock = Block.OTHER;

            if (blocks.isEmpty()) {
                Matcher modMatcher = MOD_PATTERN.matcher(line);
                Matcher useMatcher = USE_PATTERN.matcher(line);
                Matcher itemMatcher = ITEM_PATTERN.matcher(line);
                Matcher implMatcher = IMPL_PATTERN.matcher(line);
                if (modMatcher.matches()) {
                    String name = modMatcher.group(1);
                    Path target = childModuleFile(file, isRoot, name);
                    mods.add(new ModuleSource.ModDecl(name, SourceLoader.logicalName(target),
                            new SourceLocation(sourceName, lineNo, indent + modMatcher.start(1) + 1)));
                    work.add(target);
                    continue;
                } else if (useMatcher.matches()) {
                    boolean reexported = useMatcher.group(1) != null;
                    SourceLocation location = new SourceLocation(sourceName, lineNo, indent + useMatcher.start(2) + 1);
                    parseUse(useMatcher.group(2), reexported, location, uses);
                    continue;
                } else if (itemMatcher.find()) {
                    ItemKind kind = ItemKind.fromKeyword(itemMatcher.group(1));
                    items.add(new ModuleSource.ItemDecl(itemMatcher.group(2), kind,
                            new SourceLocation(sourceName, lineNo, indent + itemMatcher.start(2) + 1)));
                    if (kind == ItemKind.STRUCT) lineBlock = Block.STRUCT;
                    if (kind == ItemKind.ENUM) lineBlock = Block.ENUM;
                } else if (implMatcher.find()) {
                    addTypeReference(implMatcher.group(1), sourceName, lineNo, indent + implMatcher.start(1), Set.of(), references);
                    addTypeReference(implMatcher.group(2), sourceName, lineNo, indent + implMatcher.start(2), Set.of(), references);
                }
            }

            Matcher fnMatcher = FN_PATTERN.matcher(line);
            Block enclosing = blocks.peek();
            if (fnMatcher.find()) {
                Set<String> generics = genericNames(fnMatcher.group(2));
                int bodyStart = line.indexOf('{');
                String signature = bodyStart >= 0 ? line.substring(0, bodyStart) : line;
                collectTypePaths(signature, fnMatcher.end(1), sourceName, lineNo, indent, generics, references);
            } else if ((enclosing == Block.STRUCT || enclosing == Block.ENUM) && FIELD_PATTERN.matcher(line).find()) {
                collectTypePaths(line, 0, sourceName, lineNo, indent, Set.of(), references);
            }

            trackBraces(line, lineBlock, blocks);
        }

        return new ModuleSource(sourceName, mods, uses, items, references);
    }

    private Path childModuleFile(Path file, boolean isRoot, String name) {
        String extension = "." + options.extension();
        String fileName = file.getFileName().toString();
        Path directory = file.getParent();
        boolean ownsDirectory = isRoot || fileName.equals("mod" + extension);
        Path base = ownsDirectory
                ? directory
                : directory.resolve(fileName.endsWith(extension)
                        ? fileName.substring(0, fileName.length() - extension.length())
                        : fileName);

        Path flat = base.resolve(name + extension);
        Path nested = base.resolve(name).resolve("mod" + extension);
        if (reader.exists(flat)) return flat;
        if (reader.exists(nested)) return nested;
        return flat;
    }

    private static void parseUse(String body, boolean reexported, SourceLocation location, List<ModuleSource.UseDecl> uses) {
        Matcher group = GROUP_PATTERN.matcher(body);
        if (group.matches()) {
            String prefix = group.group(1).strip();
            for (String member : group.group(2).split(",")) {
                String entry = member.strip();
                if (entry.isEmpty()) continue;
                addUse(prefix + "::" + entry, reexported, location, uses);
            }
        } else {
            addUse(body, reexported, location, uses);
        }
    }

    private static void addUse(String entry, boolean reexported, SourceLocation location, List<ModuleSource.UseDecl> uses) {
        Matcher alias = ALIAS_PATTERN.matcher(entry);
        if (alias.matches()) {
            uses.add(new ModuleSource.UseDecl(alias.group(1).strip(), alias.group(2), reexported, location));
        } else {
            uses.add(new ModuleSource.UseDecl(entry.strip(), null, reexported, location));
        }
    }

    /**
     * Finds the type expressions after every single {@code :} and every {@code ->} starting at
     * {@code from}, and records each non-builtin path in them as a TYPE use-site.
     */
    private void collectTypePaths(String text, int from, String sourceName, int lineNo, int indent,
                                  Set<String> generics, List<ModuleSource.PathReference> references) {
        int i = from;
        while (i < text.length()) {
            int start = -1;
            if (text.startsWith("->", i)) {
                start = i + 2;
            } else if (text.charAt(i) == ':'
                    && (i + 1 >= text.length() || text.charAt(i + 1) != ':')
                    && (i == 0 || text.charAt(i - 1) != ':')) {
                start = i + 1;
            }
            if (start < 0) {
                i++;
                continue;
            }
            int end = typeExpressionEnd(text, start);
            Matcher token = PATH_TOKEN.matcher(text).region(start, end);
            while (token.find()) {
                addTypeReference(token.group(), sourceName, lineNo, indent + token.start(), generics, references);
            }
            i = Math.max(end, start);
        }
    }

    private static int typeExpressionEnd(String text, int start) {
        int depth = 0;
        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '<', '(', '[' -> depth++;
                case '>' -> {
                    if (i > 0 && text.charAt(i - 1) == '-') break;
                    if (depth == 0) return i;
                    depth--;
                }
                case ')', ']' -> {
                    if (depth == 0) return i;
                    depth--;
                }
                case ',', ';', '{', '=' -> {
                    if (depth == 0) return i;
                }
                default -> {
                    if (depth == 0 && text.startsWith("->", i)) return i;
                }
            }
        }
        return text.length();
    }

    private void addTypeReference(String path, String sourceName, int lineNo, int column, Set<String> generics,
                                  List<ModuleSource.PathReference> references) {
        boolean bare = !path.contains("::");
        if (bare && (options.isBuiltin(path) || TYPE_KEYWORDS.contains(path) || generics.contains(path))) {
            return;
        }
        references.add(new ModuleSource.PathReference(path, Namespace.TYPE,
                new SourceLocation(sourceName, lineNo, column + 1)));
    }

    private static Set<String> genericNames(String generics) {
        if (generics == null || generics.isBlank()) {
            return Set.of();
        }
        Set<String> names = new HashSet<>();
        for (String param : generics.split(",")) {
            String name = param.strip().split("[\\s:]", 2)[0];
            if (!name.isEmpty()) names.add(name);
        }
        return names;
    }

    private static void trackBraces(String line, Block lineBlock, Deque<Block> blocks) {
        boolean first = true;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == '{') {
                blocks.push(first ? lineBlock : Block.OTHER);
                first = false;
            } else if (c == '}' && !blocks.isEmpty()) {
                blocks.pop();
            }
        }
    }

    private static String stripComment(String line) {
        int commentIdx = line.indexOf("//");
        return commentIdx >= 0 ? line.substring(0, commentIdx) : line;
    }
}
