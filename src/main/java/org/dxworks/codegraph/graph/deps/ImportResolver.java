package org.dxworks.codegraph.graph.deps;

import org.dxworks.codegraph.Language;
import org.dxworks.codegraph.model.SyntaxTree;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Maps an import target, as written in a source file, to the project files it names.
 * Paths are project-relative with forward slashes. A target that names nothing in the
 * project resolves to an empty list.
 */
public class ImportResolver {
    private static final List<String> SCRIPT_EXTENSIONS = List.of(
            "ts", "tsx", "mts", "cts", "js", "jsx", "mjs", "cjs");

    private final Map<String, Language> files;
    private final Map<String, List<String>> byStem = new LinkedHashMap<>();
    private final Map<String, List<String>> byDirectory = new LinkedHashMap<>();

    public ImportResolver(Map<String, Language> files) {
        this.files = new LinkedHashMap<>();
        for (String path : new TreeSet<>(files.keySet())) {
            this.files.put(path, files.get(path));
            byStem.computeIfAbsent(SyntaxTree.modulePathOf(path), k -> new ArrayList<>()).add(path);
            byDirectory.computeIfAbsent(directoryOf(path), k -> new ArrayList<>()).add(path);
        }
    }

    public List<String> resolve(String importer, Language language, String target) {
        if (target == null || target.isBlank()) {
            return Collections.emptyList();
        }
        switch (language) {
            case JAVASCRIPT:
            case TYPESCRIPT:
                return script(importer, target);
            case PYTHON:
                return python(importer, target);
            case JAVA:
            case KOTLIN:
            case SCALA:
                return qualified(language, target);
            case CSHARP:
            case SWIFT:
                return namespace(language, target);
            case RUST:
                return rust(importer, target);
            case GO:
                return goPackage(importer, target);
            case C:
            case CPP:
                return include(importer, language, target);
            case PHP:
                return php(importer, language, target);
            default:
                return Collections.emptyList();
        }
    }

    /** Relative specifiers only; bare ones name installed packages. */
    private List<String> script(String importer, String target) {
        if (!target.startsWith(".") && !target.startsWith("/")) {
            return Collections.emptyList();
        }
        String base = target.startsWith("/") ? normalize(target.substring(1)) : join(directoryOf(importer), target);
        if (base == null) {
            return Collections.emptyList();
        }
        List<String> candidates = new ArrayList<>();
        candidates.add(base);
        String stem = SyntaxTree.modulePathOf(base);
        if (!stem.equals(base)) {
            // "./util.js" written in TypeScript for a file compiled from util.ts
            for (String extension : SCRIPT_EXTENSIONS) {
                candidates.add(stem + "." + extension);
            }
        }
        for (String extension : SCRIPT_EXTENSIONS) {
            candidates.add(base + "." + extension);
        }
        for (String extension : SCRIPT_EXTENSIONS) {
            candidates.add(base + "/index." + extension);
        }
        return first(candidates);
    }

    private List<String> python(String importer, String target) {
        int dots = 0;
        while (dots < target.length() && target.charAt(dots) == '.') {
            dots++;
        }
        String rest = target.substring(dots).replace('.', '/');
        if (dots > 0) {
            String base = directoryOf(importer);
            for (int level = 1; level < dots; level++) {
                if (base.isEmpty()) {
                    return Collections.emptyList();
                }
                base = directoryOf(base);
            }
            if (rest.isEmpty()) {
                return exceptImporter(first(List.of(join(base, "__init__.py"))), importer);
            }
            String path = join(base, rest);
            List<String> module = first(List.of(path + ".py", path + "/__init__.py"));
            if (!module.isEmpty()) {
                return module;
            }
            // from . import name, where name lives in the package itself
            return exceptImporter(first(List.of(join(base, "__init__.py"))), importer);
        }
        String sibling = join(directoryOf(importer), rest);
        List<String> found = first(Arrays.asList(sibling + ".py", sibling + "/__init__.py", rest + ".py", rest + "/__init__.py"));
        if (!found.isEmpty()) {
            return found;
        }
        List<String> matches = byStemSuffix(rest, Language.PYTHON);
        matches.addAll(byStemSuffix(rest + "/__init__", Language.PYTHON));
        if (matches.isEmpty()) {
            return matches;
        }
        matches.sort(Comparator.comparingInt(String::length).thenComparing(Comparator.naturalOrder()));
        return List.of(matches.get(0));
    }

    /**
     * Package-qualified names such as {@code com.acme.Order}, matched against the end of
     * file paths so any source root works. Trailing member names of static imports are
     * dropped until a file matches; wildcards take every file in the package directory.
     */
    private List<String> qualified(Language language, String target) {
        List<String> segments = new ArrayList<>(Arrays.asList(target.split("\\.")));
        String last = segments.get(segments.size() - 1);
        if (last.equals("*") || last.equals("_")) {
            segments.remove(segments.size() - 1);
            return byDirectorySuffix(String.join("/", segments), language, null);
        }
        while (segments.size() >= 2) {
            List<String> matches = byStemSuffix(String.join("/", segments), language);
            if (!matches.isEmpty()) {
                return matches;
            }
            segments.remove(segments.size() - 1);
        }
        return Collections.emptyList();
    }

    /**
     * Namespaces and modules that map to directories: a file matching the full name wins,
     * otherwise every file of the deepest directory matching a suffix of the name.
     */
    private List<String> namespace(Language language, String target) {
        List<String> segments = new ArrayList<>(Arrays.asList(target.split("\\.")));
        List<String> file = byStemSuffix(String.join("/", segments), language);
        if (!file.isEmpty() && segments.size() >= 2) {
            return file;
        }
        while (!segments.isEmpty()) {
            List<String> matches = byDirectorySuffix(String.join("/", segments), language, null);
            if (!matches.isEmpty()) {
                return matches;
            }
            segments.remove(0);
        }
        return Collections.emptyList();
    }

    /**
     * {@code mod name;} names a file next to the declaring module. {@code use} paths start
     * from the crate root, the current module or its parent; the longest prefix naming a
     * file wins. Paths into other crates stay unresolved.
     */
    private List<String> rust(String importer, String target) {
        String moduleDirectory = rustModuleDirectory(importer);
        if (!target.contains("::")) {
            return first(List.of(join(moduleDirectory, target + ".rs"), join(moduleDirectory, target + "/mod.rs"),
                    join(directoryOf(importer), target + ".rs")));
        }
        List<String> segments = new ArrayList<>();
        for (String segment : target.split("::")) {
            if (!segment.isEmpty()) {
                segments.add(segment);
            }
        }
        if (segments.isEmpty()) {
            return Collections.emptyList();
        }
        String base;
        String head = segments.remove(0);
        switch (head) {
            case "crate":
                base = crateRoot(importer);
                break;
            case "self":
                base = moduleDirectory;
                break;
            case "super":
                base = isModuleRoot(importer) ? directoryOf(directoryOf(importer)) : directoryOf(importer);
                while (!segments.isEmpty() && segments.get(0).equals("super")) {
                    segments.remove(0);
                    base = directoryOf(base);
                }
                break;
            default:
                return Collections.emptyList();
        }
        for (int length = segments.size(); length >= 1; length--) {
            String path = join(base, String.join("/", segments.subList(0, length)));
            List<String> found = exceptImporter(first(List.of(path + ".rs", path + "/mod.rs")), importer);
            if (!found.isEmpty()) {
                return found;
            }
        }
        return Collections.emptyList();
    }

    private static boolean isModuleRoot(String path) {
        String name = fileNameOf(path);
        return name.equals("mod.rs") || name.equals("lib.rs") || name.equals("main.rs");
    }

    /** Directory holding the child modules a file declares with {@code mod}. */
    private static String rustModuleDirectory(String importer) {
        if (isModuleRoot(importer)) {
            return directoryOf(importer);
        }
        return SyntaxTree.modulePathOf(importer);
    }

    private String crateRoot(String importer) {
        String directory = directoryOf(importer);
        while (true) {
            if (files.containsKey(join(directory, "lib.rs")) || files.containsKey(join(directory, "main.rs"))) {
                return directory;
            }
            if (directory.isEmpty()) {
                return directoryOf(importer);
            }
            directory = directoryOf(directory);
        }
    }

    /** A Go import path names a package directory; the longest matching directory suffix wins. */
    private List<String> goPackage(String importer, String target) {
        List<String> segments = new ArrayList<>(Arrays.asList(target.split("/")));
        String own = directoryOf(importer);
        while (!segments.isEmpty()) {
            List<String> matches = byDirectorySuffix(String.join("/", segments), Language.GO, "_test.go");
            matches.removeIf(path -> directoryOf(path).equals(own));
            if (!matches.isEmpty()) {
                return matches;
            }
            segments.remove(0);
        }
        return Collections.emptyList();
    }

    private List<String> include(String importer, Language language, String target) {
        String relative = join(directoryOf(importer), target);
        List<String> found = first(relative == null ? List.of(target) : List.of(relative, target));
        if (!found.isEmpty()) {
            return found;
        }
        return byPathSuffix(target, language);
    }

    private List<String> php(String importer, Language language, String target) {
        if (target.endsWith(".php") || target.contains("/")) {
            List<String> found = include(importer, language, target);
            return exceptImporter(found, importer);
        }
        List<String> segments = new ArrayList<>(Arrays.asList(target.replace('\\', '/').split("/")));
        segments.removeIf(String::isEmpty);
        int minimum = segments.size() == 1 ? 1 : 2;
        while (segments.size() >= minimum) {
            List<String> matches = byStemSuffix(String.join("/", segments), language);
            if (!matches.isEmpty()) {
                return matches;
            }
            segments.remove(0);
        }
        return Collections.emptyList();
    }

    private List<String> first(List<String> candidates) {
        for (String candidate : candidates) {
            if (candidate != null && files.containsKey(candidate)) {
                return List.of(candidate);
            }
        }
        return Collections.emptyList();
    }

    private static List<String> exceptImporter(List<String> found, String importer) {
        if (found.size() == 1 && found.get(0).equals(importer)) {
            return Collections.emptyList();
        }
        return found;
    }

    private List<String> byStemSuffix(String suffix, Language language) {
        List<String> result = new ArrayList<>();
        if (suffix.isEmpty()) {
            return result;
        }
        for (Map.Entry<String, List<String>> entry : byStem.entrySet()) {
            if (endsWithSegments(entry.getKey(), suffix)) {
                for (String path : entry.getValue()) {
                    if (sameFamily(files.get(path), language)) {
                        result.add(path);
                    }
                }
            }
        }
        return result;
    }

    private List<String> byDirectorySuffix(String suffix, Language language, String excludedEnding) {
        List<String> result = new ArrayList<>();
        if (suffix.isEmpty()) {
            return result;
        }
        for (Map.Entry<String, List<String>> entry : byDirectory.entrySet()) {
            if (endsWithSegments(entry.getKey(), suffix)) {
                for (String path : entry.getValue()) {
                    if (sameFamily(files.get(path), language) && (excludedEnding == null || !path.endsWith(excludedEnding))) {
                        result.add(path);
                    }
                }
            }
        }
        return result;
    }

    private List<String> byPathSuffix(String suffix, Language language) {
        List<String> result = new ArrayList<>();
        for (Map.Entry<String, Language> entry : files.entrySet()) {
            if (endsWithSegments(entry.getKey(), suffix) && sameFamily(entry.getValue(), language)) {
                result.add(entry.getKey());
            }
        }
        return result;
    }

    private static boolean endsWithSegments(String path, String suffix) {
        return path.equals(suffix) || path.endsWith("/" + suffix);
    }

    /** Languages that import each other's files: the JVM languages, JavaScript with TypeScript, C with C++. */
    static boolean sameFamily(Language a, Language b) {
        return a == b || family(a).equals(family(b));
    }

    private static String family(Language language) {
        switch (language) {
            case JAVA:
            case KOTLIN:
            case SCALA:
                return "jvm";
            case JAVASCRIPT:
            case TYPESCRIPT:
                return "script";
            case C:
            case CPP:
                return "c";
            default:
                return language.getName();
        }
    }

    static String directoryOf(String path) {
        int slash = path.lastIndexOf('/');
        return slash < 0 ? "" : path.substring(0, slash);
    }

    private static String fileNameOf(String path) {
        return path.substring(path.lastIndexOf('/') + 1);
    }

    private static String join(String directory, String relative) {
        return normalize(directory.isEmpty() ? relative : directory + "/" + relative);
    }

    /** Folds {@code .} and {@code ..} segments; null when the path climbs above the project root. */
    static String normalize(String path) {
        List<String> segments = new ArrayList<>();
        for (String segment : path.replace('\\', '/').split("/")) {
            if (segment.isEmpty() || segment.equals(".")) {
                continue;
            }
            if (segment.equals("..")) {
                if (segments.isEmpty()) {
                    return null;
                }
                segments.remove(segments.size() - 1);
                continue;
            }
            segments.add(segment);
        }
        return String.join("/", segments);
    }
}
