package org.dxworks.codegraph.engine;

import org.dxworks.codegraph.CodegraphConfig;
import org.dxworks.codegraph.LanguageRegistry;
import org.dxworks.codegraph.model.DiagnosticKind;
import org.dxworks.ignorerLibrary.Ignorer;
import org.dxworks.ignorerLibrary.IgnorerBuilder;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.FileVisitor;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Predicate;

/**
 * Finds the source files under a target: a single file, or every file of a known language
 * below a directory, skipping excluded directories and files matched by the ignore file.
 * Paths come back sorted.
 */
public class SourceCollector {
    private final CodegraphConfig config;
    private final LanguageRegistry registry;

    public SourceCollector(CodegraphConfig config, LanguageRegistry registry) {
        this.config = config;
        this.registry = registry;
    }

    /**
     * @param extensions extensions to keep, with or without the leading dot; empty keeps
     *                   every language the registry knows
     * @param diagnostics receives an entry for every directory or file that cannot be visited
     */
    public List<Path> collect(Path target, Collection<String> extensions, DiagnosticCollector diagnostics) {
        if (!Files.exists(target)) {
            throw new InvalidRequestException("Input path does not exist: " + target);
        }
        Set<String> wanted = normalize(extensions);
        List<Path> files = new ArrayList<>();
        try {
            Predicate<Path> notIgnored = ignoreRules();
            if (Files.isRegularFile(target)) {
                if (notIgnored.test(target) && accepts(target, wanted)) {
                    files.add(target);
                }
                return files;
            }
            walk(target, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (!dir.equals(target) && config.getExcludeDirectories().contains(dir.getFileName().toString())) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile() && notIgnored.test(file) && accepts(file, wanted)) {
                        files.add(file);
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException e) {
                    diagnostics.add(file.toString(), DiagnosticKind.IO_FAILURE, e.toString());
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult postVisitDirectory(Path dir, IOException e) {
                    if (e != null) {
                        diagnostics.add(dir.toString(), DiagnosticKind.IO_FAILURE, e.toString());
                    }
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            diagnostics.add(target.toString(), DiagnosticKind.IO_FAILURE, e.toString());
        }
        Collections.sort(files);
        return files;
    }

    void walk(Path target, FileVisitor<Path> visitor) throws IOException {
        Files.walkFileTree(target, visitor);
    }

    /** Glob rules of the configured ignore file; everything passes when there is none. */
    private Predicate<Path> ignoreRules() throws IOException {
        Path ignoreFile = config.getIgnoreFile();
        if (ignoreFile == null || !Files.isRegularFile(ignoreFile)) {
            return path -> true;
        }
        Ignorer ignorer = new IgnorerBuilder(ignoreFile).compile();
        return path -> ignorer.accepts(path.toAbsolutePath().toString());
    }

    /** Directory that relative paths are computed from: the target itself, or a file's parent. */
    public static Path rootOf(Path target) {
        if (Files.isDirectory(target)) {
            return target;
        }
        Path parent = target.toAbsolutePath().getParent();
        return parent == null ? target : parent;
    }

    public static String relativePath(Path root, Path file) {
        Path relative = root.toAbsolutePath().normalize().relativize(file.toAbsolutePath().normalize());
        String path = relative.toString().replace('\\', '/');
        return path.isEmpty() ? file.getFileName().toString() : path;
    }

    private boolean accepts(Path file, Set<String> wanted) {
        if (registry.profileFor(file).isEmpty()) {
            return false;
        }
        if (wanted.isEmpty()) {
            return true;
        }
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        int dot = name.lastIndexOf('.');
        return dot >= 0 && wanted.contains(name.substring(dot + 1));
    }

    private static Set<String> normalize(Collection<String> extensions) {
        Set<String> result = new TreeSet<>();
        if (extensions == null) {
            return result;
        }
        for (String extension : extensions) {
            for (String part : extension.split(",")) {
                String trimmed = part.trim().toLowerCase(Locale.ROOT);
                if (trimmed.startsWith(".")) {
                    trimmed = trimmed.substring(1);
                }
                if (!trimmed.isEmpty()) {
                    result.add(trimmed);
                }
            }
        }
        return result;
    }
}
