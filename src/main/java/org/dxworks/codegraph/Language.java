package org.dxworks.codegraph;

import java.util.List;
import java.util.Optional;

public enum Language {
    JAVA("java", "java"),
    PYTHON("python", "py", "pyw", "pyi"),
    JAVASCRIPT("javascript", "js", "mjs", "cjs", "jsx"),
    TYPESCRIPT("typescript", "ts", "tsx", "mts", "cts"),
    RUST("rust", "rs"),
    GO("go", "go"),
    C("c", "c", "h"),
    CPP("cpp", "cpp", "cc", "cxx", "hpp", "hh", "hxx"),
    CSHARP("csharp", "cs"),
    KOTLIN("kotlin", "kt", "kts"),
    SWIFT("swift", "swift"),
    PHP("php", "php"),
    SCALA("scala", "scala", "sc");

    private final String name;
    private final List<String> extensions;

    Language(String name, String... extensions) {
        this.name = name;
        this.extensions = List.of(extensions);
    }

    public String getName() {
        return name;
    }

    public List<String> getExtensions() {
        return extensions;
    }

    public static Optional<Language> fromName(String name) {
        for (Language language : values()) {
            if (language.name.equalsIgnoreCase(name)) {
                return Optional.of(language);
            }
        }
        return Optional.empty();
    }

    public boolean matchesFileName(String fileName) {
        String lower = fileName.toLowerCase();
        for (String ext : extensions) {
            if (lower.endsWith("." + ext)) {
                return true;
            }
        }
        return false;
    }
}
