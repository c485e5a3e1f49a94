package org.dxworks.codegraph;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Explicit table of language profiles, constructed once at startup and handed to every
 * component that needs a lookup by file extension.
 */
public class LanguageRegistry {

    private static final String MODIFIERS_JAVA = "(?:(?:public|private|protected|static|final|abstract|synchronized|native|default|strictfp)\\s+)";
    private static final String MODIFIERS_CSHARP = "(?:(?:public|private|protected|internal|static|virtual|override|abstract|sealed|async|extern|unsafe|new|partial)\\s+)";
    private static final String TYPE_DECL = "\\b(?:class|interface|enum|record|struct|trait|object|protocol)\\s+(?<name>\\w+)";

    private final Map<Language, LanguageProfile> profiles;

    public LanguageRegistry(Collection<LanguageProfile> profiles) {
        Map<Language, LanguageProfile> byLanguage = new EnumMap<>(Language.class);
        for (LanguageProfile profile : profiles) {
            byLanguage.put(profile.getLanguage(), profile);
        }
        this.profiles = Collections.unmodifiableMap(byLanguage);
    }

    public Optional<LanguageProfile> profileFor(Path filePath) {
        String fileName = filePath.getFileName().toString().toLowerCase();
        for (LanguageProfile profile : profiles.values()) {
            if (profile.getLanguage().matchesFileName(fileName)) {
                return Optional.of(profile);
            }
        }
        return Optional.empty();
    }

    public Optional<LanguageProfile> profileFor(Language language) {
        return Optional.ofNullable(profiles.get(language));
    }

    public Collection<LanguageProfile> profiles() {
        return profiles.values();
    }

    public Set<String> allLanguageNames() {
        return Arrays.stream(Language.values())
            .filter(profiles::containsKey)
            .map(Language::getName)
            .collect(Collectors.toSet());
    }

    public static LanguageRegistry defaults() {
        return new LanguageRegistry(Arrays.asList(
            LanguageProfile.builder(Language.JAVA).grammar()
                .function("^\\s*" + MODIFIERS_JAVA + "+(?:<[^>]+>\\s+)?[\\w<>\\[\\],.?]+(?:\\s*<[^>]*>)?\\s+(?<name>\\w+)\\s*\\(")
                .type(TYPE_DECL)
                .imports("^\\s*import\\s+(?:static\\s+)?(?<target>[\\w.]+(?:\\.\\*)?)\\s*;")
                .lineComment("//").blockComment("/*", "*/")
                .build(),
            LanguageProfile.builder(Language.PYTHON).grammar().indentation()
                .function("^\\s*(?:async\\s+)?def\\s+(?<name>\\w+)\\s*\\(")
                .type("^\\s*class\\s+(?<name>\\w+)")
                .imports("^\\s*import\\s+(?<target>[\\w.]+)")
                .imports("^\\s*from\\s+(?<target>\\.*[\\w.]*)\\s+import\\b")
                .lineComment("#")
                .build(),
            LanguageProfile.builder(Language.JAVASCRIPT).grammar()
                .function("^\\s*(?:export\\s+)?(?:default\\s+)?(?:async\\s+)?function\\s*\\*?\\s*(?<name>[\\w$]+)\\s*\\(")
                .function("^\\s*(?:export\\s+)?(?:const|let|var)\\s+(?<name>[\\w$]+)\\s*=\\s*(?:async\\s+)?(?:function\\b|\\([^)]*\\)\\s*=>|[\\w$]+\\s*=>)")
                .function("^\\s*(?:static\\s+)?(?:async\\s+)?(?<name>[\\w$]+)\\s*\\([^)]*\\)\\s*\\{\\s*$")
                .type(TYPE_DECL)
                .imports("^\\s*import\\s+(?:[^'\"]*\\s+from\\s+)?['\"](?<target>[^'\"]+)['\"]")
                .imports("\\brequire\\s*\\(\\s*['\"](?<target>[^'\"]+)['\"]\\s*\\)")
                .imports("^\\s*export\\s+[^'\"]*\\s+from\\s+['\"](?<target>[^'\"]+)['\"]")
                .lineComment("//").blockComment("/*", "*/")
                .build(),
            LanguageProfile.builder(Language.TYPESCRIPT)
                .function("^\\s*(?:export\\s+)?(?:default\\s+)?(?:async\\s+)?function\\s*\\*?\\s*(?<name>[\\w$]+)\\s*[<(]")
                .function("^\\s*(?:export\\s+)?(?:const|let|var)\\s+(?<name>[\\w$]+)\\s*(?::[^=]+)?=\\s*(?:async\\s+)?(?:function\\b|\\([^)]*\\)\\s*(?::[^=]+)?=>|[\\w$]+\\s*=>)")
                .function("^\\s*(?:(?:public|private|protected|static|async|readonly|override)\\s+)*(?<name>[\\w$]+)\\s*\\([^)]*\\)\\s*(?::\\s*[^{]+)?\\{\\s*$")
                .type(TYPE_DECL)
                .type("^\\s*(?:export\\s+)?type\\s+(?<name>\\w+)\\s*=")
                .imports("^\\s*import\\s+(?:type\\s+)?(?:[^'\"]*\\s+from\\s+)?['\"](?<target>[^'\"]+)['\"]")
                .imports("\\brequire\\s*\\(\\s*['\"](?<target>[^'\"]+)['\"]\\s*\\)")
                .imports("^\\s*export\\s+[^'\"]*\\s+from\\s+['\"](?<target>[^'\"]+)['\"]")
                .lineComment("//").blockComment("/*", "*/")
                .build(),
            LanguageProfile.builder(Language.RUST).noSwitchFallthrough()
                .function("^\\s*(?:pub(?:\\([^)]*\\))?\\s+)?(?:const\\s+)?(?:async\\s+)?(?:unsafe\\s+)?(?:extern\\s+\"[^\"]*\"\\s+)?fn\\s+(?<name>\\w+)")
                .type("^\\s*(?:pub(?:\\([^)]*\\))?\\s+)?(?:struct|enum|trait|union)\\s+(?<name>\\w+)")
                .type("^\\s*impl(?:<[^>]*>)?\\s+(?:[\\w:<>]+\\s+for\\s+)?(?<name>\\w+)")
                .imports("^\\s*(?:pub\\s+)?mod\\s+(?<target>\\w+)\\s*;")
                .imports("^\\s*(?:pub\\s+)?use\\s+(?<target>[\\w:]+)")
                .lineComment("//").blockComment("/*", "*/")
                .build(),
            LanguageProfile.builder(Language.GO).noSwitchFallthrough()
                .function("^\\s*func\\s+(?:\\([^)]*\\)\\s*)?(?<name>\\w+)\\s*[(\\[]")
                .type("^\\s*type\\s+(?<name>\\w+)\\s+(?:struct|interface)\\b")
                .imports("^\\s*import\\s+(?:[\\w.]+\\s+)?\"(?<target>[^\"]+)\"")
                .importBlockEntry("^\\s*(?:[\\w.]+\\s+)?\"(?<target>[^\"]+)\"")
                .lineComment("//").blockComment("/*", "*/")
                .build(),
            LanguageProfile.builder(Language.C)
                .function("^\\s*(?:(?:static|inline|extern|const|unsigned|signed)\\s+)*[\\w*]+[\\s*]+(?<name>\\w+)\\s*\\([^;]*\\)\\s*\\{?\\s*$")
                .type("^\\s*(?:typedef\\s+)?(?:struct|union|enum)\\s+(?<name>\\w+)")
                .imports("^\\s*#\\s*include\\s+[\"<](?<target>[^\">]+)[\">]")
                .lineComment("//").blockComment("/*", "*/")
                .build(),
            LanguageProfile.builder(Language.CPP)
                .function("^\\s*(?:(?:static|inline|extern|virtual|const|constexpr|unsigned|signed)\\s+)*(?:[\\w*&:<>,]+[\\s*&]+)?(?:\\w+::)*(?<name>~?\\w+)\\s*\\([^;]*\\)\\s*(?:const\\s*)?(?:override\\s*)?(?:noexcept\\s*)?\\{?\\s*$")
                .type("^\\s*(?:template\\s*<[^>]*>\\s*)?(?:class|struct|union|enum(?:\\s+class)?|namespace)\\s+(?<name>\\w+)")
                .imports("^\\s*#\\s*include\\s+[\"<](?<target>[^\">]+)[\">]")
                .lineComment("//").blockComment("/*", "*/")
                .build(),
            LanguageProfile.builder(Language.CSHARP)
                .function("^\\s*" + MODIFIERS_CSHARP + "+[\\w<>\\[\\],.?]+\\s+(?<name>\\w+)\\s*(?:<[^>]+>)?\\s*\\(")
                .type(TYPE_DECL)
                .imports("^\\s*using\\s+(?:static\\s+)?(?<target>[\\w.]+)\\s*;")
                .lineComment("//").blockComment("/*", "*/")
                .build(),
            LanguageProfile.builder(Language.KOTLIN)
                .function("^\\s*(?:(?:public|private|protected|internal|override|open|suspend|inline|operator|infix|tailrec)\\s+)*fun\\s+(?:<[^>]+>\\s*)?(?:[\\w.]+\\.)?(?<name>\\w+)\\s*\\(")
                .type(TYPE_DECL)
                .imports("^\\s*import\\s+(?<target>[\\w.]+)")
                .lineComment("//").blockComment("/*", "*/")
                .build(),
            LanguageProfile.builder(Language.SWIFT).noSwitchFallthrough()
                .function("^\\s*(?:(?:public|private|internal|fileprivate|open|static|class|override|mutating|@objc)\\s+)*func\\s+(?<name>\\w+)")
                .type(TYPE_DECL)
                .type("^\\s*extension\\s+(?<name>\\w+)")
                .imports("^\\s*import\\s+(?<target>\\w+)")
                .lineComment("//").blockComment("/*", "*/")
                .build(),
            LanguageProfile.builder(Language.PHP)
                .function("^\\s*(?:(?:public|private|protected|static|abstract|final)\\s+)*function\\s+&?(?<name>\\w+)\\s*\\(")
                .type(TYPE_DECL)
                .imports("^\\s*(?:require|include)(?:_once)?\\s*\\(?\\s*['\"](?<target>[^'\"]+)['\"]")
                .imports("^\\s*use\\s+(?<target>[\\w\\\\]+)")
                .lineComment("//", "#").blockComment("/*", "*/")
                .build(),
            LanguageProfile.builder(Language.SCALA).noSwitchFallthrough()
                .function("^\\s*(?:(?:private|protected|override|final|implicit|inline)\\s+)*def\\s+(?<name>\\w+)")
                .type(TYPE_DECL)
                .imports("^\\s*import\\s+(?<target>[\\w.]+)")
                .lineComment("//").blockComment("/*", "*/")
                .build()
        ));
    }
}
