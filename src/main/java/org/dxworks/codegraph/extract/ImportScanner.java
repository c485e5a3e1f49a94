package org.dxworks.codegraph.extract;

import org.dxworks.codegraph.Language;
import org.dxworks.codegraph.LanguageProfile;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line-level import/use extraction from a language profile's import patterns, plus the
 * top-level names a file exports. Works on raw text only, so the dependency graph never
 * waits for declaration extraction.
 */
public class ImportScanner {

    private static final Pattern BLOCK_START = Pattern.compile("^\\s*import\\s*\\(\\s*$");
    private static final Pattern PYTHON_IMPORT = Pattern.compile("^\\s*import\\s+(.+)$");
    private static final Pattern PYTHON_RELATIVE = Pattern.compile("^\\s*from\\s+(\\.+)\\s+import\\s+\\(?([^)]+)\\)?\\s*$");

    public static class ImportRef {
        public final String target;
        public final int line;

        public ImportRef(String target, int line) {
            this.target = target;
            this.line = line;
        }

        @Override
        public String toString() {
            return target + "@" + line;
        }
    }

    public List<ImportRef> scan(String source, LanguageProfile profile) {
        List<ImportRef> imports = new ArrayList<>();
        String[] lines = CodeMask.mask(source, profile, true).split("\n", -1);
        Pattern blockEntry = profile.getImportBlockEntryPattern();
        boolean inBlock = false;
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            int lineNumber = i + 1;
            if (blockEntry != null) {
                if (BLOCK_START.matcher(line).matches()) {
                    inBlock = true;
                    continue;
                }
                if (inBlock) {
                    if (line.trim().startsWith(")")) {
                        inBlock = false;
                    } else {
                        Matcher entry = blockEntry.matcher(line);
                        if (entry.find()) {
                            imports.add(new ImportRef(entry.group("target"), lineNumber));
                        }
                    }
                    continue;
                }
            }
            if (profile.getLanguage() == Language.PYTHON && scanPython(line, lineNumber, imports)) {
                continue;
            }
            for (Pattern pattern : profile.getImportPatterns()) {
                Matcher matcher = pattern.matcher(line);
                while (matcher.find()) {
                    String target = matcher.group("target");
                    if (target != null && !target.isEmpty()) {
                        imports.add(new ImportRef(target, lineNumber));
                    }
                }
            }
        }
        return imports;
    }

    /**
     * Names of functions and types declared without indentation, in file order. Nested
     * members are left out since they belong to the type that declares them.
     */
    public List<String> exports(String source, LanguageProfile profile) {
        Set<String> names = new LinkedHashSet<>();
        for (String line : CodeMask.mask(source, profile, false).split("\n", -1)) {
            if (line.isEmpty() || Character.isWhitespace(line.charAt(0))) {
                continue;
            }
            String name = firstName(profile.getClassPatterns(), line);
            if (name == null) {
                name = firstName(profile.getFunctionPatterns(), line);
            }
            if (name != null && !profile.getReservedWords().contains(name)) {
                names.add(name);
            }
        }
        return new ArrayList<>(names);
    }

    private static String firstName(List<Pattern> patterns, String line) {
        for (Pattern pattern : patterns) {
            Matcher matcher = pattern.matcher(line);
            if (matcher.find()) {
                return matcher.group("name");
            }
        }
        return null;
    }

    /** {@code import a, b as c} and {@code from . import x, y} name several modules on one line. */
    private static boolean scanPython(String line, int lineNumber, List<ImportRef> imports) {
        Matcher plain = PYTHON_IMPORT.matcher(line);
        if (plain.matches()) {
            for (String part : plain.group(1).split(",")) {
                String name = part.trim().split("\\s+")[0];
                if (!name.isEmpty()) {
                    imports.add(new ImportRef(name, lineNumber));
                }
            }
            return true;
        }
        Matcher relative = PYTHON_RELATIVE.matcher(line);
        if (relative.matches()) {
            for (String part : relative.group(2).split(",")) {
                String name = part.trim().split("\\s+")[0];
                if (!name.isEmpty() && !name.equals("*")) {
                    imports.add(new ImportRef(relative.group(1) + name, lineNumber));
                }
            }
            return true;
        }
        return false;
    }
}
