package org.dxworks.codegraph.graph.deps;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** One source file seen as a module. */
public class ModuleNode {
    public final int id;
    public final String filePath;
    public final String modulePath;
    public final String language;
    private final List<String> exports;
    private final List<String> unresolvedImports = new ArrayList<>();
    private boolean selfImport;

    ModuleNode(int id, String filePath, String modulePath, String language, List<String> exports) {
        this.id = id;
        this.filePath = filePath;
        this.modulePath = modulePath;
        this.language = language;
        this.exports = Collections.unmodifiableList(new ArrayList<>(exports));
    }

    /** Function and type names declared at the top of the file. */
    public List<String> getExports() {
        return exports;
    }

    /** Import targets outside the project, such as packages from a registry. */
    public List<String> getUnresolvedImports() {
        return Collections.unmodifiableList(unresolvedImports);
    }

    void addUnresolvedImport(String target) {
        if (!unresolvedImports.contains(target)) {
            unresolvedImports.add(target);
        }
    }

    /** The module imports itself; its self-edge is the one-module cycle. */
    public boolean isSelfImport() {
        return selfImport;
    }

    void setSelfImport(boolean selfImport) {
        this.selfImport = selfImport;
    }

    @Override
    public String toString() {
        return filePath;
    }
}
