package org.dxworks.codegraph.extract;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.dxworks.codegraph.Language;
import org.dxworks.codegraph.LanguageProfile;
import org.dxworks.codegraph.model.DeclKind;
import org.dxworks.codegraph.model.DeclNode;
import org.dxworks.codegraph.model.FunctionUnit;
import org.dxworks.codegraph.model.SyntaxTree;
import org.treesitter.TSLanguage;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSTree;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.dxworks.codegraph.extract.TreeSitterHelper.*;

/**
 * Declaration extraction from a tree-sitter concrete syntax tree, for the languages whose
 * grammar ships with the build (Java, Python, JavaScript).
 */
public class GrammarExtractor {
    private static final Logger logger = LogManager.getLogger(GrammarExtractor.class);

    public static final String MODULE_FUNCTION = "<module>";

    private static final Map<Language, String> GRAMMAR_CLASSES = Map.of(
            Language.JAVA, "org.treesitter.TreeSitterJava",
            Language.PYTHON, "org.treesitter.TreeSitterPython",
            Language.JAVASCRIPT, "org.treesitter.TreeSitterJavascript");

    private final Map<Language, TSLanguage> grammars = new EnumMap<>(Language.class);
    private final boolean failOnParseError;

    public GrammarExtractor(boolean failOnParseError) {
        this.failOnParseError = failOnParseError;
        for (Map.Entry<Language, String> entry : GRAMMAR_CLASSES.entrySet()) {
            try {
                TSLanguage grammar = (TSLanguage) Class.forName(entry.getValue()).getDeclaredConstructor().newInstance();
                grammars.put(entry.getKey(), grammar);
            } catch (ReflectiveOperationException | LinkageError e) {
                logger.warn("Grammar for {} unavailable, falling back to patterns: {}", entry.getKey().getName(), e.toString());
            }
        }
    }

    public boolean supports(Language language) {
        return grammars.containsKey(language);
    }

    public SyntaxTree extract(String filePath, String source, LanguageProfile profile) throws ParseFailureException {
        Language language = profile.getLanguage();
        TSLanguage grammar = grammars.get(language);
        if (grammar == null) {
            throw new IllegalStateException("No grammar loaded for " + language.getName());
        }

        TSParser parser = new TSParser();
        parser.setLanguage(grammar);
        TSTree tree = parser.parseString(null, source);
        TSNode root = tree.getRootNode();
        if (failOnParseError && root.hasError()) {
            TSNode error = findFirstDescendantOfTypes(root, "ERROR");
            int line = error != null ? startLine(error) : startLine(root);
            throw new ParseFailureException("syntax error near line " + line, line);
        }

        SyntaxTree.Builder builder = SyntaxTree.builder(filePath, language.getName(), false);
        Walk walk = new Walk(builder, bytesOf(source), language);
        walk.visitChildren(root, new Scope(-1, "", builder.getModulePath() + "::" + MODULE_FUNCTION, false));
        return builder.build();
    }

    private static final class Scope {
        final int parentId;
        final String prefix;
        final String enclosingFunction;
        final boolean exported;

        Scope(int parentId, String prefix, String enclosingFunction, boolean exported) {
            this.parentId = parentId;
            this.prefix = prefix;
            this.enclosingFunction = enclosingFunction;
            this.exported = exported;
        }
    }

    private static final class Walk {
        private final SyntaxTree.Builder builder;
        private final byte[] src;
        private final Language language;

        Walk(SyntaxTree.Builder builder, byte[] src, Language language) {
            this.builder = builder;
            this.src = src;
            this.language = language;
        }

        void visitChildren(TSNode node, Scope scope) {
            for (TSNode child : namedChildren(node)) {
                visit(child, scope);
            }
        }

        void visit(TSNode node, Scope scope) {
            String type = node.getType();
            if (isClass(type)) {
                visitClass(node, scope);
                return;
            }
            if (isFunction(type)) {
                visitFunction(node, getFieldText(src, node, "name"), scope);
                return;
            }
            switch (type) {
                case "export_statement":
                    TSNode exportSource = getChildByFieldName(node, "source");
                    if (exportSource != null) {
                        addImport(unquote(getNodeText(src, exportSource)), node, scope);
                    }
                    visitChildren(node, new Scope(scope.parentId, scope.prefix, scope.enclosingFunction, true));
                    return;
                case "import_declaration":
                    addImport(javaImportTarget(node), node, scope);
                    return;
                case "import_statement":
                    visitImportStatement(node, scope);
                    return;
                case "import_from_statement":
                    addImport(getFieldText(src, node, "module_name"), node, scope);
                    return;
                case "method_invocation":
                case "object_creation_expression":
                case "call":
                case "call_expression":
                case "new_expression":
                    visitCall(node, scope);
                    break;
                case "local_variable_declaration":
                case "field_declaration":
                case "lexical_declaration":
                case "variable_declaration":
                    if (visitDeclarators(node, scope)) {
                        return;
                    }
                    break;
                case "assignment":
                    visitPythonAssignment(node, scope);
                    break;
                default:
                    break;
            }
            visitChildren(node, scope);
        }

        private boolean isClass(String type) {
            return isTypeOneOf(type, "class_declaration", "interface_declaration", "enum_declaration",
                    "record_declaration", "class_definition", "class");
        }

        private boolean isFunction(String type) {
            return isTypeOneOf(type, "method_declaration", "constructor_declaration", "function_definition",
                    "function_declaration", "generator_function_declaration", "method_definition");
        }

        private void visitClass(TSNode node, Scope scope) {
            String name = getFieldText(src, node, "name");
            if (name == null) {
                visitChildren(node, scope);
                return;
            }
            DeclNode.Draft draft = new DeclNode.Draft(DeclKind.CLASS, name).lines(startLine(node), endLine(node));
            draft.qualifiedName = builder.getModulePath() + "::" + scope.prefix + name;
            draft.visibility = visibility(node, name, scope);
            draft.parentId = scope.parentId;
            DeclNode decl = builder.add(draft);
            TSNode body = getChildByFieldName(node, "body");
            if (body != null) {
                visitChildren(body, new Scope(decl.id, scope.prefix + name + ".", scope.enclosingFunction, false));
            }
        }

        private void visitFunction(TSNode node, String name, Scope scope) {
            if (name == null) {
                visitChildren(node, scope);
                return;
            }
            DeclNode.Draft draft = new DeclNode.Draft(DeclKind.FUNCTION, name).lines(startLine(node), endLine(node));
            String qualifiedName = builder.getModulePath() + "::" + scope.prefix + name;
            draft.qualifiedName = qualifiedName;
            draft.visibility = visibility(node, name, scope);
            draft.parentId = scope.parentId;
            draft.parameters = parameters(node);
            DeclNode decl = builder.add(draft);

            TSNode body = getChildByFieldName(node, "body");
            if (body == null) {
                return;
            }
            String signature = normalizeInline(getRangeText(src, node.getStartByte(), body.getStartByte()));
            if (signature.endsWith(":")) {
                signature = signature.substring(0, signature.length() - 1).trim();
            }
            builder.addFunction(functionUnit(decl, signature, body));
            visitChildren(body, new Scope(decl.id, scope.prefix + name + ".", qualifiedName, false));
        }

        private FunctionUnit functionUnit(DeclNode decl, String signature, TSNode body) {
            String text = getNodeText(src, body);
            int bodyLine = startLine(body);
            if (isNodeTypeOneOf(body, "block", "constructor_body", "statement_block") && language != Language.PYTHON) {
                String inner = text.startsWith("{") && text.endsWith("}") ? text.substring(1, text.length() - 1) : text;
                return new FunctionUnit(decl, signature, inner, bodyLine, false);
            }
            if (language == Language.PYTHON) {
                String padded = " ".repeat(body.getStartPoint().getColumn()) + text;
                return new FunctionUnit(decl, signature, padded, bodyLine, false);
            }
            return new FunctionUnit(decl, signature, text, bodyLine, true);
        }

        private List<String> parameters(TSNode function) {
            List<String> names = new ArrayList<>();
            TSNode params = getChildByFieldName(function, "parameters");
            if (params == null) {
                TSNode single = getChildByFieldName(function, "parameter");
                if (single != null) {
                    names.add(getNodeText(src, single));
                }
                return names;
            }
            if (params.getType().equals("identifier")) {
                names.add(getNodeText(src, params));
                return names;
            }
            for (TSNode param : namedChildren(params)) {
                String name = parameterName(param);
                if (name != null && !name.isEmpty()) {
                    names.add(name);
                }
            }
            return names;
        }

        private String parameterName(TSNode param) {
            switch (param.getType()) {
                case "identifier":
                    return getNodeText(src, param);
                case "formal_parameter":
                case "default_parameter":
                case "typed_default_parameter":
                    return getFieldText(src, param, "name");
                case "spread_parameter":
                    TSNode declarator = findFirstChild(param, "variable_declarator");
                    return declarator != null ? getFieldText(src, declarator, "name") : null;
                case "assignment_pattern":
                    return getFieldText(src, param, "left");
                case "typed_parameter":
                case "list_splat_pattern":
                case "dictionary_splat_pattern":
                case "rest_pattern":
                    TSNode identifier = findFirstChild(param, "identifier");
                    return identifier != null ? getNodeText(src, identifier) : null;
                default:
                    return null;
            }
        }

        private String visibility(TSNode node, String name, Scope scope) {
            switch (language) {
                case JAVA: {
                    TSNode modifiers = findFirstChild(node, "modifiers");
                    String text = modifiers != null ? getNodeText(src, modifiers) : "";
                    if (text.matches("(?s).*\\bpublic\\b.*")) return "public";
                    if (text.matches("(?s).*\\bprivate\\b.*")) return "private";
                    if (text.matches("(?s).*\\bprotected\\b.*")) return "protected";
                    return "package";
                }
                case PYTHON:
                    return pythonVisibility(name);
                default:
                    if (name.startsWith("#")) return "private";
                    if (scope.exported || node.getType().equals("method_definition")) return "public";
                    return "module";
            }
        }

        private void visitCall(TSNode node, Scope scope) {
            String name;
            String receiver = null;
            switch (node.getType()) {
                case "method_invocation":
                    name = getFieldText(src, node, "name");
                    receiver = getFieldText(src, node, "object");
                    break;
                case "object_creation_expression":
                    name = stripGenerics(getFieldText(src, node, "type"));
                    break;
                case "new_expression":
                    name = getFieldText(src, node, "constructor");
                    break;
                default: {
                    TSNode function = getChildByFieldName(node, "function");
                    if (function == null) {
                        return;
                    }
                    if (isNodeTypeOneOf(function, "attribute")) {
                        name = getFieldText(src, function, "attribute");
                        receiver = getFieldText(src, function, "object");
                    } else if (isNodeTypeOneOf(function, "member_expression")) {
                        name = getFieldText(src, function, "property");
                        receiver = getFieldText(src, function, "object");
                    } else if (isNodeTypeOneOf(function, "identifier")) {
                        name = getNodeText(src, function);
                    } else {
                        return;
                    }
                    if ("require".equals(name) && receiver == null) {
                        TSNode arguments = getChildByFieldName(node, "arguments");
                        TSNode literal = findFirstChild(arguments, "string");
                        if (literal != null) {
                            addImport(unquote(getNodeText(src, literal)), node, scope);
                            return;
                        }
                    }
                }
            }
            if (name == null || name.isEmpty()) {
                return;
            }
            DeclNode.Draft draft = new DeclNode.Draft(DeclKind.CALL_SITE, name).lines(startLine(node), endLine(node));
            draft.qualifiedName = scope.enclosingFunction + "->" + name;
            draft.target = name;
            draft.receiver = receiver == null ? null : normalizeInline(receiver);
            draft.enclosingFunction = scope.enclosingFunction;
            draft.parentId = scope.parentId;
            builder.add(draft);
        }

        /** Returns true when every declarator was a function and the subtree is already visited. */
        private boolean visitDeclarators(TSNode node, Scope scope) {
            boolean allFunctions = true;
            for (TSNode declarator : namedChildren(node)) {
                if (!declarator.getType().equals("variable_declarator")) {
                    continue;
                }
                TSNode nameNode = getChildByFieldName(declarator, "name");
                TSNode value = getChildByFieldName(declarator, "value");
                if (nameNode == null || !isNodeTypeOneOf(nameNode, "identifier")) {
                    allFunctions = false;
                    continue;
                }
                String name = getNodeText(src, nameNode);
                if (isNodeTypeOneOf(value, "arrow_function", "function_expression", "function", "generator_function")) {
                    visitFunction(value, name, scope);
                    continue;
                }
                allFunctions = false;
                addVariable(name, declarator, value, scope);
            }
            return allFunctions;
        }

        private void visitPythonAssignment(TSNode node, Scope scope) {
            TSNode left = getChildByFieldName(node, "left");
            if (left == null) {
                return;
            }
            TSNode right = getChildByFieldName(node, "right");
            if (isNodeTypeOneOf(left, "identifier")) {
                addVariable(getNodeText(src, left), node, right, scope);
            } else if (isNodeTypeOneOf(left, "pattern_list", "tuple_pattern")) {
                for (TSNode element : namedChildren(left)) {
                    if (isNodeTypeOneOf(element, "identifier")) {
                        addVariable(getNodeText(src, element), node, right, scope);
                    }
                }
            }
        }

        private void addVariable(String name, TSNode node, TSNode value, Scope scope) {
            DeclNode.Draft draft = new DeclNode.Draft(DeclKind.VARIABLE, name).lines(startLine(node), endLine(node));
            draft.qualifiedName = builder.getModulePath() + "::" + scope.prefix + name;
            draft.visibility = language == Language.PYTHON ? pythonVisibility(name) : (scope.exported ? "public" : "local");
            draft.target = value == null ? null : normalizeInline(getNodeText(src, value));
            draft.enclosingFunction = scope.enclosingFunction;
            draft.parentId = scope.parentId;
            builder.add(draft);
        }

        private void visitImportStatement(TSNode node, Scope scope) {
            if (language == Language.JAVASCRIPT) {
                TSNode source = getChildByFieldName(node, "source");
                if (source != null) {
                    addImport(unquote(getNodeText(src, source)), node, scope);
                }
                return;
            }
            for (TSNode child : namedChildren(node)) {
                if (isNodeTypeOneOf(child, "dotted_name")) {
                    addImport(getNodeText(src, child), node, scope);
                } else if (isNodeTypeOneOf(child, "aliased_import")) {
                    addImport(getFieldText(src, child, "name"), node, scope);
                }
            }
        }

        private String javaImportTarget(TSNode node) {
            String text = normalizeInline(getNodeText(src, node));
            return text.replaceFirst("^import\\s+", "").replaceFirst("^static\\s+", "").replace(";", "").replace(" ", "");
        }

        private void addImport(String target, TSNode node, Scope scope) {
            if (target == null || target.isEmpty()) {
                return;
            }
            DeclNode.Draft draft = new DeclNode.Draft(DeclKind.IMPORT, target).lines(startLine(node), endLine(node));
            draft.qualifiedName = builder.getModulePath() + "::import " + target;
            draft.target = target;
            draft.parentId = scope.parentId;
            builder.add(draft);
        }
    }

    static String pythonVisibility(String name) {
        if (name.startsWith("__") && name.endsWith("__")) return "public";
        if (name.startsWith("__")) return "private";
        if (name.startsWith("_")) return "protected";
        return "public";
    }

    private static String unquote(String literal) {
        if (literal == null) return null;
        String text = literal.trim();
        if (text.length() >= 2 && "'\"`".indexOf(text.charAt(0)) >= 0) {
            return text.substring(1, text.length() - 1);
        }
        return text;
    }

    private static String stripGenerics(String type) {
        if (type == null) return null;
        int angle = type.indexOf('<');
        String raw = angle >= 0 ? type.substring(0, angle) : type;
        int dot = raw.lastIndexOf('.');
        return dot >= 0 ? raw.substring(dot + 1) : raw;
    }
}
