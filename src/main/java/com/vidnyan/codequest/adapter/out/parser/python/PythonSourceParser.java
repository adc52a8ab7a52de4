package com.vidnyan.codequest.adapter.out.parser.python;

import com.vidnyan.codequest.application.port.out.SourceParseException;
import com.vidnyan.codequest.application.port.out.SourceParser;
import com.vidnyan.codequest.domain.analysis.CallSite;
import com.vidnyan.codequest.domain.analysis.ExtractedEntity;
import com.vidnyan.codequest.domain.analysis.FileExtraction;
import com.vidnyan.codequest.domain.model.CodeNode;
import com.vidnyan.codequest.domain.model.Language;
import com.vidnyan.codequest.domain.model.Location;
import com.vidnyan.codequest.domain.model.NodeKind;
import com.vidnyan.codequest.domain.model.Parameter;
import lombok.extern.slf4j.Slf4j;
import org.treesitter.TSNode;

import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

import static com.vidnyan.codequest.adapter.out.parser.python.PythonSyntaxTree.field;
import static com.vidnyan.codequest.adapter.out.parser.python.PythonSyntaxTree.namedChildren;

/**
 * Extracts functions, classes and methods from Python source using tree-sitter.
 * <p>
 * Emits top-level functions and classes plus the methods declared directly in a
 * class body; defs nested deeper are not emitted and their calls belong to the
 * enclosing entity. A file with any syntax error is rejected as a whole.
 */
@Slf4j
public class PythonSourceParser implements SourceParser {

    private static final Pattern LINE_BREAK = Pattern.compile("\\s*\\\\?\\n\\s*");

    private final PythonComplexityEstimator complexityEstimator;

    public PythonSourceParser() {
        this(new PythonComplexityEstimator());
    }

    public PythonSourceParser(PythonComplexityEstimator complexityEstimator) {
        this.complexityEstimator = complexityEstimator;
    }

    @Override
    public Language language() {
        return Language.PYTHON;
    }

    @Override
    public FileExtraction parse(Path file) throws SourceParseException {
        String source = normalize(read(file));
        PythonSyntaxTree tree = PythonSyntaxTree.parse(source);
        Optional<String> error = tree.firstError();
        if (error.isPresent()) {
            throw new SourceParseException(file, error.get());
        }

        int complexity = complexityEstimator.estimate(tree.root());
        FileContext context = new FileContext(file, tree, complexity);
        List<ExtractedEntity> entities = new ArrayList<>();
        for (TSNode statement : namedChildren(tree.root())) {
            Definition definition = Definition.of(statement);
            switch (definition.node().getType()) {
                case "function_definition" -> entities.add(function(definition, null, context));
                case "class_definition" -> extractClass(definition, context, entities);
                default -> {
                }
            }
        }

        log.debug("Parsed {}: {} entities, complexity {}", file, entities.size(), complexity);
        return new FileExtraction(file, entities, complexity, countLines(source));
    }

    private static String read(Path file) throws SourceParseException {
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (CharacterCodingException e) {
            try {
                return Files.readString(file, StandardCharsets.ISO_8859_1);
            } catch (IOException retry) {
                throw new SourceParseException(file, "cannot read file", retry);
            }
        } catch (IOException e) {
            throw new SourceParseException(file, "cannot read file", e);
        }
    }

    /**
     * Drop a byte order mark and convert line endings to {@code \n}.
     */
    static String normalize(String source) {
        String text = source.startsWith("﻿") ? source.substring(1) : source;
        return text.replace("\r\n", "\n").replace('\r', '\n');
    }

    // ========== Entities ==========

    private void extractClass(Definition definition, FileContext context, List<ExtractedEntity> out) {
        TSNode classNode = definition.node();
        String className = name(classNode, context);
        List<String> bases = new ArrayList<>();
        field(classNode, "superclasses").ifPresent(superclasses -> {
            String text = context.text(superclasses);
            String inner = text.substring(1, text.length() - 1).trim();
            if (!inner.isEmpty()) {
                bases.add(inner);
            }
        });

        List<ExtractedEntity> methods = new ArrayList<>();
        Optional<TSNode> body = field(classNode, "body");
        body.ifPresent(block -> {
            for (TSNode member : namedChildren(block)) {
                Definition memberDefinition = Definition.of(member);
                if ("function_definition".equals(memberDefinition.node().getType())) {
                    methods.add(function(memberDefinition, className, context));
                }
            }
        });

        Location location = location(context, classNode);
        CodeNode node = CodeNode.builder()
                .id(CodeNode.idOf(context.fileName(), className))
                .name(className)
                .kind(new NodeKind.ClassKind(methods.size()))
                .language(Language.PYTHON)
                .location(location)
                .decorators(decoratorTexts(definition, context))
                .docstring(body.map(block -> docstring(block, context)).orElse(null))
                .exported(!className.startsWith("_"))
                .complexity(methods.size())
                .loc(location.lineSpan())
                .build();

        out.add(new ExtractedEntity(node, List.of(), bases));
        out.addAll(methods);
    }

    private ExtractedEntity function(Definition definition, String className, FileContext context) {
        TSNode functionNode = definition.node();
        String name = name(functionNode, context);
        boolean async = functionNode.getChildCount() > 0 && "async".equals(functionNode.getChild(0).getType());

        List<Parameter> parameters = field(functionNode, "parameters")
                .map(list -> parameters(list, context))
                .orElse(List.of());
        String returnType = field(functionNode, "return_type").map(context::flatText).orElse(null);

        boolean[] generator = {false};
        PythonSyntaxTree.walk(functionNode, node -> generator[0] |= "yield".equals(node.getType()));

        List<CallSite> callSites = new ArrayList<>();
        definition.decorators().forEach(decorator -> collectCalls(decorator, context, callSites));
        collectCalls(functionNode, context, callSites);

        List<String> typeReferences = new ArrayList<>();
        parameters.stream().map(Parameter::typeText).filter(Objects::nonNull).forEach(typeReferences::add);
        if (returnType != null) {
            typeReferences.add(returnType);
        }

        Location location = location(context, functionNode);
        String qualifiedName = className != null ? className + "." + name : name;
        CodeNode node = CodeNode.builder()
                .id(CodeNode.idOf(context.fileName(), qualifiedName))
                .name(name)
                .kind(className != null ? new NodeKind.Method(className) : new NodeKind.Function())
                .language(Language.PYTHON)
                .location(location)
                .parameters(parameters)
                .returnType(returnType)
                .decorators(decoratorTexts(definition, context))
                .docstring(field(functionNode, "body").map(block -> docstring(block, context)).orElse(null))
                .exported(!name.startsWith("_"))
                .async(async)
                .generator(generator[0])
                .complexity(context.complexity())
                .loc(location.lineSpan())
                .build();
        return new ExtractedEntity(node, callSites, typeReferences);
    }

    /**
     * Positional-or-keyword parameters only: entries before {@code /}, after a bare
     * {@code *} or {@code *args}, and {@code **kwargs} are skipped.
     */
    private static List<Parameter> parameters(TSNode list, FileContext context) {
        List<Parameter> parameters = new ArrayList<>();
        boolean keywordOnly = false;
        for (TSNode parameter : namedChildren(list)) {
            switch (parameter.getType()) {
                case "positional_separator" -> parameters.clear();
                case "keyword_separator", "list_splat_pattern", "dictionary_splat_pattern" -> keywordOnly = true;
                case "identifier" -> {
                    if (!keywordOnly) {
                        parameters.add(Parameter.named(context.text(parameter)));
                    }
                }
                case "typed_parameter" -> {
                    TSNode target = parameter.getNamedChild(0);
                    if (!"identifier".equals(target.getType())) {
                        keywordOnly = true;
                    } else if (!keywordOnly) {
                        parameters.add(new Parameter(context.text(target),
                                field(parameter, "type").map(context::flatText).orElse(null), null));
                    }
                }
                case "default_parameter", "typed_default_parameter" -> {
                    if (!keywordOnly) {
                        parameters.add(new Parameter(
                                field(parameter, "name").map(context::text).orElse(""),
                                field(parameter, "type").map(context::flatText).orElse(null),
                                field(parameter, "value").map(context::flatText).orElse(null)));
                    }
                }
                default -> {
                }
            }
        }
        return parameters;
    }

    /**
     * Record every {@code call} under the node: the called identifier, or the
     * trailing attribute of a method-style call. Other callee shapes are skipped.
     */
    private static void collectCalls(TSNode root, FileContext context, List<CallSite> out) {
        PythonSyntaxTree.walk(root, node -> {
            if (!"call".equals(node.getType())) {
                return;
            }
            field(node, "function").flatMap(PythonSourceParser::calleeName).ifPresent(callee ->
                    out.add(new CallSite(context.text(callee), PythonSyntaxTree.startLine(callee))));
        });
    }

    private static Optional<TSNode> calleeName(TSNode function) {
        return switch (function.getType()) {
            case "identifier" -> Optional.of(function);
            case "attribute" -> field(function, "attribute");
            default -> Optional.empty();
        };
    }

    private static List<String> decoratorTexts(Definition definition, FileContext context) {
        List<String> texts = new ArrayList<>();
        for (TSNode decorator : definition.decorators()) {
            if (decorator.getNamedChildCount() > 0) {
                texts.add(context.flatText(decorator.getNamedChild(0)));
            }
        }
        return texts;
    }

    /**
     * The first statement of a block when it is a plain string literal or a
     * concatenation of them. Byte strings and f-strings are not docstrings.
     */
    private static String docstring(TSNode block, FileContext context) {
        TSNode first = namedChildren(block).stream()
                .filter(node -> !"comment".equals(node.getType()))
                .findFirst()
                .orElse(null);
        if (first == null || !"expression_statement".equals(first.getType()) || first.getNamedChildCount() != 1) {
            return null;
        }
        TSNode expression = first.getNamedChild(0);
        List<TSNode> literals = switch (expression.getType()) {
            case "string" -> List.of(expression);
            case "concatenated_string" -> namedChildren(expression);
            default -> List.of();
        };
        if (literals.isEmpty()) {
            return null;
        }

        StringBuilder value = new StringBuilder();
        for (TSNode literal : literals) {
            String text = context.text(literal);
            String prefix = text.substring(0, Math.max(0, firstQuote(text))).toLowerCase(Locale.ROOT);
            if (prefix.contains("b") || prefix.contains("f")) {
                return null;
            }
            value.append(PythonStrings.literalValue(text));
        }
        return PythonStrings.cleandoc(value.toString());
    }

    // ========== Helpers ==========

    private static int firstQuote(String literal) {
        for (int i = 0; i < literal.length(); i++) {
            char c = literal.charAt(i);
            if (c == '\'' || c == '"') {
                return i;
            }
        }
        return -1;
    }

    private static String name(TSNode definition, FileContext context) {
        return field(definition, "name").map(context::text).orElse("");
    }

    private static Location location(FileContext context, TSNode definition) {
        return new Location(context.file().toString(),
                PythonSyntaxTree.startLine(definition), PythonSyntaxTree.endLine(definition));
    }

    private static int countLines(String source) {
        if (source.isEmpty()) {
            return 0;
        }
        return (int) source.lines().count();
    }

    /**
     * A function or class definition with the decorators written above it.
     */
    private record Definition(TSNode node, List<TSNode> decorators) {

        static Definition of(TSNode statement) {
            if (!"decorated_definition".equals(statement.getType())) {
                return new Definition(statement, List.of());
            }
            List<TSNode> decorators = new ArrayList<>();
            for (TSNode child : namedChildren(statement)) {
                if ("decorator".equals(child.getType())) {
                    decorators.add(child);
                }
            }
            TSNode definition = field(statement, "definition").orElse(statement);
            return new Definition(definition, decorators);
        }
    }

    private record FileContext(Path file, PythonSyntaxTree tree, int complexity) {

        String fileName() {
            return file.getFileName().toString();
        }

        String text(TSNode node) {
            return tree.text(node);
        }

        /**
         * Node text on one line: line breaks inside brackets or after a backslash become a space.
         */
        String flatText(TSNode node) {
            return LINE_BREAK.matcher(tree.text(node)).replaceAll(" ");
        }
    }
}
