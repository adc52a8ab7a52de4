package com.vidnyan.codequest.adapter.out.parser.java;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Problem;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.*;
import com.github.javaparser.ast.expr.AnnotationExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.nodeTypes.NodeWithImplements;
import com.github.javaparser.ast.nodeTypes.NodeWithJavadoc;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import com.github.javaparser.ast.type.Type;
import com.github.javaparser.ast.visitor.VoidVisitorAdapter;
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

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Extracts classes, methods and constructors from Java source with JavaParser.
 * <p>
 * Each top-level type becomes a class node followed by one node per method or
 * constructor declared directly in its body. Constructors are named after their class.
 * Calls are taken by bare name: the method name of a {@link MethodCallExpr} and the
 * type name of a {@link ObjectCreationExpr}. No symbol solving is done.
 */
@Slf4j
public class JavaSourceParser implements SourceParser {

    private static final Set<String> ASYNC_TYPES = Set.of("CompletableFuture", "CompletionStage");
    private static final Set<String> GENERATOR_TYPES = Set.of("Stream", "Iterator");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final JavaParser parser;
    private final JavaComplexityEstimator complexityEstimator;

    public JavaSourceParser() {
        this(new JavaComplexityEstimator());
    }

    public JavaSourceParser(JavaComplexityEstimator complexityEstimator) {
        ParserConfiguration config = new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17)
                .setCharacterEncoding(StandardCharsets.UTF_8);
        this.parser = new JavaParser(config);
        this.complexityEstimator = complexityEstimator;
    }

    @Override
    public Language language() {
        return Language.JAVA;
    }

    @Override
    public FileExtraction parse(Path file) throws SourceParseException {
        String source;
        try {
            source = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SourceParseException(file, "cannot read file", e);
        }

        ParseResult<CompilationUnit> result = parser.parse(source);
        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            String problem = result.getProblems().stream()
                    .findFirst()
                    .map(Problem::getMessage)
                    .orElse("unknown parse problem");
            throw new SourceParseException(file, problem);
        }

        CompilationUnit cu = result.getResult().get();
        int complexity = complexityEstimator.estimate(cu);
        String fileName = file.getFileName().toString();

        List<ExtractedEntity> entities = new ArrayList<>();
        for (TypeDeclaration<?> td : cu.getTypes()) {
            processTypeDeclaration(td, file, fileName, complexity, entities);
        }

        log.debug("Parsed {}: {} entities, complexity {}", file, entities.size(), complexity);
        return new FileExtraction(file, entities, complexity, (int) source.lines().count());
    }

    private void processTypeDeclaration(TypeDeclaration<?> td, Path file, String fileName, int complexity,
                                        List<ExtractedEntity> out) {
        String className = td.getNameAsString();

        List<ExtractedEntity> members = new ArrayList<>();
        for (BodyDeclaration<?> member : td.getMembers()) {
            if (member instanceof MethodDeclaration md) {
                members.add(processMethod(md, td, file, fileName, complexity));
            } else if (member instanceof ConstructorDeclaration cd) {
                members.add(processConstructor(cd, td, file, fileName, complexity));
            }
        }

        List<String> supertypes = new ArrayList<>();
        if (td instanceof ClassOrInterfaceDeclaration cid) {
            cid.getExtendedTypes().forEach(t -> supertypes.add(t.asString()));
        }
        if (td instanceof NodeWithImplements<?> impl) {
            impl.getImplementedTypes().forEach(t -> supertypes.add(t.asString()));
        }

        Location location = locationOf(td, file);
        CodeNode node = CodeNode.builder()
                .id(CodeNode.idOf(fileName, className))
                .name(className)
                .kind(new NodeKind.ClassKind(members.size()))
                .language(Language.JAVA)
                .location(location)
                .decorators(annotationTexts(td.getAnnotations()))
                .docstring(javadocOf(td))
                .exported(td.isPublic())
                .complexity(members.size())
                .loc(location.lineSpan())
                .build();

        out.add(new ExtractedEntity(node, List.of(), supertypes));
        out.addAll(members);
    }

    private ExtractedEntity processMethod(MethodDeclaration md, TypeDeclaration<?> owner, Path file,
                                          String fileName, int complexity) {
        String className = owner.getNameAsString();
        List<Parameter> parameters = parametersOf(md.getParameters());
        Type returnType = md.getType();
        String rawType = erasedName(returnType);

        CodeNode.CodeNodeBuilder builder = callableNode(md, owner, file, complexity)
                .id(CodeNode.idOf(fileName, className + "." + md.getNameAsString()))
                .name(md.getNameAsString())
                .parameters(parameters)
                .returnType(returnType.asString())
                .async(md.isAnnotationPresent("Async") || ASYNC_TYPES.contains(rawType))
                .generator(GENERATOR_TYPES.contains(rawType));

        List<String> typeReferences = new ArrayList<>(typeTexts(parameters));
        typeReferences.add(returnType.asString());
        return new ExtractedEntity(builder.build(), callSitesOf(md), typeReferences);
    }

    private ExtractedEntity processConstructor(ConstructorDeclaration cd, TypeDeclaration<?> owner, Path file,
                                               String fileName, int complexity) {
        String className = owner.getNameAsString();
        List<Parameter> parameters = parametersOf(cd.getParameters());

        CodeNode.CodeNodeBuilder builder = callableNode(cd, owner, file, complexity)
                .id(CodeNode.idOf(fileName, className + "." + className))
                .name(className)
                .parameters(parameters);
        return new ExtractedEntity(builder.build(), callSitesOf(cd), typeTexts(parameters));
    }

    private CodeNode.CodeNodeBuilder callableNode(CallableDeclaration<?> callable, TypeDeclaration<?> owner,
                                                  Path file, int complexity) {
        Location location = locationOf(callable, file);
        boolean interfaceMember = owner instanceof ClassOrInterfaceDeclaration cid && cid.isInterface();
        return CodeNode.builder()
                .kind(new NodeKind.Method(owner.getNameAsString()))
                .language(Language.JAVA)
                .location(location)
                .decorators(annotationTexts(callable.getAnnotations()))
                .docstring(javadocOf(callable))
                .exported(callable.isPublic() || (interfaceMember && !callable.isPrivate()))
                .complexity(complexity)
                .loc(location.lineSpan());
    }

    private List<Parameter> parametersOf(List<com.github.javaparser.ast.body.Parameter> parameters) {
        return parameters.stream()
                .map(p -> new Parameter(p.getNameAsString(),
                        p.getType().asString() + (p.isVarArgs() ? "..." : ""), null))
                .toList();
    }

    private static List<String> typeTexts(List<Parameter> parameters) {
        return parameters.stream().map(Parameter::typeText).collect(Collectors.toList());
    }

    /**
     * Call sites in source order.
     */
    private List<CallSite> callSitesOf(Node declaration) {
        List<Node> calls = new ArrayList<>();
        declaration.accept(new VoidVisitorAdapter<Void>() {

            @Override
            public void visit(MethodCallExpr call, Void arg) {
                super.visit(call, arg);
                calls.add(call);
            }

            @Override
            public void visit(ObjectCreationExpr creation, Void arg) {
                super.visit(creation, arg);
                calls.add(creation);
            }
        }, null);

        calls.sort(Comparator.comparing((Node n) -> n.getBegin().map(p -> p.line).orElse(0))
                .thenComparing(n -> n.getBegin().map(p -> p.column).orElse(0)));

        List<CallSite> sites = new ArrayList<>();
        for (Node call : calls) {
            int line = call.getBegin().map(p -> p.line).orElse(0);
            if (call instanceof MethodCallExpr mce) {
                sites.add(new CallSite(mce.getNameAsString(), line));
            } else if (call instanceof ObjectCreationExpr oce) {
                sites.add(new CallSite(oce.getType().getNameAsString(), line));
            }
        }
        return sites;
    }

    private List<String> annotationTexts(List<AnnotationExpr> annotations) {
        return annotations.stream()
                .map(a -> WHITESPACE.matcher(a.toString().substring(1)).replaceAll(" ").trim())
                .toList();
    }

    private static String javadocOf(NodeWithJavadoc<?> node) {
        return node.getJavadoc()
                .map(javadoc -> javadoc.getDescription().toText().trim())
                .filter(text -> !text.isEmpty())
                .orElse(null);
    }

    private static String erasedName(Type type) {
        return type instanceof ClassOrInterfaceType cit ? cit.getNameAsString() : type.asString();
    }

    private static Location locationOf(Node node, Path file) {
        int begin = node.getBegin().map(p -> p.line).orElse(0);
        int end = node.getEnd().map(p -> p.line).orElse(begin);
        return new Location(file.toString(), begin, end);
    }
}
