package wfl.processor;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

import javax.annotation.processing.AbstractProcessor;
import javax.annotation.processing.Processor;
import javax.annotation.processing.RoundEnvironment;
import javax.lang.model.SourceVersion;
import javax.lang.model.element.Element;
import javax.lang.model.element.ElementKind;
import javax.lang.model.element.ExecutableElement;
import javax.lang.model.element.Modifier;
import javax.lang.model.element.TypeElement;
import javax.lang.model.type.TypeKind;
import javax.lang.model.type.TypeMirror;
import javax.lang.model.util.Types;
import javax.tools.Diagnostic.Kind;
import javax.tools.FileObject;
import javax.tools.JavaFileObject;
import javax.tools.StandardLocation;

import com.google.auto.service.AutoService;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.squareup.javapoet.ClassName;
import com.squareup.javapoet.JavaFile;
import com.squareup.javapoet.MethodSpec;
import com.squareup.javapoet.ParameterSpec;
import com.squareup.javapoet.ParameterizedTypeName;
import com.squareup.javapoet.TypeName;
import com.squareup.javapoet.TypeSpec;
import com.squareup.javapoet.TypeVariableName;

/**
 * Generates the visitor machinery for the workflow AST.
 *
 * <p>For every {@link ASTNode} class {@code Outer.Inner} an interface {@code Outer_Inner_ASTNode}
 * is written next to it, implementing {@code accept} by double dispatch and {@code visitChildren}
 * by visiting each {@link ASTChild} accessor in declaration order. When processing is over, the
 * package-private {@code ASTVisitor<V>} and the {@code DefaultASTVisitor<V>} and {@code
 * VoidDefaultASTVisitor} base classes are written with one method per known node.
 */
@AutoService(Processor.class)
public class ASTVisitorProcessor extends AbstractProcessor {

  static final String AST_PACKAGE = "wfl";
  private static final String NODE_LIST = "META-INF/astNodes/list.txt";

  private static final ClassName AST_NODE_INTERFACE_NAME =
      ClassName.get(AST_PACKAGE, "ASTNodeInterface");
  private static final ClassName AST_VISITOR_NAME = ClassName.get(AST_PACKAGE, "ASTVisitor");
  private static final ClassName AST_NODE_UTILS_NAME = ClassName.get(AST_PACKAGE, "ASTNodeUtils");
  private static final TypeVariableName V = TypeVariableName.get("V");

  private static final ImmutableList<String> CHILD_CONTAINERS =
      ImmutableList.of("java.lang.Iterable", "java.util.Optional", "java.util.stream.Stream");

  // Sorted so that the generated visitors are stable between builds.
  private final Set<String> allAstNodes = new TreeSet<>();

  @Override
  public SourceVersion getSupportedSourceVersion() {
    return SourceVersion.latestSupported();
  }

  @Override
  public ImmutableSet<String> getSupportedAnnotationTypes() {
    return ImmutableSet.of(ASTNode.class.getName(), ASTChild.class.getName());
  }

  @Override
  public boolean process(Set<? extends TypeElement> annotations, RoundEnvironment roundEnv) {
    try {
      if (roundEnv.processingOver()) {
        generateASTVisitorFiles();
      } else if (!annotations.isEmpty()) {
        processImpl(roundEnv);
      }
    } catch (IOException ex) {
      throw new RuntimeException(ex);
    }

    return true;
  }

  // Merges the node list of a previous (incremental) build with the nodes of this one, and writes
  // the result back so the next incremental build sees every node.
  private void mergeNodeList() throws IOException {
    FileObject file = null;
    try {
      file = processingEnv.getFiler().getResource(StandardLocation.CLASS_OUTPUT, "", NODE_LIST);
      try (BufferedReader br =
          new BufferedReader(
              new InputStreamReader(file.openInputStream(), StandardCharsets.UTF_8))) {
        String line;
        while ((line = br.readLine()) != null) {
          line = line.trim();
          if (!line.isEmpty()) {
            allAstNodes.add(line);
          }
        }
      }
    } catch (IOException ex) {
      processingEnv
          .getMessager()
          .printMessage(Kind.NOTE, "No previous AST node list, starting fresh: " + ex.getMessage());
      file = processingEnv.getFiler().createResource(StandardLocation.CLASS_OUTPUT, "", NODE_LIST);
    }

    try (Writer wr = file.openWriter()) {
      wr.append(allAstNodes.stream().collect(Collectors.joining("\n", "", "\n")));
    }
  }

  @FunctionalInterface
  private interface TypeRenderer {
    String renderType(String typeName);
  }

  private void writeFile(String name, String format, TypeRenderer typeRenderer)
      throws IOException {
    JavaFileObject file = processingEnv.getFiler().createSourceFile(AST_PACKAGE + "." + name);
    try (Writer wr = file.openWriter()) {
      wr.append(
          String.format(
              format,
              allAstNodes
                  .stream()
                  .map(typeRenderer::renderType)
                  .collect(Collectors.joining("\n\n"))));
    }
  }

  private void generateASTVisitorFiles() throws IOException {
    if (allAstNodes.isEmpty()) {
      // Nothing annotated in this compilation (e.g. the test sources).
      return;
    }
    mergeNodeList();

    String header = "package " + AST_PACKAGE + ";\n\n";
    writeFile(
        "ASTVisitor",
        header + "interface ASTVisitor<V> {\n\n%s\n\n}\n",
        typeName -> String.format("  V visit(%s node, V value);", typeName));
    writeFile(
        "DefaultASTVisitor",
        header
            + "public abstract class DefaultASTVisitor<V> implements ASTVisitor<V> {\n\n"
            + "%s\n\n}\n",
        typeName ->
            String.format(
                "  @Override\n"
                    + "  public V visit(%s node, V value) {\n"
                    + "    return node.visitChildren(this, value);\n"
                    + "  }",
                typeName));
    writeFile(
        "VoidDefaultASTVisitor",
        header
            + "public abstract class VoidDefaultASTVisitor extends DefaultASTVisitor<Void> {\n\n"
            + "%s\n\n}\n",
        typeName ->
            String.format(
                "  @Override\n"
                    + "  public final Void visit(%s node, Void value) {\n"
                    + "    visitImpl(node);\n"
                    + "    return null;\n"
                    + "  }\n\n"
                    + "  public void visitImpl(%s node) {\n"
                    + "    node.visitChildren(this, null);\n"
                    + "  }",
                typeName, typeName));
  }

  private static String getASTNodeClassName(Element element) {
    Deque<String> elems = new ArrayDeque<>();
    elems.push("ASTNode");
    do {
      if (element.getKind() == ElementKind.CLASS) {
        elems.addFirst(element.getSimpleName().toString());
      }
      element = element.getEnclosingElement();
    } while (element.getKind() != ElementKind.PACKAGE);
    return String.join("_", elems);
  }

  private boolean isVisitableChild(TypeMirror type) {
    Types types = processingEnv.getTypeUtils();
    TypeMirror erased = types.erasure(type);
    TypeElement node =
        processingEnv.getElementUtils().getTypeElement(AST_NODE_INTERFACE_NAME.canonicalName());
    if (node != null && types.isAssignable(erased, types.erasure(node.asType()))) {
      return true;
    }
    for (String container : CHILD_CONTAINERS) {
      TypeElement containerElement = processingEnv.getElementUtils().getTypeElement(container);
      if (types.isAssignable(erased, types.erasure(containerElement.asType()))) {
        return true;
      }
    }
    // Types generated in this same round are not resolvable yet; javac reports real mismatches.
    return type.getKind() == TypeKind.ERROR;
  }

  private void writeASTNodeFile(TypeElement element) throws IOException {
    String interfaceName = getASTNodeClassName(element);
    if (element
        .getInterfaces()
        .stream()
        .noneMatch(i -> TypeName.get(i).toString().endsWith(interfaceName))) {
      processingEnv
          .getMessager()
          .printMessage(Kind.ERROR, "Missing interface: " + interfaceName, element);
      return;
    }

    TypeSpec.Builder typeSpecBuilder =
        TypeSpec.interfaceBuilder(interfaceName)
            .addModifiers(Modifier.PUBLIC)
            .addSuperinterface(AST_NODE_INTERFACE_NAME);

    typeSpecBuilder.addMethod(
        MethodSpec.methodBuilder("accept")
            .addAnnotation(Override.class)
            .addModifiers(Modifier.PUBLIC, Modifier.DEFAULT)
            .addTypeVariable(V)
            .returns(V)
            .addParameter(
                ParameterSpec.builder(ParameterizedTypeName.get(AST_VISITOR_NAME, V), "visitor")
                    .build())
            .addParameter(ParameterSpec.builder(V, "value").build())
            .addStatement(
                "return visitor.visit(($L) this, value)", element.getQualifiedName().toString())
            .build());

    MethodSpec.Builder visitChildren =
        MethodSpec.methodBuilder("visitChildren")
            .addAnnotation(Override.class)
            .addModifiers(Modifier.PUBLIC, Modifier.DEFAULT)
            .addTypeVariable(V)
            .returns(V)
            .addParameter(
                ParameterSpec.builder(ParameterizedTypeName.get(AST_VISITOR_NAME, V), "visitor")
                    .build())
            .addParameter(ParameterSpec.builder(V, "value").build());
    for (Element maybeMethod : element.getEnclosedElements()) {
      if (maybeMethod.getKind() != ElementKind.METHOD) continue;
      if (maybeMethod.getAnnotation(ASTChild.class) == null) continue;

      ExecutableElement method = (ExecutableElement) maybeMethod;
      if (method.getAnnotation(Override.class) == null) {
        processingEnv.getMessager().printMessage(Kind.ERROR, "Missing @Override", method);
      }
      if (!method.getParameters().isEmpty()) {
        processingEnv
            .getMessager()
            .printMessage(Kind.ERROR, "@ASTChild accessors take no parameters", method);
        continue;
      }
      if (!isVisitableChild(method.getReturnType())) {
        processingEnv
            .getMessager()
            .printMessage(
                Kind.ERROR,
                "@ASTChild must return a node, or an Iterable, Optional or Stream of nodes",
                method);
        continue;
      }

      String methodName = method.getSimpleName().toString();
      typeSpecBuilder.addMethod(
          MethodSpec.methodBuilder(methodName)
              .addModifiers(Modifier.PUBLIC, Modifier.ABSTRACT)
              .returns(TypeName.get(method.getReturnType()))
              .build());
      visitChildren.addStatement(
          "value = $T.accept($L(), visitor, value)", AST_NODE_UTILS_NAME, methodName);
    }
    typeSpecBuilder.addMethod(visitChildren.addStatement("return value").build());

    String packageName =
        processingEnv.getElementUtils().getPackageOf(element).getQualifiedName().toString();
    JavaFile javaFile = JavaFile.builder(packageName, typeSpecBuilder.build()).build();
    JavaFileObject file =
        processingEnv.getFiler().createSourceFile(packageName + "." + interfaceName, element);
    try (Writer wr = file.openWriter()) {
      wr.append(javaFile.toString());
    }
  }

  private void processImpl(RoundEnvironment roundEnv) {
    for (Element element : roundEnv.getElementsAnnotatedWith(ASTNode.class)) {
      TypeElement typeElement = (TypeElement) element;
      try {
        writeASTNodeFile(typeElement);
      } catch (IOException | RuntimeException ex) {
        processingEnv.getMessager().printMessage(Kind.ERROR, "APT Error: " + ex, typeElement);
      }
      allAstNodes.add(typeElement.getQualifiedName().toString());
    }
  }
}
