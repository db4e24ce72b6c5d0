package dfs.processor;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Function;

import javax.annotation.processing.AbstractProcessor;
import javax.annotation.processing.Processor;
import javax.annotation.processing.RoundEnvironment;
import javax.lang.model.SourceVersion;
import javax.lang.model.element.Element;
import javax.lang.model.element.ElementKind;
import javax.lang.model.element.ExecutableElement;
import javax.lang.model.element.Modifier;
import javax.lang.model.element.TypeElement;
import javax.tools.Diagnostic.Kind;

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
 * Generates the visitor plumbing for the syntax tree in package {@code dfs}.
 *
 * <p>For every {@link ASTNode} class {@code Outer.Inner} an interface {@code Outer_Inner_ASTNode}
 * is emitted which implements {@code accept} by double dispatch and {@code visitChildren} by
 * walking every {@link ASTChild} accessor in declaration order. Once all nodes of a compilation are
 * known, {@code ASTVisitor}, {@code DefaultASTVisitor} and {@code VoidDefaultASTVisitor} are
 * emitted with one overload per node class.
 */
@AutoService(Processor.class)
public class ASTVisitorProcessor extends AbstractProcessor {

  private static final String PACKAGE = "dfs";

  private static final ClassName AST_NODE_INTERFACE_NAME =
      ClassName.get(PACKAGE, "ASTNodeInterface");
  private static final ClassName AST_VISITOR_NAME = ClassName.get(PACKAGE, "ASTVisitor");
  private static final ClassName DEFAULT_AST_VISITOR_NAME =
      ClassName.get(PACKAGE, "DefaultASTVisitor");
  private static final ClassName VOID_DEFAULT_AST_VISITOR_NAME =
      ClassName.get(PACKAGE, "VoidDefaultASTVisitor");
  private static final ClassName AST_NODES_NAME = ClassName.get(PACKAGE, "ASTNodes");
  private static final TypeVariableName V = TypeVariableName.get("V");
  private static final TypeName VOID = ClassName.get(Void.class);

  // Keyed by qualified name so the generated overloads have a stable order.
  private final TreeMap<String, ClassName> allAstNodes = new TreeMap<>();
  private boolean visitorsWritten = false;

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
    if (annotations.isEmpty() || roundEnv.processingOver()) {
      return false;
    }

    try {
      processImpl(roundEnv);
      if (!visitorsWritten && !allAstNodes.isEmpty()) {
        generateASTVisitorFiles();
        visitorsWritten = true;
      }
    } catch (IOException ex) {
      throw new RuntimeException(ex);
    }
    return true;
  }

  private void processImpl(RoundEnvironment roundEnv) {
    for (Element element : roundEnv.getElementsAnnotatedWith(ASTNode.class)) {
      TypeElement typeElement = (TypeElement) element;
      if (!typeElement.getTypeParameters().isEmpty()) {
        processingEnv
            .getMessager()
            .printMessage(Kind.ERROR, "@ASTNode classes may not be generic", typeElement);
        continue;
      }

      try {
        writeASTNodeFile(typeElement);
      } catch (IOException ex) {
        processingEnv.getMessager().printMessage(Kind.ERROR, "APT Error: " + ex, typeElement);
      }
      allAstNodes.put(typeElement.getQualifiedName().toString(), ClassName.get(typeElement));
    }
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

  private static ParameterSpec visitorParameter() {
    return ParameterSpec.builder(ParameterizedTypeName.get(AST_VISITOR_NAME, V), "visitor")
        .build();
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
            .addParameter(visitorParameter())
            .addParameter(V, "value")
            .addStatement("return visitor.visit(($T) this, value)", ClassName.get(element))
            .build());

    MethodSpec.Builder visitChildren =
        MethodSpec.methodBuilder("visitChildren")
            .addAnnotation(Override.class)
            .addModifiers(Modifier.PUBLIC, Modifier.DEFAULT)
            .addTypeVariable(V)
            .returns(V)
            .addParameter(visitorParameter())
            .addParameter(V, "value");
    for (Element maybeMethod : element.getEnclosedElements()) {
      if (maybeMethod.getKind() != ElementKind.METHOD) continue;
      if (maybeMethod.getAnnotation(ASTChild.class) == null) continue;
      if (maybeMethod.getAnnotation(Override.class) == null) {
        processingEnv.getMessager().printMessage(Kind.ERROR, "Missing @Override", maybeMethod);
      }

      ExecutableElement method = (ExecutableElement) maybeMethod;
      String name = method.getSimpleName().toString();
      typeSpecBuilder.addMethod(
          MethodSpec.methodBuilder(name)
              .addModifiers(Modifier.PUBLIC, Modifier.ABSTRACT)
              .returns(TypeName.get(method.getReturnType()))
              .build());
      visitChildren.addStatement("value = $T.accept($L(), visitor, value)", AST_NODES_NAME, name);
    }
    typeSpecBuilder.addMethod(visitChildren.addStatement("return value").build());

    JavaFile.builder(PACKAGE, typeSpecBuilder.build())
        .build()
        .writeTo(processingEnv.getFiler());
  }

  private void writeVisitorFile(
      TypeSpec.Builder type, Function<ClassName, Iterable<MethodSpec>> methods)
      throws IOException {
    for (ClassName node : allAstNodes.values()) {
      type.addMethods(methods.apply(node));
    }
    JavaFile.builder(PACKAGE, type.build()).build().writeTo(processingEnv.getFiler());
  }

  private void generateASTVisitorFiles() throws IOException {
    writeVisitorFile(
        TypeSpec.interfaceBuilder(AST_VISITOR_NAME).addTypeVariable(V),
        node ->
            ImmutableList.of(
                MethodSpec.methodBuilder("visit")
                    .addModifiers(Modifier.PUBLIC, Modifier.ABSTRACT)
                    .returns(V)
                    .addParameter(node, "node")
                    .addParameter(V, "value")
                    .build()));

    writeVisitorFile(
        TypeSpec.classBuilder(DEFAULT_AST_VISITOR_NAME)
            .addModifiers(Modifier.PUBLIC, Modifier.ABSTRACT)
            .addTypeVariable(V)
            .addSuperinterface(ParameterizedTypeName.get(AST_VISITOR_NAME, V)),
        node ->
            ImmutableList.of(
                MethodSpec.methodBuilder("visit")
                    .addAnnotation(Override.class)
                    .addModifiers(Modifier.PUBLIC)
                    .returns(V)
                    .addParameter(node, "node")
                    .addParameter(V, "value")
                    .addStatement("return node.visitChildren(this, value)")
                    .build()));

    writeVisitorFile(
        TypeSpec.classBuilder(VOID_DEFAULT_AST_VISITOR_NAME)
            .addModifiers(Modifier.PUBLIC, Modifier.ABSTRACT)
            .superclass(ParameterizedTypeName.get(DEFAULT_AST_VISITOR_NAME, VOID)),
        node ->
            ImmutableList.of(
                MethodSpec.methodBuilder("visit")
                    .addAnnotation(Override.class)
                    .addModifiers(Modifier.PUBLIC, Modifier.FINAL)
                    .returns(VOID)
                    .addParameter(node, "node")
                    .addParameter(VOID, "value")
                    .addStatement("visitImpl(node)")
                    .addStatement("return null")
                    .build(),
                MethodSpec.methodBuilder("visitImpl")
                    .addModifiers(Modifier.PUBLIC)
                    .addParameter(node, "node")
                    .addStatement("node.visitChildren(this, null)")
                    .build()));
  }
}
