package xlf.processor;

import java.io.IOException;
import java.io.Writer;
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
import javax.lang.model.element.Modifier;
import javax.lang.model.element.TypeElement;
import javax.tools.Diagnostic.Kind;
import javax.tools.JavaFileObject;

import com.google.auto.service.AutoService;
import com.google.common.collect.ImmutableSet;
import com.squareup.javapoet.ClassName;
import com.squareup.javapoet.JavaFile;
import com.squareup.javapoet.MethodSpec;
import com.squareup.javapoet.ParameterSpec;
import com.squareup.javapoet.ParameterizedTypeName;
import com.squareup.javapoet.TypeSpec;
import com.squareup.javapoet.TypeVariableName;

/**
 * Generates the syntax tree visitor API.
 *
 * <p>For every {@link Visitable} class {@code Outer.Inner} this writes an interface {@code
 * Outer_Inner_Visitable} with a default {@code accept} that dispatches to the matching {@code
 * visit} overload. Once all node classes are known it writes {@code SyntaxVisitor}, {@code
 * DefaultSyntaxVisitor} and {@code VoidSyntaxVisitor} into {@value #PACKAGE}.
 */
@AutoService(Processor.class)
public class VisitorProcessor extends AbstractProcessor {

  static final String PACKAGE = "xlf";

  private static final ClassName NODE_INTERFACE_NAME =
      ClassName.get(PACKAGE, "SyntaxNodeInterface");
  private static final ClassName VISITOR_NAME = ClassName.get(PACKAGE, "SyntaxVisitor");
  private static final TypeVariableName V = TypeVariableName.get("V");

  private final Set<String> allNodes = new TreeSet<>();
  private boolean visitorsWritten = false;

  @Override
  public SourceVersion getSupportedSourceVersion() {
    return SourceVersion.latestSupported();
  }

  @Override
  public ImmutableSet<String> getSupportedAnnotationTypes() {
    return ImmutableSet.of(Visitable.class.getName());
  }

  @Override
  public boolean process(Set<? extends TypeElement> annotations, RoundEnvironment roundEnv) {
    if (annotations.isEmpty() || visitorsWritten) {
      return false;
    }

    try {
      for (Element element : roundEnv.getElementsAnnotatedWith(Visitable.class)) {
        TypeElement typeElement = (TypeElement) element;
        try {
          writeVisitableFile(typeElement);
        } catch (IOException ex) {
          processingEnv.getMessager().printMessage(Kind.ERROR, "APT Error: " + ex, typeElement);
        }
        allNodes.add(typeElement.getQualifiedName().toString());
      }

      generateVisitorFiles();
      visitorsWritten = true;
    } catch (IOException ex) {
      throw new RuntimeException(ex);
    }
    return true;
  }

  @FunctionalInterface
  private static interface TypeRenderer {
    String renderType(String typeName);
  }

  private void writeFile(String name, String format, TypeRenderer typeRenderer) throws IOException {
    JavaFileObject file = processingEnv.getFiler().createSourceFile(PACKAGE + "." + name);
    try (Writer wr = file.openWriter()) {
      wr.append(
          String.format(
              format,
              allNodes.stream().map(typeRenderer::renderType).collect(Collectors.joining("\n\n"))));
    }
  }

  private void generateVisitorFiles() throws IOException {
    String nodeInterface = NODE_INTERFACE_NAME.simpleName();
    writeFile(
        "SyntaxVisitor",
        "package " + PACKAGE + ";\n\npublic interface SyntaxVisitor<V> {\n\n%s\n\n}\n",
        typeName -> String.format("  V visit(%s node, V value);", typeName));
    writeFile(
        "DefaultSyntaxVisitor",
        "package "
            + PACKAGE
            + ";\n\n"
            + "public abstract class DefaultSyntaxVisitor<V> implements SyntaxVisitor<V> {\n\n"
            + "  protected V visitDefault("
            + nodeInterface
            + " node, V value) {\n"
            + "    return node.visitChildren(this, value);\n"
            + "  }\n\n"
            + "%s\n\n}\n",
        typeName ->
            String.format(
                "  @Override\n"
                    + "  public V visit(%s node, V value) {\n"
                    + "    return visitDefault(node, value);\n"
                    + "  }",
                typeName));
    writeFile(
        "VoidSyntaxVisitor",
        "package "
            + PACKAGE
            + ";\n\n"
            + "public abstract class VoidSyntaxVisitor extends DefaultSyntaxVisitor<Void> {\n\n"
            + "  protected void visitDefault("
            + nodeInterface
            + " node) {\n"
            + "    node.visitChildren(this, null);\n"
            + "  }\n\n"
            + "%s\n\n}\n",
        typeName ->
            String.format(
                "  @Override\n"
                    + "  public final Void visit(%s node, Void value) {\n"
                    + "    visitImpl(node);\n"
                    + "    return null;\n"
                    + "  }\n\n"
                    + "  public void visitImpl(%s node) {\n"
                    + "    visitDefault(node);\n"
                    + "  }",
                typeName, typeName));
  }

  // SyntaxNode.Call -> SyntaxNode_Call_Visitable
  private static String getVisitableInterfaceName(Element element) {
    Deque<String> elems = new ArrayDeque<>();
    elems.push("Visitable");
    do {
      if (element.getKind() == ElementKind.CLASS) {
        elems.addFirst(element.getSimpleName().toString());
      }
      element = element.getEnclosingElement();
    } while (element.getKind() != ElementKind.PACKAGE);
    return elems.stream().collect(Collectors.joining("_"));
  }

  private void writeVisitableFile(TypeElement element) throws IOException {
    String interfaceName = getVisitableInterfaceName(element);
    if (element
        .getInterfaces()
        .stream()
        .noneMatch(i -> i.toString().endsWith(interfaceName))) {
      processingEnv
          .getMessager()
          .printMessage(Kind.ERROR, "Missing interface: " + interfaceName, element);
      return;
    }

    TypeSpec typeSpec =
        TypeSpec.interfaceBuilder(interfaceName)
            .addModifiers(Modifier.PUBLIC)
            .addSuperinterface(NODE_INTERFACE_NAME)
            .addMethod(
                MethodSpec.methodBuilder("accept")
                    .addAnnotation(Override.class)
                    .addModifiers(Modifier.PUBLIC, Modifier.DEFAULT)
                    .addTypeVariable(V)
                    .returns(V)
                    .addParameter(
                        ParameterSpec.builder(ParameterizedTypeName.get(VISITOR_NAME, V), "visitor")
                            .build())
                    .addParameter(ParameterSpec.builder(V, "value").build())
                    .addStatement(
                        "return visitor.visit(($L) this, value)",
                        element.getQualifiedName().toString())
                    .build())
            .build();

    JavaFile javaFile = JavaFile.builder(PACKAGE, typeSpec).build();
    JavaFileObject file = processingEnv.getFiler().createSourceFile(PACKAGE + "." + interfaceName);
    try (Writer wr = file.openWriter()) {
      wr.append(javaFile.toString());
    }
  }
}
