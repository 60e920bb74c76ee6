package bdl.processor;

import java.io.IOException;
import java.util.Comparator;
import java.util.Set;
import java.util.TreeSet;

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
import com.google.common.collect.ImmutableSet;
import com.squareup.javapoet.ClassName;
import com.squareup.javapoet.JavaFile;
import com.squareup.javapoet.MethodSpec;
import com.squareup.javapoet.ParameterizedTypeName;
import com.squareup.javapoet.TypeName;
import com.squareup.javapoet.TypeSpec;
import com.squareup.javapoet.TypeVariableName;

/**
 * Generates the visitor plumbing for the document model.
 *
 * <p>Every {@link ScriptNode} class gets a {@code <Outer>_<Name>_ScriptNode} interface with
 * {@code accept} and {@code visitChildren} defaults. Once all rounds are done, {@code
 * ScriptVisitor}, {@code DefaultScriptVisitor} and {@code VoidDefaultScriptVisitor} are written
 * with one {@code visit} overload per node type.
 */
@AutoService(Processor.class)
public class ScriptNodeProcessor extends AbstractProcessor {

  private static final String INTERFACE_SUFFIX = "_ScriptNode";
  private static final TypeVariableName V = TypeVariableName.get("V");

  private final Set<ClassName> scriptNodes =
      new TreeSet<>(Comparator.comparing(ClassName::canonicalName));
  private String packageName = null;

  @Override
  public SourceVersion getSupportedSourceVersion() {
    return SourceVersion.latestSupported();
  }

  @Override
  public ImmutableSet<String> getSupportedAnnotationTypes() {
    return ImmutableSet.of(ScriptNode.class.getName(), ScriptChild.class.getName());
  }

  @Override
  public boolean process(Set<? extends TypeElement> annotations, RoundEnvironment roundEnv) {
    try {
      if (roundEnv.processingOver()) {
        if (!scriptNodes.isEmpty()) generateVisitorFiles();
      } else {
        for (Element element : roundEnv.getElementsAnnotatedWith(ScriptNode.class)) {
          writeScriptNodeFile((TypeElement) element);
        }
      }
    } catch (IOException ex) {
      processingEnv.getMessager().printMessage(Kind.ERROR, "failed to write source: " + ex);
    }

    return true;
  }

  private ClassName packageType(String simpleName) {
    return ClassName.get(packageName, simpleName);
  }

  private void writeScriptNodeFile(TypeElement element) throws IOException {
    String elementPackage =
        processingEnv.getElementUtils().getPackageOf(element).getQualifiedName().toString();
    if (packageName == null) {
      packageName = elementPackage;
    } else if (!packageName.equals(elementPackage)) {
      processingEnv
          .getMessager()
          .printMessage(Kind.ERROR, "all @ScriptNode types must share one package", element);
      return;
    }
    if (!element.getTypeParameters().isEmpty()) {
      processingEnv
          .getMessager()
          .printMessage(Kind.ERROR, "@ScriptNode types cannot be generic", element);
      return;
    }

    ClassName nodeName = ClassName.get(element);
    String interfaceName = String.join("_", nodeName.simpleNames()) + INTERFACE_SUFFIX;
    if (element.getInterfaces().stream().noneMatch(i -> i.toString().endsWith(interfaceName))) {
      processingEnv
          .getMessager()
          .printMessage(Kind.ERROR, "missing interface: " + interfaceName, element);
      return;
    }

    ParameterizedTypeName visitorType =
        ParameterizedTypeName.get(packageType("ScriptVisitor"), V);
    TypeSpec.Builder typeBuilder =
        TypeSpec.interfaceBuilder(interfaceName)
            .addModifiers(Modifier.PUBLIC)
            .addSuperinterface(packageType("ScriptNodeInterface"))
            .addMethod(
                MethodSpec.methodBuilder("accept")
                    .addAnnotation(Override.class)
                    .addModifiers(Modifier.PUBLIC, Modifier.DEFAULT)
                    .addTypeVariable(V)
                    .returns(V)
                    .addParameter(visitorType, "visitor")
                    .addParameter(V, "value")
                    .addStatement("return visitor.visit(($T) this, value)", nodeName)
                    .build());

    MethodSpec.Builder visitChildren =
        MethodSpec.methodBuilder("visitChildren")
            .addAnnotation(Override.class)
            .addModifiers(Modifier.PUBLIC, Modifier.DEFAULT)
            .addTypeVariable(V)
            .returns(V)
            .addParameter(visitorType, "visitor")
            .addParameter(V, "value");
    for (Element enclosed : element.getEnclosedElements()) {
      if (enclosed.getKind() != ElementKind.METHOD) continue;
      if (enclosed.getAnnotation(ScriptChild.class) == null) continue;
      if (enclosed.getAnnotation(Override.class) == null) {
        processingEnv.getMessager().printMessage(Kind.ERROR, "missing @Override", enclosed);
      }

      ExecutableElement method = (ExecutableElement) enclosed;
      String methodName = method.getSimpleName().toString();
      typeBuilder.addMethod(
          MethodSpec.methodBuilder(methodName)
              .addModifiers(Modifier.PUBLIC, Modifier.ABSTRACT)
              .returns(TypeName.get(method.getReturnType()))
              .build());
      visitChildren.addStatement(
          "value = $T.accept($L(), visitor, value)", packageType("ScriptNodeUtils"), methodName);
    }
    typeBuilder.addMethod(visitChildren.addStatement("return value").build());

    JavaFile.builder(packageName, typeBuilder.build())
        .build()
        .writeTo(processingEnv.getFiler());
    scriptNodes.add(nodeName);
  }

  private void generateVisitorFiles() throws IOException {
    TypeSpec.Builder visitor =
        TypeSpec.interfaceBuilder("ScriptVisitor").addTypeVariable(V);
    TypeSpec.Builder defaultVisitor =
        TypeSpec.classBuilder("DefaultScriptVisitor")
            .addModifiers(Modifier.PUBLIC, Modifier.ABSTRACT)
            .addTypeVariable(V)
            .addSuperinterface(ParameterizedTypeName.get(packageType("ScriptVisitor"), V));
    TypeSpec.Builder voidVisitor =
        TypeSpec.classBuilder("VoidDefaultScriptVisitor")
            .addModifiers(Modifier.PUBLIC, Modifier.ABSTRACT)
            .superclass(
                ParameterizedTypeName.get(
                    packageType("DefaultScriptVisitor"), ClassName.get(Void.class)));

    for (ClassName node : scriptNodes) {
      visitor.addMethod(
          MethodSpec.methodBuilder("visit")
              .addModifiers(Modifier.PUBLIC, Modifier.ABSTRACT)
              .returns(V)
              .addParameter(node, "node")
              .addParameter(V, "value")
              .build());
      defaultVisitor.addMethod(
          MethodSpec.methodBuilder("visit")
              .addAnnotation(Override.class)
              .addModifiers(Modifier.PUBLIC)
              .returns(V)
              .addParameter(node, "node")
              .addParameter(V, "value")
              .addStatement("return node.visitChildren(this, value)")
              .build());
      voidVisitor.addMethod(
          MethodSpec.methodBuilder("visit")
              .addAnnotation(Override.class)
              .addModifiers(Modifier.PUBLIC, Modifier.FINAL)
              .returns(Void.class)
              .addParameter(node, "node")
              .addParameter(Void.class, "value")
              .addStatement("visitImpl(node)")
              .addStatement("return null")
              .build());
      voidVisitor.addMethod(
          MethodSpec.methodBuilder("visitImpl")
              .addModifiers(Modifier.PUBLIC)
              .addParameter(node, "node")
              .addStatement("node.visitChildren(this, null)")
              .build());
    }

    for (TypeSpec.Builder builder : new TypeSpec.Builder[] {visitor, defaultVisitor, voidVisitor}) {
      JavaFile.builder(packageName, builder.build()).build().writeTo(processingEnv.getFiler());
    }
  }
}
