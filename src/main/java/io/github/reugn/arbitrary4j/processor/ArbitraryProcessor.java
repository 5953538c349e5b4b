package io.github.reugn.arbitrary4j.processor;

import com.google.auto.service.AutoService;
import com.squareup.javapoet.JavaFile;
import io.github.reugn.arbitrary4j.annotation.Arbitrary;
import io.github.reugn.arbitrary4j.annotation.IncludeArbitrary;
import io.github.reugn.arbitrary4j.descriptor.RecordDescriptor;

import javax.annotation.processing.AbstractProcessor;
import javax.annotation.processing.ProcessingEnvironment;
import javax.annotation.processing.Processor;
import javax.annotation.processing.RoundEnvironment;
import javax.annotation.processing.SupportedAnnotationTypes;
import javax.annotation.processing.SupportedSourceVersion;
import javax.lang.model.SourceVersion;
import javax.lang.model.element.Element;
import javax.lang.model.element.TypeElement;
import javax.lang.model.type.MirroredTypesException;
import javax.lang.model.type.TypeKind;
import javax.lang.model.type.TypeMirror;
import javax.lang.model.util.Elements;
import javax.lang.model.util.Types;
import javax.tools.Diagnostic;
import javax.tools.FileObject;
import javax.tools.StandardLocation;
import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Annotation processor for arbitrary4j: generates a record descriptor for every record that
 * should be generated at runtime.
 *
 * <p>Registered via {@link com.google.auto.service.AutoService} for automatic discovery by
 * the Java compiler.
 *
 * <p><b>Supported Annotations:</b>
 * <table border="1">
 *   <caption>Annotations processed by this processor</caption>
 *   <tr><th>Annotation</th><th>Target</th><th>Generated into</th></tr>
 *   <tr>
 *     <td>{@link Arbitrary}</td>
 *     <td>Record</td>
 *     <td>the record's package</td>
 *   </tr>
 *   <tr>
 *     <td>{@link IncludeArbitrary}</td>
 *     <td>Class</td>
 *     <td>the annotated class's package</td>
 *   </tr>
 * </table>
 *
 * <p><b>Processing Pipeline:</b>
 * <ol>
 *   <li><b>Collection</b> - Gather {@code @Arbitrary} records and {@code @IncludeArbitrary} targets</li>
 *   <li><b>Validation</b> - Records only, accessible, non-generic, acyclic</li>
 *   <li><b>Generation</b> - One {@code {RecordName}Arbitrary} class per record, via {@link DescriptorGenerator}</li>
 *   <li><b>Registration</b> - In the last round, list every generated class in
 *       {@code META-INF/services/io.github.reugn.arbitrary4j.descriptor.RecordDescriptor}</li>
 * </ol>
 *
 * <p>Errors are reported via the {@link javax.annotation.processing.Messager} and processing
 * continues, so a single compilation reports as many problems as possible.
 *
 * @see DescriptorGenerator
 * @see ValidationUtils
 */
@AutoService(Processor.class)
@SupportedAnnotationTypes({
        "io.github.reugn.arbitrary4j.annotation.Arbitrary",
        "io.github.reugn.arbitrary4j.annotation.IncludeArbitrary"
})
@SupportedSourceVersion(SourceVersion.RELEASE_17)
public class ArbitraryProcessor extends AbstractProcessor {

    static final String SERVICES_FILE = "META-INF/services/" + RecordDescriptor.class.getName();

    private final Set<String> generated = new TreeSet<>();

    private ErrorReporter errorReporter;
    private DescriptorGenerator descriptorGenerator;
    private Types typeUtils;
    private Elements elementUtils;

    /**
     * Creates a new ArbitraryProcessor instance.
     *
     * <p>The processor is not usable until {@link #init(ProcessingEnvironment)} is called
     * by the compiler.
     */
    public ArbitraryProcessor() {
        // Required for ServiceLoader-based processor discovery
    }

    @Override
    public synchronized void init(ProcessingEnvironment processingEnv) {
        super.init(processingEnv);
        this.errorReporter = (element, message) ->
                processingEnv.getMessager().printMessage(Diagnostic.Kind.ERROR, message, element);
        this.typeUtils = processingEnv.getTypeUtils();
        this.elementUtils = processingEnv.getElementUtils();
        this.descriptorGenerator = new DescriptorGenerator(typeUtils);
    }

    /**
     * Processes {@code @Arbitrary} and {@code @IncludeArbitrary} annotations.
     *
     * @param annotations the annotation types being processed in this round
     * @param roundEnv    the environment for this processing round
     * @return {@code true} to claim the annotations
     */
    @Override
    public boolean process(Set<? extends TypeElement> annotations, RoundEnvironment roundEnv) {
        if (roundEnv.processingOver()) {
            writeServicesFile();
            return true;
        }

        for (Element element : roundEnv.getElementsAnnotatedWith(Arbitrary.class)) {
            if (ValidationUtils.validateAnnotatedType(element, typeUtils, errorReporter)) {
                TypeElement record = (TypeElement) element;
                generateDescriptor(record, CodeGenUtils.packageName(record, elementUtils), record);
            }
        }

        for (Element element : roundEnv.getElementsAnnotatedWith(IncludeArbitrary.class)) {
            if (!(element instanceof TypeElement holder)) {
                continue;
            }
            String packageName = CodeGenUtils.packageName(holder, elementUtils);
            for (TypeElement included : includedTypes(holder)) {
                if (ValidationUtils.validateIncludedType(included, holder, typeUtils, elementUtils, errorReporter)) {
                    generateDescriptor(included, packageName, holder);
                }
            }
        }
        return true;
    }

    private void generateDescriptor(TypeElement record, String packageName, Element reportOn) {
        String qualifiedName = CodeGenUtils.qualifiedName(packageName, CodeGenUtils.generatedSimpleName(record));
        if (!generated.add(qualifiedName)) {
            // already annotated directly or included elsewhere in the same package
            return;
        }
        JavaFile file = descriptorGenerator.generate(record, packageName);
        try {
            file.writeTo(processingEnv.getFiler());
        } catch (IOException e) {
            errorReporter.error(reportOn, "Failed to generate descriptor " + qualifiedName + ": " + e.getMessage());
        }
    }

    /**
     * Reads {@code @IncludeArbitrary.value()} as type mirrors.
     *
     * <p>Accessing the {@code Class[]} value directly throws {@link MirroredTypesException}
     * during annotation processing, which carries the mirrors.
     */
    private List<TypeElement> includedTypes(TypeElement holder) {
        IncludeArbitrary annotation = holder.getAnnotation(IncludeArbitrary.class);
        List<? extends TypeMirror> mirrors;
        try {
            annotation.value();
            return List.of();
        } catch (MirroredTypesException e) {
            mirrors = e.getTypeMirrors();
        }
        List<TypeElement> types = new ArrayList<>();
        for (TypeMirror mirror : mirrors) {
            if (mirror.getKind() == TypeKind.DECLARED) {
                types.add((TypeElement) typeUtils.asElement(mirror));
            } else {
                errorReporter.error(holder, "Cannot include '" + mirror + "' in @IncludeArbitrary. "
                        + "Only records are supported.");
            }
        }
        return types;
    }

    private void writeServicesFile() {
        if (generated.isEmpty()) {
            return;
        }
        try {
            FileObject file = processingEnv.getFiler()
                    .createResource(StandardLocation.CLASS_OUTPUT, "", SERVICES_FILE);
            try (Writer writer = file.openWriter()) {
                for (String name : generated) {
                    writer.write(name);
                    writer.write('\n');
                }
            }
            processingEnv.getMessager().printMessage(Diagnostic.Kind.NOTE,
                    "arbitrary4j: registered " + generated.size() + " record descriptor(s) in " + SERVICES_FILE);
        } catch (IOException e) {
            processingEnv.getMessager().printMessage(Diagnostic.Kind.ERROR,
                    "Failed to write " + SERVICES_FILE + ": " + e.getMessage());
        }
    }
}
