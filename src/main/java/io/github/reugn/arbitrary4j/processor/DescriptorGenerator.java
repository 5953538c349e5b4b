package io.github.reugn.arbitrary4j.processor;

import com.squareup.javapoet.AnnotationSpec;
import com.squareup.javapoet.ClassName;
import com.squareup.javapoet.CodeBlock;
import com.squareup.javapoet.JavaFile;
import com.squareup.javapoet.MethodSpec;
import com.squareup.javapoet.ParameterizedTypeName;
import com.squareup.javapoet.TypeName;
import com.squareup.javapoet.TypeSpec;
import io.github.reugn.arbitrary4j.descriptor.AbstractRecordDescriptor;
import io.github.reugn.arbitrary4j.descriptor.FieldDescriptor;

import javax.lang.model.element.Modifier;
import javax.lang.model.element.RecordComponentElement;
import javax.lang.model.element.TypeElement;
import javax.lang.model.util.Types;
import java.util.List;

/**
 * Generates the {@code {RecordName}Arbitrary} descriptor of one record.
 *
 * <p><b>Generated Output:</b>
 * <pre>
 * {@code // Source
 * @Arbitrary
 * public record Customer(String name, int age, List<String> tags) {}
 *
 * // Generated: CustomerArbitrary.java
 * @Generated("io.github.reugn.arbitrary4j.processor.ArbitraryProcessor")
 * public final class CustomerArbitrary extends AbstractRecordDescriptor<Customer> {
 *     public CustomerArbitrary() {
 *         super(Customer.class, List.of(
 *                 FieldDescriptor.of(0, "name", FieldType.text()),
 *                 FieldDescriptor.of(1, "age", FieldType.integral(int.class)),
 *                 FieldDescriptor.of(2, "tags", FieldType.list(FieldType.text()))));
 *     }
 *
 *     protected Customer newInstance(Object[] args) {
 *         return new Customer((String) args[0], (int) args[1], (List<String>) args[2]);
 *     }
 *
 *     protected Object component(Customer instance, int index) {
 *         return switch (index) {
 *             case 0 -> instance.name();
 *             case 1 -> instance.age();
 *             case 2 -> instance.tags();
 *             default -> throw new IndexOutOfBoundsException(...);
 *         };
 *     }
 * }}
 * </pre>
 *
 * <p>The generated class has a public no-arg constructor so that {@link java.util.ServiceLoader}
 * and the runtime naming-convention lookup can instantiate it.
 */
final class DescriptorGenerator {

    private static final ClassName GENERATED =
            ClassName.get("javax.annotation.processing", "Generated");

    private final FieldTypeMapper fieldTypeMapper;

    DescriptorGenerator(Types typeUtils) {
        this.fieldTypeMapper = new FieldTypeMapper(typeUtils);
    }

    /**
     * Builds the descriptor source for a validated record.
     *
     * @param record      the record type
     * @param packageName the package to generate into
     * @return the source file, ready to be written to the filer
     */
    JavaFile generate(TypeElement record, String packageName) {
        ClassName recordType = ClassName.get(record);
        String generatedName = CodeGenUtils.generatedSimpleName(record);
        List<RecordComponentElement> components = CodeGenUtils.recordComponents(record);

        TypeSpec descriptor = TypeSpec.classBuilder(generatedName)
                .addModifiers(Modifier.PUBLIC, Modifier.FINAL)
                .superclass(ParameterizedTypeName.get(ClassName.get(AbstractRecordDescriptor.class), recordType))
                .addAnnotation(AnnotationSpec.builder(GENERATED)
                        .addMember("value", "$S", ArbitraryProcessor.class.getCanonicalName())
                        .build())
                .addJavadoc("Arbitrary instance descriptor for {@link $T}.\n", recordType)
                .addJavadoc("<p>Generated by arbitrary4j annotation processor.\n")
                .addMethod(constructor(recordType, components))
                .addMethod(newInstance(recordType, components))
                .addMethod(component(recordType, components))
                .build();

        return JavaFile.builder(packageName, descriptor)
                .addFileComment("Generated by arbitrary4j annotation processor. Do not modify.")
                .build();
    }

    private MethodSpec constructor(ClassName recordType, List<RecordComponentElement> components) {
        CodeBlock.Builder fields = CodeBlock.builder();
        for (int i = 0; i < components.size(); i++) {
            RecordComponentElement component = components.get(i);
            fields.add(i == 0 ? "\n" : ",\n")
                    .add("$T.of($L, $S, $L)", FieldDescriptor.class, i, component.getSimpleName().toString(),
                            fieldTypeMapper.map(component.asType()));
        }
        return MethodSpec.constructorBuilder()
                .addModifiers(Modifier.PUBLIC)
                .addStatement("super($T.class, $T.of($>$>$L$<$<))", recordType, List.class, fields.build())
                .build();
    }

    private MethodSpec newInstance(ClassName recordType, List<RecordComponentElement> components) {
        CodeBlock.Builder arguments = CodeBlock.builder();
        for (int i = 0; i < components.size(); i++) {
            if (i > 0) {
                arguments.add(", ");
            }
            arguments.add("($T) args[$L]", TypeName.get(components.get(i).asType()), i);
        }
        return MethodSpec.methodBuilder("newInstance")
                .addAnnotation(Override.class)
                .addAnnotation(AnnotationSpec.builder(SuppressWarnings.class)
                        .addMember("value", "$S", "unchecked")
                        .build())
                .addModifiers(Modifier.PROTECTED)
                .returns(recordType)
                .addParameter(Object[].class, "args")
                .addStatement("return new $T($L)", recordType, arguments.build())
                .build();
    }

    private MethodSpec component(ClassName recordType, List<RecordComponentElement> components) {
        CodeBlock.Builder body = CodeBlock.builder()
                .add("return switch (index) {\n$>");
        for (int i = 0; i < components.size(); i++) {
            body.add("case $L -> instance.$N();\n", i, components.get(i).getSimpleName().toString());
        }
        body.add("default -> throw new $T($S + index);\n", IndexOutOfBoundsException.class,
                        recordType.simpleName() + " has no component at index ")
                .add("$<};\n");
        return MethodSpec.methodBuilder("component")
                .addAnnotation(Override.class)
                .addModifiers(Modifier.PROTECTED)
                .returns(Object.class)
                .addParameter(recordType, "instance")
                .addParameter(int.class, "index")
                .addCode(body.build())
                .build();
    }
}
