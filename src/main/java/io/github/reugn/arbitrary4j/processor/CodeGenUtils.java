package io.github.reugn.arbitrary4j.processor;

import com.squareup.javapoet.ClassName;

import javax.lang.model.element.Element;
import javax.lang.model.element.ElementKind;
import javax.lang.model.element.ExecutableElement;
import javax.lang.model.element.RecordComponentElement;
import javax.lang.model.element.TypeElement;
import javax.lang.model.element.VariableElement;
import javax.lang.model.util.Elements;
import javax.lang.model.util.Types;
import java.util.ArrayList;
import java.util.List;

/**
 * Shared helpers for reading record structure and naming generated descriptors.
 */
final class CodeGenUtils {

    /**
     * Suffix of generated descriptor classes.
     */
    static final String GENERATED_SUFFIX = "Arbitrary";

    /**
     * Separator between the simple names of nested types in a generated class name.
     */
    static final String NESTING_SEPARATOR = "_";

    private CodeGenUtils() {
    }

    // ==================== RECORD STRUCTURE ====================

    /**
     * Extracts record component elements from a record type, in declaration order.
     *
     * @param recordElement the record type to extract components from
     * @return list of record components; empty list if none found
     */
    static List<RecordComponentElement> recordComponents(TypeElement recordElement) {
        List<RecordComponentElement> components = new ArrayList<>();
        for (Element enclosed : recordElement.getEnclosedElements()) {
            if (enclosed.getKind() == ElementKind.RECORD_COMPONENT) {
                components.add((RecordComponentElement) enclosed);
            }
        }
        return components;
    }

    /**
     * Finds the canonical constructor of a record.
     *
     * <p>The canonical constructor has exactly the component types, in component order.
     * It may be implicit, compact or explicitly declared; all three appear as constructor
     * elements.
     *
     * @param recordElement the record type to search
     * @param typeUtils     type utilities for comparing parameter and component types
     * @return the canonical constructor element, or {@code null} if not found
     */
    static ExecutableElement findCanonicalConstructor(TypeElement recordElement, Types typeUtils) {
        List<RecordComponentElement> components = recordComponents(recordElement);

        for (Element enclosed : recordElement.getEnclosedElements()) {
            if (enclosed.getKind() != ElementKind.CONSTRUCTOR) {
                continue;
            }
            ExecutableElement constructor = (ExecutableElement) enclosed;
            List<? extends VariableElement> params = constructor.getParameters();
            if (params.size() != components.size()) {
                continue;
            }
            boolean matches = true;
            for (int i = 0; i < params.size(); i++) {
                if (!typeUtils.isSameType(params.get(i).asType(), components.get(i).asType())) {
                    matches = false;
                    break;
                }
            }
            if (matches) {
                return constructor;
            }
        }
        return null;
    }

    // ==================== NAMING ====================

    /**
     * Simple name of the descriptor generated for a record.
     *
     * <p>Top-level {@code Order} maps to {@code OrderArbitrary}; nested {@code Shop.Order}
     * maps to {@code Shop_OrderArbitrary}.
     *
     * @param recordElement the record type
     * @return the generated simple name
     */
    static String generatedSimpleName(TypeElement recordElement) {
        return String.join(NESTING_SEPARATOR, ClassName.get(recordElement).simpleNames()) + GENERATED_SUFFIX;
    }

    /**
     * @return the package name of a type, empty for the unnamed package
     */
    static String packageName(TypeElement type, Elements elementUtils) {
        return elementUtils.getPackageOf(type).getQualifiedName().toString();
    }

    /**
     * @return the fully qualified name of a generated class
     */
    static String qualifiedName(String packageName, String simpleName) {
        return packageName.isEmpty() ? simpleName : packageName + "." + simpleName;
    }
}
