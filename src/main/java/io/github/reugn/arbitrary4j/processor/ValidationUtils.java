package io.github.reugn.arbitrary4j.processor;

import javax.lang.model.element.Element;
import javax.lang.model.element.ElementKind;
import javax.lang.model.element.Modifier;
import javax.lang.model.element.NestingKind;
import javax.lang.model.element.PackageElement;
import javax.lang.model.element.RecordComponentElement;
import javax.lang.model.element.TypeElement;
import javax.lang.model.type.ArrayType;
import javax.lang.model.type.DeclaredType;
import javax.lang.model.type.TypeKind;
import javax.lang.model.type.TypeMirror;
import javax.lang.model.type.WildcardType;
import javax.lang.model.util.Elements;
import javax.lang.model.util.Types;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Locale;
import java.util.function.Predicate;

/**
 * Compile-time validation for records that receive a generated descriptor.
 *
 * <p>Errors are reported on the record (or, for {@code @IncludeArbitrary}, on the class
 * carrying the annotation) so they point at the code the user has to change.
 *
 * <p><b>Checks:</b>
 * <ul>
 *   <li>Kind: only records can be described</li>
 *   <li>Visibility: the record and its enclosing types must not be {@code private}; local
 *       records are rejected</li>
 *   <li>Type parameters: generic records are rejected</li>
 *   <li>Constructor: a canonical constructor must be found</li>
 *   <li>Component types: must not be {@code private} nested types</li>
 *   <li>Cycles: a record must not reach itself through record-typed components</li>
 *   <li>Included records from another package must be public, as must the component types
 *       they mention from outside the annotated class's package</li>
 * </ul>
 *
 * <p><b>Example Error Messages:</b>
 * <pre>
 * error: @Arbitrary can only be applied to records, but 'Customer' is a class.
 * error: Record 'Node' refers back to itself through Node.next. Make the component Optional or a collection.
 * </pre>
 */
final class ValidationUtils {

    private ValidationUtils() {
    }

    // ==================== TYPE VALIDATION ====================

    /**
     * Validates a type annotated with {@code @Arbitrary}.
     *
     * @param type          the annotated element
     * @param typeUtils     type utilities
     * @param errorReporter callback for reporting compilation errors
     * @return {@code true} if a descriptor can be generated
     */
    static boolean validateAnnotatedType(Element type, Types typeUtils, ErrorReporter errorReporter) {
        if (type.getKind() != ElementKind.RECORD) {
            errorReporter.error(type, "@Arbitrary can only be applied to records, but '" + type.getSimpleName()
                    + "' is " + describeKind(type.getKind()) + ".");
            return false;
        }
        return validateRecord((TypeElement) type, type, typeUtils, errorReporter);
    }

    /**
     * Validates a type listed in {@code @IncludeArbitrary}.
     *
     * @param includedType    the listed type
     * @param definingElement the element bearing the annotation (error location)
     * @param typeUtils       type utilities
     * @param errorReporter   callback for reporting compilation errors
     * @return {@code true} if a descriptor can be generated
     */
    static boolean validateIncludedType(TypeElement includedType, Element definingElement, Types typeUtils,
                                        Elements elementUtils, ErrorReporter errorReporter) {
        if (includedType.getKind() != ElementKind.RECORD) {
            errorReporter.error(definingElement, "Cannot include " + describeKind(includedType.getKind()) + " '"
                    + includedType.getSimpleName() + "' in @IncludeArbitrary. Only records are supported.");
            return false;
        }
        if (!validateRecord(includedType, definingElement, typeUtils, errorReporter)) {
            return false;
        }
        return validatePublicOutsidePackage(includedType, definingElement, elementUtils, errorReporter);
    }

    /**
     * Descriptors of included records are generated in the package of the annotated class,
     * so a record from another package must be public all the way out, and so must every type
     * its components mention unless that type lives in the annotated class's package.
     */
    private static boolean validatePublicOutsidePackage(TypeElement record, Element definingElement,
                                                        Elements elementUtils, ErrorReporter errorReporter) {
        PackageElement target = elementUtils.getPackageOf(definingElement);
        if (elementUtils.getPackageOf(record).equals(target)) {
            return true;
        }
        Element current = record;
        while (current instanceof TypeElement) {
            if (!current.getModifiers().contains(Modifier.PUBLIC)) {
                errorReporter.error(definingElement, "Cannot include record '" + record.getSimpleName()
                        + "' in @IncludeArbitrary: '" + current.getSimpleName() + "' is not public and the "
                        + "descriptor is generated in package '" + target + "'.");
                return false;
            }
            current = current.getEnclosingElement();
        }
        boolean valid = true;
        for (RecordComponentElement component : CodeGenUtils.recordComponents(record)) {
            TypeElement hidden = findType(component.asType(), type ->
                    !type.getModifiers().contains(Modifier.PUBLIC) && !elementUtils.getPackageOf(type).equals(target));
            if (hidden != null) {
                errorReporter.error(definingElement, "Cannot include record '" + record.getSimpleName()
                        + "' in @IncludeArbitrary: component '" + component.getSimpleName() + "' uses type '"
                        + hidden.getSimpleName() + "', which is not public, and the descriptor is generated in "
                        + "package '" + target + "'.");
                valid = false;
            }
        }
        return valid;
    }

    private static boolean validateRecord(TypeElement record, Element reportOn, Types typeUtils,
                                          ErrorReporter errorReporter) {
        boolean valid = validateVisibility(record, reportOn, errorReporter);

        if (!record.getTypeParameters().isEmpty()) {
            errorReporter.error(reportOn, "Record '" + record.getSimpleName() + "' declares type parameters. "
                    + "Generic records are not supported.");
            valid = false;
        }

        if (CodeGenUtils.findCanonicalConstructor(record, typeUtils) == null) {
            errorReporter.error(reportOn, "Could not find the canonical constructor of record '"
                    + record.getSimpleName() + "'.");
            valid = false;
        }

        for (RecordComponentElement component : CodeGenUtils.recordComponents(record)) {
            TypeElement privateType = findType(component.asType(),
                    type -> type.getModifiers().contains(Modifier.PRIVATE));
            if (privateType != null) {
                errorReporter.error(reportOn, "Component '" + component.getSimpleName() + "' of record '"
                        + record.getSimpleName() + "' has private type '" + privateType.getSimpleName()
                        + "'. Generated descriptors cannot access private types.");
                valid = false;
            }
        }

        return valid && validateNoCycle(record, reportOn, errorReporter);
    }

    // ==================== VISIBILITY VALIDATION ====================

    private static boolean validateVisibility(TypeElement record, Element reportOn, ErrorReporter errorReporter) {
        if (record.getNestingKind() == NestingKind.LOCAL) {
            errorReporter.error(reportOn, "Record '" + record.getSimpleName() + "' is a local record. "
                    + "Declare it at top level or as a member type.");
            return false;
        }
        Element current = record;
        while (current instanceof TypeElement) {
            if (current.getModifiers().contains(Modifier.PRIVATE)) {
                String subject = current == record
                        ? "Record '" + record.getSimpleName() + "' is private"
                        : "Record '" + record.getSimpleName() + "' is nested in private type '"
                        + current.getSimpleName() + "'";
                errorReporter.error(reportOn, subject + ". Generated descriptors cannot access private "
                        + "elements. Use package-private, protected, or public visibility.");
                return false;
            }
            current = current.getEnclosingElement();
        }
        return true;
    }

    /**
     * Finds the first type mentioned by {@code type} that matches {@code rejected}: the type
     * itself, its enclosing types, array components, type arguments and wildcard bounds.
     */
    private static TypeElement findType(TypeMirror type, Predicate<TypeElement> rejected) {
        switch (type.getKind()) {
            case ARRAY:
                return findType(((ArrayType) type).getComponentType(), rejected);
            case WILDCARD:
                WildcardType wildcard = (WildcardType) type;
                TypeMirror bound = wildcard.getExtendsBound() != null
                        ? wildcard.getExtendsBound()
                        : wildcard.getSuperBound();
                return bound == null ? null : findType(bound, rejected);
            case DECLARED:
                break;
            default:
                return null;
        }
        DeclaredType declared = (DeclaredType) type;
        Element element = declared.asElement();
        while (element instanceof TypeElement typeElement) {
            if (rejected.test(typeElement)) {
                return typeElement;
            }
            element = element.getEnclosingElement();
        }
        for (TypeMirror argument : declared.getTypeArguments()) {
            TypeElement found = findType(argument, rejected);
            if (found != null) {
                return found;
            }
        }
        return null;
    }

    // ==================== CYCLE VALIDATION ====================

    /**
     * Rejects records that reach themselves through record-typed components.
     *
     * <p>Only components whose declared type is itself a record are followed. A back-reference
     * wrapped in {@code Optional} or a collection is generated empty and does not recurse.
     */
    static boolean validateNoCycle(TypeElement record, Element reportOn, ErrorReporter errorReporter) {
        String cyclePath = findCycle(record, record, record.getSimpleName().toString(), new ArrayDeque<>());
        if (cyclePath != null) {
            errorReporter.error(reportOn, "Record '" + record.getSimpleName() + "' refers back to itself through "
                    + cyclePath + ". Make the component Optional or a collection.");
            return false;
        }
        return true;
    }

    private static String findCycle(TypeElement root, TypeElement current, String path, Deque<TypeElement> visiting) {
        visiting.push(current);
        try {
            for (RecordComponentElement component : CodeGenUtils.recordComponents(current)) {
                TypeElement nested = recordTypeOf(component.asType());
                if (nested == null) {
                    continue;
                }
                String componentPath = path + "." + component.getSimpleName();
                if (nested.equals(root)) {
                    return componentPath;
                }
                if (visiting.contains(nested)) {
                    // a cycle that does not pass through root is reported on its own members
                    continue;
                }
                String found = findCycle(root, nested, componentPath, visiting);
                if (found != null) {
                    return found;
                }
            }
            return null;
        } finally {
            visiting.pop();
        }
    }

    private static TypeElement recordTypeOf(TypeMirror type) {
        if (type.getKind() != TypeKind.DECLARED) {
            return null;
        }
        Element element = ((DeclaredType) type).asElement();
        return element.getKind() == ElementKind.RECORD ? (TypeElement) element : null;
    }

    private static String describeKind(ElementKind kind) {
        return switch (kind) {
            case CLASS -> "a class";
            case INTERFACE -> "an interface";
            case ENUM -> "an enum";
            case ANNOTATION_TYPE -> "an annotation type";
            default -> "a " + kind.name().toLowerCase(Locale.ROOT);
        };
    }
}
