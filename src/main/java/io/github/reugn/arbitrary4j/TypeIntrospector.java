package io.github.reugn.arbitrary4j;

import io.github.reugn.arbitrary4j.descriptor.RecordDescriptor;
import io.github.reugn.arbitrary4j.exception.ArbitraryException;
import io.github.reugn.arbitrary4j.exception.NotARecordTypeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Iterator;
import java.util.Map;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves the {@link RecordDescriptor} of a record type.
 *
 * <p><b>Lookup order:</b>
 * <ol>
 *   <li>Descriptors registered explicitly</li>
 *   <li>Descriptors listed in {@code META-INF/services/io.github.reugn.arbitrary4j.descriptor.RecordDescriptor},
 *       written by the annotation processor; entries that fail to load are skipped with a warning</li>
 *   <li>The generated class named by convention: {@code com.example.Order} maps to
 *       {@code com.example.OrderArbitrary}, nested {@code Outer.Inner} maps to {@code Outer_InnerArbitrary}</li>
 * </ol>
 *
 * <p>Only the requested type is resolved. Nested record fields are described when the
 * generator recurses into them, so a custom rule covering such a field needs no descriptor
 * for its type. Resolved descriptors are cached per type.
 */
final class TypeIntrospector {

    private static final Logger log = LoggerFactory.getLogger(TypeIntrospector.class);

    static final String GENERATED_SUFFIX = "Arbitrary";

    private final Map<Class<?>, RecordDescriptor<?>> registered = new ConcurrentHashMap<>();
    private final ClassLoader classLoader;

    TypeIntrospector(Collection<RecordDescriptor<?>> descriptors, ClassLoader classLoader) {
        this.classLoader = classLoader;
        descriptors.forEach(this::register);
        loadServiceDescriptors();
    }

    @SuppressWarnings("rawtypes")
    private void loadServiceDescriptors() {
        ServiceLoader<RecordDescriptor> loader = classLoader != null
                ? ServiceLoader.load(RecordDescriptor.class, classLoader)
                : ServiceLoader.load(RecordDescriptor.class);
        Iterator<RecordDescriptor> providers = loader.iterator();
        while (true) {
            RecordDescriptor<?> descriptor;
            try {
                if (!providers.hasNext()) {
                    break;
                }
                descriptor = providers.next();
            } catch (ServiceConfigurationError e) {
                log.warn("Skipping unusable service descriptor: {}", e.getMessage());
                continue;
            }
            RecordDescriptor<?> existing = registered.putIfAbsent(descriptor.type(), descriptor);
            if (existing != null) {
                log.warn("Ignoring service descriptor {} for {}: {} was registered explicitly",
                        descriptor.getClass().getName(), descriptor.type().getName(), existing);
            } else {
                log.debug("Loaded service descriptor {}", descriptor.getClass().getName());
            }
        }
    }

    /**
     * Registers or replaces the descriptor of a record type.
     */
    void register(RecordDescriptor<?> descriptor) {
        registered.put(descriptor.type(), descriptor);
        log.debug("Registered descriptor for {}", descriptor.type().getName());
    }

    <T> RecordDescriptor<T> describe(Class<T> type) {
        return describe(type, FieldPath.root(type));
    }

    /**
     * Describes {@code type}, found at {@code path}.
     *
     * @throws NotARecordTypeException if no descriptor exists for the type
     */
    @SuppressWarnings("unchecked")
    <T> RecordDescriptor<T> describe(Class<T> type, FieldPath path) {
        if (type.isPrimitive() || type.isInterface() || type.isArray() || type.isEnum()) {
            throw new NotARecordTypeException(kindOf(type) + " " + type.getName()
                    + " has no canonical constructor" + at(path), type.getSimpleName(), fieldPathOf(path));
        }
        RecordDescriptor<?> descriptor = registered.get(type);
        if (descriptor == null) {
            descriptor = loadGenerated(type, path);
        }
        if (descriptor == null) {
            String reason = type.isRecord()
                    ? "No descriptor found for record " + type.getName()
                    + "; annotate it with @Arbitrary, list it in @IncludeArbitrary or register one with RecordDescriptor.builder"
                    : type.getName() + " is not a record type";
            throw new NotARecordTypeException(reason + at(path), type.getSimpleName(), fieldPathOf(path));
        }
        return (RecordDescriptor<T>) descriptor;
    }

    private RecordDescriptor<?> loadGenerated(Class<?> type, FieldPath path) {
        String name = generatedName(type);
        ClassLoader loader = type.getClassLoader() != null ? type.getClassLoader() : classLoader;
        Class<?> generated;
        try {
            generated = Class.forName(name, true, loader);
        } catch (ClassNotFoundException e) {
            return null;
        }
        try {
            Object instance = generated.getConstructor().newInstance();
            if (!(instance instanceof RecordDescriptor<?> descriptor) || descriptor.type() != type) {
                throw new ArbitraryException(name + " is not a descriptor of " + type.getName(),
                        type.getSimpleName(), fieldPathOf(path));
            }
            registered.putIfAbsent(type, descriptor);
            log.debug("Loaded generated descriptor {}", name);
            return descriptor;
        } catch (ReflectiveOperationException e) {
            throw new ArbitraryException("Failed to instantiate generated descriptor " + name,
                    type.getSimpleName(), fieldPathOf(path), e);
        }
    }

    /**
     * Binary name of the descriptor the annotation processor generates for {@code type}.
     */
    static String generatedName(Class<?> type) {
        String packageName = type.getPackageName();
        String binaryName = type.getName();
        String simpleNames = packageName.isEmpty() ? binaryName : binaryName.substring(packageName.length() + 1);
        String generated = simpleNames.replace('$', '_') + GENERATED_SUFFIX;
        return packageName.isEmpty() ? generated : packageName + "." + generated;
    }

    private static String kindOf(Class<?> type) {
        if (type.isPrimitive()) {
            return "Primitive type";
        }
        if (type.isAnnotation()) {
            return "Annotation";
        }
        if (type.isInterface()) {
            return "Interface";
        }
        if (type.isArray()) {
            return "Array type";
        }
        return "Enum";
    }

    private static String at(FieldPath path) {
        return path.toString().contains(".") ? " (at " + path + ")" : "";
    }

    private static String fieldPathOf(FieldPath path) {
        return path.toString().contains(".") ? path.toString() : null;
    }
}
