package io.github.reugn.arbitrary4j.util;

import com.google.testing.compile.Compilation;
import io.github.reugn.arbitrary4j.ArbitraryGenerator;
import io.github.reugn.arbitrary4j.descriptor.RecordDescriptor;

import javax.tools.JavaFileObject;
import java.io.IOException;
import java.io.InputStream;
import java.lang.reflect.Constructor;
import java.lang.reflect.Method;
import java.util.HashMap;
import java.util.Map;

/**
 * Helper for compiling records with the processor and generating instances of them at runtime.
 *
 * <p>Usage:
 * <pre>{@code
 * RuntimeTestHelper helper = RuntimeTestHelper.compile(source);
 * Object customer = helper.generator().generate(helper.loadClass("example.Customer"));
 * assertThat(helper.invokeOn(customer, "name")).isEqualTo("arbitrary-1");
 * }</pre>
 */
public final class RuntimeTestHelper {

    private final Compilation compilation;
    private final ClassLoader classLoader;
    private final Map<String, Class<?>> loadedClasses;

    private RuntimeTestHelper(Compilation compilation) {
        this.compilation = compilation;
        this.classLoader = new CompiledClassLoader();
        this.loadedClasses = new HashMap<>();
    }

    /**
     * Compiles the given sources with the ArbitraryProcessor.
     *
     * @param sources the source files to compile
     * @return a helper for executing the compiled code
     * @throws AssertionError if compilation fails
     */
    public static RuntimeTestHelper compile(JavaFileObject... sources) {
        Compilation compilation = CompileHelper.compile(sources);

        if (compilation.status() != Compilation.Status.SUCCESS) {
            throw new AssertionError("Compilation failed: " + compilation.diagnostics());
        }

        return new RuntimeTestHelper(compilation);
    }

    /**
     * A fresh generator that resolves generated descriptors through the compiled classes.
     */
    public ArbitraryGenerator generator() {
        return ArbitraryGenerator.builder()
                .classLoader(classLoader)
                .build();
    }

    /**
     * Instantiates a generated descriptor class.
     *
     * @param className fully qualified name of the generated descriptor
     * @return the descriptor
     */
    public RecordDescriptor<?> descriptor(String className) {
        return (RecordDescriptor<?>) newInstance(className);
    }

    /**
     * Creates a new instance of the specified class using its no-arg constructor.
     *
     * @param className fully qualified class name
     * @return new instance
     */
    public Object newInstance(String className) {
        try {
            Class<?> clazz = loadClass(className);
            Constructor<?> constructor = clazz.getDeclaredConstructor();
            constructor.setAccessible(true);
            return constructor.newInstance();
        } catch (ReflectiveOperationException e) {
            throw new RuntimeException("Failed to create instance of " + className, e);
        }
    }

    /**
     * Invokes a no-arg instance method, typically a record accessor.
     *
     * @param instance   the object to invoke the method on
     * @param methodName method to invoke
     * @return the method's return value
     */
    public Object invokeOn(Object instance, String methodName) {
        try {
            Method method = instance.getClass().getDeclaredMethod(methodName);
            method.setAccessible(true);
            return method.invoke(instance);
        } catch (ReflectiveOperationException e) {
            throw new RuntimeException("Failed to invoke " + methodName, e);
        }
    }

    /**
     * Loads a class from the compilation output.
     *
     * @param className fully qualified class name
     * @return the loaded class
     */
    public Class<?> loadClass(String className) {
        return loadedClasses.computeIfAbsent(className, name -> {
            try {
                return classLoader.loadClass(name);
            } catch (ClassNotFoundException e) {
                throw new RuntimeException("Class not found: " + name, e);
            }
        });
    }

    /**
     * Returns the underlying compilation for additional assertions.
     */
    public Compilation getCompilation() {
        return compilation;
    }

    /**
     * ClassLoader that loads classes from compilation output.
     */
    private class CompiledClassLoader extends ClassLoader {
        CompiledClassLoader() {
            super(RuntimeTestHelper.class.getClassLoader());
        }

        @Override
        protected Class<?> findClass(String name) throws ClassNotFoundException {
            String path = name.replace('.', '/') + ".class";

            for (JavaFileObject file : compilation.generatedFiles()) {
                if (file.getKind() == JavaFileObject.Kind.CLASS) {
                    String filePath = file.toUri().getPath();
                    if (filePath.endsWith(path)) {
                        try (InputStream is = file.openInputStream()) {
                            byte[] bytes = is.readAllBytes();
                            return defineClass(name, bytes, 0, bytes.length);
                        } catch (IOException e) {
                            throw new ClassNotFoundException("Failed to load " + name, e);
                        }
                    }
                }
            }

            throw new ClassNotFoundException(name);
        }
    }
}
