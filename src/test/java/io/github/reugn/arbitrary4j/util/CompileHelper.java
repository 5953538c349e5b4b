package io.github.reugn.arbitrary4j.util;

import com.google.testing.compile.Compilation;
import io.github.reugn.arbitrary4j.processor.ArbitraryProcessor;

import javax.tools.JavaFileObject;

import static com.google.testing.compile.Compiler.javac;

/**
 * Shared compilation helper for processor tests.
 */
public final class CompileHelper {

    private CompileHelper() {
    }

    public static Compilation compile(JavaFileObject... sources) {
        return javac()
                .withProcessors(new ArbitraryProcessor())
                .compile(sources);
    }
}
