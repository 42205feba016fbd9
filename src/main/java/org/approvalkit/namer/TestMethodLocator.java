package org.approvalkit.namer;

import java.lang.annotation.Annotation;
import java.lang.reflect.Method;
import java.util.Optional;
import java.util.Set;

/**
 * Finds the running test by walking the call stack for the nearest method carrying a test annotation.
 * Used when no test framework integration installed an {@link ApprovalTestContext}.
 */
final class TestMethodLocator {
    private static final Set<String> TEST_ANNOTATIONS = Set.of(
            "org.junit.jupiter.api.Test",
            "org.junit.jupiter.api.RepeatedTest",
            "org.junit.jupiter.api.TestFactory",
            "org.junit.jupiter.api.TestTemplate",
            "org.junit.jupiter.params.ParameterizedTest",
            "org.junit.Test",
            "org.testng.annotations.Test");

    private static final StackWalker WALKER = StackWalker.getInstance(StackWalker.Option.RETAIN_CLASS_REFERENCE);

    private TestMethodLocator() {}

    static Optional<StackWalker.StackFrame> locate() {
        return WALKER.walk(frames -> frames
                .filter(frame -> isTestMethod(frame.getDeclaringClass(), frame.getMethodName()))
                .findFirst());
    }

    private static boolean isTestMethod(final Class<?> declaringClass, final String methodName) {
        final String className = declaringClass.getName();
        if (className.startsWith("java.") || className.startsWith("jdk.") || className.startsWith("sun.")) {
            return false;
        }
        final Method[] methods;
        try {
            methods = declaringClass.getDeclaredMethods();
        } catch (final LinkageError e) {
            // signatures referencing absent optional classes; such a class cannot be the running test
            return false;
        }
        for (final Method method : methods) {
            if (!method.getName().equals(methodName)) {
                continue;
            }
            for (final Annotation annotation : method.getAnnotations()) {
                if (TEST_ANNOTATIONS.contains(annotation.annotationType().getName())) {
                    return true;
                }
            }
        }
        return false;
    }
}
