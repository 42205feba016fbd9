package org.approvalkit.core;

import java.util.Arrays;

/**
 * {@link String#valueOf(Object)}, with arrays rendered element by element.
 */
public final class DefaultStringConverter implements StringConverter {
    public static final DefaultStringConverter INSTANCE = new DefaultStringConverter();

    @Override
    public String toString(final Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof Object[] array) {
            return Arrays.deepToString(array);
        }
        if (value instanceof int[] ints) {
            return Arrays.toString(ints);
        }
        if (value instanceof long[] longs) {
            return Arrays.toString(longs);
        }
        if (value instanceof double[] doubles) {
            return Arrays.toString(doubles);
        }
        if (value instanceof float[] floats) {
            return Arrays.toString(floats);
        }
        if (value instanceof short[] shorts) {
            return Arrays.toString(shorts);
        }
        if (value instanceof byte[] bytes) {
            return Arrays.toString(bytes);
        }
        if (value instanceof char[] chars) {
            return Arrays.toString(chars);
        }
        if (value instanceof boolean[] booleans) {
            return Arrays.toString(booleans);
        }
        return String.valueOf(value);
    }
}
