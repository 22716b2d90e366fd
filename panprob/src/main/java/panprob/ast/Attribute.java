// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package panprob.ast;

import java.util.Arrays;

/**
 * A named, typed value attached to a {@link Node}.
 * <p>
 * Attributes compare by name and value, so two trees built independently from the same input are equal.
 */
public sealed interface Attribute permits Attribute.Boolean, Attribute.String, Attribute.Bytes {
    /**
     * Returns a new boolean attribute.
     */
    @SuppressWarnings("BooleanParameter")
    static Boolean of(final java.lang.String name, final boolean value) {
        return new Boolean(name, value);
    }

    /**
     * Returns a new string attribute.
     */
    static String of(final java.lang.String name, final java.lang.String value) {
        return new String(name, value);
    }

    /**
     * Returns a new binary attribute holding a copy of {@code value}.
     */
    static Bytes of(final java.lang.String name, final byte[] value) {
        return new Bytes(name, value);
    }

    /**
     * Retrieves the name of this attribute.
     */
    java.lang.String name();

    /**
     * An attribute whose value is a boolean, such as whether a choice is correct.
     */
    record Boolean(java.lang.String name, boolean value) implements Attribute {
    }

    /**
     * An attribute whose value is a string, such as the text of a text node or the source of a formula.
     */
    record String(java.lang.String name, java.lang.String value) implements Attribute {
    }

    /**
     * An attribute whose value is binary data, such as the contents of an image file.
     * <p>
     * The array is copied both on the way in and on the way out.
     */
    record Bytes(java.lang.String name, byte[] value) implements Attribute {
        public Bytes {
            value = value.clone();
        }

        @Override
        public byte[] value() {
            return value.clone();
        }

        /**
         * Returns the number of bytes held, without copying them.
         */
        public int length() {
            return value.length;
        }

        @Override
        public boolean equals(final Object other) {
            return other instanceof Bytes bytes && name.equals(bytes.name) && Arrays.equals(value, bytes.value);
        }

        @Override
        public int hashCode() {
            return 31 * name.hashCode() + Arrays.hashCode(value);
        }

        @Override
        public java.lang.String toString() {
            return "Bytes[name=" + name + ", length=" + value.length + ']';
        }
    }
}
