/*
 * Modification.java
 * Copyright (C) 2025 Chris Burdess
 *
 * This file is part of arbor, a directory entry and query modelling library.
 *
 * arbor is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * arbor is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Lesser General Public License for more details.
 *
 * You should have received a copy of the GNU Lesser General Public License
 * along with arbor.  If not, see <http://www.gnu.org/licenses/>.
 */

package org.bluezoo.arbor;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * One change to one attribute of an entry, as passed to
 * {@link Directory#modify}.
 *
 * <p>{@link Branch} produces these from its write-through operations:
 * {@code set} and {@code merge} issue {@link Operation#REPLACE},
 * {@code delete(String...)} issues {@link Operation#DELETE} with no values.
 * Values are always held in their directory string form; see
 * {@link #toStrings}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class Modification {

    public enum Operation {
        ADD,
        /** Without values, removes the attribute. */
        DELETE,
        REPLACE
    }

    private final Operation operation;
    private final String attributeName;
    private final List<String> values;

    public Modification(Operation operation, String attributeName) {
        this(operation, attributeName, Collections.<String>emptyList());
    }

    /**
     * Creates a modification.
     *
     * @param operation what to do with the values
     * @param attributeName the attribute, possibly with options
     * @param values the values, copied
     */
    public Modification(Operation operation, String attributeName, List<String> values) {
        if (operation == null || attributeName == null) {
            throw new NullPointerException();
        }
        this.operation = operation;
        this.attributeName = attributeName;
        this.values = Collections.unmodifiableList(new ArrayList<String>(values));
    }

    public Operation getOperation() {
        return operation;
    }

    public String getAttributeName() {
        return attributeName;
    }

    /**
     * Returns the values of this modification.
     *
     * @return unmodifiable list, empty to mean every value
     */
    public List<String> getValues() {
        return values;
    }

    public static Modification add(String attributeName, Object value) {
        return new Modification(Operation.ADD, attributeName, toStrings(value));
    }

    public static Modification delete(String attributeName) {
        return new Modification(Operation.DELETE, attributeName);
    }

    public static Modification delete(String attributeName, Object value) {
        return new Modification(Operation.DELETE, attributeName, toStrings(value));
    }

    /**
     * Returns a modification replacing every value of the attribute.
     * A null value removes the attribute.
     *
     * @param attributeName the attribute
     * @param value a value, or an array or collection of values
     * @return the modification
     */
    public static Modification replace(String attributeName, Object value) {
        return new Modification(Operation.REPLACE, attributeName, toStrings(value));
    }

    /**
     * Converts a scalar, array or collection value into directory strings.
     * Booleans are rendered in directory syntax ({@code TRUE}/{@code FALSE}).
     *
     * @param value the value
     * @return the string values; empty for null
     */
    public static List<String> toStrings(Object value) {
        List<String> strings = new ArrayList<String>();
        if (value == null) {
            return strings;
        }
        if (value instanceof Collection) {
            for (Object item : (Collection<?>) value) {
                strings.add(toString(item));
            }
        } else if (value instanceof Object[]) {
            for (Object item : (Object[]) value) {
                strings.add(toString(item));
            }
        } else {
            strings.add(toString(value));
        }
        return strings;
    }

    private static String toString(Object value) {
        if (value instanceof Boolean) {
            return ((Boolean) value).booleanValue() ? "TRUE" : "FALSE";
        }
        return String.valueOf(value);
    }

    @Override
    public String toString() {
        return operation + " " + attributeName + " " + values;
    }
}
