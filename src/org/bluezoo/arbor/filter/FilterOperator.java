/*
 * FilterOperator.java
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

package org.bluezoo.arbor.filter;

/**
 * The boolean operators that may lead a criteria list passed to
 * {@link FilterCompiler}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public enum FilterOperator {

    /** Every argument must match. */
    AND("and", "&"),

    /** At least one argument must match. */
    OR("or", "|"),

    /** The single argument must not match. */
    NOT("not", "!");

    private final String name;
    private final String token;

    FilterOperator(String name, String token) {
        this.name = name;
        this.token = token;
    }

    /**
     * Returns the operator's keyword.
     *
     * @return "and", "or" or "not"
     */
    public String getName() {
        return name;
    }

    /**
     * Returns the operator's filter token.
     *
     * @return "&amp;", "|" or "!"
     */
    public String getToken() {
        return token;
    }

    /**
     * Returns the operator denoted by the given object: a FilterOperator,
     * or a keyword or token string (case-insensitive).
     *
     * @param value the candidate
     * @return the operator, or null if the value does not denote one
     */
    public static FilterOperator forValue(Object value) {
        if (value instanceof FilterOperator) {
            return (FilterOperator) value;
        }
        if (value instanceof String) {
            String key = ((String) value).trim();
            for (FilterOperator op : values()) {
                if (op.name.equalsIgnoreCase(key) || op.token.equals(key)) {
                    return op;
                }
            }
        }
        return null;
    }
}
