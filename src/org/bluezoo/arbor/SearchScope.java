/*
 * SearchScope.java
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

/**
 * How far below its base DN a search reaches.
 *
 * <p>{@link Branchset} keeps its scope as a string so that a caller may
 * supply any of the usual spellings; {@link #forName} maps them here
 * ({@code one} for {@code onelevel}, {@code sub} for {@code subtree}).
 * Directory implementations that sit on a client library can use
 * {@link #getValue}, the RFC 4511 enumeration value, which is also what
 * JNDI {@code SearchControls} expects.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public enum SearchScope {

    /** The base entry only. */
    BASE(0, "base"),

    /** The immediate children of the base, not the base itself. */
    ONE(1, "onelevel"),

    /** The base and everything below it. */
    SUBTREE(2, "subtree");

    private final int value;
    private final String name;

    SearchScope(int value, String name) {
        this.value = value;
        this.name = name;
    }

    public int getValue() {
        return value;
    }

    /**
     * Returns the canonical name of this scope.
     *
     * @return one of "base", "onelevel" or "subtree"
     */
    public String getName() {
        return name;
    }

    /**
     * Maps an RFC 4511 enumeration value to its scope.
     *
     * @param value 0, 1 or 2
     * @return the scope
     * @throws IllegalArgumentException for any other value
     */
    public static SearchScope fromValue(int value) {
        SearchScope[] scopes = values();
        if (value < 0 || value >= scopes.length) {
            throw new IllegalArgumentException("Invalid search scope: " + value);
        }
        return scopes[value];
    }

    /**
     * Returns the scope for a name or synonym.
     *
     * @param name the scope name, case-insensitive
     * @return the scope, or null if the name is not recognized
     */
    public static SearchScope forName(String name) {
        if (name == null) {
            return null;
        }
        String key = name.trim().toLowerCase();
        if ("base".equals(key)) {
            return BASE;
        } else if ("one".equals(key) || "onelevel".equals(key)) {
            return ONE;
        } else if ("sub".equals(key) || "subtree".equals(key)) {
            return SUBTREE;
        }
        return null;
    }

    @Override
    public String toString() {
        return name;
    }
}
