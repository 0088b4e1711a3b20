/*
 * SubstringFilter.java
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
 * Matches attribute values against a wildcard pattern, e.g.
 * {@code (cn=Mich*)}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class SubstringFilter extends Filter {

    private final String attribute;
    private final String pattern;

    /**
     * Creates a substring filter.
     *
     * @param attribute the attribute name
     * @param pattern the pattern; {@code *} separates the substrings
     */
    public SubstringFilter(String attribute, String pattern) {
        if (attribute == null || attribute.isEmpty()) {
            throw new IllegalArgumentException("attribute");
        }
        if (pattern == null || !hasWildcard(pattern)) {
            throw new IllegalArgumentException("Substring pattern needs a wildcard: " + pattern);
        }
        this.attribute = attribute;
        this.pattern = pattern;
    }

    public String getAttribute() {
        return attribute;
    }

    public String getPattern() {
        return pattern;
    }

    @Override
    protected void appendTo(StringBuilder buf) {
        buf.append('(').append(attribute).append('=').append(escape(pattern, true)).append(')');
    }
}
