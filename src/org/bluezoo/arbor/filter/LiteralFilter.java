/*
 * LiteralFilter.java
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
 * A pre-formed filter string, trusted and passed through verbatim.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class LiteralFilter extends Filter {

    private final String text;

    /**
     * Creates a literal filter. Surrounding whitespace is removed and
     * the text is wrapped in parentheses if it is not already.
     *
     * @param text the filter text
     */
    public LiteralFilter(String text) {
        if (text == null || text.trim().isEmpty()) {
            throw new IllegalArgumentException("Empty filter");
        }
        String trimmed = text.trim();
        this.text = trimmed.startsWith("(") ? trimmed : "(" + trimmed + ")";
    }

    public String getText() {
        return text;
    }

    @Override
    protected void appendTo(StringBuilder buf) {
        buf.append(text);
    }
}
