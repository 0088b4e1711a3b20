/*
 * ItemFilter.java
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
 * A simple attribute value assertion: equality, approximate match or
 * ordering.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class ItemFilter extends Filter {

    /**
     * Item filter types and their operator tokens.
     */
    public enum Type {
        /** {@code (attr=value)} */
        EQUAL("="),
        /** {@code (attr~=value)} */
        APPROX("~="),
        /** {@code (attr>=value)} */
        GREATER_OR_EQUAL(">="),
        /** {@code (attr<=value)} */
        LESS_OR_EQUAL("<=");

        private final String token;

        Type(String token) {
            this.token = token;
        }

        /**
         * Returns the operator token.
         *
         * @return the token
         */
        public String getToken() {
            return token;
        }
    }

    private final String attribute;
    private final Type type;
    private final String value;

    /**
     * Creates an item filter.
     *
     * @param attribute the attribute name
     * @param type the assertion type
     * @param value the unescaped assertion value
     */
    public ItemFilter(String attribute, Type type, String value) {
        if (attribute == null || attribute.isEmpty()) {
            throw new IllegalArgumentException("attribute");
        }
        if (type == null || value == null) {
            throw new NullPointerException(type == null ? "type" : "value");
        }
        this.attribute = attribute;
        this.type = type;
        this.value = value;
    }

    public String getAttribute() {
        return attribute;
    }

    public Type getType() {
        return type;
    }

    public String getValue() {
        return value;
    }

    @Override
    protected void appendTo(StringBuilder buf) {
        buf.append('(').append(attribute).append(type.getToken());
        buf.append(escape(value)).append(')');
    }
}
