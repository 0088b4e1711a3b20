/*
 * Filter.java
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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A node of a search filter expression.
 *
 * <p>Filters are immutable trees. Their {@link #toString} form is the
 * canonical, fully parenthesized RFC 4515 text handed to the directory:
 * <pre>
 * (attr=*)  (attr=value)  (attr~=value)  (attr&gt;=value)  (attr&lt;=value)
 * (&amp;expr...)  (|expr...)  (!expr)
 * </pre>
 * Canonicalization is structural only: children keep the order they were
 * given in and duplicates are not removed, so equal input produces equal
 * text.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 * @see FilterCompiler
 */
public abstract class Filter {

    /** The attribute every entry carries. */
    public static final String OBJECT_CLASS = "objectClass";

    /** The filter matching every entry: {@code (objectClass=*)}. */
    public static final Filter DEFAULT = new PresenceFilter(OBJECT_CLASS);

    Filter() {
    }

    /**
     * Appends the canonical text of this filter.
     *
     * @param buf the buffer
     */
    protected abstract void appendTo(StringBuilder buf);

    /**
     * Returns the conjunction of this filter and another.
     *
     * <p>If this filter is already an AND, the other filter is appended to a
     * copy of its children, so repeated refinement stays flat.
     *
     * @param other the filter to conjoin
     * @return the combined filter
     */
    public Filter and(Filter other) {
        List<Filter> children = new ArrayList<Filter>();
        if (this instanceof AndFilter) {
            children.addAll(((AndFilter) this).getChildren());
        } else {
            children.add(this);
        }
        children.add(other);
        return new AndFilter(children);
    }

    @Override
    public final String toString() {
        StringBuilder buf = new StringBuilder();
        appendTo(buf);
        return buf.toString();
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof Filter && toString().equals(other.toString());
    }

    @Override
    public int hashCode() {
        return toString().hashCode();
    }

    // -- Factories --

    /**
     * Returns a presence filter {@code (attr=*)}.
     *
     * @param attribute the attribute name
     * @return the filter
     */
    public static Filter presence(String attribute) {
        return new PresenceFilter(attribute);
    }

    /**
     * Returns an equality filter {@code (attr=value)}.
     *
     * @param attribute the attribute name
     * @param value the value, escaped on output
     * @return the filter
     */
    public static Filter equal(String attribute, String value) {
        return new ItemFilter(attribute, ItemFilter.Type.EQUAL, value);
    }

    /**
     * Returns an approximate-match filter {@code (attr~=value)}.
     *
     * @param attribute the attribute name
     * @param value the value
     * @return the filter
     */
    public static Filter approx(String attribute, String value) {
        return new ItemFilter(attribute, ItemFilter.Type.APPROX, value);
    }

    /**
     * Returns an ordering filter {@code (attr>=value)}.
     *
     * @param attribute the attribute name
     * @param value the value
     * @return the filter
     */
    public static Filter greaterOrEqual(String attribute, String value) {
        return new ItemFilter(attribute, ItemFilter.Type.GREATER_OR_EQUAL, value);
    }

    /**
     * Returns an ordering filter {@code (attr<=value)}.
     *
     * @param attribute the attribute name
     * @param value the value
     * @return the filter
     */
    public static Filter lessOrEqual(String attribute, String value) {
        return new ItemFilter(attribute, ItemFilter.Type.LESS_OR_EQUAL, value);
    }

    /**
     * Returns a substring filter. The pattern's {@code *} characters are
     * the wildcards; everything else is escaped.
     *
     * @param attribute the attribute name
     * @param pattern the pattern, e.g. {@code Mich*}
     * @return the filter
     */
    public static Filter substring(String attribute, String pattern) {
        return new SubstringFilter(attribute, pattern);
    }

    /**
     * Returns the conjunction of the given filters.
     *
     * @param children the filters, in order
     * @return the filter
     */
    public static Filter and(Filter... children) {
        return new AndFilter(Arrays.asList(children));
    }

    /**
     * Returns the disjunction of the given filters.
     *
     * @param children the filters, in order
     * @return the filter
     */
    public static Filter or(Filter... children) {
        return new OrFilter(Arrays.asList(children));
    }

    /**
     * Returns the negation of the given filter.
     *
     * @param child the filter to negate
     * @return the filter
     */
    public static Filter not(Filter child) {
        return new NotFilter(child);
    }

    /**
     * Returns a filter that is passed through verbatim.
     *
     * @param text pre-formed filter text; parentheses are added if missing
     * @return the filter
     */
    public static Filter literal(String text) {
        return new LiteralFilter(text);
    }

    // -- Escaping --

    /**
     * Escapes an assertion value (RFC 4515): parentheses, asterisks, NUL
     * and backslashes that do not already start a hex escape.
     *
     * @param value the raw value
     * @return the escaped value
     */
    public static String escape(String value) {
        return escape(value, false);
    }

    /**
     * Escapes an assertion value, optionally keeping asterisks as
     * substring wildcards.
     *
     * @param value the raw value
     * @param wildcards true to leave unescaped asterisks alone
     * @return the escaped value
     */
    public static String escape(String value, boolean wildcards) {
        StringBuilder buf = null;
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            String replacement = null;
            switch (c) {
                case '(':
                    replacement = "\\28";
                    break;
                case ')':
                    replacement = "\\29";
                    break;
                case '*':
                    if (!wildcards) {
                        replacement = "\\2a";
                    }
                    break;
                case '\0':
                    replacement = "\\00";
                    break;
                case '\\':
                    if (!isHexEscape(value, i)) {
                        replacement = "\\5c";
                    }
                    break;
                default:
                    break;
            }
            if (replacement != null) {
                if (buf == null) {
                    buf = new StringBuilder(value.length() + 8);
                    buf.append(value, 0, i);
                }
                buf.append(replacement);
            } else if (buf != null) {
                buf.append(c);
            }
        }
        return buf != null ? buf.toString() : value;
    }

    /**
     * Returns whether the value contains an unescaped {@code *}.
     *
     * @param value the value
     * @return true if the value is a substring pattern
     */
    static boolean hasWildcard(String value) {
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '\\') {
                i++;
            } else if (c == '*') {
                return true;
            }
        }
        return false;
    }

    private static boolean isHexEscape(String value, int i) {
        return i + 2 < value.length()
                && Character.digit(value.charAt(i + 1), 16) >= 0
                && Character.digit(value.charAt(i + 2), 16) >= 0;
    }

    static List<Filter> copyChildren(List<Filter> children) {
        if (children == null || children.isEmpty()) {
            throw new IllegalArgumentException("Filter list must not be empty");
        }
        for (Filter child : children) {
            if (child == null) {
                throw new NullPointerException("child filter");
            }
        }
        return Collections.unmodifiableList(new ArrayList<Filter>(children));
    }
}
