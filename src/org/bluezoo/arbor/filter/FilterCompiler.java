/*
 * FilterCompiler.java
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
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Compiles loosely structured search criteria into {@link Filter} trees.
 *
 * <p>Accepted criteria:
 * <ul>
 * <li>nothing: the default filter {@code (objectClass=*)}</li>
 * <li>a {@link Filter}: used as is</li>
 * <li>a filter string such as {@code "(uid=jdoe)"} or {@code "uid=jdoe"}:
 *   passed through verbatim</li>
 * <li>a bare attribute name such as {@code "mail"}: {@code (mail=*)}</li>
 * <li>an attribute and a value: {@code (attr=value)}; a collection or
 *   array of values gives {@code (|(attr=v1)(attr=v2)...)}; a value with
 *   a {@code *} gives a substring match; a null value a presence match</li>
 * <li>a {@link Map} of attributes to values: each entry compiled as above,
 *   AND-ed in iteration order when there is more than one</li>
 * <li>a list led by {@code and}, {@code or} or {@code not} (or
 *   {@code &}, {@code |}, {@code !}, or a {@link FilterOperator}):
 *   the remaining elements are compiled independently and combined</li>
 * <li>any other list or array: compiled as if its elements had been
 *   passed as separate arguments</li>
 * </ul>
 *
 * <h4>Examples</h4>
 * <pre>{@code
 * Map<String, Object> name = new LinkedHashMap<>();
 * name.put("givenName", "Michael");
 * name.put("sn", "Granger");
 * FilterCompiler.compile(name);          // (&(givenName=Michael)(sn=Granger))
 * FilterCompiler.compile("uid", Arrays.asList("a", "b"));
 *                                        // (|(uid=a)(uid=b))
 * FilterCompiler.compile("not", Arrays.asList("and",
 *         Arrays.asList("sn", "Granger"),
 *         Arrays.asList("sn", "Smith")));
 *                                        // (!(&(sn=Granger)(sn=Smith)))
 * }</pre>
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class FilterCompiler {

    private FilterCompiler() {
    }

    /**
     * Compiles the given criteria.
     *
     * @param criteria the criteria, as described in the class documentation
     * @return the filter
     * @throws IllegalArgumentException if the criteria cannot be compiled
     */
    public static Filter compile(Object... criteria) {
        if (criteria == null || criteria.length == 0) {
            return Filter.DEFAULT;
        }
        if (criteria.length == 1) {
            return compileCriterion(criteria[0]);
        }
        FilterOperator op = FilterOperator.forValue(criteria[0]);
        if (op != null) {
            return compileOperation(op, Arrays.copyOfRange(criteria, 1, criteria.length));
        }
        if (criteria.length == 2 && criteria[0] instanceof String
                && isAttributeName((String) criteria[0])) {
            return compileItem((String) criteria[0], criteria[1]);
        }
        List<Filter> children = new ArrayList<Filter>(criteria.length);
        for (Object criterion : criteria) {
            children.add(compileCriterion(criterion));
        }
        return new AndFilter(children);
    }

    private static Filter compileCriterion(Object criterion) {
        if (criterion instanceof Filter) {
            return (Filter) criterion;
        } else if (criterion instanceof String) {
            return compileString((String) criterion);
        } else if (criterion instanceof Map) {
            return compileMap((Map<?, ?>) criterion);
        } else if (criterion instanceof Collection) {
            return compile(((Collection<?>) criterion).toArray());
        } else if (criterion instanceof Object[]) {
            return compile((Object[]) criterion);
        } else if (criterion instanceof FilterOperator) {
            throw new IllegalArgumentException("Operator without arguments: " + criterion);
        }
        throw new IllegalArgumentException("Cannot compile filter criteria: " + criterion);
    }

    private static Filter compileString(String criterion) {
        String text = criterion.trim();
        if (text.startsWith("(") || text.indexOf('=') > 0) {
            return new LiteralFilter(text);
        }
        if (isAttributeName(text)) {
            return new PresenceFilter(text);
        }
        throw new IllegalArgumentException("Invalid filter: " + criterion);
    }

    private static Filter compileMap(Map<?, ?> criteria) {
        if (criteria.isEmpty()) {
            return Filter.DEFAULT;
        }
        List<Filter> children = new ArrayList<Filter>(criteria.size());
        for (Map.Entry<?, ?> entry : criteria.entrySet()) {
            children.add(compileItem(String.valueOf(entry.getKey()), entry.getValue()));
        }
        return children.size() == 1 ? children.get(0) : new AndFilter(children);
    }

    private static Filter compileOperation(FilterOperator op, Object[] args) {
        if (args.length == 0) {
            throw new IllegalArgumentException("Operator without arguments: " + op.getName());
        }
        switch (op) {
            case NOT:
                if (args.length != 1) {
                    // not(attr, value) negates the pair
                    return new NotFilter(compile(args));
                }
                return new NotFilter(compileCriterion(args[0]));
            case OR:
                return new OrFilter(compileEach(args));
            default:
                return new AndFilter(compileEach(args));
        }
    }

    private static List<Filter> compileEach(Object[] args) {
        List<Filter> children = new ArrayList<Filter>(args.length);
        for (Object arg : args) {
            children.add(compileCriterion(arg));
        }
        return children;
    }

    /**
     * Compiles an attribute and a value or sequence of values.
     *
     * @param attribute the attribute name
     * @param value a scalar, collection or array; null for presence
     * @return the filter
     */
    public static Filter compileItem(String attribute, Object value) {
        if (!isAttributeName(attribute)) {
            throw new IllegalArgumentException("Invalid attribute name: " + attribute);
        }
        if (value == null) {
            return new PresenceFilter(attribute);
        }
        List<?> values = null;
        if (value instanceof Collection) {
            values = new ArrayList<Object>((Collection<?>) value);
        } else if (value instanceof Object[]) {
            values = Arrays.asList((Object[]) value);
        }
        if (values == null) {
            return compileValue(attribute, value);
        }
        if (values.isEmpty()) {
            throw new IllegalArgumentException("No values given for " + attribute);
        }
        List<Filter> children = new ArrayList<Filter>(values.size());
        for (Object item : values) {
            children.add(compileValue(attribute, item));
        }
        return new OrFilter(children);
    }

    private static Filter compileValue(String attribute, Object value) {
        String text = valueOf(value);
        if ("*".equals(text)) {
            return new PresenceFilter(attribute);
        }
        if (Filter.hasWildcard(text)) {
            return new SubstringFilter(attribute, text);
        }
        return new ItemFilter(attribute, ItemFilter.Type.EQUAL, text);
    }

    private static String valueOf(Object value) {
        if (value instanceof Boolean) {
            return ((Boolean) value).booleanValue() ? "TRUE" : "FALSE";
        }
        return String.valueOf(value);
    }

    /**
     * Returns whether the string is an attribute description: a keystring
     * or numeric OID, optionally followed by {@code ;}-separated options.
     *
     * @param name the candidate
     * @return true if the string names an attribute
     */
    static boolean isAttributeName(String name) {
        if (name == null || name.isEmpty()) {
            return false;
        }
        char first = name.charAt(0);
        boolean numeric = Character.isDigit(first);
        if (!numeric && !Character.isLetter(first)) {
            return false;
        }
        for (int i = 1; i < name.length(); i++) {
            char c = name.charAt(i);
            if (numeric) {
                if (!Character.isDigit(c) && c != '.') {
                    return false;
                }
            } else if (!Character.isLetterOrDigit(c) && c != '-' && c != ';') {
                return false;
            }
        }
        return FilterOperator.forValue(name) == null;
    }
}
