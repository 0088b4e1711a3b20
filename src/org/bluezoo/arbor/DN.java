/*
 * DN.java
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

import java.text.MessageFormat;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Distinguished name algebra.
 *
 * <p>A DN is a comma-separated sequence of RDN components ordered from
 * most-specific to least-specific. Each RDN is one or more
 * {@code attribute=value} pairs joined by {@code +}. Separators may be
 * escaped with a backslash or enclosed in a double-quoted value.
 * The empty string is the root DN.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class DN {

    private DN() {
    }

    /**
     * Returns whether the given string matches the DN grammar.
     *
     * @param dn the candidate DN
     * @return true if valid
     */
    public static boolean isValid(String dn) {
        if (dn == null) {
            return false;
        }
        try {
            for (String rdn : split(dn)) {
                parseRDN(rdn);
            }
            return true;
        } catch (InvalidDNException e) {
            return false;
        }
    }

    /**
     * Checks the given string against the DN grammar.
     *
     * @param dn the candidate DN
     * @return the DN, for chaining
     * @throws InvalidDNException if the DN is not valid
     */
    public static String validate(String dn) {
        if (dn == null) {
            throw new InvalidDNException(
                    Branch.L10N.getString("err.null_dn"), null);
        }
        for (String rdn : split(dn)) {
            parseRDN(rdn);
        }
        return dn;
    }

    /**
     * Splits a DN into its RDN components, trimming surrounding whitespace.
     *
     * @param dn the DN
     * @return the RDN components, most-specific first; empty for the root DN
     * @throws InvalidDNException on an unterminated quote or trailing escape
     */
    public static List<String> split(String dn) {
        return split(dn, 0);
    }

    /**
     * Splits a DN into at most {@code limit} components.
     *
     * <p>If {@code limit} is positive, the first {@code limit - 1}
     * components are split off and the remainder of the DN is returned
     * unsplit as the final element.
     *
     * @param dn the DN
     * @param limit the maximum number of elements, or 0 for no limit
     * @return the components
     */
    public static List<String> split(String dn, int limit) {
        List<String> parts = new ArrayList<String>();
        if (dn.trim().isEmpty()) {
            return parts;
        }
        int start = 0;
        boolean escaped = false;
        boolean quoted = false;
        for (int i = 0; i < dn.length(); i++) {
            char c = dn.charAt(i);
            if (escaped) {
                escaped = false;
            } else if (c == '\\') {
                escaped = true;
            } else if (c == '"') {
                quoted = !quoted;
            } else if (c == ',' && !quoted) {
                if (limit > 0 && parts.size() == limit - 1) {
                    break;
                }
                parts.add(dn.substring(start, i).trim());
                start = i + 1;
            }
        }
        if (escaped || quoted) {
            throw new InvalidDNException(MessageFormat.format(
                    Branch.L10N.getString("err.invalid_dn"), dn), dn);
        }
        parts.add(dn.substring(start).trim());
        return parts;
    }

    /**
     * Returns the DN rebuilt from its components with whitespace
     * around separators removed.
     *
     * @param dn the DN
     * @return the normalized DN
     * @throws InvalidDNException if the DN is not valid
     */
    public static String normalize(String dn) {
        StringBuilder buf = new StringBuilder();
        for (String rdn : split(validate(dn))) {
            if (buf.length() > 0) {
                buf.append(',');
            }
            buf.append(normalizeRDN(rdn));
        }
        return buf.toString();
    }

    /**
     * Returns the RDN with whitespace around {@code =} and {@code +} removed.
     *
     * @param rdn the RDN
     * @return the normalized RDN
     */
    public static String normalizeRDN(String rdn) {
        return joinRDN(parseRDN(rdn));
    }

    /**
     * Parses a (possibly multi-valued) RDN into its attribute/value pairs.
     * Values of a repeated attribute are grouped under the first spelling
     * of its name, in order of appearance.
     *
     * @param rdn the RDN, e.g. {@code cn=a+uid=b}
     * @return ordered map of attribute name to values
     * @throws InvalidDNException if the RDN is not valid
     */
    public static Map<String, List<String>> parseRDN(String rdn) {
        Map<String, List<String>> pairs = new LinkedHashMap<String, List<String>>();
        int start = 0;
        boolean escaped = false;
        boolean quoted = false;
        for (int i = 0; i <= rdn.length(); i++) {
            char c = i < rdn.length() ? rdn.charAt(i) : '+';
            if (escaped) {
                escaped = false;
            } else if (c == '\\') {
                escaped = true;
            } else if (c == '"') {
                quoted = !quoted;
            } else if (c == '+' && !quoted) {
                String pair = rdn.substring(start, Math.min(i, rdn.length()));
                int eq = pair.indexOf('=');
                if (eq < 1) {
                    throw new InvalidDNException(MessageFormat.format(
                            Branch.L10N.getString("err.invalid_rdn"), rdn), rdn);
                }
                String attribute = pair.substring(0, eq).trim();
                if (!isAttributeName(attribute)) {
                    throw new InvalidDNException(MessageFormat.format(
                            Branch.L10N.getString("err.invalid_rdn"), rdn), rdn);
                }
                valuesOf(pairs, attribute).add(pair.substring(eq + 1).trim());
                start = i + 1;
            }
        }
        if (escaped || quoted) {
            throw new InvalidDNException(MessageFormat.format(
                    Branch.L10N.getString("err.invalid_rdn"), rdn), rdn);
        }
        return pairs;
    }

    private static List<String> valuesOf(Map<String, List<String>> pairs, String attribute) {
        for (Map.Entry<String, List<String>> pair : pairs.entrySet()) {
            if (pair.getKey().equalsIgnoreCase(attribute)) {
                return pair.getValue();
            }
        }
        List<String> values = new ArrayList<String>(1);
        pairs.put(attribute, values);
        return values;
    }

    /**
     * Joins attribute/value pairs into an RDN.
     *
     * @param pairs ordered attribute names to values
     * @return the RDN string
     */
    public static String joinRDN(Map<String, List<String>> pairs) {
        StringBuilder buf = new StringBuilder();
        for (Map.Entry<String, List<String>> pair : pairs.entrySet()) {
            for (String value : pair.getValue()) {
                if (buf.length() > 0) {
                    buf.append('+');
                }
                buf.append(pair.getKey()).append('=').append(value);
            }
        }
        return buf.toString();
    }

    /**
     * Returns the most-specific component of the DN.
     *
     * @param dn the DN
     * @return the RDN, or the empty string for the root DN
     */
    public static String getRDN(String dn) {
        List<String> parts = split(dn, 2);
        return parts.isEmpty() ? "" : parts.get(0);
    }

    /**
     * Returns the DN of the parent entry.
     *
     * @param dn the DN
     * @return the parent DN, or the empty string for a top-level or root DN
     */
    public static String getParent(String dn) {
        List<String> parts = split(dn, 2);
        return parts.size() < 2 ? "" : parts.get(1);
    }

    /**
     * Returns whether {@code base} is the same entry as, or an ancestor of,
     * {@code dn}. Attribute names and values are compared case-insensitively.
     *
     * @param dn the candidate descendant
     * @param base the candidate ancestor
     * @return true if {@code dn} lies at or below {@code base}
     */
    public static boolean isDescendantOrSelf(String dn, String base) {
        List<String> dnParts = split(dn);
        List<String> baseParts = split(base);
        if (baseParts.size() > dnParts.size()) {
            return false;
        }
        int offset = dnParts.size() - baseParts.size();
        for (int i = 0; i < baseParts.size(); i++) {
            String a = normalizeRDN(baseParts.get(i));
            String b = normalizeRDN(dnParts.get(offset + i));
            if (!a.equalsIgnoreCase(b)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Escapes a string for use as an RDN attribute value (RFC 4514).
     *
     * @param value the raw value
     * @return the escaped value
     */
    public static String escapeValue(String value) {
        StringBuilder buf = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case ',':
                case '+':
                case '"':
                case '\\':
                case '<':
                case '>':
                case ';':
                case '=':
                    buf.append('\\').append(c);
                    break;
                case '#':
                    if (i == 0) {
                        buf.append('\\');
                    }
                    buf.append(c);
                    break;
                case ' ':
                    if (i == 0 || i == value.length() - 1) {
                        buf.append('\\');
                    }
                    buf.append(c);
                    break;
                default:
                    buf.append(c);
            }
        }
        return buf.toString();
    }

    /**
     * Returns the reversed list of RDN components, least-specific first.
     *
     * @param dn the DN
     * @return the components from the root downwards
     */
    static List<String> reversed(String dn) {
        List<String> parts = split(dn);
        Collections.reverse(parts);
        return parts;
    }

    static boolean isAttributeName(String name) {
        if (name.isEmpty()) {
            return false;
        }
        char first = name.charAt(0);
        if (Character.isDigit(first)) {
            // numericoid
            for (int i = 0; i < name.length(); i++) {
                char c = name.charAt(i);
                if (!Character.isDigit(c) && c != '.') {
                    return false;
                }
            }
            return !name.endsWith(".");
        }
        if (!Character.isLetter(first)) {
            return false;
        }
        for (int i = 1; i < name.length(); i++) {
            char c = name.charAt(i);
            if (!Character.isLetterOrDigit(c) && c != '-' && c != ';') {
                return false;
            }
        }
        return true;
    }
}
