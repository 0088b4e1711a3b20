/*
 * SchemaDefinitionParser.java
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

package org.bluezoo.arbor.schema;

import java.text.MessageFormat;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Parser for RFC 4512 schema definition strings such as
 * <pre>
 * ( 2.5.6.6 NAME 'person' SUP top STRUCTURAL
 *   MUST ( sn $ cn ) MAY ( userPassword $ telephoneNumber ) )
 * </pre>
 *
 * <p>The parser is generic: it produces the numeric OID and a map of
 * keywords to their values, leaving interpretation to the element
 * classes. Keywords that take no value (such as {@code SINGLE-VALUE})
 * map to an empty list.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class SchemaDefinitionParser {

    private static final Set<String> FLAGS = new HashSet<String>(Arrays.asList(
            "OBSOLETE", "SINGLE-VALUE", "COLLECTIVE", "NO-USER-MODIFICATION",
            "ABSTRACT", "STRUCTURAL", "AUXILIARY"));

    private final String text;
    private final List<String> tokens = new ArrayList<String>();
    private final List<Boolean> quoted = new ArrayList<Boolean>();
    private int pos;

    private SchemaDefinitionParser(String text) {
        this.text = text;
    }

    /**
     * Parses a single definition.
     *
     * @param text the definition
     * @return the parsed definition
     * @throws SchemaException if the text is not a well-formed definition
     */
    public static Definition parse(String text) throws SchemaException {
        if (text == null) {
            throw new SchemaException(Schema.L10N.getString("err.empty_definition"));
        }
        SchemaDefinitionParser parser = new SchemaDefinitionParser(text);
        parser.tokenize();
        return parser.parseDefinition();
    }

    private void tokenize() throws SchemaException {
        int len = text.length();
        int i = 0;
        while (i < len) {
            char c = text.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (c == '(' || c == ')' || c == '$') {
                add(String.valueOf(c), false);
                i++;
            } else if (c == '\'') {
                int end = text.indexOf('\'', i + 1);
                if (end < 0) {
                    throw error("err.unterminated_quote");
                }
                add(unescape(text.substring(i + 1, end)), true);
                i = end + 1;
            } else {
                int start = i;
                while (i < len) {
                    char d = text.charAt(i);
                    if (Character.isWhitespace(d) || d == '(' || d == ')'
                            || d == '$' || d == '\'') {
                        break;
                    }
                    i++;
                }
                add(text.substring(start, i), false);
            }
        }
    }

    private void add(String token, boolean isQuoted) {
        tokens.add(token);
        quoted.add(Boolean.valueOf(isQuoted));
    }

    private Definition parseDefinition() throws SchemaException {
        expect("(");
        String oid = next();
        if (oid == null || isDelimiter(pos - 1)) {
            throw error("err.missing_oid");
        }
        Map<String, List<String>> values = new LinkedHashMap<String, List<String>>();
        while (true) {
            String keyword = next();
            if (keyword == null) {
                throw error("err.unterminated_definition");
            }
            if (")".equals(keyword) && !quoted.get(pos - 1).booleanValue()) {
                break;
            }
            keyword = keyword.toUpperCase();
            if (FLAGS.contains(keyword)) {
                values.put(keyword, Collections.<String>emptyList());
            } else {
                values.put(keyword, parseValue());
            }
        }
        if (pos < tokens.size()) {
            throw error("err.trailing_text");
        }
        return new Definition(text, oid, values);
    }

    private List<String> parseValue() throws SchemaException {
        String token = next();
        if (token == null) {
            throw error("err.unterminated_definition");
        }
        if (!"(".equals(token) || quoted.get(pos - 1).booleanValue()) {
            return Collections.singletonList(token);
        }
        List<String> list = new ArrayList<String>();
        while (true) {
            token = next();
            if (token == null) {
                throw error("err.unterminated_definition");
            }
            boolean isQuoted = quoted.get(pos - 1).booleanValue();
            if (!isQuoted && ")".equals(token)) {
                break;
            }
            if (isQuoted || !"$".equals(token)) {
                list.add(token);
            }
        }
        return Collections.unmodifiableList(list);
    }

    private String next() {
        return pos < tokens.size() ? tokens.get(pos++) : null;
    }

    private boolean isDelimiter(int index) {
        String token = tokens.get(index);
        return !quoted.get(index).booleanValue()
                && ("(".equals(token) || ")".equals(token) || "$".equals(token));
    }

    private void expect(String token) throws SchemaException {
        String actual = next();
        if (!token.equals(actual)) {
            throw error("err.expected_open");
        }
    }

    private SchemaException error(String key) {
        return new SchemaException(MessageFormat.format(
                Schema.L10N.getString(key), text), text);
    }

    // qdstring escapes: \27 is a quote, \5C a backslash
    private static String unescape(String s) {
        if (s.indexOf('\\') < 0) {
            return s;
        }
        return s.replace("\\27", "'").replace("\\5C", "\\").replace("\\5c", "\\");
    }

    /**
     * A parsed schema definition.
     */
    public static final class Definition {

        private final String text;
        private final String oid;
        private final Map<String, List<String>> values;

        Definition(String text, String oid, Map<String, List<String>> values) {
            this.text = text;
            this.oid = oid;
            this.values = Collections.unmodifiableMap(values);
        }

        /**
         * Returns the original definition text.
         *
         * @return the text
         */
        public String getText() {
            return text;
        }

        /**
         * Returns the numeric OID (or the descriptor some servers use in
         * its place).
         *
         * @return the OID
         */
        public String getOID() {
            return oid;
        }

        /**
         * Returns whether the keyword is present.
         *
         * @param keyword the upper-case keyword, e.g. {@code SINGLE-VALUE}
         * @return true if present
         */
        public boolean has(String keyword) {
            return values.containsKey(keyword);
        }

        /**
         * Returns the values of a keyword.
         *
         * @param keyword the upper-case keyword
         * @return the values, empty if absent or a flag
         */
        public List<String> get(String keyword) {
            List<String> list = values.get(keyword);
            return list != null ? list : Collections.<String>emptyList();
        }

        /**
         * Returns the first value of a keyword.
         *
         * @param keyword the upper-case keyword
         * @return the value, or null
         */
        public String getFirst(String keyword) {
            List<String> list = get(keyword);
            return list.isEmpty() ? null : list.get(0);
        }

        /**
         * Returns the {@code X-} extension keywords and their values.
         *
         * @return ordered map of extensions
         */
        public Map<String, List<String>> getExtensions() {
            Map<String, List<String>> extensions = new LinkedHashMap<String, List<String>>();
            for (Map.Entry<String, List<String>> entry : values.entrySet()) {
                if (entry.getKey().startsWith("X-")) {
                    extensions.put(entry.getKey(), entry.getValue());
                }
            }
            return extensions;
        }
    }
}
