/*
 * SearchResultEntry.java
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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The raw form of a directory entry as returned by the {@link Directory}:
 * a DN and a map of attribute names to their undecoded string values.
 *
 * <p>Attribute lookup is case-insensitive; the names are reported as the
 * directory first supplied them.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class SearchResultEntry {

    private final String dn;
    private final Map<String, List<String>> attributes;
    private final Map<String, String> names;

    /**
     * Creates an entry. The attribute map is copied.
     *
     * @param dn the entry's DN as the directory reported it
     * @param attributes attribute names to their raw values
     */
    public SearchResultEntry(String dn, Map<String, ? extends List<String>> attributes) {
        this.dn = dn;
        this.attributes = new LinkedHashMap<String, List<String>>();
        this.names = new LinkedHashMap<String, String>();
        for (Map.Entry<String, ? extends List<String>> entry : attributes.entrySet()) {
            setAttributeValues(entry.getKey(), entry.getValue());
        }
    }

    public String getDN() {
        return dn;
    }

    /**
     * Returns the attribute names, spelled as first supplied.
     *
     * @return unmodifiable ordered set
     */
    public Set<String> getAttributeNames() {
        return Collections.unmodifiableSet(new LinkedHashSet<String>(names.values()));
    }

    public boolean hasAttribute(String name) {
        return attributes.containsKey(name.toLowerCase());
    }

    /**
     * Returns whether this entry carries no attributes at all.
     *
     * @return true if empty
     */
    public boolean isEmpty() {
        return attributes.isEmpty();
    }

    /**
     * Returns the raw values of an attribute.
     *
     * @param name the attribute name, any case
     * @return unmodifiable list, empty if the entry lacks the attribute
     */
    public List<String> getAttributeValues(String name) {
        List<String> values = attributes.get(name.toLowerCase());
        return values != null ? values : Collections.<String>emptyList();
    }

    /**
     * Returns the first raw value of an attribute, or null.
     */
    public String getAttributeValue(String name) {
        List<String> values = getAttributeValues(name);
        return values.isEmpty() ? null : values.get(0);
    }

    /**
     * Replaces the values of an attribute in this local copy.
     * An empty or null list removes the attribute.
     *
     * @param name the attribute name
     * @param values the new values
     */
    public void setAttributeValues(String name, List<String> values) {
        String key = name.toLowerCase();
        if (values == null || values.isEmpty()) {
            attributes.remove(key);
            names.remove(key);
        } else {
            attributes.put(key,
                    Collections.unmodifiableList(new ArrayList<String>(values)));
            if (!names.containsKey(key)) {
                names.put(key, name);
            }
        }
    }

    /**
     * Returns a copy of the attributes as a map of name to values.
     *
     * @return ordered map of attribute names to values
     */
    public Map<String, List<String>> toMap() {
        Map<String, List<String>> map = new LinkedHashMap<String, List<String>>();
        for (Map.Entry<String, String> name : names.entrySet()) {
            map.put(name.getValue(), attributes.get(name.getKey()));
        }
        return map;
    }

    @Override
    public String toString() {
        // LDIF-like
        StringBuilder buf = new StringBuilder("dn: ").append(dn).append('\n');
        for (Map.Entry<String, String> name : names.entrySet()) {
            for (String value : attributes.get(name.getKey())) {
                buf.append(name.getValue()).append(": ").append(value).append('\n');
            }
        }
        return buf.toString();
    }
}
