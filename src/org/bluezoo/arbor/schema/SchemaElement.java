/*
 * SchemaElement.java
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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Common properties of schema definitions: numeric OID, names,
 * description, obsolescence and {@code X-} extensions.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public abstract class SchemaElement {

    private final String oid;
    private final List<String> names;
    private final String description;
    private final boolean obsolete;
    private final Map<String, List<String>> extensions;
    private final String definition;

    /**
     * Creates an element from a parsed definition.
     *
     * @param definition the parsed definition
     */
    protected SchemaElement(SchemaDefinitionParser.Definition definition) {
        this.oid = definition.getOID();
        this.names = Collections.unmodifiableList(
                new ArrayList<String>(definition.get("NAME")));
        this.description = definition.getFirst("DESC");
        this.obsolete = definition.has("OBSOLETE");
        this.extensions = Collections.unmodifiableMap(definition.getExtensions());
        this.definition = definition.getText();
    }

    /**
     * Returns the numeric OID.
     *
     * @return the OID
     */
    public String getOID() {
        return oid;
    }

    /**
     * Returns the names of this element, in declaration order.
     *
     * @return unmodifiable list of names, possibly empty
     */
    public List<String> getNames() {
        return names;
    }

    /**
     * Returns the primary name, or the OID if the element has no name.
     *
     * @return the name
     */
    public String getName() {
        return names.isEmpty() ? oid : names.get(0);
    }

    /**
     * Returns whether this element is known by the given name or OID.
     *
     * @param name a name or OID, compared case-insensitively
     * @return true if it identifies this element
     */
    public boolean isNamed(String name) {
        if (oid.equalsIgnoreCase(name)) {
            return true;
        }
        for (String n : names) {
            if (n.equalsIgnoreCase(name)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns the description.
     *
     * @return the description, or null
     */
    public String getDescription() {
        return description;
    }

    /**
     * Returns whether the element is marked obsolete.
     *
     * @return true if obsolete
     */
    public boolean isObsolete() {
        return obsolete;
    }

    /**
     * Returns the {@code X-} extensions of this element.
     *
     * @return unmodifiable map of extension name to values
     */
    public Map<String, List<String>> getExtensions() {
        return extensions;
    }

    /**
     * Returns the definition text this element was parsed from.
     *
     * @return the definition
     */
    public String getDefinition() {
        return definition;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + getName() + " (" + oid + ")]";
    }
}
