/*
 * LDAPSyntax.java
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

import java.util.List;

/**
 * An ldapSyntaxes definition. Syntaxes have no names, only a numeric OID
 * and a description.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class LDAPSyntax extends SchemaElement {

    public LDAPSyntax(SchemaDefinitionParser.Definition definition) {
        super(definition);
    }

    /**
     * Returns whether values of this syntax are human-readable, as
     * indicated by the {@code X-NOT-HUMAN-READABLE} extension.
     *
     * @return false if flagged as not human-readable
     */
    public boolean isHumanReadable() {
        List<String> flag = getExtensions().get("X-NOT-HUMAN-READABLE");
        return flag == null || flag.isEmpty() || !"TRUE".equalsIgnoreCase(flag.get(0));
    }

    @Override
    public String getName() {
        String description = getDescription();
        return description != null ? description : getOID();
    }
}
