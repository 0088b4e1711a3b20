/*
 * SchemaException.java
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

/**
 * Exception thrown when schema definitions cannot be parsed or resolved.
 * A schema that fails to load is discarded entirely.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class SchemaException extends Exception {

    private static final long serialVersionUID = 1L;

    private final String definition;

    /**
     * Creates a schema exception.
     *
     * @param message the error message
     */
    public SchemaException(String message) {
        this(message, null);
    }

    /**
     * Creates a schema exception for a particular definition.
     *
     * @param message the error message
     * @param definition the offending definition text (may be null)
     */
    public SchemaException(String message, String definition) {
        super(message);
        this.definition = definition;
    }

    /**
     * Returns the definition that could not be processed.
     *
     * @return the definition text, or null
     */
    public String getDefinition() {
        return definition;
    }
}
