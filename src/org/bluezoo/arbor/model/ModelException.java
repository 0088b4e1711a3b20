/*
 * ModelException.java
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

package org.bluezoo.arbor.model;

/**
 * Exception thrown when a model or one of its capabilities is
 * misconfigured, for example a capability asked for a search without
 * declaring any objectClasses or bases.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class ModelException extends Exception {

    private static final long serialVersionUID = 1L;

    /**
     * Creates a model exception.
     *
     * @param message the error message
     */
    public ModelException(String message) {
        super(message);
    }

    /**
     * Creates a model exception with an underlying cause.
     *
     * @param message the error message
     * @param cause the cause
     */
    public ModelException(String message, Throwable cause) {
        super(message, cause);
    }
}
