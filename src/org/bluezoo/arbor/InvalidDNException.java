/*
 * InvalidDNException.java
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

/**
 * Exception thrown when a distinguished name or relative distinguished
 * name does not match the DN grammar.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class InvalidDNException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final String dn;

    /**
     * Creates a new exception.
     *
     * @param message the error message
     * @param dn the offending DN
     */
    public InvalidDNException(String message, String dn) {
        super(message);
        this.dn = dn;
    }

    /**
     * Returns the offending DN.
     *
     * @return the DN as given
     */
    public String getDN() {
        return dn;
    }
}
