/*
 * NoSuchEntryException.java
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

/**
 * Exception thrown when an entry cannot be found in the directory.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class NoSuchEntryException extends DirectoryException {

    private static final long serialVersionUID = 1L;

    private final String dn;

    /**
     * Creates a new exception for the given DN.
     *
     * @param dn the DN of the missing entry
     */
    public NoSuchEntryException(String dn) {
        super(ResultCode.NO_SUCH_OBJECT,
              MessageFormat.format(Branch.L10N.getString("err.no_such_entry"), dn));
        this.dn = dn;
    }

    /**
     * Returns the DN of the missing entry.
     *
     * @return the DN
     */
    public String getDN() {
        return dn;
    }
}
