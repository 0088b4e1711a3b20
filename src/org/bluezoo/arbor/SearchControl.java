/*
 * SearchControl.java
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

import java.util.List;

/**
 * A protocol extension registered with a {@link Directory}.
 *
 * <p>Each {@link Branchset} created against the directory captures the
 * registered search controls at construction time. Implementations may
 * expose further operations of their own; callers reach them through
 * {@link Branchset#getControl(Class)}. Whenever the branchset searches,
 * the client and server controls returned here are appended to the
 * request.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public interface SearchControl {

    /**
     * Returns the OID identifying this extension.
     *
     * @return the OID
     */
    String getOID();

    /**
     * Returns the client-side controls to send with a search issued by
     * the given branchset.
     *
     * @param branchset the branchset performing the search
     * @return the client controls, possibly empty
     */
    List<Control> getClientControls(Branchset branchset);

    /**
     * Returns the server controls to send with a search issued by
     * the given branchset.
     *
     * @param branchset the branchset performing the search
     * @return the server controls, possibly empty
     */
    List<Control> getServerControls(Branchset branchset);

}
