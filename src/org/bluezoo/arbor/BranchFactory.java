/*
 * BranchFactory.java
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
 * Creates the {@link Branch} objects that wrap entries returned by a
 * search or reached by navigation.
 *
 * <p>A branchset wraps its results with the factory of its base branch
 * unless another is chosen with {@link Branchset#as(BranchFactory)}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public interface BranchFactory {

    /**
     * Creates a branch.
     *
     * @param directory the directory the entry belongs to
     * @param dn the entry DN
     * @param entry the already fetched entry, or null to fetch on demand
     * @return the branch
     */
    Branch newBranch(Directory directory, String dn, SearchResultEntry entry);

}
