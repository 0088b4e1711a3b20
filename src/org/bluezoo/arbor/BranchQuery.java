/*
 * BranchQuery.java
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
 * A search, or union of searches, that can be refined and enumerated.
 *
 * <p>Refinement methods return a new query and never modify the receiver.
 * Enumeration methods perform the search each time they are called; no
 * results are cached.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 * @see Branchset
 * @see BranchCollection
 */
public interface BranchQuery {

    /**
     * Returns all results.
     *
     * @return the matching branches, in the order the directory delivers them
     * @throws DirectoryException if a search fails
     */
    List<Branch> all() throws DirectoryException;

    /**
     * Delivers each result to the handler as the directory produces it.
     *
     * @param handler the handler
     * @throws DirectoryException if a search fails
     */
    void each(BranchHandler handler) throws DirectoryException;

    /**
     * Returns the first result.
     *
     * @return the first matching branch, or null if there is none
     * @throws DirectoryException if a search fails
     */
    Branch first() throws DirectoryException;

    /**
     * Returns whether the query has no results.
     *
     * @return true if nothing matches
     * @throws DirectoryException if a search fails
     */
    boolean isEmpty() throws DirectoryException;

    /**
     * Returns the decoded value of an attribute for each result.
     *
     * @param attribute the attribute name
     * @return one value (possibly null) per result
     * @throws DirectoryException if a search fails
     */
    List<Object> map(String attribute) throws DirectoryException;

    /**
     * Returns a query further restricted by the given criteria.
     *
     * @param criteria criteria accepted by
     * {@link org.bluezoo.arbor.filter.FilterCompiler#compile}
     * @return the refined query
     */
    BranchQuery filter(Object... criteria);

    /**
     * Returns a query with the given search scope.
     *
     * @param scope the scope
     * @return the refined query
     */
    BranchQuery scope(SearchScope scope);

    /**
     * Returns a query returning only the given attributes.
     *
     * @param attributes the attribute names
     * @return the refined query
     */
    BranchQuery select(String... attributes);

    /**
     * Returns the DNs the query searches from.
     *
     * @return the base DNs
     */
    List<String> getBaseDNs();

    /**
     * Returns the union of this query and another.
     *
     * @param other the other query
     * @return the union
     */
    BranchCollection plus(BranchQuery other);

    /**
     * Returns the union of this query and a search below the given branch.
     *
     * @param branch the branch
     * @return the union
     */
    BranchCollection plus(Branch branch);

}
