/*
 * Directory.java
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
import java.util.Map;

import org.bluezoo.arbor.schema.Schema;

/**
 * The directory service this library builds queries and entries over.
 *
 * <p>Implementations wrap a real protocol client; transport, binding and
 * reconnection are their concern. Every method blocks until the
 * underlying operation completes. Failures are reported as
 * {@link DirectoryException}s, which this library propagates unchanged.
 *
 * <p>Most implementations should extend {@link AbstractDirectory}, which
 * provides schema caching, syntax conversion and control registration.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public interface Directory {

    /**
     * Returns the DN of the directory's default search base.
     *
     * @return the base DN
     */
    String getBaseDN();

    /**
     * Performs a search, delivering each matching entry to the handler
     * before returning.
     *
     * @param request the search parameters
     * @param handler receives the matching entries
     * @throws DirectoryException if the search fails
     */
    void search(SearchRequest request, SearchResultHandler handler)
            throws DirectoryException;

    /**
     * Fetches the user attributes of a single entry.
     *
     * @param dn the entry DN
     * @return the entry, or null if there is no such entry
     * @throws DirectoryException if the fetch fails
     */
    SearchResultEntry getEntry(String dn) throws DirectoryException;

    /**
     * Fetches a single entry including its operational attributes.
     *
     * @param dn the entry DN
     * @return the entry, or null if there is no such entry
     * @throws DirectoryException if the fetch fails
     */
    SearchResultEntry getExtendedEntry(String dn) throws DirectoryException;

    /**
     * Modifies an existing entry.
     *
     * @param dn the DN of the entry to modify
     * @param modifications the modifications to apply, in order
     * @throws DirectoryException if the modification fails
     */
    void modify(String dn, List<Modification> modifications) throws DirectoryException;

    /**
     * Adds a new entry.
     *
     * @param dn the DN of the new entry
     * @param attributes the attributes of the new entry
     * @throws DirectoryException if the entry cannot be added
     */
    void add(String dn, Map<String, List<String>> attributes) throws DirectoryException;

    /**
     * Deletes an entry.
     *
     * @param dn the DN of the entry to delete
     * @throws DirectoryException if the entry cannot be deleted
     */
    void delete(String dn) throws DirectoryException;

    /**
     * Renames an entry within its parent, then replaces the given
     * attributes on the renamed entry.
     *
     * @param dn the current DN
     * @param newRDN the new RDN
     * @param attributes attributes to replace afterwards (may be empty)
     * @throws DirectoryException if the move fails
     */
    void move(String dn, String newRDN, Map<String, List<String>> attributes)
            throws DirectoryException;

    /**
     * Copies an entry to a new DN, replacing the given attributes on the copy.
     *
     * @param dn the DN of the entry to copy
     * @param newDN the DN of the copy
     * @param attributes attributes to replace on the copy (may be empty)
     * @throws DirectoryException if the copy fails
     */
    void copy(String dn, String newDN, Map<String, List<String>> attributes)
            throws DirectoryException;

    /**
     * Returns the directory's parsed schema.
     *
     * @return the schema
     * @throws DirectoryException if the schema cannot be fetched or parsed
     */
    Schema getSchema() throws DirectoryException;

    /**
     * Returns the protocol extensions that contribute controls to searches.
     *
     * @return the registered search controls, possibly empty
     */
    List<SearchControl> getRegisteredControls();

    /**
     * Decodes a raw attribute value according to its syntax.
     *
     * @param syntaxOID the numeric OID of the attribute syntax (may be null)
     * @param value the raw value
     * @return the decoded value
     */
    Object convertSyntaxValue(String syntaxOID, String value);

}
