/*
 * SearchResultHandler.java
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
 * Handler for search results delivered by a {@link Directory}.
 *
 * <p>The directory calls {@link #handleEntry} once for each matching
 * entry, in whatever order it produces them, before
 * {@link Directory#search} returns.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 * @see Directory#search
 */
public interface SearchResultHandler {

    /**
     * Receives one matching entry.
     *
     * @param entry the entry with the attributes the request selected
     */
    void handleEntry(SearchResultEntry entry);
}
