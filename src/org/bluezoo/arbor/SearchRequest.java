/*
 * SearchRequest.java
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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * The parameters of a single search handed to {@link Directory#search}.
 *
 * <p>Callers rarely build these directly: {@link Branchset#toSearchRequest}
 * produces one for every enumeration, carrying the projection, limits and
 * the payloads of any registered {@link SearchControl}s. A directory
 * implementation maps it onto whatever client library it wraps:
 * <pre>{@code
 * public void search(SearchRequest request, SearchResultHandler handler)
 *         throws DirectoryException {
 *     for (Entry e : client.search(request.getBaseDN(), request.getScope(),
 *             request.getFilter(), request.getAttributes())) {
 *         handler.handleEntry(toSearchResultEntry(e));
 *     }
 * }
 * }</pre>
 *
 * <p>Requests are mutable and not shared between searches.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class SearchRequest {

    /** The filter matching every entry. */
    public static final String DEFAULT_FILTER = "(objectClass=*)";

    private String baseDN = "";
    private SearchScope scope = SearchScope.SUBTREE;
    private String filter = DEFAULT_FILTER;
    private List<String> attributes = Collections.emptyList();
    private int sizeLimit;
    private double timeLimit;
    private List<Control> clientControls = Collections.emptyList();
    private List<Control> serverControls = Collections.emptyList();

    public String getBaseDN() {
        return baseDN;
    }

    /**
     * Sets the DN the search starts from.
     *
     * @param baseDN the base DN; null means the root DSE
     */
    public void setBaseDN(String baseDN) {
        this.baseDN = (baseDN == null) ? "" : baseDN;
    }

    public SearchScope getScope() {
        return scope;
    }

    /**
     * Sets how far below the base the search reaches.
     *
     * @param scope the scope; null restores the subtree default
     */
    public void setScope(SearchScope scope) {
        this.scope = (scope == null) ? SearchScope.SUBTREE : scope;
    }

    /**
     * Returns the filter in RFC 4515 string form.
     *
     * @return the filter, never null
     */
    public String getFilter() {
        return filter;
    }

    public void setFilter(String filter) {
        this.filter = (filter == null) ? DEFAULT_FILTER : filter;
    }

    /**
     * Returns the attributes the directory should return. An empty list
     * asks for every user attribute.
     *
     * @return unmodifiable list of attribute names
     */
    public List<String> getAttributes() {
        return attributes;
    }

    public void setAttributes(String... attributes) {
        setAttributes((attributes == null) ? null : Arrays.asList(attributes));
    }

    public void setAttributes(List<String> attributes) {
        this.attributes = immutableCopy(attributes);
    }

    /**
     * Returns the maximum number of entries the directory should return.
     *
     * @return the size limit, 0 for none
     */
    public int getSizeLimit() {
        return sizeLimit;
    }

    /**
     * Sets the size limit. Negative values are treated as no limit.
     *
     * @param sizeLimit the maximum number of entries
     */
    public void setSizeLimit(int sizeLimit) {
        this.sizeLimit = (sizeLimit < 0) ? 0 : sizeLimit;
    }

    /**
     * Returns the time limit, in seconds.
     *
     * @return the time limit, 0 for none
     */
    public double getTimeLimit() {
        return timeLimit;
    }

    public void setTimeLimit(double timeLimit) {
        this.timeLimit = (timeLimit < 0) ? 0 : timeLimit;
    }

    /**
     * Returns the controls interpreted by the directory implementation
     * itself rather than sent to the server.
     *
     * @return unmodifiable list of controls
     */
    public List<Control> getClientControls() {
        return clientControls;
    }

    public void setClientControls(List<Control> clientControls) {
        this.clientControls = immutableCopy(clientControls);
    }

    /**
     * Returns the controls to attach to the request sent to the server.
     *
     * @return unmodifiable list of controls
     */
    public List<Control> getServerControls() {
        return serverControls;
    }

    public void setServerControls(List<Control> serverControls) {
        this.serverControls = immutableCopy(serverControls);
    }

    private static <T> List<T> immutableCopy(List<T> list) {
        if (list == null || list.isEmpty()) {
            return Collections.emptyList();
        }
        return Collections.unmodifiableList(new ArrayList<T>(list));
    }

    @Override
    public String toString() {
        // base?attrs?scope?filter, as in an LDAP URL
        StringBuilder buf = new StringBuilder("SearchRequest[");
        buf.append(baseDN).append('?');
        for (int i = 0; i < attributes.size(); i++) {
            if (i > 0) {
                buf.append(',');
            }
            buf.append(attributes.get(i));
        }
        buf.append('?').append(scope.getName());
        buf.append('?').append(filter);
        if (sizeLimit > 0) {
            buf.append(" sizeLimit=").append(sizeLimit);
        }
        if (timeLimit > 0) {
            buf.append(" timeLimit=").append(timeLimit);
        }
        if (!serverControls.isEmpty()) {
            buf.append(" serverControls=").append(serverControls);
        }
        if (!clientControls.isEmpty()) {
            buf.append(" clientControls=").append(clientControls);
        }
        return buf.append(']').toString();
    }
}
