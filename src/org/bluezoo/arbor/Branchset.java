/*
 * Branchset.java
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
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.bluezoo.arbor.filter.Filter;
import org.bluezoo.arbor.filter.FilterCompiler;

/**
 * A lazily evaluated search below a {@link Branch}.
 *
 * <p>A branchset is an immutable description of a search: a base branch,
 * a filter, a scope, an attribute selection, a size limit and a time
 * limit. Each refinement method returns a new branchset and leaves the
 * receiver unchanged, so partially refined branchsets can be shared and
 * reused freely. Nothing is sent to the directory until one of the
 * enumeration methods ({@link #all}, {@link #each}, {@link #first},
 * {@link #isEmpty}, {@link #map}, {@link #toMap}) is called, and each call
 * performs exactly one search.
 *
 * <h4>Usage Example</h4>
 * <pre>{@code
 * Branch people = new Branch(directory, "ou=people,dc=example,dc=com");
 * Branchset admins = people.getBranchset()
 *     .filter("objectClass", "inetOrgPerson")
 *     .filter("memberOf", "cn=admins,ou=groups,dc=example,dc=com")
 *     .scope(SearchScope.ONE)
 *     .select("uid", "cn", "mail")
 *     .limit(50);
 * for (Branch admin : admins.all()) {
 *     System.out.println(admin.get("mail"));
 * }
 * }</pre>
 *
 * <p>Search controls registered with the directory when the branchset is
 * created are carried by it and its refinements; their client and server
 * controls are added to every search.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class Branchset implements BranchQuery {

    private static final Logger LOGGER = Logger.getLogger(Branchset.class.getName());

    /** The scope of a new branchset. */
    public static final SearchScope DEFAULT_SCOPE = SearchScope.SUBTREE;

    private final Branch branch;
    private final Filter filter;
    private final String scope;
    private final List<String> select;
    private final int limit;
    private final double timeout;
    private final BranchFactory branchFactory;
    private final List<SearchControl> controls;

    /**
     * Creates a branchset searching the whole subtree below the branch
     * with the default filter.
     *
     * @param branch the base of the search
     */
    public Branchset(Branch branch) {
        this(branch, Filter.DEFAULT);
    }

    /**
     * Creates a branchset searching the whole subtree below the branch
     * with the given filter.
     *
     * @param branch the base of the search
     * @param filter the filter
     */
    public Branchset(Branch branch, Filter filter) {
        this(branch, filter, DEFAULT_SCOPE.getName(), Collections.<String>emptyList(),
                0, 0.0, branch.getBranchFactory(),
                branch.getDirectory().getRegisteredControls());
    }

    private Branchset(Branch branch, Filter filter, String scope, List<String> select,
            int limit, double timeout, BranchFactory branchFactory,
            List<SearchControl> controls) {
        if (branch == null || filter == null || scope == null || branchFactory == null) {
            throw new NullPointerException();
        }
        this.branch = branch;
        this.filter = filter;
        this.scope = scope;
        this.select = Collections.unmodifiableList(new ArrayList<String>(select));
        this.limit = limit;
        this.timeout = timeout;
        this.branchFactory = branchFactory;
        this.controls = Collections.unmodifiableList(new ArrayList<SearchControl>(controls));
    }

    // -- Accessors --

    /**
     * Returns the base of the search.
     *
     * @return the base branch
     */
    public Branch getBranch() {
        return branch;
    }

    public Directory getDirectory() {
        return branch.getDirectory();
    }

    public String getBaseDN() {
        return branch.getDN();
    }

    @Override
    public List<String> getBaseDNs() {
        return Collections.singletonList(getBaseDN());
    }

    public Filter getFilter() {
        return filter;
    }

    /**
     * Returns the filter as it will be sent to the directory.
     *
     * @return the filter text
     */
    public String getFilterString() {
        return filter.toString();
    }

    /**
     * Returns the scope as it was given.
     *
     * @return the scope name, e.g. {@code subtree} or {@code one}
     */
    public String getScope() {
        return scope;
    }

    /**
     * Returns the search scope.
     *
     * @return the scope
     * @throws IllegalStateException if the scope name is not recognised
     */
    public SearchScope getSearchScope() {
        SearchScope searchScope = SearchScope.forName(scope);
        if (searchScope == null) {
            String message = Branch.L10N.getString("err.invalid_scope");
            throw new IllegalStateException(MessageFormat.format(message, scope));
        }
        return searchScope;
    }

    /**
     * Returns the attributes to return.
     *
     * @return unmodifiable list of attribute names; empty for all
     */
    public List<String> getSelect() {
        return select;
    }

    /**
     * Returns the maximum number of results.
     *
     * @return the size limit, or 0 for none
     */
    public int getLimit() {
        return limit;
    }

    /**
     * Returns the time limit in seconds.
     *
     * @return the time limit, or 0 for none
     */
    public double getTimeout() {
        return timeout;
    }

    public BranchFactory getBranchFactory() {
        return branchFactory;
    }

    /**
     * Returns the search controls captured from the directory.
     *
     * @return unmodifiable list of controls
     */
    public List<SearchControl> getControls() {
        return controls;
    }

    /**
     * Returns the captured control of the given type.
     *
     * @param type the control class
     * @return the control, or null if none was registered
     */
    public <T extends SearchControl> T getControl(Class<T> type) {
        for (SearchControl control : controls) {
            if (type.isInstance(control)) {
                return type.cast(control);
            }
        }
        return null;
    }

    // -- Refinement --

    /**
     * Returns a branchset whose filter is the conjunction of this one's
     * and the compiled criteria.
     *
     * @param criteria criteria accepted by {@link FilterCompiler#compile}
     * @return the refined branchset
     * @throws IllegalArgumentException if the criteria cannot be compiled
     */
    @Override
    public Branchset filter(Object... criteria) {
        Filter newFilter = filter.and(FilterCompiler.compile(criteria));
        return new Branchset(branch, newFilter, scope, select, limit, timeout,
                branchFactory, controls);
    }

    @Override
    public Branchset scope(SearchScope scope) {
        return scope(scope.getName());
    }

    /**
     * Returns a branchset with the given scope.
     *
     * <p>{@code base}, {@code one}, {@code onelevel}, {@code sub} and
     * {@code subtree} are recognised. Any other name is kept, but
     * searching with it fails.
     *
     * @param scope the scope name
     * @return the refined branchset
     */
    public Branchset scope(String scope) {
        return new Branchset(branch, filter, scope, select, limit, timeout,
                branchFactory, controls);
    }

    /**
     * Returns a branchset returning only the given attributes.
     *
     * @param attributes the attribute names
     * @return the refined branchset
     */
    @Override
    public Branchset select(String... attributes) {
        return new Branchset(branch, filter, scope, merge(Collections.<String>emptyList(), attributes),
                limit, timeout, branchFactory, controls);
    }

    /**
     * Returns a branchset returning all user attributes.
     *
     * @return the refined branchset
     */
    public Branchset selectAll() {
        return new Branchset(branch, filter, scope, Collections.<String>emptyList(),
                limit, timeout, branchFactory, controls);
    }

    /**
     * Returns a branchset returning the currently selected attributes and
     * the given ones. Names already selected are not repeated.
     *
     * @param attributes the additional attribute names
     * @return the refined branchset
     */
    public Branchset selectMore(String... attributes) {
        return new Branchset(branch, filter, scope, merge(select, attributes),
                limit, timeout, branchFactory, controls);
    }

    public Branchset limit(int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("Negative limit: " + limit);
        }
        return new Branchset(branch, filter, scope, select, limit, timeout,
                branchFactory, controls);
    }

    public Branchset withoutLimit() {
        return limit(0);
    }

    /**
     * Returns a branchset with the given time limit.
     *
     * @param timeout the time limit in seconds, or 0 for none
     * @return the refined branchset
     */
    public Branchset timeout(double timeout) {
        if (timeout < 0) {
            throw new IllegalArgumentException("Negative timeout: " + timeout);
        }
        return new Branchset(branch, filter, scope, select, limit, timeout,
                branchFactory, controls);
    }

    public Branchset withoutTimeout() {
        return timeout(0.0);
    }

    /**
     * Returns a branchset that wraps its results with the given factory.
     *
     * @param factory the branch factory
     * @return the refined branchset
     */
    public Branchset as(BranchFactory factory) {
        return new Branchset(branch, filter, scope, select, limit, timeout,
                factory, controls);
    }

    @Override
    public BranchCollection plus(BranchQuery other) {
        return new BranchCollection(this, other);
    }

    @Override
    public BranchCollection plus(Branch other) {
        return new BranchCollection(this, other.getBranchset());
    }

    private static List<String> merge(List<String> current, String[] attributes) {
        List<String> result = new ArrayList<String>(current);
        Set<String> seen = new HashSet<String>();
        for (String name : current) {
            seen.add(name.toLowerCase());
        }
        for (String name : attributes) {
            if (seen.add(name.toLowerCase())) {
                result.add(name);
            }
        }
        return result;
    }

    // -- Enumeration --

    /**
     * Returns the search request this branchset performs.
     *
     * @return a new search request
     * @throws IllegalStateException if the scope is not recognised
     */
    public SearchRequest toSearchRequest() {
        SearchRequest request = new SearchRequest();
        request.setBaseDN(getBaseDN());
        request.setScope(getSearchScope());
        request.setFilter(getFilterString());
        request.setAttributes(select);
        request.setSizeLimit(limit);
        request.setTimeLimit(timeout);
        List<Control> clientControls = new ArrayList<Control>();
        List<Control> serverControls = new ArrayList<Control>();
        for (SearchControl control : controls) {
            clientControls.addAll(control.getClientControls(this));
            serverControls.addAll(control.getServerControls(this));
        }
        request.setClientControls(clientControls);
        request.setServerControls(serverControls);
        return request;
    }

    @Override
    public List<Branch> all() throws DirectoryException {
        final List<Branch> results = new ArrayList<Branch>();
        search(toSearchRequest(), new BranchHandler() {
            @Override
            public void handleBranch(Branch result) {
                results.add(result);
            }
        });
        return results;
    }

    @Override
    public void each(BranchHandler handler) throws DirectoryException {
        search(toSearchRequest(), handler);
    }

    /**
     * Returns the first result. The search is limited to one entry
     * whatever this branchset's limit.
     *
     * @return the first matching branch, or null if there is none
     * @throws DirectoryException if the search fails
     */
    @Override
    public Branch first() throws DirectoryException {
        SearchRequest request = toSearchRequest();
        request.setSizeLimit(1);
        final List<Branch> results = new ArrayList<Branch>(1);
        search(request, new BranchHandler() {
            @Override
            public void handleBranch(Branch result) {
                results.add(result);
            }
        });
        return results.isEmpty() ? null : results.get(0);
    }

    @Override
    public boolean isEmpty() throws DirectoryException {
        return first() == null;
    }

    @Override
    public List<Object> map(String attribute) throws DirectoryException {
        List<Branch> results = all();
        List<Object> values = new ArrayList<Object>(results.size());
        for (Branch result : results) {
            values.add(result.get(attribute));
        }
        return values;
    }

    /**
     * Returns the results keyed by the first value of an attribute.
     * Results without the attribute are omitted; when two results share a
     * key the later one wins.
     *
     * @param keyAttribute the attribute supplying the keys
     * @return ordered map of key to raw entry
     * @throws DirectoryException if the search fails
     */
    public Map<String, SearchResultEntry> toMap(String keyAttribute) throws DirectoryException {
        Map<String, SearchResultEntry> map = new LinkedHashMap<String, SearchResultEntry>();
        for (Branch result : all()) {
            SearchResultEntry entry = result.getEntry();
            String key = entry.getAttributeValue(keyAttribute);
            if (key != null) {
                map.put(key, entry);
            }
        }
        return map;
    }

    /**
     * Returns the first value of one attribute keyed by the first value of
     * another, for each result.
     *
     * @param keyAttribute the attribute supplying the keys
     * @param valueAttribute the attribute supplying the values
     * @return ordered map of key to value
     * @throws DirectoryException if the search fails
     */
    public Map<String, String> toMap(String keyAttribute, String valueAttribute)
            throws DirectoryException {
        Map<String, String> map = new LinkedHashMap<String, String>();
        for (Branch result : all()) {
            SearchResultEntry entry = result.getEntry();
            String key = entry.getAttributeValue(keyAttribute);
            if (key != null) {
                map.put(key, entry.getAttributeValue(valueAttribute));
            }
        }
        return map;
    }

    private void search(SearchRequest request, final BranchHandler handler)
            throws DirectoryException {
        final Directory directory = getDirectory();
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("Searching " + directory + ": " + request);
        }
        directory.search(request, new SearchResultHandler() {
            @Override
            public void handleEntry(SearchResultEntry entry) {
                handler.handleBranch(branchFactory.newBranch(directory, entry.getDN(), entry));
            }
        });
    }

    // -- Object --

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Branchset)) {
            return false;
        }
        Branchset o = (Branchset) other;
        return branch.equals(o.branch)
                && filter.equals(o.filter)
                && scope.equals(o.scope)
                && select.equals(o.select)
                && limit == o.limit
                && Double.compare(timeout, o.timeout) == 0
                && branchFactory.equals(o.branchFactory)
                && controls.equals(o.controls);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(new Object[] {
            branch, filter, scope, select, Integer.valueOf(limit), Double.valueOf(timeout)
        });
    }

    @Override
    public String toString() {
        StringBuilder buf = new StringBuilder("Branchset[");
        buf.append(getBaseDN()).append('?');
        buf.append(select.isEmpty() ? "*" : String.join(",", select)).append('?');
        buf.append(scope).append('?');
        buf.append(filter);
        if (limit > 0) {
            buf.append(" limit=").append(limit);
        }
        if (timeout > 0) {
            buf.append(" timeout=").append(timeout);
        }
        buf.append(']');
        return buf.toString();
    }
}
