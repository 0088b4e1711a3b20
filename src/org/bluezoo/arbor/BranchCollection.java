/*
 * BranchCollection.java
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
import java.util.Collections;
import java.util.List;

/**
 * The union of several {@link Branchset}s.
 *
 * <p>Enumerating a collection searches each of its branchsets in turn and
 * concatenates the results; entries found by more than one branchset are
 * not merged. Refinement methods apply to every member branchset.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class BranchCollection implements BranchQuery {

    private final List<Branchset> branchsets;

    /**
     * Creates a collection from the given queries. Collections among them
     * contribute their member branchsets.
     *
     * @param queries the queries to combine
     */
    public BranchCollection(BranchQuery... queries) {
        List<Branchset> list = new ArrayList<Branchset>();
        for (BranchQuery query : queries) {
            add(list, query);
        }
        this.branchsets = Collections.unmodifiableList(list);
    }

    /**
     * Creates a collection of the given branchsets.
     *
     * @param branchsets the branchsets
     */
    public BranchCollection(List<Branchset> branchsets) {
        this.branchsets = Collections.unmodifiableList(new ArrayList<Branchset>(branchsets));
    }

    private static void add(List<Branchset> list, BranchQuery query) {
        if (query instanceof Branchset) {
            list.add((Branchset) query);
        } else if (query instanceof BranchCollection) {
            list.addAll(((BranchCollection) query).getBranchsets());
        } else {
            throw new IllegalArgumentException("Unsupported query: " + query);
        }
    }

    /**
     * Returns the member branchsets.
     *
     * @return unmodifiable list of branchsets
     */
    public List<Branchset> getBranchsets() {
        return branchsets;
    }

    @Override
    public List<String> getBaseDNs() {
        List<String> dns = new ArrayList<String>(branchsets.size());
        for (Branchset branchset : branchsets) {
            dns.add(branchset.getBaseDN());
        }
        return dns;
    }

    @Override
    public List<Branch> all() throws DirectoryException {
        List<Branch> results = new ArrayList<Branch>();
        for (Branchset branchset : branchsets) {
            results.addAll(branchset.all());
        }
        return results;
    }

    @Override
    public void each(BranchHandler handler) throws DirectoryException {
        for (Branchset branchset : branchsets) {
            branchset.each(handler);
        }
    }

    /**
     * Returns the first result of the first branchset that has one.
     *
     * @return the first matching branch, or null
     * @throws DirectoryException if a search fails
     */
    @Override
    public Branch first() throws DirectoryException {
        for (Branchset branchset : branchsets) {
            Branch branch = branchset.first();
            if (branch != null) {
                return branch;
            }
        }
        return null;
    }

    @Override
    public boolean isEmpty() throws DirectoryException {
        return first() == null;
    }

    @Override
    public List<Object> map(String attribute) throws DirectoryException {
        List<Object> values = new ArrayList<Object>();
        for (Branchset branchset : branchsets) {
            values.addAll(branchset.map(attribute));
        }
        return values;
    }

    @Override
    public BranchCollection filter(Object... criteria) {
        List<Branchset> list = new ArrayList<Branchset>(branchsets.size());
        for (Branchset branchset : branchsets) {
            list.add(branchset.filter(criteria));
        }
        return new BranchCollection(list);
    }

    @Override
    public BranchCollection scope(SearchScope scope) {
        List<Branchset> list = new ArrayList<Branchset>(branchsets.size());
        for (Branchset branchset : branchsets) {
            list.add(branchset.scope(scope));
        }
        return new BranchCollection(list);
    }

    @Override
    public BranchCollection select(String... attributes) {
        List<Branchset> list = new ArrayList<Branchset>(branchsets.size());
        for (Branchset branchset : branchsets) {
            list.add(branchset.select(attributes));
        }
        return new BranchCollection(list);
    }

    @Override
    public BranchCollection plus(BranchQuery other) {
        return new BranchCollection(this, other);
    }

    @Override
    public BranchCollection plus(Branch branch) {
        return new BranchCollection(this, branch.getBranchset());
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof BranchCollection
                && branchsets.equals(((BranchCollection) other).branchsets);
    }

    @Override
    public int hashCode() {
        return branchsets.hashCode();
    }

    @Override
    public String toString() {
        return "BranchCollection" + branchsets;
    }
}
