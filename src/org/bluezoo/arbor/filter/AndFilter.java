/*
 * AndFilter.java
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

package org.bluezoo.arbor.filter;

import java.util.List;

/**
 * Conjunction of filters: {@code (&(a=1)(b=2))}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class AndFilter extends Filter {

    private final List<Filter> children;

    /**
     * Creates a conjunction.
     *
     * @param children the filters, in order; must not be empty
     */
    public AndFilter(List<Filter> children) {
        this.children = copyChildren(children);
    }

    /**
     * Returns the conjoined filters.
     *
     * @return unmodifiable list of children
     */
    public List<Filter> getChildren() {
        return children;
    }

    @Override
    protected void appendTo(StringBuilder buf) {
        buf.append("(&");
        for (Filter child : children) {
            child.appendTo(buf);
        }
        buf.append(')');
    }
}
