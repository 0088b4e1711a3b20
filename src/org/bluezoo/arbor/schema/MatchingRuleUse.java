/*
 * MatchingRuleUse.java
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

package org.bluezoo.arbor.schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A matchingRuleUse definition: the attribute types a matching rule
 * applies to. Its OID is that of the matching rule.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class MatchingRuleUse extends SchemaElement {

    private final List<String> appliesTo;

    public MatchingRuleUse(SchemaDefinitionParser.Definition definition) {
        super(definition);
        this.appliesTo = Collections.unmodifiableList(
                new ArrayList<String>(definition.get("APPLIES")));
    }

    /**
     * Returns the names of the attribute types the rule applies to.
     *
     * @return unmodifiable list of names
     */
    public List<String> getAppliesTo() {
        return appliesTo;
    }
}
