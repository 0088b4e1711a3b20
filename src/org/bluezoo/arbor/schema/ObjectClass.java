/*
 * ObjectClass.java
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
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * An objectClass definition.
 *
 * <p>{@link #getOwnMust()} and {@link #getOwnMay()} return the attributes
 * declared by this class alone. {@link #getMust()} and {@link #getMay()}
 * return the effective sets, including every attribute inherited from the
 * superior classes, ancestors first, without duplicates (compared
 * case-insensitively).
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class ObjectClass extends SchemaElement {

    /**
     * The kind of an objectClass.
     */
    public enum Kind {
        ABSTRACT,
        STRUCTURAL,
        AUXILIARY
    }

    private final List<String> superiors;
    private final Kind kind;
    private final List<String> ownMust;
    private final List<String> ownMay;

    private Schema schema;
    private List<ObjectClass> superiorClasses = Collections.emptyList();
    private Set<String> must;
    private Set<String> may;

    /**
     * Creates an objectClass from a parsed definition.
     *
     * @param definition the parsed definition
     */
    public ObjectClass(SchemaDefinitionParser.Definition definition) {
        super(definition);
        this.superiors = Collections.unmodifiableList(
                new ArrayList<String>(definition.get("SUP")));
        if (definition.has("ABSTRACT")) {
            kind = Kind.ABSTRACT;
        } else if (definition.has("AUXILIARY")) {
            kind = Kind.AUXILIARY;
        } else {
            // RFC 4512: STRUCTURAL when unspecified
            kind = Kind.STRUCTURAL;
        }
        this.ownMust = Collections.unmodifiableList(
                new ArrayList<String>(definition.get("MUST")));
        this.ownMay = Collections.unmodifiableList(
                new ArrayList<String>(definition.get("MAY")));
        this.must = Collections.unmodifiableSet(dedupe(ownMust));
        this.may = Collections.unmodifiableSet(dedupe(ownMay));
    }

    /**
     * Returns the names of the superior classes as declared.
     *
     * @return unmodifiable list of names
     */
    public List<String> getSuperiors() {
        return superiors;
    }

    /**
     * Returns the resolved superior classes. Unknown superiors are omitted.
     *
     * @return unmodifiable list of classes
     */
    public List<ObjectClass> getSuperiorClasses() {
        return superiorClasses;
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isStructural() {
        return kind == Kind.STRUCTURAL;
    }

    public boolean isAuxiliary() {
        return kind == Kind.AUXILIARY;
    }

    public boolean isAbstract() {
        return kind == Kind.ABSTRACT;
    }

    /**
     * Returns the required attributes declared by this class.
     *
     * @return unmodifiable list of attribute names
     */
    public List<String> getOwnMust() {
        return ownMust;
    }

    /**
     * Returns the optional attributes declared by this class.
     *
     * @return unmodifiable list of attribute names
     */
    public List<String> getOwnMay() {
        return ownMay;
    }

    /**
     * Returns the effective required attributes.
     *
     * @return unmodifiable ordered set of attribute names
     */
    public Set<String> getMust() {
        return must;
    }

    /**
     * Returns the effective optional attributes.
     *
     * @return unmodifiable ordered set of attribute names
     */
    public Set<String> getMay() {
        return may;
    }

    /**
     * Returns the attributeTypes of the effective required attributes.
     * Names the schema does not know are skipped.
     *
     * @return list of attribute types
     */
    public List<AttributeType> getMustAttributeTypes() {
        return resolve(must);
    }

    /**
     * Returns the attributeTypes of the effective optional attributes.
     * Names the schema does not know are skipped.
     *
     * @return list of attribute types
     */
    public List<AttributeType> getMayAttributeTypes() {
        return resolve(may);
    }

    /**
     * Returns whether this class is, or inherits from, the named class.
     *
     * @param name a class name or OID
     * @return true if this class is a kind of the named class
     */
    public boolean isSubclassOf(String name) {
        if (isNamed(name)) {
            return true;
        }
        for (ObjectClass sup : superiorClasses) {
            if (sup.isSubclassOf(name)) {
                return true;
            }
        }
        return false;
    }

    private List<AttributeType> resolve(Set<String> names) {
        List<AttributeType> types = new ArrayList<AttributeType>(names.size());
        if (schema == null) {
            return types;
        }
        for (String name : names) {
            AttributeType type = schema.getAttributeType(name);
            if (type != null) {
                types.add(type);
            }
        }
        return types;
    }

    /**
     * Sets the resolved superiors and computes the effective attribute
     * sets. The superiors must already be resolved.
     */
    void resolve(Schema schema, List<ObjectClass> sups) {
        this.schema = schema;
        this.superiorClasses = Collections.unmodifiableList(new ArrayList<ObjectClass>(sups));
        List<String> allMust = new ArrayList<String>();
        List<String> allMay = new ArrayList<String>();
        for (ObjectClass sup : sups) {
            allMust.addAll(sup.getMust());
            allMay.addAll(sup.getMay());
        }
        allMust.addAll(ownMust);
        allMay.addAll(ownMay);
        this.must = Collections.unmodifiableSet(dedupe(allMust));
        this.may = Collections.unmodifiableSet(dedupe(allMay));
    }

    private static Set<String> dedupe(List<String> names) {
        Set<String> seen = new HashSet<String>();
        Set<String> result = new LinkedHashSet<String>();
        for (String name : names) {
            if (seen.add(name.toLowerCase())) {
                result.add(name);
            }
        }
        return result;
    }
}
