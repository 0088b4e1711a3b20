/*
 * Schema.java
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

import java.text.MessageFormat;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.ResourceBundle;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A directory schema: the objectClasses, attributeTypes, syntaxes and
 * matching rules published by a directory's subschema entry.
 *
 * <p>Elements can be looked up by numeric OID or by any of their names,
 * case-insensitively. ObjectClass and attributeType inheritance is
 * resolved when the schema is parsed, so {@link ObjectClass#getMust()}
 * and {@link AttributeType#getSyntaxOID()} reflect the superior chain.
 *
 * <p>A schema is immutable once parsed.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class Schema {

    static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.arbor.schema.L10N");
    private static final Logger LOGGER = Logger.getLogger(Schema.class.getName());

    public static final String OBJECT_CLASSES = "objectClasses";
    public static final String ATTRIBUTE_TYPES = "attributeTypes";
    public static final String LDAP_SYNTAXES = "ldapSyntaxes";
    public static final String MATCHING_RULES = "matchingRules";
    public static final String MATCHING_RULE_USE = "matchingRuleUse";

    private final Index<ObjectClass> objectClasses = new Index<ObjectClass>();
    private final Index<AttributeType> attributeTypes = new Index<AttributeType>();
    private final Index<LDAPSyntax> ldapSyntaxes = new Index<LDAPSyntax>();
    private final Index<MatchingRule> matchingRules = new Index<MatchingRule>();
    private final Index<MatchingRuleUse> matchingRuleUses = new Index<MatchingRuleUse>();

    private Schema() {
    }

    /**
     * Parses a schema from the values of a subschema entry.
     *
     * <p>The keys are the subschema attribute names, matched
     * case-insensitively; absent keys denote empty sets and other keys are
     * ignored.
     *
     * @param definitions the definition strings keyed by attribute name
     * @return the schema
     * @throws SchemaException if a definition is malformed or the
     * inheritance graph contains a cycle
     */
    public static Schema parse(Map<String, ? extends Collection<String>> definitions)
            throws SchemaException {
        Schema schema = new Schema();
        for (Map.Entry<String, ? extends Collection<String>> entry : definitions.entrySet()) {
            String key = entry.getKey();
            Collection<String> values = entry.getValue();
            if (values == null) {
                continue;
            }
            for (String value : values) {
                schema.add(key, value);
            }
        }
        schema.resolveAttributeTypes();
        schema.resolveObjectClasses();
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("Parsed " + schema);
        }
        return schema;
    }

    private void add(String key, String text) throws SchemaException {
        if (OBJECT_CLASSES.equalsIgnoreCase(key)) {
            objectClasses.add(new ObjectClass(SchemaDefinitionParser.parse(text)));
        } else if (ATTRIBUTE_TYPES.equalsIgnoreCase(key)) {
            attributeTypes.add(new AttributeType(SchemaDefinitionParser.parse(text)));
        } else if (LDAP_SYNTAXES.equalsIgnoreCase(key)) {
            ldapSyntaxes.add(new LDAPSyntax(SchemaDefinitionParser.parse(text)));
        } else if (MATCHING_RULES.equalsIgnoreCase(key)) {
            matchingRules.add(new MatchingRule(SchemaDefinitionParser.parse(text)));
        } else if (MATCHING_RULE_USE.equalsIgnoreCase(key)) {
            matchingRuleUses.add(new MatchingRuleUse(SchemaDefinitionParser.parse(text)));
        } else if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("Ignoring subschema attribute " + key);
        }
    }

    // -- Inheritance --

    private void resolveAttributeTypes() throws SchemaException {
        Map<AttributeType, Boolean> state = new IdentityHashMap<AttributeType, Boolean>();
        for (AttributeType type : attributeTypes.values()) {
            resolve(type, state);
        }
    }

    // state: FALSE while on the current path, TRUE once resolved
    private void resolve(AttributeType type, Map<AttributeType, Boolean> state)
            throws SchemaException {
        Boolean s = state.get(type);
        if (Boolean.TRUE.equals(s)) {
            return;
        }
        if (s != null) {
            throw cycle("err.attributetype_cycle", type);
        }
        state.put(type, Boolean.FALSE);
        String supName = type.getSuperior();
        if (supName != null) {
            AttributeType sup = attributeTypes.get(supName);
            if (sup == null) {
                unknownSuperior(type, supName);
            } else {
                resolve(sup, state);
                type.inherit(sup);
            }
        }
        state.put(type, Boolean.TRUE);
    }

    private void resolveObjectClasses() throws SchemaException {
        Map<ObjectClass, Boolean> state = new IdentityHashMap<ObjectClass, Boolean>();
        for (ObjectClass oc : objectClasses.values()) {
            resolve(oc, state);
        }
    }

    private void resolve(ObjectClass oc, Map<ObjectClass, Boolean> state)
            throws SchemaException {
        Boolean s = state.get(oc);
        if (Boolean.TRUE.equals(s)) {
            return;
        }
        if (s != null) {
            throw cycle("err.objectclass_cycle", oc);
        }
        state.put(oc, Boolean.FALSE);
        List<ObjectClass> sups = new ArrayList<ObjectClass>();
        for (String supName : oc.getSuperiors()) {
            ObjectClass sup = objectClasses.get(supName);
            if (sup == null) {
                unknownSuperior(oc, supName);
            } else {
                resolve(sup, state);
                sups.add(sup);
            }
        }
        oc.resolve(this, sups);
        state.put(oc, Boolean.TRUE);
    }

    private SchemaException cycle(String key, SchemaElement element) {
        String message = MessageFormat.format(L10N.getString(key), element.getName());
        return new SchemaException(message, element.getDefinition());
    }

    private void unknownSuperior(SchemaElement element, String supName) {
        if (LOGGER.isLoggable(Level.WARNING)) {
            String message = L10N.getString("warn.unknown_superior");
            LOGGER.warning(MessageFormat.format(message, element.getName(), supName));
        }
    }

    // -- Lookup --

    /**
     * Returns the objectClass with the given name or OID.
     *
     * @param name the name or OID, case-insensitive
     * @return the objectClass, or null
     */
    public ObjectClass getObjectClass(String name) {
        return objectClasses.get(name);
    }

    /**
     * Returns the attributeType with the given name or OID.
     *
     * @param name the name or OID, case-insensitive; attribute options
     * such as {@code ;lang-en} are ignored
     * @return the attributeType, or null
     */
    public AttributeType getAttributeType(String name) {
        if (name == null) {
            return null;
        }
        int semi = name.indexOf(';');
        return attributeTypes.get(semi > 0 ? name.substring(0, semi) : name);
    }

    public LDAPSyntax getLDAPSyntax(String oid) {
        return ldapSyntaxes.get(oid);
    }

    public MatchingRule getMatchingRule(String name) {
        return matchingRules.get(name);
    }

    public MatchingRuleUse getMatchingRuleUse(String name) {
        return matchingRuleUses.get(name);
    }

    /**
     * Returns every objectClass in definition order.
     *
     * @return unmodifiable collection
     */
    public Collection<ObjectClass> getObjectClasses() {
        return objectClasses.values();
    }

    /**
     * Returns every attributeType in definition order.
     *
     * @return unmodifiable collection
     */
    public Collection<AttributeType> getAttributeTypes() {
        return attributeTypes.values();
    }

    public Collection<LDAPSyntax> getLDAPSyntaxes() {
        return ldapSyntaxes.values();
    }

    public Collection<MatchingRule> getMatchingRules() {
        return matchingRules.values();
    }

    public Collection<MatchingRuleUse> getMatchingRuleUses() {
        return matchingRuleUses.values();
    }

    @Override
    public String toString() {
        return "Schema[" + objectClasses.size() + " objectClasses, "
                + attributeTypes.size() + " attributeTypes, "
                + ldapSyntaxes.size() + " ldapSyntaxes, "
                + matchingRules.size() + " matchingRules, "
                + matchingRuleUses.size() + " matchingRuleUse]";
    }

    /**
     * Elements in definition order, indexed by lower-cased OID and names.
     */
    private static final class Index<T extends SchemaElement> {

        private final Map<String, T> byOID = new LinkedHashMap<String, T>();
        private final Map<String, T> byName = new LinkedHashMap<String, T>();

        void add(T element) {
            T previous = byOID.put(element.getOID().toLowerCase(), element);
            if (previous != null) {
                if (LOGGER.isLoggable(Level.FINE)) {
                    LOGGER.fine("Redefinition of " + previous.getOID());
                }
                for (String name : previous.getNames()) {
                    byName.remove(name.toLowerCase(), previous);
                }
            }
            for (String name : element.getNames()) {
                byName.put(name.toLowerCase(), element);
            }
        }

        T get(String key) {
            if (key == null) {
                return null;
            }
            String k = key.toLowerCase();
            T element = byOID.get(k);
            return element != null ? element : byName.get(k);
        }

        Collection<T> values() {
            return Collections.unmodifiableCollection(byOID.values());
        }

        int size() {
            return byOID.size();
        }
    }
}
