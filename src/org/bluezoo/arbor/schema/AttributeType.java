/*
 * AttributeType.java
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

/**
 * An attributeType definition.
 *
 * <p>The syntax and matching rules are inherited from the superior type
 * when not declared; the schema fills them in when it resolves the
 * inheritance chain.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class AttributeType extends SchemaElement {

    /**
     * Attribute usage as declared with the USAGE keyword.
     */
    public enum Usage {
        USER_APPLICATIONS("userApplications"),
        DIRECTORY_OPERATION("directoryOperation"),
        DISTRIBUTED_OPERATION("distributedOperation"),
        DSA_OPERATION("dSAOperation");

        private final String name;

        Usage(String name) {
            this.name = name;
        }

        public String getName() {
            return name;
        }

        static Usage forName(String name) {
            for (Usage usage : values()) {
                if (usage.name.equalsIgnoreCase(name)) {
                    return usage;
                }
            }
            return USER_APPLICATIONS;
        }
    }

    private final String superior;
    private final String declaredSyntax;
    private final int syntaxLength;
    private final boolean singleValued;
    private final boolean collective;
    private final boolean noUserModification;
    private final Usage usage;
    private final String declaredEquality;
    private final String declaredOrdering;
    private final String declaredSubstring;

    private String syntaxOID;
    private String equality;
    private String ordering;
    private String substring;
    private AttributeType superiorType;

    /**
     * Creates an attributeType from a parsed definition.
     *
     * @param definition the parsed definition
     */
    public AttributeType(SchemaDefinitionParser.Definition definition) {
        super(definition);
        this.superior = definition.getFirst("SUP");
        String syntax = definition.getFirst("SYNTAX");
        int length = 0;
        if (syntax != null) {
            int brace = syntax.indexOf('{');
            if (brace > 0 && syntax.endsWith("}")) {
                try {
                    length = Integer.parseInt(syntax.substring(brace + 1, syntax.length() - 1));
                } catch (NumberFormatException e) {
                    length = 0;
                }
                syntax = syntax.substring(0, brace);
            }
        }
        this.declaredSyntax = syntax;
        this.syntaxLength = length;
        this.singleValued = definition.has("SINGLE-VALUE");
        this.collective = definition.has("COLLECTIVE");
        this.noUserModification = definition.has("NO-USER-MODIFICATION");
        this.usage = Usage.forName(definition.getFirst("USAGE"));
        this.declaredEquality = definition.getFirst("EQUALITY");
        this.declaredOrdering = definition.getFirst("ORDERING");
        this.declaredSubstring = definition.getFirst("SUBSTR");
        this.syntaxOID = declaredSyntax;
        this.equality = declaredEquality;
        this.ordering = declaredOrdering;
        this.substring = declaredSubstring;
    }

    /**
     * Returns the name of the superior attributeType.
     *
     * @return the superior, or null
     */
    public String getSuperior() {
        return superior;
    }

    /**
     * Returns the resolved superior attributeType.
     *
     * @return the superior type, or null if none or unknown
     */
    public AttributeType getSuperiorType() {
        return superiorType;
    }

    /**
     * Returns the syntax OID, inherited from the superior if not declared.
     *
     * @return the numeric syntax OID, or null
     */
    public String getSyntaxOID() {
        return syntaxOID;
    }

    /**
     * Returns the suggested maximum length declared with the syntax.
     *
     * @return the length bound, or 0 if none
     */
    public int getSyntaxLength() {
        return syntaxLength;
    }

    /**
     * Returns whether the attribute may hold at most one value.
     *
     * @return true if SINGLE-VALUE
     */
    public boolean isSingleValued() {
        return singleValued;
    }

    public boolean isCollective() {
        return collective;
    }

    public boolean isNoUserModification() {
        return noUserModification;
    }

    /**
     * Returns whether this is an operational attribute.
     *
     * @return true unless the usage is userApplications
     */
    public boolean isOperational() {
        return usage != Usage.USER_APPLICATIONS;
    }

    public Usage getUsage() {
        return usage;
    }

    public String getEquality() {
        return equality;
    }

    public String getOrdering() {
        return ordering;
    }

    public String getSubstring() {
        return substring;
    }

    /**
     * Links this type to its superior and inherits what it does not declare.
     * Called by the schema in superior-first order.
     */
    void inherit(AttributeType sup) {
        this.superiorType = sup;
        if (declaredSyntax == null) {
            syntaxOID = sup.getSyntaxOID();
        }
        if (declaredEquality == null) {
            equality = sup.getEquality();
        }
        if (declaredOrdering == null) {
            ordering = sup.getOrdering();
        }
        if (declaredSubstring == null) {
            substring = sup.getSubstring();
        }
    }
}
