/*
 * SchemaTest.java
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

import org.junit.Before;
import org.junit.Test;
import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.bluezoo.arbor.StubDirectory;

/**
 * Unit tests for Schema.
 */
public class SchemaTest {

    private static final String DIRECTORY_STRING = "1.3.6.1.4.1.1466.115.121.1.15";

    private Schema schema;

    @Before
    public void setUp() throws Exception {
        schema = Schema.parse(StubDirectory.loadSchemaDefinitions());
    }

    private static Map<String, List<String>> definitions(String key, String... values) {
        Map<String, List<String>> map = new LinkedHashMap<String, List<String>>();
        map.put(key, Arrays.asList(values));
        return map;
    }

    private static List<String> names(Collection<? extends SchemaElement> elements) {
        List<String> list = new ArrayList<String>();
        for (SchemaElement element : elements) {
            list.add(element.getName());
        }
        return list;
    }

    // Test lookup

    @Test
    public void testLookupByNameAndOID() {
        ObjectClass person = schema.getObjectClass("person");
        assertNotNull(person);
        assertSame(person, schema.getObjectClass("2.5.6.6"));
        assertSame(person, schema.getObjectClass("PERSON"));
        assertEquals("person", person.getName());
    }

    @Test
    public void testLookupByAlternateName() {
        AttributeType cn = schema.getAttributeType("commonName");
        assertNotNull(cn);
        assertSame(cn, schema.getAttributeType("CN"));
        assertEquals(Arrays.asList("cn", "commonName"), cn.getNames());
    }

    @Test
    public void testLookupIgnoresAttributeOptions() {
        assertSame(schema.getAttributeType("cn"), schema.getAttributeType("cn;lang-en"));
        assertSame(schema.getAttributeType("cn"), schema.getAttributeType("cn;binary;x"));
    }

    @Test
    public void testUnknownLookups() {
        assertNull(schema.getObjectClass("nonexistent"));
        assertNull(schema.getAttributeType("nonexistent"));
        assertNull(schema.getAttributeType(null));
        assertNull(schema.getLDAPSyntax("1.2.3.4"));
    }

    @Test
    public void testCollectionsInDefinitionOrder() {
        List<String> classes = names(schema.getObjectClasses());
        assertEquals(12, classes.size());
        assertEquals("top", classes.get(0));
        assertEquals("acmeAccount", classes.get(11));
        assertEquals(8, schema.getLDAPSyntaxes().size());
        assertEquals(3, schema.getMatchingRules().size());
        assertEquals(1, schema.getMatchingRuleUses().size());
    }

    // Test objectClasses

    @Test
    public void testKinds() {
        assertTrue(schema.getObjectClass("top").isAbstract());
        assertTrue(schema.getObjectClass("person").isStructural());
        assertTrue(schema.getObjectClass("posixAccount").isAuxiliary());
        assertEquals(ObjectClass.Kind.AUXILIARY, schema.getObjectClass("dcObject").getKind());
    }

    @Test
    public void testDefaultKindIsStructural() throws SchemaException {
        Schema s = Schema.parse(definitions("objectClasses", "( 1.2.3 NAME 'plain' )"));
        assertEquals(ObjectClass.Kind.STRUCTURAL, s.getObjectClass("plain").getKind());
    }

    @Test
    public void testEffectiveMust() {
        ObjectClass inetOrgPerson = schema.getObjectClass("inetOrgPerson");
        assertEquals(Arrays.asList("objectClass", "sn", "cn"),
                new ArrayList<String>(inetOrgPerson.getMust()));
        assertTrue(inetOrgPerson.getOwnMust().isEmpty());
    }

    @Test
    public void testEffectiveMayAncestorsFirst() {
        ObjectClass inetOrgPerson = schema.getObjectClass("inetOrgPerson");
        assertEquals(Arrays.asList("userPassword", "telephoneNumber", "description",
                "title", "l", "ou", "mail", "uid", "givenName", "displayName", "employeeNumber"),
                new ArrayList<String>(inetOrgPerson.getMay()));
        assertEquals(Arrays.asList("mail", "uid", "givenName", "displayName", "employeeNumber"),
                inetOrgPerson.getOwnMay());
    }

    @Test
    public void testAttributeTypesOfClass() {
        List<AttributeType> must = schema.getObjectClass("person").getMustAttributeTypes();
        assertEquals(3, must.size());
        assertSame(schema.getAttributeType("sn"), must.get(1));
        assertEquals(3, schema.getObjectClass("person").getMayAttributeTypes().size());
    }

    @Test
    public void testSuperiorsAndSubclassing() {
        ObjectClass inetOrgPerson = schema.getObjectClass("inetOrgPerson");
        assertEquals(Collections.singletonList("organizationalPerson"), inetOrgPerson.getSuperiors());
        assertSame(schema.getObjectClass("organizationalPerson"),
                inetOrgPerson.getSuperiorClasses().get(0));
        assertTrue(inetOrgPerson.isSubclassOf("person"));
        assertTrue(inetOrgPerson.isSubclassOf("top"));
        assertTrue(inetOrgPerson.isSubclassOf("2.5.6.6"));
        assertTrue(inetOrgPerson.isSubclassOf("inetorgperson"));
        assertFalse(inetOrgPerson.isSubclassOf("device"));
        assertFalse(schema.getObjectClass("person").isSubclassOf("inetOrgPerson"));
    }

    @Test
    public void testMultipleInheritance() throws SchemaException {
        Schema s = Schema.parse(definitions("objectClasses",
                "( 1.1 NAME 'a' ABSTRACT MUST x MAY p )",
                "( 1.2 NAME 'b' ABSTRACT MUST ( y $ x ) MAY q )",
                "( 1.3 NAME 'c' SUP ( a $ b ) MUST z )"));
        ObjectClass c = s.getObjectClass("c");
        assertEquals(2, c.getSuperiorClasses().size());
        assertEquals(Arrays.asList("x", "y", "z"), new ArrayList<String>(c.getMust()));
        assertEquals(Arrays.asList("p", "q"), new ArrayList<String>(c.getMay()));
        assertTrue(c.isSubclassOf("b"));
    }

    @Test
    public void testSuperiorDefinedLater() throws SchemaException {
        Schema s = Schema.parse(definitions("objectClasses",
                "( 1.2 NAME 'child' SUP parent MUST y )",
                "( 1.1 NAME 'parent' MUST x )"));
        assertEquals(Arrays.asList("x", "y"),
                new ArrayList<String>(s.getObjectClass("child").getMust()));
    }

    @Test
    public void testUnknownSuperiorTolerated() throws SchemaException {
        Schema s = Schema.parse(definitions("objectClasses",
                "( 1.2 NAME 'orphan' SUP missing MUST y )"));
        ObjectClass orphan = s.getObjectClass("orphan");
        assertEquals(Collections.singletonList("missing"), orphan.getSuperiors());
        assertTrue(orphan.getSuperiorClasses().isEmpty());
        assertEquals(Collections.singleton("y"), orphan.getMust());
    }

    @Test
    public void testObjectClassCycle() {
        try {
            Schema.parse(definitions("objectClasses",
                    "( 1.1 NAME 'a' SUP c )",
                    "( 1.2 NAME 'b' SUP a )",
                    "( 1.3 NAME 'c' SUP b )"));
            fail("Expected SchemaException");
        } catch (SchemaException e) {
            assertNotNull(e.getDefinition());
        }
    }

    @Test(expected = SchemaException.class)
    public void testSelfSuperior() throws SchemaException {
        Schema.parse(definitions("objectClasses", "( 1.1 NAME 'a' SUP a )"));
    }

    @Test
    public void testRedefinitionReplaces() throws SchemaException {
        Schema s = Schema.parse(definitions("objectClasses",
                "( 1.1 NAME 'a' MUST x )",
                "( 1.1 NAME 'a' MUST y )"));
        assertEquals(1, s.getObjectClasses().size());
        assertEquals(Collections.singleton("y"), s.getObjectClass("a").getMust());
    }

    @Test
    public void testRedefinitionDropsOldNames() throws SchemaException {
        Schema s = Schema.parse(definitions("objectClasses",
                "( 1.1 NAME 'base' MUST x )",
                "( 1.2 NAME ( 'old' 'kept' ) SUP base MUST y )",
                "( 1.2 NAME 'kept' SUP base MUST z )"));
        assertNull(s.getObjectClass("old"));
        ObjectClass kept = s.getObjectClass("kept");
        assertSame(kept, s.getObjectClass("1.2"));
        assertEquals(Arrays.asList("x", "z"), new ArrayList<String>(kept.getMust()));
    }

    // Test attributeTypes

    @Test
    public void testInheritedSyntaxAndMatchingRules() {
        AttributeType cn = schema.getAttributeType("cn");
        assertEquals("name", cn.getSuperior());
        assertSame(schema.getAttributeType("name"), cn.getSuperiorType());
        assertEquals(DIRECTORY_STRING, cn.getSyntaxOID());
        assertEquals("caseIgnoreMatch", cn.getEquality());
        assertEquals("caseIgnoreSubstringsMatch", cn.getSubstring());
        assertNull(cn.getOrdering());
    }

    @Test
    public void testSyntaxLength() {
        AttributeType name = schema.getAttributeType("name");
        assertEquals(DIRECTORY_STRING, name.getSyntaxOID());
        assertEquals(32768, name.getSyntaxLength());
        assertEquals(0, schema.getAttributeType("dc").getSyntaxLength());
    }

    @Test
    public void testFlags() {
        assertTrue(schema.getAttributeType("dc").isSingleValued());
        assertFalse(schema.getAttributeType("cn").isSingleValued());
        assertFalse(schema.getAttributeType("cn").isCollective());
        assertFalse(schema.getAttributeType("cn").isObsolete());
    }

    @Test
    public void testOperational() {
        AttributeType createTimestamp = schema.getAttributeType("createTimestamp");
        assertTrue(createTimestamp.isOperational());
        assertTrue(createTimestamp.isNoUserModification());
        assertEquals(AttributeType.Usage.DIRECTORY_OPERATION, createTimestamp.getUsage());

        AttributeType cn = schema.getAttributeType("cn");
        assertFalse(cn.isOperational());
        assertEquals(AttributeType.Usage.USER_APPLICATIONS, cn.getUsage());
    }

    @Test
    public void testDescriptionAndExtensions() {
        AttributeType enabled = schema.getAttributeType("acmeAccountEnabled");
        assertEquals("Whether the account may log in", enabled.getDescription());
        assertEquals(Collections.singletonList("acme"), enabled.getExtensions().get("X-ORIGIN"));
        assertTrue(enabled.getDefinition().startsWith("( 1.3.6.1.4.1.99999.1.1 "));
    }

    @Test(expected = SchemaException.class)
    public void testAttributeTypeCycle() throws SchemaException {
        Schema.parse(definitions("attributeTypes",
                "( 1.1 NAME 'a' SUP b )",
                "( 1.2 NAME 'b' SUP a )"));
    }

    // Test syntaxes and matching rules

    @Test
    public void testLDAPSyntax() {
        LDAPSyntax directoryString = schema.getLDAPSyntax(DIRECTORY_STRING);
        assertEquals("Directory String", directoryString.getName());
        assertTrue(directoryString.isHumanReadable());
        assertFalse(schema.getLDAPSyntax("1.3.6.1.4.1.1466.115.121.1.40").isHumanReadable());
    }

    @Test
    public void testMatchingRule() {
        MatchingRule rule = schema.getMatchingRule("caseIgnoreMatch");
        assertEquals("2.5.13.2", rule.getOID());
        assertEquals(DIRECTORY_STRING, rule.getSyntaxOID());
        assertSame(rule, schema.getMatchingRule("2.5.13.2"));
    }

    @Test
    public void testMatchingRuleUse() {
        MatchingRuleUse use = schema.getMatchingRuleUse("integerMatch");
        assertEquals(Arrays.asList("uidNumber", "employeeNumber"), use.getAppliesTo());
    }

    // Test input handling

    @Test
    public void testKeysCaseInsensitive() throws SchemaException {
        Schema s = Schema.parse(definitions("OBJECTCLASSES", "( 1.1 NAME 'a' )"));
        assertNotNull(s.getObjectClass("a"));
    }

    @Test
    public void testUnknownKeysIgnored() throws SchemaException {
        Map<String, List<String>> map = definitions("ditContentRules", "( 1.1 NAME 'x' )");
        map.put("cn", Collections.singletonList("schema"));
        Schema s = Schema.parse(map);
        assertTrue(s.getObjectClasses().isEmpty());
        assertTrue(s.getAttributeTypes().isEmpty());
    }

    @Test
    public void testEmptySchema() throws SchemaException {
        Schema s = Schema.parse(new LinkedHashMap<String, List<String>>());
        assertTrue(s.getObjectClasses().isEmpty());
    }

    @Test(expected = SchemaException.class)
    public void testMalformedDefinition() throws SchemaException {
        Schema.parse(definitions("attributeTypes", "2.5.4.3 NAME 'cn'"));
    }
}
