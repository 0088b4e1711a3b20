/*
 * BranchTest.java
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

import org.junit.Before;
import org.junit.Test;
import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.bluezoo.arbor.schema.ObjectClass;
import org.bluezoo.arbor.schema.SyntaxConverter;

/**
 * Unit tests for Branch.
 */
public class BranchTest {

    private static final String JDOE = "uid=jdoe,ou=people,dc=acme,dc=com";

    private StubDirectory directory;
    private Branch people;
    private Branch jdoe;

    @Before
    public void setUp() {
        directory = StubDirectory.createAcme();
        people = new Branch(directory, "ou=people,dc=acme,dc=com");
        jdoe = new Branch(directory, JDOE);
    }

    // Test construction

    @Test(expected = InvalidDNException.class)
    public void testInvalidDN() {
        new Branch(directory, "not a dn");
    }

    @Test(expected = NullPointerException.class)
    public void testNullDirectory() {
        new Branch(null, JDOE);
    }

    @Test
    public void testConstructionDoesNotFetch() {
        new Branch(directory, "uid=nobody,ou=people,dc=acme,dc=com");
        assertEquals(0, directory.getEntryFetches());
    }

    // Test DN navigation

    @Test
    public void testDNAccessors() {
        assertEquals(JDOE, jdoe.getDN());
        assertEquals("uid=jdoe", jdoe.getRDN());
        assertEquals("ou=people,dc=acme,dc=com", jdoe.getParentDN());
        assertEquals(Collections.singletonMap("uid", Arrays.asList("jdoe")), jdoe.getRDNAttributes());
        assertEquals(Arrays.asList("uid=jdoe", "ou=people", "dc=acme", "dc=com"), jdoe.splitDN());
        assertEquals(Arrays.asList("uid=jdoe", "ou=people,dc=acme,dc=com"), jdoe.splitDN(2));
    }

    @Test
    public void testGetParent() {
        Branch parent = jdoe.getParent();
        assertEquals(people, parent);
        assertSame(directory, parent.getDirectory());

        Branch top = new Branch(directory, "dc=com").getParent();
        assertEquals("", top.getDN());
        assertNull(top.getParent());
    }

    @Test
    public void testSetRDN() {
        jdoe.setRDN("uid=john");
        assertEquals("uid=john,ou=people,dc=acme,dc=com", jdoe.getDN());
    }

    @Test
    public void testGetChildren() throws DirectoryException {
        List<Branch> children = people.getChildren();
        assertEquals(2, children.size());
        assertEquals(jdoe, children.get(0));
        assertEquals(SearchScope.ONE, directory.getLastSearch().getScope());
        assertEquals("ou=people,dc=acme,dc=com", directory.getLastSearch().getBaseDN());
    }

    // Test child

    @Test
    public void testChild() throws DirectoryException {
        Branch child = people.child("uid", "bob");
        assertEquals("uid=bob,ou=people,dc=acme,dc=com", child.getDN());
        assertEquals(Branch.class, child.getClass());
    }

    @Test
    public void testChildEscapesValue() throws DirectoryException {
        Branch child = people.child("cn", "Smith, John");
        assertEquals("cn=Smith\\, John,ou=people,dc=acme,dc=com", child.getDN());
        assertEquals(Arrays.asList("Smith\\, John"), child.getRDNAttributes().get("cn"));
    }

    @Test
    public void testChildMultiValuedRDN() throws DirectoryException {
        Map<String, Object> more = new LinkedHashMap<String, Object>();
        more.put("uid", "ada");
        Branch child = people.child("cn", "Ada", more);
        assertEquals("cn=Ada+uid=ada,ou=people,dc=acme,dc=com", child.getDN());
    }

    @Test
    public void testChildOfRoot() throws DirectoryException {
        Branch child = new Branch(directory, "").child("dc", "com");
        assertEquals("dc=com", child.getDN());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testChildUnknownAttribute() throws DirectoryException {
        people.child("favouriteColour", "blue");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testChildMissingValue() throws DirectoryException {
        people.child("uid", null);
    }

    @Test
    public void testChildMultipleValues() throws DirectoryException {
        try {
            people.child("uid", Arrays.asList("bob", "robert"));
            fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().contains("uid"));
        }
    }

    // Test entry access

    @Test
    public void testEntryFetchedOnce() throws DirectoryException {
        SearchResultEntry entry = jdoe.getEntry();
        assertEquals("jdoe", entry.getAttributeValue("uid"));
        jdoe.getEntry();
        jdoe.get("cn");
        jdoe.get("mail");
        assertEquals(1, directory.getEntryFetches());
    }

    @Test(expected = NoSuchEntryException.class)
    public void testGetEntryMissing() throws DirectoryException {
        new Branch(directory, "uid=nobody,ou=people,dc=acme,dc=com").getEntry();
    }

    @Test
    public void testExists() throws DirectoryException {
        assertTrue(jdoe.exists());
        assertFalse(new Branch(directory, "uid=nobody,ou=people,dc=acme,dc=com").exists());
    }

    @Test
    public void testExistsEmptyEntry() throws DirectoryException {
        String dn = "cn=empty,dc=acme,dc=com";
        SearchResultEntry empty = new SearchResultEntry(dn,
                Collections.<String, List<String>>emptyMap());
        assertFalse(new Branch(directory, dn, empty).exists());
    }

    @Test
    public void testExistsNoSuchObjectResult() throws DirectoryException {
        StubDirectory failing = new StubDirectory() {
            @Override
            public SearchResultEntry getEntry(String dn) throws DirectoryException {
                throw new DirectoryException(ResultCode.NO_SUCH_OBJECT, dn);
            }
        };
        assertFalse(new Branch(failing, JDOE).exists());
    }

    @Test
    public void testExistsPropagatesOtherFailures() {
        StubDirectory failing = new StubDirectory() {
            @Override
            public SearchResultEntry getEntry(String dn) throws DirectoryException {
                throw new DirectoryException(ResultCode.BUSY, "busy");
            }
        };
        try {
            new Branch(failing, JDOE).exists();
            fail("Expected DirectoryException");
        } catch (DirectoryException e) {
            assertEquals(ResultCode.BUSY, e.getResultCode());
        }
    }

    // Test attribute decoding

    @Test
    public void testGetMultiValued() throws DirectoryException {
        assertEquals(Arrays.asList("John Doe", "Johnny"), jdoe.get("cn"));
        assertEquals(Arrays.asList("John Doe", "Johnny"), jdoe.get("CN"));
    }

    @Test
    public void testGetSingleValued() throws DirectoryException {
        assertEquals("John Doe", jdoe.get("displayName"));
    }

    @Test
    public void testGetConvertsSyntax() throws DirectoryException {
        assertEquals(Long.valueOf(1001), jdoe.get("uidNumber"));
        assertEquals(Boolean.TRUE, jdoe.get("acmeAccountEnabled"));
    }

    @Test
    public void testGetCustomConverter() throws DirectoryException {
        directory.registerSyntaxConverter("1.3.6.1.4.1.1466.115.121.1.26",
                new SyntaxConverter() {
                    @Override
                    public Object convert(String value) {
                        return value.toUpperCase();
                    }
                });
        assertEquals(Collections.singletonList("JDOE@ACME.COM"), jdoe.get("mail"));
    }

    @Test
    public void testGetAbsentAttribute() throws DirectoryException {
        assertNull(jdoe.get("title"));
    }

    @Test
    public void testGetUnknownAttribute() throws DirectoryException {
        assertNull(jdoe.get("favouriteColour"));
    }

    @Test(expected = UnsupportedOperationException.class)
    public void testGetReturnsUnmodifiableList() throws DirectoryException {
        @SuppressWarnings("unchecked")
        List<Object> values = (List<Object>) jdoe.get("cn");
        values.add("Jack");
    }

    @Test
    public void testOperationalAttributes() throws DirectoryException {
        assertNull(jdoe.get("createTimestamp"));
        jdoe.setIncludeOperationalAttributes(true);
        assertTrue(jdoe.isIncludeOperationalAttributes());
        Object created = jdoe.get("createTimestamp");
        assertTrue(created instanceof Date);
        assertEquals(1736847000000L, ((Date) created).getTime());
    }

    @Test
    public void testSchemaFetchedOnce() throws DirectoryException {
        jdoe.get("cn");
        people.get("ou");
        new Branch(directory, "dc=acme,dc=com").get("o");
        assertEquals(1, directory.getSchemaFetches());
    }

    // Test writes

    @Test
    public void testSet() throws DirectoryException {
        assertEquals(Collections.singletonList("jdoe@acme.com"), jdoe.get("mail"));
        jdoe.set("mail", "john@acme.com");

        List<Modification> mods = directory.getLastModifications();
        assertEquals(1, mods.size());
        assertEquals(Modification.Operation.REPLACE, mods.get(0).getOperation());
        assertEquals(Collections.singletonList("john@acme.com"), mods.get(0).getValues());
        assertEquals(Collections.singletonList("john@acme.com"), jdoe.get("mail"));
        assertEquals(1, directory.getEntryFetches());
        assertEquals("john@acme.com", directory.lookup(JDOE).getAttributeValue("mail"));
    }

    @Test
    public void testSetFailureKeepsCache() throws DirectoryException {
        Object before = jdoe.get("mail");
        directory.failNext(new DirectoryException(ResultCode.INSUFFICIENT_ACCESS_RIGHTS, "denied"));
        try {
            jdoe.set("mail", "john@acme.com");
            fail("Expected DirectoryException");
        } catch (DirectoryException e) {
            assertEquals(ResultCode.INSUFFICIENT_ACCESS_RIGHTS, e.getResultCode());
        }
        assertSame(before, jdoe.get("mail"));
    }

    @Test
    public void testSetBoolean() throws DirectoryException {
        jdoe.set("acmeAccountEnabled", Boolean.FALSE);
        assertEquals("FALSE", directory.lookup(JDOE).getAttributeValue("acmeAccountEnabled"));
        assertEquals(Boolean.FALSE, jdoe.get("acmeAccountEnabled"));
    }

    @Test
    public void testMergeClearsCaches() throws DirectoryException {
        jdoe.get("cn");
        Map<String, Object> attrs = new LinkedHashMap<String, Object>();
        attrs.put("title", "Engineer");
        attrs.put("telephoneNumber", Arrays.asList("+1 555 0100", "+1 555 0101"));
        jdoe.merge(attrs);

        assertEquals(2, directory.getLastModifications().size());
        assertEquals(Arrays.asList("+1 555 0100", "+1 555 0101"), jdoe.get("telephoneNumber"));
        assertEquals(2, directory.getEntryFetches());
    }

    @Test
    public void testDeleteAttributes() throws DirectoryException {
        jdoe.delete("mail", "displayName");

        List<Modification> mods = directory.getLastModifications();
        assertEquals(2, mods.size());
        assertEquals(Modification.Operation.DELETE, mods.get(0).getOperation());
        assertTrue(mods.get(0).getValues().isEmpty());
        assertNull(jdoe.get("mail"));
        assertTrue(jdoe.exists());
    }

    @Test
    public void testDeleteValues() throws DirectoryException {
        Map<String, Object> values = new LinkedHashMap<String, Object>();
        values.put("cn", "Johnny");
        values.put("mail", null);
        jdoe.delete(values);

        assertEquals(Collections.singletonList("John Doe"), jdoe.get("cn"));
        assertNull(jdoe.get("mail"));
    }

    @Test
    public void testDeleteEntry() throws DirectoryException {
        assertTrue(jdoe.exists());
        jdoe.delete();
        assertFalse(directory.contains(JDOE));
        assertFalse(jdoe.exists());
    }

    @Test
    public void testDeleteNoAttributesDeletesEntry() throws DirectoryException {
        jdoe.delete(new String[0]);
        assertEquals("delete " + JDOE, directory.getOperations().get(0));
    }

    @Test
    public void testCreate() throws DirectoryException {
        Branch bob = people.child("uid", "bob");
        assertFalse(bob.exists());

        Map<String, Object> attrs = new LinkedHashMap<String, Object>();
        attrs.put("objectClass", Arrays.asList("top", "inetOrgPerson"));
        attrs.put("uid", "bob");
        attrs.put("cn", "Bob");
        attrs.put("sn", "Builder");
        bob.create(attrs);

        assertTrue(bob.exists());
        assertEquals(Arrays.asList("top", "inetOrgPerson"),
                directory.getLastAttributes().get("objectClass"));
    }

    @Test
    public void testCreateExisting() {
        try {
            jdoe.create(Collections.<String, Object>singletonMap("uid", "jdoe"));
            fail("Expected DirectoryException");
        } catch (DirectoryException e) {
            assertEquals(ResultCode.ENTRY_ALREADY_EXISTS, e.getResultCode());
        }
    }

    @Test
    public void testCopy() throws DirectoryException {
        Branch copy = jdoe.copy("uid=jdoe2,ou=people,dc=acme,dc=com",
                Collections.<String, Object>singletonMap("uid", "jdoe2"));

        assertEquals("uid=jdoe2,ou=people,dc=acme,dc=com", copy.getDN());
        assertEquals(JDOE, jdoe.getDN());
        assertEquals(Collections.singletonList("jdoe2"), copy.get("uid"));
        assertTrue(jdoe.exists());
    }

    @Test
    public void testMove() throws DirectoryException {
        jdoe.get("uid");
        jdoe.move("uid=john", Collections.<String, Object>singletonMap("uid", "john"));

        assertEquals("uid=john,ou=people,dc=acme,dc=com", jdoe.getDN());
        assertFalse(directory.contains(JDOE));
        assertEquals(Collections.singletonList("john"), jdoe.get("uid"));
    }

    @Test
    public void testMoveFailureKeepsDN() {
        directory.failNext(new DirectoryException(ResultCode.UNWILLING_TO_PERFORM, "no"));
        try {
            jdoe.move("uid=john", Collections.<String, Object>emptyMap());
            fail("Expected DirectoryException");
        } catch (DirectoryException e) {
            assertEquals(JDOE, jdoe.getDN());
        }
    }

    // Test schema helpers

    @Test
    public void testGetObjectClasses() throws DirectoryException {
        List<String> names = new ArrayList<String>();
        for (ObjectClass oc : jdoe.getObjectClasses()) {
            names.add(oc.getName());
        }
        assertEquals(Arrays.asList("top", "inetOrgPerson", "posixAccount", "acmeAccount"), names);
    }

    @Test
    public void testGetObjectClassesOfNewEntry() throws DirectoryException {
        Branch bob = people.child("uid", "bob");
        List<ObjectClass> classes = bob.getObjectClasses("person", "noSuchClass");
        assertEquals(1, classes.size());
        assertEquals("person", classes.get(0).getName());
    }

    @Test
    public void testGetMustOIDs() throws DirectoryException {
        assertEquals(Arrays.asList("objectClass", "sn", "cn", "uid", "uidNumber", "homeDirectory"),
                jdoe.getMustOIDs());
    }

    @Test
    public void testGetMayOIDsIncludesInherited() throws DirectoryException {
        List<String> may = jdoe.getMayOIDs();
        assertTrue(may.contains("userPassword"));
        assertTrue(may.contains("title"));
        assertTrue(may.contains("displayName"));
        assertTrue(may.contains("acmeAccountEnabled"));
        assertFalse(may.contains("ipHostNumber"));
    }

    @Test
    public void testIsValidAttribute() throws DirectoryException {
        assertTrue(jdoe.isValidAttribute("mail"));
        assertTrue(jdoe.isValidAttribute("MAIL"));
        assertTrue(jdoe.isValidAttribute("commonName"));
        assertFalse(jdoe.isValidAttribute("ipHostNumber"));
    }

    @Test
    public void testAttributeSkeletons() throws DirectoryException {
        Branch bob = people.child("uid", "bob");
        Map<String, Object> must = bob.getMustAttributes("person");
        assertEquals(Arrays.asList("objectClass", "sn", "cn"), new ArrayList<String>(must.keySet()));
        assertEquals(Collections.emptyList(), must.get("sn"));

        Map<String, Object> may = bob.getMayAttributes("inetOrgPerson");
        assertEquals("", may.get("displayName"));
        assertEquals(Collections.emptyList(), may.get("mail"));

        Map<String, Object> valid = bob.getValidAttributes("inetOrgPerson");
        assertTrue(valid.containsKey("sn"));
        assertTrue(valid.containsKey("displayName"));
    }

    // Test query delegation

    @Test
    public void testQueryDelegation() {
        assertEquals(new Branchset(people), people.getBranchset());
        assertEquals("(&(objectClass=*)(uid=jdoe))",
                people.filter("uid", "jdoe").getFilterString());
        assertEquals(SearchScope.BASE, people.scope(SearchScope.BASE).getSearchScope());
        assertEquals("one", people.scope("one").getScope());
        assertEquals(Collections.singletonList("cn"), people.select("cn").getSelect());
    }

    @Test
    public void testPlus() {
        Branch hosts = new Branch(directory, "ou=hosts,dc=acme,dc=com");
        BranchCollection collection = people.plus(hosts);
        assertEquals(Arrays.asList("ou=people,dc=acme,dc=com", "ou=hosts,dc=acme,dc=com"),
                collection.getBaseDNs());
    }

    // Test ordering and equality

    @Test
    public void testCompareAncestorFirst() {
        Branch base = new Branch(directory, "dc=acme,dc=com");
        assertTrue(base.compareTo(people) < 0);
        assertTrue(people.compareTo(jdoe) < 0);
        assertTrue(jdoe.compareTo(base) > 0);
        assertEquals(0, jdoe.compareTo(new Branch(directory, "UID=jdoe, ou=People,dc=acme,dc=com")));
    }

    @Test
    public void testSort() {
        Branch base = new Branch(directory, "dc=acme,dc=com");
        Branch hosts = new Branch(directory, "ou=hosts,dc=acme,dc=com");
        Branch asmith = new Branch(directory, "uid=asmith,ou=people,dc=acme,dc=com");
        List<Branch> branches = new ArrayList<Branch>(Arrays.asList(jdoe, people, asmith, hosts, base));
        Collections.sort(branches);
        assertEquals(Arrays.asList(base, hosts, people, asmith, jdoe), branches);
    }

    @Test(expected = ClassCastException.class)
    public void testCompareDifferentClasses() {
        Branch other = new Branch(directory, JDOE) {
        };
        jdoe.compareTo(other);
    }

    @Test
    public void testEquals() {
        Branch same = new Branch(directory, "UID=jdoe , ou=people,dc=acme,dc=com");
        assertEquals(jdoe, same);
        assertEquals(jdoe.hashCode(), same.hashCode());
        assertNotEquals(jdoe, people);
    }

    @Test
    public void testRepeatedRDNAttributeKeepsAllValues() {
        Branch both = new Branch(directory, "cn=a+cn=b,dc=acme,dc=com");
        Branch second = new Branch(directory, "cn=b,dc=acme,dc=com");
        assertNotEquals(both, second);
        assertTrue(both.compareTo(second) != 0);
        assertEquals(both, new Branch(directory, "CN=a + cn=b, dc=acme,dc=com"));
        assertEquals(Arrays.asList("a", "b"), both.getRDNAttributes().get("cn"));
    }

    @Test
    public void testToString() {
        assertTrue(jdoe.toString().contains(JDOE));
    }
}
