/*
 * CapabilityRegistryTest.java
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

package org.bluezoo.arbor.model;

import org.junit.Before;
import org.junit.Test;
import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Unit tests for CapabilityRegistry.
 */
public class CapabilityRegistryTest {

    private CapabilityRegistry registry;
    private Capability person;
    private Capability posix;
    private Capability people;
    private Capability peoplePosix;

    @Before
    public void setUp() {
        registry = new CapabilityRegistry();

        person = new Capability("person");
        person.addObjectClasses("inetOrgPerson");

        posix = new Capability("posix");
        posix.addObjectClasses("inetOrgPerson", "posixAccount");

        people = new Capability("people");
        people.addBases("ou=people, dc=acme, dc=com");

        peoplePosix = new Capability("peoplePosix");
        peoplePosix.addObjectClasses("posixAccount");
        peoplePosix.addBases("ou=people,dc=acme,dc=com");

        registry.register(person);
        registry.register(posix);
        registry.register(people);
        registry.register(peoplePosix);
    }

    // Test registration

    @Test
    public void testRegistrationOrder() {
        assertEquals(Arrays.asList(person, posix, people, peoplePosix), registry.getCapabilities());
        assertTrue(registry.isRegistered(people));
    }

    @Test
    public void testReregistrationKeepsSingleEntry() {
        registry.register(person);
        assertEquals(Arrays.asList(posix, people, peoplePosix, person), registry.getCapabilities());
        assertEquals(2, registry.getCapabilitiesForObjectClass("inetOrgPerson").size());
    }

    @Test
    public void testUnregister() {
        assertTrue(registry.unregister(posix));
        assertFalse(registry.unregister(posix));
        assertFalse(registry.isRegistered(posix));
        assertEquals(Collections.singleton(person),
                registry.getCapabilitiesForObjectClass("inetOrgPerson"));
        assertEquals(Collections.singleton(peoplePosix),
                registry.getCapabilitiesForObjectClass("posixAccount"));
    }

    // Test index lookups

    @Test
    public void testForObjectClass() {
        assertEquals(2, registry.getCapabilitiesForObjectClass("INETORGPERSON").size());
        assertTrue(registry.getCapabilitiesForObjectClass("device").isEmpty());
    }

    @Test
    public void testForBase() {
        assertEquals(2, registry.getCapabilitiesForBase("OU=People,DC=acme,DC=com").size());
        assertTrue(registry.getCapabilitiesForBase("dc=acme,dc=com").isEmpty());
    }

    @Test(expected = UnsupportedOperationException.class)
    public void testIndexSnapshotImmutable() {
        registry.getCapabilitiesForObjectClass("inetOrgPerson").clear();
    }

    // Test resolution

    @Test
    public void testForObjectClassesRequiresAllDeclared() {
        List<Capability> result = registry.getCapabilitiesForObjectClasses(
                Arrays.asList("top", "inetOrgPerson"));
        assertEquals(Collections.singletonList(person), result);

        result = registry.getCapabilitiesForObjectClasses(
                Arrays.asList("top", "posixAccount", "inetorgperson"));
        assertEquals(Arrays.asList(person, posix, peoplePosix), result);
    }

    @Test
    public void testForDNMatchesSuffix() {
        assertEquals(Arrays.asList(people, peoplePosix),
                registry.getCapabilitiesForDN("uid=jdoe, ou=people, dc=acme, dc=com"));
        assertEquals(Arrays.asList(people, peoplePosix),
                registry.getCapabilitiesForDN("ou=people,dc=acme,dc=com"));
        assertTrue(registry.getCapabilitiesForDN("ou=hosts,dc=acme,dc=com").isEmpty());
        assertTrue(registry.getCapabilitiesForDN("dc=com").isEmpty());
    }

    @Test
    public void testCombinedCriteria() {
        List<Capability> result = registry.getCapabilities(
                Arrays.asList("top", "inetOrgPerson", "posixAccount"),
                "uid=jdoe,ou=people,dc=acme,dc=com");
        assertEquals(Arrays.asList(person, posix, people, peoplePosix), result);
    }

    @Test
    public void testCombinedCriteriaOutsideBase() {
        List<Capability> result = registry.getCapabilities(
                Arrays.asList("inetOrgPerson", "posixAccount"),
                "uid=jdoe,ou=staff,dc=acme,dc=com");
        assertEquals(Arrays.asList(person, posix), result);
    }

    @Test
    public void testCombinedCriteriaMissingClass() {
        List<Capability> result = registry.getCapabilities(
                Collections.singletonList("inetOrgPerson"),
                "uid=jdoe,ou=people,dc=acme,dc=com");
        assertEquals(Arrays.asList(person, people), result);
    }

    @Test
    public void testCapabilityWithoutCriteriaNeverMatches() {
        Capability empty = new Capability("empty");
        registry.register(empty);
        assertFalse(registry.getCapabilities(Arrays.asList("inetOrgPerson"),
                "ou=people,dc=acme,dc=com").contains(empty));
        assertFalse(registry.getCapabilitiesForObjectClasses(
                Collections.<String>emptyList()).contains(empty));
    }
}
