/*
 * SearchResultEntryTest.java
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

import org.junit.Test;
import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Unit tests for SearchResultEntry.
 */
public class SearchResultEntryTest {

    private static SearchResultEntry entry() {
        Map<String, List<String>> attributes = new LinkedHashMap<String, List<String>>();
        attributes.put("objectClass", Arrays.asList("top", "person"));
        attributes.put("cn", Arrays.asList("John Doe", "Johnny"));
        attributes.put("sn", Collections.singletonList("Doe"));
        return new SearchResultEntry("uid=jdoe,dc=acme,dc=com", attributes);
    }

    @Test
    public void testCaseInsensitiveLookup() {
        SearchResultEntry entry = entry();
        assertTrue(entry.hasAttribute("OBJECTCLASS"));
        assertFalse(entry.hasAttribute("mail"));
        assertEquals(Arrays.asList("John Doe", "Johnny"), entry.getAttributeValues("CN"));
        assertEquals("John Doe", entry.getAttributeValue("cn"));
        assertNull(entry.getAttributeValue("mail"));
        assertTrue(entry.getAttributeValues("mail").isEmpty());
    }

    @Test
    public void testNamesKeepFirstSpelling() {
        SearchResultEntry entry = entry();
        entry.setAttributeValues("SN", Collections.singletonList("Dough"));
        assertEquals(Arrays.asList("objectClass", "cn", "sn"),
                Arrays.asList(entry.getAttributeNames().toArray()));
        assertEquals("Dough", entry.getAttributeValue("sn"));
    }

    @Test
    public void testSetEmptyRemoves() {
        SearchResultEntry entry = entry();
        entry.setAttributeValues("cn", Collections.<String>emptyList());
        entry.setAttributeValues("sn", null);
        assertEquals(Collections.singleton("objectClass"), entry.getAttributeNames());
        entry.setAttributeValues("objectClass", null);
        assertTrue(entry.isEmpty());
    }

    @Test
    public void testToMapIsCopy() {
        SearchResultEntry entry = entry();
        Map<String, List<String>> map = entry.toMap();
        map.remove("cn");
        assertTrue(entry.hasAttribute("cn"));
        assertEquals(3, entry.toMap().size());
    }

    @Test(expected = UnsupportedOperationException.class)
    public void testValuesImmutable() {
        entry().getAttributeValues("cn").add("JD");
    }

    @Test
    public void testToString() {
        SearchResultEntry entry = new SearchResultEntry("ou=people,dc=acme,dc=com",
                Collections.singletonMap("ou", Collections.singletonList("people")));
        assertEquals("dn: ou=people,dc=acme,dc=com\nou: people\n", entry.toString());
    }
}
