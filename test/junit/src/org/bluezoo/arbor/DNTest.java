/*
 * DNTest.java
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
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Unit tests for DN.
 */
public class DNTest {

    // Test split

    @Test
    public void testSplit() {
        List<String> parts = DN.split("uid=jdoe, ou=people,dc=acme,dc=com");
        assertEquals(Arrays.asList("uid=jdoe", "ou=people", "dc=acme", "dc=com"), parts);
    }

    @Test
    public void testSplitRoot() {
        assertTrue(DN.split("").isEmpty());
    }

    @Test
    public void testSplitEscapedComma() {
        List<String> parts = DN.split("cn=Smith\\, John,dc=acme");
        assertEquals(2, parts.size());
        assertEquals("cn=Smith\\, John", parts.get(0));
    }

    @Test
    public void testSplitQuotedComma() {
        List<String> parts = DN.split("cn=\"Smith, John\",dc=acme");
        assertEquals(2, parts.size());
        assertEquals("cn=\"Smith, John\"", parts.get(0));
    }

    @Test
    public void testSplitLimit() {
        List<String> parts = DN.split("uid=jdoe, ou=people,dc=acme,dc=com", 2);
        assertEquals(Arrays.asList("uid=jdoe", "ou=people,dc=acme,dc=com"), parts);
    }

    @Test(expected = InvalidDNException.class)
    public void testSplitTrailingEscape() {
        DN.split("cn=a\\");
    }

    @Test(expected = InvalidDNException.class)
    public void testSplitUnterminatedQuote() {
        DN.split("cn=\"a,dc=com");
    }

    // Test RDNs

    @Test
    public void testParseMultiValuedRDN() {
        Map<String, List<String>> pairs = DN.parseRDN("cn=Ada Lovelace+uid=ada");
        assertEquals(2, pairs.size());
        Iterator<Map.Entry<String, List<String>>> i = pairs.entrySet().iterator();
        Map.Entry<String, List<String>> first = i.next();
        assertEquals("cn", first.getKey());
        assertEquals(Arrays.asList("Ada Lovelace"), first.getValue());
        assertEquals(Arrays.asList("ada"), pairs.get("uid"));
    }

    @Test
    public void testParseRDNRepeatedAttribute() {
        Map<String, List<String>> pairs = DN.parseRDN("cn=a + CN=b+uid=c");
        assertEquals(2, pairs.size());
        assertEquals(Arrays.asList("a", "b"), pairs.get("cn"));
        assertEquals(Arrays.asList("c"), pairs.get("uid"));
        assertEquals("cn=a+cn=b+uid=c", DN.normalizeRDN("cn=a + CN=b+uid=c"));
        assertEquals("cn=a+cn=b,dc=acme,dc=com", DN.normalize("cn=a+cn=b, dc=acme,dc=com"));
    }

    @Test
    public void testParseRDNEscapedPlus() {
        Map<String, List<String>> pairs = DN.parseRDN("cn=a\\+b");
        assertEquals(1, pairs.size());
        assertEquals(Arrays.asList("a\\+b"), pairs.get("cn"));
    }

    @Test(expected = InvalidDNException.class)
    public void testParseRDNWithoutEquals() {
        DN.parseRDN("jdoe");
    }

    @Test
    public void testNormalize() {
        assertEquals("uid=jdoe,ou=people,dc=acme",
                DN.normalize(" uid = jdoe , ou=people,  dc=acme"));
        assertEquals("cn=a+uid=b", DN.normalizeRDN("cn = a + uid = b"));
    }

    @Test
    public void testGetRDNAndParent() {
        assertEquals("uid=jdoe", DN.getRDN("uid=jdoe,ou=people,dc=acme"));
        assertEquals("ou=people,dc=acme", DN.getParent("uid=jdoe,ou=people,dc=acme"));
        assertEquals("", DN.getParent("dc=com"));
        assertEquals("", DN.getRDN(""));
        assertEquals("", DN.getParent(""));
    }

    // Test validity

    @Test
    public void testIsValid() {
        assertTrue(DN.isValid(""));
        assertTrue(DN.isValid("dc=acme,dc=com"));
        assertTrue(DN.isValid("2.5.4.3=Ada,dc=com"));
        assertFalse(DN.isValid("not a dn"));
        assertFalse(DN.isValid("=x,dc=com"));
        assertFalse(DN.isValid(null));
    }

    @Test(expected = InvalidDNException.class)
    public void testValidateNull() {
        DN.validate(null);
    }

    @Test
    public void testInvalidDNExceptionCarriesDN() {
        try {
            DN.validate("uid");
            fail("Expected InvalidDNException");
        } catch (InvalidDNException e) {
            assertEquals("uid", e.getDN());
            assertTrue(e.getMessage().contains("uid"));
        }
    }

    // Test hierarchy

    @Test
    public void testIsDescendantOrSelf() {
        assertTrue(DN.isDescendantOrSelf("uid=x,ou=people,dc=ACME,dc=com", "dc=acme, dc=com"));
        assertTrue(DN.isDescendantOrSelf("dc=acme,dc=com", "dc=acme,dc=com"));
        assertTrue(DN.isDescendantOrSelf("dc=acme,dc=com", ""));
        assertFalse(DN.isDescendantOrSelf("dc=acme,dc=com", "ou=people,dc=acme,dc=com"));
        assertFalse(DN.isDescendantOrSelf("uid=x,ou=hosts,dc=acme,dc=com", "ou=people,dc=acme,dc=com"));
    }

    // Test escaping

    @Test
    public void testEscapeValue() {
        assertEquals("Smith\\, John", DN.escapeValue("Smith, John"));
        assertEquals("a\\+b\\=c", DN.escapeValue("a+b=c"));
        assertEquals("\\#1", DN.escapeValue("#1"));
        assertEquals("a#1", DN.escapeValue("a#1"));
        assertEquals("\\ x\\ ", DN.escapeValue(" x "));
        assertEquals("plain", DN.escapeValue("plain"));
    }
}
