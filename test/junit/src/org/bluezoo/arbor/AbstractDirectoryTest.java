/*
 * AbstractDirectoryTest.java
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

import java.util.List;

import org.bluezoo.arbor.schema.Schema;
import org.bluezoo.arbor.schema.SyntaxConverter;
import org.bluezoo.arbor.schema.SyntaxConverters;

/**
 * Unit tests for AbstractDirectory.
 */
public class AbstractDirectoryTest {

    private StubDirectory directory;

    @Before
    public void setUp() {
        directory = new StubDirectory();
    }

    @Test
    public void testBaseDN() {
        assertEquals("dc=acme,dc=com", directory.getBaseDN());
        directory.setBaseDN("dc=example,dc=org");
        assertEquals("dc=example,dc=org", directory.getBaseDN());
    }

    @Test(expected = InvalidDNException.class)
    public void testInvalidBaseDN() {
        new StubDirectory("acme");
    }

    // Test schema caching

    @Test
    public void testSchemaFetchedOnce() throws DirectoryException {
        Schema schema = directory.getSchema();
        assertNotNull(schema.getObjectClass("inetOrgPerson"));
        assertSame(schema, directory.getSchema());
        assertEquals(1, directory.getSchemaFetches());
    }

    @Test
    public void testResetSchema() throws DirectoryException {
        Schema first = directory.getSchema();
        directory.resetSchema();
        Schema second = directory.getSchema();
        assertNotSame(first, second);
        assertEquals(2, directory.getSchemaFetches());
    }

    // Test value conversion

    @Test
    public void testDefaultConverters() {
        assertEquals(Boolean.TRUE, directory.convertSyntaxValue(SyntaxConverters.BOOLEAN, "TRUE"));
        assertEquals("plain", directory.convertSyntaxValue(null, "plain"));
    }

    @Test
    public void testConvertersPerDirectory() {
        directory.registerSyntaxConverter(SyntaxConverters.BOOLEAN, new SyntaxConverter() {
            @Override
            public Object convert(String value) {
                return "TRUE".equals(value) ? "yes" : "no";
            }
        });
        assertEquals("yes", directory.convertSyntaxValue(SyntaxConverters.BOOLEAN, "TRUE"));
        assertEquals(Boolean.TRUE,
                new StubDirectory().convertSyntaxValue(SyntaxConverters.BOOLEAN, "TRUE"));
    }

    // Test controls

    @Test
    public void testRegisteredControlsSnapshot() {
        List<SearchControl> before = directory.getRegisteredControls();
        directory.registerControl(new ManageDsaITControl(false));
        assertTrue(before.isEmpty());
        assertEquals(1, directory.getRegisteredControls().size());
    }
}
