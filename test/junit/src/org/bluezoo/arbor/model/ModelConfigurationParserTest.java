/*
 * ModelConfigurationParserTest.java
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

import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.bluezoo.arbor.StubDirectory;

/**
 * Unit tests for ModelConfigurationParser.
 */
public class ModelConfigurationParserTest {

    private static final String RESOURCE = "/org/bluezoo/arbor/model/acme-model.xml";

    private StubDirectory directory;
    private ModelConfigurationParser parser;

    @Before
    public void setUp() {
        directory = new StubDirectory("dc=example,dc=org");
        parser = new ModelConfigurationParser();
    }

    private Model parse(String xml) throws Exception {
        InputStream in = new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8));
        return parser.parse(in, directory);
    }

    // Test a complete configuration

    @Test
    public void testParseResource() throws Exception {
        InputStream in = getClass().getResourceAsStream(RESOURCE);
        assertNotNull(in);
        Model model;
        try {
            model = parser.parse(in, directory);
        } finally {
            in.close();
        }

        assertEquals("acme", model.getName());
        assertSame(directory, model.getDirectory());
        assertEquals("dc=acme,dc=com", model.getBaseDN());

        List<Capability> capabilities = model.getCapabilities();
        assertEquals(3, capabilities.size());
        assertEquals("person", capabilities.get(0).getName());
        assertEquals("phone", capabilities.get(1).getName());
        assertEquals("host", capabilities.get(2).getName());
        for (Capability capability : capabilities) {
            assertSame(model, capability.getModel());
        }
    }

    @Test
    public void testCapabilityCriteria() throws Exception {
        Model model = parser.parse(getClass().getResourceAsStream(RESOURCE), directory);

        Capability person = model.getCapability("person");
        assertEquals(Collections.singleton("inetOrgPerson"), person.getObjectClasses());
        assertTrue(person.getBases().isEmpty());

        Capability phone = model.getCapability("phone");
        assertEquals(Collections.singleton("device"), phone.getObjectClasses());
        assertEquals(Collections.singleton("ou=phones,dc=acme,dc=com"), phone.getBases());
    }

    @Test
    public void testCapabilityClass() throws Exception {
        Model model = parser.parse(getClass().getResourceAsStream(RESOURCE), directory);

        HostCapability host = model.getCapability(HostCapability.class);
        assertNotNull(host);
        assertSame(host, model.getCapability("host"));
        assertEquals(Collections.singleton("device"), host.getObjectClasses());
        assertEquals(Arrays.asList("ou=hosts,dc=acme,dc=com", "ou=subhosts,ou=hosts,dc=acme,dc=com"),
                Arrays.asList(host.getBases().toArray()));
        assertEquals(Collections.<Capability>singletonList(host),
                model.getRegistry().getCapabilitiesForDN("cn=web1,ou=hosts,dc=acme,dc=com"));
    }

    @Test
    public void testParseFile() throws Exception {
        File file = new File(getClass().getResource(RESOURCE).toURI());
        Model model = parser.parse(file, directory);
        assertEquals(3, model.getCapabilities().size());
    }

    @Test
    public void testParserReusable() throws Exception {
        Model first = parse("<model name='one'><capability name='a'>"
                + "<objectClass>person</objectClass></capability></model>");
        Model second = parse("<model name='two'/>");
        assertEquals(1, first.getCapabilities().size());
        assertEquals("two", second.getName());
        assertTrue(second.getCapabilities().isEmpty());
    }

    @Test
    public void testWithoutBaseUsesDirectoryBase() throws Exception {
        Model model = parse("<model name='plain'/>");
        assertEquals("dc=example,dc=org", model.getBaseDN());
    }

    @Test
    public void testUnknownElementsIgnored() throws Exception {
        Model model = parse("<model name='m'><capability name='a'>"
                + "<objectClass>person</objectClass><note>x</note></capability>"
                + "<comment/></model>");
        assertEquals(Collections.singleton("person"),
                model.getCapability("a").getObjectClasses());
    }

    // Test errors

    @Test
    public void testMissingModelName() throws Exception {
        try {
            parse("<model/>");
            fail("Expected ModelException");
        } catch (ModelException e) {
            assertTrue(e.getMessage().contains("name"));
        }
    }

    @Test(expected = ModelException.class)
    public void testNoModelElement() throws Exception {
        parse("<capabilities/>");
    }

    @Test
    public void testCapabilityClassNotFound() throws Exception {
        try {
            parse("<model name='m'><capability class='org.bluezoo.arbor.model.Missing'/></model>");
            fail("Expected ModelException");
        } catch (ModelException e) {
            assertTrue(e.getCause() instanceof ClassNotFoundException);
        }
    }

    @Test
    public void testCapabilityClassWrongType() throws Exception {
        try {
            parse("<model name='m'><capability class='java.lang.String'/></model>");
            fail("Expected ModelException");
        } catch (ModelException e) {
            assertTrue(e.getCause() instanceof ClassCastException);
        }
    }

    @Test(expected = ModelException.class)
    public void testInvalidBase() throws Exception {
        parse("<model name='m'><capability><base>not a dn</base></capability></model>");
    }

    @Test(expected = ModelException.class)
    public void testInvalidModelBase() throws Exception {
        parse("<model name='m' base='nonsense'/>");
    }

    @Test(expected = ModelException.class)
    public void testMalformedXML() throws Exception {
        parse("<model name='m'><capability>");
    }
}
