/*
 * ModelConfigurationParser.java
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

import java.io.BufferedInputStream;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.text.MessageFormat;
import java.util.logging.Level;
import java.util.logging.Logger;

import javax.xml.parsers.ParserConfigurationException;
import javax.xml.parsers.SAXParser;
import javax.xml.parsers.SAXParserFactory;

import org.bluezoo.arbor.Directory;
import org.xml.sax.Attributes;
import org.xml.sax.InputSource;
import org.xml.sax.Locator;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;
import org.xml.sax.helpers.DefaultHandler;

/**
 * SAX-based parser for model descriptions.
 *
 * <p>A description names the model, optionally its base DN, and the
 * capabilities registered with it:
 * <pre>
 * &lt;model name="acme" base="dc=acme,dc=com"&gt;
 *   &lt;capability name="person" class="com.example.PersonCapability"&gt;
 *     &lt;objectClass&gt;inetOrgPerson&lt;/objectClass&gt;
 *     &lt;base&gt;ou=people,dc=acme,dc=com&lt;/base&gt;
 *   &lt;/capability&gt;
 * &lt;/model&gt;
 * </pre>
 * The {@code class} attribute names a {@link Capability} subclass with a
 * public no-argument constructor; without it a plain {@link Capability}
 * is created. The objectClasses and bases listed are added to any the
 * class declares itself. Unknown elements are logged and ignored.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class ModelConfigurationParser extends DefaultHandler {

    private static final Logger LOGGER = Logger.getLogger(ModelConfigurationParser.class.getName());

    private Directory directory;
    private Locator locator;
    private Model model;
    private Capability capability;
    private StringBuilder textContent = new StringBuilder();

    /**
     * Parses a model description file.
     *
     * @param file the file
     * @param directory the directory the model views
     * @return the model, with its capabilities registered
     * @throws ModelException if the description is malformed
     * @throws IOException if the file cannot be read
     */
    public Model parse(File file, Directory directory) throws ModelException, IOException {
        InputStream in = new BufferedInputStream(new FileInputStream(file));
        try {
            InputSource source = new InputSource(in);
            source.setSystemId(file.toURI().toString());
            return parse(source, directory);
        } finally {
            in.close();
        }
    }

    /**
     * Parses a model description from a stream.
     *
     * @param in the stream, which is not closed
     * @param directory the directory the model views
     * @return the model, with its capabilities registered
     * @throws ModelException if the description is malformed
     * @throws IOException if the stream cannot be read
     */
    public Model parse(InputStream in, Directory directory) throws ModelException, IOException {
        return parse(new InputSource(in), directory);
    }

    /**
     * Parses a model description.
     *
     * @param source the input source
     * @param directory the directory the model views
     * @return the model, with its capabilities registered
     * @throws ModelException if the description is malformed
     * @throws IOException if the source cannot be read
     */
    public Model parse(InputSource source, Directory directory) throws ModelException, IOException {
        this.directory = directory;
        this.model = null;
        this.capability = null;
        try {
            SAXParserFactory factory = SAXParserFactory.newInstance();
            factory.setNamespaceAware(true);
            SAXParser parser = factory.newSAXParser();
            parser.parse(source, this);
        } catch (SAXException e) {
            Exception cause = e.getException() != null ? e.getException() : e;
            String systemId = source.getSystemId() != null ? source.getSystemId() : "";
            String message = MessageFormat.format(Model.L10N.getString("err.parse_model"), systemId);
            throw new ModelException(message + ": " + e.getMessage(), cause);
        } catch (ParserConfigurationException e) {
            throw new ModelException(e.getMessage(), e);
        }
        if (model == null) {
            throw new ModelException(MessageFormat.format(
                    Model.L10N.getString("err.missing_attribute"), "model", "name", "?"));
        }
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("Parsed model " + model.getName() + " ("
                    + model.getCapabilities().size() + " capabilities)");
        }
        return model;
    }

    @Override
    public void setDocumentLocator(Locator locator) {
        this.locator = locator;
    }

    @Override
    public void startElement(String uri, String localName, String qName,
            Attributes atts) throws SAXException {
        String name = localName != null && !localName.isEmpty() ? localName : qName;
        textContent.setLength(0);
        if ("model".equals(name)) {
            startModel(atts);
        } else if ("capability".equals(name) && model != null) {
            startCapability(atts);
        } else if (("objectClass".equals(name) || "base".equals(name)) && capability != null) {
            // text content handled in endElement
        } else {
            if (LOGGER.isLoggable(Level.WARNING)) {
                String message = Model.L10N.getString("warn.unknown_element");
                LOGGER.warning(MessageFormat.format(message, name, getLineNumber()));
            }
        }
    }

    @Override
    public void characters(char[] ch, int start, int length) {
        textContent.append(ch, start, length);
    }

    @Override
    public void endElement(String uri, String localName, String qName)
            throws SAXException {
        String name = localName != null && !localName.isEmpty() ? localName : qName;
        String text = textContent.toString().trim();
        if ("capability".equals(name) && capability != null) {
            capability.setModel(model);
            capability = null;
        } else if ("objectClass".equals(name) && capability != null) {
            if (!text.isEmpty()) {
                capability.addObjectClasses(text);
            }
        } else if ("base".equals(name) && capability != null) {
            if (!text.isEmpty()) {
                try {
                    capability.addBases(text);
                } catch (IllegalArgumentException e) {
                    throw new SAXParseException(e.getMessage(), locator, e);
                }
            }
        }
        textContent.setLength(0);
    }

    private void startModel(Attributes atts) throws SAXException {
        String name = atts.getValue("name");
        if (name == null || name.isEmpty()) {
            throw missingAttribute("model", "name");
        }
        model = new Model(name, directory);
        String base = atts.getValue("base");
        if (base != null) {
            try {
                model.setBaseDN(base);
            } catch (IllegalArgumentException e) {
                throw new SAXParseException(e.getMessage(), locator, e);
            }
        }
    }

    private void startCapability(Attributes atts) throws SAXException {
        String className = atts.getValue("class");
        if (className == null) {
            capability = new Capability();
        } else {
            try {
                Class<?> clazz = Class.forName(className);
                capability = clazz.asSubclass(Capability.class).getDeclaredConstructor().newInstance();
            } catch (ReflectiveOperationException | ClassCastException e) {
                String message = Model.L10N.getString("err.capability_class");
                throw new SAXParseException(MessageFormat.format(message, className,
                        getLineNumber()), locator, e);
            }
        }
        String name = atts.getValue("name");
        if (name != null) {
            capability.setName(name);
        }
    }

    private SAXParseException missingAttribute(String element, String attribute) {
        String message = Model.L10N.getString("err.missing_attribute");
        return new SAXParseException(MessageFormat.format(message, element, attribute,
                getLineNumber()), locator);
    }

    private String getLineNumber() {
        return locator != null ? Integer.toString(locator.getLineNumber()) : "?";
    }
}
