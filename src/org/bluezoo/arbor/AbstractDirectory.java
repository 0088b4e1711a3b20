/*
 * AbstractDirectory.java
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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.bluezoo.arbor.schema.Schema;
import org.bluezoo.arbor.schema.SchemaException;
import org.bluezoo.arbor.schema.SyntaxConverter;
import org.bluezoo.arbor.schema.SyntaxConverters;

/**
 * Base class for {@link Directory} implementations.
 *
 * <p>Subclasses supply the protocol operations and the raw schema dump;
 * this class parses the schema once and caches it, decodes attribute
 * values through a {@link SyntaxConverters} table, and keeps the list of
 * registered search controls.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public abstract class AbstractDirectory implements Directory {

    private static final Logger LOGGER = Logger.getLogger(AbstractDirectory.class.getName());

    private String baseDN;
    private final SyntaxConverters syntaxConverters = new SyntaxConverters();
    private final List<SearchControl> controls = new ArrayList<SearchControl>();
    private Schema schema;

    /**
     * Creates a directory rooted at the given base DN.
     *
     * @param baseDN the default search base
     * @throws InvalidDNException if the base DN is not valid
     */
    protected AbstractDirectory(String baseDN) {
        this.baseDN = DN.validate(baseDN);
    }

    @Override
    public String getBaseDN() {
        return baseDN;
    }

    /**
     * Sets the default search base.
     *
     * @param baseDN the base DN
     * @throws InvalidDNException if the base DN is not valid
     */
    public void setBaseDN(String baseDN) {
        this.baseDN = DN.validate(baseDN);
    }

    /**
     * Fetches the raw schema definitions from the directory.
     *
     * <p>The returned map is keyed by the subschema attribute names
     * ({@code objectClasses}, {@code attributeTypes}, {@code ldapSyntaxes},
     * {@code matchingRules}, {@code matchingRuleUse}).
     *
     * @return the raw schema dump
     * @throws DirectoryException if the schema cannot be fetched
     */
    protected abstract Map<String, List<String>> fetchSchemaDefinitions()
            throws DirectoryException;

    @Override
    public synchronized Schema getSchema() throws DirectoryException {
        if (schema == null) {
            Map<String, List<String>> definitions = fetchSchemaDefinitions();
            try {
                schema = Schema.parse(definitions);
            } catch (SchemaException e) {
                throw new DirectoryException(e.getMessage(), e);
            }
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine("Loaded schema for " + baseDN + ": " + schema);
            }
        }
        return schema;
    }

    /**
     * Discards the cached schema so that it is fetched again on next use.
     */
    public synchronized void resetSchema() {
        schema = null;
    }

    /**
     * Registers a converter for the given attribute syntax.
     *
     * @param syntaxOID the syntax OID
     * @param converter the converter
     */
    public void registerSyntaxConverter(String syntaxOID, SyntaxConverter converter) {
        syntaxConverters.register(syntaxOID, converter);
    }

    @Override
    public Object convertSyntaxValue(String syntaxOID, String value) {
        return syntaxConverters.convert(syntaxOID, value);
    }

    /**
     * Registers a search control contributed to every branchset created
     * against this directory from now on.
     *
     * @param control the control
     */
    public void registerControl(SearchControl control) {
        controls.add(control);
    }

    @Override
    public List<SearchControl> getRegisteredControls() {
        return Collections.unmodifiableList(new ArrayList<SearchControl>(controls));
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + baseDN + "]";
    }
}
