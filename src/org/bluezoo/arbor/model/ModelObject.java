/*
 * ModelObject.java
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

import java.util.Collections;
import java.util.List;

import org.bluezoo.arbor.Branch;
import org.bluezoo.arbor.BranchFactory;
import org.bluezoo.arbor.Directory;
import org.bluezoo.arbor.DirectoryException;
import org.bluezoo.arbor.SearchResultEntry;
import org.bluezoo.arbor.filter.Filter;

/**
 * A {@link Branch} belonging to a {@link Model}, aware of the
 * capabilities that apply to it.
 *
 * <p>The applicable capabilities are resolved from the entry's
 * objectClasses and DN the first time they are asked for, and again after
 * any change that discards the cached entry.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class ModelObject extends Branch {

    private final Model model;
    private List<Capability> capabilities;

    /**
     * Creates a model object.
     *
     * @param directory the directory the entry lives in
     * @param dn the entry DN
     * @param entry the already fetched entry, or null
     * @param model the model
     */
    public ModelObject(Directory directory, String dn, SearchResultEntry entry, Model model) {
        super(directory, dn, entry);
        if (model == null) {
            throw new NullPointerException("model");
        }
        this.model = model;
    }

    public Model getModel() {
        return model;
    }

    @Override
    protected BranchFactory getBranchFactory() {
        return model.getBranchFactory();
    }

    /**
     * Returns the capabilities of the model that apply to this entry.
     * An entry that does not exist has none.
     *
     * @return the capabilities, in registration order
     * @throws DirectoryException if the entry cannot be fetched
     */
    public List<Capability> getCapabilities() throws DirectoryException {
        if (capabilities == null) {
            List<String> objectClasses = exists()
                    ? getEntry().getAttributeValues("objectClass")
                    : Collections.<String>emptyList();
            capabilities = Collections.unmodifiableList(
                    model.getRegistry().getCapabilities(objectClasses, getDN()));
        }
        return capabilities;
    }

    public boolean hasCapability(Capability capability) throws DirectoryException {
        return getCapabilities().contains(capability);
    }

    /**
     * Returns the applicable capability of the given type.
     *
     * @param type the capability class
     * @return the capability, or null if none of that type applies
     * @throws DirectoryException if the entry cannot be fetched
     */
    public <T extends Capability> T getCapability(Class<T> type) throws DirectoryException {
        for (Capability capability : getCapabilities()) {
            if (type.isInstance(capability)) {
                return type.cast(capability);
            }
        }
        return null;
    }

    @Override
    protected void clearCaches() {
        super.clearCaches();
        capabilities = null;
    }

    @Override
    protected void clearCache(String attribute) {
        super.clearCache(attribute);
        if (Filter.OBJECT_CLASS.equalsIgnoreCase(attribute)) {
            capabilities = null;
        }
    }
}
