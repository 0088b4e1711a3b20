/*
 * Model.java
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

import java.util.List;
import java.util.ResourceBundle;

import org.bluezoo.arbor.BranchFactory;
import org.bluezoo.arbor.DN;
import org.bluezoo.arbor.Directory;
import org.bluezoo.arbor.SearchResultEntry;

/**
 * A named view of a directory together with the capabilities that apply
 * to its entries.
 *
 * <p>Each model owns its own {@link CapabilityRegistry}; a capability
 * belongs to at most one model at a time. Entries reached through a model
 * are {@link ModelObject}s, which know which capabilities apply to them.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class Model {

    static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.arbor.model.L10N");

    private final String name;
    private final Directory directory;
    private final CapabilityRegistry registry = new CapabilityRegistry();
    private final BranchFactory branchFactory;
    private String baseDN;

    /**
     * Creates a model over a directory.
     *
     * @param name the model name
     * @param directory the directory
     */
    public Model(String name, Directory directory) {
        if (directory == null) {
            throw new NullPointerException("directory");
        }
        this.name = name;
        this.directory = directory;
        this.branchFactory = new ModelObjectFactory();
    }

    public String getName() {
        return name;
    }

    public Directory getDirectory() {
        return directory;
    }

    public CapabilityRegistry getRegistry() {
        return registry;
    }

    /**
     * Returns the DN of the model's root entry.
     *
     * @return the configured base, or the directory's base DN
     */
    public String getBaseDN() {
        return baseDN != null ? baseDN : directory.getBaseDN();
    }

    /**
     * Sets the DN of the model's root entry.
     *
     * @param baseDN the base DN, or null to use the directory's
     */
    public void setBaseDN(String baseDN) {
        this.baseDN = baseDN == null ? null : DN.normalize(baseDN);
    }

    /**
     * Returns the factory that wraps entries of this model.
     *
     * @return the factory
     */
    public BranchFactory getBranchFactory() {
        return branchFactory;
    }

    /**
     * Returns the model's root entry.
     *
     * @return the base object
     */
    public ModelObject getBase() {
        return new ModelObject(directory, getBaseDN(), null, this);
    }

    /**
     * Returns the entry with the given DN.
     *
     * @param dn the DN
     * @return the model object
     */
    public ModelObject getObject(String dn) {
        return new ModelObject(directory, dn, null, this);
    }

    /**
     * Registers a capability with this model, moving it from any model it
     * was registered with.
     *
     * @param capability the capability
     */
    public void addCapability(Capability capability) {
        capability.setModel(this);
    }

    public List<Capability> getCapabilities() {
        return registry.getCapabilities();
    }

    /**
     * Returns the registered capability of the given type.
     *
     * @param type the capability class
     * @return the first registered instance, or null
     */
    public <T extends Capability> T getCapability(Class<T> type) {
        for (Capability capability : registry.getCapabilities()) {
            if (type.isInstance(capability)) {
                return type.cast(capability);
            }
        }
        return null;
    }

    /**
     * Returns the registered capability with the given name.
     *
     * @param name the capability name
     * @return the capability, or null
     */
    public Capability getCapability(String name) {
        for (Capability capability : registry.getCapabilities()) {
            if (capability.getName().equals(name)) {
                return capability;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return "Model[" + name + " @ " + directory + "]";
    }

    private final class ModelObjectFactory implements BranchFactory {

        @Override
        public ModelObject newBranch(Directory dir, String dn, SearchResultEntry entry) {
            return new ModelObject(dir, dn, entry, Model.this);
        }

        @Override
        public String toString() {
            return "ModelObjectFactory[" + name + "]";
        }
    }
}
