/*
 * Capability.java
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

import java.text.MessageFormat;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.bluezoo.arbor.Branch;
import org.bluezoo.arbor.BranchCollection;
import org.bluezoo.arbor.BranchQuery;
import org.bluezoo.arbor.Branchset;
import org.bluezoo.arbor.DN;
import org.bluezoo.arbor.Directory;
import org.bluezoo.arbor.DirectoryException;
import org.bluezoo.arbor.Modification;
import org.bluezoo.arbor.filter.Filter;

/**
 * An optional behaviour that applies to the entries of a {@link Model}
 * selected by objectClass, by location, or both.
 *
 * <p>A capability declares the objectClasses an entry must all carry and
 * the base DNs it must lie beneath. Subclasses add the operations that
 * make sense for such entries and reach them through
 * {@link ModelObject#getCapability(Class)}:
 * <pre>{@code
 * public class PersonCapability extends Capability {
 *     public PersonCapability() {
 *         addObjectClasses("inetOrgPerson");
 *         addBases("ou=people,dc=acme,dc=com");
 *     }
 *
 *     public String getDisplayName(ModelObject person) throws DirectoryException {
 *         List<?> cn = (List<?>) person.get("cn");
 *         return cn == null ? person.getRDN() : (String) cn.get(0);
 *     }
 * }
 *
 * PersonCapability people = new PersonCapability();
 * people.setModel(model);
 * for (Branch person : people.search().all()) { ... }
 * }</pre>
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class Capability {

    private static final Logger LOGGER = Logger.getLogger(Capability.class.getName());

    private String name;
    private final Set<String> objectClasses = new LinkedHashSet<String>();
    private final Set<String> bases = new LinkedHashSet<String>();
    private Model model;

    /**
     * Creates a capability named after its class.
     */
    public Capability() {
        this.name = getClass().getSimpleName();
    }

    /**
     * Creates a named capability.
     *
     * @param name the name
     */
    public Capability(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    // -- Criteria --

    /**
     * Adds objectClasses that entries must carry. Names already declared
     * (compared case-insensitively) are ignored.
     *
     * @param names the objectClass names
     */
    public void addObjectClasses(String... names) {
        for (String oc : names) {
            if (!containsIgnoreCase(objectClasses, oc)) {
                objectClasses.add(oc);
            }
        }
        reindex();
    }

    /**
     * Returns the declared objectClasses.
     *
     * @return unmodifiable ordered set
     */
    public Set<String> getObjectClasses() {
        return Collections.unmodifiableSet(objectClasses);
    }

    /**
     * Adds base DNs beneath which entries must lie. Each is normalized by
     * removing whitespace around its separators.
     *
     * @param dns the base DNs
     * @throws org.bluezoo.arbor.InvalidDNException if a DN is not valid
     */
    public void addBases(String... dns) {
        for (String dn : dns) {
            String base = DN.normalize(dn);
            if (!containsIgnoreCase(bases, base)) {
                bases.add(base);
            }
        }
        reindex();
    }

    /**
     * Returns the declared bases.
     *
     * @return unmodifiable ordered set of normalized DNs
     */
    public Set<String> getBases() {
        return Collections.unmodifiableSet(bases);
    }

    private void reindex() {
        if (model != null) {
            model.getRegistry().register(this);
        }
    }

    private static boolean containsIgnoreCase(Set<String> set, String value) {
        for (String s : set) {
            if (s.equalsIgnoreCase(value)) {
                return true;
            }
        }
        return false;
    }

    // -- Model --

    public Model getModel() {
        return model;
    }

    /**
     * Moves this capability to another model: it is removed from the
     * current model's registry and registered in the new one.
     *
     * @param model the new model, or null to detach
     */
    public void setModel(Model model) {
        if (this.model == model) {
            return;
        }
        if (this.model != null) {
            this.model.getRegistry().unregister(this);
        }
        this.model = model;
        if (model != null) {
            model.getRegistry().register(this);
        }
    }

    // -- Searching --

    /**
     * Returns the filter selecting the entries this capability applies to:
     * {@code (objectClass=*)} with no declared classes,
     * {@code (objectClass=c)} with one, and the conjunction of these with
     * several.
     *
     * @return the filter
     */
    public Filter getFilter() {
        if (objectClasses.isEmpty()) {
            return Filter.DEFAULT;
        }
        List<Filter> terms = new ArrayList<Filter>(objectClasses.size());
        for (String oc : objectClasses) {
            terms.add(Filter.equal(Filter.OBJECT_CLASS, oc));
        }
        if (terms.size() == 1) {
            return terms.get(0);
        }
        return Filter.and(terms.toArray(new Filter[terms.size()]));
    }

    /**
     * Returns a query for the entries of the model's directory this
     * capability applies to.
     *
     * @return a {@link Branchset}, or a {@link BranchCollection} if the
     * capability has several bases
     * @throws ModelException if the capability has no model or no criteria
     */
    public BranchQuery search() throws ModelException {
        return search(requireModel().getDirectory());
    }

    /**
     * Returns a query for the entries of another directory this capability
     * applies to. Results are wrapped as {@link ModelObject}s of the
     * capability's model.
     *
     * @param directory the directory to search
     * @return a {@link Branchset}, or a {@link BranchCollection} if the
     * capability has several bases
     * @throws ModelException if the capability has no model or no criteria
     */
    public BranchQuery search(Directory directory) throws ModelException {
        if (objectClasses.isEmpty() && bases.isEmpty()) {
            String message = Model.L10N.getString("err.no_search_criteria");
            throw new ModelException(MessageFormat.format(message, name));
        }
        Model m = requireModel();
        List<String> dns = new ArrayList<String>(bases);
        if (dns.isEmpty()) {
            dns.add(directory.getBaseDN());
        }
        Filter filter = getFilter();
        List<Branchset> branchsets = new ArrayList<Branchset>(dns.size());
        for (String dn : dns) {
            Branch base = m.getBranchFactory().newBranch(directory, dn, null);
            branchsets.add(new Branchset(base, filter));
        }
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("Search for " + name + ": " + filter + " in " + dns);
        }
        if (branchsets.size() == 1) {
            return branchsets.get(0);
        }
        return new BranchCollection(branchsets);
    }

    private Model requireModel() throws ModelException {
        if (model == null) {
            String message = Model.L10N.getString("err.no_model");
            throw new ModelException(MessageFormat.format(message, name));
        }
        return model;
    }

    // -- Creation --

    /**
     * Returns the attributes of a new entry with this capability: the
     * given attributes with the capability's objectClasses and the RDN
     * values of the DN merged in. Values already present are not repeated.
     *
     * @param dn the DN of the new entry
     * @param attributes the initial attributes (may be empty)
     * @return ordered map of attribute name to values
     * @throws org.bluezoo.arbor.InvalidDNException if the DN is not valid
     */
    public Map<String, List<String>> getCreationAttributes(String dn,
            Map<String, ?> attributes) {
        Map<String, List<String>> result = new LinkedHashMap<String, List<String>>();
        for (Map.Entry<String, ?> attr : attributes.entrySet()) {
            result.put(attr.getKey(), Modification.toStrings(attr.getValue()));
        }
        for (String oc : objectClasses) {
            addValue(result, Filter.OBJECT_CLASS, oc);
        }
        for (Map.Entry<String, List<String>> pair
                : DN.parseRDN(DN.getRDN(DN.validate(dn))).entrySet()) {
            for (String value : pair.getValue()) {
                addValue(result, pair.getKey(), value);
            }
        }
        return result;
    }

    private static void addValue(Map<String, List<String>> attributes, String name,
            String value) {
        List<String> values = null;
        for (Map.Entry<String, List<String>> attr : attributes.entrySet()) {
            if (attr.getKey().equalsIgnoreCase(name)) {
                values = attr.getValue();
                break;
            }
        }
        if (values == null) {
            values = new ArrayList<String>();
            attributes.put(name, values);
        }
        for (String v : values) {
            if (v.equalsIgnoreCase(value)) {
                return;
            }
        }
        values.add(value);
    }

    /**
     * Adds an entry with this capability to the model's directory.
     *
     * @param dn the DN of the new entry
     * @param attributes the initial attributes (may be empty)
     * @return the new entry
     * @throws ModelException if the capability has no model
     * @throws DirectoryException if the entry cannot be added
     */
    public ModelObject create(String dn, Map<String, ?> attributes)
            throws ModelException, DirectoryException {
        return create(requireModel().getDirectory(), dn, attributes);
    }

    /**
     * Adds an entry with this capability to another directory.
     *
     * @param directory the directory
     * @param dn the DN of the new entry
     * @param attributes the initial attributes (may be empty)
     * @return the new entry
     * @throws ModelException if the capability has no model
     * @throws DirectoryException if the entry cannot be added
     */
    public ModelObject create(Directory directory, String dn, Map<String, ?> attributes)
            throws ModelException, DirectoryException {
        Model m = requireModel();
        ModelObject object = new ModelObject(directory, dn, null, m);
        object.create(getCreationAttributes(dn, attributes));
        return object;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + name
                + " objectClasses=" + objectClasses + " bases=" + bases + "]";
    }
}
