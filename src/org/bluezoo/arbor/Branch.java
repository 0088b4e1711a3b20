/*
 * Branch.java
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

import java.text.MessageFormat;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.ResourceBundle;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.bluezoo.arbor.schema.AttributeType;
import org.bluezoo.arbor.schema.ObjectClass;
import org.bluezoo.arbor.schema.Schema;

/**
 * An entry in a directory, identified by its DN.
 *
 * <p>A branch is a handle: creating one does not contact the directory.
 * The entry is fetched the first time its attributes are needed and kept
 * until a structural change (a rename, a merge, a deletion) invalidates
 * it. Attribute values returned by {@link #get} are decoded according to
 * the attribute's syntax in the directory schema; single-valued
 * attributes are returned as a single object, others as an unmodifiable
 * list.
 *
 * <h4>Usage Example</h4>
 * <pre>{@code
 * Branch base = new Branch(directory, "dc=example,dc=com");
 * Branch people = base.child("ou", "people");
 * Branch jdoe = people.child("uid", "jdoe");
 * if (jdoe.exists()) {
 *     String cn = (String) ((List<?>) jdoe.get("cn")).get(0);
 *     jdoe.set("description", "Updated");
 * }
 * for (Branch child : people.getChildren()) {
 *     System.out.println(child.getRDN());
 * }
 * }</pre>
 *
 * <p>Branches order themselves hierarchically: an ancestor sorts before
 * its descendants, and siblings sort by RDN.
 *
 * <p>Branches are not thread-safe.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class Branch implements Comparable<Branch> {

    static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.arbor.L10N");
    private static final Logger LOGGER = Logger.getLogger(Branch.class.getName());

    /** Creates plain branches. */
    public static final BranchFactory FACTORY = new BranchFactory() {
        @Override
        public Branch newBranch(Directory directory, String dn, SearchResultEntry entry) {
            return new Branch(directory, dn, entry);
        }

        @Override
        public String toString() {
            return "Branch.FACTORY";
        }
    };

    private final Directory directory;
    private String dn;
    private SearchResultEntry entry;
    private final Map<String, Object> values = new HashMap<String, Object>();
    private boolean includeOperationalAttributes;

    /**
     * Creates a branch for the given DN.
     *
     * @param directory the directory the entry lives in
     * @param dn the entry DN
     * @throws InvalidDNException if the DN is not valid
     */
    public Branch(Directory directory, String dn) {
        this(directory, dn, null);
    }

    /**
     * Creates a branch for an entry that has already been fetched.
     *
     * @param directory the directory the entry lives in
     * @param dn the entry DN
     * @param entry the entry, or null to fetch it on demand
     * @throws InvalidDNException if the DN is not valid
     */
    public Branch(Directory directory, String dn, SearchResultEntry entry) {
        if (directory == null) {
            throw new NullPointerException("directory");
        }
        this.directory = directory;
        this.dn = DN.validate(dn);
        this.entry = entry;
    }

    /**
     * Returns the factory used to create related branches (parent,
     * children, copies, search results) of the same kind as this one.
     *
     * @return the branch factory
     */
    protected BranchFactory getBranchFactory() {
        return FACTORY;
    }

    public Directory getDirectory() {
        return directory;
    }

    // -- DN navigation --

    public String getDN() {
        return dn;
    }

    /**
     * Re-points this branch at another entry.
     *
     * @param dn the new DN
     * @throws InvalidDNException if the DN is not valid
     */
    public void setDN(String dn) {
        this.dn = DN.validate(dn);
        clearCaches();
    }

    /**
     * Returns the most-specific component of the DN.
     *
     * @return the RDN
     */
    public String getRDN() {
        return DN.getRDN(dn);
    }

    /**
     * Re-points this branch at the sibling with the given RDN.
     *
     * @param rdn the new RDN
     * @throws InvalidDNException if the resulting DN is not valid
     */
    public void setRDN(String rdn) {
        setDN(join(rdn, getParentDN()));
    }

    /**
     * Returns the attribute/value pairs of the RDN.
     *
     * @return ordered map of attribute name to values
     */
    public Map<String, List<String>> getRDNAttributes() {
        return DN.parseRDN(getRDN());
    }

    public String getParentDN() {
        return DN.getParent(dn);
    }

    /**
     * Returns the RDN components of the DN, most-specific first.
     *
     * @return the components
     */
    public List<String> splitDN() {
        return DN.split(dn);
    }

    /**
     * Returns at most {@code limit} components of the DN; the last element
     * holds the unsplit remainder.
     *
     * @param limit the maximum number of elements, or 0 for no limit
     * @return the components
     */
    public List<String> splitDN(int limit) {
        return DN.split(dn, limit);
    }

    /**
     * Returns the parent entry.
     *
     * @return the parent, or null if this is the root DN
     */
    public Branch getParent() {
        if (dn.isEmpty()) {
            return null;
        }
        return getBranchFactory().newBranch(directory, getParentDN(), null);
    }

    /**
     * Returns the immediate children of this entry.
     *
     * @return the children
     * @throws DirectoryException if the search fails
     */
    public List<Branch> getChildren() throws DirectoryException {
        return getBranchset().scope(SearchScope.ONE).all();
    }

    /**
     * Returns a branchset searching the subtree below this entry.
     *
     * @return a new branchset
     */
    public Branchset getBranchset() {
        return new Branchset(this);
    }

    public Branchset filter(Object... criteria) {
        return getBranchset().filter(criteria);
    }

    public Branchset scope(SearchScope scope) {
        return getBranchset().scope(scope);
    }

    public Branchset scope(String scope) {
        return getBranchset().scope(scope);
    }

    public Branchset select(String... attributes) {
        return getBranchset().select(attributes);
    }

    /**
     * Returns the child with the given RDN attribute and value.
     *
     * @param attribute the RDN attribute
     * @param value the RDN value
     * @return the child branch
     * @throws DirectoryException if the schema cannot be loaded
     * @throws IllegalArgumentException if the attribute is not in the schema
     */
    public Branch child(String attribute, Object value) throws DirectoryException {
        return child(attribute, value, Collections.<String, Object>emptyMap());
    }

    /**
     * Returns the child with a multi-valued RDN made from the given
     * attribute and value followed by the additional pairs.
     *
     * @param attribute the first RDN attribute
     * @param value the first RDN value
     * @param additional further attribute/value pairs, in order
     * @return the child branch
     * @throws DirectoryException if the schema cannot be loaded
     * @throws IllegalArgumentException if an attribute is not in the schema
     */
    public Branch child(String attribute, Object value, Map<String, ?> additional)
            throws DirectoryException {
        Map<String, Object> pairs = new LinkedHashMap<String, Object>();
        pairs.put(attribute, value);
        pairs.putAll(additional);
        Schema schema = directory.getSchema();
        StringBuilder rdn = new StringBuilder();
        for (Map.Entry<String, Object> pair : pairs.entrySet()) {
            String name = pair.getKey();
            if (schema.getAttributeType(name) == null) {
                String message = L10N.getString("err.unknown_rdn_attribute");
                throw new IllegalArgumentException(MessageFormat.format(message, name));
            }
            List<String> rdnValues = Modification.toStrings(pair.getValue());
            if (rdnValues.isEmpty()) {
                String message = L10N.getString("err.missing_rdn_value");
                throw new IllegalArgumentException(MessageFormat.format(message, name));
            }
            if (rdnValues.size() > 1) {
                String message = L10N.getString("err.multiple_rdn_values");
                throw new IllegalArgumentException(MessageFormat.format(message, name));
            }
            if (rdn.length() > 0) {
                rdn.append('+');
            }
            rdn.append(name).append('=');
            rdn.append(DN.escapeValue(rdnValues.get(0)));
        }
        return getBranchFactory().newBranch(directory, join(rdn.toString(), dn), null);
    }

    private static String join(String rdn, String parent) {
        return parent.isEmpty() ? rdn : rdn + "," + parent;
    }

    // -- Entry access --

    /**
     * Returns the raw entry, fetching it if necessary.
     *
     * @return the entry
     * @throws NoSuchEntryException if the entry does not exist
     * @throws DirectoryException if the fetch fails
     */
    public SearchResultEntry getEntry() throws DirectoryException {
        if (entry == null) {
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine("Fetching entry " + dn);
            }
            SearchResultEntry fetched = includeOperationalAttributes
                    ? directory.getExtendedEntry(dn)
                    : directory.getEntry(dn);
            if (fetched == null) {
                throw new NoSuchEntryException(dn);
            }
            entry = fetched;
        }
        return entry;
    }

    /**
     * Returns whether the entry exists in the directory. An entry
     * fetched without any attributes does not count as existing.
     *
     * @return true if the entry exists
     * @throws DirectoryException if the directory fails for any other reason
     */
    public boolean exists() throws DirectoryException {
        try {
            return !getEntry().isEmpty();
        } catch (NoSuchEntryException e) {
            return false;
        } catch (DirectoryException e) {
            if (e.getResultCode() == ResultCode.NO_SUCH_OBJECT) {
                return false;
            }
            throw e;
        }
    }

    public boolean isIncludeOperationalAttributes() {
        return includeOperationalAttributes;
    }

    /**
     * Sets whether fetching the entry also fetches its operational
     * attributes. Changing the setting discards the cached entry.
     *
     * @param flag true to include operational attributes
     */
    public void setIncludeOperationalAttributes(boolean flag) {
        if (flag != includeOperationalAttributes) {
            includeOperationalAttributes = flag;
            clearCaches();
        }
    }

    /**
     * Returns the decoded value of an attribute.
     *
     * <p>Values are decoded through the directory's syntax converters
     * according to the attribute's syntax. A single-valued attribute
     * yields its only value, any other attribute an unmodifiable list.
     * Attributes unknown to the schema yield null; their raw values are
     * still available from {@link #getEntry}.
     *
     * @param attribute the attribute name
     * @return the decoded value, or null if absent or unknown
     * @throws NoSuchEntryException if the entry does not exist
     * @throws DirectoryException if the entry or schema cannot be fetched
     */
    public Object get(String attribute) throws DirectoryException {
        String key = attribute.toLowerCase();
        if (values.containsKey(key)) {
            return values.get(key);
        }
        AttributeType type = directory.getSchema().getAttributeType(attribute);
        if (type == null) {
            if (LOGGER.isLoggable(Level.INFO)) {
                String message = L10N.getString("info.unknown_attribute");
                LOGGER.info(MessageFormat.format(message, attribute, dn));
            }
            return null;
        }
        List<String> raw = getEntry().getAttributeValues(attribute);
        if (raw.isEmpty()) {
            return null;
        }
        String syntaxOID = type.getSyntaxOID();
        Object value;
        if (type.isSingleValued()) {
            value = directory.convertSyntaxValue(syntaxOID, raw.get(0));
        } else {
            List<Object> list = new ArrayList<Object>(raw.size());
            for (String s : raw) {
                list.add(directory.convertSyntaxValue(syntaxOID, s));
            }
            value = Collections.unmodifiableList(list);
        }
        values.put(key, value);
        return value;
    }

    /**
     * Replaces the values of an attribute in the directory.
     *
     * @param attribute the attribute name
     * @param value a value, a collection or array of values, or null to
     * remove the attribute
     * @throws DirectoryException if the modification fails
     */
    public void set(String attribute, Object value) throws DirectoryException {
        List<Modification> mods = Collections.singletonList(Modification.replace(attribute, value));
        directory.modify(dn, mods);
        clearCache(attribute);
        if (entry != null) {
            entry.setAttributeValues(attribute, Modification.toStrings(value));
        }
    }

    /**
     * Replaces the values of each of the given attributes.
     *
     * @param attributes attribute names to new values
     * @throws DirectoryException if the modification fails
     */
    public void merge(Map<String, ?> attributes) throws DirectoryException {
        List<Modification> mods = new ArrayList<Modification>(attributes.size());
        for (Map.Entry<String, ?> attr : attributes.entrySet()) {
            mods.add(Modification.replace(attr.getKey(), attr.getValue()));
        }
        directory.modify(dn, mods);
        clearCaches();
    }

    /**
     * Deletes the entry from the directory.
     *
     * @throws DirectoryException if the deletion fails
     */
    public void delete() throws DirectoryException {
        directory.delete(dn);
        clearCaches();
    }

    /**
     * Deletes all values of the given attributes.
     *
     * @param attributes the attribute names
     * @throws DirectoryException if the modification fails
     */
    public void delete(String... attributes) throws DirectoryException {
        if (attributes.length == 0) {
            delete();
            return;
        }
        List<Modification> mods = new ArrayList<Modification>(attributes.length);
        for (String attribute : attributes) {
            mods.add(Modification.delete(attribute));
        }
        directory.modify(dn, mods);
        clearCaches();
    }

    /**
     * Deletes the given values of each attribute. A null value deletes
     * the whole attribute.
     *
     * @param attributes attribute names to the values to delete
     * @throws DirectoryException if the modification fails
     */
    public void delete(Map<String, ?> attributes) throws DirectoryException {
        List<Modification> mods = new ArrayList<Modification>(attributes.size());
        for (Map.Entry<String, ?> attr : attributes.entrySet()) {
            Object value = attr.getValue();
            mods.add(value == null
                    ? Modification.delete(attr.getKey())
                    : Modification.delete(attr.getKey(), value));
        }
        directory.modify(dn, mods);
        clearCaches();
    }

    /**
     * Adds an entry at this branch's DN.
     *
     * @param attributes the attributes of the new entry
     * @throws DirectoryException if the entry cannot be added
     */
    public void create(Map<String, ?> attributes) throws DirectoryException {
        directory.add(dn, toStringValues(attributes));
        clearCaches();
    }

    /**
     * Copies the entry to a new DN.
     *
     * @param newDN the DN of the copy
     * @param attributes attributes to replace on the copy
     * @return a branch for the copy, of the same kind as this one
     * @throws DirectoryException if the copy fails
     */
    public Branch copy(String newDN, Map<String, ?> attributes) throws DirectoryException {
        DN.validate(newDN);
        directory.copy(dn, newDN, toStringValues(attributes));
        return getBranchFactory().newBranch(directory, newDN, null);
    }

    /**
     * Renames the entry within its parent and re-points this branch at it.
     *
     * @param newRDN the new RDN
     * @param attributes attributes to replace after the rename
     * @throws DirectoryException if the rename fails
     */
    public void move(String newRDN, Map<String, ?> attributes) throws DirectoryException {
        String newDN = DN.validate(join(newRDN, getParentDN()));
        directory.move(dn, newRDN, toStringValues(attributes));
        dn = newDN;
        clearCaches();
    }

    private static Map<String, List<String>> toStringValues(Map<String, ?> attributes) {
        Map<String, List<String>> map = new LinkedHashMap<String, List<String>>();
        for (Map.Entry<String, ?> attr : attributes.entrySet()) {
            map.put(attr.getKey(), Modification.toStrings(attr.getValue()));
        }
        return map;
    }

    /**
     * Discards the cached entry and decoded values.
     */
    protected void clearCaches() {
        entry = null;
        values.clear();
    }

    /**
     * Discards the decoded value of one attribute after it was written.
     *
     * @param attribute the attribute name
     */
    protected void clearCache(String attribute) {
        values.remove(attribute.toLowerCase());
    }

    // -- Schema helpers --

    /**
     * Returns the objectClasses of the entry together with the given
     * additional ones. Names the schema does not know are skipped.
     * If the entry does not exist only the additional classes are used.
     *
     * @param additional additional objectClass names
     * @return the objectClasses, in order, without duplicates
     * @throws DirectoryException if the entry or schema cannot be fetched
     */
    public List<ObjectClass> getObjectClasses(String... additional) throws DirectoryException {
        Schema schema = directory.getSchema();
        List<String> names = new ArrayList<String>();
        if (exists()) {
            names.addAll(getEntry().getAttributeValues("objectClass"));
        }
        Collections.addAll(names, additional);
        Set<ObjectClass> classes = new LinkedHashSet<ObjectClass>();
        for (String name : names) {
            ObjectClass oc = schema.getObjectClass(name);
            if (oc != null) {
                classes.add(oc);
            } else if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine("No objectClass " + name + " in schema");
            }
        }
        return new ArrayList<ObjectClass>(classes);
    }

    public List<AttributeType> getMustAttributeTypes(String... additional)
            throws DirectoryException {
        Set<AttributeType> types = new LinkedHashSet<AttributeType>();
        for (ObjectClass oc : getObjectClasses(additional)) {
            types.addAll(oc.getMustAttributeTypes());
        }
        return new ArrayList<AttributeType>(types);
    }

    public List<AttributeType> getMayAttributeTypes(String... additional)
            throws DirectoryException {
        Set<AttributeType> types = new LinkedHashSet<AttributeType>();
        for (ObjectClass oc : getObjectClasses(additional)) {
            types.addAll(oc.getMayAttributeTypes());
        }
        return new ArrayList<AttributeType>(types);
    }

    /**
     * Returns the union of the required and optional attribute types.
     *
     * @param additional additional objectClass names
     * @return the attribute types
     * @throws DirectoryException if the entry or schema cannot be fetched
     */
    public List<AttributeType> getValidAttributeTypes(String... additional)
            throws DirectoryException {
        Set<AttributeType> types = new LinkedHashSet<AttributeType>();
        types.addAll(getMustAttributeTypes(additional));
        types.addAll(getMayAttributeTypes(additional));
        return new ArrayList<AttributeType>(types);
    }

    /**
     * Returns the names of the required attributes as the objectClasses
     * declare them.
     *
     * @param additional additional objectClass names
     * @return the names, without duplicates
     * @throws DirectoryException if the entry or schema cannot be fetched
     */
    public List<String> getMustOIDs(String... additional) throws DirectoryException {
        List<String> oids = new ArrayList<String>();
        for (ObjectClass oc : getObjectClasses(additional)) {
            oids.addAll(oc.getMust());
        }
        return dedupe(oids);
    }

    public List<String> getMayOIDs(String... additional) throws DirectoryException {
        List<String> oids = new ArrayList<String>();
        for (ObjectClass oc : getObjectClasses(additional)) {
            oids.addAll(oc.getMay());
        }
        return dedupe(oids);
    }

    public List<String> getValidAttributeOIDs(String... additional) throws DirectoryException {
        List<String> oids = new ArrayList<String>(getMustOIDs(additional));
        oids.addAll(getMayOIDs(additional));
        return dedupe(oids);
    }

    /**
     * Returns whether the entry's objectClasses allow the given attribute.
     *
     * @param attribute an attribute name or OID
     * @return true if the attribute is required or allowed
     * @throws DirectoryException if the entry or schema cannot be fetched
     */
    public boolean isValidAttribute(String attribute) throws DirectoryException {
        for (String oid : getValidAttributeOIDs()) {
            if (oid.equalsIgnoreCase(attribute)) {
                return true;
            }
        }
        for (AttributeType type : getValidAttributeTypes()) {
            if (type.isNamed(attribute)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns a skeleton of the required attributes: each name maps to
     * {@code ""} if the attribute is single-valued, otherwise to an empty
     * list.
     *
     * @param additional additional objectClass names
     * @return ordered map of attribute name to empty value
     * @throws DirectoryException if the entry or schema cannot be fetched
     */
    public Map<String, Object> getMustAttributes(String... additional)
            throws DirectoryException {
        return skeleton(getMustAttributeTypes(additional));
    }

    public Map<String, Object> getMayAttributes(String... additional)
            throws DirectoryException {
        return skeleton(getMayAttributeTypes(additional));
    }

    public Map<String, Object> getValidAttributes(String... additional)
            throws DirectoryException {
        return skeleton(getValidAttributeTypes(additional));
    }

    private static Map<String, Object> skeleton(List<AttributeType> types) {
        Map<String, Object> map = new LinkedHashMap<String, Object>();
        for (AttributeType type : types) {
            map.put(type.getName(), type.isSingleValued() ? "" : Collections.emptyList());
        }
        return map;
    }

    private static List<String> dedupe(List<String> names) {
        Set<String> seen = new HashSet<String>();
        List<String> result = new ArrayList<String>(names.size());
        for (String name : names) {
            if (seen.add(name.toLowerCase())) {
                result.add(name);
            }
        }
        return result;
    }

    // -- Combination and comparison --

    /**
     * Returns the union of searches below this branch and another.
     *
     * @param other the other branch
     * @return the collection
     */
    public BranchCollection plus(Branch other) {
        return new BranchCollection(getBranchset(), other.getBranchset());
    }

    public BranchCollection plus(BranchQuery other) {
        return new BranchCollection(getBranchset(), other);
    }

    /**
     * Compares branches hierarchically. RDNs are compared from the root
     * downwards; if one DN is an ancestor of the other it sorts first.
     *
     * @param other the other branch
     * @return negative, zero or positive
     * @throws ClassCastException if the branches are of different classes
     */
    @Override
    public int compareTo(Branch other) {
        if (other.getClass() != getClass()) {
            throw new ClassCastException(MessageFormat.format(
                    L10N.getString("err.incomparable"),
                    getClass().getName(), other.getClass().getName()));
        }
        List<String> mine = DN.reversed(dn);
        List<String> theirs = DN.reversed(other.dn);
        int len = Math.min(mine.size(), theirs.size());
        for (int i = 0; i < len; i++) {
            String a = DN.normalizeRDN(mine.get(i)).toLowerCase();
            String b = DN.normalizeRDN(theirs.get(i)).toLowerCase();
            int c = a.compareTo(b);
            if (c != 0) {
                return c;
            }
        }
        return mine.size() - theirs.size();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (other == null || other.getClass() != getClass()) {
            return false;
        }
        return normalizedDN().equals(((Branch) other).normalizedDN());
    }

    @Override
    public int hashCode() {
        return normalizedDN().hashCode();
    }

    private String normalizedDN() {
        return DN.normalize(dn).toLowerCase();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + dn + " @ " + directory + "]";
    }
}
