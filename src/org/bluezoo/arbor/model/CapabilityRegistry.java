/*
 * CapabilityRegistry.java
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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.bluezoo.arbor.DN;

/**
 * The capabilities registered with a {@link Model}, indexed by the
 * objectClasses and base DNs they declare.
 *
 * <p>Two lookups are supported. By objectClass, a capability matches a set
 * of classes if it declares at least one class and every class it declares
 * is in the set. By DN, a capability matches if one of its bases is the
 * DN itself or one of its ancestors. An entry's capabilities are those
 * whose declared criteria all match it.
 *
 * <p>Registration is normally done once at start-up; mutations are
 * synchronized so that lookups always see both indices in step.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class CapabilityRegistry {

    private static final Logger LOGGER = Logger.getLogger(CapabilityRegistry.class.getName());

    private final Set<Capability> capabilities = new LinkedHashSet<Capability>();
    private final Map<String, Set<Capability>> objectClassIndex =
            new LinkedHashMap<String, Set<Capability>>();
    private final Map<String, Set<Capability>> baseIndex =
            new LinkedHashMap<String, Set<Capability>>();

    /**
     * Registers a capability under its current objectClasses and bases.
     * A capability already registered is re-indexed.
     *
     * @param capability the capability
     */
    public synchronized void register(Capability capability) {
        remove(capability);
        capabilities.add(capability);
        for (String objectClass : capability.getObjectClasses()) {
            index(objectClassIndex, objectClass.toLowerCase(), capability);
        }
        for (String base : capability.getBases()) {
            index(baseIndex, base.toLowerCase(), capability);
        }
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("Registered " + capability);
        }
    }

    /**
     * Removes a capability from both indices.
     *
     * @param capability the capability
     * @return true if it was registered
     */
    public synchronized boolean unregister(Capability capability) {
        boolean removed = remove(capability);
        if (removed && LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("Unregistered " + capability);
        }
        return removed;
    }

    private boolean remove(Capability capability) {
        boolean removed = capabilities.remove(capability);
        unindex(objectClassIndex, capability);
        unindex(baseIndex, capability);
        return removed;
    }

    private static void index(Map<String, Set<Capability>> index, String key,
            Capability capability) {
        Set<Capability> set = index.get(key);
        if (set == null) {
            set = new LinkedHashSet<Capability>();
            index.put(key, set);
        }
        set.add(capability);
    }

    private static void unindex(Map<String, Set<Capability>> index, Capability capability) {
        for (Iterator<Set<Capability>> i = index.values().iterator(); i.hasNext(); ) {
            Set<Capability> set = i.next();
            set.remove(capability);
            if (set.isEmpty()) {
                i.remove();
            }
        }
    }

    public synchronized boolean isRegistered(Capability capability) {
        return capabilities.contains(capability);
    }

    /**
     * Returns every registered capability, in registration order.
     *
     * @return the capabilities
     */
    public synchronized List<Capability> getCapabilities() {
        return new ArrayList<Capability>(capabilities);
    }

    /**
     * Returns the capabilities indexed under an objectClass.
     *
     * @param objectClass the objectClass name, case-insensitive
     * @return the capabilities declaring that class
     */
    public synchronized Set<Capability> getCapabilitiesForObjectClass(String objectClass) {
        return snapshot(objectClassIndex.get(objectClass.toLowerCase()));
    }

    /**
     * Returns the capabilities indexed under a base DN.
     *
     * @param base the base DN
     * @return the capabilities declaring that base
     */
    public synchronized Set<Capability> getCapabilitiesForBase(String base) {
        return snapshot(baseIndex.get(DN.normalize(base).toLowerCase()));
    }

    private static Set<Capability> snapshot(Set<Capability> set) {
        if (set == null) {
            return Collections.emptySet();
        }
        return Collections.unmodifiableSet(new LinkedHashSet<Capability>(set));
    }

    /**
     * Returns the capabilities that declare at least one objectClass and
     * all of whose objectClasses are in the given set.
     *
     * @param objectClasses the objectClasses of a candidate entry
     * @return the matching capabilities, in registration order
     */
    public synchronized List<Capability> getCapabilitiesForObjectClasses(
            Collection<String> objectClasses) {
        Set<String> present = lowerCase(objectClasses);
        Set<Capability> candidates = new HashSet<Capability>();
        for (String objectClass : present) {
            Set<Capability> set = objectClassIndex.get(objectClass);
            if (set != null) {
                candidates.addAll(set);
            }
        }
        List<Capability> result = new ArrayList<Capability>();
        for (Capability capability : capabilities) {
            if (candidates.contains(capability) && matchesObjectClasses(capability, present)) {
                result.add(capability);
            }
        }
        return result;
    }

    /**
     * Returns the capabilities with a base that is the given DN or one of
     * its ancestors.
     *
     * @param dn the DN of a candidate entry
     * @return the matching capabilities, in registration order
     */
    public synchronized List<Capability> getCapabilitiesForDN(String dn) {
        Set<Capability> candidates = new HashSet<Capability>();
        for (String suffix : suffixes(dn)) {
            Set<Capability> set = baseIndex.get(suffix);
            if (set != null) {
                candidates.addAll(set);
            }
        }
        List<Capability> result = new ArrayList<Capability>();
        for (Capability capability : capabilities) {
            if (candidates.contains(capability)) {
                result.add(capability);
            }
        }
        return result;
    }

    /**
     * Returns the capabilities that apply to an entry: those whose
     * declared objectClasses are all present and, if they declare bases,
     * one of whose bases is an ancestor-or-self of the DN. A capability
     * that declares neither applies to nothing.
     *
     * @param objectClasses the entry's objectClasses
     * @param dn the entry's DN
     * @return the applicable capabilities, in registration order
     */
    public synchronized List<Capability> getCapabilities(Collection<String> objectClasses,
            String dn) {
        Set<String> present = lowerCase(objectClasses);
        Set<Capability> byDN = new HashSet<Capability>(getCapabilitiesForDN(dn));
        List<Capability> result = new ArrayList<Capability>();
        for (Capability capability : capabilities) {
            boolean hasClasses = !capability.getObjectClasses().isEmpty();
            boolean hasBases = !capability.getBases().isEmpty();
            if (!hasClasses && !hasBases) {
                continue;
            }
            if (hasClasses && !matchesObjectClasses(capability, present)) {
                continue;
            }
            if (hasBases && !byDN.contains(capability)) {
                continue;
            }
            result.add(capability);
        }
        return result;
    }

    private static boolean matchesObjectClasses(Capability capability, Set<String> present) {
        Set<String> required = capability.getObjectClasses();
        if (required.isEmpty()) {
            return false;
        }
        for (String objectClass : required) {
            if (!present.contains(objectClass.toLowerCase())) {
                return false;
            }
        }
        return true;
    }

    private static Set<String> lowerCase(Collection<String> names) {
        Set<String> set = new HashSet<String>();
        for (String name : names) {
            set.add(name.toLowerCase());
        }
        return set;
    }

    // The DN and each of its ancestors, normalized and lower-cased
    private static List<String> suffixes(String dn) {
        List<String> rdns = DN.split(dn);
        List<String> suffixes = new ArrayList<String>(rdns.size());
        StringBuilder buf = new StringBuilder();
        for (int i = rdns.size() - 1; i >= 0; i--) {
            String rdn = DN.normalizeRDN(rdns.get(i)).toLowerCase();
            if (buf.length() > 0) {
                buf.insert(0, ',');
            }
            buf.insert(0, rdn);
            suffixes.add(buf.toString());
        }
        return suffixes;
    }

    @Override
    public synchronized String toString() {
        return "CapabilityRegistry" + capabilities;
    }
}
