/*
 * Control.java
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

import java.util.Arrays;

/**
 * A protocol control attached to a search request.
 *
 * <p>Controls are opaque to this library: the OID, criticality and
 * encoded value are handed to the {@link Directory} unchanged.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class Control {

    /** ManageDsaIT control OID (RFC 3296). */
    public static final String MANAGE_DSA_IT = "2.16.840.1.113730.3.4.2";

    private final String oid;
    private final boolean critical;
    private final byte[] value;

    /**
     * Creates a control without a value.
     *
     * @param oid the control OID
     * @param critical whether the control is critical
     */
    public Control(String oid, boolean critical) {
        this(oid, critical, null);
    }

    /**
     * Creates a control.
     *
     * @param oid the control OID
     * @param critical whether the control is critical
     * @param value the encoded control value (may be null)
     */
    public Control(String oid, boolean critical, byte[] value) {
        if (oid == null) {
            throw new NullPointerException("oid");
        }
        this.oid = oid;
        this.critical = critical;
        this.value = value != null ? value.clone() : null;
    }

    /**
     * Returns the control OID.
     *
     * @return the OID
     */
    public String getOID() {
        return oid;
    }

    /**
     * Returns whether the control is critical.
     *
     * @return true if critical
     */
    public boolean isCritical() {
        return critical;
    }

    /**
     * Returns the encoded value.
     *
     * @return a copy of the value, or null
     */
    public byte[] getValue() {
        return value != null ? value.clone() : null;
    }

    @Override
    public boolean equals(Object other) {
        if (!(other instanceof Control)) {
            return false;
        }
        Control o = (Control) other;
        return oid.equals(o.oid) && critical == o.critical && Arrays.equals(value, o.value);
    }

    @Override
    public int hashCode() {
        return oid.hashCode() * 31 + (critical ? 1 : 0) + Arrays.hashCode(value);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("Control[").append(oid);
        if (critical) {
            sb.append(", critical");
        }
        if (value != null) {
            sb.append(", ").append(value.length).append(" bytes");
        }
        sb.append("]");
        return sb.toString();
    }
}
