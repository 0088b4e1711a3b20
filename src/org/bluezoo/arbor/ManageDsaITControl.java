/*
 * ManageDsaITControl.java
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

import java.util.Collections;
import java.util.List;

/**
 * The ManageDsaIT control (RFC 3296): asks the server to treat referral
 * and alias entries as ordinary entries.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class ManageDsaITControl implements SearchControl {

    private final boolean critical;

    /**
     * Creates a non-critical ManageDsaIT control.
     */
    public ManageDsaITControl() {
        this(false);
    }

    /**
     * Creates a ManageDsaIT control.
     *
     * @param critical whether the server must honour the control
     */
    public ManageDsaITControl(boolean critical) {
        this.critical = critical;
    }

    @Override
    public String getOID() {
        return Control.MANAGE_DSA_IT;
    }

    /**
     * Returns whether the control is sent as critical.
     *
     * @return true if critical
     */
    public boolean isCritical() {
        return critical;
    }

    @Override
    public List<Control> getClientControls(Branchset branchset) {
        return Collections.emptyList();
    }

    @Override
    public List<Control> getServerControls(Branchset branchset) {
        return Collections.singletonList(new Control(Control.MANAGE_DSA_IT, critical));
    }
}
