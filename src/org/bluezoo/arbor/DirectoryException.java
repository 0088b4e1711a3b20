/*
 * DirectoryException.java
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

/**
 * Exception thrown for failed directory operations.
 *
 * <p>Errors reported by the underlying {@link Directory} are propagated
 * as they are; this library adds no retry and recovers none of them
 * locally, with the single exception of {@link Branch#exists}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class DirectoryException extends Exception {

    private static final long serialVersionUID = 1L;

    private final ResultCode resultCode;
    private final String matchedDN;

    /**
     * Creates a directory exception with message only.
     *
     * @param message error description
     */
    public DirectoryException(String message) {
        this(ResultCode.OTHER, message, null, null);
    }

    /**
     * Creates a directory exception with message and cause.
     *
     * @param message error description
     * @param cause underlying cause
     */
    public DirectoryException(String message, Throwable cause) {
        this(ResultCode.OTHER, message, null, cause);
    }

    /**
     * Creates a directory exception with a result code.
     *
     * @param resultCode the result code reported by the directory
     * @param message error description
     */
    public DirectoryException(ResultCode resultCode, String message) {
        this(resultCode, message, null, null);
    }

    /**
     * Creates a directory exception with full details.
     *
     * @param resultCode the result code reported by the directory
     * @param message error description
     * @param matchedDN the portion of the target DN that was matched (may be null)
     * @param cause underlying cause (may be null)
     */
    public DirectoryException(ResultCode resultCode, String message,
                              String matchedDN, Throwable cause) {
        super(message, cause);
        this.resultCode = resultCode != null ? resultCode : ResultCode.OTHER;
        this.matchedDN = matchedDN != null ? matchedDN : "";
    }

    /**
     * Returns the result code associated with this exception.
     *
     * @return the result code
     */
    public ResultCode getResultCode() {
        return resultCode;
    }

    /**
     * Returns the matched DN.
     *
     * <p>For operations that fail with NO_SUCH_OBJECT, this contains
     * the portion of the DN that was matched.
     *
     * @return the matched DN, may be empty
     */
    public String getMatchedDN() {
        return matchedDN;
    }
}
