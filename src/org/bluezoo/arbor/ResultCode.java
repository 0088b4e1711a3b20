/*
 * ResultCode.java
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

import java.util.HashMap;
import java.util.Map;

/**
 * Directory result codes as defined in RFC 4511.
 *
 * <p>Only the codes a directory collaborator is likely to report back
 * through this library are listed; anything else maps to {@link #OTHER}.
 * A {@link DirectoryException} always carries one of these.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public enum ResultCode {

    SUCCESS(0, "success"),
    OPERATIONS_ERROR(1, "operationsError"),
    PROTOCOL_ERROR(2, "protocolError"),
    TIME_LIMIT_EXCEEDED(3, "timeLimitExceeded"),
    SIZE_LIMIT_EXCEEDED(4, "sizeLimitExceeded"),
    UNAVAILABLE_CRITICAL_EXTENSION(12, "unavailableCriticalExtension"),

    // attribute problems
    NO_SUCH_ATTRIBUTE(16, "noSuchAttribute"),
    UNDEFINED_ATTRIBUTE_TYPE(17, "undefinedAttributeType"),
    CONSTRAINT_VIOLATION(19, "constraintViolation"),
    ATTRIBUTE_OR_VALUE_EXISTS(20, "attributeOrValueExists"),
    INVALID_ATTRIBUTE_SYNTAX(21, "invalidAttributeSyntax"),

    // name problems
    NO_SUCH_OBJECT(32, "noSuchObject"),
    INVALID_DN_SYNTAX(34, "invalidDNSyntax"),

    // security and service problems
    INSUFFICIENT_ACCESS_RIGHTS(50, "insufficientAccessRights"),
    BUSY(51, "busy"),
    UNAVAILABLE(52, "unavailable"),
    UNWILLING_TO_PERFORM(53, "unwillingToPerform"),

    // update problems
    NAMING_VIOLATION(64, "namingViolation"),
    OBJECT_CLASS_VIOLATION(65, "objectClassViolation"),
    NOT_ALLOWED_ON_NON_LEAF(66, "notAllowedOnNonLeaf"),
    ENTRY_ALREADY_EXISTS(68, "entryAlreadyExists"),

    OTHER(80, "other");

    private static final Map<Integer, ResultCode> BY_CODE = new HashMap<Integer, ResultCode>();
    static {
        for (ResultCode rc : values()) {
            BY_CODE.put(Integer.valueOf(rc.code), rc);
        }
    }

    private final int code;
    private final String name;

    ResultCode(int code, String name) {
        this.code = code;
        this.name = name;
    }

    public int getCode() {
        return code;
    }

    /**
     * Returns the name RFC 4511 gives this code, e.g. {@code noSuchObject}.
     *
     * @return the protocol name
     */
    public String getName() {
        return name;
    }

    public boolean isSuccess() {
        return this == SUCCESS;
    }

    /**
     * Maps a numeric code reported by a directory to its constant.
     *
     * @param code the numeric code
     * @return the constant, or {@link #OTHER} for codes not listed here
     */
    public static ResultCode fromCode(int code) {
        ResultCode rc = BY_CODE.get(Integer.valueOf(code));
        return (rc != null) ? rc : OTHER;
    }

    @Override
    public String toString() {
        return name + " (" + code + ")";
    }
}
