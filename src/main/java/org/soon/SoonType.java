// Copyright The SOON Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package org.soon;

/**
 * Enumeration identifying the SOON data types.
 */
public enum SoonType
{
    NULL,
    BOOL,
    NUMBER,
    STRING,
    TIMESTAMP,
    BLOB,
    LIST,
    STRUCT;


    /**
     * Determines whether a type represents a SOON container.
     *
     * @param t may be null.
     *
     * @return true when {@code t} is {@link #LIST} or {@link #STRUCT}.
     */
    public static boolean isContainer(SoonType t)
    {
        return (t != null && (t.ordinal() >= LIST.ordinal()));
    }

    /**
     * Determines whether a type represents a scalar, that is, anything
     * rendered as a single token.
     *
     * @param t may be null.
     *
     * @return true when {@code t} is neither null nor a container.
     */
    public static boolean isScalar(SoonType t)
    {
        return (t != null && ! isContainer(t));
    }
}
