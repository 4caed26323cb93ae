// Copyright The SOON Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package org.soon;

import java.time.Instant;

/**
 * Base type for all SOON values: a closed hierarchy of
 * {@link SoonNull}, {@link SoonBool}, {@link SoonNumber}, {@link SoonString},
 * {@link SoonTimestamp}, {@link SoonBlob}, {@link SoonList} and
 * {@link SoonStruct}. Use {@link #accept(ValueVisitor)} to dispatch on the
 * concrete variant.
 * <p>
 * Scalars are immutable. Containers are mutable and are not safe for use by
 * multiple threads without external synchronization.
 * <p>
 * Equality is value equality: structs compare as maps (field order does not
 * matter) and lists compare element by element.
 */
public abstract class SoonValue
    implements Cloneable
{
    SoonValue()
    {
    }

    /**
     * Gets an enumeration value identifying the core type of this object.
     *
     * @return a non-null enumeration value.
     */
    public abstract SoonType getType();

    /**
     * Entry point for visitor pattern.  Implementations of this method by
     * concrete classes will simply call the appropriate <code>visit</code>
     * method on the <code>visitor</code>.
     */
    public abstract <R> R accept(ValueVisitor<R> visitor);

    /**
     * Creates a deep copy of this value. The copy shares no mutable state
     * with the original.
     */
    @Override
    public abstract SoonValue clone();

    public final boolean isContainer()
    {
        return SoonType.isContainer(getType());
    }

    /**
     * Returns this value rendered as SOON text with the default encoder
     * settings. Values that cannot be encoded (for example a NaN number)
     * are shown with their type and the reason instead.
     */
    @Override
    public String toString()
    {
        try
        {
            return Soon.encode(this);
        }
        catch (SoonEncodeException e)
        {
            return getType() + "{" + e.getMessage() + "}";
        }
    }


    //=========================================================================
    // Factories

    public static SoonValue of(String text)
    {
        return (text == null ? SoonNull.NULL : new SoonString(text));
    }

    public static SoonNumber of(long value)
    {
        return SoonNumber.valueOf(value);
    }

    public static SoonNumber of(double value)
    {
        return SoonNumber.valueOf(value);
    }

    public static SoonBool of(boolean value)
    {
        return SoonBool.valueOf(value);
    }

    public static SoonValue of(Instant instant)
    {
        return (instant == null ? SoonNull.NULL : SoonTimestamp.forInstant(instant));
    }

    public static SoonValue of(byte[] bytes)
    {
        return (bytes == null ? SoonNull.NULL : new SoonBlob(bytes));
    }
}
