// Copyright The SOON Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package org.soon;

/**
 * A SOON {@code true} or {@code false} value.
 */
public final class SoonBool
    extends SoonValue
{
    public static final SoonBool TRUE  = new SoonBool(true);
    public static final SoonBool FALSE = new SoonBool(false);

    private final boolean myValue;

    private SoonBool(boolean value)
    {
        myValue = value;
    }

    public static SoonBool valueOf(boolean value)
    {
        return (value ? TRUE : FALSE);
    }

    public boolean booleanValue()
    {
        return myValue;
    }

    @Override
    public SoonType getType()
    {
        return SoonType.BOOL;
    }

    @Override
    public <R> R accept(ValueVisitor<R> visitor)
    {
        return visitor.visit(this);
    }

    @Override
    public SoonBool clone()
    {
        return this;
    }

    @Override
    public boolean equals(Object other)
    {
        return other instanceof SoonBool
            && ((SoonBool) other).myValue == myValue;
    }

    @Override
    public int hashCode()
    {
        return Boolean.hashCode(myValue);
    }
}
