// Copyright The SOON Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package org.soon;

/**
 * The SOON {@code null} value.
 */
public final class SoonNull
    extends SoonValue
{
    public static final SoonNull NULL = new SoonNull();

    private SoonNull()
    {
    }

    @Override
    public SoonType getType()
    {
        return SoonType.NULL;
    }

    @Override
    public <R> R accept(ValueVisitor<R> visitor)
    {
        return visitor.visit(this);
    }

    @Override
    public SoonNull clone()
    {
        return this;
    }

    @Override
    public boolean equals(Object other)
    {
        return other instanceof SoonNull;
    }

    @Override
    public int hashCode()
    {
        return 0x6e756c6c;
    }
}
