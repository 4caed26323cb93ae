// Copyright The SOON Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package org.soon;

/**
 * A SOON number, with IEEE-754 double precision semantics. Integer literals
 * and floating-point literals share this one type; {@link #isIntegral()}
 * tells them apart by value.
 * <p>
 * Any double may be held, but only finite numbers can be encoded.
 */
public final class SoonNumber
    extends SoonValue
{
    private final double myValue;

    private SoonNumber(double value)
    {
        myValue = value;
    }

    public static SoonNumber valueOf(double value)
    {
        return new SoonNumber(value);
    }

    public static SoonNumber valueOf(long value)
    {
        return new SoonNumber(value);
    }

    public double doubleValue()
    {
        return myValue;
    }

    /**
     * Gets the value as a long, truncating any fraction.
     */
    public long longValue()
    {
        return (long) myValue;
    }

    public int intValue()
    {
        return (int) myValue;
    }

    public boolean isFinite()
    {
        return ! Double.isNaN(myValue) && ! Double.isInfinite(myValue);
    }

    /**
     * @return true if this is a finite number with no fractional part.
     */
    public boolean isIntegral()
    {
        return isFinite() && myValue == Math.rint(myValue);
    }

    @Override
    public SoonType getType()
    {
        return SoonType.NUMBER;
    }

    @Override
    public <R> R accept(ValueVisitor<R> visitor)
    {
        return visitor.visit(this);
    }

    @Override
    public SoonNumber clone()
    {
        return this;
    }

    /**
     * Numbers are equal when their doubles are the same value, counting
     * {@code 0} and {@code -0} as one value and NaN as equal to itself.
     */
    @Override
    public boolean equals(Object other)
    {
        if (! (other instanceof SoonNumber)) return false;
        double that = ((SoonNumber) other).myValue;
        return myValue == that || (Double.isNaN(myValue) && Double.isNaN(that));
    }

    @Override
    public int hashCode()
    {
        // -0.0 and 0.0 are equal, so they must hash alike
        return Double.hashCode(myValue == 0.0 ? 0.0 : myValue);
    }
}
