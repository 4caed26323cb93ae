// Copyright The SOON Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package org.soon;

/**
 * A SOON string. Whether the text is written bare or quoted is decided by
 * the encoder, not recorded on the value.
 */
public final class SoonString
    extends SoonValue
{
    private final String myText;

    public SoonString(String text)
    {
        if (text == null) throw new NullPointerException("text");
        myText = text;
    }

    public String stringValue()
    {
        return myText;
    }

    @Override
    public SoonType getType()
    {
        return SoonType.STRING;
    }

    @Override
    public <R> R accept(ValueVisitor<R> visitor)
    {
        return visitor.visit(this);
    }

    @Override
    public SoonString clone()
    {
        return this;
    }

    @Override
    public boolean equals(Object other)
    {
        return other instanceof SoonString
            && ((SoonString) other).myText.equals(myText);
    }

    @Override
    public int hashCode()
    {
        return myText.hashCode();
    }
}
