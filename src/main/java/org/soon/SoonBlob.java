// Copyright The SOON Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package org.soon;

import java.util.Arrays;

/**
 * A SOON binary buffer: an ordered sequence of bytes. Encoded as a quoted
 * Base64 string.
 */
public final class SoonBlob
    extends SoonValue
{
    private final byte[] myBytes;

    /**
     * @param bytes copied; must not be null.
     */
    public SoonBlob(byte[] bytes)
    {
        myBytes = bytes.clone();
    }

    /**
     * @return a copy of the bytes.
     */
    public byte[] getBytes()
    {
        return myBytes.clone();
    }

    public int byteSize()
    {
        return myBytes.length;
    }

    @Override
    public SoonType getType()
    {
        return SoonType.BLOB;
    }

    @Override
    public <R> R accept(ValueVisitor<R> visitor)
    {
        return visitor.visit(this);
    }

    @Override
    public SoonBlob clone()
    {
        return new SoonBlob(myBytes);
    }

    @Override
    public boolean equals(Object other)
    {
        return other instanceof SoonBlob
            && Arrays.equals(((SoonBlob) other).myBytes, myBytes);
    }

    @Override
    public int hashCode()
    {
        return Arrays.hashCode(myBytes);
    }
}
