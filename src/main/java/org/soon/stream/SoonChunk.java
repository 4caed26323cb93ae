// Copyright The SOON Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package org.soon.stream;

import org.soon.SoonValue;

/**
 * One decoded chunk of a stream: its id and its value.
 */
public final class SoonChunk
{
    private final String    myId;
    private final SoonValue myValue;

    public SoonChunk(String id, SoonValue value)
    {
        if (id == null) throw new NullPointerException("id");
        if (value == null) throw new NullPointerException("value");
        myId = id;
        myValue = value;
    }

    /**
     * @return the id written in the chunk's delimiter, or a sequence number
     * assigned by the stream for chunks without one.
     */
    public String getId()
    {
        return myId;
    }

    public SoonValue getValue()
    {
        return myValue;
    }

    @Override
    public boolean equals(Object other)
    {
        if (! (other instanceof SoonChunk)) return false;
        SoonChunk that = (SoonChunk) other;
        return myId.equals(that.myId) && myValue.equals(that.myValue);
    }

    @Override
    public int hashCode()
    {
        return 31 * myId.hashCode() + myValue.hashCode();
    }

    @Override
    public String toString()
    {
        return "SoonChunk{id=" + myId + ", value=" + myValue + "}";
    }
}
