// Copyright The SOON Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package org.soon.impl;

/**
 * A location in source text: 1-based line and column, 0-based char offset.
 * <p>
 * Columns and offsets count UTF-16 chars of the decoded text, not bytes of
 * its encoding, so {@code "\u00e9"} advances both by one.
 */
public final class Position
{
    private final int myLine;
    private final int myColumn;
    private final int myOffset;

    public Position(int line, int column, int offset)
    {
        myLine = line;
        myColumn = column;
        myOffset = offset;
    }

    public int getLine()
    {
        return myLine;
    }

    public int getColumn()
    {
        return myColumn;
    }

    /** The index of this location in the source {@code CharSequence}. */
    public int getOffset()
    {
        return myOffset;
    }

    @Override
    public boolean equals(Object other)
    {
        if (! (other instanceof Position)) return false;
        Position that = (Position) other;
        return myLine == that.myLine
            && myColumn == that.myColumn
            && myOffset == that.myOffset;
    }

    @Override
    public int hashCode()
    {
        int result = myLine;
        result = 31 * result + myColumn;
        result = 31 * result + myOffset;
        return result;
    }

    @Override
    public String toString()
    {
        return "line " + myLine + ", column " + myColumn;
    }
}
