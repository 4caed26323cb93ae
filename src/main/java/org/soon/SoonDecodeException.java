// Copyright The SOON Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package org.soon;

/**
 * An error detected while decoding SOON text. Carries the 1-based line and
 * column of the detection point and, once {@link #attachSource} has been
 * called, a single-line excerpt of the offending source with a {@code ^}
 * under the column.
 * <p>
 * A line or column of zero means the position is unknown.
 */
public class SoonDecodeException
    extends SoonException
{
    private static final long serialVersionUID = 1L;

    private final String myReason;
    private final int    myLine;
    private final int    myColumn;
    private String       mySourceExcerpt;

    public SoonDecodeException(String reason, int line, int column)
    {
        super(reason);
        myReason = reason;
        myLine = line;
        myColumn = column;
    }

    public SoonDecodeException(String reason, int line, int column,
                               Throwable cause)
    {
        super(reason, cause);
        myReason = reason;
        myLine = line;
        myColumn = column;
    }

    /** The problem description, without position information. */
    public String getReason()
    {
        return myReason;
    }

    public int getLine()
    {
        return myLine;
    }

    public int getColumn()
    {
        return myColumn;
    }

    /**
     * @return the offending source line followed by a pointer line, or null
     * if no source has been attached or the position is unknown.
     */
    public String getSourceExcerpt()
    {
        return mySourceExcerpt;
    }

    /**
     * Records the excerpt of {@code source} at this exception's line.
     * Does nothing when the line is unknown or out of range.
     */
    public final void attachSource(CharSequence source)
    {
        if (source == null || myLine < 1) return;

        String text = source.toString();
        int start = 0;
        for (int line = 1; line < myLine; line++)
        {
            int nl = text.indexOf('\n', start);
            if (nl < 0) return;
            start = nl + 1;
        }
        int end = text.indexOf('\n', start);
        if (end < 0) end = text.length();
        String lineText = text.substring(start, end);
        if (lineText.endsWith("\r"))
        {
            lineText = lineText.substring(0, lineText.length() - 1);
        }

        StringBuilder excerpt = new StringBuilder(lineText.length() * 2 + 2);
        excerpt.append(lineText).append('\n');
        for (int i = 1; i < myColumn; i++)
        {
            excerpt.append(' ');
        }
        excerpt.append('^');
        mySourceExcerpt = excerpt.toString();
    }

    @Override
    public String getMessage()
    {
        if (myLine < 1) return myReason;
        return myReason + " at line " + myLine + ", column " + myColumn;
    }

    @Override
    public String toString()
    {
        String s = getClass().getSimpleName() + ": " + getMessage();
        if (mySourceExcerpt != null)
        {
            s += "\n" + mySourceExcerpt;
        }
        return s;
    }
}
