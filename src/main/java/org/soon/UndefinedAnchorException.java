// Copyright The SOON Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package org.soon;

/**
 * Thrown when a {@code *name} reference names an anchor that has not been
 * defined earlier in the same document.
 */
public class UndefinedAnchorException
    extends SoonEvalException
{
    private static final long serialVersionUID = 1L;

    private final String myAnchorName;

    public UndefinedAnchorException(String anchorName, int line, int column)
    {
        super("Undefined anchor: " + anchorName, line, column);
        myAnchorName = anchorName;
    }

    public String getAnchorName()
    {
        return myAnchorName;
    }
}
