// Copyright The SOON Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package org.soon;

/**
 * An error caused by a token sequence that does not form a valid document: a duplicate
 * key, nesting beyond the configured depth, an invalid date literal, or (in
 * strict mode) any line the parser cannot place.
 */
public class SoonParseException
    extends SoonDecodeException
{
    private static final long serialVersionUID = 1L;

    public SoonParseException(String reason, int line, int column)
    {
        super(reason, line, column);
    }

    public SoonParseException(String reason, int line, int column, Throwable cause)
    {
        super(reason, line, column, cause);
    }
}
