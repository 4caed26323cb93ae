// Copyright The SOON Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package org.soon;

/**
 * An error caused by input the lexer cannot turn into tokens, such as an
 * unexpected character or an unterminated quoted string.
 */
public class SoonLexException
    extends SoonDecodeException
{
    private static final long serialVersionUID = 1L;

    public SoonLexException(String reason, int line, int column)
    {
        super(reason, line, column);
    }

    public SoonLexException(String reason, int line, int column, Throwable cause)
    {
        super(reason, line, column, cause);
    }
}
