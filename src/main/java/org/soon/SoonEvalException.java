// Copyright The SOON Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package org.soon;

/**
 * An error raised while turning a syntax tree into values. Apart from
 * {@link UndefinedAnchorException} this signals a broken internal invariant
 * rather than bad input.
 */
public class SoonEvalException
    extends SoonDecodeException
{
    private static final long serialVersionUID = 1L;

    public SoonEvalException(String reason, int line, int column)
    {
        super(reason, line, column);
    }

    public SoonEvalException(String reason, int line, int column, Throwable cause)
    {
        super(reason, line, column, cause);
    }
}
