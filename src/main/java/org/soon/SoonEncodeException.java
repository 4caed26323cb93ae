// Copyright The SOON Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package org.soon;

/**
 * An error caused by a value that has no SOON text form: a non-finite
 * number, a timestamp outside the four-digit-year range, or containers
 * nested where the grammar has no layout for them.
 */
public class SoonEncodeException
    extends SoonException
{
    private static final long serialVersionUID = 1L;

    public SoonEncodeException(String message)
    {
        super(message);
    }

    public SoonEncodeException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
