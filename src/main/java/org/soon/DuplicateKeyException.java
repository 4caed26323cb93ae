// Copyright The SOON Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package org.soon;

/**
 * Thrown when a key appears twice in the same block and duplicate keys
 * have not been allowed.
 *
 * @see org.soon.system.SoonDecoderBuilder#withAllowDuplicateKeys(boolean)
 */
public class DuplicateKeyException
    extends SoonParseException
{
    private static final long serialVersionUID = 1L;

    private final String myKey;

    public DuplicateKeyException(String key, int line, int column)
    {
        super("Duplicate key: " + key, line, column);
        myKey = key;
    }

    public String getKey()
    {
        return myKey;
    }
}
