// Copyright The SOON Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package org.soon.stream;

import org.soon.SoonDecodeException;

/**
 * A base class for {@link StreamListener}s whose methods do nothing, for
 * subclasses that care about only some events.
 */
public abstract class AbstractStreamListener
    implements StreamListener
{
    public void onChunk(SoonChunk chunk)
    {
    }

    public void onError(String chunkId, SoonDecodeException error)
    {
    }

    public void onEnd()
    {
    }
}
