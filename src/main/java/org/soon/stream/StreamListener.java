// Copyright The SOON Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package org.soon.stream;

import org.soon.SoonDecodeException;

/**
 * Receives the events of a {@link StreamParser}, on the thread that calls
 * {@link StreamParser#write} or {@link StreamParser#end}, in the order the
 * chunks appear in the input.
 *
 * @see AbstractStreamListener
 */
public interface StreamListener
{
    /**
     * Called once for each chunk that decodes.
     */
    public void onChunk(SoonChunk chunk);

    /**
     * Called once for each chunk that fails to decode. The stream carries
     * on with the next chunk.
     *
     * @param chunkId the id of the failed chunk.
     * @param error why it failed; positions are relative to the chunk.
     */
    public void onError(String chunkId, SoonDecodeException error);

    /**
     * Called once, after the last chunk, when the stream is ended.
     */
    public void onEnd();
}
