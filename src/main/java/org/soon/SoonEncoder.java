// Copyright The SOON Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package org.soon;

import java.io.IOException;
import org.soon.system.SoonEncoderBuilder;

/**
 * Encodes values as SOON text. Instances are obtained from
 * {@link SoonEncoderBuilder#build()}, are immutable and may be shared
 * across threads.
 */
public interface SoonEncoder
{
    /**
     * @throws SoonEncodeException if the value cannot be expressed.
     */
    public String encode(SoonValue value);

    /**
     * Encodes the value and appends the text to {@code out}. Nothing is
     * appended if the value cannot be expressed.
     *
     * @throws SoonEncodeException if the value cannot be expressed.
     * @throws IOException if the {@link Appendable} throws an exception.
     */
    public void encode(SoonValue value, Appendable out)
        throws IOException;
}
