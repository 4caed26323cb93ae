// Copyright The SOON Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package org.soon;

import org.soon.system.SoonDecoderBuilder;

/**
 * Decodes SOON text into values. Instances are obtained from
 * {@link SoonDecoderBuilder#build()}, are immutable and may be shared
 * across threads.
 */
public interface SoonDecoder
{
    /**
     * Decodes one document.
     *
     * @return the decoded value; an empty document is {@link SoonNull#NULL}.
     *
     * @throws SoonDecodeException on the first error, with the source
     * excerpt attached.
     */
    public SoonValue decode(CharSequence text);

    /**
     * Checks whether the text decodes, without throwing.
     */
    public ValidationResult validate(CharSequence text);
}
