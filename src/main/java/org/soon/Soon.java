// Copyright The SOON Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package org.soon;

import org.soon.stream.StreamListener;
import org.soon.stream.StreamParser;
import org.soon.system.SoonDecoderBuilder;
import org.soon.system.SoonEncoderBuilder;

/**
 * Static entry points for decoding and encoding SOON text with default or
 * given settings.
 * <pre>
 * SoonValue value = Soon.decode("name John\nage 30");
 * String text = Soon.encode(value, SoonEncoderBuilder.compact());
 * </pre>
 * Callers that decode or encode repeatedly with the same settings should
 * keep a {@link SoonDecoder} or {@link SoonEncoder} built once.
 */
public final class Soon
{
    private static final SoonDecoder DEFAULT_DECODER =
        SoonDecoderBuilder.standard().build();

    private static final SoonEncoder DEFAULT_ENCODER =
        SoonEncoderBuilder.standard().build();

    private Soon()
    {
    }

    /**
     * @throws SoonDecodeException on the first error, with the source
     * excerpt attached.
     */
    public static SoonValue decode(String text)
    {
        return DEFAULT_DECODER.decode(text);
    }

    /**
     * @throws SoonDecodeException on the first error, with the source
     * excerpt attached.
     */
    public static SoonValue decode(String text, SoonDecoderBuilder options)
    {
        return options.build().decode(text);
    }

    /**
     * @throws SoonEncodeException if the value cannot be expressed.
     */
    public static String encode(SoonValue value)
    {
        return DEFAULT_ENCODER.encode(value);
    }

    /**
     * @throws SoonEncodeException if the value cannot be expressed.
     */
    public static String encode(SoonValue value, SoonEncoderBuilder options)
    {
        return options.build().encode(value);
    }

    public static ValidationResult validate(String text)
    {
        return DEFAULT_DECODER.validate(text);
    }

    /**
     * Opens a stream parser with the default decoder settings.
     */
    public static StreamParser openStream(StreamListener listener)
    {
        return SoonDecoderBuilder.standard().buildStreamParser(listener);
    }
}
