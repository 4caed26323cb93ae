// Copyright The SOON Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package org.soon.system;

import org.soon.SoonDecoder;
import org.soon.impl._Private_SoonDecoderBuilder;
import org.soon.stream.StreamListener;
import org.soon.stream.StreamParser;

/**
 * Builds {@link SoonDecoder}s and {@link StreamParser}s.
 * <p>
 * An {@code SoonDecoderBuilder} with the default configuration is obtained
 * from {@link #standard()} and configured by chaining {@code with*()}
 * calls:
 * <pre>
 * SoonDecoder decoder = SoonDecoderBuilder.standard()
 *     .withMaxDepth(20)
 *     .withStrict(true)
 *     .build();
 * </pre>
 *
 * <h2>Configuration Properties</h2>
 * <ul>
 *   <li>{@code allowDuplicateKeys}: when false (the default) a key repeated
 *   in one block is a {@link org.soon.DuplicateKeyException}; when true the
 *   last occurrence wins.</li>
 *   <li>{@code maxDepth}: how many nested record blocks may be open at
 *   once, 100 by default.</li>
 *   <li>{@code strict}: when true, input the parser would otherwise skip or
 *   reinterpret is rejected.</li>
 *   <li>{@code streaming}: marks the input as one chunk of a stream, which
 *   shows in error messages.</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * Builders are not thread-safe unless made {@link #immutable()}. The
 * decoders they build are immutable and may be shared across threads.
 */
public abstract class SoonDecoderBuilder
{
    public static final int DEFAULT_MAX_DEPTH = 100;

    private boolean allowDuplicateKeys = false;
    private int maxDepth = DEFAULT_MAX_DEPTH;
    private boolean strict = false;
    private boolean streaming = false;

    protected SoonDecoderBuilder()
    {
    }

    protected SoonDecoderBuilder(SoonDecoderBuilder that)
    {
        this.allowDuplicateKeys = that.allowDuplicateKeys;
        this.maxDepth = that.maxDepth;
        this.strict = that.strict;
        this.streaming = that.streaming;
    }

    /**
     * The standard builder of {@link SoonDecoder}s, with all configuration
     * properties having their default values.
     *
     * @return a new, mutable builder instance.
     */
    public static SoonDecoderBuilder standard()
    {
        return new _Private_SoonDecoderBuilder.Mutable();
    }

    /**
     * Creates a mutable copy of this builder.
     *
     * @return a new builder with the same configuration as {@code this}.
     */
    public SoonDecoderBuilder copy()
    {
        return new _Private_SoonDecoderBuilder.Mutable(this);
    }

    /**
     * Returns an immutable builder configured exactly like this one.
     *
     * @return this builder instance, if immutable;
     * otherwise an immutable copy of this builder.
     */
    public SoonDecoderBuilder immutable()
    {
        return this;
    }

    /**
     * Returns a mutable builder configured exactly like this one.
     *
     * @return this instance, if mutable;
     * otherwise a mutable copy of this instance.
     */
    public SoonDecoderBuilder mutable()
    {
        return copy();
    }

    /** NOT FOR APPLICATION USE! */
    protected void mutationCheck()
    {
        throw new UnsupportedOperationException("This builder is immutable");
    }


    //=========================================================================

    /**
     * @return this builder instance, if mutable;
     * otherwise a mutable copy of this builder.
     *
     * @see #setAllowDuplicateKeys(boolean)
     */
    public SoonDecoderBuilder withAllowDuplicateKeys(boolean allow)
    {
        SoonDecoderBuilder b = mutable();
        b.setAllowDuplicateKeys(allow);
        return b;
    }

    /**
     * @throws UnsupportedOperationException if this builder is immutable.
     */
    public void setAllowDuplicateKeys(boolean allow)
    {
        mutationCheck();
        allowDuplicateKeys = allow;
    }

    public boolean isAllowDuplicateKeys()
    {
        return allowDuplicateKeys;
    }


    /**
     * @return this builder instance, if mutable;
     * otherwise a mutable copy of this builder.
     *
     * @see #setMaxDepth(int)
     */
    public SoonDecoderBuilder withMaxDepth(int depth)
    {
        SoonDecoderBuilder b = mutable();
        b.setMaxDepth(depth);
        return b;
    }

    /**
     * Sets how many nested record blocks may be open at once. Entering one
     * more is a {@link org.soon.SoonParseException}.
     *
     * @throws UnsupportedOperationException if this builder is immutable.
     * @throws IllegalArgumentException if {@code depth} is less than one.
     */
    public void setMaxDepth(int depth)
    {
        mutationCheck();
        if (depth < 1)
        {
            throw new IllegalArgumentException("maxDepth must be at least 1: " + depth);
        }
        maxDepth = depth;
    }

    public int getMaxDepth()
    {
        return maxDepth;
    }


    /**
     * @return this builder instance, if mutable;
     * otherwise a mutable copy of this builder.
     *
     * @see #setStrict(boolean)
     */
    public SoonDecoderBuilder withStrict(boolean strict)
    {
        SoonDecoderBuilder b = mutable();
        b.setStrict(strict);
        return b;
    }

    /**
     * In strict mode the parser rejects lines it cannot place, malformed
     * inline pairs, orphan indented blocks, surplus table cells and stray
     * {@code :} or {@code |} tokens in value positions. Otherwise it skips
     * or reinterprets them.
     *
     * @throws UnsupportedOperationException if this builder is immutable.
     */
    public void setStrict(boolean strict)
    {
        mutationCheck();
        this.strict = strict;
    }

    public boolean isStrict()
    {
        return strict;
    }


    /**
     * @return this builder instance, if mutable;
     * otherwise a mutable copy of this builder.
     *
     * @see #setStreaming(boolean)
     */
    public SoonDecoderBuilder withStreaming(boolean streaming)
    {
        SoonDecoderBuilder b = mutable();
        b.setStreaming(streaming);
        return b;
    }

    /**
     * @throws UnsupportedOperationException if this builder is immutable.
     */
    public void setStreaming(boolean streaming)
    {
        mutationCheck();
        this.streaming = streaming;
    }

    public boolean isStreaming()
    {
        return streaming;
    }


    //=========================================================================

    /**
     * Builds a decoder with this builder's current configuration. Later
     * changes to this builder do not affect it.
     */
    public abstract SoonDecoder build();

    /**
     * Builds a stream parser that decodes each chunk with this builder's
     * current configuration and reports to {@code listener}.
     */
    public abstract StreamParser buildStreamParser(StreamListener listener);
}
