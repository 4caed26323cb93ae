// Copyright The SOON Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package org.soon.system;

import org.soon.SoonEncoder;
import org.soon.impl._Private_SoonEncoderBuilder;

/**
 * Builds {@link SoonEncoder}s.
 * <p>
 * Two standard configurations are available: {@link #standard()}, which
 * writes one key per line, and {@link #compact()}, which folds small flat
 * records into a single {@code key:value} line.
 *
 * <h2>Configuration Properties</h2>
 * <ul>
 *   <li>{@code indent}: spaces per nesting level, 2 by default.</li>
 *   <li>{@code sortKeys}: write record keys in lexicographic order rather
 *   than insertion order.</li>
 *   <li>{@code compact}: write records of at most four scalar fields as
 *   one inline line.</li>
 * </ul>
 * Builders are not thread-safe unless made {@link #immutable()}.
 */
public abstract class SoonEncoderBuilder
{
    public static final int DEFAULT_INDENT = 2;

    private int indent = DEFAULT_INDENT;
    private boolean sortKeys = false;
    private boolean compact = false;

    protected SoonEncoderBuilder()
    {
    }

    protected SoonEncoderBuilder(SoonEncoderBuilder that)
    {
        this.indent = that.indent;
        this.sortKeys = that.sortKeys;
        this.compact = that.compact;
    }

    /**
     * The standard builder of {@link SoonEncoder}s, with all configuration
     * properties having their default values.
     *
     * @return a new, mutable builder instance.
     */
    public static SoonEncoderBuilder standard()
    {
        return new _Private_SoonEncoderBuilder.Mutable();
    }

    /**
     * A builder with compact output enabled.
     *
     * @return a new, mutable builder instance.
     */
    public static SoonEncoderBuilder compact()
    {
        return standard().withCompact(true);
    }

    /**
     * Creates a mutable copy of this builder.
     */
    public SoonEncoderBuilder copy()
    {
        return new _Private_SoonEncoderBuilder.Mutable(this);
    }

    /**
     * @return this builder instance, if immutable;
     * otherwise an immutable copy of this builder.
     */
    public SoonEncoderBuilder immutable()
    {
        return this;
    }

    /**
     * @return this instance, if mutable;
     * otherwise a mutable copy of this instance.
     */
    public SoonEncoderBuilder mutable()
    {
        return copy();
    }

    /** NOT FOR APPLICATION USE! */
    protected void mutationCheck()
    {
        throw new UnsupportedOperationException("This builder is immutable");
    }


    //=========================================================================

    public SoonEncoderBuilder withIndent(int indent)
    {
        SoonEncoderBuilder b = mutable();
        b.setIndent(indent);
        return b;
    }

    /**
     * @throws UnsupportedOperationException if this builder is immutable.
     * @throws IllegalArgumentException if {@code indent} is less than one.
     */
    public void setIndent(int indent)
    {
        mutationCheck();
        if (indent < 1)
        {
            throw new IllegalArgumentException("indent must be at least 1: " + indent);
        }
        this.indent = indent;
    }

    public int getIndent()
    {
        return indent;
    }


    public SoonEncoderBuilder withSortKeys(boolean sort)
    {
        SoonEncoderBuilder b = mutable();
        b.setSortKeys(sort);
        return b;
    }

    public void setSortKeys(boolean sort)
    {
        mutationCheck();
        sortKeys = sort;
    }

    public boolean isSortKeys()
    {
        return sortKeys;
    }


    public SoonEncoderBuilder withCompact(boolean compact)
    {
        SoonEncoderBuilder b = mutable();
        b.setCompact(compact);
        return b;
    }

    public void setCompact(boolean compact)
    {
        mutationCheck();
        this.compact = compact;
    }

    public boolean isCompact()
    {
        return compact;
    }


    //=========================================================================

    /**
     * Builds an encoder with this builder's current configuration. Later
     * changes to this builder do not affect it.
     */
    public abstract SoonEncoder build();
}
