// Copyright The SOON Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package org.soon.impl;

import org.soon.SoonDecoder;
import org.soon.stream.StreamListener;
import org.soon.stream.StreamParser;
import org.soon.system.SoonDecoderBuilder;

/**
 * {@link SoonDecoderBuilder} extension for internal use only.
 */
public class _Private_SoonDecoderBuilder
    extends SoonDecoderBuilder
{
    private _Private_SoonDecoderBuilder()
    {
        super();
    }

    private _Private_SoonDecoderBuilder(SoonDecoderBuilder that)
    {
        super(that);
    }

    @Override
    public SoonDecoder build()
    {
        return new SoonTextDecoder(immutable());
    }

    @Override
    public StreamParser buildStreamParser(StreamListener listener)
    {
        return new StreamParser(listener, immutable());
    }

    public static class Mutable
        extends _Private_SoonDecoderBuilder
    {
        public Mutable()
        {
        }

        public Mutable(SoonDecoderBuilder that)
        {
            super(that);
        }

        @Override
        public SoonDecoderBuilder immutable()
        {
            return new _Private_SoonDecoderBuilder(this);
        }

        @Override
        public SoonDecoderBuilder mutable()
        {
            return this;
        }

        @Override
        protected void mutationCheck()
        {
        }
    }
}
