// Copyright The SOON Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package org.soon.impl;

import org.soon.SoonEncoder;
import org.soon.system.SoonEncoderBuilder;

/**
 * {@link SoonEncoderBuilder} extension for internal use only.
 */
public class _Private_SoonEncoderBuilder
    extends SoonEncoderBuilder
{
    private _Private_SoonEncoderBuilder()
    {
        super();
    }

    private _Private_SoonEncoderBuilder(SoonEncoderBuilder that)
    {
        super(that);
    }

    @Override
    public SoonEncoder build()
    {
        return new SoonTextEncoder(immutable());
    }

    public static class Mutable
        extends _Private_SoonEncoderBuilder
    {
        public Mutable()
        {
        }

        public Mutable(SoonEncoderBuilder that)
        {
            super(that);
        }

        @Override
        public SoonEncoderBuilder immutable()
        {
            return new _Private_SoonEncoderBuilder(this);
        }

        @Override
        public SoonEncoderBuilder mutable()
        {
            return this;
        }

        @Override
        protected void mutationCheck()
        {
        }
    }
}
