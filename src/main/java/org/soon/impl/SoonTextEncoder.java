// Copyright The SOON Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package org.soon.impl;

import java.io.IOException;
import org.soon.SoonEncoder;
import org.soon.SoonValue;
import org.soon.system.SoonEncoderBuilder;

final class SoonTextEncoder
    implements SoonEncoder
{
    private final SoonEncoderBuilder myOptions;

    /**
     * @param options must be immutable.
     */
    SoonTextEncoder(SoonEncoderBuilder options)
    {
        myOptions = options;
    }

    public String encode(SoonValue value)
    {
        return new SoonSerializer(myOptions).serialize(value);
    }

    public void encode(SoonValue value, Appendable out)
        throws IOException
    {
        out.append(encode(value));
    }
}
