// Copyright The SOON Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package org.soon.impl;

import org.soon.SoonDecodeException;
import org.soon.SoonDecoder;
import org.soon.SoonValue;
import org.soon.ValidationResult;
import org.soon.impl.ast.RootNode;
import org.soon.system.SoonDecoderBuilder;

/**
 * Runs text through the lexer, parser and evaluator.
 */
final class SoonTextDecoder
    implements SoonDecoder
{
    private final SoonDecoderBuilder myOptions;

    /**
     * @param options must be immutable.
     */
    SoonTextDecoder(SoonDecoderBuilder options)
    {
        myOptions = options;
    }

    public SoonValue decode(CharSequence text)
    {
        try
        {
            RootNode root = new SoonParser(SoonLexer.tokenize(text), myOptions).parse();
            return new SoonEvaluator().evaluate(root);
        }
        catch (SoonDecodeException e)
        {
            e.attachSource(text);
            throw e;
        }
    }

    public ValidationResult validate(CharSequence text)
    {
        try
        {
            decode(text);
            return ValidationResult.valid();
        }
        catch (SoonDecodeException e)
        {
            return ValidationResult.invalid(e);
        }
    }
}
