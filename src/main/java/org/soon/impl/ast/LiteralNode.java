// Copyright The SOON Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package org.soon.impl.ast;

import org.soon.SoonValue;
import org.soon.impl.Position;
import org.soon.impl.TokenType;

/**
 * A scalar, already converted to its value, with the kind of token it was
 * read from.
 */
public final class LiteralNode
    extends AstNode
{
    private final SoonValue myValue;
    private final TokenType myKind;

    public LiteralNode(Position position, SoonValue value, TokenType kind)
    {
        super(position);
        myValue = value;
        myKind = kind;
    }

    public SoonValue getValue()
    {
        return myValue;
    }

    public TokenType getKind()
    {
        return myKind;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor)
    {
        return visitor.visit(this);
    }
}
