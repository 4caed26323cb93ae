// Copyright The SOON Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package org.soon.impl.ast;

import org.soon.impl.Position;

/**
 * Binds a name to a value, written {@code &name value}. The node evaluates
 * to the value itself.
 */
public final class AnchorDefNode
    extends AstNode
{
    private final String  myName;
    private final AstNode myValue;

    public AnchorDefNode(Position position, String name, AstNode value)
    {
        super(position);
        myName = name;
        myValue = value;
    }

    public String getName()
    {
        return myName;
    }

    public AstNode getValue()
    {
        return myValue;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor)
    {
        return visitor.visit(this);
    }
}
