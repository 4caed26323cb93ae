// Copyright The SOON Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package org.soon.impl.ast;

import org.soon.impl.Position;

/**
 * A key and its value inside a record or at the top level.
 */
public final class PropertyNode
    extends AstNode
{
    private final String  myKey;
    private final AstNode myValue;

    public PropertyNode(Position position, String key, AstNode value)
    {
        super(position);
        myKey = key;
        myValue = value;
    }

    public String getKey()
    {
        return myKey;
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
