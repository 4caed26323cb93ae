// Copyright The SOON Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package org.soon.impl.ast;

import org.soon.impl.Position;

/**
 * A reference to an anchor defined earlier in the document, written
 * {@code *name}.
 */
public final class AnchorRefNode
    extends AstNode
{
    private final String myName;

    public AnchorRefNode(Position position, String name)
    {
        super(position);
        myName = name;
    }

    public String getName()
    {
        return myName;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor)
    {
        return visitor.visit(this);
    }
}
