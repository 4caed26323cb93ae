// Copyright The SOON Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package org.soon.impl.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.soon.impl.Position;

/**
 * The top of a parsed document: its top-level units in order.
 */
public final class RootNode
    extends AstNode
{
    private final List<AstNode> myChildren = new ArrayList<AstNode>();

    public RootNode(Position position)
    {
        super(position);
    }

    public void add(AstNode child)
    {
        myChildren.add(child);
    }

    public List<AstNode> getChildren()
    {
        return Collections.unmodifiableList(myChildren);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor)
    {
        return visitor.visit(this);
    }
}
