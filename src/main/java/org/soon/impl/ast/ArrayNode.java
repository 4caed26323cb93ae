// Copyright The SOON Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package org.soon.impl.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.soon.impl.Position;

public final class ArrayNode
    extends AstNode
{
    private final List<AstNode> myElements = new ArrayList<AstNode>();

    public ArrayNode(Position position)
    {
        super(position);
    }

    public void add(AstNode element)
    {
        myElements.add(element);
    }

    public List<AstNode> getElements()
    {
        return Collections.unmodifiableList(myElements);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor)
    {
        return visitor.visit(this);
    }
}
