// Copyright The SOON Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package org.soon.impl.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.soon.impl.Position;

/**
 * A record: an ordered list of properties. Repeated keys are kept in order
 * and resolve last-wins during evaluation.
 */
public final class ObjectNode
    extends AstNode
{
    private final List<PropertyNode> myProperties = new ArrayList<PropertyNode>();

    public ObjectNode(Position position)
    {
        super(position);
    }

    public void add(PropertyNode property)
    {
        myProperties.add(property);
    }

    public List<PropertyNode> getProperties()
    {
        return Collections.unmodifiableList(myProperties);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor)
    {
        return visitor.visit(this);
    }
}
