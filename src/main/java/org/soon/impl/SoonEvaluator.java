// Copyright The SOON Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package org.soon.impl;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.soon.SoonEvalException;
import org.soon.SoonList;
import org.soon.SoonNull;
import org.soon.SoonStruct;
import org.soon.SoonValue;
import org.soon.UndefinedAnchorException;
import org.soon.impl.ast.AnchorDefNode;
import org.soon.impl.ast.AnchorRefNode;
import org.soon.impl.ast.ArrayNode;
import org.soon.impl.ast.AstNode;
import org.soon.impl.ast.AstVisitor;
import org.soon.impl.ast.LiteralNode;
import org.soon.impl.ast.ObjectNode;
import org.soon.impl.ast.PropertyNode;
import org.soon.impl.ast.RootNode;

/**
 * Turns a syntax tree into a value.
 * <p>
 * An empty document is null and a document with a single non-keyed unit is
 * that unit's value. Otherwise the top-level units form one record: keyed
 * units under their keys and anonymous ones under their position.
 * <p>
 * Anchors are scoped to one evaluator. Each reference yields a deep copy
 * of the anchored value, so no two places in the result share state.
 */
public final class SoonEvaluator
    implements AstVisitor<SoonValue>
{
    private final Map<String, SoonValue> myAnchors = new HashMap<String, SoonValue>();

    public SoonValue evaluate(RootNode root)
    {
        return root.accept(this);
    }

    public SoonValue visit(RootNode node)
    {
        List<AstNode> children = node.getChildren();
        if (children.isEmpty()) return SoonNull.NULL;

        if (children.size() == 1)
        {
            AstNode only = children.get(0);
            // a lone property still makes a record
            if (! (only instanceof PropertyNode))
            {
                return only.accept(this);
            }
        }

        SoonStruct result = new SoonStruct();
        for (int i = 0; i < children.size(); i++)
        {
            AstNode child = children.get(i);
            if (child instanceof PropertyNode)
            {
                PropertyNode property = (PropertyNode) child;
                result.put(property.getKey(), property.getValue().accept(this));
            }
            else if (child instanceof AnchorDefNode)
            {
                result.put(((AnchorDefNode) child).getName(), child.accept(this));
            }
            else
            {
                result.put(String.valueOf(i), child.accept(this));
            }
        }
        return result;
    }

    public SoonValue visit(ObjectNode node)
    {
        SoonStruct result = new SoonStruct();
        for (PropertyNode property : node.getProperties())
        {
            result.put(property.getKey(), property.getValue().accept(this));
        }
        return result;
    }

    public SoonValue visit(ArrayNode node)
    {
        SoonList result = new SoonList();
        for (AstNode element : node.getElements())
        {
            result.add(element.accept(this));
        }
        return result;
    }

    /**
     * Properties are only evaluated through their owners.
     */
    public SoonValue visit(PropertyNode node)
    {
        throw new SoonEvalException("Property '" + node.getKey()
                                    + "' outside of a record",
                                    line(node), column(node));
    }

    public SoonValue visit(LiteralNode node)
    {
        return node.getValue();
    }

    public SoonValue visit(AnchorDefNode node)
    {
        SoonValue value = node.getValue().accept(this);
        myAnchors.put(node.getName(), value);
        return value;
    }

    public SoonValue visit(AnchorRefNode node)
    {
        SoonValue value = myAnchors.get(node.getName());
        if (value == null)
        {
            throw new UndefinedAnchorException(node.getName(), line(node), column(node));
        }
        return value.clone();
    }

    private static int line(AstNode node)
    {
        return (node.getPosition() == null ? 0 : node.getPosition().getLine());
    }

    private static int column(AstNode node)
    {
        return (node.getPosition() == null ? 0 : node.getPosition().getColumn());
    }
}
