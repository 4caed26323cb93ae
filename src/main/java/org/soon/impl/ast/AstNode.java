// Copyright The SOON Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package org.soon.impl.ast;

import org.soon.impl.Position;

/**
 * A node of the syntax tree built by the parser. The tree is strict:
 * every node has one owner, and anchor references name their target
 * instead of linking to it.
 */
public abstract class AstNode
{
    private final Position myPosition;

    AstNode(Position position)
    {
        myPosition = position;
    }

    /**
     * @return where the node starts in the source; may be null for nodes
     * synthesized by the parser.
     */
    public final Position getPosition()
    {
        return myPosition;
    }

    public abstract <R> R accept(AstVisitor<R> visitor);
}
