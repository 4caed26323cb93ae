// Copyright The SOON Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package org.soon.impl.ast;

/**
 * A Visitor for the syntax tree.
 *
 * @param <R> the result type of a visit.
 */
public interface AstVisitor<R>
{
    public R visit(RootNode node);

    public R visit(ObjectNode node);

    public R visit(ArrayNode node);

    public R visit(PropertyNode node);

    public R visit(LiteralNode node);

    public R visit(AnchorDefNode node);

    public R visit(AnchorRefNode node);
}
