// Copyright The SOON Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package org.soon;

import org.soon.util.AbstractValueVisitor;

/**
 * A Visitor for the SOON value hierarchy. Every variant has its own
 * method, so an implementation covers the whole value model.
 *
 * @param <R> the result type of a visit.
 *
 * @see AbstractValueVisitor
 */
public interface ValueVisitor<R>
{
    public R visit(SoonNull value);

    public R visit(SoonBool value);

    public R visit(SoonNumber value);

    public R visit(SoonString value);

    public R visit(SoonTimestamp value);

    public R visit(SoonBlob value);

    public R visit(SoonList value);

    public R visit(SoonStruct value);
}
