// Copyright The SOON Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package org.soon.util;

import org.soon.SoonBlob;
import org.soon.SoonBool;
import org.soon.SoonList;
import org.soon.SoonNull;
import org.soon.SoonNumber;
import org.soon.SoonString;
import org.soon.SoonStruct;
import org.soon.SoonTimestamp;
import org.soon.SoonValue;
import org.soon.ValueVisitor;

/**
 * A base class for extending SOON {@link ValueVisitor}s.
 * All <code>visit</code> methods are implemented to call
 * {@link #defaultVisit(SoonValue)}.
 *
 * @param <R> the result type of a visit.
 */
public abstract class AbstractValueVisitor<R>
    implements ValueVisitor<R>
{
    /**
     * Default visitation behavior, called by all <code>visit</code> methods
     * in {@link AbstractValueVisitor}.  Subclasses should override this unless
     * they override all <code>visit</code> methods.
     * <p>
     * This implementation always throws {@link UnsupportedOperationException}.
     *
     * @param value the value to visit.
     * @throws UnsupportedOperationException always thrown unless subclass
     * overrides this implementation.
     */
    protected R defaultVisit(SoonValue value)
    {
        throw new UnsupportedOperationException(value.getType().toString());
    }

    public R visit(SoonNull value)
    {
        return defaultVisit(value);
    }

    public R visit(SoonBool value)
    {
        return defaultVisit(value);
    }

    public R visit(SoonNumber value)
    {
        return defaultVisit(value);
    }

    public R visit(SoonString value)
    {
        return defaultVisit(value);
    }

    public R visit(SoonTimestamp value)
    {
        return defaultVisit(value);
    }

    public R visit(SoonBlob value)
    {
        return defaultVisit(value);
    }

    public R visit(SoonList value)
    {
        return defaultVisit(value);
    }

    public R visit(SoonStruct value)
    {
        return defaultVisit(value);
    }
}
