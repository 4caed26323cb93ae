// Copyright The SOON Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package org.soon;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * An ordered sequence of SOON values.
 * <p>
 * Java {@code null} is not a legal element; use {@link SoonNull#NULL}.
 */
public final class SoonList
    extends SoonValue
    implements Iterable<SoonValue>
{
    private final ArrayList<SoonValue> myElements;

    public SoonList()
    {
        myElements = new ArrayList<>();
    }

    private SoonList(int capacity)
    {
        myElements = new ArrayList<>(capacity);
    }

    public static SoonList of(SoonValue... elements)
    {
        SoonList list = new SoonList(elements.length);
        for (SoonValue v : elements)
        {
            list.add(v);
        }
        return list;
    }

    /**
     * Appends an element.
     *
     * @return this list.
     */
    public SoonList add(SoonValue element)
    {
        if (element == null) throw new NullPointerException("element");
        myElements.add(element);
        return this;
    }

    public SoonList add(String text)
    {
        return add(SoonValue.of(text));
    }

    public SoonList add(long value)
    {
        return add(SoonNumber.valueOf(value));
    }

    public SoonList add(double value)
    {
        return add(SoonNumber.valueOf(value));
    }

    public SoonList add(boolean value)
    {
        return add(SoonBool.valueOf(value));
    }

    public SoonValue get(int index)
    {
        return myElements.get(index);
    }

    /**
     * @return the element previously at the index.
     */
    public SoonValue set(int index, SoonValue element)
    {
        if (element == null) throw new NullPointerException("element");
        return myElements.set(index, element);
    }

    public SoonValue remove(int index)
    {
        return myElements.remove(index);
    }

    public int size()
    {
        return myElements.size();
    }

    public boolean isEmpty()
    {
        return myElements.isEmpty();
    }

    /**
     * @return an unmodifiable view of the elements.
     */
    public List<SoonValue> values()
    {
        return Collections.unmodifiableList(myElements);
    }

    public Iterator<SoonValue> iterator()
    {
        return values().iterator();
    }

    @Override
    public SoonType getType()
    {
        return SoonType.LIST;
    }

    @Override
    public <R> R accept(ValueVisitor<R> visitor)
    {
        return visitor.visit(this);
    }

    @Override
    public SoonList clone()
    {
        SoonList copy = new SoonList(myElements.size());
        for (SoonValue v : myElements)
        {
            copy.myElements.add(v.clone());
        }
        return copy;
    }

    @Override
    public boolean equals(Object other)
    {
        return other instanceof SoonList
            && ((SoonList) other).myElements.equals(myElements);
    }

    @Override
    public int hashCode()
    {
        return myElements.hashCode();
    }
}
