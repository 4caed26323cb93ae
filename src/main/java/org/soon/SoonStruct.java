// Copyright The SOON Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package org.soon;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * A SOON record: a mapping from string keys to values.
 * <p>
 * Insertion order is kept and drives the encoder's output order, but it is
 * not part of equality. Putting an existing key replaces its value in place.
 */
public final class SoonStruct
    extends SoonValue
{
    private final LinkedHashMap<String, SoonValue> myFields;

    public SoonStruct()
    {
        myFields = new LinkedHashMap<>();
    }

    /**
     * Sets a field, replacing any previous value for the key.
     *
     * @return this struct.
     */
    public SoonStruct put(String key, SoonValue value)
    {
        if (key == null) throw new NullPointerException("key");
        if (value == null) throw new NullPointerException("value");
        myFields.put(key, value);
        return this;
    }

    public SoonStruct put(String key, String text)
    {
        return put(key, SoonValue.of(text));
    }

    public SoonStruct put(String key, long value)
    {
        return put(key, SoonNumber.valueOf(value));
    }

    public SoonStruct put(String key, double value)
    {
        return put(key, SoonNumber.valueOf(value));
    }

    public SoonStruct put(String key, boolean value)
    {
        return put(key, SoonBool.valueOf(value));
    }

    /**
     * @return the value for the key, or null if there is no such field.
     */
    public SoonValue get(String key)
    {
        return myFields.get(key);
    }

    public boolean containsKey(String key)
    {
        return myFields.containsKey(key);
    }

    public SoonValue remove(String key)
    {
        return myFields.remove(key);
    }

    public int size()
    {
        return myFields.size();
    }

    public boolean isEmpty()
    {
        return myFields.isEmpty();
    }

    /**
     * @return an unmodifiable view of the keys, in insertion order.
     */
    public Set<String> keySet()
    {
        return Collections.unmodifiableSet(myFields.keySet());
    }

    /**
     * @return an unmodifiable view of the fields, in insertion order.
     */
    public Set<Map.Entry<String, SoonValue>> entrySet()
    {
        return Collections.unmodifiableMap(myFields).entrySet();
    }

    @Override
    public SoonType getType()
    {
        return SoonType.STRUCT;
    }

    @Override
    public <R> R accept(ValueVisitor<R> visitor)
    {
        return visitor.visit(this);
    }

    @Override
    public SoonStruct clone()
    {
        SoonStruct copy = new SoonStruct();
        for (Map.Entry<String, SoonValue> e : myFields.entrySet())
        {
            copy.myFields.put(e.getKey(), e.getValue().clone());
        }
        return copy;
    }

    @Override
    public boolean equals(Object other)
    {
        // LinkedHashMap equality ignores order
        return other instanceof SoonStruct
            && ((SoonStruct) other).myFields.equals(myFields);
    }

    @Override
    public int hashCode()
    {
        return myFields.hashCode();
    }
}
