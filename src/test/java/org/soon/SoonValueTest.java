// Copyright The SOON Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package org.soon;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Iterator;
import java.util.Locale;
import org.junit.jupiter.api.Test;
import org.soon.util.AbstractValueVisitor;

public class SoonValueTest
{
    @Test
    public void testTypes()
    {
        assertEquals(SoonType.NULL, SoonNull.NULL.getType());
        assertEquals(SoonType.BOOL, SoonValue.of(true).getType());
        assertEquals(SoonType.NUMBER, SoonValue.of(1L).getType());
        assertEquals(SoonType.STRING, SoonValue.of("s").getType());
        assertEquals(SoonType.TIMESTAMP, SoonValue.of(Instant.EPOCH).getType());
        assertEquals(SoonType.BLOB, SoonValue.of(new byte[0]).getType());
        assertEquals(SoonType.LIST, new SoonList().getType());
        assertEquals(SoonType.STRUCT, new SoonStruct().getType());

        assertTrue(SoonType.isContainer(SoonType.LIST));
        assertTrue(SoonType.isContainer(SoonType.STRUCT));
        assertFalse(SoonType.isContainer(SoonType.BLOB));
        assertFalse(SoonType.isContainer(null));
        assertTrue(SoonType.isScalar(SoonType.TIMESTAMP));
        assertFalse(SoonType.isScalar(SoonType.LIST));
    }

    @Test
    public void testNullFactories()
    {
        assertSame(SoonNull.NULL, SoonValue.of((String) null));
        assertSame(SoonNull.NULL, SoonValue.of((Instant) null));
        assertSame(SoonNull.NULL, SoonValue.of((byte[]) null));
    }

    @Test
    public void testNumbers()
    {
        SoonNumber n = SoonNumber.valueOf(42L);
        assertTrue(n.isIntegral());
        assertEquals(42L, n.longValue());
        assertEquals(42, n.intValue());
        assertEquals(SoonNumber.valueOf(42.0), n);

        assertFalse(SoonNumber.valueOf(2.5).isIntegral());
        assertEquals(2L, SoonNumber.valueOf(2.5).longValue());
        assertFalse(SoonNumber.valueOf(Double.NaN).isFinite());
        assertFalse(SoonNumber.valueOf(Double.NaN).isIntegral());
        assertEquals(SoonNumber.valueOf(Double.NaN), SoonNumber.valueOf(Double.NaN));
        assertEquals(SoonNumber.valueOf(Double.NaN).hashCode(),
                     SoonNumber.valueOf(0.0 / 0.0).hashCode());
        assertNotEquals(SoonNumber.valueOf(Double.NaN), SoonNumber.valueOf(0.0));

        SoonList withNaN = new SoonList().add(Double.NaN);
        assertEquals(withNaN, withNaN);
        assertEquals(withNaN, withNaN.clone());

        assertEquals(SoonNumber.valueOf(0.0), SoonNumber.valueOf(-0.0));
        assertEquals(SoonNumber.valueOf(0.0).hashCode(), SoonNumber.valueOf(-0.0).hashCode());
    }

    @Test
    public void testTimestamps()
    {
        assertEquals(Instant.parse("2024-01-15T00:00:00Z"),
                     SoonTimestamp.valueOf("2024-01-15").instantValue());
        assertEquals(Instant.parse("2024-01-15T05:00:00Z"),
                     SoonTimestamp.valueOf("2024-01-15T10:30+05:30").instantValue());
        assertEquals(Instant.parse("2024-01-15T10:30:00.123Z"),
                     SoonTimestamp.valueOf("2024-01-15T10:30:00.123456Z").instantValue());
        assertEquals(1705314600000L, SoonTimestamp.valueOf("2024-01-15T10:30:00").getMillis());

        assertEquals("2024-01-15T05:00:00.000Z",
                     SoonTimestamp.valueOf("2024-01-15T10:00:00+05:00").toIsoString());

        assertThrows(DateTimeParseException.class, () -> SoonTimestamp.valueOf("2024-02-30"));
        assertThrows(DateTimeParseException.class, () -> SoonTimestamp.valueOf("2024-01-15T25:00"));
        assertThrows(DateTimeParseException.class, () -> SoonTimestamp.valueOf("2024-01-15T10:00+19:00"));
        assertThrows(DateTimeParseException.class, () -> SoonTimestamp.valueOf("yesterday"));
    }

    @Test
    public void testIsoStringIgnoresDefaultLocale()
    {
        Locale saved = Locale.getDefault();
        try
        {
            for (Locale locale : new Locale[] { new Locale("ar", "EG"),
                                                new Locale("hi", "IN"),
                                                new Locale("th", "TH", "TH") })
            {
                Locale.setDefault(locale);
                SoonTimestamp t = SoonTimestamp.valueOf("2024-01-02T03:04:05Z");
                assertEquals("2024-01-02T03:04:05.000Z", t.toIsoString(), locale.toString());
                assertEquals("t 2024-01-02T03:04:05.000Z",
                             new SoonStruct().put("t", t).toString(), locale.toString());
            }
        }
        finally
        {
            Locale.setDefault(saved);
        }
    }

    @Test
    public void testBlobIsCopied()
    {
        byte[] bytes = { 1, 2, 3 };
        SoonBlob blob = new SoonBlob(bytes);
        bytes[0] = 9;
        assertArrayEquals(new byte[] { 1, 2, 3 }, blob.getBytes());

        blob.getBytes()[1] = 9;
        assertArrayEquals(new byte[] { 1, 2, 3 }, blob.getBytes());
        assertEquals(3, blob.byteSize());
        assertEquals(new SoonBlob(new byte[] { 1, 2, 3 }), blob);
    }


    //=========================================================================
    // Containers

    @Test
    public void testStructKeepsInsertionOrder()
    {
        SoonStruct s = new SoonStruct().put("z", 1L).put("a", 2L).put("m", 3L);
        assertThat(s.keySet(), contains("z", "a", "m"));

        s.put("z", 9L);
        assertThat(s.keySet(), contains("z", "a", "m"));
        assertEquals(SoonNumber.valueOf(9L), s.get("z"));

        assertEquals(SoonNumber.valueOf(2L), s.remove("a"));
        assertThat(s.keySet(), contains("z", "m"));
        assertFalse(s.containsKey("a"));
        assertNull(s.get("a"));
        assertEquals(2, s.size());
    }

    @Test
    public void testStructEqualityIgnoresOrder()
    {
        SoonStruct a = new SoonStruct().put("x", 1L).put("y", "two");
        SoonStruct b = new SoonStruct().put("y", "two").put("x", 1L);
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, b.put("z", true));
    }

    @Test
    public void testStructRejectsNulls()
    {
        SoonStruct s = new SoonStruct();
        assertThrows(NullPointerException.class, () -> s.put(null, 1L));
        assertThrows(NullPointerException.class, () -> s.put("k", (SoonValue) null));
        s.put("k", (String) null);
        assertSame(SoonNull.NULL, s.get("k"));
    }

    @Test
    public void testStructViewsAreUnmodifiable()
    {
        SoonStruct s = new SoonStruct().put("k", 1L);
        assertThrows(UnsupportedOperationException.class, () -> s.keySet().remove("k"));
        assertThrows(UnsupportedOperationException.class, () -> s.entrySet().clear());
    }

    @Test
    public void testListOperations()
    {
        SoonList l = new SoonList().add(1L).add("two").add(true).add(3.5);
        assertEquals(4, l.size());
        assertEquals(new SoonString("two"), l.get(1));
        assertEquals(new SoonString("two"), l.set(1, SoonNull.NULL));
        assertSame(SoonNull.NULL, l.get(1));
        assertEquals(SoonBool.TRUE, l.remove(2));
        assertEquals(3, l.size());
        assertThrows(NullPointerException.class, () -> l.add((SoonValue) null));

        Iterator<SoonValue> it = l.iterator();
        it.next();
        assertThrows(UnsupportedOperationException.class, it::remove);
    }

    @Test
    public void testListEqualityIsOrdered()
    {
        SoonList a = new SoonList().add(1L).add(2L);
        assertEquals(SoonList.of(SoonValue.of(1L), SoonValue.of(2L)), a);
        assertNotEquals(SoonList.of(SoonValue.of(2L), SoonValue.of(1L)), a);
    }

    @Test
    public void testDeepClone()
    {
        SoonStruct inner = new SoonStruct().put("x", 1L);
        SoonList list = new SoonList().add(inner);
        SoonStruct outer = new SoonStruct().put("list", list).put("s", "text");

        SoonStruct copy = outer.clone();
        assertEquals(outer, copy);
        assertThat(copy, not(sameInstance(outer)));
        assertThat(copy.get("list"), not(sameInstance((SoonValue) list)));

        ((SoonStruct) ((SoonList) copy.get("list")).get(0)).put("x", 2L);
        assertEquals(SoonNumber.valueOf(1L), inner.get("x"));

        // scalars are immutable and may be shared
        assertSame(outer.get("s"), copy.get("s"));
    }

    @Test
    public void testToStringIsSoonText()
    {
        assertEquals("a 1\nb x", new SoonStruct().put("a", 1L).put("b", "x").toString());
        assertEquals("NUMBER{Cannot encode non-finite number: NaN}",
                     SoonValue.of(Double.NaN).toString());
    }


    //=========================================================================
    // Visitors

    @Test
    public void testVisitorDispatch()
    {
        ValueVisitor<String> names = new AbstractValueVisitor<String>()
        {
            @Override
            public String visit(SoonStruct value)
            {
                return "struct";
            }

            @Override
            public String visit(SoonList value)
            {
                return "list";
            }

            @Override
            protected String defaultVisit(SoonValue value)
            {
                return "scalar " + value.getType();
            }
        };

        assertEquals("struct", new SoonStruct().accept(names));
        assertEquals("list", new SoonList().accept(names));
        assertEquals("scalar BLOB", SoonValue.of(new byte[] { 1 }).accept(names));
    }

    @Test
    public void testDefaultVisitThrows()
    {
        ValueVisitor<Void> nothing = new AbstractValueVisitor<Void>() { };
        assertThrows(UnsupportedOperationException.class, () -> SoonNull.NULL.accept(nothing));
    }
}
