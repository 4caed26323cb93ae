// Copyright The SOON Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package org.soon.impl;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.soon.SoonBlob;
import org.soon.SoonEncodeException;
import org.soon.SoonList;
import org.soon.SoonNull;
import org.soon.SoonString;
import org.soon.SoonStruct;
import org.soon.SoonTimestamp;
import org.soon.SoonValue;
import org.soon.system.SoonEncoderBuilder;

public class SoonSerializerTest
{
    private static String encode(SoonValue value)
    {
        return encode(value, SoonEncoderBuilder.standard());
    }

    private static String encode(SoonValue value, SoonEncoderBuilder options)
    {
        return new SoonSerializer(options).serialize(value);
    }

    private static SoonStruct user(String name, long age)
    {
        return new SoonStruct().put("name", name).put("age", age);
    }


    //=========================================================================
    // Records

    @Test
    public void testFlatRecord()
    {
        SoonStruct value = new SoonStruct().put("name", "John").put("age", 30L);
        assertEquals("name John\nage 30", encode(value));
    }

    @Test
    public void testNestedRecord()
    {
        SoonStruct value = new SoonStruct()
            .put("user", new SoonStruct().put("name", "John").put("city", "NYC"))
            .put("active", true);
        assertEquals("user\n  name John\n  city NYC\nactive true", encode(value));
    }

    @Test
    public void testIndent()
    {
        SoonStruct value = new SoonStruct()
            .put("a", new SoonStruct().put("b", new SoonStruct().put("c", 1L)));
        assertEquals("a\n    b\n        c 1",
                     encode(value, SoonEncoderBuilder.standard().withIndent(4)));
    }

    @Test
    public void testSortKeys()
    {
        SoonStruct value = new SoonStruct()
            .put("b", 1L)
            .put("a", new SoonStruct().put("y", 1L).put("x", 2L));
        assertEquals("b 1\na\n  y 1\n  x 2", encode(value));
        assertEquals("a\n  x 2\n  y 1\nb 1",
                     encode(value, SoonEncoderBuilder.standard().withSortKeys(true)));
    }

    @Test
    public void testCompact()
    {
        SoonStruct point = new SoonStruct().put("x", 10L).put("y", 20L);
        assertEquals("x:10 y:20", encode(point, SoonEncoderBuilder.compact()));

        SoonStruct value = new SoonStruct().put("p", point).put("q", 1L);
        assertEquals("p x:10 y:20\nq 1", encode(value, SoonEncoderBuilder.compact()));
    }

    @Test
    public void testCompactKeepsLargeRecordsInBlocks()
    {
        SoonStruct big = new SoonStruct();
        for (int i = 0; i <= SoonSerializer.MAX_INLINE_FIELDS; i++)
        {
            big.put("f" + i, (long) i);
        }
        String text = encode(new SoonStruct().put("big", big), SoonEncoderBuilder.compact());
        assertEquals("big\n  f0 0\n  f1 1\n  f2 2\n  f3 3\n  f4 4", text);
    }

    @Test
    public void testCompactKeepsNestedRecordsInBlocks()
    {
        SoonStruct value = new SoonStruct()
            .put("a", new SoonStruct().put("b", new SoonStruct().put("c", 1L)));
        assertEquals("a\n  b c:1", encode(value, SoonEncoderBuilder.compact()));
    }

    @Test
    public void testEmptyContainers()
    {
        assertEquals("", encode(new SoonStruct()));
        assertEquals("", encode(new SoonList()));
        SoonStruct value = new SoonStruct().put("a", new SoonStruct()).put("b", new SoonList());
        assertEquals("a\nb", encode(value));
    }

    @Test
    public void testKeysAreQuotedWhenNeeded()
    {
        SoonStruct value = new SoonStruct()
            .put("first name", 1L)
            .put("123", 2L)
            .put("true", 3L)
            .put("", 4L)
            .put("-5", 5L)
            .put("plain_key", 6L);
        assertEquals("\"first name\" 1\n\"123\" 2\n\"true\" 3\n\"\" 4\n\"-5\" 5\nplain_key 6",
                     encode(value));
    }


    //=========================================================================
    // Arrays

    @Test
    public void testScalarArray()
    {
        SoonStruct value = new SoonStruct()
            .put("items", SoonList.of(SoonValue.of(1L), SoonValue.of(2L), SoonValue.of(3L)));
        assertEquals("items 1 2 3", encode(value));
    }

    @Test
    public void testScalarArrayQuotesElements()
    {
        SoonStruct value = new SoonStruct()
            .put("tags", new SoonList().add("a b").add("c").add("null").add(SoonNull.NULL));
        assertEquals("tags \"a b\" c \"null\" null", encode(value));
    }

    @Test
    public void testTable()
    {
        SoonStruct value = new SoonStruct()
            .put("users", SoonList.of(user("Alice", 25), user("Bob", 30)));
        assertEquals("users name  age\n  Alice 25\n  Bob   30", encode(value));
    }

    @Test
    public void testTableInsideNestedRecord()
    {
        SoonStruct value = new SoonStruct()
            .put("team", new SoonStruct()
                .put("members", SoonList.of(user("Al", 3), user("Bea", 41))));
        assertEquals("team\n  members name age\n    Al   3\n    Bea  41", encode(value));
    }

    @Test
    public void testSingleRecordArrayIsTable()
    {
        SoonStruct value = new SoonStruct()
            .put("items", SoonList.of(new SoonStruct().put("a", 1L)));
        assertEquals("items a\n  1", encode(value));
    }

    @Test
    public void testDifferentKeySetsUseInlineRecords()
    {
        SoonStruct value = new SoonStruct()
            .put("items", SoonList.of(new SoonStruct().put("a", 1L),
                                      new SoonStruct().put("b", 2L).put("c", "x")));
        assertEquals("items a:1\n  b:2 c:x", encode(value));
    }

    @Test
    public void testQuotedColumnsUseInlineRecords()
    {
        SoonStruct value = new SoonStruct()
            .put("items", SoonList.of(new SoonStruct().put("a b", 1L),
                                      new SoonStruct().put("a b", 2L)));
        assertEquals("items \"a b\":1\n  \"a b\":2", encode(value));
    }

    @Test
    public void testMixedElementLines()
    {
        SoonList items = SoonList.of(new SoonStruct().put("a", 1L),
                                     SoonValue.of(5L),
                                     new SoonList().add(1L).add(2L),
                                     SoonValue.of("word"));
        assertEquals("items a:1\n  5\n  1 2\n  word",
                     encode(new SoonStruct().put("items", items)));
    }

    @Test
    public void testTopLevelArrays()
    {
        assertEquals("1 2 3", encode(new SoonList().add(1L).add(2L).add(3L)));
        assertEquals("\"a\" b", encode(new SoonList().add("a").add("b")));
        assertEquals("a:1\n  a:2", encode(SoonList.of(new SoonStruct().put("a", 1L),
                                                      new SoonStruct().put("a", 2L))));
    }

    @Test
    public void testArraysNotStartingWithFlatRecord()
    {
        SoonList pairs = SoonList.of(new SoonList().add(1L).add(2L),
                                     new SoonList().add(3L).add(4L));
        assertEquals("m 1 2\n  3 4", encode(new SoonStruct().put("m", pairs)));

        SoonList startsWithScalar = SoonList.of(SoonValue.of(5L), new SoonStruct().put("a", 1L));
        assertEquals("m 5\n  a:1", encode(new SoonStruct().put("m", startsWithScalar)));

        SoonList startsWithEmpty = SoonList.of(new SoonStruct(), new SoonStruct().put("a", 1L));
        assertEquals("m null\n  a:1", encode(new SoonStruct().put("m", startsWithEmpty)));

        assertEquals("5\n  a:1", encode(startsWithScalar));
    }

    @Test
    public void testNestedContainersInElementsAreFlattened()
    {
        SoonStruct holder = new SoonStruct().put("tags", new SoonList().add("x").add("y"))
                                            .put("n", 3L)
                                            .put("none", new SoonStruct());
        SoonList items = SoonList.of(new SoonStruct().put("a", 1L),
                                     holder,
                                     SoonList.of(new SoonList().add(1L), SoonValue.of(2L)),
                                     new SoonList(),
                                     new SoonStruct().put("p", new SoonStruct().put("q", 1L)));
        assertEquals("items a:1\n  tags:x y n:3 none:null\n  1 2\n  null\n  p:q:1",
                     encode(new SoonStruct().put("items", items)));
    }


    //=========================================================================
    // Scalars

    static Stream<Arguments> scalars()
    {
        return Stream.of(
            Arguments.of(SoonNull.NULL, "null"),
            Arguments.of(SoonValue.of(true), "true"),
            Arguments.of(SoonValue.of(false), "false"),
            Arguments.of(SoonValue.of(42L), "42"),
            Arguments.of(SoonValue.of(-7L), "-7"),
            Arguments.of(SoonValue.of(-0.0), "0"),
            Arguments.of(SoonValue.of(1.5), "1.5"),
            Arguments.of(SoonValue.of(0.1), "0.1"),
            Arguments.of(SoonValue.of(123456789012L), "123456789012"),
            Arguments.of(SoonValue.of(1e20), "100000000000000000000"),
            Arguments.of(SoonValue.of(1e21), "1.0E21"),
            Arguments.of(SoonValue.of(1.5e-7), "1.5E-7"),
            Arguments.of(new SoonString("hello"), "hello"),
            Arguments.of(new SoonString("user@example.com"), "user@example.com"),
            Arguments.of(new SoonString(""), "\"\""),
            Arguments.of(new SoonString("true"), "\"true\""),
            Arguments.of(new SoonString("null"), "\"null\""),
            Arguments.of(new SoonString("123"), "\"123\""),
            Arguments.of(new SoonString("-1.5e3"), "\"-1.5e3\""),
            Arguments.of(new SoonString("1."), "\"1.\""),
            Arguments.of(new SoonString("2024-01-15"), "\"2024-01-15\""),
            Arguments.of(new SoonString("a:b"), "\"a:b\""),
            Arguments.of(new SoonString(" padded "), "\" padded \""),
            Arguments.of(new SoonString("line\nbreak\ttab"), "\"line\\nbreak\\ttab\""),
            Arguments.of(new SoonString("say \"hi\" \\o/"), "\"say \\\"hi\\\" \\\\o/\""),
            Arguments.of(new SoonString("#hash"), "\"#hash\""),
            Arguments.of(SoonTimestamp.forEpochMillis(0), "1970-01-01T00:00:00.000Z"),
            Arguments.of(SoonTimestamp.forEpochMillis(1705314600123L), "2024-01-15T10:30:00.123Z"),
            Arguments.of(new SoonBlob("hi".getBytes(StandardCharsets.UTF_8)), "\"aGk=\"")
        );
    }

    @ParameterizedTest
    @MethodSource("scalars")
    public void testScalarField(SoonValue value, String expected)
    {
        assertEquals("v " + expected, encode(new SoonStruct().put("v", value)));
    }

    @Test
    public void testTopLevelScalars()
    {
        assertEquals("42", encode(SoonValue.of(42L)));
        assertEquals("null", encode(SoonNull.NULL));
        // a bare word alone would read back as a key
        assertEquals("\"hello\"", encode(new SoonString("hello")));
    }

    @Test
    public void testNonFiniteNumbers()
    {
        for (double d : new double[] { Double.NaN, Double.POSITIVE_INFINITY,
                                       Double.NEGATIVE_INFINITY })
        {
            SoonEncodeException e = assertThrows(SoonEncodeException.class,
                                                 () -> encode(SoonValue.of(d)));
            assertThat(e.getMessage(), containsString("non-finite"));
        }
    }

    @Test
    public void testTimestampOutsideFourDigitYears()
    {
        SoonValue farFuture = SoonTimestamp.forInstant(Instant.ofEpochSecond(253402300800L));
        assertThrows(SoonEncodeException.class,
                     () -> encode(new SoonStruct().put("d", farFuture)));
    }
}
