// Copyright The SOON Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package org.soon.stream;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.soon.DuplicateKeyException;
import org.soon.Soon;
import org.soon.SoonDecodeException;
import org.soon.SoonLexException;
import org.soon.SoonNull;
import org.soon.SoonParseException;
import org.soon.SoonStruct;
import org.soon.SoonValue;
import org.soon.system.SoonDecoderBuilder;

public class StreamParserTest
{
    /**
     * Records every event as a line of text, in order.
     */
    private static final class Recorder
        implements StreamListener
    {
        final List<String>              events = new ArrayList<String>();
        final List<SoonChunk>           chunks = new ArrayList<SoonChunk>();
        final List<SoonDecodeException> errors = new ArrayList<SoonDecodeException>();

        public void onChunk(SoonChunk chunk)
        {
            chunks.add(chunk);
            events.add("chunk " + chunk.getId());
        }

        public void onError(String chunkId, SoonDecodeException error)
        {
            errors.add(error);
            events.add("error " + chunkId);
        }

        public void onEnd()
        {
            events.add("end");
        }
    }

    private static SoonStruct record(String key, SoonValue value)
    {
        return new SoonStruct().put(key, value);
    }

    private static Recorder feed(String... pieces)
    {
        Recorder recorder = new Recorder();
        StreamParser parser = Soon.openStream(recorder);
        for (String piece : pieces)
        {
            parser.write(piece);
        }
        parser.end();
        return recorder;
    }


    @Test
    public void testTwoChunks()
    {
        Recorder r = feed("|c1|\nname John", "|c2|\nage 30");
        assertThat(r.chunks, contains(new SoonChunk("c1", record("name", SoonValue.of("John"))),
                                      new SoonChunk("c2", record("age", SoonValue.of(30L)))));
        assertThat(r.events, contains("chunk c1", "chunk c2", "end"));
    }

    @Test
    public void testChunkIsEmittedWhenNextDelimiterArrives()
    {
        Recorder r = new Recorder();
        StreamParser parser = Soon.openStream(r);
        assertEquals(StreamParser.State.IDLE, parser.getState());

        parser.write("|a|\nx 1\n");
        assertThat(r.events, empty());
        assertEquals(StreamParser.State.BUFFERING, parser.getState());

        parser.write("|b|\ny 2\n");
        assertThat(r.events, contains("chunk a"));

        parser.end();
        assertThat(r.events, contains("chunk a", "chunk b", "end"));
        assertEquals(StreamParser.State.ENDED, parser.getState());
    }

    private static final String DOCUMENT =
        "|first|\n"
        + "user\n"
        + "  name \"A | B\"\n"
        + "  # a | in a comment\n"
        + "  city NYC\n"
        + "|second|\n"
        + "users name age\n"
        + "  Alice 25\n"
        + "  Bob 30\n"
        + "||\n"
        + "tags a b c\n";

    @Test
    public void testSplitDoesNotMatter()
    {
        Recorder whole = feed(DOCUMENT);
        assertThat(whole.events, contains("chunk first", "chunk second", "chunk 0", "end"));

        String[] single = new String[DOCUMENT.length()];
        for (int i = 0; i < DOCUMENT.length(); i++)
        {
            single[i] = String.valueOf(DOCUMENT.charAt(i));
        }
        Recorder byChar = feed(single);
        assertEquals(whole.chunks, byChar.chunks);
        assertEquals(whole.events, byChar.events);

        for (int split = 1; split < DOCUMENT.length(); split++)
        {
            Recorder halves = feed(DOCUMENT.substring(0, split), DOCUMENT.substring(split));
            assertEquals(whole.chunks, halves.chunks, "split at " + split);
        }
    }

    @Test
    public void testPipesInStringsAndCommentsAreContent()
    {
        Recorder r = feed(DOCUMENT);
        SoonStruct user = (SoonStruct) ((SoonStruct) r.chunks.get(0).getValue()).get("user");
        assertEquals(SoonValue.of("A | B"), user.get("name"));
        assertEquals(SoonValue.of("NYC"), user.get("city"));
    }

    @Test
    public void testAnonymousChunksAreNumbered()
    {
        Recorder r = feed("||\na 1\n|x|\nb 2\n||\nc 3");
        assertThat(r.events, contains("chunk 0", "chunk x", "chunk 1", "end"));
    }

    @Test
    public void testTextBeforeFirstDelimiterIsAChunk()
    {
        Recorder r = feed("a 1\n", "|x|\nb 2");
        assertThat(r.chunks, contains(new SoonChunk("0", record("a", SoonValue.of(1L))),
                                      new SoonChunk("x", record("b", SoonValue.of(2L)))));
    }

    @Test
    public void testBlankTextBeforeFirstDelimiterIsIgnored()
    {
        Recorder r = feed("\n  \n", "|x|\nb 2");
        assertThat(r.events, contains("chunk x", "end"));
    }

    @Test
    public void testBadChunkDoesNotStopStream()
    {
        Recorder r = feed("|good|\na 1\n|bad|\nb \"open\n|dup|\nc 1\nc 2\n|after|\nd 4");
        assertThat(r.events, contains("chunk good", "error bad", "error dup", "chunk after", "end"));

        assertThat(r.errors.get(0), instanceOf(SoonLexException.class));
        assertEquals(2, r.errors.get(0).getLine());
        assertThat(r.errors.get(1), instanceOf(DuplicateKeyException.class));
    }

    @Test
    public void testChunkErrorsMentionTheStream()
    {
        Recorder r = feed("|d|\nwhen 2024-13-45");
        assertThat(r.errors.get(0), instanceOf(SoonParseException.class));
        assertThat(r.errors.get(0).getReason(), containsString("in stream chunk"));
    }

    @Test
    public void testLastChunkErrorIsReportedAtEnd()
    {
        Recorder r = feed("|only|\nx \"open");
        assertThat(r.events, contains("error only", "end"));
    }

    @Test
    public void testEmptyChunkIsNull()
    {
        Recorder r = feed("|a|\n|b|\nx 1");
        assertEquals(new SoonChunk("a", SoonNull.NULL), r.chunks.get(0));
    }

    @Test
    public void testTrailingDataWithoutDelimiter()
    {
        Recorder r = feed("name John");
        assertThat(r.chunks, contains(new SoonChunk("0", record("name", SoonValue.of("John")))));
    }

    @Test
    public void testTrailingGarbageIsDropped()
    {
        Recorder r = feed("x \"never closed");
        assertThat(r.events, contains("end"));
    }

    @Test
    public void testUnclosedHeaderAtEndIsDropped()
    {
        Recorder r = feed("|a|\nx 1\n|pending");
        assertThat(r.chunks, contains(new SoonChunk("a", record("x", SoonValue.of(1L)))));
        assertThat(r.events, contains("chunk a", "end"));
    }

    @Test
    public void testPipeWithoutCloseOnLineIsContent()
    {
        Recorder r = feed("|a|\nx \"1\" | 2\ny 3");
        assertThat(r.events, contains("chunk a", "end"));
        SoonStruct value = (SoonStruct) r.chunks.get(0).getValue();
        assertEquals(SoonValue.of(3L), value.get("y"));
    }

    @ParameterizedTest
    @ValueSource(strings = { "", "   ", "\n\n" })
    public void testNothingToEmit(String text)
    {
        Recorder r = feed(text);
        assertThat(r.events, contains("end"));
    }

    @Test
    public void testWriteAfterEnd()
    {
        StreamParser parser = Soon.openStream(new AbstractStreamListener() { });
        parser.end();
        assertThrows(IllegalStateException.class, () -> parser.write("a 1"));
    }

    @Test
    public void testEndTwiceIsNoOp()
    {
        Recorder r = new Recorder();
        StreamParser parser = Soon.openStream(r);
        parser.write("|a|\nx 1");
        parser.end();
        parser.end();
        assertThat(r.events, contains("chunk a", "end"));
    }

    @Test
    public void testListenerCannotReenter()
    {
        final List<Throwable> failures = new ArrayList<Throwable>();
        final StreamParser[] holder = new StreamParser[1];
        holder[0] = Soon.openStream(new AbstractStreamListener()
        {
            @Override
            public void onChunk(SoonChunk chunk)
            {
                assertEquals(StreamParser.State.EMITTING, holder[0].getState());
                try
                {
                    holder[0].write("more");
                }
                catch (IllegalStateException e)
                {
                    failures.add(e);
                }
            }
        });
        holder[0].write("|a|\nx 1\n|b|\n");
        assertEquals(1, failures.size());
        assertEquals(StreamParser.State.BUFFERING, holder[0].getState());
    }

    @Test
    public void testChunksUseGivenOptions()
    {
        Recorder r = new Recorder();
        StreamParser parser = SoonDecoderBuilder.standard()
            .withAllowDuplicateKeys(true)
            .buildStreamParser(r);
        parser.write("|a|\nk 1\nk 2");
        parser.end();
        assertEquals(record("k", SoonValue.of(2L)), r.chunks.get(0).getValue());
    }

    @Test
    public void testGivenOptionsAreLeftUnchanged()
    {
        SoonDecoderBuilder options = SoonDecoderBuilder.standard();
        new StreamParser(new AbstractStreamListener() { }, options);
        assertFalse(options.isStreaming());

        SoonDecoderBuilder mutable = SoonDecoderBuilder.standard().withMaxDepth(3);
        mutable.buildStreamParser(new AbstractStreamListener() { });
        assertFalse(mutable.isStreaming());
        assertEquals(3, mutable.getMaxDepth());
    }

    @Test
    public void testInstancesAreIndependent()
    {
        Recorder r1 = new Recorder();
        Recorder r2 = new Recorder();
        StreamParser p1 = Soon.openStream(r1);
        StreamParser p2 = Soon.openStream(r2);
        p1.write("||\na 1\n");
        p2.write("||\nb 2\n||\nc 3\n");
        p1.write("||\nd 4");
        p1.end();
        p2.end();
        assertThat(r1.events, contains("chunk 0", "chunk 1", "end"));
        assertThat(r2.events, contains("chunk 0", "chunk 1", "end"));
    }


    //=========================================================================
    // parseAll

    @Test
    public void testParseAll()
        throws IOException
    {
        StringBuilder text = new StringBuilder();
        for (int i = 0; i < 2000; i++)
        {
            text.append("|c").append(i).append("|\nn ").append(i).append('\n');
        }
        List<SoonChunk> chunks = StreamParser.parseAll(new StringReader(text.toString()));
        assertEquals(2000, chunks.size());
        assertEquals(new SoonChunk("c1999", record("n", SoonValue.of(1999L))), chunks.get(1999));
    }

    @Test
    public void testParseAllRethrowsFirstError()
    {
        SoonDecodeException e =
            assertThrows(SoonDecodeException.class,
                         () -> StreamParser.parseAll(new StringReader("|a|\nx \"bad\n|b|\ny 1\ny 2")));
        assertThat(e, instanceOf(SoonLexException.class));
    }

    @Test
    public void testParseAllWithOptions()
        throws IOException
    {
        List<SoonChunk> chunks =
            StreamParser.parseAll(new StringReader("|a|\ny 1\ny 2"),
                                  SoonDecoderBuilder.standard().withAllowDuplicateKeys(true));
        assertTrue(chunks.get(0).getValue() instanceof SoonStruct);
        assertEquals(record("y", SoonValue.of(2L)), chunks.get(0).getValue());
    }
}
