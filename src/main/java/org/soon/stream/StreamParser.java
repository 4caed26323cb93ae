// Copyright The SOON Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package org.soon.stream;

import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;
import org.soon.SoonDecodeException;
import org.soon.SoonDecoder;
import org.soon.SoonValue;
import org.soon.system.SoonDecoderBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decodes a stream of chunks delimited by {@code |id|} headers as the text
 * arrives.
 * <pre>
 * |c1|
 * name John
 * |c2|
 * age 30
 * </pre>
 * Each chunk runs from the end of its header to the start of the next
 * header, so a chunk is complete once the following header has arrived, or
 * when the stream is ended. Completed chunks are decoded independently and
 * reported in input order, whatever the split of the input across
 * {@link #write} calls. A {@code |} inside a quoted string or a comment does
 * not start a header. Non-blank text before the first header is a chunk
 * with no id.
 * <p>
 * Chunks without an id are numbered from zero. A chunk that fails to
 * decode is reported through {@link StreamListener#onError} and the stream
 * goes on. When the stream ends, leftover text that is not a complete
 * chunk is decoded if possible and otherwise dropped.
 * <p>
 * Instances are not thread-safe; independent instances share no state.
 */
public final class StreamParser
{
    private static final Logger logger = LoggerFactory.getLogger(StreamParser.class);

    private static final int READ_SIZE = 4096;

    // results of looking for the closing pipe of a header
    private static final int NOT_A_HEADER = -1;
    private static final int INCOMPLETE   = -2;

    /**
     * The life cycle of a stream parser.
     */
    public enum State
    {
        /** Nothing is buffered. */
        IDLE,
        /** Text is buffered that does not yet form a complete chunk. */
        BUFFERING,
        /** A completed chunk is being decoded and reported. */
        EMITTING,
        /** {@link #end()} has been called. */
        ENDED
    }

    private final StreamListener myListener;
    private final SoonDecoder    myDecoder;

    private final StringBuilder myBuffer = new StringBuilder();
    private final List<Header>  myHeaders = new ArrayList<Header>();
    private int   myNextChunkNumber;
    private State myState = State.IDLE;

    // scanner position and context, kept across writes
    private int     myScanPos;
    private boolean myInString;
    private boolean myEscape;
    private boolean myInComment;

    /**
     * @param listener receives the stream's events.
     * @param options the configuration for decoding each chunk; the
     * streaming option is always turned on.
     */
    public StreamParser(StreamListener listener, SoonDecoderBuilder options)
    {
        if (listener == null) throw new NullPointerException("listener");
        myListener = listener;
        myDecoder = options.copy().withStreaming(true).build();
    }

    public State getState()
    {
        return myState;
    }

    /**
     * Appends text and reports every chunk it completes.
     *
     * @throws IllegalStateException if the stream has ended, or if called
     * from a listener while a chunk is being reported.
     */
    public void write(CharSequence text)
    {
        if (myState == State.ENDED)
        {
            throw new IllegalStateException("Cannot write to an ended stream");
        }
        if (myState == State.EMITTING)
        {
            throw new IllegalStateException("Cannot write while a chunk is being reported");
        }

        myBuffer.append(text);
        scan();
        emitCompleteChunks();
        updateState();
    }

    /**
     * Reports the last chunk and any decodable leftover text, then
     * {@link StreamListener#onEnd()}. Calling this again does nothing.
     */
    public void end()
    {
        if (myState == State.ENDED) return;
        if (myState == State.EMITTING)
        {
            throw new IllegalStateException("Cannot end while a chunk is being reported");
        }

        scan();
        emitCompleteChunks();

        // the scanner stops at a header that has not been closed yet
        int stop = myBuffer.length();
        boolean openHeader = myScanPos < myBuffer.length();
        if (openHeader) stop = myScanPos;

        if (! myHeaders.isEmpty())
        {
            Header last = myHeaders.get(0);
            emitChunk(last.myId, myBuffer.substring(last.myEnd, stop));
        }
        else if (! isBlank(myBuffer, 0, stop))
        {
            emitTrailingText(myBuffer.substring(0, stop));
        }

        if (openHeader)
        {
            logger.debug("Discarding incomplete chunk header at end of stream: {}",
                         myBuffer.substring(stop));
        }

        myBuffer.setLength(0);
        myHeaders.clear();
        myState = State.ENDED;
        myListener.onEnd();
    }

    /**
     * Decodes all chunks readable from {@code in}.
     *
     * @return the decoded chunks, in input order.
     *
     * @throws SoonDecodeException the first chunk error, once the whole
     * input has been read.
     * @throws IOException if reading fails.
     */
    public static List<SoonChunk> parseAll(Reader in, SoonDecoderBuilder options)
        throws IOException
    {
        ChunkCollector collector = new ChunkCollector();
        StreamParser parser = options.buildStreamParser(collector);

        char[] piece = new char[READ_SIZE];
        int count;
        while ((count = in.read(piece)) != -1)
        {
            parser.write(new String(piece, 0, count));
        }
        parser.end();

        if (collector.myFirstError != null)
        {
            throw collector.myFirstError;
        }
        return collector.myChunks;
    }

    public static List<SoonChunk> parseAll(Reader in)
        throws IOException
    {
        return parseAll(in, SoonDecoderBuilder.standard());
    }


    //=========================================================================
    // Scanning

    /**
     * Finds the headers in the unscanned part of the buffer, stopping at a
     * header whose closing pipe has not arrived.
     */
    private void scan()
    {
        while (myScanPos < myBuffer.length())
        {
            char c = myBuffer.charAt(myScanPos);

            if (c == '\n')
            {
                myInString = false;
                myEscape = false;
                myInComment = false;
            }
            else if (myInComment)
            {
                // skip
            }
            else if (myInString)
            {
                if (myEscape)
                {
                    myEscape = false;
                }
                else if (c == '\\')
                {
                    myEscape = true;
                }
                else if (c == '"')
                {
                    myInString = false;
                }
            }
            else if (c == '"')
            {
                myInString = true;
            }
            else if (c == '#')
            {
                myInComment = true;
            }
            else if (c == '|')
            {
                int close = findHeaderClose(myScanPos + 1);
                if (close == INCOMPLETE) return;
                if (close != NOT_A_HEADER)
                {
                    String id = myBuffer.substring(myScanPos + 1, close).trim();
                    myHeaders.add(new Header(myScanPos, close + 1, id));
                    myScanPos = close + 1;
                    continue;
                }
            }
            myScanPos++;
        }
    }

    private int findHeaderClose(int from)
    {
        for (int i = from; i < myBuffer.length(); i++)
        {
            char c = myBuffer.charAt(i);
            if (c == '|') return i;
            if (c == '\n') return NOT_A_HEADER;
        }
        return INCOMPLETE;
    }


    //=========================================================================
    // Emitting

    /**
     * Reports every chunk followed by a header, then drops their text. The
     * last header and its text stay buffered.
     */
    private void emitCompleteChunks()
    {
        if (myHeaders.isEmpty()) return;

        Header first = myHeaders.get(0);
        if (! isBlank(myBuffer, 0, first.myStart))
        {
            emitChunk(null, myBuffer.substring(0, first.myStart));
        }
        for (int i = 0; i < myHeaders.size() - 1; i++)
        {
            Header h = myHeaders.get(i);
            emitChunk(h.myId, myBuffer.substring(h.myEnd, myHeaders.get(i + 1).myStart));
        }

        Header last = myHeaders.get(myHeaders.size() - 1);
        int consumed = last.myStart;
        if (consumed > 0)
        {
            myBuffer.delete(0, consumed);
            myScanPos -= consumed;
        }
        myHeaders.clear();
        myHeaders.add(new Header(0, last.myEnd - consumed, last.myId));
    }

    private void emitChunk(String explicitId, String content)
    {
        String id = (explicitId == null || explicitId.isEmpty()
                     ? String.valueOf(myNextChunkNumber++)
                     : explicitId);

        State previous = myState;
        myState = State.EMITTING;
        try
        {
            SoonValue value;
            try
            {
                value = myDecoder.decode(content);
            }
            catch (SoonDecodeException e)
            {
                logger.debug("Chunk {} failed to decode: {}", id, e.getMessage());
                myListener.onError(id, e);
                return;
            }
            logger.debug("Emitting chunk {}", id);
            myListener.onChunk(new SoonChunk(id, value));
        }
        finally
        {
            myState = previous;
        }
    }

    /**
     * Gives headerless leftover text one chance to decode. It is reported
     * only if it succeeds.
     */
    private void emitTrailingText(String text)
    {
        SoonValue value;
        try
        {
            value = myDecoder.decode(text);
        }
        catch (SoonDecodeException e)
        {
            logger.debug("Discarding incomplete data at end of stream: {}", e.getMessage());
            return;
        }

        String id = String.valueOf(myNextChunkNumber++);
        State previous = myState;
        myState = State.EMITTING;
        try
        {
            logger.debug("Emitting trailing chunk {}", id);
            myListener.onChunk(new SoonChunk(id, value));
        }
        finally
        {
            myState = previous;
        }
    }

    private void updateState()
    {
        myState = (myBuffer.length() == 0 ? State.IDLE : State.BUFFERING);
    }

    private static boolean isBlank(CharSequence text, int start, int end)
    {
        for (int i = start; i < end; i++)
        {
            if (! Character.isWhitespace(text.charAt(i))) return false;
        }
        return true;
    }


    private static final class Header
    {
        final int    myStart;
        final int    myEnd;
        final String myId;

        Header(int start, int end, String id)
        {
            myStart = start;
            myEnd = end;
            myId = id;
        }
    }

    private static final class ChunkCollector
        extends AbstractStreamListener
    {
        final List<SoonChunk> myChunks = new ArrayList<SoonChunk>();
        SoonDecodeException   myFirstError;

        @Override
        public void onChunk(SoonChunk chunk)
        {
            myChunks.add(chunk);
        }

        @Override
        public void onError(String chunkId, SoonDecodeException error)
        {
            if (myFirstError == null) myFirstError = error;
        }
    }
}
