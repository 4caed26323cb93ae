// Copyright The SOON Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package org.soon.impl;

import static org.soon.util.SoonTextUtils.isDecimalDigit;
import static org.soon.util.SoonTextUtils.isWordChar;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import org.soon.SoonLexException;
import org.soon.SoonTimestamp;

/**
 * Breaks SOON text into {@link Token}s, turning leading indentation into
 * INDENT and DEDENT tokens.
 * <p>
 * Indentation is tracked with a stack of widths starting at zero. A line
 * wider than the top of the stack pushes its width and yields one INDENT; a
 * narrower line pops every wider level and yields one DEDENT per level, one
 * per call to {@link #nextToken()}. Blank and comment-only lines never
 * change indentation. At end of input every open level is closed before
 * EOF, so a complete token sequence always has as many DEDENTs as INDENTs.
 * <p>
 * Instances are not thread-safe.
 */
public final class SoonLexer
{
    private final String myInput;
    private int myOffset;
    private int myLine = 1;
    private int myColumn = 1;

    private final ArrayList<Integer> myIndentStack = new ArrayList<Integer>();
    private int myPendingDedents;
    private boolean myAtLineStart = true;
    private boolean myDone;

    public SoonLexer(CharSequence input)
    {
        myInput = input.toString();
        myIndentStack.add(0);
    }

    /**
     * Tokenizes the whole input. Comments are dropped; the last token is
     * always EOF.
     *
     * @throws SoonLexException on the first character that cannot start a
     * token, or on an unterminated string.
     */
    public static List<Token> tokenize(CharSequence input)
    {
        SoonLexer lexer = new SoonLexer(input);
        List<Token> tokens = new ArrayList<Token>();
        for (;;)
        {
            Token token = lexer.nextToken();
            if (token.is(TokenType.COMMENT)) continue;
            tokens.add(token);
            if (token.is(TokenType.EOF)) break;
        }
        return tokens;
    }

    /**
     * Reads the next token, including COMMENT tokens. After EOF has been
     * returned, every further call returns EOF again.
     */
    public Token nextToken()
    {
        if (myPendingDedents > 0)
        {
            myPendingDedents--;
            return token(TokenType.DEDENT, "", here());
        }

        if (myAtLineStart)
        {
            myAtLineStart = false;
            Token indentation = readIndentation();
            if (indentation != null) return indentation;
        }

        skipInlineWhitespace();

        if (atEnd())
        {
            if (myIndentStack.size() > 1)
            {
                myIndentStack.remove(myIndentStack.size() - 1);
                return token(TokenType.DEDENT, "", here());
            }
            myDone = true;
            return token(TokenType.EOF, "", here());
        }

        Position start = here();
        char c = peek();
        switch (c)
        {
            case '\n':
                advance();
                myLine++;
                myColumn = 1;
                myAtLineStart = true;
                return token(TokenType.NEWLINE, "\n", start);
            case '#':
                return readComment(start);
            case '"':
                return readQuotedString(start);
            case ':':
                advance();
                return token(TokenType.COLON, ":", start);
            case '|':
                advance();
                return token(TokenType.PIPE, "|", start);
            case '&':
                return readSigil(TokenType.ANCHOR, start);
            case '*':
                return readSigil(TokenType.REFERENCE, start);
            default:
                break;
        }

        if (isDecimalDigit(c) || (c == '-' && isDecimalDigit(peek(1))))
        {
            return readNumberOrDate(start);
        }
        if (isWordChar(c))
        {
            return readWord(start);
        }

        throw new SoonLexException("Unexpected character '" + c + "'",
                                   start.getLine(), start.getColumn());
    }

    /**
     * @return true once EOF has been returned.
     */
    public boolean isDone()
    {
        return myDone;
    }


    //=========================================================================
    // Indentation

    private Token readIndentation()
    {
        int width = 0;
        while (peek() == ' ')
        {
            advance();
            width++;
        }

        // blank and comment-only lines leave the indentation alone
        if (atEnd() || peek() == '\n' || peek() == '\r' || peek() == '#')
        {
            return null;
        }

        Position start = here();
        int top = myIndentStack.get(myIndentStack.size() - 1);
        if (width > top)
        {
            myIndentStack.add(width);
            return token(TokenType.INDENT, "", start);
        }
        if (width < top)
        {
            int popped = 0;
            while (myIndentStack.size() > 1
                   && myIndentStack.get(myIndentStack.size() - 1) > width)
            {
                myIndentStack.remove(myIndentStack.size() - 1);
                popped++;
            }
            // a width between two open levels closes the deeper ones only
            myPendingDedents = popped - 1;
            return token(TokenType.DEDENT, "", start);
        }
        return null;
    }

    private void skipInlineWhitespace()
    {
        while (! atEnd())
        {
            char c = peek();
            if (c != ' ' && c != '\t' && c != '\r') break;
            advance();
        }
    }


    //=========================================================================
    // Scanners

    private Token readComment(Position start)
    {
        advance(); // #
        int begin = myOffset;
        while (! atEnd() && peek() != '\n')
        {
            advance();
        }
        return token(TokenType.COMMENT, myInput.substring(begin, myOffset).trim(), start);
    }

    private Token readQuotedString(Position start)
    {
        int begin = myOffset;
        advance(); // opening quote
        StringBuilder text = new StringBuilder();
        for (;;)
        {
            if (atEnd())
            {
                throw new SoonLexException("Unterminated string",
                                           start.getLine(), start.getColumn());
            }
            char c = peek();
            if (c == '"') break;
            if (c == '\n')
            {
                throw new SoonLexException("Unterminated string (newline in string)",
                                           start.getLine(), start.getColumn());
            }
            advance();
            if (c == '\\')
            {
                if (atEnd())
                {
                    throw new SoonLexException("Unterminated string",
                                               start.getLine(), start.getColumn());
                }
                char escaped = peek();
                if (escaped == '\n')
                {
                    throw new SoonLexException("Unterminated string (newline in string)",
                                               start.getLine(), start.getColumn());
                }
                advance();
                text.append(unescape(escaped));
            }
            else
            {
                text.append(c);
            }
        }
        advance(); // closing quote
        String raw = myInput.substring(begin, myOffset);
        return new Token(TokenType.STRING, text.toString(), raw, start);
    }

    private static char unescape(char c)
    {
        switch (c)
        {
            case 'n':  return '\n';
            case 't':  return '\t';
            case 'r':  return '\r';
            default:   return c; // includes \" and \\
        }
    }

    private Token readSigil(TokenType type, Position start)
    {
        char sigil = peek();
        advance();
        int begin = myOffset;
        while (! atEnd() && isWordChar(peek()))
        {
            advance();
        }
        if (myOffset == begin)
        {
            throw new SoonLexException("Expected a name after '" + sigil + "'",
                                       start.getLine(), start.getColumn());
        }
        return token(type, myInput.substring(begin, myOffset), start);
    }

    private Token readNumberOrDate(Position start)
    {
        int begin = myOffset;

        Matcher date = SoonTimestamp.DATE_PATTERN.matcher(myInput);
        date.region(begin, myInput.length());
        if (date.lookingAt() && ! isWordChar(peekAt(date.end())))
        {
            advanceTo(date.end());
            return token(TokenType.DATE, myInput.substring(begin, myOffset), start);
        }

        if (peek() == '-') advance();
        skipDigits();
        if (peek() == '.' && isDecimalDigit(peek(1)))
        {
            advance();
            skipDigits();
        }
        if (peek() == 'e' || peek() == 'E')
        {
            char next = peek(1);
            if (isDecimalDigit(next)
                || ((next == '+' || next == '-') && isDecimalDigit(peek(2))))
            {
                advance();
                if (! isDecimalDigit(peek())) advance(); // sign
                skipDigits();
            }
        }

        if (isWordChar(peek()))
        {
            // 123abc is a string, not a malformed number
            while (isWordChar(peek()))
            {
                advance();
            }
            return token(TokenType.STRING, myInput.substring(begin, myOffset), start);
        }
        return token(TokenType.NUMBER, myInput.substring(begin, myOffset), start);
    }

    private void skipDigits()
    {
        while (isDecimalDigit(peek()))
        {
            advance();
        }
    }

    private Token readWord(Position start)
    {
        int begin = myOffset;
        while (isWordChar(peek()))
        {
            advance();
        }
        String text = myInput.substring(begin, myOffset);
        if ("true".equals(text) || "false".equals(text))
        {
            return token(TokenType.BOOLEAN, text, start);
        }
        if ("null".equals(text))
        {
            return token(TokenType.NULL, text, start);
        }
        return token(TokenType.IDENTIFIER, text, start);
    }


    //=========================================================================
    // Input

    private static Token token(TokenType type, String text, Position start)
    {
        return new Token(type, text, start);
    }

    private Position here()
    {
        return new Position(myLine, myColumn, myOffset);
    }

    private boolean atEnd()
    {
        return myOffset >= myInput.length();
    }

    /** @return the char at an absolute offset, or -1 past the end. */
    private int peekAt(int offset)
    {
        return (offset < myInput.length() ? myInput.charAt(offset) : -1);
    }

    private char peek()
    {
        return peek(0);
    }

    /** @return the char {@code ahead} places on, or NUL past the end. */
    private char peek(int ahead)
    {
        int offset = myOffset + ahead;
        return (offset < myInput.length() ? myInput.charAt(offset) : '\0');
    }

    private void advance()
    {
        myOffset++;
        myColumn++;
    }

    private void advanceTo(int offset)
    {
        while (myOffset < offset)
        {
            advance();
        }
    }
}
