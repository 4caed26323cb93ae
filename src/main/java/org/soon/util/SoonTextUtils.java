// Copyright The SOON Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package org.soon.util;

import java.io.IOException;
import java.util.regex.Pattern;
import org.soon.SoonTimestamp;

/**
 * Utility methods for working with SOON's text-oriented data types.
 */
public class SoonTextUtils
{
    /**
     * The shape of a number as the lexer reads it, with an optional trailing
     * dot. Bare strings of this shape would read back as numbers.
     */
    private static final Pattern NUMERIC_SHAPE =
        Pattern.compile("-?\\d+\\.?\\d*(?:[eE][+-]?\\d+)?");

    // escape sequences for the characters the quoted form cannot hold raw
    private static final String[] ESCAPE_CODES;
    static
    {
        ESCAPE_CODES = new String[128];
        ESCAPE_CODES['\t'] = "\\t";
        ESCAPE_CODES['\n'] = "\\n";
        ESCAPE_CODES['\r'] = "\\r";
        ESCAPE_CODES['\\'] = "\\\\";
        ESCAPE_CODES['\"'] = "\\\"";
    }


    /**
     * Determines whether a character can appear in a bare word: any Unicode
     * letter or digit, or one of {@code _ - . / @ +}.
     */
    public static boolean isWordChar(int c)
    {
        switch (c)
        {
            case '_':
            case '-':
            case '.':
            case '/':
            case '@':
            case '+':
                return true;
            default:
                return c >= 0 && Character.isLetterOrDigit(c);
        }
    }

    public static boolean isDecimalDigit(int c)
    {
        return c >= '0' && c <= '9';
    }

    /**
     * Determines whether the text denotes one of the keywords
     * {@code true}, {@code false} or {@code null}.
     */
    public static boolean isKeyword(CharSequence text)
    {
        String s = text.toString();
        return "true".equals(s) || "false".equals(s) || "null".equals(s);
    }

    public static boolean hasNumericShape(CharSequence text)
    {
        return NUMERIC_SHAPE.matcher(text).matches();
    }

    public static boolean hasDateShape(CharSequence text)
    {
        return SoonTimestamp.DATE_PATTERN.matcher(text).matches();
    }

    /**
     * Determines whether a string must be quoted so that it reads back as
     * the same single string. Bare output is allowed only for non-empty runs
     * of word characters that do not read as a keyword, number or date.
     *
     * @param text the string to check; must not be null.
     */
    public static boolean needsQuoting(CharSequence text)
    {
        int length = text.length();
        if (length == 0) return true;

        for (int i = 0; i < length; i++)
        {
            if (! isWordChar(text.charAt(i))) return true;
        }

        return isKeyword(text) || hasNumericShape(text) || hasDateShape(text);
    }

    /**
     * Determines whether a string can be written as an unquoted key, which
     * must read back as a single identifier.
     */
    public static boolean isBareKey(CharSequence text)
    {
        if (needsQuoting(text)) return false;

        char c = text.charAt(0);
        if (isDecimalDigit(c)) return false;
        if (c == '-' && text.length() > 1 && isDecimalDigit(text.charAt(1)))
        {
            return false;
        }
        return true;
    }


    /**
     * Prints characters as a SOON string, including surrounding
     * double-quotes.
     *
     * @param out the stream to receive the data.
     * @param text the text to print; must not be null.
     *
     * @throws IOException if the {@link Appendable} throws an exception.
     */
    public static void printString(Appendable out, CharSequence text)
        throws IOException
    {
        out.append('"');
        int length = text.length();
        for (int i = 0; i < length; i++)
        {
            char c = text.charAt(i);
            String escape = (c < ESCAPE_CODES.length ? ESCAPE_CODES[c] : null);
            if (escape != null)
            {
                out.append(escape);
            }
            else
            {
                out.append(c);
            }
        }
        out.append('"');
    }

    /**
     * Builds a String denoting a SOON string, including surrounding
     * double-quotes.
     *
     * @param text the text to print; must not be null.
     */
    public static String printString(CharSequence text)
    {
        if (text.length() == 0)
        {
            return "\"\"";
        }

        StringBuilder builder = new StringBuilder(text.length() + 2);
        try
        {
            printString(builder, text);
        }
        catch (IOException e)
        {
            // Shouldn't happen
            throw new Error(e);
        }
        return builder.toString();
    }

    /**
     * Prints a string bare when that reads back unchanged, otherwise quoted.
     */
    public static String printWord(CharSequence text)
    {
        return (needsQuoting(text) ? printString(text) : text.toString());
    }

    /**
     * Prints a key bare when it reads back as an identifier, otherwise quoted.
     */
    public static String printKey(CharSequence text)
    {
        return (isBareKey(text) ? text.toString() : printString(text));
    }
}
