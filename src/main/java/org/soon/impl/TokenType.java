// Copyright The SOON Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package org.soon.impl;

/**
 * The kinds of token produced by {@link SoonLexer}.
 */
public enum TokenType
{
    NULL        (true,  "null"),
    BOOLEAN     (true,  "<boolean>"),
    NUMBER      (true,  "<number>"),
    STRING      (true,  "<string>"),
    DATE        (true,  "<date>"),
    IDENTIFIER  (false, "<identifier>"),
    COLON       (false, ":"),
    PIPE        (false, "|"),
    ANCHOR      (false, "<anchor>"),
    REFERENCE   (false, "<reference>"),
    NEWLINE     (false, "<newline>"),
    INDENT      (false, "<indent>"),
    DEDENT      (false, "<dedent>"),
    EOF         (false, "<eof>"),
    COMMENT     (false, "<comment>");

    private final boolean myLiteral;
    private final String  myImage;

    TokenType(boolean literal, String image)
    {
        myLiteral = literal;
        myImage = image;
    }

    /**
     * @return true for the tokens that always denote a scalar value:
     * NULL, BOOLEAN, NUMBER, STRING and DATE.
     */
    public boolean isLiteral()
    {
        return myLiteral;
    }

    /**
     * @return true for the tokens that end the tail of a line.
     */
    public boolean isLineEnd()
    {
        return this == NEWLINE || this == INDENT || this == DEDENT || this == EOF;
    }

    public String getImage()
    {
        return myImage;
    }
}
