// Copyright The SOON Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package org.soon.impl;

/**
 * One lexical unit of SOON text. The text of a STRING token is the decoded
 * content; {@link #getRaw()} keeps the quoted source form.
 */
public final class Token
{
    private final TokenType myType;
    private final String    myText;
    private final String    myRaw;
    private final Position  myPosition;

    public Token(TokenType type, String text, Position position)
    {
        this(type, text, null, position);
    }

    public Token(TokenType type, String text, String raw, Position position)
    {
        myType = type;
        myText = text;
        myRaw = raw;
        myPosition = position;
    }

    public TokenType getType()
    {
        return myType;
    }

    public boolean is(TokenType type)
    {
        return myType == type;
    }

    public String getText()
    {
        return myText;
    }

    /**
     * @return the source form of a quoted string, or null for other tokens.
     */
    public String getRaw()
    {
        return myRaw;
    }

    /**
     * @return the quoted source form if there is one, else the text.
     */
    public String getSourceText()
    {
        return (myRaw != null ? myRaw : myText);
    }

    public Position getPosition()
    {
        return myPosition;
    }

    public int getLine()
    {
        return myPosition.getLine();
    }

    public int getColumn()
    {
        return myPosition.getColumn();
    }

    @Override
    public String toString()
    {
        return myType + "(" + getSourceText() + ") at " + myPosition;
    }
}
