// Copyright The SOON Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package org.soon.impl;

import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.soon.DuplicateKeyException;
import org.soon.SoonBool;
import org.soon.SoonNull;
import org.soon.SoonNumber;
import org.soon.SoonParseException;
import org.soon.SoonString;
import org.soon.SoonTimestamp;
import org.soon.SoonValue;
import org.soon.impl.ast.AnchorDefNode;
import org.soon.impl.ast.AnchorRefNode;
import org.soon.impl.ast.ArrayNode;
import org.soon.impl.ast.AstNode;
import org.soon.impl.ast.LiteralNode;
import org.soon.impl.ast.ObjectNode;
import org.soon.impl.ast.PropertyNode;
import org.soon.impl.ast.RootNode;
import org.soon.system.SoonDecoderBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds a syntax tree from the tokens of one document.
 * <p>
 * Structure is decided line by line from the shape of the tokens already
 * lexed, without backtracking. For a key line the rest of the line (its
 * <em>tail</em>) and whether an indented block follows select the value:
 * <ol>
 *   <li>no tail and a block: a nested record;</li>
 *   <li>a tail of {@code k:v} pairs and a block: an array of records, the
 *   tail being the first and each indented row another;</li>
 *   <li>a tail of identifiers and a block: a table, the tail naming the
 *   columns and each indented row giving one record;</li>
 *   <li>a tail of {@code k:v} pairs alone: one record;</li>
 *   <li>any other tail: one scalar, or an array for several tokens;</li>
 *   <li>no tail at all: null.</li>
 * </ol>
 * A tail may start with {@code &name}, which binds the value to an anchor.
 * <p>
 * Instances parse one token sequence once and are not thread-safe.
 */
public final class SoonParser
{
    private static final Logger logger = LoggerFactory.getLogger(SoonParser.class);

    private final List<Token> myTokens;
    private int myIndex;
    private int myDepth;

    private final boolean myAllowDuplicateKeys;
    private final int     myMaxDepth;
    private final boolean myStrict;
    private final boolean myStreaming;

    /**
     * @param tokens a complete token sequence ending with EOF, as returned by
     * {@link SoonLexer#tokenize(CharSequence)}.
     * @param options the decoder configuration to honor.
     */
    public SoonParser(List<Token> tokens, SoonDecoderBuilder options)
    {
        if (tokens.isEmpty() || ! tokens.get(tokens.size() - 1).is(TokenType.EOF))
        {
            throw new IllegalArgumentException("Token sequence must end with EOF");
        }
        myTokens = tokens;
        myAllowDuplicateKeys = options.isAllowDuplicateKeys();
        myMaxDepth = options.getMaxDepth();
        myStrict = options.isStrict();
        myStreaming = options.isStreaming();
    }

    /**
     * Parses the whole token sequence.
     *
     * @throws SoonParseException on the first structural error.
     */
    public RootNode parse()
    {
        RootNode root = new RootNode(new Position(1, 1, 0));
        Set<String> keys = new HashSet<String>();

        skipNewlines();
        while (! check(TokenType.EOF))
        {
            parseTopLevel(root, keys);
            skipNewlines();
        }
        return root;
    }


    //=========================================================================
    // Top level

    private void parseTopLevel(RootNode root, Set<String> keys)
    {
        Token t = peek();
        switch (t.getType())
        {
            case PIPE:
                parseChunkDelimiter();
                skipNewlines();
                if (check(TokenType.EOF) || check(TokenType.PIPE))
                {
                    root.add(nullLiteral(t));
                }
                else
                {
                    parseTopLevel(root, keys);
                }
                return;
            case INDENT:
                advance();
                root.add(parseBlock(t));
                return;
            case DEDENT:
                // nothing to close at the top level
                advance();
                return;
            case ANCHOR:
            {
                advance();
                checkDuplicate(keys, t.getText(), t);
                root.add(new AnchorDefNode(t.getPosition(), t.getText(),
                                           parseKeyedValue(t)));
                return;
            }
            case IDENTIFIER:
            case STRING:
                if (peek(1).is(TokenType.COLON))
                {
                    parseRootInlineLine(root, keys);
                    return;
                }
                if (t.is(TokenType.IDENTIFIER) || isQuotedKey())
                {
                    PropertyNode property = parseKeyLine();
                    checkDuplicate(keys, property.getKey(), t);
                    root.add(property);
                    return;
                }
                break;
            default:
                break;
        }

        root.add(lineValue(collectLine()));
    }

    /**
     * Consumes {@code |id|}. The id may be any single token.
     */
    private void parseChunkDelimiter()
    {
        Token open = advance();
        if (! check(TokenType.PIPE) && ! peek().getType().isLineEnd())
        {
            advance();
        }
        if (check(TokenType.PIPE))
        {
            advance();
        }
        else if (myStrict)
        {
            throw parseError("Unterminated chunk delimiter", open);
        }
    }

    /**
     * An inline record line at the top level contributes its pairs to the
     * root record, unless indented rows follow, in which case the line and
     * the rows form an array of records.
     */
    private void parseRootInlineLine(RootNode root, Set<String> keys)
    {
        List<Token> line = collectLine();
        ObjectNode first = parseInlineObject(line);
        if (indentFollows())
        {
            consumeIndent();
            root.add(parseRows(first));
            return;
        }
        for (PropertyNode property : first.getProperties())
        {
            checkDuplicate(keys, property.getKey(), line.get(0));
            root.add(property);
        }
    }

    /**
     * A quoted string starts a key line when more tokens follow it on the
     * line or an indented block follows the line.
     */
    private boolean isQuotedKey()
    {
        if (! peek(1).getType().isLineEnd()) return true;

        int i = myIndex + 1;
        while (myTokens.get(i).is(TokenType.NEWLINE)) i++;
        return myTokens.get(i).is(TokenType.INDENT);
    }


    //=========================================================================
    // Key lines

    private PropertyNode parseKeyLine()
    {
        Token key = advance();
        return new PropertyNode(key.getPosition(), key.getText(), parseKeyedValue(key));
    }

    /**
     * Parses the value after a key or top-level anchor, which owns the rest
     * of the line and any block that follows.
     */
    private AstNode parseKeyedValue(Token owner)
    {
        List<Token> tail = collectLine();
        if (! tail.isEmpty() && tail.get(0).is(TokenType.ANCHOR))
        {
            if (owner.is(TokenType.ANCHOR))
            {
                throw parseError("Anchor must follow a key", tail.get(0));
            }
            Token anchor = tail.get(0);
            AstNode value = classifyTail(anchor, tail.subList(1, tail.size()));
            return new AnchorDefNode(anchor.getPosition(), anchor.getText(), value);
        }
        return classifyTail(owner, tail);
    }

    private AstNode classifyTail(Token owner, List<Token> tail)
    {
        boolean block = indentFollows();

        if (tail.isEmpty())
        {
            if (block)
            {
                consumeIndent();
                return parseBlock(owner);
            }
            return nullLiteral(owner);
        }

        if (block)
        {
            if (hasInlineColon(tail))
            {
                ObjectNode first = parseInlineObject(tail);
                consumeIndent();
                return parseRows(first);
            }
            if (allIdentifiers(tail))
            {
                consumeIndent();
                return parseTable(tail);
            }
            skipOrphanBlock();
            return lineValue(tail);
        }

        if (hasInlineColon(tail))
        {
            return parseInlineObject(tail);
        }
        return lineValue(tail);
    }


    //=========================================================================
    // Blocks

    /**
     * Parses an indented record block. The INDENT has been consumed; the
     * matching DEDENT is consumed here.
     */
    private ObjectNode parseBlock(Token owner)
    {
        myDepth++;
        if (myDepth > myMaxDepth)
        {
            throw parseError("Maximum nesting depth exceeded: " + myMaxDepth, peek());
        }

        ObjectNode object = new ObjectNode(peek().getPosition());
        Set<String> seen = new HashSet<String>();

        for (;;)
        {
            skipNewlines();
            Token t = peek();
            if (t.is(TokenType.DEDENT))
            {
                advance();
                break;
            }
            if (t.is(TokenType.EOF)) break;

            if ((t.is(TokenType.IDENTIFIER) || t.is(TokenType.STRING))
                && peek(1).is(TokenType.COLON))
            {
                List<Token> line = collectLine();
                for (PropertyNode property : parseInlineObject(line).getProperties())
                {
                    checkDuplicate(seen, property.getKey(), t);
                    object.add(property);
                }
                if (indentFollows()) skipOrphanBlock();
            }
            else if (t.is(TokenType.IDENTIFIER) || t.is(TokenType.STRING))
            {
                PropertyNode property = parseKeyLine();
                checkDuplicate(seen, property.getKey(), t);
                object.add(property);
            }
            else if (t.is(TokenType.INDENT))
            {
                skipOrphanBlock();
            }
            else if (t.is(TokenType.ANCHOR))
            {
                throw parseError("Anchor must follow a key", t);
            }
            else
            {
                if (myStrict)
                {
                    throw parseError("Expected a key but found " + describe(t), t);
                }
                List<Token> skipped = collectLine();
                logger.debug("Skipping {} tokens at {}: line does not start with a key",
                             skipped.size(), t.getPosition());
                if (indentFollows()) skipOrphanBlock();
            }
        }

        myDepth--;
        return object;
    }

    /**
     * Parses the indented rows of an array of records. Rows of
     * {@code k:v} pairs are records; other rows are scalars or arrays.
     */
    private ArrayNode parseRows(ObjectNode first)
    {
        ArrayNode array = new ArrayNode(first.getPosition());
        array.add(first);

        for (;;)
        {
            skipNewlines();
            if (check(TokenType.DEDENT))
            {
                advance();
                break;
            }
            if (check(TokenType.EOF)) break;
            if (check(TokenType.INDENT))
            {
                skipOrphanBlock();
                continue;
            }

            List<Token> row = collectLine();
            if (hasInlineShape(row))
            {
                array.add(parseInlineObject(row));
            }
            else
            {
                array.add(lineValue(row));
            }
        }
        return array;
    }

    /**
     * Parses the indented rows of a table. Cells map to the headers by
     * position; a short row leaves the remaining fields out.
     */
    private ArrayNode parseTable(List<Token> headers)
    {
        Set<String> columns = new HashSet<String>();
        for (Token header : headers)
        {
            checkDuplicate(columns, header.getText(), header);
        }

        ArrayNode array = new ArrayNode(headers.get(0).getPosition());
        for (;;)
        {
            skipNewlines();
            if (check(TokenType.DEDENT))
            {
                advance();
                break;
            }
            if (check(TokenType.EOF)) break;
            if (check(TokenType.INDENT))
            {
                skipOrphanBlock();
                continue;
            }

            List<Token> row = collectLine();
            ObjectNode record = new ObjectNode(row.get(0).getPosition());
            int cells = Math.min(headers.size(), row.size());
            for (int i = 0; i < cells; i++)
            {
                Token cell = row.get(i);
                record.add(new PropertyNode(cell.getPosition(),
                                            headers.get(i).getText(),
                                            tokenToNode(cell)));
            }
            if (row.size() > headers.size())
            {
                Token extra = row.get(headers.size());
                if (myStrict)
                {
                    throw parseError("Table row has " + row.size() + " cells but only "
                                     + headers.size() + " columns", extra);
                }
                logger.debug("Ignoring {} extra table cells at {}",
                             row.size() - headers.size(), extra.getPosition());
            }
            array.add(record);
        }
        return array;
    }

    /**
     * Skips an indented block that no line owns. The NEWLINEs before it
     * may not have been consumed yet.
     */
    private void skipOrphanBlock()
    {
        skipNewlines();
        Token indent = advance();
        if (myStrict)
        {
            throw parseError("Unexpected indented block", indent);
        }
        logger.debug("Skipping indented block at {}", indent.getPosition());

        int level = 1;
        while (level > 0 && ! check(TokenType.EOF))
        {
            Token t = advance();
            if (t.is(TokenType.INDENT))
            {
                level++;
            }
            else if (t.is(TokenType.DEDENT))
            {
                level--;
            }
        }
    }


    //=========================================================================
    // Lines

    /**
     * Parses {@code key:value} pairs. Keys are identifiers or quoted
     * strings; each value is exactly one token.
     */
    private ObjectNode parseInlineObject(List<Token> tokens)
    {
        ObjectNode object = new ObjectNode(tokens.get(0).getPosition());
        Set<String> seen = new HashSet<String>();

        int i = 0;
        while (i < tokens.size())
        {
            Token key = tokens.get(i);
            boolean isKey = key.is(TokenType.IDENTIFIER) || key.is(TokenType.STRING);
            if (isKey
                && i + 2 < tokens.size()
                && tokens.get(i + 1).is(TokenType.COLON)
                && isValueToken(tokens.get(i + 2)))
            {
                checkDuplicate(seen, key.getText(), key);
                object.add(new PropertyNode(key.getPosition(), key.getText(),
                                            tokenToNode(tokens.get(i + 2))));
                i += 3;
                continue;
            }

            if (myStrict)
            {
                throw parseError("Malformed inline pair at " + describe(key), key);
            }
            logger.debug("Skipping {} in inline record at {}", describe(key),
                         key.getPosition());
            i++;
        }
        return object;
    }

    private static boolean isValueToken(Token t)
    {
        return t.getType().isLiteral()
            || t.is(TokenType.IDENTIFIER)
            || t.is(TokenType.REFERENCE);
    }

    /**
     * @return true if the line starts with a key immediately followed by a
     * colon.
     */
    private static boolean hasInlineShape(List<Token> line)
    {
        if (line.size() < 2) return false;
        Token first = line.get(0);
        return (first.is(TokenType.IDENTIFIER) || first.is(TokenType.STRING))
            && line.get(1).is(TokenType.COLON);
    }

    /**
     * @return true if any token of a key line's tail is immediately
     * followed by a colon.
     */
    private static boolean hasInlineColon(List<Token> tail)
    {
        for (int i = 0; i + 1 < tail.size(); i++)
        {
            if (tail.get(i + 1).is(TokenType.COLON)) return true;
        }
        return false;
    }

    private static boolean allIdentifiers(List<Token> line)
    {
        for (Token t : line)
        {
            if (! t.is(TokenType.IDENTIFIER)) return false;
        }
        return true;
    }

    /**
     * One token is a scalar; several are an array of scalars.
     */
    private AstNode lineValue(List<Token> line)
    {
        if (line.size() == 1)
        {
            return tokenToNode(line.get(0));
        }
        ArrayNode array = new ArrayNode(line.get(0).getPosition());
        for (Token t : line)
        {
            array.add(tokenToNode(t));
        }
        return array;
    }

    /**
     * Converts one value token to a literal or anchor reference.
     */
    AstNode tokenToNode(Token t)
    {
        SoonValue value;
        switch (t.getType())
        {
            case NULL:
                value = SoonNull.NULL;
                break;
            case BOOLEAN:
                value = SoonBool.valueOf("true".equals(t.getText()));
                break;
            case NUMBER:
                value = parseNumber(t.getText());
                break;
            case DATE:
                try
                {
                    value = SoonTimestamp.valueOf(t.getText());
                }
                catch (DateTimeParseException e)
                {
                    throw new SoonParseException(decorate("Invalid date: " + t.getText()),
                                                 t.getLine(), t.getColumn(), e);
                }
                break;
            case STRING:
            case IDENTIFIER:
                value = new SoonString(t.getText());
                break;
            case REFERENCE:
                return new AnchorRefNode(t.getPosition(), t.getText());
            case COLON:
            case PIPE:
                if (myStrict)
                {
                    throw parseError("Unexpected '" + t.getText() + "'", t);
                }
                value = new SoonString(t.getText());
                break;
            case ANCHOR:
                throw parseError("Anchor must follow a key", t);
            default:
                throw new IllegalStateException("Not a value token: " + t);
        }
        return new LiteralNode(t.getPosition(), value, t.getType());
    }

    static SoonNumber parseNumber(String text)
    {
        if (text.indexOf('.') >= 0 || text.indexOf('e') >= 0 || text.indexOf('E') >= 0)
        {
            return SoonNumber.valueOf(Double.parseDouble(text));
        }
        try
        {
            return SoonNumber.valueOf(Long.parseLong(text));
        }
        catch (NumberFormatException e)
        {
            // wider than a long
            return SoonNumber.valueOf(Double.parseDouble(text));
        }
    }

    private static LiteralNode nullLiteral(Token at)
    {
        return new LiteralNode(at.getPosition(), SoonNull.NULL, TokenType.NULL);
    }


    //=========================================================================
    // Token access

    /**
     * Collects the tokens up to the end of the current line, leaving the
     * line end unconsumed.
     */
    private List<Token> collectLine()
    {
        List<Token> line = new ArrayList<Token>();
        while (! peek().getType().isLineEnd())
        {
            line.add(advance());
        }
        return line;
    }

    /**
     * @return true if, past any NEWLINEs, the next token is INDENT.
     */
    private boolean indentFollows()
    {
        int i = myIndex;
        while (myTokens.get(i).is(TokenType.NEWLINE)) i++;
        return myTokens.get(i).is(TokenType.INDENT);
    }

    private void consumeIndent()
    {
        skipNewlines();
        advance();
    }

    private void skipNewlines()
    {
        while (check(TokenType.NEWLINE))
        {
            advance();
        }
    }

    private boolean check(TokenType type)
    {
        return peek().is(type);
    }

    private Token peek()
    {
        return myTokens.get(myIndex);
    }

    /** EOF is returned for any position past the end. */
    private Token peek(int ahead)
    {
        int i = Math.min(myIndex + ahead, myTokens.size() - 1);
        return myTokens.get(i);
    }

    private Token advance()
    {
        Token t = myTokens.get(myIndex);
        if (myIndex < myTokens.size() - 1) myIndex++;
        return t;
    }


    //=========================================================================
    // Errors

    private void checkDuplicate(Set<String> seen, String key, Token at)
    {
        if (! seen.add(key) && ! myAllowDuplicateKeys)
        {
            throw new DuplicateKeyException(key, at.getLine(), at.getColumn());
        }
    }

    private String decorate(String reason)
    {
        return (myStreaming ? reason + " (in stream chunk)" : reason);
    }

    private SoonParseException parseError(String reason, Token at)
    {
        return new SoonParseException(decorate(reason), at.getLine(), at.getColumn());
    }

    private static String describe(Token t)
    {
        switch (t.getType())
        {
            case STRING:
            case IDENTIFIER:
            case NUMBER:
            case DATE:
            case BOOLEAN:
            case NULL:
                return "'" + t.getSourceText() + "'";
            default:
                return t.getType().getImage();
        }
    }
}
