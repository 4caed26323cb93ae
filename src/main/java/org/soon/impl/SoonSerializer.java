// Copyright The SOON Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package org.soon.impl;

import static org.soon.util.SoonTextUtils.isBareKey;
import static org.soon.util.SoonTextUtils.printKey;
import static org.soon.util.SoonTextUtils.printString;
import static org.soon.util.SoonTextUtils.printWord;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import org.soon.SoonBlob;
import org.soon.SoonBool;
import org.soon.SoonEncodeException;
import org.soon.SoonList;
import org.soon.SoonNull;
import org.soon.SoonNumber;
import org.soon.SoonString;
import org.soon.SoonStruct;
import org.soon.SoonTimestamp;
import org.soon.SoonType;
import org.soon.SoonValue;
import org.soon.system.SoonEncoderBuilder;
import org.soon.util.AbstractValueVisitor;

/**
 * Writes a value as SOON text.
 * <p>
 * Every scalar is written as exactly one token. Arrays are written, in
 * order of preference, as one line of scalars; as a table, when the
 * elements are records with the same keys and only scalar values; or as
 * one element per line, the first on the owning key's line and the rest
 * indented under it, records in {@code key:value} form. That last layout
 * reads back as written only when the first element is a record of
 * scalars and no element holds a container; other arrays are still
 * written, flattened one element per line.
 * <p>
 * Lines are joined with {@code \n}; there is no trailing newline.
 */
public final class SoonSerializer
{
    /** Compact mode inlines records with at most this many fields. */
    static final int MAX_INLINE_FIELDS = 4;

    /** Integral numbers below this magnitude are written without exponent. */
    private static final double PLAIN_INTEGER_LIMIT = 1e21;

    private final int     myIndent;
    private final boolean mySortKeys;
    private final boolean myCompact;

    private final List<String> myIndentCache = new ArrayList<String>();
    private final ScalarPrinter myScalarPrinter = new ScalarPrinter();

    public SoonSerializer(SoonEncoderBuilder options)
    {
        myIndent = options.getIndent();
        mySortKeys = options.isSortKeys();
        myCompact = options.isCompact();
    }

    /**
     * @throws SoonEncodeException if the value holds a non-finite number or
     * a date outside the four-digit years.
     */
    public String serialize(SoonValue value)
    {
        List<String> lines = new ArrayList<String>();
        switch (value.getType())
        {
            case STRUCT:
                writeTopLevelRecord(lines, (SoonStruct) value);
                break;
            case LIST:
                writeTopLevelArray(lines, (SoonList) value);
                break;
            case STRING:
                // a bare word alone on a line would read as a key
                lines.add(printString(((SoonString) value).stringValue()));
                break;
            default:
                lines.add(scalar(value));
                break;
        }
        return join(lines);
    }


    //=========================================================================
    // Records

    private void writeTopLevelRecord(List<String> lines, SoonStruct record)
    {
        if (record.isEmpty()) return;
        if (myCompact && isSmallFlatRecord(record))
        {
            lines.add(inlineRecord(record));
            return;
        }
        writeFields(lines, record, 0);
    }

    private void writeFields(List<String> lines, SoonStruct record, int level)
    {
        for (String key : keys(record))
        {
            writeField(lines, key, record.get(key), level);
        }
    }

    private void writeField(List<String> lines, String key, SoonValue value, int level)
    {
        String head = indent(level) + printKey(key);

        if (! value.isContainer())
        {
            lines.add(head + " " + scalar(value));
            return;
        }

        if (value.getType() == SoonType.STRUCT)
        {
            SoonStruct record = (SoonStruct) value;
            if (record.isEmpty())
            {
                lines.add(head);
            }
            else if (myCompact && isSmallFlatRecord(record))
            {
                lines.add(head + " " + inlineRecord(record));
            }
            else
            {
                lines.add(head);
                writeFields(lines, record, level + 1);
            }
            return;
        }

        writeArrayField(lines, head, (SoonList) value, level);
    }


    //=========================================================================
    // Arrays

    private void writeArrayField(List<String> lines, String head, SoonList array, int level)
    {
        if (array.isEmpty())
        {
            lines.add(head);
            return;
        }
        if (allScalars(array))
        {
            lines.add(head + " " + scalarLine(array));
            return;
        }

        List<String> columns = tableColumns(array);
        if (columns != null)
        {
            writeTable(lines, head, columns, array, level);
            return;
        }

        writeElementLines(lines, head + " ", array, level);
    }

    private void writeTopLevelArray(List<String> lines, SoonList array)
    {
        if (array.isEmpty()) return;
        if (allScalars(array))
        {
            String line = scalarLine(array);
            SoonValue first = array.get(0);
            if (first.getType() == SoonType.STRING)
            {
                // keep a lone leading word from reading as a key
                String word = scalar(first);
                line = printString(((SoonString) first).stringValue())
                    + line.substring(word.length());
            }
            lines.add(line);
            return;
        }
        // no table form here: a header line needs an owning key
        writeElementLines(lines, "", array, 0);
    }

    /**
     * Writes the first element after {@code head} and each other element on
     * its own line one level below {@code level}. Only when the first
     * element is a record of scalars does the result read back as the same
     * array.
     */
    private void writeElementLines(List<String> lines, String head, SoonList array, int level)
    {
        lines.add(head + elementLine(array.get(0)));
        String pad = indent(level + 1);
        for (int i = 1; i < array.size(); i++)
        {
            lines.add(pad + elementLine(array.get(i)));
        }
    }

    /**
     * Renders one array element on one line. Records are written as
     * {@code key:value} pairs and arrays as space-joined tokens; containers
     * nested inside an element are flattened the same way.
     */
    private String elementLine(SoonValue element)
    {
        StringBuilder line = new StringBuilder();
        flatten(line, element);
        return (line.length() == 0 ? "null" : line.toString());
    }

    private void flatten(StringBuilder line, SoonValue value)
    {
        switch (value.getType())
        {
            case STRUCT:
            {
                SoonStruct record = (SoonStruct) value;
                for (String key : keys(record))
                {
                    if (line.length() > 0) line.append(' ');
                    line.append(printKey(key)).append(':');
                    SoonValue field = record.get(key);
                    if (field.isContainer())
                    {
                        int mark = line.length();
                        flatten(line, field);
                        if (line.length() == mark)
                        {
                            line.append("null");
                        }
                        else if (line.charAt(mark) == ' ')
                        {
                            line.deleteCharAt(mark);
                        }
                    }
                    else
                    {
                        line.append(scalar(field));
                    }
                }
                break;
            }
            case LIST:
                for (SoonValue element : (SoonList) value)
                {
                    flatten(line, element);
                }
                break;
            default:
                if (line.length() > 0) line.append(' ');
                line.append(scalar(value));
                break;
        }
    }

    /**
     * @return the table columns if every element is a record of scalars
     * with the same bare-word keys, else null.
     */
    private List<String> tableColumns(SoonList array)
    {
        SoonValue first = array.get(0);
        if (first.getType() != SoonType.STRUCT) return null;
        Set<String> keys = ((SoonStruct) first).keySet();
        if (keys.isEmpty()) return null;

        for (String key : keys)
        {
            if (! isBareKey(key)) return null;
        }
        for (SoonValue element : array)
        {
            if (element.getType() != SoonType.STRUCT) return null;
            SoonStruct record = (SoonStruct) element;
            if (! record.keySet().equals(keys) || ! isFlatRecord(record)) return null;
        }
        return keys((SoonStruct) first);
    }

    private void writeTable(List<String> lines, String head, List<String> columns,
                            SoonList array, int level)
    {
        int rowCount = array.size();
        String[][] cells = new String[rowCount][columns.size()];
        int[] widths = new int[columns.size()];
        for (int c = 0; c < columns.size(); c++)
        {
            widths[c] = columns.get(c).length();
            for (int r = 0; r < rowCount; r++)
            {
                SoonStruct record = (SoonStruct) array.get(r);
                cells[r][c] = scalar(record.get(columns.get(c)));
                widths[c] = Math.max(widths[c], cells[r][c].length());
            }
        }

        lines.add(head + " " + tableLine(columns.toArray(new String[0]), widths));
        String pad = indent(level + 1);
        for (int r = 0; r < rowCount; r++)
        {
            lines.add(pad + tableLine(cells[r], widths));
        }
    }

    private static String tableLine(String[] cells, int[] widths)
    {
        StringBuilder line = new StringBuilder();
        for (int c = 0; c < cells.length; c++)
        {
            if (c > 0) line.append(' ');
            line.append(cells[c]);
            if (c < cells.length - 1)
            {
                for (int i = cells[c].length(); i < widths[c]; i++)
                {
                    line.append(' ');
                }
            }
        }
        return line.toString();
    }


    //=========================================================================
    // Helpers

    private String inlineRecord(SoonStruct record)
    {
        StringBuilder line = new StringBuilder();
        for (String key : keys(record))
        {
            if (line.length() > 0) line.append(' ');
            line.append(printKey(key)).append(':').append(scalar(record.get(key)));
        }
        return line.toString();
    }

    private String scalarLine(SoonList array)
    {
        StringBuilder line = new StringBuilder();
        for (SoonValue element : array)
        {
            if (line.length() > 0) line.append(' ');
            line.append(scalar(element));
        }
        return line.toString();
    }

    private String scalar(SoonValue value)
    {
        return value.accept(myScalarPrinter);
    }

    private static boolean allScalars(SoonList array)
    {
        for (SoonValue element : array)
        {
            if (element.isContainer()) return false;
        }
        return true;
    }

    private static boolean isFlatRecord(SoonStruct record)
    {
        if (record.isEmpty()) return false;
        for (String key : record.keySet())
        {
            if (record.get(key).isContainer()) return false;
        }
        return true;
    }

    private static boolean isSmallFlatRecord(SoonStruct record)
    {
        return record.size() <= MAX_INLINE_FIELDS && isFlatRecord(record);
    }

    private List<String> keys(SoonStruct record)
    {
        List<String> keys = new ArrayList<String>(record.keySet());
        if (mySortKeys)
        {
            Collections.sort(keys);
        }
        return keys;
    }

    private String indent(int level)
    {
        if (level <= 0) return "";
        while (myIndentCache.size() <= level)
        {
            StringBuilder pad = new StringBuilder();
            for (int i = 0; i < myIndentCache.size() * myIndent; i++)
            {
                pad.append(' ');
            }
            myIndentCache.add(pad.toString());
        }
        return myIndentCache.get(level);
    }

    private static String join(List<String> lines)
    {
        StringBuilder text = new StringBuilder();
        for (String line : lines)
        {
            if (text.length() > 0) text.append('\n');
            text.append(line);
        }
        return text.toString();
    }


    /**
     * Renders scalars as single tokens. Containers are never passed here.
     */
    private static final class ScalarPrinter
        extends AbstractValueVisitor<String>
    {
        @Override
        public String visit(SoonNull value)
        {
            return "null";
        }

        @Override
        public String visit(SoonBool value)
        {
            return (value.booleanValue() ? "true" : "false");
        }

        @Override
        public String visit(SoonNumber value)
        {
            if (! value.isFinite())
            {
                throw new SoonEncodeException("Cannot encode non-finite number: "
                                              + value.doubleValue());
            }
            double d = value.doubleValue();
            if (value.isIntegral() && Math.abs(d) < PLAIN_INTEGER_LIMIT)
            {
                // also turns -0 into 0
                return new BigDecimal(d).toPlainString();
            }
            return Double.toString(d);
        }

        @Override
        public String visit(SoonString value)
        {
            return printWord(value.stringValue());
        }

        @Override
        public String visit(SoonTimestamp value)
        {
            return value.toIsoString();
        }

        @Override
        public String visit(SoonBlob value)
        {
            return printString(Base64.getEncoder().encodeToString(value.getBytes()));
        }
    }
}
