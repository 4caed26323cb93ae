// Copyright The SOON Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package org.soon;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A SOON date: an instant on the UTC time line with millisecond precision.
 * <p>
 * The text form accepted by {@link #valueOf(CharSequence)} is
 * {@code YYYY-MM-DD[THH:MM[:SS][.fff][Z|+HH:MM|-HH:MM]]}. A date without a
 * time is midnight UTC and a time without an offset is taken as UTC.
 * The canonical form written by {@link #toIsoString()} is always
 * {@code YYYY-MM-DDTHH:MM:SS.fffZ}.
 */
public final class SoonTimestamp
    extends SoonValue
{
    /**
     * The shape of a date literal. Matching this pattern does not mean the
     * date exists on the calendar; {@link #valueOf(CharSequence)} checks that.
     */
    public static final Pattern DATE_PATTERN = Pattern.compile(
        "(\\d{4}-\\d{2}-\\d{2})"
        + "(?:T(\\d{2}:\\d{2}(?::\\d{2})?(?:\\.\\d+)?)(Z|[+-]\\d{2}:\\d{2})?)?");

    private static final int MAX_YEAR = 9999;

    // ASCII digits whatever the default locale
    private static final DateTimeFormatter ISO_FORMAT =
        DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSS'Z'", Locale.ROOT);

    private final Instant myInstant;

    private SoonTimestamp(Instant instant)
    {
        myInstant = instant.truncatedTo(ChronoUnit.MILLIS);
    }

    /**
     * @param instant truncated to milliseconds; must not be null.
     */
    public static SoonTimestamp forInstant(Instant instant)
    {
        if (instant == null) throw new NullPointerException("instant");
        return new SoonTimestamp(instant);
    }

    public static SoonTimestamp forEpochMillis(long millis)
    {
        return new SoonTimestamp(Instant.ofEpochMilli(millis));
    }

    /**
     * Parses a date literal.
     *
     * @throws DateTimeParseException if the text does not have the date
     * shape or names a date or time that does not exist.
     */
    public static SoonTimestamp valueOf(CharSequence text)
    {
        Matcher m = DATE_PATTERN.matcher(text);
        if (! m.matches())
        {
            throw new DateTimeParseException("Not a date literal", text, 0);
        }

        try
        {
            LocalDate date = LocalDate.parse(m.group(1));
            if (m.group(2) == null)
            {
                return new SoonTimestamp(date.atStartOfDay().toInstant(ZoneOffset.UTC));
            }
            LocalTime time = LocalTime.parse(m.group(2));
            ZoneOffset offset = (m.group(3) == null
                                 ? ZoneOffset.UTC
                                 : ZoneOffset.of(m.group(3)));
            return new SoonTimestamp(LocalDateTime.of(date, time).toInstant(offset));
        }
        catch (DateTimeParseException e)
        {
            throw e;
        }
        catch (DateTimeException e)
        {
            // ZoneOffset.of reports range problems with the base type
            throw new DateTimeParseException(e.getMessage(), text, 0, e);
        }
    }

    public Instant instantValue()
    {
        return myInstant;
    }

    public long getMillis()
    {
        return myInstant.toEpochMilli();
    }

    /**
     * Renders the canonical text form.
     *
     * @throws SoonEncodeException if the year is outside 0000-9999, which the
     * date literal cannot express.
     */
    public String toIsoString()
    {
        OffsetDateTime t = myInstant.atOffset(ZoneOffset.UTC);
        if (t.getYear() < 0 || t.getYear() > MAX_YEAR)
        {
            throw new SoonEncodeException("Cannot encode date outside years 0000-9999: "
                                          + myInstant);
        }
        return ISO_FORMAT.format(t);
    }

    @Override
    public SoonType getType()
    {
        return SoonType.TIMESTAMP;
    }

    @Override
    public <R> R accept(ValueVisitor<R> visitor)
    {
        return visitor.visit(this);
    }

    @Override
    public SoonTimestamp clone()
    {
        return this;
    }

    @Override
    public boolean equals(Object other)
    {
        return other instanceof SoonTimestamp
            && ((SoonTimestamp) other).myInstant.equals(myInstant);
    }

    @Override
    public int hashCode()
    {
        return myInstant.hashCode();
    }
}
