package org.github.dateretention.date;

import java.util.ArrayList;
import java.util.Calendar;
import java.util.Date;
import java.util.List;
import java.util.regex.Pattern;

import org.github.dateretention.keep.IInstantCoercer;
import org.github.dateretention.keep.InvalidTimestampException;
import org.github.dateretention.keep.RetentionEngine;
import org.joda.time.DateTimeZone;
import org.joda.time.LocalDate;
import org.joda.time.LocalDateTime;
import org.joda.time.ReadableInstant;
import org.joda.time.format.DateTimeFormat;
import org.joda.time.format.DateTimeFormatter;
import org.joda.time.format.ISODateTimeFormat;

/**
 * Accepts the usual ways a snapshot time is written down and resolves it to seconds since epoch:
 * numbers (epoch seconds), joda instants and local dates, {@link Date}, {@link Calendar} and text.
 * 
 * Local dates and text without an offset are interpreted in the configured time zone.
 */
public class FlexibleInstantCoercer implements IInstantCoercer<Object>
{
    public static final String[] DEFAULT_PATTERNS={
        "yyyy-MM-dd HH:mm:ss",
        "yyyy-MM-dd HH:mm",
        "yyyyMMdd'T'HHmmss",
        "'backup-'yyyy-MM-dd-HH:mm:ss",
    };
    
    protected static final Pattern NUMBER=Pattern.compile("[+-]?\\d+(\\.\\d*)?");
    
    protected final DateTimeZone timeZone;
    protected final List<DateTimeFormatter> formatters;
    protected final List<DateTimeFormatter> extraFormatters;
    
    public FlexibleInstantCoercer(DateTimeZone timeZone, String... extraPatterns)
    {
        if (timeZone==null) throw new IllegalArgumentException("Missing time zone");
        this.timeZone=timeZone;
        
        formatters=new ArrayList<>();
        formatters.add(ISODateTimeFormat.dateTimeParser().withZone(timeZone));
        for (String pattern: DEFAULT_PATTERNS)
        {
            formatters.add(DateTimeFormat.forPattern(pattern).withZone(timeZone));
        }
        extraFormatters=new ArrayList<>();
        if (extraPatterns!=null) for (String pattern: extraPatterns)
        {
            extraFormatters.add(DateTimeFormat.forPattern(pattern).withZone(timeZone));
        }
    }
    
    public DateTimeZone getTimeZone()
    {
        return timeZone;
    }
    
    @Override
    public long toEpochSeconds(Object value) throws InvalidTimestampException
    {
        if (value==null) throw new InvalidTimestampException(value, "Timestamp must not be null");
        
        try
        {
            if (value instanceof Number) return RetentionEngine.EPOCH_SECONDS.toEpochSeconds((Number) value);
            if (value instanceof ReadableInstant) return toSeconds(((ReadableInstant) value).getMillis());
            if (value instanceof LocalDateTime) return toSeconds(((LocalDateTime) value).toDateTime(timeZone).getMillis());
            if (value instanceof LocalDate) return toSeconds(((LocalDate) value).toDateTimeAtStartOfDay(timeZone).getMillis());
            if (value instanceof Date) return toSeconds(((Date) value).getTime());
            if (value instanceof Calendar) return toSeconds(((Calendar) value).getTimeInMillis());
        }
        catch (InvalidTimestampException ex)
        {
            throw ex;
        }
        catch (IllegalArgumentException ex)
        {
            // joda reports local times inside a DST gap this way
            throw new InvalidTimestampException(value, "Not a valid timestamp in "+timeZone+": "+value, ex);
        }
        
        if (value instanceof CharSequence) return parse(value.toString());
        
        throw new InvalidTimestampException(value, "Unsupported timestamp type "+value.getClass().getName()+": "+value);
    }
    
    /**
     * Caller supplied patterns take precedence, so a naming scheme made of digits only
     * (e.g. <code>yyyyMMddHHmmss</code>) is not mistaken for epoch seconds.
     */
    protected long parse(String value)
    {
        String text=value.trim();
        IllegalArgumentException lastError=null;
        for (DateTimeFormatter formatter: extraFormatters)
        {
            try
            {
                return toSeconds(formatter.parseMillis(text));
            }
            catch (IllegalArgumentException ex)
            {
                lastError=ex;
            }
        }
        
        if (NUMBER.matcher(text).matches()) return (long) Math.floor(Double.parseDouble(text));
        
        for (DateTimeFormatter formatter: formatters)
        {
            try
            {
                return toSeconds(formatter.parseMillis(text));
            }
            catch (IllegalArgumentException ex)
            {
                lastError=ex;
            }
        }
        throw new InvalidTimestampException(value, "Unable to parse timestamp '"+value+"'", lastError);
    }
    
    protected static long toSeconds(long millis)
    {
        return Math.floorDiv(millis, 1000L);
    }
}
