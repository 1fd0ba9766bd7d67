package org.github.dateretention.date;

import org.joda.time.DateTime;
import org.joda.time.DateTimeZone;

public class ReferenceDates
{
    /**
     * The current time rounded up to the next day boundary of the time zone. Runs at different times of the
     * same day therefore walk the same windows.
     */
    public static long nextDayBoundary(DateTimeZone timeZone)
    {
        DateTime start=new DateTime(timeZone).plusDays(1).withTimeAtStartOfDay();
        return Math.floorDiv(start.getMillis(), 1000L);
    }
    
    /**
     * @param reference any representation {@link FlexibleInstantCoercer} understands, or <code>null</code>
     *          for {@link #nextDayBoundary(DateTimeZone)}
     */
    public static long resolve(Object reference, FlexibleInstantCoercer coercer)
    {
        if (reference==null) return nextDayBoundary(coercer.getTimeZone());
        return coercer.toEpochSeconds(reference);
    }
}
