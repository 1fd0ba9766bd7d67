package org.github.dateretention.date;

import org.joda.time.Period;
import org.joda.time.format.PeriodFormatter;
import org.joda.time.format.PeriodFormatterBuilder;

/**
 * Compact period notation as used in rule definitions: <code>1y</code>, <code>3m</code> (months),
 * <code>2w</code>, <code>1d12h</code>, <code>15min</code>, <code>30s</code>.
 */
public class PeriodParser
{
    protected static final PeriodFormatter periodFormatter=new PeriodFormatterBuilder()
        .appendYears().appendSuffix("y")
        .appendMonths().appendSuffix("m")
        .appendWeeks().appendSuffix("w")
        .appendDays().appendSuffix("d")
        .appendHours().appendSuffix("h")
        // joda skips "m" where the longer "min" matches
        .appendMinutes().appendSuffix("min")
        .appendSeconds().appendSuffix("s")
        .toFormatter();
    
    public static Period parse(String period)
    {
        if (period==null) throw new IllegalArgumentException("Missing period");
        String text=period.trim().toLowerCase();
        if (text.isEmpty()) throw new IllegalArgumentException("Missing period");
        try
        {
            return periodFormatter.parsePeriod(text);
        }
        catch (IllegalArgumentException ex)
        {
            throw new IllegalArgumentException("Invalid period '"+period+"', expected something like 30min, 6h, 1d, 2w, 3m or 1y", ex);
        }
    }
    
    public static String print(Period period)
    {
        return periodFormatter.print(period);
    }
}
