package org.github.dateretention.date;

import org.github.dateretention.keep.InvalidRuleException;
import org.github.dateretention.keep.RetentionRule;
import org.joda.time.DateTime;
import org.joda.time.DateTimeZone;
import org.joda.time.Period;

/**
 * A rule with calendar based interval and duration. Each window boundary is computed by subtracting the
 * interval from the previous boundary in the rule's time zone, so "1m" follows month lengths and DST.
 */
public class CalendarRetentionRule extends RetentionRule
{
    protected final Period interval;
    protected final Period duration;
    protected final DateTimeZone timeZone;
    
    public CalendarRetentionRule(Period interval, Period duration, DateTimeZone timeZone)
    {
        this(interval, duration, timeZone, null);
    }
    
    public CalendarRetentionRule(Period interval, Period duration, DateTimeZone timeZone, Double reachFactor)
    {
        super(reachFactor);
        if (interval==null) throw new InvalidRuleException("Missing interval");
        if (duration==null) throw new InvalidRuleException("Missing duration");
        if (timeZone==null) throw new InvalidRuleException("Missing time zone");
        if (reachFactor!=null) validateReachFactor(reachFactor.doubleValue());
        this.interval=interval;
        this.duration=duration;
        this.timeZone=timeZone;
        
        if (stepBack(0)>=0) throw new InvalidRuleException("interval must be > 0: "+PeriodParser.print(interval));
        if (spanStart(0)>0) throw new InvalidRuleException("duration must be >= 0: "+PeriodParser.print(duration));
    }
    
    public Period getInterval()
    {
        return interval;
    }
    
    public Period getDuration()
    {
        return duration;
    }
    
    public DateTimeZone getTimeZone()
    {
        return timeZone;
    }
    
    @Override
    public long stepBack(long epoch)
    {
        return toEpochSeconds(toDateTime(epoch).minus(interval));
    }
    
    @Override
    public long spanStart(long reference)
    {
        return toEpochSeconds(toDateTime(reference).minus(duration));
    }
    
    protected DateTime toDateTime(long epochSeconds)
    {
        return new DateTime(epochSeconds*1000L, timeZone);
    }
    
    protected static long toEpochSeconds(DateTime date)
    {
        return Math.floorDiv(date.getMillis(), 1000L);
    }
    
    @Override
    public String toString()
    {
        return PeriodParser.print(interval)+"/"+PeriodParser.print(duration)+(reachFactor==null?"":"/"+reachFactor);
    }
}
