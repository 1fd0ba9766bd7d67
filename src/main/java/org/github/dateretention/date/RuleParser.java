package org.github.dateretention.date;

import java.util.ArrayList;
import java.util.List;

import org.github.dateretention.keep.InvalidRuleException;
import org.github.dateretention.keep.RetentionRule;
import org.joda.time.DateTimeZone;
import org.joda.time.Period;

/**
 * Parses rules written as <code>interval/duration[/reachFactor]</code>, e.g. <code>6h/3m</code> keeps one
 * snapshot every 6 hours for 3 months, <code>1d/6m/0.4</code> one per day for 6 months with a narrower reach.
 */
public class RuleParser
{
    public static RetentionRule parse(String rule, DateTimeZone timeZone)
    {
        if (rule==null) throw new InvalidRuleException("Missing rule");
        
        String[] parts=rule.trim().split("\\s*/\\s*");
        if (parts.length<2 || parts.length>3) throw new InvalidRuleException("Invalid rule '"+rule+"', expected interval/duration[/reachFactor]");
        
        Period interval;
        Period duration;
        try
        {
            interval=PeriodParser.parse(parts[0]);
            duration=PeriodParser.parse(parts[1]);
        }
        catch (IllegalArgumentException ex)
        {
            throw new InvalidRuleException("Invalid rule '"+rule+"': "+ex.getMessage());
        }
        
        Double reachFactor=null;
        if (parts.length==3)
        {
            try
            {
                reachFactor=Double.valueOf(parts[2]);
            }
            catch (NumberFormatException ex)
            {
                throw new InvalidRuleException("Invalid reach factor in rule '"+rule+"': "+parts[2]);
            }
        }
        
        return new CalendarRetentionRule(interval, duration, timeZone, reachFactor);
    }
    
    public static List<RetentionRule> parseAll(String[] rules, DateTimeZone timeZone)
    {
        List<RetentionRule> result=new ArrayList<>();
        if (rules!=null) for (String rule: rules)
        {
            result.add(parse(rule, timeZone));
        }
        return result;
    }
}
