package org.github.dateretention.policy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.github.dateretention.date.FlexibleInstantCoercer;
import org.github.dateretention.date.ReferenceDates;
import org.github.dateretention.date.RuleParser;
import org.github.dateretention.keep.RetentionEngine;
import org.github.dateretention.keep.RetentionRule;
import org.github.dateretention.keep.RetentionSettings;
import org.joda.time.DateTimeZone;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A retention schedule such as "one every 6 hours for 3 months, one per day for 6 months, one per week for
 * 9 months", applied to a list of snapshot timestamps.
 *
 * <pre>
 * RetentionPolicy policy=new RetentionPolicy("6h/3m", "1d/6m", "7d/9m");
 * List&lt;String&gt; pruned=policy.prune(snapshotDates);
 * </pre>
 *
 * The timestamps may be any mix of representations {@link FlexibleInstantCoercer} accepts. The caller's
 * objects are passed through unchanged.
 */
public class RetentionPolicy
{
    protected Logger LOG=LoggerFactory.getLogger(getClass());

    protected final List<RetentionRule> rules;
    protected final DateTimeZone timeZone;
    protected RetentionSettings settings=RetentionSettings.DEFAULTS;
    protected Object referenceDate;
    protected String[] timestampPatterns=new String[0];

    public RetentionPolicy(String... rules)
    {
        this(DateTimeZone.UTC, rules);
    }

    public RetentionPolicy(DateTimeZone timeZone, String... rules)
    {
        this.timeZone=checkTimeZone(timeZone);
        this.rules=RuleParser.parseAll(rules, timeZone);
    }

    public RetentionPolicy(List<? extends RetentionRule> rules)
    {
        this(DateTimeZone.UTC, rules);
    }

    public RetentionPolicy(DateTimeZone timeZone, List<? extends RetentionRule> rules)
    {
        if (rules==null) throw new IllegalArgumentException("Missing rules");
        this.timeZone=checkTimeZone(timeZone);
        this.rules=new ArrayList<RetentionRule>(rules);
    }

    protected static DateTimeZone checkTimeZone(DateTimeZone timeZone)
    {
        if (timeZone==null) throw new IllegalArgumentException("Missing time zone");
        return timeZone;
    }

    public List<RetentionRule> getRules()
    {
        return Collections.unmodifiableList(rules);
    }

    /**
     * Zone used for text and local dates without an offset, for the default reference date and for the
     * calendar steps of rules parsed from strings. It is fixed at construction.
     */
    public DateTimeZone getTimeZone()
    {
        return timeZone;
    }

    public double getReachFactor()
    {
        return settings.getDefaultReachFactor();
    }

    public RetentionPolicy setReachFactor(double reachFactor)
    {
        settings=settings.withDefaultReachFactor(reachFactor);
        return this;
    }

    public boolean isAutoSync()
    {
        return settings.isAutoSync();
    }

    public RetentionPolicy setAutoSync(boolean autoSync)
    {
        settings=settings.withAutoSync(autoSync);
        return this;
    }

    public Object getReferenceDate()
    {
        return referenceDate;
    }

    /**
     * @param referenceDate the instant the rules walk back from, in any accepted representation.
     *          <code>null</code> means the next day boundary after now.
     */
    public RetentionPolicy setReferenceDate(Object referenceDate)
    {
        this.referenceDate=referenceDate;
        return this;
    }

    /**
     * Additional joda date patterns for parsing text timestamps, e.g. a snapshot naming scheme.
     */
    public RetentionPolicy setTimestampPatterns(String... timestampPatterns)
    {
        this.timestampPatterns=(timestampPatterns==null)?new String[0]:timestampPatterns.clone();
        return this;
    }

    public FlexibleInstantCoercer createCoercer()
    {
        return new FlexibleInstantCoercer(timeZone, timestampPatterns);
    }

    public long getReferenceEpoch()
    {
        return ReferenceDates.resolve(referenceDate, createCoercer());
    }

    /**
     * Removes the timestamps not needed by any rule from <code>dates</code> and returns them.
     *
     * @param dates modifiable list, reduced to the kept timestamps in their original order
     * @return the timestamps to prune, in their original order
     */
    public <T> List<T> prune(List<T> dates)
    {
        FlexibleInstantCoercer coercer=createCoercer();
        long reference=ReferenceDates.resolve(referenceDate, coercer);

        LOG.debug("Pruning {} timestamps with {} rules, reference {} ({})",dates.size(),rules.size(),reference,settings);

        List<T> pruned=new RetentionEngine(rules, settings).partition(dates, coercer, reference);

        LOG.info("Keeping {} timestamps, pruning {}",dates.size(),pruned.size());
        return pruned;
    }
}
