package org.github.dateretention.keep;

/**
 * A rule whose interval and span are fixed second counts.
 */
public class FixedRetentionRule extends RetentionRule
{
    protected final long interval;
    protected final long span;
    
    public FixedRetentionRule(long interval, long span)
    {
        this(interval, span, null);
    }
    
    public FixedRetentionRule(long interval, long span, Double reachFactor)
    {
        super(reachFactor);
        if (interval<=0) throw new InvalidRuleException("interval must be > 0: "+interval);
        if (span<0) throw new InvalidRuleException("span must be >= 0: "+span);
        if (reachFactor!=null) validateReachFactor(reachFactor.doubleValue());
        this.interval=interval;
        this.span=span;
    }
    
    public long getInterval()
    {
        return interval;
    }
    
    public long getSpan()
    {
        return span;
    }
    
    @Override
    public long stepBack(long epoch)
    {
        return epoch-interval;
    }
    
    @Override
    public long spanStart(long reference)
    {
        return reference-span;
    }
    
    @Override
    public String toString()
    {
        return "every "+interval+"s for "+span+"s"+(reachFactor==null?"":" (reach "+reachFactor+")");
    }
}
