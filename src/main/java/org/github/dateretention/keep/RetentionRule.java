package org.github.dateretention.keep;

/**
 * One tier of a retention schedule: keep one snapshot per interval, going back from the reference instant
 * over the rule's span.
 * 
 * Subclasses resolve the window boundaries. All boundaries are seconds since epoch, so the walker never
 * deals with calendars itself.
 */
public abstract class RetentionRule
{
    protected final Double reachFactor;
    
    protected RetentionRule(Double reachFactor)
    {
        this.reachFactor=reachFactor;
    }
    
    /**
     * @return the older edge of the window whose recent edge is <code>epoch</code>
     */
    public abstract long stepBack(long epoch);
    
    /**
     * @return the oldest instant this rule covers when walking back from <code>reference</code>
     */
    public abstract long spanStart(long reference);
    
    /**
     * @return the per-rule reach factor or <code>null</code> to use the engine default
     */
    public Double getReachFactor()
    {
        return reachFactor;
    }
    
    public double getReachFactor(double defaultReachFactor)
    {
        return reachFactor==null?defaultReachFactor:reachFactor.doubleValue();
    }
    
    /**
     * Checks the rule against the reference it will be walked from.
     * 
     * @throws InvalidRuleException if the rule would not move backward in time
     */
    public void validate(long reference) throws InvalidRuleException
    {
        if (reachFactor!=null) validateReachFactor(reachFactor.doubleValue());
        
        if (stepBack(reference)>=reference) throw new InvalidRuleException("interval must be > 0: "+this);
        if (spanStart(reference)>reference) throw new InvalidRuleException("span must be >= 0: "+this);
    }
    
    public static void validateReachFactor(double reachFactor) throws InvalidRuleException
    {
        if (Double.isNaN(reachFactor) || Double.isInfinite(reachFactor) || reachFactor<0)
        {
            throw new InvalidRuleException("reach factor must be a finite number >= 0: "+reachFactor);
        }
    }
}
