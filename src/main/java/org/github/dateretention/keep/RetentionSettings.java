package org.github.dateretention.keep;

/**
 * Engine configuration. Immutable, so one instance can be shared by concurrent prune calls.
 */
public class RetentionSettings
{
    public static final double DEFAULT_REACH_FACTOR=0.5;
    
    public static final RetentionSettings DEFAULTS=new RetentionSettings(DEFAULT_REACH_FACTOR, false);
    
    protected final double defaultReachFactor;
    protected final boolean autoSync;
    
    public RetentionSettings(double defaultReachFactor, boolean autoSync)
    {
        RetentionRule.validateReachFactor(defaultReachFactor);
        this.defaultReachFactor=defaultReachFactor;
        this.autoSync=autoSync;
    }
    
    /**
     * Reach factor for rules that do not set their own. The search radius around each goal is half the
     * window length times this factor.
     */
    public double getDefaultReachFactor()
    {
        return defaultReachFactor;
    }
    
    /**
     * If enabled, each match pulls the following goals toward the observed snapshot cadence.
     */
    public boolean isAutoSync()
    {
        return autoSync;
    }
    
    public RetentionSettings withDefaultReachFactor(double reachFactor)
    {
        return new RetentionSettings(reachFactor, autoSync);
    }
    
    public RetentionSettings withAutoSync(boolean enabled)
    {
        return new RetentionSettings(defaultReachFactor, enabled);
    }
    
    @Override
    public String toString()
    {
        return "reachFactor="+defaultReachFactor+", autoSync="+autoSync;
    }
}
