package org.github.dateretention.logging;

import java.util.Map;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.sift.Discriminator;

/**
 * Lets a SiftingAppender write one log per retention policy. The policy name is taken from the MDC key
 * {@value #KEY}; events logged outside of a policy run go to {@value #DEFAULT_VALUE}.
 */
public class PolicyNameDiscriminator implements Discriminator<ILoggingEvent>
{
    public static final String KEY = "policy";
    public static final String DEFAULT_VALUE = "global";
    private boolean started;

    @Override
    public String getDiscriminatingValue(ILoggingEvent iLoggingEvent)
    {
        Map<String, String> mdc = iLoggingEvent.getMDCPropertyMap();
        String value = (mdc == null) ? null : mdc.get(KEY);
        return (value == null || value.isEmpty()) ? DEFAULT_VALUE : value;
    }

    @Override
    public String getKey()
    {
        return KEY;
    }

    public void start()
    {
        started = true;
    }

    public void stop()
    {
        started = false;
    }

    public boolean isStarted()
    {
        return started;
    }
}
