package org.github.dateretention.keep;

/**
 * A retention rule that cannot be walked: non-positive interval, negative span or a negative reach factor.
 */
public class InvalidRuleException extends IllegalArgumentException
{
    private static final long serialVersionUID = 1L;

    public InvalidRuleException(String message)
    {
        super(message);
    }
}
