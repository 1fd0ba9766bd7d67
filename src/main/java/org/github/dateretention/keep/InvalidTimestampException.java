package org.github.dateretention.keep;

/**
 * A candidate that cannot be coerced to an instant.
 */
public class InvalidTimestampException extends IllegalArgumentException
{
    private static final long serialVersionUID = 1L;

    protected final Object value;

    public InvalidTimestampException(Object value, String message)
    {
        super(message);
        this.value=value;
    }

    public InvalidTimestampException(Object value, String message, Throwable cause)
    {
        super(message, cause);
        this.value=value;
    }

    public Object getValue()
    {
        return value;
    }
}
