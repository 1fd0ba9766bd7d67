package org.github.dateretention.keep;

/**
 * Maps a caller's timestamp representation to seconds since epoch. Must be pure within one prune call.
 */
public interface IInstantCoercer<T>
{
    public long toEpochSeconds(T value) throws InvalidTimestampException;
}
