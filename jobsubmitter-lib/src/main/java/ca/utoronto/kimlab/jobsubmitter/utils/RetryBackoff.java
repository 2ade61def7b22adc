package ca.utoronto.kimlab.jobsubmitter.utils;

/** Exponential backoff without jitter: attempt n waits base * 2^(n-1)
 * milliseconds, never more than max.  With the defaults the waits are 1, 2,
 * 4, 8, 16, 32 and then 60 seconds.
 */
public final class RetryBackoff 
{
    private final long _baseMillis;
    private final long _maxMillis;
    
    /* ---------------------------------------------------------------------- */
    /* constructor:                                                           */
    /* ---------------------------------------------------------------------- */
    public RetryBackoff(long baseMillis, long maxMillis)
    {
        if (baseMillis < 0) 
            throw new IllegalArgumentException("baseMillis must not be negative (current: " + baseMillis + ")");
        if (maxMillis < baseMillis)
            throw new IllegalArgumentException("maxMillis must be >= baseMillis (base: " + 
                                               baseMillis + ", max: " + maxMillis + ")");
        _baseMillis = baseMillis;
        _maxMillis  = maxMillis;
    }
    
    /* ---------------------------------------------------------------------- */
    /* delayMillis:                                                           */
    /* ---------------------------------------------------------------------- */
    /** The wait after the given failed attempt (1-based). */
    public long delayMillis(int attempt)
    {
        if (attempt <= 0) 
            throw new IllegalArgumentException("attempt must be positive (current: " + attempt + ")");
        
        // Stop shifting before the long overflows.
        if (attempt > 31) return _maxMillis;
        return Math.min(_baseMillis * (1L << (attempt - 1)), _maxMillis);
    }
    
    public long getBaseMillis() {return _baseMillis;}
    public long getMaxMillis() {return _maxMillis;}
}
