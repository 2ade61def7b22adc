package ca.utoronto.kimlab.jobsubmitter.submit;

import ca.utoronto.kimlab.jobsubmitter.config.RuntimeParameters;

/** Pacing of a submission.  Before every step-th job the live queue depth is
 * compared with the ceiling and dispatching waits while fewer than step slots
 * are free.  A ceiling of 0 turns admission control off; the delay between
 * dispatches always applies.
 */
public final class ThrottlePolicy 
{
    private final int  _step;
    private final long _sleepMillis;
    private final int  _ceiling;
    private final long _dispatchDelayMillis;
    
    /* ---------------------------------------------------------------------- */
    /* constructor:                                                           */
    /* ---------------------------------------------------------------------- */
    public ThrottlePolicy(int step, long sleepMillis, int ceiling, long dispatchDelayMillis)
    {
        if (step < 1) throw new IllegalArgumentException("step must be at least 1");
        if (ceiling < 0) throw new IllegalArgumentException("ceiling must not be negative");
        _step = step;
        _sleepMillis = sleepMillis;
        _ceiling = ceiling;
        _dispatchDelayMillis = dispatchDelayMillis;
    }
    
    /* ---------------------------------------------------------------------- */
    /* fromRuntimeParameters:                                                 */
    /* ---------------------------------------------------------------------- */
    /** The configured pacing with the given concurrent job ceiling. */
    public static ThrottlePolicy fromRuntimeParameters(int ceiling)
    {
        var parms = RuntimeParameters.getInstance();
        return new ThrottlePolicy(parms.getThrottleStep(), parms.getThrottleSleepMillis(), 
                                  ceiling, parms.getDispatchDelayMillis());
    }
    
    /** True when the job at this 1-based table position must wait for headroom. */
    public boolean isCheckpoint(int position) 
    {
        return isAdmissionControlled() && position % _step == 0;
    }
    
    /** True when the queue would overflow the ceiling if step more jobs were added. */
    public boolean mustWait(int submitted) {return submitted + _step > _ceiling;}
    
    public boolean isAdmissionControlled() {return _ceiling > 0;}
    
    public int getStep() {return _step;}
    public long getSleepMillis() {return _sleepMillis;}
    public int getCeiling() {return _ceiling;}
    public long getDispatchDelayMillis() {return _dispatchDelayMillis;}
}
