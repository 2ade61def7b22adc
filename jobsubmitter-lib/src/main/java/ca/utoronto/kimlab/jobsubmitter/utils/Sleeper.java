package ca.utoronto.kimlab.jobsubmitter.utils;

/** Pause the calling thread.  Retry loops and the throttle take a Sleeper so
 * tests can record waits instead of performing them.
 */
@FunctionalInterface
public interface Sleeper 
{
    Sleeper THREAD = Thread::sleep;
    
    void sleep(long millis) throws InterruptedException;
}
