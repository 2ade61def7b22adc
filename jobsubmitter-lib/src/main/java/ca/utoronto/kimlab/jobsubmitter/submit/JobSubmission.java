package ca.utoronto.kimlab.jobsubmitter.submit;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

import ca.utoronto.kimlab.jobsubmitter.model.SubmitOutcome;

/** A dispatched (or rejected) job: its index and the future that completes
 * with its outcome.  A failed job's future throws ExecutionException whose
 * cause is the JobSubmitterException that stopped it.
 */
public final class JobSubmission 
{
    private final String                 _index;
    private final Future<SubmitOutcome>  _future;
    
    public JobSubmission(String index, Future<SubmitOutcome> future)
    {
        _index = index;
        _future = future;
    }
    
    /** Block until the job has been dispatched (remote) or has finished (local). */
    public SubmitOutcome await() throws InterruptedException, ExecutionException
    {
        return _future.get();
    }
    
    public String getIndex() {return _index;}
    public Future<SubmitOutcome> getFuture() {return _future;}
}
