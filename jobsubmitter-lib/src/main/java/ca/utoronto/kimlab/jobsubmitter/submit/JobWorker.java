package ca.utoronto.kimlab.jobsubmitter.submit;

import ca.utoronto.kimlab.jobsubmitter.exceptions.JobSubmitterException;
import ca.utoronto.kimlab.jobsubmitter.model.JobRecord;
import ca.utoronto.kimlab.jobsubmitter.model.SubmitOutcome;

/** Runs or submits single jobs of a batch.  The orchestrator calls validate 
 * on every job before dispatching anything, prepare once when at least one job
 * is valid, and then run for each valid job from a pool thread.
 */
public interface JobWorker
{
    /** Check that the job can be dispatched, without side effects. */
    void validate(JobRecord job) throws JobSubmitterException;
    
    /** Create the batch's log directory if it does not exist. */
    void prepare() throws JobSubmitterException;
    
    /** Dispatch one job.  Must be safe to call from several threads at once. */
    SubmitOutcome run(JobRecord job) throws JobSubmitterException;
    
    /** Where jobs go, for log messages. */
    String getTargetName();
}
