package ca.utoronto.kimlab.jobsubmitter.submit;

import ca.utoronto.kimlab.jobsubmitter.exceptions.JobSubmitterException;

/** Reports how many of the user's jobs the scheduler currently holds. */
@FunctionalInterface
public interface QueueDepthProbe 
{
    int submittedJobs() throws JobSubmitterException;
}
