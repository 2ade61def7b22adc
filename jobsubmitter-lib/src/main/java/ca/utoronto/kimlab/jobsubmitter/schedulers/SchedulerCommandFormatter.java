package ca.utoronto.kimlab.jobsubmitter.schedulers;

import java.util.Map;

import ca.utoronto.kimlab.jobsubmitter.exceptions.InvalidCommandException;
import ca.utoronto.kimlab.jobsubmitter.model.JobOpts;
import ca.utoronto.kimlab.jobsubmitter.model.enumerations.SchedulerType;

/** Turns a batch's options and one job's environment overlay into a single
 * line understood by a scheduler's submission CLI.
 */
public interface SchedulerCommandFormatter
{
    // Variables that carry a job to the wrapper script.
    String SYSTEM_COMMAND = "SYSTEM_COMMAND";
    String STDOUT_LOG     = "STDOUT_LOG";
    String STDERR_LOG     = "STDERR_LOG";
    
    SchedulerType getSchedulerType();

    /** Format the submission command for one job.  The overlay normally holds
     * SYSTEM_COMMAND, STDOUT_LOG and STDERR_LOG and takes precedence over the
     * environment in opts.
     * 
     * @param opts the batch options
     * @param overlay per job variables
     * @return a single line command
     * @throws InvalidCommandException if the job cannot be expressed for this scheduler
     */
    String formatSubmitCommand(JobOpts opts, Map<String,String> overlay) 
     throws InvalidCommandException;
}
