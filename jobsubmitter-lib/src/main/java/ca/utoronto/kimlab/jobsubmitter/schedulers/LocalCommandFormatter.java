package ca.utoronto.kimlab.jobsubmitter.schedulers;

import java.util.List;
import java.util.Map;

import org.apache.commons.lang3.StringUtils;

import ca.utoronto.kimlab.jobsubmitter.exceptions.InvalidCommandException;
import ca.utoronto.kimlab.jobsubmitter.i18n.MsgUtils;
import ca.utoronto.kimlab.jobsubmitter.model.JobOpts;
import ca.utoronto.kimlab.jobsubmitter.model.enumerations.SchedulerType;

/** Local runs have no scheduler: the command line is the system command 
 * itself, executed by the local worker under the login shell.
 */
public final class LocalCommandFormatter 
 extends AbstractCommandFormatter
{
    @Override
    public SchedulerType getSchedulerType() {return SchedulerType.LOCAL;}

    // No wrapper script is involved.
    @Override
    protected void validate(JobOpts opts, Map<String,String> env) 
     throws InvalidCommandException
    {
        if (StringUtils.isBlank(env.get(SYSTEM_COMMAND))) {
            String msg = MsgUtils.getMsg("JOBSUB_MISSING_SYSTEM_COMMAND", opts.getJobId());
            throw new InvalidCommandException(msg);
        }
    }

    @Override
    protected void appendClauses(List<String> args, JobOpts opts, Map<String,String> env)
    {
        args.add(env.get(SYSTEM_COMMAND));
    }
}
