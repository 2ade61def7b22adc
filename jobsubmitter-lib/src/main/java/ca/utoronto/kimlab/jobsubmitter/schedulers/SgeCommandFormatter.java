package ca.utoronto.kimlab.jobsubmitter.schedulers;

import java.util.List;
import java.util.Map;

import org.apache.commons.lang3.StringUtils;

import ca.utoronto.kimlab.jobsubmitter.exceptions.InvalidCommandException;
import ca.utoronto.kimlab.jobsubmitter.model.JobOpts;
import ca.utoronto.kimlab.jobsubmitter.model.enumerations.SchedulerType;

/** Sun Grid Engine qsub.  Each variable is passed with its own -v flag, but
 * qsub still splits -v values on commas so commands with commas are rejected.
 */
public final class SgeCommandFormatter 
 extends AbstractCommandFormatter
{
    @Override
    public SchedulerType getSchedulerType() {return SchedulerType.SGE;}

    @Override
    protected void validate(JobOpts opts, Map<String,String> env) 
     throws InvalidCommandException
    {
        super.validate(opts, env);
        rejectComma(opts, env);
    }

    /* ---------------------------------------------------------------------- */
    /* appendClauses:                                                         */
    /* ---------------------------------------------------------------------- */
    @Override
    protected void appendClauses(List<String> args, JobOpts opts, Map<String,String> env)
    {
        args.add("qsub");
        args.add("-S " + opts.getShell());
        args.add("-N " + opts.getJobId());
        args.add("-o " + DEV_NULL + " -e " + DEV_NULL);
        args.add(clause("-wd ", opts.getWorkingDir()));
        args.add("-pe smp " + opts.getNproc());
        args.add("-l h_rt=" + opts.getWalltime());
        args.add(clause("-l mem_free=", opts.getMem()));
        args.add(clause("-l h_vmem=", opts.getVmem()));
        if (opts.hasGpus()) args.add("-l gpu=" + opts.getGpus());
        
        // SGE takes the concurrency limit as a separate flag.
        var array = opts.getArrayJobs();
        if (array != null) {
            int pct = array.indexOf('%');
            if (pct < 0) args.add("-t " + array);
            else {
                args.add(clause("-t ", array.substring(0, pct)));
                args.add(clause("-tc ", array.substring(pct + 1)));
            }
        }
        
        args.add(clause("-q ", opts.getQueue()));
        if (opts.getEmail() != null) args.add("-M " + opts.getEmail() + " -ma");
        
        for (var entry : env.entrySet())
            args.add("-v " + entry.getKey() + "=" + quote(entry.getValue()));
        
        args.add(quote(opts.getWrapperScript()));
    }
}
