package ca.utoronto.kimlab.jobsubmitter.schedulers;

import java.util.List;
import java.util.Map;

import ca.utoronto.kimlab.jobsubmitter.exceptions.InvalidCommandException;
import ca.utoronto.kimlab.jobsubmitter.model.JobOpts;
import ca.utoronto.kimlab.jobsubmitter.model.enumerations.SchedulerType;

/** PBS/Torque qsub.  The environment travels in a single comma separated -v
 * argument, so commands containing commas are rejected.
 */
public final class PbsCommandFormatter 
 extends AbstractCommandFormatter
{
    @Override
    public SchedulerType getSchedulerType() {return SchedulerType.PBS;}

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
        args.add(clause("-d ", opts.getWorkingDir()));
        args.add("-l " + getResourceList(opts));
        args.add(clause("-t ", opts.getArrayJobs()));
        args.add(clause("-A ", opts.getAccount()));
        args.add(clause("-q ", opts.getQueue()));
        if (opts.getEmail() != null) args.add("-M " + opts.getEmail() + " -ma");
        if (!env.isEmpty()) args.add("-v " + joinEnv(env, ","));
        args.add(quote(opts.getWrapperScript()));
    }
    
    /* ---------------------------------------------------------------------- */
    /* getResourceList:                                                       */
    /* ---------------------------------------------------------------------- */
    /** The -l value must not contain spaces. */
    private String getResourceList(JobOpts opts)
    {
        var buf = new StringBuilder(128);
        buf.append("nodes=1");
        if (opts.getNproc() > 0) buf.append(":ppn=").append(opts.getNproc());
        if (opts.hasGpus()) buf.append(":gpus=").append(opts.getGpus());
        buf.append(",walltime=").append(opts.getWalltime());
        if (opts.getMem() != null) buf.append(",mem=").append(opts.getMem());
        if (opts.getPmem() != null) buf.append(",pmem=").append(opts.getPmem());
        if (opts.getVmem() != null) buf.append(",vmem=").append(opts.getVmem());
        if (opts.getPvmem() != null) buf.append(",pvmem=").append(opts.getPvmem());
        return buf.toString();
    }
}
