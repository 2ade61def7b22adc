package ca.utoronto.kimlab.jobsubmitter.schedulers;

import java.util.List;
import java.util.Map;

import ca.utoronto.kimlab.jobsubmitter.model.JobOpts;
import ca.utoronto.kimlab.jobsubmitter.model.enumerations.SchedulerType;

/** Slurm sbatch.  Quoted values in --export may contain commas. */
public final class SlurmCommandFormatter 
 extends AbstractCommandFormatter
{
    @Override
    public SchedulerType getSchedulerType() {return SchedulerType.SLURM;}

    /* ---------------------------------------------------------------------- */
    /* appendClauses:                                                         */
    /* ---------------------------------------------------------------------- */
    @Override
    protected void appendClauses(List<String> args, JobOpts opts, Map<String,String> env)
    {
        args.add("sbatch");
        args.add("-o " + DEV_NULL + " -e " + DEV_NULL);
        args.add("--job-name=" + opts.getJobId());
        args.add(clause("--workdir=", opts.getWorkingDir()));
        args.add("--cpus-per-task=" + opts.getNproc());
        args.add("--time=" + opts.getWalltime());
        args.add(clause("--mem=", opts.getMem()));
        if (opts.hasGpus()) args.add("--gres=gpu:" + opts.getGpus());
        args.add(clause("--array=", opts.getArrayJobs()));
        args.add(clause("--account=", opts.getAccount()));
        args.add(clause("--partition=", opts.getQueue()));
        if (opts.getEmail() != null) 
            args.add("--mail-user=" + opts.getEmail() + " --mail-type=FAIL");
        if (!env.isEmpty()) args.add("--export=" + joinEnv(env, ","));
        args.add(quote(opts.getWrapperScript()));
    }
}
