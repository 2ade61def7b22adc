package ca.utoronto.kimlab.jobsubmitter.submit;

import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ca.utoronto.kimlab.jobsubmitter.channels.RemoteChannel;
import ca.utoronto.kimlab.jobsubmitter.exceptions.JobSubmitterException;
import ca.utoronto.kimlab.jobsubmitter.i18n.MsgUtils;
import ca.utoronto.kimlab.jobsubmitter.model.JobOpts;
import ca.utoronto.kimlab.jobsubmitter.model.JobRecord;
import ca.utoronto.kimlab.jobsubmitter.model.SubmitOutcome;
import ca.utoronto.kimlab.jobsubmitter.schedulers.SchedulerCommandFormatter;

/** Submits jobs to a cluster scheduler through the head node channel.  The
 * options must already carry the remote working directory and wrapper path.
 */
public final class RemoteJobWorker 
 implements JobWorker
{
    /* ********************************************************************** */
    /*                               Constants                                */
    /* ********************************************************************** */
    // Tracing.
    private static final Logger _log = LoggerFactory.getLogger(RemoteJobWorker.class);
    
    /* ********************************************************************** */
    /*                                 Fields                                 */
    /* ********************************************************************** */
    private final JobOpts                   _opts;
    private final RemoteChannel             _channel;
    private final SchedulerCommandFormatter _formatter;
    private final String                    _logDir;

    /* ********************************************************************** */
    /*                              Constructors                              */
    /* ********************************************************************** */
    public RemoteJobWorker(JobOpts opts, RemoteChannel channel, SchedulerCommandFormatter formatter)
    {
        _opts = opts;
        _channel = channel;
        _formatter = formatter;
        _logDir = getLogDir(opts);
    }

    /* ********************************************************************** */
    /*                             Public Methods                             */
    /* ********************************************************************** */
    @Override
    public void validate(JobRecord job) throws JobSubmitterException
    {
        _formatter.formatSubmitCommand(_opts, getOverlay(job));
    }

    /* ---------------------------------------------------------------------- */
    /* prepare:                                                               */
    /* ---------------------------------------------------------------------- */
    @Override
    public void prepare() throws JobSubmitterException
    {
        _channel.execute("mkdir -p \"" + _logDir + "\"");
        if (_log.isDebugEnabled()) _log.debug(MsgUtils.getMsg("JOBSUB_LOG_DIR_CREATED", _logDir));
    }

    /* ---------------------------------------------------------------------- */
    /* run:                                                                   */
    /* ---------------------------------------------------------------------- */
    @Override
    public SubmitOutcome run(JobRecord job) throws JobSubmitterException
    {
        var cmd = _formatter.formatSubmitCommand(_opts, getOverlay(job));
        var reply = _channel.execute(cmd);
        _log.info(MsgUtils.getMsg("JOBSUB_REMOTE_JOB_SUBMITTED", job.getIndex(), reply));
        return SubmitOutcome.remote(job.getIndex(), reply);
    }
    
    @Override
    public String getTargetName() {return _channel.getDisplayName();}
    
    /* ---------------------------------------------------------------------- */
    /* getLogDir:                                                             */
    /* ---------------------------------------------------------------------- */
    /** The remote directory holding the batch's log files. */
    public static String getLogDir(JobOpts opts)
    {
        var dir = opts.getWorkingDir() == null ? "." : opts.getWorkingDir();
        if (dir.endsWith("/") && dir.length() > 1) dir = dir.substring(0, dir.length() - 1);
        return dir + "/" + opts.getJobId();
    }

    /* ********************************************************************** */
    /*                            Private Methods                             */
    /* ********************************************************************** */
    private Map<String,String> getOverlay(JobRecord job)
    {
        var overlay = new LinkedHashMap<String,String>();
        if (job.getSystemCommand() != null)
            overlay.put(SchedulerCommandFormatter.SYSTEM_COMMAND, job.getSystemCommand());
        overlay.put(SchedulerCommandFormatter.STDOUT_LOG, _logDir + "/" + job.getIndex() + ".out");
        overlay.put(SchedulerCommandFormatter.STDERR_LOG, _logDir + "/" + job.getIndex() + ".err");
        return overlay;
    }
}
