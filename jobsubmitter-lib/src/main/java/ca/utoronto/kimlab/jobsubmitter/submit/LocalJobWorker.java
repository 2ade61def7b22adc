package ca.utoronto.kimlab.jobsubmitter.submit;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;

import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ca.utoronto.kimlab.jobsubmitter.exceptions.JobSubmitterException;
import ca.utoronto.kimlab.jobsubmitter.i18n.MsgUtils;
import ca.utoronto.kimlab.jobsubmitter.model.JobOpts;
import ca.utoronto.kimlab.jobsubmitter.model.JobRecord;
import ca.utoronto.kimlab.jobsubmitter.model.SubmitOutcome;
import ca.utoronto.kimlab.jobsubmitter.model.enumerations.SchedulerType;
import ca.utoronto.kimlab.jobsubmitter.schedulers.SchedulerCommandFormatter;
import ca.utoronto.kimlab.jobsubmitter.schedulers.SchedulerFormatterFactory;

/** Runs jobs as child processes of this JVM.  Each job runs under the login
 * shell in the working directory with stdout and stderr redirected to its log
 * files.  When the process ends the worker plays the wrapper's part and 
 * appends DONE! or ERROR! to the error log.
 */
public final class LocalJobWorker 
 implements JobWorker
{
    /* ********************************************************************** */
    /*                               Constants                                */
    /* ********************************************************************** */
    // Tracing.
    private static final Logger _log = LoggerFactory.getLogger(LocalJobWorker.class);
    
    // Sentinels appended to the error log.
    public static final String DONE_SENTINEL  = "DONE!";
    public static final String ERROR_SENTINEL = "ERROR!";
    
    /* ********************************************************************** */
    /*                                 Fields                                 */
    /* ********************************************************************** */
    private final JobOpts _opts;
    private final Path    _workingDir;
    private final Path    _logDir;
    private final SchedulerCommandFormatter _formatter;

    /* ********************************************************************** */
    /*                              Constructors                              */
    /* ********************************************************************** */
    public LocalJobWorker(JobOpts opts)
    {
        _opts = opts;
        _workingDir = Paths.get(opts.getWorkingDir() == null ? "." : opts.getWorkingDir()).toAbsolutePath();
        _logDir = _workingDir.resolve(opts.getJobId());
        _formatter = SchedulerFormatterFactory.getInstance(SchedulerType.LOCAL);
    }

    /* ********************************************************************** */
    /*                             Public Methods                             */
    /* ********************************************************************** */
    /* ---------------------------------------------------------------------- */
    /* validate:                                                              */
    /* ---------------------------------------------------------------------- */
    @Override
    public void validate(JobRecord job) throws JobSubmitterException
    {
        _formatter.formatSubmitCommand(_opts, getJobEnvironment(job));
    }

    /* ---------------------------------------------------------------------- */
    /* prepare:                                                               */
    /* ---------------------------------------------------------------------- */
    @Override
    public void prepare() throws JobSubmitterException
    {
        if (Files.isDirectory(_logDir)) 
            _log.warn(MsgUtils.getMsg("JOBSUB_LOG_DIR_EXISTS", _logDir));
        try {Files.createDirectories(_logDir);}
        catch (IOException e) {
            String msg = MsgUtils.getMsg("JOBSUB_JOB_FAILED", _opts.getJobId(), e.getMessage());
            _log.error(msg, e);
            throw new JobSubmitterException(msg, e);
        }
        if (_log.isDebugEnabled()) _log.debug(MsgUtils.getMsg("JOBSUB_LOG_DIR_CREATED", _logDir));
    }

    /* ---------------------------------------------------------------------- */
    /* run:                                                                   */
    /* ---------------------------------------------------------------------- */
    /** Run the job to completion.  A non-zero exit code is a result, not a
     * failure: it is returned and recorded as ERROR! in the error log.
     */
    @Override
    public SubmitOutcome run(JobRecord job) throws JobSubmitterException
    {
        var env = getJobEnvironment(job);
        File outFile = new File(env.get(SchedulerCommandFormatter.STDOUT_LOG));
        File errFile = new File(env.get(SchedulerCommandFormatter.STDERR_LOG));
        
        var pb = new ProcessBuilder(_opts.getShell(), "-c", job.getSystemCommand());
        pb.directory(_workingDir.toFile());
        pb.environment().putAll(env);
        pb.redirectOutput(ProcessBuilder.Redirect.to(outFile));
        pb.redirectError(ProcessBuilder.Redirect.to(errFile));
        
        int exitCode;
        try {
            var process = pb.start();
            exitCode = process.waitFor();
        }
        catch (IOException e) {
            String msg = MsgUtils.getMsg("JOBSUB_JOB_FAILED", job.getIndex(), e.getMessage());
            _log.error(msg, e);
            throw new JobSubmitterException(msg, e);
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            String msg = MsgUtils.getMsg("JOBSUB_INTERRUPTED", "waiting for local job " + job.getIndex());
            _log.warn(msg);
            throw new JobSubmitterException(msg, e);
        }
        
        // Mark completion the way the wrapper script does.
        var sentinel = exitCode == 0 ? DONE_SENTINEL : ERROR_SENTINEL;
        try {FileUtils.writeStringToFile(errFile, sentinel + "\n", StandardCharsets.UTF_8, true);}
        catch (IOException e) {
            String msg = MsgUtils.getMsg("JOBSUB_JOB_FAILED", job.getIndex(), e.getMessage());
            _log.error(msg, e);
            throw new JobSubmitterException(msg, e);
        }
        
        if (_log.isDebugEnabled()) 
            _log.debug(MsgUtils.getMsg("JOBSUB_LOCAL_JOB_FINISHED", job.getIndex(), exitCode));
        return SubmitOutcome.local(job.getIndex(), exitCode);
    }
    
    @Override
    public String getTargetName() {return SchedulerType.LOCAL.getScheme();}
    
    public Path getLogDir() {return _logDir;}

    /* ********************************************************************** */
    /*                            Private Methods                             */
    /* ********************************************************************** */
    /* ---------------------------------------------------------------------- */
    /* getJobEnvironment:                                                     */
    /* ---------------------------------------------------------------------- */
    /** The batch environment plus the three wrapper variables. */
    private Map<String,String> getJobEnvironment(JobRecord job)
    {
        var env = new LinkedHashMap<String,String>(_opts.getEnv());
        if (job.getSystemCommand() != null) 
            env.put(SchedulerCommandFormatter.SYSTEM_COMMAND, job.getSystemCommand());
        env.put(SchedulerCommandFormatter.STDOUT_LOG, _logDir.resolve(job.getIndex() + ".out").toString());
        env.put(SchedulerCommandFormatter.STDERR_LOG, _logDir.resolve(job.getIndex() + ".err").toString());
        return env;
    }
}
