package ca.utoronto.kimlab.jobsubmitter;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.OptionalInt;
import java.util.function.Predicate;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ca.utoronto.kimlab.jobsubmitter.channels.RemoteChannel;
import ca.utoronto.kimlab.jobsubmitter.channels.SshRemoteChannel;
import ca.utoronto.kimlab.jobsubmitter.config.RuntimeParameters;
import ca.utoronto.kimlab.jobsubmitter.exceptions.ConfigurationException;
import ca.utoronto.kimlab.jobsubmitter.exceptions.JobSubmitterException;
import ca.utoronto.kimlab.jobsubmitter.exceptions.RemoteExecutionException;
import ca.utoronto.kimlab.jobsubmitter.i18n.MsgUtils;
import ca.utoronto.kimlab.jobsubmitter.model.ClusterTarget;
import ca.utoronto.kimlab.jobsubmitter.model.JobOpts;
import ca.utoronto.kimlab.jobsubmitter.model.JobRecord;
import ca.utoronto.kimlab.jobsubmitter.model.JobResult;
import ca.utoronto.kimlab.jobsubmitter.schedulers.SchedulerFormatterFactory;
import ca.utoronto.kimlab.jobsubmitter.status.JobStatusReader;
import ca.utoronto.kimlab.jobsubmitter.submit.JobSubmission;
import ca.utoronto.kimlab.jobsubmitter.submit.JobWorker;
import ca.utoronto.kimlab.jobsubmitter.submit.LocalJobWorker;
import ca.utoronto.kimlab.jobsubmitter.submit.QueueDepthProbe;
import ca.utoronto.kimlab.jobsubmitter.submit.RemoteJobWorker;
import ca.utoronto.kimlab.jobsubmitter.submit.SubmissionOrchestrator;
import ca.utoronto.kimlab.jobsubmitter.submit.ThrottlePolicy;
import ca.utoronto.kimlab.jobsubmitter.utils.Sleeper;

/** Entry point for submitting job tables and reading back their status.
 * 
 * A JobSubmitter is bound to one cluster target and owns the channel to its
 * head node.  Use it in a try-with-resources block so the channel is released
 * on every exit path:
 * 
 * <pre>
 *   try (var js = new JobSubmitter(ClusterTarget.parse("pbs://user@head").build())) {
 *       var submissions = js.submit(jobs, opts);
 *       ...
 *       var results = js.jobStatus(jobs, opts);
 *   }
 * </pre>
 * 
 * Remote home and scratch expressions that start with $ are resolved on the
 * head node once per session.  When remote paths are configured the batch
 * runs under the remote scratch directory at the same position the local 
 * working directory has relative to the local home.  For local targets no
 * channel is ever opened.
 */
public final class JobSubmitter 
 implements AutoCloseable
{
    /* ********************************************************************** */
    /*                               Constants                                */
    /* ********************************************************************** */
    // Tracing.
    private static final Logger _log = LoggerFactory.getLogger(JobSubmitter.class);
    
    // Name of the wrapper script looked up on the head node PATH.
    public static final String WRAPPER_SCRIPT_NAME = "jobwrapper.sh";
    
    // PATH used to find the wrapper when the options don't set one.
    public static final String DEFAULT_WRAPPER_PATH = "$HOME/anaconda/bin:$PATH";
    
    // Queue introspection.
    private static final String NUM_SUBMITTED_CMD = "qstat -u \"$USER\" | grep \"$USER\" | wc -l";
    private static final String NUM_RUNNING_CMD   = 
        "qstat -u \"$USER\" | grep \"$USER\" | grep -i \" r  \" | wc -l";
    
    /* ********************************************************************** */
    /*                                 Fields                                 */
    /* ********************************************************************** */
    private final ClusterTarget   _target;
    private final RemoteChannel   _channel;
    private final Sleeper         _sleeper;
    private final int             _pollMaxAttempts;
    private final JobStatusReader _statusReader = new JobStatusReader();
    
    // Resolved once per session.
    private String _remoteHome;
    private String _remoteScratch;
    private String _wrapperScript;

    /* ********************************************************************** */
    /*                              Constructors                              */
    /* ********************************************************************** */
    /* ---------------------------------------------------------------------- */
    /* constructor:                                                           */
    /* ---------------------------------------------------------------------- */
    public JobSubmitter(ClusterTarget target)
    {
        this(target, target.getSchedulerType().isRemote() ? new SshRemoteChannel(target) : null);
    }
    
    /* ---------------------------------------------------------------------- */
    /* constructor:                                                           */
    /* ---------------------------------------------------------------------- */
    public JobSubmitter(ClusterTarget target, RemoteChannel channel)
    {
        this(target, channel, Sleeper.THREAD);
    }
    
    /* ---------------------------------------------------------------------- */
    /* constructor:                                                           */
    /* ---------------------------------------------------------------------- */
    /** 
     * @param target where jobs run
     * @param channel the head node channel, ignored for local targets
     * @param sleeper used for polling, throttling and dispatch delays
     */
    public JobSubmitter(ClusterTarget target, RemoteChannel channel, Sleeper sleeper)
    {
        if (target == null) throw new IllegalArgumentException("target must not be null");
        if (target.getSchedulerType().isRemote() && channel == null) 
            throw new IllegalArgumentException("a remote target requires a channel");
        _target = target;
        _channel = target.getSchedulerType().isRemote() ? channel : null;
        _sleeper = sleeper;
        _pollMaxAttempts = RuntimeParameters.getInstance().getPollMaxAttempts();
    }

    /* ********************************************************************** */
    /*                             Public Methods                             */
    /* ********************************************************************** */
    /* ---------------------------------------------------------------------- */
    /* connect:                                                               */
    /* ---------------------------------------------------------------------- */
    /** Open the head node session and resolve the remote paths.  Does nothing
     * for local targets or when already connected.
     */
    public synchronized void connect() throws JobSubmitterException
    {
        if (_channel == null) return;
        _channel.connect();
        if (_target.usesRemotePaths() && _remoteHome == null) {
            _remoteHome    = resolveRemotePath(_target.getRemoteHome());
            _remoteScratch = resolveRemotePath(_target.getRemoteScratch());
        }
    }
    
    /* ---------------------------------------------------------------------- */
    /* close:                                                                 */
    /* ---------------------------------------------------------------------- */
    /** Release the head node session.  The next call that needs it reconnects
     * and resolves the session values again.
     */
    @Override
    public synchronized void close()
    {
        if (_channel != null) _channel.close();
        _remoteHome = null;
        _remoteScratch = null;
        _wrapperScript = null;
    }
    
    /* ---------------------------------------------------------------------- */
    /* submit:                                                                */
    /* ---------------------------------------------------------------------- */
    /** Submit (remote) or start (local) every job of the table.
     * 
     * Each job's stdout and stderr end up in 
     * {@code <working dir>/<job id>/<index>.out} and {@code .err}.  The call 
     * returns once every job is dispatched; invalid jobs and jobs that fail to
     * dispatch report their error through their own future.
     * 
     * @param jobs the job table, indices must be unique
     * @param opts options shared by all jobs
     * @return one submission per job in table order
     * @throws JobSubmitterException if the batch as a whole cannot be dispatched
     */
    public List<JobSubmission> submit(List<JobRecord> jobs, JobOpts opts) 
     throws JobSubmitterException
    {
        JobWorker worker;
        QueueDepthProbe probe = null;
        int ceiling = 0;
        if (_channel == null) worker = new LocalJobWorker(opts);
        else {
            // Head node commands see the job environment, PATH included.
            _channel.setEnvironment(opts.getEnv());
            connect();
            var effectiveOpts = getEffectiveOptions(opts);
            worker = new RemoteJobWorker(effectiveOpts, _channel, 
                         SchedulerFormatterFactory.getInstance(_target.getSchedulerType()));
            probe = () -> countJobs(NUM_SUBMITTED_CMD);
            ceiling = _target.getConcurrentJobLimit();
        }
        
        var parms = RuntimeParameters.getInstance();
        var orchestrator = new SubmissionOrchestrator(worker, ThrottlePolicy.fromRuntimeParameters(ceiling),
                                                      probe, parms.getPoolSize(), _sleeper);
        return orchestrator.submit(jobs);
    }
    
    /* ---------------------------------------------------------------------- */
    /* jobStatus:                                                             */
    /* ---------------------------------------------------------------------- */
    /** Read the status of every job from the local view of the log directory,
     * {@code <opts working dir>/<job id>}.  Remote batches are read through a
     * shared filesystem or after the logs have been copied back.
     */
    public List<JobResult> jobStatus(List<JobRecord> jobs, JobOpts opts)
    {
        return _statusReader.readStatus(getLocalLogDir(opts), jobs);
    }
    
    /* ---------------------------------------------------------------------- */
    /* numSubmittedJobs:                                                      */
    /* ---------------------------------------------------------------------- */
    /** The number of the user's jobs in the scheduler queue, empty for local targets. */
    public OptionalInt numSubmittedJobs() throws JobSubmitterException
    {
        if (_channel == null) return OptionalInt.empty();
        connect();
        return OptionalInt.of(countJobs(NUM_SUBMITTED_CMD));
    }
    
    /* ---------------------------------------------------------------------- */
    /* numRunningJobs:                                                        */
    /* ---------------------------------------------------------------------- */
    /** The number of the user's jobs currently running, empty for local targets. */
    public OptionalInt numRunningJobs() throws JobSubmitterException
    {
        if (_channel == null) return OptionalInt.empty();
        connect();
        return OptionalInt.of(countJobs(NUM_RUNNING_CMD));
    }
    
    /* ---------------------------------------------------------------------- */
    /* execPolled:                                                            */
    /* ---------------------------------------------------------------------- */
    /** Run a head node query until it produces usable output.  Attempt n that
     * fails on stderr output or returns output rejected by the validator is
     * followed by an n second pause.  Connectivity failures are not retried
     * here since the channel has already retried them.
     * 
     * @param command the query
     * @param validator accepts usable output
     * @return the first usable output
     * @throws RemoteExecutionException if no attempt produced usable output
     * @throws JobSubmitterException on any other failure
     */
    public String execPolled(String command, Predicate<String> validator) 
     throws JobSubmitterException
    {
        if (_channel == null) throw new IllegalStateException("local targets have no head node");
        
        String lastStderr = "";
        String reason = "";
        for (int attempt = 1; attempt <= _pollMaxAttempts; attempt++) 
        {
            try {
                var output = _channel.execute(command);
                if (validator.test(output)) return output;
                reason = "unexpected output [" + output + "]";
            }
            catch (RemoteExecutionException e) {
                lastStderr = e.getStderr();
                reason = e.getMessage();
            }
            
            if (attempt < _pollMaxAttempts) {
                _log.warn(MsgUtils.getMsg("JOBSUB_POLL_RETRY", attempt, _pollMaxAttempts, command, 
                                          attempt, reason));
                try {_sleeper.sleep(attempt * 1000L);}
                catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    String msg = MsgUtils.getMsg("JOBSUB_INTERRUPTED", "polling [" + command + "]");
                    _log.warn(msg);
                    throw new JobSubmitterException(msg, e);
                }
            }
        }
        
        String msg = MsgUtils.getMsg("JOBSUB_POLL_EXHAUSTED", _pollMaxAttempts, command, reason);
        _log.error(msg);
        throw new RemoteExecutionException(msg, lastStderr);
    }
    
    /* ---------------------------------------------------------------------- */
    /* getEffectiveOptions:                                                   */
    /* ---------------------------------------------------------------------- */
    /** The caller's options with the remote working directory and the wrapper
     * script filled in.  The caller's instance is not modified.
     */
    public JobOpts getEffectiveOptions(JobOpts opts) throws JobSubmitterException
    {
        connect();
        var builder = opts.toBuilder();
        if (_target.usesRemotePaths()) {
            var workingDir = getRemoteWorkingDir(opts.getWorkingDir());
            builder.workingDir(workingDir);
            _log.info(MsgUtils.getMsg("JOBSUB_REMOTE_PATHS", _remoteHome, _remoteScratch, workingDir));
        }
        if (opts.getWrapperScript() == null) builder.wrapperScript(getWrapperScript(opts));
        return builder.build();
    }

    /* ********************************************************************** */
    /*                            Private Methods                             */
    /* ********************************************************************** */
    /* ---------------------------------------------------------------------- */
    /* resolveRemotePath:                                                     */
    /* ---------------------------------------------------------------------- */
    private String resolveRemotePath(String expr) throws JobSubmitterException
    {
        if (expr == null || !expr.startsWith("$")) return expr;
        var path = execPolled("echo \"" + expr + "\"", StringUtils::isNotBlank);
        if (StringUtils.isBlank(path)) {
            String msg = MsgUtils.getMsg("JOBSUB_REMOTE_PATH_UNRESOLVED", expr, _channel.getDisplayName());
            throw new ConfigurationException(msg);
        }
        return path;
    }
    
    /* ---------------------------------------------------------------------- */
    /* getRemoteWorkingDir:                                                   */
    /* ---------------------------------------------------------------------- */
    /** Map the local working directory under the remote scratch directory. */
    private String getRemoteWorkingDir(String localWorkingDir)
    {
        var localHome = Paths.get(System.getProperty("user.home")).toAbsolutePath().normalize();
        var local = Paths.get(localWorkingDir == null ? "." : localWorkingDir).toAbsolutePath().normalize();
        var relpath = localHome.relativize(local).toString().replace('\\', '/');
        
        var scratch = StringUtils.removeEnd(_remoteScratch, "/");
        return relpath.isEmpty() ? scratch : scratch + "/" + relpath;
    }
    
    /* ---------------------------------------------------------------------- */
    /* getWrapperScript:                                                      */
    /* ---------------------------------------------------------------------- */
    private synchronized String getWrapperScript(JobOpts opts) throws JobSubmitterException
    {
        if (_wrapperScript != null) return _wrapperScript;
        
        var path = opts.getEnv().getOrDefault("PATH", DEFAULT_WRAPPER_PATH);
        var cmd = "export PATH=\"" + path + "\"; which " + WRAPPER_SCRIPT_NAME;
        _wrapperScript = execPolled(cmd, StringUtils::isNotBlank);
        _log.info(MsgUtils.getMsg("JOBSUB_WRAPPER_RESOLVED", _wrapperScript, _channel.getDisplayName()));
        return _wrapperScript;
    }
    
    /* ---------------------------------------------------------------------- */
    /* countJobs:                                                             */
    /* ---------------------------------------------------------------------- */
    private int countJobs(String command) throws JobSubmitterException
    {
        var output = execPolled(command, JobSubmitter::isCount);
        return Integer.parseInt(output.trim());
    }
    
    private static boolean isCount(String output)
    {
        return output != null && !output.isBlank() && StringUtils.isNumeric(output.trim());
    }
    
    /* ---------------------------------------------------------------------- */
    /* getLocalLogDir:                                                        */
    /* ---------------------------------------------------------------------- */
    private static Path getLocalLogDir(JobOpts opts)
    {
        var workingDir = opts.getWorkingDir() == null ? "." : opts.getWorkingDir();
        return Paths.get(workingDir).toAbsolutePath().resolve(opts.getJobId());
    }

    /* ********************************************************************** */
    /*                               Accessors                                */
    /* ********************************************************************** */
    public ClusterTarget getTarget() {return _target;}
    public RemoteChannel getChannel() {return _channel;}
    
    // Null until resolved by connect().
    public synchronized String getRemoteHome() {return _remoteHome;}
    public synchronized String getRemoteScratch() {return _remoteScratch;}
}
