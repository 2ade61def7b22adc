package ca.utoronto.kimlab.jobsubmitter.channels;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ca.utoronto.kimlab.jobsubmitter.config.RuntimeParameters;
import ca.utoronto.kimlab.jobsubmitter.exceptions.ConnectivityException;
import ca.utoronto.kimlab.jobsubmitter.exceptions.JobSubmitterException;
import ca.utoronto.kimlab.jobsubmitter.exceptions.RemoteExecutionException;
import ca.utoronto.kimlab.jobsubmitter.i18n.MsgUtils;
import ca.utoronto.kimlab.jobsubmitter.utils.RetryBackoff;
import ca.utoronto.kimlab.jobsubmitter.utils.Sleeper;

/** Session management and retry discipline shared by channel implementations.
 * 
 * Connectivity failures, whether opening the session or running the command,
 * are retried with exponential backoff.  The session is shared by concurrent
 * callers, so a failed attempt drops it only when it is no longer usable and
 * is still the session that attempt ran on; the next attempt reconnects.  A 
 * command that writes to stderr fails immediately with a 
 * RemoteExecutionException, whatever its exit code.
 */
public abstract class AbstractRemoteChannel 
 implements RemoteChannel
{
    /* ********************************************************************** */
    /*                               Constants                                */
    /* ********************************************************************** */
    // Tracing.
    private static final Logger _log = LoggerFactory.getLogger(AbstractRemoteChannel.class);
    
    /* ********************************************************************** */
    /*                                 Fields                                 */
    /* ********************************************************************** */
    // Variables set on every command's channel.
    private final Map<String,String> _environment = new LinkedHashMap<>();
    
    private final int          _maxAttempts;
    private final RetryBackoff _backoff;
    private final Sleeper      _sleeper;
    
    // Bumped on every successful open, guarded by this.
    private long _generation;

    /* ********************************************************************** */
    /*                              Constructors                              */
    /* ********************************************************************** */
    /* ---------------------------------------------------------------------- */
    /* constructor:                                                           */
    /* ---------------------------------------------------------------------- */
    /** Use the retry settings from the runtime parameters. */
    protected AbstractRemoteChannel()
    {
        this(RuntimeParameters.getInstance().getRetryMaxAttempts(),
             new RetryBackoff(RuntimeParameters.getInstance().getRetryBaseMillis(),
                              RuntimeParameters.getInstance().getRetryMaxMillis()),
             Sleeper.THREAD);
    }
    
    /* ---------------------------------------------------------------------- */
    /* constructor:                                                           */
    /* ---------------------------------------------------------------------- */
    protected AbstractRemoteChannel(int maxAttempts, RetryBackoff backoff, Sleeper sleeper)
    {
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be at least 1");
        _maxAttempts = maxAttempts;
        _backoff = backoff;
        _sleeper = sleeper;
    }

    /* ********************************************************************** */
    /*                             Public Methods                             */
    /* ********************************************************************** */
    /* ---------------------------------------------------------------------- */
    /* connect:                                                               */
    /* ---------------------------------------------------------------------- */
    @Override
    public synchronized void connect() throws ConnectivityException
    {
        if (isConnected()) {
            if (_log.isDebugEnabled())
                _log.debug(MsgUtils.getMsg("JOBSUB_SSH_ALREADY_CONNECTED", getDisplayName()));
            return;
        }
        
        // Clear any half open state before trying again.
        closeSession();
        openSession();
        _generation++;
    }
    
    /* ---------------------------------------------------------------------- */
    /* disconnect:                                                            */
    /* ---------------------------------------------------------------------- */
    @Override
    public synchronized void disconnect() {closeSession();}
    
    /* ---------------------------------------------------------------------- */
    /* execute:                                                               */
    /* ---------------------------------------------------------------------- */
    @Override
    public String execute(String command) throws JobSubmitterException
    {
        ConnectivityException lastError = null;
        for (int attempt = 1; attempt <= _maxAttempts; attempt++) 
        {
            long generation = -1;
            try {
                generation = connectForAttempt();
                var result = runCommand(command, getEnvironment());
                return checkResult(command, result);
            }
            catch (ConnectivityException e) {
                lastError = e;
                
                // Have we maxed out the retries?
                if (attempt >= _maxAttempts) break;
                
                long delay = _backoff.delayMillis(attempt);
                _log.warn(MsgUtils.getMsg("JOBSUB_RETRY_CONNECTIVITY", attempt, _maxAttempts, 
                                          command, delay, e.getMessage()));
                
                dropSessionIfStale(generation);
                pause(delay, command);
            }
        }
        
        String msg = MsgUtils.getMsg("JOBSUB_RETRY_EXHAUSTED", _maxAttempts, command, 
                                     lastError == null ? "" : lastError.getMessage());
        _log.error(msg);
        throw new ConnectivityException(msg, lastError);
    }
    
    /* ---------------------------------------------------------------------- */
    /* setEnvironment:                                                        */
    /* ---------------------------------------------------------------------- */
    @Override
    public synchronized void setEnvironment(Map<String,String> env)
    {
        _environment.clear();
        if (env != null) _environment.putAll(env);
    }
    
    public synchronized Map<String,String> getEnvironment() 
    {
        return Collections.unmodifiableMap(new LinkedHashMap<>(_environment));
    }
    
    public int getMaxAttempts() {return _maxAttempts;}
    
    /** The number of sessions opened so far. */
    public synchronized long getGeneration() {return _generation;}

    /* ********************************************************************** */
    /*                           Protected Methods                            */
    /* ********************************************************************** */
    /** Establish an authenticated session.  Called with the channel locked. */
    protected abstract void openSession() throws ConnectivityException;
    
    /** Release the session if any.  Must not throw. */
    protected abstract void closeSession();
    
    /** Run one command on the open session without retrying.
     * 
     * @param command the command line
     * @param environment variables to set for the command
     * @return the raw output
     * @throws ConnectivityException on any transport failure
     */
    protected abstract RemoteCommandResult runCommand(String command, Map<String,String> environment)
     throws ConnectivityException;

    /* ********************************************************************** */
    /*                            Private Methods                             */
    /* ********************************************************************** */
    /* ---------------------------------------------------------------------- */
    /* connectForAttempt:                                                     */
    /* ---------------------------------------------------------------------- */
    /** Connect if necessary and return the generation of the session used. */
    private synchronized long connectForAttempt() throws ConnectivityException
    {
        connect();
        return _generation;
    }
    
    /* ---------------------------------------------------------------------- */
    /* dropSessionIfStale:                                                    */
    /* ---------------------------------------------------------------------- */
    /** Close the session after a failed attempt unless another caller already
     * replaced it or it is still usable.  A failure to open a command channel
     * on a healthy session leaves the other callers' commands running.
     * 
     * @param generation the session generation the attempt ran on, or -1 if
     *                   the attempt failed while connecting
     */
    private synchronized void dropSessionIfStale(long generation)
    {
        if (generation >= 0 && generation != _generation) {
            if (_log.isDebugEnabled())
                _log.debug(MsgUtils.getMsg("JOBSUB_SSH_SESSION_REPLACED", getDisplayName(), 
                                           generation, _generation));
            return;
        }
        if (isConnected()) {
            if (_log.isDebugEnabled())
                _log.debug(MsgUtils.getMsg("JOBSUB_SSH_SESSION_KEPT", getDisplayName()));
            return;
        }
        closeSession();
    }
    
    /* ---------------------------------------------------------------------- */
    /* checkResult:                                                           */
    /* ---------------------------------------------------------------------- */
    private String checkResult(String command, RemoteCommandResult result) 
     throws RemoteExecutionException
    {
        // Head node CLIs can exit 0 and still report an error on stderr.
        if (StringUtils.isNotEmpty(result.getStderr())) {
            String msg = MsgUtils.getMsg("JOBSUB_REMOTE_STDERR", getDisplayName(), command, 
                                         result.getExitCode(), result.getStderr().trim());
            _log.error(msg);
            throw new RemoteExecutionException(msg, result.getStderr());
        }
        
        var stdout = result.getStdout().trim();
        if (_log.isDebugEnabled()) 
            _log.debug(MsgUtils.getMsg("JOBSUB_REMOTE_STDOUT", getDisplayName(), stdout));
        return stdout;
    }
    
    /* ---------------------------------------------------------------------- */
    /* pause:                                                                 */
    /* ---------------------------------------------------------------------- */
    private void pause(long millis, String command) throws ConnectivityException
    {
        try {_sleeper.sleep(millis);}
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            String msg = MsgUtils.getMsg("JOBSUB_INTERRUPTED", "retrying command [" + command + "]");
            _log.warn(msg);
            throw new ConnectivityException(msg, e);
        }
    }
}
