package ca.utoronto.kimlab.jobsubmitter.config;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ca.utoronto.kimlab.jobsubmitter.i18n.MsgUtils;

/** Tunable parameters of the submission machinery.  Values are read from the
 * jobsubmitter.properties file on the classpath and can be overridden by JVM
 * system properties of the same name.  Missing or non-numeric values fall
 * back to the built-in defaults, which reproduce the behavior expected by
 * shared clusters (50 ms between dispatches, poll the queue every 50 jobs,
 * sleep 2 minutes when the job ceiling is reached).
 * 
 * The singleton is read-only after construction.
 */
public final class RuntimeParameters 
{
    /* ********************************************************************** */
    /*                               Constants                                */
    /* ********************************************************************** */
    // Tracing.
    private static final Logger _log = LoggerFactory.getLogger(RuntimeParameters.class);
    
    // Classpath resource holding the defaults.
    public static final String PARAMETER_FILE = "jobsubmitter.properties";
    
    // Property names.
    public static final String DISPATCH_DELAY_MILLIS    = "jobsubmitter.dispatch.delay.millis";
    public static final String POOL_SIZE                = "jobsubmitter.pool.size";
    public static final String THROTTLE_STEP            = "jobsubmitter.throttle.step";
    public static final String THROTTLE_SLEEP_MILLIS    = "jobsubmitter.throttle.sleep.millis";
    public static final String SSH_CONNECT_TIMEOUT      = "jobsubmitter.ssh.connect.timeout.millis";
    public static final String SSH_EXEC_TIMEOUT         = "jobsubmitter.ssh.exec.timeout.millis";
    public static final String RETRY_MAX_ATTEMPTS       = "jobsubmitter.retry.max.attempts";
    public static final String RETRY_BASE_MILLIS        = "jobsubmitter.retry.base.millis";
    public static final String RETRY_MAX_MILLIS         = "jobsubmitter.retry.max.millis";
    public static final String POLL_MAX_ATTEMPTS        = "jobsubmitter.poll.max.attempts";
    
    // Built-in defaults.
    private static final long DEFAULT_DISPATCH_DELAY_MILLIS = 50;
    private static final int  DEFAULT_POOL_SIZE             = 32;
    private static final int  DEFAULT_THROTTLE_STEP         = 50;
    private static final long DEFAULT_THROTTLE_SLEEP_MILLIS = 120 * 1000;
    private static final long DEFAULT_SSH_CONNECT_TIMEOUT   = 20 * 1000;
    private static final long DEFAULT_SSH_EXEC_TIMEOUT      = 0;
    private static final int  DEFAULT_RETRY_MAX_ATTEMPTS    = 7;
    private static final long DEFAULT_RETRY_BASE_MILLIS     = 1000;
    private static final long DEFAULT_RETRY_MAX_MILLIS      = 60 * 1000;
    private static final int  DEFAULT_POLL_MAX_ATTEMPTS     = 5;
    
    /* ********************************************************************** */
    /*                                 Fields                                 */
    /* ********************************************************************** */
    // Lazily created singleton.
    private static RuntimeParameters _instance;
    
    private final long _dispatchDelayMillis;
    private final int  _poolSize;
    private final int  _throttleStep;
    private final long _throttleSleepMillis;
    private final long _sshConnectTimeoutMillis;
    private final long _sshExecTimeoutMillis;
    private final int  _retryMaxAttempts;
    private final long _retryBaseMillis;
    private final long _retryMaxMillis;
    private final int  _pollMaxAttempts;

    /* ********************************************************************** */
    /*                              Constructors                              */
    /* ********************************************************************** */
    /* ---------------------------------------------------------------------- */
    /* constructor:                                                           */
    /* ---------------------------------------------------------------------- */
    RuntimeParameters(Properties props)
    {
        _dispatchDelayMillis     = getLong(props, DISPATCH_DELAY_MILLIS, DEFAULT_DISPATCH_DELAY_MILLIS);
        _poolSize                = getInt(props, POOL_SIZE, DEFAULT_POOL_SIZE);
        _throttleStep            = getInt(props, THROTTLE_STEP, DEFAULT_THROTTLE_STEP);
        _throttleSleepMillis     = getLong(props, THROTTLE_SLEEP_MILLIS, DEFAULT_THROTTLE_SLEEP_MILLIS);
        _sshConnectTimeoutMillis = getLong(props, SSH_CONNECT_TIMEOUT, DEFAULT_SSH_CONNECT_TIMEOUT);
        _sshExecTimeoutMillis    = getLong(props, SSH_EXEC_TIMEOUT, DEFAULT_SSH_EXEC_TIMEOUT);
        _retryMaxAttempts        = getInt(props, RETRY_MAX_ATTEMPTS, DEFAULT_RETRY_MAX_ATTEMPTS);
        _retryBaseMillis         = getLong(props, RETRY_BASE_MILLIS, DEFAULT_RETRY_BASE_MILLIS);
        _retryMaxMillis          = getLong(props, RETRY_MAX_MILLIS, DEFAULT_RETRY_MAX_MILLIS);
        _pollMaxAttempts         = getInt(props, POLL_MAX_ATTEMPTS, DEFAULT_POLL_MAX_ATTEMPTS);
    }
    
    /* ********************************************************************** */
    /*                             Public Methods                             */
    /* ********************************************************************** */
    /* ---------------------------------------------------------------------- */
    /* getInstance:                                                           */
    /* ---------------------------------------------------------------------- */
    public static synchronized RuntimeParameters getInstance()
    {
        if (_instance == null) _instance = new RuntimeParameters(loadProperties());
        return _instance;
    }
    
    /* ********************************************************************** */
    /*                            Private Methods                             */
    /* ********************************************************************** */
    /* ---------------------------------------------------------------------- */
    /* loadProperties:                                                        */
    /* ---------------------------------------------------------------------- */
    /** Read the parameter file and overlay any matching system properties. */
    private static Properties loadProperties()
    {
        var props = new Properties();
        try (InputStream in = RuntimeParameters.class.getClassLoader().getResourceAsStream(PARAMETER_FILE)) {
            if (in == null) _log.info(MsgUtils.getMsg("JOBSUB_CONFIG_NOT_FOUND", PARAMETER_FILE));
            else props.load(in);
        }
        catch (IOException e) {
            _log.warn(MsgUtils.getMsg("JOBSUB_CONFIG_NOT_FOUND", PARAMETER_FILE), e);
        }
        
        // System properties take precedence.
        for (var name : System.getProperties().stringPropertyNames())
            if (name.startsWith("jobsubmitter.")) props.setProperty(name, System.getProperty(name));
        
        if (_log.isDebugEnabled())
            _log.debug(MsgUtils.getMsg("JOBSUB_CONFIG_LOADED", PARAMETER_FILE, props));
        return props;
    }
    
    /* ---------------------------------------------------------------------- */
    /* getLong:                                                               */
    /* ---------------------------------------------------------------------- */
    private static long getLong(Properties props, String name, long defaultValue)
    {
        String value = props.getProperty(name);
        if (StringUtils.isBlank(value)) return defaultValue;
        try {return Long.parseLong(value.trim());}
        catch (NumberFormatException e) {
            _log.warn(MsgUtils.getMsg("JOBSUB_CONFIG_BAD_VALUE", name, value, defaultValue));
            return defaultValue;
        }
    }
    
    /* ---------------------------------------------------------------------- */
    /* getInt:                                                                */
    /* ---------------------------------------------------------------------- */
    private static int getInt(Properties props, String name, int defaultValue)
    {
        return (int) getLong(props, name, defaultValue);
    }

    /* ********************************************************************** */
    /*                               Accessors                                */
    /* ********************************************************************** */
    public long getDispatchDelayMillis() {return _dispatchDelayMillis;}
    public int getPoolSize() {return _poolSize;}
    public int getThrottleStep() {return _throttleStep;}
    public long getThrottleSleepMillis() {return _throttleSleepMillis;}
    public long getSshConnectTimeoutMillis() {return _sshConnectTimeoutMillis;}
    public long getSshExecTimeoutMillis() {return _sshExecTimeoutMillis;}
    public int getRetryMaxAttempts() {return _retryMaxAttempts;}
    public long getRetryBaseMillis() {return _retryBaseMillis;}
    public long getRetryMaxMillis() {return _retryMaxMillis;}
    public int getPollMaxAttempts() {return _pollMaxAttempts;}
}
