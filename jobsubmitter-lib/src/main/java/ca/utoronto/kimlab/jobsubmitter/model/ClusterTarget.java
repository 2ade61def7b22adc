package ca.utoronto.kimlab.jobsubmitter.model;

import java.util.Arrays;
import java.util.regex.Pattern;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;

import ca.utoronto.kimlab.jobsubmitter.exceptions.ConfigurationException;
import ca.utoronto.kimlab.jobsubmitter.i18n.MsgUtils;
import ca.utoronto.kimlab.jobsubmitter.model.enumerations.SchedulerType;

/** Identifies where jobs run: the scheduler, the head node and how the remote
 * home and scratch directories are found.  Remote paths can be literal paths
 * or environment variable references such as $SCRATCH, which are resolved on
 * the head node once per session.  A concurrent job limit of 0 means there is
 * no limit.
 * 
 * Instances are immutable.
 */
public final class ClusterTarget 
{
    /* ********************************************************************** */
    /*                               Constants                                */
    /* ********************************************************************** */
    // scheme://[user[:password]@]host[:port][/]
    //
    //   1 - scheme
    //   2 - user, possibly empty
    //   3 - password, possibly empty
    //   4 - host, possibly empty
    //   5 - port
    private static final Pattern CONNECTION_PATTERN = 
        Pattern.compile("^([A-Za-z]+)://(?:([^:@/]*)(?::([^@/]*))?@)?([^:/@]*)(?::(\\d+))?/?$");
    
    // The default ssh port.
    public static final int DEFAULT_PORT = 22;
    public static final int MAX_PORT     = 65535;
    
    /* ********************************************************************** */
    /*                                 Fields                                 */
    /* ********************************************************************** */
    private final SchedulerType _schedulerType;
    private final String        _host;
    private final int           _port;
    private final String        _username;
    private final String        _password;
    private final String        _remoteHome;
    private final String        _remoteScratch;
    private final int           _concurrentJobLimit;

    /* ********************************************************************** */
    /*                              Constructors                              */
    /* ********************************************************************** */
    /* ---------------------------------------------------------------------- */
    /* constructor:                                                           */
    /* ---------------------------------------------------------------------- */
    private ClusterTarget(Builder b) 
    {
        _schedulerType      = b.schedulerType;
        _host               = StringUtils.trimToNull(b.host);
        _port               = b.port > 0 ? b.port : DEFAULT_PORT;
        _username           = StringUtils.trimToNull(b.username);
        _password           = StringUtils.isEmpty(b.password) ? null : b.password;
        _remoteHome         = StringUtils.trimToNull(b.remoteHome);
        // Without an explicit scratch area jobs run under the remote home.
        _remoteScratch      = StringUtils.defaultIfBlank(StringUtils.trimToNull(b.remoteScratch), _remoteHome);
        _concurrentJobLimit = Math.max(0, b.concurrentJobLimit);
    }
    
    /* ********************************************************************** */
    /*                             Public Methods                             */
    /* ********************************************************************** */
    /* ---------------------------------------------------------------------- */
    /* parse:                                                                 */
    /* ---------------------------------------------------------------------- */
    /** Parse a connection string such as "pbs://:@login.scinet.utoronto.ca" or
     * "local://localhost".  A bare "local" is also accepted.
     * 
     * @param connectionString the non-null connection string
     * @return the target builder so that remote paths and limits can be added
     * @throws ConfigurationException on unknown schemes or malformed strings
     */
    public static Builder parse(String connectionString) 
     throws ConfigurationException
    {
        if (StringUtils.isBlank(connectionString)) {
            String msg = MsgUtils.getMsg("JOBSUB_INVALID_CONNECTION_STRING", connectionString);
            throw new ConfigurationException(msg);
        }
        
        // Allow the short form of the local target.
        var s = connectionString.trim();
        if (SchedulerType.LOCAL.getScheme().equalsIgnoreCase(s)) 
            return builder(SchedulerType.LOCAL);
        
        var m = CONNECTION_PATTERN.matcher(s);
        if (!m.matches()) {
            String msg = MsgUtils.getMsg("JOBSUB_INVALID_CONNECTION_STRING", connectionString);
            throw new ConfigurationException(msg);
        }
        
        var type = SchedulerType.fromScheme(m.group(1));
        if (type == null) {
            String msg = MsgUtils.getMsg("JOBSUB_UNKNOWN_SCHEME", m.group(1), connectionString,
                                         Arrays.toString(SchedulerType.values()));
            throw new ConfigurationException(msg);
        }
        
        var b = builder(type);
        b.username(m.group(2)).password(m.group(3)).host(m.group(4));
        if (m.group(5) != null) {
            int port = NumberUtils.toInt(m.group(5), -1);
            if (port < 1 || port > MAX_PORT) {
                String msg = MsgUtils.getMsg("JOBSUB_INVALID_PORT", m.group(5), m.group(4));
                throw new ConfigurationException(msg);
            }
            b.port(port);
        }
        return b;
    }
    
    /* ---------------------------------------------------------------------- */
    /* builder:                                                               */
    /* ---------------------------------------------------------------------- */
    public static Builder builder(SchedulerType schedulerType) 
    {
        return new Builder(schedulerType);
    }
    
    /* ---------------------------------------------------------------------- */
    /* usesRemotePaths:                                                       */
    /* ---------------------------------------------------------------------- */
    /** True when job folders live under a separate remote home/scratch tree. 
     * Without a remote home the head node is assumed to share our $HOME. 
     */
    public boolean usesRemotePaths() 
    {
        return _schedulerType.isRemote() && _remoteHome != null;
    }
    
    /* ---------------------------------------------------------------------- */
    /* getDisplayName:                                                        */
    /* ---------------------------------------------------------------------- */
    /** The connection string without the password. */
    public String getDisplayName()
    {
        if (_schedulerType == SchedulerType.LOCAL) return SchedulerType.LOCAL.getScheme() + "://";
        var buf = new StringBuilder(_schedulerType.getScheme()).append("://");
        if (_username != null) buf.append(_username).append("@");
        buf.append(_host);
        if (_port != DEFAULT_PORT) buf.append(":").append(_port);
        return buf.toString();
    }
    
    @Override
    public String toString() {return getDisplayName();}

    /* ********************************************************************** */
    /*                               Accessors                                */
    /* ********************************************************************** */
    public SchedulerType getSchedulerType() {return _schedulerType;}
    public String getHost() {return _host;}
    public int getPort() {return _port;}
    public String getUsername() {return _username;}
    public String getPassword() {return _password;}
    public String getRemoteHome() {return _remoteHome;}
    public String getRemoteScratch() {return _remoteScratch;}
    public int getConcurrentJobLimit() {return _concurrentJobLimit;}
    
    /* ********************************************************************** */
    /*                             Builder Class                              */
    /* ********************************************************************** */
    public static final class Builder
    {
        private final SchedulerType schedulerType;
        private String host;
        private int    port;
        private String username;
        private String password;
        private String remoteHome;
        private String remoteScratch;
        private int    concurrentJobLimit;
        
        private Builder(SchedulerType schedulerType) {this.schedulerType = schedulerType;}
        
        public Builder host(String host) {this.host = host; return this;}
        public Builder port(int port) {this.port = port; return this;}
        public Builder username(String username) {this.username = username; return this;}
        public Builder password(String password) {this.password = password; return this;}
        public Builder remoteHome(String remoteHome) {this.remoteHome = remoteHome; return this;}
        public Builder remoteScratch(String remoteScratch) {this.remoteScratch = remoteScratch; return this;}
        public Builder concurrentJobLimit(int limit) {this.concurrentJobLimit = limit; return this;}
        
        /** Validate and create the target.
         * 
         * @throws ConfigurationException when a remote scheduler has no host
         */
        public ClusterTarget build() throws ConfigurationException
        {
            if (schedulerType == null) {
                String msg = MsgUtils.getMsg("JOBSUB_UNKNOWN_SCHEME", null, "null",
                                             Arrays.toString(SchedulerType.values()));
                throw new ConfigurationException(msg);
            }
            if (port > MAX_PORT) {
                String msg = MsgUtils.getMsg("JOBSUB_INVALID_PORT", String.valueOf(port), host);
                throw new ConfigurationException(msg);
            }
            var target = new ClusterTarget(this);
            if (schedulerType.isRemote() && target._host == null) {
                String msg = MsgUtils.getMsg("JOBSUB_MISSING_HOST", target.getDisplayName(), 
                                             schedulerType.name());
                throw new ConfigurationException(msg);
            }
            return target;
        }
    }
}
