package ca.utoronto.kimlab.jobsubmitter.channels;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.EnumSet;
import java.util.Map;

import org.apache.sshd.client.SshClient;
import org.apache.sshd.client.channel.ChannelExec;
import org.apache.sshd.client.channel.ClientChannelEvent;
import org.apache.sshd.client.keyverifier.AcceptAllServerKeyVerifier;
import org.apache.sshd.client.session.ClientSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ca.utoronto.kimlab.jobsubmitter.config.RuntimeParameters;
import ca.utoronto.kimlab.jobsubmitter.exceptions.ConnectivityException;
import ca.utoronto.kimlab.jobsubmitter.i18n.MsgUtils;
import ca.utoronto.kimlab.jobsubmitter.model.ClusterTarget;
import ca.utoronto.kimlab.jobsubmitter.utils.RetryBackoff;
import ca.utoronto.kimlab.jobsubmitter.utils.Sleeper;

/** SSH channel to a cluster head node built on the Apache MINA SSHD client.
 * 
 * Server host keys are accepted without verification.  When the target has no
 * password the client's default key identities are used.  Each command gets
 * its own exec channel with a pseudo-terminal, so many worker threads can
 * share the session.
 */
public final class SshRemoteChannel 
 extends AbstractRemoteChannel
{
    /* ********************************************************************** */
    /*                               Constants                                */
    /* ********************************************************************** */
    // Tracing.
    private static final Logger _log = LoggerFactory.getLogger(SshRemoteChannel.class);

    /* ********************************************************************** */
    /*                                 Fields                                 */
    /* ********************************************************************** */
    private final ClusterTarget _target;
    private final long          _connectTimeoutMillis;
    private final long          _execTimeoutMillis;
    
    // Guarded by this.
    private SshClient     _client;
    private volatile ClientSession _session;

    /* ********************************************************************** */
    /*                              Constructors                              */
    /* ********************************************************************** */
    /* ---------------------------------------------------------------------- */
    /* constructor:                                                           */
    /* ---------------------------------------------------------------------- */
    public SshRemoteChannel(ClusterTarget target)
    {
        super();
        _target = target;
        _connectTimeoutMillis = RuntimeParameters.getInstance().getSshConnectTimeoutMillis();
        _execTimeoutMillis = RuntimeParameters.getInstance().getSshExecTimeoutMillis();
    }
    
    /* ---------------------------------------------------------------------- */
    /* constructor:                                                           */
    /* ---------------------------------------------------------------------- */
    public SshRemoteChannel(ClusterTarget target, int maxAttempts, RetryBackoff backoff, 
                            Sleeper sleeper, long connectTimeoutMillis, long execTimeoutMillis)
    {
        super(maxAttempts, backoff, sleeper);
        _target = target;
        _connectTimeoutMillis = connectTimeoutMillis;
        _execTimeoutMillis = execTimeoutMillis;
    }

    /* ********************************************************************** */
    /*                             Public Methods                             */
    /* ********************************************************************** */
    /* ---------------------------------------------------------------------- */
    /* isConnected:                                                           */
    /* ---------------------------------------------------------------------- */
    @Override
    public boolean isConnected() 
    {
        var session = _session;
        return session != null && session.isOpen() && session.isAuthenticated();
    }

    @Override
    public String getDisplayName() {return _target.getDisplayName();}
    
    /* ********************************************************************** */
    /*                           Protected Methods                            */
    /* ********************************************************************** */
    /* ---------------------------------------------------------------------- */
    /* openSession:                                                           */
    /* ---------------------------------------------------------------------- */
    @Override
    protected void openSession() throws ConnectivityException
    {
        var user = getUsername();
        _log.info(MsgUtils.getMsg("JOBSUB_SSH_CONNECTING", user, _target.getHost(), _target.getPort()));
        
        ClientSession session = null;
        try {
            if (_client == null) {
                _client = SshClient.setUpDefaultClient();
                _client.setServerKeyVerifier(AcceptAllServerKeyVerifier.INSTANCE);
                _client.start();
            }
            
            session = _client.connect(user, _target.getHost(), _target.getPort())
                             .verify(_connectTimeoutMillis).getSession();
            if (_target.getPassword() != null) session.addPasswordIdentity(_target.getPassword());
            session.auth().verify(_connectTimeoutMillis);
        }
        catch (IOException | RuntimeException e) {
            if (session != null) session.close(true);
            String msg = MsgUtils.getMsg("JOBSUB_SSH_CONNECT_ERROR", user, _target.getHost(), 
                                         _target.getPort(), e.getMessage());
            _log.error(msg, e);
            throw new ConnectivityException(msg, e);
        }
        
        _session = session;
        _log.info(MsgUtils.getMsg("JOBSUB_SSH_CONNECTED", user, _target.getHost(), _target.getPort()));
    }

    /* ---------------------------------------------------------------------- */
    /* closeSession:                                                          */
    /* ---------------------------------------------------------------------- */
    @Override
    protected void closeSession()
    {
        var session = _session;
        _session = null;
        if (session != null) {
            try {session.close();}
            catch (IOException e) {
                _log.warn(MsgUtils.getMsg("JOBSUB_SSH_DISCONNECT_ERROR", getDisplayName(), e.getMessage()), e);
            }
            _log.info(MsgUtils.getMsg("JOBSUB_SSH_DISCONNECTED", getDisplayName()));
        }
        if (_client != null) {
            _client.stop();
            _client = null;
        }
    }

    /* ---------------------------------------------------------------------- */
    /* runCommand:                                                            */
    /* ---------------------------------------------------------------------- */
    @Override
    protected RemoteCommandResult runCommand(String command, Map<String,String> environment)
     throws ConnectivityException
    {
        var session = _session;
        if (session == null) {
            String msg = MsgUtils.getMsg("JOBSUB_SSH_CHANNEL_ERROR", getDisplayName(), command, 
                                         "no open session");
            throw new ConnectivityException(msg);
        }
        
        if (_log.isDebugEnabled()) 
            _log.debug(MsgUtils.getMsg("JOBSUB_REMOTE_CMD", getDisplayName(), command));
        
        var out = new ByteArrayOutputStream(1024);
        var err = new ByteArrayOutputStream(1024);
        try (ChannelExec channel = session.createExecChannel(command)) {
            // Some scheduler CLIs misbehave without a terminal.
            channel.setUsePty(true);
            for (var entry : environment.entrySet()) channel.setEnv(entry.getKey(), entry.getValue());
            channel.setOut(out);
            channel.setErr(err);
            channel.open().verify(_connectTimeoutMillis);
            
            var events = channel.waitFor(EnumSet.of(ClientChannelEvent.CLOSED), _execTimeoutMillis);
            if (events.contains(ClientChannelEvent.TIMEOUT)) {
                String msg = MsgUtils.getMsg("JOBSUB_SSH_EXEC_TIMEOUT", getDisplayName(), command, 
                                             _execTimeoutMillis);
                throw new ConnectivityException(msg);
            }
            
            return new RemoteCommandResult(out.toString(StandardCharsets.UTF_8),
                                           err.toString(StandardCharsets.UTF_8),
                                           channel.getExitStatus());
        }
        catch (IOException | RuntimeException e) {
            String msg = MsgUtils.getMsg("JOBSUB_SSH_CHANNEL_ERROR", getDisplayName(), command, e.getMessage());
            _log.error(msg, e);
            throw new ConnectivityException(msg, e);
        }
    }

    /* ********************************************************************** */
    /*                            Private Methods                             */
    /* ********************************************************************** */
    private String getUsername()
    {
        var user = _target.getUsername();
        return user != null ? user : System.getProperty("user.name");
    }
}
