package ca.utoronto.kimlab.jobsubmitter.channels;

import java.util.Map;

import ca.utoronto.kimlab.jobsubmitter.exceptions.ConnectivityException;
import ca.utoronto.kimlab.jobsubmitter.exceptions.JobSubmitterException;

/** A command channel to a cluster head node.  One channel is shared by every
 * worker thread of a submission, so implementations must be thread safe.
 * Closing the channel is the same as disconnecting it.
 */
public interface RemoteChannel
 extends AutoCloseable
{
    /** Open the session.  Calling connect on an open channel does nothing. */
    void connect() throws ConnectivityException;
    
    /** Close the session if one is open.  Safe to call at any time. */
    void disconnect();
    
    boolean isConnected();
    
    /** Run a command on the head node and return its trimmed stdout.
     * 
     * @param command the shell command line
     * @return the trimmed standard output
     * @throws ConnectivityException if the session could not be used after retrying
     * @throws ca.utoronto.kimlab.jobsubmitter.exceptions.RemoteExecutionException if the command wrote anything to stderr
     */
    String execute(String command) throws JobSubmitterException;
    
    /** Replace the variables set in the environment of every subsequent command.
     * 
     * @param env the variables, null clears them
     */
    void setEnvironment(Map<String,String> env);
    
    /** A loggable name for the remote end, never including credentials. */
    String getDisplayName();
    
    @Override
    default void close() {disconnect();}
}
