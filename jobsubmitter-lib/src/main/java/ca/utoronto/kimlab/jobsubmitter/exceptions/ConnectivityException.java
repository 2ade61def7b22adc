package ca.utoronto.kimlab.jobsubmitter.exceptions;

/** A transient transport failure talking to the head node: the session could
 * not be opened, a channel could not be opened or the connection dropped 
 * mid-command.  These are the only failures that the remote channel retries.
 */
public class ConnectivityException 
 extends JobSubmitterException
{
    private static final long serialVersionUID = -2709184622187154840L;
    
    public ConnectivityException(String message) {super(message);}
    public ConnectivityException(String message, Throwable cause) {super(message, cause);}
}
