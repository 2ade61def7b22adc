package ca.utoronto.kimlab.jobsubmitter.exceptions;

/** A head node command produced output on stderr.  Scheduler CLIs are known 
 * to exit with 0 while reporting real errors, so stderr output alone marks
 * the command as failed.  Not retried by the channel.
 */
public class RemoteExecutionException 
 extends JobSubmitterException
{
    private static final long serialVersionUID = 6102772381565216230L;
    
    // The raw stderr content of the failed command.
    private final String _stderr;
    
    public RemoteExecutionException(String message, String stderr) 
    {
        super(message);
        _stderr = stderr;
    }
    
    public String getStderr() {return _stderr;}
}
