package ca.utoronto.kimlab.jobsubmitter.exceptions;

/** Root of the checked exceptions thrown by the job submitter library.
 */
public class JobSubmitterException 
 extends Exception
{
    private static final long serialVersionUID = 4915385613520719367L;
    
    public JobSubmitterException(String message) {super(message);}
    public JobSubmitterException(String message, Throwable cause) {super(message, cause);}
}
