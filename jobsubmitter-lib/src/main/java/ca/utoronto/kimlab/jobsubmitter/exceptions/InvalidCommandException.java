package ca.utoronto.kimlab.jobsubmitter.exceptions;

/** The literal system command cannot be expressed for the target scheduler,
 * for example a comma in a PBS or SGE submission.  Raised while formatting,
 * before any network call is made for the job.
 */
public class InvalidCommandException 
 extends JobSubmitterException
{
    private static final long serialVersionUID = -1524620349135470187L;
    
    public InvalidCommandException(String message) {super(message);}
}
