package ca.utoronto.kimlab.jobsubmitter.exceptions;

/** The caller's job table contains the same index twice.  Detected before
 * any job is dispatched.
 */
public class DuplicateJobIndexException 
 extends JobSubmitterException
{
    private static final long serialVersionUID = -8207357015627461146L;
    
    private final String _index;
    
    public DuplicateJobIndexException(String message, String index) 
    {
        super(message);
        _index = index;
    }
    
    public String getIndex() {return _index;}
}
