package ca.utoronto.kimlab.jobsubmitter.model;

/** What a dispatched job returned: the scheduler's reply for remote jobs or
 * the process exit code for local jobs.  Exactly one of the two is set.
 */
public final class SubmitOutcome 
{
    private final String  _index;
    private final String  _remoteOutput;
    private final Integer _exitCode;
    
    private SubmitOutcome(String index, String remoteOutput, Integer exitCode)
    {
        _index = index;
        _remoteOutput = remoteOutput;
        _exitCode = exitCode;
    }
    
    public static SubmitOutcome remote(String index, String remoteOutput) 
    {return new SubmitOutcome(index, remoteOutput, null);}
    
    public static SubmitOutcome local(String index, int exitCode) 
    {return new SubmitOutcome(index, null, exitCode);}
    
    public boolean isLocal() {return _exitCode != null;}
    
    public String getIndex() {return _index;}
    public String getRemoteOutput() {return _remoteOutput;}
    public Integer getExitCode() {return _exitCode;}
    
    @Override
    public String toString() 
    {
        return isLocal() ? _index + " exit=" + _exitCode : _index + " " + _remoteOutput;
    }
}
