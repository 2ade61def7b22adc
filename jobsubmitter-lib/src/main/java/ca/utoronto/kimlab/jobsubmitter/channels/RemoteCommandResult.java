package ca.utoronto.kimlab.jobsubmitter.channels;

/** Raw output of one command run on the head node. */
public final class RemoteCommandResult 
{
    private final String  _stdout;
    private final String  _stderr;
    private final Integer _exitCode;
    
    public RemoteCommandResult(String stdout, String stderr, Integer exitCode)
    {
        _stdout   = stdout == null ? "" : stdout;
        _stderr   = stderr == null ? "" : stderr;
        _exitCode = exitCode;
    }
    
    public String getStdout() {return _stdout;}
    public String getStderr() {return _stderr;}
    
    // Null when the server never reported an exit status.
    public Integer getExitCode() {return _exitCode;}
}
