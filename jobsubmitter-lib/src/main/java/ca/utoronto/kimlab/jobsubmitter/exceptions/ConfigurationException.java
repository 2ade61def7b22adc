package ca.utoronto.kimlab.jobsubmitter.exceptions;

/** Unknown scheduler scheme, malformed connection string or an otherwise
 * unusable cluster target or job option.
 */
public class ConfigurationException 
 extends JobSubmitterException
{
    private static final long serialVersionUID = 3356080264962815019L;
    
    public ConfigurationException(String message) {super(message);}
    public ConfigurationException(String message, Throwable cause) {super(message, cause);}
}
