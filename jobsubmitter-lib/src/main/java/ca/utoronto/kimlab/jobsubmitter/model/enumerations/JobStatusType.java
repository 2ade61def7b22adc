package ca.utoronto.kimlab.jobsubmitter.model.enumerations;

import java.util.Locale;

/** Terminal or in-flight state of a job as seen through its log files.
 * 
 *   MISSING - neither <index>.err nor <index>.err.tmp exists.
 *   FROZEN  - an error log exists but does not end with a sentinel.
 *   ERROR   - the error log ends with "error!".
 *   DONE    - the error log ends with "done!".
 */
public enum JobStatusType 
{
    MISSING,
    FROZEN,
    ERROR,
    DONE;
    
    /** The lower case name reported in result rows. */
    public String getLabel(){return name().toLowerCase(Locale.ROOT);}
}
