package ca.utoronto.kimlab.jobsubmitter.model.enumerations;

import java.util.Locale;

/** Where jobs run.  The scheme is the lower case name used in connection 
 * strings (sge://host).  LOCAL runs jobs as child processes of this JVM.
 */
public enum SchedulerType 
{
    LOCAL("local"),
    SGE("sge"),
    PBS("pbs"),
    SLURM("slurm");
    
    // ---- Fields
    private final String _scheme;
    
    // ---- Constructor
    SchedulerType(String scheme){_scheme = scheme;}
    
    // ---- Instance Methods
    public String getScheme(){return _scheme;}
    public boolean isRemote(){return this != LOCAL;}
    
    // ---- Static Methods
    /** Return the type for a scheme, ignoring case, or null if unknown. */
    public static SchedulerType fromScheme(String scheme)
    {
        if (scheme == null) return null;
        var s = scheme.trim().toLowerCase(Locale.ROOT);
        for (var type : values()) if (type._scheme.equals(s)) return type;
        return null;
    }
}
