package ca.utoronto.kimlab.jobsubmitter.schedulers;

import java.util.EnumMap;
import java.util.Map;

import ca.utoronto.kimlab.jobsubmitter.model.enumerations.SchedulerType;

/** Hands out the formatter for a scheduler type.  Formatters are stateless
 * and shared.
 */
public final class SchedulerFormatterFactory 
{
    private static final Map<SchedulerType,SchedulerCommandFormatter> _formatters = 
        new EnumMap<>(SchedulerType.class);
    static {
        _formatters.put(SchedulerType.LOCAL, new LocalCommandFormatter());
        _formatters.put(SchedulerType.SGE,   new SgeCommandFormatter());
        _formatters.put(SchedulerType.PBS,   new PbsCommandFormatter());
        _formatters.put(SchedulerType.SLURM, new SlurmCommandFormatter());
    }
    
    private SchedulerFormatterFactory() {}
    
    /* ---------------------------------------------------------------------- */
    /* getInstance:                                                           */
    /* ---------------------------------------------------------------------- */
    public static SchedulerCommandFormatter getInstance(SchedulerType type)
    {
        if (type == null) throw new IllegalArgumentException("scheduler type must not be null");
        return _formatters.get(type);
    }
}
