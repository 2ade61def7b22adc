package ca.utoronto.kimlab.jobsubmitter.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** One row of the caller's job table: a unique index, the literal command to
 * run and any extra columns the caller wants echoed back in the status results.
 * The index names the job's log files, <index>.out and <index>.err.
 */
public final class JobRecord 
{
    private final String             _index;
    private final String             _systemCommand;
    private final Map<String,Object> _metadata;
    
    public JobRecord(Object index, String systemCommand)
    {
        this(index, systemCommand, null);
    }
    
    public JobRecord(Object index, String systemCommand, Map<String,?> metadata)
    {
        if (index == null) throw new IllegalArgumentException("index must not be null");
        _index = index.toString();
        _systemCommand = systemCommand;
        _metadata = metadata == null ? Collections.emptyMap() :
                    Collections.unmodifiableMap(new LinkedHashMap<String,Object>(metadata));
    }
    
    public String getIndex() {return _index;}
    public String getSystemCommand() {return _systemCommand;}
    public Map<String,Object> getMetadata() {return _metadata;}
    
    @Override
    public String toString() {return _index + ": " + _systemCommand;}
}
