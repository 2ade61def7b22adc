package ca.utoronto.kimlab.jobsubmitter.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.apache.commons.lang3.StringUtils;

import ca.utoronto.kimlab.jobsubmitter.exceptions.ConfigurationException;
import ca.utoronto.kimlab.jobsubmitter.i18n.MsgUtils;

/** A caller-owned table of named clusters.  Applications build one registry
 * (from their own configuration) and hand the resolved target to the 
 * JobSubmitter; nothing in the library keeps a global host table.
 */
public final class ClusterRegistry 
{
    // Insertion ordered so listings match registration order.
    private final Map<String,ClusterTarget> _targets = new LinkedHashMap<>();
    
    /* ---------------------------------------------------------------------- */
    /* register:                                                              */
    /* ---------------------------------------------------------------------- */
    /** Add or replace the target known under alias. */
    public ClusterRegistry register(String alias, ClusterTarget target)
    {
        if (StringUtils.isBlank(alias)) throw new IllegalArgumentException("alias must not be blank");
        if (target == null) throw new IllegalArgumentException("target must not be null");
        _targets.put(alias, target);
        return this;
    }
    
    /* ---------------------------------------------------------------------- */
    /* resolve:                                                               */
    /* ---------------------------------------------------------------------- */
    /** Return the target registered under nameOrConnectionString, or parse the
     * argument as a connection string when no such alias exists.
     * 
     * @param nameOrConnectionString an alias or a connection string
     * @return the target
     * @throws ConfigurationException if the argument is neither
     */
    public ClusterTarget resolve(String nameOrConnectionString) 
     throws ConfigurationException
    {
        var target = _targets.get(nameOrConnectionString);
        if (target != null) return target;
        
        if (nameOrConnectionString == null || !nameOrConnectionString.contains("://") &&
            !"local".equalsIgnoreCase(nameOrConnectionString.trim())) 
        {
            String msg = MsgUtils.getMsg("JOBSUB_UNKNOWN_CLUSTER", nameOrConnectionString);
            throw new ConfigurationException(msg);
        }
        return ClusterTarget.parse(nameOrConnectionString).build();
    }
    
    public boolean contains(String alias) {return _targets.containsKey(alias);}
    public Map<String,ClusterTarget> getTargets() {return Collections.unmodifiableMap(_targets);}
}
