package ca.utoronto.kimlab.jobsubmitter.utils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Expands a parameter grid into the list of every combination of values, 
 * which is how large job tables are usually built.  For the grid 
 * a=[1,2], b=[3,4] the result is
 * 
 * <pre>
 *   {a=1, b=3}, {a=1, b=4}, {a=2, b=3}, {a=2, b=4}
 * </pre>
 * 
 * The first key varies slowest.  Global parameters are copied into every
 * combination and are overridden by grid keys of the same name.
 */
public final class ParameterGrid 
{
    private ParameterGrid() {}
    
    /* ---------------------------------------------------------------------- */
    /* expand:                                                                */
    /* ---------------------------------------------------------------------- */
    public static List<Map<String,Object>> expand(Map<String,? extends List<?>> grid)
    {
        return expand(null, grid);
    }
    
    /* ---------------------------------------------------------------------- */
    /* expand:                                                                */
    /* ---------------------------------------------------------------------- */
    /** Return the cartesian product of the grid.  An empty grid yields one
     * combination holding only the global parameters; a key with no values
     * yields no combinations at all.
     * 
     * @param globalParams parameters shared by every combination, may be null
     * @param grid ordered map of parameter name to candidate values
     * @return the combinations, each an insertion ordered map
     */
    public static List<Map<String,Object>> expand(Map<String,?> globalParams, 
                                                  Map<String,? extends List<?>> grid)
    {
        var seed = new LinkedHashMap<String,Object>();
        if (globalParams != null) seed.putAll(globalParams);
        
        List<Map<String,Object>> combos = new ArrayList<>();
        combos.add(seed);
        if (grid == null) return combos;
        
        for (var entry : grid.entrySet()) {
            List<?> values = entry.getValue() == null ? Collections.emptyList() : entry.getValue();
            var next = new ArrayList<Map<String,Object>>(combos.size() * Math.max(1, values.size()));
            for (var combo : combos) 
                for (var value : values) {
                    var m = new LinkedHashMap<String,Object>(combo);
                    m.put(entry.getKey(), value);
                    next.add(m);
                }
            combos = next;
        }
        return combos;
    }
}
