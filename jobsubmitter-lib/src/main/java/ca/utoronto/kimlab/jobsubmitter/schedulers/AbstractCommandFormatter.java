package ca.utoronto.kimlab.jobsubmitter.schedulers;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import org.apache.commons.lang3.StringUtils;

import ca.utoronto.kimlab.jobsubmitter.exceptions.InvalidCommandException;
import ca.utoronto.kimlab.jobsubmitter.i18n.MsgUtils;
import ca.utoronto.kimlab.jobsubmitter.model.JobOpts;

/** Common plumbing for the scheduler formatters.  Subclasses append their 
 * clauses to an argument list; this class merges the environment, quotes
 * values and flattens the result to one line.
 */
abstract class AbstractCommandFormatter 
 implements SchedulerCommandFormatter
{
    /* ********************************************************************** */
    /*                               Constants                                */
    /* ********************************************************************** */
    // Any line terminator, including \r\n as a unit.
    private static final Pattern NEWLINE_PATTERN = Pattern.compile("\\R");
    
    // Discards capture of the scheduler's own output files.
    protected static final String DEV_NULL = "/dev/null";
    
    /* ********************************************************************** */
    /*                             Public Methods                             */
    /* ********************************************************************** */
    /* ---------------------------------------------------------------------- */
    /* formatSubmitCommand:                                                   */
    /* ---------------------------------------------------------------------- */
    @Override
    public String formatSubmitCommand(JobOpts opts, Map<String,String> overlay) 
     throws InvalidCommandException
    {
        var env = mergeEnv(opts, overlay);
        validate(opts, env);
        
        var args = new ArrayList<String>();
        appendClauses(args, opts, env);
        
        // One line, single spaces, nothing empty.
        var buf = new StringBuilder(512);
        for (var arg : args) {
            if (StringUtils.isBlank(arg)) continue;
            if (buf.length() > 0) buf.append(' ');
            buf.append(arg);
        }
        return NEWLINE_PATTERN.matcher(buf).replaceAll(" ");
    }
    
    /* ********************************************************************** */
    /*                           Protected Methods                            */
    /* ********************************************************************** */
    /** Append this scheduler's clauses in order.  Blank entries are dropped. */
    protected abstract void appendClauses(List<String> args, JobOpts opts, Map<String,String> env)
     throws InvalidCommandException;
    
    /* ---------------------------------------------------------------------- */
    /* validate:                                                              */
    /* ---------------------------------------------------------------------- */
    /** Subclasses that need a wrapper script and a system command call through
     * to this method and add their own checks. 
     */
    protected void validate(JobOpts opts, Map<String,String> env) 
     throws InvalidCommandException
    {
        if (StringUtils.isBlank(env.get(SYSTEM_COMMAND))) {
            String msg = MsgUtils.getMsg("JOBSUB_MISSING_SYSTEM_COMMAND", opts.getJobId());
            throw new InvalidCommandException(msg);
        }
        if (StringUtils.isBlank(opts.getWrapperScript())) {
            String msg = MsgUtils.getMsg("JOBSUB_MISSING_WRAPPER_SCRIPT", opts.getJobId());
            throw new InvalidCommandException(msg);
        }
    }
    
    /* ---------------------------------------------------------------------- */
    /* rejectComma:                                                           */
    /* ---------------------------------------------------------------------- */
    /** Schedulers that split -v on commas cannot carry a comma in any value. */
    protected void rejectComma(JobOpts opts, Map<String,String> env) 
     throws InvalidCommandException
    {
        var cmd = env.get(SYSTEM_COMMAND);
        if (cmd != null && cmd.indexOf(',') >= 0) {
            String msg = MsgUtils.getMsg("JOBSUB_COMMA_IN_COMMAND", getSchedulerType().name(), 
                                         opts.getJobId(), cmd);
            throw new InvalidCommandException(msg);
        }
    }
    
    /* ---------------------------------------------------------------------- */
    /* quote:                                                                 */
    /* ---------------------------------------------------------------------- */
    /** Double quote a value, escaping embedded backslashes and double quotes. */
    protected static String quote(String value)
    {
        if (value == null) value = "";
        var buf = new StringBuilder(value.length() + 8);
        buf.append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '"' || c == '\\') buf.append('\\');
            buf.append(c);
        }
        buf.append('"');
        return buf.toString();
    }
    
    /* ---------------------------------------------------------------------- */
    /* joinEnv:                                                               */
    /* ---------------------------------------------------------------------- */
    /** Render each variable as key="value" and join them with the separator. */
    protected static String joinEnv(Map<String,String> env, String separator)
    {
        var buf = new StringBuilder(256);
        for (var entry : env.entrySet()) {
            if (buf.length() > 0) buf.append(separator);
            buf.append(entry.getKey()).append('=').append(quote(entry.getValue()));
        }
        return buf.toString();
    }
    
    /** Return "flag value" when value is set, otherwise null. */
    protected static String clause(String flag, Object value)
    {
        if (value == null || StringUtils.isBlank(value.toString())) return null;
        return flag + value;
    }
    
    /* ********************************************************************** */
    /*                            Private Methods                             */
    /* ********************************************************************** */
    /* ---------------------------------------------------------------------- */
    /* mergeEnv:                                                              */
    /* ---------------------------------------------------------------------- */
    /** The batch environment in its order, then the overlay.  A key present in
     * both keeps its first position but takes the overlay's value.
     */
    private static Map<String,String> mergeEnv(JobOpts opts, Map<String,String> overlay)
    {
        var env = new LinkedHashMap<String,String>(opts.getEnv());
        if (overlay != null) env.putAll(overlay);
        return env;
    }
}
