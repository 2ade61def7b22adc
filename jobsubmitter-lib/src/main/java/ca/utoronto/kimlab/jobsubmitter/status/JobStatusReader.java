package ca.utoronto.kimlab.jobsubmitter.status;

import java.io.IOException;
import java.io.StringReader;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.ToNumberPolicy;
import com.google.gson.reflect.TypeToken;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;

import ca.utoronto.kimlab.jobsubmitter.i18n.MsgUtils;
import ca.utoronto.kimlab.jobsubmitter.model.JobRecord;
import ca.utoronto.kimlab.jobsubmitter.model.JobResult;
import ca.utoronto.kimlab.jobsubmitter.model.enumerations.JobStatusType;

/** Derives each job's status from the log files its wrapper wrote.
 * 
 * For job index i the reader looks at i.err.tmp, falling back to i.err.  
 * Neither file means the job never started (MISSING).  Otherwise the trimmed, 
 * lower cased content decides: a trailing error! is ERROR, a trailing done! is
 * DONE, and anything else, including an unreadable file, is FROZEN.  Only DONE
 * jobs have their i.out read: a JSON object is merged into the result as 
 * fields, any other content is kept verbatim.
 * 
 * The reader keeps no state and never fails because of a job's files.
 */
public final class JobStatusReader 
{
    /* ********************************************************************** */
    /*                               Constants                                */
    /* ********************************************************************** */
    // Tracing.
    private static final Logger _log = LoggerFactory.getLogger(JobStatusReader.class);
    
    // Log file suffixes.
    public static final String STDOUT_SUFFIX  = ".out";
    public static final String STDERR_SUFFIX  = ".err";
    public static final String TMP_SUFFIX     = ".tmp";
    
    // Lower case sentinels.
    private static final String DONE_MARKER   = "done!";
    private static final String ERROR_MARKER  = "error!";
    
    // Integral JSON numbers become Long instead of Double.
    private static final Gson _gson = new GsonBuilder()
        .setObjectToNumberStrategy(ToNumberPolicy.LONG_OR_DOUBLE)
        .create();
    private static final Type FIELDS_TYPE = new TypeToken<Map<String,Object>>(){}.getType();

    /* ********************************************************************** */
    /*                             Public Methods                             */
    /* ********************************************************************** */
    /* ---------------------------------------------------------------------- */
    /* readStatus:                                                            */
    /* ---------------------------------------------------------------------- */
    /** Report the status of each job, in the order given.
     * 
     * @param logDir the directory holding the batch's log files
     * @param jobs the job table
     * @return one result per job
     */
    public List<JobResult> readStatus(Path logDir, List<JobRecord> jobs)
    {
        var results = new ArrayList<JobResult>(jobs.size());
        
        // Listing the directory refreshes stale NFS attribute caches.
        if (!refreshListing(logDir)) {
            for (var job : jobs) results.add(JobResult.of(job, JobStatusType.MISSING));
            logSummary(logDir, results);
            return results;
        }
        
        for (var job : jobs) results.add(readJob(logDir, job));
        logSummary(logDir, results);
        return results;
    }

    /* ---------------------------------------------------------------------- */
    /* readJob:                                                               */
    /* ---------------------------------------------------------------------- */
    /** The status of a single job. */
    public JobResult readJob(Path logDir, JobRecord job)
    {
        var errLog = logDir.resolve(job.getIndex() + STDERR_SUFFIX);
        var tmpLog = logDir.resolve(job.getIndex() + STDERR_SUFFIX + TMP_SUFFIX);
        
        String errContent;
        try {
            errContent = readFile(tmpLog);
            if (errContent == null) errContent = readFile(errLog);
        }
        catch (IOException e) {
            _log.warn(MsgUtils.getMsg("JOBSUB_STATUS_READ_ERROR", errLog, e.getMessage()));
            return JobResult.of(job, JobStatusType.FROZEN);
        }
        if (errContent == null) return JobResult.of(job, JobStatusType.MISSING);
        
        var tail = errContent.trim().toLowerCase();
        if (tail.endsWith(ERROR_MARKER)) return JobResult.of(job, JobStatusType.ERROR);
        if (!tail.endsWith(DONE_MARKER)) return JobResult.of(job, JobStatusType.FROZEN);
        
        // Done, so collect the output.
        var outLog = logDir.resolve(job.getIndex() + STDOUT_SUFFIX);
        String stdout;
        try {
            stdout = readFile(outLog);
        }
        catch (IOException e) {
            _log.warn(MsgUtils.getMsg("JOBSUB_STATUS_READ_ERROR", outLog, e.getMessage()));
            stdout = null;
        }
        stdout = stdout == null ? "" : stdout.trim();
        
        var fields = parseObject(stdout);
        if (fields != null) return JobResult.doneWithFields(job, fields);
        return JobResult.doneWithStdout(job, stdout);
    }

    /* ********************************************************************** */
    /*                            Private Methods                             */
    /* ********************************************************************** */
    /* ---------------------------------------------------------------------- */
    /* refreshListing:                                                        */
    /* ---------------------------------------------------------------------- */
    /** List the directory, returning false if it cannot be listed. */
    private boolean refreshListing(Path logDir)
    {
        try (Stream<Path> entries = Files.list(logDir)) {
            long count = entries.count();
            if (_log.isDebugEnabled()) _log.debug(logDir + " holds " + count + " file(s).");
            return true;
        }
        catch (IOException e) {
            _log.warn(MsgUtils.getMsg("JOBSUB_STATUS_LIST_ERROR", logDir, e.getMessage()));
            return false;
        }
    }
    
    /* ---------------------------------------------------------------------- */
    /* readFile:                                                              */
    /* ---------------------------------------------------------------------- */
    /** Return the file's content, or null if it does not exist. */
    private static String readFile(Path path) throws IOException
    {
        try {return FileUtils.readFileToString(path.toFile(), StandardCharsets.UTF_8);}
        catch (NoSuchFileException e) {return null;}
        catch (IOException e) {
            // commons-io reports a missing file as a plain IOException.
            if (!Files.exists(path)) return null;
            throw e;
        }
    }
    
    /* ---------------------------------------------------------------------- */
    /* parseObject:                                                           */
    /* ---------------------------------------------------------------------- */
    /** Return the fields of a JSON object, or null if text is not exactly one.
     * Parsing is strict, so any relaxed JSON syntax disqualifies the text.
     */
    private static Map<String,Object> parseObject(String text)
    {
        if (text.isEmpty() || text.charAt(0) != '{') return null;
        try (var reader = new JsonReader(new StringReader(text))) {
            reader.setLenient(false);
            JsonElement element = _gson.getAdapter(JsonElement.class).read(reader);
            if (element == null || !element.isJsonObject()) return null;
            if (reader.peek() != JsonToken.END_DOCUMENT) return null;
            return _gson.fromJson(element, FIELDS_TYPE);
        }
        catch (IOException | JsonParseException | IllegalStateException e) {
            if (_log.isDebugEnabled()) _log.debug("Output is not a JSON object: " + e.getMessage());
            return null;
        }
    }
    
    /* ---------------------------------------------------------------------- */
    /* logSummary:                                                            */
    /* ---------------------------------------------------------------------- */
    private void logSummary(Path logDir, List<JobResult> results)
    {
        var counts = new EnumMap<JobStatusType,Integer>(JobStatusType.class);
        for (var result : results) counts.merge(result.getStatus(), 1, Integer::sum);
        _log.info(MsgUtils.getMsg("JOBSUB_STATUS_SUMMARY", results.size(), logDir, counts));
    }
}
