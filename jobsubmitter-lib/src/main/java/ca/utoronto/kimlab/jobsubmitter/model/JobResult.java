package ca.utoronto.kimlab.jobsubmitter.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import ca.utoronto.kimlab.jobsubmitter.model.enumerations.JobStatusType;

/** The status of one job as read from its log files.  Only DONE jobs carry
 * output: either the fields of the JSON object the job printed, or the raw
 * stdout text when it was not a JSON object.
 */
public final class JobResult 
{
    /* ********************************************************************** */
    /*                               Constants                                */
    /* ********************************************************************** */
    // Column names used by toRow().
    public static final String JOB_ID_COLUMN      = "job_id";
    public static final String STATUS_COLUMN      = "status";
    public static final String STDOUT_DATA_COLUMN = "stdout_data";
    
    /* ********************************************************************** */
    /*                                 Fields                                 */
    /* ********************************************************************** */
    private final String             _index;
    private final Map<String,Object> _metadata;
    private final JobStatusType      _status;
    private final Map<String,Object> _fields;
    private final String             _stdoutData;

    /* ********************************************************************** */
    /*                              Constructors                              */
    /* ********************************************************************** */
    private JobResult(JobRecord job, JobStatusType status, Map<String,Object> fields, String stdoutData)
    {
        _index      = job.getIndex();
        _metadata   = job.getMetadata();
        _status     = status;
        _fields     = fields == null ? Collections.emptyMap() : 
                      Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        _stdoutData = stdoutData;
    }
    
    /* ********************************************************************** */
    /*                             Public Methods                             */
    /* ********************************************************************** */
    /** A result without output (MISSING, FROZEN or ERROR). */
    public static JobResult of(JobRecord job, JobStatusType status) 
    {
        return new JobResult(job, status, null, null);
    }
    
    /** A DONE result whose stdout was a JSON object. */
    public static JobResult doneWithFields(JobRecord job, Map<String,Object> fields) 
    {
        return new JobResult(job, JobStatusType.DONE, fields, null);
    }
    
    /** A DONE result whose stdout was kept verbatim. */
    public static JobResult doneWithStdout(JobRecord job, String stdoutData) 
    {
        return new JobResult(job, JobStatusType.DONE, null, stdoutData);
    }
    
    /* ---------------------------------------------------------------------- */
    /* toRow:                                                                 */
    /* ---------------------------------------------------------------------- */
    /** Flatten the result into one ordered row: job_id, the caller's metadata,
     * status and then either the parsed fields or stdout_data.  Later columns
     * replace earlier ones with the same name.
     */
    public Map<String,Object> toRow()
    {
        var row = new LinkedHashMap<String,Object>();
        row.put(JOB_ID_COLUMN, _index);
        row.putAll(_metadata);
        row.put(STATUS_COLUMN, _status.getLabel());
        row.putAll(_fields);
        if (_stdoutData != null) row.put(STDOUT_DATA_COLUMN, _stdoutData);
        return row;
    }
    
    @Override
    public boolean equals(Object o)
    {
        if (this == o) return true;
        if (!(o instanceof JobResult)) return false;
        var that = (JobResult) o;
        return _index.equals(that._index) && _metadata.equals(that._metadata) &&
               _status == that._status && _fields.equals(that._fields) &&
               Objects.equals(_stdoutData, that._stdoutData);
    }
    
    @Override
    public int hashCode() {return Objects.hash(_index, _metadata, _status, _fields, _stdoutData);}
    
    @Override
    public String toString() {return toRow().toString();}

    /* ********************************************************************** */
    /*                               Accessors                                */
    /* ********************************************************************** */
    public String getIndex() {return _index;}
    public Map<String,Object> getMetadata() {return _metadata;}
    public JobStatusType getStatus() {return _status;}
    public Map<String,Object> getFields() {return _fields;}
    public String getStdoutData() {return _stdoutData;}
}
