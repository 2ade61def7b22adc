package ca.utoronto.kimlab.jobsubmitter.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.apache.commons.lang3.StringUtils;

/** Options shared by every job of a batch: identity, resource requests,
 * allocation, notification and environment.
 * 
 * Resource values (walltime, mem, ...) are opaque strings that only the
 * scheduler validates.  The array job expression uses the scheduler-native
 * range-with-limit form, for example "1-100%1" runs 100 tasks one at a time,
 * and is passed through unchanged.
 * 
 * Do not use a work email address for notifications: a large batch can
 * produce thousands of emails.
 * 
 * Instances are immutable; use toBuilder() to derive a modified copy.
 */
public final class JobOpts 
{
    /* ********************************************************************** */
    /*                               Constants                                */
    /* ********************************************************************** */
    public static final int    DEFAULT_NPROC    = 1;
    public static final String DEFAULT_WALLTIME = "02:00:00";
    public static final String DEFAULT_SHELL    = "/bin/bash";
    
    /* ********************************************************************** */
    /*                                 Fields                                 */
    /* ********************************************************************** */
    private final String  _jobId;
    private final String  _workingDir;
    
    // Resources.
    private final int     _nproc;          // processors per node
    private final String  _walltime;       // hh:mm:ss
    private final String  _mem;            // RAM per node
    private final String  _pmem;           // RAM per process
    private final String  _vmem;           // virtual memory per node
    private final String  _pvmem;          // virtual memory per process
    private final Integer _gpus;
    private final String  _arrayJobs;
    
    // Allocation.
    private final String  _account;
    private final String  _queue;
    private final String  _email;
    
    // Environment.
    private final Map<String,String> _env;
    private final String  _shell;
    private final String  _wrapperScript;

    /* ********************************************************************** */
    /*                              Constructors                              */
    /* ********************************************************************** */
    private JobOpts(Builder b)
    {
        _jobId         = b.jobId;
        _workingDir    = StringUtils.trimToNull(b.workingDir);
        _nproc         = b.nproc;
        _walltime      = b.walltime;
        _mem           = StringUtils.trimToNull(b.mem);
        _pmem          = StringUtils.trimToNull(b.pmem);
        _vmem          = StringUtils.trimToNull(b.vmem);
        _pvmem         = StringUtils.trimToNull(b.pvmem);
        _gpus          = b.gpus;
        _arrayJobs     = StringUtils.trimToNull(b.arrayJobs);
        _account       = StringUtils.trimToNull(b.account);
        _queue         = StringUtils.trimToNull(b.queue);
        _email         = StringUtils.trimToNull(b.email);
        _env           = Collections.unmodifiableMap(new LinkedHashMap<>(b.env));
        _shell         = b.shell;
        _wrapperScript = StringUtils.trimToNull(b.wrapperScript);
    }
    
    /* ********************************************************************** */
    /*                             Public Methods                             */
    /* ********************************************************************** */
    public static Builder builder(String jobId) {return new Builder(jobId);}
    
    /** A builder initialized with every value of this instance. */
    public Builder toBuilder()
    {
        var b = new Builder(_jobId);
        b.workingDir = _workingDir;
        b.nproc = _nproc;
        b.walltime = _walltime;
        b.mem = _mem;
        b.pmem = _pmem;
        b.vmem = _vmem;
        b.pvmem = _pvmem;
        b.gpus = _gpus;
        b.arrayJobs = _arrayJobs;
        b.account = _account;
        b.queue = _queue;
        b.email = _email;
        b.env.putAll(_env);
        b.shell = _shell;
        b.wrapperScript = _wrapperScript;
        return b;
    }
    
    /** True when a positive GPU count was requested. */
    public boolean hasGpus() {return _gpus != null && _gpus > 0;}

    /* ********************************************************************** */
    /*                               Accessors                                */
    /* ********************************************************************** */
    public String getJobId() {return _jobId;}
    public String getWorkingDir() {return _workingDir;}
    public int getNproc() {return _nproc;}
    public String getWalltime() {return _walltime;}
    public String getMem() {return _mem;}
    public String getPmem() {return _pmem;}
    public String getVmem() {return _vmem;}
    public String getPvmem() {return _pvmem;}
    public Integer getGpus() {return _gpus;}
    public String getArrayJobs() {return _arrayJobs;}
    public String getAccount() {return _account;}
    public String getQueue() {return _queue;}
    public String getEmail() {return _email;}
    public Map<String,String> getEnv() {return _env;}
    public String getShell() {return _shell;}
    public String getWrapperScript() {return _wrapperScript;}
    
    /* ********************************************************************** */
    /*                             Builder Class                              */
    /* ********************************************************************** */
    public static final class Builder
    {
        private final String jobId;
        private String  workingDir;
        private int     nproc = DEFAULT_NPROC;
        private String  walltime = DEFAULT_WALLTIME;
        private String  mem;
        private String  pmem;
        private String  vmem;
        private String  pvmem;
        private Integer gpus;
        private String  arrayJobs;
        private String  account;
        private String  queue;
        private String  email;
        private final LinkedHashMap<String,String> env = new LinkedHashMap<>();
        private String  shell = DEFAULT_SHELL;
        private String  wrapperScript;
        
        private Builder(String jobId) 
        {
            if (StringUtils.isBlank(jobId)) throw new IllegalArgumentException("jobId must not be blank");
            this.jobId = jobId;
        }
        
        public Builder workingDir(String workingDir) {this.workingDir = workingDir; return this;}
        public Builder nproc(int nproc) {this.nproc = nproc; return this;}
        public Builder walltime(String walltime) {this.walltime = walltime; return this;}
        public Builder mem(String mem) {this.mem = mem; return this;}
        public Builder pmem(String pmem) {this.pmem = pmem; return this;}
        public Builder vmem(String vmem) {this.vmem = vmem; return this;}
        public Builder pvmem(String pvmem) {this.pvmem = pvmem; return this;}
        public Builder gpus(Integer gpus) {this.gpus = gpus; return this;}
        public Builder arrayJobs(String arrayJobs) {this.arrayJobs = arrayJobs; return this;}
        public Builder account(String account) {this.account = account; return this;}
        public Builder queue(String queue) {this.queue = queue; return this;}
        public Builder email(String email) {this.email = email; return this;}
        
        /** Add one variable; neither the name nor the value may be null. */
        public Builder env(String key, String value) 
        {
            if (StringUtils.isBlank(key)) throw new IllegalArgumentException("environment variable name must not be blank");
            if (value == null) throw new IllegalArgumentException("environment variable " + key + " has a null value");
            env.put(key, value); 
            return this;
        }
        
        public Builder env(Map<String,String> vars) 
        {
            if (vars != null) for (var entry : vars.entrySet()) env(entry.getKey(), entry.getValue()); 
            return this;
        }
        
        public Builder shell(String shell) {this.shell = shell; return this;}
        public Builder wrapperScript(String wrapperScript) {this.wrapperScript = wrapperScript; return this;}
        
        public JobOpts build() 
        {
            if (StringUtils.isBlank(walltime)) walltime = DEFAULT_WALLTIME;
            if (StringUtils.isBlank(shell)) shell = DEFAULT_SHELL;
            return new JobOpts(this);
        }
    }
}
