package ca.utoronto.kimlab.jobsubmitter.submit;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.apache.commons.lang3.concurrent.BasicThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ca.utoronto.kimlab.jobsubmitter.config.RuntimeParameters;
import ca.utoronto.kimlab.jobsubmitter.exceptions.DuplicateJobIndexException;
import ca.utoronto.kimlab.jobsubmitter.exceptions.JobSubmitterException;
import ca.utoronto.kimlab.jobsubmitter.i18n.MsgUtils;
import ca.utoronto.kimlab.jobsubmitter.model.JobRecord;
import ca.utoronto.kimlab.jobsubmitter.model.SubmitOutcome;
import ca.utoronto.kimlab.jobsubmitter.utils.Sleeper;

/** Fans a job table out over a fixed pool of worker threads.
 * 
 * Jobs are dispatched in table order from the calling thread, which also
 * waits whenever admission control finds the scheduler queue too full.  The
 * pool is shut down without waiting once everything is dispatched, so the 
 * returned futures complete in any order after submit returns.  A job that
 * fails only fails its own future.
 * 
 * Submission is at-least-once: a retried remote submission may reach the
 * scheduler twice.
 */
public final class SubmissionOrchestrator 
{
    /* ********************************************************************** */
    /*                               Constants                                */
    /* ********************************************************************** */
    // Tracing.
    private static final Logger _log = LoggerFactory.getLogger(SubmissionOrchestrator.class);
    
    // Worker thread names.
    private static final String THREAD_NAME_PATTERN = "jobsubmitter-worker-%d";
    
    /* ********************************************************************** */
    /*                                 Fields                                 */
    /* ********************************************************************** */
    private final JobWorker       _worker;
    private final ThrottlePolicy  _policy;
    private final QueueDepthProbe _probe;
    private final int             _poolSize;
    private final Sleeper         _sleeper;

    /* ********************************************************************** */
    /*                              Constructors                              */
    /* ********************************************************************** */
    /* ---------------------------------------------------------------------- */
    /* constructor:                                                           */
    /* ---------------------------------------------------------------------- */
    public SubmissionOrchestrator(JobWorker worker, ThrottlePolicy policy, QueueDepthProbe probe)
    {
        this(worker, policy, probe, RuntimeParameters.getInstance().getPoolSize(), Sleeper.THREAD);
    }
    
    /* ---------------------------------------------------------------------- */
    /* constructor:                                                           */
    /* ---------------------------------------------------------------------- */
    /** 
     * @param worker runs or submits single jobs
     * @param policy pacing and admission control
     * @param probe reports the queue depth, may be null when the policy has no ceiling
     * @param poolSize number of worker threads
     * @param sleeper used for every wait on the dispatching thread
     */
    public SubmissionOrchestrator(JobWorker worker, ThrottlePolicy policy, QueueDepthProbe probe,
                                  int poolSize, Sleeper sleeper)
    {
        if (poolSize < 1) throw new IllegalArgumentException("poolSize must be at least 1");
        if (policy.isAdmissionControlled() && probe == null)
            throw new IllegalArgumentException("a queue depth probe is required when a ceiling is set");
        _worker = worker;
        _policy = policy;
        _probe = probe;
        _poolSize = poolSize;
        _sleeper = sleeper;
    }

    /* ********************************************************************** */
    /*                             Public Methods                             */
    /* ********************************************************************** */
    /* ---------------------------------------------------------------------- */
    /* submit:                                                                */
    /* ---------------------------------------------------------------------- */
    /** Dispatch every job of the table.
     * 
     * @param jobs the job table in dispatch order
     * @return one submission per job, in table order
     * @throws DuplicateJobIndexException if two jobs share an index, nothing is dispatched
     * @throws JobSubmitterException if the log directory cannot be created or
     *         the queue depth cannot be read; jobs already dispatched keep running
     */
    public List<JobSubmission> submit(List<JobRecord> jobs) throws JobSubmitterException
    {
        checkDuplicates(jobs);
        
        // Find the jobs that cannot be expressed before touching anything.
        var rejected = new HashMap<String,JobSubmitterException>();
        for (var job : jobs) {
            try {_worker.validate(job);}
            catch (JobSubmitterException e) {
                _log.error(MsgUtils.getMsg("JOBSUB_SUBMIT_INVALID", job.getIndex(), e.getMessage()));
                rejected.put(job.getIndex(), e);
            }
        }
        if (rejected.size() < jobs.size()) _worker.prepare();
        
        _log.info(MsgUtils.getMsg("JOBSUB_SUBMIT_START", jobs.size(), _worker.getTargetName(), _poolSize));
        
        var submissions = new ArrayList<JobSubmission>(jobs.size());
        ExecutorService executor = Executors.newFixedThreadPool(_poolSize, 
            new BasicThreadFactory.Builder().namingPattern(THREAD_NAME_PATTERN).build());
        int dispatched = 0;
        try {
            int position = 0;
            for (var job : jobs) 
            {
                position++;
                
                var error = rejected.get(job.getIndex());
                if (error != null) {
                    var failed = new CompletableFuture<SubmitOutcome>();
                    failed.completeExceptionally(error);
                    submissions.add(new JobSubmission(job.getIndex(), failed));
                    continue;
                }
                
                if (_policy.isCheckpoint(position)) awaitHeadroom();
                if (dispatched > 0) pause(_policy.getDispatchDelayMillis(), "pacing dispatches");
                
                if (_log.isDebugEnabled())
                    _log.debug(MsgUtils.getMsg("JOBSUB_SUBMIT_JOB", job.getIndex(), position, 
                                               job.getSystemCommand()));
                var future = executor.submit(() -> runJob(job));
                submissions.add(new JobSubmission(job.getIndex(), future));
                dispatched++;
            }
        }
        finally {
            // Running jobs finish on their own.
            executor.shutdown();
        }
        
        _log.info(MsgUtils.getMsg("JOBSUB_SUBMIT_DONE", dispatched, jobs.size(), _worker.getTargetName()));
        return submissions;
    }

    /* ********************************************************************** */
    /*                            Private Methods                             */
    /* ********************************************************************** */
    /* ---------------------------------------------------------------------- */
    /* checkDuplicates:                                                       */
    /* ---------------------------------------------------------------------- */
    private void checkDuplicates(List<JobRecord> jobs) throws DuplicateJobIndexException
    {
        var seen = new HashSet<String>(jobs.size() * 2);
        for (var job : jobs) 
            if (!seen.add(job.getIndex())) {
                String msg = MsgUtils.getMsg("JOBSUB_DUPLICATE_INDEX", job.getIndex());
                _log.error(msg);
                throw new DuplicateJobIndexException(msg, job.getIndex());
            }
    }
    
    /* ---------------------------------------------------------------------- */
    /* awaitHeadroom:                                                         */
    /* ---------------------------------------------------------------------- */
    /** Block until the queue can take another step of jobs. */
    private void awaitHeadroom() throws JobSubmitterException
    {
        int submitted;
        while (_policy.mustWait(submitted = _probe.submittedJobs())) {
            _log.info(MsgUtils.getMsg("JOBSUB_THROTTLE_WAIT", _policy.getCeiling(), submitted, 
                                      _policy.getSleepMillis() / 1000));
            pause(_policy.getSleepMillis(), "waiting for queue headroom");
        }
    }
    
    /* ---------------------------------------------------------------------- */
    /* runJob:                                                                */
    /* ---------------------------------------------------------------------- */
    private SubmitOutcome runJob(JobRecord job) throws JobSubmitterException
    {
        try {return _worker.run(job);}
        catch (JobSubmitterException e) {
            _log.error(MsgUtils.getMsg("JOBSUB_JOB_FAILED", job.getIndex(), e.getMessage()));
            throw e;
        }
    }
    
    /* ---------------------------------------------------------------------- */
    /* pause:                                                                 */
    /* ---------------------------------------------------------------------- */
    private void pause(long millis, String activity) throws JobSubmitterException
    {
        if (millis <= 0) return;
        try {_sleeper.sleep(millis);}
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            String msg = MsgUtils.getMsg("JOBSUB_INTERRUPTED", activity);
            _log.warn(msg);
            throw new JobSubmitterException(msg, e);
        }
    }
}
