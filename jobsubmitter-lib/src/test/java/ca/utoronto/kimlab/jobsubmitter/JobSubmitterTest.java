package ca.utoronto.kimlab.jobsubmitter;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

import org.apache.commons.io.FileUtils;
import org.testng.Assert;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import ca.utoronto.kimlab.jobsubmitter.exceptions.InvalidCommandException;
import ca.utoronto.kimlab.jobsubmitter.exceptions.RemoteExecutionException;
import ca.utoronto.kimlab.jobsubmitter.model.ClusterTarget;
import ca.utoronto.kimlab.jobsubmitter.model.JobOpts;
import ca.utoronto.kimlab.jobsubmitter.model.JobRecord;
import ca.utoronto.kimlab.jobsubmitter.model.enumerations.JobStatusType;
import ca.utoronto.kimlab.jobsubmitter.model.enumerations.SchedulerType;
import ca.utoronto.kimlab.jobsubmitter.submit.JobSubmission;

@Test(groups={"unit"})
public class JobSubmitterTest 
{
    // Local working directory of each test.
    private Path _workDir;
    
    // Waits requested by the submitter, never performed.
    private List<Long> _sleeps;
    
    @BeforeMethod
    public void beforeMethod() throws IOException
    {
        _workDir = Files.createTempDirectory("jobsubmitter");
        _sleeps = Collections.synchronizedList(new ArrayList<>());
    }
    
    @AfterMethod
    public void afterMethod() throws IOException
    {
        FileUtils.deleteDirectory(_workDir.toFile());
    }
    
    /* ---------------------------------------------------------------------- */
    /* localHelloWorld:                                                       */
    /* ---------------------------------------------------------------------- */
    @Test
    public void localHelloWorld() throws Exception
    {
        var opts = JobOpts.builder("hello").workingDir(_workDir.toString()).build();
        var jobs = List.of(new JobRecord(0, "echo 'hello world'"));
        
        try (var js = newLocalSubmitter()) {
            var submissions = js.submit(jobs, opts);
            Assert.assertEquals(submissions.get(0).await().getExitCode(), Integer.valueOf(0));
            
            var result = js.jobStatus(jobs, opts).get(0);
            Assert.assertEquals(result.getStatus(), JobStatusType.DONE);
            Assert.assertEquals(result.getStdoutData(), "hello world");
        }
        Assert.assertTrue(Files.isRegularFile(_workDir.resolve("hello").resolve("0.out")));
    }
    
    /* ---------------------------------------------------------------------- */
    /* localBatch:                                                            */
    /* ---------------------------------------------------------------------- */
    @Test
    public void localBatch() throws Exception
    {
        var opts = JobOpts.builder("batch")
                          .workingDir(_workDir.toString())
                          .env("GREETING", "bonjour")
                          .build();
        var jobs = List.of(new JobRecord("json", "echo '{\"a\": 1, \"b\": \"two\"}'"),
                           new JobRecord("fail", "echo oops >&2; exit 3"),
                           new JobRecord("env", "echo $GREETING $STDOUT_LOG"),
                           new JobRecord("comma", "echo 1,2"));
        
        try (var js = newLocalSubmitter()) {
            var submissions = js.submit(jobs, opts);
            Assert.assertEquals(submissions.get(1).await().getExitCode(), Integer.valueOf(3));
            awaitAll(submissions);
            
            var results = js.jobStatus(jobs, opts);
            Assert.assertEquals(results.get(0).getStatus(), JobStatusType.DONE);
            Assert.assertEquals(results.get(0).getFields().get("a"), Long.valueOf(1));
            Assert.assertEquals(results.get(0).getFields().get("b"), "two");
            
            Assert.assertEquals(results.get(1).getStatus(), JobStatusType.ERROR);
            
            var logDir = _workDir.resolve("batch").toAbsolutePath();
            Assert.assertEquals(results.get(2).getStdoutData(), "bonjour " + logDir.resolve("env.out"));
            
            // Local runs have no comma restriction.
            Assert.assertEquals(results.get(3).getStdoutData(), "1,2");
        }
        
        var errLog = FileUtils.readFileToString(_workDir.resolve("batch").resolve("fail.err").toFile(), "UTF-8");
        Assert.assertEquals(errLog, "oops\nERROR!\n");
    }
    
    /* ---------------------------------------------------------------------- */
    /* localTargetHasNoQueue:                                                 */
    /* ---------------------------------------------------------------------- */
    @Test
    public void localTargetHasNoQueue() throws Exception
    {
        try (var js = newLocalSubmitter()) {
            Assert.assertFalse(js.numSubmittedJobs().isPresent());
            Assert.assertFalse(js.numRunningJobs().isPresent());
            Assert.assertNull(js.getChannel());
        }
    }
    
    /* ---------------------------------------------------------------------- */
    /* commaFailsBeforeAnyRemoteCall:                                         */
    /* ---------------------------------------------------------------------- */
    @Test
    public void commaFailsBeforeAnyRemoteCall() throws Exception
    {
        var channel = new RecordingChannel(cmd -> {throw new AssertionError("unexpected command " + cmd);});
        var target = ClusterTarget.parse("pbs://tester@head").build();
        var opts = JobOpts.builder("commas")
                          .workingDir("/home/tester/commas")
                          .wrapperScript("/home/tester/bin/jobwrapper.sh")
                          .build();
        var jobs = List.of(new JobRecord(0, "python -c 'print(1,2)'"));
        
        try (var js = new JobSubmitter(target, channel, _sleeps::add)) {
            var submissions = js.submit(jobs, opts);
            try {
                submissions.get(0).await();
                Assert.fail("Expected the job to be rejected");
            }
            catch (ExecutionException e) {
                Assert.assertTrue(e.getCause() instanceof InvalidCommandException, String.valueOf(e.getCause()));
            }
        }
        Assert.assertTrue(channel.getCommands().isEmpty(), channel.getCommands().toString());
    }
    
    /* ---------------------------------------------------------------------- */
    /* remoteSubmission:                                                      */
    /* ---------------------------------------------------------------------- */
    @Test
    public void remoteSubmission() throws Exception
    {
        var jobIds = new AtomicInteger(1000);
        var channel = new RecordingChannel(cmd -> {
            if (cmd.equals("echo \"$HOME\"")) return "/home/tester";
            if (cmd.equals("echo \"$SCRATCH\"")) return "/scratch/tester";
            if (cmd.startsWith("export PATH=")) return "/home/tester/anaconda/bin/jobwrapper.sh";
            if (cmd.startsWith("mkdir -p")) return "";
            if (cmd.startsWith("qsub")) return jobIds.incrementAndGet() + ".head";
            throw new AssertionError("unexpected command " + cmd);
        });
        var target = ClusterTarget.parse("pbs://tester@head")
                                  .remoteHome("$HOME")
                                  .remoteScratch("$SCRATCH")
                                  .build();
        var localWorkDir = Paths.get(System.getProperty("user.home"), "projects", "fold");
        var opts = JobOpts.builder("run1").workingDir(localWorkDir.toString()).build();
        var jobs = List.of(new JobRecord(0, "python fold.py --seed 0"), 
                           new JobRecord(1, "python fold.py --seed 1"));
        
        try (var js = new JobSubmitter(target, channel, _sleeps::add)) {
            var submissions = js.submit(jobs, opts);
            var replies = new ArrayList<String>();
            for (var s : submissions) replies.add(s.await().getRemoteOutput());
            Collections.sort(replies);
            Assert.assertEquals(replies, Arrays.asList("1001.head", "1002.head"));
            Assert.assertEquals(js.getRemoteScratch(), "/scratch/tester");
        }
        Assert.assertEquals(channel.getDisconnects(), 1);
        
        var commands = channel.getCommands();
        Assert.assertEquals(commands.get(0), "echo \"$HOME\"");
        Assert.assertEquals(commands.get(1), "echo \"$SCRATCH\"");
        Assert.assertEquals(commands.get(2), "export PATH=\"$HOME/anaconda/bin:$PATH\"; which jobwrapper.sh");
        Assert.assertEquals(commands.get(3), "mkdir -p \"/scratch/tester/projects/fold/run1\"");
        
        var qsubs = commands.subList(4, commands.size());
        Assert.assertEquals(qsubs.size(), 2);
        for (var qsub : qsubs) {
            Assert.assertTrue(qsub.contains(" -d /scratch/tester/projects/fold "), qsub);
            Assert.assertTrue(qsub.endsWith(" \"/home/tester/anaconda/bin/jobwrapper.sh\""), qsub);
        }
        Assert.assertTrue(String.join("\n", qsubs).contains(
            "STDOUT_LOG=\"/scratch/tester/projects/fold/run1/1.out\",STDERR_LOG=\"/scratch/tester/projects/fold/run1/1.err\""));
        
        // The caller's options are left alone.
        Assert.assertEquals(opts.getWorkingDir(), localWorkDir.toString());
        Assert.assertNull(opts.getWrapperScript());
    }
    
    /* ---------------------------------------------------------------------- */
    /* headNodeCommandsSeeJobEnvironment:                                     */
    /* ---------------------------------------------------------------------- */
    @Test
    public void headNodeCommandsSeeJobEnvironment() throws Exception
    {
        var channel = new RecordingChannel(cmd -> {
            if (cmd.startsWith("export PATH=")) return "/opt/sge/bin/jobwrapper.sh";
            if (cmd.startsWith("qsub")) return "77.head";
            return "";
        });
        var target = ClusterTarget.parse("sge://tester@head").build();
        var opts = JobOpts.builder("env")
                          .workingDir("/home/tester/env")
                          .env("PATH", "/opt/sge/bin:$PATH")
                          .env("OMP_NUM_THREADS", "4")
                          .build();
        
        try (var js = new JobSubmitter(target, channel, _sleeps::add)) {
            var submissions = js.submit(List.of(new JobRecord(0, "python run.py")), opts);
            Assert.assertEquals(submissions.get(0).await().getRemoteOutput(), "77.head");
        }
        
        var commands = channel.getCommands();
        var environments = channel.getEnvironments();
        Assert.assertEquals(commands.size(), 3, commands.toString());
        Assert.assertEquals(commands.get(0), "export PATH=\"/opt/sge/bin:$PATH\"; which jobwrapper.sh");
        Assert.assertTrue(commands.get(1).startsWith("mkdir -p"), commands.get(1));
        Assert.assertTrue(commands.get(2).startsWith("qsub"), commands.get(2));
        for (var env : environments) 
            Assert.assertEquals(env, Map.of("PATH", "/opt/sge/bin:$PATH", "OMP_NUM_THREADS", "4"));
    }
    
    /* ---------------------------------------------------------------------- */
    /* sessionValuesResolvedOnce:                                             */
    /* ---------------------------------------------------------------------- */
    @Test
    public void sessionValuesResolvedOnce() throws Exception
    {
        var channel = new RecordingChannel(cmd -> {
            if (cmd.startsWith("echo")) return "/home/tester";
            if (cmd.startsWith("export PATH=")) return "/opt/bin/jobwrapper.sh";
            return "";
        });
        var target = ClusterTarget.parse("sge://head").remoteHome("$HOME").build();
        var opts = JobOpts.builder("twice").workingDir(System.getProperty("user.home")).env("PATH", "/opt/bin").build();
        
        try (var js = new JobSubmitter(target, channel, _sleeps::add)) {
            var first = js.getEffectiveOptions(opts);
            var second = js.getEffectiveOptions(opts);
            Assert.assertEquals(first.getWorkingDir(), "/home/tester");
            Assert.assertEquals(second.getWrapperScript(), "/opt/bin/jobwrapper.sh");
        }
        
        // Remote scratch defaults to remote home and is resolved with it.
        var commands = channel.getCommands();
        Assert.assertEquals(commands, Arrays.asList("echo \"$HOME\"", "echo \"$HOME\"", 
                                                    "export PATH=\"/opt/bin\"; which jobwrapper.sh"));
        Assert.assertEquals(channel.getConnects(), 1);
    }
    
    /* ---------------------------------------------------------------------- */
    /* queueCounts:                                                           */
    /* ---------------------------------------------------------------------- */
    @Test
    public void queueCounts() throws Exception
    {
        var channel = new RecordingChannel(cmd -> cmd.contains(" r  ") ? "3" : "42");
        var target = ClusterTarget.parse("pbs://tester@head").build();
        
        try (var js = new JobSubmitter(target, channel, _sleeps::add)) {
            Assert.assertEquals(js.numSubmittedJobs().getAsInt(), 42);
            Assert.assertEquals(js.numRunningJobs().getAsInt(), 3);
        }
        Assert.assertEquals(channel.getCommands(), Arrays.asList(
            "qstat -u \"$USER\" | grep \"$USER\" | wc -l",
            "qstat -u \"$USER\" | grep \"$USER\" | grep -i \" r  \" | wc -l"));
    }
    
    /* ---------------------------------------------------------------------- */
    /* pollerRetriesGarbage:                                                  */
    /* ---------------------------------------------------------------------- */
    @Test
    public void pollerRetriesGarbage() throws Exception
    {
        var answers = new ArrayList<>(Arrays.asList("Last login: yesterday", "", "7"));
        var channel = new RecordingChannel(cmd -> answers.remove(0));
        var target = ClusterTarget.parse("slurm://tester@head").build();
        
        try (var js = new JobSubmitter(target, channel, _sleeps::add)) {
            Assert.assertEquals(js.numSubmittedJobs().getAsInt(), 7);
        }
        Assert.assertEquals(_sleeps, Arrays.asList(1000L, 2000L));
    }
    
    /* ---------------------------------------------------------------------- */
    /* pollerGivesUp:                                                         */
    /* ---------------------------------------------------------------------- */
    @Test
    public void pollerGivesUp() throws Exception
    {
        var channel = new RecordingChannel(cmd -> {
            throw new RemoteExecutionException("qstat failed", "qstat: cannot connect to server");
        });
        var target = ClusterTarget.parse("pbs://tester@head").build();
        
        try (var js = new JobSubmitter(target, channel, _sleeps::add)) {
            js.numRunningJobs();
            Assert.fail("Expected RemoteExecutionException");
        }
        catch (RemoteExecutionException e) {
            Assert.assertEquals(e.getStderr(), "qstat: cannot connect to server");
        }
        Assert.assertEquals(channel.getCommands().size(), 5);
        Assert.assertEquals(_sleeps, Arrays.asList(1000L, 2000L, 3000L, 4000L));
    }
    
    /* ---------------------------------------------------------------------- */
    /* remoteTargetRequiresChannel:                                           */
    /* ---------------------------------------------------------------------- */
    @Test
    public void remoteTargetRequiresChannel() throws Exception
    {
        var target = ClusterTarget.parse("slurm://head").build();
        Assert.assertThrows(IllegalArgumentException.class, () -> new JobSubmitter(target, null));
        Assert.assertEquals(ClusterTarget.parse("local").build().getSchedulerType(), SchedulerType.LOCAL);
    }
    
    /* ********************************************************************** */
    /*                            Private Methods                             */
    /* ********************************************************************** */
    private JobSubmitter newLocalSubmitter() throws Exception
    {
        return new JobSubmitter(ClusterTarget.parse("local").build(), null, _sleeps::add);
    }
    
    private static void awaitAll(List<JobSubmission> submissions) throws Exception
    {
        for (var s : submissions) s.await();
    }
}
