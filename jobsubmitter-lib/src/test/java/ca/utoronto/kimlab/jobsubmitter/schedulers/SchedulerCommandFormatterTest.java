package ca.utoronto.kimlab.jobsubmitter.schedulers;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

import org.testng.Assert;
import org.testng.annotations.Test;

import ca.utoronto.kimlab.jobsubmitter.exceptions.InvalidCommandException;
import ca.utoronto.kimlab.jobsubmitter.model.JobOpts;
import ca.utoronto.kimlab.jobsubmitter.model.enumerations.SchedulerType;

@Test(groups={"unit"})
public class SchedulerCommandFormatterTest 
{
    // Matches key="value" pairs with backslash escapes inside the quotes.
    private static final Pattern _envPattern = Pattern.compile("([A-Za-z_][A-Za-z0-9_]*)=\"((?:[^\"\\\\]|\\\\.)*)\"");
    
    /* ---------------------------------------------------------------------- */
    /* sgeFullCommand:                                                        */
    /* ---------------------------------------------------------------------- */
    @Test
    public void sgeFullCommand() throws Exception
    {
        var opts = JobOpts.builder("myjob")
                          .workingDir("/scratch/u/work")
                          .nproc(2)
                          .walltime("01:00:00")
                          .mem("4G")
                          .vmem("8G")
                          .gpus(1)
                          .arrayJobs("1-100%5")
                          .queue("short")
                          .email("me@example.com")
                          .env("PATH", "/opt/bin:$PATH")
                          .wrapperScript("/home/u/bin/jobwrapper.sh")
                          .build();
        
        var cmd = format(SchedulerType.SGE, opts, overlay("python run.py --x 1", "/scratch/u/work/myjob", "0"));
        Assert.assertEquals(cmd, 
            "qsub -S /bin/bash -N myjob -o /dev/null -e /dev/null -wd /scratch/u/work -pe smp 2 " +
            "-l h_rt=01:00:00 -l mem_free=4G -l h_vmem=8G -l gpu=1 -t 1-100 -tc 5 -q short " +
            "-M me@example.com -ma -v PATH=\"/opt/bin:$PATH\" -v SYSTEM_COMMAND=\"python run.py --x 1\" " +
            "-v STDOUT_LOG=\"/scratch/u/work/myjob/0.out\" -v STDERR_LOG=\"/scratch/u/work/myjob/0.err\" " +
            "\"/home/u/bin/jobwrapper.sh\"");
    }
    
    /* ---------------------------------------------------------------------- */
    /* sgeArrayWithoutLimit:                                                  */
    /* ---------------------------------------------------------------------- */
    @Test
    public void sgeArrayWithoutLimit() throws Exception
    {
        var opts = minimal().toBuilder().arrayJobs("1-10").build();
        var cmd = format(SchedulerType.SGE, opts, overlay("echo hi", "/w/j", "0"));
        Assert.assertTrue(cmd.contains(" -t 1-10 "), cmd);
        Assert.assertFalse(cmd.contains("-tc"), cmd);
    }
    
    /* ---------------------------------------------------------------------- */
    /* pbsMinimalCommand:                                                     */
    /* ---------------------------------------------------------------------- */
    @Test
    public void pbsMinimalCommand() throws Exception
    {
        var cmd = format(SchedulerType.PBS, minimal(), overlay("echo hi", "/w/j", "0"));
        Assert.assertEquals(cmd, 
            "qsub -S /bin/bash -N j -o /dev/null -e /dev/null -d /w " +
            "-l nodes=1:ppn=1,walltime=02:00:00 " +
            "-v SYSTEM_COMMAND=\"echo hi\",STDOUT_LOG=\"/w/j/0.out\",STDERR_LOG=\"/w/j/0.err\" " +
            "\"/bin/jobwrapper.sh\"");
    }
    
    /* ---------------------------------------------------------------------- */
    /* pbsResourceList:                                                       */
    /* ---------------------------------------------------------------------- */
    @Test
    public void pbsResourceList() throws Exception
    {
        var opts = minimal().toBuilder()
                            .nproc(4).gpus(2)
                            .mem("4G").pmem("1G").vmem("8G").pvmem("2G")
                            .arrayJobs("1-10%2")
                            .account("acct").queue("batch")
                            .email("me@example.com")
                            .build();
        var cmd = format(SchedulerType.PBS, opts, overlay("echo hi", "/w/j", "0"));
        
        // Each memory value lands in its own resource and the list has no spaces.
        Assert.assertTrue(cmd.contains(
            " -l nodes=1:ppn=4:gpus=2,walltime=02:00:00,mem=4G,pmem=1G,vmem=8G,pvmem=2G " +
            "-t 1-10%2 -A acct -q batch -M me@example.com -ma -v "), cmd);
    }
    
    /* ---------------------------------------------------------------------- */
    /* slurmCommand:                                                          */
    /* ---------------------------------------------------------------------- */
    @Test
    public void slurmCommand() throws Exception
    {
        var cmd = format(SchedulerType.SLURM, minimal(), overlay("echo a,b", "/w/j", "7"));
        Assert.assertEquals(cmd, 
            "sbatch -o /dev/null -e /dev/null --job-name=j --workdir=/w --cpus-per-task=1 " +
            "--time=02:00:00 " +
            "--export=SYSTEM_COMMAND=\"echo a,b\",STDOUT_LOG=\"/w/j/7.out\",STDERR_LOG=\"/w/j/7.err\" " +
            "\"/bin/jobwrapper.sh\"");
    }
    
    /* ---------------------------------------------------------------------- */
    /* slurmOptionalClauses:                                                  */
    /* ---------------------------------------------------------------------- */
    @Test
    public void slurmOptionalClauses() throws Exception
    {
        var opts = minimal().toBuilder()
                            .mem("16G").gpus(1).arrayJobs("1-100%1")
                            .account("def-lab").queue("gpu")
                            .email("me@example.com")
                            .build();
        var cmd = format(SchedulerType.SLURM, opts, overlay("echo hi", "/w/j", "0"));
        Assert.assertTrue(cmd.contains(
            " --time=02:00:00 --mem=16G --gres=gpu:1 --array=1-100%1 --account=def-lab " +
            "--partition=gpu --mail-user=me@example.com --mail-type=FAIL --export="), cmd);
    }
    
    /* ---------------------------------------------------------------------- */
    /* unsetResourcesAreOmitted:                                              */
    /* ---------------------------------------------------------------------- */
    @Test
    public void unsetResourcesAreOmitted() throws Exception
    {
        var opts = minimal().toBuilder().gpus(0).build();
        for (var type : new SchedulerType[] {SchedulerType.SGE, SchedulerType.PBS, SchedulerType.SLURM}) {
            var cmd = format(type, opts, overlay("echo hi", "/w/j", "0"));
            Assert.assertFalse(cmd.contains("mem"), cmd);
            Assert.assertFalse(cmd.contains("gpu"), cmd);
            Assert.assertFalse(cmd.contains("-M "), cmd);
            Assert.assertFalse(cmd.contains("--mail"), cmd);
            Assert.assertFalse(cmd.contains("  "), "double space in " + cmd);
        }
    }
    
    /* ---------------------------------------------------------------------- */
    /* commaRejectedBySgeAndPbs:                                              */
    /* ---------------------------------------------------------------------- */
    @Test
    public void commaRejectedBySgeAndPbs() throws Exception
    {
        for (var type : new SchedulerType[] {SchedulerType.SGE, SchedulerType.PBS}) {
            try {
                format(type, minimal(), overlay("python -c 'print(1,2)'", "/w/j", "0"));
                Assert.fail("Expected InvalidCommandException for " + type);
            }
            catch (InvalidCommandException e) {
                Assert.assertTrue(e.getMessage().contains(type.name()), e.getMessage());
            }
        }
        
        // Slurm quotes each value so the comma survives.
        var cmd = format(SchedulerType.SLURM, minimal(), overlay("python -c 'print(1,2)'", "/w/j", "0"));
        Assert.assertTrue(cmd.contains("SYSTEM_COMMAND=\"python -c 'print(1,2)'\""), cmd);
    }
    
    /* ---------------------------------------------------------------------- */
    /* newlinesBecomeSpaces:                                                  */
    /* ---------------------------------------------------------------------- */
    @Test
    public void newlinesBecomeSpaces() throws Exception
    {
        for (var type : SchedulerType.values()) {
            var cmd = format(type, minimal(), overlay("echo a\necho b\r\necho c", "/w/j", "0"));
            Assert.assertFalse(cmd.contains("\n"), cmd);
            Assert.assertFalse(cmd.contains("\r"), cmd);
            Assert.assertTrue(cmd.contains("echo a echo b echo c"), cmd);
        }
    }
    
    /* ---------------------------------------------------------------------- */
    /* quotesAndBackslashesAreEscaped:                                        */
    /* ---------------------------------------------------------------------- */
    @Test
    public void quotesAndBackslashesAreEscaped() throws Exception
    {
        var cmd = format(SchedulerType.SLURM, minimal(), overlay("echo \"x\" \\ y", "/w/j", "0"));
        Assert.assertTrue(cmd.contains("SYSTEM_COMMAND=\"echo \\\"x\\\" \\\\ y\""), cmd);
    }
    
    /* ---------------------------------------------------------------------- */
    /* environmentRoundTrip:                                                  */
    /* ---------------------------------------------------------------------- */
    @Test
    public void environmentRoundTrip() throws Exception
    {
        var overlay = overlay("grep \"a b\" in.txt | sort -k2 > out\\ file", "/data/runs/j", "17");
        for (var type : new SchedulerType[] {SchedulerType.SGE, SchedulerType.PBS, SchedulerType.SLURM}) {
            var cmd = format(type, minimal(), overlay);
            Assert.assertEquals(parseEnv(cmd), overlay, type.name());
        }
    }
    
    /* ---------------------------------------------------------------------- */
    /* overlayWinsOverJobEnvironment:                                         */
    /* ---------------------------------------------------------------------- */
    @Test
    public void overlayWinsOverJobEnvironment() throws Exception
    {
        var opts = minimal().toBuilder()
                            .env("LANG", "C")
                            .env("SYSTEM_COMMAND", "stale")
                            .build();
        var cmd = format(SchedulerType.PBS, opts, overlay("echo new", "/w/j", "0"));
        Assert.assertTrue(cmd.contains("-v LANG=\"C\",SYSTEM_COMMAND=\"echo new\",STDOUT_LOG="), cmd);
        Assert.assertFalse(cmd.contains("stale"), cmd);
    }
    
    /* ---------------------------------------------------------------------- */
    /* localReturnsCommand:                                                   */
    /* ---------------------------------------------------------------------- */
    @Test
    public void localReturnsCommand() throws Exception
    {
        var opts = JobOpts.builder("j").build();
        var cmd = format(SchedulerType.LOCAL, opts, overlay("echo 'hello, world'", "/w/j", "0"));
        Assert.assertEquals(cmd, "echo 'hello, world'");
    }
    
    /* ---------------------------------------------------------------------- */
    /* missingWrapperOrCommandIsRejected:                                     */
    /* ---------------------------------------------------------------------- */
    @Test
    public void missingWrapperOrCommandIsRejected() throws Exception
    {
        var noWrapper = JobOpts.builder("j").workingDir("/w").build();
        Assert.assertThrows(InvalidCommandException.class, 
            () -> format(SchedulerType.SLURM, noWrapper, overlay("echo hi", "/w/j", "0")));
        Assert.assertThrows(InvalidCommandException.class, 
            () -> format(SchedulerType.PBS, minimal(), overlay("  ", "/w/j", "0")));
        Assert.assertThrows(InvalidCommandException.class, 
            () -> format(SchedulerType.LOCAL, minimal(), new LinkedHashMap<>()));
    }
    
    /* ---------------------------------------------------------------------- */
    /* factoryReturnsMatchingFormatter:                                       */
    /* ---------------------------------------------------------------------- */
    @Test
    public void factoryReturnsMatchingFormatter()
    {
        for (var type : SchedulerType.values())
            Assert.assertEquals(SchedulerFormatterFactory.getInstance(type).getSchedulerType(), type);
    }
    
    /* ********************************************************************** */
    /*                            Private Methods                             */
    /* ********************************************************************** */
    private static JobOpts minimal()
    {
        return JobOpts.builder("j").workingDir("/w").wrapperScript("/bin/jobwrapper.sh").build();
    }
    
    private static Map<String,String> overlay(String cmd, String logDir, String index)
    {
        var overlay = new LinkedHashMap<String,String>();
        overlay.put(SchedulerCommandFormatter.SYSTEM_COMMAND, cmd);
        overlay.put(SchedulerCommandFormatter.STDOUT_LOG, logDir + "/" + index + ".out");
        overlay.put(SchedulerCommandFormatter.STDERR_LOG, logDir + "/" + index + ".err");
        return overlay;
    }
    
    private static String format(SchedulerType type, JobOpts opts, Map<String,String> overlay) 
     throws InvalidCommandException
    {
        return SchedulerFormatterFactory.getInstance(type).formatSubmitCommand(opts, overlay);
    }
    
    /** Recover the key="value" pairs of a formatted command. */
    private static Map<String,String> parseEnv(String cmd)
    {
        var env = new LinkedHashMap<String,String>();
        var m = _envPattern.matcher(cmd);
        while (m.find()) env.put(m.group(1), m.group(2).replaceAll("\\\\(.)", "$1"));
        return env;
    }
}
