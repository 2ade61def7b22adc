package ca.utoronto.kimlab.jobsubmitter.model;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.testng.Assert;
import org.testng.annotations.Test;

@Test(groups={"unit"})
public class JobOptsTest 
{
    @Test
    public void defaults()
    {
        var opts = JobOpts.builder("j").build();
        Assert.assertEquals(opts.getNproc(), 1);
        Assert.assertEquals(opts.getWalltime(), "02:00:00");
        Assert.assertEquals(opts.getShell(), "/bin/bash");
        Assert.assertNull(opts.getMem());
        Assert.assertNull(opts.getGpus());
        Assert.assertFalse(opts.hasGpus());
        Assert.assertTrue(opts.getEnv().isEmpty());
    }
    
    @Test
    public void toBuilderCopies()
    {
        var opts = JobOpts.builder("j")
                          .workingDir("/w").mem("4G").gpus(2).arrayJobs("1-5%1")
                          .env("A", "1").env("B", "2")
                          .build();
        var copy = opts.toBuilder().workingDir("/remote/w").env("C", "3").build();
        
        Assert.assertEquals(copy.getWorkingDir(), "/remote/w");
        Assert.assertEquals(copy.getMem(), "4G");
        Assert.assertEquals(copy.getGpus(), Integer.valueOf(2));
        Assert.assertEquals(copy.getArrayJobs(), "1-5%1");
        Assert.assertEquals(List.copyOf(copy.getEnv().keySet()), List.of("A", "B", "C"));
        
        // The source instance is unchanged.
        Assert.assertEquals(opts.getWorkingDir(), "/w");
        Assert.assertEquals(opts.getEnv(), Map.of("A", "1", "B", "2"));
        Assert.assertThrows(UnsupportedOperationException.class, () -> opts.getEnv().put("D", "4"));
    }
    
    @Test
    public void nullEnvironmentValuesRejected()
    {
        var builder = JobOpts.builder("j");
        Assert.assertThrows(IllegalArgumentException.class, () -> builder.env("A", null));
        Assert.assertThrows(IllegalArgumentException.class, () -> builder.env(null, "1"));
        
        var vars = new HashMap<String,String>();
        vars.put("B", null);
        Assert.assertThrows(IllegalArgumentException.class, () -> builder.env(vars));
        Assert.assertTrue(builder.build().getEnv().isEmpty());
    }
    
    @Test
    public void blankJobIdRejected()
    {
        Assert.assertThrows(IllegalArgumentException.class, () -> JobOpts.builder(" "));
    }
}
