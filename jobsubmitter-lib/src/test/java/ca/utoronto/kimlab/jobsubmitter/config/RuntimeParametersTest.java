package ca.utoronto.kimlab.jobsubmitter.config;

import java.util.Properties;

import org.testng.Assert;
import org.testng.annotations.Test;

@Test(groups={"unit"})
public class RuntimeParametersTest 
{
    @Test
    public void defaultsWithoutProperties()
    {
        var parms = new RuntimeParameters(new Properties());
        Assert.assertEquals(parms.getDispatchDelayMillis(), 50);
        Assert.assertEquals(parms.getThrottleStep(), 50);
        Assert.assertEquals(parms.getThrottleSleepMillis(), 120000);
        Assert.assertEquals(parms.getRetryMaxAttempts(), 7);
        Assert.assertEquals(parms.getRetryBaseMillis(), 1000);
        Assert.assertEquals(parms.getRetryMaxMillis(), 60000);
        Assert.assertEquals(parms.getPollMaxAttempts(), 5);
        Assert.assertEquals(parms.getSshExecTimeoutMillis(), 0);
    }
    
    @Test
    public void explicitAndBadValues()
    {
        var props = new Properties();
        props.setProperty(RuntimeParameters.POOL_SIZE, " 8 ");
        props.setProperty(RuntimeParameters.THROTTLE_STEP, "fifty");
        var parms = new RuntimeParameters(props);
        Assert.assertEquals(parms.getPoolSize(), 8);
        Assert.assertEquals(parms.getThrottleStep(), 50);
    }
    
    @Test
    public void classpathFileLoads()
    {
        var parms = RuntimeParameters.getInstance();
        Assert.assertSame(RuntimeParameters.getInstance(), parms);
        Assert.assertEquals(parms.getPoolSize(), 32);
    }
}
