package ca.utoronto.kimlab.jobsubmitter.i18n;

import java.text.MessageFormat;
import java.util.Arrays;
import java.util.Locale;
import java.util.MissingResourceException;
import java.util.ResourceBundle;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Resolve message keys against the JobSubmitterMessages bundle and fill in
 * their positional parameters.  Every log line and exception message in the
 * library goes through this class so that all user-visible text lives in one
 * properties file.
 */
public final class MsgUtils 
{
    /* ********************************************************************** */
    /*                               Constants                                */
    /* ********************************************************************** */
    // Tracing.
    private static final Logger _log = LoggerFactory.getLogger(MsgUtils.class);
    
    // The base name of the message bundle on the classpath.
    public static final String MESSAGE_BUNDLE = "ca.utoronto.kimlab.jobsubmitter.i18n.JobSubmitterMessages";
    
    // The bundle is loaded once for the default locale.
    private static final ResourceBundle _bundle = 
        ResourceBundle.getBundle(MESSAGE_BUNDLE, Locale.getDefault());

    /* ********************************************************************** */
    /*                              Constructors                              */
    /* ********************************************************************** */
    private MsgUtils() {}
    
    /* ********************************************************************** */
    /*                             Public Methods                             */
    /* ********************************************************************** */
    /* ---------------------------------------------------------------------- */
    /* getMsg:                                                                */
    /* ---------------------------------------------------------------------- */
    /** Look up the message template for key and format it with parms.  An 
     * unknown key does not throw; the key and its parameters are returned 
     * instead so that the caller's original problem is still reported.
     * 
     * @param key the message key in the bundle
     * @param parms the positional parameters referenced by the template
     * @return the formatted message
     */
    public static String getMsg(String key, Object... parms)
    {
        String template;
        try {template = _bundle.getString(key);}
        catch (MissingResourceException e) {
            _log.error("Message key not found in " + MESSAGE_BUNDLE + ": " + key);
            return key + " " + Arrays.toString(parms);
        }
        
        if (parms == null || parms.length == 0) return template;
        return MessageFormat.format(template, parms);
    }
}
