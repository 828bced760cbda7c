package org.sequent.base.util.config;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Map.Entry;
import java.util.Properties;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Class giving access to machine-specific configuration.
 *
 * Properties are read from the file named by the <code>sequent.cfg</code> system property if it is set, and otherwise
 * from <code>data/cfg/&lt;computer name&gt;.properties</code>.  Anything not configured takes its default.
 */
public class ProverConfiguration
{
  private static final Logger LOGGER = LogManager.getLogger();

  /**
   * System property naming an explicit configuration file.
   */
  public static final String CONFIG_FILE_PROPERTY = "sequent.cfg";

  /**
   * Available configuration items.
   */
  public static enum CfgItem
  {
    /**
     * Deepest rule application allowed in a proof search.  -1 for no limit.
     */
    MAX_SEARCH_DEPTH(-1),

    /**
     * Whether to search the two premises of branching rules concurrently.
     */
    PARALLEL_SEARCH(false),

    /**
     * The number of threads for parallel search.  By default, one per available CPU.
     */
    SEARCH_THREADS(-1),

    /**
     * Output format for proofs: "latex" or "text".
     */
    RENDER_FORMAT("latex");

    /**
     * Default value, as a string.
     */
    public final String mDefault;

    private CfgItem(String xiDefault)
    {
      mDefault = xiDefault;
    }

    private CfgItem(int xiDefault)
    {
      mDefault = "" + xiDefault;
    }

    private CfgItem(boolean xiDefault)
    {
      mDefault = xiDefault ? "true" : "false";
    }
  }

  private static final Properties MACHINE_PROPERTIES = new Properties();
  static
  {
    String lFileName = System.getProperty(CONFIG_FILE_PROPERTY);

    if (lFileName == null)
    {
      // Computer is identified by the COMPUTERNAME environment variable (Windows) or HOSTNAME (Linux).
      String lComputerName = System.getenv("COMPUTERNAME");
      if (lComputerName == null)
      {
        lComputerName = System.getenv("HOSTNAME");
      }

      if (lComputerName != null)
      {
        lFileName = "data/cfg/" + lComputerName + ".properties";
      }
      else
      {
        LOGGER.debug("Failed to identify computer name - no environment variable COMPUTERNAME or HOSTNAME");
      }
    }

    if (lFileName != null)
    {
      try (InputStream lPropStream = new FileInputStream(lFileName))
      {
        MACHINE_PROPERTIES.load(lPropStream);
      }
      catch (IOException lEx)
      {
        LOGGER.debug("No machine-specific configuration in " + lFileName + " (" + lEx.getMessage() + ")");
      }
    }
  }

  private ProverConfiguration()
  {
  }

  /**
   * @return the specified String configuration value, or the default if not configured.
   *
   * @param xiKey - the item.
   */
  public static String getCfgStr(CfgItem xiKey)
  {
    return (MACHINE_PROPERTIES.getProperty(xiKey.toString(), xiKey.mDefault));
  }

  /**
   * @return the specified integer configuration value, or the default if not configured or malformed.
   *
   * @param xiKey - the item.
   */
  public static int getCfgInt(CfgItem xiKey)
  {
    String lValue = getCfgStr(xiKey);
    try
    {
      return Integer.parseInt(lValue.trim());
    }
    catch (NumberFormatException lEx)
    {
      LOGGER.warn("Invalid integer '" + lValue + "' for " + xiKey + ", using default " + xiKey.mDefault);
      return Integer.parseInt(xiKey.mDefault);
    }
  }

  /**
   * @return the specified boolean configuration value, or the default if not configured.
   *
   * @param xiKey - the item.
   */
  public static boolean getCfgBool(CfgItem xiKey)
  {
    return Boolean.parseBoolean(getCfgStr(xiKey).trim());
  }

  /**
   * Log all machine-specific configuration.
   */
  public static void logConfig()
  {
    LOGGER.info("Running with machine-specific properties:");
    for (Entry<Object, Object> e : MACHINE_PROPERTIES.entrySet())
    {
      String lKey = (String)e.getKey();

      // Check that this is a known configuration parameter (and not a typo in the config file).
      try
      {
        CfgItem lItem = CfgItem.valueOf(lKey);
        LOGGER.info("\t" + lKey + " = " + e.getValue() + " (default: " + lItem.mDefault + ")");
      }
      catch (IllegalArgumentException lEx)
      {
        LOGGER.warn("Unknown configuration parameter: '" + lKey + "'");
      }
    }
  }

  /**
   * UT-only method for overriding configuration.
   *
   * @param xiKey - the property to override.
   * @param xiValue - the new value.
   */
  public static void utOverrideCfgVal(CfgItem xiKey, String xiValue)
  {
    MACHINE_PROPERTIES.setProperty(xiKey.toString(), xiValue);
  }

  /**
   * UT-only method for returning an item to its default.
   *
   * @param xiKey - the property to reset.
   */
  public static void utResetCfgVal(CfgItem xiKey)
  {
    MACHINE_PROPERTIES.remove(xiKey.toString());
  }
}
