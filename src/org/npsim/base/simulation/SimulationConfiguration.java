package org.npsim.base.simulation;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Map.Entry;
import java.util.Properties;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Class giving access to simulation configuration.
 *
 * Values come from the classpath resource npsim.properties, overridden by the properties file named by the system
 * property npsim.config.  Both are optional.
 */
public class SimulationConfiguration
{
  private static final Logger LOGGER = LogManager.getLogger();

  /**
   * Name of the classpath resource holding the default configuration.
   */
  public static final String RESOURCE_NAME = "npsim.properties";

  /**
   * System property naming an additional configuration file.
   */
  public static final String CONFIG_PROPERTY = "npsim.config";

  /**
   * Available configuration items.
   */
  public static enum CfgItem
  {
    /**
     * Limit on worklist iterations of one feasible graph computation.  Negative for no limit.
     */
    MAX_FEASIBLE_ITERATIONS(-1),

    /**
     * Limit on walk/prune iterations of one walk verification.  Negative for no limit.
     */
    MAX_VERIFIER_ITERATIONS(-1),

    /**
     * Limit on the length of a single computation walk.  Negative for no limit.
     */
    MAX_WALK_LENGTH(-1),

    /**
     * Whether to log the run statistics at the end of a simulation.
     */
    LOG_STATISTICS(true),

    /**
     * Number of instance characters shown when logging a rejected tape.
     */
    TAPE_LOG_LENGTH(40);

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

  private static final Properties PROPERTIES = new Properties();
  static
  {
    load();
  }

  private static void load()
  {
    try (InputStream lPropStream = SimulationConfiguration.class.getClassLoader().getResourceAsStream(RESOURCE_NAME))
    {
      if (lPropStream != null)
      {
        PROPERTIES.load(lPropStream);
      }
    }
    catch (IOException lEx)
    {
      System.err.println("Invalid configuration resource " + RESOURCE_NAME + ": " + lEx.getMessage());
    }

    String lFileName = System.getProperty(CONFIG_PROPERTY);
    if (lFileName != null)
    {
      try (InputStream lPropStream = new FileInputStream(lFileName))
      {
        PROPERTIES.load(lPropStream);
      }
      catch (IOException lEx)
      {
        System.err.println("Missing/invalid configuration file " + lFileName);
      }
    }
  }

  /**
   * @return the specified String configuration value, or the default if not configured.
   *
   * @param xiKey - the item.
   */
  public static String getCfgStr(CfgItem xiKey)
  {
    return (PROPERTIES.getProperty(xiKey.toString(), xiKey.mDefault));
  }

  /**
   * @return the specified integer configuration value, or the default if not configured.
   *
   * @param xiKey - the item.
   */
  public static int getCfgInt(CfgItem xiKey)
  {
    return Integer.parseInt(getCfgStr(xiKey).trim());
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
   * Log all configuration that differs from the defaults.
   */
  public static void logConfig()
  {
    LOGGER.info("Running with simulation properties:");
    for (Entry<Object, Object> e : PROPERTIES.entrySet())
    {
      // Get the key.
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
  public static void utOverrideCfgVal(CfgItem xiKey, boolean xiValue)
  {
    PROPERTIES.setProperty(xiKey.toString(), xiValue ? "true" : "false");
  }

  /**
   * UT-only method for overriding configuration.
   *
   * @param xiKey - the property to override.
   * @param xiValue - the new value.
   */
  public static void utOverrideCfgVal(CfgItem xiKey, int xiValue)
  {
    PROPERTIES.setProperty(xiKey.toString(), "" + xiValue);
  }

  /**
   * UT-only method for discarding overrides and re-reading the configuration sources.
   */
  public static void utResetCfg()
  {
    PROPERTIES.clear();
    load();
  }
}
