package org.mcts.base.util.configuration;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Map.Entry;
import java.util.Properties;
import java.util.concurrent.atomic.AtomicBoolean;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Class giving access to engine-wide default configuration.
 *
 * Defaults come from the enum below, overridden by the classpath resource {@value #RESOURCE_NAME}, overridden in
 * turn by the file named in the system property {@value #FILE_PROPERTY} (if set).
 */
public class EngineConfiguration
{
  private static final Logger LOGGER = LogManager.getLogger();

  /**
   * Name of the classpath resource holding configuration.
   */
  public static final String RESOURCE_NAME = "mcts-engine.properties";

  /**
   * System property naming an additional configuration file.
   */
  public static final String FILE_PROPERTY = "mcts.config";

  /**
   * Available configuration items.
   */
  public static enum CfgItem
  {
    /**
     * UCT exploration constant.
     */
    EXPLORATION_CONSTANT(Math.sqrt(2)),

    /**
     * Maximum number of iterations per search, always enforced (so 0 means no iterations).  -1 for no iteration
     * limit.  Unless the limit is positive, MAX_DURATION_MS must be set.
     */
    MAX_ITERATIONS(1000),

    /**
     * Maximum wall-clock time per search, in milliseconds.  Negative for no time limit.
     */
    MAX_DURATION_MS(-1),

    /**
     * Number of simulations to run from each newly expanded node.
     */
    SIMULATIONS_PER_ITERATION(1),

    /**
     * Seed for the search's random number generator.  Empty for an unseeded generator.
     */
    RANDOM_SEED(""),

    /**
     * How to pick the move to play once the search is complete (ROBUST_CHILD or MAX_CHILD).
     */
    FINAL_MOVE_SELECTION("ROBUST_CHILD"),

    /**
     * Built-in rollout policy to use (RANDOM or GREEDY).
     */
    ROLLOUT_POLICY("RANDOM"),

    /**
     * Number of independent trees to search in parallel.
     */
    SEARCH_THREADS(1);

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

    private CfgItem(double xiDefault)
    {
      mDefault = "" + xiDefault;
    }
  }

  private static final Properties ENGINE_PROPERTIES = new Properties();
  private static final AtomicBoolean CONFIG_LOGGED = new AtomicBoolean();
  static
  {
    try (InputStream lPropStream = EngineConfiguration.class.getClassLoader().getResourceAsStream(RESOURCE_NAME))
    {
      if (lPropStream != null)
      {
        ENGINE_PROPERTIES.load(lPropStream);
      }
    }
    catch (IOException lEx)
    {
      LOGGER.error("Invalid engine configuration resource " + RESOURCE_NAME, lEx);
    }

    String lFileName = System.getProperty(FILE_PROPERTY);
    if (lFileName != null)
    {
      try (InputStream lPropStream = new FileInputStream(lFileName))
      {
        ENGINE_PROPERTIES.load(lPropStream);
      }
      catch (IOException lEx)
      {
        LOGGER.error("Missing/invalid engine configuration file " + lFileName, lEx);
      }
    }
  }

  /**
   * @return the specified String configuration value, or the default if not configured.
   *
   * @param xiKey - the configuration item.
   */
  public static String getCfgStr(CfgItem xiKey)
  {
    return getCfgStr(ENGINE_PROPERTIES, xiKey);
  }

  /**
   * @return the specified String configuration value from the given properties, or the default if not configured.
   *
   * @param xiProperties - the properties to read.
   * @param xiKey - the configuration item.
   */
  public static String getCfgStr(Properties xiProperties, CfgItem xiKey)
  {
    return xiProperties.getProperty(xiKey.toString(), xiKey.mDefault).trim();
  }

  /**
   * @return a copy of the loaded engine properties (which doesn't include defaults).
   */
  public static Properties snapshot()
  {
    Properties lCopy = new Properties();
    lCopy.putAll(ENGINE_PROPERTIES);
    return lCopy;
  }

  /**
   * @return the specified integer configuration value, or the default if not configured.
   *
   * @param xiKey - the configuration item.
   */
  public static int getCfgInt(CfgItem xiKey)
  {
    return Integer.parseInt(getCfgStr(xiKey));
  }

  /**
   * @return the specified long configuration value, or the default if not configured.
   *
   * @param xiKey - the configuration item.
   */
  public static long getCfgLong(CfgItem xiKey)
  {
    return Long.parseLong(getCfgStr(xiKey));
  }

  /**
   * @return the specified floating point configuration value, or the default if not configured.
   *
   * @param xiKey - the configuration item.
   */
  public static double getCfgDouble(CfgItem xiKey)
  {
    return Double.parseDouble(getCfgStr(xiKey));
  }

  /**
   * Log all configuration that differs from the defaults.
   */
  public static void logConfig()
  {
    LOGGER.info("Running with engine properties:");
    for (Entry<Object, Object> e : ENGINE_PROPERTIES.entrySet())
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
   * Log the configuration if it hasn't been logged yet.
   *
   * @return whether this call logged it.
   */
  public static boolean logConfigOnce()
  {
    if (CONFIG_LOGGED.compareAndSet(false, true))
    {
      logConfig();
      return true;
    }
    return false;
  }

  /**
   * UT-only method for overriding configuration.
   *
   * @param xiKey - the property to override.
   * @param xiValue - the new value, or null to revert to the default.
   */
  public static void utOverrideCfgVal(CfgItem xiKey, String xiValue)
  {
    if (xiValue == null)
    {
      ENGINE_PROPERTIES.remove(xiKey.toString());
    }
    else
    {
      ENGINE_PROPERTIES.setProperty(xiKey.toString(), xiValue);
    }
  }
}
