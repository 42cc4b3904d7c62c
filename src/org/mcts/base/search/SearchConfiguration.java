package org.mcts.base.search;

import java.time.Duration;
import java.util.Properties;

import org.mcts.base.search.exceptions.ConfigurationException;
import org.mcts.base.search.policy.GreedyRolloutPolicy;
import org.mcts.base.search.policy.RandomRolloutPolicy;
import org.mcts.base.search.policy.RolloutPolicy;
import org.mcts.base.util.configuration.EngineConfiguration;
import org.mcts.base.util.configuration.EngineConfiguration.CfgItem;

/**
 * Immutable configuration for a search.  Create with {@link #builder()}, which starts from the engine-wide defaults.
 */
public class SearchConfiguration
{
  /**
   * Iteration limit meaning "no limit".  Only valid with a maximum duration.
   */
  public static final int NO_ITERATION_LIMIT = -1;

  /**
   * Names of the built-in rollout policies, for use in properties.
   */
  public static enum BuiltInRolloutPolicy
  {
    RANDOM,
    GREEDY;
  }

  private final double             mExplorationConstant;
  private final int                mMaxIterations;
  private final Duration           mMaxDuration;
  private final RolloutPolicy      mRolloutPolicy;
  private final Long               mRandomSeed;
  private final int                mSimulationsPerIteration;
  private final FinalMoveSelection mFinalMoveSelection;
  private final int                mSearchThreads;

  private SearchConfiguration(Builder xiBuilder)
  {
    mExplorationConstant = xiBuilder.mExplorationConstant;
    mMaxIterations = xiBuilder.mMaxIterations;
    mMaxDuration = xiBuilder.mMaxDuration;
    mRolloutPolicy = xiBuilder.mRolloutPolicy;
    mRandomSeed = xiBuilder.mRandomSeed;
    mSimulationsPerIteration = xiBuilder.mSimulationsPerIteration;
    mFinalMoveSelection = xiBuilder.mFinalMoveSelection;
    mSearchThreads = xiBuilder.mSearchThreads;
  }

  /**
   * @return a builder initialised with the engine-wide defaults.
   */
  public static Builder builder()
  {
    EngineConfiguration.logConfigOnce();
    return builder(EngineConfiguration.snapshot());
  }

  /**
   * @return a builder initialised from the specified properties (keyed by {@link CfgItem} name), using the built-in
   * defaults for anything not present.
   *
   * @param xiProperties - the properties.
   *
   * @throws ConfigurationException if a property can't be parsed.
   */
  public static Builder builder(Properties xiProperties)
  {
    Builder lBuilder = new Builder();
    CfgItem lItem = null;
    try
    {
      lItem = CfgItem.EXPLORATION_CONSTANT;
      lBuilder.explorationConstant(Double.parseDouble(EngineConfiguration.getCfgStr(xiProperties, lItem)));

      lItem = CfgItem.MAX_ITERATIONS;
      lBuilder.maxIterations(Integer.parseInt(EngineConfiguration.getCfgStr(xiProperties, lItem)));

      lItem = CfgItem.MAX_DURATION_MS;
      long lMaxDurationMillis = Long.parseLong(EngineConfiguration.getCfgStr(xiProperties, lItem));
      lBuilder.maxDuration(lMaxDurationMillis < 0 ? null : Duration.ofMillis(lMaxDurationMillis));

      lItem = CfgItem.SIMULATIONS_PER_ITERATION;
      lBuilder.simulationsPerIteration(Integer.parseInt(EngineConfiguration.getCfgStr(xiProperties, lItem)));

      lItem = CfgItem.RANDOM_SEED;
      String lSeed = EngineConfiguration.getCfgStr(xiProperties, lItem);
      lBuilder.randomSeed(lSeed.isEmpty() ? null : Long.valueOf(lSeed));

      lItem = CfgItem.FINAL_MOVE_SELECTION;
      lBuilder.finalMoveSelection(FinalMoveSelection.valueOf(EngineConfiguration.getCfgStr(xiProperties, lItem)));

      lItem = CfgItem.ROLLOUT_POLICY;
      switch (BuiltInRolloutPolicy.valueOf(EngineConfiguration.getCfgStr(xiProperties, lItem)))
      {
        case GREEDY:
          lBuilder.rolloutPolicy(new GreedyRolloutPolicy());
          break;

        case RANDOM:
        default:
          lBuilder.rolloutPolicy(new RandomRolloutPolicy());
          break;
      }

      lItem = CfgItem.SEARCH_THREADS;
      lBuilder.searchThreads(Integer.parseInt(EngineConfiguration.getCfgStr(xiProperties, lItem)));
    }
    catch (IllegalArgumentException lEx)
    {
      throw new ConfigurationException("Invalid value for " + lItem + ": '" +
                                       EngineConfiguration.getCfgStr(xiProperties, lItem) + "'", lEx);
    }
    return lBuilder;
  }

  /**
   * @return a configuration built from the specified properties.
   *
   * @param xiProperties - the properties.
   *
   * @throws ConfigurationException if the properties don't describe a valid configuration.
   */
  public static SearchConfiguration fromProperties(Properties xiProperties)
  {
    return builder(xiProperties).build();
  }

  /**
   * @return a builder initialised with this configuration.
   */
  public Builder toBuilder()
  {
    Builder lBuilder = new Builder();
    lBuilder.mExplorationConstant = mExplorationConstant;
    lBuilder.mMaxIterations = mMaxIterations;
    lBuilder.mMaxDuration = mMaxDuration;
    lBuilder.mRolloutPolicy = mRolloutPolicy;
    lBuilder.mRandomSeed = mRandomSeed;
    lBuilder.mSimulationsPerIteration = mSimulationsPerIteration;
    lBuilder.mFinalMoveSelection = mFinalMoveSelection;
    lBuilder.mSearchThreads = mSearchThreads;
    return lBuilder;
  }

  public double getExplorationConstant()
  {
    return mExplorationConstant;
  }

  /**
   * @return the maximum number of iterations (possibly zero), or {@link #NO_ITERATION_LIMIT} if iterations are
   * unlimited (in which case there's always a maximum duration).
   */
  public int getMaxIterations()
  {
    return mMaxIterations;
  }

  /**
   * @return the maximum wall-clock duration, or null if there's no time limit.
   */
  public Duration getMaxDuration()
  {
    return mMaxDuration;
  }

  public RolloutPolicy getRolloutPolicy()
  {
    return mRolloutPolicy;
  }

  /**
   * @return the random seed, or null if searches aren't seeded.
   */
  public Long getRandomSeed()
  {
    return mRandomSeed;
  }

  public int getSimulationsPerIteration()
  {
    return mSimulationsPerIteration;
  }

  public FinalMoveSelection getFinalMoveSelection()
  {
    return mFinalMoveSelection;
  }

  public int getSearchThreads()
  {
    return mSearchThreads;
  }

  @Override
  public String toString()
  {
    return "SearchConfiguration{C: " + mExplorationConstant +
           ", maxIterations: " + mMaxIterations +
           ", maxDuration: " + mMaxDuration +
           ", rollout: " + mRolloutPolicy.getClass().getSimpleName() +
           ", seed: " + mRandomSeed +
           ", simulationsPerIteration: " + mSimulationsPerIteration +
           ", finalMoveSelection: " + mFinalMoveSelection +
           ", threads: " + mSearchThreads + "}";
  }

  /**
   * Builder for search configurations.
   */
  public static class Builder
  {
    private double             mExplorationConstant;
    private int                mMaxIterations;
    private Duration           mMaxDuration;
    private RolloutPolicy      mRolloutPolicy;
    private Long               mRandomSeed;
    private int                mSimulationsPerIteration;
    private FinalMoveSelection mFinalMoveSelection;
    private int                mSearchThreads;

    Builder()
    {
    }

    public Builder explorationConstant(double xiExplorationConstant)
    {
      mExplorationConstant = xiExplorationConstant;
      return this;
    }

    /**
     * @param xiMaxIterations - iteration limit, or {@link SearchConfiguration#NO_ITERATION_LIMIT}.
     */
    public Builder maxIterations(int xiMaxIterations)
    {
      mMaxIterations = xiMaxIterations;
      return this;
    }

    /**
     * @param xiMaxDuration - wall-clock limit, or null for none.
     */
    public Builder maxDuration(Duration xiMaxDuration)
    {
      mMaxDuration = xiMaxDuration;
      return this;
    }

    public Builder rolloutPolicy(RolloutPolicy xiRolloutPolicy)
    {
      mRolloutPolicy = xiRolloutPolicy;
      return this;
    }

    /**
     * @param xiRandomSeed - seed, or null for an unseeded search.
     */
    public Builder randomSeed(Long xiRandomSeed)
    {
      mRandomSeed = xiRandomSeed;
      return this;
    }

    public Builder simulationsPerIteration(int xiSimulationsPerIteration)
    {
      mSimulationsPerIteration = xiSimulationsPerIteration;
      return this;
    }

    public Builder finalMoveSelection(FinalMoveSelection xiFinalMoveSelection)
    {
      mFinalMoveSelection = xiFinalMoveSelection;
      return this;
    }

    public Builder searchThreads(int xiSearchThreads)
    {
      mSearchThreads = xiSearchThreads;
      return this;
    }

    /**
     * @return the configuration.
     *
     * @throws ConfigurationException if the configuration is invalid.
     */
    public SearchConfiguration build()
    {
      if (Double.isNaN(mExplorationConstant) || mExplorationConstant < 0)
      {
        throw new ConfigurationException("Exploration constant must be non-negative, not " + mExplorationConstant);
      }
      if (mMaxDuration != null && mMaxDuration.isNegative())
      {
        throw new ConfigurationException("Maximum duration must not be negative, not " + mMaxDuration);
      }
      if (mMaxIterations < NO_ITERATION_LIMIT)
      {
        throw new ConfigurationException("Iteration limit must be " + NO_ITERATION_LIMIT + " (none) or at least 0, " +
                                         "not " + mMaxIterations);
      }
      if (mMaxIterations <= 0 && mMaxDuration == null)
      {
        throw new ConfigurationException("A positive iteration limit or a maximum duration is required");
      }
      if (mSimulationsPerIteration < 1)
      {
        throw new ConfigurationException("At least 1 simulation per iteration is required, not " +
                                         mSimulationsPerIteration);
      }
      if (mSearchThreads < 1)
      {
        throw new ConfigurationException("At least 1 search thread is required, not " + mSearchThreads);
      }
      if (mRolloutPolicy == null || mFinalMoveSelection == null)
      {
        throw new ConfigurationException("Rollout policy and final move selection are required");
      }
      return new SearchConfiguration(this);
    }
  }
}
