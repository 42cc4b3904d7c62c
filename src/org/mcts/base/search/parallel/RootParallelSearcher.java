package org.mcts.base.search.parallel;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.mcts.base.search.MCTSSearcher;
import org.mcts.base.search.MoveStatistics;
import org.mcts.base.search.Search;
import org.mcts.base.search.SearchConfiguration;
import org.mcts.base.search.exceptions.NoIterationsException;
import org.mcts.base.util.game.Game;
import org.mcts.base.util.game.exceptions.InvalidMoveException;

/**
 * Root-parallel Monte Carlo Tree Search.
 *
 * Searches several independent trees at once, one per thread, with no shared mutable state.  When every tree has
 * finished, the root statistics are summed move by move and the move to play is picked from the merged statistics.
 * Each tree uses its own random generator, seeded from the configured seed plus the tree's index.
 *
 * @param <S> - the game state type.
 * @param <M> - the move type.
 */
public class RootParallelSearcher<S, M> implements Search<S, M>
{
  private static final Logger LOGGER = LogManager.getLogger();

  private static final AtomicInteger SEARCH_COUNTER = new AtomicInteger();

  private final Game<S, M> mGame;
  private final SearchConfiguration mConfig;

  private List<MoveStatistics<M>> mLastRootStatistics = new ArrayList<>();

  /**
   * @param xiGame - the game to search.
   * @param xiConfig - the search configuration, including the number of trees (threads) to use.
   */
  public RootParallelSearcher(Game<S, M> xiGame, SearchConfiguration xiConfig)
  {
    mGame = xiGame;
    mConfig = xiConfig;
  }

  /**
   * @throws IllegalStateException if interrupted whilst waiting for the trees.  The thread's interrupt flag is kept.
   */
  @Override
  public M search(S xiState) throws InvalidMoveException, NoIterationsException
  {
    if (mGame.isTerminal(xiState))
    {
      throw new NoIterationsException("Root state is terminal - there are no moves to choose from");
    }

    int lNumThreads = mConfig.getSearchThreads();
    String lSearchID = "search-" + SEARCH_COUNTER.incrementAndGet();
    ExecutorService lExecutor = Executors.newFixedThreadPool(lNumThreads, new WorkerThreadFactory(lSearchID));
    try
    {
      List<Future<List<MoveStatistics<M>>>> lResults = new ArrayList<>(lNumThreads);
      for (int lii = 0; lii < lNumThreads; lii++)
      {
        lResults.add(lExecutor.submit(new Worker(lSearchID + "." + lii, workerConfig(lii), xiState)));
      }

      Map<M, MoveStatistics<M>> lMerged = new LinkedHashMap<>();
      for (Future<List<MoveStatistics<M>>> lResult : lResults)
      {
        for (MoveStatistics<M> lStats : waitFor(lResult))
        {
          MoveStatistics<M> lExisting = lMerged.get(lStats.getMove());
          lMerged.put(lStats.getMove(), (lExisting == null) ? lStats : lExisting.merge(lStats));
        }
      }
      mLastRootStatistics = new ArrayList<>(lMerged.values());
    }
    finally
    {
      lExecutor.shutdownNow();
    }

    MoveStatistics<M> lBest = mConfig.getFinalMoveSelection().select(mLastRootStatistics);
    if (lBest != null)
    {
      LOGGER.info("Merged " + lNumThreads + " trees, playing: " + lBest);
      return lBest.getMove();
    }

    List<M> lLegalMoves = mGame.getLegalMoves(xiState);
    if (lLegalMoves.size() == 1)
    {
      return lLegalMoves.get(0);
    }
    throw new NoIterationsException("No iterations completed to choose between " + lLegalMoves.size() + " moves");
  }

  private SearchConfiguration workerConfig(int xiIndex)
  {
    Long lSeed = mConfig.getRandomSeed();
    return mConfig.toBuilder().randomSeed((lSeed == null) ? null : lSeed + xiIndex).build();
  }

  private List<MoveStatistics<M>> waitFor(Future<List<MoveStatistics<M>>> xiResult) throws InvalidMoveException
  {
    try
    {
      return xiResult.get();
    }
    catch (InterruptedException lEx)
    {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted whilst waiting for search threads", lEx);
    }
    catch (ExecutionException lEx)
    {
      Throwable lCause = lEx.getCause();
      if (lCause instanceof InvalidMoveException)
      {
        throw (InvalidMoveException)lCause;
      }
      if (lCause instanceof RuntimeException)
      {
        throw (RuntimeException)lCause;
      }
      if (lCause instanceof Error)
      {
        throw (Error)lCause;
      }
      throw new IllegalStateException("Search thread failed", lCause);
    }
  }

  /**
   * @return the merged root statistics from the most recent search, in first-seen order.
   */
  public List<MoveStatistics<M>> getRootStatistics()
  {
    return mLastRootStatistics;
  }

  /**
   * A single independent tree search.
   */
  private class Worker implements Callable<List<MoveStatistics<M>>>
  {
    private final String mWorkerID;
    private final SearchConfiguration mWorkerConfig;
    private final S mRootState;

    Worker(String xiWorkerID, SearchConfiguration xiWorkerConfig, S xiRootState)
    {
      mWorkerID = xiWorkerID;
      mWorkerConfig = xiWorkerConfig;
      mRootState = xiRootState;
    }

    @Override
    public List<MoveStatistics<M>> call() throws InvalidMoveException
    {
      ThreadContext.put("searchID", mWorkerID);
      try
      {
        MCTSSearcher<S, M> lSearcher = new MCTSSearcher<>(mGame, mWorkerConfig);
        lSearcher.start(mRootState);
        lSearcher.run();
        return lSearcher.getRootStatistics();
      }
      finally
      {
        ThreadContext.remove("searchID");
      }
    }
  }

  /**
   * Names search threads after the search they belong to.
   */
  private static class WorkerThreadFactory implements ThreadFactory
  {
    private final String mSearchID;
    private final AtomicInteger mThreadCount = new AtomicInteger();

    WorkerThreadFactory(String xiSearchID)
    {
      mSearchID = xiSearchID;
    }

    @Override
    public Thread newThread(Runnable xiRunnable)
    {
      Thread lThread = new Thread(xiRunnable, "MCTS-" + mSearchID + "-" + mThreadCount.getAndIncrement());
      lThread.setDaemon(true);
      return lThread;
    }
  }
}
