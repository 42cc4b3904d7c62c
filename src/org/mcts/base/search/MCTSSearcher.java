package org.mcts.base.search;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.mcts.base.search.exceptions.InvalidSearchStateException;
import org.mcts.base.search.exceptions.NoIterationsException;
import org.mcts.base.search.policy.AlternatingUpdatePolicy;
import org.mcts.base.search.policy.ExpansionPolicy;
import org.mcts.base.search.policy.RolloutPolicy;
import org.mcts.base.search.policy.SelectionPolicy;
import org.mcts.base.search.policy.SimpleExpansionPolicy;
import org.mcts.base.search.policy.UCTSelectionPolicy;
import org.mcts.base.search.policy.UpdatePolicy;
import org.mcts.base.util.game.Game;
import org.mcts.base.util.game.exceptions.InvalidMoveException;

/**
 * Monte Carlo Tree Searcher.
 *
 * Each iteration selects a path through the tree with the selection policy, expands a single new node at the end of
 * it, rolls the game out from the new node and then updates every node on the path with the result.  Once the budget
 * is used up, the move to play is picked from the root's children.
 *
 * Not thread-safe.  Use {@link org.mcts.base.search.parallel.RootParallelSearcher} to search on several threads.
 *
 * @param <S> - the game state type.
 * @param <M> - the move type.
 */
public class MCTSSearcher<S, M> implements Search<S, M>
{
  private static final Logger LOGGER = LogManager.getLogger();

  private static final long NO_DEADLINE = Long.MAX_VALUE;

  private final Game<S, M>          mGame;
  private final SearchConfiguration mConfig;
  private final SelectionPolicy     mSelectionPolicy;
  private final ExpansionPolicy     mExpansionPolicy;
  private final RolloutPolicy       mRolloutPolicy;
  private final UpdatePolicy        mUpdatePolicy;
  private final SearchTree<S, M>    mTree;
  private Random                    mRandom;

  private SearchStatus              mStatus = SearchStatus.IDLE;
  private int                       mIterations = 0;
  private long                      mFinishBy = NO_DEADLINE;
  private boolean                   mTreeRetained = false;

  /**
   * Create a searcher with the standard UCT policies.
   *
   * @param xiGame - the game to search.
   * @param xiConfig - the search configuration.
   */
  public MCTSSearcher(Game<S, M> xiGame, SearchConfiguration xiConfig)
  {
    this(xiGame,
         xiConfig,
         new UCTSelectionPolicy(xiConfig.getExplorationConstant()),
         new SimpleExpansionPolicy(),
         new AlternatingUpdatePolicy());
  }

  /**
   * Create a searcher with custom tree policies.  The rollout policy always comes from the configuration.
   *
   * @param xiGame - the game to search.
   * @param xiConfig - the search configuration.
   * @param xiSelectionPolicy - the policy for selecting amongst a node's children.
   * @param xiExpansionPolicy - the policy for expanding a node.
   * @param xiUpdatePolicy - the policy for updating the tree with a simulation result.
   */
  public MCTSSearcher(Game<S, M> xiGame,
                      SearchConfiguration xiConfig,
                      SelectionPolicy xiSelectionPolicy,
                      ExpansionPolicy xiExpansionPolicy,
                      UpdatePolicy xiUpdatePolicy)
  {
    mGame = xiGame;
    mConfig = xiConfig;
    mSelectionPolicy = xiSelectionPolicy;
    mExpansionPolicy = xiExpansionPolicy;
    mRolloutPolicy = xiConfig.getRolloutPolicy();
    mUpdatePolicy = xiUpdatePolicy;
    mTree = new SearchTree<>(xiGame);
    mRandom = createRandom();
  }

  private Random createRandom()
  {
    Long lSeed = mConfig.getRandomSeed();
    return (lSeed == null) ? new Random() : new Random(lSeed);
  }

  @Override
  public M search(S xiState) throws InvalidMoveException, NoIterationsException
  {
    start(xiState);
    run();
    return getBestMove();
  }

  /**
   * Start a search.  If the tree retained by the last {@link #reset(Object...)} is rooted at the specified state, it
   * is re-used.  Otherwise a new tree is created, so repeated searches without a reset are independent.
   *
   * @param xiState - the state to search from.
   *
   * @throws InvalidSearchStateException if a search is already running.
   */
  public void start(S xiState)
  {
    if (mStatus == SearchStatus.RUNNING)
    {
      throw new InvalidSearchStateException("start a search", mStatus);
    }

    SearchTreeNode<S, M> lRetainedRoot = mTree.getRoot();
    if (mTreeRetained && (lRetainedRoot != null) && lRetainedRoot.getState().equals(xiState))
    {
      LOGGER.debug("Re-using tree with " + lRetainedRoot.getNumVisits() + " root visits");
    }
    else
    {
      mTree.clear(xiState);
    }
    mTreeRetained = false;

    if (mConfig.getRandomSeed() != null)
    {
      // Re-seed so that every search from the same state with the same configuration plays out identically.
      mRandom = createRandom();
    }

    mIterations = 0;
    mFinishBy = (mConfig.getMaxDuration() == null) ?
                  NO_DEADLINE : System.currentTimeMillis() + mConfig.getMaxDuration().toMillis();
    mStatus = SearchStatus.RUNNING;
  }

  /**
   * Iterate until the search budget is used up.  The time limit is only checked between iterations, so the search
   * may overrun by up to one iteration.
   *
   * @throws InvalidSearchStateException if no search is running.
   * @throws InvalidMoveException if the game rejects a move it listed as legal.
   */
  public void run() throws InvalidMoveException
  {
    if (mStatus != SearchStatus.RUNNING)
    {
      throw new InvalidSearchStateException("run a search", mStatus);
    }

    long lStartTime = System.currentTimeMillis();
    try
    {
      if (mTree.getRoot().isTerminal())
      {
        LOGGER.info("Root state is terminal - nothing to search");
        return;
      }

      while (!isBudgetExhausted())
      {
        iterate();
      }
    }
    finally
    {
      mStatus = SearchStatus.DONE;
    }

    LOGGER.info("Processed " + mIterations + " iterations in " + (System.currentTimeMillis() - lStartTime) +
                "ms, tree has " + mTree.getNodeCount() + " nodes");
  }

  private boolean isBudgetExhausted()
  {
    if ((mConfig.getMaxIterations() != SearchConfiguration.NO_ITERATION_LIMIT) &&
        (mIterations >= mConfig.getMaxIterations()))
    {
      return true;
    }
    return (mFinishBy != NO_DEADLINE) && (System.currentTimeMillis() >= mFinishBy);
  }

  /**
   * Perform a single MCTS iteration, regardless of the budget.
   *
   * @throws InvalidSearchStateException if no search is running.
   * @throws InvalidMoveException if the game rejects a move it listed as legal.
   */
  public void iterate() throws InvalidMoveException
  {
    if (mStatus != SearchStatus.RUNNING)
    {
      throw new InvalidSearchStateException("iterate", mStatus);
    }

    SearchTreeNode<S, M> lNode = mTree.getRoot();
    if (lNode.isTerminal())
    {
      return;
    }

    // SELECT
    while (!lNode.shouldStopSelection())
    {
      lNode = mSelectionPolicy.select(lNode);
    }

    if (lNode.isTerminal())
    {
      // The game is already over here - score the exact outcome rather than rolling out.
      mUpdatePolicy.update(lNode, mGame.getOutcome(lNode.getState(), lNode.getMover()));
    }
    else
    {
      // EXPAND
      if (lNode.hasUntriedMoves())
      {
        lNode = mExpansionPolicy.expand(lNode);
      }

      if (lNode.isTerminal())
      {
        mUpdatePolicy.update(lNode, mGame.getOutcome(lNode.getState(), lNode.getMover()));
      }
      else
      {
        for (int lii = 0; lii < mConfig.getSimulationsPerIteration(); lii++)
        {
          // ROLLOUT
          double lResult = mRolloutPolicy.rollout(mGame, lNode.getState(), lNode.getMover(), mRandom);

          // UPDATE
          mUpdatePolicy.update(lNode, lResult);
        }
      }
    }

    mIterations++;
  }

  /**
   * @return the move to play, chosen by the configured final move selection from the root's children.
   *
   * If the root has no statistics (e.g. because the budget didn't allow any iterations) but only a single legal move,
   * that move is returned.
   *
   * @throws NoIterationsException if there are no statistics to choose from and the choice isn't forced.
   */
  public M getBestMove() throws NoIterationsException
  {
    SearchTreeNode<S, M> lRoot = mTree.getRoot();
    if ((mStatus == SearchStatus.IDLE) || (lRoot == null))
    {
      throw new NoIterationsException("No search has been run");
    }

    if (lRoot.isTerminal())
    {
      throw new NoIterationsException("Root state is terminal - there are no moves to choose from");
    }

    MoveStatistics<M> lBest = mConfig.getFinalMoveSelection().select(getRootStatistics());
    if (lBest != null)
    {
      return lBest.getMove();
    }

    List<M> lLegalMoves = mGame.getLegalMoves(lRoot.getState());
    if (lLegalMoves.size() == 1)
    {
      return lLegalMoves.get(0);
    }

    throw new NoIterationsException("No iterations completed to choose between " + lLegalMoves.size() + " moves");
  }

  /**
   * Return to idle, discarding the whole tree.
   *
   * @throws InvalidSearchStateException if a search is running.
   */
  public void reset()
  {
    checkNotRunning("reset");
    mTree.discard();
    mTreeRetained = false;
    mStatus = SearchStatus.IDLE;
  }

  /**
   * Return to idle, keeping the part of the tree below the specified moves for use by the next search.
   *
   * @param xiMovesPlayed - the moves played since the root of the last search (e.g. our move and then our opponent's
   * reply).
   *
   * @throws InvalidSearchStateException if a search is running.
   */
  @SafeVarargs
  public final void reset(M... xiMovesPlayed)
  {
    checkNotRunning("reset");
    mTreeRetained = mTree.reroot(xiMovesPlayed);
    if (!mTreeRetained)
    {
      LOGGER.debug("Moves played weren't in the tree - nothing retained");
    }
    mStatus = SearchStatus.IDLE;
  }

  private void checkNotRunning(String xiOperation)
  {
    if (mStatus == SearchStatus.RUNNING)
    {
      throw new InvalidSearchStateException(xiOperation, mStatus);
    }
  }

  /**
   * @return statistics for each expanded root move, in expansion order.  Empty if there's no tree.
   */
  public List<MoveStatistics<M>> getRootStatistics()
  {
    List<MoveStatistics<M>> lStats = new ArrayList<>();
    SearchTreeNode<S, M> lRoot = mTree.getRoot();
    if (lRoot != null)
    {
      for (SearchTreeNode<S, M> lChild : lRoot.getChildren())
      {
        lStats.add(MoveStatistics.of(lChild));
      }
    }
    return lStats;
  }

  /**
   * Dump the scores of the immediate children of the root.
   *
   * @param xiDumpHeadings - whether to dump table headings.
   */
  public void dumpRootData(boolean xiDumpHeadings)
  {
    List<MoveStatistics<M>> lStats = getRootStatistics();
    if (xiDumpHeadings)
    {
      StringBuilder lHeadings = new StringBuilder("Iterations");
      for (MoveStatistics<M> lMove : lStats)
      {
        lHeadings.append('\t').append(lMove.getMove());
      }
      LOGGER.info(lHeadings.toString());
    }

    StringBuilder lRow = new StringBuilder().append(mIterations);
    for (MoveStatistics<M> lMove : lStats)
    {
      lRow.append('\t').append(lMove.getNumVisits()).append('/').append(String.format("%.3f", lMove.getMeanValue()));
    }
    LOGGER.info(lRow.toString());
  }

  /**
   * @return the number of iterations performed by the current (or most recent) search.
   */
  public int getIterationCount()
  {
    return mIterations;
  }

  public SearchStatus getStatus()
  {
    return mStatus;
  }

  /**
   * @return the search tree.
   */
  public SearchTree<S, M> getTree()
  {
    return mTree;
  }

  public SearchConfiguration getConfiguration()
  {
    return mConfig;
  }
}
