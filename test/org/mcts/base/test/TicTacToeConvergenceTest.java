package org.mcts.base.test;

import java.util.LinkedList;

import org.junit.Assert;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;
import org.mcts.base.search.MCTSSearcher;
import org.mcts.base.search.SearchConfiguration;
import org.mcts.base.search.policy.GreedyRolloutPolicy;
import org.mcts.base.search.policy.RolloutPolicy;
import org.mcts.base.test.mnk.MNKGame;
import org.mcts.base.test.mnk.MNKMove;
import org.mcts.base.test.mnk.MNKState;

/**
 * Check that the search finds a game-theoretically optimal move in a selection of tic-tac-toe positions.
 */
@RunWith(Parameterized.class)
public class TicTacToeConvergenceTest extends Assert
{
  private static final MNKGame GAME = MNKGame.ticTacToe();
  private static final NegamaxSolver<MNKState, MNKMove> SOLVER = new NegamaxSolver<>(GAME);

  /**
   * @return the positions to test, each with the rollout policy to use.
   */
  @Parameters(name="{0}")
  public static Iterable<? extends Object> data()
  {
    LinkedList<Object[]> lTests = new LinkedList<>();
    lTests.add(new Object[] {"Win now",                  "XX./OO./...", new GreedyRolloutPolicy()});
    lTests.add(new Object[] {"Block",                    "X../OO./X..", new GreedyRolloutPolicy()});
    lTests.add(new Object[] {"Win now (solved)",         "XX./OO./...", new ExactRolloutPolicy()});
    lTests.add(new Object[] {"Block (solved)",           "X../OO./X..", new ExactRolloutPolicy()});
    lTests.add(new Object[] {"Empty board (solved)",     ".../.../...", new ExactRolloutPolicy()});
    lTests.add(new Object[] {"Corner opening (solved)",  "X../.../...", new ExactRolloutPolicy()});
    lTests.add(new Object[] {"Centre opening (solved)",  ".../.X./...", new ExactRolloutPolicy()});
    return lTests;
  }

  private final String mPicture;
  private final RolloutPolicy mRolloutPolicy;

  public TicTacToeConvergenceTest(String xiName, String xiPicture, RolloutPolicy xiRolloutPolicy)
  {
    mPicture = xiPicture;
    mRolloutPolicy = xiRolloutPolicy;
  }

  @Test
  public void testFindsOptimalMove() throws Exception
  {
    MNKState lState = GAME.parse(mPicture);
    SearchConfiguration lConfig = SearchConfiguration.builder()
                                                     .maxIterations(3000)
                                                     .maxDuration(null)
                                                     .rolloutPolicy(mRolloutPolicy)
                                                     .randomSeed(99L)
                                                     .build();
    MCTSSearcher<MNKState, MNKMove> lSearcher = new MCTSSearcher<>(GAME, lConfig);
    MNKMove lMove = lSearcher.search(lState);

    assertTrue("Played " + lMove + " in " + lState, SOLVER.isOptimal(lState, lMove));
  }
}
