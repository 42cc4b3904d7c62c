package org.mcts.base.test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.time.Duration;
import java.util.List;

import org.junit.Test;
import org.mcts.base.search.MoveStatistics;
import org.mcts.base.search.SearchConfiguration;
import org.mcts.base.search.exceptions.NoIterationsException;
import org.mcts.base.search.parallel.RootParallelSearcher;
import org.mcts.base.test.mnk.MNKGame;
import org.mcts.base.test.mnk.MNKMove;
import org.mcts.base.test.mnk.MNKState;
import org.mcts.base.util.game.exceptions.InvalidMoveException;

public class RootParallelSearcherTest
{
  private final MNKGame mGame = MNKGame.ticTacToe();

  private static SearchConfiguration.Builder config(int xiThreads, int xiIterations)
  {
    return SearchConfiguration.builder()
                              .maxIterations(xiIterations)
                              .maxDuration(null)
                              .searchThreads(xiThreads)
                              .randomSeed(17L);
  }

  @Test
  public void testMergedVisitsAreSummed() throws Exception
  {
    RootParallelSearcher<MNKState, MNKMove> lSearcher = new RootParallelSearcher<>(mGame, config(4, 500).build());
    lSearcher.search(mGame.getInitialState());

    List<MoveStatistics<MNKMove>> lStats = lSearcher.getRootStatistics();
    assertEquals(9, lStats.size());
    int lTotalVisits = 0;
    for (MoveStatistics<MNKMove> lMove : lStats)
    {
      lTotalVisits += lMove.getNumVisits();
    }
    assertEquals(4 * 500, lTotalVisits);
  }

  @Test
  public void testFindsWin() throws Exception
  {
    RootParallelSearcher<MNKState, MNKMove> lSearcher = new RootParallelSearcher<>(mGame, config(3, 1000).build());
    assertEquals(new MNKMove(0, 2), lSearcher.search(mGame.parse("XX./OO./...")));
  }

  @Test
  public void testSeededSearchRepeatable() throws Exception
  {
    SearchConfiguration lConfig = config(3, 400).build();
    RootParallelSearcher<MNKState, MNKMove> lFirst = new RootParallelSearcher<>(mGame, lConfig);
    RootParallelSearcher<MNKState, MNKMove> lSecond = new RootParallelSearcher<>(mGame, lConfig);
    MNKMove lMove = lFirst.search(mGame.getInitialState());
    assertEquals(lMove, lSecond.search(mGame.getInitialState()));

    for (int lii = 0; lii < lFirst.getRootStatistics().size(); lii++)
    {
      assertEquals(lFirst.getRootStatistics().get(lii).getNumVisits(),
                   lSecond.getRootStatistics().get(lii).getNumVisits());
    }
  }

  @Test(expected = NoIterationsException.class)
  public void testTerminalRoot() throws Exception
  {
    MNKState lWon = mGame.applyMove(mGame.parse("XX./OO./..."), new MNKMove(0, 2));
    new RootParallelSearcher<>(mGame, config(2, 100).build()).search(lWon);
  }

  @Test
  public void testForcedMoveNeedsNoIterations() throws Exception
  {
    SearchConfiguration lConfig = config(2, 0).maxDuration(Duration.ofSeconds(10)).build();
    CountdownGame lGame = new CountdownGame(2);
    assertEquals(Integer.valueOf(1), new RootParallelSearcher<>(lGame, lConfig).search(new CountdownGame.Pile(1, 1)));
  }

  @Test(expected = InvalidMoveException.class)
  public void testWorkerFailurePropagated() throws Exception
  {
    new RootParallelSearcher<>(new RejectingGame(), config(2, 10).build()).search(0);
  }

  @Test
  public void testInterruptedWhilstWaiting() throws Exception
  {
    SearchConfiguration lConfig = config(2, SearchConfiguration.NO_ITERATION_LIMIT)
                                  .maxDuration(Duration.ofMillis(500))
                                  .build();
    RootParallelSearcher<MNKState, MNKMove> lSearcher = new RootParallelSearcher<>(mGame, lConfig);

    Thread.currentThread().interrupt();
    try
    {
      lSearcher.search(mGame.getInitialState());
      fail("Expected IllegalStateException");
    }
    catch (IllegalStateException lEx)
    {
      assertTrue(lEx.getCause() instanceof InterruptedException);
    }
    finally
    {
      // Clears the flag again for the following tests.
      assertTrue(Thread.interrupted());
    }
  }

  @Test
  public void testSingleThread() throws Exception
  {
    RootParallelSearcher<MNKState, MNKMove> lSearcher = new RootParallelSearcher<>(mGame, config(1, 300).build());
    MNKMove lMove = lSearcher.search(mGame.getInitialState());
    assertTrue(mGame.getLegalMoves(mGame.getInitialState()).contains(lMove));
  }
}
