package org.mcts.base.test;

import java.util.HashMap;
import java.util.Map;

import org.mcts.base.util.game.Game;
import org.mcts.base.util.game.exceptions.InvalidMoveException;

/**
 * Exhaustive game solver for small two-player games, used as the reference for what the search ought to find.
 *
 * @param <S> - the game state type.
 * @param <M> - the move type.
 */
public class NegamaxSolver<S, M>
{
  private final Game<S, M> mGame;

  // Value of each state for the player to move in it.
  private final Map<S, Double> mCache = new HashMap<>();

  public NegamaxSolver(Game<S, M> xiGame)
  {
    mGame = xiGame;
  }

  /**
   * @return the game-theoretic value of a state for the specified player.
   *
   * @param xiState - the state.
   * @param xiPlayer - the player.
   */
  public double solve(S xiState, int xiPlayer) throws InvalidMoveException
  {
    double lValue = valueForMover(xiState);
    return (xiPlayer == mGame.getCurrentPlayer(xiState)) ? lValue : -lValue;
  }

  /**
   * @return whether playing the move keeps the game-theoretic value for the player to move.
   *
   * @param xiState - the state.
   * @param xiMove - the move.
   */
  public boolean isOptimal(S xiState, M xiMove) throws InvalidMoveException
  {
    int lPlayer = mGame.getCurrentPlayer(xiState);
    return solve(mGame.applyMove(xiState, xiMove), lPlayer) == solve(xiState, lPlayer);
  }

  private double valueForMover(S xiState) throws InvalidMoveException
  {
    Double lCached = mCache.get(xiState);
    if (lCached != null)
    {
      return lCached;
    }

    int lPlayer = mGame.getCurrentPlayer(xiState);
    double lValue;
    if (mGame.isTerminal(xiState))
    {
      lValue = mGame.getOutcome(xiState, lPlayer);
    }
    else
    {
      lValue = Double.NEGATIVE_INFINITY;
      for (M lMove : mGame.getLegalMoves(xiState))
      {
        lValue = Math.max(lValue, solve(mGame.applyMove(xiState, lMove), lPlayer));
      }
    }

    mCache.put(xiState, lValue);
    return lValue;
  }
}
