package org.mcts.base.search;

import java.util.List;
import java.util.Random;

import org.mcts.base.search.exceptions.NoIterationsException;
import org.mcts.base.util.game.Game;

/**
 * A baseline decision maker that plays a uniformly random legal move.
 *
 * @param <S> - the game state type.
 * @param <M> - the move type.
 */
public class RandomSearch<S, M> implements Search<S, M>
{
  private final Game<S, M> mGame;
  private final Random mRandom;

  /**
   * @param xiGame - the game.
   * @param xiRandom - the source of randomness.
   */
  public RandomSearch(Game<S, M> xiGame, Random xiRandom)
  {
    mGame = xiGame;
    mRandom = xiRandom;
  }

  @Override
  public M search(S xiState) throws NoIterationsException
  {
    List<M> lLegalMoves = mGame.getLegalMoves(xiState);
    if (lLegalMoves.isEmpty())
    {
      throw new NoIterationsException("No legal moves in state " + xiState);
    }
    return lLegalMoves.get(mRandom.nextInt(lLegalMoves.size()));
  }
}
