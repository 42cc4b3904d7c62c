package org.mcts.base.search.policy;

import java.util.List;
import java.util.Random;

import org.mcts.base.util.game.Game;
import org.mcts.base.util.game.exceptions.InvalidMoveException;

/**
 * Base class for rollout policies that play a complete game, one chosen move at a time.
 */
public abstract class PlayoutRolloutPolicy implements RolloutPolicy
{
  /**
   * @return the move to play in a rollout.
   *
   * @param xiGame - the game.
   * @param xiState - the current (non-terminal) state.
   * @param xiLegalMoves - the legal moves in the state.  Never empty.
   * @param xiRandom - the source of randomness.
   *
   * @throws InvalidMoveException if the game rejects a move during look-ahead.
   */
  protected abstract <S, M> M chooseMove(Game<S, M> xiGame, S xiState, List<M> xiLegalMoves, Random xiRandom)
    throws InvalidMoveException;

  @Override
  public <S, M> double rollout(Game<S, M> xiGame, S xiState, int xiPerspective, Random xiRandom)
    throws InvalidMoveException
  {
    S lState = xiState;
    while (!xiGame.isTerminal(lState))
    {
      List<M> lLegalMoves = xiGame.getLegalMoves(lState);
      if (lLegalMoves.isEmpty())
      {
        throw new IllegalStateException("Game has no legal moves in non-terminal state " + lState);
      }
      lState = xiGame.applyMove(lState, chooseMove(xiGame, lState, lLegalMoves, xiRandom));
    }
    return xiGame.getOutcome(lState, xiPerspective);
  }
}
