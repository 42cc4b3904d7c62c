package org.mcts.base.search.policy;

import java.util.List;
import java.util.Random;

import org.mcts.base.util.game.Game;
import org.mcts.base.util.game.exceptions.InvalidMoveException;

/**
 * Rollout policy that plays an immediately winning move whenever there is one, and otherwise plays at random.
 *
 * Costs one look-ahead per legal move per ply, but produces much less noisy rollouts in games where wins can be
 * missed by random play.
 */
public class GreedyRolloutPolicy extends PlayoutRolloutPolicy
{
  @Override
  protected <S, M> M chooseMove(Game<S, M> xiGame, S xiState, List<M> xiLegalMoves, Random xiRandom)
    throws InvalidMoveException
  {
    int lPlayer = xiGame.getCurrentPlayer(xiState);
    for (M lMove : xiLegalMoves)
    {
      S lNextState = xiGame.applyMove(xiState, lMove);
      if (xiGame.isTerminal(lNextState) && (xiGame.getOutcome(lNextState, lPlayer) > 0))
      {
        return lMove;
      }
    }
    return xiLegalMoves.get(xiRandom.nextInt(xiLegalMoves.size()));
  }
}
