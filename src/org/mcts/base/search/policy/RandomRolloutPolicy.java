package org.mcts.base.search.policy;

import java.util.List;
import java.util.Random;

import org.mcts.base.util.game.Game;

/**
 * A simple rollout policy that picks uniformly at random amongst the legal moves.
 */
public class RandomRolloutPolicy extends PlayoutRolloutPolicy
{
  @Override
  protected <S, M> M chooseMove(Game<S, M> xiGame, S xiState, List<M> xiLegalMoves, Random xiRandom)
  {
    return xiLegalMoves.get(xiRandom.nextInt(xiLegalMoves.size()));
  }
}
