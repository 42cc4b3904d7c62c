package org.mcts.base.search.policy;

import java.util.Random;

import org.mcts.base.util.game.Game;
import org.mcts.base.util.game.exceptions.InvalidMoveException;

/**
 * An MCTS rollout (simulation) policy.
 *
 * Rollouts never modify the search tree.  Any randomness must come from the supplied generator so that seeded
 * searches are reproducible.
 */
public interface RolloutPolicy
{
  /**
   * Play the game out from the specified state.
   *
   * @param xiGame - the game.
   * @param xiState - the state to roll out from.
   * @param xiPerspective - the player for whom the result is wanted.
   * @param xiRandom - the source of randomness.
   *
   * @return the outcome of the game for the specified player.
   *
   * @throws InvalidMoveException if the game rejects a move that it listed as legal.
   */
  public <S, M> double rollout(Game<S, M> xiGame, S xiState, int xiPerspective, Random xiRandom)
    throws InvalidMoveException;
}
