package org.mcts.base.util.game;

import java.util.List;

import org.mcts.base.util.game.exceptions.InvalidMoveException;

/**
 * The contract that every game must satisfy to be searched.
 * <p>
 * These five operations are the entire surface that the search engine depends on.  States and moves are opaque to
 * the engine.  Moves are used as map keys, so implementations must provide consistent equals() and hashCode().
 * States are only compared for equality when re-using a search tree across turns.
 * <p>
 * Players are identified by non-negative indices.
 *
 * @param <S> - the game state type.  States must be immutable (or at least never mutated once handed out).
 * @param <M> - the move type.
 */
public interface Game<S, M>
{
  /**
   * @return all the moves that can be played in the given state.  The list is empty if, and only if, the state is
   * terminal (or a stalemate).  The order must be stable for a given state.
   *
   * @param xiState - the state.
   */
  public List<M> getLegalMoves(S xiState);

  /**
   * @return the state reached by playing the specified move.
   *
   * @param xiState - the state to play from (which is not modified).
   * @param xiMove - the move to play.
   *
   * @throws InvalidMoveException if the move isn't legal in the state.
   */
  public S applyMove(S xiState, M xiMove) throws InvalidMoveException;

  /**
   * @return whether the game is over in the given state.
   *
   * @param xiState - the state.
   */
  public boolean isTerminal(S xiState);

  /**
   * @return the reward for the specified player (e.g. +1 win, 0 draw, -1 loss).
   *
   * Only valid for terminal states.  Rewards must be zero-sum between the two players.
   *
   * @param xiState - the terminal state.
   * @param xiPlayer - the player whose reward is required.
   */
  public double getOutcome(S xiState, int xiPlayer);

  /**
   * @return the player whose turn it is in the given state.
   *
   * @param xiState - the state.
   */
  public int getCurrentPlayer(S xiState);
}
