package org.mcts.base.util.game.exceptions;

/**
 * Exception thrown when a move is applied to a state in which it isn't legal.
 */
public class InvalidMoveException extends Exception
{
  private static final long serialVersionUID = 1L;

  private final Object mState;
  private final Object mMove;

  /**
   * Create an exception for an illegal move.
   *
   * @param xiState - the state the move was applied to.
   * @param xiMove - the illegal move.
   */
  public InvalidMoveException(Object xiState, Object xiMove)
  {
    super("Move " + xiMove + " is not legal in state " + xiState);
    mState = xiState;
    mMove = xiMove;
  }

  /**
   * @return the state the move was applied to.
   */
  public Object getState()
  {
    return mState;
  }

  /**
   * @return the illegal move.
   */
  public Object getMove()
  {
    return mMove;
  }
}
