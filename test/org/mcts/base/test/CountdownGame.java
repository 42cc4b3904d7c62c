package org.mcts.base.test;

import java.util.ArrayList;
import java.util.List;

import org.mcts.base.util.game.Game;
import org.mcts.base.util.game.exceptions.InvalidMoveException;

/**
 * Take-away game.  Players alternately remove between 1 and a maximum number of stones from a pile, and whoever
 * takes the last stone wins.  With a maximum take of T, the player to move loses iff the pile is a multiple of T + 1.
 */
public class CountdownGame implements Game<CountdownGame.Pile, Integer>
{
  /**
   * A pile of stones and the player to move.
   */
  public static class Pile
  {
    public final int mStones;
    public final int mPlayer;

    public Pile(int xiStones, int xiPlayer)
    {
      mStones = xiStones;
      mPlayer = xiPlayer;
    }

    @Override
    public boolean equals(Object xiOther)
    {
      if (!(xiOther instanceof Pile))
      {
        return false;
      }
      Pile lOther = (Pile)xiOther;
      return (mStones == lOther.mStones) && (mPlayer == lOther.mPlayer);
    }

    @Override
    public int hashCode()
    {
      return mStones * 2 + mPlayer;
    }

    @Override
    public String toString()
    {
      return mStones + " stones, player " + mPlayer + " to take";
    }
  }

  private final int mMaxTake;

  /**
   * @param xiMaxTake - the most stones that can be taken in one turn.
   */
  public CountdownGame(int xiMaxTake)
  {
    mMaxTake = xiMaxTake;
  }

  @Override
  public List<Integer> getLegalMoves(Pile xiState)
  {
    List<Integer> lMoves = new ArrayList<>();
    for (int lTake = 1; lTake <= Math.min(mMaxTake, xiState.mStones); lTake++)
    {
      lMoves.add(lTake);
    }
    return lMoves;
  }

  @Override
  public Pile applyMove(Pile xiState, Integer xiMove) throws InvalidMoveException
  {
    if (xiMove < 1 || xiMove > mMaxTake || xiMove > xiState.mStones)
    {
      throw new InvalidMoveException(xiState, xiMove);
    }
    return new Pile(xiState.mStones - xiMove, 1 - xiState.mPlayer);
  }

  @Override
  public boolean isTerminal(Pile xiState)
  {
    return xiState.mStones == 0;
  }

  @Override
  public double getOutcome(Pile xiState, int xiPlayer)
  {
    // The player to move at an empty pile didn't take the last stone.
    return (xiPlayer == xiState.mPlayer) ? -1 : 1;
  }

  @Override
  public int getCurrentPlayer(Pile xiState)
  {
    return xiState.mPlayer;
  }
}
