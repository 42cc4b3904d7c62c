package org.mcts.base.test;

import java.util.Arrays;
import java.util.List;

/**
 * A badly behaved game that lists moves and then refuses to play them.
 */
public class RejectingGame extends StuckGame
{
  @Override
  public List<Integer> getLegalMoves(Integer xiState)
  {
    return Arrays.asList(1, 2);
  }
}
