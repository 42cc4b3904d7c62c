package org.mcts.base.search;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.mcts.base.util.game.Game;
import org.mcts.base.util.game.exceptions.InvalidMoveException;

/**
 * A node in an MCTS tree, representing a single game state reached from the root.
 *
 * A node owns its children.  The parent reference is only used to walk back up the tree during updates.
 *
 * @param <S> - the game state type.
 * @param <M> - the move type.
 */
public class SearchTreeNode<S, M>
{
  /**
   * Player index recorded as the mover into the root node, for which no move was made.
   */
  public static final int NO_PLAYER = -1;

  private final Game<S, M> mGame;
  private final S mState;
  private final int mMover;
  private final boolean mTerminal;
  private final Map<M, SearchTreeNode<S, M>> mChildren = new LinkedHashMap<>();
  private final List<M> mUntriedMoves;

  private SearchTreeNode<S, M> mParent;
  private M mIncomingMove;

  private int mNumVisits = 0;
  private double mTotalValue = 0;
  private int mNumLeafSimulations = 0;

  /**
   * Create a tree node.  This should only be called from the tree (for roots) or from a parent node.
   *
   * @param xiGame - the game being searched.
   * @param xiState - the state represented by this node.
   * @param xiParent - the parent node, or null for the root.
   * @param xiIncomingMove - the move that produced this node from its parent, or null for the root.
   * @param xiMover - the player who made the incoming move, or NO_PLAYER for the root.
   */
  SearchTreeNode(Game<S, M> xiGame, S xiState, SearchTreeNode<S, M> xiParent, M xiIncomingMove, int xiMover)
  {
    mGame = xiGame;
    mState = xiState;
    mParent = xiParent;
    mIncomingMove = xiIncomingMove;
    mMover = xiMover;
    mTerminal = xiGame.isTerminal(xiState);

    if (mTerminal)
    {
      mUntriedMoves = new ArrayList<>(0);
    }
    else
    {
      mUntriedMoves = new ArrayList<>(xiGame.getLegalMoves(xiState));
    }
  }

  /**
   * Expand the specified untried move into a new child of this node.
   *
   * @param xiMove - the move to expand.  Must be one of this node's untried moves.
   *
   * @return the newly created child.
   *
   * @throws InvalidMoveException if the game rejects the move.
   */
  public SearchTreeNode<S, M> addChild(M xiMove) throws InvalidMoveException
  {
    if (!mUntriedMoves.contains(xiMove))
    {
      throw new IllegalArgumentException("Move " + xiMove + " is not an untried move of this node");
    }

    S lChildState = mGame.applyMove(mState, xiMove);
    mUntriedMoves.remove(xiMove);

    SearchTreeNode<S, M> lChild = new SearchTreeNode<>(mGame,
                                                       lChildState,
                                                       this,
                                                       xiMove,
                                                       mGame.getCurrentPlayer(mState));
    mChildren.put(xiMove, lChild);
    return lChild;
  }

  /**
   * Record the result of a simulation that passed through this node.
   *
   * @param xiValue - the reward, from the point of view of the player who moved into this node.
   */
  public void update(double xiValue)
  {
    mNumVisits++;
    mTotalValue += xiValue;
  }

  /**
   * Record that a simulation started (or a terminal outcome was scored) at this node.
   */
  public void noteLeafSimulation()
  {
    mNumLeafSimulations++;
  }

  /**
   * Make this node the root of its tree, dropping the link to its parent.
   */
  void detach()
  {
    if (mParent != null)
    {
      mParent.mChildren.remove(mIncomingMove);
    }
    mParent = null;
    mIncomingMove = null;
  }

  /**
   * @return whether MCTS selection should stop at this node.  Selection stops at terminal nodes and nodes with any
   * untried moves (and at non-terminal nodes that have no moves at all, which is a badly behaved game).
   */
  public boolean shouldStopSelection()
  {
    return mTerminal || !mUntriedMoves.isEmpty() || mChildren.isEmpty();
  }

  /**
   * @return the game state represented by this node.
   */
  public S getState()
  {
    return mState;
  }

  /**
   * @return the parent node, or null for the root.
   */
  public SearchTreeNode<S, M> getParent()
  {
    return mParent;
  }

  /**
   * @return the move that produced this node from its parent, or null for the root.
   */
  public M getIncomingMove()
  {
    return mIncomingMove;
  }

  /**
   * @return the player who made the move into this node.
   */
  public int getMover()
  {
    return mMover;
  }

  /**
   * @return whether the state is terminal.
   */
  public boolean isTerminal()
  {
    return mTerminal;
  }

  /**
   * @return the child nodes, in the order they were expanded.
   */
  public Collection<SearchTreeNode<S, M>> getChildren()
  {
    return Collections.unmodifiableCollection(mChildren.values());
  }

  /**
   * @return the child reached by the specified move, or null if it hasn't been expanded.
   *
   * @param xiMove - the move.
   */
  public SearchTreeNode<S, M> getChild(M xiMove)
  {
    return mChildren.get(xiMove);
  }

  /**
   * @return the moves that haven't yet been expanded into children, in legal move order.
   */
  public List<M> getUntriedMoves()
  {
    return Collections.unmodifiableList(mUntriedMoves);
  }

  /**
   * @return whether any moves remain to be expanded.
   */
  public boolean hasUntriedMoves()
  {
    return !mUntriedMoves.isEmpty();
  }

  /**
   * @return the number of simulations that have passed through this node.
   */
  public int getNumVisits()
  {
    return mNumVisits;
  }

  /**
   * @return the sum of simulation rewards, from the point of view of the player who moved into this node.
   */
  public double getTotalValue()
  {
    return mTotalValue;
  }

  /**
   * @return the mean reward, or 0 if the node hasn't been visited.
   */
  public double getMeanValue()
  {
    return (mNumVisits == 0) ? 0 : mTotalValue / mNumVisits;
  }

  /**
   * @return the number of simulations that started at this node.
   */
  public int getNumLeafSimulations()
  {
    return mNumLeafSimulations;
  }

  @Override
  public String toString()
  {
    return "SearchTreeNode{move: " + mIncomingMove +
           ", visits: " + mNumVisits +
           ", value: " + mTotalValue +
           ", children: " + mChildren.keySet() +
           ", untried: " + mUntriedMoves + "}";
  }
}
