package org.mcts.base.search;

import java.util.ArrayDeque;
import java.util.Deque;

import org.mcts.base.util.game.Game;

/**
 * The store for all nodes reachable from a search root.
 *
 * @param <S> - the game state type.
 * @param <M> - the move type.
 */
public class SearchTree<S, M>
{
  private final Game<S, M> mGame;
  private SearchTreeNode<S, M> mRoot = null;

  /**
   * Create an empty search tree.
   *
   * @param xiGame - the game being searched.
   */
  public SearchTree(Game<S, M> xiGame)
  {
    mGame = xiGame;
  }

  /**
   * @return the game being searched.
   */
  public Game<S, M> getGame()
  {
    return mGame;
  }

  /**
   * Discard the whole tree and start again from a new root.
   *
   * @param xiRootState - the state at the root.
   */
  public void clear(S xiRootState)
  {
    mRoot = new SearchTreeNode<>(mGame, xiRootState, null, null, SearchTreeNode.NO_PLAYER);
  }

  /**
   * Discard the whole tree, leaving it empty.
   */
  public void discard()
  {
    mRoot = null;
  }

  /**
   * Move the root down the tree by following the specified moves, discarding everything that isn't below the new root.
   * If any move along the way hasn't been expanded, the whole tree is discarded.
   *
   * @param xiMoves - the moves played since the root, in order.
   *
   * @return whether any of the tree was retained.
   */
  @SafeVarargs
  public final boolean reroot(M... xiMoves)
  {
    SearchTreeNode<S, M> lNode = mRoot;
    for (M lMove : xiMoves)
    {
      if (lNode == null)
      {
        break;
      }
      lNode = lNode.getChild(lMove);
    }

    if (lNode != null && lNode != mRoot)
    {
      lNode.detach();
    }
    mRoot = lNode;

    return mRoot != null;
  }

  /**
   * @return the root node, or null if the tree is empty.
   */
  public SearchTreeNode<S, M> getRoot()
  {
    return mRoot;
  }

  /**
   * @return the number of nodes in the tree.
   */
  public int getNodeCount()
  {
    if (mRoot == null)
    {
      return 0;
    }

    int lCount = 0;
    Deque<SearchTreeNode<S, M>> lToVisit = new ArrayDeque<>();
    lToVisit.push(mRoot);
    while (!lToVisit.isEmpty())
    {
      SearchTreeNode<S, M> lNode = lToVisit.pop();
      lCount++;
      for (SearchTreeNode<S, M> lChild : lNode.getChildren())
      {
        lToVisit.push(lChild);
      }
    }
    return lCount;
  }
}
