package org.mcts.base.test;

import static org.junit.Assert.assertEquals;

import org.junit.Test;
import org.mcts.base.search.SearchTree;
import org.mcts.base.search.SearchTreeNode;
import org.mcts.base.search.policy.AlternatingUpdatePolicy;

public class AlternatingUpdatePolicyTest
{
  @Test
  public void testValueAlternatesWithMover() throws Exception
  {
    SearchTree<CountdownGame.Pile, Integer> lTree = new SearchTree<>(new CountdownGame(2));
    lTree.clear(new CountdownGame.Pile(5, 0));
    SearchTreeNode<CountdownGame.Pile, Integer> lOurs = lTree.getRoot().addChild(1);
    SearchTreeNode<CountdownGame.Pile, Integer> lTheirs = lOurs.addChild(2);

    new AlternatingUpdatePolicy().update(lTheirs, 1);

    assertEquals(1, lTheirs.getTotalValue(), 0);
    assertEquals(-1, lOurs.getTotalValue(), 0);
    assertEquals(1, lTree.getRoot().getNumVisits());
    assertEquals(1, lOurs.getNumVisits());
    assertEquals(1, lTheirs.getNumVisits());
  }

  @Test
  public void testOnlyLeafCountsSimulation() throws Exception
  {
    SearchTree<CountdownGame.Pile, Integer> lTree = new SearchTree<>(new CountdownGame(2));
    lTree.clear(new CountdownGame.Pile(5, 0));
    SearchTreeNode<CountdownGame.Pile, Integer> lChild = lTree.getRoot().addChild(2);

    AlternatingUpdatePolicy lPolicy = new AlternatingUpdatePolicy();
    lPolicy.update(lChild, 0);
    lPolicy.update(lChild, 0);

    assertEquals(2, lChild.getNumLeafSimulations());
    assertEquals(0, lTree.getRoot().getNumLeafSimulations());
    assertEquals(2, lTree.getRoot().getNumVisits());
  }

  @Test
  public void testSameMoverKeepsSign() throws Exception
  {
    SearchTree<String, Character> lTree = new SearchTree<>(new SolitaireGame(3));
    lTree.clear("");
    SearchTreeNode<String, Character> lFirst = lTree.getRoot().addChild('a');
    SearchTreeNode<String, Character> lSecond = lFirst.addChild('b');

    new AlternatingUpdatePolicy().update(lSecond, 0.5);

    assertEquals(0.5, lSecond.getTotalValue(), 0);
    assertEquals(0.5, lFirst.getTotalValue(), 0);
  }
}
