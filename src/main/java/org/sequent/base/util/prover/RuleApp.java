package org.sequent.base.util.prover;

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * A node of a proof tree: the sequent at this point of the search, the rule applied to it and the proofs of the
 * resulting sequents.
 *
 * Connective rules have one child (non-branching) or two (branching).  Thinning has a single axiom child.  Axiom and
 * counter nodes are leaves.
 */
public final class RuleApp
{
  private final Sequent                 mSequent;
  private final Rule                    mRule;
  private final ImmutableList<RuleApp>  mChildren;

  /**
   * Create a proof tree node.
   *
   * @param xiSequent  - the sequent proved by this node.
   * @param xiRule     - the rule applied.
   * @param xiChildren - the proofs of the rule's premises, in order.
   */
  public RuleApp(Sequent xiSequent, Rule xiRule, List<RuleApp> xiChildren)
  {
    mSequent = xiSequent;
    mRule = xiRule;
    mChildren = ImmutableList.copyOf(xiChildren);

    int lExpected;
    switch (xiRule.getKind())
    {
      case AXIOM:
      case COUNTER:
        lExpected = 0;
        break;

      case THINNING:
        lExpected = 1;
        break;

      default:
        lExpected = (mChildren.size() == 2) ? 2 : 1;
        break;
    }
    if (mChildren.size() != lExpected)
    {
      throw new IllegalArgumentException("Rule " + xiRule + " cannot have " + mChildren.size() + " children");
    }
  }

  /**
   * @return a leaf node.
   */
  public static RuleApp leaf(Sequent xiSequent, Rule xiRule)
  {
    return new RuleApp(xiSequent, xiRule, ImmutableList.<RuleApp>of());
  }

  public Sequent getSequent()
  {
    return mSequent;
  }

  public Rule getRule()
  {
    return mRule;
  }

  public ImmutableList<RuleApp> getChildren()
  {
    return mChildren;
  }

  public boolean isLeaf()
  {
    return mChildren.isEmpty();
  }

  /**
   * @return whether every leaf below this node is an axiom.
   */
  public boolean isClosed()
  {
    if (mRule.getKind() == Rule.Kind.COUNTER)
    {
      return false;
    }
    for (RuleApp lChild : mChildren)
    {
      if (!lChild.isClosed())
      {
        return false;
      }
    }
    return true;
  }

  /**
   * @return the number of nodes in the tree rooted here.
   */
  public int countNodes()
  {
    int lCount = 1;
    for (RuleApp lChild : mChildren)
    {
      lCount += lChild.countNodes();
    }
    return lCount;
  }

  /**
   * @return the number of nodes on the longest path from this node to a leaf.
   */
  public int getDepth()
  {
    int lDepth = 0;
    for (RuleApp lChild : mChildren)
    {
      lDepth = Math.max(lDepth, lChild.getDepth());
    }
    return lDepth + 1;
  }

  @Override
  public String toString()
  {
    return mSequent + " [" + mRule + "]";
  }
}
