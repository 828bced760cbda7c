package org.sequent.base.util.prover;

/**
 * Single-threaded sequent prover.  The first premise of a branching rule is searched before the second, and the second
 * is never looked at if the first is refuted.
 */
public class SequentProver extends AbstractSequentProver
{
  /**
   * Create a prover with no depth limit.
   */
  public SequentProver()
  {
    this(-1);
  }

  /**
   * @param xiMaxDepth - the deepest rule application allowed before giving up, or -1 for no limit.
   */
  public SequentProver(int xiMaxDepth)
  {
    super(xiMaxDepth);
  }

  @Override
  protected ProofResult searchBranches(Sequent xiParent,
                                       Rule xiRule,
                                       Sequent xiFirst,
                                       Sequent xiSecond,
                                       int xiDepth,
                                       SearchContext xiContext)
  {
    ProofResult lFirst = search(xiFirst, xiDepth + 1, xiContext);
    if (!lFirst.isValid())
    {
      return refutedBranch(xiParent, xiRule, null, lFirst);
    }

    ProofResult lSecond = search(xiSecond, xiDepth + 1, xiContext);
    if (!lSecond.isValid())
    {
      return refutedBranch(xiParent, xiRule, lFirst.getProof(), lSecond);
    }

    return combineBranches(xiParent, xiRule, lFirst, lSecond);
  }
}
