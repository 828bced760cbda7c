package org.sequent.base.util.prover;

import com.google.common.collect.ImmutableList;

/**
 * The outcome of a proof search: either a closed proof tree, or a counterexample read from the first atomic leaf whose
 * sides share nothing.
 *
 * A refutation also carries the partial derivation that led to the failing leaf: the rule steps from the refuted
 * sequent down to the counter leaf, together with any sibling branches that had already closed.  Branches that were
 * never searched do not appear.
 *
 * Callers must check {@link #getKind()} (or {@link #isValid()}) before asking for the proof or the counterexample.
 */
public final class ProofResult
{
  /**
   * The two possible outcomes.
   */
  public static enum Kind
  {
    /**
     * Every branch closed; the sequent is valid.
     */
    PROVED,

    /**
     * A branch ended in a counterexample; the sequent is invalid.
     */
    REFUTED
  }

  private final Kind           mKind;
  private final Sequent        mSequent;
  private final RuleApp        mTree;
  private final RuleApp        mFailingLeaf;
  private final Counterexample mCounterexample;

  // Set on refutations returned by a branch that stopped because some other branch was refuted.  Their tree doesn't
  // lead to the failing leaf.
  private final boolean        mAbandoned;

  private ProofResult(Kind xiKind,
                      RuleApp xiTree,
                      RuleApp xiFailingLeaf,
                      Counterexample xiCounterexample,
                      boolean xiAbandoned)
  {
    mKind = xiKind;
    mSequent = xiTree.getSequent();
    mTree = xiTree;
    mFailingLeaf = xiFailingLeaf;
    mCounterexample = xiCounterexample;
    mAbandoned = xiAbandoned;
  }

  /**
   * @return a successful result.
   *
   * @param xiProof - the closed proof tree.
   */
  public static ProofResult proved(RuleApp xiProof)
  {
    return new ProofResult(Kind.PROVED, xiProof, null, null, false);
  }

  /**
   * @return the refutation of an atomic sequent.
   *
   * @param xiFailingLeaf - the counter leaf the counterexample is read from.
   */
  public static ProofResult refuted(RuleApp xiFailingLeaf)
  {
    if (xiFailingLeaf.getRule().getKind() != Rule.Kind.COUNTER)
    {
      throw new IllegalArgumentException("Not a counter leaf: " + xiFailingLeaf);
    }
    return new ProofResult(Kind.REFUTED,
                           xiFailingLeaf,
                           xiFailingLeaf,
                           Counterexample.fromLeaf(xiFailingLeaf.getSequent()),
                           false);
  }

  /**
   * @return this refutation, extended by the rule step that produced the refuted sequent.
   *
   * @param xiParent        - the sequent the rule was applied to.
   * @param xiRule          - the rule.
   * @param xiClosedSibling - the proof of the rule's first premise when this refutation is of the second one, or null.
   */
  ProofResult under(Sequent xiParent, Rule xiRule, RuleApp xiClosedSibling)
  {
    if (mKind != Kind.REFUTED)
    {
      throw new IllegalStateException("Only refutations can be extended");
    }
    ImmutableList<RuleApp> lChildren = (xiClosedSibling == null) ? ImmutableList.of(mTree) :
                                                                   ImmutableList.of(xiClosedSibling, mTree);
    return new ProofResult(Kind.REFUTED,
                           new RuleApp(xiParent, xiRule, lChildren),
                           mFailingLeaf,
                           mCounterexample,
                           mAbandoned);
  }

  /**
   * @return a copy of this refutation for a branch that gave up because of it.
   */
  ProofResult abandoned()
  {
    return new ProofResult(mKind, mTree, mFailingLeaf, mCounterexample, true);
  }

  /**
   * @return whether this refutation was handed to a branch that didn't find it itself.
   */
  boolean isAbandoned()
  {
    return mAbandoned;
  }

  public Kind getKind()
  {
    return mKind;
  }

  public boolean isValid()
  {
    return mKind == Kind.PROVED;
  }

  /**
   * @return the sequent this result is about.
   */
  public Sequent getSequent()
  {
    return mSequent;
  }

  /**
   * @return the proof tree.
   *
   * @throws IllegalStateException if the sequent was refuted.
   */
  public RuleApp getProof()
  {
    if (mKind != Kind.PROVED)
    {
      throw new IllegalStateException("No proof: sequent was refuted by " + mCounterexample);
    }
    return mTree;
  }

  /**
   * @return the partial derivation from the refuted sequent down to the failing leaf.
   *
   * @throws IllegalStateException if the sequent was proved.
   */
  public RuleApp getDerivation()
  {
    if (mKind != Kind.REFUTED)
    {
      throw new IllegalStateException("No failed derivation: sequent was proved");
    }
    return mTree;
  }

  /**
   * @return the counterexample.
   *
   * @throws IllegalStateException if the sequent was proved.
   */
  public Counterexample getCounterexample()
  {
    if (mKind != Kind.REFUTED)
    {
      throw new IllegalStateException("No counterexample: sequent was proved");
    }
    return mCounterexample;
  }

  /**
   * @return the counter leaf of a refutation.
   *
   * @throws IllegalStateException if the sequent was proved.
   */
  public RuleApp getFailingLeaf()
  {
    if (mKind != Kind.REFUTED)
    {
      throw new IllegalStateException("No failing leaf: sequent was proved");
    }
    return mFailingLeaf;
  }

  @Override
  public String toString()
  {
    if (mKind == Kind.PROVED)
    {
      return "PROVED " + mSequent + " (" + mTree.countNodes() + " steps)";
    }
    return "REFUTED " + mSequent + " by " + mCounterexample;
  }
}
