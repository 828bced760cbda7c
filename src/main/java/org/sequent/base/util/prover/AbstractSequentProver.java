package org.sequent.base.util.prover;

import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.sequent.base.util.logic.grammar.ComplexSentence;
import org.sequent.base.util.logic.grammar.Sentence;
import org.sequent.base.util.prover.exceptions.SearchLimitExceededException;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

/**
 * Cut-free sequent calculus proof search for propositional logic.
 *
 * At each step the search applies, in strict priority order:
 *
 * <ol>
 *   <li>a non-branching rule to a complex antecedent;
 *   <li>a non-branching rule to a complex consequent;
 *   <li>a branching rule to a complex antecedent;
 *   <li>a branching rule to a complex consequent.
 * </ol>
 *
 * Once only atoms remain, the branch is closed (by an axiom, with thinning if the sides have other atoms) when the two
 * sides share an atom, and otherwise yields a counterexample which ends the whole search.
 *
 * Every rule replaces a sentence with strictly smaller ones, so the search always terminates.  Subclasses decide how
 * the two premises of a branching rule are searched.
 */
public abstract class AbstractSequentProver implements Prover
{
  private static final Logger LOGGER = LogManager.getLogger();

  private final int mMaxDepth;

  /**
   * @param xiMaxDepth - the deepest rule application allowed before giving up, or -1 for no limit.
   */
  protected AbstractSequentProver(int xiMaxDepth)
  {
    mMaxDepth = xiMaxDepth;
  }

  /**
   * @return the depth limit, or -1 if there is none.
   */
  public int getMaxDepth()
  {
    return mMaxDepth;
  }

  /**
   * @throws SearchLimitExceededException if a depth limit is set and the search exceeds it.
   */
  @Override
  public ProofResult prove(Sequent xiSequent)
  {
    LOGGER.debug("Proving " + xiSequent);

    ProofResult lResult = runSearch(xiSequent, new SearchContext());
    if (lResult.isValid())
    {
      LOGGER.debug("Proved " + xiSequent + " in " + lResult.getProof().countNodes() + " steps");
      return lResult;
    }

    LOGGER.debug("Refuted " + xiSequent + " by " + lResult.getCounterexample());
    return lResult;
  }

  @Override
  public boolean isValid(Set<? extends Sentence> xiPremises, Set<? extends Sentence> xiConclusions)
  {
    return prove(new Sequent(xiPremises, xiConclusions)).isValid();
  }

  /**
   * Run the search from the root sequent.
   */
  protected ProofResult runSearch(Sequent xiSequent, SearchContext xiContext)
  {
    return search(xiSequent, 0, xiContext);
  }

  /**
   * Search for a proof of one sequent.
   *
   * @param xiSequent - the sequent.
   * @param xiDepth   - number of rule applications between the root and this sequent.
   * @param xiContext - state shared across the whole search.
   *
   * @return the proof of this sequent, or the search's refutation.
   */
  protected ProofResult search(Sequent xiSequent, int xiDepth, SearchContext xiContext)
  {
    ProofResult lRefutation = xiContext.getRefutation();
    if (lRefutation != null)
    {
      // Some other branch has already found a counterexample.
      return lRefutation.abandoned();
    }

    if ((mMaxDepth >= 0) && (xiDepth > mMaxDepth))
    {
      throw new SearchLimitExceededException(mMaxDepth, xiSequent);
    }

    LOGGER.trace("Depth " + xiDepth + ": " + xiSequent);

    for (Sentence lSentence : xiSequent.getAntecedents())
    {
      if (!lSentence.isAtomic() && !((ComplexSentence)lSentence).branchesOnLeft())
      {
        ComplexSentence lComplex = (ComplexSentence)lSentence;
        Sequent lNext = xiSequent.applyLeft(lComplex, DecompositionRules.left(lComplex).getPremise());
        return searchSingle(xiSequent, Rule.left(lComplex.getConnective()), lNext, xiDepth, xiContext);
      }
    }

    for (Sentence lSentence : xiSequent.getConsequents())
    {
      if (!lSentence.isAtomic() && !((ComplexSentence)lSentence).branchesOnRight())
      {
        ComplexSentence lComplex = (ComplexSentence)lSentence;
        Sequent lNext = xiSequent.applyRight(lComplex, DecompositionRules.right(lComplex).getPremise());
        return searchSingle(xiSequent, Rule.right(lComplex.getConnective()), lNext, xiDepth, xiContext);
      }
    }

    // Only branching connectives (if any) are left.
    for (Sentence lSentence : xiSequent.getAntecedents())
    {
      if (!lSentence.isAtomic())
      {
        ComplexSentence lComplex = (ComplexSentence)lSentence;
        ImmutableList<Decomposition.Premise> lPremises = DecompositionRules.left(lComplex).getPremises();
        return searchBranches(xiSequent,
                              Rule.left(lComplex.getConnective()),
                              xiSequent.applyLeft(lComplex, lPremises.get(0)),
                              xiSequent.applyLeft(lComplex, lPremises.get(1)),
                              xiDepth,
                              xiContext);
      }
    }

    for (Sentence lSentence : xiSequent.getConsequents())
    {
      if (!lSentence.isAtomic())
      {
        ComplexSentence lComplex = (ComplexSentence)lSentence;
        ImmutableList<Decomposition.Premise> lPremises = DecompositionRules.right(lComplex).getPremises();
        return searchBranches(xiSequent,
                              Rule.right(lComplex.getConnective()),
                              xiSequent.applyRight(lComplex, lPremises.get(0)),
                              xiSequent.applyRight(lComplex, lPremises.get(1)),
                              xiDepth,
                              xiContext);
      }
    }

    return closeBranch(xiSequent, xiContext);
  }

  private ProofResult searchSingle(Sequent xiParent,
                                   Rule xiRule,
                                   Sequent xiNext,
                                   int xiDepth,
                                   SearchContext xiContext)
  {
    ProofResult lChild = search(xiNext, xiDepth + 1, xiContext);
    if (!lChild.isValid())
    {
      return lChild.under(xiParent, xiRule, null);
    }
    return ProofResult.proved(new RuleApp(xiParent, xiRule, ImmutableList.of(lChild.getProof())));
  }

  /**
   * Search both premises of a branching rule.  Implementations must return a refutation as soon as either premise is
   * refuted, without finishing the other, and extend it with {@link #refutedBranch}.
   *
   * @param xiParent  - the sequent the rule was applied to.
   * @param xiRule    - the rule.
   * @param xiFirst   - the first premise.
   * @param xiSecond  - the second premise.
   * @param xiDepth   - depth of the parent.
   * @param xiContext - state shared across the whole search.
   *
   * @return the combined proof, or the search's refutation.
   */
  protected abstract ProofResult searchBranches(Sequent xiParent,
                                                Rule xiRule,
                                                Sequent xiFirst,
                                                Sequent xiSecond,
                                                int xiDepth,
                                                SearchContext xiContext);

  /**
   * @return a refutation of one premise, extended to the parent.
   *
   * @param xiParent       - the sequent the rule was applied to.
   * @param xiRule         - the rule.
   * @param xiClosedFirst  - the proof of the first premise if it was the second premise that was refuted, else null.
   * @param xiRefutation   - the refutation of the premise.
   */
  protected static ProofResult refutedBranch(Sequent xiParent,
                                             Rule xiRule,
                                             RuleApp xiClosedFirst,
                                             ProofResult xiRefutation)
  {
    return xiRefutation.under(xiParent, xiRule, xiClosedFirst);
  }

  /**
   * @return the proof of a parent whose two premises have both been proved.
   */
  protected static ProofResult combineBranches(Sequent xiParent,
                                               Rule xiRule,
                                               ProofResult xiFirst,
                                               ProofResult xiSecond)
  {
    return ProofResult.proved(new RuleApp(xiParent,
                                          xiRule,
                                          ImmutableList.of(xiFirst.getProof(), xiSecond.getProof())));
  }

  /**
   * Resolve an atomic sequent.
   */
  private static ProofResult closeBranch(Sequent xiSequent, SearchContext xiContext)
  {
    ImmutableSet<Sentence> lShared = xiSequent.getSharedSentences();
    if (!lShared.isEmpty())
    {
      if ((xiSequent.getAntecedents().size() > 1) || (xiSequent.getConsequents().size() > 1))
      {
        Sentence lAtom = lShared.iterator().next();
        Sequent lAxiom = new Sequent(ImmutableSet.of(lAtom), ImmutableSet.of(lAtom));
        return ProofResult.proved(new RuleApp(xiSequent,
                                              Rule.THINNING,
                                              ImmutableList.of(RuleApp.leaf(lAxiom, Rule.AXIOM))));
      }
      return ProofResult.proved(RuleApp.leaf(xiSequent, Rule.AXIOM));
    }

    LOGGER.trace("Counterexample at " + xiSequent);
    return xiContext.recordRefutation(ProofResult.refuted(RuleApp.leaf(xiSequent, Rule.COUNTER)));
  }
}
