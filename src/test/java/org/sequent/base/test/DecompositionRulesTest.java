package org.sequent.base.test;

import static org.sequent.base.util.logic.grammar.SentencePool.getAtom;
import static org.sequent.base.util.logic.grammar.SentencePool.getConditional;
import static org.sequent.base.util.logic.grammar.SentencePool.getConjunction;
import static org.sequent.base.util.logic.grammar.SentencePool.getDisjunction;
import static org.sequent.base.util.logic.grammar.SentencePool.getNegation;

import org.junit.Assert;
import org.junit.Test;
import org.sequent.base.util.logic.grammar.Atom;
import org.sequent.base.util.logic.grammar.ComplexSentence;
import org.sequent.base.util.logic.grammar.Sentence;
import org.sequent.base.util.prover.Decomposition;
import org.sequent.base.util.prover.Decomposition.Premise;
import org.sequent.base.util.prover.DecompositionRules;

import com.google.common.collect.ImmutableSet;

/**
 * One test per row of the rule table.
 */
public class DecompositionRulesTest extends Assert
{
  private static final ImmutableSet<Sentence> NONE = ImmutableSet.of();

  private final Atom A = getAtom("A");
  private final Atom B = getAtom("B");

  private static void assertPremise(Premise xiPremise, ImmutableSet<? extends Sentence> xiAntecedents,
                                    ImmutableSet<? extends Sentence> xiConsequents)
  {
    assertEquals(xiAntecedents, xiPremise.getAntecedents());
    assertEquals(xiConsequents, xiPremise.getConsequents());
  }

  @Test
  public void testNegationLeft()
  {
    Decomposition lResult = DecompositionRules.left(getNegation(A));
    assertFalse(lResult.isBranching());
    assertPremise(lResult.getPremise(), NONE, ImmutableSet.of(A));
  }

  @Test
  public void testNegationRight()
  {
    Decomposition lResult = DecompositionRules.right(getNegation(A));
    assertFalse(lResult.isBranching());
    assertPremise(lResult.getPremise(), ImmutableSet.of(A), NONE);
  }

  @Test
  public void testDisjunctionLeft()
  {
    Decomposition lResult = DecompositionRules.left(getDisjunction(A, B));
    assertTrue(lResult.isBranching());
    assertPremise(lResult.getPremises().get(0), ImmutableSet.of(A), NONE);
    assertPremise(lResult.getPremises().get(1), ImmutableSet.of(B), NONE);
  }

  @Test
  public void testDisjunctionRight()
  {
    Decomposition lResult = DecompositionRules.right(getDisjunction(A, B));
    assertFalse(lResult.isBranching());
    assertPremise(lResult.getPremise(), NONE, ImmutableSet.of(A, B));
  }

  @Test
  public void testConjunctionLeft()
  {
    Decomposition lResult = DecompositionRules.left(getConjunction(A, B));
    assertFalse(lResult.isBranching());
    assertPremise(lResult.getPremise(), ImmutableSet.of(A, B), NONE);
  }

  @Test
  public void testConjunctionRight()
  {
    Decomposition lResult = DecompositionRules.right(getConjunction(A, B));
    assertTrue(lResult.isBranching());
    assertPremise(lResult.getPremises().get(0), NONE, ImmutableSet.of(A));
    assertPremise(lResult.getPremises().get(1), NONE, ImmutableSet.of(B));
  }

  @Test
  public void testConditionalLeft()
  {
    Decomposition lResult = DecompositionRules.left(getConditional(A, B));
    assertTrue(lResult.isBranching());
    assertPremise(lResult.getPremises().get(0), NONE, ImmutableSet.of(A));
    assertPremise(lResult.getPremises().get(1), ImmutableSet.of(B), NONE);
  }

  @Test
  public void testConditionalRight()
  {
    Decomposition lResult = DecompositionRules.right(getConditional(A, B));
    assertFalse(lResult.isBranching());
    assertPremise(lResult.getPremise(), ImmutableSet.of(A), ImmutableSet.of(B));
  }

  @Test
  public void testBranchingMatchesConnectiveFlags()
  {
    for (Sentence lSentence : ImmutableSet.of(getNegation(A),
                                              getDisjunction(A, B),
                                              getConjunction(A, B),
                                              getConditional(A, B)))
    {
      ComplexSentence lComplex = (ComplexSentence)lSentence;
      assertEquals(lComplex.branchesOnLeft(), DecompositionRules.left(lComplex).isBranching());
      assertEquals(lComplex.branchesOnRight(), DecompositionRules.right(lComplex).isBranching());
    }
  }

  @Test(expected = IllegalStateException.class)
  public void testBranchingHasNoSinglePremise()
  {
    DecompositionRules.left(getDisjunction(A, B)).getPremise();
  }
}
