package org.sequent.base.test;

import static org.sequent.base.util.logic.grammar.SentencePool.getAtom;
import static org.sequent.base.util.logic.grammar.SentencePool.getConditional;
import static org.sequent.base.util.logic.grammar.SentencePool.getConjunction;
import static org.sequent.base.util.logic.grammar.SentencePool.getDisjunction;
import static org.sequent.base.util.logic.grammar.SentencePool.getNegation;

import java.util.Set;

import org.junit.Assert;
import org.junit.Test;
import org.sequent.base.util.logic.grammar.Atom;
import org.sequent.base.util.logic.grammar.Sentence;
import org.sequent.base.util.prover.Counterexample;
import org.sequent.base.util.prover.ProofResult;
import org.sequent.base.util.prover.Prover;
import org.sequent.base.util.prover.Sequent;
import org.sequent.base.util.prover.SequentProver;

import com.google.common.collect.ImmutableSet;

/**
 * Classic valid and invalid arguments.
 */
public class ProverScenarioTests extends Assert
{
  private final Atom P = getAtom("P");
  private final Atom Q = getAtom("Q");
  private final Atom R = getAtom("R");

  private final Prover mProver = new SequentProver();

  private ProofResult prove(Set<? extends Sentence> xiAntecedents, Set<? extends Sentence> xiConsequents)
  {
    Sequent lSequent = new Sequent(xiAntecedents, xiConsequents);
    ProofResult lResult = mProver.prove(lSequent);
    assertEquals(lSequent, lResult.getSequent());
    return lResult;
  }

  private void assertProved(Set<? extends Sentence> xiAntecedents, Set<? extends Sentence> xiConsequents)
  {
    ProofResult lResult = prove(xiAntecedents, xiConsequents);
    assertEquals(ProofResult.Kind.PROVED, lResult.getKind());
    assertTrue(lResult.getProof().isClosed());
    assertEquals(lResult.getSequent(), lResult.getProof().getSequent());
  }

  private Counterexample assertRefuted(Set<? extends Sentence> xiAntecedents, Set<? extends Sentence> xiConsequents)
  {
    ProofResult lResult = prove(xiAntecedents, xiConsequents);
    assertEquals(ProofResult.Kind.REFUTED, lResult.getKind());
    assertTrue(lResult.getCounterexample().falsifies(lResult.getSequent()));
    return lResult.getCounterexample();
  }

  @Test
  public void testModusPonens()
  {
    assertProved(ImmutableSet.of(P, getConditional(P, Q)), ImmutableSet.of(Q));
  }

  @Test
  public void testTautology()
  {
    assertProved(ImmutableSet.<Sentence>of(), ImmutableSet.of(getConditional(P, getConditional(Q, P))));
  }

  @Test
  public void testDoubleNegation()
  {
    assertProved(ImmutableSet.of(P), ImmutableSet.of(getNegation(getNegation(P))));
  }

  @Test
  public void testContraposition()
  {
    assertProved(ImmutableSet.of(getConditional(P, Q)),
                 ImmutableSet.of(getConditional(getNegation(Q), getNegation(P))));
  }

  @Test
  public void testTransitivityOfConditionals()
  {
    assertProved(ImmutableSet.of(getConditional(P, Q), getConditional(Q, R)), ImmutableSet.of(getConditional(P, R)));
  }

  @Test
  public void testHypotheticalSyllogism()
  {
    assertProved(ImmutableSet.of(P, getConditional(P, Q), getConditional(Q, R)), ImmutableSet.of(R));
  }

  @Test
  public void testDeMorgansLaws()
  {
    assertProved(ImmutableSet.of(getNegation(getDisjunction(P, Q))),
                 ImmutableSet.of(getConjunction(getNegation(P), getNegation(Q))));
    assertProved(ImmutableSet.of(getNegation(getConjunction(P, Q))),
                 ImmutableSet.of(getDisjunction(getNegation(P), getNegation(Q))));
  }

  @Test
  public void testExcludedMiddleAndContradiction()
  {
    assertProved(ImmutableSet.<Sentence>of(), ImmutableSet.of(getDisjunction(P, getNegation(P))));
    assertProved(ImmutableSet.of(P, getNegation(P)), ImmutableSet.<Sentence>of());
  }

  @Test
  public void testInvalidSyllogism()
  {
    Counterexample lCounter = assertRefuted(ImmutableSet.of(P, getConditional(Q, P)), ImmutableSet.of(Q));
    assertTrue(lCounter.get("P"));
    assertFalse(lCounter.get("Q"));
  }

  @Test
  public void testAtomDoesNotImplyItsNegation()
  {
    Counterexample lCounter = assertRefuted(ImmutableSet.of(P), ImmutableSet.of(getNegation(P)));
    assertTrue(lCounter.get("P"));
  }

  @Test
  public void testThreeAtomCounterexample()
  {
    Counterexample lCounter = assertRefuted(ImmutableSet.of(getNegation(getConditional(getNegation(P), Q)),
                                                            getNegation(getConditional(R, P)),
                                                            getDisjunction(P, R),
                                                            getNegation(getConditional(R, Q))),
                                            ImmutableSet.of(getNegation(getConditional(P, Q))));
    assertFalse(lCounter.get("P"));
    assertFalse(lCounter.get("Q"));
    assertTrue(lCounter.get("R"));
  }

  @Test
  public void testEmptySequentIsRefuted()
  {
    Counterexample lCounter = assertRefuted(ImmutableSet.<Sentence>of(), ImmutableSet.<Sentence>of());
    assertTrue(lCounter.getAssignment().isEmpty());
  }

  @Test
  public void testCounterexampleCoversOnlyLeafAtoms()
  {
    // The first branch of P ∨ Q is {P} => {}, which is read before Q is ever seen.
    Counterexample lCounter = assertRefuted(ImmutableSet.of(getDisjunction(P, Q)), ImmutableSet.<Sentence>of());
    assertTrue(lCounter.get("P"));
    assertFalse(lCounter.assigns("Q"));
  }

  @Test
  public void testIsValid()
  {
    assertTrue(mProver.isValid(ImmutableSet.of(P, getConditional(P, Q)), ImmutableSet.of(Q)));
    assertFalse(mProver.isValid(ImmutableSet.of(Q, getConditional(P, Q)), ImmutableSet.of(P)));
  }

  @Test(expected = IllegalStateException.class)
  public void testNoCounterexampleForValidResult()
  {
    mProver.prove(new Sequent(ImmutableSet.of(P), ImmutableSet.of(P))).getCounterexample();
  }

  @Test(expected = IllegalStateException.class)
  public void testNoProofForInvalidResult()
  {
    mProver.prove(new Sequent(ImmutableSet.of(P), ImmutableSet.of(Q))).getProof();
  }
}
