package org.sequent.base.test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.sequent.base.util.logic.grammar.SentencePool.getAtom;
import static org.sequent.base.util.logic.grammar.SentencePool.getConditional;
import static org.sequent.base.util.logic.grammar.SentencePool.getConjunction;
import static org.sequent.base.util.logic.grammar.SentencePool.getDisjunction;

import org.apache.commons.lang.StringUtils;
import org.junit.Test;
import org.sequent.base.util.logic.grammar.Atom;
import org.sequent.base.util.prover.ProofResult;
import org.sequent.base.util.prover.Sequent;
import org.sequent.base.util.prover.SequentProver;
import org.sequent.base.util.render.LatexProofRenderer;
import org.sequent.base.util.render.ProofRenderer;
import org.sequent.base.util.render.RenderFormat;
import org.sequent.base.util.render.TextProofRenderer;

import com.google.common.collect.ImmutableSet;

public class RendererTests
{
  private final Atom P = getAtom("P");
  private final Atom Q = getAtom("Q");
  private final Atom R = getAtom("R");

  private static ProofResult prove(Sequent xiSequent)
  {
    return new SequentProver().prove(xiSequent);
  }

  private static String lines(String... xiLines)
  {
    return StringUtils.join(xiLines, "\n");
  }

  @Test
  public void testLatexAxiom()
  {
    String lLatex = new LatexProofRenderer().render(prove(new Sequent(ImmutableSet.of(P), ImmutableSet.of(P))));
    assertEquals(lines("\\begin{prooftree}",
                       "\\infer0[axiom]{ P &\\Rightarrow P }",
                       "\\end{prooftree}"),
                 lLatex);
  }

  @Test
  public void testLatexChildrenBeforeParent()
  {
    String lLatex = new LatexProofRenderer().render(prove(new Sequent(ImmutableSet.of(P, getConditional(P, Q)),
                                                                      ImmutableSet.of(Q))));
    assertEquals(lines("\\begin{prooftree}",
                       "\\infer0[axiom]{ P &\\Rightarrow P }",
                       "\\infer1[thinning]{ P &\\Rightarrow Q, P }",
                       "\\infer0[axiom]{ Q &\\Rightarrow Q }",
                       "\\infer1[thinning]{ P, Q &\\Rightarrow Q }",
                       "\\infer2[left \\rightarrow]{ P, (P \\rightarrow Q) &\\Rightarrow Q }",
                       "\\end{prooftree}"),
                 lLatex);
  }

  @Test
  public void testLatexCounterexample()
  {
    String lLatex = new LatexProofRenderer().render(prove(new Sequent(ImmutableSet.of(P, getConditional(Q, P)),
                                                                      ImmutableSet.of(Q))));
    assertEquals(lines("% Counterexample: P = true, Q = false",
                       "\\begin{prooftree}",
                       "\\hypo{ P &\\Rightarrow Q }",
                       "\\rewrite{\\color{red}\\box\\treebox}",
                       "\\infer1[left \\rightarrow]{ P, (Q \\rightarrow P) &\\Rightarrow Q }",
                       "\\end{prooftree}"),
                 lLatex);
  }

  @Test
  public void testLatexCounterexampleKeepsEveryStep()
  {
    String lLatex = new LatexProofRenderer().render(prove(new Sequent(ImmutableSet.of(getConjunction(P,
                                                                                     getConditional(Q, R))),
                                                                      ImmutableSet.of(R))));
    assertEquals(lines("% Counterexample: P = true, Q = false, R = false",
                       "\\begin{prooftree}",
                       "\\hypo{ P &\\Rightarrow R, Q }",
                       "\\rewrite{\\color{red}\\box\\treebox}",
                       "\\infer1[left \\rightarrow]{ P, (Q \\rightarrow R) &\\Rightarrow R }",
                       "\\infer1[left \\wedge]{ (P \\wedge (Q \\rightarrow R)) &\\Rightarrow R }",
                       "\\end{prooftree}"),
                 lLatex);
  }

  @Test
  public void testLatexCounterexampleKeepsClosedSibling()
  {
    String lLatex = new LatexProofRenderer().render(prove(new Sequent(ImmutableSet.of(getDisjunction(P, Q)),
                                                                      ImmutableSet.of(P))));
    assertEquals(lines("% Counterexample: P = false, Q = true",
                       "\\begin{prooftree}",
                       "\\infer0[axiom]{ P &\\Rightarrow P }",
                       "\\hypo{ Q &\\Rightarrow P }",
                       "\\rewrite{\\color{red}\\box\\treebox}",
                       "\\infer2[left \\vee]{ (P \\vee Q) &\\Rightarrow P }",
                       "\\end{prooftree}"),
                 lLatex);
  }

  @Test
  public void testLatexAtomicCounterexampleHasNoInference()
  {
    String lLatex = new LatexProofRenderer().render(prove(new Sequent(ImmutableSet.of(P), ImmutableSet.of(Q))));
    assertTrue(lLatex.contains("\\hypo{ P &\\Rightarrow Q }"));
    assertFalse(lLatex.contains("\\infer"));
  }

  @Test
  public void testTextProof()
  {
    String lText = new TextProofRenderer().render(prove(new Sequent(ImmutableSet.of(P, Q), ImmutableSet.of(P))));
    assertEquals(lines("Valid: P, Q ⇒ P",
                       "  P, Q ⇒ P   [thinning]",
                       "    P ⇒ P   [axiom]"),
                 lText);
  }

  @Test
  public void testTextCounterexample()
  {
    String lText = new TextProofRenderer().render(prove(new Sequent(ImmutableSet.of(P, getConditional(Q, P)),
                                                                    ImmutableSet.of(Q))));
    assertEquals(lines("Invalid: P, (Q → P) ⇒ Q",
                       "  P, (Q → P) ⇒ Q   [left →]",
                       "    P ⇒ Q   [counter]",
                       "Counterexample: {P: true, Q: false}"),
                 lText);
  }

  @Test
  public void testRenderFormatByName()
  {
    assertEquals(RenderFormat.LATEX, RenderFormat.fromName("latex"));
    assertEquals(RenderFormat.TEXT, RenderFormat.fromName(" Text "));
    ProofRenderer lRenderer = RenderFormat.TEXT.createRenderer();
    assertTrue(lRenderer instanceof TextProofRenderer);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testUnknownRenderFormat()
  {
    RenderFormat.fromName("html");
  }
}
