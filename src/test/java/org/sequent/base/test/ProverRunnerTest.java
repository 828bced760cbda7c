package org.sequent.base.test;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import org.junit.Test;
import org.sequent.base.apps.prover.ExampleArgument;
import org.sequent.base.apps.prover.ProverRunner;
import org.sequent.base.util.prover.ProofResult;
import org.sequent.base.util.prover.SequentProver;

public class ProverRunnerTest
{
  private String mOutput;

  private boolean run(String... xiArgs)
  {
    ByteArrayOutputStream lBytes = new ByteArrayOutputStream();
    boolean lResult;
    try (PrintStream lOut = ProverRunner.openOutput(lBytes))
    {
      lResult = ProverRunner.run(xiArgs, lOut);
    }
    mOutput = new String(lBytes.toByteArray(), StandardCharsets.UTF_8);
    return lResult;
  }

  @Test
  public void testExamplesHaveExpectedVerdicts()
  {
    SequentProver lProver = new SequentProver();
    for (ExampleArgument lExample : ExampleArgument.values())
    {
      ProofResult lResult = lProver.prove(lExample.getSequent());
      assertEquals(lExample.getName(), lExample.isValid(), lResult.isValid());
      assertEquals(lExample, ExampleArgument.fromName(lExample.getName()));
    }
    assertNull(ExampleArgument.fromName("no-such-example"));
  }

  @Test
  public void testSingleExampleAsText()
  {
    assertTrue(run("modus-ponens", "text"));
    assertTrue(mOutput.startsWith("Valid: P, (P → Q) ⇒ Q"));
    assertTrue(mOutput.contains("[left →]"));
  }

  @Test
  public void testInvalidExampleAsLatex()
  {
    assertTrue(run("affirming-the-consequent", "latex"));
    assertTrue(mOutput.startsWith("% Counterexample: P = false, Q = true"));
    assertTrue(mOutput.contains("\\begin{prooftree}"));
  }

  @Test
  public void testAllExamples()
  {
    assertTrue(run("all", "text"));
    for (ExampleArgument lExample : ExampleArgument.values())
    {
      String lHeader = (lExample.isValid() ? "Valid: " : "Invalid: ") + lExample.getSequent();
      assertTrue("Missing " + lHeader, mOutput.contains(lHeader));
    }
  }

  @Test
  public void testOutputIsUtf8()
  {
    assertTrue(run("tautology", "latex"));
    String lExpected = "\\infer1[right \\rightarrow]{ Ø &\\Rightarrow (P \\rightarrow (Q \\rightarrow P)) }";
    assertTrue(mOutput.contains(lExpected));

    ByteArrayOutputStream lBytes = new ByteArrayOutputStream();
    PrintStream lOut = ProverRunner.openOutput(lBytes);
    lOut.print("Ø ⇒ (P → Q)");
    assertArrayEquals("Ø ⇒ (P → Q)".getBytes(StandardCharsets.UTF_8), lBytes.toByteArray());
  }

  @Test
  public void testNoArgumentsPrintsUsage()
  {
    assertFalse(run());
    assertTrue(mOutput.contains("ProverRunner [example|all] [latex|text]"));
    assertTrue(mOutput.contains("hypothetical-syllogism"));
  }

  @Test
  public void testUnknownExample()
  {
    assertFalse(run("modus-tollens"));
    assertTrue(mOutput.startsWith("Unknown example: modus-tollens"));
  }

  @Test
  public void testUnknownFormat()
  {
    assertFalse(run("tautology", "html"));
    assertTrue(mOutput.startsWith("Unknown render format: html"));
  }
}
