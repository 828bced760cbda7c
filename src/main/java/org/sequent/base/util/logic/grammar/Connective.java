package org.sequent.base.util.logic.grammar;

/**
 * The connectives from which complex sentences are built.
 *
 * Each connective records whether its decomposition branches when the sentence is on the left of a sequent and when it
 * is on the right.  The prover applies non-branching decompositions before branching ones.
 */
public enum Connective
{
  /**
   * Negation.  Never branches.
   */
  NEGATION(false, false, "¬", "\\neg"),

  /**
   * Disjunction.  Branches on the left.
   */
  DISJUNCTION(true, false, "∨", "\\vee"),

  /**
   * Conjunction.  Branches on the right.
   */
  CONJUNCTION(false, true, "∧", "\\wedge"),

  /**
   * Material conditional.  Branches on the left.
   */
  CONDITIONAL(true, false, "→", "\\rightarrow");

  private final boolean mBranchesOnLeft;
  private final boolean mBranchesOnRight;
  private final String  mSymbol;
  private final String  mLatexSymbol;

  private Connective(boolean xiBranchesOnLeft, boolean xiBranchesOnRight, String xiSymbol, String xiLatexSymbol)
  {
    mBranchesOnLeft = xiBranchesOnLeft;
    mBranchesOnRight = xiBranchesOnRight;
    mSymbol = xiSymbol;
    mLatexSymbol = xiLatexSymbol;
  }

  /**
   * @return whether decomposing this connective in the antecedent produces two sequents.
   */
  public boolean branchesOnLeft()
  {
    return mBranchesOnLeft;
  }

  /**
   * @return whether decomposing this connective in the consequent produces two sequents.
   */
  public boolean branchesOnRight()
  {
    return mBranchesOnRight;
  }

  /**
   * @return the plain-text symbol.
   */
  public String getSymbol()
  {
    return mSymbol;
  }

  /**
   * @return the LaTeX command for the symbol.
   */
  public String getLatexSymbol()
  {
    return mLatexSymbol;
  }
}
