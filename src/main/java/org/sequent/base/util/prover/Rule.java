package org.sequent.base.util.prover;

import org.sequent.base.util.logic.grammar.Connective;

/**
 * The rule applied at a node of a proof tree: the left or right rule of a connective, or one of the terminal rules.
 */
public final class Rule
{
  /**
   * Kinds of rule.
   */
  public static enum Kind
  {
    /**
     * Decomposition of an antecedent.
     */
    LEFT("left"),

    /**
     * Decomposition of a consequent.
     */
    RIGHT("right"),

    /**
     * A closed leaf: <code>{p} => {p}</code>.
     */
    AXIOM("axiom"),

    /**
     * Weakening of an axiom to a larger sequent whose sides share an atom.
     */
    THINNING("thinning"),

    /**
     * A leaf whose sides share no atom, giving a counterexample.
     */
    COUNTER("counter");

    public final String mLabel;

    private Kind(String xiLabel)
    {
      mLabel = xiLabel;
    }
  }

  public static final Rule AXIOM    = new Rule(Kind.AXIOM, null);
  public static final Rule THINNING = new Rule(Kind.THINNING, null);
  public static final Rule COUNTER  = new Rule(Kind.COUNTER, null);

  private final Kind       mKind;
  private final Connective mConnective;

  private Rule(Kind xiKind, Connective xiConnective)
  {
    mKind = xiKind;
    mConnective = xiConnective;
  }

  /**
   * @return the rule decomposing the given connective in the antecedents.
   */
  public static Rule left(Connective xiConnective)
  {
    return new Rule(Kind.LEFT, xiConnective);
  }

  /**
   * @return the rule decomposing the given connective in the consequents.
   */
  public static Rule right(Connective xiConnective)
  {
    return new Rule(Kind.RIGHT, xiConnective);
  }

  public Kind getKind()
  {
    return mKind;
  }

  /**
   * @return the connective for a LEFT or RIGHT rule, or null for a terminal rule.
   */
  public Connective getConnective()
  {
    return mConnective;
  }

  /**
   * @return whether this rule ends a branch.
   */
  public boolean isTerminal()
  {
    return mConnective == null;
  }

  /**
   * @return the plain-text name, e.g. "left ∧" or "axiom".
   */
  public String getName()
  {
    return (mConnective == null) ? mKind.mLabel : mKind.mLabel + " " + mConnective.getSymbol();
  }

  /**
   * @return the name for use in LaTeX, e.g. "left \wedge" or "axiom".
   */
  public String getLatexName()
  {
    return (mConnective == null) ? mKind.mLabel : mKind.mLabel + " " + mConnective.getLatexSymbol();
  }

  @Override
  public boolean equals(Object xiOther)
  {
    if (!(xiOther instanceof Rule))
    {
      return false;
    }
    Rule lOther = (Rule)xiOther;
    return mKind == lOther.mKind && mConnective == lOther.mConnective;
  }

  @Override
  public int hashCode()
  {
    return 31 * mKind.ordinal() + ((mConnective == null) ? 0 : mConnective.ordinal() + 1);
  }

  @Override
  public String toString()
  {
    return getName();
  }
}
