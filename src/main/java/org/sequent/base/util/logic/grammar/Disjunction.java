package org.sequent.base.util.logic.grammar;

/**
 * A <i>disjunction</i>: <code>(a ∨ b)</code>.
 *
 * See {@link Sentence} for a complete description of the sentence hierarchy.
 */
@SuppressWarnings("serial")
public final class Disjunction extends BinarySentence
{
  Disjunction(Sentence left, Sentence right)
  {
    super(left, right);
  }

  @Override
  public Connective getConnective()
  {
    return Connective.DISJUNCTION;
  }

  @Override
  protected boolean combine(boolean xiLeft, boolean xiRight)
  {
    return xiLeft || xiRight;
  }
}
