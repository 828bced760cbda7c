package org.sequent.base.util.logic.grammar;

/**
 * A <i>conjunction</i>: <code>(a ∧ b)</code>.
 *
 * See {@link Sentence} for a complete description of the sentence hierarchy.
 */
@SuppressWarnings("serial")
public final class Conjunction extends BinarySentence
{
  Conjunction(Sentence left, Sentence right)
  {
    super(left, right);
  }

  @Override
  public Connective getConnective()
  {
    return Connective.CONJUNCTION;
  }

  @Override
  protected boolean combine(boolean xiLeft, boolean xiRight)
  {
    return xiLeft && xiRight;
  }
}
