package org.sequent.base.util.logic.grammar;

/**
 * A <i>conditional</i>: <code>(a → b)</code>, where <code>a</code> is the <i>antecedent</i> and <code>b</code> is the
 * <i>consequent</i>.  Only false when the antecedent is true and the consequent false.
 *
 * See {@link Sentence} for a complete description of the sentence hierarchy.
 */
@SuppressWarnings("serial")
public final class Conditional extends BinarySentence
{
  Conditional(Sentence antecedent, Sentence consequent)
  {
    super(antecedent, consequent);
  }

  public Sentence getAntecedent()
  {
    return getLeft();
  }

  public Sentence getConsequent()
  {
    return getRight();
  }

  @Override
  public Connective getConnective()
  {
    return Connective.CONDITIONAL;
  }

  @Override
  protected boolean combine(boolean xiLeft, boolean xiRight)
  {
    return !xiLeft || xiRight;
  }
}
