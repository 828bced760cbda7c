package org.sequent.base.util.logic.grammar;

import java.util.Map;
import java.util.Set;

import com.google.common.base.Preconditions;

/**
 * A <i>negation</i> is a negated sentence.
 *
 * See {@link Sentence} for a complete description of the sentence hierarchy.
 */
@SuppressWarnings("serial")
public final class Negation extends ComplexSentence
{
  private final Sentence negand;

  Negation(Sentence negand)
  {
    this.negand = Preconditions.checkNotNull(negand, "Negand must not be null");
  }

  public Sentence getNegand()
  {
    return negand;
  }

  @Override
  public Connective getConnective()
  {
    return Connective.NEGATION;
  }

  @Override
  public int symbolCount()
  {
    return 1 + negand.symbolCount();
  }

  @Override
  public boolean evaluate(Map<String, Boolean> xiAssignment)
  {
    return !negand.evaluate(xiAssignment);
  }

  @Override
  protected void addAtoms(Set<String> xiAtoms)
  {
    negand.addAtoms(xiAtoms);
  }

  @Override
  public String toLatex()
  {
    return "\\neg " + negand.toLatex();
  }

  @Override
  public boolean equals(Object xiOther)
  {
    if (this == xiOther)
    {
      return true;
    }
    if (!(xiOther instanceof Negation))
    {
      return false;
    }
    return negand.equals(((Negation)xiOther).negand);
  }

  @Override
  public int hashCode()
  {
    return 31 * (Connective.NEGATION.ordinal() + 1) + negand.hashCode();
  }

  @Override
  public String toString()
  {
    return "¬" + negand;
  }
}
