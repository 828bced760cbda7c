package org.sequent.base.util.logic.grammar;

import java.util.Map;
import java.util.Set;

import com.google.common.base.Preconditions;

/**
 * A complex sentence with an ordered pair of operands: a <i>disjunction</i>, <i>conjunction</i> or
 * <i>conditional</i>.
 *
 * See {@link Sentence} for a complete description of the sentence hierarchy.
 */
@SuppressWarnings("serial")
public abstract class BinarySentence extends ComplexSentence
{
  private final Sentence left;
  private final Sentence right;
  private transient int  hash;

  BinarySentence(Sentence left, Sentence right)
  {
    this.left = Preconditions.checkNotNull(left, "Left operand must not be null");
    this.right = Preconditions.checkNotNull(right, "Right operand must not be null");
  }

  public Sentence getLeft()
  {
    return left;
  }

  public Sentence getRight()
  {
    return right;
  }

  /**
   * Combine the truth values of the two operands.
   */
  protected abstract boolean combine(boolean xiLeft, boolean xiRight);

  @Override
  public int symbolCount()
  {
    return 1 + left.symbolCount() + right.symbolCount();
  }

  @Override
  public boolean evaluate(Map<String, Boolean> xiAssignment)
  {
    // Evaluate both sides so that an unassigned atom is always reported.
    boolean lLeft = left.evaluate(xiAssignment);
    boolean lRight = right.evaluate(xiAssignment);
    return combine(lLeft, lRight);
  }

  @Override
  protected void addAtoms(Set<String> xiAtoms)
  {
    left.addAtoms(xiAtoms);
    right.addAtoms(xiAtoms);
  }

  @Override
  public String toLatex()
  {
    return "(" + left.toLatex() + " " + getConnective().getLatexSymbol() + " " + right.toLatex() + ")";
  }

  @Override
  public boolean equals(Object xiOther)
  {
    if (this == xiOther)
    {
      return true;
    }
    if (xiOther == null || xiOther.getClass() != getClass())
    {
      return false;
    }
    BinarySentence lOther = (BinarySentence)xiOther;
    return left.equals(lOther.left) && right.equals(lOther.right);
  }

  @Override
  public int hashCode()
  {
    if (hash == 0)
    {
      hash = 31 * (31 * (getConnective().ordinal() + 1) + left.hashCode()) + right.hashCode();
    }
    return hash;
  }

  @Override
  public String toString()
  {
    return "(" + left + " " + getConnective().getSymbol() + " " + right + ")";
  }
}
