package org.sequent.base.util.logic.grammar;

/**
 * A <i>complex sentence</i> is a sentence built by applying a {@link Connective} to one or two smaller sentences.
 *
 * See {@link Sentence} for a complete description of the sentence hierarchy.
 */
@SuppressWarnings("serial")
public abstract class ComplexSentence extends Sentence
{
  /**
   * @return the connective at the top of this sentence.
   */
  public abstract Connective getConnective();

  public boolean branchesOnLeft()
  {
    return getConnective().branchesOnLeft();
  }

  public boolean branchesOnRight()
  {
    return getConnective().branchesOnRight();
  }

  @Override
  public boolean isAtomic()
  {
    return false;
  }
}
