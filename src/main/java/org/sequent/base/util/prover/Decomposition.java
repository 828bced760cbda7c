package org.sequent.base.util.prover;

import org.sequent.base.util.logic.grammar.Sentence;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

/**
 * The result of decomposing one complex sentence: either a single premise (a non-branching rule) or two premises (a
 * branching rule).  Each premise lists the sentences to add to each side of the sequent in place of the decomposed
 * sentence.
 */
public final class Decomposition
{
  /**
   * The sentences added to each side of a sequent by one premise of a rule.
   */
  public static final class Premise
  {
    private final ImmutableSet<Sentence> mAntecedents;
    private final ImmutableSet<Sentence> mConsequents;

    Premise(ImmutableSet<Sentence> xiAntecedents, ImmutableSet<Sentence> xiConsequents)
    {
      mAntecedents = xiAntecedents;
      mConsequents = xiConsequents;
    }

    /**
     * @return the sentences to add to the antecedents.
     */
    public ImmutableSet<Sentence> getAntecedents()
    {
      return mAntecedents;
    }

    /**
     * @return the sentences to add to the consequents.
     */
    public ImmutableSet<Sentence> getConsequents()
    {
      return mConsequents;
    }

    @Override
    public boolean equals(Object xiOther)
    {
      if (!(xiOther instanceof Premise))
      {
        return false;
      }
      Premise lOther = (Premise)xiOther;
      return mAntecedents.equals(lOther.mAntecedents) && mConsequents.equals(lOther.mConsequents);
    }

    @Override
    public int hashCode()
    {
      return 31 * mAntecedents.hashCode() + mConsequents.hashCode();
    }

    @Override
    public String toString()
    {
      return "+" + mAntecedents + " => +" + mConsequents;
    }
  }

  private final ImmutableList<Premise> mPremises;

  private Decomposition(ImmutableList<Premise> xiPremises)
  {
    mPremises = xiPremises;
  }

  /**
   * @return a non-branching decomposition.
   */
  static Decomposition single(ImmutableSet<Sentence> xiAntecedents, ImmutableSet<Sentence> xiConsequents)
  {
    return new Decomposition(ImmutableList.of(new Premise(xiAntecedents, xiConsequents)));
  }

  /**
   * @return a branching decomposition.
   */
  static Decomposition branching(Premise xiFirst, Premise xiSecond)
  {
    return new Decomposition(ImmutableList.of(xiFirst, xiSecond));
  }

  public boolean isBranching()
  {
    return mPremises.size() == 2;
  }

  public ImmutableList<Premise> getPremises()
  {
    return mPremises;
  }

  /**
   * @return the only premise of a non-branching decomposition.
   */
  public Premise getPremise()
  {
    if (isBranching())
    {
      throw new IllegalStateException("Branching decomposition has two premises");
    }
    return mPremises.get(0);
  }

  @Override
  public String toString()
  {
    return mPremises.toString();
  }
}
