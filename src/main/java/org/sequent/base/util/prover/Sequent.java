package org.sequent.base.util.prover;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.sequent.base.util.logic.grammar.Sentence;
import org.sequent.base.util.prover.Decomposition.Premise;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;

/**
 * A sequent <code>{a1, ..., an} => {b1, ..., bm}</code>, which stands for "a1 and ... and an implies b1 or ... or bm".
 * An empty antecedent set means true and an empty consequent set means false.
 *
 * Sequents are immutable.  Applying a rule produces a new sequent.
 */
public final class Sequent
{
  private static final Joiner COMMA_JOINER = Joiner.on(", ");
  private static final String EMPTY_SIDE   = "Ø";

  private final ImmutableSet<Sentence> antecedents;
  private final ImmutableSet<Sentence> consequents;

  /**
   * Create a sequent.  The iteration order of each set is preserved and decides which sentence the prover picks first
   * when several are eligible.
   *
   * @param xiAntecedents - the sentences on the left of the arrow.
   * @param xiConsequents - the sentences on the right of the arrow.
   */
  public Sequent(Set<? extends Sentence> xiAntecedents, Set<? extends Sentence> xiConsequents)
  {
    antecedents = ImmutableSet.copyOf(xiAntecedents);
    consequents = ImmutableSet.copyOf(xiConsequents);
  }

  public ImmutableSet<Sentence> getAntecedents()
  {
    return antecedents;
  }

  public ImmutableSet<Sentence> getConsequents()
  {
    return consequents;
  }

  /**
   * @return the sequent produced by removing a sentence from the antecedents and adding the premise's sentences.
   *
   * @param xiSentence - the antecedent being decomposed.
   * @param xiPremise  - the sentences that replace it.
   */
  public Sequent applyLeft(Sentence xiSentence, Premise xiPremise)
  {
    return new Sequent(without(antecedents, xiSentence, xiPremise.getAntecedents()),
                       with(consequents, xiPremise.getConsequents()));
  }

  /**
   * @return the sequent produced by removing a sentence from the consequents and adding the premise's sentences.
   *
   * @param xiSentence - the consequent being decomposed.
   * @param xiPremise  - the sentences that replace it.
   */
  public Sequent applyRight(Sentence xiSentence, Premise xiPremise)
  {
    return new Sequent(with(antecedents, xiPremise.getAntecedents()),
                       without(consequents, xiSentence, xiPremise.getConsequents()));
  }

  private static ImmutableSet<Sentence> without(ImmutableSet<Sentence> xiOld,
                                                Sentence xiRemoved,
                                                ImmutableSet<Sentence> xiAdded)
  {
    ImmutableSet.Builder<Sentence> lBuilder = ImmutableSet.builder();
    for (Sentence lSentence : xiOld)
    {
      if (!lSentence.equals(xiRemoved))
      {
        lBuilder.add(lSentence);
      }
    }
    return lBuilder.addAll(xiAdded).build();
  }

  private static ImmutableSet<Sentence> with(ImmutableSet<Sentence> xiOld, ImmutableSet<Sentence> xiAdded)
  {
    if (xiAdded.isEmpty())
    {
      return xiOld;
    }
    return ImmutableSet.<Sentence>builder().addAll(xiOld).addAll(xiAdded).build();
  }

  /**
   * @return whether every sentence on both sides is an atom.
   */
  public boolean isAtomic()
  {
    for (Sentence lSentence : Sets.union(antecedents, consequents))
    {
      if (!lSentence.isAtomic())
      {
        return false;
      }
    }
    return true;
  }

  /**
   * @return the total number of symbols on both sides.  Every rule application strictly reduces this.
   */
  public int size()
  {
    int lSize = 0;
    for (Sentence lSentence : antecedents)
    {
      lSize += lSentence.symbolCount();
    }
    for (Sentence lSentence : consequents)
    {
      lSize += lSentence.symbolCount();
    }
    return lSize;
  }

  /**
   * @return the sentences that appear on both sides.
   */
  public ImmutableSet<Sentence> getSharedSentences()
  {
    return Sets.intersection(antecedents, consequents).immutableCopy();
  }

  /**
   * @return the symbols of every atom mentioned in the sequent.
   */
  public ImmutableSet<String> getAtoms()
  {
    Set<String> lAtoms = new HashSet<>();
    for (Sentence lSentence : Sets.union(antecedents, consequents))
    {
      lAtoms.addAll(lSentence.getAtoms());
    }
    return ImmutableSet.copyOf(lAtoms);
  }

  /**
   * @return whether the assignment makes every antecedent true and every consequent false.
   *
   * @param xiAssignment - truth values for every atom of the sequent.
   */
  public boolean isFalsifiedBy(Map<String, Boolean> xiAssignment)
  {
    for (Sentence lSentence : antecedents)
    {
      if (!lSentence.evaluate(xiAssignment))
      {
        return false;
      }
    }
    for (Sentence lSentence : consequents)
    {
      if (lSentence.evaluate(xiAssignment))
      {
        return false;
      }
    }
    return true;
  }

  /**
   * @return the sequent in LaTeX, with the arrow aligned for use in a proof tree.
   */
  public String toLatex()
  {
    return latexSide(antecedents) + " &\\Rightarrow " + latexSide(consequents);
  }

  private static String latexSide(ImmutableSet<Sentence> xiSide)
  {
    if (xiSide.isEmpty())
    {
      return EMPTY_SIDE;
    }
    List<String> lLatex = new ArrayList<>(xiSide.size());
    for (Sentence lSentence : xiSide)
    {
      lLatex.add(lSentence.toLatex());
    }
    return COMMA_JOINER.join(lLatex);
  }

  @Override
  public boolean equals(Object xiOther)
  {
    if (this == xiOther)
    {
      return true;
    }
    if (!(xiOther instanceof Sequent))
    {
      return false;
    }
    Sequent lOther = (Sequent)xiOther;
    return antecedents.equals(lOther.antecedents) && consequents.equals(lOther.consequents);
  }

  @Override
  public int hashCode()
  {
    return 31 * antecedents.hashCode() + consequents.hashCode();
  }

  @Override
  public String toString()
  {
    String lLeft = antecedents.isEmpty() ? EMPTY_SIDE : COMMA_JOINER.join(antecedents);
    String lRight = consequents.isEmpty() ? EMPTY_SIDE : COMMA_JOINER.join(consequents);
    return lLeft + " ⇒ " + lRight;
  }
}
