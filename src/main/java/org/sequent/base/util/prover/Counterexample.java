package org.sequent.base.util.prover;

import java.util.Map;
import java.util.Set;

import org.sequent.base.util.logic.grammar.Atom;
import org.sequent.base.util.logic.grammar.Sentence;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedMap;

/**
 * A truth assignment that makes every antecedent of a sequent true and every consequent false, witnessing that the
 * argument is invalid.
 *
 * It covers exactly the atoms of the atomic leaf it was read from.  Atoms of the original sequent that were dropped on
 * the way to that leaf can take either value.
 */
public final class Counterexample
{
  private static final Joiner.MapJoiner ASSIGNMENT_JOINER = Joiner.on(", ").withKeyValueSeparator(": ");

  private final ImmutableSortedMap<String, Boolean> mAssignment;

  private Counterexample(ImmutableSortedMap<String, Boolean> xiAssignment)
  {
    mAssignment = xiAssignment;
  }

  /**
   * Read a counterexample from an atomic sequent whose sides share nothing: antecedent atoms are true and consequent
   * atoms are false.
   *
   * @param xiLeaf - the failing leaf.
   */
  public static Counterexample fromLeaf(Sequent xiLeaf)
  {
    ImmutableSortedMap.Builder<String, Boolean> lBuilder = ImmutableSortedMap.naturalOrder();
    for (Sentence lSentence : xiLeaf.getAntecedents())
    {
      lBuilder.put(symbolOf(lSentence), Boolean.TRUE);
    }
    for (Sentence lSentence : xiLeaf.getConsequents())
    {
      lBuilder.put(symbolOf(lSentence), Boolean.FALSE);
    }

    // Throws if an atom is on both sides.
    return new Counterexample(lBuilder.build());
  }

  private static String symbolOf(Sentence xiSentence)
  {
    if (!(xiSentence instanceof Atom))
    {
      throw new IllegalArgumentException("Counterexamples can only be read from atomic sequents: " + xiSentence);
    }
    return ((Atom)xiSentence).getSymbol();
  }

  /**
   * @return the truth value assigned to an atom.
   *
   * @param xiSymbol - the atom's symbol.
   *
   * @throws IllegalArgumentException if the atom is not covered by this counterexample.
   */
  public boolean get(String xiSymbol)
  {
    Boolean lValue = mAssignment.get(xiSymbol);
    if (lValue == null)
    {
      throw new IllegalArgumentException("Counterexample does not assign " + xiSymbol);
    }
    return lValue;
  }

  public boolean assigns(String xiSymbol)
  {
    return mAssignment.containsKey(xiSymbol);
  }

  /**
   * @return the assignment, ordered by symbol.
   */
  public ImmutableSortedMap<String, Boolean> getAssignment()
  {
    return mAssignment;
  }

  /**
   * @return this assignment extended to cover the given atoms, giving any unassigned atom the value false.
   *
   * @param xiSymbols - the atoms to cover.
   */
  public Map<String, Boolean> extendTo(Set<String> xiSymbols)
  {
    ImmutableMap.Builder<String, Boolean> lBuilder = ImmutableMap.builder();
    lBuilder.putAll(mAssignment);
    for (String lSymbol : xiSymbols)
    {
      if (!mAssignment.containsKey(lSymbol))
      {
        lBuilder.put(lSymbol, Boolean.FALSE);
      }
    }
    return lBuilder.build();
  }

  /**
   * @return whether this assignment makes every antecedent of the sequent true and every consequent false.
   */
  public boolean falsifies(Sequent xiSequent)
  {
    return xiSequent.isFalsifiedBy(extendTo(xiSequent.getAtoms()));
  }

  @Override
  public boolean equals(Object xiOther)
  {
    return (xiOther instanceof Counterexample) && mAssignment.equals(((Counterexample)xiOther).mAssignment);
  }

  @Override
  public int hashCode()
  {
    return mAssignment.hashCode();
  }

  @Override
  public String toString()
  {
    return "{" + ASSIGNMENT_JOINER.join(mAssignment) + "}";
  }
}
