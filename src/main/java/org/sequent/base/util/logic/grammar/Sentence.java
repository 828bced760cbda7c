package org.sequent.base.util.logic.grammar;

import java.io.Serializable;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import com.google.common.collect.ImmutableSet;

/**
 * Class at the root of the sentence hierarchy.  Every propositional formula handled by the prover is represented by an
 * object that is part of this hierarchy.
 *
 * <h1>The sentence hierarchy</h1>
 *
 * <ul>
 *
 * <li><b>Atom</b>: A basic proposition with no internal structure.  It is identified by its symbol, so two atoms with
 *     the same symbol are the same atom.
 *
 * <li><b>Complex sentence</b>: A sentence built by applying a <i>connective</i> to one or two smaller sentences.<ul>
 *
 *   <li><b>Negation</b>: <code>¬a</code>, the negation of a single sentence (the <i>negand</i>).
 *
 *   <li><b>Disjunction</b>: <code>(a ∨ b)</code>.
 *
 *   <li><b>Conjunction</b>: <code>(a ∧ b)</code>.
 *
 *   <li><b>Conditional</b>: <code>(a → b)</code>.  The left operand is the <i>antecedent</i> and the right operand is
 *       the <i>consequent</i>.</ul>
 *
 * </ul>
 *
 * <h1>Decomposition</h1>
 *
 * Each connective describes how a sentence built from it is broken down when it appears on the left (antecedent) or
 * right (consequent) side of a sequent.  Some of these decompositions <i>branch</i>, producing two sequents which must
 * both be resolved.  See {@link Connective} for the branching flags.
 *
 * <h1>Equality</h1>
 *
 * Equality and hashing are structural: two sentences are equal if they are built from the same connective applied to
 * equal operands, or are atoms with the same symbol.  Sentences are immutable, so sub-sentences can be freely shared.
 *
 * Sentences should be created through {@link SentencePool}.
 */
@SuppressWarnings("serial")
public abstract class Sentence implements Serializable
{
  /**
   * @return whether this sentence is an atom.
   */
  public abstract boolean isAtomic();

  /**
   * @return the number of symbols in this sentence.  An atom counts one and each connective adds one.
   */
  public abstract int symbolCount();

  /**
   * Evaluate this sentence under a truth assignment.
   *
   * @param xiAssignment - truth values for the atoms, keyed by symbol.
   *
   * @return the truth value of the sentence.
   *
   * @throws IllegalArgumentException if an atom in this sentence has no value in the assignment.
   */
  public abstract boolean evaluate(Map<String, Boolean> xiAssignment);

  /**
   * @return this sentence in LaTeX math notation.
   */
  public abstract String toLatex();

  /**
   * Add the symbols of all atoms in this sentence to the given set.
   */
  protected abstract void addAtoms(Set<String> xiAtoms);

  /**
   * @return the symbols of all atoms appearing in this sentence.
   */
  public ImmutableSet<String> getAtoms()
  {
    Set<String> lAtoms = new HashSet<>();
    addAtoms(lAtoms);
    return ImmutableSet.copyOf(lAtoms);
  }

  @Override
  public abstract boolean equals(Object xiOther);

  @Override
  public abstract int hashCode();

  @Override
  public abstract String toString();

  /**
   * This method is used by deserialization to ensure that sentences loaded from an ObjectInputStream are the versions
   * that exist in the SentencePool.
   */
  protected Object readResolve()
  {
    return SentencePool.immerse(this);
  }
}
