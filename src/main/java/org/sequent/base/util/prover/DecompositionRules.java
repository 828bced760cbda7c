package org.sequent.base.util.prover;

import org.sequent.base.util.logic.grammar.BinarySentence;
import org.sequent.base.util.logic.grammar.ComplexSentence;
import org.sequent.base.util.logic.grammar.Negation;
import org.sequent.base.util.logic.grammar.Sentence;
import org.sequent.base.util.prover.Decomposition.Premise;

import com.google.common.collect.ImmutableSet;

/**
 * The left and right decomposition rules for each connective.  Rules are read from the conclusion upwards: they say
 * which sequents must be falsifiable for the sequent containing the connective to be falsifiable.
 *
 * <pre>
 *   Negation     left   {¬a} + L => R          becomes  L => R + {a}
 *                right  L => R + {¬a}          becomes  {a} + L => R
 *   Disjunction  left   {a ∨ b} + L => R       becomes  {a} + L => R   and  {b} + L => R
 *                right  L => R + {a ∨ b}       becomes  L => R + {a, b}
 *   Conjunction  left   {a ∧ b} + L => R       becomes  {a, b} + L => R
 *                right  L => R + {a ∧ b}       becomes  L => R + {a}   and  L => R + {b}
 *   Conditional  left   {a → b} + L => R       becomes  L => R + {a}   and  {b} + L => R
 *                right  L => R + {a → b}       becomes  {a} + L => R + {b}
 * </pre>
 */
public final class DecompositionRules
{
  private static final ImmutableSet<Sentence> NONE = ImmutableSet.of();

  private DecompositionRules()
  {
  }

  /**
   * @return the decomposition of a sentence appearing in the antecedents.
   *
   * @param xiSentence - the sentence to decompose.
   */
  public static Decomposition left(ComplexSentence xiSentence)
  {
    switch (xiSentence.getConnective())
    {
      case NEGATION:
        return Decomposition.single(NONE, ImmutableSet.of(((Negation)xiSentence).getNegand()));

      case DISJUNCTION:
      {
        BinarySentence lOr = (BinarySentence)xiSentence;
        return Decomposition.branching(new Premise(ImmutableSet.of(lOr.getLeft()), NONE),
                                       new Premise(ImmutableSet.of(lOr.getRight()), NONE));
      }

      case CONJUNCTION:
      {
        BinarySentence lAnd = (BinarySentence)xiSentence;
        return Decomposition.single(ImmutableSet.of(lAnd.getLeft(), lAnd.getRight()), NONE);
      }

      case CONDITIONAL:
      {
        BinarySentence lCond = (BinarySentence)xiSentence;
        return Decomposition.branching(new Premise(NONE, ImmutableSet.of(lCond.getLeft())),
                                       new Premise(ImmutableSet.of(lCond.getRight()), NONE));
      }

      default:
        throw new IllegalArgumentException("Unknown connective: " + xiSentence.getConnective());
    }
  }

  /**
   * @return the decomposition of a sentence appearing in the consequents.
   *
   * @param xiSentence - the sentence to decompose.
   */
  public static Decomposition right(ComplexSentence xiSentence)
  {
    switch (xiSentence.getConnective())
    {
      case NEGATION:
        return Decomposition.single(ImmutableSet.of(((Negation)xiSentence).getNegand()), NONE);

      case DISJUNCTION:
      {
        BinarySentence lOr = (BinarySentence)xiSentence;
        return Decomposition.single(NONE, ImmutableSet.of(lOr.getLeft(), lOr.getRight()));
      }

      case CONJUNCTION:
      {
        BinarySentence lAnd = (BinarySentence)xiSentence;
        return Decomposition.branching(new Premise(NONE, ImmutableSet.of(lAnd.getLeft())),
                                       new Premise(NONE, ImmutableSet.of(lAnd.getRight())));
      }

      case CONDITIONAL:
      {
        BinarySentence lCond = (BinarySentence)xiSentence;
        return Decomposition.single(ImmutableSet.of(lCond.getLeft()), ImmutableSet.of(lCond.getRight()));
      }

      default:
        throw new IllegalArgumentException("Unknown connective: " + xiSentence.getConnective());
    }
  }
}
