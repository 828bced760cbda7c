package org.sequent.base.util.logic.grammar;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Factory for sentences.  Structurally equal sentences created through the pool are shared, which keeps repeated
 * sub-formulas cheap.  Equality of sentences never depends on pooling.
 */
public final class SentencePool
{
  private static final ConcurrentMap<Sentence, Sentence> POOL = new ConcurrentHashMap<>();

  private SentencePool()
  {
  }

  /**
   * @return the pooled instance equal to the given sentence, adding it to the pool if necessary.
   */
  @SuppressWarnings("unchecked")
  public static <T extends Sentence> T immerse(T xiSentence)
  {
    Sentence lExisting = POOL.putIfAbsent(xiSentence, xiSentence);
    return (lExisting == null) ? xiSentence : (T)lExisting;
  }

  /**
   * Empty the pool.  Sentences created before the drain remain valid and equal to those created after it.
   */
  public static void drainPool()
  {
    POOL.clear();
  }

  public static Atom getAtom(String xiSymbol)
  {
    return immerse(new Atom(xiSymbol));
  }

  public static Negation getNegation(Sentence xiNegand)
  {
    return immerse(new Negation(xiNegand));
  }

  public static Disjunction getDisjunction(Sentence xiLeft, Sentence xiRight)
  {
    return immerse(new Disjunction(xiLeft, xiRight));
  }

  public static Conjunction getConjunction(Sentence xiLeft, Sentence xiRight)
  {
    return immerse(new Conjunction(xiLeft, xiRight));
  }

  public static Conditional getConditional(Sentence xiAntecedent, Sentence xiConsequent)
  {
    return immerse(new Conditional(xiAntecedent, xiConsequent));
  }
}
