package org.sequent.base.apps.prover;

import static org.sequent.base.util.logic.grammar.SentencePool.getAtom;
import static org.sequent.base.util.logic.grammar.SentencePool.getConditional;
import static org.sequent.base.util.logic.grammar.SentencePool.getConjunction;
import static org.sequent.base.util.logic.grammar.SentencePool.getDisjunction;
import static org.sequent.base.util.logic.grammar.SentencePool.getNegation;

import org.sequent.base.util.logic.grammar.Atom;
import org.sequent.base.util.logic.grammar.Sentence;
import org.sequent.base.util.prover.Sequent;

import com.google.common.collect.ImmutableSet;

/**
 * Built-in example arguments for the command line prover.
 */
public enum ExampleArgument
{
  MODUS_PONENS("modus-ponens", true)
  {
    @Override
    Sequent build()
    {
      return new Sequent(ImmutableSet.of(P, getConditional(P, Q)), ImmutableSet.of(Q));
    }
  },

  TAUTOLOGY("tautology", true)
  {
    @Override
    Sequent build()
    {
      return new Sequent(ImmutableSet.<Sentence>of(), ImmutableSet.of(getConditional(P, getConditional(Q, P))));
    }
  },

  DOUBLE_NEGATION("double-negation", true)
  {
    @Override
    Sequent build()
    {
      return new Sequent(ImmutableSet.of(P), ImmutableSet.of(getNegation(getNegation(P))));
    }
  },

  DE_MORGAN("de-morgan", true)
  {
    @Override
    Sequent build()
    {
      return new Sequent(ImmutableSet.of(getNegation(getDisjunction(P, Q))),
                         ImmutableSet.of(getConjunction(getNegation(P), getNegation(Q))));
    }
  },

  HYPOTHETICAL_SYLLOGISM("hypothetical-syllogism", true)
  {
    @Override
    Sequent build()
    {
      return new Sequent(ImmutableSet.of(P, getConditional(P, Q), getConditional(Q, R)), ImmutableSet.of(R));
    }
  },

  AFFIRMING_THE_CONSEQUENT("affirming-the-consequent", false)
  {
    @Override
    Sequent build()
    {
      return new Sequent(ImmutableSet.of(Q, getConditional(P, Q)), ImmutableSet.of(P));
    }
  },

  INVALID_SYLLOGISM("invalid-syllogism", false)
  {
    @Override
    Sequent build()
    {
      return new Sequent(ImmutableSet.of(P, getConditional(Q, P)), ImmutableSet.of(Q));
    }
  },

  FOUR_PREMISES("four-premises", true)
  {
    @Override
    Sequent build()
    {
      Atom lA = getAtom("A");
      Atom lB = getAtom("B");
      Atom lC = getAtom("C");
      Atom lD = getAtom("D");
      return new Sequent(ImmutableSet.of(getConditional(getDisjunction(lA, getNegation(lB)), lC),
                                         getConditional(lB, getNegation(lD)),
                                         lD),
                         ImmutableSet.of(lC));
    }
  };

  private static final Atom P = getAtom("P");
  private static final Atom Q = getAtom("Q");
  private static final Atom R = getAtom("R");

  private final String  mName;
  private final boolean mValid;

  private ExampleArgument(String xiName, boolean xiValid)
  {
    mName = xiName;
    mValid = xiValid;
  }

  abstract Sequent build();

  /**
   * @return the argument as a sequent.
   */
  public Sequent getSequent()
  {
    return build();
  }

  /**
   * @return the name used on the command line.
   */
  public String getName()
  {
    return mName;
  }

  /**
   * @return whether the argument is valid.
   */
  public boolean isValid()
  {
    return mValid;
  }

  /**
   * @return the example with the given command-line name, or null if there isn't one.
   */
  public static ExampleArgument fromName(String xiName)
  {
    for (ExampleArgument lExample : values())
    {
      if (lExample.mName.equals(xiName))
      {
        return lExample;
      }
    }
    return null;
  }
}
