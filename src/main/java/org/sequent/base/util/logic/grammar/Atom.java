package org.sequent.base.util.logic.grammar;

import java.util.Map;
import java.util.Set;

/**
 * An <i>atom</i> is a basic proposition, named by its symbol.
 *
 * See {@link Sentence} for a complete description of the sentence hierarchy.
 */
@SuppressWarnings("serial")
public final class Atom extends Sentence
{
  private final String symbol;

  Atom(String symbol)
  {
    if (symbol == null || symbol.isEmpty())
    {
      throw new IllegalArgumentException("Atoms must have a non-empty symbol");
    }
    this.symbol = symbol.intern();
  }

  public String getSymbol()
  {
    return symbol;
  }

  @Override
  public boolean isAtomic()
  {
    return true;
  }

  @Override
  public int symbolCount()
  {
    return 1;
  }

  @Override
  public boolean evaluate(Map<String, Boolean> xiAssignment)
  {
    Boolean lValue = xiAssignment.get(symbol);
    if (lValue == null)
    {
      throw new IllegalArgumentException("No truth value assigned to " + symbol);
    }
    return lValue;
  }

  @Override
  protected void addAtoms(Set<String> xiAtoms)
  {
    xiAtoms.add(symbol);
  }

  @Override
  public String toLatex()
  {
    return symbol;
  }

  @Override
  public boolean equals(Object xiOther)
  {
    if (this == xiOther)
    {
      return true;
    }
    if (!(xiOther instanceof Atom))
    {
      return false;
    }
    return symbol.equals(((Atom)xiOther).symbol);
  }

  @Override
  public int hashCode()
  {
    return symbol.hashCode();
  }

  @Override
  public String toString()
  {
    return symbol;
  }
}
