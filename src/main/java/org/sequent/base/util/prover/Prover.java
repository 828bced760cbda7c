package org.sequent.base.util.prover;

import java.util.Set;

import org.sequent.base.util.logic.grammar.Sentence;

public interface Prover
{
  public ProofResult prove(Sequent sequent);
  public boolean isValid(Set<? extends Sentence> premises, Set<? extends Sentence> conclusions);
}
