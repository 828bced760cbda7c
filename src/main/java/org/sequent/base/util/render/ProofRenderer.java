package org.sequent.base.util.render;

import org.sequent.base.util.prover.ProofResult;

/**
 * Turns the result of a proof search into human-readable output.
 */
public interface ProofRenderer
{
  /**
   * @return the rendered proof tree, or the rendered counterexample if the sequent was refuted.
   */
  public String render(ProofResult xiResult);
}
