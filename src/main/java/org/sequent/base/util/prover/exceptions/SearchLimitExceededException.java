package org.sequent.base.util.prover.exceptions;

import org.sequent.base.util.prover.Sequent;

/**
 * Thrown when a proof search goes deeper than the configured limit.
 */
public final class SearchLimitExceededException extends ProverException
{
  private static final long serialVersionUID = 1L;

  private final int mLimit;

  public SearchLimitExceededException(int xiLimit, Sequent xiSequent)
  {
    super("Search depth limit of " + xiLimit + " exceeded at " + xiSequent);
    mLimit = xiLimit;
  }

  /**
   * @return the depth limit that was exceeded.
   */
  public int getLimit()
  {
    return mLimit;
  }
}
