package org.sequent.base.util.prover;

import java.util.concurrent.atomic.AtomicReference;

/**
 * State shared by every branch of one top-level proof search.  Records the first refutation found so that all other
 * branches stop as soon as they next look.
 */
public final class SearchContext
{
  private final AtomicReference<ProofResult> mRefutation = new AtomicReference<>();

  SearchContext()
  {
  }

  /**
   * @return the refutation found by some branch of this search, or null if none has been found yet.
   */
  public ProofResult getRefutation()
  {
    return mRefutation.get();
  }

  /**
   * Record a refutation, unless one has already been recorded.
   *
   * @param xiRefutation - the refutation just found.
   *
   * @return the given refutation if it was the first, otherwise the first one recorded, marked as abandoned.
   */
  ProofResult recordRefutation(ProofResult xiRefutation)
  {
    if (mRefutation.compareAndSet(null, xiRefutation))
    {
      return xiRefutation;
    }
    return mRefutation.get().abandoned();
  }
}
