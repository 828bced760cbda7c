package org.sequent.base.util.prover;

import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.RecursiveTask;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Sequent prover that searches the two premises of each branching rule concurrently on a fork-join pool.
 *
 * The first counterexample found by any branch is recorded in the search context.  The sibling of a refuted branch is
 * cancelled if it hasn't started, and every other branch gives up at its next step.  Only the branch that found the
 * counterexample contributes to the reported derivation.  The verdict is always the same as
 * {@link SequentProver}'s, though a different counterexample may be reported when there are several.
 */
public class ParallelSequentProver extends AbstractSequentProver implements AutoCloseable
{
  private static final Logger LOGGER = LogManager.getLogger();

  private final ForkJoinPool mPool;

  /**
   * Create a prover.
   *
   * @param xiThreads  - the number of worker threads.
   * @param xiMaxDepth - the deepest rule application allowed before giving up, or -1 for no limit.
   */
  public ParallelSequentProver(int xiThreads, int xiMaxDepth)
  {
    super(xiMaxDepth);
    mPool = new ForkJoinPool(xiThreads);
    LOGGER.debug("Created parallel prover with " + xiThreads + " threads");
  }

  public int getParallelism()
  {
    return mPool.getParallelism();
  }

  @Override
  protected ProofResult runSearch(Sequent xiSequent, SearchContext xiContext)
  {
    return mPool.invoke(new BranchTask(xiSequent, 0, xiContext));
  }

  @Override
  protected ProofResult searchBranches(Sequent xiParent,
                                       Rule xiRule,
                                       Sequent xiFirst,
                                       Sequent xiSecond,
                                       int xiDepth,
                                       SearchContext xiContext)
  {
    BranchTask lSecondTask = new BranchTask(xiSecond, xiDepth + 1, xiContext);
    lSecondTask.fork();

    ProofResult lFirst;
    try
    {
      lFirst = search(xiFirst, xiDepth + 1, xiContext);
    }
    catch (RuntimeException lEx)
    {
      lSecondTask.cancel(true);
      throw lEx;
    }

    if (!lFirst.isValid() && !lFirst.isAbandoned())
    {
      lSecondTask.cancel(true);
      return refutedBranch(xiParent, xiRule, null, lFirst);
    }

    // The first premise closed, or gave up because of a refutation that may be in the second premise.
    ProofResult lSecond = lSecondTask.join();
    if (!lSecond.isValid())
    {
      return refutedBranch(xiParent, xiRule, lFirst.isValid() ? lFirst.getProof() : null, lSecond);
    }

    if (!lFirst.isValid())
    {
      return refutedBranch(xiParent, xiRule, null, lFirst);
    }

    return combineBranches(xiParent, xiRule, lFirst, lSecond);
  }

  /**
   * Shut down the worker threads.
   */
  @Override
  public void close()
  {
    mPool.shutdown();
  }

  /**
   * Search task for one premise.
   */
  private class BranchTask extends RecursiveTask<ProofResult>
  {
    private static final long serialVersionUID = 1L;

    private final Sequent       mSequent;
    private final int           mDepth;
    private final SearchContext mContext;

    BranchTask(Sequent xiSequent, int xiDepth, SearchContext xiContext)
    {
      mSequent = xiSequent;
      mDepth = xiDepth;
      mContext = xiContext;
    }

    @Override
    protected ProofResult compute()
    {
      return search(mSequent, mDepth, mContext);
    }
  }
}
