package org.sequent.base.util.prover;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.sequent.base.util.config.ProverConfiguration;
import org.sequent.base.util.config.ProverConfiguration.CfgItem;

/**
 * Creates provers according to the machine-specific configuration.
 */
public final class ProverFactory
{
  private static final Logger LOGGER = LogManager.getLogger();

  /**
   * The number of vCPUs available on the system.
   */
  public static final int NUM_CPUS = Runtime.getRuntime().availableProcessors();

  private ProverFactory()
  {
  }

  /**
   * @return a prover configured by MAX_SEARCH_DEPTH, PARALLEL_SEARCH and SEARCH_THREADS.
   */
  public static AbstractSequentProver createProver()
  {
    int lMaxDepth = ProverConfiguration.getCfgInt(CfgItem.MAX_SEARCH_DEPTH);

    if (ProverConfiguration.getCfgBool(CfgItem.PARALLEL_SEARCH))
    {
      int lThreads = ProverConfiguration.getCfgInt(CfgItem.SEARCH_THREADS);
      if (lThreads <= 0)
      {
        lThreads = NUM_CPUS;
      }
      LOGGER.info("Using parallel prover, " + lThreads + " threads, depth limit " + lMaxDepth);
      return new ParallelSequentProver(lThreads, lMaxDepth);
    }

    LOGGER.debug("Using sequential prover, depth limit " + lMaxDepth);
    return new SequentProver(lMaxDepth);
  }
}
