package org.sequent.base.apps.prover;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.sequent.base.util.config.ProverConfiguration;
import org.sequent.base.util.config.ProverConfiguration.CfgItem;
import org.sequent.base.util.prover.AbstractSequentProver;
import org.sequent.base.util.prover.ParallelSequentProver;
import org.sequent.base.util.prover.ProofResult;
import org.sequent.base.util.prover.ProverFactory;
import org.sequent.base.util.prover.exceptions.SearchLimitExceededException;
import org.sequent.base.util.render.ProofRenderer;
import org.sequent.base.util.render.RenderFormat;

/**
 * This is a simple command line app for checking the built-in example arguments.
 */
public final class ProverRunner
{
  private static final Logger LOGGER = LogManager.getLogger();

  private static final String ALL = "all";

  private ProverRunner()
  {
  }

  public static void main(String[] args)
  {
    PrintStream lOut = openOutput(new FileOutputStream(FileDescriptor.out));
    boolean lSuccess = run(args, lOut);
    lOut.flush();
    if (!lSuccess)
    {
      System.exit(1);
    }
  }

  /**
   * @return a stream that prints to the given output in UTF-8, whatever the platform's default charset, since sequents
   * are written with symbols such as ⇒ and Ø.
   *
   * @param xiStream - the underlying output.
   */
  public static PrintStream openOutput(OutputStream xiStream)
  {
    return new PrintStream(xiStream, true, StandardCharsets.UTF_8);
  }

  /**
   * Prove the requested examples and print the rendered results.
   *
   * @param xiArgs - [example-name|all] [latex|text]
   * @param xiOut  - where to print the output.
   *
   * @return whether the arguments were understood.
   */
  public static boolean run(String[] xiArgs, PrintStream xiOut)
  {
    if (xiArgs.length < 1)
    {
      printUsage(xiOut);
      return false;
    }

    List<ExampleArgument> lExamples = new ArrayList<>();
    if (xiArgs[0].equals(ALL))
    {
      for (ExampleArgument lExample : ExampleArgument.values())
      {
        lExamples.add(lExample);
      }
    }
    else
    {
      ExampleArgument lExample = ExampleArgument.fromName(xiArgs[0]);
      if (lExample == null)
      {
        xiOut.println("Unknown example: " + xiArgs[0]);
        printUsage(xiOut);
        return false;
      }
      lExamples.add(lExample);
    }

    RenderFormat lFormat;
    try
    {
      lFormat = RenderFormat.fromName((xiArgs.length > 1) ? xiArgs[1] :
                                                            ProverConfiguration.getCfgStr(CfgItem.RENDER_FORMAT));
    }
    catch (IllegalArgumentException lEx)
    {
      xiOut.println(lEx.getMessage());
      printUsage(xiOut);
      return false;
    }

    ProverConfiguration.logConfig();

    ProofRenderer lRenderer = lFormat.createRenderer();
    AbstractSequentProver lProver = ProverFactory.createProver();
    try
    {
      for (ExampleArgument lExample : lExamples)
      {
        ThreadContext.put("argument", lExample.getName());
        try
        {
          ProofResult lResult = lProver.prove(lExample.getSequent());
          LOGGER.info(lExample.getName() + ": " + (lResult.isValid() ? "valid" : "invalid, " +
                                                                       lResult.getCounterexample()));
          xiOut.println(lRenderer.render(lResult));
          xiOut.println();
        }
        catch (SearchLimitExceededException lEx)
        {
          LOGGER.warn(lExample.getName() + ": gave up - " + lEx.getMessage());
        }
        finally
        {
          ThreadContext.remove("argument");
        }
      }
    }
    finally
    {
      if (lProver instanceof ParallelSequentProver)
      {
        ((ParallelSequentProver)lProver).close();
      }
    }

    return true;
  }

  private static void printUsage(PrintStream xiOut)
  {
    xiOut.println("ProverRunner [example|" + ALL + "] [latex|text]");
    xiOut.print("Available examples:");
    for (ExampleArgument lExample : ExampleArgument.values())
    {
      xiOut.print(" " + lExample.getName());
    }
    xiOut.println();
  }
}
