package org.sequent.base.util.render;

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang.StringUtils;
import org.sequent.base.util.prover.ProofResult;
import org.sequent.base.util.prover.RuleApp;

/**
 * Renders proofs as an indented plain-text tree, root first, one node per line.
 */
public class TextProofRenderer implements ProofRenderer
{
  private static final String INDENT = "  ";

  @Override
  public String render(ProofResult xiResult)
  {
    List<String> lLines = new ArrayList<>();

    if (xiResult.isValid())
    {
      lLines.add("Valid: " + xiResult.getSequent());
      addNode(xiResult.getProof(), 1, lLines);
    }
    else
    {
      lLines.add("Invalid: " + xiResult.getSequent());
      addNode(xiResult.getDerivation(), 1, lLines);
      lLines.add("Counterexample: " + xiResult.getCounterexample());
    }

    return StringUtils.join(lLines, "\n");
  }

  private static void addNode(RuleApp xiNode, int xiDepth, List<String> xiLines)
  {
    xiLines.add(StringUtils.repeat(INDENT, xiDepth) + xiNode.getSequent() + "   [" + xiNode.getRule() + "]");
    for (RuleApp lChild : xiNode.getChildren())
    {
      addNode(lChild, xiDepth + 1, xiLines);
    }
  }
}
