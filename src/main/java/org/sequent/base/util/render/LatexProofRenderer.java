package org.sequent.base.util.render;

import java.util.ArrayList;
import java.util.List;
import java.util.Map.Entry;

import org.apache.commons.lang.StringUtils;
import org.sequent.base.util.prover.ProofResult;
import org.sequent.base.util.prover.Rule;
import org.sequent.base.util.prover.RuleApp;

/**
 * Renders proofs for the LaTeX <code>ebproof</code> package.
 *
 * A proved sequent becomes a <code>prooftree</code> environment in which each node is written after its children as
 * <code>\infer&lt;n&gt;[&lt;rule&gt;]{ &lt;sequent&gt; }</code>.  A refuted sequent is rendered the same way, down to
 * the failing leaf, which becomes a hypothesis boxed in red.  A comment giving the counterexample comes first.
 */
public class LatexProofRenderer implements ProofRenderer
{
  static final String BEGIN_TREE   = "\\begin{prooftree}";
  static final String END_TREE     = "\\end{prooftree}";
  static final String COUNTER_MARK = "\\rewrite{\\color{red}\\box\\treebox}";

  @Override
  public String render(ProofResult xiResult)
  {
    List<String> lLines = new ArrayList<>();

    if (xiResult.isValid())
    {
      lLines.add(BEGIN_TREE);
      addNode(xiResult.getProof(), lLines);
      lLines.add(END_TREE);
    }
    else
    {
      List<String> lValues = new ArrayList<>();
      for (Entry<String, Boolean> lEntry : xiResult.getCounterexample().getAssignment().entrySet())
      {
        lValues.add(lEntry.getKey() + " = " + lEntry.getValue());
      }
      lLines.add("% Counterexample: " + StringUtils.join(lValues, ", "));
      lLines.add(BEGIN_TREE);
      addNode(xiResult.getDerivation(), lLines);
      lLines.add(END_TREE);
    }

    return StringUtils.join(lLines, "\n");
  }

  /**
   * Add the lines for a subtree, children first.
   */
  private static void addNode(RuleApp xiNode, List<String> xiLines)
  {
    if (xiNode.getRule().getKind() == Rule.Kind.COUNTER)
    {
      xiLines.add("\\hypo{ " + xiNode.getSequent().toLatex() + " }");
      xiLines.add(COUNTER_MARK);
      return;
    }

    for (RuleApp lChild : xiNode.getChildren())
    {
      addNode(lChild, xiLines);
    }
    xiLines.add("\\infer" + xiNode.getChildren().size() +
                "[" + xiNode.getRule().getLatexName() + "]" +
                "{ " + xiNode.getSequent().toLatex() + " }");
  }
}
