package edu.jhu.hlt.ptb.analysis;

import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.Logger;

import edu.jhu.hlt.ptb.datatypes.Node;
import edu.jhu.hlt.ptb.util.Counts;

/**
 * How often each non-lexical rule (as produced by
 * {@link TreeAnalyses#allRules}) occurs over a set of trees.
 */
public class RuleCounts {
  public static final Logger LOG = Logger.getLogger(RuleCounts.class);

  private final Counts<String> counts = new Counts<>();
  private int numTrees = 0;

  public void observe(Node tree) {
    counts.incrementAll(TreeAnalyses.allRules(tree));
    numTrees++;
  }

  public void observeAll(Iterable<Node> trees) {
    for (Node t : trees)
      observe(t);
    LOG.info("counted " + counts.getTotalCount() + " rules ("
        + counts.numNonZero() + " distinct) in " + numTrees + " trees");
  }

  public int getCount(String rule) {
    return counts.getCount(rule);
  }

  public int getNumTrees() {
    return numTrees;
  }

  /** "rule\tcount" lines, most frequent first */
  public List<String> mostCommon() {
    List<String> lines = new ArrayList<>();
    for (String r : counts.getKeysSortedByCount(true))
      lines.add(r + "\t" + counts.getCount(r));
    return lines;
  }
}
