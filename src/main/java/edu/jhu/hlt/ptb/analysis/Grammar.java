package edu.jhu.hlt.ptb.analysis;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;

import edu.jhu.hlt.ptb.datatypes.GrammarRule;
import edu.jhu.hlt.ptb.datatypes.Node;
import edu.jhu.hlt.ptb.util.Counts;

/**
 * A relative frequency estimate of a PCFG from a set of trees:
 * P(lhs -> rhs) = count(lhs -> rhs) / count(lhs -> *). Lexical rules are
 * included.
 */
public class Grammar {
  public static final Logger LOG = Logger.getLogger(Grammar.class);

  private final Counts<GrammarRule> rules = new Counts<>();
  private final Counts<String> lhsTotals = new Counts<>();

  public void observe(Node tree) {
    for (GrammarRule r : TreeAnalyses.grammarRules(tree)) {
      rules.increment(r);
      lhsTotals.increment(r.getLhs());
    }
  }

  public void observeAll(Iterable<Node> trees) {
    int n = 0;
    for (Node t : trees) {
      observe(t);
      n++;
    }
    LOG.info("read " + rules.getTotalCount() + " rules with " + lhsTotals.numNonZero()
        + " left hand sides from " + n + " trees");
  }

  public int getCount(GrammarRule r) {
    return rules.getCount(r);
  }

  public double probability(GrammarRule r) {
    int total = lhsTotals.getCount(r.getLhs());
    if (total == 0)
      return 0d;
    return ((double) rules.getCount(r)) / total;
  }

  /**
   * Rules grouped by left hand side (in order of each side's most frequent
   * rule), most frequent first within a group.
   */
  public Map<String, List<GrammarRule>> byLhs() {
    Map<String, List<GrammarRule>> g = new LinkedHashMap<>();
    for (GrammarRule r : rules.getKeysSortedByCount(true))
      g.computeIfAbsent(r.getLhs(), k -> new ArrayList<>()).add(r);
    return g;
  }

  /** "lhs -> rhs\tprobability" lines */
  public List<String> lines() {
    List<String> out = new ArrayList<>();
    for (List<GrammarRule> group : byLhs().values())
      for (GrammarRule r : group)
        out.add(r + "\t" + probability(r));
    return out;
  }
}
