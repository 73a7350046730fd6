package edu.jhu.hlt.ptb.analysis;

import java.util.ArrayList;
import java.util.List;

import edu.jhu.hlt.ptb.datatypes.Leaf;
import edu.jhu.hlt.ptb.datatypes.Node;

/**
 * Flat text renderings of a tree's leaves.
 */
public final class Sentences {

  private Sentences() {}

  /** words joined by spaces, null elements included */
  public static String words(Node tree) {
    List<String> w = new ArrayList<>();
    for (Leaf l : TreeAnalyses.leaves(tree))
      w.add(l.getWord());
    return TreeAnalyses.join(w);
  }

  /** e.g. "the_DT dog_NN" */
  public static String taggedWords(Node tree) {
    List<String> w = new ArrayList<>();
    for (Leaf l : TreeAnalyses.leaves(tree))
      w.add(l.getWord() + "_" + l.getPos());
    return TreeAnalyses.join(w);
  }

  /**
   * The words followed by a tab and the root's base label, e.g. for sentence
   * classification data.
   */
  public static String wordsWithRootLabel(Node tree) {
    return words(tree) + "\t" + TreeAnalyses.baseLabel(tree);
  }
}
