package edu.jhu.hlt.ptb.transforms;

import java.util.function.Function;

import org.apache.log4j.Logger;

import edu.jhu.hlt.ptb.datatypes.Node;
import edu.jhu.hlt.ptb.util.TreebankProperties;

/**
 * A fixed sequence of optional transforms applied to each tree, in this order:
 * remove empties, simplify labels, add root, annotate parent, remove parent,
 * mark top.
 */
public class TransformPipeline implements Function<Node, Node> {
  public static final Logger LOG = Logger.getLogger(TransformPipeline.class);

  public static final String REMOVE_EMPTIES = "removeEmpties";
  public static final String SIMPLIFY_LABELS = "simplifyLabels";
  public static final String KEEP_SBJ_TAGS = "keepSbjTags";
  public static final String ADD_ROOT = "addRoot";
  public static final String ROOT_LABEL = "rootLabel";
  public static final String ANNOTATE_PARENT = "annotateParent";
  public static final String REMOVE_PARENT = "removeParent";
  public static final String MARK_TOP = "markTop";

  private boolean removeEmpties;
  private boolean simplifyLabels;
  private boolean keepSbj;
  private boolean addRoot;
  private String rootLabel;
  private boolean annotateParent;
  private boolean removeParent;
  private boolean markTop;

  /** Does nothing until options are turned on. */
  public TransformPipeline() {
    this.rootLabel = TreeTransforms.ROOT;
  }

  public TransformPipeline(TreebankProperties config) {
    removeEmpties = config.getBoolean(REMOVE_EMPTIES, false);
    simplifyLabels = config.getBoolean(SIMPLIFY_LABELS, false);
    keepSbj = config.getBoolean(KEEP_SBJ_TAGS, false);
    addRoot = config.getBoolean(ADD_ROOT, false);
    rootLabel = config.getString(ROOT_LABEL, TreeTransforms.ROOT);
    annotateParent = config.getBoolean(ANNOTATE_PARENT, false);
    removeParent = config.getBoolean(REMOVE_PARENT, false);
    markTop = config.getBoolean(MARK_TOP, false);
    LOG.info("transforms: " + this);
  }

  public TransformPipeline removeEmpties(boolean b) { removeEmpties = b; return this; }
  public TransformPipeline simplifyLabels(boolean b, boolean keepSbj) {
    this.simplifyLabels = b;
    this.keepSbj = keepSbj;
    return this;
  }
  public TransformPipeline addRoot(boolean b, String rootLabel) {
    if (b && (rootLabel == null || rootLabel.isEmpty()))
      throw new IllegalArgumentException("rootLabel");
    this.addRoot = b;
    this.rootLabel = rootLabel;
    return this;
  }
  public TransformPipeline annotateParent(boolean b) { annotateParent = b; return this; }
  public TransformPipeline removeParent(boolean b) { removeParent = b; return this; }
  public TransformPipeline markTop(boolean b) { markTop = b; return this; }

  @Override
  public Node apply(Node t) {
    if (removeEmpties)
      TreeTransforms.removeEmptyElements(t);
    if (simplifyLabels)
      TreeTransforms.simplifyLabels(t, keepSbj);
    if (addRoot)
      t = TreeTransforms.addRoot(t, rootLabel);
    if (annotateParent)
      TreeTransforms.annotateParent(t);
    if (removeParent)
      TreeTransforms.removeParent(t);
    if (markTop)
      TreeTransforms.markTop(t);
    return t;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("[");
    if (removeEmpties) sb.append(" removeEmpties");
    if (simplifyLabels) sb.append(" simplifyLabels(keepSbj=" + keepSbj + ")");
    if (addRoot) sb.append(" addRoot(" + rootLabel + ")");
    if (annotateParent) sb.append(" annotateParent");
    if (removeParent) sb.append(" removeParent");
    if (markTop) sb.append(" markTop");
    return sb.append(" ]").toString();
  }
}
