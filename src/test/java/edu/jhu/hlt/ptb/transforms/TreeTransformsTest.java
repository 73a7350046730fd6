package edu.jhu.hlt.ptb.transforms;

import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.Test;

import edu.jhu.hlt.ptb.analysis.TreeAnalyses;
import edu.jhu.hlt.ptb.data.PtbParser;
import edu.jhu.hlt.ptb.datatypes.Leaf;
import edu.jhu.hlt.ptb.datatypes.Node;

public class TreeTransformsTest {

  private static Node tree(String s) {
    return PtbParser.parseOne(s);
  }

  @Test
  public void removeNullLeaf() {
    Node t = TreeTransforms.removeEmptyElements(tree("(VP (VB go) (-NONE- *))"));
    assertEquals(1, t.numChildren());
    assertEquals("(VP (VB go))", t.toString());
  }

  @Test
  public void emptinessPropagatesUp() {
    Node t = tree("(S (NP-SBJ (-NONE- *T*-1)) (VP (VBD left) (S (NP (-NONE- *)) (VP (-NONE- *?*)))))");
    TreeTransforms.removeEmptyElements(t);
    assertEquals("(S (VP (VBD left)))", t.toString());
  }

  @Test
  public void removeEmptiesIsAFixpoint() {
    String[] inputs = {
        "(S (NP-SBJ (-NONE- *)) (VP (VB go) (NP (-NONE- *T*-2)) (ADVP (RB now))))",
        "(S (NP (DT a)))",
        "( (S (SBAR (-NONE- 0) (S (-NONE- *T*))) (VP (VBZ is))))",
    };
    for (String in : inputs) {
      Node t = TreeTransforms.removeEmptyElements(tree(in));
      String once = t.toString();
      TreeTransforms.removeEmptyElements(t);
      assertEquals(once, t.toString());
    }
  }

  @Test
  public void nonNullLeavesAreKept() {
    Node t = tree("(S (NP-SBJ (-NONE- *)) (VP (VB go) (NP (-NONE- *T*-2)) (ADVP (RB now))) (. .))");
    List<Leaf> expected = new ArrayList<>();
    for (Leaf l : TreeAnalyses.leaves(t))
      if (!l.isNull())
        expected.add(l);
    TreeTransforms.removeEmptyElements(t);
    assertEquals(expected, TreeAnalyses.leaves(t));
    assertEquals("(S (VP (VB go) (ADVP (RB now))) (. .))", t.toString());
  }

  @Test
  public void rootIsNeverRemoved() {
    Node t = tree("(S (NP (-NONE- *)) (-NONE- *U*))");
    Node r = TreeTransforms.removeEmptyElements(t);
    assertSame(t, r);
    assertEquals(0, r.numChildren());
    assertEquals("S", r.getSymbol().getLabel());
  }

  @Test
  public void simplifyKeepingSbj() {
    Node t = tree("(NP-SBJ-2 (DT a))");
    assertEquals("NP", t.getSymbol().getLabel());
    assertEquals(Arrays.asList("SBJ"), t.getSymbol().getTags());
    assertEquals("2", t.getSymbol().getCoindex());

    TreeTransforms.simplifyLabels(t, true);
    assertEquals(Arrays.asList("SBJ"), t.getSymbol().getTags());
    assertNull(t.getSymbol().getCoindex());

    TreeTransforms.simplifyLabels(t, false);
    assertTrue(t.getSymbol().getTags().isEmpty());
  }

  @Test
  public void simplifyWholeTree() {
    Node t = tree("(S-TPC-1 (NP-SBJ=2 (PRP it)) (VP (VBD was) (NP-PRD-TMP (NN today))))");
    TreeTransforms.simplifyLabels(t);
    assertEquals("(S (NP (PRP it)) (VP (VBD was) (NP (NN today))))", t.toString());
    TreeTransforms.simplifyLabels(t);
    assertEquals("(S (NP (PRP it)) (VP (VBD was) (NP (NN today))))", t.toString());
  }

  @Test
  public void annotateParent() {
    Node t = tree("(S-TPC-1 (NP-SBJ (DT the)) (VP (VBZ runs) (ADVP-TMP=3 (RB now))))");
    TreeTransforms.annotateParent(t);
    assertNull(t.getSymbol().getParentMark());
    assertEquals("(S-TPC-1 (NP-SBJ^S-TPC (DT the)) (VP^S-TPC (VBZ runs) (ADVP-TMP=3^VP (RB now))))",
        t.toString());
  }

  @Test
  public void annotateParentUnderHeadlessRoot() {
    Node t = tree("( (S (NP (DT a))))");
    TreeTransforms.annotateParent(t);
    assertEquals("", t.getFirstChild().getSymbol().getParentMark());
    assertEquals("( (S^ (NP^S (DT a))))", t.toString());
  }

  @Test
  public void removeParentFromLabels() {
    Node t = tree("(S (NP^S (DT^NP the)) (VP^S (VBZ^VP runs)))");
    assertEquals("NP^S", t.getFirstChild().getSymbol().getLabel());
    TreeTransforms.removeParent(t);
    assertEquals("(S (NP (DT the)) (VP (VBZ runs)))", t.toString());
  }

  @Test
  public void annotatedTreeWrittenAndReadBack() {
    Node t = tree("(S (NP (DT the)) (VP (VBZ runs)))");
    TreeTransforms.annotateParent(t);
    Node reread = tree(t.toString());
    TreeTransforms.removeParent(reread);
    assertEquals("(S (NP (DT the)) (VP (VBZ runs)))", reread.toString());
  }

  @Test
  public void markTop() {
    Node t = TreeTransforms.markTop(tree("( (S (NP (DT a))))"));
    assertEquals("ROOT", t.getFirstChild().getSymbol().getParentMark());
    assertEquals("( (S^ROOT (NP (DT a))))", t.toString());
  }

  @Test(expected = StructuralPreconditionException.class)
  public void markTopNeedsOneChild() {
    TreeTransforms.markTop(tree("(S (NP (DT a)) (VP (VB go)))"));
  }

  @Test(expected = StructuralPreconditionException.class)
  public void markTopNeedsAChild() {
    TreeTransforms.markTop(tree("(S)"));
  }

  @Test(expected = StructuralPreconditionException.class)
  public void markTopNeedsAConstituent() {
    TreeTransforms.markTop(tree("(S (DT a))"));
  }

  @Test
  public void addRootRelabelsReservedLabel() {
    Node t = tree("(TOP (S (NP (DT the) (NN cat))))");
    Node r = TreeTransforms.addRoot(t, "ROOT");
    assertSame(t, r);
    assertEquals("ROOT", r.getSymbol().getLabel());
    assertEquals("(ROOT (S (NP (DT the) (NN cat))))", r.toString());
  }

  @Test
  public void addRootRelabelsHeadless() {
    Node r = TreeTransforms.addRoot(tree("( (S (DT a)))"));
    assertEquals("(ROOT (S (DT a)))", r.toString());
  }

  @Test
  public void addRootWraps() {
    Node t = tree("(S (NP (DT a)) (VP (VB go)))");
    Node r = TreeTransforms.addRoot(t, "ROOT");
    assertNotSame(t, r);
    assertSame(t, r.getFirstChild());
    assertEquals(1, r.numChildren());
    assertEquals("(ROOT (S (NP (DT a)) (VP (VB go))))", r.toString());

    assertEquals("(ROOT (DT a))", TreeTransforms.addRoot(tree("(DT a)")).toString());
  }

  @Test
  public void addRootIsIdempotent() {
    for (String label : Arrays.asList("ROOT", "TOP", "S1")) {
      Node r = TreeTransforms.addRoot(tree("(S (NP (DT a)) (VP (VB go)))"), label);
      String once = r.toString();
      Node again = TreeTransforms.addRoot(r, label);
      assertSame(r, again);
      assertEquals(once, again.toString());
    }
  }

  @Test
  public void addRootComparesParsedLabels() {
    // "S1" parses to base label S, so the relabelled root matches it
    Node t = tree("(S (NP (DT a)) (VP (VB go)))");
    Node r = TreeTransforms.addRoot(t, "S1");
    assertSame(t, r);
    assertSame(r, TreeTransforms.addRoot(r, "S1"));
    assertEquals("(S (NP (DT a)) (VP (VB go)))", r.toString());

    Node tagged = tree("(S-TPC (NP (DT a)))");
    Node wrapped = TreeTransforms.addRoot(tagged, "S");
    assertNotSame(tagged, wrapped);
    assertEquals("(S (S-TPC (NP (DT a))))", wrapped.toString());
    assertSame(wrapped, TreeTransforms.addRoot(wrapped, "S"));
  }
}
