package edu.jhu.hlt.ptb.data;

import static org.junit.Assert.*;

import java.io.StringReader;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.apache.log4j.AppenderSkeleton;
import org.apache.log4j.Level;
import org.apache.log4j.spi.LoggingEvent;
import org.junit.Test;

import edu.jhu.hlt.ptb.datatypes.Constituent;
import edu.jhu.hlt.ptb.datatypes.Node;

public class PtbParserTest {

  static final String DOG = "(S (NP (DT the) (NN dog)) (VP (VBZ runs)))";

  @Test
  public void simpleTree() {
    Node t = PtbParser.parseOne(DOG);
    assertFalse(t.isLeaf());
    assertEquals("S", t.getSymbol().getLabel());
    assertEquals(2, t.numChildren());
    Node np = t.getFirstChild();
    assertEquals("NP", np.getSymbol().getLabel());
    assertEquals(2, np.numChildren());
    assertTrue(np.getFirstChild().isLeaf());
    assertEquals("DT", np.getFirstChild().getLeaf().getPos());
    assertEquals("the", np.getFirstChild().getLeaf().getWord());
    assertEquals("VP", np.getNextSibling().getSymbol().getLabel());
    assertNull(np.getNextSibling().getNextSibling());
  }

  @Test
  public void printThenParseAgain() {
    String[] inputs = {
        DOG,
        "( (S (NP-SBJ-1 (-NONE- *T*-1)) (VP (VBD left) (, ,))))",
        "(NP-SBJ-TMP (PRP it))",
    };
    for (String in : inputs) {
      String printed = PtbParser.parseOne(in).toString();
      assertEquals(in, printed);
      assertEquals(printed, PtbParser.parseOne(printed).toString());
    }
  }

  @Test
  public void whitespaceInsensitive() {
    Node a = PtbParser.parseOne(DOG);
    Node b = PtbParser.parseOne("(S\n  (NP (DT the)\n      (NN dog))\n  (VP (VBZ runs) ) )");
    assertEquals(a.toString(), b.toString());
  }

  @Test
  public void severalTrees() {
    PtbParser p = PtbParser.parse("(A (B c)) (D (E f))\n(G (H i))");
    assertTrue(p.hasNext());
    assertEquals("(A (B c))", p.next().toString());
    assertEquals("(D (E f))", p.next().toString());
    assertEquals("(G (H i))", p.next().toString());
    assertFalse(p.hasNext());
    assertEquals(3, p.getTreesParsed());
  }

  @Test
  public void noTrees() {
    assertTrue(PtbParser.parseAll("").isEmpty());
    assertTrue(PtbParser.parseAll("   \n ").isEmpty());
  }

  @Test
  public void twoAtomsAreALeaf() {
    Node t = PtbParser.parseOne("(X y)");
    assertTrue(t.isLeaf());
    assertEquals("X", t.getLeaf().getPos());
    assertEquals("y", t.getLeaf().getWord());
  }

  @Test
  public void headlessWrapper() {
    Node t = PtbParser.parseOne("( (S (NP (DT a))))");
    assertTrue(t instanceof Constituent);
    assertTrue(((Constituent) t).isHeadless());
    assertNull(t.getSymbol());
    assertEquals(1, t.numChildren());
    assertEquals("S", t.getFirstChild().getSymbol().getLabel());
  }

  @Test
  public void childlessConstituents() {
    Node t = PtbParser.parseOne("(X)");
    assertEquals("X", t.getSymbol().getLabel());
    assertEquals(0, t.numChildren());
    Node empty = PtbParser.parseOne("()");
    assertNull(empty.getSymbol());
    assertEquals(0, empty.numChildren());
  }

  @Test
  public void missingCloseParen() {
    PtbParser p = PtbParser.parse("(S (NP (DT the))");
    try {
      p.hasNext();
      fail("expected a parse error");
    } catch (PtbParseException e) {
      assertEquals(1, e.getLine());
    }
  }

  @Test
  public void strayCloseParen() {
    try {
      PtbParser.parseAll(")");
      fail("expected a parse error");
    } catch (PtbParseException e) {
      assertEquals(1, e.getLine());
      assertTrue(e.getMessage().contains("unmatched"));
    }
  }

  @Test
  public void earlierTreesSurviveLaterError() {
    PtbParser p = PtbParser.parse(Arrays.asList("(A (B c))", "(D (E f)"));
    assertEquals("(A (B c))", p.next().toString());
    try {
      p.hasNext();
      fail("expected a parse error");
    } catch (PtbParseException e) {
      assertEquals(2, e.getLine());
    }
    // the iteration is over once it has failed
    try {
      p.hasNext();
      fail();
    } catch (IllegalStateException e) {
      // expected
    }
  }

  @Test(expected = PtbParseException.class)
  public void atomAmongChildren() {
    PtbParser.parseAll("(S (DT a) b)");
  }

  @Test(expected = PtbParseException.class)
  public void atomOutsideTree() {
    PtbParser.parseAll("(S (DT a)) leftover");
  }

  @Test
  public void multiLineTrees() {
    List<String> lines = Arrays.asList("(S", "  (NP (DT the)", "      (NN dog))", ")", "(X (Y z))");
    PtbParser p = PtbParser.parse(lines);
    assertEquals("(S (NP (DT the) (NN dog)))", p.next().toString());
    assertEquals("(X (Y z))", p.next().toString());
    assertFalse(p.hasNext());
  }

  @Test
  public void fromReader() {
    PtbParser p = PtbParser.parse(new StringReader("(A (B c))\n(D (E f))\n"));
    assertEquals("(A (B c))", p.next().toString());
    assertEquals("(D (E f))", p.next().toString());
    assertFalse(p.hasNext());
  }

  @Test
  public void leafAtTopLevel() {
    List<Node> trees = PtbParser.parseAll("(DT the) (NN dog)");
    assertEquals(2, trees.size());
    assertTrue(trees.get(0).isLeaf());
    assertEquals("dog", trees.get(1).getLeaf().getWord());
  }

  @Test
  public void endOfInputIsNotLoggedAtInfo() {
    Level old = PtbParser.LOG.getLevel();
    final List<String> infos = new ArrayList<>();
    AppenderSkeleton capture = new AppenderSkeleton() {
      @Override
      protected void append(LoggingEvent e) {
        if (e.getLevel().isGreaterOrEqual(Level.INFO))
          infos.add(String.valueOf(e.getMessage()));
      }
      @Override
      public void close() {}
      @Override
      public boolean requiresLayout() { return false; }
    };
    PtbParser.LOG.addAppender(capture);
    PtbParser.LOG.setLevel(Level.DEBUG);
    try {
      PtbParser.parseAll("(A (B c)) (D (E f))");
    } finally {
      PtbParser.LOG.removeAppender(capture);
      PtbParser.LOG.setLevel(old);
    }
    assertTrue(infos.toString(), infos.isEmpty());
  }
}
