package edu.jhu.hlt.ptb.data;

import java.io.Reader;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

import org.apache.commons.io.LineIterator;
import org.apache.log4j.Logger;

import com.google.common.collect.AbstractIterator;

import edu.jhu.hlt.ptb.datatypes.Constituent;
import edu.jhu.hlt.ptb.datatypes.Leaf;
import edu.jhu.hlt.ptb.datatypes.LeafNode;
import edu.jhu.hlt.ptb.datatypes.Node;
import edu.jhu.hlt.ptb.datatypes.Symbol;

/**
 * Builds trees from a token stream with a shift/reduce stack. Each top level
 * bracketed group becomes one tree, returned as soon as its closing paren has
 * been read, so a long file can be consumed one tree at a time.
 *
 * On a closing paren:
 * <ul>
 * <li>"( POS WORD )" reduces to a leaf. This check is purely structural, so
 * "(X y)" is always a leaf and never a one word constituent.</li>
 * <li>anything else reduces to a constituent whose label is the atom directly
 * after the open paren. The remaining items must be subtrees. With no label
 * atom the constituent is headless.</li>
 * </ul>
 *
 * Malformed input throws {@link PtbParseException}, after which the iterator
 * is unusable. Trees returned before the error are unaffected.
 */
public class PtbParser extends AbstractIterator<Node> {
  public static final Logger LOG = Logger.getLogger(PtbParser.class);

  /** Either a token (open paren or atom) or a finished subtree. */
  private static final class Item {
    final Token token;
    final Node node;
    Item(Token token) { this.token = token; this.node = null; }
    Item(Node node) { this.token = null; this.node = node; }
    boolean is(TokenKind k) { return token != null && token.is(k); }
  }

  private final Iterator<Token> tokens;
  private final Deque<Item> stack;
  private int treesParsed;

  public PtbParser(Iterator<Token> tokens) {
    if (tokens == null)
      throw new IllegalArgumentException("tokens");
    this.tokens = tokens;
    this.stack = new ArrayDeque<>();
    this.treesParsed = 0;
  }

  public static PtbParser parse(String text) {
    return new PtbParser(PtbLexer.of(text));
  }

  public static PtbParser parse(Iterable<String> lines) {
    return new PtbParser(new PtbLexer(lines));
  }

  /**
   * Lines are pulled from the reader as trees are requested. Closing the
   * reader is up to the caller.
   */
  public static PtbParser parse(Reader reader) {
    return new PtbParser(new PtbLexer(new LineIterator(reader)));
  }

  /**
   * Parses text holding exactly one tree.
   */
  public static Node parseOne(String text) {
    PtbParser p = parse(text);
    if (!p.hasNext())
      throw new PtbParseException("no tree in input", Token.NO_LINE);
    Node t = p.next();
    if (p.hasNext())
      throw new IllegalArgumentException("expected one tree but found more: " + text);
    return t;
  }

  /** Every tree in the text, read eagerly. */
  public static List<Node> parseAll(String text) {
    List<Node> trees = new ArrayList<>();
    PtbParser p = parse(text);
    while (p.hasNext())
      trees.add(p.next());
    return trees;
  }

  public int getTreesParsed() {
    return treesParsed;
  }

  @Override
  protected Node computeNext() {
    while (tokens.hasNext()) {
      Token t = tokens.next();
      if (t.is(TokenKind.RPAREN)) {
        Node n = reduce(t);
        if (stack.isEmpty()) {
          treesParsed++;
          if (LOG.isDebugEnabled())
            LOG.debug("parsed tree " + treesParsed + " ending on line " + t.getLine());
          return n;
        }
        stack.push(new Item(n));
      } else {
        stack.push(new Item(t));
      }
    }
    if (!stack.isEmpty())
      throw unterminated();
    if (LOG.isDebugEnabled())
      LOG.debug("done, parsed " + treesParsed + " trees");
    return endOfData();
  }

  private Node reduce(Token rparen) {
    if (stack.isEmpty())
      throw new PtbParseException("unmatched ')'", rparen);
    if (isLeafPattern()) {
      Token word = stack.pop().token;
      Token pos = stack.pop().token;
      stack.pop();
      return new LeafNode(new Leaf(word.getText(), pos.getText()));
    }

    // pop back to the open paren, restoring left to right order
    List<Item> items = new ArrayList<>();
    while (true) {
      if (stack.isEmpty())
        throw new PtbParseException("unmatched ')'", rparen);
      Item it = stack.pop();
      if (it.is(TokenKind.LPAREN))
        break;
      items.add(0, it);
    }

    Symbol symbol = null;
    int start = 0;
    if (!items.isEmpty() && items.get(0).is(TokenKind.ATOM)) {
      symbol = new Symbol(items.get(0).token.getText());
      start = 1;
    }
    List<Node> children = new ArrayList<>(items.size());
    for (int i = start; i < items.size(); i++) {
      Item it = items.get(i);
      if (it.node == null)
        throw new PtbParseException("atom in a constituent's child position", it.token);
      children.add(it.node);
    }
    return Constituent.of(symbol, children);
  }

  /** top of stack reads: "(" ATOM ATOM */
  private boolean isLeafPattern() {
    if (stack.size() < 3)
      return false;
    Iterator<Item> it = stack.iterator();
    return it.next().is(TokenKind.ATOM)
        && it.next().is(TokenKind.ATOM)
        && it.next().is(TokenKind.LPAREN);
  }

  private PtbParseException unterminated() {
    // report the outermost open paren, where the unfinished group starts
    Token open = null;
    Token any = null;
    for (Item it : stack) {
      if (it.is(TokenKind.LPAREN))
        open = it.token;
      if (it.token != null)
        any = it.token;
    }
    if (open != null)
      return new PtbParseException("unexpected end of input, unclosed '('", open);
    if (any != null)
      return new PtbParseException("unexpected end of input, atom outside any tree", any);
    return new PtbParseException("unexpected end of input", Token.NO_LINE);
  }
}
