package edu.jhu.hlt.ptb.data;

import java.util.Collections;
import java.util.Iterator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.google.common.base.Splitter;
import com.google.common.collect.AbstractIterator;

/**
 * Splits lines of bracketed text into {@link Token}s. Every character sequence
 * tokenizes: whitespace is dropped, parentheses are their own tokens, and any
 * other maximal run of characters is an atom. There is no quoting or escaping.
 *
 * Tokens are produced lazily and the lexer can only be walked once.
 */
public class PtbLexer extends AbstractIterator<Token> {

  static final Pattern TOKEN = Pattern.compile("\\(|\\)|[^()\\s]+",
      Pattern.UNICODE_CHARACTER_CLASS);

  private final Iterator<String> lines;
  private Matcher matcher;
  private int lineNumber;

  public PtbLexer(Iterator<String> lines) {
    if (lines == null)
      throw new IllegalArgumentException("lines");
    this.lines = lines;
    this.lineNumber = 0;
  }

  public PtbLexer(Iterable<String> lines) {
    this(lines.iterator());
  }

  /**
   * Lex a single string. Embedded line breaks only advance the line counter.
   */
  public static PtbLexer of(String text) {
    if (text == null)
      return new PtbLexer(Collections.<String>emptyIterator());
    return new PtbLexer(Splitter.on('\n').split(text));
  }

  @Override
  protected Token computeNext() {
    while (true) {
      if (matcher != null && matcher.find()) {
        String m = matcher.group();
        if ("(".equals(m))
          return Token.lparen(lineNumber);
        if (")".equals(m))
          return Token.rparen(lineNumber);
        return Token.atom(m, lineNumber);
      }
      if (!lines.hasNext())
        return endOfData();
      matcher = TOKEN.matcher(lines.next());
      lineNumber++;
    }
  }
}
