package edu.jhu.hlt.ptb.datatypes;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A constituent label broken into its parts, e.g. "NP-SBJ-1" is base label
 * "NP", tags [SBJ] and coindex "1"; "WHNP-1=2" has coindex "1" and parent
 * index "2".
 *
 * Strings which do not start with a base label are kept whole as the base
 * label, with no tags or indices.
 */
public class Symbol {
  public static final String SBJ = "SBJ";

  private static final Pattern PARTS = Pattern.compile(
      "(?<label>^[^0-9=-]+)"
      + "|(?:-(?<tag>[^0-9=-]+))"
      + "|(?:=(?<parind>[0-9]+))"
      + "|(?:-(?<coind>[0-9]+))");

  private String label;
  private List<String> tags;
  private String parentIndex;
  private String coindex;
  private String parentMark;

  public Symbol(String text) {
    if (text == null)
      throw new IllegalArgumentException("label text");
    this.label = text;
    this.tags = new ArrayList<>();
    Matcher m = PARTS.matcher(text);
    // no base label at the start: keep the whole string as the label
    if (!m.find() || m.group("label") == null)
      return;
    label = m.group("label");
    while (m.find()) {
      if (m.group("label") != null)
        label = m.group("label");
      else if (m.group("tag") != null)
        tags.add(m.group("tag"));
      else if (m.group("parind") != null)
        parentIndex = m.group("parind");
      else if (m.group("coind") != null)
        coindex = m.group("coind");
    }
  }

  public String getLabel() {
    return label;
  }

  public void setLabel(String label) {
    this.label = label;
  }

  public List<String> getTags() {
    return Collections.unmodifiableList(tags);
  }

  public boolean hasTag(String tag) {
    return tags.contains(tag);
  }

  /** may be null */
  public String getParentIndex() {
    return parentIndex;
  }

  /** may be null */
  public String getCoindex() {
    return coindex;
  }

  /** null until a parent annotation is added */
  public String getParentMark() {
    return parentMark;
  }

  public void setParentMark(String parentMark) {
    this.parentMark = parentMark;
  }

  /**
   * Drops indices and the parent mark, and all tags unless keepSbj is set and
   * SBJ is among them, in which case the tags become exactly [SBJ].
   */
  public void simplify(boolean keepSbj) {
    boolean sbj = keepSbj && hasTag(SBJ);
    tags = new ArrayList<>();
    if (sbj)
      tags.add(SBJ);
    coindex = null;
    parentIndex = null;
    parentMark = null;
  }

  /** base label and tags joined by '-', without indices or mark */
  public String labelWithTags() {
    StringBuilder sb = new StringBuilder(label);
    for (String t : tags)
      sb.append('-').append(t);
    return sb.toString();
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(labelWithTags());
    if (parentIndex != null)
      sb.append('=').append(parentIndex);
    if (coindex != null)
      sb.append('-').append(coindex);
    if (parentMark != null)
      sb.append('^').append(parentMark);
    return sb.toString();
  }
}
