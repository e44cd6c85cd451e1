package io.intellixity.jobly.query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Output of a compiler: placeholder-bound fragments, their positionally aligned values, and the joined text.
 * <p>
 * Built per call and consumed by exactly one statement. Values may contain {@code null}.
 */
public final class CompiledClause {
  private final List<Object> values;
  private final String text;
  private final int nextIndex;
  private final boolean none;

  CompiledClause(List<String> fragments, List<Object> values, String separator, int nextIndex) {
    this.values = Collections.unmodifiableList(new ArrayList<>(values));
    this.text = String.join(separator, fragments);
    this.nextIndex = nextIndex;
    this.none = false;
  }

  private CompiledClause(int nextIndex) {
    this.values = List.of();
    this.text = "";
    this.nextIndex = nextIndex;
    this.none = true;
  }

  /** "No filtering": callers omit the clause keyword entirely. */
  public static CompiledClause none() {
    return new CompiledClause(1);
  }

  static CompiledClause none(int startIndex) {
    return new CompiledClause(startIndex);
  }

  public boolean isNone() { return none; }
  public List<Object> values() { return values; }
  public String text() { return text; }

  /** First placeholder index not used by this clause. */
  public int nextIndex() { return nextIndex; }

  /** {@code " KEYWORD text"}, or the empty string for {@link #none()}. */
  public String render(String keyword) {
    return none ? "" : " " + keyword + " " + text;
  }

  @Override
  public String toString() {
    return none ? "CompiledClause[none]" : "CompiledClause[" + text + ", binds=" + values.size() + "]";
  }
}
