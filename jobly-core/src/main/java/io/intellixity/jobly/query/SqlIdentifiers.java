package io.intellixity.jobly.query;

public final class SqlIdentifiers {
  private SqlIdentifiers() {}

  /** Double-quote an identifier, doubling any embedded quote. */
  public static String quote(String ident) {
    if (ident == null || ident.isEmpty()) throw new IllegalArgumentException("Identifier must be non-empty");
    return "\"" + ident.replace("\"", "\"\"") + "\"";
  }
}
