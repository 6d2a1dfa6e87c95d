package io.intellixity.frugal.access.jdbc;

/**
 * Rewrites SQL containing named params (e.g. {@code :b1}) into JDBC SQL with '?' binds.
 *
 * Rules:
 * - Params are recognized as ':' followed by [A-Za-z_][A-Za-z0-9_]*\n
 * - '::' is treated as a SQL cast and not a param.\n
 * - Params inside single quotes are ignored.\n
 */
public final class SqlParamCompiler {
  private SqlParamCompiler() {}

  /** Purely lexical scanning; bind order is the order of appearance. */
  public static String toJdbcSql(String sql) {
    if (sql == null) return "";
    StringBuilder out = new StringBuilder(sql.length());
    boolean inSingleQuote = false;

    for (int i = 0; i < sql.length(); i++) {
      char ch = sql.charAt(i);

      if (ch == '\'') {
        // '' escape
        if (inSingleQuote && i + 1 < sql.length() && sql.charAt(i + 1) == '\'') {
          out.append("''");
          i++;
          continue;
        }
        inSingleQuote = !inSingleQuote;
        out.append(ch);
        continue;
      }

      if (!inSingleQuote && ch == ':') {
        if (i + 1 < sql.length() && sql.charAt(i + 1) == ':') {
          out.append("::");
          i++;
          continue;
        }

        int start = i + 1;
        if (start < sql.length() && isIdentStart(sql.charAt(start))) {
          int end = start + 1;
          while (end < sql.length() && isIdentPart(sql.charAt(end))) end++;
          out.append('?');
          i = end - 1;
          continue;
        }
      }

      out.append(ch);
    }

    return out.toString();
  }

  /** Number of '?' placeholders {@link #toJdbcSql} would produce. */
  public static int paramCount(String sql) {
    String jdbc = toJdbcSql(sql);
    int n = 0;
    boolean inSingleQuote = false;
    for (int i = 0; i < jdbc.length(); i++) {
      char ch = jdbc.charAt(i);
      if (ch == '\'') inSingleQuote = !inSingleQuote;
      else if (ch == '?' && !inSingleQuote) n++;
    }
    return n;
  }

  private static boolean isIdentStart(char c) {
    return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || c == '_';
  }

  private static boolean isIdentPart(char c) {
    return isIdentStart(c) || (c >= '0' && c <= '9');
  }
}
