package io.dcsim.shell.core.sim;

import java.util.ArrayList;
import java.util.List;

/** Column-aligned plain text tables in the style of ps/sinfo, without box drawing. */
public final class TableFormatter {
  private static final int MAX_CELL_WIDTH = 40;
  private static final int COL_SPACING = 2;

  private TableFormatter() {}

  /**
   * Formats rows under a header. Cells wider than the column limit are truncated with "...".
   *
   * @param header column names
   * @param rows row cells, each the same length as {@code header}
   * @return table text ending in a newline
   */
  public static String format(List<String> header, List<List<String>> rows) {
    int[] widths = new int[header.size()];
    for (int i = 0; i < header.size(); i++) {
      widths[i] = Math.min(header.get(i).length(), MAX_CELL_WIDTH);
    }
    for (List<String> row : rows) {
      for (int i = 0; i < widths.length && i < row.size(); i++) {
        widths[i] = Math.min(Math.max(widths[i], cell(row, i).length()), MAX_CELL_WIDTH);
      }
    }
    StringBuilder sb = new StringBuilder();
    appendRow(sb, header, widths);
    for (List<String> row : rows) {
      appendRow(sb, row, widths);
    }
    return sb.toString();
  }

  public static String format(List<String> header, List<List<String>> rows, String emptyText) {
    return rows.isEmpty() ? emptyText + "\n" : format(header, rows);
  }

  private static void appendRow(StringBuilder sb, List<String> row, int[] widths) {
    List<String> cells = new ArrayList<>(widths.length);
    for (int i = 0; i < widths.length; i++) {
      cells.add(padRight(truncate(cell(row, i), widths[i]), widths[i]));
    }
    sb.append(String.join(" ".repeat(COL_SPACING), cells).stripTrailing()).append('\n');
  }

  private static String cell(List<String> row, int i) {
    String value = i < row.size() ? row.get(i) : null;
    return value == null ? "" : value;
  }

  private static String truncate(String s, int maxLen) {
    if (s.length() <= maxLen) {
      return s;
    }
    return s.substring(0, Math.max(0, maxLen - 3)) + "...";
  }

  private static String padRight(String s, int width) {
    return s.length() >= width ? s : s + " ".repeat(width - s.length());
  }
}
