package io.dcsim.shell.core.suggest;

/** Levenshtein distance between two strings. */
public final class EditDistance {
  private EditDistance() {}

  public static int between(String s1, String s2) {
    int[] prev = new int[s2.length() + 1];
    int[] cur = new int[s2.length() + 1];
    for (int j = 0; j <= s2.length(); j++) {
      prev[j] = j;
    }
    for (int i = 1; i <= s1.length(); i++) {
      cur[0] = i;
      char c1 = s1.charAt(i - 1);
      for (int j = 1; j <= s2.length(); j++) {
        int cost = c1 == s2.charAt(j - 1) ? 0 : 1;
        cur[j] = Math.min(Math.min(cur[j - 1] + 1, prev[j] + 1), prev[j - 1] + cost);
      }
      int[] tmp = prev;
      prev = cur;
      cur = tmp;
    }
    return prev[s2.length()];
  }

  /** Similarity in [0, 1]: one minus the distance over the longer length. */
  public static double similarity(String s1, String s2) {
    int max = Math.max(s1.length(), s2.length());
    if (max == 0) {
      return 1.0;
    }
    double ratio = 1.0 - (double) between(s1, s2) / max;
    return Math.max(0.0, Math.min(1.0, ratio));
  }
}
