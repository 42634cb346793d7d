package io.dcsim.shell.sim;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Slurm hostlist expressions: {@code dgx-00,dgx-01,dgx-02,dgx-05} compresses to {@code
 * dgx-[00-02,05]}.
 */
final class Hostlist {
  private static final Pattern NUMBERED = Pattern.compile("(.*?)(\\d+)");

  private Hostlist() {}

  static String compress(List<String> hosts) {
    if (hosts.isEmpty()) {
      return "";
    }
    Map<String, List<String>> byPrefix = new LinkedHashMap<>();
    List<String> plain = new ArrayList<>();
    for (String host : hosts) {
      Matcher m = NUMBERED.matcher(host);
      if (m.matches()) {
        byPrefix.computeIfAbsent(m.group(1), k -> new ArrayList<>()).add(m.group(2));
      } else {
        plain.add(host);
      }
    }
    List<String> parts = new ArrayList<>();
    for (Map.Entry<String, List<String>> e : byPrefix.entrySet()) {
      List<String> numbers = e.getValue();
      if (numbers.size() == 1) {
        parts.add(e.getKey() + numbers.get(0));
      } else {
        parts.add(e.getKey() + "[" + ranges(numbers) + "]");
      }
    }
    parts.addAll(plain);
    return String.join(",", parts);
  }

  private static String ranges(List<String> numbers) {
    List<String> out = new ArrayList<>();
    int i = 0;
    while (i < numbers.size()) {
      int j = i;
      while (j + 1 < numbers.size()
          && Integer.parseInt(numbers.get(j + 1)) == Integer.parseInt(numbers.get(j)) + 1
          && numbers.get(j + 1).length() == numbers.get(j).length()) {
        j++;
      }
      out.add(i == j ? numbers.get(i) : numbers.get(i) + "-" + numbers.get(j));
      i = j + 1;
    }
    return String.join(",", out);
  }
}
