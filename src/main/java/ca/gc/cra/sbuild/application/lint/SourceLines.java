package ca.gc.cra.sbuild.application.lint;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps top-level keys to the 1-based source lines declaring them. The n-th lookup of a key returns the
 * n-th declaring line, so repeated keys resolve to their own occurrence.
 */
final class SourceLines {
  private static final Pattern TOP_LEVEL_KEY = Pattern.compile("^([\"']?)([^\\s\"':#][^\"':]*?)\\1\\s*:(\\s|$)");

  private final Map<String, List<Integer>> linesByKey = new HashMap<>();
  private final Map<String, Integer> consumed = new HashMap<>();

  SourceLines(String source) {
    String[] lines = source.split("\\R", -1);
    for (int i = 0; i < lines.length; i++) {
      Matcher matcher = TOP_LEVEL_KEY.matcher(lines[i]);
      if (matcher.find()) {
        linesByKey.computeIfAbsent(matcher.group(2), k -> new ArrayList<>()).add(i + 1);
      }
    }
  }

  /**
   * Returns the line of the next unconsumed occurrence of {@code key}.
   *
   * @param key top-level key
   * @return 1-based line, the last known line when occurrences run out, or 0 when the key never appears
   */
  int next(String key) {
    List<Integer> lines = linesByKey.get(key);
    if (lines == null || lines.isEmpty()) {
      return 0;
    }
    int index = consumed.merge(key, 1, Integer::sum) - 1;
    return lines.get(Math.min(index, lines.size() - 1));
  }
}
