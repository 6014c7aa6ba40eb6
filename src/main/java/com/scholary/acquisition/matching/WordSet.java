package com.scholary.acquisition.matching;

import java.util.Collections;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * A piece of text reduced to its lowercase word set.
 *
 * <p>Underscores and every non-word character act as separators, so {@code "Boards_of-Canada"}
 * and {@code "boards of canada"} produce the same set. The original text is retained because the
 * guessed artist/album/track reported to callers is the text as it appeared in the path.
 */
final class WordSet {

  private static final Pattern NON_WORD =
      Pattern.compile("[^\\w\\s]", Pattern.UNICODE_CHARACTER_CLASS);
  private static final Pattern WHITESPACE =
      Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

  static final WordSet EMPTY = new WordSet("", Collections.emptySet());

  private final String original;
  private final Set<String> words;

  private WordSet(String original, Set<String> words) {
    this.original = original;
    this.words = words;
  }

  static WordSet of(String text) {
    if (text == null || text.isEmpty()) {
      return EMPTY;
    }
    String separated = NON_WORD.matcher(text.replace('_', ' ')).replaceAll(" ");
    Set<String> words = new HashSet<>();
    for (String word : WHITESPACE.split(separated.toLowerCase(Locale.ROOT))) {
      if (!word.isBlank()) {
        words.add(word);
      }
    }
    return new WordSet(text, words);
  }

  String original() {
    return original;
  }

  Set<String> words() {
    return words;
  }

  /** Intersection over union. Zero when both sets are empty. */
  double jaccard(WordSet other) {
    int intersection = intersectionSize(other);
    int union = words.size() + other.words.size() - intersection;
    return union == 0 ? 0.0 : (double) intersection / union;
  }

  /**
   * Fraction of {@code target}'s words present in this set.
   *
   * <p>Asymmetric: a folder named "Artist - Album [FLAC]" fully contains the target "Artist" even
   * though it carries extra words.
   */
  double containment(WordSet target) {
    if (target.words.isEmpty()) {
      return 0.0;
    }
    return (double) intersectionSize(target) / target.words.size();
  }

  /** Sorensen-Dice coefficient. Two empty sets are considered identical. */
  double dice(WordSet other) {
    int total = words.size() + other.words.size();
    if (total == 0) {
      return 1.0;
    }
    return (2.0 * intersectionSize(other)) / total;
  }

  private int intersectionSize(WordSet other) {
    Set<String> smaller = words.size() <= other.words.size() ? words : other.words;
    Set<String> larger = smaller == words ? other.words : words;
    int count = 0;
    for (String word : smaller) {
      if (larger.contains(word)) {
        count++;
      }
    }
    return count;
  }
}
