package com.scholary.acquisition.matching;

import java.util.Locale;

/**
 * Decides whether a path reported by the gateway refers to a file we asked for.
 *
 * <p>The gateway frequently reports a path with a different prefix, case or separator style than
 * the one submitted. Two paths match when, after normalising separators and case, they are equal,
 * one ends with the other, or their final components are equal. The relation is reflexive and
 * symmetric.
 */
public final class FilenameMatcher {

  private FilenameMatcher() {}

  public static boolean matches(String first, String second) {
    String a = normalize(first);
    String b = normalize(second);
    if (a.equals(b)) {
      return true;
    }
    // An empty path would be a suffix of everything.
    if (a.isEmpty() || b.isEmpty()) {
      return false;
    }
    if (a.endsWith(b) || b.endsWith(a)) {
      return true;
    }
    String lastA = lastComponent(a);
    return !lastA.isEmpty() && lastA.equals(lastComponent(b));
  }

  static String normalize(String path) {
    if (path == null) {
      return "";
    }
    return path.replace('\\', '/').toLowerCase(Locale.ROOT).trim();
  }

  private static String lastComponent(String normalized) {
    int slash = normalized.lastIndexOf('/');
    return slash >= 0 ? normalized.substring(slash + 1) : normalized;
  }
}
