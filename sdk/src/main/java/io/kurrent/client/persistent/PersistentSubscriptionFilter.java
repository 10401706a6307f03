package io.kurrent.client.persistent;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Server-side filter for a persistent subscription to the all-stream.
 *
 * <p>A filter matches either stream names or record types, by regular expression or by prefixes.
 */
public final class PersistentSubscriptionFilter {

  /** Default number of records the server scans between checkpoints of a filtered read. */
  public static final int DEFAULT_WINDOW_MAX = 1000;

  /** What a filter matches against. */
  public enum Scope {
    STREAM,
    RECORD_TYPE
  }

  private final Scope scope;
  private final Optional<String> regex;
  private final List<String> prefixes;
  private final int windowMax;

  private PersistentSubscriptionFilter(
      Scope scope, Optional<String> regex, List<String> prefixes, int windowMax) {
    this.scope = scope;
    this.regex = regex;
    this.prefixes = prefixes;
    this.windowMax = windowMax;
  }

  public static PersistentSubscriptionFilter streamRegex(String regex) {
    return new PersistentSubscriptionFilter(
        Scope.STREAM,
        Optional.of(requireText(regex, "regex")),
        Collections.emptyList(),
        DEFAULT_WINDOW_MAX);
  }

  public static PersistentSubscriptionFilter streamPrefix(String... prefixes) {
    return new PersistentSubscriptionFilter(
        Scope.STREAM, Optional.empty(), requirePrefixes(prefixes), DEFAULT_WINDOW_MAX);
  }

  public static PersistentSubscriptionFilter recordTypeRegex(String regex) {
    return new PersistentSubscriptionFilter(
        Scope.RECORD_TYPE,
        Optional.of(requireText(regex, "regex")),
        Collections.emptyList(),
        DEFAULT_WINDOW_MAX);
  }

  public static PersistentSubscriptionFilter recordTypePrefix(String... prefixes) {
    return new PersistentSubscriptionFilter(
        Scope.RECORD_TYPE, Optional.empty(), requirePrefixes(prefixes), DEFAULT_WINDOW_MAX);
  }

  /**
   * Returns a copy of this filter with a different scan window.
   *
   * @param windowMax the maximum number of records scanned between checkpoints
   * @return the new filter
   */
  public PersistentSubscriptionFilter withWindowMax(int windowMax) {
    if (windowMax <= 0) {
      throw new IllegalArgumentException("windowMax must be positive");
    }
    return new PersistentSubscriptionFilter(scope, regex, prefixes, windowMax);
  }

  public Scope getScope() {
    return scope;
  }

  public Optional<String> getRegex() {
    return regex;
  }

  public List<String> getPrefixes() {
    return prefixes;
  }

  public int getWindowMax() {
    return windowMax;
  }

  private static String requireText(String value, String name) {
    Objects.requireNonNull(value, name + " cannot be null");
    if (value.isEmpty()) {
      throw new IllegalArgumentException(name + " cannot be empty");
    }
    return value;
  }

  private static List<String> requirePrefixes(String... prefixes) {
    if (prefixes.length == 0) {
      throw new IllegalArgumentException("at least one prefix is required");
    }
    List<String> checked = new ArrayList<>(prefixes.length);
    for (String prefix : Arrays.asList(prefixes)) {
      checked.add(requireText(prefix, "prefix"));
    }
    return Collections.unmodifiableList(checked);
  }
}
