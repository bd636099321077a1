package io.calrecur.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The parameters of a content line, in the order they appeared.
 *
 * <p>Parameter names are case-insensitive and stored upper-cased. A parameter may carry several
 * comma-separated values (for example {@code MEMBER="a","b"}); quoting is already removed.
 */
public final class Parameters {
  private static final Parameters EMPTY = new Parameters(Map.of());

  private final Map<String, List<String>> values;

  private Parameters(Map<String, List<String>> values) {
    this.values = values;
  }

  /**
   * Returns the empty parameter set.
   *
   * @return an empty instance
   */
  public static Parameters empty() {
    return EMPTY;
  }

  /**
   * Creates a parameter set holding a single value per name, mostly for tests.
   *
   * @param nameValuePairs alternating names and values
   * @return the parameters
   */
  public static Parameters of(String... nameValuePairs) {
    Builder builder = builder();
    for (int i = 0; i + 1 < nameValuePairs.length; i += 2) {
      builder.add(nameValuePairs[i], List.of(nameValuePairs[i + 1]));
    }
    return builder.build();
  }

  /**
   * Creates a new builder.
   *
   * @return a builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns the first value of the named parameter.
   *
   * @param name the parameter name, any case
   * @return the first value, or empty if the parameter is absent or valueless
   */
  public Optional<String> first(String name) {
    List<String> list = values.get(normalize(name));
    if (list == null || list.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(list.get(0));
  }

  /**
   * Returns all values of the named parameter.
   *
   * @param name the parameter name, any case
   * @return the values, empty if absent
   */
  public List<String> all(String name) {
    return values.getOrDefault(normalize(name), List.of());
  }

  /**
   * Checks whether the named parameter is present.
   *
   * @param name the parameter name, any case
   * @return true if present
   */
  public boolean has(String name) {
    return values.containsKey(normalize(name));
  }

  /**
   * Returns the parameter names in order of appearance.
   *
   * @return the upper-cased names
   */
  public Set<String> names() {
    return values.keySet();
  }

  /**
   * Checks whether no parameters are present.
   *
   * @return true if empty
   */
  public boolean isEmpty() {
    return values.isEmpty();
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof Parameters other && values.equals(other.values);
  }

  @Override
  public int hashCode() {
    return values.hashCode();
  }

  @Override
  public String toString() {
    return values.toString();
  }

  static String normalize(String name) {
    return name.toUpperCase(Locale.ROOT);
  }

  /** Accumulates parameters while a content line is lexed. */
  public static final class Builder {
    private final Map<String, List<String>> values = new LinkedHashMap<>();

    private Builder() {}

    /**
     * Adds values to a parameter; repeated names are merged.
     *
     * @param name the parameter name
     * @param vals the values
     * @return this builder
     */
    public Builder add(String name, List<String> vals) {
      values.computeIfAbsent(normalize(name), k -> new ArrayList<>()).addAll(vals);
      return this;
    }

    /**
     * Builds the immutable parameter set.
     *
     * @return the parameters
     */
    public Parameters build() {
      if (values.isEmpty()) {
        return EMPTY;
      }
      Map<String, List<String>> copy = new LinkedHashMap<>();
      values.forEach((k, v) -> copy.put(k, List.copyOf(v)));
      return new Parameters(Collections.unmodifiableMap(copy));
    }
  }
}
