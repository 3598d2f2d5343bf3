package io.intellixity.schemata.construct;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Input of one construction call: a single positional mapping, or discrete named fields.
 * <p>
 * The two sources are mutually exclusive; {@link InstanceConstructor} rejects a call that mixes them.
 */
public final class Arguments {
  private final List<Object> positional;
  private final Map<String, Object> named;

  private Arguments(List<?> positional, Map<String, ?> named) {
    this.positional = Collections.unmodifiableList(new ArrayList<>(positional));
    this.named = Collections.unmodifiableMap(new LinkedHashMap<>(named));
  }

  /** Single positional mapping, typically a parsed document. */
  public static Arguments of(Map<?, ?> mapping) {
    Objects.requireNonNull(mapping, "mapping");
    return new Arguments(List.of(mapping), Map.of());
  }

  public static Arguments named(Map<String, ?> fields) {
    return new Arguments(List.of(), Objects.requireNonNull(fields, "fields"));
  }

  public static Arguments of(List<?> positional, Map<String, ?> named) {
    return new Arguments(
        positional == null ? List.of() : positional,
        named == null ? Map.of() : named);
  }

  public static Arguments none() {
    return new Arguments(List.of(), Map.of());
  }

  public static Builder builder() { return new Builder(); }

  public List<Object> positional() { return positional; }
  public Map<String, Object> named() { return named; }

  public static final class Builder {
    private final List<Object> positional = new ArrayList<>();
    private final Map<String, Object> named = new LinkedHashMap<>();

    private Builder() {}

    public Builder positional(Object value) {
      positional.add(value);
      return this;
    }

    public Builder with(String name, Object value) {
      named.put(Objects.requireNonNull(name, "name"), value);
      return this;
    }

    public Arguments build() {
      return new Arguments(positional, named);
    }
  }
}
