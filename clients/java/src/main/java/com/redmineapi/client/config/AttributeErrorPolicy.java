package com.redmineapi.client.config;

import com.google.common.base.MoreObjects;
import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableSet;
import java.util.Collection;
import java.util.Objects;
import javax.annotation.Nonnull;

/**
 * Decides whether reading an unresolvable attribute of a persisted resource raises a {@link
 * com.redmineapi.client.exceptions.MissingAttributeException} or yields {@code null}.
 */
public final class AttributeErrorPolicy {

  /** How the policy applies to resource types. */
  public enum Mode {
    /** Never raise; missing attributes read as null. */
    OFF,
    /** Always raise. */
    ON,
    /** Raise only for the configured resource type names. */
    RESTRICTED
  }

  private static final AttributeErrorPolicy OFF_POLICY =
      new AttributeErrorPolicy(Mode.OFF, ImmutableSet.of());
  private static final AttributeErrorPolicy ON_POLICY =
      new AttributeErrorPolicy(Mode.ON, ImmutableSet.of());

  private final Mode mode;
  private final ImmutableSet<String> typeNames;

  private AttributeErrorPolicy(Mode mode, ImmutableSet<String> typeNames) {
    this.mode = mode;
    this.typeNames = typeNames;
  }

  public static AttributeErrorPolicy off() {
    return OFF_POLICY;
  }

  public static AttributeErrorPolicy on() {
    return ON_POLICY;
  }

  public static AttributeErrorPolicy forTypes(@Nonnull Collection<String> typeNames) {
    return new AttributeErrorPolicy(Mode.RESTRICTED, ImmutableSet.copyOf(typeNames));
  }

  public static AttributeErrorPolicy forTypes(String... typeNames) {
    return forTypes(ImmutableSet.copyOf(typeNames));
  }

  /**
   * Parses a policy from its textual form: {@code true}, {@code false}, or a comma-separated list
   * of resource type names. Blank input means {@link #on()}.
   */
  public static AttributeErrorPolicy parse(String text) {
    if (Strings.isNullOrEmpty(text) || text.isBlank() || "true".equalsIgnoreCase(text.trim())) {
      return on();
    }
    if ("false".equalsIgnoreCase(text.trim())) {
      return off();
    }
    return forTypes(Splitter.on(',').trimResults().omitEmptyStrings().splitToList(text));
  }

  public Mode mode() {
    return mode;
  }

  public ImmutableSet<String> typeNames() {
    return typeNames;
  }

  /** Returns true if a missing attribute on a resource of the given type should raise. */
  public boolean shouldRaise(String typeName) {
    return switch (mode) {
      case OFF -> false;
      case ON -> true;
      case RESTRICTED -> typeNames.contains(typeName);
    };
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    AttributeErrorPolicy other = (AttributeErrorPolicy) obj;
    return mode == other.mode && typeNames.equals(other.typeNames);
  }

  @Override
  public int hashCode() {
    return Objects.hash(mode, typeNames);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("mode", mode)
        .add("typeNames", typeNames)
        .toString();
  }
}
