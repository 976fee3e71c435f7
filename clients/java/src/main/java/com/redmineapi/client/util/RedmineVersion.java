package com.redmineapi.client.util;

import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Ints;
import java.util.List;
import javax.annotation.Nonnull;

/**
 * A dotted Redmine version such as {@code 2.3} or {@code 5.1.2.stable}. Components are compared
 * numerically; a trailing non-numeric part of a component is ignored, and missing components
 * count as zero.
 */
public final class RedmineVersion implements Comparable<RedmineVersion> {
  private final String text;
  private final ImmutableList<Integer> components;

  private RedmineVersion(String text, ImmutableList<Integer> components) {
    this.text = text;
    this.components = components;
  }

  public static RedmineVersion parse(@Nonnull String text) {
    Preconditions.checkArgument(!text.isBlank(), "Version cannot be blank");
    ImmutableList.Builder<Integer> parts = ImmutableList.builder();
    for (String part : Splitter.on('.').trimResults().split(text)) {
      int end = 0;
      while (end < part.length() && Character.isDigit(part.charAt(end))) {
        end++;
      }
      if (end == 0) {
        break;
      }
      Integer number = Ints.tryParse(part.substring(0, end));
      parts.add(number == null ? Integer.MAX_VALUE : number);
      if (end < part.length()) {
        break;
      }
    }
    return new RedmineVersion(text, parts.build());
  }

  /** Returns true if this version is lower than the given one. */
  public boolean isBefore(@Nonnull String other) {
    return compareTo(parse(other)) < 0;
  }

  public List<Integer> components() {
    return components;
  }

  @Override
  public int compareTo(RedmineVersion other) {
    int length = Math.max(components.size(), other.components.size());
    for (int i = 0; i < length; i++) {
      int mine = i < components.size() ? components.get(i) : 0;
      int theirs = i < other.components.size() ? other.components.get(i) : 0;
      if (mine != theirs) {
        return Integer.compare(mine, theirs);
      }
    }
    return 0;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    return compareTo((RedmineVersion) obj) == 0;
  }

  @Override
  public int hashCode() {
    int end = components.size();
    while (end > 0 && components.get(end - 1) == 0) {
      end--;
    }
    return components.subList(0, end).hashCode();
  }

  @Override
  public String toString() {
    return text;
  }
}
