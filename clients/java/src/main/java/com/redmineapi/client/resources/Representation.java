package com.redmineapi.client.resources;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.redmineapi.client.exceptions.MissingAttributeException;
import java.util.ArrayList;
import java.util.List;

/**
 * Text views of a resource built from the first attribute tuple of its type's representation
 * preferences that resolves.
 *
 * <p>Attributes of a tuple are resolved last to first; resolution of a tuple stops at the first
 * absent attribute, and the tuple is accepted if anything was resolved by then. For a new
 * resource, a tuple of more than two values loses its last value. The display text leaves out the
 * {@code id}, the structured text keeps a leading numeric identity.
 */
final class Representation {
  private static final Joiner SPACE = Joiner.on(' ');

  private final String typeName;
  private final ImmutableList<Object> displayValues;
  private final ImmutableList<Object> values;

  private Representation(String typeName, List<Object> displayValues, List<Object> values) {
    this.typeName = typeName;
    this.displayValues = ImmutableList.copyOf(displayValues);
    this.values = ImmutableList.copyOf(values);
  }

  static Representation of(Resource resource) {
    List<Object> display = new ArrayList<>();
    List<Object> values = new ArrayList<>();

    for (ImmutableList<String> tuple : resource.type().representation()) {
      for (String name : tuple.reverse()) {
        Object value = resolve(resource, name);
        if (value == null) {
          break;
        }
        values.add(0, value);
        if (!"id".equals(name)) {
          display.add(0, value);
        }
      }
      if (!values.isEmpty()) {
        break;
      }
    }

    if (resource.isNew() && values.size() > 2) {
      values.remove(values.size() - 1);
      if (!display.isEmpty()) {
        display.remove(display.size() - 1);
      }
    }
    return new Representation(resource.type().name(), display, values);
  }

  private static Object resolve(Resource resource, String name) {
    try {
      return resource.get(name);
    } catch (MissingAttributeException e) {
      return null;
    }
  }

  /** The values the display text is made of. */
  ImmutableList<Object> displayValues() {
    return displayValues;
  }

  /** The values the structured text is made of. */
  ImmutableList<Object> values() {
    return values;
  }

  /** The short text, such as {@code Fix bug}; falls back to the first value. */
  String display() {
    if (!displayValues.isEmpty()) {
      return SPACE.join(displayValues);
    }
    return values.isEmpty() ? "" : String.valueOf(values.get(0));
  }

  /** The structured text, such as {@code <Issue #12 "Fix bug">}. */
  String structured() {
    StringBuilder view = new StringBuilder("<").append(typeName);
    List<Object> rest = values;
    if (!values.isEmpty() && values.get(0) instanceof Number) {
      view.append(" #").append(values.get(0));
      rest = values.subList(1, values.size());
    }
    if (!rest.isEmpty()) {
      view.append(" \"").append(SPACE.join(rest)).append('"');
    }
    return view.append('>').toString();
  }
}
