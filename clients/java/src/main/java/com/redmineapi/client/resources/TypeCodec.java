package com.redmineapi.client.resources;

import com.redmineapi.client.common.status.Status;
import com.redmineapi.client.common.status.StatusOr;
import com.redmineapi.client.config.RedmineConfig;
import com.redmineapi.client.managers.ResourceManager;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Converts attribute values between their wire form and their Java form for one resource type.
 *
 * <p>{@link #decode} and {@link #encode} dispatch through the type's {@link ResourceBehavior}, so
 * type-specific renames and reshapes apply; {@link #decodeValue} and {@link #encodeValue} are the
 * generic conversions the behaviors fall back to.
 *
 * <ul>
 *   <li>Decoding formats {@link LocalDate} and {@link LocalDateTime} values with the configured
 *       patterns and leaves everything else untouched.
 *   <li>Encoding wraps embedded resources and resource lists, then tries to parse strings as a
 *       timestamp, then as a date. Anything that doesn't parse is returned as it is.
 * </ul>
 */
public final class TypeCodec {
  private final ResourceType type;
  private final ResourceManager manager;

  public TypeCodec(@Nonnull ResourceType type, @Nonnull ResourceManager manager) {
    this.type = type;
    this.manager = manager;
  }

  public ResourceType type() {
    return type;
  }

  public ResourceManager manager() {
    return manager;
  }

  /** Converts a single value to its wire form using the type's behavior. */
  public Attribute decode(String name, @Nullable Object value) {
    return type.behavior().decode(this, name, value);
  }

  /** Converts a single wire value to its Java form using the type's behavior. */
  public Attribute encode(String name, Object value) {
    return type.behavior().encode(this, name, value);
  }

  /** Decodes every entry of a mapping. */
  public Map<String, Object> bulkDecode(Map<String, ?> attributes) {
    Map<String, Object> result = new LinkedHashMap<>();
    attributes.forEach((name, value) -> {
      Attribute attribute = decode(name, value);
      result.put(attribute.name(), attribute.value());
    });
    return result;
  }

  /** Encodes every entry of a mapping. */
  public Map<String, Object> bulkEncode(Map<String, ?> attributes) {
    Map<String, Object> result = new LinkedHashMap<>();
    attributes.forEach((name, value) -> {
      Attribute attribute = value == null ? new Attribute(name, null) : encode(name, value);
      result.put(attribute.name(), attribute.value());
    });
    return result;
  }

  /** The generic Java to wire conversion. */
  public Attribute decodeValue(String name, @Nullable Object value) {
    RedmineConfig config = manager.redmine().config();
    if (value instanceof LocalDate) {
      return new Attribute(name, ((LocalDate) value).format(config.dateFormatter()));
    } else if (value instanceof LocalDateTime) {
      return new Attribute(name, ((LocalDateTime) value).format(config.datetimeFormatter()));
    }
    return new Attribute(name, value);
  }

  /** The generic wire to Java conversion. */
  public Attribute encodeValue(String name, Object value) {
    if (type.unconvertible().contains(name)) {
      return new Attribute(name, value);
    } else if (ResourceMappings.RESOURCES.containsKey(name)) {
      return new Attribute(
          name, manager.newManager(ResourceMappings.RESOURCES.get(name)).toResource(value));
    } else if (ResourceMappings.RESOURCE_SETS.containsKey(name)) {
      return new Attribute(
          name, manager.newManager(ResourceMappings.RESOURCE_SETS.get(name)).toResourceSet(value));
    } else if ("parent".equals(name)) {
      return new Attribute(name, manager.newManager(type.name()).toResource(value));
    }
    return new Attribute(name, parseTemporal(value).getOrDefault(value));
  }

  private StatusOr<Object> parseTemporal(Object value) {
    if (!(value instanceof String)) {
      return StatusOr.ofStatus(Status.invalidArgument("Not a string"));
    }
    String text = (String) value;
    RedmineConfig config = manager.redmine().config();
    return parse(text, config.datetimeFormatter(), true)
        .or(() -> parse(text, config.dateFormatter(), false));
  }

  private static StatusOr<Object> parse(String text, DateTimeFormatter formatter, boolean withTime) {
    try {
      return StatusOr.ofValue(
          withTime ? LocalDateTime.parse(text, formatter) : LocalDate.parse(text, formatter));
    } catch (DateTimeParseException e) {
      return StatusOr.ofStatus(Status.invalidArgument(e.getMessage()));
    }
  }
}
