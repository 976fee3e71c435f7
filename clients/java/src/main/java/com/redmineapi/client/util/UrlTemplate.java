package com.redmineapi.client.util;

import com.google.common.collect.ImmutableSet;
import com.google.common.escape.Escaper;
import com.google.common.net.UrlEscapers;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Expands endpoint templates such as {@code /projects/{project_id}/wiki/{0}.json}. The positional
 * placeholder {@code {0}} is replaced by a resource identity, named placeholders by parameters.
 * Substituted values are escaped as path segments.
 */
public final class UrlTemplate {

  private static final Pattern PLACEHOLDER = Pattern.compile("\\{([A-Za-z0-9_]+)}");
  private static final Escaper PATH_SEGMENT = UrlEscapers.urlPathSegmentEscaper();

  private UrlTemplate() {
    // Utility class, no instances
  }

  /**
   * Expands a template.
   *
   * @param template The endpoint template
   * @param id The value for {@code {0}}, or null if the template has none
   * @param params Values for named placeholders
   * @return The expanded path
   * @throws IllegalArgumentException if a placeholder has no value
   */
  @Nonnull
  public static String expand(
      @Nonnull String template, @Nullable Object id, @Nonnull Map<String, ?> params) {
    Matcher matcher = PLACEHOLDER.matcher(template);
    StringBuilder result = new StringBuilder();
    while (matcher.find()) {
      String name = matcher.group(1);
      Object value = "0".equals(name) ? id : params.get(name);
      if (value == null) {
        throw new IllegalArgumentException(
            String.format("Missing value for '%s' in url template %s", name, template));
      }
      matcher.appendReplacement(
          result, Matcher.quoteReplacement(PATH_SEGMENT.escape(String.valueOf(value))));
    }
    matcher.appendTail(result);
    return result.toString();
  }

  /** Returns the names of the named placeholders in a template. */
  @Nonnull
  public static ImmutableSet<String> placeholders(@Nonnull String template) {
    ImmutableSet.Builder<String> names = ImmutableSet.builder();
    Matcher matcher = PLACEHOLDER.matcher(template);
    while (matcher.find()) {
      if (!"0".equals(matcher.group(1))) {
        names.add(matcher.group(1));
      }
    }
    return names.build();
  }

  /** Returns the parameters that the template does not consume, in their original order. */
  @Nonnull
  public static Map<String, Object> remaining(@Nonnull String template, @Nonnull Map<String, ?> params) {
    ImmutableSet<String> used = placeholders(template);
    Map<String, Object> rest = new LinkedHashMap<>();
    params.forEach((name, value) -> {
      if (!used.contains(name)) {
        rest.put(name, value);
      }
    });
    return rest;
  }
}
