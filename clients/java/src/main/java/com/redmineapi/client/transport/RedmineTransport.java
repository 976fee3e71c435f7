package com.redmineapi.client.transport;

import java.nio.file.Path;
import java.util.Map;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Performs requests against a Redmine server. Implementations own authentication and JSON
 * encoding; callers deal only in wire payloads represented as maps, lists, strings, numbers and
 * booleans.
 *
 * <p>Failures are reported as {@link com.redmineapi.client.exceptions.RedmineException}s whose
 * status reflects the HTTP response.
 */
public interface RedmineTransport {

  /**
   * Sends a request and returns the decoded JSON object of the response body.
   *
   * @param method The HTTP method ("get", "post", "put", "delete"), case-insensitive
   * @param url The absolute request URL
   * @param params Query parameters
   * @param data The JSON request body, or null for none
   * @return The decoded response, empty when the server sent no body
   */
  @Nonnull
  Map<String, Object> request(
      @Nonnull String method,
      @Nonnull String url,
      @Nonnull Map<String, ?> params,
      @Nullable Map<String, ?> data);

  /**
   * Downloads the body of a GET request into a file.
   *
   * @param url The absolute URL of the file
   * @param directory The directory to save into
   * @param filename The file name, or null to use the last segment of the URL path
   * @return The path of the written file
   */
  @Nonnull
  Path download(@Nonnull String url, @Nonnull Path directory, @Nullable String filename);
}
