package com.redmineapi.client.config;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import java.time.Duration;
import java.time.format.DateTimeFormatter;
import java.util.Optional;
import java.util.function.Function;
import javax.annotation.Nullable;

/**
 * Connection-level settings for a Redmine server.
 *
 * <p>Either {@code key} (sent as {@code X-Redmine-API-Key}) or {@code username}/{@code password}
 * (HTTP basic authentication) is used to authenticate; with neither set the client works
 * anonymously. Date patterns are {@link DateTimeFormatter} patterns and control both how wire
 * strings are parsed into {@code LocalDate}/{@code LocalDateTime} values and how such values are
 * written back.
 *
 * @param url The base URL of the server, without a trailing slash (e.g., "https://redmine.example.com")
 * @param key The API access key, or null
 * @param username The login for basic authentication, or null
 * @param password The password for basic authentication, or null
 * @param impersonate The login of a user to act as (admin only), or null
 * @param dateFormat The pattern of calendar dates on the wire
 * @param datetimeFormat The pattern of timestamps on the wire
 * @param version The server version, or null when unknown
 * @param attributeErrorPolicy What happens when a persisted resource lacks a requested attribute
 * @param requestTimeout The timeout applied to each HTTP request
 */
public record RedmineConfig(
    String url,
    @Nullable String key,
    @Nullable String username,
    @Nullable String password,
    @Nullable String impersonate,
    String dateFormat,
    String datetimeFormat,
    @Nullable String version,
    AttributeErrorPolicy attributeErrorPolicy,
    Duration requestTimeout) {

  public static final String DEFAULT_DATE_FORMAT = "yyyy-MM-dd";
  public static final String DEFAULT_DATETIME_FORMAT = "yyyy-MM-dd'T'HH:mm:ss'Z'";
  public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);

  public RedmineConfig {
    Preconditions.checkArgument(!Strings.isNullOrEmpty(url), "Redmine URL cannot be empty");
    url = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    dateFormat = MoreObjects.firstNonNull(dateFormat, DEFAULT_DATE_FORMAT);
    datetimeFormat = MoreObjects.firstNonNull(datetimeFormat, DEFAULT_DATETIME_FORMAT);
    attributeErrorPolicy = MoreObjects.firstNonNull(attributeErrorPolicy, AttributeErrorPolicy.on());
    requestTimeout = MoreObjects.firstNonNull(requestTimeout, DEFAULT_REQUEST_TIMEOUT);
  }

  /** Creates a configuration with default formats and policy for the given server and key. */
  public static RedmineConfig of(String url, @Nullable String key) {
    return new RedmineConfig(url, key, null, null, null, null, null, null, null, null);
  }

  /**
   * Reads the configuration from {@code REDMINE_*} environment variables. {@code REDMINE_URL} is
   * required.
   */
  public static RedmineConfig fromEnvironment() {
    return fromVariables(System::getenv);
  }

  static RedmineConfig fromVariables(Function<String, String> env) {
    String policy = env.apply("REDMINE_RAISE_ATTR_EXCEPTION");
    String timeout = env.apply("REDMINE_TIMEOUT_SECONDS");
    return new RedmineConfig(
        env.apply("REDMINE_URL"),
        Strings.emptyToNull(env.apply("REDMINE_KEY")),
        Strings.emptyToNull(env.apply("REDMINE_USERNAME")),
        Strings.emptyToNull(env.apply("REDMINE_PASSWORD")),
        Strings.emptyToNull(env.apply("REDMINE_IMPERSONATE")),
        Strings.emptyToNull(env.apply("REDMINE_DATE_FORMAT")),
        Strings.emptyToNull(env.apply("REDMINE_DATETIME_FORMAT")),
        Strings.emptyToNull(env.apply("REDMINE_VERSION")),
        policy == null ? null : AttributeErrorPolicy.parse(policy),
        Strings.isNullOrEmpty(timeout) ? null : Duration.ofSeconds(Long.parseLong(timeout.trim())));
  }

  public RedmineConfig withVersion(@Nullable String version) {
    return new RedmineConfig(url, key, username, password, impersonate,
        dateFormat, datetimeFormat, version, attributeErrorPolicy, requestTimeout);
  }

  public RedmineConfig withAttributeErrorPolicy(AttributeErrorPolicy policy) {
    return new RedmineConfig(url, key, username, password, impersonate,
        dateFormat, datetimeFormat, version, policy, requestTimeout);
  }

  public RedmineConfig withBasicAuth(String username, String password) {
    return new RedmineConfig(url, key, username, password, impersonate,
        dateFormat, datetimeFormat, version, attributeErrorPolicy, requestTimeout);
  }

  public RedmineConfig withImpersonation(@Nullable String login) {
    return new RedmineConfig(url, key, username, password, login,
        dateFormat, datetimeFormat, version, attributeErrorPolicy, requestTimeout);
  }

  public RedmineConfig withDateFormats(String dateFormat, String datetimeFormat) {
    return new RedmineConfig(url, key, username, password, impersonate,
        dateFormat, datetimeFormat, version, attributeErrorPolicy, requestTimeout);
  }

  public DateTimeFormatter dateFormatter() {
    return DateTimeFormatter.ofPattern(dateFormat);
  }

  public DateTimeFormatter datetimeFormatter() {
    return DateTimeFormatter.ofPattern(datetimeFormat);
  }

  public Optional<String> serverVersion() {
    return Optional.ofNullable(version);
  }

  /**
   * Returns a string representation of this object without the API key and password, safe to
   * use in logs.
   */
  public String toSecureString() {
    return MoreObjects.toStringHelper(this)
        .omitNullValues()
        .add("url", url())
        .add("username", username())
        .add("impersonate", impersonate())
        .add("version", version())
        .add("attributeErrorPolicy", attributeErrorPolicy())
        .add("hasKey", key() != null)
        .toString();
  }
}
