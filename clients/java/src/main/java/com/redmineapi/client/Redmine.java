package com.redmineapi.client;

import com.google.common.collect.ImmutableMap;
import com.redmineapi.client.config.RedmineConfig;
import com.redmineapi.client.exceptions.UnsupportedServerVersionException;
import com.redmineapi.client.managers.DefaultResourceManager;
import com.redmineapi.client.managers.ResourceManager;
import com.redmineapi.client.resources.ResourceType;
import com.redmineapi.client.resources.ResourceTypes;
import com.redmineapi.client.transport.HttpRedmineTransport;
import com.redmineapi.client.transport.RedmineTransport;
import com.redmineapi.client.util.RedmineVersion;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import org.tinylog.Logger;

/**
 * Entry point of the client: a connection to one Redmine server.
 *
 * <p>Resources are reached through per-type managers:
 *
 * <pre>
 * Redmine redmine = new Redmine(RedmineConfig.of("https://redmine.example.com", apiKey));
 * Resource issue = redmine.manager("Issue").get(42, Map.of());
 * issue.set("subject", "Fix the build");
 * issue.save();
 * </pre>
 */
public class Redmine {
  private final RedmineConfig config;
  private final RedmineTransport transport;

  public Redmine(@Nonnull RedmineConfig config) {
    this(config, new HttpRedmineTransport(config));
  }

  public Redmine(@Nonnull RedmineConfig config, @Nonnull RedmineTransport transport) {
    this.config = config;
    this.transport = transport;
    Logger.info("Configured Redmine connection: {}", config.toSecureString());
  }

  public RedmineConfig config() {
    return config;
  }

  /** The base URL of the server. */
  public String url() {
    return config.url();
  }

  /** The server version, if configured. */
  public Optional<RedmineVersion> version() {
    return config.serverVersion().map(RedmineVersion::parse);
  }

  /**
   * Fails if the configured server version is lower than the given minimum. An unknown version
   * always passes.
   *
   * @throws UnsupportedServerVersionException if the server is too old
   */
  public void requireVersion(@Nonnull String feature, @Nonnull String minimum) {
    Optional<RedmineVersion> version = version();
    if (version.isPresent() && version.get().isBefore(minimum)) {
      throw new UnsupportedServerVersionException(feature, minimum, version.get().toString());
    }
  }

  /** Sends a request through the transport. */
  @Nonnull
  public Map<String, Object> request(
      @Nonnull String method,
      @Nonnull String url,
      @Nonnull Map<String, ?> params,
      @Nullable Map<String, ?> data) {
    return transport.request(method, url, params, data);
  }

  /** Downloads a file through the transport. */
  @Nonnull
  public Path download(@Nonnull String url, @Nonnull Path directory, @Nullable String filename) {
    return transport.download(url, directory, filename);
  }

  /** Returns a manager for a resource type. */
  @Nonnull
  public ResourceManager manager(@Nonnull String typeName) {
    return manager(typeName, ImmutableMap.of());
  }

  /**
   * Returns a manager for a resource type, scoped by parameters such as {@code project_id}.
   *
   * @throws IllegalArgumentException if the type is unknown
   * @throws UnsupportedServerVersionException if the server is older than the type's API
   */
  @Nonnull
  public ResourceManager manager(@Nonnull String typeName, @Nonnull Map<String, ?> scopeParams) {
    ResourceType type = ResourceTypes.byName(typeName);
    requireVersion(type.name() + " resource", type.minimumVersion());
    return new DefaultResourceManager(this, type, scopeParams);
  }

  public ResourceManager projects() {
    return manager("Project");
  }

  public ResourceManager issues() {
    return manager("Issue");
  }

  public ResourceManager users() {
    return manager("User");
  }

  public ResourceManager groups() {
    return manager("Group");
  }

  public ResourceManager timeEntries() {
    return manager("TimeEntry");
  }

  public ResourceManager wikiPages(@Nonnull Object projectId) {
    return manager("WikiPage", ImmutableMap.of("project_id", projectId));
  }
}
