package com.redmineapi.client.managers;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.redmineapi.client.Redmine;
import com.redmineapi.client.common.status.Status;
import com.redmineapi.client.exceptions.RedmineException;
import com.redmineapi.client.exceptions.UnsupportedResourceOperationException;
import com.redmineapi.client.resources.Resource;
import com.redmineapi.client.resources.ResourceSet;
import com.redmineapi.client.resources.ResourceType;
import com.redmineapi.client.util.UrlTemplate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import org.tinylog.Logger;

/**
 * {@link ResourceManager} that builds request URLs from the type's endpoint templates and talks to
 * the server through the connection's transport.
 *
 * <p>Parameters consumed by a template (the identity for {@code {0}}, scope and field values for
 * named placeholders) become part of the path; the remaining call parameters are sent as the
 * query string. Payloads are wrapped in, and read from, the type's container keys.
 */
public class DefaultResourceManager implements ResourceManager {
  private final Redmine redmine;
  private final ResourceType type;
  private final ImmutableMap<String, Object> params;

  public DefaultResourceManager(
      @Nonnull Redmine redmine, @Nonnull ResourceType type, @Nonnull Map<String, ?> params) {
    this.redmine = Preconditions.checkNotNull(redmine);
    this.type = Preconditions.checkNotNull(type);
    this.params = ImmutableMap.copyOf(params);
  }

  @Nonnull
  @Override
  public ResourceType type() {
    return type;
  }

  @Nonnull
  @Override
  public Redmine redmine() {
    return redmine;
  }

  @Nonnull
  @Override
  public Map<String, Object> params() {
    return params;
  }

  @Nonnull
  @Override
  public Resource get(@Nonnull Object id, @Nonnull Map<String, ?> params) {
    String template = require(type.queryOne(), "get");
    String url = redmine.url() + UrlTemplate.expand(template, id, merge(params));
    Map<String, Object> response =
        redmine.request("get", url, UrlTemplate.remaining(template, params), null);
    Object fragment = response.get(type.containerOne());
    if (!(fragment instanceof Map)) {
      throw new RedmineException(
          Status.notFound(String.format("%s %s was not found in the response", type.name(), id)));
    }
    return scoped(template, params).toResource(fragment);
  }

  @Nonnull
  @Override
  public ResourceSet all(@Nonnull Map<String, ?> params) {
    String template = require(type.queryAll(), "all");
    return ResourceSet.ofQuery(scoped(template, params), template, params);
  }

  @Nonnull
  @Override
  public ResourceSet filter(@Nonnull Map<String, ?> query) {
    String template = require(type.queryFilter(), "filter");
    return ResourceSet.ofQuery(scoped(template, query), template, query);
  }

  @Nonnull
  @Override
  public Resource create(@Nonnull Map<String, ?> fields) {
    String template = require(type.queryCreate(), "create");
    String url = redmine.url() + UrlTemplate.expand(template, null, merge(fields));
    Map<String, Object> response =
        redmine.request(type.createMethod(), url, ImmutableMap.of(), wrap(fields));
    Object fragment = response.get(type.containerOne());
    Resource created = scoped(template, fields)
        .toResource(fragment instanceof Map ? fragment : new LinkedHashMap<>(fields));
    Logger.info("Created {} {}", type.name(), created.raw().get("id"));
    return created;
  }

  @Nonnull
  @Override
  public Map<String, Object> update(@Nonnull Object id, @Nonnull Map<String, ?> fields) {
    String template = require(type.queryUpdate(), "update");
    String url = redmine.url() + UrlTemplate.expand(template, id, merge(fields));
    return redmine.request("put", url, ImmutableMap.of(), wrap(fields));
  }

  @Nonnull
  @Override
  public Map<String, Object> delete(@Nonnull Object id, @Nonnull Map<String, ?> params) {
    String template = require(type.queryDelete(), "delete");
    String url = redmine.url() + UrlTemplate.expand(template, id, merge(params));
    Map<String, Object> response =
        redmine.request("delete", url, UrlTemplate.remaining(template, params), null);
    Logger.info("Deleted {} {}", type.name(), id);
    return response;
  }

  @Nonnull
  @Override
  public ResourceManager newManager(@Nonnull String typeName, @Nonnull Map<String, ?> scopeParams) {
    return redmine.manager(typeName, scopeParams);
  }

  @Nonnull
  @Override
  public Resource toResource(@Nullable Object fragment) {
    Preconditions.checkArgument(
        fragment instanceof Map, "%s payload should be an object: %s", type.name(), fragment);
    Map<String, Object> attributes = new LinkedHashMap<>();
    ((Map<?, ?>) fragment).forEach((key, value) -> attributes.put(String.valueOf(key), value));
    return new Resource(this, attributes);
  }

  @Nonnull
  @Override
  public ResourceSet toResourceSet(@Nullable Object fragments) {
    Preconditions.checkArgument(
        fragments instanceof List, "%s payload should be a list: %s", type.name(), fragments);
    return ResourceSet.ofFragments(this, (List<?>) fragments);
  }

  private String require(@Nullable String template, String operation) {
    if (template == null) {
      throw new UnsupportedResourceOperationException(type.name(), operation);
    }
    return template;
  }

  /**
   * Returns the manager for resources produced through a template: this manager's scope plus the
   * call parameters the template consumed, such as the {@code project_id} of a wiki page.
   */
  private ResourceManager scoped(String template, Map<String, ?> callParams) {
    Map<String, Object> scope = new LinkedHashMap<>(params);
    for (String name : UrlTemplate.placeholders(template)) {
      Object value = callParams.get(name);
      if (value != null) {
        scope.put(name, value);
      }
    }
    return scope.equals(params) ? this : new DefaultResourceManager(redmine, type, scope);
  }

  private Map<String, Object> merge(Map<String, ?> extra) {
    Map<String, Object> merged = new LinkedHashMap<>(params);
    extra.forEach((name, value) -> {
      if (value != null) {
        merged.put(name, value);
      }
    });
    return merged;
  }

  private Map<String, Object> wrap(Map<String, ?> fields) {
    Map<String, Object> data = new LinkedHashMap<>();
    data.put(type.containerOne(), fields);
    return data;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("type", type.name())
        .add("params", params)
        .toString();
  }
}
