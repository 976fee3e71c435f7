package com.redmineapi.client.managers;

import com.google.common.collect.ImmutableMap;
import com.redmineapi.client.Redmine;
import com.redmineapi.client.resources.Resource;
import com.redmineapi.client.resources.ResourceSet;
import com.redmineapi.client.resources.ResourceType;
import java.util.Map;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Performs the network operations for one resource type, optionally scoped by parameters such as
 * a parent {@code project_id}. Resources reach the server exclusively through their manager, and
 * reach managers of related types through {@link #newManager}.
 */
public interface ResourceManager {

  /** The type this manager works with. */
  @Nonnull
  ResourceType type();

  /** The connection this manager belongs to. */
  @Nonnull
  Redmine redmine();

  /** The scope parameters, used to expand endpoint templates. */
  @Nonnull
  Map<String, Object> params();

  /** Fetches a single resource by identity. */
  @Nonnull
  Resource get(@Nonnull Object id, @Nonnull Map<String, ?> params);

  /** Returns a lazy set of every resource of this type. */
  @Nonnull
  ResourceSet all(@Nonnull Map<String, ?> params);

  /** Returns a lazy set of the resources matching a query. */
  @Nonnull
  ResourceSet filter(@Nonnull Map<String, ?> query);

  /** Creates a resource and returns it as the server sent it back. */
  @Nonnull
  Resource create(@Nonnull Map<String, ?> fields);

  /** Updates a resource, returning the server's acknowledgement. */
  @Nonnull
  Map<String, Object> update(@Nonnull Object id, @Nonnull Map<String, ?> fields);

  /** Deletes a resource, returning the server's acknowledgement. */
  @Nonnull
  Map<String, Object> delete(@Nonnull Object id, @Nonnull Map<String, ?> params);

  /** Returns a manager for another type on the same connection. */
  @Nonnull
  ResourceManager newManager(@Nonnull String typeName, @Nonnull Map<String, ?> scopeParams);

  @Nonnull
  default ResourceManager newManager(@Nonnull String typeName) {
    return newManager(typeName, ImmutableMap.of());
  }

  /** Wraps an embedded wire fragment into a resource of this type. */
  @Nonnull
  Resource toResource(@Nullable Object fragment);

  /** Wraps a list of embedded wire fragments into a lazy set of resources of this type. */
  @Nonnull
  ResourceSet toResourceSet(@Nullable Object fragments);

  /** Creates an unsaved resource of this type. */
  @Nonnull
  default Resource newResource() {
    return new Resource(this, ImmutableMap.of());
  }
}
