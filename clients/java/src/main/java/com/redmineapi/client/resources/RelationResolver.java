package com.redmineapi.client.resources;

import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Map;
import org.tinylog.Logger;

/**
 * Resolves attributes that aren't part of a resource's payload. A relation becomes a lazy filter
 * on the related type keyed by the owner's identity; an include is read from a fresh copy of the
 * owner fetched with an {@code include} parameter. Neither mutates the owner.
 */
final class RelationResolver {
  private final Resource owner;

  RelationResolver(Resource owner) {
    this.owner = owner;
  }

  /**
   * Returns the lazy set of related resources, filtered by {@code {relationsName}_id}.
   *
   * @param name The relation attribute
   * @param relationsName The prefix of the filter key
   */
  ResourceSet filter(String name, String relationsName) {
    String typeName = ResourceMappings.RELATIONS.get(name);
    if (typeName == null) {
      throw new IllegalStateException(
          String.format("Relation '%s' of %s has no mapped type", name, owner.type().name()));
    }
    String key = relationsName + "_id";
    Object id = owner.internalId();
    Logger.debug("Resolving {}.{} as {} filtered by {}={}",
        owner.type().name(), name, typeName, key, id);
    Map<String, Object> query = new LinkedHashMap<>();
    query.put(key, id);
    return owner.manager().newManager(typeName).filter(query);
  }

  /**
   * Fetches the owner again with the include and returns the included attribute, or null if the
   * server didn't send it.
   */
  Object include(String name) {
    Logger.debug("Refreshing {} #{} to include {}", owner.type().name(), owner.internalId(), name);
    Resource refreshed = owner.refresh(false, ImmutableMap.of("include", name));
    if (refreshed.raw().get(name) == null) {
      return null;
    }
    return refreshed.get(name);
  }
}
