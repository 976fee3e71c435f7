package com.redmineapi.client.resources;

import com.redmineapi.client.util.UrlTemplate;
import java.util.Map;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * The points at which a resource type can specialize the shared attribute engine. Every method
 * has a default that applies the generic behavior, so a type only overrides what differs.
 *
 * <p>Implementations are stateless and shared by every resource of their type.
 */
public interface ResourceBehavior {

  ResourceBehavior DEFAULT = new ResourceBehavior() {};

  /** Reads an attribute. Overrides may alias names or expose helper objects. */
  @Nullable
  default Object get(Resource resource, String name) {
    return resource.resolve(name, resource.type().relationsName());
  }

  /** Writes an attribute. Overrides may alias names before delegating. */
  default void set(Resource resource, String name, @Nullable Object value) {
    resource.assign(name, value);
  }

  /** Converts a value from its Java form to its wire form. */
  default Attribute decode(TypeCodec codec, String name, @Nullable Object value) {
    return codec.decodeValue(name, value);
  }

  /** Converts a value from its wire form to its Java form. */
  default Attribute encode(TypeCodec codec, String name, Object value) {
    return codec.encodeValue(name, value);
  }

  /** The identity used in endpoint URLs and relation filters. */
  @Nullable
  default Object internalId(Resource resource) {
    return resource.get("id");
  }

  /** The numeric view of the resource. */
  @Nullable
  default Object intValue(Resource resource) {
    return resource.get("id");
  }

  /** The URL of the resource for humans, or null if the type has no page. */
  @Nullable
  default String url(Resource resource) {
    String queryOne = resource.type().queryOne();
    if (queryOne == null) {
      return null;
    }
    return resource.redmine().url()
        + UrlTemplate.expand(queryOne, resource.internalId(), resource.manager().params())
            .replace(".json", "");
  }

  /** The parameters used to re-fetch the resource. */
  @Nonnull
  default Map<String, Object> refreshParams(Resource resource, Map<String, Object> params) {
    return params;
  }

  /** The parameters used to delete the resource. */
  @Nonnull
  default Map<String, Object> deleteParams(Resource resource, Map<String, Object> params) {
    return params;
  }

  default void preCreate(Resource resource) {}

  default void postCreate(Resource resource) {}

  default void preUpdate(Resource resource) {}

  default void postUpdate(Resource resource) {}

  default void preDelete(Resource resource) {}

  default void postDelete(Resource resource) {}
}
