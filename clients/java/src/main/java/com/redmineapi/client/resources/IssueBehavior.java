package com.redmineapi.client.resources;

import com.redmineapi.client.helpers.IssueWatchers;

/**
 * Issues alias {@code version} to {@code fixed_version} and expose their watcher list as the
 * {@code watcher} attribute.
 */
final class IssueBehavior implements ResourceBehavior {

  @Override
  public Object get(Resource resource, String name) {
    if ("version".equals(name)) {
      return resource.resolve("fixed_version", resource.type().relationsName());
    } else if ("watcher".equals(name)) {
      return new IssueWatchers(resource);
    }
    return resource.resolve(name, resource.type().relationsName());
  }

  @Override
  public void set(Resource resource, String name, Object value) {
    resource.assign("version_id".equals(name) ? "fixed_version_id" : name, value);
  }

  @Override
  public Attribute decode(TypeCodec codec, String name, Object value) {
    if ("version_id".equals(name)) {
      return new Attribute("fixed_version_id", value);
    }
    return codec.decodeValue(name, value);
  }
}
