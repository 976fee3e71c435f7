package com.redmineapi.client.resources;

/**
 * A user's issues are the ones assigned to them, but their time entries are the ones they
 * logged, so the two relations filter on different keys.
 */
final class UserBehavior implements ResourceBehavior {

  @Override
  public Object get(Resource resource, String name) {
    if ("time_entries".equals(name) && !resource.isCached(name)) {
      return resource.resolve(name, "user");
    }
    return resource.resolve(name, resource.type().relationsName());
  }
}
