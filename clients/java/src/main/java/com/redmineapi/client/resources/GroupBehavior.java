package com.redmineapi.client.resources;

import com.redmineapi.client.helpers.GroupUsers;

/** Groups expose their membership as the {@code user} attribute. */
final class GroupBehavior implements ResourceBehavior {

  @Override
  public Object get(Resource resource, String name) {
    if ("user".equals(name)) {
      return new GroupUsers(resource);
    }
    return resource.resolve(name, resource.type().relationsName());
  }
}
