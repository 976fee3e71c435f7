package com.redmineapi.client.resources;

import com.google.common.collect.ImmutableList;
import java.util.Map;

final class CustomFieldBehavior implements ResourceBehavior {

  @Override
  public Object get(Resource resource, String name) {
    // A field created after the resource it is read from has no value yet.
    if ("value".equals(name) && !resource.raw().containsKey(name)) {
      return "";
    }
    return resource.resolve(name, resource.type().relationsName());
  }

  @Override
  public Attribute encode(TypeCodec codec, String name, Object value) {
    // Redmine < 2.5.2 sends a single tracker instead of the list of trackers.
    if ("trackers".equals(name) && value instanceof Map && ((Map<?, ?>) value).containsKey("tracker")) {
      Object tracker = ((Map<?, ?>) value).get("tracker");
      return codec.encodeValue(name, tracker == null ? ImmutableList.of() : ImmutableList.of(tracker));
    }
    return codec.encodeValue(name, value);
  }

  @Override
  public String url(Resource resource) {
    return resource.redmine().url() + "/custom_fields/" + resource.internalId() + "/edit";
  }
}
