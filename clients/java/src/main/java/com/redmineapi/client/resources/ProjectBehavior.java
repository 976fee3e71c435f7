package com.redmineapi.client.resources;

import com.redmineapi.client.util.UrlTemplate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** Projects are addressed by their identifier and list enabled modules by name. */
final class ProjectBehavior implements ResourceBehavior {

  @Override
  public Attribute encode(TypeCodec codec, String name, Object value) {
    if ("enabled_modules".equals(name) && value instanceof Iterable) {
      List<Object> modules = new ArrayList<>();
      for (Object module : (Iterable<?>) value) {
        modules.add(module instanceof Map ? ((Map<?, ?>) module).get("name") : module);
      }
      return new Attribute(name, modules);
    }
    return codec.encodeValue(name, value);
  }

  @Override
  public String url(Resource resource) {
    return resource.redmine().url()
        + UrlTemplate.expand(resource.type().queryOne(), resource.get("identifier"), Map.of())
            .replace(".json", "");
  }
}
