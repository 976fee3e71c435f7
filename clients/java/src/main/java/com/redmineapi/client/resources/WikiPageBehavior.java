package com.redmineapi.client.resources;

import com.google.common.collect.ImmutableMap;
import com.redmineapi.client.managers.ResourceManager;
import com.redmineapi.client.util.UrlTemplate;
import java.util.Map;

/**
 * Wiki pages are identified by title within a project. Every request about a page carries the
 * {@code project_id} of the manager that produced it.
 */
final class WikiPageBehavior implements ResourceBehavior {

  @Override
  public Object get(Resource resource, String name) {
    // Listings don't include the text, fetch the page for it.
    if ("text".equals(name) && !resource.isNew() && !resource.raw().containsKey(name)) {
      resource.putDecoded(name, resource.refresh(false, ImmutableMap.of()).raw().get(name));
    }
    return resource.resolve(name, resource.type().relationsName());
  }

  @Override
  public Attribute encode(TypeCodec codec, String name, Object value) {
    if ("parent".equals(name)) {
      ResourceManager pages = codec.manager().newManager(
          codec.type().name(), ImmutableMap.of("project_id", projectId(codec.manager())));
      return new Attribute(name, pages.toResource(value));
    }
    return codec.encodeValue(name, value);
  }

  @Override
  public Object internalId(Resource resource) {
    return resource.get("title");
  }

  @Override
  public Object intValue(Resource resource) {
    return resource.get("version");
  }

  @Override
  public String url(Resource resource) {
    return resource.redmine().url()
        + UrlTemplate.expand(
                resource.type().queryOne(),
                resource.internalId(),
                ImmutableMap.of("project_id", projectId(resource.manager())))
            .replace(".json", "");
  }

  @Override
  public Map<String, Object> refreshParams(Resource resource, Map<String, Object> params) {
    params.put("project_id", projectId(resource.manager()));
    return params;
  }

  @Override
  public Map<String, Object> deleteParams(Resource resource, Map<String, Object> params) {
    params.put("project_id", projectId(resource.manager()));
    return params;
  }

  /** The server doesn't return the new version on update, so it is counted locally. */
  @Override
  public void postUpdate(Resource resource) {
    Object version = resource.raw().get("version");
    long current = version instanceof Number ? ((Number) version).longValue() : 0L;
    resource.putDecodedAndEncoded("version", current + 1);
  }

  private static Object projectId(ResourceManager manager) {
    return manager.params().getOrDefault("project_id", 0);
  }
}
