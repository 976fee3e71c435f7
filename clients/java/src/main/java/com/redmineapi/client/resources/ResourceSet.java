package com.redmineapi.client.resources;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.redmineapi.client.managers.ResourceManager;
import com.redmineapi.client.util.UrlTemplate;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;
import javax.annotation.Nonnull;
import org.tinylog.Logger;

/**
 * A lazily loaded list of resources of one type.
 *
 * <p>A set is backed either by fragments embedded in another resource's payload or by a query.
 * Nothing is converted or fetched until the set is first read. Query-backed sets page through
 * the results with {@code limit}/{@code offset} unless the query sets {@code limit} itself.
 */
public class ResourceSet implements Iterable<Resource> {

  static final int PAGE_SIZE = 100;

  private final ResourceManager manager;
  private final List<?> fragments;
  private final String endpoint;
  private final ImmutableMap<String, Object> query;
  private List<Resource> resources;

  private ResourceSet(
      ResourceManager manager, List<?> fragments, String endpoint, Map<String, ?> query) {
    this.manager = manager;
    this.fragments = fragments;
    this.endpoint = endpoint;
    this.query = copyOf(query);
  }

  /** Creates a set over fragments embedded in a payload. */
  public static ResourceSet ofFragments(@Nonnull ResourceManager manager, @Nonnull List<?> fragments) {
    return new ResourceSet(manager, fragments, null, ImmutableMap.of());
  }

  /** Creates a set over the results of a query against an endpoint template. */
  public static ResourceSet ofQuery(
      @Nonnull ResourceManager manager, @Nonnull String endpoint, @Nonnull Map<String, ?> query) {
    return new ResourceSet(manager, null, Preconditions.checkNotNull(endpoint), query);
  }

  public ResourceManager manager() {
    return manager;
  }

  /** The query parameters of a query-backed set, empty for embedded sets. */
  public Map<String, Object> query() {
    return query;
  }

  /** Returns true once the resources have been materialized. */
  public boolean isLoaded() {
    return resources != null;
  }

  public int size() {
    return resources().size();
  }

  public boolean isEmpty() {
    return resources().isEmpty();
  }

  public Resource get(int index) {
    return resources().get(index);
  }

  public List<Resource> asList() {
    return resources();
  }

  public Stream<Resource> stream() {
    return resources().stream();
  }

  @Override
  public Iterator<Resource> iterator() {
    return resources().iterator();
  }

  private List<Resource> resources() {
    if (resources == null) {
      resources = fragments != null ? wrap(fragments) : fetch();
    }
    return resources;
  }

  private List<Resource> wrap(List<?> items) {
    ImmutableList.Builder<Resource> result = ImmutableList.builder();
    for (Object item : items) {
      result.add(manager.toResource(item));
    }
    return result.build();
  }

  private List<Resource> fetch() {
    Map<String, Object> merged = new LinkedHashMap<>(manager.params());
    merged.putAll(query);
    String url = manager.redmine().url() + UrlTemplate.expand(endpoint, null, merged);
    Map<String, Object> params = UrlTemplate.remaining(endpoint, merged);
    String containerMany = manager.type().containerMany();
    Preconditions.checkState(
        containerMany != null, "%s has no collection container", manager.type().name());
    String container = UrlTemplate.expand(containerMany, null, merged);

    boolean paged = !params.containsKey("limit");
    int offset = 0;
    List<Object> items = new ArrayList<>();
    while (true) {
      if (paged) {
        params.put("limit", PAGE_SIZE);
        params.put("offset", offset);
      }
      Map<String, Object> response = manager.redmine().request("get", url, params, null);
      List<?> page = (List<?>) response.getOrDefault(container, ImmutableList.of());
      items.addAll(page);
      Object total = response.get("total_count");
      offset += page.size();
      if (!paged || page.isEmpty() || !(total instanceof Number)
          || offset >= ((Number) total).intValue()) {
        break;
      }
    }
    Logger.debug("Loaded {} {} from {}", items.size(), manager.type().name(), url);
    return wrap(items);
  }

  private static ImmutableMap<String, Object> copyOf(Map<String, ?> query) {
    ImmutableMap.Builder<String, Object> result = ImmutableMap.builder();
    query.forEach((name, value) -> {
      if (value != null) {
        result.put(name, value);
      }
    });
    return result.build();
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("type", manager.type().name())
        .add("endpoint", endpoint)
        .add("query", query)
        .add("loaded", isLoaded())
        .toString();
  }
}
