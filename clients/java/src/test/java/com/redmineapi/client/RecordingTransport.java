package com.redmineapi.client;

import com.redmineapi.client.transport.RedmineTransport;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * In-memory transport for tests. Responses are queued per method and URL; every call is recorded
 * so tests can assert on the requests a resource operation produced.
 */
public class RecordingTransport implements RedmineTransport {

  /** One recorded call. */
  public record Request(
      String method, String url, Map<String, Object> params, Map<String, Object> data) {}

  private final Map<String, Deque<Map<String, Object>>> responses = new HashMap<>();
  private final List<Request> requests = new ArrayList<>();
  private final List<String> downloads = new ArrayList<>();

  /** Queues a response for the next call with this method and URL. */
  public RecordingTransport respond(String method, String url, Map<String, ?> response) {
    responses
        .computeIfAbsent(key(method, url), k -> new ArrayDeque<>())
        .add(new LinkedHashMap<>(response));
    return this;
  }

  public List<Request> requests() {
    return requests;
  }

  public Request lastRequest() {
    return requests.get(requests.size() - 1);
  }

  /** Returns the requests sent with the given method and URL. */
  public List<Request> requestsTo(String method, String url) {
    List<Request> matching = new ArrayList<>();
    for (Request request : requests) {
      if (key(request.method(), request.url()).equals(key(method, url))) {
        matching.add(request);
      }
    }
    return matching;
  }

  public List<String> downloads() {
    return downloads;
  }

  @Override
  public Map<String, Object> request(
      String method, String url, Map<String, ?> params, Map<String, ?> data) {
    requests.add(new Request(
        method.toLowerCase(Locale.ROOT),
        url,
        new LinkedHashMap<>(params),
        data == null ? null : new LinkedHashMap<>(data)));
    Deque<Map<String, Object>> queued = responses.get(key(method, url));
    if (queued == null || queued.isEmpty()) {
      return new LinkedHashMap<>();
    }
    return queued.size() == 1 ? new LinkedHashMap<>(queued.peek()) : queued.poll();
  }

  @Override
  public Path download(String url, Path directory, String filename) {
    downloads.add(url);
    return directory.resolve(filename == null ? "download" : filename);
  }

  private static String key(String method, String url) {
    return method.toLowerCase(Locale.ROOT) + " " + url;
  }
}
