package com.redmineapi.client.transport;

import com.google.common.base.Joiner;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.io.BaseEncoding;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonSyntaxException;
import com.google.gson.ToNumberPolicy;
import com.google.gson.reflect.TypeToken;
import com.redmineapi.client.common.status.Status;
import com.redmineapi.client.config.RedmineConfig;
import com.redmineapi.client.exceptions.RedmineException;
import java.io.IOException;
import java.lang.reflect.Type;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import org.tinylog.Logger;

/**
 * {@link RedmineTransport} on top of {@link HttpClient}, with Gson for JSON bodies.
 *
 * <p>Numbers in responses are decoded as {@code Long} when integral and {@code Double}
 * otherwise.
 */
public class HttpRedmineTransport implements RedmineTransport {

  private static final Type MAP_TYPE = new TypeToken<Map<String, Object>>() {}.getType();

  private static final Gson GSON =
      new GsonBuilder()
          .setObjectToNumberStrategy(ToNumberPolicy.LONG_OR_DOUBLE)
          .serializeNulls()
          .create();

  private final RedmineConfig config;
  private final HttpClient client;

  public HttpRedmineTransport(RedmineConfig config) {
    this(
        config,
        HttpClient.newBuilder()
            .connectTimeout(config.requestTimeout())
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build());
  }

  public HttpRedmineTransport(RedmineConfig config, HttpClient client) {
    this.config = config;
    this.client = client;
  }

  @Nonnull
  @Override
  public Map<String, Object> request(
      @Nonnull String method,
      @Nonnull String url,
      @Nonnull Map<String, ?> params,
      @Nullable Map<String, ?> data) {
    URI uri = URI.create(url + queryString(params));
    HttpRequest.Builder builder = newRequest(uri);
    HttpRequest.BodyPublisher body = HttpRequest.BodyPublishers.noBody();
    if (data != null) {
      builder.header("Content-Type", "application/json");
      body = HttpRequest.BodyPublishers.ofString(GSON.toJson(data), StandardCharsets.UTF_8);
    }
    String verb = method.toUpperCase(Locale.ROOT);
    builder.method(verb, body);
    Logger.debug("{} {}", verb, uri);

    HttpResponse<String> response =
        send(builder.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    checkResponse(verb, uri, response.statusCode(), response.body());
    return parseBody(response.body());
  }

  @Nonnull
  @Override
  public Path download(@Nonnull String url, @Nonnull Path directory, @Nullable String filename) {
    URI uri = URI.create(url);
    String name = Strings.isNullOrEmpty(filename) ? lastPathSegment(uri) : filename;
    Path target = directory.resolve(name);
    HttpRequest request = newRequest(uri).GET().build();
    Logger.debug("GET {} -> {}", uri, target);

    Path partial;
    try {
      Files.createDirectories(directory);
      partial = Files.createTempFile(directory, ".download", ".part");
    } catch (IOException e) {
      throw new RedmineException(Status.internal("Cannot prepare download in " + directory, e));
    }
    // The body is only moved into place on success, error pages never land at the target.
    HttpResponse<Path> response;
    try {
      response = send(request, HttpResponse.BodyHandlers.ofFile(partial));
      checkResponse("GET", uri, response.statusCode(), null);
    } catch (RedmineException e) {
      discard(partial, e);
      throw e;
    }
    try {
      return Files.move(partial, target, StandardCopyOption.REPLACE_EXISTING);
    } catch (IOException e) {
      RedmineException failure =
          new RedmineException(Status.internal("Cannot write download to " + target, e));
      discard(partial, failure);
      throw failure;
    }
  }

  private static void discard(Path partial, RedmineException failure) {
    try {
      Files.deleteIfExists(partial);
    } catch (IOException e) {
      Logger.warn(e, "Cannot remove partial download {}", partial);
      failure.addSuppressed(e);
    }
  }

  private HttpRequest.Builder newRequest(URI uri) {
    HttpRequest.Builder builder =
        HttpRequest.newBuilder(uri)
            .timeout(config.requestTimeout())
            .header("Accept", "application/json");
    if (config.key() != null) {
      builder.header("X-Redmine-API-Key", config.key());
    } else if (config.username() != null) {
      String credentials = config.username() + ":" + Strings.nullToEmpty(config.password());
      builder.header(
          "Authorization",
          "Basic " + BaseEncoding.base64().encode(credentials.getBytes(StandardCharsets.UTF_8)));
    }
    if (config.impersonate() != null) {
      builder.header("X-Redmine-Switch-User", config.impersonate());
    }
    return builder;
  }

  private <T> HttpResponse<T> send(HttpRequest request, HttpResponse.BodyHandler<T> handler) {
    try {
      return client.send(request, handler);
    } catch (IOException e) {
      Logger.error(e, "Request {} {} failed", request.method(), request.uri());
      throw new RedmineException(
          Status.unavailable("Request to " + request.uri() + " failed: " + e.getMessage(), e));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new RedmineException(
          Status.unavailable("Request to " + request.uri() + " was interrupted", e));
    }
  }

  private void checkResponse(String verb, URI uri, int statusCode, @Nullable String body) {
    if (statusCode >= 200 && statusCode < 300) {
      return;
    }
    String message;
    List<String> errors =
        statusCode == 422 && body != null ? validationErrors(body) : ImmutableList.of();
    if (!errors.isEmpty()) {
      message = "Validation failed: " + Joiner.on("; ").join(errors);
    } else {
      message = String.format("%s %s returned HTTP %d", verb, uri, statusCode);
    }
    Logger.warn("Error response: {} - {}", statusCode, message);
    throw new RedmineException(Status.fromHttp(statusCode, message));
  }

  private static List<String> validationErrors(String body) {
    List<String> errors = new ArrayList<>();
    Map<String, Object> parsed;
    try {
      parsed = GSON.fromJson(body, MAP_TYPE);
    } catch (JsonSyntaxException e) {
      Logger.debug(e, "Validation response is not a JSON object");
      return errors;
    }
    Object raw = parsed == null ? null : parsed.get("errors");
    if (raw instanceof Iterable) {
      for (Object error : (Iterable<?>) raw) {
        errors.add(String.valueOf(error));
      }
    } else if (raw != null) {
      errors.add(String.valueOf(raw));
    }
    return errors;
  }

  private static Map<String, Object> parseBody(@Nullable String body) {
    if (body == null || body.isBlank()) {
      return new LinkedHashMap<>();
    }
    try {
      Map<String, Object> parsed = GSON.fromJson(body, MAP_TYPE);
      return parsed == null ? new LinkedHashMap<>() : parsed;
    } catch (JsonSyntaxException e) {
      throw new RedmineException(Status.internal("Response is not a JSON object", e));
    }
  }

  static String queryString(Map<String, ?> params) {
    if (params.isEmpty()) {
      return "";
    }
    List<String> pairs = new ArrayList<>();
    params.forEach((name, value) -> {
      if (value != null) {
        pairs.add(encode(name) + "=" + encode(String.valueOf(value)));
      }
    });
    return pairs.isEmpty() ? "" : "?" + Joiner.on('&').join(pairs);
  }

  private static String encode(String text) {
    return URLEncoder.encode(text, StandardCharsets.UTF_8);
  }

  private static String lastPathSegment(URI uri) {
    String path = Strings.nullToEmpty(uri.getPath());
    String name = path.substring(path.lastIndexOf('/') + 1);
    return name.isEmpty() ? "download" : name;
  }
}
