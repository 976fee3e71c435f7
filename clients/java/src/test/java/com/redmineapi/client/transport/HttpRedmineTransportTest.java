package com.redmineapi.client.transport;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.google.common.collect.ImmutableMap;
import com.redmineapi.client.common.status.StatusCode;
import com.redmineapi.client.config.RedmineConfig;
import com.redmineapi.client.exceptions.RedmineException;
import java.io.IOException;
import java.net.ConnectException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class HttpRedmineTransportTest {

  @Mock
  private HttpClient client;

  @Mock
  private HttpResponse<Object> response;

  private HttpRedmineTransport transport;

  @BeforeEach
  void setUp() {
    transport = new HttpRedmineTransport(RedmineConfig.of("http://redmine.test", "secret"), client);
  }

  private void respondWith(int status, String body) throws Exception {
    when(client.send(any(HttpRequest.class), any())).thenReturn(response);
    when(response.statusCode()).thenReturn(status);
    if (body != null) {
      when(response.body()).thenReturn(body);
    }
  }

  @Test
  void testRequestSendsKeyAndQueryString() throws Exception {
    respondWith(200, "{\"issue\": {\"id\": 1, \"done_ratio\": 12.5}}");

    Map<String, Object> params = new LinkedHashMap<>();
    params.put("include", "journals");
    params.put("subject", "a b");
    Map<String, Object> body =
        transport.request("get", "http://redmine.test/issues/1.json", params, null);

    ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
    verify(client).send(captor.capture(), any());
    HttpRequest sent = captor.getValue();
    assertEquals("GET", sent.method());
    assertEquals(
        "http://redmine.test/issues/1.json?include=journals&subject=a+b", sent.uri().toString());
    assertEquals("secret", sent.headers().firstValue("X-Redmine-API-Key").orElseThrow());

    Map<?, ?> issue = (Map<?, ?>) body.get("issue");
    assertEquals(1L, issue.get("id"), "Integral numbers should decode as Long");
    assertEquals(12.5, issue.get("done_ratio"));
  }

  @Test
  void testBasicAuthAndImpersonation() throws Exception {
    transport = new HttpRedmineTransport(
        RedmineConfig.of("http://redmine.test", null)
            .withBasicAuth("admin", "admin")
            .withImpersonation("jsmith"),
        client);
    respondWith(200, "");

    Map<String, Object> body = transport.request(
        "put", "http://redmine.test/issues/1.json", ImmutableMap.of(),
        ImmutableMap.of("issue", ImmutableMap.of("subject", "x")));

    ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
    verify(client).send(captor.capture(), any());
    HttpRequest sent = captor.getValue();
    assertEquals("PUT", sent.method());
    assertEquals("Basic YWRtaW46YWRtaW4=", sent.headers().firstValue("Authorization").orElseThrow());
    assertEquals("jsmith", sent.headers().firstValue("X-Redmine-Switch-User").orElseThrow());
    assertEquals("application/json", sent.headers().firstValue("Content-Type").orElseThrow());
    assertTrue(body.isEmpty(), "An empty body should parse as an empty map");
  }

  @Test
  void testNotFoundBecomesRedmineException() throws Exception {
    respondWith(404, "");

    RedmineException e = assertThrows(RedmineException.class,
        () -> transport.request("get", "http://redmine.test/issues/9.json", Map.of(), null));

    assertEquals(StatusCode.NOT_FOUND, e.getStatus().getCode());
  }

  @Test
  void testValidationErrorsAreJoined() throws Exception {
    respondWith(422, "{\"errors\": [\"Subject cannot be blank\", \"Tracker is invalid\"]}");

    RedmineException e = assertThrows(RedmineException.class,
        () -> transport.request("post", "http://redmine.test/issues.json", Map.of(), Map.of()));

    assertEquals(StatusCode.UNPROCESSABLE, e.getStatus().getCode());
    assertEquals("Validation failed: Subject cannot be blank; Tracker is invalid",
        e.getStatus().getMessage());
  }

  @Test
  void testUnparseableValidationBodyKeepsHttpStatus() throws Exception {
    respondWith(422, "<html>Proxy error</html>");

    RedmineException e = assertThrows(RedmineException.class,
        () -> transport.request("post", "http://redmine.test/issues.json", Map.of(), Map.of()));

    assertEquals(StatusCode.UNPROCESSABLE, e.getStatus().getCode());
    assertTrue(e.getStatus().getMessage().contains("returned HTTP 422"));
  }

  @Test
  void testFailedDownloadLeavesNoFile(@TempDir Path directory) throws Exception {
    respondWith(404, null);

    RedmineException e = assertThrows(RedmineException.class,
        () -> transport.download(
            "http://redmine.test/attachments/download/3", directory, "report.pdf"));

    assertEquals(StatusCode.NOT_FOUND, e.getStatus().getCode());
    assertFalse(Files.exists(directory.resolve("report.pdf")));
    try (Stream<Path> files = Files.list(directory)) {
      assertEquals(0, files.count());
    }
  }

  @Test
  void testDownloadIsMovedToTarget(@TempDir Path directory) throws Exception {
    respondWith(200, null);

    Path saved = transport.download(
        "http://redmine.test/attachments/download/3/report.pdf", directory, null);

    assertEquals(directory.resolve("report.pdf"), saved);
    assertTrue(Files.exists(saved));
    try (Stream<Path> files = Files.list(directory)) {
      assertEquals(1, files.count());
    }
  }

  @Test
  void testIoFailureBecomesUnavailable() throws Exception {
    when(client.send(any(HttpRequest.class), any())).thenThrow(new ConnectException("refused"));

    RedmineException e = assertThrows(RedmineException.class,
        () -> transport.request("get", "http://redmine.test/projects.json", Map.of(), null));

    assertEquals(StatusCode.UNAVAILABLE, e.getStatus().getCode());
    assertTrue(e.getStatus().getCause() instanceof IOException);
  }

  @Test
  void testQueryStringSkipsNullValues() {
    Map<String, Object> params = new LinkedHashMap<>();
    params.put("offset", 0);
    params.put("project_id", null);
    params.put("limit", 100);

    assertEquals("?offset=0&limit=100", HttpRedmineTransport.queryString(params));
    assertEquals("", HttpRedmineTransport.queryString(Map.of()));
  }
}
