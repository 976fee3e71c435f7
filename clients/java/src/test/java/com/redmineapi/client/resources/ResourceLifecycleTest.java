package com.redmineapi.client.resources;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.google.common.collect.ImmutableMap;
import com.redmineapi.client.RecordingTransport;
import com.redmineapi.client.Redmine;
import com.redmineapi.client.RedmineFixtures;
import com.redmineapi.client.common.status.Status;
import com.redmineapi.client.config.RedmineConfig;
import com.redmineapi.client.exceptions.RedmineException;
import com.redmineapi.client.transport.RedmineTransport;
import java.time.LocalDateTime;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/** Tests for create, update, refresh and delete of resources. */
@ExtendWith(MockitoExtension.class)
class ResourceLifecycleTest {
  private static final String URL = RedmineFixtures.URL;

  @Mock
  private RedmineTransport failingTransport;

  private RecordingTransport transport;
  private Redmine redmine;

  @BeforeEach
  void setUp() {
    transport = new RecordingTransport();
    redmine = RedmineFixtures.create(transport);
  }

  @Test
  void testSaveCreatesNewResource() {
    transport.respond("post", URL + "/projects/1/issues.json", ImmutableMap.of("issue",
        ImmutableMap.of("id", 42, "subject", "Fix bug", "created_on", "2024-05-01T08:00:00Z")));
    Resource issue = redmine.issues().newResource();
    issue.set("project_id", 1);
    issue.set("subject", "Fix bug");

    assertTrue(issue.save());

    assertFalse(issue.isNew());
    assertEquals(42, issue.get("id"));
    assertEquals(LocalDateTime.of(2024, 5, 1, 8, 0), issue.get("created_on"));
    assertTrue(issue.changes().isEmpty());
    assertEquals(
        ImmutableMap.of("issue", ImmutableMap.of("project_id", 1, "subject", "Fix bug")),
        transport.lastRequest().data());
  }

  @Test
  void testSaveUpdatesPersistedResource() {
    Resource issue = redmine.issues().toResource(ImmutableMap.of(
        "id", 1, "subject", "Old", "updated_on", "2020-01-01T00:00:00Z"));
    LocalDateTime before = (LocalDateTime) issue.get("updated_on");

    issue.set("subject", "New");
    issue.save();

    RecordingTransport.Request request = transport.lastRequest();
    assertEquals("put", request.method());
    assertEquals(URL + "/issues/1.json", request.url());
    assertEquals(ImmutableMap.of("issue", ImmutableMap.of("subject", "New")), request.data());
    assertTrue(issue.changes().isEmpty());
    assertEquals("New", issue.get("subject"));
    assertTrue(((LocalDateTime) issue.get("updated_on")).isAfter(before),
        "updated_on should be stamped locally after an update");
  }

  @Test
  void testFailedSaveKeepsChanges() {
    when(failingTransport.request(eq("put"), eq(URL + "/issues/1.json"), anyMap(), anyMap()))
        .thenThrow(new RedmineException(Status.fromHttp(422, "Validation failed")))
        .thenReturn(ImmutableMap.of());
    Redmine flaky = new Redmine(RedmineConfig.of(URL, "secret"), failingTransport);
    Resource issue = flaky.issues().toResource(ImmutableMap.of("id", 1, "subject", "Old"));
    issue.set("subject", "New");

    assertThrows(RedmineException.class, issue::save);
    assertEquals(ImmutableMap.of("subject", "New"), issue.changes());

    assertTrue(issue.save());
    assertTrue(issue.changes().isEmpty());
    verify(failingTransport, times(2))
        .request(eq("put"), eq(URL + "/issues/1.json"), anyMap(), anyMap());
  }

  @Test
  void testRefreshReplacesDataAndCache() {
    transport.respond("get", URL + "/issues/1.json",
        ImmutableMap.of("issue", ImmutableMap.of("id", 1, "subject", "Server")));
    Resource issue = redmine.issues().toResource(ImmutableMap.of("id", 1, "subject", "Local"));
    assertEquals("Local", issue.get("subject"));

    assertSame(issue, issue.refresh());

    assertEquals("Server", issue.get("subject"));
  }

  @Test
  void testRefreshIntoNewInstance() {
    transport.respond("get", URL + "/issues/1.json",
        ImmutableMap.of("issue", ImmutableMap.of("id", 1, "subject", "Server")));
    Resource issue = redmine.issues().toResource(ImmutableMap.of("id", 1, "subject", "Local"));

    Resource fetched = issue.refresh(false, ImmutableMap.of("include", "journals"));

    assertNotSame(issue, fetched);
    assertEquals("Server", fetched.get("subject"));
    assertEquals("Local", issue.get("subject"));
    assertEquals(ImmutableMap.of("include", "journals"), transport.lastRequest().params());
  }

  @Test
  void testDelete() {
    Resource membership = redmine.manager("ProjectMembership", ImmutableMap.of("project_id", 1))
        .toResource(ImmutableMap.of("id", 30));

    Map<String, Object> response = membership.delete();

    assertNotNull(response);
    RecordingTransport.Request request = transport.lastRequest();
    assertEquals("delete", request.method());
    assertEquals(URL + "/memberships/30.json", request.url());
  }
}
