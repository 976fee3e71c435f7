package com.redmineapi.client.resources;

import static org.junit.jupiter.api.Assertions.*;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.redmineapi.client.RecordingTransport;
import com.redmineapi.client.Redmine;
import com.redmineapi.client.RedmineFixtures;
import com.redmineapi.client.config.AttributeErrorPolicy;
import com.redmineapi.client.config.RedmineConfig;
import com.redmineapi.client.exceptions.InvalidCustomFieldValueException;
import com.redmineapi.client.exceptions.MissingAttributeException;
import com.redmineapi.client.exceptions.ReadonlyAttributeException;
import com.redmineapi.client.managers.ResourceManager;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Tests for attribute reads and writes on {@link Resource}: caching, conversion, relation and
 * include resolution, readonly checks and custom field merging.
 */
class ResourceTest {
  private static final String URL = RedmineFixtures.URL;

  private RecordingTransport transport;
  private Redmine redmine;

  @BeforeEach
  void setUp() {
    transport = new RecordingTransport();
    redmine = RedmineFixtures.create(transport);
  }

  private Resource issue(Map<String, ?> attributes) {
    return redmine.issues().toResource(attributes);
  }

  @Test
  void testSetThenGetOnNewResource() {
    Resource issue = redmine.issues().newResource();

    issue.set("subject", "Fix bug");

    assertTrue(issue.isNew());
    assertEquals("Fix bug", issue.get("subject"));
    assertEquals(ImmutableMap.of("subject", "Fix bug"), issue.changes());
  }

  @Test
  void testNewResourceDefaults() {
    Resource issue = redmine.issues().newResource();

    assertEquals(0, issue.get("id"));
    assertEquals("", issue.get("description"));
    assertTrue(transport.requests().isEmpty(), "Defaults should not touch the server");
  }

  @Test
  void testManagerIsAFrameworkMember() {
    Resource issue = redmine.issues().newResource();
    ResourceManager other = redmine.issues();

    assertSame(issue.manager(), issue.get("manager"));
    issue.set("manager", other);
    assertSame(other, issue.manager());
    assertTrue(issue.changes().isEmpty());
  }

  @Test
  void testReadonlyDependsOnLifecycleState() {
    Resource fresh = redmine.projects().newResource();
    fresh.set("identifier", "demo");
    assertThrows(ReadonlyAttributeException.class, () -> fresh.set("id", 5));
    assertThrows(ReadonlyAttributeException.class, () -> fresh.set("trackers", List.of()));

    Resource saved = redmine.projects().toResource(ImmutableMap.of("id", 1, "identifier", "demo"));
    ReadonlyAttributeException e =
        assertThrows(ReadonlyAttributeException.class, () -> saved.set("identifier", "other"));
    assertEquals("identifier", e.getAttribute());
    saved.set("name", "Demo");
    assertEquals("Demo", saved.get("name"));
  }

  @Test
  void testWireStringsBecomeDates() {
    Resource issue = issue(ImmutableMap.of(
        "id", 1,
        "start_date", "2024-01-31",
        "created_on", "2024-01-31T10:15:00Z",
        "subject", "2024-01-31"));

    assertEquals(LocalDate.of(2024, 1, 31), issue.get("start_date"));
    assertEquals(LocalDateTime.of(2024, 1, 31, 10, 15), issue.get("created_on"));
    assertEquals("2024-01-31", issue.get("subject"), "Unconvertible attributes stay strings");
  }

  @Test
  void testDatesAreWrittenInWireFormat() {
    Resource issue = issue(ImmutableMap.of("id", 1));

    issue.set("due_date", LocalDate.of(2024, 2, 1));

    assertEquals("2024-02-01", issue.changes().get("due_date"));
    assertEquals(LocalDate.of(2024, 2, 1), issue.get("due_date"));
  }

  @Test
  void testEmbeddedResourcesAreWrapped() {
    Resource issue = issue(ImmutableMap.of(
        "id", 1,
        "project", ImmutableMap.of("id", 3, "name", "Demo"),
        "journals", ImmutableList.of(ImmutableMap.of("id", 10, "notes", "2024-01-01"))));

    Resource project = issue.getResource("project");
    assertEquals("Project", project.type().name());
    assertEquals("Demo", project.get("name"));
    assertSame(project, issue.get("project"), "Converted values are cached");

    ResourceSet journals = issue.getResourceSet("journals");
    assertEquals(1, journals.size());
    assertEquals("2024-01-01", journals.get(0).get("notes"));
    assertTrue(transport.requests().isEmpty());
  }

  @Test
  void testIdWriteUpdatesMirroredStub() {
    Resource issue = issue(ImmutableMap.of(
        "id", 1, "project", ImmutableMap.of("id", 3, "name", "Demo")));
    assertEquals(3, issue.getResource("project").get("id"));

    issue.set("project_id", 4);

    assertEquals(4, issue.getResource("project").get("id"));
    assertEquals(ImmutableMap.of("id", 4), issue.raw().get("project"));
    assertEquals(ImmutableMap.of("project_id", 4), issue.changes());
  }

  @Test
  void testIdListWriteUpdatesMirroredStubs() {
    Resource group = redmine.groups().toResource(ImmutableMap.of("id", 2, "name", "Staff"));

    group.set("user_ids", List.of(5, 6));

    ResourceSet users = group.getResourceSet("users");
    assertEquals(2, users.size());
    assertEquals(6, users.get(1).get("id"));
  }

  @Test
  void testRelationIsFilteredOnceAndCached() {
    transport.respond("get", URL + "/time_entries.json", ImmutableMap.of(
        "time_entries", ImmutableList.of(ImmutableMap.of("id", 20, "hours", 1.5)),
        "total_count", 1));
    Resource issue = issue(ImmutableMap.of("id", 1));

    ResourceSet entries = issue.getResourceSet("time_entries");
    assertSame(entries, issue.get("time_entries"));
    assertEquals(1, entries.size());
    assertEquals(1, entries.size());

    List<RecordingTransport.Request> requests =
        transport.requestsTo("get", URL + "/time_entries.json");
    assertEquals(1, requests.size());
    assertEquals(1, requests.get(0).params().get("issue_id"));
  }

  @Test
  void testUserRelationsUseDifferentFilterKeys() {
    transport
        .respond("get", URL + "/issues.json", ImmutableMap.of("issues", List.of()))
        .respond("get", URL + "/time_entries.json", ImmutableMap.of("time_entries", List.of()));
    Resource user = redmine.users().toResource(ImmutableMap.of("id", 8, "login", "jsmith"));

    assertTrue(user.getResourceSet("issues").isEmpty());
    assertTrue(user.getResourceSet("time_entries").isEmpty());

    assertEquals(8, transport.requestsTo("get", URL + "/issues.json").get(0).params()
        .get("assigned_to_id"));
    assertEquals(8, transport.requestsTo("get", URL + "/time_entries.json").get(0).params()
        .get("user_id"));
  }

  @Test
  void testIncludeRefreshesOnceAndCaches() {
    transport.respond("get", URL + "/issues/1.json", ImmutableMap.of("issue", ImmutableMap.of(
        "id", 1, "children", ImmutableList.of(ImmutableMap.of("id", 2, "subject", "Child")))));
    Resource issue = issue(ImmutableMap.of("id", 1, "subject", "Parent"));

    ResourceSet children = issue.getResourceSet("children");
    assertSame(children, issue.get("children"));

    assertEquals("Child", children.get(0).get("subject"));
    assertEquals(1, transport.requests().size());
    assertEquals(ImmutableMap.of("include", "children"), transport.lastRequest().params());
    assertEquals("Parent", issue.get("subject"), "The owner is not replaced by the refresh");
  }

  @Test
  void testIncludeNotReturnedIsMissing() {
    transport.respond("get", URL + "/issues/1.json",
        ImmutableMap.of("issue", ImmutableMap.of("id", 1)));
    Resource issue = issue(ImmutableMap.of("id", 1));

    MissingAttributeException e =
        assertThrows(MissingAttributeException.class, () -> issue.get("journals"));
    assertEquals("journals", e.getAttribute());
    assertEquals("Issue", e.getResourceType());
  }

  @Test
  void testMissingAttributePolicy() {
    Resource strict = issue(ImmutableMap.of("id", 1));
    assertThrows(MissingAttributeException.class, () -> strict.get("estimated_hours"));

    Redmine lenient = new Redmine(
        RedmineConfig.of(URL, "secret").withAttributeErrorPolicy(AttributeErrorPolicy.off()),
        transport);
    assertNull(lenient.issues().toResource(ImmutableMap.of("id", 1)).get("estimated_hours"));

    Redmine restricted = new Redmine(
        RedmineConfig.of(URL, "secret")
            .withAttributeErrorPolicy(AttributeErrorPolicy.forTypes("Project")),
        transport);
    assertNull(restricted.issues().toResource(ImmutableMap.of("id", 1)).get("estimated_hours"));
    assertThrows(MissingAttributeException.class,
        () -> restricted.projects().toResource(ImmutableMap.of("id", 1)).get("homepage"));
  }

  @Test
  void testCustomFieldsAreMergedById() {
    Resource issue = issue(ImmutableMap.of("id", 1, "custom_fields", ImmutableList.of(
        ImmutableMap.of("id", 1L, "value", "a"),
        ImmutableMap.of("id", 2L, "value", "b"))));

    issue.set("custom_fields", ImmutableList.of(
        ImmutableMap.of("id", 2, "value", "c"),
        ImmutableMap.of("id", 3, "value", "d")));

    List<?> merged = (List<?>) issue.raw().get("custom_fields");
    assertEquals(3, merged.size());
    assertEquals(ImmutableMap.of("id", 1L, "value", "a"), merged.get(0));
    assertEquals(ImmutableMap.of("id", 2, "value", "c"), merged.get(1));
    assertEquals(ImmutableMap.of("id", 3, "value", "d"), merged.get(2));
    assertEquals(merged, issue.changes().get("custom_fields"));
  }

  @Test
  void testCustomFieldDatesAreDecoded() {
    Resource issue = issue(ImmutableMap.of("id", 1));
    Map<String, Object> field = new HashMap<>();
    field.put("id", 4);
    field.put("value", LocalDate.of(2024, 3, 1));

    issue.set("custom_fields", List.of(field));

    List<?> merged = (List<?>) issue.changes().get("custom_fields");
    assertEquals("2024-03-01", ((Map<?, ?>) merged.get(0)).get("value"));
  }

  @Test
  void testMalformedCustomFieldsAreRejected() {
    Resource issue = issue(ImmutableMap.of("id", 1));

    assertThrows(InvalidCustomFieldValueException.class,
        () -> issue.set("custom_fields", "not a list"));
    assertThrows(InvalidCustomFieldValueException.class,
        () -> issue.set("custom_fields", List.of("not a mapping")));
    assertThrows(InvalidCustomFieldValueException.class,
        () -> issue.set("custom_fields", List.of(ImmutableMap.of("value", "x"))));
    assertTrue(issue.changes().isEmpty());
  }

  @Test
  void testIterationFollowsPayload() {
    Resource project = redmine.projects().toResource(ImmutableMap.of("id", 1, "name", "Demo"));

    assertTrue(project.attributeNames().containsAll(List.of("id", "name", "trackers", "versions")));
    assertNull(project.raw().get("trackers"), "Relations and includes start out unresolved");
  }
}
