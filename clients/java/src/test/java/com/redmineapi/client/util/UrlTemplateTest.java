package com.redmineapi.client.util;

import static org.junit.jupiter.api.Assertions.*;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class UrlTemplateTest {

  @Test
  void testExpandIdentityAndNamedPlaceholders() {
    String path = UrlTemplate.expand(
        "/projects/{project_id}/wiki/{0}.json", "Start", ImmutableMap.of("project_id", "demo"));
    assertEquals("/projects/demo/wiki/Start.json", path);
  }

  @Test
  void testExpandEscapesPathSegments() {
    String path = UrlTemplate.expand(
        "/projects/{project_id}/wiki/{0}.json",
        "Meeting notes?",
        ImmutableMap.of("project_id", "demo"));
    assertEquals("/projects/demo/wiki/Meeting%20notes%3F.json", path);
    assertEquals("/projects/demo/wiki/A%2FB%23C.json", UrlTemplate.expand(
        "/projects/{project_id}/wiki/{0}.json", "A/B#C", ImmutableMap.of("project_id", "demo")));
  }

  @Test
  void testExpandWithoutPlaceholders() {
    assertEquals("/issues.json", UrlTemplate.expand("/issues.json", null, ImmutableMap.of()));
  }

  @Test
  void testExpandFailsOnMissingValue() {
    IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
        () -> UrlTemplate.expand("/projects/{project_id}/issues.json", null, ImmutableMap.of()));
    assertTrue(e.getMessage().contains("project_id"));
  }

  @Test
  void testPlaceholdersIgnoreIdentity() {
    assertEquals(ImmutableSet.of("project_id"),
        UrlTemplate.placeholders("/projects/{project_id}/wiki/{0}.json"));
  }

  @Test
  void testRemainingKeepsOrderAndDropsConsumed() {
    Map<String, Object> params = new LinkedHashMap<>();
    params.put("status_id", "open");
    params.put("project_id", 1);
    params.put("sort", "id:desc");

    Map<String, Object> rest = UrlTemplate.remaining("/projects/{project_id}/issues.json", params);

    assertEquals(2, rest.size());
    assertEquals("[status_id, sort]", rest.keySet().toString());
  }
}
