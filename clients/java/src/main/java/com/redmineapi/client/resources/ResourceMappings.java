package com.redmineapi.client.resources;

import com.google.common.collect.ImmutableMap;

/**
 * Process-wide lookup tables that tell the codec and the attribute engine which attributes refer
 * to other resources. Keys are wire attribute names, values are resource type names.
 */
public final class ResourceMappings {

  private ResourceMappings() {
    // Utility class, no instances
  }

  /** Attributes whose embedded value is a list of resources of the mapped type. */
  public static final ImmutableMap<String, String> RESOURCE_SETS =
      ImmutableMap.<String, String>builder()
          .put("trackers", "Tracker")
          .put("issue_categories", "IssueCategory")
          .put("custom_fields", "CustomField")
          .put("groups", "Group")
          .put("users", "User")
          .put("memberships", "ProjectMembership")
          .put("relations", "IssueRelation")
          .put("attachments", "Attachment")
          .put("watchers", "User")
          .put("journals", "IssueJournal")
          .put("children", "Issue")
          .put("roles", "Role")
          .build();

  /** Attributes whose embedded value is a single resource of the mapped type. */
  public static final ImmutableMap<String, String> RESOURCES =
      ImmutableMap.<String, String>builder()
          .put("author", "User")
          .put("assigned_to", "User")
          .put("project", "Project")
          .put("tracker", "Tracker")
          .put("status", "IssueStatus")
          .put("user", "User")
          .put("issue", "Issue")
          .put("priority", "Enumeration")
          .put("activity", "Enumeration")
          .put("category", "IssueCategory")
          .put("fixed_version", "Version")
          .build();

  /** Relation attributes and the type that is filtered to resolve them. */
  public static final ImmutableMap<String, String> RELATIONS =
      ImmutableMap.<String, String>builder()
          .put("wiki_pages", "WikiPage")
          .put("memberships", "ProjectMembership")
          .put("issue_categories", "IssueCategory")
          .put("versions", "Version")
          .put("news", "News")
          .put("relations", "IssueRelation")
          .put("time_entries", "TimeEntry")
          .put("issues", "Issue")
          .build();

  /** Convenience id attributes and the composite attribute that mirrors their value. */
  public static final ImmutableMap<String, String> SINGLE_ID_ATTRIBUTES =
      ImmutableMap.<String, String>builder()
          .put("parent_id", "parent")
          .put("project_id", "project")
          .put("tracker_id", "tracker")
          .put("priority_id", "priority")
          .put("assigned_to_id", "assigned_to")
          .put("category_id", "category")
          .put("fixed_version_id", "fixed_version")
          .put("parent_issue_id", "parent")
          .put("issue_id", "issue")
          .put("activity_id", "activity")
          .build();

  /** Convenience id-list attributes and the composite list attribute that mirrors them. */
  public static final ImmutableMap<String, String> MULTIPLE_ID_ATTRIBUTES =
      ImmutableMap.of(
          "user_ids", "users",
          "role_ids", "roles");
}
