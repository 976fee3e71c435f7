package com.redmineapi.client.resources;

import com.google.common.collect.ImmutableMap;
import javax.annotation.Nonnull;

/** The catalogue of Redmine resource types, keyed by type name. */
public final class ResourceTypes {

  private ResourceTypes() {
    // Utility class, no instances
  }

  public static final ResourceType PROJECT = ResourceType.builder("Project")
      .minimumVersion("1.0")
      .containers("projects", "project")
      .queryAll("/projects.json")
      .queryOne("/projects/{0}.json")
      .queryCreate("/projects.json")
      .queryUpdate("/projects/{0}.json")
      .queryDelete("/projects/{0}.json")
      .includes("trackers", "issue_categories", "enabled_modules")
      .relations("wiki_pages", "memberships", "issue_categories", "time_entries", "versions",
          "news", "issues")
      .alsoUnconvertible("identifier", "status")
      .alsoUpdateReadonly("identifier")
      .behavior(new ProjectBehavior())
      .build();

  public static final ResourceType ISSUE = ResourceType.builder("Issue")
      .minimumVersion("1.0")
      .containers("issues", "issue")
      .queryAll("/issues.json")
      .queryOne("/issues/{0}.json")
      .queryFilter("/issues.json")
      .queryCreate("/projects/{project_id}/issues.json")
      .queryUpdate("/issues/{0}.json")
      .queryDelete("/issues/{0}.json")
      .representation(new String[] {"id", "subject"}, new String[] {"id"})
      .includes("children", "attachments", "relations", "changesets", "journals", "watchers")
      .relations("relations", "time_entries")
      .alsoUnconvertible("subject", "notes")
      .alsoReadonly("spent_hours")
      .behavior(new IssueBehavior())
      .build();

  public static final ResourceType TIME_ENTRY = ResourceType.builder("TimeEntry")
      .minimumVersion("1.1")
      .containers("time_entries", "time_entry")
      .queryAll("/time_entries.json")
      .queryOne("/time_entries/{0}.json")
      .queryFilter("/time_entries.json")
      .queryCreate("/time_entries.json")
      .queryUpdate("/time_entries/{0}.json")
      .queryDelete("/time_entries/{0}.json")
      .representation(new String[] {"id"})
      .behavior(new TimeEntryBehavior())
      .build();

  public static final ResourceType ENUMERATION = ResourceType.builder("Enumeration")
      .minimumVersion("2.2")
      .containers("{resource}", null)
      .queryFilter("/enumerations/{resource}.json")
      .behavior(new PagePathBehavior("/enumerations/", "/edit"))
      .build();

  public static final ResourceType ATTACHMENT = ResourceType.builder("Attachment")
      .minimumVersion("1.3")
      .containers(null, "attachment")
      .queryOne("/attachments/{0}.json")
      .representation(new String[] {"id", "filename"}, new String[] {"id"})
      .build();

  public static final ResourceType ISSUE_JOURNAL = ResourceType.builder("IssueJournal")
      .minimumVersion("1.0")
      .representation(new String[] {"id"})
      .unconvertible("notes")
      .build();

  public static final ResourceType WIKI_PAGE = ResourceType.builder("WikiPage")
      .minimumVersion("2.2")
      .containers("wiki_pages", "wiki_page")
      .queryFilter("/projects/{project_id}/wiki/index.json")
      .queryOne("/projects/{project_id}/wiki/{0}.json")
      .queryCreate("/projects/{project_id}/wiki/{title}.json")
      .queryUpdate("/projects/{project_id}/wiki/{0}.json")
      .queryDelete("/projects/{project_id}/wiki/{0}.json")
      .createMethod("put")
      .representation(new String[] {"title"})
      .includes("attachments")
      .alsoUnconvertible("title", "text")
      .alsoReadonly("version")
      .behavior(new WikiPageBehavior())
      .build();

  public static final ResourceType PROJECT_MEMBERSHIP = ResourceType.builder("ProjectMembership")
      .minimumVersion("1.4")
      .containers("memberships", "membership")
      .queryFilter("/projects/{project_id}/memberships.json")
      .queryOne("/memberships/{0}.json")
      .queryCreate("/projects/{project_id}/memberships.json")
      .queryUpdate("/memberships/{0}.json")
      .queryDelete("/memberships/{0}.json")
      .representation(new String[] {"id"})
      .alsoReadonly("user", "roles")
      .build();

  public static final ResourceType ISSUE_CATEGORY = ResourceType.builder("IssueCategory")
      .minimumVersion("1.3")
      .containers("issue_categories", "issue_category")
      .queryFilter("/projects/{project_id}/issue_categories.json")
      .queryOne("/issue_categories/{0}.json")
      .queryCreate("/projects/{project_id}/issue_categories.json")
      .queryUpdate("/issue_categories/{0}.json")
      .queryDelete("/issue_categories/{0}.json")
      .build();

  public static final ResourceType ISSUE_RELATION = ResourceType.builder("IssueRelation")
      .minimumVersion("1.3")
      .containers("relations", "relation")
      .queryFilter("/issues/{issue_id}/relations.json")
      .queryOne("/relations/{0}.json")
      .queryCreate("/issues/{issue_id}/relations.json")
      .queryDelete("/relations/{0}.json")
      .representation(new String[] {"id"})
      .build();

  public static final ResourceType VERSION = ResourceType.builder("Version")
      .minimumVersion("1.3")
      .containers("versions", "version")
      .queryFilter("/projects/{project_id}/versions.json")
      .queryOne("/versions/{0}.json")
      .queryCreate("/projects/{project_id}/versions.json")
      .queryUpdate("/versions/{0}.json")
      .queryDelete("/versions/{0}.json")
      .unconvertible("status")
      .build();

  public static final ResourceType USER = ResourceType.builder("User")
      .minimumVersion("1.1")
      .containers("users", "user")
      .queryAll("/users.json")
      .queryOne("/users/{0}.json")
      .queryFilter("/users.json")
      .queryCreate("/users.json")
      .queryUpdate("/users/{0}.json")
      .queryDelete("/users/{0}.json")
      .representation(new String[] {"id", "firstname", "lastname"}, new String[] {"id", "name"})
      .includes("memberships", "groups")
      .relations("issues", "time_entries")
      .relationsName("assigned_to")
      .unconvertible("status")
      .alsoReadonly("api_key", "last_login_on")
      .behavior(new UserBehavior())
      .build();

  public static final ResourceType GROUP = ResourceType.builder("Group")
      .minimumVersion("2.1")
      .containers("groups", "group")
      .queryAll("/groups.json")
      .queryOne("/groups/{0}.json")
      .queryCreate("/groups.json")
      .queryUpdate("/groups/{0}.json")
      .queryDelete("/groups/{0}.json")
      .includes("memberships", "users")
      .behavior(new GroupBehavior())
      .build();

  public static final ResourceType ROLE = ResourceType.builder("Role")
      .minimumVersion("1.4")
      .containers("roles", "role")
      .queryAll("/roles.json")
      .queryOne("/roles/{0}.json")
      .build();

  public static final ResourceType NEWS = ResourceType.builder("News")
      .minimumVersion("1.1")
      .containers("news", null)
      .queryAll("/news.json")
      .queryFilter("/news.json")
      .representation(new String[] {"id", "title"})
      .behavior(new PagePathBehavior("/news/", ""))
      .build();

  public static final ResourceType ISSUE_STATUS = ResourceType.builder("IssueStatus")
      .minimumVersion("1.3")
      .containers("issue_statuses", null)
      .queryAll("/issue_statuses.json")
      .relations("issues")
      .relationsName("status")
      .behavior(new PagePathBehavior("/issue_statuses/", "/edit"))
      .build();

  public static final ResourceType TRACKER = ResourceType.builder("Tracker")
      .minimumVersion("1.3")
      .containers("trackers", null)
      .queryAll("/trackers.json")
      .relations("issues")
      .behavior(new PagePathBehavior("/trackers/", "/edit"))
      .build();

  public static final ResourceType QUERY = ResourceType.builder("Query")
      .minimumVersion("1.3")
      .containers("queries", null)
      .queryAll("/queries.json")
      .behavior(new QueryBehavior())
      .build();

  public static final ResourceType CUSTOM_FIELD = ResourceType.builder("CustomField")
      .minimumVersion("2.4")
      .containers("custom_fields", null)
      .queryAll("/custom_fields.json")
      .behavior(new CustomFieldBehavior())
      .build();

  private static final ImmutableMap<String, ResourceType> BY_NAME = index(
      PROJECT, ISSUE, TIME_ENTRY, ENUMERATION, ATTACHMENT, ISSUE_JOURNAL, WIKI_PAGE,
      PROJECT_MEMBERSHIP, ISSUE_CATEGORY, ISSUE_RELATION, VERSION, USER, GROUP, ROLE, NEWS,
      ISSUE_STATUS, TRACKER, QUERY, CUSTOM_FIELD);

  /**
   * Returns the type with the given name, such as {@code "Issue"}.
   *
   * @throws IllegalArgumentException if there is no such type
   */
  @Nonnull
  public static ResourceType byName(@Nonnull String name) {
    ResourceType type = BY_NAME.get(name);
    if (type == null) {
      throw new IllegalArgumentException("Unknown resource type: " + name);
    }
    return type;
  }

  /** Returns every registered type by name. */
  public static ImmutableMap<String, ResourceType> all() {
    return BY_NAME;
  }

  private static ImmutableMap<String, ResourceType> index(ResourceType... types) {
    ImmutableMap.Builder<String, ResourceType> result = ImmutableMap.builder();
    for (ResourceType type : types) {
      result.put(type.name(), type);
    }
    return result.build();
  }
}
