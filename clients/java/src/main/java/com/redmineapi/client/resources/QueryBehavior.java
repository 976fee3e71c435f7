package com.redmineapi.client.resources;

/** A saved query opens as the issue list of its project. */
final class QueryBehavior implements ResourceBehavior {

  @Override
  public String url(Resource resource) {
    Object projectId = resource.raw().get("project_id");
    return String.format("%s/projects/%s/issues?query_id=%s",
        resource.redmine().url(), projectId == null ? 0 : projectId, resource.internalId());
  }
}
