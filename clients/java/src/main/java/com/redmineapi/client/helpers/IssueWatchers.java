package com.redmineapi.client.helpers;

import com.google.common.collect.ImmutableMap;
import com.redmineapi.client.Redmine;
import com.redmineapi.client.resources.Resource;
import java.util.Map;
import javax.annotation.Nonnull;

/**
 * Adds users to and removes them from an issue's watcher list. Calls go straight to the server;
 * they are not attribute writes and are not part of the issue's pending changes.
 */
public class IssueWatchers {
  static final String MINIMUM_VERSION = "2.3";

  private final Redmine redmine;
  private final Object issueId;

  /**
   * @param issue The issue whose watchers to manage
   * @throws com.redmineapi.client.exceptions.UnsupportedServerVersionException if the server is
   *     older than 2.3
   */
  public IssueWatchers(@Nonnull Resource issue) {
    this.redmine = issue.redmine();
    this.issueId = issue.internalId();
    redmine.requireVersion("Issue watchers", MINIMUM_VERSION);
  }

  /** Adds a user to the watchers. */
  public Map<String, Object> add(@Nonnull Object userId) {
    String url = String.format("%s/issues/%s/watchers.json", redmine.url(), issueId);
    return redmine.request("post", url, ImmutableMap.of(), ImmutableMap.of("user_id", userId));
  }

  /** Removes a user from the watchers. */
  public Map<String, Object> remove(@Nonnull Object userId) {
    String url = String.format("%s/issues/%s/watchers/%s.json", redmine.url(), issueId, userId);
    return redmine.request("delete", url, ImmutableMap.of(), null);
  }
}
