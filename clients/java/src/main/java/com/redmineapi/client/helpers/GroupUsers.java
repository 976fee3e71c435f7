package com.redmineapi.client.helpers;

import com.google.common.collect.ImmutableMap;
import com.redmineapi.client.Redmine;
import com.redmineapi.client.resources.Resource;
import java.util.Map;
import javax.annotation.Nonnull;

/** Adds users to and removes them from a group, directly on the server. */
public class GroupUsers {
  private final Redmine redmine;
  private final Object groupId;

  public GroupUsers(@Nonnull Resource group) {
    this.redmine = group.redmine();
    this.groupId = group.internalId();
  }

  public Map<String, Object> add(@Nonnull Object userId) {
    String url = String.format("%s/groups/%s/users.json", redmine.url(), groupId);
    return redmine.request("post", url, ImmutableMap.of(), ImmutableMap.of("user_id", userId));
  }

  public Map<String, Object> remove(@Nonnull Object userId) {
    String url = String.format("%s/groups/%s/users/%s.json", redmine.url(), groupId, userId);
    return redmine.request("delete", url, ImmutableMap.of(), null);
  }
}
