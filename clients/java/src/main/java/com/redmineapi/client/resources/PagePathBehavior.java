package com.redmineapi.client.resources;

/** Types whose page for humans lives at a fixed path, such as {@code /trackers/{id}/edit}. */
final class PagePathBehavior implements ResourceBehavior {
  private final String prefix;
  private final String suffix;

  PagePathBehavior(String prefix, String suffix) {
    this.prefix = prefix;
    this.suffix = suffix;
  }

  @Override
  public String url(Resource resource) {
    return resource.redmine().url() + prefix + resource.internalId() + suffix;
  }
}
