package com.redmineapi.client.exceptions;

import com.redmineapi.client.common.status.Status;

/** Raised on a write to an attribute that is readonly in the resource's current lifecycle state. */
public class ReadonlyAttributeException extends RedmineException {
  private final String attribute;

  public ReadonlyAttributeException(String resourceType, String attribute, boolean isNew) {
    super(Status.failedPrecondition(String.format(
        "Attribute '%s' of %s can't be set %s",
        attribute, resourceType, isNew ? "on create" : "on update")));
    this.attribute = attribute;
  }

  public String getAttribute() {
    return attribute;
  }
}
