package com.redmineapi.client.exceptions;

import com.redmineapi.client.common.status.Status;

/** Raised when an attribute cannot be resolved and the attribute error policy asks to fail. */
public class MissingAttributeException extends RedmineException {
  private final String resourceType;
  private final String attribute;

  public MissingAttributeException(String resourceType, String attribute) {
    super(Status.notFound(
        String.format("%s doesn't have the requested attribute '%s'", resourceType, attribute)));
    this.resourceType = resourceType;
    this.attribute = attribute;
  }

  public String getResourceType() {
    return resourceType;
  }

  public String getAttribute() {
    return attribute;
  }
}
