package com.redmineapi.client.exceptions;

import com.redmineapi.client.common.status.Status;

/** Raised when a resource type has no endpoint for the requested operation. */
public class UnsupportedResourceOperationException extends RedmineException {

  public UnsupportedResourceOperationException(String resourceType, String operation) {
    super(Status.unimplemented(
        String.format("%s doesn't support the '%s' operation", resourceType, operation)));
  }
}
