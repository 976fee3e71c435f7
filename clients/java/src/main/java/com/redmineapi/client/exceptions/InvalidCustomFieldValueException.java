package com.redmineapi.client.exceptions;

import com.redmineapi.client.common.status.Status;

/**
 * Raised when custom fields are assigned something other than a sequence of mappings that each
 * carry an {@code id}.
 */
public class InvalidCustomFieldValueException extends RedmineException {

  public InvalidCustomFieldValueException(String detail) {
    super(Status.invalidArgument(
        "Custom fields should be a list of mappings with an 'id' key: " + detail));
  }
}
