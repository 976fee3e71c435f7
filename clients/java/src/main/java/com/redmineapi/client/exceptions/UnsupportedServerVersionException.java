package com.redmineapi.client.exceptions;

import com.redmineapi.client.common.status.Status;

/** Raised when a feature needs a newer Redmine than the one the client is configured for. */
public class UnsupportedServerVersionException extends RedmineException {

  public UnsupportedServerVersionException(String feature, String required, String actual) {
    super(Status.unimplemented(String.format(
        "%s requires Redmine %s or higher, server version is %s", feature, required, actual)));
  }
}
