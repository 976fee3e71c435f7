package com.redmineapi.client.exceptions;

import com.redmineapi.client.common.status.Status;
import javax.annotation.Nonnull;

/**
 * Base class of every failure raised by this library. The attached {@link Status} tells whether
 * the failure came from the server (its code mirrors the HTTP response) or was detected locally.
 */
public class RedmineException extends RuntimeException {
  private final Status status;

  public RedmineException(@Nonnull Status status) {
    super(status.toString(), status.getCause());
    this.status = status;
  }

  /** Returns the status describing this failure. */
  @Nonnull
  public Status getStatus() {
    return status;
  }
}
