/**
 * Status types used for error reporting across the client.
 *
 * <ul>
 *   <li>{@link com.redmineapi.client.common.status.StatusCode} - Enum of possible status codes, aligned with HTTP status codes</li>
 *   <li>{@link com.redmineapi.client.common.status.Status} - A status with an optional message and cause</li>
 *   <li>{@link com.redmineapi.client.common.status.StatusOr} - Container that holds either a successful value or an error status</li>
 * </ul>
 *
 * <p>Every {@link com.redmineapi.client.exceptions.RedmineException} carries a {@code Status}, so
 * callers can branch on {@code getStatus().getCode()} whether the failure was raised by the
 * resource engine (a readonly attribute, a missing attribute) or reported by the server.
 */
package com.redmineapi.client.common.status;
