/**
 * The HTTP boundary of the client. {@link com.redmineapi.client.transport.RedmineTransport} is
 * the seam tests replace with an in-memory implementation.
 */
package com.redmineapi.client.transport;
