/**
 * Exceptions raised by the client. All of them are unchecked and extend {@link
 * com.redmineapi.client.exceptions.RedmineException}.
 */
package com.redmineapi.client.exceptions;
