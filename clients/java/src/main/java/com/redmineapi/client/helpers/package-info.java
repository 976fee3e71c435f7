/**
 * Helper objects bound to a single resource that change relationships on the server directly,
 * outside of the resource's pending changes and {@code save()}.
 */
package com.redmineapi.client.helpers;
