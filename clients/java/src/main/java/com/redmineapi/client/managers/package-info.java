/**
 * Managers perform the network operations for a resource type. {@link
 * com.redmineapi.client.managers.ResourceManager} is the collaborator the resource engine drives;
 * {@link com.redmineapi.client.managers.DefaultResourceManager} implements it over HTTP.
 */
package com.redmineapi.client.managers;
