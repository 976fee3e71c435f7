/**
 * The resource engine: typed, mutable views over Redmine's JSON payloads.
 *
 * <p>Every resource type shares one engine, {@link com.redmineapi.client.resources.Resource}. It
 * reads attributes lazily through a per-instance cache, resolving embedded resources, relation
 * filters and include refreshes on first access, and records writes as a change set that {@code
 * save()} submits. What differs between types is data ({@link
 * com.redmineapi.client.resources.ResourceType}, catalogued in {@link
 * com.redmineapi.client.resources.ResourceTypes}) plus a small {@link
 * com.redmineapi.client.resources.ResourceBehavior} for the types that rename, reshape or alias
 * attributes.
 */
package com.redmineapi.client.resources;
