package com.redmineapi.client.resources;

import javax.annotation.Nullable;

/**
 * An attribute name paired with a value. Returned by the codec because a conversion may also
 * rename the attribute.
 *
 * @param name The attribute name
 * @param value The converted value
 */
public record Attribute(String name, @Nullable Object value) {}
