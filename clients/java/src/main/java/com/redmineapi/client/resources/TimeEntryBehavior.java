package com.redmineapi.client.resources;

/** Time entry filters are named {@code from}/{@code to} on the wire. */
final class TimeEntryBehavior implements ResourceBehavior {

  @Override
  public Attribute decode(TypeCodec codec, String name, Object value) {
    if ("from_date".equals(name)) {
      return codec.decodeValue("from", value);
    } else if ("to_date".equals(name)) {
      return codec.decodeValue("to", value);
    }
    return codec.decodeValue(name, value);
  }
}
