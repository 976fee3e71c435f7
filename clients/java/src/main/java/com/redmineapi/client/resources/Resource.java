package com.redmineapi.client.resources;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.redmineapi.client.Redmine;
import com.redmineapi.client.exceptions.InvalidCustomFieldValueException;
import com.redmineapi.client.exceptions.MissingAttributeException;
import com.redmineapi.client.exceptions.ReadonlyAttributeException;
import com.redmineapi.client.managers.ResourceManager;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * A single Redmine resource: an issue, a project, a user and so on.
 *
 * <p>A resource keeps three maps:
 *
 * <ul>
 *   <li>decoded attributes, the wire values as the server knows them (plus local writes);
 *   <li>encoded attributes, a cache of the Java values produced from the decoded ones;
 *   <li>changes, the wire values written since the last save.
 * </ul>
 *
 * <p>Reads go through the cache, then the codec, then relation filters and include refreshes.
 * Related resources are fetched on first access and cached, so callers never issue explicit
 * fetches for them. Writes are checked against the readonly attributes of the current lifecycle
 * state, decoded, and recorded as changes that {@link #save()} sends to the server.
 *
 * <p>A resource is new until it has an {@code id} or a {@code created_on} attribute. Instances
 * are not thread-safe.
 */
public class Resource implements Iterable<Map.Entry<String, Object>> {

  /** Attribute names owned by the framework rather than by the resource's data. */
  static final ImmutableSet<String> MEMBERS = ImmutableSet.of("manager");

  static final String CUSTOM_FIELDS = "custom_fields";

  private static final ImmutableSet<String> NUMERIC_DEFAULTS = ImmutableSet.of("id", "version");

  private ResourceManager manager;
  private final ResourceType type;
  private Map<String, Object> decoded;
  private final Map<String, Object> encoded = new HashMap<>();
  private Map<String, Object> changes = new LinkedHashMap<>();

  /**
   * Creates a resource from a wire payload.
   *
   * @param manager The manager of the resource's type
   * @param attributes The wire payload, empty for a resource that is yet to be created
   */
  public Resource(@Nonnull ResourceManager manager, @Nonnull Map<String, ?> attributes) {
    this.manager = Preconditions.checkNotNull(manager);
    this.type = manager.type();
    this.decoded = new LinkedHashMap<>();
    for (String name : type.relations()) {
      decoded.put(name, null);
    }
    for (String name : type.includes()) {
      decoded.put(name, null);
    }
    decoded.putAll(attributes);
  }

  public ResourceType type() {
    return type;
  }

  public ResourceManager manager() {
    return manager;
  }

  public Redmine redmine() {
    return manager.redmine();
  }

  /**
   * Returns the value of an attribute.
   *
   * <p>Embedded resources come back as {@link Resource}s, embedded lists and relations as {@link
   * ResourceSet}s, dates and timestamps as {@code LocalDate} and {@code LocalDateTime}. On a new
   * resource an unknown attribute reads as {@code 0} ({@code id}, {@code version}) or {@code ""}.
   *
   * @throws MissingAttributeException if the attribute can't be resolved on a persisted resource
   *     and the attribute error policy asks to fail; otherwise null is returned
   */
  @Nullable
  public Object get(@Nonnull String name) {
    Preconditions.checkNotNull(name);
    if (MEMBERS.contains(name)) {
      return manager;
    }
    return type.behavior().get(this, name);
  }

  /** Returns an attribute that holds an embedded resource. */
  @Nullable
  public Resource getResource(@Nonnull String name) {
    return (Resource) get(name);
  }

  /** Returns an attribute that holds a list of resources. */
  @Nullable
  public ResourceSet getResourceSet(@Nonnull String name) {
    return (ResourceSet) get(name);
  }

  /**
   * Writes an attribute.
   *
   * <p>Setting {@code custom_fields} merges the given fields into the existing ones by id. Setting
   * a convenience id such as {@code project_id} also updates the mirrored {@code project} stub,
   * so it can be read back without a round trip.
   *
   * @throws ReadonlyAttributeException if the attribute can't be written in the current state
   * @throws InvalidCustomFieldValueException if custom fields are malformed
   */
  public void set(@Nonnull String name, @Nullable Object value) {
    Preconditions.checkNotNull(name);
    if (MEMBERS.contains(name)) {
      this.manager = (ResourceManager) Preconditions.checkNotNull(value);
      return;
    }
    type.behavior().set(this, name, value);
  }

  /** The generic read path behaviors delegate to. */
  @Nullable
  Object resolve(String name, String relationsName) {
    Object cached = encoded.get(name);
    if (cached != null) {
      return cached;
    }

    String key = name;
    Object value = null;
    Object raw = decoded.get(name);
    if (raw != null) {
      Attribute attribute = codec().encode(name, raw);
      key = attribute.name();
      value = attribute.value();
    } else if (type.relations().contains(name)) {
      value = new RelationResolver(this).filter(name, relationsName);
    } else if (type.includes().contains(name)) {
      value = new RelationResolver(this).include(name);
    }

    if (value != null) {
      encoded.put(key, value);
      return value;
    }

    if (isNew()) {
      return NUMERIC_DEFAULTS.contains(name) ? 0 : "";
    }
    if (redmine().config().attributeErrorPolicy().shouldRaise(type.name())) {
      throw new MissingAttributeException(type.name(), name);
    }
    return null;
  }

  /** The generic write path behaviors delegate to. */
  void assign(String name, @Nullable Object value) {
    boolean isNew = isNew();
    Set<String> readonly = isNew ? type.createReadonly() : type.updateReadonly();
    if (readonly.contains(name)) {
      throw new ReadonlyAttributeException(type.name(), name, isNew);
    }

    if (CUSTOM_FIELDS.equals(name)) {
      mergeCustomFields(value);
    } else {
      Attribute attribute = codec().decode(name, value);
      changes.put(attribute.name(), attribute.value());
      decoded.put(name, attribute.value());

      String single = ResourceMappings.SINGLE_ID_ATTRIBUTES.get(name);
      String multiple = ResourceMappings.MULTIPLE_ID_ATTRIBUTES.get(name);
      if (single != null) {
        decoded.put(single, idStub(attribute.value()));
        encoded.remove(single);
      } else if (multiple != null) {
        decoded.put(multiple, idStubs(name, attribute.value()));
        encoded.remove(multiple);
      }
    }

    // Only the cache entry is dropped, encoding happens again on the next read.
    encoded.remove(name);
  }

  private void mergeCustomFields(@Nullable Object value) {
    if (!(value instanceof Iterable)) {
      throw new InvalidCustomFieldValueException("expected a list but got " + describe(value));
    }
    TypeCodec codec = codec();
    Map<Object, Map<String, Object>> incoming = new LinkedHashMap<>();
    for (Object field : (Iterable<?>) value) {
      if (!(field instanceof Map)) {
        throw new InvalidCustomFieldValueException("expected a mapping but got " + describe(field));
      }
      Map<?, ?> fieldMap = (Map<?, ?>) field;
      if (!fieldMap.containsKey("id")) {
        throw new InvalidCustomFieldValueException("field " + fieldMap + " has no id");
      }
      Map<String, Object> attributes = new LinkedHashMap<>();
      fieldMap.forEach((key, fieldValue) -> attributes.put(String.valueOf(key), fieldValue));
      incoming.put(normalizeId(fieldMap.get("id")), codec.bulkDecode(attributes));
    }

    List<Object> merged = new ArrayList<>();
    Object existing = decoded.get(CUSTOM_FIELDS);
    if (existing instanceof Iterable) {
      for (Object field : (Iterable<?>) existing) {
        Object id = field instanceof Map ? normalizeId(((Map<?, ?>) field).get("id")) : null;
        merged.add(id != null && incoming.containsKey(id) ? incoming.remove(id) : field);
      }
    }
    merged.addAll(incoming.values());

    decoded.put(CUSTOM_FIELDS, merged);
    changes.put(CUSTOM_FIELDS, merged);
  }

  /**
   * Ids arrive from JSON as {@code Long} but are often written as {@code Integer}; integral
   * numbers are compared by value.
   */
  @Nullable
  private static Object normalizeId(@Nullable Object id) {
    if (id instanceof Integer || id instanceof Short || id instanceof Byte) {
      return ((Number) id).longValue();
    } else if (id instanceof Double && ((Double) id) == Math.rint((Double) id)) {
      return ((Double) id).longValue();
    }
    return id;
  }

  private static Map<String, Object> idStub(@Nullable Object id) {
    Map<String, Object> stub = new LinkedHashMap<>();
    stub.put("id", id);
    return stub;
  }

  private static List<Object> idStubs(String name, @Nullable Object ids) {
    Preconditions.checkArgument(
        ids instanceof Iterable, "Attribute '%s' should be a list of ids", name);
    List<Object> stubs = new ArrayList<>();
    for (Object id : (Iterable<?>) ids) {
      stubs.add(idStub(id));
    }
    return stubs;
  }

  private static String describe(@Nullable Object value) {
    return value == null ? "null" : value.getClass().getSimpleName();
  }

  /** Creates the codec bound to this resource's type and manager. */
  TypeCodec codec() {
    return new TypeCodec(type, manager);
  }

  /** Returns the wire payload of this resource as a read-only view. */
  public Map<String, Object> raw() {
    return Collections.unmodifiableMap(decoded);
  }

  /** Returns the pending changes as a read-only view. */
  public Map<String, Object> changes() {
    return Collections.unmodifiableMap(changes);
  }

  /** Returns the names of the attributes present in the wire payload. */
  public Set<String> attributeNames() {
    return Collections.unmodifiableSet(decoded.keySet());
  }

  @Override
  public Iterator<Map.Entry<String, Object>> iterator() {
    return raw().entrySet().iterator();
  }

  /** Returns true if the resource hasn't been saved to the server yet. */
  public boolean isNew() {
    return !decoded.containsKey("id") && !decoded.containsKey("created_on");
  }

  /** Returns the identity used in URLs and relation filters. */
  @Nullable
  public Object internalId() {
    return type.behavior().internalId(this);
  }

  /** Returns the numeric view of the resource, its id for most types. */
  @Nullable
  public Object intValue() {
    return type.behavior().intValue(this);
  }

  /** Returns the URL of the resource for humans, or null if there is none. */
  @Nullable
  public String url() {
    return type.behavior().url(this);
  }

  /** Reloads this resource from the server, discarding cached values. */
  public Resource refresh() {
    return refresh(true, ImmutableMap.of());
  }

  /**
   * Fetches the resource again.
   *
   * @param itself Whether to replace this resource's data or return a new resource
   * @param params Additional parameters for the fetch, such as {@code include}
   * @return This resource when {@code itself}, otherwise the freshly fetched one
   */
  public Resource refresh(boolean itself, @Nonnull Map<String, ?> params) {
    Resource fetched =
        manager.get(internalId(), type.behavior().refreshParams(this, new LinkedHashMap<>(params)));
    if (!itself) {
      return fetched;
    }
    encoded.clear();
    decoded = new LinkedHashMap<>(fetched.raw());
    return this;
  }

  /**
   * Creates the resource if it is new, otherwise sends the pending changes as an update.
   *
   * <p>After a create the payload returned by the server replaces this resource's data. After an
   * update {@code updated_on} is stamped locally instead of re-fetching. On failure the pending
   * changes are kept so the save can be retried.
   *
   * @return true
   */
  public boolean save() {
    ResourceBehavior behavior = type.behavior();
    if (!isNew()) {
      behavior.preUpdate(this);
      manager.update(internalId(), pendingChanges());
      decoded.put(
          "updated_on",
          LocalDateTime.now(ZoneOffset.UTC).format(redmine().config().datetimeFormatter()));
      encoded.remove("updated_on");
      behavior.postUpdate(this);
    } else {
      behavior.preCreate(this);
      Resource created = manager.create(pendingChanges());
      decoded = new LinkedHashMap<>(created.raw());
      encoded.clear();
      behavior.postCreate(this);
    }
    changes = new LinkedHashMap<>();
    return true;
  }

  /** Deletes the resource on the server. The instance must not be used afterwards. */
  public Map<String, Object> delete() {
    return delete(ImmutableMap.of());
  }

  /**
   * Deletes the resource on the server.
   *
   * @param params Additional parameters for the delete request
   * @return The server's acknowledgement
   */
  public Map<String, Object> delete(@Nonnull Map<String, ?> params) {
    ResourceBehavior behavior = type.behavior();
    behavior.preDelete(this);
    Map<String, Object> response =
        manager.delete(internalId(), behavior.deleteParams(this, new LinkedHashMap<>(params)));
    behavior.postDelete(this);
    return response;
  }

  private Map<String, Object> pendingChanges() {
    return Collections.unmodifiableMap(new LinkedHashMap<>(changes));
  }

  /** Returns true if the attribute has a cached Java value. */
  boolean isCached(String name) {
    return encoded.containsKey(name);
  }

  /** Writes a wire value without change tracking, dropping its cached Java value. */
  void putDecoded(String name, @Nullable Object value) {
    decoded.put(name, value);
    encoded.remove(name);
  }

  /** Writes a wire value and its Java value without change tracking. */
  void putDecodedAndEncoded(String name, Object value) {
    decoded.put(name, value);
    encoded.put(name, value);
  }

  /** Returns the short text of this resource, for display. */
  public String displayText() {
    return Representation.of(this).display();
  }

  /**
   * Returns a structured text of this resource, such as {@code <Issue #12 "Fix bug">}.
   */
  @Override
  public String toString() {
    return Representation.of(this).structured();
  }
}
