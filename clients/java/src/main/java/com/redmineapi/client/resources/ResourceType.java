package com.redmineapi.client.resources;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.Arrays;
import java.util.Locale;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Static description of a Redmine resource type: its endpoints, container keys, the attributes
 * that resolve through relations or includes, and the attributes that can't be written.
 *
 * <p>The readonly sets are expanded when the type is built so that every relation and include
 * name is readonly both on create and on update.
 */
public final class ResourceType {

  static final ImmutableList<ImmutableList<String>> DEFAULT_REPRESENTATION =
      ImmutableList.of(ImmutableList.of("id", "name"));
  static final ImmutableSet<String> DEFAULT_UNCONVERTIBLE = ImmutableSet.of("name", "description");
  static final ImmutableSet<String> DEFAULT_READONLY =
      ImmutableSet.of("id", "created_on", "updated_on", "author", "user", "project", "issue");

  private final String name;
  private final String minimumVersion;
  private final String containerMany;
  private final String containerOne;
  private final String queryAll;
  private final String queryOne;
  private final String queryFilter;
  private final String queryCreate;
  private final String queryUpdate;
  private final String queryDelete;
  private final String createMethod;
  private final ImmutableList<ImmutableList<String>> representation;
  private final ImmutableSet<String> includes;
  private final ImmutableSet<String> relations;
  private final String relationsName;
  private final ImmutableSet<String> unconvertible;
  private final ImmutableSet<String> createReadonly;
  private final ImmutableSet<String> updateReadonly;
  private final ResourceBehavior behavior;

  private ResourceType(Builder builder) {
    this.name = builder.name;
    this.minimumVersion = builder.minimumVersion;
    this.containerMany = builder.containerMany;
    this.containerOne = builder.containerOne;
    this.queryAll = builder.queryAll;
    this.queryOne = builder.queryOne;
    this.queryFilter = builder.queryFilter;
    this.queryCreate = builder.queryCreate;
    this.queryUpdate = builder.queryUpdate;
    this.queryDelete = builder.queryDelete;
    this.createMethod = builder.createMethod;
    this.representation = builder.representation;
    this.includes = builder.includes;
    this.relations = builder.relations;
    this.relationsName =
        builder.relationsName != null ? builder.relationsName : name.toLowerCase(Locale.ROOT);
    this.unconvertible = builder.unconvertible;
    this.createReadonly = ImmutableSet.<String>builder()
        .addAll(builder.createReadonly).addAll(relations).addAll(includes).build();
    this.updateReadonly = ImmutableSet.<String>builder()
        .addAll(builder.updateReadonly).addAll(relations).addAll(includes).build();
    this.behavior = builder.behavior;
  }

  public static Builder builder(String name) {
    return new Builder(name);
  }

  public String name() {
    return name;
  }

  /** The lowest server version that has this resource's API. */
  public String minimumVersion() {
    return minimumVersion;
  }

  @Nullable
  public String containerMany() {
    return containerMany;
  }

  @Nullable
  public String containerOne() {
    return containerOne;
  }

  @Nullable
  public String queryAll() {
    return queryAll;
  }

  @Nullable
  public String queryOne() {
    return queryOne;
  }

  @Nullable
  public String queryFilter() {
    return queryFilter;
  }

  @Nullable
  public String queryCreate() {
    return queryCreate;
  }

  @Nullable
  public String queryUpdate() {
    return queryUpdate;
  }

  @Nullable
  public String queryDelete() {
    return queryDelete;
  }

  /** The HTTP method used for creation. */
  public String createMethod() {
    return createMethod;
  }

  /** Attribute tuples tried in order when rendering a resource as text. */
  public ImmutableList<ImmutableList<String>> representation() {
    return representation;
  }

  /** Attributes obtained only by refreshing the resource with an {@code include} parameter. */
  public ImmutableSet<String> includes() {
    return includes;
  }

  /** Attributes resolved by filtering another resource type by this resource's identity. */
  public ImmutableSet<String> relations() {
    return relations;
  }

  /** The prefix of the filter key used for relations, as in {@code {relationsName}_id}. */
  public String relationsName() {
    return relationsName;
  }

  /** Attributes passed through without any type conversion. */
  public ImmutableSet<String> unconvertible() {
    return unconvertible;
  }

  public ImmutableSet<String> createReadonly() {
    return createReadonly;
  }

  public ImmutableSet<String> updateReadonly() {
    return updateReadonly;
  }

  public ResourceBehavior behavior() {
    return behavior;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("name", name)
        .add("containerOne", containerOne)
        .add("queryOne", queryOne)
        .toString();
  }

  /** Builder for {@link ResourceType}; starts from the defaults shared by all resource types. */
  public static final class Builder {
    private final String name;
    private String minimumVersion = "1.0";
    private String containerMany;
    private String containerOne;
    private String queryAll;
    private String queryOne;
    private String queryFilter;
    private String queryCreate;
    private String queryUpdate;
    private String queryDelete;
    private String createMethod = "post";
    private ImmutableList<ImmutableList<String>> representation = DEFAULT_REPRESENTATION;
    private ImmutableSet<String> includes = ImmutableSet.of();
    private ImmutableSet<String> relations = ImmutableSet.of();
    private String relationsName;
    private ImmutableSet<String> unconvertible = DEFAULT_UNCONVERTIBLE;
    private ImmutableSet<String> createReadonly = DEFAULT_READONLY;
    private ImmutableSet<String> updateReadonly = DEFAULT_READONLY;
    private ResourceBehavior behavior = ResourceBehavior.DEFAULT;

    private Builder(String name) {
      this.name = Preconditions.checkNotNull(name);
    }

    public Builder minimumVersion(@Nonnull String version) {
      this.minimumVersion = version;
      return this;
    }

    public Builder containers(@Nullable String many, @Nullable String one) {
      this.containerMany = many;
      this.containerOne = one;
      return this;
    }

    public Builder queryAll(String template) {
      this.queryAll = template;
      return this;
    }

    public Builder queryOne(String template) {
      this.queryOne = template;
      return this;
    }

    public Builder queryFilter(String template) {
      this.queryFilter = template;
      return this;
    }

    public Builder queryCreate(String template) {
      this.queryCreate = template;
      return this;
    }

    public Builder queryUpdate(String template) {
      this.queryUpdate = template;
      return this;
    }

    public Builder queryDelete(String template) {
      this.queryDelete = template;
      return this;
    }

    public Builder createMethod(String method) {
      this.createMethod = method;
      return this;
    }

    /** Each array is one attribute tuple, in order of preference. */
    public Builder representation(String[]... tuples) {
      ImmutableList.Builder<ImmutableList<String>> result = ImmutableList.builder();
      for (String[] tuple : tuples) {
        Preconditions.checkArgument(tuple.length > 0, "Representation tuples cannot be empty");
        result.add(ImmutableList.copyOf(tuple));
      }
      this.representation = result.build();
      return this;
    }

    public Builder includes(String... names) {
      this.includes = ImmutableSet.copyOf(names);
      return this;
    }

    public Builder relations(String... names) {
      this.relations = ImmutableSet.copyOf(names);
      return this;
    }

    public Builder relationsName(String relationsName) {
      this.relationsName = relationsName;
      return this;
    }

    /** Replaces the unconvertible attributes. */
    public Builder unconvertible(String... names) {
      this.unconvertible = ImmutableSet.copyOf(names);
      return this;
    }

    /** Adds to the default unconvertible attributes. */
    public Builder alsoUnconvertible(String... names) {
      this.unconvertible = union(DEFAULT_UNCONVERTIBLE, names);
      return this;
    }

    /** Adds to the default create-readonly attributes. */
    public Builder alsoCreateReadonly(String... names) {
      this.createReadonly = union(DEFAULT_READONLY, names);
      return this;
    }

    /** Adds to the default update-readonly attributes. */
    public Builder alsoUpdateReadonly(String... names) {
      this.updateReadonly = union(DEFAULT_READONLY, names);
      return this;
    }

    /** Adds to the default readonly attributes on both create and update. */
    public Builder alsoReadonly(String... names) {
      return alsoCreateReadonly(names).alsoUpdateReadonly(names);
    }

    public Builder behavior(@Nonnull ResourceBehavior behavior) {
      this.behavior = Preconditions.checkNotNull(behavior);
      return this;
    }

    public ResourceType build() {
      return new ResourceType(this);
    }

    private static ImmutableSet<String> union(ImmutableSet<String> base, String... names) {
      return ImmutableSet.<String>builder().addAll(base).addAll(Arrays.asList(names)).build();
    }
  }
}
