package wfl.runtime;

import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableMap;

/** A {@code tool} definition. The runtime only describes tools; the backend provides them. */
@AutoValue
public abstract class ToolSpec {
  public abstract String name();

  /** {@code mcp}, {@code builtin}, or the {@code type} of a configured tool. */
  public abstract String kind();

  /** MCP url or builtin module name. */
  public abstract Optional<String> location();

  public abstract Optional<String> authScheme();

  public abstract Optional<String> authValue();

  public abstract ImmutableMap<String, Object> properties();

  public static Builder builder(String name, String kind) {
    return new AutoValue_ToolSpec.Builder().setName(name).setKind(kind);
  }

  @AutoValue.Builder
  public abstract static class Builder {
    abstract Builder setName(String name);

    abstract Builder setKind(String kind);

    public abstract Builder setLocation(String location);

    public abstract Builder setAuthScheme(String authScheme);

    public abstract Builder setAuthValue(String authValue);

    abstract ImmutableMap.Builder<String, Object> propertiesBuilder();

    public Builder putProperty(String key, Object value) {
      propertiesBuilder().put(key, value);
      return this;
    }

    public abstract ToolSpec build();
  }
}
