package wfl.runtime;

import java.util.Map;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableMap;

/** A {@code model} definition: the id handed to the backend plus its extra settings. */
@AutoValue
public abstract class ModelSpec {
  public abstract String name();

  public abstract String modelId();

  /** Settings such as {@code temperature}, keyed as written. */
  public abstract ImmutableMap<String, Object> properties();

  public static ModelSpec create(String name, String modelId, Map<String, Object> properties) {
    return new AutoValue_ModelSpec(name, modelId, ImmutableMap.copyOf(properties));
  }

  public static ModelSpec create(String name, String modelId) {
    return create(name, modelId, ImmutableMap.of());
  }
}
