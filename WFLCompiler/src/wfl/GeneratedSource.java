package wfl;

import java.util.List;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/** Java source generated for one workflow unit, with its source map. */
@AutoValue
public abstract class GeneratedSource {
  public abstract String className();

  public abstract String source();

  public abstract ImmutableList<SourceMapping> mappings();

  public String qualifiedName() {
    return CodeGenerator.PACKAGE + "." + className();
  }

  public static GeneratedSource create(
      String className, String source, List<SourceMapping> mappings) {
    return new AutoValue_GeneratedSource(className, source, ImmutableList.copyOf(mappings));
  }
}
