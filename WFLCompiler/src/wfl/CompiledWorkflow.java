package wfl;

import java.lang.reflect.InvocationTargetException;

import com.google.common.collect.ImmutableList;

import wfl.runtime.DslWorkflow;
import wfl.runtime.ModelClient;
import wfl.runtime.RuntimeConfig;

/**
 * A compiled workflow unit: the loaded workflow class and the source it was generated from.
 * Instances are immutable and may be shared; {@link #newInstance} creates a runnable workflow.
 */
public final class CompiledWorkflow {
  private final String name;
  private final GeneratedSource source;
  private final Class<? extends DslWorkflow> workflowClass;
  private final SourceMapRegistry sourceMaps;

  CompiledWorkflow(
      String name,
      GeneratedSource source,
      Class<? extends DslWorkflow> workflowClass,
      SourceMapRegistry sourceMaps) {
    this.name = name;
    this.source = source;
    this.workflowClass = workflowClass;
    this.sourceMaps = sourceMaps;
  }

  /** The file name the unit was compiled as. */
  public String name() {
    return name;
  }

  public String className() {
    return source.qualifiedName();
  }

  public String generatedSource() {
    return source.source();
  }

  public ImmutableList<SourceMapping> sourceMap() {
    return source.mappings();
  }

  public Class<? extends DslWorkflow> workflowClass() {
    return workflowClass;
  }

  public DslWorkflow newInstance(ModelClient modelClient) {
    return newInstance(modelClient, RuntimeConfig.defaults());
  }

  public DslWorkflow newInstance(ModelClient modelClient, RuntimeConfig config) {
    DslWorkflow workflow;
    try {
      workflow = workflowClass.getDeclaredConstructor().newInstance();
    } catch (InvocationTargetException ex) {
      sourceMaps.translate(ex.getCause());
      throw new IllegalStateException(
          "failed to initialize workflow " + name + ": " + ex.getCause(), ex.getCause());
    } catch (ReflectiveOperationException ex) {
      throw new IllegalStateException("cannot instantiate " + className(), ex);
    }
    return workflow
        .setModelClient(modelClient)
        .setConfig(config)
        .setStackTraceTranslator(sourceMaps);
  }

  @Override
  public String toString() {
    return name + " (" + className() + ")";
  }
}
