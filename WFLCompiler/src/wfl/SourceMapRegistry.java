package wfl;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;

import wfl.runtime.StackTraceTranslator;

/**
 * Source maps of every generated workflow class, keyed by class name. Used to report failures of
 * generated code at their workflow source position.
 */
public final class SourceMapRegistry implements StackTraceTranslator {
  private static final Logger logger = LoggerFactory.getLogger(SourceMapRegistry.class);

  private static final SourceMapRegistry SHARED = new SourceMapRegistry();

  /** The process-wide registry used by default. */
  public static SourceMapRegistry shared() {
    return SHARED;
  }

  private final Map<String, ImmutableSortedMap<Integer, SourceMapping>> maps =
      new ConcurrentHashMap<>();

  public void register(String className, List<SourceMapping> mappings) {
    ImmutableSortedMap.Builder<Integer, SourceMapping> sorted = ImmutableSortedMap.naturalOrder();
    for (SourceMapping mapping : mappings) {
      sorted.put(mapping.generatedLine(), mapping);
    }
    maps.put(className, sorted.build());
    logger.debug("registered {} source mappings for {}", mappings.size(), className);
  }

  public void unregister(String className) {
    maps.remove(className);
  }

  public boolean contains(String className) {
    return maps.containsKey(className);
  }

  /** The mapping of the statement covering {@code generatedLine}: the last one at or before it. */
  public Optional<SourceMapping> lookup(String className, int generatedLine) {
    ImmutableSortedMap<Integer, SourceMapping> map = maps.get(className);
    if (map == null) return Optional.empty();
    Map.Entry<Integer, SourceMapping> entry = map.floorEntry(generatedLine);
    return entry == null ? Optional.empty() : Optional.of(entry.getValue());
  }

  /** Generated lines produced from a workflow source line, in order. */
  public ImmutableList<Integer> generatedLines(String className, String sourceFile, int line) {
    ImmutableSortedMap<Integer, SourceMapping> map = maps.get(className);
    if (map == null) return ImmutableList.of();
    return map.values()
        .stream()
        .filter(m -> m.sourceFile().equals(sourceFile) && m.sourceLine() == line)
        .map(SourceMapping::generatedLine)
        .collect(ImmutableList.toImmutableList());
  }

  /**
   * Rewrites the frames of generated classes in {@code throwable} and its causes to point at the
   * workflow source, e.g. {@code Workflow_1a2b.flow_triage(triage.wf:12)}.
   */
  @Override
  public void translate(Throwable throwable) {
    for (Throwable t = throwable; t != null; t = t.getCause()) {
      StackTraceElement[] frames = t.getStackTrace();
      boolean changed = false;
      for (int i = 0; i < frames.length; i++) {
        Optional<SourceMapping> mapping =
            lookup(frames[i].getClassName(), frames[i].getLineNumber());
        if (mapping.isPresent()) {
          frames[i] =
              new StackTraceElement(
                  frames[i].getClassName(),
                  frames[i].getMethodName(),
                  mapping.get().sourceFile(),
                  mapping.get().sourceLine());
          changed = true;
        }
      }
      if (changed) t.setStackTrace(frames);
      if (t.getCause() == t) break;
    }
  }
}
