package wfl.runtime;

/** Rewrites stack frames of generated workflow code to workflow source positions. */
@FunctionalInterface
public interface StackTraceTranslator {
  StackTraceTranslator NONE = t -> {};

  void translate(Throwable throwable);
}
