package wfl.runtime;

/** Receives the events of a run. Implementations must accept events from several threads. */
public interface EventSink {
  EventSink DISCARD = event -> {};

  void emit(WorkflowEvent event) throws WorkflowException;
}
