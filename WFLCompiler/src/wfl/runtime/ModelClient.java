package wfl.runtime;

/**
 * The model backend. Implementations may report partial output through the sink as {@link
 * WorkflowEvent.ModelOutputEvent}s; the returned string is the complete response text.
 */
public interface ModelClient {
  String complete(ModelRequest request, EventSink sink) throws WorkflowException;
}
