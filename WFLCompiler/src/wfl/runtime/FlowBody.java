package wfl.runtime;

/** A compiled flow or handler body. */
@FunctionalInterface
public interface FlowBody {
  Object run(WorkflowContext ctx) throws WorkflowException;
}
