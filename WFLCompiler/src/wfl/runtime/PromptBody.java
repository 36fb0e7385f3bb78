package wfl.runtime;

/** Renders a prompt's text against the variables of the calling context. */
@FunctionalInterface
public interface PromptBody {
  String render(WorkflowContext ctx);
}
