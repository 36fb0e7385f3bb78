package wfl.runtime;

import java.util.List;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

/** A model response that still did not match its schema after the last attempt. */
public class SchemaValidationException extends WorkflowException {
  private static final long serialVersionUID = 1L;

  private final String schema;
  private final ImmutableList<String> errors;
  private final String rawResponse;

  public SchemaValidationException(String schema, List<String> errors, String rawResponse) {
    super(
        String.format(
            "response does not match schema '%s': %s", schema, Joiner.on("; ").join(errors)));
    this.schema = schema;
    this.errors = ImmutableList.copyOf(errors);
    this.rawResponse = rawResponse;
  }

  public String schema() {
    return schema;
  }

  public ImmutableList<String> errors() {
    return errors;
  }

  public String rawResponse() {
    return rawResponse;
  }
}
