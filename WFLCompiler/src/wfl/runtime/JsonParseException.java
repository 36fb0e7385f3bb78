package wfl.runtime;

/** A model response that holds no single parseable JSON value. */
public class JsonParseException extends WorkflowException {
  private static final long serialVersionUID = 1L;

  private final String rawResponse;

  public JsonParseException(String message, String rawResponse) {
    super(message);
    this.rawResponse = rawResponse;
  }

  public JsonParseException(String message, String rawResponse, Throwable cause) {
    super(message, cause);
    this.rawResponse = rawResponse;
  }

  public String rawResponse() {
    return rawResponse;
  }
}
