package wfl.runtime;

/** A property path step that names no existing key. */
public class MissingKeyException extends WorkflowException {
  private static final long serialVersionUID = 1L;

  private final String key;

  public MissingKeyException(String path, String key) {
    super(String.format("'%s' has no key '%s'", path, key));
    this.key = key;
  }

  public String key() {
    return key;
  }
}
