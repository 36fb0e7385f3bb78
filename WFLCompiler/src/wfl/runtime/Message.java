package wfl.runtime;

import com.google.auto.value.AutoValue;

/** One conversation message sent to a model. */
@AutoValue
public abstract class Message {
  public static final String SYSTEM = "system";
  public static final String USER = "user";
  public static final String ASSISTANT = "assistant";

  public abstract String role();

  public abstract String content();

  public static Message create(String role, String content) {
    return new AutoValue_Message(role, content);
  }

  public static Message user(String content) {
    return create(USER, content);
  }

  public static Message assistant(String content) {
    return create(ASSISTANT, content);
  }

  public static Message system(String content) {
    return create(SYSTEM, content);
  }
}
