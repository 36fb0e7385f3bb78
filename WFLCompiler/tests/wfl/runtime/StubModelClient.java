package wfl.runtime;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Function;

import com.google.common.collect.ImmutableList;

/**
 * A model client for tests. Replies with scripted responses in order, then with a fallback
 * computed from the request; records every request it receives.
 */
public class StubModelClient implements ModelClient {
  private final Deque<String> replies = new ArrayDeque<>();
  private final List<ModelRequest> requests = new ArrayList<>();
  private Function<ModelRequest, String> fallback = request -> "ok";

  public StubModelClient reply(String... texts) {
    synchronized (this) {
      for (String text : texts) {
        replies.add(text);
      }
    }
    return this;
  }

  public synchronized StubModelClient otherwise(Function<ModelRequest, String> fallback) {
    this.fallback = fallback;
    return this;
  }

  /** Replies with the last message of each request. */
  public StubModelClient echo() {
    return otherwise(request -> lastMessage(request).content());
  }

  public static Message lastMessage(ModelRequest request) {
    return request.messages().get(request.messages().size() - 1);
  }

  @Override
  public String complete(ModelRequest request, EventSink sink) throws WorkflowException {
    String reply;
    synchronized (this) {
      requests.add(request);
      reply = replies.isEmpty() ? fallback.apply(request) : replies.poll();
    }
    if (reply == null) throw new ModelInvocationException("model unavailable");
    return reply;
  }

  public synchronized ImmutableList<ModelRequest> requests() {
    return ImmutableList.copyOf(requests);
  }

  public synchronized ModelRequest lastRequest() {
    return requests.get(requests.size() - 1);
  }
}
