package wfl.runtime;

import java.util.Iterator;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ThreadFactory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.AbstractIterator;
import com.google.common.util.concurrent.SettableFuture;

/**
 * The events of a run, observable while it is still going. The run executes on its own thread and
 * blocks when the consumer falls more than the channel capacity behind.
 *
 * <pre>{@code
 * try (EventStream events = workflow.run("triage", input)) {
 *   for (WorkflowEvent event : events) { ... }
 *   Object result = events.result();
 * }
 * }</pre>
 */
public final class EventStream implements Iterable<WorkflowEvent>, AutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(EventStream.class);

  /** The body of a run, reporting to the stream's sink. */
  @FunctionalInterface
  interface Producer {
    Object run(EventSink sink) throws WorkflowException;
  }

  // An empty element marks the end of the run.
  private final BlockingQueue<Optional<WorkflowEvent>> channel;
  private final SettableFuture<Object> result = SettableFuture.create();
  private final Thread worker;
  private volatile boolean closed = false;

  EventStream(int capacity, ThreadFactory threads, Producer producer) {
    this.channel = new ArrayBlockingQueue<>(capacity);
    this.worker = threads.newThread(() -> produce(producer));
  }

  void start() {
    worker.start();
  }

  private void produce(Producer producer) {
    try {
      result.set(producer.run(this::publish));
    } catch (WorkflowException | RuntimeException ex) {
      result.setException(ex);
    } catch (Throwable t) {
      logger.error("run died", t);
      result.setException(t);
    } finally {
      endOfRun();
    }
  }

  private void endOfRun() {
    try {
      channel.put(Optional.empty());
    } catch (InterruptedException ex) {
      // Closed while the consumer was not reading; nobody waits for the end marker.
      Thread.currentThread().interrupt();
    }
  }

  private void publish(WorkflowEvent event) throws WorkflowException {
    if (closed) throw new AbortException("run cancelled");
    try {
      channel.put(Optional.of(event));
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new AbortException("run cancelled");
    }
  }

  @Override
  public Iterator<WorkflowEvent> iterator() {
    return new AbstractIterator<WorkflowEvent>() {
      @Override
      protected WorkflowEvent computeNext() {
        if (closed) return endOfData();
        try {
          Optional<WorkflowEvent> next = channel.take();
          return next.isPresent() ? next.get() : endOfData();
        } catch (InterruptedException ex) {
          Thread.currentThread().interrupt();
          return endOfData();
        }
      }
    };
  }

  /** Waits for the run to finish: the flow's return value, or the failure that ended it. */
  public Object result() throws WorkflowException {
    try {
      return result.get();
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new AbortException("interrupted while waiting for the run");
    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause();
      if (cause instanceof WorkflowException) throw (WorkflowException) cause;
      if (cause instanceof RuntimeException) throw (RuntimeException) cause;
      throw new WorkflowException("run failed", cause);
    }
  }

  public boolean isDone() {
    return result.isDone();
  }

  /** Cancels the run if it is still going. */
  @Override
  public void close() {
    if (closed) return;
    closed = true;
    if (!result.isDone()) {
      logger.info("cancelling run");
      worker.interrupt();
    }
    channel.clear();
  }
}
