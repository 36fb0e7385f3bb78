package wfl;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.ExecutionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Throwables;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.cache.RemovalListener;
import com.google.common.hash.HashCode;
import com.google.common.hash.Hashing;
import com.google.common.util.concurrent.UncheckedExecutionException;

/**
 * Compiled units keyed by the SHA-256 of their normalized source text, so that compiling the same
 * text again returns the same {@link CompiledWorkflow}. Lookups run concurrently; concurrent
 * compilations of one source wait for a single load.
 */
public final class CompilationCache {
  private static final Logger logger = LoggerFactory.getLogger(CompilationCache.class);

  public static final int DEFAULT_MAXIMUM_SIZE = 100;

  private final Compiler compiler;
  private final Cache<HashCode, CompiledWorkflow> cache;

  public CompilationCache(Compiler compiler) {
    this(compiler, DEFAULT_MAXIMUM_SIZE);
  }

  public CompilationCache(Compiler compiler, int maximumSize) {
    this.compiler = compiler;
    RemovalListener<HashCode, CompiledWorkflow> onRemoval =
        removal -> {
          logger.debug("evicted {} ({})", removal.getValue(), removal.getCause());
          compiler.sourceMaps().unregister(removal.getValue().className());
        };
    this.cache =
        CacheBuilder.newBuilder().maximumSize(maximumSize).removalListener(onRemoval).build();
  }

  static HashCode key(String source) {
    return Hashing.sha256().hashString(Compiler.normalize(source), StandardCharsets.UTF_8);
  }

  /** The cached unit for {@code source}, compiling it as {@code name} on a miss. */
  public CompiledWorkflow compile(String source, String name) throws DslCompileException {
    HashCode key = key(source);
    CompiledWorkflow cached = cache.getIfPresent(key);
    if (cached != null) {
      logger.debug("{}: cache hit {}", name, key);
      return cached;
    }
    try {
      return cache.get(
          key,
          () -> {
            logger.debug("{}: cache miss {}", name, key);
            return compiler.compile(source, name);
          });
    } catch (ExecutionException ex) {
      Throwables.throwIfInstanceOf(ex.getCause(), DslCompileException.class);
      throw new IllegalStateException(ex.getCause());
    } catch (UncheckedExecutionException ex) {
      Throwables.throwIfUnchecked(ex.getCause());
      throw ex;
    }
  }

  public void invalidate(String source) {
    cache.invalidate(key(source));
  }

  public void clear() {
    cache.invalidateAll();
  }

  public long size() {
    return cache.size();
  }
}
