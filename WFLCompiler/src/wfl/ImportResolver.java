package wfl;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.io.Files;

/**
 * Expands {@code import} declarations by parsing the imported files and appending their
 * definitions to the importing unit. Paths are relative to the importing file; every file is
 * included once even when imported along several paths.
 */
public class ImportResolver {
  private static final Logger logger = LoggerFactory.getLogger(ImportResolver.class);

  /** Reads imported files; absent when the file does not exist. */
  public interface SourceLoader {
    Optional<String> load(Path path) throws IOException;
  }

  public static final SourceLoader FILE_SYSTEM =
      path -> {
        File file = path.toFile();
        if (!file.isFile()) return Optional.empty();
        return Optional.of(Files.asCharSource(file, StandardCharsets.UTF_8).read());
      };

  private final SourceLoader loader;
  private final List<Diagnostic> diagnostics = new ArrayList<>();
  private final Deque<Path> importing = new ArrayDeque<>();
  private final Set<Path> included = new HashSet<>();

  public ImportResolver(SourceLoader loader) {
    this.loader = loader;
  }

  public ImmutableList<Diagnostic> diagnostics() {
    return ImmutableList.copyOf(diagnostics);
  }

  /**
   * The unit with all transitively imported definitions appended. Missing and circular imports are
   * recorded as diagnostics; a syntax error in an imported file is thrown.
   */
  public AST resolve(AST root) throws CompilerException {
    Path rootPath = normalize(Paths.get(root.file()));
    importing.push(rootPath);
    included.add(rootPath);
    List<AST.Declaration> extra = new ArrayList<>();
    expand(root, rootPath, extra);
    importing.pop();
    return extra.isEmpty() ? root : root.withDeclarations(extra);
  }

  private void expand(AST ast, Path path, List<AST.Declaration> out) throws CompilerException {
    Path dir = path.getParent();
    for (AST.ImportDef def : ast.<AST.ImportDef>declarations(AST.Declaration.Type.IMPORT)) {
      Path target = normalize(dir == null ? Paths.get(def.path()) : dir.resolve(def.path()));
      if (importing.contains(target)) {
        List<String> chain = new ArrayList<>();
        importing
            .descendingIterator()
            .forEachRemaining(p -> chain.add(p.getFileName().toString()));
        chain.add(target.getFileName().toString());
        diagnostics.add(
            Diagnostic.at(
                ErrorCode.E0006,
                def.pos(),
                "circular import: " + Joiner.on(" -> ").join(chain)));
        continue;
      }
      if (!included.add(target)) continue;

      Optional<String> content;
      try {
        content = loader.load(target);
      } catch (IOException ex) {
        throw new CompilerException(
            def.pos(),
            ErrorCode.E0005,
            "cannot read import '" + def.path() + "': " + ex.getMessage());
      }
      if (!content.isPresent()) {
        diagnostics.add(
            Diagnostic.at(
                ErrorCode.E0005,
                def.pos(),
                String.format("import file not found: '%s'", def.path()),
                "imports are resolved relative to the importing file: " + target));
        continue;
      }

      logger.debug("importing {}", target);
      String source = content.get().endsWith("\n") ? content.get() : content.get() + "\n";
      AST imported =
          Transformer.transform(target.toString(), EarleyParser.parse(target.toString(), source));
      for (AST.Declaration declaration : imported.declarations()) {
        if (declaration.type() != AST.Declaration.Type.VERSION
            && declaration.type() != AST.Declaration.Type.IMPORT) {
          out.add(declaration);
        }
      }
      importing.push(target);
      expand(imported, target, out);
      importing.pop();
    }
  }

  private static Path normalize(Path path) {
    return path.toAbsolutePath().normalize();
  }
}
