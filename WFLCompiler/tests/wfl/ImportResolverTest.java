package wfl;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.Test;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

public class ImportResolverTest {

  private final Map<Path, String> files = new HashMap<>();
  private final ImportResolver.SourceLoader loader =
      path -> Optional.ofNullable(files.get(path.toAbsolutePath().normalize()));

  private void file(String path, String... lines) {
    files.put(Paths.get(path).toAbsolutePath().normalize(), Joiner.on('\n').join(lines) + "\n");
  }

  private AST resolve(ImportResolver resolver, String path) throws CompilerException {
    String source = files.get(Paths.get(path).toAbsolutePath().normalize());
    return resolver.resolve(Transformer.transform(path, EarleyParser.parse(path, source)));
  }

  private static ImmutableList<String> names(AST ast) {
    return ast.declarations()
        .stream()
        .filter(d -> d instanceof AST.NamedDeclaration)
        .map(d -> ((AST.NamedDeclaration) d).name())
        .collect(ImmutableList.toImmutableList());
  }

  @Test
  public void importsAreAppended() throws CompilerException {
    file("/proj/main.wf", "import ./lib/models.wf", "prompt p: \"hi\"");
    file("/proj/lib/models.wf", "version 1", "model main = openai/gpt-4o");

    ImportResolver resolver = new ImportResolver(loader);
    AST ast = resolve(resolver, "/proj/main.wf");

    assertThat(resolver.diagnostics()).isEmpty();
    assertThat(names(ast)).containsExactly("p", "main").inOrder();
    assertThat(ast.version()).isEmpty();
  }

  @Test
  public void nestedImportsResolveRelativeToTheImportingFile() throws CompilerException {
    file("/proj/main.wf", "import \"lib/agents.wf\"");
    file("/proj/lib/agents.wf", "import ./prompts.wf", "schema S:", "    n: int");
    file("/proj/lib/prompts.wf", "prompt greet: \"hello\"");

    ImportResolver resolver = new ImportResolver(loader);
    AST ast = resolve(resolver, "/proj/main.wf");

    assertThat(resolver.diagnostics()).isEmpty();
    assertThat(names(ast)).containsExactly("S", "greet").inOrder();
    assertThat(ast.declarations(AST.Declaration.Type.PROMPT).get(0).pos().file())
        .endsWith("prompts.wf");
  }

  @Test
  public void diamondImportsAreIncludedOnce() throws CompilerException {
    file("/proj/main.wf", "import ./a.wf", "import ./b.wf");
    file("/proj/a.wf", "import ./common.wf");
    file("/proj/b.wf", "import ./common.wf");
    file("/proj/common.wf", "model main = openai/gpt-4o");

    ImportResolver resolver = new ImportResolver(loader);
    AST ast = resolve(resolver, "/proj/main.wf");

    assertThat(resolver.diagnostics()).isEmpty();
    assertThat(names(ast)).containsExactly("main");
  }

  @Test
  public void missingImport() throws CompilerException {
    file("/proj/main.wf", "import ./nowhere.wf");

    ImportResolver resolver = new ImportResolver(loader);
    resolve(resolver, "/proj/main.wf");

    assertThat(resolver.diagnostics()).hasSize(1);
    Diagnostic d = resolver.diagnostics().get(0);
    assertThat(d.code()).isEqualTo(ErrorCode.E0005);
    assertThat(d.message()).isEqualTo("import file not found: './nowhere.wf'");
    assertThat(d.help().get()).endsWith("nowhere.wf");
  }

  @Test
  public void circularImport() throws CompilerException {
    file("/proj/main.wf", "import ./a.wf");
    file("/proj/a.wf", "import ./b.wf");
    file("/proj/b.wf", "import ./main.wf");

    ImportResolver resolver = new ImportResolver(loader);
    resolve(resolver, "/proj/main.wf");

    assertThat(resolver.diagnostics()).hasSize(1);
    Diagnostic d = resolver.diagnostics().get(0);
    assertThat(d.code()).isEqualTo(ErrorCode.E0006);
    assertThat(d.message()).isEqualTo("circular import: main.wf -> a.wf -> b.wf -> main.wf");
    assertThat(d.file()).endsWith("b.wf");
  }

  @Test
  public void syntaxErrorInImportedFile() {
    file("/proj/main.wf", "import ./broken.wf");
    file("/proj/broken.wf", "model = x");

    CompilerException ex =
        assertThrows(
            CompilerException.class, () -> resolve(new ImportResolver(loader), "/proj/main.wf"));
    assertThat(ex.code()).isEqualTo(ErrorCode.E0007);
    assertThat(ex.pos().file()).endsWith("broken.wf");
  }

  @Test
  public void unreadableImport() {
    file("/proj/main.wf", "import ./locked.wf");
    ImportResolver.SourceLoader failing =
        path -> {
          throw new IOException("permission denied");
        };

    CompilerException ex =
        assertThrows(
            CompilerException.class, () -> resolve(new ImportResolver(failing), "/proj/main.wf"));
    assertThat(ex.code()).isEqualTo(ErrorCode.E0005);
    assertThat(ex).hasMessageThat().contains("permission denied");
  }

  @Test
  public void importedDefinitionsAreVisibleToTheAnalyzer() {
    file("/proj/lib.wf", "prompt greet: \"hello\"", "agent greeter:", "    instruction greet");
    Compiler compiler = new Compiler(new SourceMapRegistry(), loader);

    ImmutableList<Diagnostic> diagnostics =
        compiler.validate(
            "import ./lib.wf\nflow main $x:\n    $r = run agent greeter $x\n    return $r\n",
            "/proj/main.wf");

    assertThat(diagnostics).isEmpty();
  }

  @Test
  public void importDiagnosticsAreReportedByValidate() {
    Compiler compiler = new Compiler(new SourceMapRegistry(), loader);

    ImmutableList<Diagnostic> diagnostics =
        compiler.validate("import ./gone.wf\n", "/proj/main.wf");

    assertThat(diagnostics).hasSize(1);
    assertThat(diagnostics.get(0).code()).isEqualTo(ErrorCode.E0005);
    assertThat(diagnostics.get(0).line()).isEqualTo(1);
  }
}
