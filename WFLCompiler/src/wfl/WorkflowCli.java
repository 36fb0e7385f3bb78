package wfl;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Streams;
import com.google.common.io.Files;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

/** Command line entry point: {@code check} and {@code dump-generated-code}. */
@Command(
    name = "wfl",
    mixinStandardHelpOptions = true,
    version = "wfl 1.0.0",
    description = "Workflow language compiler.",
    subcommands = {WorkflowCli.Check.class, WorkflowCli.DumpGeneratedCode.class})
public class WorkflowCli implements Runnable {
  public static final int EXIT_OK = 0;
  public static final int EXIT_INVALID = 1;
  public static final int EXIT_FILE_ERROR = 2;

  static final String EXTENSION = ".wf";

  @Spec CommandSpec spec;

  @Override
  public void run() {
    spec.commandLine().usage(spec.commandLine().getErr());
  }

  /** The command line with its parsing settings; {@code --format json} is case-insensitive. */
  public static CommandLine commandLine() {
    return new CommandLine(new WorkflowCli()).setCaseInsensitiveEnumValuesAllowed(true);
  }

  public static void main(String[] args) {
    System.exit(commandLine().execute(args));
  }

  enum Format {
    TEXT,
    JSON;
  }

  @Command(name = "check", description = "Validate workflow files without generating code.")
  static final class Check implements Callable<Integer> {
    @Spec CommandSpec spec;

    @Option(
        names = {"-v", "--verbose"},
        description = "Print definition counts for every file.")
    boolean verbose;

    @Option(
        names = "--format",
        defaultValue = "TEXT",
        description = "Output format: text or json.")
    Format format;

    @Option(names = "--strict", description = "Treat warnings as errors.")
    boolean strict;

    @Parameters(paramLabel = "PATH", description = "A workflow file, or a directory to search.")
    File path;

    @Override
    public Integer call() {
      PrintWriter out = spec.commandLine().getOut();
      PrintWriter err = spec.commandLine().getErr();
      if (!path.exists()) {
        err.println("error: no such file or directory: " + path);
        return EXIT_FILE_ERROR;
      }
      List<File> files = workflowFiles(path);
      if (files.isEmpty()) {
        err.println("error: no " + EXTENSION + " files in " + path);
        return EXIT_FILE_ERROR;
      }

      Compiler compiler = new Compiler();
      boolean invalid = false;
      boolean fileError = false;
      for (File file : files) {
        String source;
        try {
          source = read(file);
        } catch (IOException ex) {
          err.println("error: cannot read " + file + ": " + ex.getMessage());
          fileError = true;
          continue;
        }
        String name = file.getPath();
        ImmutableList<Diagnostic> diagnostics = compiler.validate(source, name);
        Optional<FileStats> stats = stats(compiler, source, name);
        boolean errors = diagnostics.stream().anyMatch(Diagnostic::isError);
        if (errors || (strict && !diagnostics.isEmpty())) invalid = true;

        DiagnosticRenderer renderer = new DiagnosticRenderer().addSource(name, source);
        if (format == Format.JSON) {
          out.println(renderer.toJson(diagnostics, name, stats));
          continue;
        }
        out.print(renderer.renderAll(diagnostics));
        if (!errors) {
          out.println(name + ": " + stats.map(FileStats::summary).orElse("valid"));
        }
        if (verbose && stats.isPresent()) {
          out.printf(
              "  models: %d, agents: %d, flows: %d, handlers: %d%n",
              stats.get().models(),
              stats.get().agents(),
              stats.get().flows(),
              stats.get().handlers());
        }
      }
      out.flush();
      if (fileError) return EXIT_FILE_ERROR;
      return invalid ? EXIT_INVALID : EXIT_OK;
    }

    private static Optional<FileStats> stats(Compiler compiler, String source, String name) {
      try {
        return Optional.of(compiler.fileStats(source, name));
      } catch (DslSyntaxException ex) {
        // Already reported by validate.
        return Optional.empty();
      }
    }
  }

  @Command(
      name = "dump-generated-code",
      description = "Print the Java source generated for a workflow file.")
  static final class DumpGeneratedCode implements Callable<Integer> {
    @Spec CommandSpec spec;

    @Option(
        names = {"-o", "--output"},
        paramLabel = "FILE",
        description = "Write to FILE instead of standard output.")
    File output;

    @Option(names = "--no-comments", description = "Leave out the '// file:line' comments.")
    boolean noComments;

    @Parameters(paramLabel = "FILE", description = "The workflow file.")
    File file;

    @Override
    public Integer call() {
      PrintWriter out = spec.commandLine().getOut();
      PrintWriter err = spec.commandLine().getErr();
      String source;
      try {
        source = read(file);
      } catch (IOException ex) {
        err.println("error: cannot read " + file + ": " + ex.getMessage());
        return EXIT_FILE_ERROR;
      }

      String name = file.getPath();
      GeneratedSource generated;
      try {
        generated = new Compiler().generateSource(source, name, !noComments);
      } catch (DslCompileException ex) {
        err.print(new DiagnosticRenderer().addSource(name, source).renderAll(ex.diagnostics()));
        err.flush();
        return EXIT_FILE_ERROR;
      }

      if (output == null) {
        out.print(generated.source());
        out.flush();
        return EXIT_OK;
      }
      try {
        Files.asCharSink(output, StandardCharsets.UTF_8).write(generated.source());
      } catch (IOException ex) {
        err.println("error: cannot write " + output + ": " + ex.getMessage());
        return EXIT_FILE_ERROR;
      }
      out.println("wrote " + generated.qualifiedName() + " to " + output);
      out.flush();
      return EXIT_OK;
    }
  }

  static List<File> workflowFiles(File path) {
    if (path.isFile()) return ImmutableList.of(path);
    return Streams.stream(Files.fileTraverser().depthFirstPreOrder(path))
        .filter(f -> f.isFile() && f.getName().endsWith(EXTENSION))
        .sorted()
        .collect(ImmutableList.toImmutableList());
  }

  private static String read(File file) throws IOException {
    return Files.asCharSource(file, StandardCharsets.UTF_8).read();
  }
}
