package wfl;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.OutputStream;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;
import java.security.CodeSource;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import javax.tools.DiagnosticCollector;
import javax.tools.FileObject;
import javax.tools.ForwardingJavaFileManager;
import javax.tools.JavaCompiler;
import javax.tools.JavaFileManager;
import javax.tools.JavaFileObject;
import javax.tools.SimpleJavaFileObject;
import javax.tools.StandardJavaFileManager;
import javax.tools.ToolProvider;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;

import wfl.runtime.DslWorkflow;

/**
 * Compiles generated workflow classes with the platform Java compiler, entirely in memory. Each
 * unit is defined by its own class loader, so units are unloaded with their workflows.
 */
final class InMemoryJavac {
  private static final Logger logger = LoggerFactory.getLogger(InMemoryJavac.class);

  private static final class SourceFile extends SimpleJavaFileObject {
    private final String code;

    SourceFile(String className, String code) {
      super(
          URI.create("string:///" + className.replace('.', '/') + Kind.SOURCE.extension),
          Kind.SOURCE);
      this.code = code;
    }

    @Override
    public CharSequence getCharContent(boolean ignoreEncodingErrors) {
      return code;
    }
  }

  private static final class ClassFile extends SimpleJavaFileObject {
    private final ByteArrayOutputStream bytes = new ByteArrayOutputStream();

    ClassFile(String className) {
      super(URI.create("mem:///" + className.replace('.', '/') + Kind.CLASS.extension), Kind.CLASS);
    }

    @Override
    public OutputStream openOutputStream() {
      return bytes;
    }
  }

  private static final class MemoryFileManager extends ForwardingJavaFileManager<JavaFileManager> {
    private final Map<String, ClassFile> classes = new HashMap<>();

    MemoryFileManager(StandardJavaFileManager delegate) {
      super(delegate);
    }

    @Override
    public JavaFileObject getJavaFileForOutput(
        Location location, String className, JavaFileObject.Kind kind, FileObject sibling) {
      ClassFile file = new ClassFile(className);
      classes.put(className, file);
      return file;
    }
  }

  private static final class UnitClassLoader extends ClassLoader {
    private final Map<String, ClassFile> classes;

    UnitClassLoader(Map<String, ClassFile> classes, ClassLoader parent) {
      super(parent);
      this.classes = classes;
    }

    @Override
    protected Class<?> findClass(String name) throws ClassNotFoundException {
      ClassFile file = classes.get(name);
      if (file == null) throw new ClassNotFoundException(name);
      byte[] bytes = file.bytes.toByteArray();
      return defineClass(name, bytes, 0, bytes.length);
    }
  }

  private final JavaCompiler javac;
  private final String classpath;

  InMemoryJavac() {
    this.javac = ToolProvider.getSystemJavaCompiler();
    if (javac == null) {
      throw new IllegalStateException("no Java compiler available; workflows require a JDK");
    }
    this.classpath = classpath();
  }

  /** Compiles and loads {@code generated}; a javac error here is a code generator bug. */
  Class<? extends DslWorkflow> compile(GeneratedSource generated) {
    String className = generated.qualifiedName();
    DiagnosticCollector<JavaFileObject> diagnostics = new DiagnosticCollector<>();
    MemoryFileManager files =
        new MemoryFileManager(
            javac.getStandardFileManager(diagnostics, null, StandardCharsets.UTF_8));
    List<String> options =
        ImmutableList.of("-classpath", classpath, "-proc:none", "-g", "-nowarn", "-Xlint:none");
    boolean ok =
        javac
            .getTask(
                null,
                files,
                diagnostics,
                options,
                null,
                ImmutableList.of(new SourceFile(className, generated.source())))
            .call();
    try {
      files.close();
    } catch (IOException ex) {
      logger.warn("closing the file manager for {} failed", className, ex);
    }
    if (!ok) {
      logger.error("generated source of {} does not compile:\n{}", className, generated.source());
      StringBuilder message = new StringBuilder("generated code for " + className + " failed:");
      for (javax.tools.Diagnostic<? extends JavaFileObject> d : diagnostics.getDiagnostics()) {
        message
            .append("\n  line ")
            .append(d.getLineNumber())
            .append(": ")
            .append(d.getMessage(null));
      }
      throw new IllegalStateException(message.toString());
    }
    logger.debug("compiled {} into {} classes", className, files.classes.size());

    ClassLoader loader = new UnitClassLoader(files.classes, DslWorkflow.class.getClassLoader());
    try {
      return loader.loadClass(className).asSubclass(DslWorkflow.class);
    } catch (ClassNotFoundException ex) {
      throw new IllegalStateException("javac produced no class " + className, ex);
    }
  }

  // The runtime and its dependencies, wherever they were loaded from, plus the JVM's classpath.
  private static String classpath() {
    Set<String> entries = new LinkedHashSet<>();
    List<Class<?>> roots = ImmutableList.of(DslWorkflow.class, ImmutableList.class, JsonNode.class);
    for (Class<?> cls : roots) {
      CodeSource source = cls.getProtectionDomain().getCodeSource();
      if (source == null || source.getLocation() == null) continue;
      try {
        entries.add(Paths.get(source.getLocation().toURI()).toString());
      } catch (URISyntaxException ex) {
        throw new IllegalStateException("bad code source for " + cls.getName(), ex);
      }
    }
    String jvm = Strings.nullToEmpty(System.getProperty("java.class.path"));
    for (String entry : Splitter.on(File.pathSeparatorChar).omitEmptyStrings().split(jvm)) {
      entries.add(entry);
    }
    return Joiner.on(File.pathSeparatorChar).join(entries);
  }
}
