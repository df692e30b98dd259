package com.github.fsmdsl.codegen;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.OutputStream;
import java.io.StringWriter;
import java.net.URI;
import java.security.SecureClassLoader;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import javax.tools.DiagnosticCollector;
import javax.tools.FileObject;
import javax.tools.ForwardingJavaFileManager;
import javax.tools.JavaCompiler;
import javax.tools.JavaFileObject;
import javax.tools.SimpleJavaFileObject;
import javax.tools.StandardJavaFileManager;
import javax.tools.ToolProvider;

import com.github.fsmdsl.runtime.GeneratedMachine;

/**
 * Compiles generated source without touching the file system and loads the result in a child of
 * the test class loader.
 */
final class InMemoryCompiler {
  private final JavaCompiler compiler = ToolProvider.getSystemJavaCompiler();

  boolean isAvailable() {
    return compiler != null;
  }

  Class<?> compile(final String className, final String source) throws ClassNotFoundException {
    final DiagnosticCollector<JavaFileObject> diagnostics = new DiagnosticCollector<>();
    final StandardJavaFileManager standard = compiler.getStandardFileManager(diagnostics, null, null);
    final ClassFileManager fileManager = new ClassFileManager(standard);
    final List<String> options = new ArrayList<>();
    options.add("-classpath");
    options.add(runtimeClasspath());
    final StringWriter output = new StringWriter();
    final boolean compiled = compiler.getTask(output, fileManager, diagnostics, options, null,
        Collections.singletonList(new SourceFile(className, source))).call();
    if (!compiled) {
      throw new IllegalStateException(
          "Generated source did not compile: " + diagnostics.getDiagnostics() + output);
    }
    return new ClassFileLoader(InMemoryCompiler.class.getClassLoader(), fileManager.classFiles)
        .loadClass(className);
  }

  // surefire may hide target/classes behind a manifest-only jar
  private static String runtimeClasspath() {
    final List<String> entries = new ArrayList<>();
    try {
      entries.add(new File(GeneratedMachine.class.getProtectionDomain().getCodeSource()
          .getLocation().toURI()).getPath());
    } catch (Exception problem) {
      throw new IllegalStateException("Cannot locate the runtime classes", problem);
    }
    entries.add(System.getProperty("java.class.path"));
    return String.join(File.pathSeparator, entries);
  }

  private static final class SourceFile extends SimpleJavaFileObject {
    private final String source;

    private SourceFile(final String className, final String source) {
      super(URI.create("string:///" + className.replace('.', '/') + Kind.SOURCE.extension),
          Kind.SOURCE);
      this.source = source;
    }

    @Override
    public CharSequence getCharContent(final boolean ignoreEncodingErrors) {
      return source;
    }
  }

  private static final class ClassFile extends SimpleJavaFileObject {
    private final ByteArrayOutputStream bytecode = new ByteArrayOutputStream();

    private ClassFile(final String className) {
      super(URI.create("mem:///" + className.replace('.', '/') + Kind.CLASS.extension),
          Kind.CLASS);
    }

    @Override
    public OutputStream openOutputStream() {
      return bytecode;
    }
  }

  private static final class ClassFileManager
      extends ForwardingJavaFileManager<StandardJavaFileManager> {
    private final Map<String, ClassFile> classFiles = new HashMap<>();

    private ClassFileManager(final StandardJavaFileManager fileManager) {
      super(fileManager);
    }

    @Override
    public JavaFileObject getJavaFileForOutput(final Location location, final String className,
        final JavaFileObject.Kind kind, final FileObject sibling) {
      final ClassFile classFile = new ClassFile(className);
      classFiles.put(className, classFile);
      return classFile;
    }
  }

  private static final class ClassFileLoader extends SecureClassLoader {
    private final Map<String, ClassFile> classFiles;

    private ClassFileLoader(final ClassLoader parent, final Map<String, ClassFile> classFiles) {
      super(parent);
      this.classFiles = classFiles;
    }

    @Override
    protected Class<?> findClass(final String name) throws ClassNotFoundException {
      final ClassFile classFile = classFiles.get(name);
      if (classFile == null) {
        throw new ClassNotFoundException(name);
      }
      final byte[] bytecode = classFile.bytecode.toByteArray();
      return defineClass(name, bytecode, 0, bytecode.length);
    }
  }
}
