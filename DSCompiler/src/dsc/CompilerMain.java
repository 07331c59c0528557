package dsc;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import com.google.common.collect.ImmutableList;
import com.google.common.io.Files;

public class CompilerMain {

  private static final String USAGE = "Usage: $COMPILER [--strict] [--raw] script_file output_file";

  public static void main(String[] args) throws IOException {
    CompilerOptions.Builder options = CompilerOptions.builder();
    boolean raw = false;
    List<String> files = new ArrayList<>();
    for (String arg : args) {
      if (arg.equals("--strict")) {
        options.setStrictDirectives(true);
      } else if (arg.equals("--raw")) {
        raw = true;
      } else if (arg.startsWith("--")) {
        System.err.println("Unknown flag: " + arg);
        System.err.println(USAGE);
        System.exit(1);
      } else {
        files.add(arg);
      }
    }
    if (files.size() != 2) {
      System.err.println(USAGE);
      System.exit(1);
    }

    File in = new File(files.get(0));
    File out = new File(files.get(1));
    ImmutableList<String> lines = read(in);
    System.out.println(String.format("%s has %d lines", in.getName(), lines.size()));

    String output;
    try {
      output = new ScriptCompiler(options.build()).compile(in.getName(), lines);
    } catch (CompilerException ex) {
      ex.print();
      System.out.println("Compilation failed.  See errors above.");
      System.exit(1);
      return;
    }

    if (!raw) {
      output = new BraceIndentFormatter().format(output);
    }
    write(output, out);
    System.out.println("Compilation succeeded!");
  }

  private static ImmutableList<String> read(File file) throws IOException {
    return Files.asCharSource(file, StandardCharsets.UTF_8).readLines();
  }

  private static void write(String string, File file) throws IOException {
    Files.asCharSink(file, StandardCharsets.UTF_8).write(string);
  }
}
