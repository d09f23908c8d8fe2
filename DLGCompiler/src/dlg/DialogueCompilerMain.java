package dlg;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.google.common.collect.ImmutableList;
import com.google.common.io.Files;

public class DialogueCompilerMain {
  private static final Logger LOGGER = LogManager.getLogger(DialogueCompilerMain.class);

  public static final String SCRIPT_EXTENSION = ".dlg";

  private static final String INDEX_EXTENSION = ".index";

  private static final String OUT_EXTENSION = ".out";

  public static void main(String[] args) {
    if (args.length != 2) {
      System.err.println("Usage: $COMPILER script_file_or_dir out_dir");
      System.exit(1);
    }

    File outDir = new File(args[1]);
    if (!outDir.isDirectory() && !outDir.mkdirs()) {
      LOGGER.error("Cannot create output directory {}", outDir);
      System.exit(1);
    }

    List<File> files = getFiles(new File(args[0]));
    if (files.isEmpty()) {
      LOGGER.error("No {} files found at {}", SCRIPT_EXTENSION, args[0]);
      System.exit(1);
    }

    DialogueCompiler compiler = new DialogueCompiler();
    boolean success = true;
    for (File f : files) {
      try {
        compileFile(compiler, f, outDir);
      } catch (CompilerException ex) {
        LOGGER.error(ex.describe(), ex.getCause());
        success = false;
      }
    }

    if (!success) {
      LOGGER.error("Compilation failed.  See errors above.");
      System.exit(1);
    }
    LOGGER.info("Compilation succeeded!");
  }

  static void compileFile(DialogueCompiler compiler, File file, File outDir)
      throws CompilerException {
    ScriptReader.Pos filePos = ScriptReader.Pos.ofFile(file.toString());
    String content;
    try {
      content = Files.asCharSource(file, StandardCharsets.UTF_8).read();
    } catch (IOException ex) {
      throw new CompilerException(filePos, "cannot read script: " + ex.getMessage(), ex);
    }

    DialogueGraph graph = compiler.compile(file.toString(), content);
    LOGGER.info("{}: {} nodes", file, graph.size());

    // Dangling targets and duplicate tags are left to the runtime; only warn about them here.
    ImmutableList<CompilerException> warnings = new GraphValidator(graph).computeErrors();
    warnings.forEach(w -> LOGGER.warn(w.describe()));

    GraphWriter writer = new GraphWriter(graph);
    writer.write();

    String baseName = Files.getNameWithoutExtension(file.getName());
    try {
      Files.asByteSink(new File(outDir, baseName + INDEX_EXTENSION)).write(writer.indexFile());
      Files.asByteSink(new File(outDir, baseName + OUT_EXTENSION)).write(writer.outFile());
    } catch (IOException ex) {
      throw new CompilerException(filePos, "cannot write output: " + ex.getMessage(), ex);
    }
  }

  static List<File> getFiles(File path) {
    if (path.isFile()) return ImmutableList.of(path);

    File[] children = path.listFiles();
    if (children == null) return ImmutableList.of();

    return Arrays.stream(children)
        .filter(f -> f.isFile() && f.getName().endsWith(SCRIPT_EXTENSION))
        .sorted(Comparator.comparing(File::getName))
        .collect(Collectors.toList());
  }
}
