package dlg;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.google.common.io.Files;

public class DialogueCompilerMainTest {

  @TempDir File tempDir;

  private File writeScript(String name, String content) throws IOException {
    File file = new File(tempDir, name);
    Files.asCharSink(file, StandardCharsets.UTF_8).write(content);
    return file;
  }

  @Test
  public void findsScriptsInDirectory() throws IOException {
    writeScript("b.dlg", "");
    writeScript("a.dlg", "");
    writeScript("notes.txt", "");

    assertThat(DialogueCompilerMain.getFiles(tempDir))
        .containsExactly(new File(tempDir, "a.dlg"), new File(tempDir, "b.dlg"))
        .inOrder();
  }

  @Test
  public void singleFile() throws IOException {
    File script = writeScript("intro.dlg", "");

    assertThat(DialogueCompilerMain.getFiles(script)).containsExactly(script);
  }

  @Test
  public void writesIndexAndOut() throws IOException, CompilerException {
    File script = writeScript("intro.dlg", "Alice:\nHello.\n\tBye\n\t[missing]\n");
    File outDir = new File(tempDir, "out");
    outDir.mkdirs();

    DialogueCompilerMain.compileFile(new DialogueCompiler(), script, outDir);

    DialogueGraph graph =
        new DialogueCompiler().compile(script.toString(), "Alice:\nHello.\n\tBye\n\t[missing]\n");
    GraphWriter expected = new GraphWriter(graph);
    expected.write();
    assertThat(Files.toByteArray(new File(outDir, "intro.index"))).isEqualTo(expected.indexFile());
    assertThat(Files.toByteArray(new File(outDir, "intro.out"))).isEqualTo(expected.outFile());
  }

  @Test
  public void missingScript() {
    CompilerException ex =
        assertThrows(
            CompilerException.class,
            () ->
                DialogueCompilerMain.compileFile(
                    new DialogueCompiler(), new File(tempDir, "absent.dlg"), tempDir));

    assertThat(ex).hasMessageThat().contains("cannot read script");
  }
}
