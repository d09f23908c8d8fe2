package dlg;

import static com.google.common.truth.Truth.assertThat;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;

public class ScriptReaderTest {

  private static ImmutableList<ScriptReader.Line> read(String content) {
    return new ScriptReader("/test/file.dlg", content, new LineClassifier(4)).read();
  }

  @Test
  public void skipsBlankLines() {
    ImmutableList<ScriptReader.Line> lines = read("Alice:\n\n   \n\tYes\n");

    assertThat(lines).hasSize(2);
    assertThat(lines.get(0).type()).isEqualTo(LineClassifier.Type.CHARACTER_ID);
    assertThat(lines.get(1).type()).isEqualTo(LineClassifier.Type.CHOICE);
    assertThat(lines.get(1).text()).isEqualTo("Yes");
  }

  @Test
  public void positions() {
    ImmutableList<ScriptReader.Line> lines = read("Alice:\n\n    [target]");

    ScriptReader.Pos pos = lines.get(1).pos();
    assertThat(pos.file()).isEqualTo("/test/file.dlg");
    assertThat(pos.lineNumber()).isEqualTo(2);
    assertThat(pos.column()).isEqualTo(4);
    assertThat(pos.toString()).isEqualTo("/test/file.dlg@3:5");
    assertThat(lines.get(0).pos()).isLessThan(pos);
  }

  @Test
  public void classifiesBeforeStripping() {
    ImmutableList<ScriptReader.Line> lines = read("\t[target]");

    assertThat(lines.get(0).type()).isEqualTo(LineClassifier.Type.CHOICE);
    assertThat(lines.get(0).text()).isEqualTo("[target]");
  }

  @Test
  public void carriageReturns() {
    ImmutableList<ScriptReader.Line> lines = read("Alice:\r\n\r\nHi.\r\n");

    assertThat(lines).hasSize(2);
    assertThat(lines.get(0).type()).isEqualTo(LineClassifier.Type.CHARACTER_ID);
    assertThat(lines.get(1).text()).isEqualTo("Hi.");
  }
}
