package dlg;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

import com.google.common.base.Preconditions;
import com.google.common.io.ByteArrayDataOutput;
import com.google.common.io.ByteStreams;

/**
 * Serializes a {@link DialogueGraph} into an out file holding the nodes and an index file mapping
 * each tag to its node's bytes.
 *
 * <pre>
 * out:   node*
 * node:  UTF8 tag, OPT characterId, UTF8 text,
 *        varint N, (UTF8 name, OPT parameter){N},
 *        varint M, (UTF8 text, OPT targetTag){M}
 * index: varint count, (UTF8 tag, varint offset, varint length){count}
 *
 * UTF8:  varint byte length, bytes
 * OPT:   byte 0, or byte 1 then UTF8
 * </pre>
 */
public class GraphWriter {

  public interface Writer {
    void write(ByteArrayDataOutput out);
  }

  private final DialogueGraph graph;

  private byte[] indexFile;
  private byte[] outFile;

  public GraphWriter(DialogueGraph graph) {
    this.graph = Preconditions.checkNotNull(graph);
  }

  public static byte[] capture(Writer writer) {
    ByteArrayDataOutput out = ByteStreams.newDataOutput();
    writer.write(out);
    return out.toByteArray();
  }

  public static void writeVarint(int value, ByteArrayDataOutput out) {
    Preconditions.checkArgument(value >= 0, "negative varint: %s", value);
    while (value >= 128) {
      out.writeByte((value % 128) | 128);
      value /= 128;
    }
    out.writeByte(value);
  }

  public static void writeVarintBytes(byte[] bytes, ByteArrayDataOutput out) {
    writeVarint(bytes.length, out);
    out.write(bytes);
  }

  public static void writeUTF8(String value, ByteArrayDataOutput out) {
    writeVarintBytes(value.getBytes(StandardCharsets.UTF_8), out);
  }

  public static void writeOptionalUTF8(Optional<String> value, ByteArrayDataOutput out) {
    if (value.isPresent()) {
      out.writeByte(1);
      writeUTF8(value.get(), out);
    } else {
      out.writeByte(0);
    }
  }

  public static void writeNode(DialogueGraph.Node node, ByteArrayDataOutput out) {
    writeUTF8(node.tag(), out);
    writeOptionalUTF8(node.characterId(), out);
    writeUTF8(node.text(), out);

    writeVarint(node.commands().size(), out);
    for (DialogueGraph.Command command : node.commands()) {
      writeUTF8(command.name(), out);
      writeOptionalUTF8(command.parameter(), out);
    }

    writeVarint(node.choices().size(), out);
    for (DialogueGraph.Choice choice : node.choices()) {
      writeUTF8(choice.text(), out);
      writeOptionalUTF8(choice.targetTag(), out);
    }
  }

  public void write() {
    ByteArrayDataOutput indexOut = ByteStreams.newDataOutput();
    ByteArrayDataOutput outOut = ByteStreams.newDataOutput();
    int outIndex = 0;

    writeVarint(graph.size(), indexOut);
    for (DialogueGraph.Node node : graph.nodes()) {
      byte[] nodeBytes = capture(out -> writeNode(node, out));
      writeUTF8(node.tag(), indexOut);
      writeVarint(outIndex, indexOut);
      writeVarint(nodeBytes.length, indexOut);

      outOut.write(nodeBytes);
      outIndex += nodeBytes.length;
    }

    indexFile = indexOut.toByteArray();
    outFile = outOut.toByteArray();
  }

  public byte[] indexFile() {
    Preconditions.checkState(indexFile != null, "write() has not been called");
    return indexFile;
  }

  public byte[] outFile() {
    Preconditions.checkState(outFile != null, "write() has not been called");
    return outFile;
  }
}
