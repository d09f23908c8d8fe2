package dlg;

import java.util.Optional;

import com.google.common.collect.ImmutableList;

public final class NodeBuilder {
  // Shared by node text and choice text.
  private final StringBuilder text = new StringBuilder();

  private final BoundedList<DialogueGraph.Command> commands;
  private final BoundedList<DialogueGraph.Choice> choices;

  private String tag;
  private Optional<String> characterId = Optional.empty();
  private Optional<String> choiceTarget = Optional.empty();

  public NodeBuilder(CompilerConfig config) {
    this.commands = new BoundedList<>(config.maxCommands());
    this.choices = new BoundedList<>(config.maxChoices());
    this.tag = config.initialTag();
  }

  public void appendText(String line) {
    if (text.length() > 0) text.append('\n');
    text.append(line);
  }

  public boolean hasText() {
    return text.length() > 0;
  }

  public boolean addCommand(DialogueGraph.Command command) {
    return commands.tryAdd(command);
  }

  public void setTag(String tag) {
    this.tag = tag;
  }

  public void setCharacterId(String characterId) {
    this.characterId = Optional.of(characterId);
  }

  public void setChoiceTarget(Optional<String> choiceTarget) {
    this.choiceTarget = choiceTarget;
  }

  // Tag and speaker carry over to the next node.
  public DialogueGraph.Node closeNode() {
    DialogueGraph.Node node =
        DialogueGraph.Node.create(
            tag, characterId, text.toString(), commands.toList(), ImmutableList.of());
    text.setLength(0);
    commands.clear();
    return node;
  }

  // A flush without pending text is a no-op and reports success.
  public boolean flushChoice() {
    if (!hasText()) return true;

    String choiceText = text.toString();
    text.setLength(0);
    return choices.tryAdd(DialogueGraph.Choice.create(choiceText, choiceTarget));
  }

  public ImmutableList<DialogueGraph.Choice> takeChoices() {
    ImmutableList<DialogueGraph.Choice> taken = choices.toList();
    choices.clear();
    return taken;
  }
}
