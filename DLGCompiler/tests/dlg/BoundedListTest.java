package dlg;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;

public class BoundedListTest {

  @Test
  public void dropsBeyondCapacity() {
    BoundedList<String> list = new BoundedList<>(2);

    assertThat(list.tryAdd("a")).isTrue();
    assertThat(list.tryAdd("b")).isTrue();
    assertThat(list.isFull()).isTrue();
    assertThat(list.tryAdd("c")).isFalse();

    assertThat(list.toList()).containsExactly("a", "b").inOrder();
  }

  @Test
  public void clearMakesRoom() {
    BoundedList<String> list = new BoundedList<>(1);
    list.tryAdd("a");
    list.clear();

    assertThat(list.isEmpty()).isTrue();
    assertThat(list.tryAdd("b")).isTrue();
    assertThat(list.toList()).containsExactly("b");
  }

  @Test
  public void snapshotIsDetached() {
    BoundedList<String> list = new BoundedList<>(3);
    list.tryAdd("a");

    ImmutableList<String> snapshot = list.toList();
    list.tryAdd("b");

    assertThat(snapshot).containsExactly("a");
  }

  @Test
  public void rejectsInvalidCapacity() {
    assertThrows(IllegalArgumentException.class, () -> new BoundedList<String>(0));
  }
}
