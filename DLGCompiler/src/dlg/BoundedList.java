package dlg;

import java.util.ArrayList;
import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

public final class BoundedList<T> {
  private final int capacity;
  private final List<T> elements;

  public BoundedList(int capacity) {
    Preconditions.checkArgument(capacity > 0, "capacity must be positive: %s", capacity);
    this.capacity = capacity;
    this.elements = new ArrayList<>(capacity);
  }

  public boolean tryAdd(T element) {
    Preconditions.checkNotNull(element);
    if (isFull()) return false;

    elements.add(element);
    return true;
  }

  public T get(int index) {
    return elements.get(index);
  }

  public void set(int index, T element) {
    elements.set(index, Preconditions.checkNotNull(element));
  }

  public int size() {
    return elements.size();
  }

  public boolean isEmpty() {
    return elements.isEmpty();
  }

  public boolean isFull() {
    return elements.size() >= capacity;
  }

  public void clear() {
    elements.clear();
  }

  public ImmutableList<T> toList() {
    return ImmutableList.copyOf(elements);
  }
}
