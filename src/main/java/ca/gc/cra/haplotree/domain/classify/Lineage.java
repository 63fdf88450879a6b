package ca.gc.cra.haplotree.domain.classify;

import java.util.AbstractList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.ListIterator;
import java.util.Objects;

/**
 * Immutable root-to-node name list that shares its prefix with the parent's lineage.
 * <p>Extending a lineage costs one link, so lineages for a whole tree take memory proportional to the node
 * count. Random access walks up the chain, iteration collects the names once, and {@code subList(0, n)}
 * returns the shared ancestor chain itself.</p>
 *
 * @since 0.1.0
 */
final class Lineage extends AbstractList<String> {
  private final Lineage parent;
  private final String name;
  private final int size;

  private Lineage(Lineage parent, String name) {
    this.parent = parent;
    this.name = Objects.requireNonNull(name, "name");
    this.size = parent == null ? 1 : parent.size + 1;
  }

  static Lineage root(String name) {
    return new Lineage(null, name);
  }

  Lineage child(String childName) {
    return new Lineage(this, childName);
  }

  @Override
  public String get(int index) {
    Objects.checkIndex(index, size);
    return ancestor(index + 1).name;
  }

  @Override
  public int size() {
    return size;
  }

  @Override
  public List<String> subList(int fromIndex, int toIndex) {
    if (fromIndex == 0 && toIndex >= 1 && toIndex <= size) {
      return ancestor(toIndex);
    }
    return super.subList(fromIndex, toIndex);
  }

  @Override
  public Iterator<String> iterator() {
    return listIterator(0);
  }

  @Override
  public ListIterator<String> listIterator(int index) {
    return Collections.unmodifiableList(Arrays.asList(names())).listIterator(index);
  }

  private Lineage ancestor(int length) {
    Lineage node = this;
    while (node.size > length) {
      node = node.parent;
    }
    return node;
  }

  private String[] names() {
    String[] names = new String[size];
    for (Lineage node = this; node != null; node = node.parent) {
      names[node.size - 1] = node.name;
    }
    return names;
  }
}
