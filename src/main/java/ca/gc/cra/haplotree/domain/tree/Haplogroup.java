package ca.gc.cra.haplotree.domain.tree;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> One node of a haplogroup tree.
 * <p><strong>Role:</strong> Arena entry inside {@link HaplogroupTree}. Children are referenced by name and
 * resolved through the owning tree; {@link #parent()} is a lookup key, not an object reference.</p>
 * <p><strong>Thread-safety:</strong> Immutable once built.</p>
 *
 * @since 0.1.0
 */
public final class Haplogroup {
  private final String name;
  private final String parent;
  private final List<Locus> loci;
  private final List<String> children;

  Haplogroup(String name, String parent, List<Locus> loci, List<String> children) {
    this.name = Objects.requireNonNull(name, "name");
    this.parent = parent;
    this.loci = List.copyOf(loci);
    this.children = List.copyOf(children);
  }

  /**
   * Returns the haplogroup label, unique within its tree.
   *
   * @return node name
   */
  public String name() {
    return name;
  }

  /**
   * Returns the parent name, empty for roots.
   *
   * @return optional parent name
   */
  public Optional<String> parent() {
    return Optional.ofNullable(parent);
  }

  /**
   * Indicates whether this node is a root of its tree.
   *
   * @return {@code true} when the node has no parent
   */
  public boolean isRoot() {
    return parent == null;
  }

  /**
   * Returns the defining markers in declared order.
   *
   * @return immutable list of loci
   */
  public List<Locus> loci() {
    return loci;
  }

  /**
   * Returns child names in declared order.
   *
   * @return immutable list of child names
   */
  public List<String> children() {
    return children;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Haplogroup that)) {
      return false;
    }
    return name.equals(that.name)
        && Objects.equals(parent, that.parent)
        && loci.equals(that.loci)
        && children.equals(that.children);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, parent, loci, children);
  }

  @Override
  public String toString() {
    return "Haplogroup{" + name + ", loci=" + loci.size() + ", children=" + children.size() + '}';
  }
}
