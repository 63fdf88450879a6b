package ca.gc.cra.haplotree.domain.tree;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * <strong>What:</strong> Immutable haplogroup tree stored as an arena of nodes addressed by name.
 * <p><strong>Why:</strong> Name-addressed nodes avoid object back-pointers while keeping parent lookups and
 * ordered child traversal cheap.</p>
 * <p><strong>Role:</strong> Domain aggregate produced by the tree provider and shared read-only by the scorer,
 * path resolver and report writer.</p>
 * <p><strong>Thread-safety:</strong> Immutable after {@link Builder#build()}; safe to share across concurrent
 * classification requests.</p>
 * <p><strong>Performance:</strong> Node lookup is O(1); traversals are O(nodes).</p>
 *
 * @since 0.1.0
 */
public final class HaplogroupTree {
  private final String build;
  private final List<String> roots;
  private final Map<String, Haplogroup> nodes;

  private HaplogroupTree(String build, List<String> roots, Map<String, Haplogroup> nodes) {
    this.build = build;
    this.roots = List.copyOf(roots);
    this.nodes = Collections.unmodifiableMap(nodes);
  }

  /**
   * Starts a builder for a tree whose loci are expressed in {@code build} coordinates.
   *
   * @param build reference assembly name; must not be {@code null}
   * @return new builder
   */
  public static Builder builder(String build) {
    return new Builder(build);
  }

  /**
   * Returns the assembly the loci positions refer to.
   *
   * @return reference build name
   */
  public String build() {
    return build;
  }

  /**
   * Returns root nodes in declared order.
   *
   * @return immutable list of roots
   */
  public List<Haplogroup> roots() {
    List<Haplogroup> result = new ArrayList<>(roots.size());
    for (String root : roots) {
      result.add(nodes.get(root));
    }
    return List.copyOf(result);
  }

  /**
   * Looks up a node by name.
   *
   * @param name haplogroup name
   * @return node when present
   */
  public Optional<Haplogroup> node(String name) {
    if (name == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(nodes.get(name));
  }

  /**
   * Resolves the children of {@code node} in declared order.
   *
   * @param node node belonging to this tree
   * @return immutable list of child nodes
   */
  public List<Haplogroup> children(Haplogroup node) {
    Objects.requireNonNull(node, "node");
    List<Haplogroup> result = new ArrayList<>(node.children().size());
    for (String child : node.children()) {
      result.add(nodes.get(child));
    }
    return List.copyOf(result);
  }

  /**
   * Returns the number of nodes.
   *
   * @return node count
   */
  public int size() {
    return nodes.size();
  }

  /**
   * Indicates whether the tree has no nodes.
   *
   * @return {@code true} for an empty tree
   */
  public boolean isEmpty() {
    return nodes.isEmpty();
  }

  /**
   * Returns every node in pre-order, roots and siblings in declared order.
   *
   * @return immutable pre-order node list
   */
  public List<Haplogroup> preOrder() {
    List<Haplogroup> ordered = new ArrayList<>(nodes.size());
    Deque<String> stack = new ArrayDeque<>();
    for (int i = roots.size() - 1; i >= 0; i--) {
      stack.push(roots.get(i));
    }
    while (!stack.isEmpty()) {
      Haplogroup current = nodes.get(stack.pop());
      ordered.add(current);
      List<String> children = current.children();
      for (int i = children.size() - 1; i >= 0; i--) {
        stack.push(children.get(i));
      }
    }
    return List.copyOf(ordered);
  }

  /**
   * Returns the distinct markers defined anywhere in the tree, in pre-order.
   *
   * @return immutable list of distinct loci
   */
  public List<Locus> distinctLoci() {
    Set<Locus> loci = new LinkedHashSet<>();
    for (Haplogroup node : preOrder()) {
      loci.addAll(node.loci());
    }
    return List.copyOf(loci);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof HaplogroupTree that)) {
      return false;
    }
    return build.equals(that.build) && roots.equals(that.roots) && nodes.equals(that.nodes);
  }

  @Override
  public int hashCode() {
    return Objects.hash(build, roots, nodes);
  }

  @Override
  public String toString() {
    return "HaplogroupTree{build=" + build + ", roots=" + roots + ", nodes=" + nodes.size() + '}';
  }

  /**
   * Collects nodes and validates the tree invariants on {@link #build()}.
   * <p>Children keep the order in which they were added. Not thread-safe.</p>
   */
  public static final class Builder {
    private final String build;
    private final Map<String, PendingNode> pending = new LinkedHashMap<>();

    private Builder(String build) {
      this.build = Objects.requireNonNull(build, "build");
    }

    /**
     * Adds a node. Parents may be added before or after their children.
     *
     * @param name unique node name
     * @param parent parent name, {@code null} for a root
     * @param loci defining markers in declared order
     * @return this builder
     * @throws IllegalArgumentException if the name is blank or already present
     */
    public Builder add(String name, String parent, List<Locus> loci) {
      Objects.requireNonNull(name, "name");
      if (name.isBlank()) {
        throw new IllegalArgumentException("haplogroup name must not be blank");
      }
      if (pending.containsKey(name)) {
        throw new IllegalArgumentException("duplicate haplogroup name: " + name);
      }
      if (name.equals(parent)) {
        throw new IllegalArgumentException("haplogroup " + name + " cannot be its own parent");
      }
      pending.put(name, new PendingNode(parent, loci == null ? List.of() : List.copyOf(loci)));
      return this;
    }

    /**
     * Indicates whether a node with {@code name} was already added.
     *
     * @param name candidate name
     * @return {@code true} if present
     */
    public boolean contains(String name) {
      return pending.containsKey(name);
    }

    /**
     * Validates parent references and reachability, then freezes the tree.
     *
     * @return immutable tree
     * @throws IllegalArgumentException when a parent is missing or nodes form a cycle
     */
    public HaplogroupTree build() {
      Map<String, List<String>> childNames = new LinkedHashMap<>();
      List<String> roots = new ArrayList<>();
      for (Map.Entry<String, PendingNode> entry : pending.entrySet()) {
        String parent = entry.getValue().parent();
        if (parent == null) {
          roots.add(entry.getKey());
          continue;
        }
        if (!pending.containsKey(parent)) {
          throw new IllegalArgumentException(
              "haplogroup " + entry.getKey() + " references unknown parent " + parent);
        }
        childNames.computeIfAbsent(parent, k -> new ArrayList<>()).add(entry.getKey());
      }

      Map<String, Haplogroup> nodes = new LinkedHashMap<>(pending.size() * 2);
      for (Map.Entry<String, PendingNode> entry : pending.entrySet()) {
        String name = entry.getKey();
        PendingNode node = entry.getValue();
        nodes.put(name, new Haplogroup(
            name, node.parent(), node.loci(), childNames.getOrDefault(name, List.of())));
      }

      int reachable = 0;
      Deque<String> stack = new ArrayDeque<>(roots);
      while (!stack.isEmpty()) {
        reachable++;
        stack.addAll(childNames.getOrDefault(stack.pop(), List.of()));
      }
      if (reachable != nodes.size()) {
        throw new IllegalArgumentException(
            "haplogroup tree contains a cycle: " + (nodes.size() - reachable) + " nodes unreachable from roots");
      }
      return new HaplogroupTree(build, roots, nodes);
    }

    private record PendingNode(String parent, List<Locus> loci) {}
  }
}
