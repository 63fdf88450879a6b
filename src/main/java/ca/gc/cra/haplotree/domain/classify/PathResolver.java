package ca.gc.cra.haplotree.domain.classify;

import ca.gc.cra.haplotree.domain.tree.Haplogroup;
import ca.gc.cra.haplotree.domain.tree.HaplogroupTree;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Reconstructs the root-to-node ancestry of a haplogroup.
 * <p>Searches depth-first from each root, siblings in declared order, and stops at the first node whose name
 * matches. An absent name yields an empty path.</p>
 *
 * @since 0.1.0
 */
public final class PathResolver {

  /**
   * Resolves the path to {@code targetName}.
   *
   * @param tree immutable tree
   * @param targetName haplogroup to locate
   * @return root-first steps ending at the target, or an empty list when the name is absent
   */
  public List<PathStep> resolvePath(HaplogroupTree tree, String targetName) {
    Objects.requireNonNull(tree, "tree");
    if (targetName == null) {
      return List.of();
    }
    Deque<Cursor> stack = new ArrayDeque<>();
    List<Haplogroup> roots = tree.roots();
    for (int i = roots.size() - 1; i >= 0; i--) {
      stack.push(new Cursor(roots.get(i), 0, null));
    }
    while (!stack.isEmpty()) {
      Cursor cursor = stack.pop();
      if (cursor.node().name().equals(targetName)) {
        return unwind(cursor);
      }
      List<Haplogroup> children = tree.children(cursor.node());
      for (int i = children.size() - 1; i >= 0; i--) {
        stack.push(new Cursor(children.get(i), cursor.depth() + 1, cursor));
      }
    }
    return List.of();
  }

  private static List<PathStep> unwind(Cursor target) {
    Deque<PathStep> steps = new ArrayDeque<>(target.depth() + 1);
    for (Cursor c = target; c != null; c = c.previous()) {
      steps.push(new PathStep(c.node(), c.depth()));
    }
    return List.copyOf(new ArrayList<>(steps));
  }

  private record Cursor(Haplogroup node, int depth, Cursor previous) {}
}
