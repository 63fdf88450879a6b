package ca.gc.cra.haplotree.application.tree;

import ca.gc.cra.haplotree.domain.tree.HaplogroupTree;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a tree load: either an immutable tree or a {@link TreeLoadError}.
 *
 * @since 0.1.0
 */
public final class TreeLoadResult {
  private final HaplogroupTree tree;
  private final TreeLoadError error;

  private TreeLoadResult(HaplogroupTree tree, TreeLoadError error) {
    this.tree = tree;
    this.error = error;
  }

  /**
   * Creates a successful result.
   *
   * @param tree loaded tree
   * @return success
   */
  public static TreeLoadResult success(HaplogroupTree tree) {
    return new TreeLoadResult(Objects.requireNonNull(tree, "tree"), null);
  }

  /**
   * Creates a failed result.
   *
   * @param error failure details
   * @return failure
   */
  public static TreeLoadResult failure(TreeLoadError error) {
    return new TreeLoadResult(null, Objects.requireNonNull(error, "error"));
  }

  public boolean isSuccess() {
    return tree != null;
  }

  public Optional<HaplogroupTree> tree() {
    return Optional.ofNullable(tree);
  }

  public Optional<TreeLoadError> error() {
    return Optional.ofNullable(error);
  }

  /**
   * Returns the tree or raises the failure as a checked exception.
   *
   * @return loaded tree
   * @throws TreeLoadException when the load failed
   */
  public HaplogroupTree orElseThrow() throws TreeLoadException {
    if (tree == null) {
      throw new TreeLoadException(error);
    }
    return tree;
  }

  @Override
  public String toString() {
    return isSuccess()
        ? "TreeLoadResult{success, nodes=" + tree.size() + '}'
        : "TreeLoadResult{" + error.describe() + '}';
  }
}
