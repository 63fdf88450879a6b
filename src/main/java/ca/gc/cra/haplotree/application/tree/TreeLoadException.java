package ca.gc.cra.haplotree.application.tree;

import java.util.Objects;

/**
 * Checked form of a {@link TreeLoadError}, raised by {@link TreeLoadResult#orElseThrow()}.
 *
 * @since 0.1.0
 */
public final class TreeLoadException extends Exception {
  private static final long serialVersionUID = 1L;

  private final transient TreeLoadError error;

  /**
   * Wraps a load error.
   *
   * @param error failure outcome
   */
  public TreeLoadException(TreeLoadError error) {
    super(Objects.requireNonNull(error, "error").describe(), error.cause());
    this.error = error;
  }

  /**
   * Returns the wrapped error.
   *
   * @return load error
   */
  public TreeLoadError error() {
    return error;
  }
}
