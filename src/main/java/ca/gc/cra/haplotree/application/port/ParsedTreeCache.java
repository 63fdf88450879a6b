package ca.gc.cra.haplotree.application.port;

import ca.gc.cra.haplotree.domain.tree.HaplogroupTree;
import java.util.Optional;

/**
 * Process-lifetime cache of assembled trees.
 * <p>Entries live until {@link #clear()} or process exit. Implementations must be thread-safe; concurrent
 * writers for the same key may race and the last write wins.</p>
 *
 * @since 0.1.0
 */
public interface ParsedTreeCache {
  /**
   * Looks up an assembled tree.
   *
   * @param key source and build
   * @return cached tree when present
   */
  Optional<HaplogroupTree> get(TreeCacheKey key);

  /**
   * Stores an assembled tree.
   *
   * @param key source and build
   * @param tree immutable tree
   */
  void put(TreeCacheKey key, HaplogroupTree tree);

  /**
   * Removes every entry.
   */
  void clear();
}
