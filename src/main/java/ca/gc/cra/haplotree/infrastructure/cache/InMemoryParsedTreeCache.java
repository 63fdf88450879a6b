package ca.gc.cra.haplotree.infrastructure.cache;

import ca.gc.cra.haplotree.application.port.ParsedTreeCache;
import ca.gc.cra.haplotree.application.port.TreeCacheKey;
import ca.gc.cra.haplotree.domain.tree.HaplogroupTree;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * {@link ParsedTreeCache} backed by a {@link ConcurrentHashMap}. One instance per provider; nothing is static.
 *
 * @since 0.1.0
 */
public final class InMemoryParsedTreeCache implements ParsedTreeCache {
  private final ConcurrentMap<TreeCacheKey, HaplogroupTree> trees = new ConcurrentHashMap<>();

  @Override
  public Optional<HaplogroupTree> get(TreeCacheKey key) {
    return Optional.ofNullable(trees.get(Objects.requireNonNull(key, "key")));
  }

  @Override
  public void put(TreeCacheKey key, HaplogroupTree tree) {
    trees.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(tree, "tree"));
  }

  @Override
  public void clear() {
    trees.clear();
  }

  /**
   * Returns the number of cached trees.
   *
   * @return entry count
   */
  public int size() {
    return trees.size();
  }
}
