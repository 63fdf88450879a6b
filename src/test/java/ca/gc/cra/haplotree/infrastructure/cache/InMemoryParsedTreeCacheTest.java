package ca.gc.cra.haplotree.infrastructure.cache;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.haplotree.application.port.TreeCacheKey;
import ca.gc.cra.haplotree.domain.tree.HaplogroupTree;
import ca.gc.cra.haplotree.testutil.TreeFixtures;
import org.junit.jupiter.api.Test;

class InMemoryParsedTreeCacheTest {

  @Test
  void entriesAreKeyedBySourceAndBuild() {
    InMemoryParsedTreeCache cache = new InMemoryParsedTreeCache();
    HaplogroupTree tree = TreeFixtures.chain();

    cache.put(new TreeCacheKey("ftdna-ytree", "GRCh38"), tree);

    assertSame(tree, cache.get(new TreeCacheKey("ftdna-ytree", "GRCh38")).orElseThrow());
    assertTrue(cache.get(new TreeCacheKey("ftdna-ytree", "GRCh37")).isEmpty());
    cache.clear();
    assertEquals(0, cache.size());
  }
}
