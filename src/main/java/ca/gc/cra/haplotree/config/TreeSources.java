package ca.gc.cra.haplotree.config;

import ca.gc.cra.haplotree.application.tree.TreeFormat;
import ca.gc.cra.haplotree.application.tree.TreeSource;
import ca.gc.cra.haplotree.domain.tree.ReferenceBuilds;
import ca.gc.cra.haplotree.domain.tree.TreeType;
import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Built-in tree sources and URL overrides.
 * <p>FTDNA publishes both trees in GRCh38 coordinates; its mitochondrial tree positions are also valid rCRS
 * positions. Decoding-Us publishes per-assembly coordinates for GRCh38, GRCh37 and T2T-CHM13v2.0.</p>
 *
 * @since 0.1.0
 */
public final class TreeSources {
  public static final String FTDNA_Y = "ftdna-ytree";
  public static final String FTDNA_MT = "ftdna-mttree";
  public static final String DECODINGUS_Y = "decodingus-ytree";

  private static final List<TreeSource> BUILT_IN = List.of(
      new TreeSource(
          FTDNA_Y,
          TreeType.Y_DNA,
          URI.create("https://www.familytreedna.com/public/y-dna-haplotree/get"),
          TreeFormat.FTDNA,
          ReferenceBuilds.GRCH38,
          Set.of(ReferenceBuilds.GRCH38),
          Set.of()),
      new TreeSource(
          FTDNA_MT,
          TreeType.MT_DNA,
          URI.create("https://www.familytreedna.com/public/mt-dna-haplotree/get"),
          TreeFormat.FTDNA,
          ReferenceBuilds.GRCH38,
          Set.of(ReferenceBuilds.GRCH38, ReferenceBuilds.RCRS),
          Set.of(ReferenceBuilds.RCRS)),
      new TreeSource(
          DECODINGUS_Y,
          TreeType.Y_DNA,
          URI.create("https://decoding-us.com/api/v1/y-tree"),
          TreeFormat.DECODINGUS,
          ReferenceBuilds.GRCH38,
          Set.of(ReferenceBuilds.GRCH38, ReferenceBuilds.GRCH37, ReferenceBuilds.T2T_CHM13),
          Set.of()));

  private TreeSources() {}

  /**
   * Returns the built-in sources.
   *
   * @return immutable list in declaration order
   */
  public static List<TreeSource> builtIn() {
    return BUILT_IN;
  }

  /**
   * Returns the built-in sources with download URLs replaced where {@code urlOverrides} names them.
   *
   * @param urlOverrides source id to replacement URL
   * @return sources in declaration order
   * @throws IllegalArgumentException if an override names an unknown source
   */
  public static List<TreeSource> withOverrides(Map<String, URI> urlOverrides) {
    Objects.requireNonNull(urlOverrides, "urlOverrides");
    Map<String, TreeSource> byId = new LinkedHashMap<>();
    for (TreeSource source : BUILT_IN) {
      byId.put(source.id(), source);
    }
    for (Map.Entry<String, URI> override : urlOverrides.entrySet()) {
      TreeSource source = byId.get(override.getKey());
      if (source == null) {
        throw new IllegalArgumentException(
            "sources." + override.getKey() + ".url refers to an unknown tree source; known: " + byId.keySet());
      }
      byId.put(source.id(), source.withUrl(override.getValue()));
    }
    return List.copyOf(new ArrayList<>(byId.values()));
  }
}
