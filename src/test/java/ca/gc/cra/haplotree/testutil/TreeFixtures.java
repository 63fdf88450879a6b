package ca.gc.cra.haplotree.testutil;

import ca.gc.cra.haplotree.domain.tree.HaplogroupTree;
import ca.gc.cra.haplotree.domain.tree.Locus;
import ca.gc.cra.haplotree.domain.tree.ReferenceBuilds;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Shared trees and payloads for tests.
 */
public final class TreeFixtures {

  private TreeFixtures() {}

  /**
   * A (no markers) -> A1 (1000 C&gt;T) -> A1a (2000 A&gt;G).
   */
  public static HaplogroupTree chain() {
    return HaplogroupTree.builder(ReferenceBuilds.GRCH38)
        .add("A", null, List.of())
        .add("A1", "A", List.of(new Locus("M1", 1000, "C", "T")))
        .add("A1a", "A1", List.of(new Locus("M2", 2000, "A", "G")))
        .build();
  }

  /**
   * R (100 G&gt;A) with branches R1 (200 C&gt;T, 300 G&gt;C) and R2 (400 T&gt;A), and R1a (500 A&gt;C) under R1.
   */
  public static HaplogroupTree branching() {
    return HaplogroupTree.builder(ReferenceBuilds.GRCH38)
        .add("R", null, List.of(new Locus("P1", 100, "G", "A")))
        .add("R1", "R", List.of(new Locus("P2", 200, "C", "T"), new Locus("P3", 300, "G", "C")))
        .add("R2", "R", List.of(new Locus("P4", 400, "T", "A")))
        .add("R1a", "R1", List.of(new Locus("P5", 500, "A", "C")))
        .build();
  }

  /**
   * Three roots in declared order: X (10 A&gt;G), Y (no markers) with child Y1 (20 C&gt;T), and W (30 T&gt;C).
   */
  public static HaplogroupTree multiRoot() {
    return HaplogroupTree.builder(ReferenceBuilds.GRCH38)
        .add("X", null, List.of(new Locus("S1", 10, "A", "G")))
        .add("Y", null, List.of())
        .add("Y1", "Y", List.of(new Locus("S2", 20, "C", "T")))
        .add("W", null, List.of(new Locus("S3", 30, "T", "C")))
        .build();
  }

  /**
   * Reads a classpath fixture as UTF-8 text.
   *
   * @param name resource path below {@code /fixtures/}
   * @return resource content
   */
  public static String resource(String name) {
    try (InputStream in = TreeFixtures.class.getResourceAsStream("/fixtures/" + name)) {
      if (in == null) {
        throw new IllegalStateException("missing fixture " + name);
      }
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException ex) {
      throw new UncheckedIOException(ex);
    }
  }
}
