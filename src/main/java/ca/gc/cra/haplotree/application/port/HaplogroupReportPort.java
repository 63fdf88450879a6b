package ca.gc.cra.haplotree.application.port;

import ca.gc.cra.haplotree.domain.classify.HaplogroupResult;
import ca.gc.cra.haplotree.domain.classify.ObservedCalls;
import ca.gc.cra.haplotree.domain.tree.HaplogroupTree;
import ca.gc.cra.haplotree.domain.tree.TreeType;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Report assembly surface consuming classification output.
 *
 * @since 0.1.0
 */
public interface HaplogroupReportPort {
  /**
   * Renders a report for one sample.
   *
   * @param treeType tree kind, used for titles and file naming
   * @param ranked ranked results, best first
   * @param tree tree the results were computed against
   * @param calls observed calls
   * @param sampleName optional sample label
   * @return location of the written artifact
   * @throws IOException when the artifact cannot be written
   */
  Path write(
      TreeType treeType,
      List<HaplogroupResult> ranked,
      HaplogroupTree tree,
      ObservedCalls calls,
      Optional<String> sampleName) throws IOException;
}
