package ca.gc.cra.haplotree.application.port;

import ca.gc.cra.haplotree.domain.tree.TreeDefinition;

/**
 * Parses a tree source's native payload into a build-independent {@link TreeDefinition}.
 * <p>Implementations are stateless and thread-safe.</p>
 *
 * @since 0.1.0
 */
public interface TreeFormatParser {
  /**
   * Parses {@code payload}.
   *
   * @param payload raw bytes as downloaded
   * @param nativeBuild canonical build of coordinates that carry no explicit assembly
   * @return parsed definition
   * @throws TreeParseException when the payload is not a valid tree in this format
   */
  TreeDefinition parse(byte[] payload, String nativeBuild) throws TreeParseException;
}
