package ca.gc.cra.haplotree.application.tree;

import ca.gc.cra.haplotree.domain.tree.TreeType;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.zip.CRC32;

/**
 * <strong>What:</strong> Configuration record describing one downloadable haplogroup tree.
 * <p><strong>Why:</strong> Source-specific behaviour lives in data handed to a single generic
 * {@link TreeProvider} instead of one provider class per source.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param id stable identifier
 * @param type tree kind
 * @param url download location
 * @param format payload format
 * @param nativeBuild canonical build of coordinates that carry no explicit assembly
 * @param supportedBuilds builds the tree can be reconciled to
 * @param nativeEquivalents builds sharing the native coordinate system
 * @since 0.1.0
 */
public record TreeSource(
    String id,
    TreeType type,
    URI url,
    TreeFormat format,
    String nativeBuild,
    Set<String> supportedBuilds,
    Set<String> nativeEquivalents) {

  /**
   * Validates the record.
   *
   * @throws IllegalArgumentException if the id is blank
   */
  public TreeSource {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(url, "url");
    Objects.requireNonNull(format, "format");
    Objects.requireNonNull(nativeBuild, "nativeBuild");
    if (id.isBlank()) {
      throw new IllegalArgumentException("tree source id must not be blank");
    }
    supportedBuilds = supportedBuilds == null ? Set.of(nativeBuild) : Set.copyOf(supportedBuilds);
    nativeEquivalents = nativeEquivalents == null ? Set.of() : Set.copyOf(nativeEquivalents);
  }

  /**
   * Returns a copy pointing at a different download location.
   *
   * @param newUrl replacement URL
   * @return updated source
   */
  public TreeSource withUrl(URI newUrl) {
    return new TreeSource(id, type, newUrl, format, nativeBuild, supportedBuilds, nativeEquivalents);
  }

  /**
   * Returns the raw payload cache key: the id followed by a checksum of the download URL, so a payload
   * fetched from one URL is never served after the source is pointed elsewhere.
   *
   * @return key of the form {@code <id>-<8 hex digits>}
   */
  public String cacheKey() {
    CRC32 crc = new CRC32();
    crc.update(url.toString().getBytes(StandardCharsets.UTF_8));
    return id + "-" + String.format(Locale.ROOT, "%08x", crc.getValue());
  }

  /**
   * Indicates whether {@code build} is one the tree can be served for.
   *
   * @param build canonical build name
   * @return {@code true} when supported
   */
  public boolean supports(String build) {
    return supportedBuilds.contains(build) || nativeEquivalents.contains(build);
  }
}
