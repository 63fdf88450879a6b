package ca.gc.cra.haplotree.application.tree;

import ca.gc.cra.haplotree.application.port.FetchException;
import ca.gc.cra.haplotree.application.port.MetricsPort;
import ca.gc.cra.haplotree.application.port.ParsedTreeCache;
import ca.gc.cra.haplotree.application.port.RawTreeStore;
import ca.gc.cra.haplotree.application.port.TreeCacheKey;
import ca.gc.cra.haplotree.application.port.TreeFormatParser;
import ca.gc.cra.haplotree.application.port.TreeParseException;
import ca.gc.cra.haplotree.application.port.TreeSourceFetcher;
import ca.gc.cra.haplotree.domain.tree.CoordinateReconciler;
import ca.gc.cra.haplotree.domain.tree.HaplogroupTree;
import ca.gc.cra.haplotree.domain.tree.ReferenceBuilds;
import ca.gc.cra.haplotree.domain.tree.TreeAssembler;
import ca.gc.cra.haplotree.domain.tree.TreeDefinition;
import java.io.IOException;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Produces immutable haplogroup trees for a (source, reference build) pair.
 * <p><strong>Why:</strong> Tree payloads are large; repeated classifications must not re-download or re-parse
 * them. The provider consults the parsed-tree cache, then the raw payload store, and only then the network.</p>
 * <p><strong>Role:</strong> Application service between the classification use case and the fetch, store,
 * cache and parser ports.</p>
 * <p><strong>Thread-safety:</strong> Safe for concurrent use when the injected ports are. Concurrent loads of the
 * same key may each parse; the last cache write wins.</p>
 * <p><strong>Observability:</strong> Sets MDC key {@code treeSource} while loading; emits
 * {@code tree.cache.*}, {@code tree.fetch.*}, {@code tree.parse.*} and {@code tree.reconcile.dropped}.</p>
 *
 * @since 0.1.0
 */
public final class TreeProvider {
  private static final Logger log = LoggerFactory.getLogger(TreeProvider.class);
  private static final String MDC_KEY = "treeSource";

  private final Map<String, TreeSource> sources;
  private final Map<TreeFormat, TreeFormatParser> parsers;
  private final ParsedTreeCache parsedCache;
  private final RawTreeStore rawStore;
  private final TreeSourceFetcher fetcher;
  private final MetricsPort metrics;

  /**
   * Creates a provider.
   *
   * @param sources known tree sources; ids must be unique
   * @param parsers parser per payload format; every source format must be covered
   * @param parsedCache in-memory tier
   * @param rawStore durable payload tier
   * @param fetcher network fetcher
   * @param metrics metrics sink; {@link MetricsPort#NO_OP} when metrics are disabled
   * @throws IllegalArgumentException if ids repeat or a source format has no parser
   */
  public TreeProvider(
      Collection<TreeSource> sources,
      Map<TreeFormat, TreeFormatParser> parsers,
      ParsedTreeCache parsedCache,
      RawTreeStore rawStore,
      TreeSourceFetcher fetcher,
      MetricsPort metrics) {
    Objects.requireNonNull(sources, "sources");
    Objects.requireNonNull(parsers, "parsers");
    this.parsers = new EnumMap<>(parsers);
    Map<String, TreeSource> byId = new LinkedHashMap<>();
    for (TreeSource source : sources) {
      if (byId.putIfAbsent(source.id(), source) != null) {
        throw new IllegalArgumentException("duplicate tree source id: " + source.id());
      }
      if (!this.parsers.containsKey(source.format())) {
        throw new IllegalArgumentException(
            "no parser registered for format " + source.format() + " (source " + source.id() + ")");
      }
    }
    this.sources = Map.copyOf(byId);
    this.parsedCache = Objects.requireNonNull(parsedCache, "parsedCache");
    this.rawStore = Objects.requireNonNull(rawStore, "rawStore");
    this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  /**
   * Looks up a configured source.
   *
   * @param sourceId source identifier
   * @return source when known
   */
  public Optional<TreeSource> source(String sourceId) {
    return Optional.ofNullable(sources.get(sourceId));
  }

  /**
   * Returns the configured source ids in sorted order.
   *
   * @return source ids
   */
  public List<String> sourceIds() {
    return sources.keySet().stream().sorted().toList();
  }

  /**
   * Loads the tree for {@code sourceId} reconciled to {@code targetBuild}.
   *
   * @param sourceId configured source id
   * @param targetBuild reference build name, accession or alias
   * @return success with the tree, or a fetch/parse failure
   * @throws IllegalArgumentException if the source id is unknown or the build is blank
   */
  public TreeLoadResult loadTree(String sourceId, String targetBuild) {
    Objects.requireNonNull(sourceId, "sourceId");
    TreeSource source = sources.get(sourceId);
    if (source == null) {
      throw new IllegalArgumentException(
          "unknown tree source '" + sourceId + "'; known sources: " + sourceIds());
    }
    String build = ReferenceBuilds.canonical(targetBuild);
    TreeCacheKey key = new TreeCacheKey(source.id(), build);

    String previous = MDC.get(MDC_KEY);
    try {
      MDC.put(MDC_KEY, source.id());
      return load(source, key);
    } finally {
      if (previous == null) {
        MDC.remove(MDC_KEY);
      } else {
        MDC.put(MDC_KEY, previous);
      }
    }
  }

  /**
   * Drops every parsed tree held in memory. The durable payload store is untouched.
   */
  public void clearParsedCache() {
    parsedCache.clear();
  }

  private TreeLoadResult load(TreeSource source, TreeCacheKey key) {
    Optional<HaplogroupTree> cached = parsedCache.get(key);
    if (cached.isPresent()) {
      metrics.increment("tree.cache.memory.hit");
      log.debug("Parsed tree cache hit for {} at {}", key.sourceId(), key.build());
      return TreeLoadResult.success(cached.get());
    }
    metrics.increment("tree.cache.memory.miss");

    if (!source.supports(key.build())) {
      log.warn("Tree source {} does not publish {} coordinates; unmatched markers will be dropped",
          source.id(), key.build());
    }

    Optional<byte[]> stored = readStored(source);
    if (stored.isPresent()) {
      metrics.increment("tree.cache.disk.hit");
      log.debug("Raw tree cache hit for {} ({} bytes)", source.id(), stored.get().length);
      return parseAndCache(source, key, stored.get());
    }
    metrics.increment("tree.cache.disk.miss");

    byte[] payload;
    try {
      log.info("Downloading tree {} from {}", source.id(), source.url());
      payload = fetcher.fetch(source.url());
    } catch (FetchException ex) {
      metrics.increment("tree.fetch.failure");
      log.error("Failed to download tree {} from {}: {}", source.id(), source.url(), ex.getMessage());
      return TreeLoadResult.failure(new TreeLoadError(
          TreeLoadError.Kind.FETCH_FAILURE, source.id(), source.url(), ex.getMessage(), ex));
    }
    metrics.increment("tree.fetch.success");
    metrics.observe("tree.fetch.bytes", payload.length);
    log.info("Downloaded tree {} ({} bytes)", source.id(), payload.length);
    store(source, payload);
    return parseAndCache(source, key, payload);
  }

  private Optional<byte[]> readStored(TreeSource source) {
    try {
      return rawStore.get(source.cacheKey());
    } catch (IOException ex) {
      metrics.increment("tree.cache.disk.error");
      log.warn("Unable to read cached tree payload for {}; treating as a miss", source.id(), ex);
      return Optional.empty();
    }
  }

  private void store(TreeSource source, byte[] payload) {
    try {
      rawStore.put(source.cacheKey(), payload);
    } catch (IOException ex) {
      metrics.increment("tree.cache.disk.error");
      log.warn("Unable to cache tree payload for {}; continuing without a durable copy", source.id(), ex);
    }
  }

  private TreeLoadResult parseAndCache(TreeSource source, TreeCacheKey key, byte[] payload) {
    long start = System.nanoTime();
    TreeDefinition definition;
    TreeAssembler.Assembly assembly;
    try {
      definition = parsers.get(source.format()).parse(payload, source.nativeBuild());
      TreeAssembler assembler = new TreeAssembler(
          new CoordinateReconciler(source.nativeBuild(), source.nativeEquivalents()));
      assembly = assembler.assemble(definition, key.build());
    } catch (TreeParseException | IllegalArgumentException ex) {
      metrics.increment("tree.parse.failure");
      log.error("Failed to parse tree {}: {}", source.id(), ex.getMessage());
      return TreeLoadResult.failure(new TreeLoadError(
          TreeLoadError.Kind.PARSE_FAILURE, source.id(), source.url(), ex.getMessage(), ex));
    }
    metrics.observe("tree.parse.latencyNanos", System.nanoTime() - start);

    if (assembly.droppedMarkers() > 0) {
      metrics.observe("tree.reconcile.dropped", assembly.droppedMarkers());
      log.warn("Dropped {} of {} markers of tree {} with no {} coordinate",
          assembly.droppedMarkers(), definition.markerCount(), source.id(), key.build());
    }
    HaplogroupTree tree = assembly.tree();
    parsedCache.put(key, tree);
    log.info("Loaded tree {} for {}: {} nodes", source.id(), key.build(), tree.size());
    return TreeLoadResult.success(tree);
  }
}
