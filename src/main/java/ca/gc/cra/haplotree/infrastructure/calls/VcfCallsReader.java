package ca.gc.cra.haplotree.infrastructure.calls;

import ca.gc.cra.haplotree.domain.classify.ObservedCalls;
import ca.gc.cra.haplotree.domain.tree.TreeType;
import htsjdk.samtools.util.CloseableIterator;
import htsjdk.tribble.TribbleException;
import htsjdk.variant.variantcontext.Allele;
import htsjdk.variant.variantcontext.Genotype;
import htsjdk.variant.variantcontext.VariantContext;
import htsjdk.variant.vcf.VCFFileReader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads observed calls from a single-sample VCF using htsjdk.
 * <p>Each record contributes {@code POS -> first allele of the first sample's genotype}. No-call genotypes and
 * sites-only records are skipped. When a {@link TreeType} is given, only records on that tree's contig
 * (for example {@code chrY} or {@code Y}) are kept.</p>
 *
 * @since 0.1.0
 */
public final class VcfCallsReader {
  private static final Logger log = LoggerFactory.getLogger(VcfCallsReader.class);
  private static final Map<TreeType, Set<String>> CONTIGS = Map.of(
      TreeType.Y_DNA, Set.of("chry", "y"),
      TreeType.MT_DNA, Set.of("chrm", "chrmt", "m", "mt"));

  /**
   * Reads every record regardless of contig.
   *
   * @param vcf VCF or bgzipped VCF path
   * @return observed calls
   * @throws IOException when the file is missing or malformed
   */
  public ObservedCalls read(Path vcf) throws IOException {
    return read(vcf, null);
  }

  /**
   * Reads records on the contig of {@code treeType}.
   *
   * @param vcf VCF or bgzipped VCF path
   * @param treeType tree kind selecting the contig; {@code null} keeps all records
   * @return observed calls
   * @throws IOException when the file is missing or malformed
   */
  public ObservedCalls read(Path vcf, TreeType treeType) throws IOException {
    Objects.requireNonNull(vcf, "vcf");
    if (!Files.isRegularFile(vcf)) {
      throw new IOException("VCF file not found: " + vcf);
    }
    Set<String> contigs = treeType == null ? null : CONTIGS.get(treeType);
    Map<Long, String> calls = new HashMap<>();
    int skipped = 0;
    try (VCFFileReader reader = new VCFFileReader(vcf, false);
         CloseableIterator<VariantContext> records = reader.iterator()) {
      while (records.hasNext()) {
        VariantContext record = records.next();
        if (contigs != null && !contigs.contains(record.getContig().toLowerCase(Locale.ROOT))) {
          continue;
        }
        String allele = firstCalledAllele(record);
        if (allele == null) {
          skipped++;
          continue;
        }
        calls.put((long) record.getStart(), allele);
      }
    } catch (TribbleException ex) {
      throw new IOException("Malformed VCF " + vcf + ": " + ex.getMessage(), ex);
    }
    log.info("Read {} calls from {} ({} no-call records skipped)", calls.size(), vcf, skipped);
    return ObservedCalls.of(calls);
  }

  private static String firstCalledAllele(VariantContext record) {
    if (!record.hasGenotypes()) {
      return null;
    }
    Genotype genotype = record.getGenotype(0);
    if (genotype == null || genotype.isNoCall() || genotype.getPloidy() == 0) {
      return null;
    }
    Allele allele = genotype.getAllele(0);
    if (allele == null || allele.isNoCall()) {
      return null;
    }
    return allele.getBaseString();
  }
}
