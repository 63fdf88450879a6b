package ca.gc.cra.haplotree.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.haplotree.logging.LoggingConfigurator;
import java.io.PrintWriter;
import java.io.StringWriter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MainTest {
  private StringWriter buffer;
  private String rootLevel;

  @BeforeEach
  void setUp() {
    rootLevel = LoggingConfigurator.rootLevel();
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
  }

  @AfterEach
  void tearDown() {
    LoggingConfigurator.setRootLevel(rootLevel);
    CliPrinter.clearTestWriter();
  }

  @Test
  void noArgumentsIsInvalid() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[0]));
    assertTrue(buffer.toString().contains("usage: haplotree"));
  }

  @Test
  void unknownCommandIsInvalid() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"capture"}));
    assertTrue(buffer.toString().contains("usage: haplotree"));
  }

  @Test
  void helpFlagPrintsCommands() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"--help"}));
    assertTrue(buffer.toString().contains("classify"));
    assertTrue(buffer.toString().contains("sources"));
  }

  @Test
  void sourcesCommandListsBuiltInSources() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"sources"}));
    String printed = buffer.toString();
    assertTrue(printed.contains("ftdna-ytree"));
    assertTrue(printed.contains("ftdna-mttree"));
    assertTrue(printed.contains("decodingus-ytree"));
    assertTrue(printed.contains("GRCh37"));
  }

  @Test
  void sourcesRejectsArguments() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"sources", "id=x"}));
    assertTrue(buffer.toString().contains("usage: sources"));
  }

  @Test
  void verboseFlagIsStrippedBeforeDispatch() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"--verbose", "sources"}));
    assertTrue(buffer.toString().contains("ftdna-ytree"));
    assertEquals("DEBUG", LoggingConfigurator.rootLevel());
  }
}
