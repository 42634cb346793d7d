package io.dcsim.shell.cli;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import org.jline.reader.Candidate;
import org.jline.reader.ParsedLine;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ShellCompleterTest {

  static class SimpleParsedLine implements ParsedLine {
    private final String line;
    private final List<String> words;
    private final int wordIndex;

    SimpleParsedLine(String line) {
      this.line = line;
      List<String> w = new ArrayList<>(Arrays.asList(line.stripLeading().split("\\s+")));
      if (line.endsWith(" ")) {
        w.add("");
      }
      this.words = Collections.unmodifiableList(w);
      this.wordIndex = words.size() - 1;
    }

    @Override
    public String word() {
      return words.get(wordIndex);
    }

    @Override
    public int wordCursor() {
      return word().length();
    }

    @Override
    public int wordIndex() {
      return wordIndex;
    }

    @Override
    public List<String> words() {
      return words;
    }

    @Override
    public String line() {
      return line;
    }

    @Override
    public int cursor() {
      return line.length();
    }
  }

  private ShellRuntime runtime;
  private ShellCompleter completer;

  @BeforeEach
  void setUp() throws Exception {
    runtime = ShellRuntime.create(ShellConfig.defaults(), new BufferIO());
    completer =
        new ShellCompleter(
            runtime.registry(), runtime.router(), runtime.scenarios(), runtime.store());
  }

  @AfterEach
  void tearDown() {
    runtime.close();
  }

  private List<String> complete(String line) {
    List<Candidate> cands = new ArrayList<>();
    completer.complete(null, new SimpleParsedLine(line), cands);
    return cands.stream().map(Candidate::value).collect(Collectors.toList());
  }

  @Test
  void suggestsCommandNames() {
    List<String> values = complete("s");
    assertTrue(values.contains("sinfo"));
    assertTrue(values.contains("squeue"));
    assertTrue(values.contains("scontrol"));
    assertTrue(values.contains("scenario"));
    assertTrue(values.contains("ssh"));
    assertTrue(values.contains("sudo"));
    assertFalse(values.contains("hostname"));
  }

  @Test
  void skipsLeadingSudo() {
    List<String> values = complete("sudo nvidia-smi -p");
    assertTrue(values.contains("-pl"));
    assertTrue(values.contains("-pm"));
  }

  @Test
  void suggestsToolFlagsAndSubcommands() {
    List<String> flags = complete("nvidia-smi --q");
    assertTrue(flags.contains("--query"));
    assertTrue(flags.contains("--query-gpu"));

    List<String> subs = complete("nvidia-smi ");
    assertTrue(subs.containsAll(List.of("nvlink", "topo", "mig")));

    assertEquals(List.of("show"), complete("scontrol sh"));
  }

  @Test
  void suggestsScenarioIdsAndModes() {
    runtime.dispatcher().execute("scenario create alpha");
    runtime.dispatcher().execute("scenario create beta");

    assertTrue(complete("scenario ").containsAll(List.of("create", "use", "reset", "export")));
    assertEquals(List.of("alpha", "beta", "none"), complete("scenario use "));
    assertEquals(List.of("alpha"), complete("scenario info a"));
    assertEquals(List.of("on", "off"), complete("scenario readonly beta "));
    assertEquals(List.of("--from"), complete("scenario create gamma --"));
  }

  @Test
  void suggestsNodesForSshAndFault() {
    List<String> nodes = complete("ssh dgx-0");
    assertEquals(8, nodes.size());
    assertTrue(nodes.contains("dgx-07"));

    assertTrue(complete("fault ").containsAll(List.of("list", "thermal", "xid-error")));
    assertTrue(complete("fault thermal dgx-0").contains("dgx-03"));
  }

  @Test
  void explainCompletesToolsThenTopics() {
    assertTrue(complete("explain nv").contains("nvidia-smi"));
    assertTrue(complete("explain nvidia-smi -").contains("-pl"));
  }
}
