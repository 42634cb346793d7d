package io.dcsim.shell;

import io.dcsim.shell.cli.CommandDispatcher;
import io.dcsim.shell.cli.ShellCompleter;
import io.dcsim.shell.cli.ShellConfig;
import io.dcsim.shell.cli.ShellRuntime;
import io.dcsim.shell.core.registry.CommandDefinitionException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.UserInterruptException;
import org.jline.reader.impl.DefaultParser;
import org.jline.reader.impl.history.DefaultHistory;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Interactive REPL over a {@link ShellRuntime}. */
public final class Shell implements AutoCloseable {
  private static final Logger LOG = LoggerFactory.getLogger(Shell.class);

  private final Terminal terminal;
  private final LineReader lineReader;
  private final ShellRuntime runtime;
  private final DefaultHistory history;
  private boolean running = true;

  public Shell(ShellConfig config) throws IOException, CommandDefinitionException {
    this.terminal = TerminalBuilder.builder().system(true).build();
    this.runtime = ShellRuntime.create(config, new TerminalIO(terminal));

    Path histPath = config.historyFile();
    try {
      Files.createDirectories(histPath.getParent());
    } catch (IOException e) {
      LOG.debug("History directory {} unavailable", histPath.getParent(), e);
    }
    this.history = new DefaultHistory();
    Map<String, Object> vars = new HashMap<>();
    vars.put(LineReader.HISTORY_FILE, histPath);

    DefaultParser parser = new DefaultParser();
    // keep backslashes and quotes for the command parser
    parser.setEscapeChars(null);
    this.lineReader =
        LineReaderBuilder.builder()
            .terminal(terminal)
            .variables(vars)
            .history(history)
            .parser(parser)
            .completer(
                new ShellCompleter(
                    runtime.registry(), runtime.router(), runtime.scenarios(), runtime.store()))
            .build();
  }

  public void run(boolean quiet) {
    if (!quiet) {
      printBanner();
    }
    CommandDispatcher dispatcher = runtime.dispatcher();

    while (running) {
      try {
        String input = lineReader.readLine(dispatcher.prompt());
        if (input == null || input.isBlank()) {
          continue;
        }
        input = input.trim();

        if ("exit".equalsIgnoreCase(input) || "quit".equalsIgnoreCase(input)) {
          running = false;
          continue;
        }
        dispatcher.dispatch(input);
      } catch (UserInterruptException e) {
        terminal.writer().println("^C");
        terminal.flush();
      } catch (EndOfFileException e) {
        terminal.writer().println();
        terminal.writer().println("logout");
        terminal.flush();
        running = false;
      } catch (RuntimeException e) {
        LOG.warn("Unexpected error handling input", e);
        terminal.writer().println("Error: " + e.getMessage());
        terminal.flush();
      }
    }
  }

  private void printBanner() {
    int nodes = runtime.store().getCluster().getNodes().size();
    terminal.writer().println("DGX cluster simulator: " + nodes + " nodes");
    terminal.writer().println("Type 'help' for commands, 'explain <command>' for details,"
        + " 'exit' to quit");
    terminal.writer().println();
    terminal.flush();
  }

  @Override
  public void close() throws IOException {
    try {
      history.save();
    } catch (IOException e) {
      LOG.warn("Failed to save history", e);
    }
    runtime.close();
    terminal.close();
  }

  /** Writes dispatcher output to the terminal. */
  private static final class TerminalIO implements CommandDispatcher.IO {
    private final Terminal terminal;

    TerminalIO(Terminal terminal) {
      this.terminal = terminal;
    }

    @Override
    public void println(String s) {
      terminal.writer().println(s);
      terminal.flush();
    }

    @Override
    public void error(String s) {
      terminal.writer().println(s);
      terminal.flush();
    }
  }
}
