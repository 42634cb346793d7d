package io.dcsim.shell.core.sim;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

class TableFormatterTest {

  @Test
  void alignsColumns() {
    String table =
        TableFormatter.format(
            List.of("NODELIST", "STATE"),
            List.of(List.of("dgx-00", "idle"), List.of("dgx-01", "drain")));

    assertEquals("NODELIST  STATE\ndgx-00    idle\ndgx-01    drain\n", table);
  }

  @Test
  void truncatesWideCells() {
    String wide = "x".repeat(60);
    String table = TableFormatter.format(List.of("A"), List.of(List.of(wide)));
    String row = table.split("\n")[1];
    assertEquals(40, row.length());
    assertTrue(row.endsWith("..."));
  }

  @Test
  void missingCellsAreBlank() {
    String table = TableFormatter.format(List.of("A", "B"), List.of(List.of("1")));
    assertEquals("A  B\n1\n", table);
  }

  @Test
  void emptyTextWhenNoRows() {
    assertEquals("No jobs\n", TableFormatter.format(List.of("JOBID"), List.of(), "No jobs"));
  }

  @Test
  void commandResultHelpers() {
    CommandResult ok = CommandResult.success(null);
    assertEquals("", ok.output());
    assertTrue(ok.isSuccess());
    assertEquals(CommandResult.USAGE, CommandResult.error("bad", CommandResult.USAGE).exitCode());
    assertEquals("dgx-01$ ", ok.withPrompt("dgx-01$ ").prompt());
    assertFalse(CommandResult.error("x").isSuccess());
  }
}
