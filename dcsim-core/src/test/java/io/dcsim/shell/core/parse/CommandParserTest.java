package io.dcsim.shell.core.parse;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

class CommandParserTest {

  private final CommandParser parser = new CommandParser();

  @Test
  void mixedFlagsAndPositionals() {
    ParsedCommand cmd = parser.parse("cmd --flag value -xyz pos1 pos2");

    assertEquals("cmd", cmd.baseCommand());
    assertEquals("value", cmd.flags().get("flag"));
    assertEquals(Boolean.TRUE, cmd.flags().get("x"));
    assertEquals(Boolean.TRUE, cmd.flags().get("y"));
    assertEquals(Boolean.TRUE, cmd.flags().get("z"));
    assertEquals(List.of("pos1", "pos2"), cmd.positionalArgs());
    assertTrue(cmd.subcommands().isEmpty());
    assertFalse(cmd.isPiped());
    assertTrue(cmd.pipedSegments().isEmpty());
  }

  @Test
  void subcommandsAreBareWordsBeforeFirstFlag() {
    ParsedCommand cmd = parser.parse("scontrol show node dgx-01 --details");

    assertEquals(List.of("show", "node", "dgx-01"), cmd.subcommands());
    assertEquals(List.of("show", "node", "dgx-01"), cmd.positionalArgs());
    assertEquals(Boolean.TRUE, cmd.flags().get("details"));
    assertEquals("show", cmd.subcommand(0).orElseThrow());
    assertTrue(cmd.subcommand(3).isEmpty());
  }

  @Test
  void subcommandsAreAlsoTheLeadingPositionals() {
    ParsedCommand cmd = parser.parse("fault xid-error dgx-00 0 --xid 79 trailing");

    assertEquals(List.of("xid-error", "dgx-00", "0"), cmd.subcommands());
    assertEquals(List.of("xid-error", "dgx-00", "0", "trailing"), cmd.positionalArgs());
    assertEquals("dgx-00", cmd.positional(1).orElseThrow());
    assertEquals("trailing", cmd.positional(3).orElseThrow());
  }

  @Test
  void equalsFormSetsValueWithoutConsuming() {
    ParsedCommand cmd =
        parser.parse("nvidia-smi --query-gpu=name,temperature.gpu --format=csv extra");

    assertEquals("name,temperature.gpu", cmd.flagValue("query-gpu").orElseThrow());
    assertEquals("csv", cmd.flagValue("format").orElseThrow());
    assertEquals(List.of("extra"), cmd.positionalArgs());
  }

  @Test
  void shortFlagConsumesValue() {
    ParsedCommand cmd = parser.parse("nvidia-smi -i 0 -q");

    assertEquals("0", cmd.flagValue("i", "id").orElseThrow());
    assertEquals(Boolean.TRUE, cmd.flags().get("q"));
    assertTrue(cmd.positionalArgs().isEmpty());
  }

  @Test
  void negativeNumberIsAValueNotAFlag() {
    ParsedCommand cmd = parser.parse("nvidia-smi -i -1");

    assertEquals("-1", cmd.flags().get("i"));
    assertFalse(cmd.hasFlag("1"));
  }

  @Test
  void flagBeforeFlagIsBoolean() {
    ParsedCommand cmd = parser.parse("sinfo --long -N");

    assertEquals(Boolean.TRUE, cmd.flags().get("long"));
    assertEquals(Boolean.TRUE, cmd.flags().get("N"));
  }

  @Test
  void compoundShortFlagNeedsVocabulary() {
    ParsedCommand plain = parser.parse("nvidia-smi -pl 300");
    assertEquals(Boolean.TRUE, plain.flags().get("p"));
    assertEquals(Boolean.TRUE, plain.flags().get("l"));
    assertEquals(List.of("300"), plain.positionalArgs());

    CommandParser aware =
        new CommandParser((command, name) -> command.equals("nvidia-smi") && name.equals("pl"));
    ParsedCommand compound = aware.parse("nvidia-smi -pl 300");
    assertEquals("300", compound.flagValue("pl").orElseThrow());
    assertFalse(compound.hasFlag("p", "l"));
    assertTrue(compound.positionalArgs().isEmpty());
  }

  @Test
  void doubleDashEndsOptions() {
    ParsedCommand cmd = parser.parse("grep -i -- -v file");

    assertEquals(List.of("-v", "file"), cmd.positionalArgs());
    assertFalse(cmd.hasFlag("v"));
  }

  @Test
  void quotesGroupWordsAndAreRemoved() {
    ParsedCommand cmd = parser.parse("scontrol update nodename=dgx-01 reason=\"bad gpu\"");

    assertEquals(List.of("update", "nodename=dgx-01", "reason=bad gpu"), cmd.positionalArgs());
    assertEquals(
        List.of("sinfo", "-o", "%N %T"), CommandParser.tokenize("sinfo -o '%N %T'"));
  }

  @Test
  void pipesSplitSegments() {
    ParsedCommand cmd = parser.parse("nvidia-smi -q | grep -i temp | head -5");

    assertTrue(cmd.isPiped());
    assertEquals(List.of("nvidia-smi -q", "grep -i temp", "head -5"), cmd.pipedSegments());
    assertEquals("nvidia-smi", cmd.baseCommand());
    assertEquals(Boolean.TRUE, cmd.flags().get("q"));
    assertFalse(cmd.hasFlag("i"));
    assertEquals("nvidia-smi -q", cmd.firstSegment());
  }

  @Test
  void quotedPipeIsNotASeparator() {
    ParsedCommand cmd = parser.parse("echo 'a|b'");

    assertFalse(cmd.isPiped());
    assertEquals(List.of("a|b"), cmd.positionalArgs());
  }

  @Test
  void blankLineParsesToEmptyCommand() {
    ParsedCommand cmd = parser.parse("   ");

    assertEquals("", cmd.baseCommand());
    assertTrue(cmd.flags().isEmpty());
    assertTrue(cmd.positionalArgs().isEmpty());
    assertEquals("", parser.parse(null).raw());
  }

  @Test
  void flagShape() {
    assertTrue(CommandParser.isFlagShaped("-q"));
    assertTrue(CommandParser.isFlagShaped("--query"));
    assertFalse(CommandParser.isFlagShaped("-"));
    assertFalse(CommandParser.isFlagShaped("-3"));
    assertFalse(CommandParser.isFlagShaped("-0.5"));
    assertFalse(CommandParser.isFlagShaped("value"));
  }

  @Test
  void parsedCommandIsImmutable() {
    ParsedCommand cmd = parser.parse("sinfo -N");
    assertThrows(UnsupportedOperationException.class, () -> cmd.flags().put("x", true));
    assertThrows(UnsupportedOperationException.class, () -> cmd.positionalArgs().add("x"));
  }
}
