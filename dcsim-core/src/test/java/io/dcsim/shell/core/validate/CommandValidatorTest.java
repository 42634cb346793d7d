package io.dcsim.shell.core.validate;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

class CommandValidatorTest {

  private final CommandValidator validator = new CommandValidator();

  private boolean check(String executed, String... templates) {
    return validator.validateCommandExecuted(executed, List.of(templates));
  }

  @Test
  void exactMatchIgnoresCaseAndSpacing() {
    assertTrue(check("  NVIDIA-SMI -q  ", "nvidia-smi -q"));
  }

  @Test
  void scontrolShowAcceptsPluralTargets() {
    assertTrue(check("SCONTROL SHOW NODES", "scontrol show node"));
    assertTrue(check("scontrol show partition", "scontrol show partitions"));
    assertFalse(check("scontrol show jobs", "scontrol show node"));
  }

  @Test
  void negativeGpuIdIsRejected() {
    assertFalse(check("nvidia-smi -i -1", "nvidia-smi -i -1"));
    assertFalse(check("nvidia-smi --id -0 -q", "nvidia-smi"));
  }

  @Test
  void knownInvalidInvocations() {
    assertFalse(check("nvidia-smi -gpu 0 -q", "nvidia-smi"));
    assertFalse(check("sinfo help", "sinfo"));
    assertFalse(check("scontrol help", "scontrol"));
  }

  @Test
  void pipelinesCompareSegmentBySegment() {
    assertTrue(check("nvidia-smi -q |   grep temp", "nvidia-smi -q | grep temp"));
    assertFalse(check("nvidia-smi -q | grep power", "nvidia-smi -q | grep temp"));
    assertFalse(check("nvidia-smi -q | grep temp | head", "nvidia-smi -q | grep temp"));
  }

  @Test
  void baseOnlyTemplateAcceptsAnyFlags() {
    assertTrue(check("nvidia-smi -L", "nvidia-smi"));
    assertFalse(check("nvtop", "nvidia-smi"));
  }

  @Test
  void flagValuesMustAgree() {
    assertTrue(check("nvidia-smi -i 0 -q", "nvidia-smi -q -i 0"));
    assertTrue(check("nvidia-smi -q -d TEMPERATURE -i 0", "nvidia-smi -q -i 0"));
    assertFalse(check("nvidia-smi -i 1 -q", "nvidia-smi -q -i 0"));
    assertFalse(check("nvidia-smi -L", "nvidia-smi -q"));
  }

  @Test
  void sinfoFormatFlagsAreInterchangeable() {
    assertTrue(check("sinfo -o '%n %t'", "sinfo --output-format=%N"));
    assertTrue(check("sinfo --output-format '%P'", "sinfo -o %n"));
    assertFalse(check("sinfo -N", "sinfo -o %n"));
  }

  @Test
  void shellSubstitutionsNormalize() {
    assertTrue(check("scancel $(squeue -h -o %i -u alice)", "scancel $(squeue -h -o %i)"));
    assertEquals("kill 12345", CommandValidator.normalize("KILL $(pidof slurmd)"));
  }

  @Test
  void anyTemplateMaySatisfy() {
    assertTrue(check("sinfo -N -l", "squeue", "sinfo -N"));
    assertFalse(check("sinfo"));
    assertFalse(validator.validateCommandExecuted(null, List.of("sinfo")));
  }
}
