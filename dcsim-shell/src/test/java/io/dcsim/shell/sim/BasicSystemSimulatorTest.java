package io.dcsim.shell.sim;

import static org.junit.jupiter.api.Assertions.*;

import io.dcsim.shell.cli.BufferIO;
import io.dcsim.shell.cli.ShellConfig;
import io.dcsim.shell.cli.ShellRuntime;
import io.dcsim.shell.core.sim.CommandResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class BasicSystemSimulatorTest {

  private ShellRuntime runtime;

  @BeforeEach
  void setUp() throws Exception {
    runtime = ShellRuntime.create(ShellConfig.defaults(), new BufferIO());
  }

  @AfterEach
  void tearDown() {
    runtime.close();
  }

  private String out(String line) {
    CommandResult result = runtime.dispatcher().execute(line);
    assertTrue(result.isSuccess(), line + " -> " + result.output());
    return result.output();
  }

  @Test
  void hostnameVariants() {
    assertEquals("dgx-00", out("hostname"));
    assertEquals("dgx-00.cluster.local", out("hostname -f"));
    assertEquals("dgx-00", out("hostname -s"));
    assertEquals("10.10.0.11", out("hostname -i"));

    out("ssh dgx-03");
    assertEquals("10.10.0.14", out("hostname -i"));
  }

  @Test
  void unameFields() {
    assertEquals("Linux", out("uname"));
    assertEquals("5.15.0-1042-nvidia", out("uname -r"));
    assertEquals("dgx-00 x86_64", out("uname -n -m"));
    assertEquals(
        "Linux dgx-00 5.15.0-1042-nvidia #48-Ubuntu SMP Tue Nov 14 18:57:07 UTC 2023"
            + " x86_64 x86_64 x86_64 GNU/Linux",
        out("uname -a"));
  }

  @Test
  void whoamiFollowsPrivilege() throws Exception {
    assertEquals("admin", out("whoami"));
    assertEquals("root", out("sudo whoami"));

    try (ShellRuntime rootShell =
        ShellRuntime.create(ShellConfig.builder().root(true).build(), new BufferIO())) {
      assertEquals("root", rootShell.dispatcher().execute("whoami").output());
    }
  }

  @Test
  void versionFlag() {
    assertEquals("hostname (GNU coreutils) 8.32", out("hostname --version"));
  }

  @Test
  void dmesgStartsWithBootBanner() {
    String[] lines = out("dmesg").split("\n");
    assertEquals("[    0.000000] Linux version 5.15.0-1042-nvidia (buildd@lcy02-amd64-011) "
        + "#48-Ubuntu SMP Tue Nov 14 18:57:07 UTC 2023", lines[0]);
    assertTrue(lines[lines.length - 1].endsWith("mlx5_core mlx5_7: Port 1 link active"));
  }

  @Test
  void dmesgReportsXidAndNvLinkFaults() {
    out("fault xid-error dgx-00 0 --xid 79");
    out("fault nvlink-failure dgx-00 1 --link 5");
    String log = out("dmesg");
    assertTrue(log.contains("NVRM: Xid (PCI:0000:18:00): 79, pid='<unknown>', name=<unknown>, "));
    assertTrue(log.contains("NVRM: GPU 00000000:28:00.0: NVLink link 5 is down"));

    String[] lines = log.split("\n");
    assertTrue(lines[lines.length - 1].contains("Xid (PCI:0000:18:00): 79"));
  }

  @Test
  void dmesgHumanTimestamps() {
    String first = out("dmesg -T").split("\n")[0];
    assertEquals("[Mon Jan 15 08:00:00 2024] Linux version 5.15.0-1042-nvidia"
        + " (buildd@lcy02-amd64-011) #48-Ubuntu SMP Tue Nov 14 18:57:07 UTC 2023", first);
  }

  @Test
  void kernelPciDropsDomainPrefixAndFunction() {
    assertEquals("0000:18:00", BasicSystemSimulator.kernelPci("00000000:18:00.0"));
    assertEquals("0000:28:00", BasicSystemSimulator.kernelPci("0000:28:00.0"));
  }
}
