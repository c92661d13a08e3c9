// Copyright 2026 The Nomulus Authors. All Rights Reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//     http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package libdns.rfc2136.tools;

import static com.google.common.truth.Truth.assertThat;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.beust.jcommander.ParameterException;
import java.nio.file.Files;
import java.nio.file.Path;
import libdns.rfc2136.testing.FakeNameserver;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.xbill.DNS.Type;

/** End-to-end tests of {@link Rfc2136Cli} against a {@link FakeNameserver}. */
class Rfc2136CliTest {

  @TempDir Path tmpDir;

  private FakeNameserver server;
  private Rfc2136Cli cli;

  @BeforeEach
  void beforeEach() throws Exception {
    server = FakeNameserver.start("example.org.");
    cli = new Rfc2136Cli("rfc2136", Rfc2136Tool.COMMAND_MAP);
  }

  @AfterEach
  void afterEach() throws Exception {
    server.close();
  }

  @Test
  void testSuccess_appendThenDelete() throws Exception {
    cli.run(
        new String[] {
          "--nameserver", server.getAddress(),
          "append_records", "--zone", "example.org.", "--type", "TXT", "--value", "hello"
        });
    assertThat(server.getRecords("example.org.", Type.TXT)).hasSize(1);

    cli.run(
        new String[] {
          "--nameserver", server.getAddress(),
          "delete_records", "--zone", "example.org.", "--type", "TXT", "--value", "hello"
        });
    assertThat(server.getRecords("example.org.", Type.TXT)).isEmpty();
  }

  @Test
  void testSuccess_configFile() throws Exception {
    Path config = tmpDir.resolve("rfc2136.yaml");
    Files.write(
        config,
        String.format(
                "nameserver:\n"
                    + "  address: %s\n"
                    + "  protocol: TCP\n"
                    + "records:\n"
                    + "  ownerNameScope: RECORD\n",
                server.getAddress())
            .getBytes(UTF_8));

    cli.run(
        new String[] {
          "--config", config.toString(),
          "set_records", "-z", "example.org.", "-n", "www", "-t", "A", "-v", "192.0.2.1"
        });

    assertThat(server.getRecords("www.example.org.", Type.A)).hasSize(1);
    assertThat(server.getTcpRequestCount()).isEqualTo(1);
  }

  @Test
  void testFailure_unknownCommand() {
    assertThrows(ParameterException.class, () -> cli.run(new String[] {"transfer_zone"}));
  }

  @Test
  void testFailure_missingRequiredParameter() {
    assertThrows(
        ParameterException.class,
        () -> cli.run(new String[] {"--nameserver", server.getAddress(), "list_records"}));
  }

  @Test
  void testFailure_invalidLogLevel() {
    ParameterException thrown =
        assertThrows(
            ParameterException.class,
            () ->
                cli.run(
                    new String[] {
                      "--log_level", "loud", "list_records", "--zone", "example.org."
                    }));
    assertThat(thrown).hasMessageThat().contains("not a logging level");
  }
}
