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

import static libdns.rfc2136.tools.Injector.injectReflectively;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.beust.jcommander.Parameters;
import com.beust.jcommander.ParametersDelegate;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Iterables;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import javax.annotation.Nullable;
import libdns.rfc2136.config.Rfc2136Config;
import libdns.rfc2136.config.Rfc2136ConfigSettings;
import libdns.rfc2136.tools.params.ParameterFactory;

/** Container class to parse the global flags and run one command against a nameserver. */
@Parameters(separators = " =", commandDescription = "Command-line interface to an RFC 2136 server")
final class Rfc2136Cli {

  @Nullable
  @Parameter(
      names = {"-c", "--config"},
      description = "YAML file overriding settings of the default configuration")
  private Path configFile;

  @Nullable
  @Parameter(
      names = {"-s", "--nameserver"},
      description = "Nameserver address as host[:port]; overrides nameserver.address")
  private String nameserver;

  // Do not make this final - compile-time constant inlining may interfere with JCommander.
  @ParametersDelegate
  private LoggingParameters loggingParams = new LoggingParameters();

  private final String programName;
  private final ImmutableMap<String, ? extends Class<? extends Command>> commands;

  Rfc2136Cli(
      String programName, ImmutableMap<String, ? extends Class<? extends Command>> commands) {
    this.programName = programName;
    this.commands = commands;
  }

  void run(String[] args) throws Exception {
    JCommander jcommander = new JCommander(this);
    jcommander.addConverterFactory(new ParameterFactory());
    jcommander.setProgramName(programName);

    // JCommander mutates command instances, so fresh ones are created for every run.
    try {
      for (Map.Entry<String, ? extends Class<? extends Command>> entry : commands.entrySet()) {
        Command command = entry.getValue().getDeclaredConstructor().newInstance();
        jcommander.addCommand(entry.getKey(), command);
      }
    } catch (ReflectiveOperationException e) {
      throw new IllegalStateException("Unable to instantiate commands", e);
    }

    try {
      jcommander.parse(args);
    } catch (ParameterException e) {
      if (jcommander.getParsedCommand() != null) {
        jcommander.usage(jcommander.getParsedCommand());
      }
      throw e;
    }
    String parsedCommand = jcommander.getParsedCommand();
    if (parsedCommand == null) {
      System.out.println("The list of available subcommands is:");
      commands.keySet().forEach(System.out::println);
      return;
    }
    loggingParams.configureLogging(); // Must be called after parameters are parsed.

    Rfc2136ConfigSettings settings =
        Rfc2136Config.getConfigSettings(Optional.ofNullable(configFile));
    if (nameserver != null) {
      settings.nameserver.address = nameserver;
    }
    Rfc2136ToolComponent component = DaggerRfc2136ToolComponent.builder().config(settings).build();

    // JCommander stores sub-commands as nested JCommander objects; the command object is the
    // only one in its wrapper.
    Command command =
        (Command)
            Iterables.getOnlyElement(jcommander.getCommands().get(parsedCommand).getObjects());
    injectReflectively(Rfc2136ToolComponent.class, component, command);
    command.run();
  }
}
