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

import static java.nio.charset.StandardCharsets.UTF_8;
import static libdns.rfc2136.util.ResourceUtils.readResourceBytes;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Joiner;
import com.google.common.io.ByteSource;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.LogManager;
import javax.annotation.Nullable;
import libdns.rfc2136.dns.transport.DnsMessageTransport;
import libdns.rfc2136.tools.params.LoggingLevelParameter;

/**
 * Parameter delegate class to handle logging configuration for {@link Rfc2136Cli}.
 *
 * <p>Settings are appended to the bundled {@code logging.properties}, so later lines win.
 */
@Parameters(separators = " =")
final class LoggingParameters {

  private static final String TRANSPORT_LOGGER = DnsMessageTransport.class.getPackage().getName();

  @Nullable
  @Parameter(
      names = "--log_level",
      description = "Default level at which to log messages",
      validateWith = LoggingLevelParameter.class)
  private Level logLevel;

  @Parameter(
      names = "--log_exchanges",
      description = "Log every DNS exchange, including shared and truncated ones, at FINE")
  private boolean logExchanges;

  @Parameter(
      names = "--logging_configs",
      description =
          "Comma-delimited list of logging properties to add to the logging.properties file, "
              + "e.g. libdns.rfc2136.dns.level=INFO")
  private List<String> configLines = new ArrayList<>();

  private static final ByteSource DEFAULT_LOG_CONFIG =
      readResourceBytes(LoggingParameters.class, "logging.properties");

  void configureLogging() throws IOException {
    try (InputStream input = buildLogConfig().openStream()) {
      LogManager.getLogManager().readConfiguration(input);
    }
  }

  @VisibleForTesting
  ByteSource buildLogConfig() {
    List<String> overrides = new ArrayList<>();
    if (logLevel != null) {
      overrides.add(".level = " + logLevel);
    }
    if (logExchanges) {
      overrides.add(TRANSPORT_LOGGER + ".level = " + Level.FINE);
    }
    // Explicit properties go last so they override the shorthand flags above.
    overrides.addAll(configLines);
    if (overrides.isEmpty()) {
      return DEFAULT_LOG_CONFIG;
    }
    // Leading newline in case the bundled file doesn't end with one.
    String customProperties = "\n" + Joiner.on('\n').join(overrides) + "\n";
    return ByteSource.concat(
        DEFAULT_LOG_CONFIG, ByteSource.wrap(customProperties.getBytes(UTF_8)));
  }
}
