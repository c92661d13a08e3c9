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

package libdns.rfc2136.config;

import static com.google.common.base.Preconditions.checkArgument;
import static java.lang.annotation.RetentionPolicy.RUNTIME;
import static libdns.rfc2136.util.ResourceUtils.readFileUtf8;
import static libdns.rfc2136.util.ResourceUtils.readResourceUtf8;

import com.google.common.base.Ascii;
import com.google.common.base.Enums;
import com.google.common.base.Strings;
import dagger.Module;
import dagger.Provides;
import java.io.IOException;
import java.lang.annotation.Documented;
import java.lang.annotation.Retention;
import java.nio.file.Path;
import java.util.Optional;
import javax.annotation.Nullable;
import javax.inject.Qualifier;
import libdns.rfc2136.dns.OwnerNameScope;
import libdns.rfc2136.dns.transport.TransportProtocol;
import libdns.rfc2136.util.YamlUtils;
import org.joda.time.Duration;

/**
 * Central clearing-house for the provider's configuration.
 *
 * <p>Settings are read from {@code files/default-config.yaml} in this package, optionally
 * overridden by an operator-supplied YAML file that only needs to name the settings it changes.
 */
public final class Rfc2136Config {

  private static final String YAML_CONFIG_DEFAULT =
      readResourceUtf8(Rfc2136Config.class, "files/default-config.yaml");

  /** Dagger qualifier for configuration settings. */
  @Qualifier
  @Retention(RUNTIME)
  @Documented
  public @interface Config {
    String value() default "";
  }

  /** Returns the default settings. */
  public static Rfc2136ConfigSettings getConfigSettings() {
    return getConfigSettings("");
  }

  /** Returns the default settings merged with the given YAML document. */
  public static Rfc2136ConfigSettings getConfigSettings(String overrideYaml) {
    return YamlUtils.getConfigSettings(
        YAML_CONFIG_DEFAULT, overrideYaml, Rfc2136ConfigSettings.class);
  }

  /** Returns the default settings merged with the YAML file at {@code overrideFile}, if any. */
  public static Rfc2136ConfigSettings getConfigSettings(Optional<Path> overrideFile)
      throws IOException {
    return getConfigSettings(overrideFile.isPresent() ? readFileUtf8(overrideFile.get()) : "");
  }

  /** Dagger module for providing configuration settings. */
  @Module
  public static final class ConfigModule {

    /** The {@code host[:port]} address of the nameserver; port 53 is assumed when omitted. */
    @Provides
    @Config("nameserverAddress")
    public static String provideNameserverAddress(Rfc2136ConfigSettings config) {
      checkArgument(
          !Strings.isNullOrEmpty(config.nameserver.address),
          "nameserver.address must be configured");
      return config.nameserver.address;
    }

    @Provides
    @Config("transportProtocol")
    public static TransportProtocol provideTransportProtocol(Rfc2136ConfigSettings config) {
      return parseEnum(TransportProtocol.class, "nameserver.protocol", config.nameserver.protocol);
    }

    /**
     * How long a single exchange (including any TCP retry) may take before it's abandoned.
     *
     * @see libdns.rfc2136.dns.transport.DnsMessageTransport
     */
    @Provides
    @Config("exchangeTimeout")
    public static Duration provideExchangeTimeout(Rfc2136ConfigSettings config) {
      checkArgument(
          config.nameserver.exchangeTimeoutSeconds > 0,
          "nameserver.exchangeTimeoutSeconds must be positive, was %s",
          config.nameserver.exchangeTimeoutSeconds);
      return Duration.standardSeconds(config.nameserver.exchangeTimeoutSeconds);
    }

    @Provides
    @Config("tsigKeyName")
    @Nullable
    public static String provideTsigKeyName(Rfc2136ConfigSettings config) {
      return config.tsig.keyName;
    }

    @Provides
    @Config("tsigAlgorithm")
    @Nullable
    public static String provideTsigAlgorithm(Rfc2136ConfigSettings config) {
      return config.tsig.algorithm;
    }

    /** The base64-encoded shared secret. */
    @Provides
    @Config("tsigSecret")
    @Nullable
    public static String provideTsigSecret(Rfc2136ConfigSettings config) {
      return config.tsig.secret;
    }

    @Provides
    public static OwnerNameScope provideOwnerNameScope(Rfc2136ConfigSettings config) {
      return parseEnum(
          OwnerNameScope.class, "records.ownerNameScope", config.records.ownerNameScope);
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> clazz, String key, String value) {
      checkArgument(value != null, "%s must be configured", key);
      return Enums.getIfPresent(clazz, Ascii.toUpperCase(value.trim()))
          .toJavaUtil()
          .orElseThrow(
              () -> new IllegalArgumentException(String.format("Invalid %s: %s", key, value)));
    }

    private ConfigModule() {}
  }

  private Rfc2136Config() {}
}
