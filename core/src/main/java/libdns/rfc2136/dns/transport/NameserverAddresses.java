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

package libdns.rfc2136.dns.transport;

import com.google.common.base.CharMatcher;
import com.google.common.flogger.FluentLogger;
import com.google.common.net.HostAndPort;

/** Static helpers for nameserver addresses of the form {@code host[:port]}. */
public final class NameserverAddresses {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  public static final int DEFAULT_DNS_PORT = 53;

  /**
   * Appends the default DNS port to an address that doesn't have one.
   *
   * <p>Addresses that already carry a port are returned unchanged, as are addresses that can't be
   * parsed at all; the latter fail later, when the exchange is attempted. An address with an
   * empty port, e.g. {@code ns1.example.org:}, counts as having one. Bare IPv6 literals come back
   * bracketed, e.g. {@code [2001:db8::1]:53}.
   */
  public static String normalize(String address) {
    HostAndPort hostAndPort;
    try {
      hostAndPort = HostAndPort.fromString(address);
    } catch (IllegalArgumentException e) {
      logger.atFine().withCause(e).log("Leaving unparseable nameserver address %s as is.", address);
      return address;
    }
    if (hostAndPort.hasPort() || hostAndPort.getHost().isEmpty() || hasEmptyPort(address)) {
      return address;
    }
    return HostAndPort.fromParts(hostAndPort.getHost(), DEFAULT_DNS_PORT).toString();
  }

  /** True for {@code host:} and {@code [v6]:}, but not for a bare literal like {@code fe80::}. */
  private static boolean hasEmptyPort(String address) {
    if (!address.endsWith(":")) {
      return false;
    }
    return address.startsWith("[") || CharMatcher.is(':').countIn(address) == 1;
  }

  private NameserverAddresses() {}
}
