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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Strings.isNullOrEmpty;

import com.google.common.flogger.FluentLogger;
import com.google.common.io.BaseEncoding;
import java.util.Optional;
import javax.annotation.Nullable;
import org.xbill.DNS.Message;
import org.xbill.DNS.Name;
import org.xbill.DNS.Rcode;
import org.xbill.DNS.TSIG;
import org.xbill.DNS.TextParseException;

/**
 * Signs outgoing messages and verifies replies with a shared TSIG key (RFC 8945).
 *
 * <p>Messages are stamped with the current time and a fudge of {@value #FUDGE_SECONDS} seconds.
 */
public final class TsigAuthenticator {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  /** Algorithm used when none is configured. */
  public static final String DEFAULT_ALGORITHM = "hmac-sha256";

  /** Permitted clock skew between client and server; this is also dnsjava's default. */
  public static final int FUDGE_SECONDS = 300;

  private final Name keyName;
  private final Name algorithm;
  private final TSIG tsig;

  private TsigAuthenticator(Name keyName, Name algorithm, byte[] secret) {
    this.keyName = keyName;
    this.algorithm = algorithm;
    this.tsig = new TSIG(algorithm, keyName, secret);
  }

  /**
   * Returns an authenticator for the given key, or empty if the key name or secret is missing.
   *
   * <p>The key name and algorithm are made absolute. A missing algorithm defaults to {@value
   * #DEFAULT_ALGORITHM}.
   *
   * @throws IllegalArgumentException if the algorithm is unknown, or a name or the base64 secret
   *     is malformed
   */
  public static Optional<TsigAuthenticator> create(
      @Nullable String keyName, @Nullable String algorithm, @Nullable String secret) {
    if (isNullOrEmpty(keyName) || isNullOrEmpty(secret)) {
      logger.atFine().log("No TSIG key configured; messages won't be signed.");
      return Optional.empty();
    }
    Name algorithmName = absoluteName(isNullOrEmpty(algorithm) ? DEFAULT_ALGORITHM : algorithm);
    return Optional.of(
        new TsigAuthenticator(absoluteName(keyName), algorithmName, decodeSecret(secret)));
  }

  public Name getKeyName() {
    return keyName;
  }

  public Name getAlgorithm() {
    return algorithm;
  }

  /** Appends a TSIG record to the additional section of {@code message}. */
  public void sign(Message message) {
    tsig.apply(message, null);
  }

  /**
   * Verifies a reply to a request previously passed to {@link #sign}.
   *
   * <p>Servers may answer a signed request without a signature (e.g. when they reject the key),
   * so an unsigned reply is accepted with a warning and left to the response code check.
   *
   * @param reply the parsed reply
   * @param replyBytes the reply exactly as received
   * @param request the signed request
   * @param nameserver the address the reply came from, for error messages
   */
  public void verify(Message reply, byte[] replyBytes, Message request, String nameserver)
      throws TsigVerificationException {
    if (reply.getTSIG() == null) {
      logger.atWarning().log(
          "Unsigned reply from %s to a request signed with key %s (rcode %s).",
          nameserver, keyName, Rcode.string(reply.getRcode()));
      return;
    }
    int error = tsig.verify(reply, replyBytes, request.getTSIG());
    if (error != Rcode.NOERROR) {
      throw new TsigVerificationException(nameserver, error);
    }
  }

  /** Decodes the secret, which must be padded base64 as written by {@code tsig-keygen}. */
  private static byte[] decodeSecret(String secret) {
    byte[] decoded;
    try {
      decoded = BaseEncoding.base64().decode(secret);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("TSIG secret is not valid base64", e);
    }
    checkArgument(
        BaseEncoding.base64().encode(decoded).equals(secret),
        "TSIG secret is not canonical padded base64");
    return decoded;
  }

  private static Name absoluteName(String name) {
    try {
      return Name.fromString(name, Name.root);
    } catch (TextParseException e) {
      throw new IllegalArgumentException(
          String.format("Invalid TSIG name '%s': %s", name, e.getMessage()), e);
    }
  }
}
