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

import static com.google.common.base.Preconditions.checkNotNull;
import static java.util.concurrent.TimeUnit.MILLISECONDS;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Throwables;
import com.google.common.flogger.FluentLogger;
import com.google.common.io.BaseEncoding;
import com.google.common.net.HostAndPort;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.SettableFuture;
import com.google.common.util.concurrent.TimeLimiter;
import com.google.common.util.concurrent.UncheckedExecutionException;
import java.io.EOFException;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.DatagramChannel;
import java.nio.channels.SocketChannel;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import javax.annotation.concurrent.ThreadSafe;
import javax.inject.Inject;
import javax.inject.Singleton;
import libdns.rfc2136.config.Rfc2136Config.Config;
import org.joda.time.Duration;
import org.xbill.DNS.Flags;
import org.xbill.DNS.Message;
import org.xbill.DNS.Rcode;

/**
 * Sends a DNS message to a nameserver and returns its reply.
 *
 * <p>Each exchange runs under a deadline. Blocking happens on interruptible NIO channels, so an
 * expired deadline or an interrupt of the calling thread closes the socket and abandons the
 * exchange.
 *
 * <p>Identical messages sent to the same nameserver while one of them is still in flight share a
 * single exchange and its reply. Messages are considered identical when their wire forms match
 * apart from the message ID.
 */
@Singleton
@ThreadSafe
public class DnsMessageTransport {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  /** Largest DNS message; also the limit imposed by the two-byte TCP length prefix. */
  @VisibleForTesting static final int MAX_MESSAGE_SIZE = 65535;

  private final TransportProtocol protocol;
  private final Duration exchangeTimeout;
  private final TimeLimiter timeLimiter;
  private final Optional<TsigAuthenticator> authenticator;
  private final ConcurrentMap<String, ListenableFuture<Message>> inflight =
      new ConcurrentHashMap<>();

  @Inject
  public DnsMessageTransport(
      @Config("transportProtocol") TransportProtocol protocol,
      @Config("exchangeTimeout") Duration exchangeTimeout,
      TimeLimiter timeLimiter,
      Optional<TsigAuthenticator> authenticator) {
    this.protocol = protocol;
    this.exchangeTimeout = exchangeTimeout;
    this.timeLimiter = timeLimiter;
    this.authenticator = authenticator;
  }

  /**
   * Sends {@code message} to {@code nameserver} and returns the reply.
   *
   * <p>The message is signed first when a TSIG key is configured, and the reply is verified.
   *
   * @param message the query or update to send; it is modified by signing
   * @param nameserver the {@code host[:port]} address of the nameserver
   * @throws NetworkFailureException if no valid reply arrived before the deadline
   * @throws ServerRejectedException if the reply's response code isn't NOERROR
   */
  public Message send(Message message, String nameserver)
      throws NetworkFailureException, ServerRejectedException {
    checkNotNull(message, "message");
    InetSocketAddress address = resolve(nameserver);
    Message reply = sendCoalesced(message, address, nameserver);
    if (reply.getRcode() != Rcode.NOERROR) {
      throw new ServerRejectedException(nameserver, reply.getRcode());
    }
    return reply;
  }

  private static InetSocketAddress resolve(String nameserver) throws NetworkFailureException {
    HostAndPort hostAndPort;
    try {
      hostAndPort =
          HostAndPort.fromString(nameserver).withDefaultPort(NameserverAddresses.DEFAULT_DNS_PORT);
    } catch (IllegalArgumentException e) {
      throw new NetworkFailureException("Invalid nameserver address: " + nameserver, e);
    }
    if (hostAndPort.getHost().isEmpty()) {
      throw new NetworkFailureException("Invalid nameserver address: " + nameserver);
    }
    InetSocketAddress address =
        new InetSocketAddress(hostAndPort.getHost(), hostAndPort.getPort());
    if (address.isUnresolved()) {
      throw new NetworkFailureException("Unable to resolve nameserver " + nameserver);
    }
    return address;
  }

  private Message sendCoalesced(Message message, InetSocketAddress address, String nameserver)
      throws NetworkFailureException {
    String key = inflightKey(message, address);
    SettableFuture<Message> ours = SettableFuture.create();
    ListenableFuture<Message> existing = inflight.putIfAbsent(key, ours);
    if (existing != null) {
      logger.atFine().log("Sharing the in-flight exchange of an identical message to %s.", address);
      return awaitSharedReply(existing, nameserver);
    }
    try {
      Message reply = exchangeWithDeadline(message, address, nameserver);
      ours.set(reply);
      return reply;
    } catch (NetworkFailureException | RuntimeException e) {
      ours.setException(e);
      throw e;
    } finally {
      inflight.remove(key, ours);
    }
  }

  /** The key under which exchanges are coalesced: the destination and the unsigned wire form. */
  private static String inflightKey(Message message, InetSocketAddress address) {
    byte[] wire = message.toWire();
    // The ID is the first two bytes of the header.
    wire[0] = 0;
    wire[1] = 0;
    return address + "/" + BaseEncoding.base16().encode(wire);
  }

  private Message awaitSharedReply(ListenableFuture<Message> shared, String nameserver)
      throws NetworkFailureException {
    try {
      return shared.get(exchangeTimeout.getMillis(), MILLISECONDS);
    } catch (ExecutionException e) {
      Throwables.throwIfInstanceOf(e.getCause(), NetworkFailureException.class);
      Throwables.throwIfUnchecked(e.getCause());
      throw new NetworkFailureException("Shared exchange with " + nameserver + " failed", e);
    } catch (TimeoutException e) {
      throw timedOut(nameserver, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw interrupted(nameserver, e);
    }
  }

  private Message exchangeWithDeadline(
      Message message, InetSocketAddress address, String nameserver)
      throws NetworkFailureException {
    try {
      return timeLimiter.callWithTimeout(
          () -> exchange(message, address, nameserver), exchangeTimeout.getMillis(), MILLISECONDS);
    } catch (TimeoutException e) {
      throw timedOut(nameserver, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw interrupted(nameserver, e);
    } catch (ExecutionException e) {
      Throwables.throwIfInstanceOf(e.getCause(), NetworkFailureException.class);
      throw new NetworkFailureException(
          String.format("Exchange with %s failed: %s", nameserver, e.getCause().getMessage()),
          e.getCause());
    } catch (UncheckedExecutionException e) {
      Throwables.throwIfUnchecked(e.getCause());
      throw e;
    }
  }

  private Message exchange(Message message, InetSocketAddress address, String nameserver)
      throws IOException, NetworkFailureException {
    authenticator.ifPresent(a -> a.sign(message));
    byte[] request = message.toWire();
    byte[] response;
    Message reply;
    if (protocol == TransportProtocol.TCP) {
      response = sendTcp(request, address);
      reply = new Message(response);
    } else {
      response = sendUdp(request, address);
      reply = new Message(response);
      if (reply.getHeader().getFlag(Flags.TC)) {
        logger.atInfo().log("Truncated reply from %s; repeating the exchange over TCP.", address);
        response = sendTcp(request, address);
        reply = new Message(response);
      }
    }
    if (reply.getHeader().getID() != message.getHeader().getID()) {
      throw new NetworkFailureException(
          String.format(
              "Reply from %s has ID %d, expected %d",
              nameserver, reply.getHeader().getID(), message.getHeader().getID()));
    }
    if (authenticator.isPresent()) {
      authenticator.get().verify(reply, response, message, nameserver);
    }
    logger.atFine().log(
        "Reply from %s: %s, %d bytes.", address, Rcode.string(reply.getRcode()), response.length);
    return reply;
  }

  private static byte[] sendUdp(byte[] request, InetSocketAddress address) throws IOException {
    try (DatagramChannel channel = DatagramChannel.open()) {
      channel.connect(address);
      channel.write(ByteBuffer.wrap(request));
      ByteBuffer buffer = ByteBuffer.allocate(MAX_MESSAGE_SIZE);
      channel.read(buffer);
      buffer.flip();
      byte[] response = new byte[buffer.remaining()];
      buffer.get(response);
      return response;
    }
  }

  private static byte[] sendTcp(byte[] request, InetSocketAddress address) throws IOException {
    try (SocketChannel channel = SocketChannel.open(address)) {
      ByteBuffer out = ByteBuffer.allocate(2 + request.length);
      out.putShort((short) request.length);
      out.put(request);
      out.flip();
      while (out.hasRemaining()) {
        channel.write(out);
      }
      int length = readFully(channel, 2).getShort() & 0xFFFF;
      return readFully(channel, length).array();
    }
  }

  private static ByteBuffer readFully(SocketChannel channel, int length) throws IOException {
    ByteBuffer buffer = ByteBuffer.allocate(length);
    while (buffer.hasRemaining()) {
      if (channel.read(buffer) < 0) {
        throw new EOFException(
            String.format("Connection closed after %d of %d bytes", buffer.position(), length));
      }
    }
    buffer.flip();
    return buffer;
  }

  private NetworkFailureException timedOut(String nameserver, Exception cause) {
    return new NetworkFailureException(
        String.format(
            "No reply from %s within %d ms", nameserver, exchangeTimeout.getMillis()),
        cause);
  }

  private static NetworkFailureException interrupted(String nameserver, Exception cause) {
    return new NetworkFailureException(
        "Interrupted while waiting for a reply from " + nameserver, cause);
  }
}
