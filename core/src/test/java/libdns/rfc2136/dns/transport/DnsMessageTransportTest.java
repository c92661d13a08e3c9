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

import static com.google.common.truth.Truth.assertThat;
import static libdns.rfc2136.dns.transport.TsigAuthenticatorTest.KEY_NAME;
import static libdns.rfc2136.dns.transport.TsigAuthenticatorTest.OTHER_SECRET;
import static libdns.rfc2136.dns.transport.TsigAuthenticatorTest.SECRET;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.util.concurrent.SimpleTimeLimiter;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import libdns.rfc2136.testing.FakeNameserver;
import org.joda.time.Duration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.xbill.DNS.DClass;
import org.xbill.DNS.Message;
import org.xbill.DNS.Name;
import org.xbill.DNS.Rcode;
import org.xbill.DNS.Record;
import org.xbill.DNS.Section;
import org.xbill.DNS.TSIG;
import org.xbill.DNS.Type;

/** Unit tests for {@link DnsMessageTransport}, run against a {@link FakeNameserver}. */
class DnsMessageTransportTest {

  private final ExecutorService executor = Executors.newCachedThreadPool();
  private FakeNameserver server;

  @BeforeEach
  void beforeEach() throws Exception {
    server = FakeNameserver.start("example.org.");
  }

  @AfterEach
  void afterEach() throws Exception {
    server.close();
    executor.shutdownNow();
  }

  @Test
  void testSuccess_udp() throws Exception {
    Message reply = newTransport(TransportProtocol.UDP).send(newQuery(), server.getAddress());

    assertThat(reply.getRcode()).isEqualTo(Rcode.NOERROR);
    assertThat(reply.getSection(Section.ANSWER)).hasSize(1);
    assertThat(reply.getSection(Section.ANSWER).get(0).getType()).isEqualTo(Type.SOA);
    assertThat(server.getUdpRequestCount()).isEqualTo(1);
    assertThat(server.getTcpRequestCount()).isEqualTo(0);
  }

  @Test
  void testSuccess_tcp() throws Exception {
    Message reply = newTransport(TransportProtocol.TCP).send(newQuery(), server.getAddress());

    assertThat(reply.getSection(Section.ANSWER)).hasSize(1);
    assertThat(server.getUdpRequestCount()).isEqualTo(0);
    assertThat(server.getTcpRequestCount()).isEqualTo(1);
  }

  @Test
  void testSuccess_truncatedUdpReply_repeatedOverTcp() throws Exception {
    server.setTruncateUdpReplies(true);

    Message reply = newTransport(TransportProtocol.UDP).send(newQuery(), server.getAddress());

    assertThat(reply.getSection(Section.ANSWER)).hasSize(1);
    assertThat(server.getUdpRequestCount()).isEqualTo(1);
    assertThat(server.getTcpRequestCount()).isEqualTo(1);
  }

  @Test
  void testFailure_noReply_deadlineExpires() {
    server.setDropRequests(true);
    DnsMessageTransport transport =
        newTransport(TransportProtocol.UDP, Duration.millis(200), Optional.empty());

    NetworkFailureException thrown =
        assertThrows(
            NetworkFailureException.class, () -> transport.send(newQuery(), server.getAddress()));
    assertThat(thrown).hasMessageThat().contains("No reply");
  }

  @Test
  void testFailure_serverRejects() {
    server.setForcedRcode(Rcode.REFUSED);

    ServerRejectedException thrown =
        assertThrows(
            ServerRejectedException.class,
            () -> newTransport(TransportProtocol.UDP).send(newQuery(), server.getAddress()));
    assertThat(thrown.getRcode()).isEqualTo(Rcode.REFUSED);
    assertThat(thrown.getRcodeName()).isEqualTo("REFUSED");
    assertThat(thrown).hasMessageThat().contains("replied REFUSED");
  }

  @Test
  void testFailure_malformedAddress() {
    assertThrows(
        NetworkFailureException.class,
        () -> newTransport(TransportProtocol.UDP).send(newQuery(), "ns.example.org:port"));
  }

  @Test
  void testFailure_interruptedCaller() {
    server.setResponseDelayMillis(2000);
    DnsMessageTransport transport = newTransport(TransportProtocol.UDP);

    Thread.currentThread().interrupt();
    try {
      NetworkFailureException thrown =
          assertThrows(
              NetworkFailureException.class,
              () -> transport.send(newQuery(), server.getAddress()));
      assertThat(thrown).hasMessageThat().contains("Interrupted");
      assertThat(Thread.currentThread().isInterrupted()).isTrue();
    } finally {
      Thread.interrupted();
    }
  }

  @Test
  void testSuccess_tsig_signedRequestAndVerifiedReply() throws Exception {
    server.requireTsig(newServerKey(SECRET));
    DnsMessageTransport transport =
        newTransport(TransportProtocol.UDP, Duration.standardSeconds(5), authenticator());

    Message reply = transport.send(newQuery(), server.getAddress());

    assertThat(reply.getTSIG()).isNotNull();
    assertThat(server.getRequests().get(0).getTSIG()).isNotNull();
  }

  @Test
  void testSuccess_tsig_signedRequestRepeatedOverTcp() throws Exception {
    server.requireTsig(newServerKey(SECRET)).setTruncateUdpReplies(true);
    DnsMessageTransport transport =
        newTransport(TransportProtocol.UDP, Duration.standardSeconds(5), authenticator());

    Message reply = transport.send(newQuery(), server.getAddress());

    assertThat(reply.getSection(Section.ANSWER)).hasSize(1);
    assertThat(server.getTcpRequestCount()).isEqualTo(1);
  }

  @Test
  void testFailure_tsig_unsignedRequestRejected() {
    server.requireTsig(newServerKey(SECRET));

    ServerRejectedException thrown =
        assertThrows(
            ServerRejectedException.class,
            () -> newTransport(TransportProtocol.UDP).send(newQuery(), server.getAddress()));
    assertThat(thrown.getRcodeName()).isEqualTo("NOTAUTH");
  }

  @Test
  void testFailure_tsig_replySignedWithWrongKey() {
    server.signRepliesWith(newServerKey(OTHER_SECRET));
    DnsMessageTransport transport =
        newTransport(TransportProtocol.UDP, Duration.standardSeconds(5), authenticator());

    assertThrows(
        TsigVerificationException.class, () -> transport.send(newQuery(), server.getAddress()));
  }

  @Test
  void testSuccess_identicalConcurrentMessages_shareOneExchange() throws Exception {
    server.setResponseDelayMillis(500);
    DnsMessageTransport transport = newTransport(TransportProtocol.UDP);
    CountDownLatch start = new CountDownLatch(1);

    Future<Message> first =
        executor.submit(
            () -> {
              start.await();
              return transport.send(newQuery(), server.getAddress());
            });
    Future<Message> second =
        executor.submit(
            () -> {
              start.await();
              return transport.send(newQuery(), server.getAddress());
            });
    start.countDown();

    assertThat(first.get().getSection(Section.ANSWER)).hasSize(1);
    assertThat(second.get().getSection(Section.ANSWER)).hasSize(1);
    assertThat(server.getRequests()).hasSize(1);
  }

  @Test
  void testSuccess_sequentialIdenticalMessages_notShared() throws Exception {
    DnsMessageTransport transport = newTransport(TransportProtocol.UDP);

    transport.send(newQuery(), server.getAddress());
    transport.send(newQuery(), server.getAddress());

    assertThat(server.getRequests()).hasSize(2);
  }

  private DnsMessageTransport newTransport(TransportProtocol protocol) {
    return newTransport(protocol, Duration.standardSeconds(5), Optional.empty());
  }

  private DnsMessageTransport newTransport(
      TransportProtocol protocol,
      Duration exchangeTimeout,
      Optional<TsigAuthenticator> authenticator) {
    return new DnsMessageTransport(
        protocol, exchangeTimeout, SimpleTimeLimiter.create(executor), authenticator);
  }

  private static Optional<TsigAuthenticator> authenticator() {
    return TsigAuthenticator.create(KEY_NAME, "hmac-sha256", SECRET);
  }

  private static TSIG newServerKey(String secret) {
    return new TSIG(TSIG.HMAC_SHA256, Name.fromConstantString("update-key."), secret);
  }

  private static Message newQuery() throws Exception {
    return Message.newQuery(
        Record.newRecord(Name.fromString("example.org."), Type.ANY, DClass.IN));
  }
}
