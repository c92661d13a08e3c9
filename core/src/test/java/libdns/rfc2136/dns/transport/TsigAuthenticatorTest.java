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
import static com.google.common.truth.Truth8.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.xbill.DNS.DClass;
import org.xbill.DNS.Flags;
import org.xbill.DNS.Message;
import org.xbill.DNS.Name;
import org.xbill.DNS.Rcode;
import org.xbill.DNS.Record;
import org.xbill.DNS.Section;
import org.xbill.DNS.TSIG;
import org.xbill.DNS.TSIGRecord;
import org.xbill.DNS.Type;

/** Unit tests for {@link TsigAuthenticator}. */
class TsigAuthenticatorTest {

  static final String KEY_NAME = "update-key";
  static final String SECRET = "MDEyMzQ1Njc4OWFiY2RlZjAxMjM0NTY3ODlhYmNkZWY=";
  static final String OTHER_SECRET = "ZmVkY2JhOTg3NjU0MzIxMGZlZGNiYTk4NzY1NDMyMTA=";

  private TsigAuthenticator authenticator;
  private Message request;

  @BeforeEach
  void beforeEach() throws Exception {
    authenticator = TsigAuthenticator.create(KEY_NAME, "hmac-sha256", SECRET).get();
    request =
        Message.newQuery(Record.newRecord(Name.fromString("example.org."), Type.ANY, DClass.IN));
  }

  @Test
  void testSuccess_create_missingKeyNameOrSecret_isEmpty() {
    assertThat(TsigAuthenticator.create(null, "hmac-sha256", SECRET)).isEmpty();
    assertThat(TsigAuthenticator.create("", "hmac-sha256", SECRET)).isEmpty();
    assertThat(TsigAuthenticator.create(KEY_NAME, "hmac-sha256", null)).isEmpty();
    assertThat(TsigAuthenticator.create(KEY_NAME, "hmac-sha256", "")).isEmpty();
  }

  @Test
  void testSuccess_create_namesMadeAbsolute() {
    assertThat(authenticator.getKeyName().toString()).isEqualTo("update-key.");
    assertThat(authenticator.getAlgorithm().toString()).isEqualTo("hmac-sha256.");
  }

  @Test
  void testSuccess_create_missingAlgorithm_defaultsToHmacSha256() {
    Optional<TsigAuthenticator> created = TsigAuthenticator.create(KEY_NAME, "", SECRET);
    assertThat(created).isPresent();
    assertThat(created.get().getAlgorithm()).isEqualTo(TSIG.HMAC_SHA256);
  }

  @Test
  void testFailure_create_unknownAlgorithm() {
    assertThrows(
        IllegalArgumentException.class,
        () -> TsigAuthenticator.create(KEY_NAME, "hmac-rot13", SECRET));
  }

  @Test
  void testFailure_create_invalidSecret() {
    assertThrows(
        IllegalArgumentException.class, () -> TsigAuthenticator.create(KEY_NAME, "", "abc"));
  }

  @Test
  void testFailure_create_secretOutsideBase64Alphabet() {
    IllegalArgumentException thrown =
        assertThrows(
            IllegalArgumentException.class,
            () -> TsigAuthenticator.create(KEY_NAME, "", "not*base64=="));
    assertThat(thrown).hasMessageThat().contains("base64");
  }

  @Test
  void testSuccess_sign_appendsTsigRecord() {
    authenticator.sign(request);

    TSIGRecord tsig = request.getTSIG();
    assertThat(tsig).isNotNull();
    assertThat(tsig.getName().toString()).isEqualTo("update-key.");
    assertThat(tsig.getAlgorithm()).isEqualTo(TSIG.HMAC_SHA256);
    assertThat(tsig.getFudge().getSeconds()).isEqualTo((long) TsigAuthenticator.FUDGE_SECONDS);
    assertThat(request.getSection(Section.ADDITIONAL)).contains(tsig);
  }

  @Test
  void testSuccess_verify_replySignedWithSameKey() throws Exception {
    authenticator.sign(request);
    byte[] replyBytes = signedReply(SECRET);

    authenticator.verify(new Message(replyBytes), replyBytes, request, "ns");
  }

  @Test
  void testFailure_verify_replySignedWithOtherSecret() throws Exception {
    authenticator.sign(request);
    byte[] replyBytes = signedReply(OTHER_SECRET);

    TsigVerificationException thrown =
        assertThrows(
            TsigVerificationException.class,
            () -> authenticator.verify(new Message(replyBytes), replyBytes, request, "ns"));
    assertThat(thrown.getTsigError()).isEqualTo(Rcode.BADSIG);
    assertThat(thrown).hasMessageThat().contains("BADSIG");
  }

  @Test
  void testSuccess_verify_unsignedReplyAccepted() throws Exception {
    authenticator.sign(request);
    Message reply = new Message(request.getHeader().getID());
    reply.getHeader().setFlag(Flags.QR);
    reply.getHeader().setRcode(Rcode.NOTAUTH);
    byte[] replyBytes = reply.toWire();

    authenticator.verify(new Message(replyBytes), replyBytes, request, "ns");
  }

  /** Builds the server's reply to {@link #request}, signed with {@code secret}. */
  private byte[] signedReply(String secret) throws Exception {
    Message received = new Message(request.toWire());
    TSIG serverKey = new TSIG(TSIG.HMAC_SHA256, Name.fromString("update-key."), secret);
    Message reply = new Message(received.getHeader().getID());
    reply.getHeader().setFlag(Flags.QR);
    reply.addRecord(received.getQuestion(), Section.QUESTION);
    serverKey.apply(reply, received.getTSIG());
    return reply.toWire();
  }
}
