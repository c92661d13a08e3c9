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

package libdns.rfc2136.dns;

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import javax.inject.Inject;
import libdns.rfc2136.dns.transport.DnsMessageTransport;
import libdns.rfc2136.dns.transport.NetworkFailureException;
import libdns.rfc2136.dns.transport.ServerRejectedException;
import libdns.rfc2136.model.DnsRecord;
import org.xbill.DNS.DClass;
import org.xbill.DNS.Message;
import org.xbill.DNS.Record;
import org.xbill.DNS.Section;
import org.xbill.DNS.Type;

/**
 * Lists a zone's records with a single {@code ANY} query for the zone apex.
 *
 * <p>The answer is returned as the server sent it, including SOA and NS records. Only records at
 * the apex are returned; this isn't a zone transfer.
 */
public class ZoneQuery {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final RecordTranslator translator;
  private final DnsMessageTransport transport;

  @Inject
  public ZoneQuery(RecordTranslator translator, DnsMessageTransport transport) {
    this.translator = translator;
    this.transport = transport;
  }

  /** Returns the answer records for {@code zone}, in the order the server sent them. */
  public ImmutableList<DnsRecord> query(String zone, String nameserver)
      throws InvalidRecordException, NetworkFailureException, ServerRejectedException {
    Record question = Record.newRecord(translator.toZoneName(zone), Type.ANY, DClass.IN);
    Message reply = transport.send(Message.newQuery(question), nameserver);
    ImmutableList<DnsRecord> records =
        reply.getSection(Section.ANSWER).stream()
            .map(translator::fromWire)
            .collect(toImmutableList());
    logger.atInfo().log("Zone %s has %d records at %s.", zone, records.size(), nameserver);
    return records;
  }
}
