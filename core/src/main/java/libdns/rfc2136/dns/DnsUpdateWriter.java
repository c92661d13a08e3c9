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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import java.util.List;
import javax.inject.Inject;
import libdns.rfc2136.dns.transport.DnsMessageTransport;
import libdns.rfc2136.model.DnsProviderException;
import libdns.rfc2136.model.DnsRecord;
import org.xbill.DNS.Record;
import org.xbill.DNS.Update;

/**
 * Applies records to a zone using the DNS UPDATE protocol as specified in <a
 * href="https://tools.ietf.org/html/rfc2136">RFC 2136</a>.
 *
 * <p>Each record is sent as its own UPDATE message, so each one is an atomic transaction on the
 * server. There are no prerequisites; the server increments the zone's SOA serial on every
 * successful update. Records are applied in input order and processing stops at the first
 * failure, leaving earlier records committed.
 */
public class DnsUpdateWriter {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final RecordTranslator translator;
  private final DnsMessageTransport transport;

  /**
   * Class constructor.
   *
   * @param translator converts records to their wire form
   * @param transport the transport used to send/receive the UPDATE messages
   */
  @Inject
  public DnsUpdateWriter(RecordTranslator translator, DnsMessageTransport transport) {
    this.translator = translator;
    this.transport = transport;
  }

  /**
   * Applies each of {@code records} to {@code zone} in its own transaction.
   *
   * @return the applied records, which are all of {@code records} in input order
   * @throws RecordUpdateException for the first record that couldn't be applied; records before
   *     it remain applied and are reported by {@link RecordUpdateException#getAppliedRecords}
   */
  public ImmutableList<DnsRecord> write(
      String zone, List<DnsRecord> records, UpdateMode mode, String nameserver)
      throws RecordUpdateException {
    ImmutableList.Builder<DnsRecord> applied = new ImmutableList.Builder<>();
    for (DnsRecord record : records) {
      try {
        transport.send(buildUpdate(zone, record, mode), nameserver);
      } catch (DnsProviderException e) {
        logger.atWarning().withCause(e).log(
            "Failed to %s %s %s in zone %s.", mode.getVerb(), record.type(), record.name(), zone);
        throw new RecordUpdateException(mode, record, applied.build(), e);
      }
      logger.atInfo().log(
          "Applied %s of %s %s in zone %s.", mode.getVerb(), record.type(), record.name(), zone);
      applied.add(record);
    }
    return applied.build();
  }

  /** Builds the single-record UPDATE message for {@code record}. */
  @VisibleForTesting
  Update buildUpdate(String zone, DnsRecord record, UpdateMode mode)
      throws UnsupportedRecordTypeException, InvalidRecordException {
    Record wireRecord = translator.toWire(zone, record);
    Update update = new Update(translator.toZoneName(zone));
    mode.addTo(update, wireRecord);
    return update;
  }
}
