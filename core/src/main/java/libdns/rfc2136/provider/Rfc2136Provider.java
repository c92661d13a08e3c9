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

package libdns.rfc2136.provider;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import javax.annotation.concurrent.ThreadSafe;
import javax.inject.Inject;
import javax.inject.Singleton;
import libdns.rfc2136.config.Rfc2136Config.Config;
import libdns.rfc2136.dns.DnsUpdateWriter;
import libdns.rfc2136.dns.UpdateMode;
import libdns.rfc2136.dns.ZoneQuery;
import libdns.rfc2136.dns.transport.NameserverAddresses;
import libdns.rfc2136.dns.transport.NetworkFailureException;
import libdns.rfc2136.model.DnsProviderException;
import libdns.rfc2136.model.DnsRecord;
import libdns.rfc2136.model.RecordAppender;
import libdns.rfc2136.model.RecordDeleter;
import libdns.rfc2136.model.RecordGetter;
import libdns.rfc2136.model.RecordSetter;

/**
 * Manages a zone's records on a nameserver that accepts RFC 2136 dynamic updates.
 *
 * <p>Operations on one provider never overlap: each waits until the previous one has finished,
 * including its network exchanges. A thread waiting for its turn can be interrupted.
 */
@Singleton
@ThreadSafe
public class Rfc2136Provider implements RecordGetter, RecordAppender, RecordSetter, RecordDeleter {

  private final String nameserver;
  private final ZoneQuery zoneQuery;
  private final DnsUpdateWriter updateWriter;
  private final ReentrantLock lock = new ReentrantLock();

  @Inject
  public Rfc2136Provider(
      @Config("nameserverAddress") String nameserver,
      ZoneQuery zoneQuery,
      DnsUpdateWriter updateWriter) {
    this.nameserver = NameserverAddresses.normalize(nameserver);
    this.zoneQuery = zoneQuery;
    this.updateWriter = updateWriter;
  }

  /** Returns the normalized {@code host:port} address operations are sent to. */
  public String getNameserver() {
    return nameserver;
  }

  @Override
  public ImmutableList<DnsRecord> getRecords(String zone) throws DnsProviderException {
    checkNotNull(zone, "zone");
    return locked("list records of " + zone, () -> zoneQuery.query(zone, nameserver));
  }

  @Override
  public ImmutableList<DnsRecord> appendRecords(String zone, List<DnsRecord> records)
      throws DnsProviderException {
    return update(zone, records, UpdateMode.APPEND);
  }

  @Override
  public ImmutableList<DnsRecord> setRecords(String zone, List<DnsRecord> records)
      throws DnsProviderException {
    return update(zone, records, UpdateMode.SET);
  }

  @Override
  public ImmutableList<DnsRecord> deleteRecords(String zone, List<DnsRecord> records)
      throws DnsProviderException {
    return update(zone, records, UpdateMode.DELETE);
  }

  private ImmutableList<DnsRecord> update(String zone, List<DnsRecord> records, UpdateMode mode)
      throws DnsProviderException {
    checkNotNull(zone, "zone");
    ImmutableList<DnsRecord> batch = ImmutableList.copyOf(records);
    return locked(
        mode.getVerb() + " records in " + zone,
        () -> updateWriter.write(zone, batch, mode, nameserver));
  }

  private <T> T locked(String description, LockedOperation<T> operation)
      throws DnsProviderException {
    try {
      lock.lockInterruptibly();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new NetworkFailureException("Interrupted while waiting to " + description, e);
    }
    try {
      return operation.run();
    } finally {
      lock.unlock();
    }
  }

  /** An operation run while holding the provider's lock. */
  @FunctionalInterface
  private interface LockedOperation<T> {
    T run() throws DnsProviderException;
  }
}
