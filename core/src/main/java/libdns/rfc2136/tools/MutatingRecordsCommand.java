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

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.converters.IParameterSplitter;
import com.google.common.collect.ImmutableList;
import java.util.List;
import javax.inject.Inject;
import libdns.rfc2136.dns.RecordUpdateException;
import libdns.rfc2136.model.DnsProviderException;
import libdns.rfc2136.model.DnsRecord;
import libdns.rfc2136.provider.Rfc2136Provider;

/**
 * Base class for commands that build records from their parameters and send them to the
 * nameserver.
 *
 * <p>Each {@code --value} yields one record. The records that were applied are printed even when
 * a later one fails.
 */
abstract class MutatingRecordsCommand implements Command {

  @Parameter(
      names = {"-z", "--zone"},
      description = "Zone the records belong to, e.g. example.org.",
      required = true)
  String zone;

  @Parameter(
      names = {"-n", "--name"},
      description = "Owner name of the records, relative to the zone; only used with RECORD scope")
  String name = "";

  @Parameter(
      names = {"-t", "--type"},
      description = "Record type: A, AAAA, CNAME, MX or TXT",
      required = true)
  String type;

  @Parameter(
      names = {"-v", "--value"},
      splitter = NoSplittingSplitter.class,
      description = "Record value; may be repeated, one record per value",
      required = true)
  List<String> values;

  @Parameter(
      names = "--ttl",
      description = "Time to live of the records, in seconds")
  long ttlSeconds = 3600;

  @Inject Rfc2136Provider provider;

  /** Keeps commas inside a value, e.g. in TXT data. */
  public static class NoSplittingSplitter implements IParameterSplitter {
    @Override
    public List<String> split(String value) {
      return ImmutableList.of(value);
    }
  }

  /** Sends {@code records} to the nameserver and returns those applied. */
  abstract ImmutableList<DnsRecord> apply(String zone, ImmutableList<DnsRecord> records)
      throws DnsProviderException;

  /** Past-tense verb for the summary line, e.g. "Appended". */
  abstract String describeResult();

  @Override
  public final void run() throws Exception {
    ImmutableList<DnsRecord> records =
        values.stream()
            .map(value -> DnsRecord.create(name, type, value, ttlSeconds))
            .collect(toImmutableList());
    try {
      printApplied(apply(zone, records));
    } catch (RecordUpdateException e) {
      printApplied(e.getAppliedRecords());
      throw e;
    }
  }

  private void printApplied(ImmutableList<DnsRecord> applied) {
    System.out.printf("%s %d record(s) in zone %s\n", describeResult(), applied.size(), zone);
    for (DnsRecord record : applied) {
      System.out.println(record.toZoneFileLine());
    }
  }
}
