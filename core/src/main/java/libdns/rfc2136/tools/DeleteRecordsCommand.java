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

import com.beust.jcommander.Parameters;
import com.google.common.collect.ImmutableList;
import libdns.rfc2136.model.DnsProviderException;
import libdns.rfc2136.model.DnsRecord;

/** Command to delete the given records from a zone. */
@Parameters(separators = " =", commandDescription = "Delete the given records from a zone")
final class DeleteRecordsCommand extends MutatingRecordsCommand {

  @Override
  ImmutableList<DnsRecord> apply(String zone, ImmutableList<DnsRecord> records)
      throws DnsProviderException {
    return provider.deleteRecords(zone, records);
  }

  @Override
  String describeResult() {
    return "Deleted";
  }
}
