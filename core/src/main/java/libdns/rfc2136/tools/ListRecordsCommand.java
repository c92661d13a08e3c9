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

import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;
import javax.inject.Inject;
import libdns.rfc2136.model.DnsRecord;
import libdns.rfc2136.provider.Rfc2136Provider;

/** Command to list the records at a zone's apex. */
@Parameters(separators = " =", commandDescription = "List the records at the apex of a zone")
final class ListRecordsCommand implements Command {

  @Parameter(
      names = {"-z", "--zone"},
      description = "Zone to list, e.g. example.org.",
      required = true)
  private String zone;

  @Inject Rfc2136Provider provider;

  @Override
  public void run() throws Exception {
    for (DnsRecord record : provider.getRecords(zone)) {
      System.out.println(record.toZoneFileLine());
    }
  }
}
