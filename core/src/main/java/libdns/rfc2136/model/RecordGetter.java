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

package libdns.rfc2136.model;

import com.google.common.collect.ImmutableList;

/** Lists the records of a zone. */
public interface RecordGetter {

  /**
   * Returns all records the nameserver reports for {@code zone}, in the server's order.
   *
   * @param zone the fully qualified zone name, e.g. {@code "example.org."}
   */
  ImmutableList<DnsRecord> getRecords(String zone) throws DnsProviderException;
}
