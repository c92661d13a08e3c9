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

import com.google.common.collect.ImmutableList;
import libdns.rfc2136.model.DnsProviderException;
import libdns.rfc2136.model.DnsRecord;

/**
 * Thrown when one record of a batch could not be applied.
 *
 * <p>Records are applied one transaction at a time, so the records preceding the failed one have
 * already been committed by the server; they're available from {@link #getAppliedRecords}. The
 * cause is the underlying failure (translation, network or server rejection).
 */
public class RecordUpdateException extends DnsProviderException {

  private static final long serialVersionUID = 2093580176648003310L;

  private final UpdateMode mode;
  private final DnsRecord failedRecord;
  private final ImmutableList<DnsRecord> appliedRecords;

  public RecordUpdateException(
      UpdateMode mode,
      DnsRecord failedRecord,
      ImmutableList<DnsRecord> appliedRecords,
      DnsProviderException cause) {
    super(
        String.format(
            "Failed to %s record %s %s: %s",
            mode.getVerb(), failedRecord.type(), failedRecord.name(), cause.getMessage()),
        cause);
    this.mode = mode;
    this.failedRecord = failedRecord;
    this.appliedRecords = appliedRecords;
  }

  public UpdateMode getMode() {
    return mode;
  }

  public DnsRecord getFailedRecord() {
    return failedRecord;
  }

  /** Returns the records committed before the failure, in input order. */
  public ImmutableList<DnsRecord> getAppliedRecords() {
    return appliedRecords;
  }

  @Override
  public synchronized DnsProviderException getCause() {
    return (DnsProviderException) super.getCause();
  }
}
