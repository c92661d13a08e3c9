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

import org.xbill.DNS.Rcode;

/** Thrown when a signed reply fails TSIG verification. */
public class TsigVerificationException extends NetworkFailureException {

  private static final long serialVersionUID = 7799516962751208424L;

  private final int tsigError;

  public TsigVerificationException(String nameserver, int tsigError) {
    super(
        String.format(
            "TSIG verification of reply from %s failed: %s",
            nameserver, Rcode.TSIGstring(tsigError)));
    this.tsigError = tsigError;
  }

  /** Returns the TSIG error code reported by verification, e.g. {@link Rcode#BADSIG}. */
  public int getTsigError() {
    return tsigError;
  }
}
