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

import libdns.rfc2136.model.DnsProviderException;
import org.xbill.DNS.Rcode;

/** Thrown when the nameserver answers with a response code other than NOERROR. */
public class ServerRejectedException extends DnsProviderException {

  private static final long serialVersionUID = -2583457722904446151L;

  private final int rcode;

  public ServerRejectedException(String nameserver, int rcode) {
    super(String.format("Server %s replied %s", nameserver, Rcode.string(rcode)));
    this.rcode = rcode;
  }

  public int getRcode() {
    return rcode;
  }

  /** Returns the mnemonic of the response code, e.g. {@code REFUSED}. */
  public String getRcodeName() {
    return Rcode.string(rcode);
  }
}
