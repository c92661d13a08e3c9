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

/**
 * Thrown when no usable reply was obtained from the nameserver.
 *
 * <p>Covers unresolvable addresses, socket errors, malformed replies, expired deadlines and
 * interruption of the calling thread.
 */
public class NetworkFailureException extends DnsProviderException {

  private static final long serialVersionUID = -1306049431858129517L;

  public NetworkFailureException(String message) {
    super(message);
  }

  public NetworkFailureException(String message, Throwable cause) {
    super(message, cause);
  }
}
