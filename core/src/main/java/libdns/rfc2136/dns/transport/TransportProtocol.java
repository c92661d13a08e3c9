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

/** The socket type used for exchanges with the nameserver. */
public enum TransportProtocol {

  /** Datagrams, repeating the request over TCP when the reply comes back truncated. */
  UDP,

  /** Stream connections with the two-byte length prefix of RFC 1035 section 4.2.2. */
  TCP
}
