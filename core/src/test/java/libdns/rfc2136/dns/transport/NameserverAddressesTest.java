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

import static com.google.common.truth.Truth.assertThat;
import static libdns.rfc2136.dns.transport.NameserverAddresses.normalize;

import org.junit.jupiter.api.Test;

/** Unit tests for {@link NameserverAddresses}. */
class NameserverAddressesTest {

  @Test
  void testSuccess_ipv4WithoutPort_getsDefaultPort() {
    assertThat(normalize("192.0.2.1")).isEqualTo("192.0.2.1:53");
  }

  @Test
  void testSuccess_hostnameWithoutPort_getsDefaultPort() {
    assertThat(normalize("ns1.example.org")).isEqualTo("ns1.example.org:53");
  }

  @Test
  void testSuccess_explicitPort_unchanged() {
    assertThat(normalize("ns1.example.org:5353")).isEqualTo("ns1.example.org:5353");
    assertThat(normalize("127.0.0.1:53")).isEqualTo("127.0.0.1:53");
  }

  @Test
  void testSuccess_bareIpv6_isBracketed() {
    assertThat(normalize("2001:db8::1")).isEqualTo("[2001:db8::1]:53");
  }

  @Test
  void testSuccess_bracketedIpv6WithoutPort_getsDefaultPort() {
    assertThat(normalize("[2001:db8::1]")).isEqualTo("[2001:db8::1]:53");
  }

  @Test
  void testSuccess_bracketedIpv6WithPort_unchanged() {
    assertThat(normalize("[2001:db8::1]:5353")).isEqualTo("[2001:db8::1]:5353");
  }

  @Test
  void testSuccess_emptyPort_unchanged() {
    assertThat(normalize("ns1.example.org:")).isEqualTo("ns1.example.org:");
    assertThat(normalize("[2001:db8::1]:")).isEqualTo("[2001:db8::1]:");
  }

  @Test
  void testSuccess_bareIpv6EndingInColon_getsDefaultPort() {
    assertThat(normalize("2001:db8::")).isEqualTo("[2001:db8::]:53");
  }

  @Test
  void testSuccess_unparseable_returnedUnchanged() {
    assertThat(normalize("ns1.example.org:port")).isEqualTo("ns1.example.org:port");
    assertThat(normalize("")).isEmpty();
  }
}
