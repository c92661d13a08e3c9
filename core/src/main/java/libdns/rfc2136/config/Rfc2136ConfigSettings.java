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

package libdns.rfc2136.config;

/** The POJO that YAML config files are deserialized into. */
public class Rfc2136ConfigSettings {
  public Nameserver nameserver;
  public Tsig tsig;
  public Records records;

  /** Configuration for the nameserver that receives queries and updates. */
  public static class Nameserver {
    public String address;
    public String protocol;
    public int exchangeTimeoutSeconds;
  }

  /** Configuration for TSIG signing; signing is off unless both keyName and secret are set. */
  public static class Tsig {
    public String keyName;
    public String algorithm;
    public String secret;
  }

  /** Configuration for record translation. */
  public static class Records {
    public String ownerNameScope;
  }
}
