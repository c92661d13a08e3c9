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

import libdns.rfc2136.model.DnsProviderException;

/** Thrown when a record's type mnemonic has no wire translation. */
public class UnsupportedRecordTypeException extends DnsProviderException {

  private static final long serialVersionUID = 4410731872230781594L;

  private final String type;

  public UnsupportedRecordTypeException(String type) {
    super(String.format("Unsupported record type '%s'", type));
    this.type = type;
  }

  /** Returns the mnemonic that couldn't be translated. */
  public String getType() {
    return type;
  }
}
