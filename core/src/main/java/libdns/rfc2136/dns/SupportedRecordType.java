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

import com.google.common.base.Ascii;
import com.google.common.base.Enums;
import java.util.Optional;
import javax.annotation.Nullable;
import org.xbill.DNS.Type;

/** The record types that can be written to a nameserver. */
public enum SupportedRecordType {
  A(Type.A),
  AAAA(Type.AAAA),
  CNAME(Type.CNAME),
  MX(Type.MX),
  TXT(Type.TXT);

  private final int typeCode;

  SupportedRecordType(int typeCode) {
    this.typeCode = typeCode;
  }

  /** Returns the numeric type code, as defined in {@link Type}. */
  public int getTypeCode() {
    return typeCode;
  }

  /** Looks up a type by its mnemonic, ignoring case and surrounding whitespace. */
  public static Optional<SupportedRecordType> fromMnemonic(@Nullable String mnemonic) {
    if (mnemonic == null) {
      return Optional.empty();
    }
    return Enums.getIfPresent(SupportedRecordType.class, Ascii.toUpperCase(mnemonic.trim()))
        .toJavaUtil();
  }
}
