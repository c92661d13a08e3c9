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

/** Selects the owner name written into a translated record's header. */
public enum OwnerNameScope {

  /**
   * Every record is written at the zone apex; the record's own name is ignored.
   *
   * <p>This is the historical behavior of this provider and remains the default.
   */
  ZONE,

  /**
   * The record's own name is used. Relative names are resolved against the zone, and an empty
   * name or {@code @} denotes the apex.
   */
  RECORD
}
