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

import org.xbill.DNS.Record;
import org.xbill.DNS.Update;

/** How a single record is applied to a zone in an RFC 2136 update. */
public enum UpdateMode {

  /** Adds the record, leaving any existing data for the name and type in place. */
  APPEND("append") {
    @Override
    void addTo(Update update, Record record) {
      update.add(record);
    }
  },

  /** Deletes exactly the RR matching the record's name, type and data. */
  DELETE("delete") {
    @Override
    void addTo(Update update, Record record) {
      update.delete(record);
    }
  },

  /**
   * Deletes the whole RRset for the record's name and type, then adds the record, so the record
   * is the only value left.
   */
  SET("set") {
    @Override
    void addTo(Update update, Record record) {
      update.delete(record.getName(), record.getType());
      update.add(record);
    }
  };

  private final String verb;

  UpdateMode(String verb) {
    this.verb = verb;
  }

  public String getVerb() {
    return verb;
  }

  /** Adds the directives for {@code record} to the update section of {@code update}. */
  abstract void addTo(Update update, Record record);
}
