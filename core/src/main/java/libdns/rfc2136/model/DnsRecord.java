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

package libdns.rfc2136.model;

import com.google.auto.value.AutoValue;
import org.joda.time.Duration;

/**
 * A protocol-agnostic description of a single DNS resource record.
 *
 * <p>{@link #value} holds the record data in its textual presentation form, e.g. {@code
 * "192.0.2.1"} for an {@code A} record or {@code "10 mail.example.com."} for an {@code MX}
 * record. {@link #ttl} is only meaningful at second precision.
 */
@AutoValue
public abstract class DnsRecord {

  /** The owner name, either absolute (trailing dot) or relative to the zone. */
  public abstract String name();

  /** The type mnemonic, e.g. {@code "TXT"}. */
  public abstract String type();

  public abstract String value();

  public abstract Duration ttl();

  public static DnsRecord create(String name, String type, String value, Duration ttl) {
    return new AutoValue_DnsRecord(name, type, value, ttl);
  }

  public static DnsRecord create(String name, String type, String value, long ttlSeconds) {
    return create(name, type, value, Duration.standardSeconds(ttlSeconds));
  }

  /** Returns the record in zone-file order: name, TTL, class, type and value. */
  public String toZoneFileLine() {
    return String.format("%s\t%d\tIN\t%s\t%s", name(), ttl().getStandardSeconds(), type(), value());
  }
}
