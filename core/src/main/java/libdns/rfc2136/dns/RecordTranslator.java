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

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.net.InetAddresses;
import java.io.ByteArrayOutputStream;
import java.net.Inet4Address;
import java.net.Inet6Address;
import java.net.InetAddress;
import java.util.List;
import javax.inject.Inject;
import libdns.rfc2136.model.DnsRecord;
import org.joda.time.Duration;
import org.xbill.DNS.AAAARecord;
import org.xbill.DNS.ARecord;
import org.xbill.DNS.CNAMERecord;
import org.xbill.DNS.DClass;
import org.xbill.DNS.MXRecord;
import org.xbill.DNS.Name;
import org.xbill.DNS.Record;
import org.xbill.DNS.TXTRecord;
import org.xbill.DNS.TextParseException;
import org.xbill.DNS.Type;

/**
 * Converts between {@link DnsRecord} and dnsjava's wire-level {@link Record}.
 *
 * <p>Only the types in {@link SupportedRecordType} can be written. Any type can be read back,
 * using its presentation format as the value.
 */
public class RecordTranslator {

  /** Largest number of bytes a single TXT character-string can hold. */
  @VisibleForTesting static final int MAX_TXT_STRING_BYTES = 255;

  /** RFC 2181 section 8 keeps the top bit of the TTL field clear. */
  private static final long MAX_TTL_SECONDS = 0x7FFFFFFFL;
  private static final CharMatcher MX_SEPARATOR = CharMatcher.whitespace();
  private static final CharMatcher DIGITS = CharMatcher.inRange('0', '9');

  private final OwnerNameScope ownerNameScope;

  @Inject
  public RecordTranslator(OwnerNameScope ownerNameScope) {
    this.ownerNameScope = ownerNameScope;
  }

  /**
   * Builds the wire record for {@code record} in {@code zone}, always in class IN.
   *
   * @throws UnsupportedRecordTypeException if the type isn't one of {@link SupportedRecordType}
   * @throws InvalidRecordException if the zone, name, value or TTL can't be encoded
   */
  public Record toWire(String zone, DnsRecord record)
      throws UnsupportedRecordTypeException, InvalidRecordException {
    SupportedRecordType type =
        SupportedRecordType.fromMnemonic(record.type())
            .orElseThrow(() -> new UnsupportedRecordTypeException(record.type()));
    Name owner = ownerName(zone, record);
    long ttl = ttlSeconds(record);
    String value = record.value();
    try {
      switch (type) {
        case A:
          return new ARecord(owner, DClass.IN, ttl, parseAddress(value, Inet4Address.class));
        case AAAA:
          return new AAAARecord(owner, DClass.IN, ttl, parseAddress(value, Inet6Address.class));
        case CNAME:
          return new CNAMERecord(owner, DClass.IN, ttl, Name.fromString(value, Name.root));
        case MX:
          return toMxRecord(owner, ttl, value);
        case TXT:
          return new TXTRecord(owner, DClass.IN, ttl, toTxtStrings(value));
        default:
          throw new UnsupportedRecordTypeException(record.type());
      }
    } catch (TextParseException | IllegalArgumentException e) {
      throw new InvalidRecordException(
          String.format("Invalid %s value '%s': %s", type, value, e.getMessage()), e);
    }
  }

  /**
   * Converts a record received from the server.
   *
   * <p>The name is the absolute owner name with its trailing dot. Addresses use their canonical
   * textual form, TXT strings are concatenated back into one UTF-8 value, and every other type
   * uses its presentation format.
   */
  public DnsRecord fromWire(Record record) {
    return DnsRecord.create(
        record.getName().toString(),
        Type.string(record.getType()),
        presentationValue(record),
        Duration.standardSeconds(record.getTTL()));
  }

  /** Parses {@code zone} as an absolute name. */
  public Name toZoneName(String zone) throws InvalidRecordException {
    try {
      return Name.fromString(zone, Name.root);
    } catch (TextParseException e) {
      throw new InvalidRecordException(
          String.format("Invalid zone '%s': %s", zone, e.getMessage()), e);
    }
  }

  private Name ownerName(String zone, DnsRecord record) throws InvalidRecordException {
    Name zoneName = toZoneName(zone);
    if (ownerNameScope == OwnerNameScope.ZONE || record.name().isEmpty()) {
      return zoneName;
    }
    try {
      // Name.fromString resolves "@" to the origin.
      return Name.fromString(record.name(), zoneName);
    } catch (TextParseException e) {
      throw new InvalidRecordException(
          String.format("Invalid record name '%s': %s", record.name(), e.getMessage()), e);
    }
  }

  private static long ttlSeconds(DnsRecord record) throws InvalidRecordException {
    long seconds = record.ttl().getStandardSeconds();
    if (seconds < 0 || seconds > MAX_TTL_SECONDS) {
      throw new InvalidRecordException(
          String.format(
              "TTL of %d seconds for %s %s is outside [0, %d]",
              seconds, record.type(), record.name(), MAX_TTL_SECONDS));
    }
    return seconds;
  }

  private static InetAddress parseAddress(String value, Class<? extends InetAddress> family) {
    InetAddress address = InetAddresses.forString(value);
    if (!family.isInstance(address)) {
      throw new IllegalArgumentException(
          String.format("'%s' is not an %s address", value, family.getSimpleName()));
    }
    return address;
  }

  /** Accepts either "{@code preference exchange}" or a bare exchange with preference 0. */
  private static MXRecord toMxRecord(Name owner, long ttl, String value)
      throws TextParseException {
    List<String> parts = Splitter.on(MX_SEPARATOR).omitEmptyStrings().splitToList(value);
    if (parts.size() == 1) {
      return new MXRecord(owner, DClass.IN, ttl, 0, Name.fromString(parts.get(0), Name.root));
    }
    if (parts.size() == 2 && DIGITS.matchesAllOf(parts.get(0))) {
      return new MXRecord(
          owner,
          DClass.IN,
          ttl,
          Integer.parseInt(parts.get(0)),
          Name.fromString(parts.get(1), Name.root));
    }
    throw new IllegalArgumentException("expected '[preference] exchange'");
  }

  /**
   * Splits a TXT value into character-strings of at most {@value #MAX_TXT_STRING_BYTES} UTF-8
   * bytes each, escaped as dnsjava expects.
   *
   * <p>Splitting happens on byte boundaries, so a multi-byte character may straddle two strings;
   * {@link #fromWire} concatenates the raw bytes before decoding.
   */
  @VisibleForTesting
  static ImmutableList<String> toTxtStrings(String value) {
    byte[] bytes = value.getBytes(UTF_8);
    if (bytes.length == 0) {
      return ImmutableList.of("");
    }
    ImmutableList.Builder<String> strings = new ImmutableList.Builder<>();
    for (int start = 0; start < bytes.length; start += MAX_TXT_STRING_BYTES) {
      strings.add(escape(bytes, start, Math.min(bytes.length, start + MAX_TXT_STRING_BYTES)));
    }
    return strings.build();
  }

  /** Escapes quotes, backslashes and non-printable bytes in the {@code \DDD} form. */
  private static String escape(byte[] bytes, int from, int to) {
    StringBuilder escaped = new StringBuilder();
    for (int i = from; i < to; i++) {
      int b = bytes[i] & 0xFF;
      if (b >= 0x20 && b < 0x7F && b != '"' && b != '\\') {
        escaped.append((char) b);
      } else {
        escaped.append(String.format("\\%03d", b));
      }
    }
    return escaped.toString();
  }

  private static String presentationValue(Record record) {
    if (record instanceof ARecord) {
      return InetAddresses.toAddrString(((ARecord) record).getAddress());
    }
    if (record instanceof AAAARecord) {
      return InetAddresses.toAddrString(((AAAARecord) record).getAddress());
    }
    if (record instanceof TXTRecord) {
      ByteArrayOutputStream joined = new ByteArrayOutputStream();
      for (byte[] string : ((TXTRecord) record).getStringsAsByteArrays()) {
        joined.write(string, 0, string.length);
      }
      return new String(joined.toByteArray(), UTF_8);
    }
    return record.rdataToString();
  }
}
