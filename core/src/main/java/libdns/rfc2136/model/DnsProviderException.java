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

/**
 * Base class of every expected failure of a record operation.
 *
 * <p>Programmer errors (bad arguments, unusable configuration) are reported with unchecked
 * exceptions instead.
 */
public abstract class DnsProviderException extends Exception {

  private static final long serialVersionUID = -3182735164390157266L;

  protected DnsProviderException(String message) {
    super(message);
  }

  protected DnsProviderException(String message, Throwable cause) {
    super(message, cause);
  }
}
