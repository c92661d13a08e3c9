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

package libdns.rfc2136.tools.params;

import com.google.common.base.Ascii;
import java.util.logging.Level;

/** {@link Level} CLI parameter converter/validator, accepting names in any case. */
public final class LoggingLevelParameter extends ParameterConverterValidator<Level> {

  public LoggingLevelParameter() {
    super("not a logging level, e.g. WARNING, INFO or FINE");
  }

  @Override
  public Level convert(String value) {
    return Level.parse(Ascii.toUpperCase(value));
  }
}
