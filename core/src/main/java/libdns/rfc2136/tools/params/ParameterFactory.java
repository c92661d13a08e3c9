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

import com.beust.jcommander.IStringConverter;
import com.beust.jcommander.IStringConverterFactory;
import com.google.common.collect.ImmutableMap;
import java.util.logging.Level;
import javax.annotation.Nullable;

/** JCommander converter factory that works for non-internal converters. */
public final class ParameterFactory implements IStringConverterFactory {

  /** Returns JCommander converter for a given type, or {@code null} if none exists. */
  @Nullable
  @Override
  @SuppressWarnings("unchecked")
  public <T> Class<? extends IStringConverter<T>> getConverter(@Nullable Class<T> type) {
    return (Class<? extends IStringConverter<T>>) CONVERTERS.get(type);
  }

  private static final ImmutableMap<Class<?>, Class<? extends IStringConverter<?>>> CONVERTERS =
      ImmutableMap.of(Level.class, LoggingLevelParameter.class);
}
