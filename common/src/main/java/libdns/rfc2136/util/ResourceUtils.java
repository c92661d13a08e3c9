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

package libdns.rfc2136.util;

import static com.google.common.io.Resources.getResource;
import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.io.ByteSource;
import com.google.common.io.Files;
import com.google.common.io.Resources;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;

/** Utility methods for reading bundled resources and operator-supplied files. */
public final class ResourceUtils {

  /**
   * Loads a resource (specified relative to the contextClass) as a string, assuming UTF-8.
   *
   * @throws IllegalArgumentException if the resource doesn't exist
   */
  public static String readResourceUtf8(Class<?> contextClass, String filename) {
    try {
      return Resources.toString(getResource(contextClass, filename), UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to load resource: " + filename, e);
    }
  }

  /** Loads a resource (specified relative to the contextClass) as a {@link ByteSource}. */
  public static ByteSource readResourceBytes(Class<?> contextClass, String filename) {
    return Resources.asByteSource(getResource(contextClass, filename));
  }

  /** Reads a file from the local filesystem as a string, assuming UTF-8. */
  public static String readFileUtf8(Path path) throws IOException {
    return Files.asCharSource(path.toFile(), UTF_8).read();
  }

  private ResourceUtils() {}
}
