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

package libdns.rfc2136.tools;

import com.google.common.base.Throwables;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;

/** Utilities for dependency injection using Dagger2. */
final class Injector {

  /**
   * Reflectively injects the dependencies of a command using Dagger2.
   *
   * <p>The {@code component} must declare a method named {@code inject} whose single parameter
   * type is exactly the class of {@code object}. This avoids a long chain of instanceof checks for
   * the handful of commands the tool has.
   *
   * @throws IllegalStateException if no matching {@code inject} method exists
   */
  static <T> void injectReflectively(Class<T> componentType, T component, Object object) {
    for (Method method : componentType.getMethods()) {
      if (method.getName().equals("inject")
          && method.getParameterCount() == 1
          && method.getParameterTypes()[0] == object.getClass()) {
        try {
          method.invoke(component, object);
        } catch (InvocationTargetException e) {
          Throwables.throwIfUnchecked(e.getCause());
          throw new IllegalStateException("Injection failed for " + object.getClass(), e);
        } catch (IllegalAccessException e) {
          throw new IllegalStateException("Injection failed for " + object.getClass(), e);
        }
        return;
      }
    }
    throw new IllegalStateException(
        String.format(
            "%s has no inject method for %s",
            componentType.getSimpleName(), object.getClass().getSimpleName()));
  }

  private Injector() {}
}
