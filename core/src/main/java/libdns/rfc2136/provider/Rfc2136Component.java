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

package libdns.rfc2136.provider;

import dagger.BindsInstance;
import dagger.Component;
import javax.inject.Singleton;
import libdns.rfc2136.config.Rfc2136Config.ConfigModule;
import libdns.rfc2136.config.Rfc2136ConfigSettings;
import libdns.rfc2136.dns.transport.DnsTransportModule;

/**
 * Dagger component that builds a {@link Rfc2136Provider} from configuration settings.
 *
 * <p>Use {@code DaggerRfc2136Component.builder().config(settings).build().provider()}.
 */
@Singleton
@Component(modules = {ConfigModule.class, DnsTransportModule.class})
public interface Rfc2136Component {

  Rfc2136Provider provider();

  /** Builder for {@link Rfc2136Component}. */
  @Component.Builder
  interface Builder {
    @BindsInstance
    Builder config(Rfc2136ConfigSettings config);

    Rfc2136Component build();
  }
}
