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

package libdns.rfc2136.dns.transport;

import com.google.common.util.concurrent.SimpleTimeLimiter;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.common.util.concurrent.TimeLimiter;
import dagger.Module;
import dagger.Provides;
import java.util.Optional;
import java.util.concurrent.Executors;
import javax.annotation.Nullable;
import javax.inject.Singleton;
import libdns.rfc2136.config.Rfc2136Config.Config;

/** Dagger module that provides the collaborators of {@link DnsMessageTransport}. */
@Module
public final class DnsTransportModule {

  /** Runs exchanges on daemon threads so a hung socket never keeps the JVM alive. */
  @Provides
  @Singleton
  static TimeLimiter provideTimeLimiter() {
    return SimpleTimeLimiter.create(
        Executors.newCachedThreadPool(
            new ThreadFactoryBuilder().setDaemon(true).setNameFormat("dns-exchange-%d").build()));
  }

  @Provides
  @Singleton
  static Optional<TsigAuthenticator> provideTsigAuthenticator(
      @Config("tsigKeyName") @Nullable String keyName,
      @Config("tsigAlgorithm") @Nullable String algorithm,
      @Config("tsigSecret") @Nullable String secret) {
    return TsigAuthenticator.create(keyName, algorithm, secret);
  }

  private DnsTransportModule() {}
}
