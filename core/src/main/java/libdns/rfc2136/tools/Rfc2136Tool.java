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

import com.google.common.collect.ImmutableMap;

/** Entry point of the {@code rfc2136} command-line tool. */
public final class Rfc2136Tool {

  /** Available commands. */
  public static final ImmutableMap<String, Class<? extends Command>> COMMAND_MAP =
      new ImmutableMap.Builder<String, Class<? extends Command>>()
          .put("append_records", AppendRecordsCommand.class)
          .put("delete_records", DeleteRecordsCommand.class)
          .put("list_records", ListRecordsCommand.class)
          .put("set_records", SetRecordsCommand.class)
          .build();

  public static void main(String[] args) throws Exception {
    new Rfc2136Cli("rfc2136", COMMAND_MAP).run(args);
  }

  private Rfc2136Tool() {}
}
