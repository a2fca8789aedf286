package io.mrimate.command;

/*
 * Copyright (c) mrimate
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import io.mrimate.command.describe.CMD_describe;
import io.mrimate.command.export.CMD_export;
import io.mrimate.command.inspect.CMD_inspect;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

/// Tools for reconstructing Philips PAR/REC scans
///
/// This is the top level command which serves as the entry point for all sub-commands
@CommandLine.Command(name = "mrimate",
    mixinStandardHelpOptions = true,
    versionProvider = CMD_mrimate.VersionProvider.class,
    description = "Reconstruct PAR/REC scans into HDF5 containers",
    subcommands = {
        CommandLine.HelpCommand.class, CMD_describe.class, CMD_export.class, CMD_inspect.class
    })
public class CMD_mrimate {

  /// run a mrimate command
  /// @param args
  ///     command line args
  public static void main(String[] args) {
    Logger logger = LogManager.getLogger(CMD_mrimate.class);
    logger.debug("starting mrimate");

    CMD_mrimate command = new CMD_mrimate();
    CommandLine commandLine = new CommandLine(command).setCaseInsensitiveEnumValuesAllowed(true)
        .setOptionsCaseInsensitive(true);
    int exitCode = commandLine.execute(args);
    System.exit(exitCode);
  }

  /// Reports the version recorded in the jar manifest
  static class VersionProvider implements CommandLine.IVersionProvider {
    @Override
    public String[] getVersion() {
      String version = CMD_mrimate.class.getPackage().getImplementationVersion();
      return new String[]{"mrimate " + (version == null ? "(development)" : version)};
    }
  }
}
