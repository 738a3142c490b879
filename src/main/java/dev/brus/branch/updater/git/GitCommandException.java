package dev.brus.branch.updater.git;

import dev.brus.branch.updater.UpdaterException;

public class GitCommandException extends UpdaterException {

   private final String command;
   private final int exitCode;

   public GitCommandException(String command, int exitCode, String output) {
      super("Error executing [" + command + "]: " + exitCode + (output == null || output.isEmpty() ? "" : "\n" + output));
      this.command = command;
      this.exitCode = exitCode;
   }

   public String getCommand() {
      return command;
   }

   public int getExitCode() {
      return exitCode;
   }
}
