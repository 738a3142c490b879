package dev.brus.branch.updater.git;

import java.util.Objects;

import org.eclipse.jgit.lib.Constants;

public class RemoteBranch {
   private final String remote;
   private final String branch;

   public RemoteBranch(String remote, String branch) {
      this.remote = remote;
      this.branch = branch;
   }

   public String getRemote() {
      return remote;
   }

   /**
    * The branch name on the remote.
    */
   public String getBranch() {
      return branch;
   }

   /**
    * The short name of the remote-tracking branch, i.e. origin/feature.
    */
   public String getName() {
      return remote + "/" + branch;
   }

   public String getRefName() {
      return Constants.R_REMOTES + getName();
   }

   @Override
   public boolean equals(Object o) {
      if (this == o) {
         return true;
      }
      if (o == null || getClass() != o.getClass()) {
         return false;
      }
      RemoteBranch that = (RemoteBranch) o;
      return remote.equals(that.remote) && branch.equals(that.branch);
   }

   @Override
   public int hashCode() {
      return Objects.hash(remote, branch);
   }

   @Override
   public String toString() {
      return getName();
   }
}
