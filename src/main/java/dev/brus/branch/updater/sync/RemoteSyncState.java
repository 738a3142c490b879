/**
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements. See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License. You may obtain a copy of the License at
 * <p>
 * http://www.apache.org/licenses/LICENSE-2.0
 * <p>
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.brus.branch.updater.sync;

import dev.brus.branch.updater.git.RemoteBranch;

/**
 * A {@link RemoteSyncStatus} with the remote branch it was computed against.
 */
public class RemoteSyncState {
   private final RemoteSyncStatus status;
   private final RemoteBranch remoteBranch;

   public RemoteSyncState(RemoteSyncStatus status, RemoteBranch remoteBranch) {
      this.status = status;
      this.remoteBranch = remoteBranch;
   }

   public RemoteSyncStatus getStatus() {
      return status;
   }

   /**
    * @return the counterpart of the branch, null if untracked or there are no remotes
    */
   public RemoteBranch getRemoteBranch() {
      return remoteBranch;
   }

   public String getRemote() {
      return remoteBranch != null ? remoteBranch.getRemote() : null;
   }

   public String getDescription() {
      switch (status) {
         case UNTRACKED:
            return "untracked";
         case AHEAD_OF_REMOTE:
            return "ahead of " + getRemote();
         case BEHIND_REMOTE:
            return "behind " + getRemote();
         case DIVERGED_FROM_AND_NEWER_THAN_REMOTE:
            return "diverged from " + getRemote();
         case DIVERGED_FROM_AND_OLDER_THAN_REMOTE:
            return "diverged from & older than " + getRemote();
         default:
            return "";
      }
   }

   @Override
   public String toString() {
      return status + (remoteBranch != null ? " " + remoteBranch : "");
   }
}
