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

import dev.brus.branch.updater.RunConfig;
import dev.brus.branch.updater.forkpoint.ForkPoint;
import dev.brus.branch.updater.forkpoint.ForkPointResolver;
import dev.brus.branch.updater.git.GitRepository;
import dev.brus.branch.updater.git.RemoteBranch;
import dev.brus.branch.updater.layout.BranchLayout;
import dev.brus.branch.updater.merge.SquashMergeDetector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes the edge color of a branch and its state against its remote counterpart. Nothing
 * is kept between calls apart from the caches of the repository and of the fork point
 * resolver, which follow the repository state.
 */
public class SyncStateClassifier {

   private final static Logger logger = LoggerFactory.getLogger(SyncStateClassifier.class);

   private final GitRepository repository;
   private final BranchLayout layout;
   private final ForkPointResolver forkPointResolver;
   private final SquashMergeDetector squashMergeDetector;
   private final RunConfig runConfig;

   public SyncStateClassifier(GitRepository repository, BranchLayout layout, ForkPointResolver forkPointResolver,
                              SquashMergeDetector squashMergeDetector, RunConfig runConfig) {
      this.repository = repository;
      this.layout = layout;
      this.forkPointResolver = forkPointResolver;
      this.squashMergeDetector = squashMergeDetector;
      this.runConfig = runConfig;
   }

   /**
    * @return the edge color, null for a root
    */
   public ParentSyncStatus classifyParentEdge(String branch) throws Exception {
      String parent = layout.getParent(branch);
      if (parent == null) {
         return null;
      }

      ParentSyncStatus status;
      if (squashMergeDetector.isMergedToParent(branch, parent, runConfig.getSquashMergeDetection())) {
         status = ParentSyncStatus.MERGED_TO_PARENT;
      } else if (!repository.isAncestorOrEqual(parent, branch)) {
         status = ParentSyncStatus.OUT_OF_SYNC;
      } else if (isForkPointAtParentTip(branch, parent)) {
         status = ParentSyncStatus.IN_SYNC;
      } else {
         status = ParentSyncStatus.IN_SYNC_BUT_FORK_POINT_OFF;
      }

      logger.debug("Edge " + parent + " -> " + branch + " is " + status.getColor());
      return status;
   }

   /**
    * Whether the branch descends from the tip of its parent and its fork point is that tip,
    * the condition under which no rebase onto the parent is needed.
    */
   public boolean isInSyncWithParent(String branch) throws Exception {
      String parent = layout.getParent(branch);
      return parent != null && repository.isAncestorOrEqual(parent, branch) && isForkPointAtParentTip(branch, parent);
   }

   private boolean isForkPointAtParentTip(String branch, String parent) throws Exception {
      ForkPoint forkPoint = forkPointResolver.findForkPoint(branch, true);
      return forkPoint != null && forkPoint.getHash().equals(repository.resolve(parent));
   }

   public RemoteSyncState classifyRemote(String branch) throws Exception {
      if (repository.getRemotes().isEmpty()) {
         return new RemoteSyncState(RemoteSyncStatus.NO_REMOTES, null);
      }

      RemoteBranch remoteBranch = repository.getRemoteCounterpart(branch);
      if (remoteBranch == null) {
         return new RemoteSyncState(RemoteSyncStatus.UNTRACKED, null);
      }

      return new RemoteSyncState(getRelationToRemote(branch, remoteBranch.getName()), remoteBranch);
   }

   /**
    * Relation of a local branch to a remote branch, whether or not it tracks it.
    */
   public RemoteSyncStatus getRelationToRemote(String branch, String remoteBranch) throws Exception {
      boolean branchBehind = repository.isAncestorOrEqual(branch, remoteBranch);
      boolean branchAhead = repository.isAncestorOrEqual(remoteBranch, branch);

      if (branchBehind && branchAhead) {
         return RemoteSyncStatus.IN_SYNC_WITH_REMOTE;
      } else if (branchBehind) {
         return RemoteSyncStatus.BEHIND_REMOTE;
      } else if (branchAhead) {
         return RemoteSyncStatus.AHEAD_OF_REMOTE;
      }

      long branchTime = repository.resolveCommit(branch).getCommitterWhen().getTime();
      long remoteBranchTime = repository.resolveCommit(remoteBranch).getCommitterWhen().getTime();
      return branchTime < remoteBranchTime ?
         RemoteSyncStatus.DIVERGED_FROM_AND_OLDER_THAN_REMOTE : RemoteSyncStatus.DIVERGED_FROM_AND_NEWER_THAN_REMOTE;
   }

   public String getYellowEdgeWarning(String branch) {
      String parent = layout.getParent(branch);
      return "yellow edge indicates that fork point for " + branch + " is probably incorrectly inferred, " +
         "or that some extra branch should be between " + parent + " and " + branch + ".\n" +
         "Consider using 'fork-point --override-to=<revision>|--override-to-inferred|--override-to-parent " + branch +
         "', or reattaching " + branch + " under a different parent branch.";
   }
}
