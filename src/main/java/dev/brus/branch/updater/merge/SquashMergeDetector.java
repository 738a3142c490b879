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

package dev.brus.branch.updater.merge;

import dev.brus.branch.updater.forkpoint.ForkPointResolver;
import dev.brus.branch.updater.git.GitCommit;
import dev.brus.branch.updater.git.GitRepository;
import org.eclipse.jgit.lib.Constants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class SquashMergeDetector {

   private final static Logger logger = LoggerFactory.getLogger(SquashMergeDetector.class);

   private final GitRepository repository;
   private final ForkPointResolver forkPointResolver;

   public SquashMergeDetector(GitRepository repository, ForkPointResolver forkPointResolver) {
      this.repository = repository;
      this.forkPointResolver = forkPointResolver;
   }

   /**
    * Whether the changes of the branch are already part of the parent.
    * <p>
    * A branch reachable from its parent counts as merged only if it ever had commits of its
    * own, so that a branch freshly created on top of its parent is not reported as merged.
    */
   public boolean isMergedToParent(String branch, String parent, SquashMergeDetection mode) throws Exception {
      if (repository.isAncestorOrEqual(branch, parent)) {
         return !forkPointResolver.getFilteredReflog(Constants.R_HEADS + branch).isEmpty();
      }

      switch (mode) {
         case NONE:
            return false;
         case SIMPLE:
            return isEquivalentTreeReachable(branch, parent);
         case EXACT:
            return isEquivalentTreeReachable(branch, parent) || isEquivalentPatchReachable(branch, parent);
         default:
            throw new IllegalStateException("Unsupported squash merge detection: " + mode);
      }
   }

   /**
    * Whether a commit of the parent, not reachable from the branch, has the tree of the branch tip.
    */
   public boolean isEquivalentTreeReachable(String branch, String parent) throws Exception {
      String branchTreeHash = repository.getTreeHash(branch);
      for (GitCommit commit : repository.log(parent, branch)) {
         if (branchTreeHash.equals(commit.getTreeName())) {
            logger.debug("Commit " + commit.getName() + " of " + parent + " has the tree of " + branch);
            return true;
         }
      }
      return false;
   }

   /**
    * Whether a commit of the parent, not reachable from the branch, introduces the same patch
    * as all the commits of the branch taken together.
    */
   public boolean isEquivalentPatchReachable(String branch, String parent) throws Exception {
      String mergeBase = repository.getMergeBase(parent, branch);
      if (mergeBase == null) {
         return false;
      }

      String branchPatchId = repository.getPatchId(mergeBase, branch);
      for (GitCommit commit : repository.log(parent, branch)) {
         if (commit.getParentCount() != 1) {
            continue;
         }
         if (branchPatchId.equals(repository.getPatchId(commit.getName() + "^", commit.getName()))) {
            logger.debug("Commit " + commit.getName() + " of " + parent + " has the patch of " + branch);
            return true;
         }
      }
      return false;
   }
}
