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

package dev.brus.branch.updater.ops;

import dev.brus.branch.updater.RunConfig;
import dev.brus.branch.updater.UpdaterException;
import dev.brus.branch.updater.UpdaterSession;
import dev.brus.branch.updater.git.GitRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Brings a branch up to date with its parent, by rebase of the commits after the fork point
 * or by merge of the parent.
 */
public class ParentSync {

   private final static Logger logger = LoggerFactory.getLogger(ParentSync.class);

   private final UpdaterSession session;

   public ParentSync(UpdaterSession session) {
      this.session = session;
   }

   /**
    * Whether the branch is synced by merge, either for the whole run or by its annotation.
    */
   public boolean isMerge(String branch) {
      return session.getRunConfig().isMerge() || session.getLayout().getQualifiers(branch).isUpdateWithMerge();
   }

   public void rebase(String branch, String onto, String forkPoint) throws Exception {
      GitRepository repository = session.getRepository();
      if (!repository.isAncestorOrEqual(forkPoint, branch)) {
         throw new UpdaterException("Fork point " + forkPoint + " is not an ancestor of or the tip of the " + branch + " branch");
      }

      logger.info("Rebasing " + branch + " onto " + onto + " from fork point " + forkPoint);
      repository.rebase(onto, forkPoint, branch, session.getRunConfig().isInteractiveRebase());
   }

   public void merge(String branch, String parent) throws Exception {
      GitRepository repository = session.getRepository();
      if (!branch.equals(repository.getCurrentBranch())) {
         repository.checkout(branch);
      }

      logger.info("Merging " + parent + " into " + branch);
      repository.merge(parent, session.getRunConfig().isNoEditMerge());
   }

   /**
    * @param forkPoint the commit to rebase from, null to use the fork point of the branch
    */
   public void sync(String branch, String parent, boolean merge, String forkPoint) throws Exception {
      if (merge) {
         merge(branch, parent);
      } else {
         rebase(branch, parent, forkPoint != null ? forkPoint :
            session.getForkPointResolver().getForkPointHash(branch, true));
      }
   }

   /**
    * Syncs the current branch with its parent, or with an inferred parent if it is not managed.
    */
   public void update(String forkPoint) throws Exception {
      session.expectNoOperationInProgress();
      RunConfig runConfig = session.getRunConfig();
      String currentBranch = session.getCurrentBranch();
      boolean merge = isMerge(currentBranch);

      String parent = session.getLayout().getParent(currentBranch);
      if (parent == null) {
         parent = session.getForkPointResolver().inferParent(currentBranch, candidate -> !candidate.equals(currentBranch));
         if (parent == null) {
            throw new UpdaterException("Cannot find a parent for " + currentBranch);
         }
         String action = merge ? "Merge with" : "Rebase onto";
         if (!session.getPrompter().confirm("Branch " + currentBranch + " not found in the tree of branch dependencies. " +
            action + " the inferred parent " + parent + "?",
            "Branch " + currentBranch + " not found in the tree of branch dependencies. " + action + " the inferred parent " + parent + "...")) {
            return;
         }
      }

      if (merge) {
         merge(currentBranch, parent);
      } else {
         String rebaseForkPoint = forkPoint != null ? session.getRepository().resolve(forkPoint) : null;
         if (forkPoint != null && rebaseForkPoint == null) {
            throw new UpdaterException("Cannot find revision " + forkPoint);
         }
         if (rebaseForkPoint == null && session.getLayout().contains(currentBranch)) {
            rebaseForkPoint = session.getForkPointResolver().getForkPointHash(currentBranch, true);
         } else if (rebaseForkPoint == null) {
            rebaseForkPoint = session.getRepository().getMergeBase(parent, currentBranch);
         }
         logger.debug("Updating " + currentBranch + " with interactive rebase " + runConfig.isInteractiveRebase());
         rebase(currentBranch, parent, rebaseForkPoint);
      }
   }
}
