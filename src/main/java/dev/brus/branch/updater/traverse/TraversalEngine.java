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

package dev.brus.branch.updater.traverse;

import java.util.ArrayList;
import java.util.List;

import dev.brus.branch.updater.RunConfig;
import dev.brus.branch.updater.UpdaterException;
import dev.brus.branch.updater.UpdaterSession;
import dev.brus.branch.updater.git.GitCommandException;
import dev.brus.branch.updater.git.GitRepository;
import dev.brus.branch.updater.git.RemoteBranch;
import dev.brus.branch.updater.layout.BranchLayout;
import dev.brus.branch.updater.layout.Qualifiers;
import dev.brus.branch.updater.ops.ParentSync;
import dev.brus.branch.updater.status.StatusPrinter;
import dev.brus.branch.updater.sync.RemoteSyncState;
import dev.brus.branch.updater.sync.RemoteSyncStatus;
import dev.brus.branch.updater.util.Answer;
import dev.brus.branch.updater.util.Console;
import dev.brus.branch.updater.util.Prompter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Walks the managed branches in layout order and, for each one, offers to slide it out if it
 * is merged into its parent, to sync it with its parent and to sync it with its remote
 * counterpart.
 * <p>
 * Every prompt accepts y, N, q and yq. Quitting leaves the current branch checked out; a
 * rebase or merge left in progress stops the walk.
 */
public class TraversalEngine {

   private final static Logger logger = LoggerFactory.getLogger(TraversalEngine.class);

   private static final Answer[] CHOICES = {Answer.YES, Answer.NO, Answer.QUIT, Answer.YES_AND_QUIT};

   private final UpdaterSession session;
   private final ParentSync parentSync;
   private final StatusPrinter statusPrinter;

   private String currentBranch;
   private String nearestRemainingBranch;

   public TraversalEngine(UpdaterSession session) {
      this.session = session;
      this.parentSync = new ParentSync(session);
      this.statusPrinter = new StatusPrinter(session);
   }

   public TraversalOutcome traverse() throws Exception {
      GitRepository repository = session.getRepository();
      BranchLayout layout = session.getLayout();
      RunConfig runConfig = session.getRunConfig();
      Console console = session.getConsole();

      session.expectNoOperationInProgress();
      if (layout.isEmpty()) {
         throw new UpdaterException("No branches listed in " + session.getLayoutFile().getFile().getPath() +
            "; use 'discover' or 'add', or edit the branch layout file manually");
      }
      String stopAfter = runConfig.getStopAfter();
      if (stopAfter != null) {
         session.expectManaged(stopAfter);
      }

      if (runConfig.isFetch()) {
         for (String remote : repository.getRemotes()) {
            console.println("Fetching " + remote + "...");
            repository.fetch(remote);
         }
      }

      String initialBranch = session.getCurrentBranch();
      nearestRemainingBranch = initialBranch;
      currentBranch = initialBranch;
      checkOutStartBranch(runConfig.getStartFrom());

      List<String> managedBranches = new ArrayList<>(layout.getManagedBranches());
      int startIndex = managedBranches.indexOf(currentBranch);
      for (String branch : managedBranches.subList(startIndex, managedBranches.size())) {
         TraversalOutcome outcome = visit(branch);
         if (!outcome.isContinue()) {
            logger.debug("Traversal stopped at " + branch + ": " + outcome);
            return outcome;
         }
         if (branch.equals(stopAfter)) {
            break;
         }
      }

      String lastTraversedBranch = currentBranch;
      switch (runConfig.getReturnTo()) {
         case HERE:
            checkOut(initialBranch);
            break;
         case NEAREST_REMAINING:
            checkOut(nearestRemainingBranch);
            break;
         default:
            break;
      }

      console.println("");
      statusPrinter.print(runConfig.isListCommits());
      console.println("");
      List<String> remainingBranches = layout.getManagedBranches();
      if (!remainingBranches.isEmpty() && lastTraversedBranch.equals(remainingBranches.get(remainingBranches.size() - 1))) {
         console.println("Reached branch " + lastTraversedBranch + " which has no successor; nothing left to update");
      } else {
         console.println("No successor of " + lastTraversedBranch + " needs to be slid out or synced with parent branch or remote; nothing left to update");
      }

      if (runConfig.getReturnTo() == ReturnTo.HERE ||
         (runConfig.getReturnTo() == ReturnTo.NEAREST_REMAINING && nearestRemainingBranch.equals(initialBranch))) {
         console.println("Returned to the initial branch " + initialBranch);
      } else if (runConfig.getReturnTo() == ReturnTo.NEAREST_REMAINING) {
         console.println("The initial branch " + initialBranch + " has been slid out. Returned to nearest remaining managed branch " +
            nearestRemainingBranch);
      }

      return TraversalOutcome.CONTINUE;
   }

   private void checkOutStartBranch(StartFrom startFrom) throws Exception {
      BranchLayout layout = session.getLayout();
      Console console = session.getConsole();

      switch (startFrom.getType()) {
         case ROOT: {
            String root = layout.getRootOf(requireManagedCurrentBranch());
            console.println("Checking out the root branch (" + root + ")");
            checkOut(root);
            break;
         }
         case FIRST_ROOT: {
            String firstRoot = layout.getRoots().get(0);
            console.println("Checking out the first root branch (" + firstRoot + ")");
            checkOut(firstRoot);
            break;
         }
         case BRANCH:
            session.expectManaged(startFrom.getBranch());
            console.println("Checking out branch " + startFrom.getBranch());
            checkOut(startFrom.getBranch());
            break;
         default:
            requireManagedCurrentBranch();
            break;
      }
   }

   private String requireManagedCurrentBranch() throws UpdaterException {
      session.expectManaged(currentBranch);
      return currentBranch;
   }

   private void checkOut(String branch) throws Exception {
      if (!branch.equals(currentBranch)) {
         session.getRepository().checkout(branch);
         currentBranch = branch;
      }
   }

   private TraversalOutcome visit(String branch) throws Exception {
      BranchLayout layout = session.getLayout();
      GitRepository repository = session.getRepository();
      RunConfig runConfig = session.getRunConfig();
      Console console = session.getConsole();
      Prompter prompter = session.getPrompter();

      String parent = layout.getParent(branch);
      Qualifiers qualifiers = layout.getQualifiers(branch);

      boolean needsSlideOut = parent != null && qualifiers.isSlideOut() &&
         session.getSquashMergeDetector().isMergedToParent(branch, parent, runConfig.getSquashMergeDetection());
      RemoteSyncState remoteState = session.getSyncStateClassifier().classifyRemote(branch);
      boolean needsRemoteSync = needsRemoteSync(remoteState.getStatus(), qualifiers);
      boolean merge = parentSync.isMerge(branch);
      boolean needsParentSync = needsParentSync(branch, parent, qualifiers, merge, needsSlideOut, remoteState.getStatus());

      logger.debug("Visiting " + branch + ": slide out " + needsSlideOut + ", parent sync " + needsParentSync +
         ", remote sync " + needsRemoteSync + " (" + remoteState + ")");

      if (!branch.equals(currentBranch) && (needsSlideOut || needsParentSync || needsRemoteSync)) {
         console.println("");
         console.println("Checking out " + branch);
         checkOut(branch);
         console.println("");
         statusPrinter.print(runConfig.isListCommits());
      }

      if (needsSlideOut) {
         console.println("");
         Answer answer = prompter.ask("Branch " + branch + " is merged into " + parent +
               ". Slide " + branch + " out of the tree of branch dependencies?",
            "Branch " + branch + " is merged into " + parent + ". Sliding " + branch + " out of the tree of branch dependencies...",
            CHOICES);
         if (answer.isYes()) {
            List<String> children = layout.getChildren(branch);
            if (branch.equals(nearestRemainingBranch)) {
               nearestRemainingBranch = children.isEmpty() ? parent : children.get(0);
            }
            layout.removeBranch(branch);
            session.saveLayout();
            logger.info("Slid " + branch + " out of the branch layout");
            return answer.isQuit() ? TraversalOutcome.CANCELLED : TraversalOutcome.CONTINUE;
         } else if (answer.isQuit()) {
            return TraversalOutcome.CANCELLED;
         }
      } else if (needsParentSync) {
         console.println("");
         Answer answer;
         if (merge) {
            answer = prompter.ask("Merge " + parent + " into " + branch + "?", "Merging " + parent + " into " + branch + "...", CHOICES);
         } else {
            answer = prompter.ask("Rebase " + branch + " onto " + parent + "?", "Rebasing " + branch + " onto " + parent + "...", CHOICES);
         }

         if (answer.isYes()) {
            TraversalOutcome outcome = syncWithParent(branch, parent, merge);
            if (!outcome.isContinue()) {
               return outcome;
            }
            if (answer.isQuit()) {
               return TraversalOutcome.CANCELLED;
            }
            remoteState = session.getSyncStateClassifier().classifyRemote(branch);
            needsRemoteSync = needsRemoteSync(remoteState.getStatus(), qualifiers);
         } else if (answer.isQuit()) {
            return TraversalOutcome.CANCELLED;
         }
      }

      if (needsRemoteSync) {
         return syncWithRemote(branch, remoteState);
      }
      return TraversalOutcome.CONTINUE;
   }

   private boolean needsRemoteSync(RemoteSyncStatus status, Qualifiers qualifiers) {
      RunConfig runConfig = session.getRunConfig();
      switch (status) {
         case BEHIND_REMOTE:
         case DIVERGED_FROM_AND_OLDER_THAN_REMOTE:
            return true;
         case UNTRACKED:
         case AHEAD_OF_REMOTE:
         case DIVERGED_FROM_AND_NEWER_THAN_REMOTE:
            return qualifiers.isPush() && (runConfig.isPushTracked() || runConfig.isPushUntracked());
         default:
            return false;
      }
   }

   private boolean needsParentSync(String branch, String parent, Qualifiers qualifiers, boolean merge,
                                   boolean needsSlideOut, RemoteSyncStatus remoteStatus) throws Exception {
      if (parent == null || needsSlideOut || remoteStatus == RemoteSyncStatus.DIVERGED_FROM_AND_OLDER_THAN_REMOTE) {
         return false;
      }
      if (merge) {
         return !session.getRepository().isAncestorOrEqual(parent, branch);
      }
      return qualifiers.isRebase() && !session.getSyncStateClassifier().isInSyncWithParent(branch);
   }

   private TraversalOutcome syncWithParent(String branch, String parent, boolean merge) throws Exception {
      GitRepository repository = session.getRepository();
      Console console = session.getConsole();
      try {
         if (merge) {
            parentSync.merge(branch, parent);
         } else {
            parentSync.rebase(branch, parent, session.getForkPointResolver().getForkPointHash(branch, true));
         }
      } catch (GitCommandException e) {
         logger.debug("Syncing " + branch + " with " + parent + " failed", e);
         if (!repository.isOperationInProgress()) {
            return TraversalOutcome.failed(e.getMessage());
         }
      }

      if (repository.isOperationInProgress()) {
         String reason = merge ? "Merge in progress; stopping the traversal" :
            "Rebase of " + branch + " in progress; stopping the traversal";
         console.println("");
         console.println(reason);
         return TraversalOutcome.failed(reason);
      }
      return TraversalOutcome.CONTINUE;
   }

   private TraversalOutcome syncWithRemote(String branch, RemoteSyncState remoteState) throws Exception {
      GitRepository repository = session.getRepository();
      RunConfig runConfig = session.getRunConfig();
      Prompter prompter = session.getPrompter();
      RemoteBranch remoteBranch = remoteState.getRemoteBranch();

      Answer answer;
      session.getConsole().println("");
      try {
         switch (remoteState.getStatus()) {
            case BEHIND_REMOTE:
               answer = prompter.ask("Branch " + branch + " is behind its remote counterpart " + remoteBranch +
                     ".\nPull " + branch + " (fast-forward only) from " + remoteBranch.getRemote() + "?",
                  "Branch " + branch + " is behind its remote counterpart " + remoteBranch + ".\nPulling " + branch +
                     " (fast-forward only) from " + remoteBranch.getRemote() + "...", CHOICES);
               if (answer.isYes()) {
                  repository.pull(branch, remoteBranch);
               }
               break;
            case AHEAD_OF_REMOTE:
               answer = !runConfig.isPushTracked() ? Answer.NO :
                  prompter.ask("Push " + branch + " to " + remoteBranch.getRemote() + "?",
                     "Pushing " + branch + " to " + remoteBranch.getRemote() + "...", CHOICES);
               if (answer.isYes()) {
                  repository.push(remoteBranch.getRemote(), branch, false);
               }
               break;
            case DIVERGED_FROM_AND_OLDER_THAN_REMOTE:
               answer = prompter.ask("Branch " + branch + " diverged from (and has older commits than) its remote counterpart " +
                     remoteBranch + ".\nReset branch " + branch + " to the commit pointed by " + remoteBranch + "?",
                  "Branch " + branch + " diverged from (and has older commits than) its remote counterpart " +
                     remoteBranch + ".\nResetting branch " + branch + " to the commit pointed by " + remoteBranch + "...", CHOICES);
               if (answer.isYes()) {
                  repository.resetKeep(remoteBranch.getName());
               }
               break;
            case DIVERGED_FROM_AND_NEWER_THAN_REMOTE:
               answer = !runConfig.isPushTracked() ? Answer.NO :
                  prompter.ask("Branch " + branch + " diverged from (and has newer commits than) its remote counterpart " +
                        remoteBranch + ".\nPush " + branch + " with force-with-lease to " + remoteBranch.getRemote() + "?",
                     "Branch " + branch + " diverged from (and has newer commits than) its remote counterpart " +
                        remoteBranch + ".\nPushing " + branch + " with force-with-lease to " + remoteBranch.getRemote() + "...", CHOICES);
               if (answer.isYes()) {
                  repository.push(remoteBranch.getRemote(), branch, true);
               }
               break;
            case UNTRACKED:
               return syncUntracked(branch);
            default:
               return TraversalOutcome.CONTINUE;
         }
      } catch (GitCommandException e) {
         logger.debug("Syncing " + branch + " with its remote failed", e);
         return TraversalOutcome.failed(e.getMessage());
      }

      return answer.isQuit() ? TraversalOutcome.CANCELLED : TraversalOutcome.CONTINUE;
   }

   private TraversalOutcome syncUntracked(String branch) throws Exception {
      GitRepository repository = session.getRepository();
      RunConfig runConfig = session.getRunConfig();
      Prompter prompter = session.getPrompter();

      List<String> remotes = repository.getRemotes();
      String remote;
      if (remotes.size() == 1) {
         remote = remotes.get(0);
      } else if (remotes.contains("origin")) {
         remote = "origin";
      } else {
         session.getConsole().println("Branch " + branch + " is untracked and there's no origin remote.");
         remote = prompter.pick(remotes, "the remote to push " + branch + " to");
         if (remote == null) {
            return TraversalOutcome.CONTINUE;
         }
      }

      if (!runConfig.isPushUntracked()) {
         return TraversalOutcome.CONTINUE;
      }
      Answer answer = prompter.ask("Push untracked branch " + branch + " to " + remote + "?",
         "Pushing untracked branch " + branch + " to " + remote + "...", CHOICES);
      if (answer.isYes()) {
         try {
            repository.push(remote, branch, false);
         } catch (GitCommandException e) {
            logger.debug("Pushing " + branch + " to " + remote + " failed", e);
            return TraversalOutcome.failed(e.getMessage());
         }
      }
      return answer.isQuit() ? TraversalOutcome.CANCELLED : TraversalOutcome.CONTINUE;
   }
}
