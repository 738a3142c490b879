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

import java.util.ArrayList;
import java.util.List;

import dev.brus.branch.updater.UpdaterException;
import dev.brus.branch.updater.UpdaterSession;
import dev.brus.branch.updater.forkpoint.ForkPoint;
import dev.brus.branch.updater.forkpoint.ForkPointResolver;
import dev.brus.branch.updater.git.GitRepository;
import dev.brus.branch.updater.git.RemoteBranch;
import dev.brus.branch.updater.layout.Annotation;
import dev.brus.branch.updater.layout.BranchLayout;
import dev.brus.branch.updater.merge.SquashMergeDetection;
import dev.brus.branch.updater.util.Answer;
import dev.brus.branch.updater.util.Console;
import dev.brus.branch.updater.util.Prompter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Commands that change the shape of the branch layout, and the branches themselves where
 * asked to. The layout is verified before each save.
 */
public class TreeMutationOps {

   private final static Logger logger = LoggerFactory.getLogger(TreeMutationOps.class);

   private final UpdaterSession session;
   private final ParentSync parentSync;

   public TreeMutationOps(UpdaterSession session) {
      this.session = session;
      this.parentSync = new ParentSync(session);
   }

   /**
    * Adds a branch to the layout, creating it first if it does not exist.
    *
    * @param onto the parent, null to infer it from the fork point of the branch
    */
   public void add(String branch, String onto, boolean asRoot, boolean asFirstChild) throws Exception {
      GitRepository repository = session.getRepository();
      BranchLayout layout = session.getLayout();
      Prompter prompter = session.getPrompter();
      Console console = session.getConsole();

      if (layout.contains(branch)) {
         throw new UpdaterException("Branch " + branch + " already exists in the tree of branch dependencies");
      }
      if (onto != null) {
         session.expectManaged(onto);
      }

      if (!repository.branchExists(branch)) {
         String remoteBranch = getSoleRemoteBranch(branch);
         if (remoteBranch != null) {
            String commonLine = "A local branch " + branch + " does not exist, but a remote branch " + remoteBranch + " exists.\n";
            if (!prompter.confirm(commonLine + "Check out " + branch + " locally?", commonLine + "Checking out " + branch + " locally...")) {
               return;
            }
            repository.branchCreate(branch, remoteBranch);
         } else {
            String outOf = onto != null ? onto : "the current HEAD";
            if (!prompter.confirm("A local branch " + branch + " does not exist. Create out of " + outOf + "?",
               "A local branch " + branch + " does not exist. Creating out of " + outOf)) {
               return;
            }
            if (onto == null) {
               String currentBranch = repository.getCurrentBranch();
               if (!layout.isEmpty()) {
                  if (currentBranch != null && layout.contains(currentBranch)) {
                     onto = currentBranch;
                  }
               } else if (currentBranch != null) {
                  layout.addBranch(currentBranch, null, false, Annotation.EMPTY);
                  console.println("Added branch " + currentBranch + " as a new root");
                  onto = currentBranch;
               }
            }
            repository.branchCreate(branch, onto != null ? onto : "HEAD");
         }
      }

      if (asRoot || layout.isEmpty()) {
         layout.addBranch(branch, null, false, Annotation.EMPTY);
         console.println("Added branch " + branch + " as a new root");
      } else {
         if (onto == null) {
            onto = session.getForkPointResolver().inferParent(branch, layout::contains);
            if (onto == null) {
               throw new UpdaterException("Could not automatically infer upstream (parent) branch for " + branch + ".\n" +
                  "You can either:\n" +
                  "1) specify the desired upstream branch with '--onto' or\n" +
                  "2) pass '--as-root' to attach " + branch + " as a new root or\n" +
                  "3) edit the branch layout file manually");
            }
            if (!prompter.confirm("Add " + branch + " onto the inferred upstream (parent) branch " + onto + "?",
               "Adding " + branch + " onto the inferred upstream (parent) branch " + onto)) {
               return;
            }
         }
         layout.addBranch(branch, onto, asFirstChild, Annotation.EMPTY);
         console.println("Added branch " + branch + " onto " + onto);
      }

      session.saveLayout();
   }

   private String getSoleRemoteBranch(String branch) throws Exception {
      List<String> matchingRemoteBranches = new ArrayList<>();
      for (String remoteBranch : session.getRepository().getRemoteBranches()) {
         if (remoteBranch.endsWith("/" + branch)) {
            matchingRemoteBranches.add(remoteBranch);
         }
      }
      return matchingRemoteBranches.size() == 1 ? matchingRemoteBranches.get(0) : null;
   }

   /**
    * Removes a parent to child chain of branches from the layout, attaches the children of its
    * last branch to the parent of its first branch and syncs each of them with that parent.
    *
    * @param downForkPoint the commit the children are rebased from, null to use their fork points
    */
   public void slideOut(List<String> branches, String downForkPoint, boolean delete) throws Exception {
      GitRepository repository = session.getRepository();
      BranchLayout layout = session.getLayout();
      Console console = session.getConsole();

      session.expectNoOperationInProgress();
      if (branches.isEmpty()) {
         throw new UpdaterException("No branches to slide out");
      }

      for (String branch : branches) {
         session.expectManaged(branch);
         if (!layout.getQualifiers(branch).isSlideOut()) {
            throw new UpdaterException("Branch " + branch + " is annotated with slide-out=no qualifier, aborting.\n" +
               "Remove the qualifier using 'anno' or edit the branch layout file directly.");
         }
         if (layout.getParent(branch) == null) {
            throw new UpdaterException("Branch " + branch + " has no parent, cannot slide out");
         }
      }

      String lastBranch = branches.get(branches.size() - 1);
      String downForkPointHash = null;
      if (downForkPoint != null) {
         List<String> lastBranchChildren = layout.getChildren(lastBranch);
         if (lastBranchChildren.isEmpty()) {
            throw new UpdaterException("Last branch to slide out must have a child branch if option '--down-fork-point' is passed");
         } else if (lastBranchChildren.size() > 1) {
            throw new UpdaterException("Last branch to slide out can't have more than one child branch if option '--down-fork-point' is passed");
         }
         downForkPointHash = repository.resolve(downForkPoint);
         if (downForkPointHash == null || !repository.isAncestorOrEqual(downForkPointHash, lastBranchChildren.get(0))) {
            throw new UpdaterException("Fork point " + downForkPoint + " is not an ancestor of or the tip of the " +
               lastBranchChildren.get(0) + " branch");
         }
      }

      for (int i = 1; i < branches.size(); i++) {
         String upper = branches.get(i - 1);
         String lower = branches.get(i);
         List<String> children = layout.getChildren(upper);
         if (children.isEmpty()) {
            throw new UpdaterException("No downstream branch defined for " + upper + ", cannot slide out");
         } else if (children.size() > 1) {
            throw new UpdaterException("Multiple downstream branches defined for " + upper + ": " +
               String.join(", ", children) + "; cannot slide out");
         } else if (!children.get(0).equals(lower)) {
            throw new UpdaterException(lower + " is not downstream of " + upper + ", cannot slide out");
         }
      }

      String newParent = layout.getParent(branches.get(0));
      List<String> newChildren = layout.slideOut(branches);
      session.saveLayout();
      logger.info("Slid " + branches + " out of the branch layout, " + newChildren + " attached to " + newParent);

      if (branches.contains(repository.getCurrentBranch())) {
         repository.checkout(newParent);
      }

      for (String newChild : newChildren) {
         boolean merge = parentSync.isMerge(newChild);
         boolean rebase = !merge && layout.getQualifiers(newChild).isRebase();
         if (merge) {
            console.println("Merging " + newParent + " into " + newChild + "...");
            parentSync.merge(newChild, newParent);
         } else if (rebase) {
            repository.checkout(newChild);
            console.println("Rebasing " + newChild + " onto " + newParent + "...");
            String forkPoint = downForkPointHash != null ? downForkPointHash :
               session.getForkPointResolver().getForkPointHash(newChild, true);
            parentSync.rebase(newChild, newParent, forkPoint);
         }
      }

      if (delete) {
         deleteBranches(branches, SquashMergeDetection.NONE, false);
      }
   }

   /**
    * Slides out the branches whose tracking branch was deleted on the remote.
    */
   public void slideOutRemovedFromRemote(boolean delete) throws Exception {
      GitRepository repository = session.getRepository();
      BranchLayout layout = session.getLayout();
      Console console = session.getConsole();

      session.expectNoOperationInProgress();

      List<String> slidOutBranches = new ArrayList<>();
      for (String branch : layout.getManagedBranches()) {
         RemoteBranch remoteBranch = repository.getStrictRemoteCounterpart(branch);
         if (remoteBranch == null || repository.remoteBranchExists(remoteBranch.getName())) {
            continue;
         }
         if (!layout.getQualifiers(branch).isSlideOut()) {
            console.println("Skipping " + branch + " as it's marked as slide-out=no");
         } else {
            console.println("Sliding out " + branch);
            slidOutBranches.add(branch);
         }
      }

      for (String branch : slidOutBranches) {
         layout.removeBranch(branch);
      }
      session.saveLayout();

      if (delete) {
         deleteBranches(slidOutBranches, SquashMergeDetection.NONE, true);
      }
   }

   /**
    * Fast-forwards the current branch to its only child connected with a green edge, then
    * offers to push it and to slide that child out.
    */
   public void advance() throws Exception {
      GitRepository repository = session.getRepository();
      BranchLayout layout = session.getLayout();
      Prompter prompter = session.getPrompter();

      session.expectNoOperationInProgress();
      String branch = session.getCurrentBranch();
      session.expectManaged(branch);

      List<String> children = layout.getChildren(branch);
      if (children.isEmpty()) {
         throw new UpdaterException(branch + " does not have any downstream (child) branches to advance towards");
      }

      List<String> candidates = new ArrayList<>();
      for (String child : children) {
         if (isConnectedWithGreenEdge(branch, child)) {
            candidates.add(child);
         }
      }

      String child;
      if (candidates.isEmpty()) {
         throw new UpdaterException("No downstream (child) branch of " + branch + " is connected to " + branch + " with a green edge");
      } else if (candidates.size() > 1) {
         if (prompter.isYes()) {
            throw new UpdaterException("More than one downstream (child) branch of " + branch + " is connected to " +
               branch + " with a green edge and '--yes' option is specified");
         }
         child = prompter.pick(candidates, "downstream branch towards which " + branch + " is to be fast-forwarded");
         if (child == null) {
            return;
         }
      } else {
         child = candidates.get(0);
         if (!prompter.confirm("Fast-forward " + branch + " to match " + child + "?",
            "Fast-forwarding " + branch + " to match " + child + "...")) {
            return;
         }
      }
      repository.mergeFastForwardOnly(child);
      logger.info("Fast-forwarded " + branch + " to " + child);

      String message = "Branch " + branch + " is now fast-forwarded to match " + child + ".";
      String remote = getRemoteForPush(branch);
      if (remote != null && layout.getQualifiers(branch).isPush()) {
         if (prompter.confirm("\n" + message + " Push " + branch + " to " + remote + "?",
            "\n" + message + " Pushing " + branch + " to " + remote + "...")) {
            repository.push(remote, branch, false);
            message = "Branch " + branch + " is now pushed to " + remote + ".";
         }
      }

      if (layout.getQualifiers(child).isSlideOut()) {
         if (prompter.confirm("\n" + message + " Slide " + child + " out of the tree of branch dependencies?",
            "\n" + message + " Sliding " + child + " out of the tree of branch dependencies...")) {
            layout.removeBranch(child);
            session.saveLayout();
         }
      }
   }

   private boolean isConnectedWithGreenEdge(String branch, String child) throws Exception {
      GitRepository repository = session.getRepository();
      ForkPointResolver forkPointResolver = session.getForkPointResolver();
      if (session.getSquashMergeDetector().isMergedToParent(child, branch, SquashMergeDetection.NONE) ||
         !repository.isAncestorOrEqual(branch, child)) {
         return false;
      }
      if (forkPointResolver.hasOverriddenForkPoint(child)) {
         return true;
      }
      ForkPoint forkPoint = forkPointResolver.findForkPoint(child, false);
      return forkPoint != null && forkPoint.getHash().equals(repository.resolve(branch));
   }

   private String getRemoteForPush(String branch) throws Exception {
      RemoteBranch remoteBranch = session.getRepository().getRemoteCounterpart(branch);
      if (remoteBranch != null) {
         return remoteBranch.getRemote();
      }
      List<String> remotes = session.getRepository().getRemotes();
      if (remotes.size() == 1) {
         return remotes.get(0);
      }
      return remotes.contains("origin") ? "origin" : null;
   }

   /**
    * Replaces the annotation of a branch, qualifiers included.
    */
   public void annotate(String branch, String text) throws Exception {
      session.expectManaged(branch);
      session.getLayout().setAnnotation(branch, Annotation.parse(text));
      session.saveLayout();
   }

   /**
    * Offers to delete the local branches that are not in the layout.
    */
   public void deleteUnmanaged() throws Exception {
      session.getConsole().println("Checking for unmanaged branches...");
      List<String> unmanagedBranches = new ArrayList<>();
      for (String branch : session.getRepository().getLocalBranches()) {
         if (!session.getLayout().contains(branch)) {
            unmanagedBranches.add(branch);
         }
      }
      unmanagedBranches.sort(null);
      deleteBranches(unmanagedBranches, session.getRunConfig().getSquashMergeDetection(), session.getRunConfig().isYes());
   }

   private void deleteBranches(List<String> branches, SquashMergeDetection squashMergeDetection, boolean yes) throws Exception {
      GitRepository repository = session.getRepository();
      Console console = session.getConsole();

      List<String> branchesToDelete = new ArrayList<>(branches);
      String currentBranch = repository.getCurrentBranch();
      if (currentBranch != null && branchesToDelete.remove(currentBranch)) {
         console.println("Skipping current branch " + currentBranch);
      }
      if (branchesToDelete.isEmpty()) {
         console.println("No branches to delete");
         return;
      }

      for (String branch : branchesToDelete) {
         if (yes) {
            console.println("Deleting branch " + branch + "...");
            repository.branchDelete(branch);
            continue;
         }

         String description;
         if (session.getSquashMergeDetector().isMergedToParent(branch, "HEAD", squashMergeDetection)) {
            RemoteBranch remoteBranch = repository.getStrictRemoteCounterpart(branch);
            if (remoteBranch != null && repository.remoteBranchExists(remoteBranch.getName()) &&
               !session.getSquashMergeDetector().isMergedToParent(branch, remoteBranch.getName(), squashMergeDetection)) {
               description = branch + " (merged to HEAD, but not merged to " + remoteBranch + ")";
            } else {
               description = branch + " (merged to HEAD)";
            }
         } else {
            description = branch + " (unmerged to HEAD)";
         }

         Answer answer = session.getPrompter().ask("Delete branch " + description + "?", null, Answer.YES, Answer.NO, Answer.QUIT);
         if (answer.isYes()) {
            repository.branchDelete(branch);
            logger.info("Deleted branch " + branch);
         } else if (answer.isQuit()) {
            return;
         }
      }
   }
}
