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

package dev.brus.branch.updater;

import java.util.ArrayList;
import java.util.List;

import dev.brus.branch.updater.forkpoint.ForkPointResolver;
import dev.brus.branch.updater.git.GitRepository;
import dev.brus.branch.updater.layout.BranchLayout;
import dev.brus.branch.updater.layout.LayoutFile;
import dev.brus.branch.updater.merge.SquashMergeDetector;
import dev.brus.branch.updater.sync.SyncStateClassifier;
import dev.brus.branch.updater.util.Answer;
import dev.brus.branch.updater.util.Console;
import dev.brus.branch.updater.util.Prompter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Everything a command works with: the repository, the loaded branch layout and the
 * components computing fork points and sync states over them.
 */
public class UpdaterSession {

   private final static Logger logger = LoggerFactory.getLogger(UpdaterSession.class);

   private final GitRepository repository;
   private final RunConfig runConfig;
   private final Prompter prompter;
   private final LayoutFile layoutFile;
   private final BranchLayout layout;
   private final ForkPointResolver forkPointResolver;
   private final SquashMergeDetector squashMergeDetector;
   private final SyncStateClassifier syncStateClassifier;

   public UpdaterSession(GitRepository repository, RunConfig runConfig, Console console, LayoutFile layoutFile, BranchLayout layout) {
      this.repository = repository;
      this.runConfig = runConfig;
      this.prompter = new Prompter(console, runConfig.isYes());
      this.layoutFile = layoutFile;
      this.layout = layout;
      this.forkPointResolver = new ForkPointResolver(repository, layout);
      this.squashMergeDetector = new SquashMergeDetector(repository, forkPointResolver);
      this.syncStateClassifier = new SyncStateClassifier(repository, layout, forkPointResolver, squashMergeDetector, runConfig);
   }

   /**
    * Loads the layout file of the repository.
    *
    * @param verifyBranches whether branches that are not local branches any more are slid out
    */
   public static UpdaterSession open(GitRepository repository, RunConfig runConfig, Console console, boolean verifyBranches) throws Exception {
      LayoutFile layoutFile = new LayoutFile(repository.getGitDirectory());
      UpdaterSession session = new UpdaterSession(repository, runConfig, console, layoutFile, layoutFile.load());
      if (verifyBranches) {
         session.slideOutInvalidBranches();
      }
      return session;
   }

   public GitRepository getRepository() {
      return repository;
   }

   public RunConfig getRunConfig() {
      return runConfig;
   }

   public Prompter getPrompter() {
      return prompter;
   }

   public Console getConsole() {
      return prompter.getConsole();
   }

   public LayoutFile getLayoutFile() {
      return layoutFile;
   }

   public BranchLayout getLayout() {
      return layout;
   }

   public ForkPointResolver getForkPointResolver() {
      return forkPointResolver;
   }

   public SquashMergeDetector getSquashMergeDetector() {
      return squashMergeDetector;
   }

   public SyncStateClassifier getSyncStateClassifier() {
      return syncStateClassifier;
   }

   public void saveLayout() throws Exception {
      layoutFile.save(layout);
   }

   public void expectManaged(String branch) throws UpdaterException {
      if (!layout.contains(branch)) {
         throw new UpdaterException("Branch " + branch + " not found in the tree of branch dependencies. " +
            "Use 'add " + branch + "' or edit the branch layout file " + layoutFile.getFile().getPath());
      }
   }

   public void expectNoOperationInProgress() throws Exception {
      if (repository.isOperationInProgress()) {
         throw new UpdaterException("A rebase or merge is in progress; finish or abort it first");
      }
   }

   public String getCurrentBranch() throws Exception {
      String currentBranch = repository.getCurrentBranch();
      if (currentBranch == null) {
         throw new UpdaterException("Not currently on any branch");
      }
      return currentBranch;
   }

   /**
    * Drops layout branches that are not local branches. The layout file is rewritten only if
    * the user agrees, or right away when confirmations are off.
    */
   void slideOutInvalidBranches() throws Exception {
      List<String> invalidBranches = new ArrayList<>();
      for (String branch : layout.getManagedBranches()) {
         if (!repository.branchExists(branch)) {
            invalidBranches.add(branch);
         }
      }
      if (invalidBranches.isEmpty()) {
         return;
      }

      boolean save;
      if (runConfig.isYes()) {
         getConsole().warn("sliding invalid " + (invalidBranches.size() == 1 ? "branch " : "branches ") +
            String.join(", ", invalidBranches) + " out of the branch layout file");
         save = true;
      } else {
         String question = "Skipping " + String.join(", ", invalidBranches) +
            (invalidBranches.size() == 1 ? " which is not a local branch" : " which are not local branches") +
            " (perhaps " + (invalidBranches.size() == 1 ? "it has" : "they have") + " been deleted?). Slide " +
            (invalidBranches.size() == 1 ? "it" : "them") + " out from the branch layout file?";
         save = prompter.ask(question, null, Answer.YES, Answer.NO) == Answer.YES;
      }

      for (String invalidBranch : invalidBranches) {
         layout.removeBranch(invalidBranch);
      }
      if (save) {
         saveLayout();
      } else {
         logger.debug("Skipping invalid branches " + invalidBranches + " for this run only");
      }
   }
}
