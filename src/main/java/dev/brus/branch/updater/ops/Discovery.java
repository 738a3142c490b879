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
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import dev.brus.branch.updater.RunConfig;
import dev.brus.branch.updater.UpdaterException;
import dev.brus.branch.updater.UpdaterSession;
import dev.brus.branch.updater.git.GitRepository;
import dev.brus.branch.updater.layout.Annotation;
import dev.brus.branch.updater.layout.BranchLayout;
import dev.brus.branch.updater.layout.Qualifiers;
import dev.brus.branch.updater.merge.SquashMergeDetection;
import dev.brus.branch.updater.status.StatusPrinter;
import dev.brus.branch.updater.util.Console;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Proposes a branch layout built from the local branches, each one attached to the parent
 * inferred from its fork point.
 */
public class Discovery {
   public static final int DEFAULT_FRESH_BRANCH_COUNT = 10;

   private final static Logger logger = LoggerFactory.getLogger(Discovery.class);

   private static final String[] DEFAULT_ROOTS = {"master", "main", "develop"};

   private final UpdaterSession session;

   public Discovery(UpdaterSession session) {
      this.session = session;
   }

   /**
    * @param roots             the branches to use as roots, empty for master or main, and develop
    * @param freshBranchCount  how many of the most recently checked out branches are kept, 0 to keep all
    * @return the discovered layout, saved only if the user agreed
    */
   public BranchLayout discover(List<String> roots, int freshBranchCount, boolean listCommits) throws Exception {
      GitRepository repository = session.getRepository();
      Console console = session.getConsole();

      List<String> localBranches = repository.getLocalBranches();
      if (localBranches.isEmpty()) {
         throw new UpdaterException("No local branches found");
      }
      for (String root : roots) {
         if (!localBranches.contains(root)) {
            throw new UpdaterException(root + " is not a local branch");
         }
      }

      List<String> discoveredRoots = new ArrayList<>(roots);
      if (discoveredRoots.isEmpty()) {
         if (localBranches.contains(DEFAULT_ROOTS[0])) {
            discoveredRoots.add(DEFAULT_ROOTS[0]);
         } else if (localBranches.contains(DEFAULT_ROOTS[1])) {
            discoveredRoots.add(DEFAULT_ROOTS[1]);
         }
         if (localBranches.contains(DEFAULT_ROOTS[2])) {
            discoveredRoots.add(DEFAULT_ROOTS[2]);
         }
      }

      List<String> candidates = new ArrayList<>();
      for (String branch : localBranches) {
         if (!discoveredRoots.contains(branch)) {
            candidates.add(branch);
         }
      }

      Set<String> staleBranches = new HashSet<>();
      if (freshBranchCount > 0 && candidates.size() > freshBranchCount) {
         List<String> recentBranches = new ArrayList<>(repository.getRecentlyCheckedOutBranches());
         recentBranches.retainAll(candidates);
         for (String candidate : candidates) {
            if (!recentBranches.contains(candidate)) {
               recentBranches.add(candidate);
            }
         }
         staleBranches.addAll(recentBranches.subList(freshBranchCount, recentBranches.size()));
         console.warn("to keep the size of the discovered tree reasonable (ca. " + freshBranchCount + " branches), " +
            "only the most recently checked out branches are included.\n" +
            "Use 'discover --max-branches=<n>' to change this limit, 0 to include all branches.");
      }
      candidates.removeAll(staleBranches);

      BranchLayout previousLayout = session.getLayout();
      BranchLayout layout = new BranchLayout();
      for (String root : discoveredRoots) {
         layout.addBranch(root, null, false, keepQualifiers(previousLayout, root));
      }

      Map<String, String> rootOf = new HashMap<>();
      for (String branch : localBranches) {
         rootOf.put(branch, branch);
      }

      // Parents are picked so that no branch ends up under one of its own descendants.
      Map<String, String> parentOf = new HashMap<>();
      List<String> extraRoots = new ArrayList<>();
      for (String branch : candidates) {
         String parent = session.getForkPointResolver().inferParent(branch,
            candidate -> !getRootOf(rootOf, candidate).equals(branch) && !staleBranches.contains(candidate));
         if (parent != null) {
            logger.debug("Inferred parent of " + branch + " is " + parent);
            parentOf.put(branch, parent);
            rootOf.put(branch, parent);
         } else {
            logger.debug("Inferred no parent for " + branch + ", attaching it as a new root");
            extraRoots.add(branch);
         }
      }
      for (String root : extraRoots) {
         layout.addBranch(root, null, false, keepQualifiers(previousLayout, root));
      }
      for (String branch : candidates) {
         attach(layout, previousLayout, parentOf, branch);
      }

      List<String> mergedBranches = new ArrayList<>();
      for (String branch : layout.getManagedBranches()) {
         String parent = layout.getParent(branch);
         if (parent != null && layout.getChildren(branch).isEmpty() &&
            session.getSquashMergeDetector().isMergedToParent(branch, parent, SquashMergeDetection.NONE)) {
            mergedBranches.add(branch);
         }
      }
      if (!mergedBranches.isEmpty()) {
         console.warn("skipping " + String.join(", ", mergedBranches) + " since " +
            (mergedBranches.size() == 1 ? "it's" : "they're") + " merged to another branch and would not have any downstream branches.");
         for (String branch : mergedBranches) {
            layout.removeBranch(branch);
         }
      }

      RunConfig previewConfig = new RunConfig().setSquashMergeDetection(SquashMergeDetection.NONE);
      UpdaterSession preview = new UpdaterSession(repository, previewConfig, console, session.getLayoutFile(), layout);
      console.println("Discovered tree of branch dependencies:\n");
      console.println(new StatusPrinter(preview).render(new StatusPrinter(preview).classifyEdges(), listCommits));

      String layoutPath = session.getLayoutFile().getFile().getPath();
      boolean backup = !previousLayout.isEmpty();
      String backupMessage = backup ? "\nThe existing branch layout file will be backed up as " + layoutPath + "~" : "";
      if (session.getPrompter().confirm("Save the above tree to " + layoutPath + "?" + backupMessage,
         "Saving the above tree to " + layoutPath + "..." + backupMessage)) {
         if (backup) {
            session.getLayoutFile().backup();
         }
         session.getLayoutFile().save(layout);
         logger.info("Saved discovered layout of " + layout.getManagedBranches().size() + " branches");
      }
      return layout;
   }

   private void attach(BranchLayout layout, BranchLayout previousLayout, Map<String, String> parentOf, String branch) throws Exception {
      if (layout.contains(branch)) {
         return;
      }
      String parent = parentOf.get(branch);
      attach(layout, previousLayout, parentOf, parent);
      layout.addBranch(branch, parent, false, keepQualifiers(previousLayout, branch));
   }

   private Annotation keepQualifiers(BranchLayout previousLayout, String branch) {
      Qualifiers qualifiers = previousLayout.getQualifiers(branch);
      return qualifiers.equals(Qualifiers.DEFAULT) ? Annotation.EMPTY : Annotation.of("", qualifiers);
   }

   private String getRootOf(Map<String, String> rootOf, String branch) {
      String root = rootOf.getOrDefault(branch, branch);
      if (!root.equals(branch)) {
         root = getRootOf(rootOf, root);
         rootOf.put(branch, root);
      }
      return root;
   }
}
