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

package dev.brus.branch.updater.forkpoint;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

import dev.brus.branch.updater.UpdaterException;
import dev.brus.branch.updater.git.GitCommit;
import dev.brus.branch.updater.git.GitReflogEntry;
import dev.brus.branch.updater.git.GitRepository;
import dev.brus.branch.updater.git.RemoteBranch;
import dev.brus.branch.updater.layout.BranchLayout;
import org.eclipse.jgit.lib.Constants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds where the unique history of a branch starts.
 * <p>
 * Every local branch contributes the commits of its filtered reflog, and of the filtered
 * reflog of its remote counterpart. Walking the history of a branch from its tip, the first
 * commit contributed by any other branch is the inferred fork point, later adjusted against
 * the parent of the branch in the layout. Results are cached until the repository state
 * changes.
 */
public class ForkPointResolver {

   private final static Logger logger = LoggerFactory.getLogger(ForkPointResolver.class);

   private final GitRepository repository;
   private final BranchLayout layout;
   private final ForkPointOverride override;

   private long cachedStateVersion = -1;
   private Map<String, List<BranchPair>> branchPairsByHash;
   private final Map<String, ForkPoint> forkPoints = new HashMap<>();

   public ForkPointResolver(GitRepository repository, BranchLayout layout) {
      this.repository = repository;
      this.layout = layout;
      this.override = new ForkPointOverride(repository);
   }

   public ForkPointOverride getOverride() {
      return override;
   }

   /**
    * The fork point as used to compute rebase ranges and edge colors.
    *
    * @throws ForkPointNotFoundException if the branch shares no history with any other branch
    *                                    and has no parent to fall back to
    */
   public ForkPoint getForkPoint(String branch, boolean useOverrides) throws Exception {
      checkCaches();

      String parent = layout.getParent(branch);
      String key = branch + "|" + parent + "|" + useOverrides;
      ForkPoint forkPoint = forkPoints.get(key);
      if (forkPoint == null) {
         forkPoint = computeForkPoint(branch, parent, useOverrides);
         forkPoints.put(key, forkPoint);
      }
      return forkPoint;
   }

   public String getForkPointHash(String branch, boolean useOverrides) throws Exception {
      return getForkPoint(branch, useOverrides).getHash();
   }

   /**
    * @return the fork point, null if none can be found
    */
   public ForkPoint findForkPoint(String branch, boolean useOverrides) throws Exception {
      try {
         return getForkPoint(branch, useOverrides);
      } catch (ForkPointNotFoundException e) {
         logger.debug(e.getMessage());
         return null;
      }
   }

   private ForkPoint computeForkPoint(String branch, String parent, boolean useOverrides) throws Exception {
      String parentHash = parent != null ? repository.resolve(parent) : null;

      if (useOverrides) {
         String overriddenForkPoint = getOverriddenForkPoint(branch);
         if (overriddenForkPoint != null) {
            if (parentHash != null && repository.isAncestorOrEqual(parent, branch) &&
               !repository.isAncestorOrEqual(parent, overriddenForkPoint)) {
               logger.debug(branch + " descends from its parent " + parent + " but the overridden fork point " +
                  overriddenForkPoint + " does not; using " + parent + " as fork point");
               return new ForkPoint(parentHash, ForkPoint.Source.PARENT, null);
            } else if (parentHash != null && repository.isAncestorOrEqual(overriddenForkPoint, parent)) {
               return new ForkPoint(repository.getMergeBase(parent, branch), ForkPoint.Source.PARENT, null);
            } else {
               logger.debug("Fork point of " + branch + " is overridden to " + overriddenForkPoint);
               return new ForkPoint(overriddenForkPoint, ForkPoint.Source.OVERRIDE, null);
            }
         }
      }

      Match match = findFirstMatch(branch);
      if (match == null) {
         if (parentHash != null) {
            if (repository.isAncestorOrEqual(parent, branch)) {
               logger.debug("Cannot find fork point of " + branch + " but it descends from its parent " + parent);
               return new ForkPoint(parentHash, ForkPoint.Source.PARENT, null);
            }
            String mergeBase = repository.getMergeBase(parent, branch);
            if (mergeBase != null) {
               logger.debug("Cannot find fork point of " + branch + ", using the merge base with " + parent);
               return new ForkPoint(mergeBase, ForkPoint.Source.PARENT, null);
            }
         }
         throw new ForkPointNotFoundException(branch);
      }

      logger.debug("Commit " + match.hash + " is the most recent commit of " + branch +
         " found on the filtered reflog of " + match.getMatchedBranches());

      if (parentHash != null && repository.isAncestorOrEqual(parent, branch) &&
         !repository.isAncestorOrEqual(parent, match.hash)) {
         return new ForkPoint(parentHash, ForkPoint.Source.PARENT, null);
      } else if (parentHash != null && !repository.isAncestorOrEqual(parent, branch) &&
         repository.isAncestorOrEqual(match.hash, parent)) {
         return new ForkPoint(repository.getMergeBase(parent, branch), ForkPoint.Source.PARENT, null);
      }

      String improvedForkPoint = match.hash;
      List<String> improvedContainingBranches = match.getMatchedBranches();
      for (BranchPair pair : match.pairs) {
         String mergeBase = repository.getMergeBase(pair.matchedBranch, branch);
         if (mergeBase != null && repository.isAncestor(improvedForkPoint, mergeBase)) {
            logger.debug("Improving fork point " + improvedForkPoint + " of " + branch + " to " + mergeBase);
            improvedForkPoint = mergeBase;
            improvedContainingBranches = List.of(pair.matchedBranch);
         }
      }
      return new ForkPoint(improvedForkPoint, ForkPoint.Source.INFERRED, improvedContainingBranches);
   }

   /**
    * The most recent commit in the history of the branch found on the filtered reflog of
    * another branch, ignoring the layout and the overrides.
    *
    * @return the commit hash, null if there is none
    */
   public String inferForkPoint(String branch) throws Exception {
      checkCaches();
      Match match = findFirstMatch(branch);
      return match != null ? match.hash : null;
   }

   /**
    * The first branch, scanning the history of the given one from its tip, whose filtered
    * reflog contains a commit of that history and that satisfies the condition.
    *
    * @return the branch name, null if none qualifies
    */
   public String inferParent(String branch, Predicate<String> condition) throws Exception {
      checkCaches();
      if (repository.resolve(branch) == null) {
         return null;
      }
      for (GitCommit commit : repository.log(branch, null)) {
         List<BranchPair> pairs = getContainingPairs(branch, commit.getName());
         for (BranchPair pair : pairs) {
            if (condition.test(pair.localBranch)) {
               logger.debug("Inferred parent " + pair.localBranch + " of " + branch + " from commit " + commit.getName() +
                  " on the filtered reflog of " + pair.matchedBranch);
               return pair.localBranch;
            }
            logger.debug("Rejected parent candidate " + pair.localBranch + " of " + branch);
         }
      }
      return null;
   }

   /**
    * @return the override if it is still an ancestor of (or equal to) the branch tip, otherwise null
    */
   public String getOverriddenForkPoint(String branch) throws Exception {
      String to = override.get(branch);
      if (to == null) {
         return null;
      }
      if (repository.resolve(to) == null || !repository.isAncestorOrEqual(to, branch)) {
         logger.warn("Since branch " + branch + " is no longer a descendant of commit " + to +
            ", the fork point override to this commit no longer applies. Consider running 'fork-point --unset-override " + branch + "'");
         return null;
      }
      return repository.resolve(to);
   }

   public boolean hasOverriddenForkPoint(String branch) throws Exception {
      return getOverriddenForkPoint(branch) != null;
   }

   public void overrideTo(String branch, String revision) throws Exception {
      String hash = repository.resolve(revision);
      if (hash == null) {
         throw new UpdaterException("Cannot find revision " + revision);
      }
      if (!repository.isAncestorOrEqual(hash, branch)) {
         throw new UpdaterException("Cannot override fork point: " + revision + " is not an ancestor of " + branch);
      }
      override.set(branch, hash);
      forkPoints.clear();
      logger.info("Fork point for " + branch + " is overridden to " + hash);
   }

   public void unsetOverride(String branch) throws Exception {
      override.unset(branch);
      forkPoints.clear();
   }

   /**
    * Reflog entries of a local or remote-tracking branch that reflect commits made on the
    * branch, newest first. Creation, resets, fetches into the branch, pushes and no-op
    * rebases are left out.
    */
   public List<String> getFilteredReflog(String refName) throws Exception {
      List<GitReflogEntry> reflog = repository.getReflogEntries(refName);
      List<String> result = new ArrayList<>();
      if (reflog.isEmpty()) {
         return result;
      }

      String branchName = refName.startsWith(Constants.R_HEADS) ? refName.substring(Constants.R_HEADS.length()) : null;

      Set<String> excludedHashes = new HashSet<>();
      GitReflogEntry earliest = reflog.get(reflog.size() - 1);
      if (earliest.getSubject().startsWith("branch: Created from")) {
         excludedHashes.add(earliest.getNewName());
      }

      for (GitReflogEntry entry : reflog) {
         String subject = entry.getSubject();
         boolean excluded = excludedHashes.contains(entry.getNewName()) ||
            subject.startsWith("branch: Created from") ||
            (branchName != null && subject.equals("branch: Reset to " + branchName)) ||
            subject.equals("branch: Reset to HEAD") ||
            subject.startsWith("reset: moving to ") ||
            subject.startsWith("fetch . ") ||
            subject.equals("update by push") ||
            subject.equals("rebase finished: " + refName + " onto " + entry.getNewName()) ||
            subject.equals("rebase -i (finish): " + refName + " onto " + entry.getNewName()) ||
            subject.equals("rebase (finish): " + refName + " onto " + entry.getNewName());
         if (!excluded) {
            result.add(entry.getNewName());
         }
      }
      return result;
   }

   private void checkCaches() {
      if (cachedStateVersion != repository.getStateVersion()) {
         logger.debug("Discarding fork point caches");
         cachedStateVersion = repository.getStateVersion();
         branchPairsByHash = null;
         forkPoints.clear();
      }
   }

   private Map<String, List<BranchPair>> getBranchPairsByHash() throws Exception {
      if (branchPairsByHash == null) {
         branchPairsByHash = new LinkedHashMap<>();
         for (String localBranch : repository.getLocalBranches()) {
            Set<String> localHashes = new HashSet<>();
            for (String hash : getFilteredReflog(Constants.R_HEADS + localBranch)) {
               localHashes.add(hash);
               branchPairsByHash.computeIfAbsent(hash, h -> new ArrayList<>()).add(new BranchPair(localBranch, localBranch));
            }

            RemoteBranch remoteBranch = repository.getRemoteCounterpart(localBranch);
            if (remoteBranch != null) {
               for (String hash : getFilteredReflog(remoteBranch.getRefName())) {
                  if (!localHashes.contains(hash)) {
                     branchPairsByHash.computeIfAbsent(hash, h -> new ArrayList<>()).add(new BranchPair(localBranch, remoteBranch.getName()));
                  }
               }
            }
         }
      }
      return branchPairsByHash;
   }

   private List<BranchPair> getContainingPairs(String branch, String hash) throws Exception {
      List<BranchPair> pairs = new ArrayList<>();
      for (BranchPair pair : getBranchPairsByHash().getOrDefault(hash, List.of())) {
         if (!pair.localBranch.equals(branch)) {
            pairs.add(pair);
         }
      }
      pairs.sort(Comparator.comparing((BranchPair pair) -> pair.matchedBranch));
      return pairs;
   }

   private Match findFirstMatch(String branch) throws Exception {
      if (repository.resolve(branch) == null) {
         return null;
      }
      for (GitCommit commit : repository.log(branch, null)) {
         List<BranchPair> pairs = getContainingPairs(branch, commit.getName());
         if (!pairs.isEmpty()) {
            return new Match(commit.getName(), pairs);
         }
      }
      return null;
   }

   private static class BranchPair {
      private final String localBranch;
      private final String matchedBranch;

      BranchPair(String localBranch, String matchedBranch) {
         this.localBranch = localBranch;
         this.matchedBranch = matchedBranch;
      }
   }

   private static class Match {
      private final String hash;
      private final List<BranchPair> pairs;

      Match(String hash, List<BranchPair> pairs) {
         this.hash = hash;
         this.pairs = pairs;
      }

      List<String> getMatchedBranches() {
         List<String> matchedBranches = new ArrayList<>();
         for (BranchPair pair : pairs) {
            matchedBranches.add(pair.matchedBranch);
         }
         return matchedBranches;
      }
   }
}
