package dev.brus.branch.updater.git;

import java.io.File;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import dev.brus.branch.updater.UpdaterException;
import dev.brus.branch.updater.util.CommandExecutor;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.errors.RefNotFoundException;
import org.eclipse.jgit.diff.PatchIdDiffFormatter;
import org.eclipse.jgit.errors.IncorrectObjectTypeException;
import org.eclipse.jgit.errors.MissingObjectException;
import org.eclipse.jgit.lib.BranchConfig;
import org.eclipse.jgit.lib.Constants;
import org.eclipse.jgit.lib.ObjectId;
import org.eclipse.jgit.lib.Ref;
import org.eclipse.jgit.lib.ReflogEntry;
import org.eclipse.jgit.lib.Repository;
import org.eclipse.jgit.lib.RepositoryState;
import org.eclipse.jgit.lib.StoredConfig;
import org.eclipse.jgit.revwalk.RevCommit;
import org.eclipse.jgit.revwalk.RevWalk;
import org.eclipse.jgit.revwalk.filter.RevFilter;
import org.eclipse.jgit.storage.file.FileRepositoryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Answers queries through JGit and moves refs by running the git executable, so that rebase,
 * merge and push behave exactly as they do on the command line (hooks, editors, credentials).
 */
public class JGitRepository implements GitRepository {

   private final static Logger logger = LoggerFactory.getLogger(JGitRepository.class);

   private final static Pattern checkoutPattern = Pattern.compile("^checkout: moving from (\\S+) to (\\S+)$");

   private Git git;
   private long stateVersion;

   private final Map<String, String> resolvedRevisions = new HashMap<>();
   private final Map<String, Boolean> ancestry = new HashMap<>();
   private final Map<String, String> mergeBases = new HashMap<>();
   private final Map<String, List<GitReflogEntry>> reflogs = new HashMap<>();
   private final Map<String, String> treeHashes = new HashMap<>();
   private final Map<String, String> patchIds = new HashMap<>();
   private List<String> localBranches;
   private List<String> remoteBranches;

   @Override
   public File getDirectory() {
      return git.getRepository().getWorkTree();
   }

   @Override
   public File getGitDirectory() {
      return git.getRepository().getDirectory();
   }

   @Override
   public GitRepository open(File dir) throws Exception {
      FileRepositoryBuilder repositoryBuilder = new FileRepositoryBuilder()
         .readEnvironment()
         .findGitDir(dir);
      if (repositoryBuilder.getGitDir() == null) {
         throw new UpdaterException("Not a git repository: " + dir.getAbsolutePath());
      }
      git = new Git(repositoryBuilder.build());
      return this;
   }

   @Override
   public void close() throws Exception {
      Repository repository = git.getRepository();
      git.close();
      repository.close();
   }

   @Override
   public long getStateVersion() {
      return stateVersion;
   }

   @Override
   public void flushCaches() {
      logger.debug("Flushing caches at state version " + stateVersion);
      stateVersion++;
      resolvedRevisions.clear();
      ancestry.clear();
      mergeBases.clear();
      reflogs.clear();
      treeHashes.clear();
      patchIds.clear();
      localBranches = null;
      remoteBranches = null;
   }

   @Override
   public String getCurrentBranch() throws Exception {
      String fullBranch = git.getRepository().getFullBranch();
      if (fullBranch == null || !fullBranch.startsWith(Constants.R_HEADS)) {
         return null;
      }
      return fullBranch.substring(Constants.R_HEADS.length());
   }

   @Override
   public List<String> getLocalBranches() throws Exception {
      if (localBranches == null) {
         localBranches = Collections.unmodifiableList(listRefs(Constants.R_HEADS));
      }
      return localBranches;
   }

   @Override
   public List<String> getRemoteBranches() throws Exception {
      if (remoteBranches == null) {
         List<String> branches = new ArrayList<>();
         for (String remoteBranch : listRefs(Constants.R_REMOTES)) {
            if (!remoteBranch.endsWith("/" + Constants.HEAD)) {
               branches.add(remoteBranch);
            }
         }
         remoteBranches = Collections.unmodifiableList(branches);
      }
      return remoteBranches;
   }

   private List<String> listRefs(String prefix) throws Exception {
      List<String> names = new ArrayList<>();
      for (Ref ref : git.getRepository().getRefDatabase().getRefsByPrefix(prefix)) {
         names.add(ref.getName().substring(prefix.length()));
      }
      Collections.sort(names);
      return names;
   }

   @Override
   public List<String> getRemotes() throws Exception {
      List<String> remotes = new ArrayList<>(git.getRepository().getRemoteNames());
      Collections.sort(remotes);
      return remotes;
   }

   @Override
   public boolean branchExists(String name) throws Exception {
      return getLocalBranches().contains(name);
   }

   @Override
   public boolean remoteBranchExists(String name) throws Exception {
      return getRemoteBranches().contains(name);
   }

   @Override
   public String resolve(String revision) throws Exception {
      if (!resolvedRevisions.containsKey(revision)) {
         ObjectId objectId;
         try {
            objectId = git.getRepository().resolve(revision + "^{commit}");
         } catch (MissingObjectException | IncorrectObjectTypeException e) {
            logger.debug("Cannot resolve " + revision + ": " + e.getMessage());
            objectId = null;
         }
         resolvedRevisions.put(revision, objectId != null ? objectId.getName() : null);
      }
      return resolvedRevisions.get(revision);
   }

   private ObjectId requireObjectId(String revision) throws Exception {
      String name = resolve(revision);
      if (name == null) {
         throw new UpdaterException("Cannot find revision " + revision);
      }
      return ObjectId.fromString(name);
   }

   @Override
   public GitCommit resolveCommit(String revision) throws Exception {
      return new JGitCommit(git.getRepository().parseCommit(requireObjectId(revision)));
   }

   @Override
   public boolean isAncestor(String earlier, String later) throws Exception {
      return !requireObjectId(earlier).equals(requireObjectId(later)) && isAncestorOrEqual(earlier, later);
   }

   @Override
   public boolean isAncestorOrEqual(String earlier, String later) throws Exception {
      ObjectId earlierId = requireObjectId(earlier);
      ObjectId laterId = requireObjectId(later);
      String key = earlierId.getName() + ".." + laterId.getName();

      Boolean result = ancestry.get(key);
      if (result == null) {
         try (RevWalk walk = new RevWalk(git.getRepository())) {
            result = walk.isMergedInto(walk.parseCommit(earlierId), walk.parseCommit(laterId));
         }
         ancestry.put(key, result);
      }
      return result;
   }

   @Override
   public String getMergeBase(String revision, String otherRevision) throws Exception {
      ObjectId id = requireObjectId(revision);
      ObjectId otherId = requireObjectId(otherRevision);
      String key = id.getName().compareTo(otherId.getName()) < 0 ?
         id.getName() + "..." + otherId.getName() : otherId.getName() + "..." + id.getName();

      if (!mergeBases.containsKey(key)) {
         try (RevWalk walk = new RevWalk(git.getRepository())) {
            walk.setRevFilter(RevFilter.MERGE_BASE);
            walk.markStart(walk.parseCommit(id));
            walk.markStart(walk.parseCommit(otherId));
            RevCommit mergeBase = walk.next();
            mergeBases.put(key, mergeBase != null ? mergeBase.getName() : null);
         }
      }
      return mergeBases.get(key);
   }

   @Override
   public List<GitReflogEntry> getReflogEntries(String refName) throws Exception {
      List<GitReflogEntry> entries = reflogs.get(refName);
      if (entries == null) {
         entries = new ArrayList<>();
         Collection<ReflogEntry> reflogEntries;
         try {
            reflogEntries = git.reflog().setRef(refName).call();
         } catch (RefNotFoundException e) {
            logger.debug("No reflog for " + refName + ": " + e.getMessage());
            reflogEntries = Collections.emptyList();
         }
         for (ReflogEntry reflogEntry : reflogEntries) {
            entries.add(new GitReflogEntry(reflogEntry.getNewId().getName(), reflogEntry.getComment()));
         }
         entries = Collections.unmodifiableList(entries);
         reflogs.put(refName, entries);
      }
      return entries;
   }

   @Override
   public String getTreeHash(String revision) throws Exception {
      String commitName = requireObjectId(revision).getName();
      String treeHash = treeHashes.get(commitName);
      if (treeHash == null) {
         treeHash = resolveCommit(commitName).getTreeName();
         treeHashes.put(commitName, treeHash);
      }
      return treeHash;
   }

   @Override
   public String getPatchId(String fromExclusive, String toInclusive) throws Exception {
      ObjectId fromId = fromExclusive != null ? requireObjectId(fromExclusive) : null;
      ObjectId toId = requireObjectId(toInclusive);
      String key = (fromId != null ? fromId.getName() : "") + ".." + toId.getName();

      String patchId = patchIds.get(key);
      if (patchId == null) {
         try (PatchIdDiffFormatter formatter = new PatchIdDiffFormatter()) {
            formatter.setRepository(git.getRepository());
            formatter.format(fromId, toId);
            formatter.flush();
            patchId = formatter.getCalulatedPatchId().getName();
         }
         patchIds.put(key, patchId);
      }
      return patchId;
   }

   @Override
   public RemoteBranch getStrictRemoteCounterpart(String branch) throws Exception {
      BranchConfig branchConfig = new BranchConfig(git.getRepository().getConfig(), branch);
      String remoteTrackingBranch = branchConfig.getRemoteTrackingBranch();
      String remote = branchConfig.getRemote();
      if (remoteTrackingBranch == null || remote == null || !remoteTrackingBranch.startsWith(Constants.R_REMOTES + remote + "/")) {
         return null;
      }
      return new RemoteBranch(remote, remoteTrackingBranch.substring((Constants.R_REMOTES + remote + "/").length()));
   }

   @Override
   public RemoteBranch getRemoteCounterpart(String branch) throws Exception {
      RemoteBranch strictCounterpart = getStrictRemoteCounterpart(branch);
      if (strictCounterpart != null && remoteBranchExists(strictCounterpart.getName())) {
         return strictCounterpart;
      }
      for (String remote : getRemotes()) {
         RemoteBranch candidate = new RemoteBranch(remote, branch);
         if (remoteBranchExists(candidate.getName())) {
            return candidate;
         }
      }
      return null;
   }

   @Override
   public AheadBehindCounts getAheadBehindCounts(String revision, String otherRevision) throws Exception {
      return new AheadBehindCounts(countCommits(revision, otherRevision), countCommits(otherRevision, revision));
   }

   private int countCommits(String addStart, String notStart) throws Exception {
      int count = 0;
      try (RevWalk walk = new RevWalk(git.getRepository())) {
         walk.markStart(walk.parseCommit(requireObjectId(addStart)));
         walk.markUninteresting(walk.parseCommit(requireObjectId(notStart)));
         for (Iterator<RevCommit> iterator = walk.iterator(); iterator.hasNext(); iterator.next()) {
            count++;
         }
      }
      return count;
   }

   @Override
   public List<GitCommit> log(String addStart, String notStart) throws Exception {
      List<GitCommit> commits = new ArrayList<>();
      try (RevWalk walk = new RevWalk(git.getRepository())) {
         walk.markStart(walk.parseCommit(requireObjectId(addStart)));
         if (notStart != null) {
            walk.markUninteresting(walk.parseCommit(requireObjectId(notStart)));
         }
         for (RevCommit commit : walk) {
            commits.add(new JGitCommit(commit));
         }
      }
      return commits;
   }

   @Override
   public List<String> getRecentlyCheckedOutBranches() throws Exception {
      Set<String> branches = new LinkedHashSet<>();
      String currentBranch = getCurrentBranch();
      if (currentBranch != null) {
         branches.add(currentBranch);
      }
      for (GitReflogEntry entry : getReflogEntries(Constants.HEAD)) {
         Matcher checkoutMatcher = checkoutPattern.matcher(entry.getSubject());
         if (checkoutMatcher.find()) {
            branches.add(checkoutMatcher.group(2));
            branches.add(checkoutMatcher.group(1));
         }
      }
      branches.retainAll(getLocalBranches());
      return new ArrayList<>(branches);
   }

   @Override
   public boolean isOperationInProgress() throws Exception {
      RepositoryState state = git.getRepository().getRepositoryState();
      return state != RepositoryState.SAFE && state != RepositoryState.BARE;
   }

   @Override
   public String getConfigValue(String key) throws Exception {
      String[] keyTokens = splitConfigKey(key);
      return git.getRepository().getConfig().getString(keyTokens[0], keyTokens[1], keyTokens[2]);
   }

   @Override
   public boolean getConfigBoolean(String key, boolean defaultValue) throws Exception {
      String[] keyTokens = splitConfigKey(key);
      return git.getRepository().getConfig().getBoolean(keyTokens[0], keyTokens[1], keyTokens[2], defaultValue);
   }

   @Override
   public void setConfigValue(String key, String value) throws Exception {
      String[] keyTokens = splitConfigKey(key);
      StoredConfig config = git.getRepository().getConfig();
      config.setString(keyTokens[0], keyTokens[1], keyTokens[2], value);
      config.save();
   }

   @Override
   public void unsetConfigValue(String key) throws Exception {
      String[] keyTokens = splitConfigKey(key);
      StoredConfig config = git.getRepository().getConfig();
      config.unset(keyTokens[0], keyTokens[1], keyTokens[2]);
      config.save();
   }

   /**
    * Splits section.subsection.name, where the subsection may contain dots.
    */
   private static String[] splitConfigKey(String key) {
      int firstDot = key.indexOf('.');
      int lastDot = key.lastIndexOf('.');
      if (firstDot < 0) {
         throw new IllegalArgumentException("Invalid config key: " + key);
      }
      String section = key.substring(0, firstDot);
      String name = key.substring(lastDot + 1);
      String subsection = firstDot == lastDot ? null : key.substring(firstDot + 1, lastDot);
      return new String[] {section, subsection, name};
   }

   @Override
   public void checkout(String branch) throws Exception {
      runGit("checkout " + branch + " --", false);
   }

   @Override
   public void branchCreate(String name, String startPoint) throws Exception {
      runGit("branch " + name + " " + startPoint, false);
   }

   @Override
   public void branchDelete(String name) throws Exception {
      runGit("branch -D " + name, false);
   }

   @Override
   public void rebase(String onto, String fromExclusive, String branch, boolean interactive) throws Exception {
      runGit("rebase " + (interactive ? "--interactive " : "") + "--onto " + onto + " " + fromExclusive + " " + branch, interactive);
   }

   @Override
   public void merge(String branch, boolean noEdit) throws Exception {
      runGit("merge " + (noEdit ? "--no-edit " : "") + branch, !noEdit);
   }

   @Override
   public void mergeFastForwardOnly(String branch) throws Exception {
      runGit("merge --ff-only " + branch, false);
   }

   @Override
   public void push(String remote, String branch, boolean forceWithLease) throws Exception {
      runGit("push --set-upstream " + (forceWithLease ? "--force-with-lease " : "") + remote + " " + branch, false);
   }

   @Override
   public void pull(String branch, RemoteBranch remoteBranch) throws Exception {
      fetch(remoteBranch.getRemote());
      mergeFastForwardOnly(remoteBranch.getName());
      setUpstream(branch, remoteBranch);
   }

   @Override
   public void fetch(String remote) throws Exception {
      runGit("fetch --prune " + remote, false);
   }

   @Override
   public void resetKeep(String revision) throws Exception {
      runGit("reset --keep " + revision, false);
   }

   @Override
   public void setUpstream(String branch, RemoteBranch remoteBranch) throws Exception {
      runGit("branch --set-upstream-to=" + remoteBranch.getName() + " " + branch, false);
   }

   private void runGit(String arguments, boolean interactive) throws Exception {
      String commandLine = "git " + arguments;
      StringWriter outputWriter = new StringWriter();
      int exitCode;
      try {
         if (interactive) {
            exitCode = CommandExecutor.tryExecuteInteractive(commandLine, getDirectory());
         } else {
            exitCode = CommandExecutor.tryExecute(commandLine, getDirectory(), outputWriter);
         }
      } finally {
         flushCaches();
      }

      if (exitCode != 0) {
         throw new GitCommandException(commandLine, exitCode, CommandExecutor.trimLastNewLine(outputWriter));
      }
   }
}
