package dev.brus.branch.updater.git;

import java.io.File;
import java.util.List;

/**
 * Queries and ref-moving operations on a local repository. Branches are given by short name,
 * commits by any revision git can resolve. Query results may be cached until the next
 * ref-moving operation.
 */
public interface GitRepository extends AutoCloseable {
   File getDirectory();

   File getGitDirectory();

   GitRepository open(File dir) throws Exception;

   /**
    * Incremented by every operation that can move a ref.
    */
   long getStateVersion();

   void flushCaches();

   String getCurrentBranch() throws Exception;

   List<String> getLocalBranches() throws Exception;

   List<String> getRemoteBranches() throws Exception;

   List<String> getRemotes() throws Exception;

   boolean branchExists(String name) throws Exception;

   boolean remoteBranchExists(String name) throws Exception;

   /**
    * @return the full commit hash, null if the revision does not resolve
    */
   String resolve(String revision) throws Exception;

   GitCommit resolveCommit(String revision) throws Exception;

   /**
    * Strict ancestry: false when both revisions point to the same commit.
    */
   boolean isAncestor(String earlier, String later) throws Exception;

   boolean isAncestorOrEqual(String earlier, String later) throws Exception;

   String getMergeBase(String revision, String otherRevision) throws Exception;

   /**
    * @param refName a full ref name, i.e. refs/heads/feature
    * @return the reflog entries, newest first
    */
   List<GitReflogEntry> getReflogEntries(String refName) throws Exception;

   String getTreeHash(String revision) throws Exception;

   /**
    * Identifies the change between two commits independently of where it is applied.
    *
    * @param fromExclusive the base commit, null for the empty tree
    */
   String getPatchId(String fromExclusive, String toInclusive) throws Exception;

   /**
    * The configured tracking branch, whether or not it still exists.
    */
   RemoteBranch getStrictRemoteCounterpart(String branch) throws Exception;

   /**
    * The existing tracking branch, or the first remote holding a branch with the same name.
    */
   RemoteBranch getRemoteCounterpart(String branch) throws Exception;

   AheadBehindCounts getAheadBehindCounts(String revision, String otherRevision) throws Exception;

   /**
    * Commits reachable from addStart and not from notStart, newest first.
    */
   List<GitCommit> log(String addStart, String notStart) throws Exception;

   /**
    * Local branches in the order they were last checked out, most recent first.
    */
   List<String> getRecentlyCheckedOutBranches() throws Exception;

   boolean isOperationInProgress() throws Exception;

   String getConfigValue(String key) throws Exception;

   /**
    * Reads a boolean the way git does, so yes, on, true and 1 are all true.
    */
   boolean getConfigBoolean(String key, boolean defaultValue) throws Exception;

   void setConfigValue(String key, String value) throws Exception;

   void unsetConfigValue(String key) throws Exception;

   void checkout(String branch) throws Exception;

   void branchCreate(String name, String startPoint) throws Exception;

   void branchDelete(String name) throws Exception;

   void rebase(String onto, String fromExclusive, String branch, boolean interactive) throws Exception;

   void merge(String branch, boolean noEdit) throws Exception;

   void mergeFastForwardOnly(String branch) throws Exception;

   void push(String remote, String branch, boolean forceWithLease) throws Exception;

   void pull(String branch, RemoteBranch remoteBranch) throws Exception;

   void fetch(String remote) throws Exception;

   void resetKeep(String revision) throws Exception;

   void setUpstream(String branch, RemoteBranch remoteBranch) throws Exception;
}
