package dev.brus.branch.updater.sync;

import java.util.Date;

import dev.brus.branch.updater.GitRepositoryFixture;
import dev.brus.branch.updater.RunConfig;
import dev.brus.branch.updater.UpdaterSession;
import dev.brus.branch.updater.git.GitCommit;
import dev.brus.branch.updater.git.GitRepository;
import dev.brus.branch.updater.git.RemoteBranch;
import dev.brus.branch.updater.layout.BranchLayout;
import dev.brus.branch.updater.layout.LayoutFile;
import dev.brus.branch.updater.layout.LayoutParser;
import dev.brus.branch.updater.util.Console;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.mockito.Mockito;

public class SyncStateClassifierTest {

   @Rule
   public TemporaryFolder testFolder = new TemporaryFolder();

   private GitRepositoryFixture fixture;

   @Before
   public void initRepository() throws Exception {
      fixture = GitRepositoryFixture.init(testFolder.newFolder("repo"));
   }

   private SyncStateClassifier createClassifier(GitRepository repository, String layoutText) throws Exception {
      BranchLayout layout = new LayoutParser().parse(layoutText);
      UpdaterSession session = new UpdaterSession(repository, new RunConfig(), Mockito.mock(Console.class),
         new LayoutFile(repository.getGitDirectory()), layout);
      return session.getSyncStateClassifier();
   }

   @Test
   public void testParentEdges() throws Exception {
      fixture.checkoutNewBranch("red");
      fixture.commit("red.txt", "Add red");
      fixture.checkout("main");

      fixture.checkoutNewBranch("merged");
      fixture.commit("merged.txt", "Add merged");
      fixture.checkout("main");
      fixture.git("merge --ff-only merged");

      fixture.checkoutNewBranch("green");
      fixture.commit("green.txt", "Add green");
      fixture.checkout("main");

      fixture.checkoutNewBranch("base");
      fixture.commit("base.txt", "Add base");
      fixture.checkoutNewBranch("yellow");
      fixture.commit("yellow.txt", "Add yellow");
      fixture.checkout("main");

      try (GitRepository repository = fixture.open()) {
         SyncStateClassifier classifier = createClassifier(repository, "main\n  green\n  yellow\n  red\n  merged\n");

         Assert.assertNull(classifier.classifyParentEdge("main"));
         Assert.assertEquals(ParentSyncStatus.IN_SYNC, classifier.classifyParentEdge("green"));
         Assert.assertEquals(ParentSyncStatus.IN_SYNC_BUT_FORK_POINT_OFF, classifier.classifyParentEdge("yellow"));
         Assert.assertEquals(ParentSyncStatus.OUT_OF_SYNC, classifier.classifyParentEdge("red"));
         Assert.assertEquals(ParentSyncStatus.MERGED_TO_PARENT, classifier.classifyParentEdge("merged"));

         Assert.assertTrue(classifier.isInSyncWithParent("green"));
         Assert.assertFalse(classifier.isInSyncWithParent("yellow"));
         Assert.assertFalse(classifier.isInSyncWithParent("red"));
         Assert.assertFalse(classifier.isInSyncWithParent("main"));
      }
   }

   @Test
   public void testFreshBranchIsInSync() throws Exception {
      fixture.checkoutNewBranch("feature");

      try (GitRepository repository = fixture.open()) {
         SyncStateClassifier classifier = createClassifier(repository, "main\n  feature\n");

         Assert.assertEquals(ParentSyncStatus.IN_SYNC, classifier.classifyParentEdge("feature"));
      }
   }

   @Test
   public void testRemoteStates() throws Exception {
      try (GitRepository repository = fixture.open()) {
         Assert.assertEquals(RemoteSyncStatus.NO_REMOTES,
            createClassifier(repository, "main\n").classifyRemote("main").getStatus());
      }

      GitRepositoryFixture origin = GitRepositoryFixture.initBare(testFolder.newFolder("origin.git"));
      fixture.git("remote add origin " + origin.getDirectory().getAbsolutePath());
      fixture.git("push --set-upstream origin main");

      fixture.checkoutNewBranch("ahead");
      fixture.git("push --set-upstream origin ahead");
      fixture.commit("ahead.txt", "Add ahead");

      fixture.checkout("main");
      fixture.checkoutNewBranch("behind");
      String behindCommit = fixture.commit("behind.txt", "Add behind");
      fixture.commit("behind.txt", "Extend behind");
      fixture.git("push --set-upstream origin behind");
      fixture.git("reset --hard " + behindCommit);

      fixture.checkout("main");
      fixture.checkoutNewBranch("diverged");
      fixture.commit("diverged.txt", "Add diverged");
      fixture.git("push --set-upstream origin diverged");
      fixture.git("reset --hard main");
      fixture.commit("diverged.txt", "Rewrite diverged");

      fixture.checkout("main");
      fixture.checkoutNewBranch("untracked");

      try (GitRepository repository = fixture.open()) {
         SyncStateClassifier classifier = createClassifier(repository, "main\n  ahead\n  behind\n  diverged\n  untracked\n");

         RemoteSyncState mainState = classifier.classifyRemote("main");
         Assert.assertEquals(RemoteSyncStatus.IN_SYNC_WITH_REMOTE, mainState.getStatus());
         Assert.assertEquals(new RemoteBranch("origin", "main"), mainState.getRemoteBranch());
         Assert.assertEquals("", mainState.getDescription());

         RemoteSyncState aheadState = classifier.classifyRemote("ahead");
         Assert.assertEquals(RemoteSyncStatus.AHEAD_OF_REMOTE, aheadState.getStatus());
         Assert.assertEquals("ahead of origin", aheadState.getDescription());

         Assert.assertEquals(RemoteSyncStatus.BEHIND_REMOTE, classifier.classifyRemote("behind").getStatus());
         Assert.assertEquals(RemoteSyncStatus.DIVERGED_FROM_AND_NEWER_THAN_REMOTE, classifier.classifyRemote("diverged").getStatus());

         RemoteSyncState untrackedState = classifier.classifyRemote("untracked");
         Assert.assertEquals(RemoteSyncStatus.UNTRACKED, untrackedState.getStatus());
         Assert.assertEquals("untracked", untrackedState.getDescription());
      }
   }

   @Test
   public void testDivergedComparesCommitterTime() throws Exception {
      GitRepository repository = Mockito.mock(GitRepository.class);
      GitCommit olderCommit = Mockito.mock(GitCommit.class);
      GitCommit newerCommit = Mockito.mock(GitCommit.class);
      Mockito.when(olderCommit.getCommitterWhen()).thenReturn(new Date(1000000L));
      Mockito.when(newerCommit.getCommitterWhen()).thenReturn(new Date(2000000L));
      Mockito.when(repository.isAncestorOrEqual(Mockito.anyString(), Mockito.anyString())).thenReturn(false);
      Mockito.when(repository.resolveCommit("feature")).thenReturn(olderCommit);
      Mockito.when(repository.resolveCommit("origin/feature")).thenReturn(newerCommit);
      Mockito.when(repository.resolveCommit("bugfix")).thenReturn(newerCommit);
      Mockito.when(repository.resolveCommit("origin/bugfix")).thenReturn(olderCommit);

      SyncStateClassifier classifier = new SyncStateClassifier(repository, new BranchLayout(), null, null, new RunConfig());

      Assert.assertEquals(RemoteSyncStatus.DIVERGED_FROM_AND_OLDER_THAN_REMOTE, classifier.getRelationToRemote("feature", "origin/feature"));
      Assert.assertEquals(RemoteSyncStatus.DIVERGED_FROM_AND_NEWER_THAN_REMOTE, classifier.getRelationToRemote("bugfix", "origin/bugfix"));
   }
}
