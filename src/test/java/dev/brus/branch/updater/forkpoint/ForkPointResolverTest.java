package dev.brus.branch.updater.forkpoint;

import java.util.Arrays;
import java.util.Collections;

import dev.brus.branch.updater.GitRepositoryFixture;
import dev.brus.branch.updater.UpdaterException;
import dev.brus.branch.updater.git.GitRepository;
import dev.brus.branch.updater.layout.BranchLayout;
import dev.brus.branch.updater.layout.LayoutParser;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class ForkPointResolverTest {

   @Rule
   public TemporaryFolder testFolder = new TemporaryFolder();

   private GitRepositoryFixture fixture;

   @Before
   public void initRepository() throws Exception {
      fixture = GitRepositoryFixture.init(testFolder.newFolder("repo"));
   }

   @Test
   public void testForkPointIsParentTip() throws Exception {
      String mainCommit = fixture.commit("main.txt", "Update main");
      fixture.checkoutNewBranch("feature");
      fixture.commit("feature.txt", "Add feature");
      fixture.commit("feature.txt", "Extend feature");

      try (GitRepository repository = fixture.open()) {
         ForkPointResolver resolver = new ForkPointResolver(repository, new LayoutParser().parse("main\n  feature\n"));

         ForkPoint forkPoint = resolver.getForkPoint("feature", true);
         Assert.assertEquals(mainCommit, forkPoint.getHash());
         Assert.assertEquals(ForkPoint.Source.INFERRED, forkPoint.getSource());
         Assert.assertEquals(Collections.singletonList("main"), forkPoint.getContainingBranches());
         Assert.assertEquals(mainCommit, resolver.inferForkPoint("feature"));
      }
   }

   @Test
   public void testForkPointOnUnmanagedBranch() throws Exception {
      fixture.checkoutNewBranch("feature");
      String featureCommit = fixture.commit("feature.txt", "Add feature");
      fixture.checkoutNewBranch("child");
      fixture.commit("child.txt", "Add child");

      try (GitRepository repository = fixture.open()) {
         ForkPointResolver resolver = new ForkPointResolver(repository, new LayoutParser().parse("main\n  child\n"));

         ForkPoint forkPoint = resolver.getForkPoint("child", true);
         Assert.assertEquals(featureCommit, forkPoint.getHash());
         Assert.assertEquals(Collections.singletonList("feature"), forkPoint.getContainingBranches());
         Assert.assertEquals("feature", resolver.inferParent("child", branch -> true));
         Assert.assertEquals("main", resolver.inferParent("child", branch -> branch.equals("main")));
      }
   }

   @Test
   public void testForkPointAfterParentMovedOn() throws Exception {
      String initialCommit = fixture.resolve("main");
      fixture.checkoutNewBranch("feature");
      fixture.commit("feature.txt", "Add feature");
      fixture.checkout("main");
      fixture.commit("main.txt", "Update main");

      try (GitRepository repository = fixture.open()) {
         ForkPointResolver resolver = new ForkPointResolver(repository, new LayoutParser().parse("main\n  feature\n"));

         Assert.assertEquals(initialCommit, resolver.getForkPointHash("feature", true));
      }
   }

   @Test
   public void testForkPointWithoutSharedHistory() throws Exception {
      fixture.git("checkout --orphan lonely");
      fixture.commit("lonely.txt", "Start lonely history");

      try (GitRepository repository = fixture.open()) {
         ForkPointResolver resolver = new ForkPointResolver(repository, new LayoutParser().parse("lonely\n"));

         Assert.assertNull(resolver.findForkPoint("lonely", true));
         try {
            resolver.getForkPoint("lonely", true);
            Assert.fail("Fork point expected not to be found");
         } catch (ForkPointNotFoundException e) {
            Assert.assertEquals("lonely", e.getBranch());
         }
      }
   }

   @Test
   public void testOverride() throws Exception {
      String mainCommit = fixture.commit("main.txt", "Update main");
      fixture.checkoutNewBranch("feature");
      String firstFeatureCommit = fixture.commit("feature.txt", "Add feature");
      fixture.commit("feature.txt", "Extend feature");

      try (GitRepository repository = fixture.open()) {
         ForkPointResolver resolver = new ForkPointResolver(repository, new LayoutParser().parse("main\n  feature\n"));

         resolver.overrideTo("feature", firstFeatureCommit);

         Assert.assertEquals(firstFeatureCommit, repository.getConfigValue("updater.overrideForkPoint.feature.to"));
         Assert.assertTrue(resolver.hasOverriddenForkPoint("feature"));
         ForkPoint forkPoint = resolver.getForkPoint("feature", true);
         Assert.assertEquals(firstFeatureCommit, forkPoint.getHash());
         Assert.assertEquals(ForkPoint.Source.OVERRIDE, forkPoint.getSource());
         Assert.assertEquals(mainCommit, resolver.getForkPointHash("feature", false));

         resolver.unsetOverride("feature");
         Assert.assertNull(repository.getConfigValue("updater.overrideForkPoint.feature.to"));
         Assert.assertEquals(mainCommit, resolver.getForkPointHash("feature", true));
      }
   }

   @Test
   public void testOverrideToNonAncestor() throws Exception {
      fixture.checkoutNewBranch("feature");
      fixture.commit("feature.txt", "Add feature");
      fixture.checkout("main");
      String mainCommit = fixture.commit("main.txt", "Update main");

      try (GitRepository repository = fixture.open()) {
         ForkPointResolver resolver = new ForkPointResolver(repository, new LayoutParser().parse("main\n  feature\n"));

         try {
            resolver.overrideTo("feature", "main");
            Assert.fail("Override to a non ancestor expected to be rejected");
         } catch (UpdaterException e) {
            Assert.assertEquals("Cannot override fork point: main is not an ancestor of feature", e.getMessage());
         }
         Assert.assertNull(repository.getConfigValue("updater.overrideForkPoint.feature.to"));
         Assert.assertNotEquals(mainCommit, resolver.getForkPointHash("feature", true));
      }
   }

   @Test
   public void testOverrideToMissingCommitIsIgnored() throws Exception {
      String mainCommit = fixture.commit("main.txt", "Update main");
      fixture.checkoutNewBranch("feature");
      fixture.commit("feature.txt", "Add feature");
      fixture.git("config " + ForkPointOverride.getToKey("feature") + " 1234567890123456789012345678901234567890");

      try (GitRepository repository = fixture.open()) {
         ForkPointResolver resolver = new ForkPointResolver(repository, new LayoutParser().parse("main\n  feature\n"));

         Assert.assertNull(resolver.getOverriddenForkPoint("feature"));
         Assert.assertEquals(mainCommit, resolver.getForkPointHash("feature", true));
         Assert.assertEquals(ForkPoint.Source.INFERRED, resolver.getForkPoint("feature", true).getSource());

         try {
            resolver.overrideTo("feature", "1234567890123456789012345678901234567890");
            Assert.fail("Override to a missing commit expected to be rejected");
         } catch (UpdaterException e) {
            Assert.assertEquals("Cannot find revision 1234567890123456789012345678901234567890", e.getMessage());
         }
      }
   }

   @Test
   public void testStaleOverrideIsIgnored() throws Exception {
      String mainCommit = fixture.commit("main.txt", "Update main");
      fixture.checkoutNewBranch("feature");
      String firstFeatureCommit = fixture.commit("feature.txt", "Add feature");

      try (GitRepository repository = fixture.open()) {
         ForkPointResolver resolver = new ForkPointResolver(repository, new LayoutParser().parse("main\n  feature\n"));
         resolver.overrideTo("feature", firstFeatureCommit);

         fixture.git("reset --hard " + mainCommit);
         fixture.commit("other.txt", "Replace feature");
         repository.flushCaches();

         Assert.assertFalse(resolver.hasOverriddenForkPoint("feature"));
         Assert.assertEquals(mainCommit, resolver.getForkPointHash("feature", true));
      }
   }

   @Test
   public void testFilteredReflog() throws Exception {
      fixture.checkoutNewBranch("feature");
      String firstFeatureCommit = fixture.commit("feature.txt", "Add feature");
      String secondFeatureCommit = fixture.commit("feature.txt", "Extend feature");
      fixture.git("reset --hard " + firstFeatureCommit);

      try (GitRepository repository = fixture.open()) {
         ForkPointResolver resolver = new ForkPointResolver(repository, new BranchLayout());

         Assert.assertEquals(Arrays.asList(secondFeatureCommit, firstFeatureCommit), resolver.getFilteredReflog("refs/heads/feature"));
      }
   }
}
