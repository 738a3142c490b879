package dev.brus.branch.updater.ops;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import dev.brus.branch.updater.GitRepositoryFixture;
import dev.brus.branch.updater.RunConfig;
import dev.brus.branch.updater.UpdaterException;
import dev.brus.branch.updater.UpdaterSession;
import dev.brus.branch.updater.git.GitRepository;
import dev.brus.branch.updater.util.Console;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.mockito.Mockito;

public class TreeMutationOpsTest {

   private final static String SLIDE_LAYOUT = "slide_root\n" +
      "  child_a\n" +
      "  child_b\n" +
      "    child_c\n" +
      "      child_d\n";

   @Rule
   public TemporaryFolder testFolder = new TemporaryFolder();

   private GitRepositoryFixture fixture;
   private Console console;

   @Before
   public void initRepository() throws Exception {
      fixture = GitRepositoryFixture.init(testFolder.newFolder("repo"));
      console = Mockito.mock(Console.class);
   }

   private TreeMutationOps createOps(GitRepository repository, RunConfig runConfig, String layoutText) throws Exception {
      fixture.writeLayout(layoutText);
      return new TreeMutationOps(UpdaterSession.open(repository, runConfig, console, false));
   }

   private boolean isAncestor(String earlier, String later) throws Exception {
      return fixture.git("merge-base " + earlier + " " + later).equals(fixture.resolve(earlier));
   }

   private void createSlideBranches() throws Exception {
      fixture.checkoutNewBranch("slide_root");
      fixture.commit("root.txt", "Add root");
      fixture.checkoutNewBranch("child_a");
      fixture.commit("a.txt", "Add a");
      fixture.checkout("slide_root");
      fixture.checkoutNewBranch("child_b");
      fixture.commit("b.txt", "Add b");
      fixture.checkoutNewBranch("child_c");
      fixture.commit("c.txt", "Add c");
      fixture.checkoutNewBranch("child_d");
      fixture.commit("d.txt", "Add d");
      fixture.checkout("child_b");
      fixture.commit("b.txt", "Extend b");
   }

   @Test
   public void testSlideOut() throws Exception {
      createSlideBranches();

      try (GitRepository repository = fixture.open()) {
         TreeMutationOps ops = createOps(repository, new RunConfig(), SLIDE_LAYOUT);

         ops.slideOut(Collections.singletonList("child_c"), null, false);

         Assert.assertEquals("slide_root\n  child_a\n  child_b\n    child_d\n", fixture.readLayout());
         Assert.assertEquals("child_d", fixture.getCurrentBranch());
         Assert.assertTrue(isAncestor("child_b", "child_d"));
         Assert.assertFalse(isAncestor("child_c", "child_d"));
         Assert.assertTrue(fixture.branchExists("child_c"));
         Mockito.verify(console).println("Rebasing child_d onto child_b...");
      }
   }

   @Test
   public void testSlideOutCurrentBranchAndDelete() throws Exception {
      createSlideBranches();
      fixture.git("branch child_e child_d");
      fixture.checkout("child_c");
      Mockito.when(console.ask(Mockito.anyString())).thenReturn("y");

      try (GitRepository repository = fixture.open()) {
         TreeMutationOps ops = createOps(repository, new RunConfig().setNoEditMerge(true), SLIDE_LAYOUT + "      child_e update=merge\n");

         ops.slideOut(Collections.singletonList("child_c"), null, true);

         Assert.assertEquals("slide_root\n  child_a\n  child_b\n    child_d\n    child_e update=merge\n", fixture.readLayout());
         Assert.assertTrue(isAncestor("child_b", "child_e"));
         Assert.assertFalse(fixture.branchExists("child_c"));
         Mockito.verify(console).println("Merging child_b into child_e...");
         Mockito.verify(console).ask("Delete branch child_c (merged to HEAD)? (y, N, q)");
      }
   }

   @Test
   public void testSlideOutValidation() throws Exception {
      createSlideBranches();

      try (GitRepository repository = fixture.open()) {
         TreeMutationOps ops = createOps(repository, new RunConfig(), SLIDE_LAYOUT.replace("child_a\n", "child_a slide-out=no\n"));

         assertSlideOutFails(ops, Collections.singletonList("slide_root"), "Branch slide_root has no parent, cannot slide out");
         assertSlideOutFails(ops, Collections.singletonList("main"), "Branch main not found in the tree of branch dependencies");
         assertSlideOutFails(ops, Arrays.asList("child_b", "child_d"), "child_d is not downstream of child_b, cannot slide out");
         assertSlideOutFails(ops, Collections.singletonList("child_a"), "Branch child_a is annotated with slide-out=no qualifier, aborting.");
         assertSlideOutFails(ops, Arrays.asList("child_d", "child_c"), "No downstream branch defined for child_d, cannot slide out");
         Assert.assertEquals(SLIDE_LAYOUT.replace("child_a\n", "child_a slide-out=no\n"), fixture.readLayout());
      }
   }

   private void assertSlideOutFails(TreeMutationOps ops, List<String> branches, String messagePrefix) throws Exception {
      try {
         ops.slideOut(branches, null, false);
         Assert.fail("Slide out of " + branches + " expected to fail");
      } catch (UpdaterException e) {
         Assert.assertTrue(e.getMessage(), e.getMessage().startsWith(messagePrefix));
      }
   }

   @Test
   public void testSlideOutWithDownForkPoint() throws Exception {
      createSlideBranches();
      String childCommit = fixture.resolve("child_c");

      try (GitRepository repository = fixture.open()) {
         TreeMutationOps ops = createOps(repository, new RunConfig(), SLIDE_LAYOUT);

         try {
            ops.slideOut(Collections.singletonList("child_c"), "child_a", false);
            Assert.fail("Down fork point off the child expected to be rejected");
         } catch (UpdaterException e) {
            Assert.assertEquals("Fork point child_a is not an ancestor of or the tip of the child_d branch", e.getMessage());
         }

         ops.slideOut(Collections.singletonList("child_c"), childCommit, false);

         Assert.assertTrue(isAncestor("child_b", "child_d"));
         Assert.assertFalse(isAncestor(childCommit, "child_d"));
      }
   }

   @Test
   public void testAddInfersParent() throws Exception {
      fixture.checkoutNewBranch("feature");
      fixture.commit("feature.txt", "Add feature");

      try (GitRepository repository = fixture.open()) {
         TreeMutationOps ops = createOps(repository, new RunConfig().setYes(true), "main\n");

         ops.add("feature", null, false, false);

         Assert.assertEquals("main\n  feature\n", fixture.readLayout());
         Mockito.verify(console).println("Adding feature onto the inferred upstream (parent) branch main");
         Mockito.verify(console).println("Added branch feature onto main");
      }
   }

   @Test
   public void testAddDeclined() throws Exception {
      fixture.checkoutNewBranch("feature");
      fixture.commit("feature.txt", "Add feature");
      Mockito.when(console.ask(Mockito.anyString())).thenReturn("n");

      try (GitRepository repository = fixture.open()) {
         TreeMutationOps ops = createOps(repository, new RunConfig(), "main\n");

         ops.add("feature", null, false, false);

         Assert.assertEquals("main\n", fixture.readLayout());
         Mockito.verify(console).ask("Add feature onto the inferred upstream (parent) branch main? (y, N)");
      }
   }

   @Test
   public void testAddNewBranchToEmptyLayout() throws Exception {
      try (GitRepository repository = fixture.open()) {
         TreeMutationOps ops = createOps(repository, new RunConfig().setYes(true), "");

         ops.add("feature", null, false, false);

         Assert.assertEquals("main\n  feature\n", fixture.readLayout());
         Assert.assertTrue(fixture.branchExists("feature"));
         Assert.assertEquals(fixture.resolve("main"), fixture.resolve("feature"));
         Mockito.verify(console).println("Added branch main as a new root");
         Mockito.verify(console).println("Added branch feature onto main");
      }
   }

   @Test
   public void testAddOntoAsFirstChildAndAsRoot() throws Exception {
      fixture.git("branch develop");
      fixture.git("branch hotfix");
      fixture.git("branch docs");

      try (GitRepository repository = fixture.open()) {
         TreeMutationOps ops = createOps(repository, new RunConfig(), "main\n  develop\n");

         ops.add("hotfix", "main", false, true);
         ops.add("docs", null, true, false);

         Assert.assertEquals("main\n  hotfix\n  develop\ndocs\n", fixture.readLayout());
         Mockito.verify(console, Mockito.never()).ask(Mockito.anyString());

         try {
            ops.add("develop", null, false, false);
            Assert.fail("Managed branch expected not to be added twice");
         } catch (UpdaterException e) {
            Assert.assertEquals("Branch develop already exists in the tree of branch dependencies", e.getMessage());
         }
      }
   }

   @Test
   public void testAdvance() throws Exception {
      fixture.checkoutNewBranch("feature");
      String featureCommit = fixture.commit("feature.txt", "Add feature");
      fixture.checkout("main");

      try (GitRepository repository = fixture.open()) {
         TreeMutationOps ops = createOps(repository, new RunConfig().setYes(true), "main\n  feature\n");

         ops.advance();

         Assert.assertEquals(featureCommit, fixture.resolve("main"));
         Assert.assertEquals("main\n", fixture.readLayout());
         Mockito.verify(console).println("Fast-forwarding main to match feature...");
      }
   }

   @Test
   public void testAdvanceWithoutGreenEdge() throws Exception {
      fixture.checkoutNewBranch("feature");
      fixture.commit("feature.txt", "Add feature");
      fixture.checkout("main");
      fixture.commit("main.txt", "Update main");

      try (GitRepository repository = fixture.open()) {
         TreeMutationOps ops = createOps(repository, new RunConfig().setYes(true), "main\n  feature\n");

         try {
            ops.advance();
            Assert.fail("Advance without a green edge expected to fail");
         } catch (UpdaterException e) {
            Assert.assertEquals("No downstream (child) branch of main is connected to main with a green edge", e.getMessage());
         }

         fixture.checkout("feature");
         repository.flushCaches();
         try {
            ops.advance();
            Assert.fail("Advance of a childless branch expected to fail");
         } catch (UpdaterException e) {
            Assert.assertEquals("feature does not have any downstream (child) branches to advance towards", e.getMessage());
         }
      }
   }

   @Test
   public void testAnnotate() throws Exception {
      fixture.git("branch feature");

      try (GitRepository repository = fixture.open()) {
         TreeMutationOps ops = createOps(repository, new RunConfig(), "main\n  feature PR #1\n");

         ops.annotate("feature", "PR #5 rebase=no");
         Assert.assertEquals("main\n  feature PR #5 rebase=no\n", fixture.readLayout());

         ops.annotate("feature", "");
         Assert.assertEquals("main\n  feature\n", fixture.readLayout());
      }
   }

   @Test
   public void testDeleteUnmanaged() throws Exception {
      fixture.git("branch feature");
      fixture.git("branch stale");
      fixture.checkoutNewBranch("current");

      try (GitRepository repository = fixture.open()) {
         TreeMutationOps ops = createOps(repository, new RunConfig().setYes(true), "main\n  feature\n");

         ops.deleteUnmanaged();

         Assert.assertFalse(fixture.branchExists("stale"));
         Assert.assertTrue(fixture.branchExists("current"));
         Assert.assertTrue(fixture.branchExists("feature"));
         Mockito.verify(console).println("Skipping current branch current");
         Mockito.verify(console).println("Deleting branch stale...");
      }
   }

   @Test
   public void testDeleteUnmanagedAsksPerBranch() throws Exception {
      fixture.checkoutNewBranch("stale");
      fixture.commit("stale.txt", "Add stale");
      fixture.checkout("main");
      Mockito.when(console.ask(Mockito.anyString())).thenReturn("n");

      try (GitRepository repository = fixture.open()) {
         TreeMutationOps ops = createOps(repository, new RunConfig(), "main\n");

         ops.deleteUnmanaged();

         Assert.assertTrue(fixture.branchExists("stale"));
         Mockito.verify(console).ask("Delete branch stale (unmerged to HEAD)? (y, N, q)");
      }
   }

   @Test
   public void testDeleteUnmanagedIgnoresYesAndQuit() throws Exception {
      fixture.git("branch first");
      fixture.git("branch second");
      Mockito.when(console.ask(Mockito.anyString())).thenReturn("yq", "y");

      try (GitRepository repository = fixture.open()) {
         TreeMutationOps ops = createOps(repository, new RunConfig(), "main\n");

         ops.deleteUnmanaged();

         Assert.assertTrue(fixture.branchExists("first"));
         Assert.assertFalse(fixture.branchExists("second"));
         Mockito.verify(console).ask("Delete branch first (unmerged to HEAD)? (y, N, q)");
      }
   }

   @Test
   public void testSlideOutRemovedFromRemote() throws Exception {
      GitRepositoryFixture origin = GitRepositoryFixture.initBare(testFolder.newFolder("origin.git"));
      fixture.git("remote add origin " + origin.getDirectory().getAbsolutePath());
      fixture.git("push --set-upstream origin main");
      fixture.checkoutNewBranch("feature");
      fixture.commit("feature.txt", "Add feature");
      fixture.git("push --set-upstream origin feature");
      fixture.checkoutNewBranch("child");
      fixture.commit("child.txt", "Add child");
      fixture.checkout("main");
      fixture.git("push origin --delete feature");

      try (GitRepository repository = fixture.open()) {
         TreeMutationOps ops = createOps(repository, new RunConfig(), "main\n  feature\n    child\n");

         ops.slideOutRemovedFromRemote(true);

         Assert.assertEquals("main\n  child\n", fixture.readLayout());
         Assert.assertFalse(fixture.branchExists("feature"));
         Mockito.verify(console).println("Sliding out feature");
         Mockito.verify(console).println("Deleting branch feature...");
      }
   }
}
