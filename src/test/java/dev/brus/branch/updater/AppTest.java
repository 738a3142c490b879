package dev.brus.branch.updater;

import dev.brus.branch.updater.util.Console;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.mockito.Mockito;

public class AppTest {

   @Rule
   public TemporaryFolder testFolder = new TemporaryFolder();

   private GitRepositoryFixture fixture;
   private Console console;
   private App app;

   @Before
   public void initRepository() throws Exception {
      fixture = GitRepositoryFixture.init(testFolder.newFolder("repo"));
      fixture.checkoutNewBranch("feature");
      fixture.commit("feature.txt", "Add feature");
      fixture.writeLayout("main\n  feature\n");

      console = Mockito.mock(Console.class);
      app = new App(console);
   }

   private int run(String... args) {
      return app.run(args, fixture.getDirectory());
   }

   @Test
   public void testUnknownCommand() {
      Assert.assertEquals(App.EXIT_ARGUMENT_ERROR, run("frobnicate"));
      Mockito.verify(console).error("Unknown command: frobnicate");
   }

   @Test
   public void testHelp() {
      Assert.assertEquals(App.EXIT_SUCCESS, run("--help"));
      Assert.assertEquals(App.EXIT_SUCCESS, run("status", "--help"));
      Mockito.verify(console).println(Mockito.startsWith("usage: branch-updater status"));
   }

   @Test
   public void testInvalidSquashMergeDetection() {
      Assert.assertEquals(App.EXIT_ARGUMENT_ERROR, run("status", "--squash-merge-detection", "fuzzy"));
      Mockito.verify(console).error("Invalid squash merge detection: fuzzy, valid values are none, simple, exact");
   }

   @Test
   public void testStatus() {
      Assert.assertEquals(App.EXIT_SUCCESS, run("status"));
      Mockito.verify(console).println("  main\n  |\n  o-feature *");
   }

   @Test
   public void testListAndShow() {
      Assert.assertEquals(App.EXIT_SUCCESS, run("list", "managed"));
      Assert.assertEquals(App.EXIT_SUCCESS, run("show", "up"));

      Mockito.verify(console, Mockito.times(2)).println("main");
      Mockito.verify(console).println("feature");
   }

   @Test
   public void testGoUpAndDown() throws Exception {
      Assert.assertEquals(App.EXIT_SUCCESS, run("go", "up"));
      Assert.assertEquals("main", fixture.getCurrentBranch());

      Assert.assertEquals(App.EXIT_SUCCESS, run("go", "down"));
      Assert.assertEquals("feature", fixture.getCurrentBranch());

      Assert.assertEquals(App.EXIT_UPDATER_ERROR, run("go", "down"));
      Mockito.verify(console).error("Branch feature has no downstream branch");
   }

   @Test
   public void testForkPoint() throws Exception {
      String initialCommit = fixture.resolve("main");

      Assert.assertEquals(App.EXIT_SUCCESS, run("fork-point", "feature"));
      Mockito.verify(console).println(initialCommit);

      fixture.checkout("main");
      fixture.commit("main.txt", "Update main");

      Assert.assertEquals(App.EXIT_UPDATER_ERROR, run("fork-point", "--override-to", "main", "feature"));
      Mockito.verify(console).error("Cannot override fork point: main is not an ancestor of feature");
   }

   @Test
   public void testAnnotate() throws Exception {
      Assert.assertEquals(App.EXIT_SUCCESS, run("anno", "PR", "#3"));
      Assert.assertEquals("main\n  feature PR #3\n", fixture.readLayout());

      Assert.assertEquals(App.EXIT_SUCCESS, run("anno"));
      Mockito.verify(console).println("PR #3");
   }

   @Test
   public void testInvalidBranchSlidOut() throws Exception {
      fixture.writeLayout("main\n  feature\n  gone\n");

      Assert.assertEquals(App.EXIT_SUCCESS, run("status"));
      Assert.assertEquals("main\n  feature\n  gone\n", fixture.readLayout());
      Mockito.verify(console).ask("Skipping gone which is not a local branch (perhaps it has been deleted?). " +
         "Slide it out from the branch layout file? (y, N)");

      Mockito.when(console.ask(Mockito.anyString())).thenReturn("y");
      Assert.assertEquals(App.EXIT_SUCCESS, run("status"));
      Assert.assertEquals("main\n  feature\n", fixture.readLayout());
   }
}
