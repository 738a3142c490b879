package dev.brus.branch.updater.status;

import java.util.Map;

import dev.brus.branch.updater.GitRepositoryFixture;
import dev.brus.branch.updater.RunConfig;
import dev.brus.branch.updater.UpdaterSession;
import dev.brus.branch.updater.git.GitRepository;
import dev.brus.branch.updater.layout.LayoutFile;
import dev.brus.branch.updater.layout.LayoutParser;
import dev.brus.branch.updater.sync.ParentSyncStatus;
import dev.brus.branch.updater.util.Console;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.mockito.Mockito;

public class StatusPrinterTest {

   @Rule
   public TemporaryFolder testFolder = new TemporaryFolder();

   private GitRepositoryFixture fixture;
   private Console console;

   @Before
   public void initRepository() throws Exception {
      fixture = GitRepositoryFixture.init(testFolder.newFolder("repo"));
      console = Mockito.mock(Console.class);
   }

   private StatusPrinter createPrinter(GitRepository repository, String layoutText) throws Exception {
      return new StatusPrinter(new UpdaterSession(repository, new RunConfig(), console,
         new LayoutFile(repository.getGitDirectory()), new LayoutParser().parse(layoutText)));
   }

   @Test
   public void testRender() throws Exception {
      fixture.checkoutNewBranch("develop");
      fixture.commit("develop.txt", "Add develop");
      fixture.checkoutNewBranch("feature");
      fixture.commit("feature.txt", "Add feature");
      fixture.checkout("main");
      fixture.checkoutNewBranch("hotfix");
      fixture.commit("hotfix.txt", "Add hotfix");
      fixture.checkout("feature");

      try (GitRepository repository = fixture.open()) {
         StatusPrinter printer = createPrinter(repository, "main\n  develop PR #1\n    feature\n  hotfix rebase=no\n");
         Map<String, ParentSyncStatus> edges = printer.classifyEdges();

         Assert.assertEquals(3, edges.size());
         Assert.assertEquals("  main\n" +
            "  |\n" +
            "  o-develop  PR #1\n" +
            "  | |\n" +
            "  | o-feature *\n" +
            "  |\n" +
            "  o-hotfix  rebase=no\n", printer.render(edges, false));

         Assert.assertEquals("  main\n" +
            "  |\n" +
            "  | Add develop\n" +
            "  o-develop  PR #1\n" +
            "  | |\n" +
            "  | | Add feature\n" +
            "  | o-feature *\n" +
            "  |\n" +
            "  | Add hotfix\n" +
            "  o-hotfix  rebase=no\n", printer.render(edges, true));
      }
   }

   @Test
   public void testPrintYellowEdge() throws Exception {
      fixture.checkoutNewBranch("base");
      String baseCommit = fixture.commit("base.txt", "Add base");
      fixture.checkoutNewBranch("yellow");
      fixture.commit("yellow.txt", "Add yellow");
      fixture.checkout("main");
      fixture.checkoutNewBranch("other");
      fixture.commit("other.txt", "Add other");
      fixture.checkout("main");

      try (GitRepository repository = fixture.open()) {
         StatusPrinter printer = createPrinter(repository, "main\n  yellow\nother\n");

         printer.print(true);

         Mockito.verify(console).println("  main *\n" +
            "  |\n" +
            "  | Add base -> fork point ??? commit " + baseCommit.substring(0, 7) +
            " seems to be a part of the unique history of base\n" +
            "  | Add yellow\n" +
            "  ?-yellow\n" +
            "\n" +
            "  other");
         Mockito.verify(console).warn(Mockito.startsWith("yellow edge indicates that fork point for yellow is probably incorrectly inferred"));
      }
   }

   @Test
   public void testRenderWithRemote() throws Exception {
      GitRepositoryFixture origin = GitRepositoryFixture.initBare(testFolder.newFolder("origin.git"));
      fixture.git("remote add origin " + origin.getDirectory().getAbsolutePath());
      fixture.git("push --set-upstream origin main");
      fixture.checkoutNewBranch("feature");
      fixture.git("push --set-upstream origin feature");
      fixture.commit("feature.txt", "Add feature");
      fixture.checkout("main");
      fixture.checkoutNewBranch("bugfix");
      fixture.commit("bugfix.txt", "Add bugfix");

      try (GitRepository repository = fixture.open()) {
         StatusPrinter printer = createPrinter(repository, "main\n  feature\n  bugfix\n");

         Assert.assertEquals("  main\n" +
            "  |\n" +
            "  o-feature (ahead of origin)\n" +
            "  |\n" +
            "  o-bugfix * (untracked)\n", printer.render(printer.classifyEdges(), false));
      }
   }
}
