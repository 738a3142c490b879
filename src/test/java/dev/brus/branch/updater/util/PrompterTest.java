package dev.brus.branch.updater.util;

import java.util.Arrays;

import dev.brus.branch.updater.UpdaterException;
import org.junit.Assert;
import org.junit.Test;
import org.mockito.Mockito;

public class PrompterTest {

   @Test
   public void testAsk() throws Exception {
      Console console = Mockito.mock(Console.class);
      Mockito.when(console.ask("Rebase feature onto main? (y, N, q, yq)")).thenReturn("yq");

      Answer answer = new Prompter(console, false).ask("Rebase feature onto main?", "Rebasing feature onto main...",
         Answer.YES, Answer.NO, Answer.QUIT, Answer.YES_AND_QUIT);

      Assert.assertEquals(Answer.YES_AND_QUIT, answer);
      Assert.assertTrue(answer.isYes());
      Assert.assertTrue(answer.isQuit());
      Mockito.verify(console, Mockito.never()).println(Mockito.anyString());
   }

   @Test
   public void testAskWithoutConfirmation() throws Exception {
      Console console = Mockito.mock(Console.class);

      Answer answer = new Prompter(console, true).ask("Rebase feature onto main?", "Rebasing feature onto main...",
         Answer.YES, Answer.NO);

      Assert.assertEquals(Answer.YES, answer);
      Mockito.verify(console).println("Rebasing feature onto main...");
      Mockito.verify(console, Mockito.never()).ask(Mockito.anyString());
   }

   @Test
   public void testConfirm() throws Exception {
      Console console = Mockito.mock(Console.class);
      Mockito.when(console.ask(Mockito.anyString())).thenReturn("", "YES", "q");
      Prompter prompter = new Prompter(console, false);

      Assert.assertFalse(prompter.confirm("Push feature to origin?", "Pushing feature to origin..."));
      Assert.assertTrue(prompter.confirm("Push feature to origin?", "Pushing feature to origin..."));
      Assert.assertFalse(prompter.confirm("Push feature to origin?", "Pushing feature to origin..."));
      Mockito.verify(console, Mockito.times(3)).ask("Push feature to origin? (y, N)");
   }

   @Test
   public void testReplyOutsideChoices() throws Exception {
      Console console = Mockito.mock(Console.class);
      Mockito.when(console.ask("Delete branch stale? (y, N, q)")).thenReturn("yq", "q");
      Prompter prompter = new Prompter(console, false);

      Assert.assertEquals(Answer.NO, prompter.ask("Delete branch stale?", null, Answer.YES, Answer.NO, Answer.QUIT));
      Assert.assertEquals(Answer.QUIT, prompter.ask("Delete branch stale?", null, Answer.YES, Answer.NO, Answer.QUIT));
   }

   @Test
   public void testPick() throws Exception {
      Console console = Mockito.mock(Console.class);
      Mockito.when(console.ask("[1] develop\n[2] hotfix\nSpecify branch or hit <return> to skip:")).thenReturn("2", "");
      Prompter prompter = new Prompter(console, false);

      Assert.assertEquals("hotfix", prompter.pick(Arrays.asList("develop", "hotfix"), "branch"));
      Assert.assertNull(prompter.pick(Arrays.asList("develop", "hotfix"), "branch"));
   }

   @Test
   public void testPickInvalidIndex() throws Exception {
      Console console = Mockito.mock(Console.class);
      Mockito.when(console.ask(Mockito.anyString())).thenReturn("3", "two");
      Prompter prompter = new Prompter(console, false);

      try {
         prompter.pick(Arrays.asList("develop", "hotfix"), "branch");
         Assert.fail();
      } catch (UpdaterException e) {
         Assert.assertEquals("Invalid index: 3", e.getMessage());
      }

      try {
         prompter.pick(Arrays.asList("develop", "hotfix"), "branch");
         Assert.fail();
      } catch (UpdaterException e) {
         Assert.assertEquals("Invalid index: two", e.getMessage());
      }
   }
}
