package dev.brus.branch.updater.util;

import java.util.Arrays;

import org.apache.commons.cli.ParseException;
import org.junit.Assert;
import org.junit.Test;

public class CommandLineParserTest {

   @Test
   public void testNoOptions() throws Exception {
      String testOptionName = "onto";
      String testOptionValue = "develop";
      CommandLineParser parser = new CommandLineParser();
      parser.addOption("o", testOptionName, false, true, false, "test option description");

      CommandLine emptyLine = parser.parse(new String[0]);
      Assert.assertNull(emptyLine.getOptionValue(testOptionName));
      Assert.assertNull(emptyLine.getOptionValue(testOptionName, null));

      CommandLine fullLine = parser.parse(new String[] { "--" + testOptionName, testOptionValue });
      Assert.assertEquals(testOptionValue, fullLine.getOptionValue(testOptionName));
      Assert.assertEquals(testOptionValue, fullLine.getOptionValue("o", null));
   }

   @Test
   public void testFlagsAndArgs() throws Exception {
      CommandLineParser parser = new CommandLineParser()
         .addFlag("y", "yes", "don't ask for confirmation")
         .addFlag(null, "delete", "delete the branches");

      CommandLine commandLine = parser.parse(new String[] { "-y", "feature", "bugfix" });

      Assert.assertTrue(commandLine.hasOption("yes"));
      Assert.assertFalse(commandLine.hasOption("delete"));
      Assert.assertEquals(Arrays.asList("feature", "bugfix"), commandLine.getArgs());
      Assert.assertEquals("bugfix", commandLine.getArg(1, null));
      Assert.assertNull(commandLine.getArg(2, null));
   }

   @Test(expected = ParseException.class)
   public void testUnrecognizedOption() throws Exception {
      new CommandLineParser().addFlag("y", "yes", "don't ask for confirmation").parse(new String[] { "--no-such-option" });
   }

   @Test
   public void testHelp() {
      String help = new CommandLineParser().addFlag("y", "yes", "don't ask for confirmation").getHelp("branch-updater add [options] <branch>");

      Assert.assertTrue(help.startsWith("usage: branch-updater add [options] <branch>"));
      Assert.assertTrue(help.contains("-y,--yes"));
   }
}
