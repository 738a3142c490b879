package dev.brus.branch.updater.layout;

import java.util.Arrays;
import java.util.Collections;

import org.junit.Assert;
import org.junit.Test;

public class LayoutParserTest {

   private final LayoutParser parser = new LayoutParser();

   @Test
   public void testParseSpaceIndentedLayout() throws Exception {
      String text = "main\n" +
         "  develop PR #1 rebase=no\n" +
         "    feature\n" +
         "  hotfix\n" +
         "other\n";

      BranchLayout layout = parser.parse(text);

      Assert.assertEquals(Arrays.asList("main", "other"), layout.getRoots());
      Assert.assertEquals(Arrays.asList("develop", "hotfix"), layout.getChildren("main"));
      Assert.assertEquals("develop", layout.getParent("feature"));
      Assert.assertNull(layout.getParent("other"));
      Assert.assertEquals("PR #1", layout.getAnnotation("develop").getText());
      Assert.assertFalse(layout.getQualifiers("develop").isRebase());
      Assert.assertTrue(layout.getQualifiers("feature").isRebase());
      Assert.assertEquals(Arrays.asList("main", "develop", "feature", "hotfix", "other"), layout.getManagedBranches());
      Assert.assertEquals(text, layout.serialize());
   }

   @Test
   public void testParseTabIndentedLayout() throws Exception {
      String text = "master\n\tdevelop\n\t\tfeature\n";

      BranchLayout layout = parser.parse(text);

      Assert.assertEquals("\t", layout.getIndent());
      Assert.assertEquals("develop", layout.getParent("feature"));
      Assert.assertEquals(text, layout.serialize());
   }

   @Test
   public void testParseSkipsBlankLines() throws Exception {
      BranchLayout layout = parser.parse("\nmain\n\n  feature   \n  \n\nother");

      Assert.assertEquals(Arrays.asList("main", "other"), layout.getRoots());
      Assert.assertEquals(Collections.singletonList("feature"), layout.getChildren("main"));
      Assert.assertTrue(layout.getAnnotation("feature").isEmpty());
   }

   @Test
   public void testParseEmptyLayout() throws Exception {
      BranchLayout layout = parser.parse("");

      Assert.assertTrue(layout.isEmpty());
      Assert.assertEquals("", layout.serialize());
   }

   @Test
   public void testParseDuplicateBranch() {
      try {
         parser.parse("master\n\tdevelop\n\t\n\ndevelop");
         Assert.fail("Duplicate branch expected to be rejected");
      } catch (LayoutParseException e) {
         Assert.assertEquals(5, e.getLineNumber());
         Assert.assertEquals("branch develop re-appears in the branch layout", e.getReason());
         Assert.assertEquals("line 5: branch develop re-appears in the branch layout", e.getMessage());
      }
   }

   @Test
   public void testParseInvalidIndent() {
      try {
         parser.parse("main\n  develop\n   feature\n");
         Assert.fail("Invalid indent expected to be rejected");
      } catch (LayoutParseException e) {
         Assert.assertEquals(3, e.getLineNumber());
         Assert.assertEquals("invalid indent <SPACE><SPACE><SPACE>, expected a multiple of <SPACE><SPACE>", e.getReason());
      }
   }

   @Test
   public void testParseMixedIndent() {
      try {
         parser.parse("main\n\tdevelop\n  feature\n");
         Assert.fail("Mixed indent expected to be rejected");
      } catch (LayoutParseException e) {
         Assert.assertEquals(3, e.getLineNumber());
         Assert.assertEquals("invalid indent <SPACE><SPACE>, expected a multiple of <TAB>", e.getReason());
      }
   }

   @Test
   public void testParseTooMuchIndent() {
      try {
         parser.parse("main\n  develop\n      feature\n");
         Assert.fail("Too much indent expected to be rejected");
      } catch (LayoutParseException e) {
         Assert.assertEquals(3, e.getLineNumber());
         Assert.assertEquals("too much indent (level 3, expected at most 2) for the branch feature", e.getReason());
      }
   }

   @Test
   public void testParseInvalidBranchName() {
      try {
         parser.parse("main\n  bad..name\n");
         Assert.fail("Invalid branch name expected to be rejected");
      } catch (LayoutParseException e) {
         Assert.assertEquals(2, e.getLineNumber());
         Assert.assertEquals("invalid branch name bad..name", e.getReason());
      }
   }
}
