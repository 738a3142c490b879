/**
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements. See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License. You may obtain a copy of the License at
 * <p>
 * http://www.apache.org/licenses/LICENSE-2.0
 * <p>
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.brus.branch.updater.layout;

import java.util.HashMap;
import java.util.Map;

import org.eclipse.jgit.lib.Repository;

/**
 * Reads the indented branch layout text.
 * <p>
 * The first indented line sets the indent unit; every other indent must repeat that unit a
 * whole number of times and may open at most one level below the previous line.
 */
public class LayoutParser {

   public BranchLayout parse(String text) throws LayoutParseException {
      BranchLayout layout = new BranchLayout();
      String indent = null;
      Map<Integer, String> branchAtDepth = new HashMap<>();
      int lastDepth = -1;

      String[] lines = text.split("\n", -1);
      for (int index = 0; index < lines.length; index++) {
         int lineNumber = index + 1;
         String line = lines[index].stripTrailing();
         if (line.isEmpty()) {
            continue;
         }

         String prefix = line.substring(0, line.length() - line.stripLeading().length());
         String content = line.substring(prefix.length());
         int separatorIndex = content.indexOf(' ');
         String name = separatorIndex < 0 ? content : content.substring(0, separatorIndex);
         String annotation = separatorIndex < 0 ? "" : content.substring(separatorIndex + 1);

         if (layout.contains(name)) {
            throw new LayoutParseException(lineNumber, "branch " + name + " re-appears in the branch layout");
         }
         if (!Repository.isValidRefName("refs/heads/" + name)) {
            throw new LayoutParseException(lineNumber, "invalid branch name " + name);
         }

         int depth = 0;
         if (!prefix.isEmpty()) {
            if (indent == null) {
               indent = prefix;
            }
            depth = prefix.length() / indent.length();
            if (!prefix.equals(indent.repeat(depth))) {
               throw new LayoutParseException(lineNumber, "invalid indent " + describeIndent(prefix) +
                  ", expected a multiple of " + describeIndent(indent));
            }
            if (depth > lastDepth + 1) {
               throw new LayoutParseException(lineNumber, "too much indent (level " + depth +
                  ", expected at most " + (lastDepth + 1) + ") for the branch " + name);
            }
         }

         try {
            layout.addBranch(name, depth == 0 ? null : branchAtDepth.get(depth - 1), false, Annotation.parse(annotation));
         } catch (InvariantViolationException e) {
            throw new LayoutParseException(lineNumber, e.getMessage());
         }
         branchAtDepth.put(depth, name);
         lastDepth = depth;
      }

      if (indent != null) {
         layout.setIndent(indent);
      }

      return layout;
   }

   private static String describeIndent(String indent) {
      StringBuilder builder = new StringBuilder();
      for (char c : indent.toCharArray()) {
         if (c == ' ') {
            builder.append("<SPACE>");
         } else if (c == '\t') {
            builder.append("<TAB>");
         } else {
            builder.append("<U+").append(String.format("%04X", (int) c)).append('>');
         }
      }
      return builder.toString();
   }
}
