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

package dev.brus.branch.updater.status;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import dev.brus.branch.updater.UpdaterSession;
import dev.brus.branch.updater.forkpoint.ForkPoint;
import dev.brus.branch.updater.git.GitCommit;
import dev.brus.branch.updater.git.GitRepository;
import dev.brus.branch.updater.layout.Annotation;
import dev.brus.branch.updater.layout.BranchLayout;
import dev.brus.branch.updater.sync.ParentSyncStatus;
import dev.brus.branch.updater.sync.RemoteSyncState;
import dev.brus.branch.updater.sync.SyncStateClassifier;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders the branch layout as an ASCII tree:
 * <pre>
 *   main
 *   |
 *   o-develop *  (ahead of origin)
 *     |
 *     x-feature  PR #12
 * </pre>
 * The junction of each branch tells the color of the edge to its parent.
 */
public class StatusPrinter {

   private final static Logger logger = LoggerFactory.getLogger(StatusPrinter.class);

   private final UpdaterSession session;

   public StatusPrinter(UpdaterSession session) {
      this.session = session;
   }

   public void print(boolean listCommits) throws Exception {
      Map<String, ParentSyncStatus> edges = classifyEdges();
      session.getConsole().println(StringUtils.stripEnd(render(edges, listCommits), "\n"));

      List<String> yellowBranches = new ArrayList<>();
      for (Map.Entry<String, ParentSyncStatus> edge : edges.entrySet()) {
         if (edge.getValue() == ParentSyncStatus.IN_SYNC_BUT_FORK_POINT_OFF) {
            yellowBranches.add(edge.getKey());
         }
      }
      if (yellowBranches.size() == 1) {
         session.getConsole().warn(session.getSyncStateClassifier().getYellowEdgeWarning(yellowBranches.get(0)));
      } else if (yellowBranches.size() > 1) {
         session.getConsole().warn("yellow edges indicate that fork points for " + String.join(", ", yellowBranches) +
            " are probably incorrectly inferred,\nor that some extra branch should be added between each of these branches and its parent.");
      }
   }

   /**
    * Edge colors are computed up front since the line of a branch is prefixed with the edges
    * of its ancestors' later siblings.
    */
   public Map<String, ParentSyncStatus> classifyEdges() throws Exception {
      SyncStateClassifier classifier = session.getSyncStateClassifier();
      Map<String, ParentSyncStatus> edges = new LinkedHashMap<>();
      for (String branch : session.getLayout().getManagedBranches()) {
         ParentSyncStatus status = classifier.classifyParentEdge(branch);
         if (status != null) {
            edges.put(branch, status);
         }
      }
      return edges;
   }

   public String render(Map<String, ParentSyncStatus> edges, boolean listCommits) throws Exception {
      BranchLayout layout = session.getLayout();
      GitRepository repository = session.getRepository();
      String currentBranch = repository.getCurrentBranch();

      Map<String, List<String>> nextSiblingsOfAncestors = new LinkedHashMap<>();
      for (String root : layout.getRoots()) {
         collectNextSiblings(root, new ArrayList<>(), nextSiblingsOfAncestors);
      }

      StringBuilder out = new StringBuilder();
      for (Map.Entry<String, List<String>> entry : nextSiblingsOfAncestors.entrySet()) {
         String branch = entry.getKey();
         List<String> nextSiblings = entry.getValue();

         if (edges.containsKey(branch)) {
            appendPrefix(out, nextSiblings, "|\n");
            if (listCommits) {
               appendCommits(out, branch, edges.get(branch), nextSiblings);
            }
            appendPrefix(out, nextSiblings, edges.get(branch).getJunction());
         } else {
            if (!branch.equals(layout.getRoots().get(0))) {
               out.append('\n');
            }
            out.append("  ");
         }

         out.append(branch);
         if (branch.equals(currentBranch)) {
            out.append(" *");
         }

         Annotation annotation = layout.getAnnotation(branch);
         if (!annotation.isEmpty()) {
            out.append("  ").append(annotation.getRawText());
         }

         RemoteSyncState remoteState = session.getSyncStateClassifier().classifyRemote(branch);
         String description = remoteState.getDescription();
         if (!description.isEmpty()) {
            out.append(" (").append(description).append(')');
         }
         out.append('\n');
      }
      return out.toString();
   }

   private void collectNextSiblings(String branch, List<String> path, Map<String, List<String>> result) {
      result.put(branch, path);
      List<String> children = session.getLayout().getChildren(branch);
      for (int i = 0; i < children.size(); i++) {
         List<String> childPath = new ArrayList<>(path);
         childPath.add(i + 1 < children.size() ? children.get(i + 1) : null);
         collectNextSiblings(children.get(i), childPath, result);
      }
   }

   private void appendPrefix(StringBuilder out, List<String> nextSiblings, String suffix) {
      out.append("  ");
      for (String sibling : nextSiblings.subList(0, nextSiblings.size() - 1)) {
         out.append(sibling == null ? "  " : "| ");
      }
      out.append(suffix);
   }

   private void appendCommits(StringBuilder out, String branch, ParentSyncStatus status, List<String> nextSiblings) throws Exception {
      ForkPoint forkPoint = session.getForkPointResolver().findForkPoint(branch, true);
      if (forkPoint == null || status == ParentSyncStatus.MERGED_TO_PARENT) {
         return;
      }

      String notStart = status == ParentSyncStatus.IN_SYNC_BUT_FORK_POINT_OFF ?
         session.getLayout().getParent(branch) : forkPoint.getHash();
      List<GitCommit> commits = new ArrayList<>();
      for (GitCommit commit : session.getRepository().log(branch, notStart)) {
         commits.add(commit);
      }
      Collections.reverse(commits);
      logger.debug("Listing " + commits.size() + " commits of " + branch + " after " + notStart);

      for (GitCommit commit : commits) {
         appendPrefix(out, nextSiblings, "|");
         out.append(' ').append(commit.getShortMessage());
         if (commit.getName().equals(forkPoint.getHash())) {
            List<String> containingBranches = new ArrayList<>(forkPoint.getContainingBranches());
            Collections.sort(containingBranches);
            out.append(" -> fork point ??? commit ").append(commit.getName(), 0, 7)
               .append(" seems to be a part of the unique history of ").append(String.join(" and ", containingBranches));
         }
         out.append('\n');
      }
   }
}
