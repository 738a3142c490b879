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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.eclipse.jgit.lib.Repository;

/**
 * The forest of managed branches: an ordered list of roots plus a name to {@link Branch} map.
 * Parents and children are stored as names only, so {@link #verify()} never follows a
 * reference cycle.
 */
public class BranchLayout {
   public static final String DEFAULT_INDENT = "  ";

   private final List<String> roots;
   private final Map<String, Branch> branches;
   private String indent;

   public BranchLayout() {
      this.roots = new ArrayList<>();
      this.branches = new LinkedHashMap<>();
      this.indent = DEFAULT_INDENT;
   }

   public String getIndent() {
      return indent;
   }

   public BranchLayout setIndent(String indent) {
      this.indent = indent;
      return this;
   }

   public List<String> getRoots() {
      return Collections.unmodifiableList(roots);
   }

   public boolean isEmpty() {
      return branches.isEmpty();
   }

   public boolean contains(String name) {
      return branches.containsKey(name);
   }

   public Branch getBranch(String name) {
      return branches.get(name);
   }

   public String getParent(String name) {
      Branch branch = branches.get(name);
      return branch != null ? branch.getParent() : null;
   }

   public List<String> getChildren(String name) {
      Branch branch = branches.get(name);
      return branch != null ? branch.getChildren() : Collections.emptyList();
   }

   public Annotation getAnnotation(String name) {
      Branch branch = branches.get(name);
      return branch != null ? branch.getAnnotation() : Annotation.EMPTY;
   }

   public Qualifiers getQualifiers(String name) {
      return getAnnotation(name).getQualifiers();
   }

   public void setAnnotation(String name, Annotation annotation) throws InvariantViolationException {
      requireBranch(name).setAnnotation(annotation);
   }

   /**
    * Adds a leaf.
    *
    * @param parent the parent name, null to add a root
    */
   public Branch addBranch(String name, String parent, boolean asFirstChild, Annotation annotation) throws InvariantViolationException {
      if (branches.containsKey(name)) {
         throw new InvariantViolationException("Branch " + name + " already exists in the branch layout");
      }

      Branch branch = new Branch(name, parent, annotation);
      List<String> siblings = parent == null ? roots : requireBranch(parent).getMutableChildren();
      if (asFirstChild) {
         siblings.add(0, name);
      } else {
         siblings.add(name);
      }
      branches.put(name, branch);

      return branch;
   }

   /**
    * Removes a branch and puts its children in its place among its siblings.
    */
   public void removeBranch(String name) throws InvariantViolationException {
      Branch branch = requireBranch(name);
      List<String> siblings = branch.isRoot() ? roots : requireBranch(branch.getParent()).getMutableChildren();

      int index = siblings.indexOf(name);
      siblings.remove(index);
      siblings.addAll(index, branch.getChildren());
      for (String child : branch.getChildren()) {
         branches.get(child).setParent(branch.getParent());
      }
      branches.remove(name);
   }

   /**
    * Removes a parent to child chain and appends the children of its last branch to the
    * children of the parent of its first branch.
    *
    * @return the children moved under the new parent
    */
   public List<String> slideOut(List<String> chain) throws InvariantViolationException {
      if (chain.isEmpty()) {
         throw new InvariantViolationException("No branches to slide out");
      }

      String first = chain.get(0);
      String newParent = requireBranch(first).getParent();
      if (newParent == null) {
         throw new InvariantViolationException("No upstream branch defined for " + first + ", cannot slide out");
      }
      for (int i = 1; i < chain.size(); i++) {
         if (!chain.get(i - 1).equals(requireBranch(chain.get(i)).getParent())) {
            throw new InvariantViolationException(chain.get(i) + " is not downstream of " + chain.get(i - 1));
         }
      }

      List<String> newChildren = new ArrayList<>(requireBranch(chain.get(chain.size() - 1)).getChildren());

      List<String> newParentChildren = requireBranch(newParent).getMutableChildren();
      newParentChildren.remove(first);
      for (String newChild : newChildren) {
         newParentChildren.add(newChild);
         branches.get(newChild).setParent(newParent);
      }
      for (String branch : chain) {
         branches.remove(branch);
      }

      return newChildren;
   }

   /**
    * Managed branches in pre-order: each root followed by its subtree, children in layout order.
    */
   public List<String> getManagedBranches() {
      List<String> result = new ArrayList<>();
      Deque<String> stack = new ArrayDeque<>();
      for (int i = roots.size() - 1; i >= 0; i--) {
         stack.push(roots.get(i));
      }
      while (!stack.isEmpty()) {
         String name = stack.pop();
         result.add(name);
         List<String> children = branches.get(name).getChildren();
         for (int i = children.size() - 1; i >= 0; i--) {
            stack.push(children.get(i));
         }
      }
      return result;
   }

   /**
    * Branches below the given one, in pre-order.
    */
   public List<String> getDescendants(String name) {
      List<String> result = new ArrayList<>();
      for (String child : getChildren(name)) {
         result.add(child);
         result.addAll(getDescendants(child));
      }
      return result;
   }

   public List<String> getChildlessBranches() {
      List<String> result = new ArrayList<>();
      for (String name : getManagedBranches()) {
         if (branches.get(name).getChildren().isEmpty()) {
            result.add(name);
         }
      }
      return result;
   }

   public String getRootOf(String name) throws InvariantViolationException {
      Branch branch = requireBranch(name);
      while (branch.getParent() != null) {
         branch = requireBranch(branch.getParent());
      }
      return branch.getName();
   }

   public String getNext(String name) throws InvariantViolationException {
      requireBranch(name);
      List<String> managedBranches = getManagedBranches();
      int index = managedBranches.indexOf(name);
      return index + 1 < managedBranches.size() ? managedBranches.get(index + 1) : null;
   }

   public String getPrevious(String name) throws InvariantViolationException {
      requireBranch(name);
      List<String> managedBranches = getManagedBranches();
      int index = managedBranches.indexOf(name);
      return index > 0 ? managedBranches.get(index - 1) : null;
   }

   public String getFirst(String name) throws InvariantViolationException {
      String root = getRootOf(name);
      List<String> rootChildren = getChildren(root);
      return rootChildren.isEmpty() ? root : rootChildren.get(0);
   }

   public String getLast(String name) throws InvariantViolationException {
      String last = getRootOf(name);
      while (!getChildren(last).isEmpty()) {
         List<String> children = getChildren(last);
         last = children.get(children.size() - 1);
      }
      return last;
   }

   /**
    * Checks that the layout is a forest of uniquely named, valid branches whose parent and
    * children references agree.
    */
   public void verify() throws InvariantViolationException {
      Set<String> rootSet = new HashSet<>();
      for (String root : roots) {
         Branch branch = branches.get(root);
         if (branch == null) {
            throw new InvariantViolationException("Root " + root + " is not a branch of the layout");
         }
         if (branch.getParent() != null) {
            throw new InvariantViolationException("Root " + root + " has parent " + branch.getParent());
         }
         if (!rootSet.add(root)) {
            throw new InvariantViolationException("Root " + root + " appears more than once");
         }
      }

      Map<String, String> parentByChild = new HashMap<>();
      for (Branch branch : branches.values()) {
         if (!Repository.isValidRefName("refs/heads/" + branch.getName())) {
            throw new InvariantViolationException("Invalid branch name " + branch.getName());
         }
         for (String child : branch.getChildren()) {
            Branch childBranch = branches.get(child);
            if (childBranch == null) {
               throw new InvariantViolationException("Child " + child + " of " + branch.getName() + " is not a branch of the layout");
            }
            if (!branch.getName().equals(childBranch.getParent())) {
               throw new InvariantViolationException("Child " + child + " of " + branch.getName() + " has parent " + childBranch.getParent());
            }
            if (parentByChild.put(child, branch.getName()) != null) {
               throw new InvariantViolationException("Branch " + child + " has more than one parent");
            }
         }
      }

      // Every branch must hang from exactly one root, which also rules out cycles.
      Set<String> reached = new HashSet<>();
      Deque<String> pending = new ArrayDeque<>(roots);
      while (!pending.isEmpty()) {
         String name = pending.pop();
         if (!reached.add(name)) {
            throw new InvariantViolationException("Branch " + name + " is reachable more than once");
         }
         pending.addAll(branches.get(name).getChildren());
      }
      for (Branch branch : branches.values()) {
         if (!reached.contains(branch.getName())) {
            throw new InvariantViolationException("Branch " + branch.getName() + " is not reachable from any root");
         }
         if (branch.getParent() != null && !branch.getParent().equals(parentByChild.get(branch.getName()))) {
            throw new InvariantViolationException("Branch " + branch.getName() + " is not a child of its parent " + branch.getParent());
         }
      }
   }

   /**
    * Renders the layout one branch per line, children indented one unit deeper than their parent.
    */
   public String serialize() {
      StringBuilder builder = new StringBuilder();
      for (String root : roots) {
         serialize(builder, root, 0);
      }
      return builder.toString();
   }

   private void serialize(StringBuilder builder, String name, int depth) {
      Branch branch = branches.get(name);
      builder.append(indent.repeat(depth)).append(name);
      if (!branch.getAnnotation().isEmpty()) {
         builder.append(' ').append(branch.getAnnotation().getRawText());
      }
      builder.append('\n');
      for (String child : branch.getChildren()) {
         serialize(builder, child, depth + 1);
      }
   }

   private Branch requireBranch(String name) throws InvariantViolationException {
      Branch branch = branches.get(name);
      if (branch == null) {
         throw new InvariantViolationException("Branch " + name + " not found in the branch layout");
      }
      return branch;
   }
}
