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

package dev.brus.branch.updater.forkpoint;

import java.util.Collections;
import java.util.List;

/**
 * The commit where the unique history of a branch starts, with the branches whose reflogs
 * pointed at it.
 */
public class ForkPoint {
   public enum Source {
      /**
       * Found on the filtered reflog of another branch or of its remote counterpart.
       */
      INFERRED,

      /**
       * Taken from the parent: its tip or the merge base with it.
       */
      PARENT,

      /**
       * Set by hand.
       */
      OVERRIDE
   }

   private final String hash;
   private final Source source;
   private final List<String> containingBranches;

   public ForkPoint(String hash, Source source, List<String> containingBranches) {
      this.hash = hash;
      this.source = source;
      this.containingBranches = containingBranches == null ? Collections.emptyList() : Collections.unmodifiableList(containingBranches);
   }

   public String getHash() {
      return hash;
   }

   public Source getSource() {
      return source;
   }

   public List<String> getContainingBranches() {
      return containingBranches;
   }

   @Override
   public String toString() {
      return hash;
   }
}
