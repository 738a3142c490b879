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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Per-branch switches carried by the annotation of a branch layout line.
 */
public class Qualifiers {
   public static final String NO_REBASE_TOKEN = "rebase=no";
   public static final String NO_PUSH_TOKEN = "push=no";
   public static final String NO_SLIDE_OUT_TOKEN = "slide-out=no";
   public static final String UPDATE_WITH_MERGE_TOKEN = "update=merge";

   public static final Qualifiers DEFAULT = new Qualifiers(true, true, true, false);

   private final boolean rebase;
   private final boolean push;
   private final boolean slideOut;
   private final boolean updateWithMerge;

   public Qualifiers(boolean rebase, boolean push, boolean slideOut, boolean updateWithMerge) {
      this.rebase = rebase;
      this.push = push;
      this.slideOut = slideOut;
      this.updateWithMerge = updateWithMerge;
   }

   /**
    * Whether the branch may be rebased onto its parent.
    */
   public boolean isRebase() {
      return rebase;
   }

   /**
    * Whether the branch may be pushed to its remote.
    */
   public boolean isPush() {
      return push;
   }

   /**
    * Whether the branch may be slid out once merged.
    */
   public boolean isSlideOut() {
      return slideOut;
   }

   /**
    * Whether the branch is synced with its parent by merge instead of rebase.
    */
   public boolean isUpdateWithMerge() {
      return updateWithMerge;
   }

   /**
    * Tokens in the canonical order rebase, push, slide-out, update.
    */
   public String getText() {
      List<String> tokens = new ArrayList<>();
      if (!rebase) {
         tokens.add(NO_REBASE_TOKEN);
      }
      if (!push) {
         tokens.add(NO_PUSH_TOKEN);
      }
      if (!slideOut) {
         tokens.add(NO_SLIDE_OUT_TOKEN);
      }
      if (updateWithMerge) {
         tokens.add(UPDATE_WITH_MERGE_TOKEN);
      }
      return String.join(" ", tokens);
   }

   @Override
   public boolean equals(Object o) {
      if (this == o) {
         return true;
      }
      if (o == null || getClass() != o.getClass()) {
         return false;
      }
      Qualifiers that = (Qualifiers) o;
      return rebase == that.rebase && push == that.push && slideOut == that.slideOut && updateWithMerge == that.updateWithMerge;
   }

   @Override
   public int hashCode() {
      return Objects.hash(rebase, push, slideOut, updateWithMerge);
   }

   @Override
   public String toString() {
      return getText();
   }
}
