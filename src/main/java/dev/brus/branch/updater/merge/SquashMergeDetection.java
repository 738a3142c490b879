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

package dev.brus.branch.updater.merge;

import java.util.Locale;

/**
 * How hard to look for a branch whose changes already landed in its parent without a
 * true merge.
 */
public enum SquashMergeDetection {
   /**
    * Only ancestry counts.
    */
   NONE,

   /**
    * A commit of the parent has the same tree as the branch tip.
    */
   SIMPLE,

   /**
    * A commit of the parent introduces the same patch as the whole branch.
    */
   EXACT;

   public static SquashMergeDetection fromString(String value) {
      try {
         return valueOf(value.trim().toUpperCase(Locale.ROOT));
      } catch (IllegalArgumentException e) {
         throw new IllegalArgumentException("Invalid squash merge detection: " + value +
            ", valid values are none, simple, exact", e);
      }
   }
}
