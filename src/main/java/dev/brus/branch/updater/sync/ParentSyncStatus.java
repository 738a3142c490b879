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

package dev.brus.branch.updater.sync;

/**
 * The relation between a branch and its parent, drawn as the color of the edge joining them.
 */
public enum ParentSyncStatus {
   /**
    * Green: the branch descends from the parent tip and its fork point is that tip.
    */
   IN_SYNC("o-", "green"),

   /**
    * Yellow: the branch descends from the parent tip but its fork point is somewhere else.
    */
   IN_SYNC_BUT_FORK_POINT_OFF("?-", "yellow"),

   /**
    * Red: the parent tip is not part of the branch history.
    */
   OUT_OF_SYNC("x-", "red"),

   /**
    * Grey: the changes of the branch are already in the parent.
    */
   MERGED_TO_PARENT("m-", "grey");

   private final String junction;
   private final String color;

   ParentSyncStatus(String junction, String color) {
      this.junction = junction;
      this.color = color;
   }

   public String getJunction() {
      return junction;
   }

   public String getColor() {
      return color;
   }
}
