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

package dev.brus.branch.updater;

import dev.brus.branch.updater.git.GitRepository;
import dev.brus.branch.updater.merge.SquashMergeDetection;
import dev.brus.branch.updater.traverse.ReturnTo;
import dev.brus.branch.updater.traverse.StartFrom;

/**
 * Settings of a single invocation, built once from the command line and the git config and
 * handed to every component that needs them.
 */
public class RunConfig {
   public static final String SQUASH_MERGE_DETECTION_KEY = "updater.squashMergeDetection";
   public static final String TRAVERSE_PUSH_KEY = "updater.traverse.push";

   private SquashMergeDetection squashMergeDetection = SquashMergeDetection.SIMPLE;
   private boolean yes;
   private boolean merge;
   private boolean noEditMerge;
   private boolean interactiveRebase;
   private boolean pushTracked = true;
   private boolean pushUntracked = true;
   private boolean fetch;
   private boolean listCommits;
   private StartFrom startFrom = StartFrom.HERE;
   private ReturnTo returnTo = ReturnTo.STAY;
   private String stopAfter;

   public static RunConfig fromGitConfig(GitRepository repository) throws Exception {
      RunConfig runConfig = new RunConfig();

      String squashMergeDetection = repository.getConfigValue(SQUASH_MERGE_DETECTION_KEY);
      if (squashMergeDetection != null) {
         runConfig.setSquashMergeDetection(SquashMergeDetection.fromString(squashMergeDetection));
      }

      boolean push = repository.getConfigBoolean(TRAVERSE_PUSH_KEY, true);
      runConfig.setPushTracked(push).setPushUntracked(push);

      return runConfig;
   }

   public SquashMergeDetection getSquashMergeDetection() {
      return squashMergeDetection;
   }

   public RunConfig setSquashMergeDetection(SquashMergeDetection squashMergeDetection) {
      this.squashMergeDetection = squashMergeDetection;
      return this;
   }

   /**
    * Whether every action is taken without asking for confirmation.
    */
   public boolean isYes() {
      return yes;
   }

   public RunConfig setYes(boolean yes) {
      this.yes = yes;
      return this;
   }

   /**
    * Whether branches are synced with their parent by merge for this run.
    */
   public boolean isMerge() {
      return merge;
   }

   public RunConfig setMerge(boolean merge) {
      this.merge = merge;
      return this;
   }

   public boolean isNoEditMerge() {
      return noEditMerge;
   }

   public RunConfig setNoEditMerge(boolean noEditMerge) {
      this.noEditMerge = noEditMerge;
      return this;
   }

   public boolean isInteractiveRebase() {
      return interactiveRebase;
   }

   public RunConfig setInteractiveRebase(boolean interactiveRebase) {
      this.interactiveRebase = interactiveRebase;
      return this;
   }

   public boolean isPushTracked() {
      return pushTracked;
   }

   public RunConfig setPushTracked(boolean pushTracked) {
      this.pushTracked = pushTracked;
      return this;
   }

   public boolean isPushUntracked() {
      return pushUntracked;
   }

   public RunConfig setPushUntracked(boolean pushUntracked) {
      this.pushUntracked = pushUntracked;
      return this;
   }

   public boolean isFetch() {
      return fetch;
   }

   public RunConfig setFetch(boolean fetch) {
      this.fetch = fetch;
      return this;
   }

   public boolean isListCommits() {
      return listCommits;
   }

   public RunConfig setListCommits(boolean listCommits) {
      this.listCommits = listCommits;
      return this;
   }

   public StartFrom getStartFrom() {
      return startFrom;
   }

   public RunConfig setStartFrom(StartFrom startFrom) {
      this.startFrom = startFrom;
      return this;
   }

   public ReturnTo getReturnTo() {
      return returnTo;
   }

   public RunConfig setReturnTo(ReturnTo returnTo) {
      this.returnTo = returnTo;
      return this;
   }

   /**
    * @return the branch after which the traversal stops, null to walk the whole layout
    */
   public String getStopAfter() {
      return stopAfter;
   }

   public RunConfig setStopAfter(String stopAfter) {
      this.stopAfter = stopAfter;
      return this;
   }
}
