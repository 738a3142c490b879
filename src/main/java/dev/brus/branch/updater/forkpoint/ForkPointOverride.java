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

import dev.brus.branch.updater.git.GitRepository;

/**
 * Fork points set by hand, kept in the git config of the repository rather than in the
 * branch layout.
 */
public class ForkPointOverride {
   public static final String KEY_PREFIX = "updater.overrideForkPoint.";
   public static final String TO_KEY_SUFFIX = ".to";

   private final GitRepository repository;

   public ForkPointOverride(GitRepository repository) {
      this.repository = repository;
   }

   public static String getToKey(String branch) {
      return KEY_PREFIX + branch + TO_KEY_SUFFIX;
   }

   /**
    * @return the overriding commit, null if none is stored
    */
   public String get(String branch) throws Exception {
      return repository.getConfigValue(getToKey(branch));
   }

   public void set(String branch, String commitHash) throws Exception {
      repository.setConfigValue(getToKey(branch), commitHash);
   }

   public void unset(String branch) throws Exception {
      if (get(branch) != null) {
         repository.unsetConfigValue(getToKey(branch));
      }
   }
}
