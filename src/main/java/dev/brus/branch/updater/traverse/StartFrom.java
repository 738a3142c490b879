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

package dev.brus.branch.updater.traverse;

/**
 * The branch a traversal starts from.
 */
public class StartFrom {
   public enum Type {
      HERE,
      ROOT,
      FIRST_ROOT,
      BRANCH
   }

   public static final StartFrom HERE = new StartFrom(Type.HERE, null);
   public static final StartFrom ROOT = new StartFrom(Type.ROOT, null);
   public static final StartFrom FIRST_ROOT = new StartFrom(Type.FIRST_ROOT, null);

   private final Type type;
   private final String branch;

   private StartFrom(Type type, String branch) {
      this.type = type;
      this.branch = branch;
   }

   public static StartFrom branch(String branch) {
      return new StartFrom(Type.BRANCH, branch);
   }

   public static StartFrom fromString(String value) {
      switch (value) {
         case "here":
            return HERE;
         case "root":
            return ROOT;
         case "first-root":
            return FIRST_ROOT;
         default:
            return branch(value);
      }
   }

   public Type getType() {
      return type;
   }

   public String getBranch() {
      return branch;
   }

   @Override
   public String toString() {
      return type == Type.BRANCH ? branch : type.name().toLowerCase().replace('_', '-');
   }
}
