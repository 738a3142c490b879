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
import java.util.Collections;
import java.util.List;

/**
 * A node of the branch layout. The parent and the children are referenced by name and
 * resolved through the owning {@link BranchLayout}.
 */
public class Branch {
   private final String name;
   private Annotation annotation;
   private String parent;
   private final List<String> children;

   Branch(String name, String parent, Annotation annotation) {
      this.name = name;
      this.parent = parent;
      this.annotation = annotation == null ? Annotation.EMPTY : annotation;
      this.children = new ArrayList<>();
   }

   public String getName() {
      return name;
   }

   public Annotation getAnnotation() {
      return annotation;
   }

   void setAnnotation(Annotation annotation) {
      this.annotation = annotation == null ? Annotation.EMPTY : annotation;
   }

   public Qualifiers getQualifiers() {
      return annotation.getQualifiers();
   }

   /**
    * @return the parent name, null for a root
    */
   public String getParent() {
      return parent;
   }

   void setParent(String parent) {
      this.parent = parent;
   }

   public boolean isRoot() {
      return parent == null;
   }

   public List<String> getChildren() {
      return Collections.unmodifiableList(children);
   }

   List<String> getMutableChildren() {
      return children;
   }

   @Override
   public String toString() {
      return name;
   }
}
