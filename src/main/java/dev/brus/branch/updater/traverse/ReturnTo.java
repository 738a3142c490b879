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

import java.util.Locale;

/**
 * Where the checkout ends up once a traversal completes.
 */
public enum ReturnTo {
   /**
    * The branch checked out when the traversal started.
    */
   HERE,

   /**
    * The starting branch or, if it was slid out, its nearest remaining parent.
    */
   NEAREST_REMAINING,

   /**
    * The branch where the traversal stopped.
    */
   STAY;

   public static ReturnTo fromString(String value) {
      return valueOf(value.trim().replace('-', '_').toUpperCase(Locale.ROOT));
   }
}
