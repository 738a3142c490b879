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
 * The result of one step of a traversal, and of the whole traversal.
 */
public class TraversalOutcome {
   public enum State {
      /**
       * Go on with the next action or branch.
       */
      CONTINUE,

      /**
       * The user quit.
       */
      CANCELLED,

      /**
       * A git operation failed or left the repository with an operation in progress.
       */
      FAILED
   }

   public static final TraversalOutcome CONTINUE = new TraversalOutcome(State.CONTINUE, null);
   public static final TraversalOutcome CANCELLED = new TraversalOutcome(State.CANCELLED, null);

   private final State state;
   private final String reason;

   private TraversalOutcome(State state, String reason) {
      this.state = state;
      this.reason = reason;
   }

   public static TraversalOutcome failed(String reason) {
      return new TraversalOutcome(State.FAILED, reason);
   }

   public State getState() {
      return state;
   }

   /**
    * @return why the traversal failed, null unless {@link State#FAILED}
    */
   public String getReason() {
      return reason;
   }

   public boolean isContinue() {
      return state == State.CONTINUE;
   }

   @Override
   public String toString() {
      return reason != null ? state + ": " + reason : state.toString();
   }
}
