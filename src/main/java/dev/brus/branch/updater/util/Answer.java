package dev.brus.branch.updater.util;

import java.util.Locale;

/**
 * A reply to a confirmation prompt.
 */
public enum Answer {
   /**
    * Take the action and go on.
    */
   YES("y"),

   /**
    * Skip the action and go on.
    */
   NO("N"),

   /**
    * Stop without taking the action.
    */
   QUIT("q"),

   /**
    * Take the action, then stop.
    */
   YES_AND_QUIT("yq");

   private final String choice;

   Answer(String choice) {
      this.choice = choice;
   }

   public String getChoice() {
      return choice;
   }

   public boolean isYes() {
      return this == YES || this == YES_AND_QUIT;
   }

   public boolean isQuit() {
      return this == QUIT || this == YES_AND_QUIT;
   }

   /**
    * Anything unrecognized, the empty answer included, is a no.
    */
   public static Answer fromReply(String reply) {
      switch (reply == null ? "" : reply.trim().toLowerCase(Locale.ROOT)) {
         case "y":
         case "yes":
            return YES;
         case "q":
         case "quit":
            return QUIT;
         case "yq":
            return YES_AND_QUIT;
         default:
            return NO;
      }
   }
}
