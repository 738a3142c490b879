package dev.brus.branch.updater.git;

public class AheadBehindCounts {
   private final int ahead;
   private final int behind;

   public AheadBehindCounts(int ahead, int behind) {
      this.ahead = ahead;
      this.behind = behind;
   }

   /**
    * Commits reachable from the first revision only.
    */
   public int getAhead() {
      return ahead;
   }

   /**
    * Commits reachable from the second revision only.
    */
   public int getBehind() {
      return behind;
   }

   @Override
   public String toString() {
      return "+" + ahead + "/-" + behind;
   }
}
