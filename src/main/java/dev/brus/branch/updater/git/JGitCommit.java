package dev.brus.branch.updater.git;

import java.util.Date;

import org.eclipse.jgit.revwalk.RevCommit;

public class JGitCommit implements GitCommit {
   private RevCommit revCommit;

   public JGitCommit(RevCommit revCommit) {
      this.revCommit = revCommit;
   }

   public RevCommit getRevCommit() {
      return revCommit;
   }

   @Override
   public String getName() {
      return revCommit.getName();
   }

   @Override
   public String getTreeName() {
      return revCommit.getTree().getName();
   }

   @Override
   public String getShortMessage() {
      return revCommit.getShortMessage();
   }

   @Override
   public String getAuthorName() {
      return revCommit.getAuthorIdent().getName();
   }

   @Override
   public Date getAuthorWhen() {
      return revCommit.getAuthorIdent().getWhen();
   }

   @Override
   public Date getCommitterWhen() {
      return revCommit.getCommitterIdent().getWhen();
   }

   @Override
   public int getParentCount() {
      return revCommit.getParentCount();
   }

   @Override
   public String toString() {
      return revCommit.getName();
   }
}
