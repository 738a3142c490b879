package dev.brus.branch.updater.git;

import java.util.Date;

public interface GitCommit {

   String getName();

   String getTreeName();

   String getShortMessage();

   String getAuthorName();

   Date getAuthorWhen();

   Date getCommitterWhen();

   int getParentCount();
}
