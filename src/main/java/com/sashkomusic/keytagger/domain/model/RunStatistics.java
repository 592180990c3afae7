package com.sashkomusic.keytagger.domain.model;

public class RunStatistics {

    private int renamedCount;
    private int renameErrors;

    public void record(TrackResult result) {
        if (!result.renameAttempted()) {
            return;
        }
        if (result.renamed()) {
            renamedCount++;
        } else {
            renameErrors++;
        }
    }

    public int getRenamedCount() {
        return renamedCount;
    }

    public int getRenameErrors() {
        return renameErrors;
    }
}
