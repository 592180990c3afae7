package com.sashkomusic.keytagger.domain.port;

import java.nio.file.Path;

public interface TagStorePort {

    boolean writeTitle(Path audioFile, String title);
}
