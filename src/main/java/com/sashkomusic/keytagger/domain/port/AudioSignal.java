package com.sashkomusic.keytagger.domain.port;

import java.nio.file.Path;

public interface AudioSignal {

    Path source();
}
