package com.sashkomusic.keytagger.domain.port;

import java.nio.file.Path;
import java.util.OptionalDouble;

public interface AudioPropertiesPort {

    OptionalDouble durationSeconds(Path audioFile);
}
