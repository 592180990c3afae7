package com.sashkomusic.keytagger.infrastructure.tag;

import com.sashkomusic.keytagger.domain.port.AudioPropertiesPort;
import lombok.extern.slf4j.Slf4j;
import org.jaudiotagger.audio.AudioFile;
import org.jaudiotagger.audio.AudioFileIO;
import org.jaudiotagger.audio.AudioHeader;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.OptionalDouble;

@Slf4j
@Service
public class JaudiotaggerAudioProperties implements AudioPropertiesPort {

    @Override
    public OptionalDouble durationSeconds(Path audioFile) {
        try {
            AudioFile f = AudioFileIO.read(audioFile.toFile());
            AudioHeader header = f.getAudioHeader();
            if (header == null) {
                log.warn("No audio header in: {}", audioFile.getFileName());
                return OptionalDouble.empty();
            }
            return OptionalDouble.of(header.getPreciseTrackLength());
        } catch (Exception ex) {
            log.warn("Could not read duration of {}: {}", audioFile.getFileName(), ex.getMessage());
            return OptionalDouble.empty();
        }
    }
}
